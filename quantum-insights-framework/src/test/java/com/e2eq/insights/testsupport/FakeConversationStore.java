package com.e2eq.insights.testsupport;

import com.e2eq.insights.model.persistent.ConversationTurn;
import com.e2eq.insights.model.persistent.store.ConversationStore;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

public class FakeConversationStore implements ConversationStore {

    private final List<ConversationTurn> turns = new ArrayList<>();
    private boolean failing;

    public void setFailing(boolean failing) {
        this.failing = failing;
    }

    public List<ConversationTurn> getTurns() {
        return turns;
    }

    public ConversationTurn last() {
        return turns.isEmpty() ? null : turns.get(turns.size() - 1);
    }

    @Override
    public ConversationTurn save(ConversationTurn turn) {
        if (failing) {
            throw new IllegalStateException("conversation store unavailable");
        }
        turns.add(turn);
        return turn;
    }

    @Override
    public List<ConversationTurn> findRecent(String userId, String sessionId, int limit) {
        List<ConversationTurn> matching = turns.stream()
            .filter(t -> userId.equals(t.getUserId()) && sessionId.equals(t.getSessionId()))
            .collect(Collectors.toList());
        return new ArrayList<>(matching.subList(Math.max(0, matching.size() - limit), matching.size()));
    }
}
