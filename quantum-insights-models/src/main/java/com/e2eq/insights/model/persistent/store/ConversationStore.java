package com.e2eq.insights.model.persistent.store;

import com.e2eq.insights.model.persistent.ConversationTurn;

import java.util.List;

public interface ConversationStore {

    ConversationTurn save(ConversationTurn turn);

    /**
     * Most recent turns of the identity in the session, oldest first.
     */
    List<ConversationTurn> findRecent(String userId, String sessionId, int limit);
}
