package com.e2eq.insights.model.persistent.morphia;

import com.e2eq.insights.model.persistent.ConversationTurn;
import com.e2eq.insights.model.persistent.store.ConversationStore;
import dev.morphia.query.FindOptions;
import dev.morphia.query.Query;
import dev.morphia.query.Sort;
import dev.morphia.query.filters.Filters;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.apache.commons.lang3.StringUtils;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Repository for question turns.
 */
@ApplicationScoped
public class ConversationTurnRepo implements ConversationStore {

    @Inject
    MorphiaDataStore morphiaDataStore;

    @Override
    public ConversationTurn save(ConversationTurn turn) {
        if (turn == null || StringUtils.isBlank(turn.getUserId())) {
            throw new IllegalArgumentException("userId is required");
        }
        return morphiaDataStore.getDataStore().save(turn);
    }

    @Override
    public List<ConversationTurn> findRecent(String userId, String sessionId, int limit) {
        if (StringUtils.isBlank(userId) || limit <= 0) {
            return List.of();
        }
        Query<ConversationTurn> query = morphiaDataStore.getDataStore()
            .find(ConversationTurn.class)
            .filter(Filters.eq("userId", userId));
        if (sessionId != null) {
            query.filter(Filters.eq("sessionId", sessionId));
        }
        List<ConversationTurn> newestFirst = query
            .iterator(new FindOptions().sort(Sort.descending("createdAt")).limit(limit))
            .toList();
        List<ConversationTurn> turns = new ArrayList<>(newestFirst);
        Collections.reverse(turns);
        return turns;
    }
}
