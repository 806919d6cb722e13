package com.e2eq.insights.router;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Records the states one question passes through and rejects transitions the pipeline does not
 * allow. Any non-terminal state may jump to PERSISTED when the request fails.
 */
public class RouteTrace {

    private static final Map<RouterState, Set<RouterState>> ALLOWED = new EnumMap<>(RouterState.class);

    static {
        ALLOWED.put(RouterState.RECEIVED, EnumSet.of(RouterState.CLASSIFIED));
        ALLOWED.put(RouterState.CLASSIFIED, EnumSet.of(RouterState.METADATA_HANDLED, RouterState.SQL_GENERATED));
        ALLOWED.put(RouterState.METADATA_HANDLED, EnumSet.noneOf(RouterState.class));
        ALLOWED.put(RouterState.SQL_GENERATED, EnumSet.of(RouterState.SYNTAX_CHECKED));
        ALLOWED.put(RouterState.SYNTAX_CHECKED, EnumSet.of(RouterState.ACCESS_CHECKED));
        ALLOWED.put(RouterState.ACCESS_CHECKED, EnumSet.of(RouterState.EXECUTED));
        ALLOWED.put(RouterState.EXECUTED, EnumSet.of(RouterState.SUMMARIZED));
        ALLOWED.put(RouterState.SUMMARIZED, EnumSet.noneOf(RouterState.class));
        ALLOWED.put(RouterState.PERSISTED, EnumSet.of(RouterState.TERMINAL_SUCCESS, RouterState.TERMINAL_ERROR));
        ALLOWED.put(RouterState.TERMINAL_SUCCESS, EnumSet.noneOf(RouterState.class));
        ALLOWED.put(RouterState.TERMINAL_ERROR, EnumSet.noneOf(RouterState.class));
    }

    private final List<RouterState> history = new ArrayList<>();
    private RouterState current = RouterState.RECEIVED;
    private RouterState furthest = RouterState.RECEIVED;
    private boolean failed;

    public RouteTrace() {
        history.add(RouterState.RECEIVED);
    }

    /**
     * @throws IllegalStateException when {@code next} cannot follow the current state
     */
    public RouteTrace advance(RouterState next) {
        boolean allowed = ALLOWED.get(current).contains(next)
            || (next == RouterState.PERSISTED && !current.isTerminal() && current != RouterState.PERSISTED);
        if (!allowed) {
            throw new IllegalStateException("Illegal router transition " + current + " -> " + next);
        }
        if (next == RouterState.TERMINAL_SUCCESS && failed) {
            throw new IllegalStateException("A failed request cannot end in " + next);
        }
        if (next != RouterState.PERSISTED && !next.isTerminal()) {
            furthest = next;
        }
        current = next;
        history.add(next);
        return this;
    }

    /**
     * Moves to PERSISTED marking the request as failed; only TERMINAL_ERROR may follow.
     */
    public RouteTrace fail() {
        failed = true;
        return advance(RouterState.PERSISTED);
    }

    public RouterState getCurrent() {
        return current;
    }

    /** Last pipeline state reached before persistence. */
    public RouterState getFurthest() {
        return furthest;
    }

    public boolean isFailed() {
        return failed;
    }

    public List<RouterState> getHistory() {
        return Collections.unmodifiableList(history);
    }
}
