package com.e2eq.insights.router;

/**
 * States of one routed question.
 */
public enum RouterState {
    RECEIVED,
    CLASSIFIED,
    METADATA_HANDLED,
    SQL_GENERATED,
    SYNTAX_CHECKED,
    ACCESS_CHECKED,
    EXECUTED,
    SUMMARIZED,
    PERSISTED,
    TERMINAL_SUCCESS,
    TERMINAL_ERROR;

    public boolean isTerminal() {
        return this == TERMINAL_SUCCESS || this == TERMINAL_ERROR;
    }
}
