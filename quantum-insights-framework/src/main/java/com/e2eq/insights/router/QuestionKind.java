package com.e2eq.insights.router;

public enum QuestionKind {
    /** About datasets, tables or columns; answered from the catalog without generation. */
    METADATA,
    /** Needs a generated query. */
    DATA
}
