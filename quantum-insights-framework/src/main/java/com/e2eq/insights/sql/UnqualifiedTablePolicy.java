package com.e2eq.insights.sql;

/**
 * How a table named without a dataset is treated.
 */
public enum UnqualifiedTablePolicy {
    /** The reference keeps no dataset and can never be authorized. */
    REJECT,
    /** The reference is placed in {@code quantum.insights.sql.default-dataset}. */
    DEFAULT_DATASET
}
