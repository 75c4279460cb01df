package com.spending.fraud.store;

/**
 * Outcome of a relationship upsert.
 */
public enum UpsertResult {
    /** No row existed for the pair and relation type. */
    INSERTED,
    /** A row existed with a strictly lower confidence and was replaced. */
    UPDATED,
    /** A row existed with an equal or higher confidence and was kept. */
    UNCHANGED
}
