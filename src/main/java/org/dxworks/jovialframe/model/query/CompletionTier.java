package org.dxworks.jovialframe.model.query;

/**
 * Ranking bucket of a completion candidate; candidates sort by tier first.
 */
public enum CompletionTier {
    LOCAL_SCOPE,
    OUTER_SCOPE,
    KEYWORD
}
