package org.dxworks.jovialframe.query;

/**
 * Syntactic position of the cursor, which decides what completion offers.
 */
public enum CompletionContext {
    /** Right after ITEM, TABLE, PROC, DEFINE, TYPE, COMPOOL or START: a new name is typed. */
    DECLARATION_NAME,
    /** After {@code ITEM name} or its attributes. */
    TYPE_POSITION,
    /** Inside {@code V(}. */
    STATUS_VALUE,
    STATEMENT_START,
    EXPRESSION,
    /** Inside quoted text. */
    NONE
}
