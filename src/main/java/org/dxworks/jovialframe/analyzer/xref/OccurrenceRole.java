package org.dxworks.jovialframe.analyzer.xref;

public enum OccurrenceRole {
    DECLARATION,
    /** Name of a duplicate declaration; resolves to the declaration that stayed bound. */
    REDECLARATION,
    READ,
    WRITE,
    CALL
}
