package org.dxworks.jovialframe.model.ast;

public enum TypeSpecKind {
    /** Type letter with optional width and scale, e.g. {@code S 16} or {@code A 16,8}. */
    SCALAR,
    STATUS,
    /** Reference to a TYPE declaration. */
    NAMED
}
