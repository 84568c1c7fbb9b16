package org.dxworks.jovialframe.model.ast;

public enum LiteralKind {
    INTEGER,
    FLOAT,
    FIXED,
    BIT_STRING,
    STRING
}
