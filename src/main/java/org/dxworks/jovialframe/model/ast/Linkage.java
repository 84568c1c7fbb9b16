package org.dxworks.jovialframe.model.ast;

/**
 * DEF exports a declaration from a compool, REF imports one defined elsewhere.
 */
public enum Linkage {
    NONE,
    DEF,
    REF
}
