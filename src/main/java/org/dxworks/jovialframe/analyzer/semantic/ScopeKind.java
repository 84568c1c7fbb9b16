package org.dxworks.jovialframe.analyzer.semantic;

public enum ScopeKind {
    PROGRAM,
    COMPOOL,
    PROCEDURE,
    TABLE_BLOCK
}
