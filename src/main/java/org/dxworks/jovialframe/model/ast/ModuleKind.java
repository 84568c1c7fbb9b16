package org.dxworks.jovialframe.model.ast;

public enum ModuleKind {
    PROGRAM,
    COMPOOL
}
