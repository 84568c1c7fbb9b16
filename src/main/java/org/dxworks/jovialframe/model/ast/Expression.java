package org.dxworks.jovialframe.model.ast;

public abstract class Expression extends Node {

    /**
     * Normalized source form, used in hover details and outline entries.
     */
    public abstract String text();
}
