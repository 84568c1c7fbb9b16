package org.dxworks.jovialframe.model.ast;

/**
 * A named declaration. The span runs from the introducing keyword (or DEF/REF prefix) through the
 * terminating {@code ;} or END.
 */
public abstract class Declaration extends Node {
    public Identifier name;
    public String documentation;
    public Linkage linkage = Linkage.NONE;
}
