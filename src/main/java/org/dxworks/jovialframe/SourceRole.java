package org.dxworks.jovialframe;

/**
 * What a JOVIAL source file is, judged by its extension. Informational only.
 */
public enum SourceRole {
    PROGRAM("program"),
    COMPOOL("compool");

    private final String name;

    SourceRole(String name) {
        this.name = name;
    }

    public String getName() {
        return name;
    }
}
