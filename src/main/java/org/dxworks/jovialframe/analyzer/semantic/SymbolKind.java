package org.dxworks.jovialframe.analyzer.semantic;

import java.util.Locale;

public enum SymbolKind {
    CONSTANT,
    ITEM,
    TABLE,
    PROCEDURE,
    STATUS,
    STATUS_VALUE,
    COMPOOL,
    PARAMETER,
    TYPE,
    LABEL,
    LOOP_VARIABLE,
    EXTERNAL;

    /**
     * Display name used in hover and completion details, e.g. "Status value".
     */
    public String displayName() {
        String lower = name().toLowerCase(Locale.ROOT).replace('_', ' ');
        return Character.toUpperCase(lower.charAt(0)) + lower.substring(1);
    }
}
