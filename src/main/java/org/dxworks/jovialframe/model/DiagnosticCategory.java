package org.dxworks.jovialframe.model;

public enum DiagnosticCategory {
    LEX_ERROR,
    PARSE_ERROR,
    DUPLICATE_DECLARATION,
    UNRESOLVED_REFERENCE,
    TYPE_CONSISTENCY
}
