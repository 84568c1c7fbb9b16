package org.dxworks.jovialframe.model;

public enum DiagnosticSeverity {
    ERROR,
    WARNING
}
