package org.dxworks.jovialframe.model;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;

@JsonPropertyOrder({"severity", "category", "message", "line", "column"})
public class DiagnosticInfo {
    public String severity;
    public String category;
    public String message;
    /** 1-based. */
    public int line;
    /** 1-based. */
    public int column;
}
