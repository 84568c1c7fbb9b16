package org.dxworks.jovialframe.model;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Comparator;
import java.util.Objects;

/**
 * A problem found while analyzing one document.
 */
@JsonPropertyOrder({"severity", "category", "message", "span"})
public final class Diagnostic {

    /**
     * Source order, then category so that lexical problems come before the parse errors they cause.
     */
    public static final Comparator<Diagnostic> POSITION_ORDER = Comparator
            .comparing(Diagnostic::getSpan)
            .thenComparing(Diagnostic::getCategory)
            .thenComparing(Diagnostic::getMessage);

    private final DiagnosticSeverity severity;
    private final Span span;
    private final String message;
    private final DiagnosticCategory category;

    public Diagnostic(DiagnosticSeverity severity, Span span, String message, DiagnosticCategory category) {
        this.severity = Objects.requireNonNull(severity, "severity");
        this.span = Objects.requireNonNull(span, "span");
        this.message = message != null ? message : "";
        this.category = Objects.requireNonNull(category, "category");
    }

    public static Diagnostic error(Span span, String message, DiagnosticCategory category) {
        return new Diagnostic(DiagnosticSeverity.ERROR, span, message, category);
    }

    public static Diagnostic warning(Span span, String message, DiagnosticCategory category) {
        return new Diagnostic(DiagnosticSeverity.WARNING, span, message, category);
    }

    public DiagnosticSeverity getSeverity() {
        return severity;
    }

    public Span getSpan() {
        return span;
    }

    public String getMessage() {
        return message;
    }

    public DiagnosticCategory getCategory() {
        return category;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Diagnostic)) return false;
        Diagnostic that = (Diagnostic) o;
        return severity == that.severity && span.equals(that.span)
                && message.equals(that.message) && category == that.category;
    }

    @Override
    public int hashCode() {
        return Objects.hash(severity, span, message, category);
    }

    @Override
    public String toString() {
        return severity + " " + category + " at " + span + ": " + message;
    }
}
