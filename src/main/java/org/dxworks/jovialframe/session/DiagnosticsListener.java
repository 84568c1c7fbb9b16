package org.dxworks.jovialframe.session;

import org.dxworks.jovialframe.model.Diagnostic;

import java.util.List;

/**
 * Told about the diagnostics of every snapshot right after it is published.
 */
@FunctionalInterface
public interface DiagnosticsListener {

    DiagnosticsListener NONE = (uri, generation, diagnostics) -> { };

    void diagnosticsPublished(String uri, long generation, List<Diagnostic> diagnostics);
}
