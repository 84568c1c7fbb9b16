package org.dxworks.jovialframe.analyzer;

import org.dxworks.jovialframe.JovialframeConfig;
import org.dxworks.jovialframe.model.Diagnostic;
import org.dxworks.jovialframe.model.DiagnosticInfo;
import org.dxworks.jovialframe.model.JovialFileAnalysis;
import org.dxworks.jovialframe.model.SymbolInfo;
import org.dxworks.jovialframe.model.query.DocumentSymbol;
import org.dxworks.jovialframe.query.QueryService;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Batch analysis of a whole file into the record the command line tool writes.
 */
public class JovialFileAnalyzer {

    private final AnalysisPipeline pipeline;
    private final QueryService queries = new QueryService();

    public JovialFileAnalyzer(JovialframeConfig config) {
        this.pipeline = new AnalysisPipeline(config);
    }

    public JovialFileAnalysis analyze(String filePath, String sourceCode) {
        AnalysisSnapshot snapshot = pipeline.analyze(filePath, sourceCode);

        JovialFileAnalysis analysis = new JovialFileAnalysis();
        analysis.filePath = filePath;
        analysis.role = snapshot.getRole().getName();
        analysis.moduleKind = snapshot.getUnit().moduleKind.name();
        analysis.programName = snapshot.getUnit().programName != null ? snapshot.getUnit().programName.text : null;
        analysis.compoolDirectives.addAll(snapshot.getCompoolDirectives());
        analysis.symbols.addAll(toSymbolInfos(queries.documentSymbols(snapshot)));
        for (Diagnostic diagnostic : snapshot.getDiagnostics()) {
            analysis.diagnostics.add(toDiagnosticInfo(diagnostic));
        }
        analysis.symbolCount = snapshot.getScopeTree().getSymbols().size();
        analysis.occurrenceCount = snapshot.getCrossReferences().size();
        analysis.unresolvedCount = snapshot.getCrossReferences().unresolved().size();
        return analysis;
    }

    private static List<SymbolInfo> toSymbolInfos(List<DocumentSymbol> entries) {
        return entries.stream().map(JovialFileAnalyzer::toSymbolInfo).collect(Collectors.toList());
    }

    private static SymbolInfo toSymbolInfo(DocumentSymbol entry) {
        SymbolInfo info = new SymbolInfo();
        info.name = entry.name;
        info.kind = entry.kind;
        info.type = entry.detail;
        info.line = entry.selectionRange.getStartLine() + 1;
        info.children = toSymbolInfos(entry.children);
        return info;
    }

    private static DiagnosticInfo toDiagnosticInfo(Diagnostic diagnostic) {
        DiagnosticInfo info = new DiagnosticInfo();
        info.severity = diagnostic.getSeverity().name();
        info.category = diagnostic.getCategory().name();
        info.message = diagnostic.getMessage();
        info.line = diagnostic.getSpan().getStartLine() + 1;
        info.column = diagnostic.getSpan().getStartColumn() + 1;
        return info;
    }
}
