package org.dxworks.jovialframe.analyzer;

import org.dxworks.jovialframe.JovialframeConfig;
import org.dxworks.jovialframe.SourceRoleDetector;
import org.dxworks.jovialframe.analyzer.lexer.IncrementalRelexer;
import org.dxworks.jovialframe.analyzer.lexer.JovialLexer;
import org.dxworks.jovialframe.analyzer.lexer.LineIndex;
import org.dxworks.jovialframe.analyzer.lexer.Token;
import org.dxworks.jovialframe.analyzer.lexer.TokenKind;
import org.dxworks.jovialframe.analyzer.parser.JovialParser;
import org.dxworks.jovialframe.analyzer.parser.ParseResult;
import org.dxworks.jovialframe.analyzer.semantic.SymbolTable;
import org.dxworks.jovialframe.analyzer.semantic.SymbolTableBuilder;
import org.dxworks.jovialframe.analyzer.xref.CrossReferenceBuilder;
import org.dxworks.jovialframe.analyzer.xref.CrossReferenceIndex;
import org.dxworks.jovialframe.model.Diagnostic;
import org.dxworks.jovialframe.model.DiagnosticCategory;
import org.dxworks.jovialframe.model.ast.CompilationUnit;
import org.dxworks.jovialframe.model.ast.Directive;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.function.BooleanSupplier;

/**
 * Runs lex, parse, symbol table and cross-reference stages over one text and assembles the snapshot.
 *
 * <p>Between stages the pass asks whether it has been superseded and, if so, stops with an
 * {@link AnalysisCancelledException}. A stage that breaks an invariant ends the pass with an
 * {@link InternalAnalysisException}.</p>
 */
public class AnalysisPipeline {

    private static final Logger LOG = LoggerFactory.getLogger(AnalysisPipeline.class);

    private static final BooleanSupplier NEVER_CANCELLED = () -> false;

    private final JovialframeConfig config;

    public AnalysisPipeline(JovialframeConfig config) {
        this.config = config;
    }

    /**
     * One-off analysis of a text that nobody will edit.
     */
    public AnalysisSnapshot analyze(String uri, String text) {
        return analyze(uri, text, 0, null, NEVER_CANCELLED);
    }

    /**
     * Analyzes {@code text} as generation {@code generation} of the document. When {@code previous}
     * is given its tokens are reused for the parts of the text the edit left alone.
     */
    public AnalysisSnapshot analyze(String uri, String text, long generation,
                                    AnalysisSnapshot previous, BooleanSupplier cancelled) {
        String source = text == null ? "" : text;
        try {
            checkpoint(cancelled, generation, "lexing");
            LineIndex lineIndex = new LineIndex(source);
            List<Token> tokens = lex(source, lineIndex, previous);
            List<Diagnostic> diagnostics = lexDiagnostics(tokens);

            checkpoint(cancelled, generation, "parsing");
            ParseResult parsed = JovialParser.parse(tokens);
            CompilationUnit unit = parsed.unit;
            diagnostics.addAll(parsed.diagnostics);

            checkpoint(cancelled, generation, "symbol table");
            SymbolTable symbolTable = SymbolTableBuilder.build(unit);
            diagnostics.addAll(symbolTable.getDiagnostics());

            checkpoint(cancelled, generation, "cross-reference index");
            CrossReferenceIndex crossReferences = CrossReferenceBuilder.build(unit, symbolTable,
                    config.isReportUnresolvedReferences());
            crossReferences.verify(symbolTable.getScopeTree());
            diagnostics.addAll(crossReferences.getDiagnostics());

            checkpoint(cancelled, generation, "publishing");
            diagnostics.sort(Diagnostic.POSITION_ORDER);
            return new AnalysisSnapshot(uri, SourceRoleDetector.roleOf(uri), generation, source, lineIndex,
                    tokens, unit, symbolTable, crossReferences, diagnostics, compoolDirectives(unit));
        } catch (AnalysisCancelledException | InternalAnalysisException e) {
            throw e;
        } catch (RuntimeException | StackOverflowError e) {
            throw new InternalAnalysisException("analysis of " + uri + " failed at generation " + generation, e);
        }
    }

    private List<Token> lex(String text, LineIndex lineIndex, AnalysisSnapshot previous) {
        if (previous != null) {
            var incremental = IncrementalRelexer.tryRelex(previous.getText(), previous.getTokens(), text,
                    lineIndex, config.getIncrementalRelexThreshold());
            if (incremental.isPresent()) {
                return incremental.get();
            }
            LOG.debug("Edit too large for incremental lexing, re-lexing {} characters", text.length());
        }
        return new JovialLexer(text, lineIndex).tokenize();
    }

    private static List<Diagnostic> lexDiagnostics(List<Token> tokens) {
        List<Diagnostic> diagnostics = new ArrayList<>();
        for (Token token : tokens) {
            if (token.is(TokenKind.ERROR)) {
                diagnostics.add(Diagnostic.error(token.getSpan(), token.getErrorMessage(), DiagnosticCategory.LEX_ERROR));
            }
        }
        return diagnostics;
    }

    private static List<String> compoolDirectives(CompilationUnit unit) {
        List<String> names = new ArrayList<>();
        for (Directive directive : unit.directives) {
            if ("COMPOOL".equals(directive.name)) {
                names.addAll(directive.arguments);
            }
        }
        return names;
    }

    private static void checkpoint(BooleanSupplier cancelled, long generation, String stage) {
        if (cancelled.getAsBoolean()) {
            throw new AnalysisCancelledException(generation, stage);
        }
    }
}
