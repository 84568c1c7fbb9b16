package org.dxworks.jovialframe.query;

import org.dxworks.jovialframe.analyzer.AnalysisSnapshot;
import org.dxworks.jovialframe.analyzer.lexer.JovialLexer;
import org.dxworks.jovialframe.analyzer.lexer.Keywords;
import org.dxworks.jovialframe.analyzer.lexer.Token;
import org.dxworks.jovialframe.analyzer.lexer.TokenKind;
import org.dxworks.jovialframe.analyzer.semantic.Scope;
import org.dxworks.jovialframe.analyzer.semantic.ScopeTree;
import org.dxworks.jovialframe.analyzer.semantic.Symbol;
import org.dxworks.jovialframe.analyzer.semantic.SymbolKind;
import org.dxworks.jovialframe.analyzer.xref.Occurrence;
import org.dxworks.jovialframe.analyzer.xref.OccurrenceRole;
import org.dxworks.jovialframe.model.Position;
import org.dxworks.jovialframe.model.Span;
import org.dxworks.jovialframe.model.ast.CompilationUnit;
import org.dxworks.jovialframe.model.ast.ModuleKind;
import org.dxworks.jovialframe.model.query.CompletionItem;
import org.dxworks.jovialframe.model.query.CompletionTier;
import org.dxworks.jovialframe.model.query.DocumentSymbol;
import org.dxworks.jovialframe.model.query.HoverInfo;
import org.dxworks.jovialframe.model.query.Location;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Editor queries over a published snapshot. Every method is a pure read; a position that hits
 * nothing gives an empty answer.
 */
public class QueryService {

    private static final Set<String> DECLARATION_NAME_KEYWORDS = Set.of(
            "ITEM", "TABLE", "PROC", "DEFINE", "TYPE", "COMPOOL", "START", "PROGRAM");
    private static final Set<String> ITEM_ATTRIBUTES = Set.of("STATIC", "CONSTANT", "PARALLEL");
    private static final Set<String> STATEMENT_BOUNDARY_KEYWORDS = Set.of("BEGIN", "END", "THEN", "ELSE", "DEF", "REF");
    // status values are listed under their enumeration
    private static final Set<SymbolKind> OUTLINE_HIDDEN = Set.of(SymbolKind.LABEL, SymbolKind.LOOP_VARIABLE,
            SymbolKind.STATUS_VALUE);

    private static final String KEYWORD = "Keyword";
    private static final String BUILTIN_FUNCTION = "Built-in function";

    public List<CompletionItem> completion(AnalysisSnapshot snapshot, Position position) {
        int offset = snapshot.getLineIndex().offsetOf(position);
        String prefix = prefixBefore(snapshot.getText(), offset);
        CompletionContext context = contextAt(snapshot, offset - prefix.length());
        if (context == CompletionContext.NONE || context == CompletionContext.DECLARATION_NAME) {
            return List.of();
        }

        int scopeIndex = snapshot.getScopeTree().innermostAt(offset).getIndex();
        List<CompletionItem> candidates = new ArrayList<>();
        switch (context) {
            case TYPE_POSITION:
                addKeywords(candidates, Keywords.TYPE_POSITION_KEYWORDS);
                visibleSymbols(snapshot.getScopeTree(), scopeIndex).stream()
                        .filter(item -> SymbolKind.TYPE.displayName().equals(item.getKind()))
                        .forEach(candidates::add);
                break;
            case STATUS_VALUE:
                candidates.addAll(visibleStatusValues(snapshot.getScopeTree(), scopeIndex));
                break;
            case STATEMENT_START:
                candidates.addAll(visibleSymbols(snapshot.getScopeTree(), scopeIndex));
                addKeywords(candidates, Keywords.STATEMENT_KEYWORDS);
                addKeywords(candidates, Keywords.DECLARATION_KEYWORDS);
                break;
            default:
                candidates.addAll(visibleSymbols(snapshot.getScopeTree(), scopeIndex));
                addKeywords(candidates, Keywords.EXPRESSION_KEYWORDS);
                Keywords.BUILTIN_FUNCTIONS.forEach(name -> candidates.add(new CompletionItem(name, BUILTIN_FUNCTION,
                        Keywords.describe(name).orElse(null), CompletionTier.KEYWORD)));
                break;
        }

        String upperPrefix = prefix.toUpperCase(Locale.ROOT);
        Set<String> seen = new HashSet<>();
        return candidates.stream()
                .filter(item -> item.getLabel().toUpperCase(Locale.ROOT).startsWith(upperPrefix))
                .sorted(CompletionItem.RANKING)
                .filter(item -> seen.add(item.getLabel().toUpperCase(Locale.ROOT)))
                .collect(Collectors.toList());
    }

    /**
     * Context of a completion whose typed prefix starts at {@code offset}.
     */
    public CompletionContext contextAt(AnalysisSnapshot snapshot, int offset) {
        List<Token> tokens = snapshot.getTokens();
        List<Token> before = new ArrayList<>();
        for (Token token : tokens) {
            if (token.is(TokenKind.END_OF_INPUT) || token.getStart() >= offset) {
                break;
            }
            if (token.is(TokenKind.QUOTED_TEXT) && token.getEnd() > offset) {
                return CompletionContext.NONE;
            }
            if (token.is(TokenKind.ERROR) && token.isUnterminated() && token.getEnd() >= offset) {
                return CompletionContext.NONE;
            }
            if (token.getEnd() <= offset && !token.is(TokenKind.QUOTED_TEXT) && !token.is(TokenKind.ERROR)) {
                before.add(token);
            }
        }

        Token previous = last(before, 1);
        if (previous == null) {
            return CompletionContext.STATEMENT_START;
        }
        Token beforePrevious = last(before, 2);
        if (previous.isPunctuation("(") && beforePrevious != null && beforePrevious.key().equals("V")) {
            return CompletionContext.STATUS_VALUE;
        }
        if (previous.is(TokenKind.KEYWORD) && DECLARATION_NAME_KEYWORDS.contains(previous.key())) {
            return CompletionContext.DECLARATION_NAME;
        }

        List<Token> fragment = currentFragment(before);
        if (isTypePosition(fragment)) {
            return CompletionContext.TYPE_POSITION;
        }
        if (previous.isPunctuation(";") || (previous.is(TokenKind.KEYWORD) && STATEMENT_BOUNDARY_KEYWORDS.contains(previous.key()))) {
            return CompletionContext.STATEMENT_START;
        }
        if (previous.isPunctuation(":") && isLabelOrCaseHead(fragment)) {
            return CompletionContext.STATEMENT_START;
        }
        return CompletionContext.EXPRESSION;
    }

    public Optional<HoverInfo> hover(AnalysisSnapshot snapshot, Position position) {
        int offset = snapshot.getLineIndex().offsetOf(position);
        Optional<Occurrence> occurrence = snapshot.getCrossReferences().occurrenceAt(offset);
        if (occurrence.isPresent()) {
            return occurrence.filter(Occurrence::isResolved)
                    .map(found -> symbolHover(snapshot.getScopeTree(), found.getSymbol(), found.getSpan()));
        }
        return tokenAt(snapshot, offset).flatMap(QueryService::keywordHover);
    }

    public Optional<Location> definition(AnalysisSnapshot snapshot, Position position) {
        return symbolAt(snapshot, position)
                .map(symbol -> new Location(snapshot.getUri(), symbol.getDeclarationSpan()));
    }

    public List<Location> references(AnalysisSnapshot snapshot, Position position) {
        return references(snapshot, position, true);
    }

    /**
     * Every occurrence of the symbol under the cursor, in source order.
     */
    public List<Location> references(AnalysisSnapshot snapshot, Position position, boolean includeDeclaration) {
        return referencingOccurrences(snapshot, position, includeDeclaration).stream()
                .map(occurrence -> new Location(snapshot.getUri(), occurrence.getSpan()))
                .collect(Collectors.toList());
    }

    public List<Occurrence> referencingOccurrences(AnalysisSnapshot snapshot, Position position, boolean includeDeclaration) {
        Optional<Symbol> symbol = symbolAt(snapshot, position);
        if (symbol.isEmpty()) {
            return List.of();
        }
        return snapshot.getCrossReferences().occurrencesOf(symbol.get()).stream()
                .filter(occurrence -> includeDeclaration || occurrence.getRole() != OccurrenceRole.DECLARATION)
                .sorted(Comparator.comparing(Occurrence::getSpan))
                .collect(Collectors.toList());
    }

    /**
     * Outline in declaration order. A named program or compool header wraps everything else.
     */
    public List<DocumentSymbol> documentSymbols(AnalysisSnapshot snapshot) {
        ScopeTree tree = snapshot.getScopeTree();
        List<DocumentSymbol> entries = outline(tree, tree.getRoot());
        CompilationUnit unit = snapshot.getUnit();
        if (unit.programName == null) {
            return entries;
        }
        DocumentSymbol header = new DocumentSymbol();
        header.name = unit.programName.text;
        header.kind = unit.moduleKind == ModuleKind.COMPOOL ? "Compool" : "Program";
        header.range = unit.span;
        header.selectionRange = unit.programName.span;
        header.children = entries;
        return List.of(header);
    }

    private List<DocumentSymbol> outline(ScopeTree tree, Scope scope) {
        List<Symbol> symbols = scope.getSymbols().stream()
                .filter(symbol -> !OUTLINE_HIDDEN.contains(symbol.getKind()))
                .sorted(Comparator.comparing(QueryService::rangeOf))
                .collect(Collectors.toList());
        List<DocumentSymbol> entries = new ArrayList<>();
        for (Symbol symbol : symbols) {
            DocumentSymbol entry = entryFor(symbol);
            if (symbol.getOwnedScopeIndex() >= 0) {
                entry.children.addAll(outline(tree, tree.get(symbol.getOwnedScopeIndex())));
            }
            for (Symbol member : symbol.getMembers()) {
                entry.children.add(entryFor(member));
            }
            entries.add(entry);
        }
        return entries;
    }

    private static DocumentSymbol entryFor(Symbol symbol) {
        DocumentSymbol entry = new DocumentSymbol();
        entry.name = symbol.getName();
        entry.kind = symbol.getKind().displayName();
        entry.detail = symbol.getType();
        entry.range = rangeOf(symbol);
        entry.selectionRange = symbol.getDeclarationSpan();
        return entry;
    }

    private static Span rangeOf(Symbol symbol) {
        return symbol.getExtent() != null ? symbol.getExtent() : symbol.getDeclarationSpan();
    }

    private static Optional<Symbol> symbolAt(AnalysisSnapshot snapshot, Position position) {
        int offset = snapshot.getLineIndex().offsetOf(position);
        return snapshot.getCrossReferences().occurrenceAt(offset)
                .filter(Occurrence::isResolved)
                .map(Occurrence::getSymbol);
    }

    private static HoverInfo symbolHover(ScopeTree tree, Symbol symbol, Span span) {
        HoverInfo hover = new HoverInfo();
        hover.name = symbol.getName();
        hover.kind = symbol.getKind().displayName();
        hover.type = symbol.getType();
        hover.scope = tree.get(symbol.getScopeIndex()).getName();
        hover.documentation = symbol.getDocumentation();
        if (symbol.getKind() == SymbolKind.STATUS_VALUE && symbol.getOwner() != null) {
            hover.details.put("value of", symbol.getOwner().getName());
        }
        hover.details.putAll(symbol.getDetails());
        if (!symbol.getMembers().isEmpty()) {
            hover.details.put("values", symbol.getMembers().stream()
                    .map(member -> "V(" + member.getName() + ")")
                    .collect(Collectors.joining(", ")));
        }
        hover.span = span;
        return hover;
    }

    private static Optional<HoverInfo> keywordHover(Token token) {
        boolean word = token.is(TokenKind.KEYWORD)
                || (token.is(TokenKind.IDENTIFIER) && (Keywords.isBuiltinFunction(token.getText()) || Keywords.isTypeLetter(token.getText())));
        if (!word) {
            return Optional.empty();
        }
        return Keywords.describe(token.getText()).map(description -> {
            HoverInfo hover = new HoverInfo();
            hover.name = token.key();
            hover.kind = Keywords.isBuiltinFunction(token.getText()) ? BUILTIN_FUNCTION : KEYWORD;
            hover.documentation = description;
            hover.span = token.getSpan();
            return hover;
        });
    }

    private static Optional<Token> tokenAt(AnalysisSnapshot snapshot, int offset) {
        List<Token> tokens = snapshot.getTokens();
        int low = 0;
        int high = tokens.size() - 1;
        int found = -1;
        while (low <= high) {
            int mid = (low + high) >>> 1;
            if (tokens.get(mid).getStart() <= offset) {
                found = mid;
                low = mid + 1;
            } else {
                high = mid - 1;
            }
        }
        if (found >= 0 && tokens.get(found).getSpan().touches(offset) && !tokens.get(found).is(TokenKind.END_OF_INPUT)) {
            return Optional.of(tokens.get(found));
        }
        return Optional.empty();
    }

    private static List<CompletionItem> visibleSymbols(ScopeTree tree, int scopeIndex) {
        List<CompletionItem> items = new ArrayList<>();
        Set<String> shadowed = new HashSet<>();
        for (Scope scope : tree.searchOrder(scopeIndex)) {
            for (Symbol symbol : scope.getSymbols()) {
                if (shadowed.add(symbol.getKey())) {
                    items.add(new CompletionItem(symbol.getName(), symbol.getKind().displayName(),
                            symbol.getType(), tierOf(symbol, scopeIndex)));
                }
            }
        }
        return items;
    }

    private static List<CompletionItem> visibleStatusValues(ScopeTree tree, int scopeIndex) {
        List<CompletionItem> items = new ArrayList<>();
        Set<String> shadowed = new HashSet<>();
        for (Scope scope : tree.searchOrder(scopeIndex)) {
            for (Symbol value : scope.getSymbols()) {
                if (value.getKind() == SymbolKind.STATUS_VALUE && shadowed.add(value.getKey())) {
                    items.add(new CompletionItem(value.getName(), value.getKind().displayName(),
                            value.getType(), tierOf(value, scopeIndex)));
                }
            }
        }
        return items;
    }

    private static CompletionTier tierOf(Symbol symbol, int scopeIndex) {
        return symbol.getScopeIndex() == scopeIndex ? CompletionTier.LOCAL_SCOPE : CompletionTier.OUTER_SCOPE;
    }

    private static void addKeywords(List<CompletionItem> items, List<String> keywords) {
        for (String keyword : keywords) {
            items.add(new CompletionItem(keyword, KEYWORD, Keywords.describe(keyword).orElse(null), CompletionTier.KEYWORD));
        }
    }

    /**
     * Identifier characters typed right before {@code offset}, apostrophe separators included.
     */
    static String prefixBefore(String text, int offset) {
        int start = offset;
        while (start > 0) {
            char c = text.charAt(start - 1);
            if (JovialLexer.isIdentifierPart(c)) {
                start--;
            } else if (c == '\'' && start - 2 >= 0 && start < offset
                    && JovialLexer.isIdentifierPart(text.charAt(start - 2))) {
                start--;
            } else {
                break;
            }
        }
        return text.substring(start, offset);
    }

    /**
     * Tokens since the last statement or block boundary.
     */
    private static List<Token> currentFragment(List<Token> before) {
        int start = before.size();
        while (start > 0) {
            Token token = before.get(start - 1);
            if (token.isPunctuation(";") || token.isKeyword("BEGIN") || token.isKeyword("END")) {
                break;
            }
            start--;
        }
        return before.subList(start, before.size());
    }

    private static boolean isTypePosition(List<Token> fragment) {
        int i = 0;
        while (i < fragment.size() && (fragment.get(i).isKeyword("DEF") || fragment.get(i).isKeyword("REF"))) {
            i++;
        }
        if (i >= fragment.size() || !(fragment.get(i).isKeyword("ITEM") || fragment.get(i).isKeyword("TYPE"))) {
            return false;
        }
        if (i + 1 >= fragment.size() || !fragment.get(i + 1).is(TokenKind.IDENTIFIER)) {
            return false;
        }
        for (int k = i + 2; k < fragment.size(); k++) {
            if (!(fragment.get(k).is(TokenKind.KEYWORD) && ITEM_ATTRIBUTES.contains(fragment.get(k).key()))) {
                return false;
            }
        }
        return true;
    }

    private static boolean isLabelOrCaseHead(List<Token> fragment) {
        if (fragment.size() == 2 && fragment.get(0).is(TokenKind.IDENTIFIER)) {
            return true;
        }
        return !fragment.isEmpty() && fragment.get(0).isPunctuation("(");
    }

    private static Token last(List<Token> tokens, int fromEnd) {
        return tokens.size() >= fromEnd ? tokens.get(tokens.size() - fromEnd) : null;
    }
}
