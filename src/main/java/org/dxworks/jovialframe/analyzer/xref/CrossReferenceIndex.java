package org.dxworks.jovialframe.analyzer.xref;

import org.dxworks.jovialframe.analyzer.InternalAnalysisException;
import org.dxworks.jovialframe.analyzer.semantic.ScopeTree;
import org.dxworks.jovialframe.analyzer.semantic.Symbol;
import org.dxworks.jovialframe.model.Diagnostic;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Every occurrence of a document, sorted by position, plus the occurrences of each symbol with its
 * declaration first.
 */
public final class CrossReferenceIndex {

    private final List<Occurrence> occurrences;
    private final Map<Integer, List<Occurrence>> bySymbol = new HashMap<>();
    private final List<Diagnostic> diagnostics;

    CrossReferenceIndex(List<Occurrence> occurrences, List<Diagnostic> diagnostics) {
        List<Occurrence> sorted = new ArrayList<>(occurrences);
        sorted.sort(Comparator.comparing(Occurrence::getSpan));
        this.occurrences = Collections.unmodifiableList(sorted);
        this.diagnostics = Collections.unmodifiableList(new ArrayList<>(diagnostics));

        for (Occurrence occurrence : sorted) {
            if (occurrence.isResolved()) {
                bySymbol.computeIfAbsent(occurrence.getSymbol().getId(), id -> new ArrayList<>()).add(occurrence);
            }
        }
        for (List<Occurrence> list : bySymbol.values()) {
            list.sort(Comparator.comparing((Occurrence o) -> !o.isDeclaration()).thenComparing(Occurrence::getSpan));
        }
    }

    public List<Occurrence> getOccurrences() {
        return occurrences;
    }

    /**
     * Occurrences of {@code symbol}: the declaration first, then uses in source order.
     */
    public List<Occurrence> occurrencesOf(Symbol symbol) {
        List<Occurrence> list = bySymbol.get(symbol.getId());
        return list == null ? List.of() : Collections.unmodifiableList(list);
    }

    /**
     * Occurrence whose span touches {@code offset}, so a cursor right behind a name still finds it.
     */
    public Optional<Occurrence> occurrenceAt(int offset) {
        int low = 0;
        int high = occurrences.size() - 1;
        int found = -1;
        while (low <= high) {
            int mid = (low + high) >>> 1;
            if (occurrences.get(mid).getSpan().getStartOffset() <= offset) {
                found = mid;
                low = mid + 1;
            } else {
                high = mid - 1;
            }
        }
        if (found >= 0 && occurrences.get(found).getSpan().touches(offset)) {
            return Optional.of(occurrences.get(found));
        }
        return Optional.empty();
    }

    public List<Occurrence> unresolved() {
        return occurrences.stream().filter(o -> !o.isResolved()).collect(Collectors.toList());
    }

    public List<Diagnostic> getDiagnostics() {
        return diagnostics;
    }

    public int size() {
        return occurrences.size();
    }

    /**
     * Resolved occurrences must point into {@code tree}, declarations must sit on their symbol's name.
     */
    public void verify(ScopeTree tree) {
        List<Symbol> symbols = tree.getSymbols();
        for (Occurrence occurrence : occurrences) {
            Symbol symbol = occurrence.getSymbol();
            if (symbol == null) {
                continue;
            }
            if (symbol.getId() >= symbols.size() || symbols.get(symbol.getId()) != symbol) {
                throw new InternalAnalysisException("occurrence " + occurrence + " refers to a foreign symbol");
            }
            if (occurrence.isDeclaration() && !occurrence.getSpan().equals(symbol.getDeclarationSpan())) {
                throw new InternalAnalysisException("declaration occurrence " + occurrence + " is not at the symbol's name");
            }
        }
    }
}
