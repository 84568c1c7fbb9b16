package org.dxworks.jovialframe.model.query;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Comparator;
import java.util.Objects;

@JsonPropertyOrder({"label", "kind", "detail", "tier"})
public final class CompletionItem {

    /**
     * Tier, then label ignoring case.
     */
    public static final Comparator<CompletionItem> RANKING = Comparator
            .comparing(CompletionItem::getTier)
            .thenComparing(CompletionItem::getLabel, String.CASE_INSENSITIVE_ORDER)
            .thenComparing(CompletionItem::getLabel);

    private final String label;
    private final String kind;
    private final String detail;
    private final CompletionTier tier;

    public CompletionItem(String label, String kind, String detail, CompletionTier tier) {
        this.label = label;
        this.kind = kind;
        this.detail = detail;
        this.tier = tier;
    }

    public String getLabel() {
        return label;
    }

    /**
     * "Keyword", "Built-in function" or the display name of the symbol kind.
     */
    public String getKind() {
        return kind;
    }

    public String getDetail() {
        return detail;
    }

    public CompletionTier getTier() {
        return tier;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof CompletionItem)) return false;
        CompletionItem that = (CompletionItem) o;
        return label.equals(that.label) && Objects.equals(kind, that.kind)
                && Objects.equals(detail, that.detail) && tier == that.tier;
    }

    @Override
    public int hashCode() {
        return Objects.hash(label, kind, detail, tier);
    }

    @Override
    public String toString() {
        return label + " (" + kind + ", " + tier + ")";
    }
}
