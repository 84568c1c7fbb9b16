package org.dxworks.jovialframe.model.query;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import org.dxworks.jovialframe.model.Span;

import java.util.ArrayList;
import java.util.List;

/**
 * One outline entry. Programs, compools, tables, procedures and status enumerations have children.
 */
@JsonPropertyOrder({"name", "kind", "detail", "range", "selectionRange", "children"})
public class DocumentSymbol {
    public String name;
    public String kind;
    public String detail;
    /** Whole declaration. */
    public Span range;
    /** Declared name. */
    public Span selectionRange;
    public List<DocumentSymbol> children = new ArrayList<>();
}
