package org.dxworks.jovialframe.model;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.ArrayList;
import java.util.List;

@JsonPropertyOrder({"name", "kind", "type", "line", "children"})
public class SymbolInfo {
    public String name;
    public String kind;
    public String type;
    /** 1-based line of the declared name. */
    public int line;
    public List<SymbolInfo> children = new ArrayList<>();
}
