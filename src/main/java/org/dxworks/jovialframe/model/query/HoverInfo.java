package org.dxworks.jovialframe.model.query;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import org.dxworks.jovialframe.model.Span;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * What hover shows for a resolved name or a keyword.
 */
@JsonPropertyOrder({"name", "kind", "type", "scope", "documentation", "details", "span"})
public class HoverInfo {
    public String name;
    /** Display kind such as "Item", or "Keyword" for reserved words. */
    public String kind;
    public String type;
    /** Name of the declaring scope; null for keywords. */
    public String scope;
    public String documentation;
    public Map<String, String> details = new LinkedHashMap<>();
    /** Span of the hovered word. */
    public Span span;

    public String toMarkdown() {
        StringBuilder markdown = new StringBuilder();
        markdown.append("**").append(name).append("** (").append(kind).append(")\n");
        if (type != null) {
            markdown.append("\nType: `").append(type).append('`');
        }
        if (scope != null) {
            markdown.append("\nScope: `").append(scope).append('`');
        }
        details.forEach((key, value) -> markdown.append('\n').append(capitalize(key)).append(": `").append(value).append('`'));
        if (documentation != null && !documentation.isEmpty()) {
            markdown.append("\n\n").append(documentation);
        }
        return markdown.toString();
    }

    private static String capitalize(String text) {
        return text.isEmpty() ? text : Character.toUpperCase(text.charAt(0)) + text.substring(1);
    }
}
