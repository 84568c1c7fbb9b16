package org.dxworks.jovialframe.model.ast;

import org.dxworks.jovialframe.model.Span;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

public class TypeSpec {
    public TypeSpecKind kind;
    /** Upper-case type letter for scalar types. */
    public String letter;
    public Integer width;
    public Integer scale;
    public Identifier typeName;
    public List<Identifier> statusValues = new ArrayList<>();
    public Span span;

    public static TypeSpec scalar(String letter) {
        TypeSpec spec = new TypeSpec();
        spec.kind = TypeSpecKind.SCALAR;
        spec.letter = letter;
        return spec;
    }

    public static TypeSpec status() {
        TypeSpec spec = new TypeSpec();
        spec.kind = TypeSpecKind.STATUS;
        return spec;
    }

    public static TypeSpec named(Identifier typeName) {
        TypeSpec spec = new TypeSpec();
        spec.kind = TypeSpecKind.NAMED;
        spec.typeName = typeName;
        spec.span = typeName.span;
        return spec;
    }

    /**
     * Display form: {@code S 16}, {@code A 16,8}, {@code STATUS (V(ON), V(OFF))} or the type name.
     */
    public String text() {
        switch (kind) {
            case SCALAR: {
                StringBuilder sb = new StringBuilder(letter);
                if (width != null) {
                    sb.append(' ').append(width);
                }
                if (scale != null) {
                    sb.append(',').append(scale);
                }
                if (typeName != null) {
                    sb.append(' ').append(typeName.text);
                }
                return sb.toString();
            }
            case STATUS: {
                String values = statusValues.stream()
                        .map(v -> "V(" + v.text + ")")
                        .collect(Collectors.joining(", "));
                return (width != null ? "STATUS " + width : "STATUS") + " (" + values + ")";
            }
            default:
                return typeName != null ? typeName.text : "";
        }
    }
}
