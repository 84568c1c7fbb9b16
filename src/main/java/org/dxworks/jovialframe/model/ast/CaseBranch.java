package org.dxworks.jovialframe.model.ast;

import org.dxworks.jovialframe.model.Span;

import java.util.ArrayList;
import java.util.List;

/**
 * {@code (labels): statement [FALLTHRU]}; a range label {@code lo:hi} is a binary ":" expression.
 */
public class CaseBranch {
    public List<Expression> labels = new ArrayList<>();
    public boolean isDefault;
    public boolean fallthru;
    public Node body;
    public Span span;
}
