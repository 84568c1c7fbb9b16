package org.dxworks.jovialframe.analyzer.parser;

import org.dxworks.jovialframe.model.Diagnostic;
import org.dxworks.jovialframe.model.ast.CompilationUnit;

import java.util.ArrayList;
import java.util.List;

public class ParseResult {
    public CompilationUnit unit;
    public List<Diagnostic> diagnostics = new ArrayList<>();
}
