package org.dxworks.jovialframe.analyzer.parser;

import org.dxworks.jovialframe.analyzer.lexer.Keywords;
import org.dxworks.jovialframe.analyzer.lexer.Token;
import org.dxworks.jovialframe.analyzer.lexer.TokenKind;
import org.dxworks.jovialframe.model.Diagnostic;
import org.dxworks.jovialframe.model.DiagnosticCategory;
import org.dxworks.jovialframe.model.Span;
import org.dxworks.jovialframe.model.ast.AssignmentStatement;
import org.dxworks.jovialframe.model.ast.BinaryExpression;
import org.dxworks.jovialframe.model.ast.BlockStatement;
import org.dxworks.jovialframe.model.ast.CallStatement;
import org.dxworks.jovialframe.model.ast.CaseBranch;
import org.dxworks.jovialframe.model.ast.CaseStatement;
import org.dxworks.jovialframe.model.ast.CompilationUnit;
import org.dxworks.jovialframe.model.ast.CompoolDeclaration;
import org.dxworks.jovialframe.model.ast.ConstantDeclaration;
import org.dxworks.jovialframe.model.ast.ControlStatement;
import org.dxworks.jovialframe.model.ast.Declaration;
import org.dxworks.jovialframe.model.ast.Dimension;
import org.dxworks.jovialframe.model.ast.Directive;
import org.dxworks.jovialframe.model.ast.Expression;
import org.dxworks.jovialframe.model.ast.ExternalDeclaration;
import org.dxworks.jovialframe.model.ast.ForStatement;
import org.dxworks.jovialframe.model.ast.GotoStatement;
import org.dxworks.jovialframe.model.ast.Identifier;
import org.dxworks.jovialframe.model.ast.IfStatement;
import org.dxworks.jovialframe.model.ast.IndexedExpression;
import org.dxworks.jovialframe.model.ast.ItemDeclaration;
import org.dxworks.jovialframe.model.ast.Linkage;
import org.dxworks.jovialframe.model.ast.LiteralExpression;
import org.dxworks.jovialframe.model.ast.LiteralKind;
import org.dxworks.jovialframe.model.ast.ModuleKind;
import org.dxworks.jovialframe.model.ast.NameExpression;
import org.dxworks.jovialframe.model.ast.Node;
import org.dxworks.jovialframe.model.ast.NullStatement;
import org.dxworks.jovialframe.model.ast.ProcDeclaration;
import org.dxworks.jovialframe.model.ast.Statement;
import org.dxworks.jovialframe.model.ast.StatusDeclaration;
import org.dxworks.jovialframe.model.ast.StatusValueExpression;
import org.dxworks.jovialframe.model.ast.TableDeclaration;
import org.dxworks.jovialframe.model.ast.TypeDeclaration;
import org.dxworks.jovialframe.model.ast.TypeSpec;
import org.dxworks.jovialframe.model.ast.TypeSpecKind;
import org.dxworks.jovialframe.model.ast.UnaryExpression;
import org.dxworks.jovialframe.model.ast.WhileStatement;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.function.Supplier;

/**
 * Error-tolerant recursive-descent parser for J73 compilation units.
 *
 * <p>The parser never gives up: a syntax error is reported as a {@link DiagnosticCategory#PARSE_ERROR},
 * the tokens up to the next boundary (a consumed {@code ;}, or BEGIN, END, TERM or a declaration
 * keyword) are skipped and parsing resumes. Declarations are added to the tree as soon as their
 * name has been read, so a broken declaration still declares its name.</p>
 */
public final class JovialParser {

    private static final Set<String> ITEM_ATTRIBUTES = Set.of("STATIC", "CONSTANT", "PARALLEL");
    private static final Set<String> PROC_ATTRIBUTES = Set.of("REC", "RENT", "INLINE");
    private static final Set<String> TABLE_BODY_STARTERS = Set.of("ITEM", "TABLE", "TYPE");
    private static final Set<String> DECLARATION_KEYWORDS = Set.of("ITEM", "TABLE", "PROC", "DEFINE", "TYPE", "COMPOOL");
    private static final Set<String> STATEMENT_KEYWORDS = Set.of(
            "BEGIN", "IF", "WHILE", "FOR", "CASE", "GOTO", "RETURN", "EXIT", "ABORT", "STOP");
    private static final Set<String> RELATIONAL_OPERATORS = Set.of("=", "<>", "<", ">", "<=", ">=");
    private static final Set<String> LOGICAL_OPERATORS = Set.of("OR", "XOR", "EQV");

    private enum MemberContext {
        TOP,
        BLOCK,
        TABLE
    }

    static final int MAX_NESTING = 256;

    private final TokenCursor cursor;
    private final List<Diagnostic> diagnostics = new ArrayList<>();
    private final CompilationUnit unit = new CompilationUnit();
    private int depth;

    private JovialParser(List<Token> tokens) {
        this.cursor = new TokenCursor(tokens);
    }

    /**
     * Parses a token list produced by the lexer; the list must end with {@link TokenKind#END_OF_INPUT}.
     */
    public static ParseResult parse(List<Token> tokens) {
        JovialParser parser = new JovialParser(tokens);
        ParseResult result = new ParseResult();
        result.unit = parser.parseUnit();
        result.diagnostics = parser.diagnostics;
        return result;
    }

    // ------------------------------------------------------------------ unit

    private CompilationUnit parseUnit() {
        if (cursor.peek().isKeyword("START")) {
            try {
                parseStartHeader();
            } catch (SyntaxError e) {
                recover(e);
            }
        }

        while (true) {
            Token token = cursor.peek();
            if (token.is(TokenKind.END_OF_INPUT)) {
                break;
            }
            if (token.isKeyword("TERM")) {
                parseTerm();
                break;
            }
            if (token.isKeyword("END")) {
                report(token.getSpan(), "unexpected END without matching BEGIN");
                cursor.advance();
                continue;
            }
            parseMember(unit.members, MemberContext.TOP);
        }

        unit.span = Span.covering(cursor.raw(0).getSpan(), cursor.raw(cursor.size() - 1).getSpan());
        return unit;
    }

    private void parseStartHeader() {
        cursor.advance();
        if (acceptKeyword("COMPOOL")) {
            unit.moduleKind = ModuleKind.COMPOOL;
        } else {
            acceptKeyword("PROGRAM");
        }
        if (cursor.peek().is(TokenKind.IDENTIFIER)) {
            unit.programName = identifier(cursor.advance());
        }
        expectPunctuation(";");
    }

    private void parseTerm() {
        cursor.advance();
        if (cursor.peek().is(TokenKind.IDENTIFIER)) {
            cursor.advance();
        }
        acceptPunctuation(";");
        unit.terminated = true;

        if (!cursor.atEnd()) {
            Token first = cursor.peek();
            while (!cursor.atEnd()) {
                cursor.advance();
            }
            report(Span.covering(first.getSpan(), cursor.previous().getSpan()), "unexpected text after TERM");
        }
    }

    // ------------------------------------------------------------------ members

    private void parseMember(List<Node> into, MemberContext context) {
        int before = cursor.position();
        try {
            nested(() -> {
                member(into, context);
                return null;
            });
        } catch (SyntaxError e) {
            recover(e);
        }
        if (cursor.position() == before && !cursor.atEnd()) {
            // recovery stopped on the token that caused the error
            cursor.advance();
        }
    }

    private void member(List<Node> into, MemberContext context) {
        Token token = cursor.peek();
        int startIndex = cursor.peekIndex();

        if (token.isPunctuation("!")) {
            parseDirective(into);
            return;
        }
        if (token.is(TokenKind.KEYWORD)) {
            String key = token.key();
            if (key.equals("DEF") || key.equals("REF")) {
                parseLinked(into, context, startIndex);
                return;
            }
            if (DECLARATION_KEYWORDS.contains(key)) {
                if (context == MemberContext.TABLE && !TABLE_BODY_STARTERS.contains(key)) {
                    throw error("expected ITEM, TABLE or TYPE in table body");
                }
                parseDeclaration(into, context, Linkage.NONE, token, startIndex);
                return;
            }
        }
        if (context == MemberContext.TABLE) {
            throw error("expected ITEM, TABLE or TYPE in table body");
        }
        Statement statement = parseStatement();
        if (statement != null) {
            into.add(statement);
        }
    }

    /**
     * Members of a BEGIN block up to and including its END. Returns false when the END is missing.
     */
    private boolean parseMembersUntilEnd(List<Node> into, MemberContext context) {
        while (true) {
            Token token = cursor.peek();
            if (token.isKeyword("END")) {
                cursor.advance();
                return true;
            }
            if (token.is(TokenKind.END_OF_INPUT) || token.isKeyword("TERM")) {
                report(token.getSpan(), "missing END");
                return false;
            }
            if (context == MemberContext.TABLE && token.is(TokenKind.KEYWORD)
                    && Keywords.DECLARATION_STARTERS.contains(token.key())
                    && !TABLE_BODY_STARTERS.contains(token.key())) {
                report(token.getSpan(), "missing END before " + token.key());
                return false;
            }
            parseMember(into, context);
        }
    }

    private void parseDirective(List<Node> into) {
        Token bang = cursor.advance();
        Token nameToken = cursor.peek();
        if (!nameToken.is(TokenKind.IDENTIFIER) && !nameToken.is(TokenKind.KEYWORD)) {
            throw error("expected directive name");
        }
        cursor.advance();

        Directive directive = new Directive();
        directive.name = nameToken.key();
        into.add(directive);
        unit.directives.add(directive);
        try {
            while (true) {
                Token token = cursor.peekRaw();
                if (token.is(TokenKind.END_OF_INPUT) || token.isPunctuation(";") || isBoundary(token)) {
                    break;
                }
                cursor.advanceRaw();
                if (token.isPunctuation("(") || token.isPunctuation(")") || token.isPunctuation(",")) {
                    continue;
                }
                directive.arguments.add(token.is(TokenKind.QUOTED_TEXT) ? quotedContent(token.getText()) : token.getText());
            }
            expectPunctuation(";");
        } finally {
            directive.span = spanFrom(bang);
        }
    }

    private void parseLinked(List<Node> into, MemberContext context, int startIndex) {
        Token start = cursor.advance();
        Linkage linkage = start.isKeyword("DEF") ? Linkage.DEF : Linkage.REF;
        Token next = cursor.peek();

        if (next.isKeyword("BEGIN")) {
            cursor.advance();
            List<Node> block = new ArrayList<>();
            parseMembersUntilEnd(block, MemberContext.BLOCK);
            for (Node node : block) {
                if (node instanceof Declaration declaration && declaration.linkage == Linkage.NONE) {
                    declaration.linkage = linkage;
                }
            }
            into.addAll(block);
            return;
        }
        if (next.is(TokenKind.IDENTIFIER)) {
            ExternalDeclaration external = new ExternalDeclaration();
            declare(into, external, identifier(cursor.advance()), startIndex, linkage);
            try {
                expectPunctuation(";");
            } finally {
                close(external, start);
            }
            return;
        }
        if (next.is(TokenKind.KEYWORD) && DECLARATION_KEYWORDS.contains(next.key())) {
            parseDeclaration(into, context, linkage, start, startIndex);
            return;
        }
        throw error("expected declaration after " + start.key());
    }

    private void parseDeclaration(List<Node> into, MemberContext context, Linkage linkage, Token start, int startIndex) {
        switch (cursor.peek().key()) {
            case "ITEM" -> parseItem(into, linkage, start, startIndex);
            case "TABLE" -> {
                cursor.advance();
                TableDeclaration table = new TableDeclaration();
                declare(into, table, expectName("table name"), startIndex, linkage);
                parseTableRest(table, start);
            }
            case "PROC" -> parseProc(into, linkage, start, startIndex);
            case "DEFINE" -> parseDefine(into, linkage, start, startIndex);
            case "TYPE" -> parseTypeDeclaration(into, linkage, start, startIndex);
            case "COMPOOL" -> parseCompool(into, context, linkage, start, startIndex);
            default -> throw error("expected declaration");
        }
    }

    // ------------------------------------------------------------------ declarations

    private void parseItem(List<Node> into, Linkage linkage, Token start, int startIndex) {
        cursor.advance();
        Identifier name = expectName("item name");
        List<String> modifiers = new ArrayList<>();
        TypeSpec type;
        try {
            parseAttributes(modifiers, ITEM_ATTRIBUTES);
            type = parseTypeSpec();
        } catch (SyntaxError e) {
            ItemDeclaration partial = new ItemDeclaration();
            partial.modifiers = modifiers;
            declare(into, partial, name, startIndex, linkage);
            close(partial, start);
            throw e;
        }

        if (type.kind == TypeSpecKind.STATUS) {
            StatusDeclaration status = new StatusDeclaration();
            status.type = type;
            status.modifiers = modifiers;
            declare(into, status, name, startIndex, linkage);
            try {
                parseAttributes(modifiers, ITEM_ATTRIBUTES);
                status.initializer = parseInitializer();
                expectPunctuation(";");
            } finally {
                close(status, start);
            }
        } else {
            ItemDeclaration item = new ItemDeclaration();
            item.type = type;
            item.modifiers = modifiers;
            declare(into, item, name, startIndex, linkage);
            try {
                parseAttributes(modifiers, ITEM_ATTRIBUTES);
                item.initializer = parseInitializer();
                expectPunctuation(";");
            } finally {
                close(item, start);
            }
        }
    }

    private Expression parseInitializer() {
        if (acceptPunctuation("=") || acceptPunctuation(":=")) {
            return parseExpression();
        }
        return null;
    }

    private void parseTableRest(TableDeclaration table, Token start) {
        try {
            if (acceptPunctuation("(")) {
                do {
                    table.dimensions.add(parseDimension());
                } while (acceptPunctuation(","));
                expectPunctuation(")");
            }
            parseTableAttributes(table);
            if (startsType(cursor.peek())) {
                table.entryType = parseTypeSpec();
                parseTableAttributes(table);
            }
            if (acceptPunctuation("=") || acceptPunctuation(":=")) {
                do {
                    table.initialValues.add(parseExpression());
                } while (acceptPunctuation(","));
            }
            expectPunctuation(";");
            if (cursor.peek().isKeyword("BEGIN")) {
                cursor.advance();
                table.hasBlock = true;
                parseMembersUntilEnd(table.members, MemberContext.TABLE);
            }
        } finally {
            close(table, start);
        }
    }

    private Dimension parseDimension() {
        Token first = cursor.peek();
        Dimension dimension = new Dimension();
        if (acceptPunctuation("*")) {
            dimension.star = true;
        } else {
            Expression bound = parseExpression();
            if (acceptPunctuation(":")) {
                dimension.lower = bound;
                dimension.upper = parseExpression();
            } else {
                dimension.upper = bound;
            }
        }
        dimension.span = spanFrom(first);
        return dimension;
    }

    private void parseTableAttributes(TableDeclaration table) {
        while (true) {
            Token token = cursor.peek();
            if (token.is(TokenKind.KEYWORD) && ITEM_ATTRIBUTES.contains(token.key())) {
                table.modifiers.add(cursor.advance().key());
            } else if (token.is(TokenKind.IDENTIFIER) && token.key().equals("W")
                    && cursor.peek(1).is(TokenKind.INTEGER_LITERAL)) {
                cursor.advance();
                table.modifiers.add("W " + cursor.advance().getText());
            } else {
                return;
            }
        }
    }

    private void parseProc(List<Node> into, Linkage linkage, Token start, int startIndex) {
        cursor.advance();
        ProcDeclaration proc = new ProcDeclaration();
        declare(into, proc, expectName("procedure name"), startIndex, linkage);
        try {
            if (acceptPunctuation("(")) {
                if (!atPunctuation(":") && !atPunctuation(")")) {
                    do {
                        proc.inputParameters.add(expectName("parameter name"));
                    } while (acceptPunctuation(","));
                }
                if (acceptPunctuation(":")) {
                    do {
                        proc.outputParameters.add(expectName("parameter name"));
                    } while (acceptPunctuation(","));
                }
                expectPunctuation(")");
            }
            parseAttributes(proc.modifiers, PROC_ATTRIBUTES);
            if (startsType(cursor.peek())) {
                proc.returnType = parseTypeSpec();
            }
            expectPunctuation(";");

            Token next = cursor.peek();
            if (next.isKeyword("BEGIN")) {
                cursor.advance();
                proc.hasBody = true;
                parseMembersUntilEnd(proc.body, MemberContext.BLOCK);
            } else if (linkage != Linkage.REF && startsStatement(next)) {
                proc.hasBody = true;
                Node body = parseSingle();
                if (body != null) {
                    proc.body.add(body);
                }
            }
        } finally {
            close(proc, start);
        }
    }

    private void parseDefine(List<Node> into, Linkage linkage, Token start, int startIndex) {
        cursor.advance();
        ConstantDeclaration constant = new ConstantDeclaration();
        declare(into, constant, expectName("constant name"), startIndex, linkage);
        try {
            if (atPunctuation("(") && cursor.peek(1).is(TokenKind.IDENTIFIER)
                    && (cursor.peek(2).isPunctuation(",") || cursor.peek(2).isPunctuation(")"))) {
                cursor.advance();
                do {
                    constant.parameters.add(expectName("parameter name"));
                } while (acceptPunctuation(","));
                expectPunctuation(")");
            }
            acceptPunctuation("=");
            if (!atPunctuation(";")) {
                constant.value = parseExpression();
            }
            expectPunctuation(";");
        } finally {
            close(constant, start);
        }
    }

    private void parseTypeDeclaration(List<Node> into, Linkage linkage, Token start, int startIndex) {
        cursor.advance();
        Identifier name = expectName("type name");
        if (cursor.peek().isKeyword("TABLE")) {
            cursor.advance();
            TableDeclaration table = new TableDeclaration();
            table.definesType = true;
            declare(into, table, name, startIndex, linkage);
            parseTableRest(table, start);
            return;
        }
        TypeDeclaration type = new TypeDeclaration();
        declare(into, type, name, startIndex, linkage);
        try {
            type.type = parseTypeSpec();
            parseAttributes(new ArrayList<>(), ITEM_ATTRIBUTES);
            expectPunctuation(";");
        } finally {
            close(type, start);
        }
    }

    private void parseCompool(List<Node> into, MemberContext context, Linkage linkage, Token start, int startIndex) {
        cursor.advance();
        CompoolDeclaration compool = new CompoolDeclaration();
        declare(into, compool, expectName("compool name"), startIndex, linkage);
        try {
            acceptPunctuation(";");
            if (cursor.peek().isKeyword("BEGIN")) {
                cursor.advance();
                compool.hasBlock = true;
                parseMembersUntilEnd(compool.members, MemberContext.BLOCK);
            } else if (context == MemberContext.TOP) {
                // a bare compool header turns the rest of the unit into the compool
                while (!cursor.atEnd() && !cursor.peek().isKeyword("TERM")) {
                    Token token = cursor.peek();
                    if (token.isKeyword("END")) {
                        report(token.getSpan(), "unexpected END without matching BEGIN");
                        cursor.advance();
                        continue;
                    }
                    parseMember(compool.members, MemberContext.BLOCK);
                }
            }
        } finally {
            close(compool, start);
        }
    }

    private void parseAttributes(List<String> modifiers, Set<String> allowed) {
        while (cursor.peek().is(TokenKind.KEYWORD) && allowed.contains(cursor.peek().key())) {
            modifiers.add(cursor.advance().key());
        }
    }

    // ------------------------------------------------------------------ types

    private boolean startsType(Token token) {
        return token.isKeyword("STATUS") || token.is(TokenKind.IDENTIFIER);
    }

    private TypeSpec parseTypeSpec() {
        Token first = cursor.peek();
        if (first.isKeyword("STATUS")) {
            return parseStatusType();
        }
        if (first.is(TokenKind.IDENTIFIER) && Keywords.isTypeLetter(first.getText())) {
            cursor.advance();
            TypeSpec spec = TypeSpec.scalar(first.key());
            if (cursor.peek().is(TokenKind.INTEGER_LITERAL)) {
                spec.width = intValue(cursor.advance());
                if (cursor.peek().isPunctuation(",") && cursor.peek(1).is(TokenKind.INTEGER_LITERAL)) {
                    cursor.advance();
                    spec.scale = intValue(cursor.advance());
                }
            } else if ("P".equals(spec.letter) && cursor.peek().is(TokenKind.IDENTIFIER)) {
                spec.typeName = identifier(cursor.advance());
            }
            spec.span = spanFrom(first);
            return spec;
        }
        if (first.is(TokenKind.IDENTIFIER)) {
            return TypeSpec.named(identifier(cursor.advance()));
        }
        throw error("expected type");
    }

    private TypeSpec parseStatusType() {
        Token statusToken = cursor.advance();
        TypeSpec spec = TypeSpec.status();
        if (cursor.peek().is(TokenKind.INTEGER_LITERAL)) {
            spec.width = intValue(cursor.advance());
        }
        expectPunctuation("(");
        do {
            spec.statusValues.add(parseStatusValueName());
        } while (acceptPunctuation(","));
        expectPunctuation(")");
        spec.span = spanFrom(statusToken);
        return spec;
    }

    private Identifier parseStatusValueName() {
        Token token = cursor.peek();
        if (token.is(TokenKind.IDENTIFIER) && token.key().equals("V") && cursor.peek(1).isPunctuation("(")) {
            cursor.advance();
            cursor.advance();
            Identifier value = expectName("status value");
            expectPunctuation(")");
            return value;
        }
        return expectName("status value");
    }

    private int intValue(Token token) {
        try {
            return Integer.parseInt(token.getText());
        } catch (NumberFormatException e) {
            throw new SyntaxError("number out of range: " + token.getText(), token.getSpan());
        }
    }

    // ------------------------------------------------------------------ statements

    private boolean startsStatement(Token token) {
        return token.is(TokenKind.IDENTIFIER)
                || (token.is(TokenKind.KEYWORD) && STATEMENT_KEYWORDS.contains(token.key()) && !token.isKeyword("BEGIN"));
    }

    private Statement parseStatement() {
        Token start = cursor.peek();
        List<Identifier> labels = new ArrayList<>();
        while (cursor.peek().is(TokenKind.IDENTIFIER) && cursor.peek(1).isPunctuation(":")) {
            labels.add(identifier(cursor.advance()));
            cursor.advance();
        }

        Token first = cursor.peek();
        Statement statement;
        if (first.isPunctuation(";")) {
            cursor.advance();
            if (labels.isEmpty()) {
                return null;
            }
            statement = new NullStatement();
        } else if (first.is(TokenKind.KEYWORD)) {
            statement = switch (first.key()) {
                case "BEGIN" -> parseBlock();
                case "IF" -> parseIf();
                case "WHILE" -> parseWhile();
                case "FOR" -> parseFor();
                case "CASE" -> parseCase();
                case "GOTO" -> parseGoto();
                case "RETURN", "EXIT", "ABORT", "STOP" -> parseControl();
                default -> throw error("unexpected keyword " + first.key());
            };
        } else if (first.is(TokenKind.IDENTIFIER)) {
            statement = parseSimpleStatement();
        } else {
            throw error("expected statement");
        }
        statement.labels = labels;
        statement.span = spanFrom(start);
        return statement;
    }

    /**
     * One statement or declaration in a position that takes exactly one, e.g. an IF branch.
     */
    private Node parseSingle() {
        Token token = cursor.peek();
        if (token.is(TokenKind.END_OF_INPUT) || token.isKeyword("END") || token.isKeyword("TERM")
                || token.isKeyword("ELSE")) {
            report(token.getSpan(), "expected statement");
            return null;
        }
        List<Node> holder = new ArrayList<>();
        parseMember(holder, MemberContext.BLOCK);
        if (holder.isEmpty()) {
            return null;
        }
        if (holder.size() == 1) {
            return holder.get(0);
        }
        BlockStatement block = new BlockStatement();
        block.members = holder;
        block.span = Span.covering(holder.get(0).span, holder.get(holder.size() - 1).span);
        return block;
    }

    private BlockStatement parseBlock() {
        cursor.advance();
        BlockStatement block = new BlockStatement();
        parseMembersUntilEnd(block.members, MemberContext.BLOCK);
        return block;
    }

    private IfStatement parseIf() {
        cursor.advance();
        IfStatement statement = new IfStatement();
        statement.condition = parseExpression();
        if (acceptKeyword("THEN")) {
            acceptPunctuation(";");
        } else {
            expectPunctuation(";");
        }
        statement.thenBranch = parseSingle();
        if (acceptKeyword("ELSE")) {
            statement.elseBranch = parseSingle();
        }
        return statement;
    }

    private WhileStatement parseWhile() {
        cursor.advance();
        WhileStatement statement = new WhileStatement();
        statement.condition = parseExpression();
        expectPunctuation(";");
        statement.body = parseSingle();
        return statement;
    }

    private ForStatement parseFor() {
        cursor.advance();
        ForStatement statement = new ForStatement();
        statement.variable = expectName("loop variable");
        expectPunctuation(":");
        statement.initial = parseExpression();
        while (true) {
            if (acceptKeyword("BY")) {
                statement.step = parseExpression();
            } else if (acceptKeyword("THEN")) {
                statement.next = parseExpression();
            } else if (acceptKeyword("WHILE")) {
                statement.condition = parseExpression();
            } else {
                break;
            }
        }
        expectPunctuation(";");
        statement.body = parseSingle();
        return statement;
    }

    private CaseStatement parseCase() {
        cursor.advance();
        CaseStatement statement = new CaseStatement();
        statement.selector = parseExpression();
        expectPunctuation(";");
        if (!acceptKeyword("BEGIN")) {
            throw error("expected BEGIN");
        }
        while (true) {
            Token token = cursor.peek();
            if (token.isKeyword("END")) {
                cursor.advance();
                return statement;
            }
            if (token.is(TokenKind.END_OF_INPUT) || token.isKeyword("TERM")) {
                report(token.getSpan(), "missing END");
                return statement;
            }
            int before = cursor.position();
            try {
                if (!token.isPunctuation("(")) {
                    throw error("expected case label");
                }
                statement.branches.add(parseCaseBranch());
            } catch (SyntaxError e) {
                recover(e);
            }
            if (cursor.position() == before && !cursor.peek().isKeyword("END")) {
                cursor.advance();
            }
        }
    }

    private CaseBranch parseCaseBranch() {
        Token open = cursor.advance();
        CaseBranch branch = new CaseBranch();
        do {
            if (acceptKeyword("DEFAULT")) {
                branch.isDefault = true;
            } else {
                Expression label = parseExpression();
                if (acceptPunctuation(":")) {
                    label = binary(":", label, parseExpression());
                }
                branch.labels.add(label);
            }
        } while (acceptPunctuation(","));
        expectPunctuation(")");
        expectPunctuation(":");
        branch.body = parseSingle();
        if (acceptKeyword("FALLTHRU")) {
            branch.fallthru = true;
            acceptPunctuation(";");
        }
        branch.span = spanFrom(open);
        return branch;
    }

    private GotoStatement parseGoto() {
        cursor.advance();
        GotoStatement statement = new GotoStatement();
        statement.target = expectName("label");
        expectPunctuation(";");
        return statement;
    }

    private ControlStatement parseControl() {
        ControlStatement statement = new ControlStatement();
        statement.keyword = cursor.advance().key();
        if (statement.keyword.equals("STOP") && !atPunctuation(";")) {
            statement.value = parseExpression();
        }
        expectPunctuation(";");
        return statement;
    }

    /**
     * Assignment or procedure call, both starting with a name.
     */
    private Statement parseSimpleStatement() {
        Token nameToken = cursor.advance();
        Identifier name = identifier(nameToken);
        List<Expression> inputs = new ArrayList<>();
        List<Expression> outputs = new ArrayList<>();
        boolean hasArguments = false;
        if (acceptPunctuation("(")) {
            hasArguments = true;
            parseArguments(inputs, outputs);
        }

        if (atPunctuation(":=") || atPunctuation("=") || atPunctuation(",") || atPunctuation("@")) {
            if (!outputs.isEmpty()) {
                throw error("output arguments are only allowed in a procedure call");
            }
            Expression target = hasArguments ? indexed(name, inputs, nameToken) : new NameExpression(name);
            AssignmentStatement assignment = new AssignmentStatement();
            assignment.targets.add(parsePostfix(target, nameToken));
            while (acceptPunctuation(",")) {
                assignment.targets.add(parseTarget());
            }
            if (!acceptPunctuation(":=") && !acceptPunctuation("=")) {
                throw error("expected ':='");
            }
            assignment.value = parseExpression();
            expectPunctuation(";");
            return assignment;
        }

        CallStatement call = new CallStatement();
        call.target = name;
        call.inputArguments = inputs;
        call.outputArguments = outputs;
        expectPunctuation(";");
        return call;
    }

    private Expression parseTarget() {
        Token first = cursor.peek();
        Identifier name = expectName("assignment target");
        Expression target = new NameExpression(name);
        if (acceptPunctuation("(")) {
            List<Expression> arguments = new ArrayList<>();
            if (!atPunctuation(")")) {
                do {
                    arguments.add(parseExpression());
                } while (acceptPunctuation(","));
            }
            expectPunctuation(")");
            target = indexed(name, arguments, first);
        }
        return parsePostfix(target, first);
    }

    private void parseArguments(List<Expression> inputs, List<Expression> outputs) {
        if (!atPunctuation(")") && !atPunctuation(":")) {
            do {
                inputs.add(parseExpression());
            } while (acceptPunctuation(","));
        }
        if (acceptPunctuation(":")) {
            do {
                outputs.add(parseExpression());
            } while (acceptPunctuation(","));
        }
        expectPunctuation(")");
    }

    // ------------------------------------------------------------------ expressions

    private Expression parseExpression() {
        return nested(this::parseLogical);
    }

    private Expression parseLogical() {
        Expression left = parseAnd();
        while (cursor.peek().is(TokenKind.KEYWORD) && LOGICAL_OPERATORS.contains(cursor.peek().key())) {
            String operator = cursor.advance().key();
            left = binary(operator, left, parseAnd());
        }
        return left;
    }

    private Expression parseAnd() {
        Expression left = parseNot();
        while (acceptKeyword("AND")) {
            left = binary("AND", left, parseNot());
        }
        return left;
    }

    private Expression parseNot() {
        Token token = cursor.peekOperand();
        if (token.isKeyword("NOT")) {
            cursor.advanceOperand();
            UnaryExpression not = new UnaryExpression();
            not.operator = "NOT";
            not.operand = nested(this::parseNot);
            not.span = Span.covering(token.getSpan(), not.operand.span);
            return not;
        }
        return parseRelational();
    }

    private Expression parseRelational() {
        Expression left = parseAdditive();
        while (cursor.peek().is(TokenKind.PUNCTUATION) && RELATIONAL_OPERATORS.contains(cursor.peek().getText())) {
            String operator = cursor.advance().getText();
            left = binary(operator, left, parseAdditive());
        }
        return left;
    }

    private Expression parseAdditive() {
        Expression left = parseMultiplicative();
        while (atPunctuation("+") || atPunctuation("-")) {
            String operator = cursor.advance().getText();
            left = binary(operator, left, parseMultiplicative());
        }
        return left;
    }

    private Expression parseMultiplicative() {
        Expression left = parsePower();
        while (atPunctuation("*") || atPunctuation("/") || cursor.peek().isKeyword("MOD")) {
            String operator = cursor.advance().key();
            left = binary(operator, left, parsePower());
        }
        return left;
    }

    private Expression parsePower() {
        Expression left = parseUnary();
        while (acceptPunctuation("**")) {
            left = binary("**", left, parseUnary());
        }
        return left;
    }

    private Expression parseUnary() {
        Token token = cursor.peekOperand();
        if (token.isPunctuation("+") || token.isPunctuation("-")) {
            cursor.advanceOperand();
            UnaryExpression unary = new UnaryExpression();
            unary.operator = token.getText();
            unary.operand = nested(this::parseUnary);
            unary.span = Span.covering(token.getSpan(), unary.operand.span);
            return unary;
        }
        return parsePrimary();
    }

    private Expression parsePrimary() {
        Token token = cursor.peekOperand();
        switch (token.getKind()) {
            case QUOTED_TEXT:
                cursor.advanceOperand();
                return literal(LiteralKind.STRING, token);
            case INTEGER_LITERAL:
                cursor.advance();
                return literal(LiteralKind.INTEGER, token);
            case FLOAT_LITERAL:
                cursor.advance();
                return literal(LiteralKind.FLOAT, token);
            case FIXED_LITERAL:
                cursor.advance();
                return literal(LiteralKind.FIXED, token);
            case BIT_STRING_LITERAL:
                cursor.advance();
                return literal(LiteralKind.BIT_STRING, token);
            case IDENTIFIER:
                return parseNamePrimary();
            case PUNCTUATION:
                if (token.isPunctuation("(")) {
                    cursor.advance();
                    Expression inner = parseExpression();
                    expectPunctuation(")");
                    return inner;
                }
                throw error("expected expression");
            default:
                throw error("expected expression");
        }
    }

    private Expression parseNamePrimary() {
        Token nameToken = cursor.advance();
        Identifier name = identifier(nameToken);

        if (name.key().equals("V") && atPunctuation("(")) {
            cursor.advance();
            StatusValueExpression status = new StatusValueExpression();
            status.value = expectName("status value");
            expectPunctuation(")");
            status.span = spanFrom(nameToken);
            return status;
        }

        Expression expression = new NameExpression(name);
        if (acceptPunctuation("(")) {
            List<Expression> arguments = new ArrayList<>();
            if (!atPunctuation(")")) {
                do {
                    arguments.add(parseExpression());
                } while (acceptPunctuation(","));
            }
            expectPunctuation(")");
            expression = indexed(name, arguments, nameToken);
        }
        return parsePostfix(expression, nameToken);
    }

    /**
     * Pointer qualification, {@code X @ P}.
     */
    private Expression parsePostfix(Expression expression, Token start) {
        Expression result = expression;
        while (acceptPunctuation("@")) {
            BinaryExpression qualified = binary("@", result, parsePrimary());
            qualified.span = Span.covering(start.getSpan(), qualified.right.span);
            result = qualified;
        }
        return result;
    }

    private IndexedExpression indexed(Identifier name, List<Expression> arguments, Token start) {
        IndexedExpression indexed = new IndexedExpression();
        indexed.name = name;
        indexed.arguments = arguments;
        indexed.builtin = Keywords.isBuiltinFunction(name.text);
        indexed.span = spanFrom(start);
        return indexed;
    }

    private BinaryExpression binary(String operator, Expression left, Expression right) {
        BinaryExpression binary = new BinaryExpression();
        binary.operator = operator;
        binary.left = left;
        binary.right = right;
        binary.span = Span.covering(left.span, right.span);
        return binary;
    }

    private LiteralExpression literal(LiteralKind kind, Token token) {
        LiteralExpression literal = new LiteralExpression();
        literal.kind = kind;
        literal.value = token.getText();
        literal.span = token.getSpan();
        return literal;
    }

    // ------------------------------------------------------------------ documentation

    private void declare(List<Node> into, Declaration declaration, Identifier name, int startIndex, Linkage linkage) {
        declaration.name = name;
        declaration.linkage = linkage;
        declaration.documentation = leadingDocumentation(startIndex);
        into.add(declaration);
    }

    private void close(Declaration declaration, Token start) {
        declaration.span = spanFrom(start);
        if (declaration.documentation == null) {
            declaration.documentation = trailingDocumentation();
        }
    }

    /**
     * Comments on their own lines directly above the token at {@code startIndex}, no blank line in between.
     */
    private String leadingDocumentation(int startIndex) {
        List<String> parts = new ArrayList<>();
        int nextLine = cursor.raw(startIndex).getSpan().getStartLine();
        for (int i = startIndex - 1; i >= 0; i--) {
            Token token = cursor.raw(i);
            if (!token.is(TokenKind.QUOTED_TEXT) || cursor.isLiteral(i)) {
                break;
            }
            if (nextLine - token.getSpan().getEndLine() > 1) {
                break;
            }
            if (i > 0 && cursor.raw(i - 1).getSpan().getEndLine() >= token.getSpan().getStartLine()) {
                break;
            }
            parts.add(0, quotedContent(token.getText()));
            nextLine = token.getSpan().getStartLine();
        }
        String documentation = String.join("\n", parts).trim();
        return documentation.isEmpty() ? null : documentation;
    }

    /**
     * A comment on the same line right after the {@code ;} or END that closed a declaration.
     */
    private String trailingDocumentation() {
        Token last = cursor.previous();
        if (last == null || !(last.isPunctuation(";") || last.isKeyword("END"))) {
            return null;
        }
        Token next = cursor.peekRaw();
        if (next.is(TokenKind.QUOTED_TEXT) && next.getSpan().getStartLine() == last.getSpan().getEndLine()) {
            String documentation = quotedContent(next.getText()).trim();
            return documentation.isEmpty() ? null : documentation;
        }
        return null;
    }

    static String quotedContent(String text) {
        if (text.isEmpty()) {
            return text;
        }
        char delimiter = text.charAt(0);
        String inner = text.length() >= 2 && text.charAt(text.length() - 1) == delimiter
                ? text.substring(1, text.length() - 1)
                : text.substring(1);
        String doubled = String.valueOf(delimiter) + delimiter;
        List<String> lines = new ArrayList<>();
        for (String line : inner.replace(doubled, String.valueOf(delimiter)).split("\n")) {
            String trimmed = line.trim();
            if (!trimmed.isEmpty()) {
                lines.add(trimmed);
            }
        }
        return String.join("\n", lines);
    }

    // ------------------------------------------------------------------ helpers

    private Identifier identifier(Token token) {
        return new Identifier(token.getText(), token.getSpan());
    }

    private Identifier expectName(String what) {
        if (!cursor.peek().is(TokenKind.IDENTIFIER)) {
            throw error("expected " + what);
        }
        return identifier(cursor.advance());
    }

    private boolean atPunctuation(String punctuation) {
        return cursor.peek().isPunctuation(punctuation);
    }

    private boolean acceptPunctuation(String punctuation) {
        if (atPunctuation(punctuation)) {
            cursor.advance();
            return true;
        }
        return false;
    }

    private boolean acceptKeyword(String keyword) {
        if (cursor.peek().isKeyword(keyword)) {
            cursor.advance();
            return true;
        }
        return false;
    }

    private void expectPunctuation(String punctuation) {
        if (!acceptPunctuation(punctuation)) {
            throw error("expected '" + punctuation + "'");
        }
    }

    private Span spanFrom(Token start) {
        Token last = cursor.previous();
        if (last == null || last.getStart() < start.getStart()) {
            return start.getSpan();
        }
        return Span.covering(start.getSpan(), last.getSpan());
    }

    /**
     * Runs one level of nested syntax; deeper than {@link #MAX_NESTING} levels is a syntax error.
     */
    private <T> T nested(Supplier<T> body) {
        if (depth >= MAX_NESTING) {
            throw new SyntaxError("nesting deeper than " + MAX_NESTING + " levels", cursor.peek().getSpan());
        }
        depth++;
        try {
            return body.get();
        } finally {
            depth--;
        }
    }

    private SyntaxError error(String message) {
        Token token = cursor.peek();
        String found = token.is(TokenKind.END_OF_INPUT) ? "end of input" : "'" + token.getText() + "'";
        return new SyntaxError(message + " but found " + found, token.getSpan());
    }

    private void report(Span span, String message) {
        diagnostics.add(Diagnostic.error(span, message, DiagnosticCategory.PARSE_ERROR));
    }

    private void recover(SyntaxError e) {
        report(e.getSpan(), e.getMessage());
        synchronize();
    }

    /**
     * Skips to the next statement boundary: past a {@code ;}, or up to BEGIN, END, TERM or a declaration keyword.
     */
    private void synchronize() {
        while (true) {
            Token token = cursor.peek();
            if (token.is(TokenKind.END_OF_INPUT) || isBoundary(token)) {
                return;
            }
            cursor.advance();
            if (token.isPunctuation(";")) {
                return;
            }
        }
    }

    private static boolean isBoundary(Token token) {
        return token.is(TokenKind.KEYWORD)
                && (token.isKeyword("BEGIN") || token.isKeyword("END") || token.isKeyword("TERM")
                || Keywords.DECLARATION_STARTERS.contains(token.key()));
    }
}
