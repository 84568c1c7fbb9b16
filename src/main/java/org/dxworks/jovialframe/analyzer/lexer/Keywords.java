package org.dxworks.jovialframe.analyzer.lexer;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * J73 word tables: reserved words, built-in functions and the type letters that are only
 * meaningful in a type position.
 */
public final class Keywords {

    public static final Set<String> RESERVED = Set.of(
            // module structure
            "START", "TERM", "PROGRAM", "COMPOOL", "BEGIN", "END",
            // declarations
            "ITEM", "TABLE", "PROC", "TYPE", "DEFINE", "DEF", "REF", "STATUS", "LIKE",
            // attributes
            "STATIC", "CONSTANT", "PARALLEL", "OVERLAY", "REC", "RENT", "INLINE",
            // control flow
            "IF", "THEN", "ELSE", "WHILE", "FOR", "BY", "CASE", "DEFAULT", "FALLTHRU",
            "GOTO", "EXIT", "ABORT", "RETURN", "STOP",
            // operators
            "AND", "OR", "NOT", "XOR", "EQV", "MOD");

    public static final Set<String> BUILTIN_FUNCTIONS = Set.of(
            "LOC", "NEXT", "BIT", "BYTE", "SHIFTL", "SHIFTR", "ABS", "SGN", "FIRST", "LAST",
            "LBOUND", "UBOUND", "NENT", "NWDSEN", "BITSIZE", "BYTESIZE", "WORDSIZE");

    public static final Set<String> TYPE_LETTERS = Set.of("S", "U", "F", "A", "B", "C", "P");

    /**
     * Keywords that introduce a declaration; the parser resynchronizes in front of them.
     */
    public static final Set<String> DECLARATION_STARTERS = Set.of(
            "ITEM", "TABLE", "PROC", "TYPE", "DEFINE", "DEF", "REF", "COMPOOL", "START", "TERM");

    public static final List<String> STATEMENT_KEYWORDS = List.of(
            "IF", "ELSE", "WHILE", "FOR", "CASE", "GOTO", "RETURN", "EXIT", "STOP", "ABORT", "BEGIN", "END");

    public static final List<String> DECLARATION_KEYWORDS = List.of(
            "ITEM", "TABLE", "PROC", "DEFINE", "TYPE", "DEF", "REF", "COMPOOL");

    public static final List<String> TYPE_POSITION_KEYWORDS = List.of(
            "S", "U", "F", "A", "B", "C", "P", "STATUS", "STATIC", "CONSTANT", "PARALLEL");

    public static final List<String> EXPRESSION_KEYWORDS = List.of(
            "AND", "OR", "NOT", "XOR", "EQV", "MOD");

    private static final Map<String, String> DESCRIPTIONS = new LinkedHashMap<>();

    static {
        DESCRIPTIONS.put("START", "Begin main program module");
        DESCRIPTIONS.put("TERM", "End program module");
        DESCRIPTIONS.put("BEGIN", "Begin block");
        DESCRIPTIONS.put("END", "End block");
        DESCRIPTIONS.put("COMPOOL", "Communication pool module (shared data)");
        DESCRIPTIONS.put("PROGRAM", "Main program module");
        DESCRIPTIONS.put("ITEM", "Scalar variable declaration");
        DESCRIPTIONS.put("TABLE", "Array/structure declaration");
        DESCRIPTIONS.put("PROC", "Procedure declaration");
        DESCRIPTIONS.put("TYPE", "User-defined type declaration");
        DESCRIPTIONS.put("DEFINE", "Compile-time constant");
        DESCRIPTIONS.put("DEF", "Definition exported from a COMPOOL");
        DESCRIPTIONS.put("REF", "Reference to an external definition");
        DESCRIPTIONS.put("S", "Signed integer type");
        DESCRIPTIONS.put("U", "Unsigned integer type");
        DESCRIPTIONS.put("F", "Floating-point type");
        DESCRIPTIONS.put("A", "Fixed-point (scaled) type");
        DESCRIPTIONS.put("B", "Bit string type");
        DESCRIPTIONS.put("C", "Character string type");
        DESCRIPTIONS.put("P", "Pointer type");
        DESCRIPTIONS.put("STATUS", "Enumeration type");
        DESCRIPTIONS.put("STATIC", "Static allocation (persistent)");
        DESCRIPTIONS.put("CONSTANT", "Read-only value");
        DESCRIPTIONS.put("PARALLEL", "Parallel allocation for bit-packing");
        DESCRIPTIONS.put("IF", "Conditional statement");
        DESCRIPTIONS.put("ELSE", "Alternative branch of an IF statement");
        DESCRIPTIONS.put("FOR", "Counted loop");
        DESCRIPTIONS.put("WHILE", "Conditional loop (test before)");
        DESCRIPTIONS.put("CASE", "Multi-way branch");
        DESCRIPTIONS.put("GOTO", "Unconditional branch");
        DESCRIPTIONS.put("RETURN", "Return from procedure");
        DESCRIPTIONS.put("EXIT", "Exit from loop");
        DESCRIPTIONS.put("STOP", "Stop program execution");
        DESCRIPTIONS.put("ABORT", "Abort program execution");
        DESCRIPTIONS.put("LOC", "Location (address) function");
        DESCRIPTIONS.put("NEXT", "Next value in sequence");
        DESCRIPTIONS.put("BIT", "Bit extraction function");
        DESCRIPTIONS.put("BYTE", "Byte extraction function");
        DESCRIPTIONS.put("SHIFTL", "Shift left");
        DESCRIPTIONS.put("SHIFTR", "Shift right");
        DESCRIPTIONS.put("ABS", "Absolute value");
        DESCRIPTIONS.put("SGN", "Sign function");
    }

    private Keywords() {
        // utility class
    }

    public static boolean isReserved(String word) {
        return RESERVED.contains(word.toUpperCase(Locale.ROOT));
    }

    public static boolean isBuiltinFunction(String word) {
        return BUILTIN_FUNCTIONS.contains(word.toUpperCase(Locale.ROOT));
    }

    public static boolean isTypeLetter(String word) {
        return TYPE_LETTERS.contains(word.toUpperCase(Locale.ROOT));
    }

    /**
     * Hover text for a reserved word, built-in function or type letter.
     */
    public static Optional<String> describe(String word) {
        String key = word.toUpperCase(Locale.ROOT);
        String description = DESCRIPTIONS.get(key);
        if (description != null) {
            return Optional.of(description);
        }
        if (RESERVED.contains(key) || BUILTIN_FUNCTIONS.contains(key)) {
            return Optional.of("J73 keyword: " + key);
        }
        return Optional.empty();
    }
}
