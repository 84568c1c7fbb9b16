package org.dxworks.jovialframe.analyzer.lexer;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Re-lexes only the region of a text that an edit touched.
 *
 * <p>The changed region is the part left over after stripping the common prefix and suffix of the
 * old and new text. Tokens that end well before the region are kept, lexing restarts behind the
 * last kept token and stops as soon as a fresh token starts where a shifted old token started; from
 * there on the old tokens are reused at their new positions. The result is always the token list
 * a full {@link JovialLexer#tokenize()} of the new text would give.</p>
 */
public final class IncrementalRelexer {

    /**
     * Characters a token may look at past its own end before deciding where it stops.
     */
    private static final int LOOKAHEAD_MARGIN = 3;

    private IncrementalRelexer() {
        // utility class
    }

    /**
     * Tokens of {@code newText}, re-lexed incrementally when possible and in full otherwise.
     */
    public static List<Token> relex(String oldText, List<Token> oldTokens, String newText,
                                    LineIndex newIndex, int threshold) {
        return tryRelex(oldText, oldTokens, newText, newIndex, threshold)
                .orElseGet(() -> new JovialLexer(newText, newIndex).tokenize());
    }

    /**
     * Incremental tokens of {@code newText}, or empty when the edit is too large or an unterminated
     * quoted text in front of it makes the incremental path unsafe.
     */
    public static Optional<List<Token>> tryRelex(String oldText, List<Token> oldTokens, String newText,
                                                 LineIndex newIndex, int threshold) {
        if (oldText == null || oldTokens == null || oldTokens.isEmpty()) {
            return Optional.empty();
        }
        int oldLength = oldText.length();
        int newLength = newText.length();

        int prefix = 0;
        int limit = Math.min(oldLength, newLength);
        while (prefix < limit && oldText.charAt(prefix) == newText.charAt(prefix)) {
            prefix++;
        }
        int suffix = 0;
        while (suffix < limit - prefix
                && oldText.charAt(oldLength - 1 - suffix) == newText.charAt(newLength - 1 - suffix)) {
            suffix++;
        }
        int oldEditEnd = oldLength - suffix;
        int newEditEnd = newLength - suffix;
        int delta = newLength - oldLength;

        if (Math.max(oldEditEnd, newEditEnd) - prefix > threshold) {
            return Optional.empty();
        }

        List<Token> result = new ArrayList<>();
        int kept = 0;
        while (kept < oldTokens.size()) {
            Token token = oldTokens.get(kept);
            if (token.is(TokenKind.END_OF_INPUT) || token.getEnd() + LOOKAHEAD_MARGIN > prefix) {
                break;
            }
            if (token.isUnterminated()) {
                return Optional.empty();
            }
            result.add(token);
            kept++;
        }

        JovialLexer lexer = new JovialLexer(newText, newIndex);
        int position = kept > 0 ? oldTokens.get(kept - 1).getEnd() : 0;
        int oldCursor = kept;
        while (true) {
            Token token = lexer.scanFrom(position);
            if (token.is(TokenKind.END_OF_INPUT)) {
                result.add(token);
                return Optional.of(result);
            }
            if (token.getStart() >= newEditEnd) {
                int oldStart = token.getStart() - delta;
                while (oldCursor < oldTokens.size() && oldTokens.get(oldCursor).getStart() < oldStart) {
                    oldCursor++;
                }
                if (oldCursor < oldTokens.size() && oldTokens.get(oldCursor).getStart() == oldStart
                        && !oldTokens.get(oldCursor).is(TokenKind.END_OF_INPUT)) {
                    // same start in identical trailing text: everything from here on lexes the same
                    for (int i = oldCursor; i < oldTokens.size(); i++) {
                        Token old = oldTokens.get(i);
                        result.add(old.movedTo(newIndex.span(old.getStart() + delta, old.getEnd() + delta)));
                    }
                    return Optional.of(result);
                }
            }
            result.add(token);
            position = token.getEnd();
        }
    }
}
