package com.constlang.playground.lexer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.IntStream;

/**
 * Error-tolerant scanner for constant declarations.
 *
 * <p>Never fails: malformed identifiers and numbers are sanitized in place, near-miss keywords
 * are corrected, and characters nothing accepts are reported and skipped. Instances hold no
 * per-call state and can be shared.
 */
public class Scanner {

    private static final Logger logger = LoggerFactory.getLogger(Scanner.class);

    /** Also starts on {@code $} so that the identifier can be salvaged with a diagnostic. */
    private static final Pattern IDENTIFIER_PATTERN = Pattern.compile("[\\p{L}_$][^\\s:;=+]*");
    private static final Pattern NUMBER_PATTERN = Pattern.compile("\\d[^\\s:;=+]*");

    /** Tried in order; the first rule matching at the cursor wins. */
    private static final List<Rule> RULES = List.of(
            new Rule(Pattern.compile("const\\b"), TokenKind.CONST),
            new Rule(Pattern.compile("i32\\b"), TokenKind.I32),
            new Rule(Pattern.compile(":"), TokenKind.COLON),
            new Rule(Pattern.compile("="), TokenKind.ASSIGN),
            new Rule(Pattern.compile("\\+"), TokenKind.PLUS),
            new Rule(Pattern.compile("-"), TokenKind.MINUS),
            new Rule(Pattern.compile(";"), TokenKind.SEMICOLON),
            new Rule(IDENTIFIER_PATTERN, TokenKind.IDENTIFIER),
            new Rule(NUMBER_PATTERN, TokenKind.NUMBER));

    private final KeywordCorrector keywordCorrector;

    public Scanner(KeywordCorrector keywordCorrector) {
        this.keywordCorrector = keywordCorrector;
    }

    public ScanResult tokenize(String text) {
        Cursor cursor = new Cursor(text == null ? "" : text);

        while (cursor.skipWhitespace()) {
            int line = cursor.line();
            int column = cursor.column();

            boolean matched = false;
            for (Rule rule : RULES) {
                String value = cursor.match(rule.pattern());
                if (value == null) {
                    continue;
                }
                switch (rule.kind()) {
                    case IDENTIFIER -> scanIdentifier(cursor, value, line, column);
                    case NUMBER -> scanNumber(cursor, value, line, column);
                    default -> cursor.tokens.add(new Token(rule.kind(), value, line, column));
                }
                matched = true;
                break;
            }

            if (!matched) {
                char c = cursor.advance();
                cursor.diagnostics.add(Diagnostic.lexicalError(line, column,
                        "unrecognized character '" + c + "'"));
            }
        }

        logger.debug("Scanned {} tokens with {} lexical diagnostics",
                cursor.tokens.size(), cursor.diagnostics.size());
        return new ScanResult(cursor.tokens, cursor.diagnostics);
    }

    private void scanIdentifier(Cursor cursor, String original, int line, int column) {
        StringBuilder valid = new StringBuilder();
        boolean stripped = false;

        char first = original.charAt(0);
        if (Character.isLetter(first) || first == '_') {
            valid.append(first);
        } else {
            cursor.diagnostics.add(Diagnostic.lexicalError(line, column,
                    "invalid first character of identifier: '" + first + "'"));
            stripped = true;
        }
        for (int i = 1; i < original.length(); i++) {
            char c = original.charAt(i);
            if (Character.isLetterOrDigit(c) || c == '_') {
                valid.append(c);
            } else {
                stripped = true;
            }
        }

        String cleaned = valid.length() == 0 ? "_" : valid.toString();

        TokenKind exact = exactKeyword(cleaned);
        if (exact != null) {
            cursor.tokens.add(new Token(exact, cleaned, line, column));
            if (stripped) {
                cursor.diagnostics.add(Diagnostic.correction(line, column,
                        "corrected '" + original + "' to '" + cleaned + "'"));
            }
            return;
        }

        Optional<TokenKind> corrected = keywordCorrector.correct(cleaned);
        if (corrected.isPresent()) {
            TokenKind keyword = corrected.get();
            logger.debug("Promoting '{}' to keyword {} at {}:{}", original, keyword, line, column);
            cursor.tokens.add(new Token(keyword, keyword.literal(), line, column));
            cursor.diagnostics.add(Diagnostic.correction(line, column,
                    "corrected '" + original + "' to '" + keyword.literal() + "'"));
            return;
        }

        cursor.tokens.add(new Token(TokenKind.IDENTIFIER, cleaned, line, column));
        if (stripped) {
            cursor.diagnostics.add(Diagnostic.correction(line, column,
                    "corrected identifier '" + original + "' -> '" + cleaned + "'"));
        }
    }

    private void scanNumber(Cursor cursor, String original, int line, int column) {
        StringBuilder digits = new StringBuilder();
        for (int i = 0; i < original.length(); i++) {
            char c = original.charAt(i);
            if (Character.isDigit(c)) {
                digits.append(c);
            }
        }
        String cleaned = digits.length() == 0 ? "0" : digits.toString();
        cursor.tokens.add(new Token(TokenKind.NUMBER, cleaned, line, column));
        if (!cleaned.equals(original)) {
            cursor.diagnostics.add(Diagnostic.correction(line, column,
                    "corrected number '" + original + "' -> '" + cleaned + "'"));
        }
    }

    private static TokenKind exactKeyword(String value) {
        for (TokenKind kind : TokenKind.values()) {
            if (kind.isKeyword() && kind.literal().equals(value)) {
                return kind;
            }
        }
        return null;
    }

    private record Rule(Pattern pattern, TokenKind kind) {
    }

    /**
     * Per-call scanning state: position, output buffers and the newline index used to turn
     * offsets into line/column pairs.
     */
    private static final class Cursor {
        private final String text;
        private final int[] newlines;
        private final List<Token> tokens = new ArrayList<>();
        private final List<Diagnostic> diagnostics = new ArrayList<>();
        private int pos;

        Cursor(String text) {
            this.text = text;
            this.newlines = IntStream.range(0, text.length())
                    .filter(i -> text.charAt(i) == '\n')
                    .toArray();
        }

        /**
         * @return {@code true} if a non-whitespace character remains
         */
        boolean skipWhitespace() {
            while (pos < text.length() && Character.isWhitespace(text.charAt(pos))) {
                pos++;
            }
            return pos < text.length();
        }

        String match(Pattern pattern) {
            Matcher matcher = pattern.matcher(text);
            matcher.region(pos, text.length());
            matcher.useTransparentBounds(true);
            if (!matcher.lookingAt()) {
                return null;
            }
            pos = matcher.end();
            return matcher.group();
        }

        char advance() {
            return text.charAt(pos++);
        }

        int line() {
            return precedingNewlines() + 1;
        }

        int column() {
            int before = precedingNewlines();
            return before == 0 ? pos + 1 : pos - newlines[before - 1];
        }

        /** Number of newline offsets at or before the cursor. */
        private int precedingNewlines() {
            int low = 0;
            int high = newlines.length;
            while (low < high) {
                int mid = (low + high) >>> 1;
                if (newlines[mid] <= pos) {
                    low = mid + 1;
                } else {
                    high = mid;
                }
            }
            return low;
        }
    }
}
