package com.constlang.playground.lexer;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Promotes near-miss spellings such as {@code cnost} or {@code i3} to the keyword they were
 * most likely meant to be.
 *
 * <p>A word is a candidate for a keyword when its length is within {@value #LENGTH_TOLERANCE}
 * of the keyword's, it starts with the same letter, and a greedy in-order alignment matches at
 * least {@code MIN_COVERAGE} of the keyword's characters.
 */
public class KeywordCorrector {

    static final int LENGTH_TOLERANCE = 2;
    static final double MIN_COVERAGE = 0.6;

    private final List<TokenKind> keywords;

    public KeywordCorrector() {
        this.keywords = Arrays.stream(TokenKind.values())
                .filter(TokenKind::isKeyword)
                .toList();
    }

    /**
     * @return the keyword {@code word} should be read as, if any
     */
    public Optional<TokenKind> correct(String word) {
        if (word == null || word.isEmpty()) {
            return Optional.empty();
        }
        String lower = word.toLowerCase(Locale.ROOT);
        for (TokenKind keyword : keywords) {
            if (isCandidate(lower, keyword.literal())) {
                return Optional.of(keyword);
            }
        }
        return Optional.empty();
    }

    boolean isCandidate(String word, String keyword) {
        if (Math.abs(word.length() - keyword.length()) > LENGTH_TOLERANCE) {
            return false;
        }
        if (word.charAt(0) != keyword.charAt(0)) {
            return false;
        }
        return coverage(word, keyword) >= MIN_COVERAGE;
    }

    /**
     * Fraction of {@code keyword} covered by a single left-to-right pass over {@code word}.
     * Each character of the word is looked up ahead of the keyword pointer; the pointer only
     * moves when a match is found, and unmatched characters of the word are skipped.
     */
    static double coverage(String word, String keyword) {
        int matches = 0;
        int pointer = 0;
        for (int i = 0; i < word.length() && pointer < keyword.length(); i++) {
            int found = keyword.indexOf(word.charAt(i), pointer);
            if (found >= 0) {
                matches++;
                pointer = found + 1;
            }
        }
        return (double) matches / keyword.length();
    }
}
