package com.gt.vocab.util;

import java.util.Locale;
import java.util.regex.Pattern;

// Produces the identity key of a card: lowercased, whitespace collapsed, punctuation trimmed from both ends
public class TermNormalizer {

    private static final Pattern WHITESPACE_RUN = Pattern.compile("\\s+", Pattern.UNICODE_CHARACTER_CLASS);
    private static final Pattern EDGE_PUNCTUATION = Pattern.compile("^[\\W_]+|[\\W_]+$", Pattern.UNICODE_CHARACTER_CLASS);

    public static String normalize(String term) {
        if (term == null) {
            return "";
        }

        String normalized = collapseWhitespace(term.strip().toLowerCase(Locale.ROOT));
        normalized = EDGE_PUNCTUATION.matcher(normalized).replaceAll("");

        return collapseWhitespace(normalized);
    }

    private static String collapseWhitespace(String value) {
        return WHITESPACE_RUN.matcher(value).replaceAll(" ").strip();
    }
}
