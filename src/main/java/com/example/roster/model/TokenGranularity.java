package com.example.roster.model;

/**
 * Size of the text units a token source produces. Glyphs are concatenated as-is
 * when a line is rebuilt, words are joined with a single space.
 */
public enum TokenGranularity {
    CHARACTER(""),
    WORD(" ");

    private final String separator;

    TokenGranularity(String separator) {
        this.separator = separator;
    }

    public String separator() {
        return separator;
    }
}
