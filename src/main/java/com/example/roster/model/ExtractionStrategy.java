package com.example.roster.model;

public enum ExtractionStrategy {
    /** Bold lines open a delegation, following plain lines describe one person. */
    SINGLE_COLUMN,
    /** All-caps paragraphs open a delegation, each other paragraph in a column is one person. */
    TWO_COLUMN
}
