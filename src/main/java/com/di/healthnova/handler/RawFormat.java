package com.di.healthnova.handler;

/**
 * Closed set of raw file formats. Every adapter is exactly one of these variants.
 */
public enum RawFormat {
    /** CSV-like text with a header row. */
    DELIMITED_TEXT,
    /** Key/value tree (JSON). */
    NESTED_STRUCTURED,
    /** Tagged markup (XML). */
    TAGGED_MARKUP
}
