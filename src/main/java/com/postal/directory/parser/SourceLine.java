package com.postal.directory.parser;

/**
 * A non-blank line of an eDNE source.
 *
 * @param lineNumber 1-based position in the source, counting skipped blank lines
 * @param text       line content without the line terminator
 */
public record SourceLine(long lineNumber, String text) {}
