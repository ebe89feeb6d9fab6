package org.mapextract.text;

/**
 * The result of matching one balanced brace block.
 *
 * @param inner     The text strictly between the opening brace and its matching closing brace.
 * @param remainder Everything after the matching closing brace, unconsumed.
 */
public record Block(TextSpan inner, TextSpan remainder) {}
