package org.springaicommunity.sonarqube.client;

/**
 * Location of an issue or hotspot in a source file. Lines are 1-based, offsets 0-based.
 */
public record TextRange(int startLine, int endLine, int startOffset, int endOffset) {
}
