package org.parable.compiler;

/**
 * One entry of a case block: the value it matches and its inline body.
 *
 * @param value the case value; 0 is the default entry
 * @param body  the body, assembled as a fragment without header
 */
public record CaseEntry(int value, MessageAssembler body) {
}
