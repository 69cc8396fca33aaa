package org.parable.runtime.model;

/**
 * Saved cursor state, restored when EndSym is reached inside a call or case body.
 *
 * @param kind           why the frame was pushed
 * @param address        the message address to resume in
 * @param position       the symbol position to resume at
 * @param declaredLength the informational length of the resumed message
 */
public record CallFrame(FrameKind kind, int address, int position, int declaredLength) {
}
