package org.nowstart.edgeguard.data.type;

/**
 * Trailing stop lifecycle of one open position.
 *
 * <ul>
 *   <li>{@link #INACTIVE}: tracking the water mark only, activation gain not reached.</li>
 *   <li>{@link #ARMED}: stop price is tracked with the base callback, offset not confirmed yet.</li>
 *   <li>{@link #ACTIVE}: positive offset reached, stop price uses the tighter positive callback.</li>
 * </ul>
 */
public enum TrailingState {
    INACTIVE,
    ARMED,
    ACTIVE
}
