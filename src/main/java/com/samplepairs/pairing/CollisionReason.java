package com.samplepairs.pairing;

/**
 * Why an incoming pair was not appended to the canonical store.
 */
public enum CollisionReason {
    /** The same key appeared earlier in the same incoming batch. */
    DUPLICATE_WITHIN_BATCH,
    /** The key is already held by a stored pair. */
    ALREADY_IN_STORE;

    /** Wire name, e.g. {@code already_in_store}. */
    public String wireName() {
        return name().toLowerCase(java.util.Locale.ROOT);
    }
}
