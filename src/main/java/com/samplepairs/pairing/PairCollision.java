package com.samplepairs.pairing;

/**
 * Diagnostic entry for an incoming pair that collided with an existing key.
 */
public record PairCollision(Pair pair, String key, CollisionReason reason) {}
