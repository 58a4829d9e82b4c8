package com.monthledger.sync;

import java.time.Instant;

/**
 * Merged settings patch waiting for the remote store; {@code payload} is a JSON object.
 */
public record QueuedSettings(String payload, Instant queuedAt) {}
