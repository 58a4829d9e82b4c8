package com.monthledger.sync;

import java.time.Instant;

public record QueuedUpsert(String payload, Instant queuedAt) {}
