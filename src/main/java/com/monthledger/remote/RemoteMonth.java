package com.monthledger.remote;

import com.fasterxml.jackson.databind.JsonNode;
import java.time.Instant;

/**
 * A month as stored remotely. {@code data} is raw and must be normalized before use;
 * {@code updatedAt} is {@code null} when the store does not report it.
 */
public record RemoteMonth(String monthKey, JsonNode data, Instant updatedAt) {}
