package uk.gegc.docintake.features.realtime.domain;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Envelope used on every live transport: {@code {"type": ..., "payload": ...}}.
 */
public record LiveMessage(String type, JsonNode payload) {
}
