package com.demo.gateway.adapter;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.Locale;
import java.util.Set;

/**
 * Redacts credential-like fields before a request body is logged.
 */
final class LogSanitizer {

    static final String REDACTED = "[REDACTED]";

    private static final Set<String> SENSITIVE_FIELDS =
            Set.of("apikey", "password", "token", "secret", "authorization", "auth", "key");

    private LogSanitizer() {
    }

    /**
     * Returns a copy of {@code node} with sensitive top-level fields replaced.
     * Field names match case-insensitively.
     */
    static JsonNode redact(JsonNode node) {
        if (node == null || !node.isObject()) {
            return node;
        }
        ObjectNode copy = ((ObjectNode) node).deepCopy();
        node.fieldNames().forEachRemaining(field -> {
            if (SENSITIVE_FIELDS.contains(field.toLowerCase(Locale.ROOT))) {
                copy.put(field, REDACTED);
            }
        });
        return copy;
    }
}
