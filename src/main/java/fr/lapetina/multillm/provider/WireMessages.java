package fr.lapetina.multillm.provider;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Chat message objects as sent on the wire, always serialized as {@code {"role":..,"content":..}}.
 */
final class WireMessages {

    private WireMessages() {
    }

    static Map<String, String> of(String role, String content) {
        Map<String, String> message = new LinkedHashMap<>();
        message.put("role", role);
        message.put("content", content);
        return message;
    }
}
