package fr.lapetina.multillm.domain.model;

import java.util.Locale;

/**
 * Author of a chat message.
 */
public enum ChatRole {
    SYSTEM,
    USER,
    ASSISTANT;

    /**
     * Lowercase name used on the wire by every provider.
     */
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
