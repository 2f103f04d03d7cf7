package fr.lapetina.multillm.domain.session;

import fr.lapetina.multillm.domain.model.ChatMessage;
import fr.lapetina.multillm.domain.model.ChatRole;

import java.time.Instant;
import java.util.Objects;

/**
 * One line of a session transcript.
 */
public record TranscriptEntry(ChatRole role, String content, Kind kind, Instant timestamp) {

    public enum Kind {
        /** Conversational turn, replayed as history. */
        MESSAGE,
        /** Connection or lifecycle notice. */
        STATUS,
        /** Error-marked entry. */
        ERROR
    }

    public TranscriptEntry {
        Objects.requireNonNull(role, "Role is required");
        Objects.requireNonNull(content, "Content is required");
        Objects.requireNonNull(kind, "Kind is required");
        Objects.requireNonNull(timestamp, "Timestamp is required");
    }

    public static TranscriptEntry message(ChatRole role, String content, Instant timestamp) {
        return new TranscriptEntry(role, content, Kind.MESSAGE, timestamp);
    }

    public static TranscriptEntry status(String content, Instant timestamp) {
        return new TranscriptEntry(ChatRole.SYSTEM, content, Kind.STATUS, timestamp);
    }

    public static TranscriptEntry error(ChatRole role, String content, Instant timestamp) {
        return new TranscriptEntry(role, content, Kind.ERROR, timestamp);
    }

    public boolean isMessage() {
        return kind == Kind.MESSAGE;
    }

    public boolean isError() {
        return kind == Kind.ERROR;
    }

    public ChatMessage toMessage() {
        return new ChatMessage(role, content);
    }
}
