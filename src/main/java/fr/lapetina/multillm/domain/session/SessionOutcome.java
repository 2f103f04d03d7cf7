package fr.lapetina.multillm.domain.session;

import fr.lapetina.multillm.domain.model.ErrorType;

import java.util.Objects;
import java.util.Optional;

/**
 * Result of one operation on one session.
 *
 * @param reply     assistant text, empty unless {@link Status#COMPLETED}
 * @param errorType set for {@link Status#FAILED} and {@link Status#CANCELLED}
 * @param message   human-readable detail, as recorded in the transcript
 */
public record SessionOutcome(
        String sessionName,
        String provider,
        Status status,
        String reply,
        ErrorType errorType,
        String message
) {

    public enum Status {
        COMPLETED,
        FAILED,
        REJECTED,
        SKIPPED,
        CANCELLED
    }

    public SessionOutcome {
        Objects.requireNonNull(sessionName, "Session name is required");
        Objects.requireNonNull(status, "Status is required");
        if (reply == null) {
            reply = "";
        }
        if (message == null) {
            message = "";
        }
    }

    static SessionOutcome completed(ChatSession session, String reply) {
        return new SessionOutcome(session.displayName(), session.provider(), Status.COMPLETED, reply, null, "");
    }

    static SessionOutcome failed(ChatSession session, ErrorType errorType, String message) {
        return new SessionOutcome(session.displayName(), session.provider(), Status.FAILED, "", errorType, message);
    }

    static SessionOutcome rejected(ChatSession session) {
        return new SessionOutcome(session.displayName(), session.provider(), Status.REJECTED, "", null,
                "Session is busy.");
    }

    static SessionOutcome skipped(ChatSession session, String message) {
        return new SessionOutcome(session.displayName(), session.provider(), Status.SKIPPED, "", null, message);
    }

    static SessionOutcome cancelled(ChatSession session) {
        return new SessionOutcome(session.displayName(), session.provider(), Status.CANCELLED, "",
                ErrorType.CANCELLED, "Request cancelled");
    }

    public boolean isSuccess() {
        return status == Status.COMPLETED;
    }

    public Optional<ErrorType> error() {
        return Optional.ofNullable(errorType);
    }
}
