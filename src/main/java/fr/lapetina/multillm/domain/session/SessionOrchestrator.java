package fr.lapetina.multillm.domain.session;

import fr.lapetina.multillm.domain.model.ChatMessage;
import fr.lapetina.multillm.domain.model.ChatRole;
import fr.lapetina.multillm.domain.model.ErrorType;
import fr.lapetina.multillm.domain.model.HandshakeResult;
import fr.lapetina.multillm.exception.MultiLlmException;
import fr.lapetina.multillm.infrastructure.connection.ConnectionRegistry;
import fr.lapetina.multillm.infrastructure.http.Futures;
import fr.lapetina.multillm.provider.CompletionGateway;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Runs chat sessions concurrently against their providers.
 *
 * <p>Every operation returns a future that completes normally: failures are recorded in the
 * session transcript and reported through {@link SessionOutcome}. A session runs one operation
 * at a time; an operation started on a busy session is rejected without touching it.
 * Cancelling a returned future cancels the network call in flight, and the session is released
 * once that call has unwound.
 */
public final class SessionOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(SessionOrchestrator.class);

    public static final String DEFAULT_SUMMARY_PROMPT =
            "Summarize the following assistant conversations in concise bullet points.";

    static final String GREETING = "hello";
    static final String NO_RESPONSE = "(no response)";
    static final String REQUEST_CANCELLED = "Request cancelled";
    static final String NO_SESSIONS = "No sessions to summarize.";

    private final ConnectionRegistry connectionRegistry;
    private final CompletionGateway gateway;
    private final Clock clock;

    public SessionOrchestrator(ConnectionRegistry connectionRegistry, CompletionGateway gateway, Clock clock) {
        this.connectionRegistry = connectionRegistry;
        this.gateway = gateway;
        this.clock = clock;
    }

    public SessionOrchestrator(ConnectionRegistry connectionRegistry, CompletionGateway gateway) {
        this(connectionRegistry, gateway, Clock.systemUTC());
    }

    /**
     * Handshakes with the session's provider, then greets the model.
     */
    public CompletableFuture<SessionOutcome> initializeConnection(ChatSession session, String credential) {
        return run(session, SessionOutcome.rejected(session), inFlight -> {
            String provider = session.provider();
            CompletableFuture<HandshakeResult> handshake;
            try {
                handshake = connectionRegistry.performHandshake(provider, credential);
            } catch (RuntimeException e) {
                handshake = CompletableFuture.failedFuture(e);
            }

            return inFlight.track(handshake).handle((result, ex) -> {
                if (ex != null) {
                    Throwable cause = Futures.unwrap(ex);
                    if (Futures.isCancellation(cause)) {
                        return CompletableFuture.completedFuture(recordCancellation(session));
                    }
                    String message = "Connection error: " + cause.getMessage();
                    session.append(TranscriptEntry.error(ChatRole.SYSTEM, message, clock.instant()));
                    log.error("Failed to initialize connection: session={}, provider={}",
                            session.displayName(), provider, cause);
                    return CompletableFuture.completedFuture(
                            SessionOutcome.failed(session, errorTypeOf(cause), message));
                }
                if (!result.success()) {
                    String message = "Connection failed: " + result.message();
                    session.append(TranscriptEntry.error(ChatRole.SYSTEM, message, clock.instant()));
                    return CompletableFuture.completedFuture(
                            SessionOutcome.failed(session, ErrorType.HANDSHAKE_ERROR, message));
                }
                session.append(TranscriptEntry.status(
                        "Connected to " + provider + " (" + result.handshakeId() + ")", clock.instant()));
                return exchange(session, GREETING, credential, inFlight);
            }).thenCompose(Function.identity());
        });
    }

    /**
     * Sends one user message and records the reply. Blank input is a no-op.
     */
    public CompletableFuture<SessionOutcome> send(ChatSession session, String userText, String credential) {
        String trimmed = userText == null ? "" : userText.trim();
        if (trimmed.isEmpty()) {
            return CompletableFuture.completedFuture(SessionOutcome.skipped(session, "Empty input"));
        }
        return run(session, SessionOutcome.rejected(session),
                inFlight -> exchange(session, trimmed, credential, inFlight));
    }

    /**
     * Asks the session's model to summarize its own transcript. The transcript is left unchanged.
     */
    public CompletableFuture<String> summarize(ChatSession session, String credential, String systemPrompt) {
        String name = session.displayName();
        if (session.transcript().isEmpty()) {
            return CompletableFuture.completedFuture(name + ": No conversation yet.");
        }
        return run(session, name + ": Session is busy.", inFlight -> {
            List<ChatMessage> request = List.of(
                    ChatMessage.system(systemPrompt != null ? systemPrompt : DEFAULT_SUMMARY_PROMPT),
                    ChatMessage.user("Summarize the following conversation between a user and an assistant named "
                            + name + ". Provide 2 short bullet points.\n\n" + buildTranscript(session)));

            return inFlight.track(complete(session, request, credential)).handle((summary, ex) -> {
                if (ex == null) {
                    return name + ": " + (summary == null ? "" : summary.trim());
                }
                Throwable cause = Futures.unwrap(ex);
                if (Futures.isCancellation(cause)) {
                    return name + ": " + REQUEST_CANCELLED;
                }
                log.error("Failed to summarize conversation: session={}", name, cause);
                return name + ": Warning: " + cause.getMessage();
            });
        });
    }

    /**
     * Sends the same input to every session concurrently and waits for all of them.
     */
    public CompletableFuture<BroadcastResult> broadcast(List<ChatSession> sessions, String userText,
                                                        CredentialSource credentials) {
        log.info("Broadcasting to {} sessions", sessions.size());
        return fanOut(sessions, session -> send(session, userText, credentialFor(credentials, session)));
    }

    public CompletableFuture<BroadcastResult> broadcast(List<ChatSession> sessions, String userText,
                                                        String credential) {
        return broadcast(sessions, userText, CredentialSource.fixed(credential));
    }

    /**
     * Initializes every session concurrently. Sessions without a credential are skipped
     * with an error entry naming the provider.
     */
    public CompletableFuture<BroadcastResult> initializeAll(List<ChatSession> sessions, CredentialSource credentials) {
        log.info("Initializing {} sessions", sessions.size());
        return fanOut(sessions, session -> {
            Optional<String> credential = credentials.credentialFor(session.provider())
                    .filter(value -> !value.isBlank());
            if (credential.isPresent()) {
                return initializeConnection(session, credential.get());
            }
            return run(session, SessionOutcome.rejected(session), inFlight -> {
                String message = "No API key configured for " + session.provider() + ".";
                session.append(TranscriptEntry.error(ChatRole.SYSTEM, message, clock.instant()));
                log.warn("Skipping session without credential: session={}, provider={}",
                        session.displayName(), session.provider());
                return CompletableFuture.completedFuture(SessionOutcome.skipped(session, message));
            });
        });
    }

    /**
     * Summarizes every session concurrently; summaries are separated by a blank line.
     */
    public CompletableFuture<String> summarizeAll(List<ChatSession> sessions, CredentialSource credentials,
                                                  String systemPrompt) {
        if (sessions.isEmpty()) {
            return CompletableFuture.completedFuture(NO_SESSIONS);
        }
        List<CompletableFuture<String>> summaries = new ArrayList<>(sessions.size());
        for (ChatSession session : sessions) {
            summaries.add(summarize(session, credentialFor(credentials, session), systemPrompt));
        }
        return CompletableFuture.allOf(summaries.toArray(new CompletableFuture[0]))
                .thenApply(ignored -> summaries.stream()
                        .map(CompletableFuture::join)
                        .collect(Collectors.joining("\n\n")));
    }

    private CompletableFuture<BroadcastResult> fanOut(
            List<ChatSession> sessions,
            Function<ChatSession, CompletableFuture<SessionOutcome>> operation
    ) {
        List<CompletableFuture<SessionOutcome>> outcomes = new ArrayList<>(sessions.size());
        for (ChatSession session : sessions) {
            outcomes.add(operation.apply(session));
        }
        return CompletableFuture.allOf(outcomes.toArray(new CompletableFuture[0]))
                .thenApply(ignored -> new BroadcastResult(outcomes.stream()
                        .map(CompletableFuture::join)
                        .toList()));
    }

    /**
     * Appends the user turn, calls the provider with the replayed history and records the reply.
     * The caller holds the session.
     */
    private CompletableFuture<SessionOutcome> exchange(ChatSession session, String text, String credential,
                                                       InFlight inFlight) {
        List<ChatMessage> request = session.history();
        request.add(ChatMessage.user(text));
        session.append(TranscriptEntry.message(ChatRole.USER, text, clock.instant()));

        return inFlight.track(complete(session, request, credential)).handle((reply, ex) -> {
            if (ex == null) {
                String content = reply == null || reply.isBlank() ? NO_RESPONSE : reply.trim();
                session.append(TranscriptEntry.message(ChatRole.ASSISTANT, content, clock.instant()));
                logOutcome(session, "completed");
                return SessionOutcome.completed(session, content);
            }
            Throwable cause = Futures.unwrap(ex);
            if (Futures.isCancellation(cause)) {
                return recordCancellation(session);
            }
            String message = "Warning: " + cause.getMessage();
            session.append(TranscriptEntry.error(ChatRole.ASSISTANT, message, clock.instant()));
            log.error("Failed to complete chat: session={}, provider={}, error={}",
                    session.displayName(), session.provider(), cause.getMessage());
            return SessionOutcome.failed(session, errorTypeOf(cause), message);
        });
    }

    private CompletableFuture<String> complete(ChatSession session, List<ChatMessage> messages, String credential) {
        try {
            return gateway.complete(session.model(), messages, credential);
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    private SessionOutcome recordCancellation(ChatSession session) {
        session.append(TranscriptEntry.status(REQUEST_CANCELLED, clock.instant()));
        logOutcome(session, "cancelled");
        return SessionOutcome.cancelled(session);
    }

    /**
     * Runs one operation while holding the session. The session is released once the
     * operation has settled, whether it completed, failed or was cancelled by the caller.
     */
    private <T> CompletableFuture<T> run(ChatSession session, T rejected,
                                         Function<InFlight, CompletableFuture<T>> operation) {
        if (!session.tryAcquire()) {
            log.warn("Session is busy, operation rejected: session={}", session.displayName());
            return CompletableFuture.completedFuture(rejected);
        }

        InFlight inFlight = new InFlight();
        CompletableFuture<T> call;
        try {
            call = operation.apply(inFlight);
        } catch (RuntimeException e) {
            call = CompletableFuture.failedFuture(e);
        }

        CompletableFuture<T> outcome = new CompletableFuture<>();
        call.whenComplete((result, ex) -> {
            session.release();
            if (ex != null) {
                log.error("Session operation failed unexpectedly: session={}", session.displayName(), ex);
                outcome.completeExceptionally(Futures.unwrap(ex));
            } else {
                outcome.complete(result);
            }
        });
        outcome.whenComplete((ignored, ex) -> {
            if (outcome.isCancelled()) {
                inFlight.cancel();
            }
        });
        return outcome;
    }

    private String buildTranscript(ChatSession session) {
        StringBuilder builder = new StringBuilder();
        for (TranscriptEntry entry : session.transcript()) {
            String header = switch (entry.role()) {
                case USER -> "User";
                case ASSISTANT -> session.displayName();
                case SYSTEM -> "System";
            };
            builder.append(header).append(": ").append(entry.content()).append('\n');
        }
        return builder.toString();
    }

    private void logOutcome(ChatSession session, String outcome) {
        MDC.put("session", session.displayName());
        try {
            log.info("Session operation {}: provider={}", outcome, session.provider());
        } finally {
            MDC.remove("session");
        }
    }

    private static String credentialFor(CredentialSource credentials, ChatSession session) {
        return credentials.credentialFor(session.provider()).orElse(null);
    }

    private static ErrorType errorTypeOf(Throwable cause) {
        return cause instanceof MultiLlmException multiLlm ? multiLlm.getErrorType() : ErrorType.INTERNAL_ERROR;
    }

    /**
     * The network call an operation is currently waiting on.
     */
    private static final class InFlight {
        private final AtomicReference<Future<?>> current = new AtomicReference<>();
        private volatile boolean cancelled;

        <T> CompletableFuture<T> track(CompletableFuture<T> future) {
            current.set(future);
            if (cancelled) {
                future.cancel(true);
            }
            return future;
        }

        void cancel() {
            cancelled = true;
            Future<?> future = current.get();
            if (future != null) {
                future.cancel(true);
            }
        }
    }
}
