package fr.lapetina.multillm.exception;

import fr.lapetina.multillm.domain.model.ErrorType;

/**
 * Thrown when a provider answers with a non-success status, or cannot be reached at all.
 *
 * A status code of {@code 0} means no HTTP response was received; the cause then holds
 * the underlying I/O failure. Never retried by the core.
 */
public final class TransportException extends MultiLlmException {

    private final String provider;
    private final int statusCode;
    private final String body;

    public TransportException(String provider, int statusCode, String body) {
        super(ErrorType.TRANSPORT_ERROR,
                provider + " request failed: HTTP " + statusCode + " - " + body);
        this.provider = provider;
        this.statusCode = statusCode;
        this.body = body;
    }

    public TransportException(String provider, Throwable cause) {
        super(ErrorType.TRANSPORT_ERROR,
                provider + " request failed: " + cause.getClass().getSimpleName() + ": " + cause.getMessage(),
                cause);
        this.provider = provider;
        this.statusCode = 0;
        this.body = "";
    }

    public String getProvider() {
        return provider;
    }

    public int getStatusCode() {
        return statusCode;
    }

    public String getBody() {
        return body;
    }

    public boolean isAuthenticationFailure() {
        return statusCode == 401 || statusCode == 403;
    }
}
