package fr.lapetina.multillm.provider;

import fr.lapetina.multillm.domain.model.ChatMessage;
import fr.lapetina.multillm.domain.model.ModelDefinition;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Translates a provider-neutral completion request into one vendor's wire format
 * and extracts the generated text from its answer.
 *
 * Implementations must be thread-safe as they are called from many sessions concurrently.
 */
public interface ProviderAdapter {

    /**
     * Returns the normalized provider key this adapter is bound to.
     */
    String provider();

    /**
     * Completes a conversation.
     *
     * <p>The future fails with {@link fr.lapetina.multillm.exception.ValidationException}
     * for a blank credential, {@link fr.lapetina.multillm.exception.HandshakeException} when
     * the preceding handshake fails, {@link fr.lapetina.multillm.exception.TransportException}
     * for a non-success status and {@link java.util.concurrent.CancellationException} when
     * cancelled. An unrecognized success payload is returned verbatim.
     *
     * @param model      model to complete with
     * @param messages   conversation, oldest first
     * @param credential API key passed through to the provider
     * @return future with the generated text
     */
    CompletableFuture<String> complete(ModelDefinition model, List<ChatMessage> messages, String credential);
}
