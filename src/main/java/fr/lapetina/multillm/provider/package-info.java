/**
 * Protocol translation between the provider-neutral conversation model and each vendor's wire format.
 *
 * <p>{@link fr.lapetina.multillm.provider.CompletionGateway} resolves a
 * {@link fr.lapetina.multillm.provider.ProviderAdapter} per provider key. Adapters share the
 * flow in {@link fr.lapetina.multillm.provider.AbstractProviderAdapter}; handshake probes share
 * {@link fr.lapetina.multillm.provider.AbstractHandshakeProbe}.
 */
package fr.lapetina.multillm.provider;
