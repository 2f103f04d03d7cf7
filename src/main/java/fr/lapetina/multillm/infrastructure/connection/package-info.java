/**
 * Provider connection tracking.
 *
 * <p>{@link fr.lapetina.multillm.infrastructure.connection.ConnectionRegistry} owns the
 * per-provider connected/disconnected state, performs handshakes through registered
 * {@link fr.lapetina.multillm.infrastructure.connection.HandshakeProbe}s and notifies
 * listeners after every state change.
 *
 * <h2>Locking</h2>
 * <p>Each provider key has its own lock, held across the in-memory update and the listener
 * notification only. A slow handshake with one provider never blocks reads or writes for
 * another provider.
 */
package fr.lapetina.multillm.infrastructure.connection;
