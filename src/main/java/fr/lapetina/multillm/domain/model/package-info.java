/**
 * Domain model classes shared by the adapters, the connection registry and the sessions.
 *
 * <h2>Key Classes</h2>
 * <ul>
 *   <li>{@link fr.lapetina.multillm.domain.model.ModelDefinition} - Immutable configured model</li>
 *   <li>{@link fr.lapetina.multillm.domain.model.ChatMessage} - Provider-neutral message</li>
 *   <li>{@link fr.lapetina.multillm.domain.model.ConnectionState} - Per-provider connection snapshot</li>
 *   <li>{@link fr.lapetina.multillm.domain.model.ErrorType} - Categorized error types</li>
 * </ul>
 *
 * <h2>Thread Safety</h2>
 * <p>Everything in this package is an immutable record or enum and can be shared freely
 * between concurrently running session operations.
 */
package fr.lapetina.multillm.domain.model;
