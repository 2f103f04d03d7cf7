/**
 * Multi LLM orchestrator.
 *
 * <p>Runs one chat session per configured model, sends each conversation to its provider
 * through a uniform completion call and tracks whether each provider connection is usable.
 *
 * <h2>Architecture</h2>
 * <pre>
 * SessionOrchestrator --> CompletionGateway --> ProviderAdapter --> ProviderHttpClient
 *          |                                          |
 *          +-------------> ConnectionRegistry <-------+ (lazy handshake)
 * </pre>
 *
 * <p>{@link fr.lapetina.multillm.OrchestratorFactory} wires everything from YAML configuration.
 */
package fr.lapetina.multillm;
