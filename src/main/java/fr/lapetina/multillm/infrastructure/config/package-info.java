/**
 * Configuration loading and credential resolution.
 *
 * <p>{@link fr.lapetina.multillm.infrastructure.config.ConfigLoader} reads YAML into
 * {@link fr.lapetina.multillm.infrastructure.config.MultiLlmConfig}.
 * {@link fr.lapetina.multillm.infrastructure.config.ApiKeyResolver} picks the API key for each provider.
 */
package fr.lapetina.multillm.infrastructure.config;
