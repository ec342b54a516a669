/**
 * Engine configuration and its YAML loading.
 *
 * <p>
 * Settings are defined in YAML and loaded by
 * {@link com.spanlens.core.config.EngineConfigLoader} into an
 * {@link com.spanlens.core.config.EngineConfig}. Validation runs right after
 * parsing.
 * </p>
 *
 * @since 1.0.0
 */
package com.spanlens.core.config;
