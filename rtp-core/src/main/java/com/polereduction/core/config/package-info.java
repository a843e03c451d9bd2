/**
 * Pipeline settings and their YAML loading.
 *
 * <p>
 * {@link com.polereduction.core.config.SettingsLoader} reads a
 * {@link com.polereduction.core.config.ReductionSettings} document and
 * validates it before any profile is processed.
 * </p>
 *
 * @since 1.0.0
 */
package com.polereduction.core.config;
