/**
 * Runtime wiring.
 *
 * <p>{@link io.fetchbox.runtime.FetchBoxRuntime} is built once per process from a
 * {@link io.fetchbox.config.FetchBoxConfig}; settings and collaborators are passed
 * down by reference, there is no global registry.
 */
package io.fetchbox.runtime;
