/**
 * FetchBox source tree root.
 *
 * <p>Primary entry points while reading code:
 *
 * <ul>
 *   <li>{@code io.fetchbox.Main} bootstraps the CLI process.</li>
 *   <li>{@code io.fetchbox.cli.FetchBoxCommand} maps commands to runtime APIs.</li>
 *   <li>{@code io.fetchbox.runtime.FetchBoxRuntime} wires the queue, broker and workers together.</li>
 *   <li>{@code io.fetchbox.storage.DurableQueue} is the authoritative record of every task.</li>
 *   <li>{@code io.fetchbox.worker.TaskPipeline} runs one download-and-store attempt.</li>
 * </ul>
 */
package io.fetchbox;
