/**
 * spiffe-helper source tree root.
 *
 * <p>Primary entry points while reading code:
 *
 * <ul>
 *   <li>{@code io.spiffehelper.Main} bootstraps the CLI process.</li>
 *   <li>{@code io.spiffehelper.cli.SpiffeHelperCommand} loads configuration and picks daemon or one-shot mode.</li>
 *   <li>{@code io.spiffehelper.runtime.Daemon} orchestrates startup, the concurrent activities and shutdown.</li>
 *   <li>{@code io.spiffehelper.source.RetryingConnector} opens the Workload API session.</li>
 * </ul>
 */
package io.spiffehelper;
