/**
 * Daemon orchestration package.
 *
 * <p>{@link io.spiffehelper.runtime.Daemon} owns the run loop: it writes each
 * credential update, supervises the managed command, serves health checks and
 * tears everything down through one {@link io.spiffehelper.runtime.ShutdownSignal}.
 */
package io.spiffehelper.runtime;
