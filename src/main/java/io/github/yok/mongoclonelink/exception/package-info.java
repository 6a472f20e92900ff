/**
 * Failure types raised by the replication workflow.
 *
 * <p>
 * Every type extends {@link io.github.yok.mongoclonelink.exception.ReplicationException}; the
 * engine catches that hierarchy at one boundary per operation and converts it into a failure
 * result.
 * </p>
 */
package io.github.yok.mongoclonelink.exception;
