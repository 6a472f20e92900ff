/**
 * Root package of MongoCloneLink.
 *
 * <p>
 * Provides a CLI/library to clone a MongoDB database to another server, dump it to line-oriented
 * Extended JSON files and restore it from those files with idempotent upserts.
 * </p>
 *
 * <p>
 * Main responsibilities are separated into the following subpackages:
 * </p>
 *
 * <ul>
 * <li>{@code io.github.yok.mongoclonelink.config}: configuration models</li>
 * <li>{@code io.github.yok.mongoclonelink.core}: clone/dump/restore workflow</li>
 * <li>{@code io.github.yok.mongoclonelink.codec}: dump line format</li>
 * <li>{@code io.github.yok.mongoclonelink.db}: connection handling</li>
 * <li>{@code io.github.yok.mongoclonelink.exception}: failure types</li>
 * </ul>
 */
package io.github.yok.mongoclonelink;
