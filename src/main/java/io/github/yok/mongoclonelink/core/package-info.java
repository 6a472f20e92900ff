/**
 * Core clone/dump/restore workflow package.
 *
 * <p>
 * Orchestrates copying collections from one database to another, dumping them to line-oriented
 * files and restoring them from those files. Writes are batched, unordered upserts keyed by
 * {@code _id}.
 * </p>
 *
 * <p>
 * Connection handling is delegated to {@code db}; the file format to {@code codec}.
 * </p>
 */
package io.github.yok.mongoclonelink.core;
