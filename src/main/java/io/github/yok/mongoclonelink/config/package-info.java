/**
 * Configuration model package for MongoCloneLink.
 *
 * <p>
 * Defines classes that represent values loaded from {@code application.yml} (or equivalent
 * sources), such as connection settings, path settings and replication settings.
 * </p>
 *
 * <p>
 * This package primarily holds configuration data; execution logic is implemented in {@code core}
 * and {@code db}.
 * </p>
 */
package io.github.yok.mongoclonelink.config;
