/**
 * Shared helpers for error reporting and log formatting.
 */
package io.github.yok.mongoclonelink.util;
