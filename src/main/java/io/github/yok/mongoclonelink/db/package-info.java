/**
 * MongoDB connection package.
 *
 * <p>
 * Turns configured connection entries into open database handles and owns the one connection
 * string repair the tool performs.
 * </p>
 */
package io.github.yok.mongoclonelink.db;
