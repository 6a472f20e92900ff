/**
 * Text codec for dump files.
 */
package io.github.yok.mongoclonelink.codec;
