package io.github.yok.mongoclonelink.core;

/**
 * Receiver of human-readable progress lines.
 *
 * <p>
 * One line per call, strictly in emission order. Lines carry no severity; failures are reported as
 * lines starting with {@code ERROR:}.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@FunctionalInterface
public interface ProgressSink {

    /**
     * Receives one progress line.
     *
     * @param line progress line
     */
    void accept(String line);

    /**
     * Returns a sink that discards every line.
     *
     * @return no-op sink
     */
    static ProgressSink noop() {
        return line -> {
        };
    }
}
