package io.github.yok.mongoclonelink.core;

import com.google.common.base.Preconditions;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import lombok.extern.slf4j.Slf4j;

/**
 * {@link ProgressSink} that hands lines to a delegate on a dedicated consumer thread.
 *
 * <p>
 * The producer never waits for the delegate: {@link #accept(String)} only enqueues. A single
 * consumer thread delivers lines in the order they were accepted. {@link #close()} stops accepting
 * new lines and waits until every queued line has been delivered.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class AsyncProgressSink implements ProgressSink, AutoCloseable {

    // Upper bound for draining queued lines on close
    private static final long DRAIN_TIMEOUT_SECONDS = 30L;

    private final ProgressSink delegate;

    private final ExecutorService consumer;

    /**
     * Creates a sink that forwards to the given delegate.
     *
     * @param delegate sink that finally receives the lines
     */
    public AsyncProgressSink(ProgressSink delegate) {
        this.delegate = Preconditions.checkNotNull(delegate, "delegate must not be null");
        this.consumer = Executors.newSingleThreadExecutor(
                new ThreadFactoryBuilder().setNameFormat("progress-sink-%d").setDaemon(true)
                        .build());
    }

    /**
     * Enqueues a line for delivery.
     *
     * @param line progress line
     * @throws java.util.concurrent.RejectedExecutionException if the sink is already closed
     */
    @Override
    public void accept(String line) {
        consumer.execute(() -> deliver(line));
    }

    private void deliver(String line) {
        try {
            delegate.accept(line);
        } catch (RuntimeException e) {
            log.warn("Progress sink rejected line [{}]", line, e);
        }
    }

    /**
     * Stops accepting lines and waits until all queued lines are delivered.
     */
    @Override
    public void close() {
        consumer.shutdown();
        try {
            if (!consumer.awaitTermination(DRAIN_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
                log.warn("Progress lines still pending after {}s; giving up",
                        DRAIN_TIMEOUT_SECONDS);
                consumer.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            consumer.shutdownNow();
        }
    }
}
