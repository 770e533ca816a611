package com.branchwork.core.coordinator;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Cooperative cancellation shared between a caller and in-flight sub-task executions.
 * <p>
 * Listeners run while the signal's lock is held, so once {@link Registration#close()} returns the
 * listener will not fire.
 */
public final class CancellationSignal {

    private static final Logger log = LoggerFactory.getLogger(CancellationSignal.class);

    private final List<Runnable> listeners = new ArrayList<>();
    private volatile boolean cancelled;

    /** A signal that is never cancelled. */
    public static CancellationSignal none() {
        return new CancellationSignal();
    }

    public synchronized void cancel() {
        if (cancelled) {
            return;
        }
        cancelled = true;
        for (Runnable listener : List.copyOf(listeners)) {
            try {
                listener.run();
            } catch (RuntimeException e) {
                log.warn("Cancellation listener failed: {}", e.getMessage(), e);
            }
        }
        listeners.clear();
    }

    public boolean isCancelled() {
        return cancelled;
    }

    /**
     * Registers {@code listener} to run on cancellation; runs it immediately if already cancelled.
     */
    public synchronized Registration onCancel(Runnable listener) {
        if (cancelled) {
            listener.run();
            return () -> { };
        }
        listeners.add(listener);
        return () -> {
            synchronized (CancellationSignal.this) {
                listeners.remove(listener);
            }
        };
    }

    @FunctionalInterface
    public interface Registration extends AutoCloseable {
        @Override
        void close();
    }
}
