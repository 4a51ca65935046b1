package io.jobcast4j.core;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * One-shot advisory cancellation signal handed to a running job.
 *
 * <p>Cancelling only flips the flag and notifies listeners; executors are expected to poll
 * {@link #isCancelled()} or register a listener. Nothing is forcibly interrupted.
 */
public final class CancellationToken {
    private static final Logger log = LoggerFactory.getLogger(CancellationToken.class);

    private final AtomicBoolean cancelled = new AtomicBoolean(false);
    private final List<Runnable> listeners = new CopyOnWriteArrayList<>();

    /**
     * @return true if this call cancelled the token, false if it was already cancelled
     */
    public boolean cancel() {
        if (!cancelled.compareAndSet(false, true)) {
            return false;
        }
        for (Runnable listener : listeners) {
            // whoever removes a listener runs it, so a concurrent onCancel never runs it twice
            if (!listeners.remove(listener)) {
                continue;
            }
            try {
                listener.run();
            } catch (RuntimeException e) {
                log.error("cancellation listener failed msg={}", e.getMessage(), e);
            }
        }
        return true;
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    /**
     * Register a listener. Runs immediately on the calling thread if the token is already cancelled.
     */
    public void onCancel(Runnable listener) {
        listeners.add(listener);
        if (cancelled.get() && listeners.remove(listener)) {
            listener.run();
        }
    }

    public void throwIfCancelled() {
        if (cancelled.get()) {
            throw new CancellationException("job cancelled");
        }
    }
}
