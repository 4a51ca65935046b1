package io.jobcast4j.core.event;

import java.util.Objects;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;

/**
 * Two unbounded queues (output and error) through which the scheduler reports lifecycle transitions.
 *
 * <p>Publishing never blocks. A consumer waits on both queues at once; when both hold events the older
 * head is handed out first.
 */
public class StatusEventChannel {

    private final BlockingQueue<StatusEvent> outputs = new LinkedBlockingQueue<>();
    private final BlockingQueue<StatusEvent> errors = new LinkedBlockingQueue<>();

    // one permit per queued event across both queues
    private final Semaphore available = new Semaphore(0);

    public void publish(StatusEvent event) {
        Objects.requireNonNull(event, "event must not be null");
        queue(event.channel()).add(event);
        available.release();
    }

    public StatusEvent take() throws InterruptedException {
        available.acquire();
        return next();
    }

    /**
     * @return the next event, or null if none arrived within the timeout
     */
    public StatusEvent poll(long timeout, TimeUnit unit) throws InterruptedException {
        if (!available.tryAcquire(timeout, unit)) {
            return null;
        }
        return next();
    }

    public int size(StatusChannel channel) {
        return queue(channel).size();
    }

    private BlockingQueue<StatusEvent> queue(StatusChannel channel) {
        return channel == StatusChannel.ERROR ? errors : outputs;
    }

    private StatusEvent next() {
        // a permit guarantees at least one event is queued, possibly on either side
        while (true) {
            StatusEvent out = outputs.peek();
            StatusEvent err = errors.peek();
            BlockingQueue<StatusEvent> first;
            BlockingQueue<StatusEvent> second;
            if (out != null && err != null && err.time().isBefore(out.time())) {
                first = errors;
                second = outputs;
            } else if (out == null && err != null) {
                first = errors;
                second = outputs;
            } else {
                first = outputs;
                second = errors;
            }

            StatusEvent e = first.poll();
            if (e == null) {
                e = second.poll();
            }
            if (e != null) {
                return e;
            }
        }
    }
}
