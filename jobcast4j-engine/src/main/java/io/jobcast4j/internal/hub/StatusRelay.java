package io.jobcast4j.internal.hub;

import com.fasterxml.jackson.core.JsonProcessingException;
import io.jobcast4j.core.JobRegistry;
import io.jobcast4j.core.event.StatusEvent;
import io.jobcast4j.core.event.StatusEventChannel;
import io.jobcast4j.core.event.StatusSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Drains the status channel into the coalesced snapshot and hands each resulting payload to the hub.
 *
 * <p>After an event, only the table of the channel it arrived on is serialized. Ids that are no longer
 * in the registry (removed by a rebuild) are dropped from the snapshot first. A serialization failure
 * drops that cycle; the next event re-serializes the current state.
 */
public class StatusRelay {
    private static final Logger log = LoggerFactory.getLogger(StatusRelay.class);

    private final StatusEventChannel channel;
    private final BroadcastHub hub;
    private final StatusCodec codec;
    private final JobRegistry registry;

    // relay thread only
    private final StatusSnapshot snapshot = new StatusSnapshot();

    private final AtomicBoolean started = new AtomicBoolean(false);
    private Thread relayThread;

    public StatusRelay(StatusEventChannel channel, BroadcastHub hub, StatusCodec codec, JobRegistry registry) {
        this.channel = Objects.requireNonNull(channel, "channel must not be null");
        this.hub = Objects.requireNonNull(hub, "hub must not be null");
        this.codec = Objects.requireNonNull(codec, "codec must not be null");
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
    }

    public void start() {
        if (!started.compareAndSet(false, true)) {
            return;
        }
        relayThread = new Thread(this::relayLoop);
        relayThread.setName("jobcast.relay");
        relayThread.setDaemon(true);
        relayThread.start();
        log.info("Status relay started.");
    }

    public void stop() {
        if (!started.compareAndSet(true, false)) {
            return;
        }
        relayThread.interrupt();
        relayThread = null;
        log.info("Status relay stopped.");
    }

    private void relayLoop() {
        while (started.get()) {
            StatusEvent event;
            try {
                event = channel.take();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
            relay(event);
        }
    }

    void relay(StatusEvent event) {
        log.debug("status event id={} channel={} type={}", event.id(), event.channel(), event.getClass().getSimpleName());
        try {
            snapshot.record(event.channel(), event.id(), codec.payload(event));
            snapshot.retain(registry.ids());
            hub.broadcast(codec.encode(snapshot.records(event.channel())));
        } catch (JsonProcessingException | RuntimeException e) {
            log.error("socket: marshal failed id={} msg={}", event.id(), e.getMessage(), e);
        }
    }
}
