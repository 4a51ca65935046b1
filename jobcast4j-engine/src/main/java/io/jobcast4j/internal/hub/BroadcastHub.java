package io.jobcast4j.internal.hub;

import io.jobcast4j.ViewerConnection;
import io.jobcast4j.config.JobcastProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.Executors;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Owns the set of connected viewers and fans payloads out to them.
 *
 * <p>All changes arrive as commands on a single queue drained by one hub thread, which is the only
 * reader and writer of the client map. A failed write evicts that viewer and delivery continues with the
 * rest. A periodic sweep evicts viewers that sent nothing for longer than the client timeout.
 *
 * <p>Each start runs a fresh loop with its own queue and client map. On stop the hub thread itself
 * closes its viewers and every connection still queued, so a stop that times out waiting for a blocked
 * write never touches the client map from the outside. Connections submitted while the hub is not
 * running are closed right away.
 */
public class BroadcastHub {
    private static final Logger log = LoggerFactory.getLogger(BroadcastHub.class);

    private final JobcastProperties props;
    private final Clock clock;

    private final AtomicBoolean started = new AtomicBoolean(false);

    private volatile HubLoop loop;
    private ScheduledExecutorService sweeper;

    private interface Command {
    }

    private record Register(ViewerConnection connection) implements Command {
    }

    private record Unregister(ViewerConnection connection) implements Command {
    }

    private record Touch(String connectionId) implements Command {
    }

    private record Broadcast(String payload) implements Command {
    }

    private record Sweep() implements Command {
    }

    public BroadcastHub(JobcastProperties props) {
        this(props, Clock.systemUTC());
    }

    public BroadcastHub(JobcastProperties props, Clock clock) {
        this.props = Objects.requireNonNull(props, "props must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    /**
     * Start the hub thread and the liveness sweep. Idempotent.
     */
    public void start() {
        Duration sweepInterval = Objects.requireNonNull(props.getSweepInterval(), "jobcast.sweepInterval must not be null");
        if (sweepInterval.isZero() || sweepInterval.isNegative()) {
            throw new IllegalArgumentException("jobcast.sweepInterval must be a positive duration");
        }
        Duration timeout = Objects.requireNonNull(props.getClientTimeout(), "jobcast.clientTimeout must not be null");
        if (timeout.isZero() || timeout.isNegative()) {
            throw new IllegalArgumentException("jobcast.clientTimeout must be a positive duration");
        }
        if (!started.compareAndSet(false, true)) {
            return;
        }

        log.info("Broadcast hub starting with sweepInterval={}, clientTimeout={}", sweepInterval, timeout);

        HubLoop next = new HubLoop();
        Thread hubThread = new Thread(next::run);
        hubThread.setName("jobcast.hub");
        hubThread.setDaemon(true);
        next.thread = hubThread;
        loop = next;
        hubThread.start();

        sweeper = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r);
            t.setName("jobcast.sweeper");
            t.setDaemon(true);
            return t;
        });
        long period = sweepInterval.toMillis();
        sweeper.scheduleAtFixedRate(this::sweep, period, period, TimeUnit.MILLISECONDS);
    }

    /**
     * Stop sweeping and the hub thread, which closes every remaining connection on its way out.
     * Waits up to the shutdown timeout for that to happen. Idempotent.
     */
    public void stop() {
        if (!started.compareAndSet(true, false)) {
            return;
        }
        log.info("Broadcast hub stopping...");

        sweeper.shutdownNow();
        sweeper = null;

        HubLoop current = loop;
        loop = null;
        current.halt();
        try {
            current.thread.join(props.getShutdownTimeout().toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        if (current.thread.isAlive()) {
            log.warn("Broadcast hub thread still busy after {}, it closes its viewers once the pending write returns",
                    props.getShutdownTimeout());
            return;
        }
        log.info("Broadcast hub stopped successfully.");
    }

    public void register(ViewerConnection connection) {
        submit(new Register(Objects.requireNonNull(connection, "connection must not be null")));
    }

    /**
     * Remove and close a viewer. Removing an absent viewer is a no-op.
     */
    public void unregister(ViewerConnection connection) {
        submit(new Unregister(Objects.requireNonNull(connection, "connection must not be null")));
    }

    /**
     * Liveness signal from the viewer with the given connection id.
     */
    public void touch(String connectionId) {
        submit(new Touch(connectionId));
    }

    public void broadcast(String payload) {
        submit(new Broadcast(Objects.requireNonNull(payload, "payload must not be null")));
    }

    /**
     * Evict viewers silent for longer than the client timeout. Called by the sweeper on a fixed interval.
     */
    public void sweep() {
        submit(new Sweep());
    }

    public int clientCount() {
        HubLoop current = loop;
        return current == null ? 0 : current.clientCount;
    }

    private void submit(Command command) {
        HubLoop current = loop;
        if (current == null || !current.offer(command)) {
            reject(command);
        }
    }

    // a command the hub will never handle; connections in it must not stay open
    private static void reject(Command command) {
        if (command instanceof Register r) {
            log.debug("hub not running, connection closed addr={}", r.connection().remoteAddress());
            r.connection().close();
        } else if (command instanceof Unregister u) {
            u.connection().close();
        }
    }

    private final class HubLoop {
        private final BlockingQueue<Command> commands = new LinkedBlockingQueue<>();
        // hub thread only
        private final Map<String, Client> clients = new LinkedHashMap<>();
        private volatile int clientCount = 0;
        private volatile boolean running = true;
        // guarded by this
        private boolean closed = false;
        private Thread thread;

        synchronized boolean offer(Command command) {
            if (closed) {
                return false;
            }
            commands.add(command);
            return true;
        }

        void halt() {
            running = false;
            thread.interrupt();
        }

        void run() {
            while (running) {
                Command command;
                try {
                    command = commands.take();
                } catch (InterruptedException e) {
                    break;
                }
                try {
                    handle(command);
                } catch (RuntimeException e) {
                    log.error("hub command failed command={} msg={}", command.getClass().getSimpleName(), e.getMessage(), e);
                }
                clientCount = clients.size();
            }
            shutdown();
        }

        private void shutdown() {
            // clear a halt() interrupt that landed outside take() before closing connections
            Thread.interrupted();
            List<Command> pending = new ArrayList<>();
            synchronized (this) {
                closed = true;
                commands.drainTo(pending);
            }
            pending.forEach(BroadcastHub::reject);
            for (Client client : clients.values()) {
                client.connection().close();
            }
            clients.clear();
            clientCount = 0;
            log.debug("hub loop exited, pending commands dropped count={}", pending.size());
        }

        private void handle(Command command) {
            if (command instanceof Register r) {
                ViewerConnection c = r.connection();
                clients.put(c.id(), new Client(c, clock.instant()));
                log.debug("connection registered addr={} clients={}", c.remoteAddress(), clients.size());
            } else if (command instanceof Unregister u) {
                Client removed = clients.remove(u.connection().id());
                u.connection().close();
                if (removed != null) {
                    log.debug("connection unregistered addr={} clients={}", u.connection().remoteAddress(), clients.size());
                }
            } else if (command instanceof Touch t) {
                Client client = clients.get(t.connectionId());
                if (client != null) {
                    client.touch(clock.instant());
                }
            } else if (command instanceof Broadcast b) {
                deliver(b.payload());
            } else if (command instanceof Sweep) {
                evictStale();
            }
        }

        private void deliver(String payload) {
            for (Client client : new ArrayList<>(clients.values())) {
                ViewerConnection c = client.connection();
                try {
                    c.send(payload);
                    log.debug("message sent addr={} msg={}", c.remoteAddress(), payload);
                } catch (Exception e) {
                    log.error("write error addr={} msg={}", c.remoteAddress(), e.getMessage(), e);
                    evict(client);
                }
            }
        }

        private void evictStale() {
            Instant now = clock.instant();
            Duration timeout = props.getClientTimeout();
            List<Client> stale = new ArrayList<>();
            for (Client client : clients.values()) {
                if (Duration.between(client.lastSeen(), now).compareTo(timeout) > 0) {
                    stale.add(client);
                }
            }
            for (Client client : stale) {
                log.warn("evicting silent viewer addr={} lastSeen={}", client.connection().remoteAddress(), client.lastSeen());
                evict(client);
            }
        }

        private void evict(Client client) {
            clients.remove(client.connection().id());
            client.connection().close();
        }
    }
}
