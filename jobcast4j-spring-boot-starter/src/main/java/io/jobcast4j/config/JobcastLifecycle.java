package io.jobcast4j.config;

import io.jobcast4j.JobScheduler;
import io.jobcast4j.internal.hub.BroadcastHub;
import io.jobcast4j.internal.hub.StatusRelay;
import org.springframework.context.SmartLifecycle;

/**
 * Bridges scheduler, relay and hub start/stop with the Spring container lifecycle.
 *
 * <p>The configured schedules become the first generation on start.
 */
public class JobcastLifecycle implements SmartLifecycle {
    private final JobScheduler scheduler;
    private final BroadcastHub hub;
    private final StatusRelay relay;
    private final JobcastProperties props;
    private volatile boolean running = false;

    public JobcastLifecycle(JobScheduler scheduler, BroadcastHub hub, StatusRelay relay, JobcastProperties props) {
        this.scheduler = scheduler;
        this.hub = hub;
        this.relay = relay;
        this.props = props;
    }

    @Override
    public void start() {
        hub.start();
        relay.start();
        scheduler.rebuildSchedule(props.getSchedules());
        scheduler.start();
        running = true;
    }

    @Override
    public void stop() {
        scheduler.stop();
        relay.stop();
        hub.stop();
        running = false;
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    // below the embedded web server: the hub accepts viewers before the first connection arrives
    // and is stopped only after the server no longer hands out new ones
    @Override
    public int getPhase() {
        return SmartLifecycle.DEFAULT_PHASE - 4096;
    }

    @Override
    public boolean isAutoStartup() {
        return true;
    }
}
