package io.jobcast4j.internal;

import io.jobcast4j.core.Schedule;
import io.jobcast4j.core.TaskHandle;
import io.jobcast4j.utils.CronExpressions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.Objects;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

/**
 * Timer task for one schedule.
 *
 * <p>Cron schedules re-arm themselves after every timer fire; manual-only schedules get a single fire far
 * enough in the future to be inert. The task never runs concurrently with itself: a fire that arrives
 * while an execution is in flight is skipped.
 */
final class ScheduledJobTask implements TaskHandle {
    private static final Logger log = LoggerFactory.getLogger(ScheduledJobTask.class);

    private static final int PLACEHOLDER_YEARS = 1000;

    private final Schedule schedule;
    private final ScheduledExecutorService timer;
    private final ZoneId zone;
    private final Consumer<Schedule> body;

    private final AtomicBoolean executing = new AtomicBoolean(false);
    private final AtomicBoolean retired = new AtomicBoolean(false);

    // guarded by this
    private ScheduledFuture<?> pending;
    private Instant nextRunAt;

    /**
     * @throws IllegalArgumentException if the schedule id is blank or its cron expression is invalid
     */
    ScheduledJobTask(Schedule schedule, ScheduledExecutorService timer, ZoneId zone, Consumer<Schedule> body) {
        this.schedule = Objects.requireNonNull(schedule, "schedule must not be null");
        this.timer = Objects.requireNonNull(timer, "timer must not be null");
        this.zone = Objects.requireNonNull(zone, "zone must not be null");
        this.body = Objects.requireNonNull(body, "body must not be null");
        if (schedule.id() == null || schedule.id().isBlank()) {
            throw new IllegalArgumentException("schedule id must not be blank");
        }
        this.nextRunAt = firstRunAt(Instant.now());
    }

    String id() {
        return schedule.id();
    }

    synchronized Instant nextRunAt() {
        return nextRunAt;
    }

    /**
     * Start the timer. Called once the job is visible in the registry.
     */
    synchronized void arm() {
        if (retired.get() || pending != null) {
            return;
        }
        schedulePending();
    }

    @Override
    public boolean runNow(Runnable onAccepted) {
        if (retired.get()) {
            return false;
        }
        if (!executing.compareAndSet(false, true)) {
            log.warn("Job already running, manual run skipped id={}", schedule.id());
            return false;
        }
        try {
            onAccepted.run();
            timer.execute(this::executeClaimed);
        } catch (RuntimeException e) {
            executing.set(false);
            throw e;
        }
        return true;
    }

    @Override
    public void retire() {
        if (!retired.compareAndSet(false, true)) {
            return;
        }
        synchronized (this) {
            if (pending != null) {
                pending.cancel(false);
                pending = null;
            }
            nextRunAt = null;
        }
        log.debug("Retired job task id={}", schedule.id());
    }

    @Override
    public boolean isExecuting() {
        return executing.get();
    }

    private Instant firstRunAt(Instant from) {
        if (schedule.isManualOnly()) {
            return ZonedDateTime.ofInstant(from, zone).plusYears(PLACEHOLDER_YEARS).toInstant();
        }
        return CronExpressions.nextRunAt(schedule.cron(), zone, from);
    }

    // caller holds the monitor
    private void schedulePending() {
        long delay = Math.max(0L, Duration.between(Instant.now(), nextRunAt).toMillis());
        try {
            pending = timer.schedule(this::onTimer, delay, TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            log.debug("Timer shut down, job not re-armed id={}", schedule.id());
            pending = null;
        }
    }

    private void onTimer() {
        if (retired.get()) {
            return;
        }
        if (executing.compareAndSet(false, true)) {
            executeClaimed();
        } else {
            log.warn("Job still running, timer fire skipped id={}", schedule.id());
        }

        synchronized (this) {
            if (retired.get()) {
                return;
            }
            if (schedule.isManualOnly()) {
                pending = null;
                nextRunAt = null;
                return;
            }
            try {
                nextRunAt = CronExpressions.nextRunAt(schedule.cron(), zone, Instant.now());
            } catch (IllegalArgumentException e) {
                log.warn("Cron produced no further run, job disarmed id={} cron={}", schedule.id(), schedule.cron());
                pending = null;
                nextRunAt = null;
                return;
            }
            schedulePending();
        }
    }

    private void executeClaimed() {
        try {
            body.accept(schedule);
        } finally {
            executing.set(false);
        }
    }
}
