package io.jobcast4j.internal;

import io.jobcast4j.BackupExecutor;
import io.jobcast4j.JobScheduler;
import io.jobcast4j.config.JobcastProperties;
import io.jobcast4j.core.CancellationToken;
import io.jobcast4j.core.Job;
import io.jobcast4j.core.JobRegistry;
import io.jobcast4j.core.Schedule;
import io.jobcast4j.core.TaskHandle;
import io.jobcast4j.core.event.JobFinishedError;
import io.jobcast4j.core.event.JobFinishedOk;
import io.jobcast4j.core.event.JobStarted;
import io.jobcast4j.core.event.JobStopped;
import io.jobcast4j.core.event.StatusEventChannel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * JobScheduler backed by an in-process timer pool.
 *
 * <p>Core capabilities:
 * <ul>
 *   <li>Cron-driven jobs (5- or 6-field expressions)</li>
 *   <li>Manual-only jobs for schedules without a cron expression</li>
 *   <li>Manual run/stop by job id</li>
 *   <li>Whole-generation rebuilds while jobs are running</li>
 * </ul>
 *
 * <p>Typical usage:
 * <pre>{@code
 * scheduler.start();
 * scheduler.rebuildSchedule(List.of(new Schedule("nightly", "0 2 * * *", "home", "nas", null)));
 * scheduler.runJobById("nightly");
 * scheduler.stop();
 * }</pre>
 */
public class TimerJobScheduler implements JobScheduler {
    private static final Logger log = LoggerFactory.getLogger(TimerJobScheduler.class);

    private final JobcastProperties props;
    private final BackupExecutor executor;
    private final JobRegistry registry;
    private final StatusEventChannel channel;

    private final AtomicBoolean started = new AtomicBoolean(false);
    private final Object rebuildLock = new Object();

    private ScheduledExecutorService timer;
    private ZoneId zone;
    private volatile List<Schedule> schedules = List.of();

    public TimerJobScheduler(JobcastProperties props, BackupExecutor executor, JobRegistry registry, StatusEventChannel channel) {
        this.props = Objects.requireNonNull(props, "props must not be null");
        this.executor = Objects.requireNonNull(executor, "executor must not be null");
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
        this.channel = Objects.requireNonNull(channel, "channel must not be null");
    }

    /**
     * Start the timer pool and materialize the current schedule generation. Idempotent.
     */
    @Override
    public void start() {
        if (props.getPoolSize() <= 0) {
            throw new IllegalArgumentException("jobcast.poolSize must be a positive number");
        }
        ZoneId resolved = resolveZone(props.getTimezone());

        synchronized (rebuildLock) {
            if (!started.compareAndSet(false, true)) {
                return;
            }
            zone = resolved;
            AtomicInteger seq = new AtomicInteger();
            timer = Executors.newScheduledThreadPool(props.getPoolSize(), r -> {
                Thread t = new Thread(r);
                t.setName("jobcast.timer-" + seq.incrementAndGet());
                t.setDaemon(true);
                return t;
            });
            log.info("Job scheduler starting with poolSize={}, timezone={}, schedules={}",
                    props.getPoolSize(), zone, schedules.size());
            materialize(schedules);
        }
        log.info("Job scheduler started successfully.");
    }

    /**
     * Retire every timer and shut the pool down, waiting up to the shutdown timeout for running jobs.
     * Idempotent.
     */
    @Override
    public void stop() {
        ScheduledExecutorService pool;
        synchronized (rebuildLock) {
            if (!started.compareAndSet(true, false)) {
                return;
            }
            log.info("Job scheduler stopping...");
            registry.tasks().forEach(TaskHandle::retire);
            pool = timer;
            timer = null;
        }

        pool.shutdown();
        try {
            Duration wait = props.getShutdownTimeout();
            if (!pool.awaitTermination(wait.toMillis(), TimeUnit.MILLISECONDS)) {
                registry.runningJobs().forEach(j -> registry.cancellation(j.id()).ifPresent(CancellationToken::cancel));
                pool.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            pool.shutdownNow();
        }
        log.info("Job scheduler stopped successfully.");
    }

    @Override
    public void rebuildSchedule(List<Schedule> schedules) {
        Objects.requireNonNull(schedules, "schedules must not be null");
        synchronized (rebuildLock) {
            this.schedules = List.copyOf(schedules);
            if (!started.get()) {
                log.info("Schedule generation stored until start count={}", schedules.size());
                return;
            }
            materialize(this.schedules);
        }
    }

    // caller holds rebuildLock and the scheduler is started
    private void materialize(List<Schedule> generation) {
        log.info("Rescheduling jobs count={}", generation.size());

        List<JobRegistry.Binding> bindings = new ArrayList<>();
        List<ScheduledJobTask> tasks = new ArrayList<>();
        List<String> seen = new ArrayList<>();
        for (Schedule schedule : generation) {
            if (schedule == null) {
                log.error("Error creating job msg=schedule is null");
                continue;
            }
            if (seen.contains(schedule.id())) {
                log.error("Error creating job id={} msg=duplicate schedule id", schedule.id());
                continue;
            }
            try {
                ScheduledJobTask task = new ScheduledJobTask(schedule, timer, zone, this::runJob);
                bindings.add(new JobRegistry.Binding(schedule, task));
                tasks.add(task);
                seen.add(schedule.id());
            } catch (RuntimeException e) {
                log.error("Error creating job id={} cron={} msg={}", schedule.id(), schedule.cron(), e.getMessage(), e);
            }
        }

        registry.tasks().forEach(TaskHandle::retire);
        JobRegistry.Replacement replacement = registry.replace(bindings);

        for (String id : replacement.migrated()) {
            log.info("In-flight job carried into new generation id={}", id);
        }
        if (!replacement.orphaned().isEmpty()) {
            log.info("Cancelling in-flight jobs removed by rebuild count={}", replacement.orphaned().size());
            replacement.orphaned().forEach(CancellationToken::cancel);
        }

        for (ScheduledJobTask task : tasks) {
            task.arm();
            log.debug("Job scheduled id={} nextRunAt={}", task.id(), task.nextRunAt());
        }
    }

    @Override
    public void runJobById(String id) {
        Optional<TaskHandle> task = registry.task(id);
        if (task.isEmpty()) {
            log.debug("Manual run ignored, unknown job id={}", id);
            return;
        }
        log.info("Running job manually id={}", id);
        try {
            task.get().runNow(() -> registry.markForced(id));
        } catch (RuntimeException e) {
            log.error("Error running job manually id={} msg={}", id, e.getMessage(), e);
        }
    }

    @Override
    public void stopJobById(String id) {
        Optional<CancellationToken> token = registry.runningCancellation(id);
        if (token.isEmpty()) {
            log.debug("Stop ignored, job not running id={}", id);
            return;
        }
        log.info("Stopping job id={}", id);
        channel.publish(new JobStopped(id, Instant.now()));
        token.get().cancel();
    }

    @Override
    public Optional<Job> findById(String id) {
        return registry.findById(id);
    }

    @Override
    public List<Job> runningJobs() {
        return registry.runningJobs();
    }

    @Override
    public List<Job> jobs() {
        return registry.jobs();
    }

    @Override
    public List<Schedule> schedules() {
        return schedules;
    }

    private void runJob(Schedule schedule) {
        String id = schedule.id();
        // a run carried over from the previous generation still owns this id
        if (registry.findById(id).map(Job::running).orElse(false)) {
            log.warn("Job still running from previous generation, run skipped id={}", id);
            return;
        }
        beforeRun(id);

        CancellationToken token = registry.cancellation(id).orElseGet(CancellationToken::new);
        try {
            String output = executor.execute(schedule, token);
            log.debug("Job output id={} bytes={}", id, output == null ? 0 : output.length());
            afterRunSuccess(id);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            afterRunError(id, errorText(e));
        } catch (Exception e) {
            log.error("Job failed id={} msg={}", id, e.getMessage(), e);
            afterRunError(id, errorText(e));
        }
    }

    private void beforeRun(String id) {
        channel.publish(new JobStarted(id, Instant.now()));
        log.debug("before job run id={}", id);
        registry.markRunning(id);
    }

    private void afterRunSuccess(String id) {
        Instant now = Instant.now();
        channel.publish(new JobFinishedOk(id, now));
        log.debug("after job run res=success id={}", id);
        registry.finish(id, "", now);
    }

    private void afterRunError(String id, String error) {
        Instant now = Instant.now();
        channel.publish(new JobFinishedOk(id, now));
        channel.publish(new JobFinishedError(id, error, now));
        log.debug("after job run res=error id={} err={}", id, error);
        registry.finish(id, error, now);
    }

    private static String errorText(Exception e) {
        String msg = e.getMessage();
        return (msg == null || msg.isBlank()) ? e.getClass().getSimpleName() : msg;
    }

    private static ZoneId resolveZone(String timezone) {
        if (timezone == null || timezone.isBlank()) {
            return ZoneId.systemDefault();
        }
        try {
            return ZoneId.of(timezone);
        } catch (Exception e) {
            throw new IllegalArgumentException("jobcast.timezone is not a valid zone id: " + timezone, e);
        }
    }
}
