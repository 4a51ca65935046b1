package io.jobcast4j;

import io.jobcast4j.core.Job;
import io.jobcast4j.core.Schedule;

import java.util.List;
import java.util.Optional;

/**
 * Main scheduler API.
 *
 * <p>Holds one generation of schedules at a time. Each schedule becomes a job driven by its cron
 * expression, or a manual-only job when the expression is blank. Lifecycle transitions are reported on
 * the {@link io.jobcast4j.core.event.StatusEventChannel} the scheduler was built with.
 */
public interface JobScheduler {
    void start();

    void stop();

    /**
     * Discard every job and timer and rebuild them from {@code schedules}.
     *
     * <p>A schedule whose task cannot be created is logged and skipped. Runs in flight keep running:
     * if their id survives they are carried into the new generation, otherwise they are cancelled
     * advisorily.
     */
    void rebuildSchedule(List<Schedule> schedules);

    /**
     * Run a job now, marking it as forced. Unknown ids and jobs already running are ignored.
     */
    void runJobById(String id);

    /**
     * Report a running job as stopped and signal its cancellation token. Idle or unknown jobs are ignored.
     */
    void stopJobById(String id);

    Optional<Job> findById(String id);

    List<Job> runningJobs();

    List<Job> jobs();

    /**
     * The schedules of the current generation, including ones that failed to materialize.
     */
    List<Schedule> schedules();
}
