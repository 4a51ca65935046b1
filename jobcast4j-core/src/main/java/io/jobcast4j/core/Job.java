package io.jobcast4j.core;

import java.time.Instant;

/**
 * Point-in-time copy of a job's runtime state, as returned by {@link JobRegistry} reads.
 *
 * <p>Mutating or discarding a snapshot has no effect on the registry.
 *
 * @param id        job id, equal to {@code schedule.id()}
 * @param schedule  schedule the job was built from
 * @param running   true between the before-run and after-run hooks of an invocation
 * @param forced    true when the current/next invocation was triggered manually
 * @param lastError error text of the last completed run; empty after a successful run, null if never run
 * @param lastRunAt completion time of the last run, null if never run
 */
public record Job(
        String id,
        Schedule schedule,
        boolean running,
        boolean forced,
        String lastError,
        Instant lastRunAt
) {
}
