package io.jobcast4j.core.event;

import java.time.Instant;

/**
 * Job lifecycle transition reported by the scheduler.
 *
 * <p>Implementations: {@link JobStarted}, {@link JobFinishedOk}, {@link JobStopped} (output channel)
 * and {@link JobFinishedError} (error channel).
 */
public interface StatusEvent {
    String id();

    Instant time();

    StatusChannel channel();
}
