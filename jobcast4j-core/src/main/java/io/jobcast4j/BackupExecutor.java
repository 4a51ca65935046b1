package io.jobcast4j;

import io.jobcast4j.core.CancellationToken;
import io.jobcast4j.core.Schedule;

/**
 * Runs the backup/restore operation a schedule points at, usually by invoking an external tool.
 */
public interface BackupExecutor {

    /**
     * @param schedule     schedule being run
     * @param cancellation advisory stop signal; honoring it is up to the implementation
     * @return tool output
     * @throws Exception the failure reported as the job's last error
     */
    String execute(Schedule schedule, CancellationToken cancellation) throws Exception;
}
