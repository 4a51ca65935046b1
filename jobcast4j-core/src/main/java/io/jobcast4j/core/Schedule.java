package io.jobcast4j.core;

/**
 * Recurring job definition supplied by configuration.
 *
 * <p>Treated as immutable input for one scheduling generation. The backup/repository identifiers are
 * opaque to the scheduler and only handed to the {@link io.jobcast4j.BackupExecutor}.
 *
 * @param id               unique schedule id, also the id of the job built from it
 * @param cron             cron expression; blank means a one-shot job that only runs when triggered manually
 * @param backupId         backup definition to run (nullable)
 * @param toRepositoryId   target repository (nullable)
 * @param fromRepositoryId source repository for repository-to-repository copies (nullable)
 */
public record Schedule(
        String id,
        String cron,
        String backupId,
        String toRepositoryId,
        String fromRepositoryId
) {

    public boolean isManualOnly() {
        return cron == null || cron.isBlank();
    }
}
