package io.jobcast4j.core;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Lock-protected, ordered collection of job runtime records, one per schedule id.
 *
 * <p>Every read and mutation takes the same exclusive lock, and the lock is only held for in-memory
 * field updates. Reads return {@link Job} snapshots; the live records never leave this class.
 * Operations on an unknown id are no-ops and report {@code false} / empty.
 */
public class JobRegistry {
    private static final Logger log = LoggerFactory.getLogger(JobRegistry.class);

    private final ReentrantLock lock = new ReentrantLock();
    private final Map<String, JobRecord> jobs = new LinkedHashMap<>();

    /**
     * A schedule paired with the timer task built for it.
     */
    public record Binding(Schedule schedule, TaskHandle task) {
        public Binding {
            Objects.requireNonNull(schedule, "schedule must not be null");
            Objects.requireNonNull(task, "task must not be null");
        }
    }

    /**
     * Outcome of {@link #replace(List)}.
     *
     * @param migrated ids whose in-flight run was carried over into the new generation
     * @param orphaned cancellation tokens of in-flight runs whose id is gone from the new generation
     */
    public record Replacement(List<String> migrated, List<CancellationToken> orphaned) {
    }

    private static final class JobRecord {
        private final Schedule schedule;
        private final TaskHandle task;
        private boolean running;
        private boolean forced;
        private CancellationToken cancellation = new CancellationToken();
        private String lastError;
        private Instant lastRunAt;

        private JobRecord(Schedule schedule, TaskHandle task) {
            this.schedule = schedule;
            this.task = task;
        }

        private Job snapshot() {
            return new Job(schedule.id(), schedule, running, forced, lastError, lastRunAt);
        }
    }

    /**
     * Swap the whole generation. Ids present in both generations keep their last-run outcome; if such a job
     * is mid-run, its running/forced flags and live cancellation token move to the new record so the run
     * can still be stopped and its after-run hook settles the new record.
     *
     * @throws IllegalArgumentException if two bindings share an id
     */
    public Replacement replace(List<Binding> bindings) {
        Objects.requireNonNull(bindings, "bindings must not be null");
        Map<String, JobRecord> next = new LinkedHashMap<>();
        for (Binding b : bindings) {
            if (next.putIfAbsent(b.schedule().id(), new JobRecord(b.schedule(), b.task())) != null) {
                throw new IllegalArgumentException("Duplicate job id: " + b.schedule().id());
            }
        }

        List<String> migrated = new ArrayList<>();
        List<CancellationToken> orphaned = new ArrayList<>();

        lock.lock();
        try {
            for (var e : jobs.entrySet()) {
                JobRecord old = e.getValue();
                JobRecord fresh = next.get(e.getKey());
                if (fresh == null) {
                    if (old.running) {
                        orphaned.add(old.cancellation);
                    }
                    continue;
                }
                fresh.lastError = old.lastError;
                fresh.lastRunAt = old.lastRunAt;
                if (old.running) {
                    fresh.running = true;
                    fresh.forced = old.forced;
                    fresh.cancellation = old.cancellation;
                    migrated.add(e.getKey());
                }
            }
            jobs.clear();
            jobs.putAll(next);
        } finally {
            lock.unlock();
        }

        return new Replacement(List.copyOf(migrated), List.copyOf(orphaned));
    }

    public Optional<Job> findById(String id) {
        lock.lock();
        try {
            JobRecord r = jobs.get(id);
            return r == null ? Optional.empty() : Optional.of(r.snapshot());
        } finally {
            lock.unlock();
        }
    }

    public Optional<TaskHandle> task(String id) {
        lock.lock();
        try {
            JobRecord r = jobs.get(id);
            return r == null ? Optional.empty() : Optional.of(r.task);
        } finally {
            lock.unlock();
        }
    }

    public List<TaskHandle> tasks() {
        lock.lock();
        try {
            List<TaskHandle> out = new ArrayList<>(jobs.size());
            for (JobRecord r : jobs.values()) {
                out.add(r.task);
            }
            return out;
        } finally {
            lock.unlock();
        }
    }

    public boolean markRunning(String id) {
        lock.lock();
        try {
            JobRecord r = jobs.get(id);
            if (r == null) {
                return false;
            }
            r.running = true;
            return true;
        } finally {
            lock.unlock();
        }
    }

    public boolean markForced(String id) {
        lock.lock();
        try {
            JobRecord r = jobs.get(id);
            if (r == null) {
                return false;
            }
            r.forced = true;
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Flip the job back to idle: clears both {@code running} and {@code forced}.
     */
    public boolean clearRunning(String id) {
        lock.lock();
        try {
            JobRecord r = jobs.get(id);
            if (r == null) {
                return false;
            }
            log.debug("Clearing running job id={}", id);
            r.running = false;
            r.forced = false;
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Replace the cancellation token after a run so a later stop always has an un-fired token.
     */
    public boolean recreateCancellation(String id) {
        lock.lock();
        try {
            JobRecord r = jobs.get(id);
            if (r == null) {
                return false;
            }
            log.debug("Recreating cancellation for job id={}", id);
            r.cancellation = new CancellationToken();
            return true;
        } finally {
            lock.unlock();
        }
    }

    public Optional<CancellationToken> cancellation(String id) {
        lock.lock();
        try {
            JobRecord r = jobs.get(id);
            return r == null ? Optional.empty() : Optional.of(r.cancellation);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Cancellation token of the job only while it is running; empty for idle or unknown jobs.
     */
    public Optional<CancellationToken> runningCancellation(String id) {
        lock.lock();
        try {
            JobRecord r = jobs.get(id);
            return (r == null || !r.running) ? Optional.empty() : Optional.of(r.cancellation);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Settle a completed run in one step: back to idle, fresh cancellation token, outcome recorded.
     * Readers see either the running job or the settled one, never a mix.
     *
     * @param error error text of the run, null or empty for success
     */
    public boolean finish(String id, String error, Instant finishedAt) {
        lock.lock();
        try {
            JobRecord r = jobs.get(id);
            if (r == null) {
                return false;
            }
            log.debug("Finishing job id={}", id);
            r.running = false;
            r.forced = false;
            r.cancellation = new CancellationToken();
            r.lastError = error == null ? "" : error;
            r.lastRunAt = finishedAt;
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Ids of the current generation, in schedule order.
     */
    public Set<String> ids() {
        lock.lock();
        try {
            return new LinkedHashSet<>(jobs.keySet());
        } finally {
            lock.unlock();
        }
    }

    public List<Job> runningJobs() {
        lock.lock();
        try {
            List<Job> out = new ArrayList<>();
            for (JobRecord r : jobs.values()) {
                if (r.running) {
                    out.add(r.snapshot());
                }
            }
            return out;
        } finally {
            lock.unlock();
        }
    }

    public List<Job> jobs() {
        lock.lock();
        try {
            List<Job> out = new ArrayList<>(jobs.size());
            for (JobRecord r : jobs.values()) {
                out.add(r.snapshot());
            }
            return out;
        } finally {
            lock.unlock();
        }
    }

    public int size() {
        lock.lock();
        try {
            return jobs.size();
        } finally {
            lock.unlock();
        }
    }
}
