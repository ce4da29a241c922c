package statemigrator.state;

import statemigrator.pipeline.OutcomeStatus;
import statemigrator.pipeline.RepositoryOutcome;
import statemigrator.pipeline.RepositoryTarget;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Thread-safe progress of one batch.
 *
 * <p>Tracks which repositories are in flight, how many finished per status, and the
 * highest number of pipelines that were running at the same time. One instance per
 * batch; workers update it, the CLI and tests read it.
 */
public final class BatchProgress {

    private final ReadWriteLock lock = new ReentrantReadWriteLock();

    private final int total;
    private final Instant startTime = Instant.now();
    private final Set<String> active = new LinkedHashSet<>();
    private final Map<OutcomeStatus, Integer> finished = new EnumMap<>(OutcomeStatus.class);
    private int peakActive;

    public BatchProgress(int total) {
        this.total = total;
    }

    /**
     * Marks a pipeline as started.
     *
     * @param target the repository
     */
    public void pipelineStarted(RepositoryTarget target) {
        lock.writeLock().lock();
        try {
            active.add(target.fullName());
            peakActive = Math.max(peakActive, active.size());
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Marks a pipeline as finished with the given outcome.
     *
     * @param outcome the terminal outcome
     */
    public void pipelineFinished(RepositoryOutcome outcome) {
        lock.writeLock().lock();
        try {
            active.remove(outcome.target().fullName());
            finished.merge(outcome.status(), 1, Integer::sum);
        } finally {
            lock.writeLock().unlock();
        }
    }

    public int total() {
        return total;
    }

    /** Number of pipelines currently running. */
    public int activeCount() {
        lock.readLock().lock();
        try {
            return active.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    /** Names of the repositories currently running. */
    public List<String> activeRepositories() {
        lock.readLock().lock();
        try {
            return Collections.unmodifiableList(new ArrayList<>(active));
        } finally {
            lock.readLock().unlock();
        }
    }

    /** Highest number of simultaneously running pipelines so far. */
    public int peakActive() {
        lock.readLock().lock();
        try {
            return peakActive;
        } finally {
            lock.readLock().unlock();
        }
    }

    /** Number of pipelines that reached a terminal state. */
    public int completedCount() {
        lock.readLock().lock();
        try {
            return finished.values().stream().mapToInt(Integer::intValue).sum();
        } finally {
            lock.readLock().unlock();
        }
    }

    public int count(OutcomeStatus status) {
        lock.readLock().lock();
        try {
            return finished.getOrDefault(status, 0);
        } finally {
            lock.readLock().unlock();
        }
    }

    public Duration elapsed() {
        return Duration.between(startTime, Instant.now());
    }
}
