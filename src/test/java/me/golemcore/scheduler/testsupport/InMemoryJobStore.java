package me.golemcore.scheduler.testsupport;

import me.golemcore.scheduler.domain.exception.StorageException;
import me.golemcore.scheduler.domain.model.Job;
import me.golemcore.scheduler.domain.model.JobStatus;
import me.golemcore.scheduler.port.outbound.JobStorePort;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.UnaryOperator;

/**
 * {@link JobStorePort} kept in memory, with switches to simulate storage
 * failures.
 */
public class InMemoryJobStore implements JobStorePort {

    private final Map<String, Job> jobs = new LinkedHashMap<>();
    private final AtomicInteger listDueFailures = new AtomicInteger();
    private final AtomicInteger modifyFailures = new AtomicInteger();
    private volatile String failingClaimJobId;

    public void failNextListDue() {
        listDueFailures.incrementAndGet();
    }

    public void failNextModifies(int count) {
        modifyFailures.set(count);
    }

    public void failClaimsOf(String jobId) {
        failingClaimJobId = jobId;
    }

    @Override
    public synchronized Optional<Job> get(String id) {
        return Optional.ofNullable(jobs.get(id)).map(InMemoryJobStore::copy);
    }

    @Override
    public synchronized Optional<Job> findByName(String name) {
        return jobs.values().stream()
                .filter(job -> Objects.equals(job.getName(), name))
                .findFirst()
                .map(InMemoryJobStore::copy);
    }

    @Override
    public synchronized List<Job> list() {
        return jobs.values().stream().map(InMemoryJobStore::copy).toList();
    }

    @Override
    public synchronized List<Job> listDue(Instant now) {
        if (listDueFailures.getAndUpdate(n -> Math.max(0, n - 1)) > 0) {
            throw new StorageException("Simulated listDue failure");
        }
        return jobs.values().stream()
                .filter(job -> job.isDueAt(now))
                .sorted(Comparator.comparing(Job::getNextRun))
                .map(InMemoryJobStore::copy)
                .toList();
    }

    @Override
    public synchronized Job create(Job job) {
        if (jobs.containsKey(job.getId())) {
            throw new IllegalStateException("Job already exists: " + job.getId());
        }
        jobs.put(job.getId(), copy(job));
        return copy(job);
    }

    @Override
    public synchronized Job update(Job job) {
        if (!jobs.containsKey(job.getId())) {
            throw new IllegalArgumentException("Job not found: " + job.getId());
        }
        jobs.put(job.getId(), copy(job));
        return copy(job);
    }

    @Override
    public synchronized Optional<Job> modify(String id, UnaryOperator<Job> change) {
        if (modifyFailures.getAndUpdate(n -> Math.max(0, n - 1)) > 0) {
            throw new StorageException("Simulated modify failure");
        }
        Job current = jobs.get(id);
        if (current == null) {
            return Optional.empty();
        }
        Job changed = change.apply(copy(current));
        jobs.put(id, copy(changed));
        return Optional.of(copy(changed));
    }

    @Override
    public synchronized boolean compareAndSetStatus(String id, JobStatus expected, JobStatus next, Instant updatedAt) {
        if (id.equals(failingClaimJobId)) {
            throw new StorageException("Simulated claim failure for " + id);
        }
        Job current = jobs.get(id);
        if (current == null || current.getStatus() != expected) {
            return false;
        }
        current.setStatus(next);
        current.setUpdatedAt(updatedAt);
        return true;
    }

    @Override
    public synchronized boolean delete(String id) {
        return jobs.remove(id) != null;
    }

    private static Job copy(Job job) {
        return job.toBuilder()
                .params(job.getParams() != null ? new LinkedHashMap<>(job.getParams()) : new LinkedHashMap<>())
                .options(job.getOptions() != null
                        ? job.getOptions().toBuilder()
                                .dependencies(new ArrayList<>(job.getOptions().getDependencies()))
                                .build()
                        : null)
                .build();
    }
}
