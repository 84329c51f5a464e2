package com.di.healthnova.ingest;

import org.springframework.stereotype.Component;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * In-memory job repository. Suitable for single-node and testing.
 */
@Component
public class InMemoryIngestionJobRepository implements IngestionJobRepository {

    private final Map<String, IngestionJob> jobsById = new ConcurrentHashMap<>();

    @Override
    public void save(IngestionJob job) {
        if (job == null || job.getJobId() == null) return;
        jobsById.put(job.getJobId(), job);
    }

    @Override
    public Optional<IngestionJob> findById(String jobId) {
        return jobId == null ? Optional.empty() : Optional.ofNullable(jobsById.get(jobId));
    }

    @Override
    public List<IngestionJob> findByUser(String userId) {
        return jobsById.values().stream()
                .filter(job -> job.getUserId().equals(userId))
                .sorted(Comparator.comparing(IngestionJob::getCreatedAt).reversed())
                .collect(Collectors.toList());
    }
}
