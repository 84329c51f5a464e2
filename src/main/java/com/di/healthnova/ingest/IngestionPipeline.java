package com.di.healthnova.ingest;

import com.di.healthnova.config.HealthNovaProperties;
import com.di.healthnova.exception.ErrorCategory;
import com.di.healthnova.exception.SchemaMismatchException;
import com.di.healthnova.exception.UnitConversionException;
import com.di.healthnova.handler.AdapterParseResult;
import com.di.healthnova.handler.ProviderAdapter;
import com.di.healthnova.handler.ProviderAdapterRegistry;
import com.di.healthnova.mapping.CanonicalizationMapper;
import com.di.healthnova.mapping.MappingContext;
import com.di.healthnova.model.CanonicalMetricRecord;
import com.di.healthnova.model.PartialIngestionWarning;
import com.di.healthnova.model.RawFile;
import com.di.healthnova.model.RawRecord;
import com.di.healthnova.model.RecordKey;
import com.di.healthnova.profile.UserProfileProvider;
import com.di.healthnova.store.TimeSeriesStore;
import com.di.healthnova.util.IngestionMetrics;
import com.di.healthnova.util.MdcPropagation;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.DateTimeException;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Orchestrates one ingestion job: adapter selection and parsing, canonicalization, upsert.
 *
 * <p>Record-level problems (malformed rows, unknown units, implausible values) are counted and skipped.
 * File-level and storage problems fail the job; the returned result says whether a retry may help.
 * A job that persisted at least one record is Completed. Stateless apart from the job repository, so
 * jobs for different users and for different files of the same user run concurrently.
 */
@Slf4j
@Service
public class IngestionPipeline implements IngestionJobContract {

    private final ProviderAdapterRegistry adapterRegistry;
    private final CanonicalizationMapper mapper;
    private final TimeSeriesStore store;
    private final IngestionJobRepository jobRepository;
    private final RawFileResolver rawFileResolver;
    private final UserProfileProvider profiles;
    private final IngestionMetrics metrics;
    private final BackoffPolicy backoffPolicy;
    private final Clock clock;
    private final int maxRecordedWarnings;

    public IngestionPipeline(ProviderAdapterRegistry adapterRegistry,
                             CanonicalizationMapper mapper,
                             TimeSeriesStore store,
                             IngestionJobRepository jobRepository,
                             RawFileResolver rawFileResolver,
                             UserProfileProvider profiles,
                             IngestionMetrics metrics,
                             BackoffPolicy backoffPolicy,
                             Clock clock,
                             HealthNovaProperties properties) {
        this.adapterRegistry = adapterRegistry;
        this.mapper = mapper;
        this.store = store;
        this.jobRepository = jobRepository;
        this.rawFileResolver = rawFileResolver;
        this.profiles = profiles;
        this.metrics = metrics;
        this.backoffPolicy = backoffPolicy;
        this.clock = clock;
        this.maxRecordedWarnings = Math.max(0, properties.getIngestion().getMaxRecordedWarnings());
    }

    @Override
    public IngestionJob enqueue(IngestionJobRequest request) {
        String jobId = request.jobId() != null && !request.jobId().isBlank() ? request.jobId().trim() : UUID.randomUUID().toString();
        if (jobRepository.findById(jobId).isPresent()) {
            throw new IllegalArgumentException("Job id already in use: " + jobId);
        }
        IngestionJob job = new IngestionJob(jobId, request.userId().trim(), request.rawFileRef().trim(),
                request.declaredProvider(), parseOffset(request.declaredUtcOffset()), clock.instant());
        jobRepository.save(job);
        log.info("[INGEST] job={} queued: user={}, file={}, provider={}", jobId, job.getUserId(), job.getRawFileRef(),
                job.getDeclaredProvider() == null ? "(detect)" : job.getDeclaredProvider());
        return job;
    }

    @Override
    public IngestionJobResult execute(String jobId) {
        IngestionJob job = jobRepository.findById(jobId)
                .orElseThrow(() -> new IllegalArgumentException("Unknown ingestion job: " + jobId));
        if (job.getState() == JobState.COMPLETED) {
            log.info("[INGEST] job={} already completed; returning its result", jobId);
            return job.getResult();
        }
        if (job.getState() == JobState.FAILED) {
            job.transitionTo(JobState.QUEUED, clock.instant());
            log.info("[INGEST] job={} requeued for attempt {}", jobId, job.getAttempts() + 1);
        }
        try (MDC.MDCCloseable j = MDC.putCloseable(MdcPropagation.JOB_ID, jobId);
             MDC.MDCCloseable u = MDC.putCloseable(MdcPropagation.USER_ID, job.getUserId())) {
            return run(job);
        }
    }

    @Override
    public Optional<IngestionJobResult> report(String jobId) {
        return jobRepository.findById(jobId).map(IngestionJob::getResult);
    }

    private IngestionJobResult run(IngestionJob job) {
        Instant started = clock.instant();
        RunCounters counters = new RunCounters();
        String fileHash = null;
        job.transitionTo(JobState.PARSING, clock.instant());
        try {
            RawFile rawFile = rawFileResolver.resolve(job.getRawFileRef());
            fileHash = rawFile.sha256();
            ProviderAdapter adapter = adapterRegistry.resolve(job.getDeclaredProvider(), rawFile.getFileName());
            job.setProvider(adapter.provider());
            AdapterParseResult parsed = adapter.parse(rawFile);
            counters.skippedRows = parsed.skippedCount();
            parsed.getSkipped().forEach(counters::warn);
            log.info("[INGEST] job={} parsed {} raw record(s) with {} ({} row(s) skipped)",
                    job.getJobId(), parsed.getRecords().size(), adapter.provider(), counters.skippedRows);

            job.transitionTo(JobState.CANONICALIZING, clock.instant());
            MappingContext context = new MappingContext(job.getUserId(), job.getDeclaredOffset(),
                    profiles.zoneFor(job.getUserId()), fileHash);
            Map<RecordKey, CanonicalMetricRecord> canonical = canonicalize(parsed.getRecords(), context, counters);

            job.transitionTo(JobState.PERSISTING, clock.instant());
            counters.persisted = canonical.isEmpty() ? 0 : store.upsertAll(canonical.values());

            if (counters.persisted == 0) {
                String message = String.format("No records persisted (%d warning(s), %d unmapped field(s))",
                        counters.warningCount, counters.unmapped);
                return finishFailed(job, ErrorCategory.VALIDATION_ERROR, message, counters, fileHash, started);
            }
            job.transitionTo(JobState.COMPLETED, clock.instant());
            IngestionJobResult result = buildResult(job, counters, fileHash, null, false);
            job.setResult(result);
            log.info("[INGEST] job={} COMPLETED: persisted={}, warnings={}, unmapped={}", job.getJobId(),
                    counters.persisted, counters.warningCount, counters.unmapped);
            metrics.recordJob(JobState.COMPLETED.name(), null, counters.persisted, counters.warningCount,
                    counters.unmapped, Duration.between(started, clock.instant()));
            return result;
        } catch (RuntimeException e) {
            ErrorCategory category = ErrorCategory.categorize(e);
            return finishFailed(job, category, category + ": " + e.getMessage(), counters, fileHash, started);
        }
    }

    private Map<RecordKey, CanonicalMetricRecord> canonicalize(List<RawRecord> records, MappingContext context,
                                                               RunCounters counters) {
        // Same key twice in one file: the later record wins, as a re-ingestion would.
        Map<RecordKey, CanonicalMetricRecord> byKey = new LinkedHashMap<>();
        for (RawRecord raw : records) {
            try {
                CanonicalMetricRecord record = mapper.map(raw, context);
                if (record == null) {
                    counters.unmapped++;
                    continue;
                }
                byKey.put(record.key(), record);
            } catch (SchemaMismatchException | UnitConversionException e) {
                ErrorCategory category = ErrorCategory.categorize(e);
                log.warn("[INGEST] skipping {} record #{} ({}): {}", raw.provider(), raw.position(), category, e.getMessage());
                counters.warn(new PartialIngestionWarning(raw.position(), category, raw.fieldName() + ": " + e.getMessage()));
            }
        }
        return byKey;
    }

    private IngestionJobResult finishFailed(IngestionJob job, ErrorCategory category, String message,
                                            RunCounters counters, String fileHash, Instant started) {
        job.fail(category, message, clock.instant());
        boolean retryable = backoffPolicy.nextDelay(job.getAttempts(), category).isPresent();
        counters.persisted = 0;
        IngestionJobResult result = buildResult(job, counters, fileHash, category, retryable);
        job.setResult(result);
        log.error("[INGEST] job={} FAILED on attempt {} [{}] retryable={}: {}", job.getJobId(), job.getAttempts(),
                category, retryable, message);
        metrics.recordJob(JobState.FAILED.name(), category, 0, counters.warningCount, counters.unmapped,
                Duration.between(started, clock.instant()));
        return result;
    }

    private IngestionJobResult buildResult(IngestionJob job, RunCounters counters, String fileHash,
                                           ErrorCategory category, boolean retryable) {
        return IngestionJobResult.builder()
                .jobId(job.getJobId())
                .finalState(job.getState())
                .persistedCount(counters.persisted)
                .warningCount(counters.warningCount)
                .unmappedCount(counters.unmapped)
                .skippedRows(counters.skippedRows)
                .errorLog(job.getErrorLog())
                .errorCategory(category)
                .retryable(retryable)
                .attempts(job.getAttempts())
                .warnings(List.copyOf(counters.warnings))
                .provider(job.getProvider())
                .sourceFileHash(fileHash)
                .mappingVersion(mapper.getTableVersion())
                .build();
    }

    private static ZoneOffset parseOffset(String offset) {
        if (offset == null || offset.isBlank()) {
            return null;
        }
        try {
            return ZoneOffset.of(offset.trim());
        } catch (DateTimeException e) {
            throw new IllegalArgumentException("Invalid UTC offset '" + offset + "'", e);
        }
    }

    /** Per-run tallies; confined to the executing thread. */
    private final class RunCounters {
        int persisted;
        int warningCount;
        int unmapped;
        int skippedRows;
        final List<PartialIngestionWarning> warnings = new ArrayList<>();

        void warn(PartialIngestionWarning warning) {
            warningCount++;
            if (warnings.size() < maxRecordedWarnings) {
                warnings.add(warning);
            }
        }
    }
}
