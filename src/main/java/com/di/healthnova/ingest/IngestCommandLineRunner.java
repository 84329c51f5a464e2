package com.di.healthnova.ingest;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Ingests one export file at startup when started with {@code --ingest.file=<path>}.
 * Optional: {@code --ingest.user=<id>} (default "default"), {@code --ingest.provider=<name>} (detected from the
 * file name when absent), {@code --ingest.offset=<+hh:mm>}.
 */
@Component
@Order(2)
@RequiredArgsConstructor
@Slf4j
public class IngestCommandLineRunner implements ApplicationRunner {

    static final String FILE = "ingest.file";
    static final String USER = "ingest.user";
    static final String PROVIDER = "ingest.provider";
    static final String OFFSET = "ingest.offset";

    private final IngestionWorker worker;

    @Override
    public void run(ApplicationArguments args) {
        String file = option(args, FILE);
        if (file == null) {
            return;
        }
        String user = option(args, USER);
        IngestionJobRequest request = new IngestionJobRequest(null, user == null ? "default" : user, file,
                option(args, PROVIDER), option(args, OFFSET));
        log.info("[INGEST-CLI] Ingesting {} for user {}", file, request.userId());
        IngestionJobResult result = worker.runNow(request);
        log.info("[INGEST-CLI] {} -> {}: persisted={}, warnings={}, unmapped={}, skippedRows={}", file,
                result.getFinalState(), result.getPersistedCount(), result.getWarningCount(),
                result.getUnmappedCount(), result.getSkippedRows());
        result.getWarnings().forEach(w -> log.info("[INGEST-CLI]   {}", w));
        result.getErrorLog().forEach(e -> log.error("[INGEST-CLI]   {}", e));
    }

    private static String option(ApplicationArguments args, String name) {
        List<String> values = args.getOptionValues(name);
        if (values == null || values.isEmpty() || values.get(0).isBlank()) {
            return null;
        }
        return values.get(0).trim();
    }
}
