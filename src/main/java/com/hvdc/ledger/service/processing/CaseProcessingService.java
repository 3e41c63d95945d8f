package com.hvdc.ledger.service.processing;

import com.hvdc.ledger.model.CaseRecord;
import com.hvdc.ledger.model.CaseTimeline;
import com.hvdc.ledger.model.FailedCase;
import com.hvdc.ledger.service.extraction.EventExtractor;
import com.hvdc.ledger.service.extraction.ExtractedEvents;
import com.hvdc.ledger.service.schema.ColumnSchema;
import com.hvdc.ledger.service.timeline.TransitionClassifier;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Semaphore;

/**
 * Runs event extraction and transition classification for every case in parallel.
 *
 * Cases share no mutable state, so each one is an independent task. A failing case
 * becomes a {@link FailedCase} and the rest of the batch carries on. Results come back
 * in input order regardless of completion order.
 */
@Service
@Slf4j
public class CaseProcessingService {

    private final EventExtractor eventExtractor;
    private final TransitionClassifier transitionClassifier;
    private final Semaphore processingSemaphore;

    public CaseProcessingService(
            EventExtractor eventExtractor,
            TransitionClassifier transitionClassifier,
            @Value("${app.executor.processing-concurrency:64}") int processingConcurrency) {
        this.eventExtractor = eventExtractor;
        this.transitionClassifier = transitionClassifier;
        this.processingSemaphore = new Semaphore(processingConcurrency);
        log.info("CaseProcessingService initialized with concurrency limit: {}", processingConcurrency);
    }

    /**
     * Classify all cases.
     *
     * @param cases    case rows of one snapshot
     * @param schema   resolved column roles
     * @param executor executor for the per-case tasks
     */
    public ProcessingOutput process(List<CaseRecord> cases, ColumnSchema schema, ExecutorService executor) {
        if (cases.isEmpty()) {
            return new ProcessingOutput(List.of(), List.of());
        }

        log.info("Classifying {} cases in PARALLEL (max {} concurrent)...",
                cases.size(), processingSemaphore.availablePermits());

        List<CompletableFuture<CaseOutcome>> futures = cases.stream()
                .map(record -> CompletableFuture.supplyAsync(() -> processWithSemaphore(record, schema), executor))
                .toList();

        CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();

        List<CaseTimeline> timelines = new ArrayList<>(cases.size());
        List<FailedCase> failures = new ArrayList<>();
        for (CompletableFuture<CaseOutcome> future : futures) {
            CaseOutcome outcome = future.join();
            if (outcome.timeline() != null) {
                timelines.add(outcome.timeline());
            } else {
                failures.add(outcome.failure());
            }
        }

        log.info("Classification complete: {} timelines, {} failures", timelines.size(), failures.size());
        return new ProcessingOutput(List.copyOf(timelines), List.copyOf(failures));
    }

    private CaseOutcome processWithSemaphore(CaseRecord record, ColumnSchema schema) {
        try {
            processingSemaphore.acquire();
            try {
                return new CaseOutcome(processCase(record, schema), null);
            } finally {
                processingSemaphore.release();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Processing interrupted for case {}", record.caseId());
            return new CaseOutcome(null, new FailedCase(record.caseId(), "Processing interrupted", "InterruptedException"));
        } catch (Exception e) {
            log.warn("Failed to process case {}: {}", record.caseId(), e.getMessage());
            return new CaseOutcome(null, new FailedCase(record.caseId(), e.getMessage(), e.getClass().getSimpleName()));
        }
    }

    /**
     * Pure per-case work: extract, then fold.
     */
    CaseTimeline processCase(CaseRecord record, ColumnSchema schema) {
        ExtractedEvents extracted = eventExtractor.extract(record, schema);
        if (extracted.isEmpty()) {
            log.debug("Case {} has no location events", record.caseId());
        }
        return transitionClassifier.classify(record, extracted);
    }

    private record CaseOutcome(CaseTimeline timeline, FailedCase failure) {}

    /**
     * Timelines in input order plus the cases that could not be processed.
     */
    public record ProcessingOutput(
            List<CaseTimeline> timelines,
            List<FailedCase> failures
    ) {}
}
