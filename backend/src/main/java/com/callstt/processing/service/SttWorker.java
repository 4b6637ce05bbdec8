package com.callstt.processing.service;

import com.callstt.calls.model.CallRecordEntity;
import com.callstt.calls.service.CallRecordStateService;
import com.callstt.config.AppProperties;
import com.callstt.processing.adapter.CallSummarizer;
import com.callstt.processing.model.DeadLetterEntry;
import com.callstt.processing.model.SttJob;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Optional;

@Service
public class SttWorker {

    private static final Logger log = LoggerFactory.getLogger(SttWorker.class);
    private static final Duration MIN_IDLE_SLEEP = Duration.ofMillis(100);
    static final String MAX_RETRIES_REASON = "max_retries";

    private final SttQueueService queue;
    private final CallRecordStateService callRecordStateService;
    private final ProviderRouter providerRouter;
    private final CallSummarizer callSummarizer;
    private final Sleeper sleeper;
    private final RetryPolicy retryPolicy;
    private final Duration idleSleep;
    private final Timer jobTimer;
    private final Counter successCounter;
    private final Counter retryCounter;
    private final Counter dlqCounter;
    private final Counter missingRecordCounter;

    private volatile boolean running;

    public SttWorker(SttQueueService queue,
                     CallRecordStateService callRecordStateService,
                     ProviderRouter providerRouter,
                     CallSummarizer callSummarizer,
                     Sleeper sleeper,
                     AppProperties appProperties,
                     MeterRegistry meterRegistry) {
        this.queue = queue;
        this.callRecordStateService = callRecordStateService;
        this.providerRouter = providerRouter;
        this.callSummarizer = callSummarizer;
        this.sleeper = sleeper;
        this.retryPolicy = new RetryPolicy(appProperties.stt().maxRetries(), appProperties.stt().baseBackoff());
        Duration configuredIdle = appProperties.stt().idleSleep();
        this.idleSleep = configuredIdle == null || configuredIdle.compareTo(MIN_IDLE_SLEEP) < 0
                ? MIN_IDLE_SLEEP
                : configuredIdle;
        this.jobTimer = meterRegistry.timer("stt.job.duration");
        this.successCounter = meterRegistry.counter("stt.jobs.total", "status", "success");
        this.retryCounter = meterRegistry.counter("stt.jobs.total", "status", "retry");
        this.dlqCounter = meterRegistry.counter("stt.jobs.total", "status", "dlq");
        this.missingRecordCounter = meterRegistry.counter("stt.jobs.total", "status", "missing_record");
    }

    public void runForever(Duration timeout) {
        running = true;
        log.info("Starting STT worker loop");
        while (running && !Thread.currentThread().isInterrupted()) {
            boolean handled;
            try {
                handled = processNext(timeout);
            } catch (RuntimeException exception) {
                log.error("STT worker iteration failed", exception);
                handled = false;
            }

            if (!handled && running) {
                try {
                    sleeper.sleep(idleSleep);
                } catch (InterruptedException exception) {
                    Thread.currentThread().interrupt();
                }
            }
        }
        running = false;
        log.info("STT worker loop stopped");
    }

    public void stop() {
        running = false;
    }

    // A record or queue write that fails after the pop puts the job back on the pending list and rethrows.
    public boolean processNext(Duration timeout) {
        Optional<SttJob> next = queue.fetchJob(timeout);
        if (next.isEmpty()) {
            return false;
        }

        SttJob job = next.get();
        Timer.Sample sample = Timer.start();
        try (MDC.MDCCloseable ignoredCall = MDC.putCloseable("callId", job.callId());
             MDC.MDCCloseable ignoredEngine = MDC.putCloseable("engine", job.engine())) {
            log.info("Processing STT job callId={} engine={}", job.callId(), job.engine());
            try {
                Optional<CallRecordEntity> record = callRecordStateService.markTranscribing(job);
                if (record.isEmpty()) {
                    markProcessed(job);
                    missingRecordCounter.increment();
                    log.warn("Dropping orphaned STT job callId={} recordId={}", job.callId(), job.recordId());
                    return true;
                }

                transcribeWithRetry(job);
                return true;
            } catch (RuntimeException exception) {
                log.error("STT job callId={} could not be settled, returning it to the queue", job.callId(), exception);
                try {
                    queue.enqueue(job);
                } catch (RuntimeException requeueFailure) {
                    exception.addSuppressed(requeueFailure);
                }
                throw exception;
            }
        } finally {
            sample.stop(jobTimer);
        }
    }

    private void transcribeWithRetry(SttJob job) {
        int attempt = 0;
        while (true) {
            TranscriptionResult result;
            try {
                result = providerRouter.transcribe(job);
            } catch (Exception exception) {
                attempt++;
                TranscriptionFailure failure = TranscriptionFailure.from(exception);
                RetryPolicy.Decision decision = retryPolicy.decide(failure, attempt);

                if (decision == RetryPolicy.Decision.DEAD_LETTER) {
                    handleClientFailure(job, failure);
                    return;
                }
                if (decision == RetryPolicy.Decision.EXHAUSTED) {
                    handleExhaustedRetries(job, failure, exception);
                    return;
                }

                Duration delay = retryPolicy.backoff(attempt);
                retryCounter.increment();
                log.warn("Retrying STT job callId={} attempt={} statusCode={} delay={} ({})",
                        job.callId(), attempt, failure.statusCode(), delay, failure.classification(), exception);
                try {
                    sleeper.sleep(delay);
                } catch (InterruptedException interrupted) {
                    Thread.currentThread().interrupt();
                    queue.enqueue(job);
                    log.warn("STT worker interrupted during backoff, returned job callId={} to the queue", job.callId());
                    return;
                }
                continue;
            }

            String summaryPath = callSummarizer.summarize(job.callId(), result.transcriptPath())
                    .map(Path::toString)
                    .orElse(null);
            callRecordStateService.recordSuccess(job, result, summaryPath);
            markProcessed(job);
            successCounter.increment();
            log.info("STT job completed callId={} transcript={}", job.callId(), result.transcriptPath());
            return;
        }
    }

    private void handleClientFailure(SttJob job, TranscriptionFailure failure) {
        int statusCode = failure.statusCode();
        callRecordStateService.recordFailure(job, "http_" + statusCode, failure.message());
        queue.pushToDlq(DeadLetterEntry.of(job, failure.describe(), statusCode));
        markProcessed(job);
        dlqCounter.increment();
        log.error("STT job callId={} moved to DLQ after client error {}", job.callId(), statusCode);
    }

    private void handleExhaustedRetries(SttJob job, TranscriptionFailure failure, Exception exception) {
        String errorCode = failure.classification() == FailureClassification.UNEXPECTED
                ? "unexpected_error"
                : MAX_RETRIES_REASON;
        callRecordStateService.recordFailure(job, errorCode, failure.describe());
        queue.pushToDlq(DeadLetterEntry.of(job, MAX_RETRIES_REASON, failure.statusCode()));
        markProcessed(job);
        dlqCounter.increment();
        log.error("STT job callId={} moved to DLQ after {} attempts", job.callId(), retryPolicy.maxRetries(), exception);
    }

    // Runs once the outcome is stored, so a failure here must not send the job round again.
    private void markProcessed(SttJob job) {
        try {
            queue.markProcessed(job);
        } catch (RuntimeException exception) {
            log.error("Unable to mark STT job callId={} as processed", job.callId(), exception);
        }
    }
}
