package com.callstt.processing.service;

import com.callstt.calls.service.CallRecordStateService;
import com.callstt.common.util.Hashing;
import com.callstt.config.AppProperties;
import com.callstt.processing.model.DeadLetterEntry;
import com.callstt.processing.model.DeadLetterRecord;
import com.callstt.processing.model.SttJob;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

@Service
public class SttQueueService {

    private static final Logger log = LoggerFactory.getLogger(SttQueueService.class);

    private final QueueStore queueStore;
    private final ObjectMapper objectMapper;
    private final CallRecordStateService callRecordStateService;
    private final String queueKey;
    private final String dlqKey;
    private final String processedKey;

    public SttQueueService(QueueStore queueStore,
                           ObjectMapper objectMapper,
                           CallRecordStateService callRecordStateService,
                           AppProperties appProperties) {
        this.queueStore = queueStore;
        this.objectMapper = objectMapper;
        this.callRecordStateService = callRecordStateService;
        this.queueKey = appProperties.stt().queueKey();
        this.dlqKey = appProperties.stt().dlqKey();
        this.processedKey = appProperties.stt().processedKey();
    }

    public boolean enqueue(SttJob job) {
        boolean pushed = queueStore.rightPushUnlessMember(queueKey, processedKey, job.dedupKey(), write(job));
        if (!pushed) {
            log.info("Skipping enqueue for already processed STT job callId={} engine={}", job.callId(), job.engine());
        }
        return pushed;
    }

    // At most one blocking wait; duplicates found after it are drained without blocking.
    public Optional<SttJob> fetchJob(Duration timeout) {
        boolean block = timeout != null && !timeout.isZero() && !timeout.isNegative();

        while (true) {
            Optional<String> item = block
                    ? queueStore.blockingLeftPop(queueKey, timeout)
                    : queueStore.leftPop(queueKey);
            block = false;
            if (item.isEmpty()) {
                return Optional.empty();
            }

            SttJob job = read(item.get(), SttJob.class);
            if (job == null) {
                log.error("Dropping unreadable STT job payload: {}", item.get());
                continue;
            }

            if (isProcessed(job)) {
                log.warn("Skipping duplicate STT job callId={} engine={}", job.callId(), job.engine());
                continue;
            }
            return Optional.of(job);
        }
    }

    public boolean isProcessed(SttJob job) {
        return queueStore.isMember(processedKey, job.dedupKey());
    }

    public void markProcessed(SttJob job) {
        queueStore.addMember(processedKey, job.dedupKey());
    }

    public void pushToDlq(DeadLetterEntry entry) {
        queueStore.rightPush(dlqKey, write(entry));
    }

    public List<DeadLetterRecord> listDlqEntries() {
        List<DeadLetterRecord> records = new ArrayList<>();
        for (StoredEntry stored : storedEntries()) {
            records.add(new DeadLetterRecord(stored.entryId(), stored.entry()));
        }
        return records;
    }

    public Optional<DeadLetterEntry> requeueDlqEntry(String entryId) {
        return storedEntries().stream()
                .filter(stored -> stored.entryId().equals(entryId))
                .findFirst()
                .flatMap(this::replay);
    }

    public Optional<DeadLetterEntry> replayByRecordId(long recordId) {
        return storedEntries().stream()
                .filter(stored -> stored.entry().job().recordId() == recordId)
                .findFirst()
                .flatMap(this::replay);
    }

    private Optional<DeadLetterEntry> replay(StoredEntry stored) {
        SttJob job = stored.entry().job();
        boolean claimed = queueStore.moveBack(
                dlqKey,
                stored.payload(),
                processedKey,
                job.dedupKey(),
                queueKey,
                write(job)
        );
        if (!claimed) {
            log.info("DLQ entry {} was already replayed", stored.entryId());
            return Optional.empty();
        }

        callRecordStateService.resetForReplay(job.recordId());
        log.info("Requeued DLQ entry {} for callId={} recordId={}", stored.entryId(), job.callId(), job.recordId());
        return Optional.of(stored.entry());
    }

    private List<StoredEntry> storedEntries() {
        List<StoredEntry> entries = new ArrayList<>();
        for (String payload : queueStore.range(dlqKey)) {
            DeadLetterEntry entry = read(payload, DeadLetterEntry.class);
            if (entry == null) {
                log.error("Ignoring unreadable DLQ payload: {}", payload);
                continue;
            }
            entries.add(new StoredEntry(Hashing.sha256Hex(payload), payload, entry));
        }
        return entries;
    }

    // null for anything that does not bind, including a literal JSON null
    private <T> T read(String payload, Class<T> type) {
        try {
            return objectMapper.readValue(payload, type);
        } catch (JsonProcessingException | IllegalArgumentException exception) {
            log.warn("Unable to parse STT queue payload as {}", type.getSimpleName(), exception);
            return null;
        }
    }

    private String write(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException exception) {
            throw new IllegalStateException("Unable to serialize STT queue payload", exception);
        }
    }

    private record StoredEntry(String entryId, String payload, DeadLetterEntry entry) {
    }
}
