package com.callstt.processing.service;

import com.callstt.calls.model.CallRecordEntity;
import com.callstt.calls.service.CallRecordStateService;
import com.callstt.common.exception.BadRequestException;
import com.callstt.common.exception.NotFoundException;
import com.callstt.config.AppProperties;
import com.callstt.processing.model.SttJob;
import org.springframework.stereotype.Service;

@Service
public class SttIngestionService {

    private final CallRecordStateService callRecordStateService;
    private final SttQueueService queue;
    private final AppProperties appProperties;

    public SttIngestionService(CallRecordStateService callRecordStateService,
                               SttQueueService queue,
                               AppProperties appProperties) {
        this.callRecordStateService = callRecordStateService;
        this.queue = queue;
        this.appProperties = appProperties;
    }

    public EnqueueResult enqueueRecord(long recordId, String engine, String language) {
        CallRecordEntity record = callRecordStateService.find(recordId)
                .orElseThrow(() -> new NotFoundException("Call record not found"));
        if (record.getRecordingUrl() == null || record.getRecordingUrl().isBlank()) {
            throw new BadRequestException("Call record has no recording to transcribe");
        }

        SttJob job = new SttJob(
                record.getId(),
                record.getCallId(),
                record.getRecordingUrl(),
                engine == null || engine.isBlank() ? appProperties.stt().defaultEngine() : engine,
                language == null || language.isBlank() ? record.getLanguage() : language
        );
        return new EnqueueResult(job, queue.enqueue(job));
    }

    public record EnqueueResult(SttJob job, boolean queued) {
    }
}
