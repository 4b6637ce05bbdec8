package com.callstt.calls.service;

import com.callstt.calls.model.CallRecordEntity;
import com.callstt.calls.model.CallStatus;
import com.callstt.calls.repo.CallRecordRepository;
import com.callstt.processing.model.SttJob;
import com.callstt.processing.service.TranscriptionResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.Optional;

@Service
public class CallRecordStateService {

    private static final Logger log = LoggerFactory.getLogger(CallRecordStateService.class);

    private final CallRecordRepository callRecordRepository;

    public CallRecordStateService(CallRecordRepository callRecordRepository) {
        this.callRecordRepository = callRecordRepository;
    }

    @Transactional(readOnly = true)
    public Optional<CallRecordEntity> find(long recordId) {
        return callRecordRepository.findById(recordId);
    }

    @Transactional
    public Optional<CallRecordEntity> markTranscribing(SttJob job) {
        CallRecordEntity record = callRecordRepository.findById(job.recordId()).orElse(null);
        if (record == null) {
            log.warn("Call record {} for STT job {} not found", job.recordId(), job.callId());
            return Optional.empty();
        }

        record.setStatus(CallStatus.TRANSCRIBING);
        record.setRetryCount(record.getRetryCount() + 1);
        record.setLastRetryAt(Instant.now());
        return Optional.of(callRecordRepository.save(record));
    }

    @Transactional
    public void recordSuccess(SttJob job, TranscriptionResult result, String summaryPath) {
        CallRecordEntity record = callRecordRepository.findById(job.recordId()).orElse(null);
        if (record == null) {
            log.error("Call record {} missing when storing transcript for {}", job.recordId(), job.callId());
            return;
        }

        record.setTranscriptPath(result.transcriptPath());
        record.setSummaryPath(summaryPath);
        record.setLanguage(result.language());
        record.setStatus(CallStatus.COMPLETED);
        record.setErrorCode(null);
        record.setErrorMessage(null);
        record.setLastRetryAt(Instant.now());
        callRecordRepository.save(record);
    }

    @Transactional
    public void recordFailure(SttJob job, String errorCode, String errorMessage) {
        CallRecordEntity record = callRecordRepository.findById(job.recordId()).orElse(null);
        if (record == null) {
            log.error("Call record {} missing when recording STT error for {}", job.recordId(), job.callId());
            return;
        }

        record.setStatus(CallStatus.ERROR);
        record.setErrorCode(errorCode);
        record.setErrorMessage(errorMessage);
        record.setLastRetryAt(Instant.now());
        callRecordRepository.save(record);
    }

    // Retry count is kept across replays.
    @Transactional
    public boolean resetForReplay(long recordId) {
        CallRecordEntity record = callRecordRepository.findById(recordId).orElse(null);
        if (record == null) {
            log.warn("Call record {} not found while resetting for replay", recordId);
            return false;
        }

        record.setStatus(CallStatus.DOWNLOADED);
        record.setErrorCode(null);
        record.setErrorMessage(null);
        callRecordRepository.save(record);
        return true;
    }
}
