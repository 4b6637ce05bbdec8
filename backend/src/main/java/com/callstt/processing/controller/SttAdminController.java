package com.callstt.processing.controller;

import com.callstt.common.exception.NotFoundException;
import com.callstt.common.security.SecurityUtils;
import com.callstt.processing.dto.DlqEntryResponse;
import com.callstt.processing.dto.DlqReplayRequest;
import com.callstt.processing.dto.DlqRequeueResponse;
import com.callstt.processing.dto.SttJobResponse;
import com.callstt.processing.model.DeadLetterEntry;
import com.callstt.processing.model.SttJob;
import com.callstt.processing.service.SttQueueService;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
public class SttAdminController {

    private static final Logger audit = LoggerFactory.getLogger("com.callstt.audit");

    private final SttQueueService queue;

    public SttAdminController(SttQueueService queue) {
        this.queue = queue;
    }

    @GetMapping("/api/v1/admin/stt/dlq")
    public List<DlqEntryResponse> listDlqEntries() {
        return queue.listDlqEntries()
                .stream()
                .map(DlqEntryResponse::from)
                .toList();
    }

    @PostMapping("/api/v1/admin/stt/dlq/{entryId}/requeue")
    public DlqRequeueResponse requeueDlqEntry(@PathVariable String entryId) {
        String actor = SecurityUtils.currentActor().name();
        DeadLetterEntry entry = queue.requeueDlqEntry(entryId)
                .orElseThrow(() -> new NotFoundException("DLQ entry not found"));
        logReplay(actor, entry.job(), entryId, entry.reason());
        return DlqRequeueResponse.requeued(entryId, entry);
    }

    @PostMapping("/api/v1/stt/dlq/replay")
    @ResponseStatus(HttpStatus.ACCEPTED)
    public SttJobResponse replayDlqJob(@RequestBody @Valid DlqReplayRequest request) {
        String actor = SecurityUtils.currentActor().name();
        DeadLetterEntry entry = queue.replayByRecordId(request.recordId())
                .orElseThrow(() -> new NotFoundException("DLQ job not found"));
        logReplay(actor, entry.job(), null, request.reason());
        return new SttJobResponse("requeued", entry.job());
    }

    private void logReplay(String actor, SttJob job, String entryId, String reason) {
        audit.info("stt.dlq.replay actor={} recordId={} callId={} engine={} entryId={} reason={}",
                actor, job.recordId(), job.callId(), job.engine(), entryId, reason);
    }
}
