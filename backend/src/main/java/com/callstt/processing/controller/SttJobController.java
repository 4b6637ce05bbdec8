package com.callstt.processing.controller;

import com.callstt.processing.dto.EnqueueJobRequest;
import com.callstt.processing.dto.SttJobResponse;
import com.callstt.processing.service.SttIngestionService;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/v1/stt/jobs")
public class SttJobController {

    private final SttIngestionService ingestionService;

    public SttJobController(SttIngestionService ingestionService) {
        this.ingestionService = ingestionService;
    }

    @PostMapping
    @ResponseStatus(HttpStatus.ACCEPTED)
    public SttJobResponse enqueue(@RequestBody @Valid EnqueueJobRequest request) {
        SttIngestionService.EnqueueResult result = ingestionService.enqueueRecord(
                request.recordId(),
                request.engine(),
                request.language()
        );
        return new SttJobResponse(result.queued() ? "queued" : "skipped", result.job());
    }
}
