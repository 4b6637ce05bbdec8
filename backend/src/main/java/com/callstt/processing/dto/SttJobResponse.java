package com.callstt.processing.dto;

import com.callstt.processing.model.SttJob;

public record SttJobResponse(
        String status,
        SttJob job
) {
}
