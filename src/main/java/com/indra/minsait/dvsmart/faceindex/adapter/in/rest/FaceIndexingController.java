/*
 * /////////////////////////////////////////////////////////////////////////////
 *
 * Copyright (c) 2026 Indra Sistemas, S.A. All Rights Reserved.
 * http://www.indracompany.com/
 *
 * The contents of this file are owned by Indra Sistemas, S.A. copyright holder.
 * This file can only be copied, distributed and used all or in part with the
 * written permission of Indra Sistemas, S.A, or in accordance with the terms and
 * conditions laid down in the agreement / contract under which supplied.
 *
 * /////////////////////////////////////////////////////////////////////////////
 */
package com.indra.minsait.dvsmart.faceindex.adapter.in.rest;

import com.indra.minsait.dvsmart.faceindex.adapter.in.rest.dto.JobAcceptedResponse;
import com.indra.minsait.dvsmart.faceindex.adapter.in.rest.dto.StartJobRequest;
import com.indra.minsait.dvsmart.faceindex.application.port.in.CancelJobUseCase;
import com.indra.minsait.dvsmart.faceindex.application.port.in.GetJobStatusUseCase;
import com.indra.minsait.dvsmart.faceindex.application.port.in.StartFaceIndexingUseCase;
import com.indra.minsait.dvsmart.faceindex.domain.model.JobSnapshot;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

/**
 * Author: hahuaranga@indracompany.com
 * Created on: 19-01-2026 at 10:15:37
 * File: FaceIndexingController.java
 */

/**
 * Jobs de indexación facial.
 * 
 * Endpoints disponibles:
 * - POST   /api/face-index/jobs                  - Arranca un job (202)
 * - GET    /api/face-index/jobs/{owner}          - Snapshot del job
 * - GET    /api/face-index/jobs/{owner}/stream   - Progreso por SSE
 * - POST   /api/face-index/jobs/{owner}/cancel   - Solicita cancelación
 * - DELETE /api/face-index/jobs/{owner}          - Olvida un job terminado
 */
@Slf4j
@RestController
@RequestMapping("/api/face-index/jobs")
@RequiredArgsConstructor
public class FaceIndexingController {

    private final StartFaceIndexingUseCase startUseCase;
    private final GetJobStatusUseCase statusUseCase;
    private final CancelJobUseCase cancelUseCase;
    private final JobProgressStreamer progressStreamer;

    @PostMapping
    public ResponseEntity<JobAcceptedResponse> start(@Valid @RequestBody StartJobRequest request) {
        JobSnapshot snapshot = startUseCase.start(request.owner(), request.scope(), request.forceReprocess());
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(JobAcceptedResponse.from(snapshot));
    }

    @GetMapping("/{owner}")
    public ResponseEntity<JobSnapshot> status(@PathVariable String owner) {
        return ResponseEntity.ok(statusUseCase.status(owner));
    }

    @GetMapping(path = "/{owner}/stream", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public SseEmitter stream(@PathVariable String owner) {
        return progressStreamer.open(owner);
    }

    @PostMapping("/{owner}/cancel")
    public ResponseEntity<JobSnapshot> cancel(@PathVariable String owner) {
        return cancelUseCase.cancel(owner)
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.notFound().build());
    }

    @DeleteMapping("/{owner}")
    public ResponseEntity<Void> reset(@PathVariable String owner) {
        return cancelUseCase.reset(owner)
                ? ResponseEntity.noContent().build()
                : ResponseEntity.notFound().build();
    }
}
