package com.checkmate.pos_sync.validation;

import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequiredArgsConstructor
public class SyncValidationController {

    private final SyncValidationService syncValidationService;

    @PostMapping("/api/pos/sync/validate")
    public ResponseEntity<SyncValidationResponse> validate(@Valid @RequestBody SyncValidationRequest request) {
        return ResponseEntity.ok(syncValidationService.validate(request));
    }
}
