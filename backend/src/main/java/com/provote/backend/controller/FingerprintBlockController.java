package com.provote.backend.controller;

import com.provote.backend.core.security.SecurityUtils;
import com.provote.backend.domain.FingerprintBlock;
import com.provote.backend.domain.FingerprintBlockEvent;
import com.provote.backend.dto.BlockRequest;
import com.provote.backend.service.FingerprintBlockService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/admin/fingerprints")
@RequiredArgsConstructor
public class FingerprintBlockController {

    private final FingerprintBlockService blockService;

    @GetMapping
    public ResponseEntity<List<FingerprintBlock>> listActive() {
        return ResponseEntity.ok(blockService.listActive());
    }

    @GetMapping("/{fingerprint}")
    public ResponseEntity<Map<String, Object>> detail(@PathVariable String fingerprint) {
        List<FingerprintBlockEvent> history = blockService.history(fingerprint);
        return blockService.find(fingerprint)
                .map(block -> ResponseEntity.ok(Map.<String, Object>of("block", block, "history", history)))
                .orElseGet(() -> ResponseEntity.notFound().build());
    }

    @PostMapping("/{fingerprint}/block")
    public ResponseEntity<FingerprintBlock> block(@PathVariable String fingerprint,
                                                  @Valid @RequestBody BlockRequest request) {
        FingerprintBlock block = blockService.blockManually(fingerprint, request.reason(), SecurityUtils.currentUserId());
        return ResponseEntity.ok(block);
    }

    @PostMapping("/{fingerprint}/unblock")
    public ResponseEntity<Void> unblock(@PathVariable String fingerprint) {
        blockService.unblock(fingerprint, SecurityUtils.currentUserId());
        return ResponseEntity.noContent().build();
    }
}
