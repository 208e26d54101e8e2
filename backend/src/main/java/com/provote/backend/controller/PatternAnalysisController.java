package com.provote.backend.controller;

import com.provote.backend.domain.FraudAlert;
import com.provote.backend.dto.AnalysisResult;
import com.provote.backend.repository.FraudAlertRepository;
import com.provote.backend.service.PatternAnalysisService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.UUID;

@RestController
@RequestMapping("/api/admin/polls")
@RequiredArgsConstructor
public class PatternAnalysisController {

    private final PatternAnalysisService patternAnalysisService;
    private final FraudAlertRepository fraudAlertRepository;

    @PostMapping("/{pollId}/pattern-analysis")
    public ResponseEntity<AnalysisResult> analyze(@PathVariable UUID pollId,
                                                  @RequestParam(required = false) Integer windowHours) {
        AnalysisResult result = windowHours == null
                ? patternAnalysisService.analyze(pollId)
                : patternAnalysisService.analyze(pollId, windowHours);
        return ResponseEntity.ok(result);
    }

    @GetMapping("/{pollId}/fraud-alerts")
    public ResponseEntity<List<FraudAlert>> fraudAlerts(@PathVariable UUID pollId) {
        return ResponseEntity.ok(fraudAlertRepository.findByPollIdOrderByCreatedAtDesc(pollId));
    }
}
