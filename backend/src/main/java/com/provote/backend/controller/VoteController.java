package com.provote.backend.controller;

import com.provote.backend.core.request.FingerprintExtractor;
import com.provote.backend.core.security.SecurityUtils;
import com.provote.backend.dto.CastResult;
import com.provote.backend.dto.CastVoteCommand;
import com.provote.backend.dto.RequestMetadata;
import com.provote.backend.dto.VoteRequest;
import com.provote.backend.dto.VoteResponse;
import com.provote.backend.service.VoteCastService;
import com.provote.backend.service.VoterIdentityService;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/votes")
@RequiredArgsConstructor
public class VoteController {

    private final VoteCastService voteCastService;
    private final VoterIdentityService voterIdentityService;
    private final FingerprintExtractor fingerprintExtractor;

    /**
     * 201 for a new vote, 200 when the request replays an earlier one.
     */
    @PostMapping("/cast")
    public ResponseEntity<VoteResponse> cast(@Valid @RequestBody VoteRequest request, HttpServletRequest http) {
        RequestMetadata metadata = new RequestMetadata(
                voterIdentityService.extractIp(http),
                http.getHeader("User-Agent"),
                fingerprintExtractor.extract(http));

        CastResult result = voteCastService.castVote(new CastVoteCommand(
                SecurityUtils.currentUserId(), request.pollId(), request.optionId(),
                request.idempotencyKey(), metadata));

        HttpStatus status = result.isNew() ? HttpStatus.CREATED : HttpStatus.OK;
        return ResponseEntity.status(status).body(VoteResponse.from(result));
    }
}
