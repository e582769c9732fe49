package com.stockgame.api.controller;

import com.stockgame.api.dto.request.ExcludeEventRequest;
import com.stockgame.domain.model.ExclusionStepResult;
import com.stockgame.domain.model.LeaderOpportunityGroup;
import com.stockgame.service.GameService;
import jakarta.validation.Valid;
import java.util.List;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST controller for the end-of-round leadership exclusion phase.
 *
 * <p>Leaders act one at a time in the order fixed when the phase opened. Calls made while no
 * phase is active fail with 409.
 */
@RestController
@RequestMapping("/api/games/{gameId}/leadership")
public class LeadershipController {

    private final GameService gameService;

    public LeadershipController(GameService gameService) {
        this.gameService = gameService;
    }

    @GetMapping("/opportunities")
    public ResponseEntity<List<LeaderOpportunityGroup>> getOpportunities(@PathVariable String gameId) {
        return ResponseEntity.ok(gameService.getLeadershipOpportunities(gameId));
    }

    @PostMapping("/exclusions")
    public ResponseEntity<Void> excludeEvent(
            @PathVariable String gameId, @Valid @RequestBody ExcludeEventRequest request) {
        gameService.excludeEvent(gameId, request.getEventId(), request.getLeaderId());
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/advance")
    public ResponseEntity<ExclusionStepResult> advance(@PathVariable String gameId) {
        return ResponseEntity.ok(gameService.advanceToNextLeader(gameId));
    }

    @PostMapping("/complete")
    public ResponseEntity<ExclusionStepResult> complete(@PathVariable String gameId) {
        return ResponseEntity.ok(gameService.completeRound(gameId));
    }
}
