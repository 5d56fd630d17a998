package com.flagrank.controller;

import com.flagrank.dto.ScoreboardResponses;
import com.flagrank.mapper.FlagrankResponseMapper;
import com.flagrank.model.Capability;
import com.flagrank.service.CapabilityGuard;
import com.flagrank.service.LeaderboardCache;
import com.flagrank.service.ScoreAggregator;
import com.flagrank.web.CallerContext;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.UUID;

@RestController
@RequestMapping("/api")
public class ScoreboardController {

    private final LeaderboardCache leaderboardCache;
    private final ScoreAggregator scoreAggregator;
    private final CapabilityGuard capabilityGuard;
    private final FlagrankResponseMapper flagrankResponseMapper;

    public ScoreboardController(
            LeaderboardCache leaderboardCache,
            ScoreAggregator scoreAggregator,
            CapabilityGuard capabilityGuard,
            FlagrankResponseMapper flagrankResponseMapper
    ) {
        this.leaderboardCache = leaderboardCache;
        this.scoreAggregator = scoreAggregator;
        this.capabilityGuard = capabilityGuard;
        this.flagrankResponseMapper = flagrankResponseMapper;
    }

    @GetMapping("/scoreboard")
    public ResponseEntity<ScoreboardResponses.Scoreboard> getScoreboard(CallerContext caller) {
        capabilityGuard.require(caller, Capability.VIEW_SCOREBOARD);
        boolean liveView = capabilityGuard.allows(caller, Capability.VIEW_LIVE_SCOREBOARD);
        return ResponseEntity.ok(flagrankResponseMapper.toScoreboard(leaderboardCache.rankedTeams(liveView)));
    }

    @GetMapping("/teams/{teamId}/score")
    public ResponseEntity<ScoreboardResponses.TeamScore> getTeamScore(
            CallerContext caller,
            @PathVariable UUID teamId
    ) {
        capabilityGuard.require(caller, Capability.VIEW_TEAM_SCORE);
        return ResponseEntity.ok(flagrankResponseMapper.toTeamScore(scoreAggregator.teamScore(teamId)));
    }

    @PostMapping("/admin/scores/reconcile")
    public ResponseEntity<ScoreboardResponses.ReconciliationSummary> reconcileScores(CallerContext caller) {
        capabilityGuard.require(caller, Capability.RECONCILE_SCORES);
        ScoreAggregator.ReconciliationReport report = scoreAggregator.reconcileAll();
        leaderboardCache.markDirty();
        return ResponseEntity.ok(flagrankResponseMapper.toReconciliationSummary(report));
    }
}
