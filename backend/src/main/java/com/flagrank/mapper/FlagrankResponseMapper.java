package com.flagrank.mapper;

import com.flagrank.dto.CompetitionResponse;
import com.flagrank.dto.KothResponses;
import com.flagrank.dto.ScoreboardResponses;
import com.flagrank.dto.ScoringResponses;
import com.flagrank.model.CompetitionSettings;
import com.flagrank.model.Hint;
import com.flagrank.model.HintUnlockStatus;
import com.flagrank.model.KothTarget;
import com.flagrank.model.Submission;
import com.flagrank.model.SubmissionStatus;
import com.flagrank.service.LeaderboardSnapshot;
import com.flagrank.service.RankedTeam;
import com.flagrank.service.ScoreAggregator;
import com.flagrank.service.TeamTally;
import org.springframework.stereotype.Component;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.UUID;

@Component
public class FlagrankResponseMapper {

    public ScoringResponses.SubmissionResult toSubmissionResult(Submission submission, SubmissionStatus status) {
        return new ScoringResponses.SubmissionResult(
                submission.getSubmissionId(),
                submission.getChallengeId(),
                submission.getTeamId(),
                status,
                status == SubmissionStatus.ACCEPTED ? submission.getAwardedValue() : null,
                submission.getSubmittedAt()
        );
    }

    public ScoringResponses.HintUnlockResult toHintUnlockResult(
            Hint hint,
            UUID teamId,
            HintUnlockStatus status,
            int cost
    ) {
        boolean revealed = status != HintUnlockStatus.OUT_OF_ORDER;
        return new ScoringResponses.HintUnlockResult(
                hint.getHintId(),
                hint.getChallengeId(),
                teamId,
                hint.getHintRank(),
                status,
                cost,
                revealed ? hint.getBody() : null
        );
    }

    public KothResponses.TargetState toTargetState(KothTarget target) {
        return new KothResponses.TargetState(
                target.getTargetId(),
                target.getName(),
                target.getChallengeId(),
                target.getStatus(),
                target.getOwnerTeamId(),
                target.getOwnerSince(),
                target.getAccruedUntil(),
                target.getPointsPerPeriod(),
                target.getAccrualPeriodSeconds(),
                target.getClosedAt()
        );
    }

    public ScoreboardResponses.Scoreboard toScoreboard(LeaderboardSnapshot snapshot) {
        List<ScoreboardResponses.ScoreboardEntry> entries = snapshot.entries().stream()
                .map(this::toScoreboardEntry)
                .toList();
        return new ScoreboardResponses.Scoreboard(
                entries,
                snapshot.generatedAt(),
                snapshot.frozen(),
                snapshot.frozenAt()
        );
    }

    public ScoreboardResponses.ScoreboardEntry toScoreboardEntry(RankedTeam rankedTeam) {
        return new ScoreboardResponses.ScoreboardEntry(
                rankedTeam.rank(),
                rankedTeam.teamId(),
                rankedTeam.teamName(),
                rankedTeam.score(),
                rankedTeam.lastSolveAt()
        );
    }

    public ScoreboardResponses.TeamScore toTeamScore(TeamTally tally) {
        return new ScoreboardResponses.TeamScore(tally.teamId(), tally.score(), tally.lastSolveAt());
    }

    public ScoreboardResponses.ReconciliationSummary toReconciliationSummary(ScoreAggregator.ReconciliationReport report) {
        return new ScoreboardResponses.ReconciliationSummary(
                report.teamsChecked(),
                report.mismatches(),
                report.reconciledAt()
        );
    }

    public CompetitionResponse toCompetitionResponse(CompetitionSettings settings, OffsetDateTime now) {
        return new CompetitionResponse(
                settings.getName(),
                settings.phaseAt(now),
                settings.getStartTime(),
                settings.getEndTime(),
                settings.getFreezeTime(),
                settings.getClosedAt(),
                settings.isFrozenAt(now)
        );
    }
}
