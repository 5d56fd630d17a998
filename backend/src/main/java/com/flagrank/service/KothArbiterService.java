package com.flagrank.service;

import com.flagrank.config.FlagrankRuntimeProperties;
import com.flagrank.dto.KothResponses;
import com.flagrank.mapper.FlagrankResponseMapper;
import com.flagrank.model.CompetitionPhase;
import com.flagrank.model.KothAccrual;
import com.flagrank.model.KothClaim;
import com.flagrank.model.KothClaimStatus;
import com.flagrank.model.KothTarget;
import com.flagrank.model.KothTargetStatus;
import com.flagrank.repository.KothAccrualRepository;
import com.flagrank.repository.KothClaimRepository;
import com.flagrank.repository.KothTargetRepository;
import com.flagrank.web.ScoringValidationException;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;
import org.springframework.web.server.ResponseStatusException;

import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Decides KOTH target ownership.
 * <p>
 * Every ownership change reads the target, decides, then swaps with a version-checked update. Losing the
 * swap means another claim, tick, close or token rotation committed in between; the caller gets
 * {@code CONTESTED} and may retry. Holds accrue {@code pointsPerPeriod} for every full period; takeover and
 * close credit the last partial period proportionally. No hold accrues past the competition's end.
 */
@Service
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "flagrank.koth", name = "enabled", havingValue = "true", matchIfMissing = true)
public class KothArbiterService implements CompetitionLifecycleListener {

    private static final Logger log = LoggerFactory.getLogger(KothArbiterService.class);

    private final KothTargetRepository kothTargetRepository;
    private final KothClaimRepository kothClaimRepository;
    private final KothAccrualRepository kothAccrualRepository;
    private final CompetitionService competitionService;
    private final CompetitionClock competitionClock;
    private final ScoreEventPublisher scoreEventPublisher;
    private final FlagrankRuntimeProperties flagrankRuntimeProperties;
    private final FlagrankResponseMapper flagrankResponseMapper;
    private final TransactionTemplate transactionTemplate;

    public KothResponses.ClaimResult claim(UUID teamId, String memberId, UUID targetId, String proof) {
        return LedgerCalls.guarded("KOTH claim", () -> {
            CompetitionPhase phase = competitionService.phase();
            if (phase == CompetitionPhase.UPCOMING) {
                throw ScoringValidationException.competitionNotActive("Competition has not started");
            }
            return transactionTemplate.execute(status -> claimInTransaction(teamId, memberId, targetId, proof, phase));
        });
    }

    public KothResponses.TargetState targetState(UUID targetId) {
        return flagrankResponseMapper.toTargetState(findTarget(targetId));
    }

    public KothResponses.TargetState rotateCaptureToken(UUID targetId, String captureToken) {
        if (captureToken == null || captureToken.isBlank()) {
            throw ScoringValidationException.invalidSubmission("captureToken must not be blank");
        }
        KothTarget rotated = transactionTemplate.execute(status -> {
            findTarget(targetId);
            kothTargetRepository.rotateCaptureToken(targetId, captureToken.trim(), competitionClock.now());
            return findTarget(targetId);
        });
        log.info("Capture token rotated for KOTH target {}", targetId);
        return flagrankResponseMapper.toTargetState(rotated);
    }

    /**
     * Credits every full accrual period held since the last credit. Returns the number of targets credited.
     */
    public int accrueHeldTargets() {
        if (competitionService.phase() != CompetitionPhase.ACTIVE) {
            return 0;
        }
        int credited = 0;
        for (KothTarget target : kothTargetRepository.findByStatusOrderByCreatedAtAsc(KothTargetStatus.OPEN)) {
            if (target.getOwnerTeamId() == null) {
                continue;
            }
            Boolean accrued = transactionTemplate.execute(status -> accrueFullPeriods(target.getTargetId()));
            if (Boolean.TRUE.equals(accrued)) {
                credited++;
            }
        }
        return credited;
    }

    @Override
    public void onCompetitionClosed(OffsetDateTime endedAt) {
        if (competitionService.phase() != CompetitionPhase.FINISHED) {
            log.info("Competition reopened before KOTH targets were closed; leaving them open");
            return;
        }
        int closed = closeAll(endedAt);
        log.info("KOTH targets closed after competition end at {}: {}", endedAt, closed);
    }

    @Override
    public void onCompetitionReopened() {
        int reopened = transactionTemplate.execute(status -> kothTargetRepository.reopenClosed(
                KothTargetStatus.CLOSED,
                KothTargetStatus.OPEN,
                competitionClock.now()
        ));
        if (reopened > 0) {
            log.info("KOTH targets reopened with the competition: {}", reopened);
        }
    }

    /**
     * Closes every open target, crediting current owners up to {@code endedAt} (or now, if earlier).
     */
    public int closeAll(OffsetDateTime endedAt) {
        int maxAttempts = Math.max(1, flagrankRuntimeProperties.getKoth().getCloseAttempts());
        int closed = 0;
        for (KothTarget target : kothTargetRepository.findByStatusOrderByCreatedAtAsc(KothTargetStatus.OPEN)) {
            boolean targetClosed = false;
            for (int attempt = 1; attempt <= maxAttempts && !targetClosed; attempt++) {
                targetClosed = Boolean.TRUE.equals(
                        transactionTemplate.execute(status -> closeTarget(target.getTargetId(), endedAt))
                );
            }
            if (targetClosed) {
                closed++;
            } else {
                log.warn("KOTH target {} stayed open after {} close attempts", target.getTargetId(), maxAttempts);
            }
        }
        return closed;
    }

    static long proportionalPoints(int pointsPerPeriod, int accrualPeriodSeconds, Duration held) {
        long heldMs = Math.max(0L, held.toMillis());
        long periodMs = accrualPeriodSeconds * 1_000L;
        long fullPeriods = heldMs / periodMs;
        long partialMs = heldMs % periodMs;
        return fullPeriods * pointsPerPeriod + (partialMs * pointsPerPeriod) / periodMs;
    }

    private KothResponses.ClaimResult claimInTransaction(
            UUID teamId,
            String memberId,
            UUID targetId,
            String proof,
            CompetitionPhase phase
    ) {
        KothTarget target = findTarget(targetId);
        if (phase == CompetitionPhase.FINISHED || target.getStatus() == KothTargetStatus.CLOSED) {
            return result(target, KothClaimStatus.CLOSED, 0);
        }
        if (teamId.equals(target.getOwnerTeamId())) {
            return result(target, KothClaimStatus.ALREADY_OWNER, 0);
        }

        KothClaim heldClaim = null;
        if (target.getOwnerTeamId() != null) {
            heldClaim = kothClaimRepository.findByOpenTargetId(targetId).orElse(null);
            if (!takeoverAllowed(target, heldClaim, proof)) {
                return result(target, KothClaimStatus.REJECTED, 0);
            }
        }

        OffsetDateTime now = competitionClock.now();
        int swapped = kothTargetRepository.swapOwnerIfVersion(
                targetId,
                teamId,
                now,
                KothTargetStatus.OPEN,
                target.getStateVersion()
        );
        if (swapped == 0) {
            return contested(teamId, targetId);
        }

        List<ScoreEvent> events = new ArrayList<>();
        long creditedToPrevious = 0;
        if (heldClaim != null) {
            KothAccrual finalAccrual = creditPartialHold(target, heldClaim, now, now);
            if (finalAccrual != null) {
                events.add(ScoreEvent.accrued(finalAccrual));
                creditedToPrevious = finalAccrual.getPoints();
            }
            release(heldClaim, now);
        }

        KothClaim claim = new KothClaim();
        claim.setClaimId(UUID.randomUUID());
        claim.setTargetId(targetId);
        claim.setTeamId(teamId);
        claim.setMemberId(memberId);
        claim.setProofDigest(proof == null || proof.isBlank() ? null : FlagMatcher.digest(proof));
        claim.setOpenTargetId(targetId);
        claim.setClaimedAt(now);
        kothClaimRepository.saveAndFlush(claim);

        scoreEventPublisher.publishAll(events);
        log.info(
                "KOTH target {} claimed by team {} (previous owner {}, credited {})",
                targetId,
                teamId,
                target.getOwnerTeamId(),
                creditedToPrevious
        );
        return new KothResponses.ClaimResult(targetId, KothClaimStatus.CLAIMED, teamId, now, creditedToPrevious);
    }

    private KothResponses.ClaimResult contested(UUID teamId, UUID targetId) {
        KothTarget current = findTarget(targetId);
        if (teamId.equals(current.getOwnerTeamId())) {
            return result(current, KothClaimStatus.ALREADY_OWNER, 0);
        }
        if (current.getStatus() == KothTargetStatus.CLOSED) {
            return result(current, KothClaimStatus.CLOSED, 0);
        }
        return result(current, KothClaimStatus.CONTESTED, 0);
    }

    // Takeover needs the current capture token, and a different proof than the one behind the current hold.
    private static boolean takeoverAllowed(KothTarget target, KothClaim heldClaim, String proof) {
        if (proof == null || proof.isBlank()) {
            return false;
        }
        if (!FlagMatcher.matches(proof, target.getCaptureToken(), false)) {
            return false;
        }
        return heldClaim == null || !FlagMatcher.digest(proof).equals(heldClaim.getProofDigest());
    }

    private Boolean accrueFullPeriods(UUID targetId) {
        KothTarget target = kothTargetRepository.findById(targetId).orElse(null);
        if (target == null || target.getStatus() != KothTargetStatus.OPEN || target.getOwnerTeamId() == null) {
            return false;
        }
        OffsetDateTime now = competitionClock.now();
        OffsetDateTime from = accrualStart(target);
        long periodMs = target.getAccrualPeriodSeconds() * 1_000L;
        long fullPeriods = Duration.between(from, now).toMillis() / periodMs;
        if (fullPeriods <= 0) {
            return false;
        }
        KothClaim heldClaim = kothClaimRepository.findByOpenTargetId(targetId).orElse(null);
        if (heldClaim == null) {
            log.warn("KOTH target {} has owner {} but no open claim", targetId, target.getOwnerTeamId());
            return false;
        }

        OffsetDateTime periodEnd = from.plus(Duration.ofMillis(fullPeriods * periodMs));
        int advanced = kothTargetRepository.advanceAccrualIfVersion(
                targetId,
                periodEnd,
                now,
                KothTargetStatus.OPEN,
                target.getStateVersion()
        );
        if (advanced == 0) {
            log.debug("KOTH target {} changed during accrual tick; deferring to next tick", targetId);
            return false;
        }
        KothAccrual accrual = saveAccrual(
                target,
                heldClaim,
                Math.multiplyExact(fullPeriods, (long) target.getPointsPerPeriod()),
                from,
                periodEnd,
                now
        );
        scoreEventPublisher.publish(ScoreEvent.accrued(accrual));
        return true;
    }

    private Boolean closeTarget(UUID targetId, OffsetDateTime endedAt) {
        KothTarget target = kothTargetRepository.findById(targetId).orElse(null);
        if (target == null || target.getStatus() == KothTargetStatus.CLOSED) {
            return true;
        }
        KothClaim heldClaim = target.getOwnerTeamId() == null
                ? null
                : kothClaimRepository.findByOpenTargetId(targetId).orElse(null);

        OffsetDateTime now = competitionClock.now();
        OffsetDateTime creditUntil = endedAt != null && endedAt.isBefore(now) ? endedAt : now;
        int swapped = kothTargetRepository.closeIfVersion(
                targetId,
                creditUntil,
                now,
                KothTargetStatus.OPEN,
                KothTargetStatus.CLOSED,
                target.getStateVersion()
        );
        if (swapped == 0) {
            return false;
        }
        if (heldClaim != null) {
            KothAccrual finalAccrual = creditPartialHold(target, heldClaim, creditUntil, now);
            if (finalAccrual != null) {
                scoreEventPublisher.publish(ScoreEvent.accrued(finalAccrual));
            }
            release(heldClaim, now);
        }
        log.info("KOTH target {} closed; final owner {}", targetId, target.getOwnerTeamId());
        return true;
    }

    private KothAccrual creditPartialHold(
            KothTarget target,
            KothClaim heldClaim,
            OffsetDateTime creditUntil,
            OffsetDateTime creditedAt
    ) {
        OffsetDateTime from = accrualStart(target);
        long points = proportionalPoints(
                target.getPointsPerPeriod(),
                target.getAccrualPeriodSeconds(),
                Duration.between(from, creditUntil)
        );
        if (points <= 0) {
            return null;
        }
        return saveAccrual(target, heldClaim, points, from, creditUntil, creditedAt);
    }

    private KothAccrual saveAccrual(
            KothTarget target,
            KothClaim heldClaim,
            long points,
            OffsetDateTime periodStart,
            OffsetDateTime periodEnd,
            OffsetDateTime creditedAt
    ) {
        KothAccrual accrual = new KothAccrual();
        accrual.setAccrualId(UUID.randomUUID());
        accrual.setTargetId(target.getTargetId());
        accrual.setClaimId(heldClaim.getClaimId());
        accrual.setTeamId(heldClaim.getTeamId());
        accrual.setPoints(points);
        accrual.setPeriodStart(periodStart);
        accrual.setPeriodEnd(periodEnd);
        accrual.setCreditedAt(creditedAt);
        return kothAccrualRepository.save(accrual);
    }

    // The old claim must give up its open-target slot before the next claim is inserted.
    private void release(KothClaim heldClaim, OffsetDateTime now) {
        heldClaim.setReleasedAt(now);
        heldClaim.setOpenTargetId(null);
        kothClaimRepository.saveAndFlush(heldClaim);
    }

    private static OffsetDateTime accrualStart(KothTarget target) {
        return target.getAccruedUntil() != null ? target.getAccruedUntil() : target.getOwnerSince();
    }

    private KothTarget findTarget(UUID targetId) {
        return kothTargetRepository.findById(targetId)
                .orElseThrow(() -> new ResponseStatusException(
                        HttpStatus.NOT_FOUND,
                        "KOTH target not found: " + targetId
                ));
    }

    private static KothResponses.ClaimResult result(KothTarget target, KothClaimStatus status, long credited) {
        return new KothResponses.ClaimResult(
                target.getTargetId(),
                status,
                target.getOwnerTeamId(),
                target.getOwnerSince(),
                credited
        );
    }
}
