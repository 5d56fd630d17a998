package com.flagrank.service;

import com.flagrank.model.Challenge;
import com.flagrank.model.ChallengeScoringType;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;

/**
 * Point value snapshotted onto a solve. Static challenges always award their base value; dynamic
 * challenges decay geometrically with the number of earlier solves, never below the minimum.
 */
@Component
public class ChallengeValuePolicy {

    public int valueForNextSolve(Challenge challenge, long priorSolves) {
        if (challenge.getScoringType() != ChallengeScoringType.DYNAMIC) {
            return challenge.getPointValue();
        }
        int initial = challenge.getInitialValue() != null ? challenge.getInitialValue() : challenge.getPointValue();
        int minimum = challenge.getMinimumValue() != null ? challenge.getMinimumValue() : 0;
        BigDecimal decay = challenge.getDecayFactor();
        if (decay == null || priorSolves <= 0) {
            return Math.max(minimum, initial);
        }
        if (priorSolves > 999_999_999L) {
            return minimum;
        }
        BigDecimal decayed = decay.pow((int) priorSolves, MathContext.DECIMAL64)
                .multiply(BigDecimal.valueOf(initial));
        int floored = decayed.setScale(0, RoundingMode.FLOOR).intValue();
        return Math.max(minimum, floored);
    }
}
