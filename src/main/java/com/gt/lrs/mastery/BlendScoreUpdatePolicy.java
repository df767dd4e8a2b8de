package com.gt.lrs.mastery;

import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Moves the score a fixed fraction of the way towards 1 on a pass and towards 0 on a failure. With a weight of 1 the
 * score simply becomes 1 or 0.
 */
@Component
public class BlendScoreUpdatePolicy implements ScoreUpdatePolicy {

    private final double blendWeight;

    @Autowired
    public BlendScoreUpdatePolicy(@Value("${lrs.mastery.blendWeight:1.0}") double blendWeight) {
        if (!(blendWeight > 0 && blendWeight <= 1)) {
            throw new IllegalArgumentException("lrs.mastery.blendWeight must be in (0, 1], got: " + blendWeight);
        }

        this.blendWeight = blendWeight;
    }

    @Override
    public double updateScore(double priorScore, boolean passed) {
        double target = passed ? 1 : 0;
        double updated = priorScore + blendWeight * (target - priorScore);

        // keep rounding error from breaking monotonicity
        return passed ? Math.max(priorScore, updated) : Math.min(priorScore, updated);
    }
}
