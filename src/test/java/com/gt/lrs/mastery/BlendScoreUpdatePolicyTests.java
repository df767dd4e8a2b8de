package com.gt.lrs.mastery;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class BlendScoreUpdatePolicyTests {

    private static final double[] PRIOR_SCORES = { 0, 0.001, 0.1, 0.33, 0.5, 0.75, 0.999, 1 };
    private static final double[] WEIGHTS = { 0.01, 0.1, 0.25, 0.5, 0.9, 1 };

    @Test
    public void testFullWeight() {
        BlendScoreUpdatePolicy policy = new BlendScoreUpdatePolicy(1.0);

        assertEquals(1.0, policy.updateScore(0.0, true));
        assertEquals(1.0, policy.updateScore(0.42, true));
        assertEquals(0.0, policy.updateScore(1.0, false));
        assertEquals(0.0, policy.updateScore(0.42, false));
    }

    @Test
    public void testPartialWeight() {
        BlendScoreUpdatePolicy policy = new BlendScoreUpdatePolicy(0.5);

        assertEquals(0.75, policy.updateScore(0.5, true), 1e-9);
        assertEquals(0.25, policy.updateScore(0.5, false), 1e-9);
    }

    @Test
    public void testMonotone() {
        for (double weight : WEIGHTS) {
            BlendScoreUpdatePolicy policy = new BlendScoreUpdatePolicy(weight);
            for (double prior : PRIOR_SCORES) {
                double passed = policy.updateScore(prior, true);
                double failed = policy.updateScore(prior, false);

                assertTrue(passed >= prior && passed <= 1, "pass lowered score " + prior + " with weight " + weight);
                assertTrue(failed <= prior && failed >= 0, "fail raised score " + prior + " with weight " + weight);
            }
        }
    }

    @Test
    public void testInvalidWeight() {
        assertThrows(IllegalArgumentException.class, () -> new BlendScoreUpdatePolicy(0));
        assertThrows(IllegalArgumentException.class, () -> new BlendScoreUpdatePolicy(-0.5));
        assertThrows(IllegalArgumentException.class, () -> new BlendScoreUpdatePolicy(1.5));
        assertThrows(IllegalArgumentException.class, () -> new BlendScoreUpdatePolicy(Double.NaN));
    }
}
