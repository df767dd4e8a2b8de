package com.gt.lrs.mastery;

/**
 * Decides the new mastery score after a single test answer. Implementations must never lower the score for a passed
 * answer and never raise it for a failed one. Results outside [0,1] are clamped by the caller.
 */
public interface ScoreUpdatePolicy {

    double updateScore(double priorScore, boolean passed);
}
