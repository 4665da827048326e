package com.datakeeper.policy;

import com.datakeeper.config.ExceptionRule;

import java.util.Optional;

/**
 * Default implementation of EvaluationResult.
 */
public class DefaultEvaluationResult implements EvaluationResult {

    private final boolean accepted;
    private final Long effectiveRetentionTime;
    private final ExceptionRule matchedException;
    private final String explanation;

    private DefaultEvaluationResult(boolean accepted, Long effectiveRetentionTime,
                                    ExceptionRule matchedException, String explanation) {
        this.accepted = accepted;
        this.effectiveRetentionTime = effectiveRetentionTime;
        this.matchedException = matchedException;
        this.explanation = explanation;
    }

    @Override
    public boolean isAccepted() {
        return accepted;
    }

    @Override
    public Optional<Long> getEffectiveRetentionTime() {
        return Optional.ofNullable(effectiveRetentionTime);
    }

    @Override
    public Optional<ExceptionRule> getMatchedException() {
        return Optional.ofNullable(matchedException);
    }

    @Override
    public String getExplanation() {
        return explanation;
    }

    @Override
    public String toString() {
        return "EvaluationResult{" +
                "accepted=" + accepted +
                ", retention=" + effectiveRetentionTime +
                ", exception=" + (matchedException != null ? matchedException.condition() : "none") +
                '}';
    }

    /**
     * Create a result for an accepted context.
     */
    public static EvaluationResult accepted(Long retentionTime, ExceptionRule matchedException) {
        String explanation = matchedException != null
                ? "Matched exception '" + matchedException.condition() + "' | Retention: " + retentionTime
                : "Matched selector | Retention: " + (retentionTime != null ? retentionTime : "n/a");
        return new DefaultEvaluationResult(true, retentionTime, matchedException, explanation);
    }

    /**
     * Create a result for a rejected context.
     */
    public static EvaluationResult rejected(String reason) {
        return new DefaultEvaluationResult(false, null, null, reason);
    }
}
