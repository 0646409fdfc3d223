package com.jobagents.matching;

/**
 * Tunable constants of the {@link MatchingEngine}.
 */
public final class MatcherSettings {
    public static final double DEFAULT_THRESHOLD = 0.46;
    public static final int DEFAULT_MIN_DESCRIPTION_LENGTH = 80;
    public static final int DEFAULT_POOL_WIDTH = 4;
    public static final double DEFAULT_SKILL_WEIGHT = 0.3;

    private final double threshold;
    private final int minDescriptionLength;
    private final int poolWidth;
    private final double skillWeight;

    /**
     * @param threshold minimum combined score for a candidate to be enqueued downstream
     * @param minDescriptionLength shorter descriptions are scored 0 without calling the scorer
     * @param poolWidth number of concurrent scoring calls
     * @param skillWeight weight of the skill overlap when a match carries no combined score
     * @throws IllegalArgumentException if poolWidth < 1 or a value is negative
     */
    public MatcherSettings(double threshold, int minDescriptionLength, int poolWidth, double skillWeight) {
        if (poolWidth < 1) {
            throw new IllegalArgumentException("Pool width must be at least 1, got " + poolWidth);
        }
        if (threshold < 0 || minDescriptionLength < 0 || skillWeight < 0) {
            throw new IllegalArgumentException("Matcher settings must not be negative");
        }
        this.threshold = threshold;
        this.minDescriptionLength = minDescriptionLength;
        this.poolWidth = poolWidth;
        this.skillWeight = skillWeight;
    }

    public static MatcherSettings defaults() {
        return new MatcherSettings(DEFAULT_THRESHOLD, DEFAULT_MIN_DESCRIPTION_LENGTH, DEFAULT_POOL_WIDTH,
                DEFAULT_SKILL_WEIGHT);
    }

    public double getThreshold() {
        return threshold;
    }

    public int getMinDescriptionLength() {
        return minDescriptionLength;
    }

    public int getPoolWidth() {
        return poolWidth;
    }

    public double getSkillWeight() {
        return skillWeight;
    }

    @Override
    public String toString() {
        return "MatcherSettings{threshold=" + threshold + ", minDescriptionLength=" + minDescriptionLength
                + ", poolWidth=" + poolWidth + ", skillWeight=" + skillWeight + "}";
    }
}
