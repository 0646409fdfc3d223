package com.jobagents.matching;

import com.jobagents.model.ReferenceMatch;

import java.util.List;

/**
 * Turns the per-reference matches returned by the scorer into one candidate score.
 *
 * <p>Per reference: the {@code combined_score} if present; otherwise
 * {@code min(1, similarity + weight * skill_overlap)} when both parts are present;
 * otherwise the bare {@code similarity}. Each reference score is clamped to [0, 1] and
 * references with no score at all are ignored. The candidate score is the arithmetic
 * mean, and 0.0 when nothing is left.</p>
 */
public class ScoreCombiner {

    private final double skillWeight;

    public ScoreCombiner(double skillWeight) {
        this.skillWeight = skillWeight;
    }

    public double combine(List<ReferenceMatch> matches) {
        if (matches == null || matches.isEmpty()) {
            return 0.0;
        }

        double sum = 0.0;
        int count = 0;
        for (ReferenceMatch match : matches) {
            Double score = referenceScore(match);
            if (score != null) {
                sum += score;
                count++;
            }
        }
        return count == 0 ? 0.0 : sum / count;
    }

    /**
     * @return the reference's score, or null if it carries none
     */
    Double referenceScore(ReferenceMatch match) {
        if (match == null) {
            return null;
        }
        if (match.getCombinedScore() != null) {
            return clamp(match.getCombinedScore());
        }
        Double similarity = match.getSimilarity();
        Double overlap = match.getSkillOverlap();
        if (similarity != null && overlap != null) {
            return clamp(similarity + skillWeight * overlap);
        }
        return similarity == null ? null : clamp(similarity);
    }

    private static double clamp(double score) {
        return Math.max(0.0, Math.min(1.0, score));
    }
}
