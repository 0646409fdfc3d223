package com.jobagents.model;

import com.google.gson.annotations.SerializedName;

/**
 * One reference artifact (project, write-up, code sample) that the scoring service found
 * relevant to a posting, with the scores it computed.
 *
 * <p>Any score may be missing: older scoring responses carry only {@code similarity}.</p>
 */
public class ReferenceMatch {
    @SerializedName("artifact_id")
    private Long artifactId;
    private String name;
    private Double similarity;
    @SerializedName("skill_overlap")
    private Double skillOverlap;
    @SerializedName("combined_score")
    private Double combinedScore;
    private String source;

    // Needed by Gson
    public ReferenceMatch() {
    }

    public ReferenceMatch(Long artifactId, String name, Double similarity, Double skillOverlap, Double combinedScore) {
        this.artifactId = artifactId;
        this.name = name;
        this.similarity = similarity;
        this.skillOverlap = skillOverlap;
        this.combinedScore = combinedScore;
    }

    /**
     * Match that only carries a combined score.
     */
    public static ReferenceMatch scored(String name, double combinedScore) {
        return new ReferenceMatch(null, name, null, null, combinedScore);
    }

    public Long getArtifactId() { return artifactId; }
    public String getName() { return name; }
    public Double getSimilarity() { return similarity; }
    public Double getSkillOverlap() { return skillOverlap; }
    public Double getCombinedScore() { return combinedScore; }
    public String getSource() { return source; }

    @Override
    public String toString() {
        return "ReferenceMatch{name='" + name + "', similarity=" + similarity
                + ", skillOverlap=" + skillOverlap + ", combined=" + combinedScore + "}";
    }
}
