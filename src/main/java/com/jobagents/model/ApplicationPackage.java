package com.jobagents.model;

import org.json.JSONObject;

import java.time.LocalDateTime;

/**
 * Record of a generated document for a posting, stored by the {@code PackageStore}.
 * Exactly one of {@code resumePath} / {@code coverLetterPath} is set per record.
 */
public class ApplicationPackage {
    private Long id;
    private long jobId;
    private String title;
    private String company;
    private double score;
    private String resumePath;
    private String coverLetterPath;
    private String metadata;
    private LocalDateTime createdAt;

    public ApplicationPackage() {
    }

    /**
     * Build the record for one generated document.
     *
     * @param kind which document was generated
     * @param candidate the posting
     * @param score match score that qualified the posting
     * @param documentPath where the document was written
     * @param agentName producing agent, stored in the metadata
     */
    public static ApplicationPackage forDocument(GenerationKind kind, Candidate candidate, double score,
                                                 String documentPath, String agentName) {
        ApplicationPackage pkg = new ApplicationPackage();
        pkg.setJobId(candidate.getId());
        pkg.setTitle(candidate.getTitle());
        pkg.setCompany(candidate.getCompany());
        pkg.setScore(score);
        if (kind == GenerationKind.RESUME) {
            pkg.setResumePath(documentPath);
        } else {
            pkg.setCoverLetterPath(documentPath);
        }
        pkg.setMetadata(new JSONObject().put("agent", agentName).toString());
        return pkg;
    }

    // Getters and Setters
    public Long getId() { return id; }
    public void setId(Long id) { this.id = id; }

    public long getJobId() { return jobId; }
    public void setJobId(long jobId) { this.jobId = jobId; }

    public String getTitle() { return title; }
    public void setTitle(String title) { this.title = title; }

    public String getCompany() { return company; }
    public void setCompany(String company) { this.company = company; }

    public double getScore() { return score; }
    public void setScore(double score) { this.score = score; }

    public String getResumePath() { return resumePath; }
    public void setResumePath(String resumePath) { this.resumePath = resumePath; }

    public String getCoverLetterPath() { return coverLetterPath; }
    public void setCoverLetterPath(String coverLetterPath) { this.coverLetterPath = coverLetterPath; }

    public String getMetadata() { return metadata; }
    public void setMetadata(String metadata) { this.metadata = metadata; }

    public LocalDateTime getCreatedAt() { return createdAt; }
    public void setCreatedAt(LocalDateTime createdAt) { this.createdAt = createdAt; }

    @Override
    public String toString() {
        return "ApplicationPackage{id=" + id + ", jobId=" + jobId + ", title='" + title + "'}";
    }
}
