package com.jobagents.model;

import com.google.gson.annotations.SerializedName;

/**
 * A job posting as the pipeline sees it.
 *
 * <p>Postings that come back from the backend carry a stable numeric {@code id}.
 * Listings freshly pulled from a search adapter have no id yet; they get one when the
 * backend stores them. {@code sourceUrl} is transient identity (redirect links change
 * between fetches) and is never used for dedup, see {@link Fingerprint}.</p>
 */
public class Candidate {
    private Long id;
    private String title;
    private String company;
    private String location;
    private String description;
    @SerializedName("source_url")
    private String sourceUrl;

    // Needed by Gson
    public Candidate() {
    }

    public Candidate(Long id, String title, String company, String description) {
        this.id = id;
        this.title = title;
        this.company = company;
        this.description = description;
    }

    public Candidate(Long id, String title, String company, String location, String description, String sourceUrl) {
        this.id = id;
        this.title = title;
        this.company = company;
        this.location = location;
        this.description = description;
        this.sourceUrl = sourceUrl;
    }

    public Long getId() { return id; }

    public String getTitle() { return title == null ? "" : title; }

    public String getCompany() { return company == null ? "" : company; }

    public String getLocation() { return location == null ? "" : location; }

    public String getDescription() { return description == null ? "" : description; }

    public String getSourceUrl() { return sourceUrl == null ? "" : sourceUrl; }

    /**
     * @return a copy with the description cut to at most {@code maxChars} characters
     */
    public Candidate truncatedTo(int maxChars) {
        String desc = getDescription();
        if (desc.length() <= maxChars) {
            return this;
        }
        return new Candidate(id, title, company, location, desc.substring(0, maxChars), sourceUrl);
    }

    @Override
    public String toString() {
        return "Candidate{id=" + id + ", title='" + getTitle() + "', company='" + getCompany() + "'}";
    }
}
