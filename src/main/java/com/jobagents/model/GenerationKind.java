package com.jobagents.model;

/**
 * The documents the generation stage produces for a matched posting.
 */
public enum GenerationKind {
    RESUME("Resume", "resumes"),
    COVER_LETTER("Cover letter", "cover_letters");

    private final String displayName;
    private final String directoryName;

    GenerationKind(String displayName, String directoryName) {
        this.displayName = displayName;
        this.directoryName = directoryName;
    }

    public String getDisplayName() {
        return displayName;
    }

    /**
     * @return sub-directory of the output directory that holds documents of this kind
     */
    public String getDirectoryName() {
        return directoryName;
    }

    @Override
    public String toString() {
        return displayName;
    }
}
