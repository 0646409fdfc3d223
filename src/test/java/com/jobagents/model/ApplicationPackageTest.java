package com.jobagents.model;

import org.json.JSONObject;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class ApplicationPackageTest {

    @Test
    public void testForResume() {
        Candidate candidate = new Candidate(12L, "Data Engineer", "Acme", "Build pipelines.");
        ApplicationPackage pkg = ApplicationPackage.forDocument(GenerationKind.RESUME, candidate, 0.61,
                "generated/resumes/12_Acme_Data_Engineer.txt", "resume_agent");

        assertEquals(12L, pkg.getJobId());
        assertEquals("generated/resumes/12_Acme_Data_Engineer.txt", pkg.getResumePath());
        assertNull(pkg.getCoverLetterPath());
        assertEquals("resume_agent", new JSONObject(pkg.getMetadata()).getString("agent"));
    }

    @Test
    public void testForCoverLetter() {
        Candidate candidate = new Candidate(12L, "Data Engineer", "Acme", "Build pipelines.");
        ApplicationPackage pkg = ApplicationPackage.forDocument(GenerationKind.COVER_LETTER, candidate, 0.61,
                "letter.txt", "cover_letter_agent");

        assertNull(pkg.getResumePath());
        assertEquals("letter.txt", pkg.getCoverLetterPath());
    }
}
