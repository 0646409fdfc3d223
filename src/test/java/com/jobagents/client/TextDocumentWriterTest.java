package com.jobagents.client;

import com.jobagents.core.Result;
import com.jobagents.model.Candidate;
import com.jobagents.model.GenerationKind;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

public class TextDocumentWriterTest {

    @TempDir
    Path tempDir;

    @Test
    public void testSafeFileName() {
        assertEquals("Senior_Data_Engineer", TextDocumentWriter.safeFileName(" Senior Data Engineer "));
        assertEquals("Acme__Co_Inc", TextDocumentWriter.safeFileName("Acme & Co. Inc"));
        assertEquals("", TextDocumentWriter.safeFileName(null));
    }

    @Test
    public void testWritesUnderKindDirectory() throws Exception {
        TextDocumentWriter writer = new TextDocumentWriter(tempDir);
        Candidate candidate = new Candidate(9L, "Data Engineer (NYC)", "Acme, Inc.", "desc");

        Result<Path> written = writer.write(GenerationKind.COVER_LETTER, candidate, "Dear Acme");

        assertTrue(written.isOk());
        assertEquals(tempDir.resolve("cover_letters").resolve("9_Acme_Inc_Data_Engineer_NYC.txt"), written.get());
        assertEquals("Dear Acme", Files.readString(written.get(), StandardCharsets.UTF_8));
    }
}
