package com.jobagents.client;

import com.jobagents.core.Result;
import com.jobagents.model.Candidate;
import com.jobagents.model.GenerationKind;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Writes generated documents as UTF-8 text files:
 * {@code <outputDir>/<kind dir>/<id>_<Company>_<Title>.txt}.
 */
public class TextDocumentWriter implements DocumentWriter {

    private final Path outputDirectory;

    public TextDocumentWriter(Path outputDirectory) {
        this.outputDirectory = outputDirectory;
    }

    @Override
    public Result<Path> write(GenerationKind kind, Candidate candidate, String text) {
        Path dir = outputDirectory.resolve(kind.getDirectoryName());
        String fileName = candidate.getId() + "_" + safeFileName(candidate.getCompany())
                + "_" + safeFileName(candidate.getTitle()) + ".txt";
        Path target = dir.resolve(fileName);
        try {
            Files.createDirectories(dir);
            Files.writeString(target, text, StandardCharsets.UTF_8);
            return Result.ok(target);
        } catch (IOException e) {
            return Result.failure("Failed to write " + target, e);
        }
    }

    /**
     * Spaces become underscores, everything outside {@code [A-Za-z0-9_]} is dropped.
     */
    public static String safeFileName(String text) {
        if (text == null) {
            return "";
        }
        return text.strip().replace(" ", "_").replaceAll("[^A-Za-z0-9_]+", "");
    }
}
