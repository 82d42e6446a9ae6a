package com.entity.canonical.extraction;

import com.entity.canonical.core.model.RawMention;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Replays precomputed extractor output stored as {@code <documentId>.json} (single chunk)
 * or {@code <documentId>.<chunkIndex>.json} files in a directory.
 * A missing file yields no mentions; an unreadable file is a retryable error and an
 * unparseable one is fatal.
 */
public class JsonDirectoryMentionExtractor implements MentionExtractor {
    private static final Logger log = LoggerFactory.getLogger(JsonDirectoryMentionExtractor.class);

    private final Path directory;
    private final JsonMentionParser parser;

    public JsonDirectoryMentionExtractor(Path directory) {
        this(directory, new JsonMentionParser());
    }

    public JsonDirectoryMentionExtractor(Path directory, JsonMentionParser parser) {
        this.directory = directory;
        this.parser = parser;
    }

    @Override
    public ExtractionResult extract(String documentId, int chunkIndex, String chunkText) {
        Path file = resolve(documentId, chunkIndex);
        if (file == null) {
            log.debug("extraction.payload.missing documentId={} chunk={}", documentId, chunkIndex);
            return ExtractionResult.ok(List.of());
        }
        String json;
        try {
            json = Files.readString(file, StandardCharsets.UTF_8);
        } catch (IOException e) {
            log.warn("extraction.payload.unreadable file={} error={}", file, e.getMessage());
            return ExtractionResult.retryable("Cannot read " + file + ": " + e.getMessage());
        }
        try {
            List<RawMention> mentions = parser.parse(json, documentId + "#" + chunkIndex);
            return ExtractionResult.ok(mentions);
        } catch (MalformedMentionException e) {
            return ExtractionResult.fatal(file.getFileName() + ": " + e.getMessage());
        }
    }

    private Path resolve(String documentId, int chunkIndex) {
        Path chunkFile = directory.resolve(documentId + "." + chunkIndex + ".json");
        if (Files.isRegularFile(chunkFile)) {
            return chunkFile;
        }
        Path documentFile = directory.resolve(documentId + ".json");
        if (chunkIndex == 0 && Files.isRegularFile(documentFile)) {
            return documentFile;
        }
        return null;
    }
}
