package com.entity.canonical.extraction;

import com.entity.canonical.core.model.EntityType;
import com.entity.canonical.core.model.RawMention;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Parses extractor JSON into raw mentions.
 *
 * <p>Accepts {@code {"entities": [...]}} or a bare array. Each entry carries {@code text},
 * {@code type} (PERSON, LOCATION or ORGANIZATION), and optionally {@code context} and
 * {@code position}. Entries without text or with an unknown type are skipped; a
 * non-numeric or negative position is dropped.</p>
 */
public class JsonMentionParser {
    private static final Logger log = LoggerFactory.getLogger(JsonMentionParser.class);

    private final ObjectMapper objectMapper;

    public JsonMentionParser() {
        this(new ObjectMapper());
    }

    public JsonMentionParser(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * @throws MalformedMentionException if the payload is not JSON or has no entity array
     */
    public List<RawMention> parse(String json, String chunkRef) {
        JsonNode root;
        try {
            root = objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new MalformedMentionException("Extractor payload is not valid JSON", e);
        }
        JsonNode entities = root != null && root.isObject() ? root.get("entities") : root;
        if (entities == null || !entities.isArray()) {
            throw new MalformedMentionException("Extractor payload has no entity array");
        }

        List<RawMention> mentions = new ArrayList<>();
        int skipped = 0;
        for (JsonNode entry : entities) {
            String text = textOf(entry, "text");
            EntityType type = EntityType.fromLabel(textOf(entry, "type"));
            if (text == null || text.isBlank() || type == null) {
                skipped++;
                continue;
            }
            JsonNode positionNode = entry.get("position");
            Integer position = positionNode != null && positionNode.isNumber() && positionNode.asDouble() >= 0
                    ? (int) Math.floor(positionNode.asDouble())
                    : null;
            mentions.add(new RawMention(text.trim(), type, textOf(entry, "context"), position, chunkRef));
        }
        if (skipped > 0) {
            log.debug("extraction.entries.skipped count={} chunkRef={}", skipped, chunkRef);
        }
        return mentions;
    }

    private static String textOf(JsonNode entry, String field) {
        if (entry == null || !entry.isObject()) {
            return null;
        }
        JsonNode node = entry.get(field);
        return node != null && node.isTextual() ? node.asText() : null;
    }
}
