package com.entity.canonical.extraction;

import com.entity.canonical.core.model.EntityType;
import com.entity.canonical.core.model.RawMention;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class JsonMentionParserTest {

    private final JsonMentionParser parser = new JsonMentionParser();

    @Test
    @DisplayName("Should parse an entities object")
    void testEntitiesObject() {
        String json = """
                {"entities": [
                  {"text": " Jeffrey Epstein ", "type": "PERSON", "context": "flew with", "position": 12},
                  {"text": "Palm Beach", "type": "location"}
                ]}
                """;

        List<RawMention> mentions = parser.parse(json, "doc-1#0");

        assertEquals(2, mentions.size());
        RawMention first = mentions.get(0);
        assertEquals("Jeffrey Epstein", first.text());
        assertEquals(EntityType.PERSON, first.type());
        assertEquals("flew with", first.context());
        assertEquals(12, first.position());
        assertEquals("doc-1#0", first.chunkRef());
        assertEquals(EntityType.LOCATION, mentions.get(1).type());
        assertNull(mentions.get(1).position());
    }

    @Test
    @DisplayName("Should parse a bare array")
    void testBareArray() {
        List<RawMention> mentions = parser.parse("[{\"text\": \"Interpol\", \"type\": \"Organization\"}]", null);

        assertEquals(1, mentions.size());
        assertEquals(EntityType.ORGANIZATION, mentions.get(0).type());
    }

    @Test
    @DisplayName("Should skip entries without text or with an unknown type")
    void testSkipInvalidEntries() {
        String json = """
                [
                  {"text": "", "type": "PERSON"},
                  {"type": "PERSON"},
                  {"text": "Tuesday", "type": "DATE"},
                  "not an object",
                  {"text": "Maxwell", "type": "PERSON"}
                ]
                """;

        List<RawMention> mentions = parser.parse(json, null);

        assertEquals(1, mentions.size());
        assertEquals("Maxwell", mentions.get(0).text());
    }

    @Test
    @DisplayName("Should drop negative or non-numeric positions and floor fractional ones")
    void testPositions() {
        String json = """
                [
                  {"text": "A", "type": "PERSON", "position": -3},
                  {"text": "B", "type": "PERSON", "position": "7"},
                  {"text": "C", "type": "PERSON", "position": 4.8}
                ]
                """;

        List<RawMention> mentions = parser.parse(json, null);

        assertNull(mentions.get(0).position());
        assertNull(mentions.get(1).position());
        assertEquals(4, mentions.get(2).position());
    }

    @ParameterizedTest
    @ValueSource(strings = {"not json", "{\"entities\": 3}", "{\"items\": []}", "42"})
    @DisplayName("Should reject payloads without an entity array")
    void testMalformed(String payload) {
        assertThrows(MalformedMentionException.class, () -> parser.parse(payload, null));
    }
}
