package com.archivesafrica.mailprocessor.registry;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

class SenderRegistryTest {

    @TempDir
    Path dir;

    @Test
    void loadsEntriesAndMatchesAddressesCaseInsensitively() throws IOException {
        Path file = dir.resolve("senders.json");
        Files.writeString(file, "{ \"Archivist@Example.org\": { \"code\": \"AX\", \"sequence\": 4, \"language\": \"fr\" } }");

        SenderRegistry registry = SenderRegistry.load(file);

        assertTrue(registry.isKnown("archivist@example.org"));
        assertTrue(registry.isKnown(" ARCHIVIST@example.ORG "));
        assertEquals("AX", registry.codeOf("archivist@example.org"));
        assertEquals(4, registry.sequenceOf("archivist@example.org"));
        assertEquals("fr", registry.languageOf("archivist@example.org"));
    }

    @Test
    void missingFileGivesEmptyRegistry() throws IOException {
        SenderRegistry registry = SenderRegistry.load(dir.resolve("absent.json"));

        assertFalse(registry.isKnown("a@x.org"));
        assertNull(registry.sequenceOf("a@x.org"));
        assertNull(registry.codeOf("a@x.org"));
    }

    @Test
    void unknownAndNullSendersAreNotKnown() throws IOException {
        SenderRegistry registry = SenderRegistry.load(dir.resolve("absent.json"));
        registry.register("a@x.org", "AX", null);

        assertFalse(registry.isKnown(null));
        assertFalse(registry.isKnown("b@x.org"));
    }

    @Test
    void languageDefaultsToEnglish() throws IOException {
        SenderRegistry registry = SenderRegistry.load(dir.resolve("absent.json"));
        registry.register("a@x.org", "AX", null);

        assertEquals(SenderRegistry.DEFAULT_LANGUAGE, registry.languageOf("a@x.org"));
        assertEquals(SenderRegistry.DEFAULT_LANGUAGE, registry.languageOf("nobody@x.org"));
    }

    @Test
    void counterOnlyEntryDoesNotRegisterAddress() throws IOException {
        SenderRegistry registry = SenderRegistry.load(dir.resolve("absent.json"));

        registry.setSequence("a@x.org", 7);

        assertFalse(registry.isKnown("a@x.org"));
        assertEquals(7, registry.sequenceOf("a@x.org"));
    }

    @Test
    void clearingCounterDropsCounterOnlyEntry() throws IOException {
        SenderRegistry registry = SenderRegistry.load(dir.resolve("absent.json"));
        registry.setSequence("a@x.org", 1);

        registry.setSequence("a@x.org", null);

        assertNull(registry.sequenceOf("a@x.org"));
    }

    @Test
    void registerKeepsExistingCounter() throws IOException {
        SenderRegistry registry = SenderRegistry.load(dir.resolve("absent.json"));
        registry.setSequence("a@x.org", 3);

        registry.register("A@x.org", "AX", "fr");

        assertTrue(registry.isKnown("a@x.org"));
        assertEquals(3, registry.sequenceOf("a@x.org"));
    }

    @Test
    void saveWritesJsonThatLoadsBack() throws IOException {
        Path file = dir.resolve("conf/senders.json");
        SenderRegistry registry = SenderRegistry.load(file);
        registry.register("a@x.org", "AX", "fr");
        registry.setSequence("a@x.org", 2);

        registry.save();

        JsonNode json = new ObjectMapper().readTree(file.toFile());
        assertEquals("AX", json.get("a@x.org").get("code").asText());
        assertEquals(2, json.get("a@x.org").get("sequence").asInt());

        SenderRegistry reloaded = SenderRegistry.load(file);
        assertEquals(2, reloaded.sequenceOf("a@x.org"));
        assertEquals("fr", reloaded.languageOf("a@x.org"));
        try (Stream<Path> files = Files.list(file.getParent())) {
            assertEquals(1, files.count());
        }
    }

    @Test
    void savedFileHoldsOnlyStoredFieldsAndReloadsAfterCounterAdvance() throws IOException {
        Path file = dir.resolve("senders.json");
        Files.writeString(file, "{\"a@x.org\":{\"code\":\"AX\",\"language\":\"en\"}}");
        SenderRegistry registry = SenderRegistry.load(file);

        assertEquals(1, new RegistrySequenceStore(registry).next("a@x.org"));

        JsonNode entry = new ObjectMapper().readTree(file.toFile()).get("a@x.org");
        assertEquals(3, entry.size());
        assertFalse(entry.has("registered"));
        SenderRegistry reloaded = SenderRegistry.load(file);
        assertTrue(reloaded.isKnown("a@x.org"));
        assertEquals(1, reloaded.sequenceOf("a@x.org"));
    }

    @Test
    void extraEntryPropertiesAreIgnoredOnLoad() throws IOException {
        Path file = dir.resolve("senders.json");
        Files.writeString(file, "{\"a@x.org\":{\"code\":\"AX\",\"sequence\":2,\"registered\":true,\"note\":\"legacy\"}}");

        SenderRegistry registry = SenderRegistry.load(file);

        assertTrue(registry.isKnown("a@x.org"));
        assertEquals(2, registry.sequenceOf("a@x.org"));
    }

    @Test
    void unparsableFileFailsToLoad() throws IOException {
        Path file = dir.resolve("senders.json");
        Files.writeString(file, "{ not json");

        assertThrows(IOException.class, () -> SenderRegistry.load(file));
    }
}
