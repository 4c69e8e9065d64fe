package com.archivesafrica.mailprocessor.config;

import com.archivesafrica.mailprocessor.exception.ConfigurationException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class ProcessorSettingsTest {

    @TempDir
    Path dir;

    @Test
    void loadsAllSections() throws IOException {
        Path file = Files.writeString(dir.resolve("processor.json"), "{\n"
                + "  \"directories\": { \"staging\": \"in\", \"success\": \"ok\", \"error\": \"ko\", \"output\": \"xml\" },\n"
                + "  \"mailbox\": { \"host\": \"imap.example.org\", \"username\": \"inbox\", \"password\": \"secret\" },\n"
                + "  \"smtp\": { \"host\": \"smtp.example.org\", \"port\": 587, \"starttls\": true, \"from\": \"noreply@example.org\" },\n"
                + "  \"reports\": { \"email\": \"admin@example.org\", \"templates\": { \"failure_en\": \"reports/failure_en.txt\" } },\n"
                + "  \"legacy\": true\n"
                + "}");

        ProcessorSettings settings = ProcessorSettings.load(file);

        assertEquals("in", settings.directories.staging);
        assertEquals("xml", settings.directories.output);
        assertEquals(993, settings.mailbox.port);
        assertEquals("INBOX", settings.mailbox.folder);
        assertTrue(settings.mailbox.isComplete());
        assertEquals(587, settings.smtp.port);
        assertTrue(settings.smtp.starttls);
        assertTrue(settings.smtp.isComplete());
        assertFalse(settings.smtp.hasCredentials());
        assertEquals("admin@example.org", settings.reports.email);
        assertEquals("reports/failure_en.txt", settings.reports.templates.get("failure_en"));
    }

    @Test
    void missingSectionsGetDefaults() throws IOException {
        Path file = Files.writeString(dir.resolve("processor.json"), "{ \"mailbox\": null, \"reports\": null }");

        ProcessorSettings settings = ProcessorSettings.load(file);

        assertEquals("sandbox", settings.directories.staging);
        assertFalse(settings.mailbox.isComplete());
        assertFalse(settings.smtp.isComplete());
        assertNotNull(settings.reports.templates);
    }

    @Test
    void blankDirectoryIsRejected() throws IOException {
        Path file = Files.writeString(dir.resolve("processor.json"), "{ \"directories\": { \"output\": \" \" } }");

        ConfigurationException e = assertThrows(ConfigurationException.class, () -> ProcessorSettings.load(file));
        assertTrue(e.getMessage().contains("directories.output"));
    }

    @Test
    void missingOrBrokenFileIsAConfigurationError() throws IOException {
        assertThrows(ConfigurationException.class, () -> ProcessorSettings.load(dir.resolve("absent.json")));

        Path broken = Files.writeString(dir.resolve("broken.json"), "{ \"directories\": ");
        assertThrows(ConfigurationException.class, () -> ProcessorSettings.load(broken));
    }
}
