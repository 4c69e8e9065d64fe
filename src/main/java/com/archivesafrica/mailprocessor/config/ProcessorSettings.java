package com.archivesafrica.mailprocessor.config;

import com.archivesafrica.mailprocessor.exception.ConfigurationException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Settings loaded once at startup from the settings JSON file and handed to every component.
 * <p>
 * Layout:
 * <pre>
 * {
 *   "directories": { "staging": "sandbox", "success": "success", "error": "error", "output": "output" },
 *   "mailbox":     { "host": "imap.example.org", "port": 993, "username": "...", "password": "...", "folder": "INBOX" },
 *   "smtp":        { "host": "smtp.example.org", "port": 25, "username": "...", "password": "...", "from": "...", "starttls": false },
 *   "reports":     { "email": "admin@example.org",
 *                    "templates": { "failure_en": "reports/failure_en.txt", "success_en": "reports/success_en.txt" } }
 * }
 * </pre>
 * Relative paths are resolved against the current working directory.
 */
public class ProcessorSettings {

    private static final Logger logger = LoggerFactory.getLogger(ProcessorSettings.class);

    public Directories directories = new Directories();
    public Mailbox mailbox = new Mailbox();
    public Smtp smtp = new Smtp();
    public Reports reports = new Reports();

    /**
     * Reads settings from a JSON file. Unknown properties are ignored so older settings
     * files keep loading.
     *
     * @param file the settings file
     * @return parsed and validated settings
     * @throws ConfigurationException if the file is missing, unreadable or invalid
     */
    public static ProcessorSettings load(Path file) {
        if (!Files.isRegularFile(file)) {
            throw new ConfigurationException("Settings file not found: " + file.toAbsolutePath());
        }
        ObjectMapper mapper = new ObjectMapper()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        ProcessorSettings settings;
        try {
            settings = mapper.readValue(file.toFile(), ProcessorSettings.class);
        } catch (IOException e) {
            throw new ConfigurationException("Cannot read settings file " + file + ": " + e.getMessage(), e);
        }
        settings.validate();
        logger.debug("Settings loaded from {}", file);
        return settings;
    }

    /**
     * @throws ConfigurationException if a section is missing or a directory is not set.
     */
    public void validate() {
        if (directories == null) {
            throw new ConfigurationException("Missing 'directories' section");
        }
        requireNonBlank(directories.staging, "directories.staging");
        requireNonBlank(directories.success, "directories.success");
        requireNonBlank(directories.error, "directories.error");
        requireNonBlank(directories.output, "directories.output");
        if (mailbox == null) {
            mailbox = new Mailbox();
        }
        if (smtp == null) {
            smtp = new Smtp();
        }
        if (reports == null) {
            reports = new Reports();
        }
        if (reports.templates == null) {
            reports.templates = new LinkedHashMap<>();
        }
    }

    private static void requireNonBlank(String value, String name) {
        if (value == null || value.isBlank()) {
            throw new ConfigurationException("Missing setting: " + name);
        }
    }

    static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    public static class Directories {
        public String staging = "sandbox";
        public String success = "success";
        public String error = "error";
        public String output = "output";
    }

    /** IMAP account the attachments are collected from. */
    public static class Mailbox {
        public String host;
        public int port = 993;
        public String username;
        public String password;
        public String folder = "INBOX";

        public boolean isComplete() {
            return !isBlank(host) && !isBlank(username) && !isBlank(password);
        }
    }

    /** Relay used for the automated replies. */
    public static class Smtp {
        public String host;
        public int port = 25;
        public String username;
        public String password;
        public String from;
        public boolean starttls = false;

        public boolean isComplete() {
            return !isBlank(host);
        }

        public boolean hasCredentials() {
            return !isBlank(username) && !isBlank(password);
        }
    }

    /** Report recipients and localized report templates, keyed {@code failure_<lang>} / {@code success_<lang>}. */
    public static class Reports {
        public String email;
        public Map<String, String> templates = new LinkedHashMap<>();
    }
}
