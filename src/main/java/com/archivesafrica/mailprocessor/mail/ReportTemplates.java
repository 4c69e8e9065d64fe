package com.archivesafrica.mailprocessor.mail;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Localized report texts, one file per report kind and language, registered under keys
 * like {@code failure_en} or {@code success_fr}.
 */
public class ReportTemplates {

    private static final Logger logger = LoggerFactory.getLogger(ReportTemplates.class);

    public enum Kind {
        FAILURE, SUCCESS;

        String key(String language) {
            return name().toLowerCase(Locale.ROOT) + "_" + language.toLowerCase(Locale.ROOT);
        }
    }

    private final Map<String, Path> files = new LinkedHashMap<>();

    /**
     * @param templates template key → file path
     */
    public ReportTemplates(Map<String, String> templates) {
        if (templates != null) {
            templates.forEach((key, path) -> files.put(key.toLowerCase(Locale.ROOT), Path.of(path)));
        }
    }

    /**
     * Reads the template text for a report kind and language.
     *
     * @return the text, or empty if no template is registered or the file cannot be read
     */
    public Optional<String> load(Kind kind, String language) {
        String key = kind.key(language);
        Path file = files.get(key);
        if (file == null) {
            logger.warn("No report template registered for '{}'", key);
            return Optional.empty();
        }
        try {
            return Optional.of(Files.readString(file, StandardCharsets.UTF_8));
        } catch (IOException e) {
            logger.warn("Cannot read report template '{}' from {}: {}", key, file, e.getMessage());
            return Optional.empty();
        }
    }
}
