package com.archivesafrica.mailprocessor.registry;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Registry of known senders, persisted as a JSON object keyed by email address:
 * <pre>
 * {
 *   "a@x.org": { "code": "AX", "sequence": 4, "language": "fr" }
 * }
 * </pre>
 * Addresses are matched case-insensitively. The file is read once on {@link #load(Path)}
 * and rewritten in full by {@link #save()} through a temp file and a rename, so a crash
 * leaves either the old or the new content on disk.
 *
 * @invariant Single writer: one run owns the registry file at a time.
 */
public class SenderRegistry {

    private static final Logger logger = LoggerFactory.getLogger(SenderRegistry.class);
    private static final TypeReference<LinkedHashMap<String, SenderProfile>> PROFILES_TYPE =
            new TypeReference<LinkedHashMap<String, SenderProfile>>() {};

    public static final String DEFAULT_LANGUAGE = "en";

    private final Path file;
    private final ObjectMapper mapper;
    private final Map<String, SenderProfile> profiles = new LinkedHashMap<>();

    SenderRegistry(Path file, Map<String, SenderProfile> initial) {
        this.file = file;
        this.mapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);
        initial.forEach((address, profile) -> profiles.put(normalize(address), profile));
    }

    /**
     * Loads the registry from {@code file}. A missing file yields an empty registry that
     * will be created on the first {@link #save()}.
     *
     * @throws IOException if the file exists but cannot be read or parsed
     */
    public static SenderRegistry load(Path file) throws IOException {
        Map<String, SenderProfile> initial = new LinkedHashMap<>();
        if (Files.exists(file)) {
            Map<String, SenderProfile> read = new ObjectMapper().readValue(file.toFile(), PROFILES_TYPE);
            if (read != null) {
                initial.putAll(read);
            }
            logger.info("Loaded {} sender(s) from {}", initial.size(), file);
        } else {
            logger.warn("Sender registry {} does not exist; starting empty", file);
        }
        return new SenderRegistry(file, initial);
    }

    /**
     * Adds or replaces a sender entry in memory. Call {@link #save()} to persist it.
     */
    public void register(String address, String code, String language) {
        SenderProfile existing = profiles.get(normalize(address));
        Integer sequence = existing == null ? null : existing.sequence;
        profiles.put(normalize(address), new SenderProfile(code, sequence, language));
    }

    /**
     * @return true if the address has an entry with a short code.
     */
    public boolean isKnown(String address) {
        if (address == null) {
            return false;
        }
        SenderProfile profile = profiles.get(normalize(address));
        return profile != null && profile.isRegistered();
    }

    public String codeOf(String address) {
        SenderProfile profile = profiles.get(normalize(address));
        return profile == null ? null : profile.code;
    }

    /**
     * @return the preferred report language, or {@value #DEFAULT_LANGUAGE} if none is set.
     */
    public String languageOf(String address) {
        SenderProfile profile = profiles.get(normalize(address));
        if (profile == null || profile.language == null || profile.language.isBlank()) {
            return DEFAULT_LANGUAGE;
        }
        return profile.language.trim();
    }

    /**
     * @return the last sequence number handed out to the address, or null if it has none.
     */
    public Integer sequenceOf(String address) {
        SenderProfile profile = profiles.get(normalize(address));
        return profile == null ? null : profile.sequence;
    }

    /**
     * Sets the counter in memory. A null value clears it; a counter-only entry is then dropped.
     */
    void setSequence(String address, Integer sequence) {
        String key = normalize(address);
        SenderProfile profile = profiles.get(key);
        if (profile == null) {
            if (sequence == null) {
                return;
            }
            profile = new SenderProfile();
            profiles.put(key, profile);
        }
        profile.sequence = sequence;
        if (sequence == null && !profile.isRegistered() && profile.language == null) {
            profiles.remove(key);
        }
    }

    /**
     * Rewrites the registry file atomically.
     *
     * @post The file holds the current in-memory state and has been forced to disk.
     * @throws IOException if writing or renaming fails; the previous file is left intact.
     */
    public synchronized void save() throws IOException {
        Path parent = file.toAbsolutePath().getParent();
        Files.createDirectories(parent);
        Path temp = Files.createTempFile(parent, file.getFileName().toString(), ".tmp");
        try {
            byte[] content = mapper.writeValueAsBytes(profiles);
            try (FileChannel channel = FileChannel.open(temp, StandardOpenOption.WRITE, StandardOpenOption.TRUNCATE_EXISTING)) {
                ByteBuffer buffer = ByteBuffer.wrap(content);
                while (buffer.hasRemaining()) {
                    channel.write(buffer);
                }
                channel.force(true);
            }
            try {
                Files.move(temp, file, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                logger.debug("Atomic move not supported for {}, falling back to replace", file);
                Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING);
            }
        } finally {
            Files.deleteIfExists(temp);
        }
    }

    public Path getFile() {
        return file;
    }

    private static String normalize(String address) {
        return address.trim().toLowerCase(Locale.ROOT);
    }
}
