package com.archivesafrica.mailprocessor.pipeline;

import com.archivesafrica.mailprocessor.config.ProcessorSettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Stream;

/**
 * The four working directories: staging (incoming attachments), success and error (routed
 * attachments) and output (generated documents).
 */
public class DirectoryLayout {

    private static final Logger logger = LoggerFactory.getLogger(DirectoryLayout.class);

    private final Path staging;
    private final Path success;
    private final Path error;
    private final Path output;

    public DirectoryLayout(Path staging, Path success, Path error, Path output) {
        this.staging = staging;
        this.success = success;
        this.error = error;
        this.output = output;
    }

    public static DirectoryLayout from(ProcessorSettings.Directories directories) {
        return new DirectoryLayout(Path.of(directories.staging), Path.of(directories.success),
                Path.of(directories.error), Path.of(directories.output));
    }

    /**
     * Creates any missing directory.
     *
     * @throws IOException if a directory cannot be created
     */
    public void prepare() throws IOException {
        for (Path dir : List.of(error, output, staging, success)) {
            if (!Files.isDirectory(dir)) {
                Files.createDirectories(dir);
                logger.info("Created directory: {}", dir.toAbsolutePath());
            }
        }
    }

    /**
     * @return regular files currently in staging, sorted by file name
     */
    public List<Path> listStaged() throws IOException {
        if (!Files.isDirectory(staging)) {
            return new ArrayList<>();
        }
        List<Path> files = new ArrayList<>();
        try (Stream<Path> stream = Files.list(staging)) {
            stream.filter(Files::isRegularFile)
                  .sorted(Comparator.comparing(p -> p.getFileName().toString()))
                  .forEach(files::add);
        }
        return files;
    }

    public Path moveToSuccess(Path file) throws IOException {
        return move(file, success);
    }

    public Path moveToError(Path file) throws IOException {
        return move(file, error);
    }

    private Path move(Path file, Path dir) throws IOException {
        Path target = dir.resolve(file.getFileName().toString());
        Files.move(file, target, StandardCopyOption.REPLACE_EXISTING);
        logger.debug("Moved {} to {}", file.getFileName(), dir);
        return target;
    }

    public Path getStaging() {
        return staging;
    }

    public Path getSuccess() {
        return success;
    }

    public Path getError() {
        return error;
    }

    public Path getOutput() {
        return output;
    }
}
