package com.archivesafrica.mailprocessor.config;

import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.nio.file.Path;

/**
 * Command definition for the collection mail processor.
 * Uses picocli annotations to define command line arguments; everything else lives in the
 * settings file pointed to by {@code --config}.
 *
 * @invariant settingsFile != null && registryFile != null && minInflateRatio >= 0
 *           && configuration is not mutated after validation
 */
@Command(name = "collection-mail-processor",
         mixinStandardHelpOptions = true, // Adds --help and --version options
         version = "Collection Mail Processor 1.0.0",
         description = "Collects spreadsheet attachments from the mailbox, converts them to XML and routes them by outcome.")
public class ProcessorConfig {

    @Option(names = {"-c", "--config"}, description = "Path to the settings JSON file. Default: ${DEFAULT-VALUE}")
    public Path settingsFile = Path.of("processor.json");

    @Option(names = {"-r", "--registry"}, description = "Path to the sender registry JSON file. Default: ${DEFAULT-VALUE}")
    public Path registryFile = Path.of("senders.json");

    @Option(names = {"--skip-mailbox"}, description = "Do not poll the mailbox; only process files already in staging.")
    public boolean skipMailbox = false;

    @Option(names = {"--min-inflate-ratio"}, description = "Minimum XML inflation ratio for zip bomb protection (set to 0 to disable). Default: ${DEFAULT-VALUE}")
    public double minInflateRatio = 0.01; // POI default

    @Option(names = {"-v", "--verbose"}, description = "Enable verbose logging.")
    public boolean verbose = false;

    public ProcessorConfig() {}

    /**
     * Performs basic validation after picocli populates fields.
     * @throws IllegalArgumentException if validation fails.
     * @post Fields are not mutated after validation.
     */
    public void validate() {
        if (settingsFile == null) {
            throw new IllegalArgumentException("Settings file (--config) must be given");
        }
        if (registryFile == null) {
            throw new IllegalArgumentException("Registry file (--registry) must be given");
        }
        if (minInflateRatio < 0) {
            throw new IllegalArgumentException("Minimum inflate ratio cannot be negative: " + minInflateRatio);
        }
    }
}
