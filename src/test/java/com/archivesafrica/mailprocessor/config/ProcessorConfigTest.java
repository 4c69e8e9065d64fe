package com.archivesafrica.mailprocessor.config;

import org.junit.jupiter.api.Test;
import picocli.CommandLine;

import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class ProcessorConfigTest {

    @Test
    void defaultsApplyWithoutArguments() {
        ProcessorConfig config = new ProcessorConfig();
        new CommandLine(config).parseArgs();

        assertEquals(Path.of("processor.json"), config.settingsFile);
        assertEquals(Path.of("senders.json"), config.registryFile);
        assertFalse(config.skipMailbox);
        assertFalse(config.verbose);
        assertEquals(0.01, config.minInflateRatio);
        assertDoesNotThrow(config::validate);
    }

    @Test
    void parsesAllOptions() {
        ProcessorConfig config = new ProcessorConfig();
        new CommandLine(config).parseArgs("-c", "conf/processor.json", "--registry", "conf/senders.json",
                "--skip-mailbox", "--min-inflate-ratio", "0.005", "-v");

        assertEquals(Path.of("conf/processor.json"), config.settingsFile);
        assertEquals(Path.of("conf/senders.json"), config.registryFile);
        assertTrue(config.skipMailbox);
        assertTrue(config.verbose);
        assertEquals(0.005, config.minInflateRatio);
    }

    @Test
    void negativeInflateRatioFailsValidation() {
        ProcessorConfig config = new ProcessorConfig();
        new CommandLine(config).parseArgs("--min-inflate-ratio=-1");

        assertThrows(IllegalArgumentException.class, config::validate);
    }

    @Test
    void unknownOptionIsRejected() {
        assertThrows(CommandLine.ParameterException.class,
                () -> new CommandLine(new ProcessorConfig()).parseArgs("--no-such-option"));
    }
}
