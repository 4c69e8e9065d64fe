package com.archivesafrica.mailprocessor;

import java.io.IOException;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.TimeUnit;

import org.apache.poi.openxml4j.util.ZipSecureFile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.archivesafrica.mailprocessor.config.ProcessorConfig;
import com.archivesafrica.mailprocessor.config.ProcessorSettings;
import com.archivesafrica.mailprocessor.core.CollectionDocumentBuilder;
import com.archivesafrica.mailprocessor.core.RecordExtractor;
import com.archivesafrica.mailprocessor.core.RecordValidator;
import com.archivesafrica.mailprocessor.core.writers.XmlDocumentWriter;
import com.archivesafrica.mailprocessor.exception.ConfigurationException;
import com.archivesafrica.mailprocessor.intake.AttachmentIntake;
import com.archivesafrica.mailprocessor.intake.IntakeResult;
import com.archivesafrica.mailprocessor.mail.ImapMailboxClient;
import com.archivesafrica.mailprocessor.mail.MailSender;
import com.archivesafrica.mailprocessor.mail.MailboxClient;
import com.archivesafrica.mailprocessor.mail.ReportNotifier;
import com.archivesafrica.mailprocessor.mail.ReportTemplates;
import com.archivesafrica.mailprocessor.mail.SmtpMailSender;
import com.archivesafrica.mailprocessor.pipeline.DirectoryLayout;
import com.archivesafrica.mailprocessor.pipeline.PipelineOrchestrator;
import com.archivesafrica.mailprocessor.pipeline.PipelineReport;
import com.archivesafrica.mailprocessor.registry.RegistrySequenceStore;
import com.archivesafrica.mailprocessor.registry.SenderRegistry;

import jakarta.mail.MessagingException;
import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.core.config.Configurator;
import picocli.CommandLine;

/**
 * Main class of the collection mail processor.
 * <p>
 * One run: read the settings, create the working directories, download the attachments of
 * unread messages from registered senders into staging, then convert and route every staged
 * file. Meant to be started periodically (cron or a systemd timer); runs never overlap.
 *
 * @invariant Settings and registry are loaded once per run and passed to the components.
 */
public class CollectionMailProcessor {

    private static final Logger logger = LoggerFactory.getLogger(CollectionMailProcessor.class);

    private final ProcessorSettings settings;
    private final SenderRegistry registry;
    private final DirectoryLayout layout;
    private final AttachmentIntake intake;

    public CollectionMailProcessor(ProcessorSettings settings, SenderRegistry registry) {
        this.settings = settings;
        this.registry = registry;
        this.layout = DirectoryLayout.from(settings.directories);
        this.intake = new AttachmentIntake(registry, new RegistrySequenceStore(registry), layout.getStaging());
    }

    /**
     * Executes one run.
     *
     * @param mailbox source of unread messages, or null to only process what is already staged
     * @param mailSender transport for the automated replies
     * @return outcome of every staged file
     * @throws IOException if the working directories cannot be prepared or listed
     */
    public PipelineReport run(MailboxClient mailbox, MailSender mailSender) throws IOException {
        logger.info("Processor: preparing directories from the config");
        layout.prepare();

        logger.info("Processor: getting attachments");
        Map<Path, String> staged = mailbox == null ? new LinkedHashMap<>() : collect(mailbox);

        logger.info("Processor: processing attachments");
        ReportNotifier notifier = new ReportNotifier(mailSender, new ReportTemplates(settings.reports.templates),
                registry, settings.reports.email);
        PipelineOrchestrator orchestrator = new PipelineOrchestrator(layout, new RecordExtractor(),
                new RecordValidator(), new CollectionDocumentBuilder(), new XmlDocumentWriter(), notifier);
        return orchestrator.process(staged);
    }

    private Map<Path, String> collect(MailboxClient mailbox) {
        Map<Path, String> staged = new LinkedHashMap<>();
        try {
            int seen = mailbox.poll(message -> {
                IntakeResult result = intake.stage(message);
                staged.putAll(result.getStaged());
                // Partially failed messages are still marked read; unknown senders stay unread.
                return intake.accepts(message.getSender());
            });
            logger.info("Checked {} unread message(s), staged {} attachment(s)", seen, staged.size());
        } catch (MessagingException e) {
            logger.error("Mailbox poll failed: {}", e.getMessage(), e);
        }
        return staged;
    }

    /**
     * Main entry point for the application.
     *
     * @param args Command line arguments.
     * @post Staging is empty (every file routed) or the process exited with a non-zero code.
     */
    public static void main(String[] args) {
        if (args == null) {
            throw new IllegalArgumentException("args must not be null");
        }
        long startTime = System.nanoTime();
        logger.info("Processor: start");

        ProcessorConfig config = new ProcessorConfig();
        CommandLine cmd = new CommandLine(config);

        try {
            cmd.parseArgs(args);

            if (cmd.isUsageHelpRequested()) {
                cmd.usage(System.out);
                return;
            }
            if (cmd.isVersionHelpRequested()) {
                cmd.printVersionHelp(System.out);
                return;
            }

            config.validate();
            if (config.verbose) {
                enableVerboseLogging();
            }

            ZipSecureFile.setMinInflateRatio(config.minInflateRatio);
            logger.debug("ZipSecureFile.minInflateRatio set to: {}", config.minInflateRatio);

            logger.info("Processor: reading config");
            ProcessorSettings settings = ProcessorSettings.load(config.settingsFile);
            SenderRegistry registry = SenderRegistry.load(config.registryFile);

            MailboxClient mailbox = config.skipMailbox ? null : mailboxOrNull(settings);
            PipelineReport report = new CollectionMailProcessor(settings, registry).run(mailbox, mailSender(settings));
            logger.info("Processor: {}", report);

        } catch (CommandLine.ParameterException ex) {
            logger.error("Invalid parameter(s): {}", ex.getMessage());
            cmd.usage(System.err);
            System.exit(cmd.getCommandSpec().exitCodeOnInvalidInput());
        } catch (IllegalArgumentException | ConfigurationException ex) {
            logger.error("Configuration validation failed: {}", ex.getMessage());
            System.exit(1);
        } catch (Exception ex) {
            logger.error("An unexpected error occurred during processing: {}", ex.getMessage(), ex);
            System.exit(1);
        } finally {
            long durationMillis = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startTime);
            logger.info("Processor: end ({} ms)", durationMillis);
        }
    }

    private static MailboxClient mailboxOrNull(ProcessorSettings settings) {
        try {
            return new ImapMailboxClient(settings.mailbox);
        } catch (ConfigurationException e) {
            logger.error("{} Skipping mailbox, only staged files are processed.", e.getMessage());
            return null;
        }
    }

    private static MailSender mailSender(ProcessorSettings settings) {
        try {
            return new SmtpMailSender(settings.smtp);
        } catch (ConfigurationException e) {
            logger.error("{} Replies will not be sent.", e.getMessage());
            return (to, subject, body) -> {
                throw new MessagingException("SMTP is not configured");
            };
        }
    }

    private static void enableVerboseLogging() {
        Configurator.setAllLevels("com.archivesafrica", Level.DEBUG);
    }
}
