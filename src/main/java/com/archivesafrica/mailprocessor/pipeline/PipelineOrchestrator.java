package com.archivesafrica.mailprocessor.pipeline;

import com.archivesafrica.mailprocessor.core.CollectionDocumentBuilder;
import com.archivesafrica.mailprocessor.core.NormalizedRecord;
import com.archivesafrica.mailprocessor.core.RecordExtractor;
import com.archivesafrica.mailprocessor.core.RecordValidator;
import com.archivesafrica.mailprocessor.core.TermSheet;
import com.archivesafrica.mailprocessor.core.ValidationResult;
import com.archivesafrica.mailprocessor.core.writers.DocumentWriter;
import com.archivesafrica.mailprocessor.exception.MalformedSpreadsheetException;
import com.archivesafrica.mailprocessor.intake.AttachmentIntake;
import com.archivesafrica.mailprocessor.mail.ReportNotifier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.w3c.dom.Document;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Drives every staged attachment through extraction, validation, document building and routing.
 * <p>
 * Per file: {@code Staged → Extracted → {Invalid, Valid} → {ErrorRouted, SuccessRouted}}.
 * Failures are contained per file: whatever happens to one file, the remaining files are still
 * processed, the failing file ends up in the error directory and none of its documents is left
 * in the output directory.
 *
 * @invariant After {@link #process(Map)} returns, every file that was in staging when it
 *      started has been moved out, unless the move itself failed (logged).
 * @invariant Only files present in staging are touched; re-running on an empty staging
 *      directory does nothing.
 */
public class PipelineOrchestrator {

    private static final Logger logger = LoggerFactory.getLogger(PipelineOrchestrator.class);

    private final DirectoryLayout layout;
    private final RecordExtractor extractor;
    private final RecordValidator validator;
    private final CollectionDocumentBuilder builder;
    private final DocumentWriter writer;
    private final ReportNotifier notifier;

    public PipelineOrchestrator(DirectoryLayout layout, RecordExtractor extractor, RecordValidator validator,
                                CollectionDocumentBuilder builder, DocumentWriter writer, ReportNotifier notifier) {
        this.layout = layout;
        this.extractor = extractor;
        this.validator = validator;
        this.builder = builder;
        this.writer = writer;
        this.notifier = notifier;
    }

    /**
     * Processes every file currently in staging, in file name order.
     *
     * @param owners staged file → sender address, as produced by intake
     * @return the outcome of each file
     * @throws IOException if the staging directory cannot be listed
     */
    public PipelineReport process(Map<Path, String> owners) throws IOException {
        PipelineReport report = new PipelineReport();
        if (owners.isEmpty()) {
            logger.info("No attachments found");
        } else {
            logger.debug("Processing attachments: {}", owners);
        }

        Map<Path, String> byLocation = new HashMap<>();
        owners.forEach((path, sender) -> byLocation.put(key(path), sender));

        for (Path file : layout.listStaged()) {
            FileOutcome outcome = processFile(file, byLocation.get(key(file)));
            report.record(file, outcome);
        }
        logger.info("Pipeline finished: {}", report);
        return report;
    }

    private FileOutcome processFile(Path file, String owner) {
        String name = file.getFileName().toString();
        if (!name.toLowerCase(Locale.ROOT).endsWith(AttachmentIntake.STAGED_EXTENSION)) {
            logger.warn("Moving file with unsupported extension to error: {}", file);
            routeToError(file);
            return FileOutcome.UNSUPPORTED;
        }
        if (owner == null) {
            logger.warn("Moving file that is not associated with an email address to error: {}", file);
            routeToError(file);
            return FileOutcome.UNOWNED;
        }

        logger.info("{}: processing attachment", file);
        List<Path> produced = new ArrayList<>();
        try {
            NormalizedRecord record = extractor.extract(file);

            ValidationResult validation = validator.validate(record);
            if (!validation.isValid()) {
                logger.warn("{}: has missing fields {}", file, validation.getMissingFields());
                layout.moveToError(file);
                notifier.sendFailureReport(owner, validation.getMissingFieldList());
                return FileOutcome.INVALID;
            }

            Map<Path, Document> documents = buildDocuments(file, record);
            Path primary = documents.keySet().iterator().next();
            for (Map.Entry<Path, Document> entry : documents.entrySet()) {
                writer.write(entry.getValue(), entry.getKey());
                produced.add(entry.getKey());
            }

            layout.moveToSuccess(file);
            notifier.sendSuccessReport(owner, primary);
            return FileOutcome.SUCCESS_ROUTED;
        } catch (MalformedSpreadsheetException e) {
            logger.error("{}: failed to process: {}", file, e.getMessage());
            discard(produced);
            routeToError(file);
            return FileOutcome.MALFORMED;
        } catch (Exception e) {
            logger.error("{}: failed to process: {}", file, e.getMessage(), e);
            discard(produced);
            routeToError(file);
            return FileOutcome.FAILED;
        } finally {
            logger.info("{}: processed attachment", file);
        }
    }

    /**
     * Builds the collection document and one vocabulary document per secondary sheet, keyed by
     * destination. The collection document comes first.
     *
     * @throws MalformedSpreadsheetException if two sheets would be written to the same file
     */
    private Map<Path, Document> buildDocuments(Path file, NormalizedRecord record) {
        String base = baseName(file);
        Map<Path, Document> documents = new LinkedHashMap<>();
        documents.put(layout.getOutput().resolve(base + writer.extension()), builder.buildPrimary(record));

        List<TermSheet> sheets = extractor.extractTermSheets(file);
        for (TermSheet sheet : sheets) {
            String root = CollectionDocumentBuilder.rootName(sheet);
            Path target = layout.getOutput().resolve(base + "_" + root + writer.extension());
            if (documents.containsKey(target)) {
                throw new MalformedSpreadsheetException("Sheet '" + sheet.getSheetName() + "' yields the same document name '"
                        + root + "' as an earlier sheet in " + file.getFileName());
            }
            documents.put(target, builder.buildAuxiliary(sheet));
        }
        return documents;
    }

    private void discard(List<Path> produced) {
        for (Path path : produced) {
            try {
                Files.deleteIfExists(path);
            } catch (IOException e) {
                logger.error("Could not remove partial output {}: {}", path, e.getMessage());
            }
        }
    }

    private void routeToError(Path file) {
        if (!Files.exists(file)) {
            return;
        }
        try {
            layout.moveToError(file);
        } catch (IOException e) {
            logger.error("{}: could not move to error directory: {}", file, e.getMessage(), e);
        }
    }

    static String baseName(Path file) {
        String name = file.getFileName().toString();
        int dot = name.lastIndexOf('.');
        return dot <= 0 ? name : name.substring(0, dot);
    }

    private static Path key(Path path) {
        return path.toAbsolutePath().normalize();
    }
}
