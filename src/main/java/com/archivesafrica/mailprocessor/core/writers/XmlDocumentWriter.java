package com.archivesafrica.mailprocessor.core.writers;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.w3c.dom.Document;

import javax.xml.transform.OutputKeys;
import javax.xml.transform.Transformer;
import javax.xml.transform.TransformerException;
import javax.xml.transform.TransformerFactory;
import javax.xml.transform.dom.DOMSource;
import javax.xml.transform.stream.StreamResult;
import java.io.BufferedOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

/**
 * Implements {@link DocumentWriter} for indented UTF-8 XML using the JDK identity transformer.
 * <p>
 * The document is written to a temp file next to the destination and moved into place, so
 * readers of the output directory never see a half-written file.
 */
public class XmlDocumentWriter implements DocumentWriter {

    private static final Logger logger = LoggerFactory.getLogger(XmlDocumentWriter.class);
    private static final int BUFFER_SIZE = 64 * 1024;
    private static final String INDENT_AMOUNT = "{http://xml.apache.org/xslt}indent-amount";

    private final TransformerFactory transformerFactory;
    private final int indent;

    public XmlDocumentWriter() {
        this(2);
    }

    public XmlDocumentWriter(int indent) {
        this.transformerFactory = TransformerFactory.newInstance();
        this.indent = indent;
    }

    @Override
    public void write(Document document, Path destination) throws IOException {
        Path parent = destination.toAbsolutePath().getParent();
        Path temp = Files.createTempFile(parent, destination.getFileName().toString(), ".part");
        try {
            try (OutputStream out = new BufferedOutputStream(Files.newOutputStream(temp), BUFFER_SIZE)) {
                Transformer transformer = newTransformer();
                transformer.transform(new DOMSource(document), new StreamResult(out));
            } catch (TransformerException e) {
                throw new IOException("Cannot serialize document to " + destination + ": " + e.getMessage(), e);
            }
            try {
                Files.move(temp, destination, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(temp, destination, StandardCopyOption.REPLACE_EXISTING);
            }
            logger.debug("Saved XML document {}", destination);
        } finally {
            Files.deleteIfExists(temp);
        }
    }

    @Override
    public String extension() {
        return ".xml";
    }

    private Transformer newTransformer() throws TransformerException {
        Transformer transformer = transformerFactory.newTransformer();
        transformer.setOutputProperty(OutputKeys.METHOD, "xml");
        transformer.setOutputProperty(OutputKeys.ENCODING, "UTF-8");
        transformer.setOutputProperty(OutputKeys.INDENT, "yes");
        transformer.setOutputProperty(INDENT_AMOUNT, String.valueOf(indent));
        return transformer;
    }
}
