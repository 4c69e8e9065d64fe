package com.archivesafrica.mailprocessor.core.writers;

import org.w3c.dom.Document;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Serializes a built document to a file.
 *
 * @inv Implementations keep element and attribute order exactly as built.
 * @inv A failed write leaves no file at the destination.
 */
public interface DocumentWriter {

    /**
     * Writes {@code document} to {@code destination}, replacing any existing file.
     *
     * @param document the document to write
     * @param destination target file; its parent directory must exist
     * @throws IOException if serialization or the file move fails
     * @pre document != null && destination != null
     * @post destination holds the complete serialized document.
     */
    void write(Document document, Path destination) throws IOException;

    /**
     * @return the file extension of the produced files, including the dot
     */
    String extension();
}
