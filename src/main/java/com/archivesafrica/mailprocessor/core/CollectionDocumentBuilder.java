package com.archivesafrica.mailprocessor.core;

import com.archivesafrica.mailprocessor.exception.MalformedSpreadsheetException;
import com.archivesafrica.mailprocessor.exception.ProcessingException;
import org.w3c.dom.Document;
import org.w3c.dom.Element;

import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Turns a validated {@link NormalizedRecord} into the collection document and each
 * {@link TermSheet} into a vocabulary document.
 * <p>
 * Collection document:
 * <pre>
 * &lt;collection&gt;
 *   &lt;Title&gt;Letters&lt;/Title&gt;
 *   &lt;Description&gt;
 *     &lt;p&gt;First paragraph&lt;/p&gt;
 *     &lt;p&gt;&lt;![CDATA[See <b>box 4</b>]]&gt;&lt;/p&gt;
 *   &lt;/Description&gt;
 *   &lt;Date&gt;1961-03-01&lt;/Date&gt;
 * &lt;/collection&gt;
 * </pre>
 * Text containing angle brackets goes into a CDATA section so markup typed by the submitter
 * is kept verbatim and never escaped into entities.
 */
public class CollectionDocumentBuilder {

    public static final String ROOT_ELEMENT = "collection";
    public static final String PARAGRAPH_ELEMENT = "p";
    public static final String TERM_ELEMENT = "p";

    private static final Pattern NON_WORD = Pattern.compile("\\W", Pattern.UNICODE_CHARACTER_CLASS);
    private static final Pattern LINE_BREAK = Pattern.compile("\\r\\n|\\r|\\n");
    private static final String NAME_SEPARATOR = ":";

    private final DocumentBuilderFactory factory;

    public CollectionDocumentBuilder() {
        this.factory = DocumentBuilderFactory.newInstance();
    }

    /**
     * Builds the collection document.
     *
     * @param record a record with no missing required field
     * @return a document with one child per present field, in record order
     * @post Absent fields produce no element.
     */
    public Document buildPrimary(NormalizedRecord record) {
        Document document = newDocument();
        Element root = document.createElement(ROOT_ELEMENT);
        document.appendChild(root);

        for (RecordField field : record.getFields()) {
            if (!field.isPresent()) {
                continue;
            }
            FieldValue value = field.getValue().get();
            Element element = document.createElement(sanitize(field.getName()));
            root.appendChild(element);

            if (value.isText() && isMultiLine(value.asText())) {
                for (String line : LINE_BREAK.split(value.asText())) {
                    String paragraph = line.trim();
                    if (paragraph.isEmpty()) {
                        continue;
                    }
                    Element p = document.createElement(PARAGRAPH_ELEMENT);
                    appendText(document, p, paragraph);
                    element.appendChild(p);
                }
            } else if (value.isText()) {
                appendText(document, element, value.asText().trim());
            } else {
                element.setTextContent(value.asText());
            }
        }
        return document;
    }

    /**
     * Builds the vocabulary document of one secondary sheet.
     *
     * @param sheet the sheet; its first data row names the columns
     * @return a document rooted at {@link #rootName(TermSheet)} with one {@value #TERM_ELEMENT}
     *         group per term row
     * @throws MalformedSpreadsheetException if the root name is unusable, or a term row has a
     *         value in a column without a usable label
     */
    public Document buildAuxiliary(TermSheet sheet) {
        Document document = newDocument();
        Element root = document.createElement(rootName(sheet));
        document.appendChild(root);

        Map<Integer, String> labels = sheet.getLabelRow();
        for (Map<Integer, String> row : sheet.getTermRows()) {
            Element group = document.createElement(TERM_ELEMENT);
            root.appendChild(group);
            for (Map.Entry<Integer, String> cell : row.entrySet()) {
                String label = labels.get(cell.getKey());
                String name = label == null ? "" : columnName(label);
                if (name.isEmpty()) {
                    throw new MalformedSpreadsheetException("Sheet '" + sheet.getSheetName() + "' has a value in column "
                            + (cell.getKey() + 1) + " without a label");
                }
                Element term = document.createElement(name);
                appendText(document, term, cell.getValue());
                group.appendChild(term);
            }
        }
        return document;
    }

    /**
     * Root element name of a vocabulary sheet: the first header cell up to the first
     * {@code :}, lower-cased, spaces turned into underscores.
     * {@code "Subject Terms: use one per row"} becomes {@code subject_terms}.
     */
    public static String rootName(TermSheet sheet) {
        String header = sheet.getHeader().get(0);
        String name = header == null ? "" : sanitize(beforeSeparator(header).trim().toLowerCase(Locale.ROOT).replace(' ', '_'));
        if (name.isEmpty()) {
            throw new MalformedSpreadsheetException("Sheet '" + sheet.getSheetName() + "' header does not yield an element name");
        }
        return name;
    }

    static String columnName(String label) {
        String name = beforeSeparator(label).toLowerCase(Locale.ROOT).replace(">", "").trim().replace(' ', '_');
        return sanitize(name);
    }

    /**
     * Strips every non-word character, so {@code "Title*"} becomes {@code "Title"}.
     */
    public static String sanitize(String label) {
        return NON_WORD.matcher(label).replaceAll("");
    }

    private static String beforeSeparator(String text) {
        int idx = text.indexOf(NAME_SEPARATOR);
        return idx < 0 ? text : text.substring(0, idx);
    }

    private static boolean isMultiLine(String text) {
        return text.indexOf('\n') >= 0 || text.indexOf('\r') >= 0;
    }

    private static void appendText(Document document, Element element, String text) {
        if (text.indexOf('<') >= 0 || text.indexOf('>') >= 0) {
            element.appendChild(document.createCDATASection(text));
        } else {
            element.appendChild(document.createTextNode(text));
        }
    }

    private Document newDocument() {
        try {
            return factory.newDocumentBuilder().newDocument();
        } catch (ParserConfigurationException e) {
            throw new ProcessingException("XML document builder unavailable", e);
        }
    }
}
