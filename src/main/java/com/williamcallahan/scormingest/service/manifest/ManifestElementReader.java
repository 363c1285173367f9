package com.williamcallahan.scormingest.service.manifest;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.Deque;
import javax.xml.stream.XMLInputFactory;
import javax.xml.stream.XMLStreamConstants;
import javax.xml.stream.XMLStreamException;
import javax.xml.stream.XMLStreamReader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Streams a manifest file into a {@link ManifestElement} tree.
 *
 * <p>DTD processing and external entities are disabled since packages come from untrusted
 * uploads. Nesting deeper than {@link #MAX_DEPTH} elements is rejected as malformed.</p>
 */
@Component
public class ManifestElementReader {
    private static final Logger log = LoggerFactory.getLogger(ManifestElementReader.class);

    static final int MAX_DEPTH = 100;

    private final XMLInputFactory inputFactory;

    public ManifestElementReader() {
        this.inputFactory = XMLInputFactory.newFactory();
        inputFactory.setProperty(XMLInputFactory.SUPPORT_DTD, false);
        inputFactory.setProperty(XMLInputFactory.IS_SUPPORTING_EXTERNAL_ENTITIES, false);
        inputFactory.setProperty(XMLInputFactory.IS_NAMESPACE_AWARE, true);
        inputFactory.setProperty(XMLInputFactory.IS_COALESCING, true);
    }

    /**
     * Reads the XML file and returns its root element.
     *
     * @param xmlFile manifest file
     * @return root element of the document
     * @throws MalformedManifestException when the XML is not well-formed or nests too deeply
     * @throws IOException when the file cannot be read
     */
    public ManifestElement read(Path xmlFile) throws MalformedManifestException, IOException {
        try (InputStream inputStream = Files.newInputStream(xmlFile)) {
            return read(inputStream);
        }
    }

    /**
     * Reads XML from the stream and returns its root element. The stream is not closed.
     */
    public ManifestElement read(InputStream inputStream) throws MalformedManifestException {
        XMLStreamReader reader = null;
        try {
            reader = inputFactory.createXMLStreamReader(inputStream);
            return readDocument(reader);
        } catch (XMLStreamException xmlException) {
            throw new MalformedManifestException(xmlException.getMessage(), xmlException);
        } finally {
            closeQuietly(reader);
        }
    }

    private ManifestElement readDocument(XMLStreamReader reader) throws XMLStreamException, MalformedManifestException {
        Deque<ManifestElement.Builder> openElements = new ArrayDeque<>();
        while (reader.hasNext()) {
            int event = reader.next();
            switch (event) {
                case XMLStreamConstants.START_ELEMENT -> {
                    if (openElements.size() >= MAX_DEPTH) {
                        throw new MalformedManifestException("Element nesting exceeds " + MAX_DEPTH + " levels at line "
                                + reader.getLocation().getLineNumber());
                    }
                    openElements.push(startElement(reader));
                }
                case XMLStreamConstants.CHARACTERS, XMLStreamConstants.CDATA -> {
                    if (!openElements.isEmpty()) {
                        openElements.peek().appendText(reader.getText());
                    }
                }
                case XMLStreamConstants.END_ELEMENT -> {
                    ManifestElement completed = openElements.pop().build();
                    if (openElements.isEmpty()) {
                        return completed;
                    }
                    openElements.peek().child(completed);
                }
                default -> {
                    // comments, processing instructions and whitespace outside the root carry no manifest data
                }
            }
        }
        throw new MalformedManifestException("Document has no root element");
    }

    private ManifestElement.Builder startElement(XMLStreamReader reader) {
        ManifestElement.Builder builder = ManifestElement.builder(reader.getLocalName());
        for (int index = 0; index < reader.getAttributeCount(); index++) {
            String prefix = reader.getAttributePrefix(index);
            String localName = reader.getAttributeLocalName(index);
            String qualifiedName = prefix == null || prefix.isEmpty() ? localName : prefix + ":" + localName;
            builder.attribute(qualifiedName, reader.getAttributeValue(index));
        }
        return builder;
    }

    private static void closeQuietly(XMLStreamReader reader) {
        if (reader == null) {
            return;
        }
        try {
            reader.close();
        } catch (XMLStreamException closeException) {
            log.debug("Failed to close manifest reader: {}", closeException.getMessage());
        }
    }
}
