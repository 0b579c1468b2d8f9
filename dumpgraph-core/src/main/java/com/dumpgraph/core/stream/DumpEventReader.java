package com.dumpgraph.core.stream;

import com.ctc.wstx.api.WstxInputProperties;
import com.ctc.wstx.stax.WstxInputFactory;
import com.dumpgraph.core.DumpFormatException;
import com.dumpgraph.core.config.ParserConfig.ReaderSettings;
import org.codehaus.stax2.XMLInputFactory2;
import org.codehaus.stax2.XMLStreamReader2;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.xml.stream.XMLInputFactory;
import javax.xml.stream.XMLStreamConstants;
import javax.xml.stream.XMLStreamException;
import java.io.BufferedInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.Iterator;
import java.util.Map;
import java.util.NoSuchElementException;

/**
 * Forward-only reader producing {@link DumpEvent}s from a dump document.
 *
 * <p>Built on the Woodstox StAX2 cursor API, so only the element under the cursor is in
 * memory; nothing before it is retained by the reader. Attribute values are copied into
 * the event when the element starts, so events stay valid after the cursor has moved on.
 * Text, comments and processing instructions are skipped.
 *
 * <p>The sequence is finite and cannot be restarted. Malformed markup fails the whole
 * traversal with a {@link DumpFormatException}; an I/O failure surfaces as an
 * {@link UncheckedIOException}.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * try (DumpEventReader reader = DumpEventReader.open(dumpFile, ReaderSettings.defaults())) {
 *     while (reader.hasNext()) {
 *         DumpEvent event = reader.next();
 *         ...
 *     }
 * }
 * }</pre>
 */
public final class DumpEventReader implements Iterator<DumpEvent>, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(DumpEventReader.class);

    private final XMLStreamReader2 reader;
    private final String source;
    private DumpEvent pending;
    private boolean finished;

    private DumpEventReader(XMLStreamReader2 reader, String source) {
        this.reader = reader;
        this.source = source;
    }

    /**
     * Opens a dump file.
     *
     * @param dumpFile path of the dump
     * @param settings reader limits
     * @return reader positioned before the first element
     * @throws IOException if the file cannot be opened
     */
    public static DumpEventReader open(Path dumpFile, ReaderSettings settings) throws IOException {
        InputStream input = new BufferedInputStream(Files.newInputStream(dumpFile));
        try {
            return of(input, dumpFile.toString(), settings);
        } catch (RuntimeException e) {
            input.close();
            throw e;
        }
    }

    /**
     * Creates a reader over a stream. Closing the reader closes the stream.
     *
     * @param input dump content
     * @param source name of the source, used in error messages
     * @param settings reader limits
     * @return reader positioned before the first element
     */
    public static DumpEventReader of(InputStream input, String source, ReaderSettings settings) {
        XMLInputFactory2 factory = createFactory(settings);
        try {
            XMLStreamReader2 reader = (XMLStreamReader2) factory.createXMLStreamReader(input);
            log.debug("Opened dump stream: {}", source);
            return new DumpEventReader(reader, source);
        } catch (XMLStreamException e) {
            throw translate(e, source);
        }
    }

    private static XMLInputFactory2 createFactory(ReaderSettings settings) {
        XMLInputFactory2 factory = new WstxInputFactory();
        factory.configureForSpeed();
        factory.setProperty(XMLInputFactory.SUPPORT_DTD, false);
        factory.setProperty(XMLInputFactory.IS_SUPPORTING_EXTERNAL_ENTITIES, false);
        factory.setProperty(XMLInputFactory.IS_COALESCING, false);
        factory.setProperty(XMLInputFactory2.P_LAZY_PARSING, false);
        factory.setProperty(WstxInputProperties.P_MAX_ELEMENT_DEPTH, settings.maxElementDepth());
        factory.setProperty(WstxInputProperties.P_MAX_ATTRIBUTE_SIZE, settings.maxAttributeSize());
        factory.setProperty(WstxInputProperties.P_MAX_ATTRIBUTES_PER_ELEMENT, settings.maxAttributesPerElement());
        return factory;
    }

    @Override
    public boolean hasNext() {
        if (pending == null && !finished) {
            pending = advance();
        }
        return pending != null;
    }

    @Override
    public DumpEvent next() {
        if (!hasNext()) {
            throw new NoSuchElementException("No more events in " + source);
        }
        DumpEvent event = pending;
        pending = null;
        return event;
    }

    /**
     * Returns the source this reader was opened on.
     *
     * @return file path or stream name
     */
    public String source() {
        return source;
    }

    @Override
    public void close() {
        finished = true;
        pending = null;
        try {
            reader.closeCompletely();
        } catch (XMLStreamException e) {
            throw translate(e, source);
        }
    }

    private DumpEvent advance() {
        try {
            while (reader.hasNext()) {
                int type = reader.next();
                if (type == XMLStreamConstants.START_ELEMENT) {
                    return DumpEvent.enter(readAttributes());
                }
                if (type == XMLStreamConstants.END_ELEMENT) {
                    return DumpEvent.exit(reader.getLocalName(), currentLine());
                }
            }
            finished = true;
            return null;
        } catch (XMLStreamException e) {
            finished = true;
            throw translate(e, source);
        }
    }

    private ElementAttributes readAttributes() {
        int count = reader.getAttributeCount();
        Map<String, String> values = new HashMap<>(count * 2);
        for (int i = 0; i < count; i++) {
            values.put(reader.getAttributeLocalName(i), reader.getAttributeValue(i));
        }
        return ElementAttributes.of(reader.getLocalName(), currentLine(), values);
    }

    private int currentLine() {
        return reader.getLocation().getLineNumber();
    }

    private static RuntimeException translate(XMLStreamException e, String source) {
        Throwable cause = e.getNestedException() != null ? e.getNestedException() : e.getCause();
        if (cause instanceof IOException ioException) {
            return new UncheckedIOException("Failed to read dump " + source, ioException);
        }
        return new DumpFormatException("Malformed dump " + source + ": " + e.getMessage(), e);
    }
}
