package com.dumpgraph.core.parser;

import com.dumpgraph.core.config.ParserConfig;
import com.dumpgraph.core.stream.DumpEventReader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;

/**
 * Entry point for reading dump files.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * DumpDocument document = DumpParser.open(dumpFile);
 * try (ConfigurationIterator configurations = document.configurations()) {
 *     while (configurations.hasNext()) {
 *         Configuration configuration = configurations.next();
 *         ...
 *     }
 * }
 * }</pre>
 */
public final class DumpParser {

    private static final Logger log = LoggerFactory.getLogger(DumpParser.class);

    private DumpParser() {
        // Utility class
    }

    /**
     * Opens a dump with default settings.
     *
     * @param dumpFile path of the dump
     * @return the opened document
     * @throws IOException if the file cannot be read
     */
    public static DumpDocument open(Path dumpFile) throws IOException {
        return open(dumpFile, ParserConfig.defaults());
    }

    /**
     * Opens a dump and reads its document-level facts.
     *
     * @param dumpFile path of the dump
     * @param config reader settings
     * @return the opened document
     * @throws IOException if the file cannot be read
     * @throws com.dumpgraph.core.DumpFormatException if the document-level elements are malformed
     */
    public static DumpDocument open(Path dumpFile, ParserConfig config) throws IOException {
        if (!Files.isRegularFile(dumpFile)) {
            throw new NoSuchFileException(dumpFile.toString());
        }
        DocumentFacts facts;
        try (DumpEventReader reader = DumpEventReader.open(dumpFile, config.reader())) {
            facts = new DocumentRootParser().scan(reader);
        }
        log.info("Opened dump {}: platform {}, {} raw tokens in {} files, {} suppressions",
            dumpFile, facts.platform() != null ? facts.platform().name() : "none",
            facts.rawTokens().size(), facts.files().size(), facts.suppressions().size());
        return new DumpDocument(dumpFile, config, facts);
    }
}
