package com.dumpgraph.core.parser;

import com.dumpgraph.core.config.ParserConfig;
import com.dumpgraph.core.model.Configuration;
import com.dumpgraph.core.model.Platform;
import com.dumpgraph.core.model.Suppression;
import com.dumpgraph.core.model.Token;
import com.dumpgraph.core.stream.DumpEventReader;
import com.dumpgraph.core.verify.GraphVerifier;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * An opened dump: its document-level facts, and access to its configurations.
 *
 * <p>The facts are read once when the document is opened. Configurations are not kept;
 * every call to {@link #configurations()} reads the file again from the start.
 */
public final class DumpDocument {

    private final Path source;
    private final ParserConfig config;
    private final DocumentFacts facts;

    DumpDocument(Path source, ParserConfig config, DocumentFacts facts) {
        this.source = source;
        this.config = config;
        this.facts = facts;
    }

    public Path source() {
        return source;
    }

    /**
     * Returns the numeric platform model.
     *
     * @return platform, or null if the dump has none
     */
    public Platform platform() {
        return facts.platform();
    }

    /**
     * Returns the raw tokens, linked in their own sequence.
     *
     * @return raw tokens in document order
     */
    public List<Token> rawTokens() {
        return facts.rawTokens();
    }

    /**
     * Returns the file table of the raw tokens.
     *
     * @return file names in index order
     */
    public List<String> files() {
        return facts.files();
    }

    public List<Suppression> suppressions() {
        return facts.suppressions();
    }

    /**
     * Opens a lazy iterator over the configurations.
     *
     * @return iterator yielding configurations in document order; must be closed
     * @throws IOException if the file cannot be opened again
     */
    public ConfigurationIterator configurations() throws IOException {
        DumpEventReader reader = DumpEventReader.open(source, config.reader());
        GraphVerifier verifier = config.verifyGraph() ? new GraphVerifier() : null;
        return new ConfigurationIterator(reader, new ConfigurationAssembler(), verifier);
    }

    /**
     * Streams the configurations lazily. Closing the stream closes the file.
     *
     * @return stream of configurations in document order
     * @throws IOException if the file cannot be opened again
     */
    public Stream<Configuration> streamConfigurations() throws IOException {
        ConfigurationIterator iterator = configurations();
        return StreamSupport.stream(
                Spliterators.spliteratorUnknownSize(iterator, Spliterator.ORDERED | Spliterator.NONNULL), false)
            .onClose(iterator::close);
    }

    /**
     * Reads every configuration into memory.
     *
     * @return configurations in document order
     * @throws UncheckedIOException if reading fails part way
     * @throws IOException if the file cannot be opened again
     */
    public List<Configuration> readAllConfigurations() throws IOException {
        List<Configuration> configurations = new ArrayList<>();
        try (ConfigurationIterator iterator = configurations()) {
            iterator.forEachRemaining(configurations::add);
        }
        return configurations;
    }
}
