package com.dumpgraph.core.parser;

import com.dumpgraph.core.DumpFormatException;
import com.dumpgraph.core.UnresolvedIdentifierException;
import com.dumpgraph.core.model.Configuration;
import com.dumpgraph.core.stream.DumpEventReader;
import com.dumpgraph.core.verify.GraphVerifier;
import com.dumpgraph.core.verify.Violation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;

/**
 * Lazily yields the configurations of a dump in document order.
 *
 * <p>Each pull reads events up to the next {@code </dump>} and resolves that configuration
 * only; nothing from earlier configurations is kept.
 *
 * <p>Failures propagate from {@link #hasNext()} or {@link #next()}. Two of them are limited
 * to one configuration: an {@link UnresolvedIdentifierException} and, with verification
 * enabled, a configuration that violates the graph invariants. The iterator is then
 * positioned after the failed configuration and pulling again continues with the next one.
 * Any other failure (malformed markup, a bad attribute, an I/O error) ends the document:
 * the reader is closed and every later pull rethrows it.
 *
 * <p>Must be closed to release the file.
 */
public final class ConfigurationIterator implements Iterator<Configuration>, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ConfigurationIterator.class);

    private final DumpEventReader reader;
    private final ConfigurationAssembler assembler;
    private final GraphVerifier verifier;
    private Configuration pending;
    private RuntimeException fatal;
    private int yielded;

    /**
     * Creates an iterator over a reader positioned at the start of the document.
     *
     * @param reader event reader; closed by {@link #close()}
     * @param assembler assembler to feed
     * @param verifier verifier run on every configuration, or null to skip verification
     */
    ConfigurationIterator(DumpEventReader reader, ConfigurationAssembler assembler, GraphVerifier verifier) {
        this.reader = reader;
        this.assembler = assembler;
        this.verifier = verifier;
    }

    @Override
    public boolean hasNext() {
        if (fatal != null) {
            throw new DumpFormatException("Reading " + reader.source() + " already failed: " + fatal.getMessage(), fatal);
        }
        Configuration configuration = null;
        try {
            while (pending == null && configuration == null && reader.hasNext()) {
                configuration = assembler.accept(reader.next());
            }
        } catch (UnresolvedIdentifierException e) {
            throw e;
        } catch (RuntimeException e) {
            terminate(e);
            throw e;
        }
        if (configuration != null) {
            verify(configuration);
            pending = configuration;
        }
        return pending != null;
    }

    @Override
    public Configuration next() {
        if (!hasNext()) {
            throw new NoSuchElementException("No more configurations in " + reader.source());
        }
        Configuration configuration = pending;
        pending = null;
        yielded++;
        return configuration;
    }

    @Override
    public void close() {
        log.debug("Closing {} after {} configurations", reader.source(), yielded);
        pending = null;
        reader.close();
    }

    private void terminate(RuntimeException failure) {
        log.debug("Stopping {} after {} configurations: {}", reader.source(), yielded, failure.getMessage());
        fatal = failure;
        pending = null;
        try {
            reader.close();
        } catch (RuntimeException closeFailure) {
            failure.addSuppressed(closeFailure);
        }
    }

    private void verify(Configuration configuration) {
        if (verifier == null) {
            return;
        }
        List<Violation> violations = verifier.verify(configuration);
        if (!violations.isEmpty()) {
            throw new DumpFormatException("Configuration '" + configuration.name() + "' in " + reader.source()
                + " violates graph invariants: " + violations);
        }
    }
}
