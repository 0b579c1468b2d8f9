package com.dumpgraph.core.parser;

import com.dumpgraph.core.model.Platform;
import com.dumpgraph.core.model.Suppression;
import com.dumpgraph.core.model.Token;
import com.dumpgraph.core.parser.builder.FileRecordBuilder;
import com.dumpgraph.core.parser.builder.PlatformRecordBuilder;
import com.dumpgraph.core.parser.builder.RawTokenEntry;
import com.dumpgraph.core.parser.builder.RawTokenRecordBuilder;
import com.dumpgraph.core.parser.builder.SuppressionRecordBuilder;
import com.dumpgraph.core.stream.DumpEvent;
import com.dumpgraph.core.stream.DumpEventReader;
import com.dumpgraph.core.stream.ElementAttributes;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Collects the document-level facts: the platform model, the raw token stream with its
 * file table, and the suppression rules.
 *
 * <p>The scan stops as soon as all three have been seen, however much of the document is
 * left. Configurations are skipped over, not assembled.
 */
public class DocumentRootParser {

    private static final Logger log = LoggerFactory.getLogger(DocumentRootParser.class);

    static final String RAWTOKENS_TAG = "rawtokens";
    static final String SUPPRESSIONS_TAG = "suppressions";

    private final PlatformRecordBuilder platformBuilder = new PlatformRecordBuilder();
    private final FileRecordBuilder fileBuilder = new FileRecordBuilder();
    private final RawTokenRecordBuilder rawTokenBuilder = new RawTokenRecordBuilder();
    private final SuppressionRecordBuilder suppressionBuilder = new SuppressionRecordBuilder();

    /**
     * Scans a document for its document-level facts.
     *
     * @param reader event reader positioned at the start of the document; not closed
     * @return the facts found; missing ones are null or empty
     * @throws com.dumpgraph.core.DumpFormatException if an element is malformed or a raw token names no file
     */
    public DocumentFacts scan(DumpEventReader reader) {
        Platform platform = null;
        List<String> files = new ArrayList<>();
        List<RawTokenEntry> entries = new ArrayList<>();
        List<Suppression> suppressions = new ArrayList<>();

        boolean platformSeen = false;
        boolean rawTokensSeen = false;
        boolean suppressionsSeen = false;
        boolean inRawTokens = false;
        boolean inSuppressions = false;
        int events = 0;

        while (reader.hasNext() && !(platformSeen && rawTokensSeen && suppressionsSeen)) {
            DumpEvent event = reader.next();
            events++;
            String tag = event.tag();

            if (event.isExit()) {
                if (RAWTOKENS_TAG.equals(tag) && inRawTokens) {
                    inRawTokens = false;
                    rawTokensSeen = true;
                } else if (SUPPRESSIONS_TAG.equals(tag) && inSuppressions) {
                    inSuppressions = false;
                    suppressionsSeen = true;
                }
                continue;
            }

            ElementAttributes attributes = event.attributes();
            if (inRawTokens) {
                if (FileRecordBuilder.TAG.equals(tag)) {
                    files.add(fileBuilder.build(attributes));
                } else if (RawTokenRecordBuilder.TAG.equals(tag)) {
                    entries.add(rawTokenBuilder.build(attributes));
                }
            } else if (inSuppressions) {
                if (SuppressionRecordBuilder.TAG.equals(tag)) {
                    suppressions.add(suppressionBuilder.build(attributes));
                }
            } else if (PlatformRecordBuilder.TAG.equals(tag) && !platformSeen) {
                platform = platformBuilder.build(attributes);
                platformSeen = true;
            } else if (RAWTOKENS_TAG.equals(tag) && !rawTokensSeen) {
                inRawTokens = true;
            } else if (SUPPRESSIONS_TAG.equals(tag) && !suppressionsSeen) {
                inSuppressions = true;
            }
        }

        List<Token> rawTokens = new ArrayList<>(entries.size());
        for (RawTokenEntry entry : entries) {
            rawTokens.add(entry.toToken(files));
        }
        Token.linkSequence(rawTokens);

        if (platformSeen && rawTokensSeen && suppressionsSeen) {
            log.debug("Document facts complete after {} events", events);
        } else {
            log.debug("Reached end of {} without platform={}, rawtokens={}, suppressions={}",
                reader.source(), platformSeen, rawTokensSeen, suppressionsSeen);
        }
        return new DocumentFacts(platform, rawTokens, files, suppressions);
    }
}
