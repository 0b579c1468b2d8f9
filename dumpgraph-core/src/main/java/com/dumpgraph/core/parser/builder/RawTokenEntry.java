package com.dumpgraph.core.parser.builder;

import com.dumpgraph.core.DumpFormatException;
import com.dumpgraph.core.model.Token;
import com.dumpgraph.core.model.TokenKind;

import java.util.List;
import java.util.Objects;

/**
 * A raw token as read, before its file index has been looked up.
 *
 * <p>The file table of the {@code rawtokens} element is only complete when the element
 * ends, so raw tokens are held in this form until then.
 *
 * @param fileIndex index into the file table
 * @param str token text
 * @param line line number
 * @param column column
 * @param sourceLine line of the {@code tok} element in the dump, for error messages
 */
public record RawTokenEntry(
    int fileIndex,
    String str,
    int line,
    int column,
    int sourceLine
) {
    /**
     * Compact constructor with validation.
     */
    public RawTokenEntry {
        Objects.requireNonNull(str, "str must not be null");
    }

    /**
     * Creates the raw token, naming its file from the table.
     *
     * @param files file names in table order
     * @return raw token without identifier or relations
     * @throws DumpFormatException if the file index is outside the table
     */
    public Token toToken(List<String> files) {
        if (fileIndex < 0 || fileIndex >= files.size()) {
            throw new DumpFormatException("Raw token '" + str + "' at line " + sourceLine
                + " has file index " + fileIndex + " but the file table has " + files.size() + " entries");
        }
        return Token.builder()
            .str(str)
            .kind(TokenKind.OTHER)
            .location(files.get(fileIndex), line, column)
            .build();
    }
}
