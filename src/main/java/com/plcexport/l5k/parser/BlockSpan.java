package com.plcexport.l5k.parser;

import lombok.Value;

/**
 * Offsets of a keyword-delimited block such as {@code DATATYPE ... END_DATATYPE}.
 *
 * <pre>
 * start       headerEnd               bodyEnd          end
 * |DATATYPE X (...)|\n  members...\n  |END_DATATYPE|
 * </pre>
 */
@Value
public class BlockSpan {
    String keyword;
    int start;
    /** Just past the header, which may span several physical lines. */
    int headerEnd;
    /** Start of the closing {@code END_} line. */
    int bodyEnd;
    /** Just past the closing keyword. */
    int end;

    public int getBodyStart() {
        return headerEnd;
    }
}
