package com.plcexport.l5k.parser;

import lombok.Value;

/**
 * One top-level unit of a region: a comment, a statement, or a whole block.
 */
@Value
public class Segment {
    SegmentType type;
    int start;
    int end;
    /** False for a statement that ran out at a line end without its {@code ;}. */
    boolean terminated;
    BlockSpan block;

    static Segment comment(int start, int end) {
        return new Segment(SegmentType.COMMENT, start, end, true, null);
    }

    static Segment statement(int start, int end, boolean terminated) {
        return new Segment(SegmentType.STATEMENT, start, end, terminated, null);
    }

    static Segment block(BlockSpan span) {
        return new Segment(SegmentType.BLOCK, span.getStart(), span.getEnd(), true, span);
    }

    public boolean isBlock() {
        return type == SegmentType.BLOCK;
    }

    public boolean isStatement() {
        return type == SegmentType.STATEMENT;
    }
}
