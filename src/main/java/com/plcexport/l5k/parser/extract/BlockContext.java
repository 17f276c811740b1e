package com.plcexport.l5k.parser.extract;

import java.util.List;

import com.plcexport.l5k.parser.BlockHeader;
import com.plcexport.l5k.parser.BlockKind;
import com.plcexport.l5k.parser.BlockSpan;
import com.plcexport.l5k.parser.L5kScanner;
import com.plcexport.l5k.parser.Segment;

import lombok.Value;

/**
 * A completed block as handed to its extractor.
 */
@Value
public class BlockContext {
    BlockKind kind;
    BlockHeader header;
    BlockSpan span;
    L5kScanner scanner;

    public static String headerText(BlockSpan span, L5kScanner scanner) {
        return scanner.text(span.getStart(), span.getHeaderEnd());
    }

    public int getLine() {
        return scanner.lineOf(span.getStart());
    }

    public List<Segment> bodySegments() {
        return scanner.segments(span.getBodyStart(), span.getBodyEnd());
    }

    /**
     * A nested block of this body, e.g. {@code PARAMETERS} inside an AOI.
     */
    public BlockContext nested(Segment segment) {
        return new BlockContext(kind, BlockHeader.parse(headerText(segment.getBlock(), scanner)),
                segment.getBlock(), scanner);
    }

    public String text(Segment segment) {
        return scanner.text(segment.getStart(), segment.getEnd());
    }

    public int lineOf(Segment segment) {
        return scanner.lineOf(segment.getStart());
    }
}
