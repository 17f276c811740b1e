package com.plcexport.l5k.parser;

import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.plcexport.l5k.model.L5kProject;
import com.plcexport.l5k.parser.extract.AddOnInstructionExtractor;
import com.plcexport.l5k.parser.extract.BlockContext;
import com.plcexport.l5k.parser.extract.BlockExtractor;
import com.plcexport.l5k.parser.extract.DatatypeExtractor;
import com.plcexport.l5k.parser.extract.HeaderExtractor;
import com.plcexport.l5k.parser.extract.ProgramExtractor;
import com.plcexport.l5k.parser.extract.TagListExtractor;

/**
 * Parser for L5K controller exports.
 * Drives the scanner through an explicit state machine and hands each completed
 * block to the extractor for its kind.
 *
 * Parsing only:
 * - Builds the project model in file order
 * - Reports skipped blocks and lines as diagnostics
 *
 * It does NOT resolve types; see {@code TypeNormalizer}.
 *
 * <p>Scan failures and key collisions abort the parse. Anything a pattern does not
 * recognise is skipped with a warning.</p>
 */
public class L5kParser {
    private static final Logger log = LoggerFactory.getLogger(L5kParser.class);

    private final L5kScanner scanner;
    private final String sourceName;
    private final Map<BlockKind, BlockExtractor> extractors = new EnumMap<>(BlockKind.class);

    public L5kParser(String source, String sourceName) {
        this.scanner = new L5kScanner(source);
        this.sourceName = sourceName;

        AddOnInstructionExtractor aoiExtractor = new AddOnInstructionExtractor();
        TagListExtractor tagListExtractor = new TagListExtractor();
        extractors.put(BlockKind.HEADER, new HeaderExtractor());
        extractors.put(BlockKind.UDT, new DatatypeExtractor());
        extractors.put(BlockKind.AOI, aoiExtractor);
        extractors.put(BlockKind.ENCODED_AOI, aoiExtractor);
        extractors.put(BlockKind.CONTROLLER_TAGS, tagListExtractor);
        extractors.put(BlockKind.PROGRAM, new ProgramExtractor(tagListExtractor));
    }

    public L5kProject parse(ParseDiagnostics diagnostics) {
        L5kProject project = new L5kProject();
        Region top = new Region(0, scanner.length(), EnumSet.of(BlockKind.HEADER), true);
        run(top, project, diagnostics);

        if (project.getHeader().getName() == null) {
            log.warn("No CONTROLLER block found in {}", sourceName);
            diagnostics.getWarnings().add("No CONTROLLER block found");
        }
        log.info("Parsed {}: {} UDTs, {} AOIs, {} controller tags, {} programs", sourceName,
                project.getUdts().size(), project.getAois().size(),
                project.getControllerTags().size(), project.getPrograms().size());
        return project;
    }

    private void run(Region region, L5kProject project, ParseDiagnostics diagnostics) {
        ParserState state = ParserState.SEEKING;
        while (state != ParserState.FINISHED) {
            state = step(state, region, project, diagnostics);
        }
    }

    /**
     * Transition function of the block state machine.
     */
    private ParserState step(ParserState state, Region region, L5kProject project, ParseDiagnostics diagnostics) {
        return switch (state) {
            case SEEKING -> seek(region, diagnostics);
            case IN_HEADER -> {
                region.header = BlockContext.headerText(region.segment.getBlock(), scanner);
                yield ParserState.IN_BODY;
            }
            case IN_BODY -> {
                region.block = new BlockContext(region.kind, BlockHeader.parse(region.header),
                        region.segment.getBlock(), scanner);
                yield ParserState.BLOCK_COMPLETE;
            }
            case BLOCK_COMPLETE -> {
                complete(region, project, diagnostics);
                yield ParserState.SEEKING;
            }
            case FINISHED -> ParserState.FINISHED;
        };
    }

    private ParserState seek(Region region, ParseDiagnostics diagnostics) {
        Segment segment = scanner.nextSegment(region.position, region.limit);
        if (segment == null) {
            return ParserState.FINISHED;
        }
        region.position = segment.getEnd();
        region.segment = segment;

        switch (segment.getType()) {
            case COMMENT -> {
                return ParserState.SEEKING;
            }
            case STATEMENT -> {
                looseStatement(region, segment, diagnostics);
                return ParserState.SEEKING;
            }
            default -> {
                // block
            }
        }

        String headerText = BlockContext.headerText(segment.getBlock(), scanner);
        BlockKind kind = BlockKind.classify(headerText)
                .filter(region.accepted::contains)
                .orElse(null);
        if (kind == null) {
            int line = scanner.lineOf(segment.getStart());
            log.warn("Skipping unrecognized {} block at line {}", segment.getBlock().getKeyword(), line);
            diagnostics.getWarnings().add("Unrecognized block " + segment.getBlock().getKeyword() + " at line " + line);
            return ParserState.SEEKING;
        }
        region.kind = kind;
        return ParserState.IN_HEADER;
    }

    private void complete(Region region, L5kProject project, ParseDiagnostics diagnostics) {
        BlockContext block = region.block;
        log.trace("{} block complete at line {}", block.getKind(), block.getLine());
        extractors.get(block.getKind()).extract(block, project, diagnostics);

        if (block.getKind() == BlockKind.HEADER) {
            // one controller per export
            region.accepted = EnumSet.noneOf(BlockKind.class);
            BlockSpan span = block.getSpan();
            run(new Region(span.getBodyStart(), span.getBodyEnd(), BlockKind.CONTROLLER_CONTENT, false),
                    project, diagnostics);
            region.beforeController = false;
        }
    }

    /**
     * Text between blocks. Before the controller it belongs to the header and is
     * kept there; anywhere else it is dropped with a warning.
     */
    private void looseStatement(Region region, Segment segment, ParseDiagnostics diagnostics) {
        if (region.beforeController) {
            return;
        }
        int line = scanner.lineOf(segment.getStart());
        String text = scanner.text(segment.getStart(), segment.getEnd()).strip();
        log.warn("Skipping unrecognized line {}: {}", line, text);
        diagnostics.getWarnings().add("Unrecognized line " + line + ": " + text);
    }

    /**
     * Mutable cursor over one region (the file, or the CONTROLLER body).
     */
    private static final class Region {
        private final int limit;
        private int position;
        private Set<BlockKind> accepted;
        private boolean beforeController;
        private Segment segment;
        private BlockKind kind;
        private String header;
        private BlockContext block;

        private Region(int from, int limit, Set<BlockKind> accepted, boolean beforeController) {
            this.position = from;
            this.limit = limit;
            this.accepted = accepted;
            this.beforeController = beforeController;
        }
    }
}
