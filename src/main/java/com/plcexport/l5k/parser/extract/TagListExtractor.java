package com.plcexport.l5k.parser.extract;

import java.util.Optional;
import java.util.function.Consumer;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.plcexport.l5k.model.AttributeList;
import com.plcexport.l5k.model.L5kProject;
import com.plcexport.l5k.model.Program;
import com.plcexport.l5k.model.Tag;
import com.plcexport.l5k.parser.L5kSyntax;
import com.plcexport.l5k.parser.ParseDiagnostics;
import com.plcexport.l5k.parser.Segment;

/**
 * Extracts a {@code TAG ... END_TAG} list, either controller scoped or inside a program.
 *
 * <p>{@code Name : TYPE[dims] (attrs) := value, force;} keeps name, type, dimensions and
 * attributes. Values and force data are dropped.</p>
 */
public class TagListExtractor extends AbstractBlockExtractor {
    private static final Logger log = LoggerFactory.getLogger(TagListExtractor.class);

    private static final Pattern NAME = Pattern.compile("^([A-Za-z_]\\w*)(?:\\s+OF\\s+\\S+)?$");
    private static final Pattern TYPE = Pattern.compile(
            "^([A-Za-z_][\\w:]*)\\s*(\\[\\s*\\d+(?:\\s*,\\s*\\d+)*\\s*\\])?$");

    @Override
    public void extract(BlockContext block, L5kProject project, ParseDiagnostics diagnostics) {
        int count = readTags(block, project::addControllerTag, diagnostics);
        log.debug("Parsed {} controller tags at line {}", count, block.getLine());
    }

    public void extractInto(BlockContext block, Program program, ParseDiagnostics diagnostics) {
        int count = readTags(block, program::addTag, diagnostics);
        log.debug("Parsed {} tags for program {}", count, program.getName());
    }

    private int readTags(BlockContext block, Consumer<Tag> sink, ParseDiagnostics diagnostics) {
        int count = 0;
        for (Segment segment : block.bodySegments()) {
            if (segment.isBlock()) {
                unrecognizedBlock(block, segment, diagnostics);
                continue;
            }
            if (!segment.isStatement()) {
                continue;
            }
            Optional<Tag> tag = segment.isTerminated()
                    ? parseTag(declaration(block, segment)) : Optional.empty();
            if (tag.isEmpty()) {
                unrecognizedLine(block, segment, diagnostics);
                continue;
            }
            tag.get().setSourceLine(block.lineOf(segment));
            sink.accept(tag.get());
            count++;
        }
        return count;
    }

    Optional<Tag> parseTag(String declaration) {
        int colon = L5kSyntax.firstOutsideParens(declaration, ":");
        if (colon <= 0) {
            return Optional.empty();
        }
        Matcher name = NAME.matcher(declaration.substring(0, colon).strip());
        if (!name.matches()) {
            return Optional.empty();
        }
        L5kSyntax.OuterSplit split = L5kSyntax.splitOuterAttrs(declaration.substring(colon + 1));
        Matcher type = TYPE.matcher(split.getPrefix());
        if (!type.matches()) {
            return Optional.empty();
        }

        Tag tag = new Tag(name.group(1), type.group(1));
        tag.setDimensions(normalizeDimensions(type.group(2)));
        AttributeList attributes = L5kSyntax.parseAttributes(split.getAttributes());
        tag.setDescription(L5kSyntax.takeDescription(attributes).orElse(null));
        tag.setAttributes(attributes);
        return Optional.of(tag);
    }
}
