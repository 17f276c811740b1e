package com.plcexport.l5k.parser.extract;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.plcexport.l5k.model.AddOnInstruction;
import com.plcexport.l5k.model.AoiLocalTag;
import com.plcexport.l5k.model.AoiParameter;
import com.plcexport.l5k.model.AttributeList;
import com.plcexport.l5k.model.CrossReference;
import com.plcexport.l5k.model.FieldDeclaration;
import com.plcexport.l5k.model.L5kProject;
import com.plcexport.l5k.parser.BlockKind;
import com.plcexport.l5k.parser.L5kSyntax;
import com.plcexport.l5k.parser.ParseDiagnostics;
import com.plcexport.l5k.parser.Segment;

/**
 * Extracts {@code ADD_ON_INSTRUCTION_DEFINITION} blocks and encoded AOIs
 * ({@code ENCODED_DATA (EncodedType := ADD_ON_INSTRUCTION_DEFINITION, Name := "X")}).
 * Only the PARAMETERS and LOCAL_TAGS sections are read; routines are skipped.
 */
public class AddOnInstructionExtractor extends AbstractBlockExtractor {
    private static final Logger log = LoggerFactory.getLogger(AddOnInstructionExtractor.class);

    private static final Pattern TYPED = Pattern.compile(
            "^([A-Za-z_]\\w*)\\s*:\\s*([A-Za-z_][\\w:]*)\\s*(\\[\\s*\\d+(?:\\s*,\\s*\\d+)*\\s*\\])?$");
    private static final Pattern ALIAS = Pattern.compile(
            "^([A-Za-z_]\\w*)\\s+OF\\s+([A-Za-z_][\\w.\\[\\]:]*)$");
    private static final String DEFAULT_DATA = "DefaultData";

    @Override
    public void extract(BlockContext block, L5kProject project, ParseDiagnostics diagnostics) {
        AttributeList attributes = block.getHeader().getAttributes().copy();
        boolean encoded = block.getKind() == BlockKind.ENCODED_AOI;
        String name = encoded
                ? attributes.get("Name").map(L5kSyntax::decodeString).orElse(null)
                : block.getHeader().getName();
        if (name == null || name.isBlank()) {
            log.warn("Skipping add-on instruction without a name at line {}", block.getLine());
            diagnostics.getWarnings().add("Unrecognized block " + block.getHeader().getKeyword()
                    + " at line " + block.getLine() + ": no name");
            return;
        }

        AddOnInstruction aoi = new AddOnInstruction(name);
        aoi.setSourceLine(block.getLine());
        L5kSyntax.takeDescription(attributes).ifPresent(aoi::setDescription);
        attributes.get("FamilyType").ifPresent(aoi::setFamilyType);

        for (Segment segment : block.bodySegments()) {
            if (segment.isBlock()) {
                String keyword = segment.getBlock().getKeyword();
                if ("PARAMETERS".equals(keyword)) {
                    readParameters(block.nested(segment), aoi, diagnostics);
                } else if ("LOCAL_TAGS".equals(keyword)) {
                    readLocalTags(block.nested(segment), aoi, diagnostics);
                } else {
                    log.debug("Skipping {} in {} at line {}", keyword, name, block.lineOf(segment));
                }
            } else if (segment.isStatement()) {
                if (encoded) {
                    log.trace("Skipping encoded payload in {} at line {}", name, block.lineOf(segment));
                } else {
                    unrecognizedLine(block, segment, diagnostics);
                }
            }
        }

        project.addAoi(aoi);
        log.debug("Parsed AOI {} with {} parameters and {} local tags", name,
                aoi.getParameters().size(), aoi.getLocalTags().size());
    }

    private void readParameters(BlockContext section, AddOnInstruction aoi, ParseDiagnostics diagnostics) {
        for (Segment segment : section.bodySegments()) {
            if (!segment.isStatement()) {
                continue;
            }
            Optional<AoiParameter> parameter = segment.isTerminated()
                    ? parseParameter(declaration(section, segment)) : Optional.empty();
            if (parameter.isEmpty()) {
                unrecognizedLine(section, segment, diagnostics);
                continue;
            }
            parameter.get().setSourceLine(section.lineOf(segment));
            if (!aoi.addParameter(parameter.get())) {
                duplicate(aoi, parameter.get(), section.lineOf(segment), diagnostics);
            }
        }
    }

    private void readLocalTags(BlockContext section, AddOnInstruction aoi, ParseDiagnostics diagnostics) {
        for (Segment segment : section.bodySegments()) {
            if (!segment.isStatement()) {
                continue;
            }
            Optional<AoiLocalTag> local = segment.isTerminated()
                    ? parseLocalTag(declaration(section, segment)) : Optional.empty();
            if (local.isEmpty()) {
                unrecognizedLine(section, segment, diagnostics);
                continue;
            }
            local.get().setSourceLine(section.lineOf(segment));
            if (!aoi.addLocalTag(local.get())) {
                duplicate(aoi, local.get(), section.lineOf(segment), diagnostics);
            }
        }
    }

    Optional<AoiParameter> parseParameter(String declaration) {
        L5kSyntax.OuterSplit split = L5kSyntax.splitOuterAttrs(declaration);
        AoiParameter parameter;
        Matcher typed = TYPED.matcher(split.getPrefix());
        Matcher alias = ALIAS.matcher(split.getPrefix());
        if (typed.matches()) {
            parameter = new AoiParameter(typed.group(1), typed.group(2));
            parameter.setDimensions(normalizeDimensions(typed.group(3)));
        } else if (alias.matches()) {
            parameter = AoiParameter.alias(alias.group(1), CrossReference.parse(alias.group(2)));
        } else {
            return Optional.empty();
        }
        applyAttributes(parameter, split.getAttributes());
        return Optional.of(parameter);
    }

    Optional<AoiLocalTag> parseLocalTag(String declaration) {
        L5kSyntax.OuterSplit split = L5kSyntax.splitOuterAttrs(declaration);
        Matcher typed = TYPED.matcher(split.getPrefix());
        if (!typed.matches()) {
            return Optional.empty();
        }
        AoiLocalTag local = new AoiLocalTag(typed.group(1), typed.group(2));
        local.setDimensions(normalizeDimensions(typed.group(3)));
        applyAttributes(local, split.getAttributes());
        return Optional.of(local);
    }

    private void applyAttributes(FieldDeclaration field, String rawAttributes) {
        AttributeList attributes = L5kSyntax.parseAttributes(rawAttributes);
        attributes.remove(DEFAULT_DATA);
        field.setDescription(L5kSyntax.takeDescription(attributes).orElse(null));
        field.setAttributes(attributes);
    }

    private void duplicate(AddOnInstruction aoi, FieldDeclaration field, int line, ParseDiagnostics diagnostics) {
        log.warn("Duplicate declaration {} in AOI {} at line {}; keeping the first", field.getName(), aoi.getName(), line);
        diagnostics.getWarnings().add("Duplicate declaration " + aoi.getName() + "." + field.getName() + " at line " + line);
    }
}
