package com.plcexport.l5k.parser.extract;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.plcexport.l5k.model.AttributeList;
import com.plcexport.l5k.model.L5kProject;
import com.plcexport.l5k.model.UdtMember;
import com.plcexport.l5k.model.UserDefinedType;
import com.plcexport.l5k.parser.L5kSyntax;
import com.plcexport.l5k.parser.ParseDiagnostics;
import com.plcexport.l5k.parser.Segment;

/**
 * Extracts a {@code DATATYPE} block.
 *
 * Member forms:
 * <pre>
 * DINT Speed (Description := "rpm", Radix := Decimal);
 * MOTOR_DATA2 DATA[20];
 * SINT ZZZZZZZZZZMOTOR_DATA0 (Hidden := 1);
 * BIT Running ZZZZZZZZZZMOTOR_DATA0 : 0 (Radix := Decimal);
 * </pre>
 */
public class DatatypeExtractor extends AbstractBlockExtractor {
    private static final Logger log = LoggerFactory.getLogger(DatatypeExtractor.class);

    private static final Pattern BIT_MEMBER = Pattern.compile(
            "^BIT\\s+([A-Za-z_]\\w*)\\s+([A-Za-z_]\\w*)\\s*:\\s*(\\d{1,9})$");
    private static final Pattern TYPED_MEMBER = Pattern.compile(
            "^([A-Za-z_][\\w:]*)\\s+([A-Za-z_]\\w*)\\s*(\\[\\s*\\d+(?:\\s*,\\s*\\d+)*\\s*\\])?$");
    private static final String HIDDEN_PREFIX = "ZZZZZZZZZZ";

    @Override
    public void extract(BlockContext block, L5kProject project, ParseDiagnostics diagnostics) {
        String name = block.getHeader().getName();
        UserDefinedType udt = new UserDefinedType(name);
        udt.setSourceLine(block.getLine());

        AttributeList attributes = block.getHeader().getAttributes().copy();
        L5kSyntax.takeDescription(attributes).ifPresent(udt::setDescription);
        udt.setFamilyType(attributes.get("FamilyType").orElse(UserDefinedType.DEFAULT_FAMILY_TYPE));

        for (Segment segment : block.bodySegments()) {
            switch (segment.getType()) {
                case COMMENT -> {
                    // ignored
                }
                case BLOCK -> unrecognizedBlock(block, segment, diagnostics);
                case STATEMENT -> {
                    Optional<UdtMember> member = segment.isTerminated()
                            ? parseMember(declaration(block, segment)) : Optional.empty();
                    if (member.isEmpty()) {
                        unrecognizedLine(block, segment, diagnostics);
                        continue;
                    }
                    member.get().setSourceLine(block.lineOf(segment));
                    if (!udt.addMember(member.get())) {
                        log.warn("Duplicate member {} in {} at line {}; keeping the first",
                                member.get().getName(), name, block.lineOf(segment));
                        diagnostics.getWarnings().add("Duplicate member " + name + "." + member.get().getName()
                                + " at line " + block.lineOf(segment));
                    }
                }
            }
        }

        project.addUdt(udt);
        log.debug("Parsed DATATYPE {} with {} members", name, udt.getMembers().size());
    }

    Optional<UdtMember> parseMember(String declaration) {
        L5kSyntax.OuterSplit split = L5kSyntax.splitOuterAttrs(declaration);
        AttributeList attributes = L5kSyntax.parseAttributes(split.getAttributes());
        String description = L5kSyntax.takeDescription(attributes).orElse(null);

        UdtMember member;
        Matcher bit = BIT_MEMBER.matcher(split.getPrefix());
        Matcher typed = TYPED_MEMBER.matcher(split.getPrefix());
        if (bit.matches()) {
            member = UdtMember.bit(bit.group(1), bit.group(2), Integer.parseInt(bit.group(3)));
        } else if (typed.matches()) {
            member = new UdtMember(typed.group(2), typed.group(1));
            member.setDimensions(normalizeDimensions(typed.group(3)));
            member.setHidden(member.getName().startsWith(HIDDEN_PREFIX)
                    || attributes.get("Hidden").map("1"::equals).orElse(false));
        } else {
            return Optional.empty();
        }
        member.setDescription(description);
        member.setAttributes(attributes);
        return Optional.of(member);
    }
}
