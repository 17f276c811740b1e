package com.plcexport.l5k.export;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import com.plcexport.l5k.config.TunerConfig;
import com.plcexport.l5k.exception.MissingRequiredFieldException;
import com.plcexport.l5k.model.AddOnInstruction;
import com.plcexport.l5k.model.AoiLocalTag;
import com.plcexport.l5k.model.AoiParameter;
import com.plcexport.l5k.model.AttributeList;
import com.plcexport.l5k.model.BaseTypes;
import com.plcexport.l5k.model.Entity;
import com.plcexport.l5k.model.EntityVisitor;
import com.plcexport.l5k.model.FieldDeclaration;
import com.plcexport.l5k.model.L5kHeader;
import com.plcexport.l5k.model.Program;
import com.plcexport.l5k.model.Tag;
import com.plcexport.l5k.model.UdtMember;
import com.plcexport.l5k.model.UserDefinedType;
import com.plcexport.l5k.parser.L5kSyntax;
import com.plcexport.l5k.state.TreeState;

/**
 * Writes one entity as dialect text into its own line buffer. A writer that
 * throws leaves nothing behind, so a failed entity never reaches the output.
 *
 * <p>Attributes are written Description first, then the remaining parsed
 * attributes verbatim. Values are never written.</p>
 */
class BlockWriter implements EntityVisitor {

    private final TunerConfig config;
    private final TreeState state;
    private final List<String> lines = new ArrayList<>();
    /** Program tags dropped by {@link #visit(Program)}; the program itself still goes out. */
    private final List<ExportError> nestedErrors = new ArrayList<>();
    private int programTagsWritten;

    BlockWriter(TunerConfig config, TreeState state) {
        this.config = config;
        this.state = state;
    }

    List<String> getLines() {
        return lines;
    }

    List<ExportError> getNestedErrors() {
        return nestedErrors;
    }

    int getProgramTagsWritten() {
        return programTagsWritten;
    }

    @Override
    public void visit(L5kHeader header) {
        if (!header.getPreamble().isEmpty()) {
            lines.addAll(List.of(header.getPreamble().split("\n", -1)));
            lines.add("");
        }
        if (!header.getControllerHeaderLines().isEmpty()) {
            lines.addAll(header.getControllerHeaderLines());
        } else if (header.getControllerName() != null) {
            lines.add("CONTROLLER " + header.getControllerName());
        } else {
            throw new MissingRequiredFieldException(header.getKey(), "controllerName", "no CONTROLLER header to write");
        }
    }

    @Override
    public void visit(UserDefinedType udt) {
        requireName(udt);
        AttributeList header = AttributeList.empty();
        putDescription(header, state.effectiveDescription(udt));
        header.put("FamilyType", udt.getEffectiveFamilyType());

        List<String> body = new ArrayList<>();
        for (UdtMember member : udt.getMembers().values()) {
            if (member.getResolvedBaseType() == null) {
                throw new MissingRequiredFieldException(udt.getKey(), member.getName() + ".resolvedBaseType",
                        "member type " + member.getDeclaredType() + " did not resolve");
            }
            String declaration = member.isBitMember()
                    ? "BIT " + member.getName() + " " + member.getHostWord() + " : " + member.getBitIndex()
                    : member.getDeclaredType() + " " + member.getName() + member.getDimensions();
            body.add(indent(2) + declaration + attributesOf(member) + ";");
        }

        lines.add(indent(1) + "DATATYPE " + udt.getName() + " (" + header.render() + ")");
        lines.addAll(body);
        lines.add(indent(1) + "END_DATATYPE");
    }

    @Override
    public void visit(AddOnInstruction aoi) {
        requireName(aoi);
        AttributeList header = AttributeList.empty();
        putDescription(header, state.effectiveDescription(aoi));
        if (aoi.getFamilyType() != null) {
            header.put("FamilyType", aoi.getFamilyType());
        }

        List<String> parameters = new ArrayList<>();
        for (AoiParameter parameter : aoi.getParameters().values()) {
            parameters.add(indent(3) + parameterDeclaration(aoi, parameter) + attributesOf(parameter) + ";");
        }
        List<String> locals = new ArrayList<>();
        for (AoiLocalTag local : aoi.getLocalTags().values()) {
            requireType(aoi, local);
            locals.add(indent(3) + local.getName() + " : " + local.getDeclaredType() + local.getDimensions()
                    + attributesOf(local) + ";");
        }

        lines.add(indent(1) + "ADD_ON_INSTRUCTION_DEFINITION " + aoi.getName() + " (" + header.render() + ")");
        lines.add(indent(2) + "PARAMETERS");
        lines.addAll(parameters);
        lines.add(indent(2) + "END_PARAMETERS");
        lines.add(indent(2) + "LOCAL_TAGS");
        lines.addAll(locals);
        lines.add(indent(2) + "END_LOCAL_TAGS");
        lines.add(indent(1) + "END_ADD_ON_INSTRUCTION_DEFINITION");
    }

    @Override
    public void visit(Tag tag) {
        requireName(tag);
        if (tag.getDeclaredType() == null) {
            throw new MissingRequiredFieldException(tag.getKey(), "declaredType", null);
        }
        if (tag.getResolvedBaseType() == null) {
            throw new MissingRequiredFieldException(tag.getKey(), "resolvedBaseType",
                    "type " + tag.getDeclaredType() + " did not resolve");
        }
        AttributeList attributes = AttributeList.empty();
        putDescription(attributes, state.effectiveDescription(tag));
        copyInto(attributes, tag.getAttributes());
        lines.add(indent(tag.isProgramTag() ? 3 : 2) + tag.getName() + " : " + tag.getDeclaredType()
                + tag.getDimensions() + render(attributes) + ";");
    }

    /**
     * Writes the program with the tags that are included on their own.
     */
    @Override
    public void visit(Program program) {
        requireName(program);
        String description = state.effectiveDescription(program);
        String header = indent(1) + "PROGRAM " + program.getName();
        if (description != null && !description.isEmpty()) {
            header += " (" + L5kSyntax.DESCRIPTION + " := " + L5kSyntax.encodeString(description) + ")";
        }

        List<String> tagLines = new ArrayList<>();
        int written = 0;
        for (Tag tag : program.getTags().values()) {
            if (!state.isIncluded(tag)) {
                continue;
            }
            BlockWriter tagWriter = new BlockWriter(config, state);
            try {
                tag.accept(tagWriter);
            } catch (MissingRequiredFieldException e) {
                nestedErrors.add(ExportError.of(e));
                continue;
            }
            tagLines.addAll(tagWriter.getLines());
            written++;
        }

        lines.add(header);
        if (!tagLines.isEmpty()) {
            lines.add(indent(2) + "TAG");
            lines.addAll(tagLines);
            lines.add(indent(2) + "END_TAG");
        }
        lines.add(indent(1) + "END_PROGRAM");
        programTagsWritten = written;
    }

    private String parameterDeclaration(AddOnInstruction aoi, AoiParameter parameter) {
        if (parameter.isCrossReference()) {
            if (parameter.getCrossReference().isBit()) {
                return parameter.getName() + " : " + BaseTypes.BOOL;
            }
            if (parameter.getResolvedBaseType() != null) {
                return parameter.getName() + " : " + parameter.getResolvedBaseType();
            }
            return parameter.getName() + " OF " + parameter.getCrossReference().getPath();
        }
        requireType(aoi, parameter);
        return parameter.getName() + " : " + parameter.getDeclaredType() + parameter.getDimensions();
    }

    private String attributesOf(FieldDeclaration field) {
        AttributeList attributes = AttributeList.empty();
        putDescription(attributes, field.getDescription());
        copyInto(attributes, field.getAttributes());
        return render(attributes);
    }

    private static void putDescription(AttributeList attributes, String description) {
        if (description != null && !description.isEmpty()) {
            attributes.put(L5kSyntax.DESCRIPTION, L5kSyntax.encodeString(description));
        }
    }

    private static void copyInto(AttributeList target, AttributeList source) {
        if (source == null) {
            return;
        }
        for (Map.Entry<String, String> e : source.entries()) {
            if (!e.getKey().equalsIgnoreCase(L5kSyntax.DESCRIPTION)) {
                target.put(e.getKey(), e.getValue());
            }
        }
    }

    private static String render(AttributeList attributes) {
        return attributes.isEmpty() ? "" : " (" + attributes.render() + ")";
    }

    private static void requireName(Entity entity) {
        if (entity.getName() == null || entity.getName().isBlank()) {
            throw new MissingRequiredFieldException(entity.getKey(), "name", null);
        }
    }

    private static void requireType(AddOnInstruction aoi, FieldDeclaration field) {
        if (field.getDeclaredType() == null || field.getDeclaredType().isBlank()) {
            throw new MissingRequiredFieldException(aoi.getKey(), field.getName() + ".declaredType", null);
        }
    }

    private String indent(int level) {
        return config.getIndent().repeat(level);
    }
}
