package com.plcexport.l5k.parser;

import java.util.EnumSet;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Recognised block kinds, in the order their header patterns are tried. The
 * encoded add-on instruction comes before anything more general.
 */
public enum BlockKind {
    HEADER("^CONTROLLER\\b"),
    ENCODED_AOI("^ENCODED_DATA\\b.*\\bEncodedType\\s*:=\\s*ADD_ON_INSTRUCTION_DEFINITION\\b"),
    UDT("^DATATYPE\\s+[A-Za-z_]\\w*"),
    AOI("^ADD_ON_INSTRUCTION_DEFINITION\\s+[A-Za-z_]\\w*"),
    CONTROLLER_TAGS("^TAG\\s*$"),
    PROGRAM("^PROGRAM\\s+[A-Za-z_]\\w*");

    /** Kinds that may appear directly inside the CONTROLLER block. */
    public static final Set<BlockKind> CONTROLLER_CONTENT =
            EnumSet.of(ENCODED_AOI, UDT, AOI, CONTROLLER_TAGS, PROGRAM);

    private final Pattern pattern;

    BlockKind(String regex) {
        this.pattern = Pattern.compile(regex, Pattern.DOTALL);
    }

    /**
     * First kind whose pattern matches the comment-free header text.
     */
    public static Optional<BlockKind> classify(String headerText) {
        String s = L5kSyntax.stripComments(headerText).strip();
        for (BlockKind kind : values()) {
            if (kind.pattern.matcher(s).find()) {
                return Optional.of(kind);
            }
        }
        return Optional.empty();
    }
}
