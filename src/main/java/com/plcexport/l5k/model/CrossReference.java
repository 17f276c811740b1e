package com.plcexport.l5k.model;

import lombok.Value;

/**
 * Target of an {@code OF <tag>.<member>} parameter alias.
 */
@Value
public class CrossReference {
    private static final int MAX_BIT_DIGITS = 9;

    String target;
    String member;

    public static CrossReference parse(String path) {
        int dot = path.indexOf('.');
        if (dot < 0) {
            return new CrossReference(path, null);
        }
        return new CrossReference(path.substring(0, dot), path.substring(dot + 1));
    }

    /**
     * True when the alias points at a single bit, e.g. {@code Motor.3}.
     */
    public boolean isBit() {
        return member != null && !member.isEmpty() && member.length() <= MAX_BIT_DIGITS
                && member.chars().allMatch(Character::isDigit);
    }

    public Integer getBitIndex() {
        return isBit() ? Integer.valueOf(member) : null;
    }

    public String getPath() {
        return member == null ? target : target + "." + member;
    }

    @Override
    public String toString() {
        return getPath();
    }
}
