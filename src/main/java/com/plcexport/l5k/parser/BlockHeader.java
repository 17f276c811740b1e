package com.plcexport.l5k.parser;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

import com.plcexport.l5k.model.AttributeList;

import lombok.Value;

/**
 * Keyword, optional name and attribute list of a block header, e.g.
 * {@code DATATYPE MOTOR_DATA (Description := "x", FamilyType := NoFamily)}.
 */
@Value
public class BlockHeader {
    private static final Pattern KEYWORD = Pattern.compile("^[A-Z][A-Z0-9_]*");
    private static final Pattern NAME = Pattern.compile("^[A-Za-z_]\\w*");

    String keyword;
    String name;
    AttributeList attributes;

    public static BlockHeader parse(String headerText) {
        String s = L5kSyntax.stripComments(headerText).strip();
        Matcher kw = KEYWORD.matcher(s);
        String keyword = kw.find() ? kw.group() : "";
        String rest = s.substring(keyword.length()).strip();

        String name = null;
        Matcher nm = NAME.matcher(rest);
        if (nm.find()) {
            name = nm.group();
            rest = rest.substring(nm.end()).strip();
        }

        AttributeList attributes = AttributeList.empty();
        if (rest.startsWith("(")) {
            int close = L5kSyntax.matchingClose(rest, 0);
            if (close > 0) {
                attributes = L5kSyntax.parseAttributes(rest.substring(1, close));
            }
        }
        return new BlockHeader(keyword, name, attributes);
    }
}
