package com.plcexport.l5k.parser;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.plcexport.l5k.model.AttributeList;

import lombok.Value;
import lombok.experimental.UtilityClass;

/**
 * Quote-aware helpers for the inside of a single statement or header.
 *
 * <p>String literals are delimited by {@code "} or {@code '} and use {@code $} to
 * escape the following character. Grouping characters inside literals are ignored.</p>
 */
@UtilityClass
public class L5kSyntax {
    private static final Logger log = LoggerFactory.getLogger(L5kSyntax.class);

    public static final String DESCRIPTION = "Description";

    /**
     * Index of the first {@code target} outside (), [], {} and outside string literals, or -1.
     */
    public static int firstOutsideParens(String s, String target) {
        int depth = 0;
        char quote = 0;
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            if (quote != 0) {
                if (c == '$') {
                    i++;
                } else if (c == quote) {
                    quote = 0;
                }
                continue;
            }
            if (c == '"' || c == '\'') {
                quote = c;
            } else if (c == '(' || c == '[' || c == '{') {
                depth++;
            } else if (c == ')' || c == ']' || c == '}') {
                if (depth > 0) {
                    depth--;
                }
            } else if (depth == 0 && s.startsWith(target, i)) {
                return i;
            }
        }
        return -1;
    }

    /**
     * Index of the bracket closing the one at {@code open}, or -1 when it never closes.
     */
    public static int matchingClose(String s, int open) {
        int depth = 0;
        char quote = 0;
        for (int i = open; i < s.length(); i++) {
            char c = s.charAt(i);
            if (quote != 0) {
                if (c == '$') {
                    i++;
                } else if (c == quote) {
                    quote = 0;
                }
                continue;
            }
            if (c == '"' || c == '\'') {
                quote = c;
            } else if (c == '(' || c == '[' || c == '{') {
                depth++;
            } else if (c == ')' || c == ']' || c == '}') {
                depth--;
                if (depth == 0) {
                    return i;
                }
            }
        }
        return -1;
    }

    /**
     * Removes {@code (* ... *)} comments that sit outside string literals.
     */
    public static String stripComments(String s) {
        if (!s.contains("(*")) {
            return s;
        }
        StringBuilder sb = new StringBuilder(s.length());
        char quote = 0;
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            if (quote != 0) {
                sb.append(c);
                if (c == '$' && i + 1 < s.length()) {
                    sb.append(s.charAt(++i));
                } else if (c == quote) {
                    quote = 0;
                }
                continue;
            }
            if (c == '(' && i + 1 < s.length() && s.charAt(i + 1) == '*') {
                int close = s.indexOf("*)", i + 2);
                if (close < 0) {
                    break;
                }
                i = close + 1;
                continue;
            }
            if (c == '"' || c == '\'') {
                quote = c;
            }
            sb.append(c);
        }
        return sb.toString();
    }

    /**
     * Drops the trailing {@code ;} and anything from a top-level {@code :=} on, which is
     * how initial values and force data are attached to a declaration.
     */
    public static String stripValue(String statement) {
        String s = statement.strip();
        if (s.endsWith(";")) {
            s = s.substring(0, s.length() - 1);
        }
        int assign = firstOutsideParens(s, ":=");
        if (assign >= 0) {
            s = s.substring(0, assign);
        }
        return s.strip();
    }

    /**
     * Splits {@code prefix (attrs)} into its prefix and the inside of the trailing
     * top-level parenthesised group. Without such a group the attributes are null.
     */
    public static OuterSplit splitOuterAttrs(String text) {
        String s = text.strip();
        if (!s.endsWith(")")) {
            return new OuterSplit(s, null);
        }
        int depth = 0;
        char quote = 0;
        int groupStart = -1;
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            if (quote != 0) {
                if (c == '$') {
                    i++;
                } else if (c == quote) {
                    quote = 0;
                }
                continue;
            }
            if (c == '"' || c == '\'') {
                quote = c;
            } else if (c == '(') {
                if (depth == 0) {
                    groupStart = i;
                }
                depth++;
            } else if (c == ')') {
                depth--;
                if (depth < 0) {
                    return new OuterSplit(s, null);
                }
            }
        }
        if (depth != 0 || groupStart < 0) {
            return new OuterSplit(s, null);
        }
        return new OuterSplit(s.substring(0, groupStart).strip(), s.substring(groupStart + 1, s.length() - 1));
    }

    /**
     * Parses {@code A := x, B := "y, z"} into an ordered attribute list. Values stay raw.
     */
    public static AttributeList parseAttributes(String inner) {
        AttributeList attributes = AttributeList.empty();
        if (inner == null || inner.isBlank()) {
            return attributes;
        }
        for (String item : splitTopLevel(inner, ',')) {
            String entry = item.strip();
            if (entry.isEmpty()) {
                continue;
            }
            int assign = firstOutsideParens(entry, ":=");
            if (assign <= 0) {
                log.debug("Ignoring attribute without a value: {}", entry);
                continue;
            }
            attributes.put(entry.substring(0, assign).strip(), entry.substring(assign + 2).strip());
        }
        return attributes;
    }

    /**
     * Splits on {@code separator} where it sits outside grouping and string literals.
     */
    public static List<String> splitTopLevel(String s, char separator) {
        List<String> parts = new ArrayList<>();
        int depth = 0;
        char quote = 0;
        int start = 0;
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            if (quote != 0) {
                if (c == '$') {
                    i++;
                } else if (c == quote) {
                    quote = 0;
                }
                continue;
            }
            if (c == '"' || c == '\'') {
                quote = c;
            } else if (c == '(' || c == '[' || c == '{') {
                depth++;
            } else if (c == ')' || c == ']' || c == '}') {
                if (depth > 0) {
                    depth--;
                }
            } else if (c == separator && depth == 0) {
                parts.add(s.substring(start, i));
                start = i + 1;
            }
        }
        parts.add(s.substring(start));
        return parts;
    }

    /**
     * Removes the Description attribute and returns its decoded text.
     */
    public static Optional<String> takeDescription(AttributeList attributes) {
        Optional<String> raw = attributes.get(DESCRIPTION);
        attributes.remove(DESCRIPTION);
        return raw.map(L5kSyntax::decodeString);
    }

    /**
     * Decodes a quoted literal such as {@code "Line 1$NLine $"2$""}. Unquoted input is
     * returned stripped and unchanged.
     */
    public static String decodeString(String literal) {
        String s = literal.strip();
        if (s.length() < 2) {
            return s;
        }
        char quote = s.charAt(0);
        if ((quote != '"' && quote != '\'') || s.charAt(s.length() - 1) != quote) {
            return s;
        }
        String body = s.substring(1, s.length() - 1);
        int hexWidth = quote == '"' ? 4 : 2;
        StringBuilder sb = new StringBuilder(body.length());
        for (int i = 0; i < body.length(); i++) {
            char c = body.charAt(i);
            if (c != '$' || i + 1 >= body.length()) {
                sb.append(c);
                continue;
            }
            char next = body.charAt(++i);
            switch (Character.toUpperCase(next)) {
                case 'N', 'L' -> sb.append('\n');
                case 'R' -> sb.append('\r');
                case 'T' -> sb.append('\t');
                case 'P' -> sb.append('\f');
                default -> {
                    if (isHex(body, i, hexWidth)) {
                        sb.append((char) Integer.parseInt(body.substring(i, i + hexWidth), 16));
                        i += hexWidth - 1;
                    } else {
                        sb.append(next);
                    }
                }
            }
        }
        return sb.toString();
    }

    /**
     * Encodes plain text as a double-quoted literal.
     */
    public static String encodeString(String text) {
        StringBuilder sb = new StringBuilder(text.length() + 2).append('"');
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            switch (c) {
                case '$' -> sb.append("$$");
                case '"' -> sb.append("$\"");
                case '\'' -> sb.append("$'");
                case '\n' -> sb.append("$N");
                case '\r' -> sb.append("$R");
                case '\t' -> sb.append("$T");
                case '\f' -> sb.append("$P");
                default -> sb.append(c);
            }
        }
        return sb.append('"').toString();
    }

    private static boolean isHex(String s, int from, int width) {
        if (from + width > s.length()) {
            return false;
        }
        for (int i = from; i < from + width; i++) {
            if (Character.digit(s.charAt(i), 16) < 0) {
                return false;
            }
        }
        return true;
    }

    /**
     * A declaration split around its trailing attribute group.
     */
    @Value
    public static class OuterSplit {
        String prefix;
        /** Inside of the parentheses, or null when there were none. */
        String attributes;

        public boolean hasAttributes() {
            return attributes != null;
        }
    }
}
