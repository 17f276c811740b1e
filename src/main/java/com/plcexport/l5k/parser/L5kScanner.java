package com.plcexport.l5k.parser;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.plcexport.l5k.exception.ScanException;

/**
 * Lexical walker over L5K text.
 *
 * <p>Splits a region into comments, statements and keyword blocks while tracking
 * string literals, {@code $} escapes, {@code (* *)} comments and bracket depth, so
 * that delimiters inside literals never count. The scanner never builds entities;
 * it only reports offsets.</p>
 */
public class L5kScanner {
    private static final Logger log = LoggerFactory.getLogger(L5kScanner.class);

    /** Blocks that must be closed by their END_ keyword. */
    public static final Set<String> STRUCTURAL_KEYWORDS = Set.of(
            "CONTROLLER", "DATATYPE", "ADD_ON_INSTRUCTION_DEFINITION", "ENCODED_DATA",
            "PROGRAM", "TAG", "PARAMETERS", "LOCAL_TAGS"
    );

    /** A statement continues on the next line when that line starts with one of these. */
    private static final String CONTINUATION = ":(,[";

    private final String source;
    private final int[] lineStarts;

    public L5kScanner(String source) {
        this.source = source;
        this.lineStarts = indexLines(source);
    }

    public String getSource() {
        return source;
    }

    public int length() {
        return source.length();
    }

    public String text(int start, int end) {
        return source.substring(start, end);
    }

    /**
     * 1-based line number of an offset.
     */
    public int lineOf(int offset) {
        int idx = Arrays.binarySearch(lineStarts, offset);
        return idx >= 0 ? idx + 1 : -idx - 1;
    }

    /**
     * All segments between {@code from} and {@code limit}.
     */
    public List<Segment> segments(int from, int limit) {
        List<Segment> segments = new ArrayList<>();
        Segment segment = nextSegment(from, limit);
        while (segment != null) {
            segments.add(segment);
            segment = nextSegment(segment.getEnd(), limit);
        }
        return segments;
    }

    /**
     * The next segment starting at or after {@code from}, or null when only
     * whitespace is left before {@code limit}.
     *
     * @throws ScanException on an unterminated literal or comment, unbalanced
     *         brackets at the end of the region, or a structural block without its END_ line
     */
    public Segment nextSegment(int from, int limit) {
        int pos = skipWhitespace(from, limit);
        if (pos >= limit) {
            return null;
        }
        if (source.startsWith("(*", pos)) {
            return Segment.comment(pos, commentEnd(pos, limit));
        }

        String word = wordAt(pos, limit);
        StatementEnd statementEnd = scanStatement(pos, limit);
        if (statementEnd.terminated) {
            return Segment.statement(pos, statementEnd.end, true);
        }
        if (isKeyword(word)) {
            BlockSpan span = findBlockEnd(word, pos, statementEnd.end, limit);
            if (span != null) {
                log.trace("Block {} spans lines {}-{}", word, lineOf(pos), lineOf(span.getEnd()));
                return Segment.block(span);
            }
            if (STRUCTURAL_KEYWORDS.contains(word)) {
                throw error("Missing END_" + word + " for " + word + " block", pos);
            }
        }
        return Segment.statement(pos, statementEnd.end, false);
    }

    /**
     * Walks one statement or header. It ends at a top-level {@code ;}, or at a
     * top-level line end unless the next line continues it.
     */
    private StatementEnd scanStatement(int pos, int limit) {
        int depth = 0;
        char quote = 0;
        int quoteStart = -1;
        for (int i = pos; i < limit; i++) {
            char c = source.charAt(i);
            if (quote != 0) {
                if (c == '$') {
                    i++;
                } else if (c == quote) {
                    quote = 0;
                }
                continue;
            }
            if (c == '(' && i + 1 < limit && source.charAt(i + 1) == '*') {
                i = commentEnd(i, limit) - 1;
                continue;
            }
            switch (c) {
                case '"', '\'' -> {
                    quote = c;
                    quoteStart = i;
                }
                case '(', '[', '{' -> depth++;
                case ')', ']', '}' -> {
                    if (depth > 0) {
                        depth--;
                    }
                }
                case ';' -> {
                    if (depth == 0) {
                        return new StatementEnd(i + 1, true);
                    }
                }
                case '\n' -> {
                    if (depth == 0) {
                        int next = skipWhitespace(i + 1, limit);
                        if (continuesOn(next, limit)) {
                            i = next - 1;
                        } else {
                            return new StatementEnd(i, false);
                        }
                    }
                }
                default -> {
                    // plain character
                }
            }
        }
        if (quote != 0) {
            throw error("Unterminated string literal", quoteStart);
        }
        if (depth > 0) {
            throw error("Unbalanced delimiters: " + depth + " left open at end of input", pos);
        }
        return new StatementEnd(limit, false);
    }

    /**
     * Finds the {@code END_<keyword>} line matching a header, counting nested
     * openers of the same keyword. Literals and comments are skipped.
     */
    private BlockSpan findBlockEnd(String keyword, int start, int headerEnd, int limit) {
        String closer = "END_" + keyword;
        int nesting = 0;
        char quote = 0;
        int quoteStart = -1;
        // first literal that ran past a line end, the likely culprit of an unterminated one
        int openAcrossLine = -1;
        boolean lineStart = true;
        for (int i = headerEnd; i < limit; i++) {
            char c = source.charAt(i);
            if (quote != 0) {
                if (c == '$') {
                    i++;
                } else if (c == quote) {
                    quote = 0;
                } else if (c == '\n') {
                    lineStart = true;
                    if (openAcrossLine < 0) {
                        openAcrossLine = quoteStart;
                    }
                }
                continue;
            }
            if (c == '\n') {
                lineStart = true;
                continue;
            }
            if (lineStart) {
                if (c == ' ' || c == '\t' || c == '\r') {
                    continue;
                }
                lineStart = false;
                if (wordMatches(closer, i, limit)) {
                    if (nesting == 0) {
                        int end = i + closer.length();
                        int after = skipBlanks(end, limit);
                        if (after < limit && source.charAt(after) == ';') {
                            end = after + 1;
                        }
                        return new BlockSpan(keyword, start, headerEnd, i, end);
                    }
                    nesting--;
                } else if (wordMatches(keyword, i, limit) && !lineEndsWithSemicolon(i, limit)) {
                    nesting++;
                }
            }
            if (c == '(' && i + 1 < limit && source.charAt(i + 1) == '*') {
                i = commentEnd(i, limit) - 1;
            } else if (c == '"' || c == '\'') {
                quote = c;
                quoteStart = i;
            }
        }
        if (quote != 0) {
            throw error("Unterminated string literal", openAcrossLine >= 0 ? openAcrossLine : quoteStart);
        }
        return null;
    }

    private boolean continuesOn(int next, int limit) {
        if (next >= limit || CONTINUATION.indexOf(source.charAt(next)) < 0) {
            return false;
        }
        return !source.startsWith("(*", next);
    }

    private int commentEnd(int open, int limit) {
        int close = source.indexOf("*)", open + 2);
        if (close < 0 || close + 2 > limit) {
            throw error("Unterminated comment", open);
        }
        return close + 2;
    }

    private boolean wordMatches(String word, int pos, int limit) {
        if (!source.startsWith(word, pos)) {
            return false;
        }
        int after = pos + word.length();
        return after >= limit || !isWordChar(source.charAt(after));
    }

    private boolean lineEndsWithSemicolon(int pos, int limit) {
        int nl = source.indexOf('\n', pos);
        int end = nl < 0 || nl > limit ? limit : nl;
        return source.substring(pos, end).strip().endsWith(";");
    }

    private String wordAt(int pos, int limit) {
        int end = pos;
        while (end < limit && isWordChar(source.charAt(end))) {
            end++;
        }
        return source.substring(pos, end);
    }

    private static boolean isKeyword(String word) {
        if (word.length() < 2 || word.startsWith("END_")) {
            return false;
        }
        for (int i = 0; i < word.length(); i++) {
            char c = word.charAt(i);
            boolean ok = (c >= 'A' && c <= 'Z') || c == '_' || (i > 0 && c >= '0' && c <= '9');
            if (!ok) {
                return false;
            }
        }
        return true;
    }

    private static boolean isWordChar(char c) {
        return Character.isLetterOrDigit(c) || c == '_';
    }

    private int skipWhitespace(int pos, int limit) {
        while (pos < limit && Character.isWhitespace(source.charAt(pos))) {
            pos++;
        }
        return pos;
    }

    private int skipBlanks(int pos, int limit) {
        while (pos < limit && (source.charAt(pos) == ' ' || source.charAt(pos) == '\t')) {
            pos++;
        }
        return pos;
    }

    private ScanException error(String condition, int offset) {
        return new ScanException(condition, offset, lineOf(offset));
    }

    private static int[] indexLines(String source) {
        List<Integer> starts = new ArrayList<>();
        starts.add(0);
        for (int i = 0; i < source.length(); i++) {
            if (source.charAt(i) == '\n') {
                starts.add(i + 1);
            }
        }
        return starts.stream().mapToInt(Integer::intValue).toArray();
    }

    private static final class StatementEnd {
        private final int end;
        private final boolean terminated;

        private StatementEnd(int end, boolean terminated) {
            this.end = end;
            this.terminated = terminated;
        }
    }
}
