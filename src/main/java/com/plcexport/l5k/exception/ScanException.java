package com.plcexport.l5k.exception;

import lombok.Getter;

/**
 * Structural failure of the scanner: an unterminated string literal or comment,
 * an attribute list that never closes, or a block without its END_ keyword.
 * Aborts the whole parse.
 */
@Getter
public class ScanException extends L5kException {

    private static final long serialVersionUID = 1L;

    private final int offset;
    private final int line;
    private final String condition;

    public ScanException(String condition, int offset, int line) {
        super(condition + " (line " + line + ", offset " + offset + ")");
        this.condition = condition;
        this.offset = offset;
        this.line = line;
    }
}
