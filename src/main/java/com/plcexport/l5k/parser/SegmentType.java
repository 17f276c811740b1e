package com.plcexport.l5k.parser;

public enum SegmentType {
    COMMENT,
    STATEMENT,
    BLOCK
}
