package com.plcexport.l5k.parser;

/**
 * States of the block parser. {@code FINISHED} is terminal for one region.
 */
public enum ParserState {
    /** Between blocks, looking for the next opener. */
    SEEKING,
    /** A recognised opener was found; its header is being read. */
    IN_HEADER,
    /** Header done; the body runs up to the matching END_ line. */
    IN_BODY,
    /** Body closed; the block is handed to its extractor. */
    BLOCK_COMPLETE,
    FINISHED
}
