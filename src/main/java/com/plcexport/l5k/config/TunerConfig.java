package com.plcexport.l5k.config;

import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;

import lombok.Builder;
import lombok.Data;

/**
 * Settings for reading and writing L5K text.
 *
 * The lossy export transforms (bit aliases become BOOL, values are dropped)
 * are not settings; they always apply.
 */
@Data
@Builder
public class TunerConfig {

    /**
     * Charset used to read input exports and write output exports.
     */
    @Builder.Default
    private Charset charset = StandardCharsets.UTF_8;

    /**
     * One indentation level in exported text.
     */
    @Builder.Default
    private String indent = "\t";

    /**
     * Line separator of exported text.
     */
    @Builder.Default
    private String lineSeparator = "\n";

    public static TunerConfig defaults() {
        return TunerConfig.builder().build();
    }
}
