package com.plcexport.l5k.merge;

import lombok.Builder;
import lombok.Data;

@Data
@Builder
public class MergeResult {
    private int added;
    private int removed;
    private int programShellsCreated;
    /** Accepted keys that were not part of the change set. */
    private int ignored;
}
