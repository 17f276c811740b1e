package com.plcexport.l5k.state;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.ToString;

/**
 * Inclusion flags and description overrides of a project, plus enough identifying
 * data to reattach them to a later parse of the same or an updated export.
 */
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
@ToString
@EqualsAndHashCode
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ProjectSnapshot {

    public static final int CURRENT_VERSION = 1;

    @Builder.Default
    @JsonProperty("version")
    private int version = CURRENT_VERSION;

    @JsonProperty("source_name")
    private String sourceName;

    @JsonProperty("controller_name")
    private String controllerName;

    @Builder.Default
    @JsonProperty("entries")
    private List<SnapshotEntry> entries = List.of();

    public List<SnapshotEntry> getEntries() {
        return entries == null ? List.of() : entries;
    }
}
