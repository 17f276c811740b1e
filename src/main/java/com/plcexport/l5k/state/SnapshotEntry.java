package com.plcexport.l5k.state;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.plcexport.l5k.model.EntityKey;
import com.plcexport.l5k.model.EntityKind;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.ToString;

/**
 * Saved state of one entity, addressed by its key parts.
 */
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
@ToString
@EqualsAndHashCode
@JsonInclude(JsonInclude.Include.NON_NULL)
public class SnapshotEntry {

    @JsonProperty("kind")
    private EntityKind kind;

    @JsonProperty("name")
    private String name;

    /** Program name for program tags, otherwise null. */
    @JsonProperty("parent")
    private String parent;

    @JsonProperty("included")
    private boolean included;

    /** Description override, null when the parsed one stands. */
    @JsonProperty("description")
    private String description;

    public EntityKey toKey() {
        return new EntityKey(kind, name, parent);
    }

    public static SnapshotEntry of(EntityKey key, EntityState state) {
        return SnapshotEntry.builder()
                .kind(key.getKind())
                .name(key.getName())
                .parent(key.getParent())
                .included(state.isIncluded())
                .description(state.getDescriptionOverride())
                .build();
    }
}
