package com.plcexport.l5k.state;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Per-entity user state, kept apart from the parsed model.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class EntityState {
    private boolean included = true;
    /** Replaces the parsed description when non-null. */
    private String descriptionOverride;

    public static EntityState defaults() {
        return new EntityState();
    }
}
