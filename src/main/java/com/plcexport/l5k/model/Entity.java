package com.plcexport.l5k.model;

import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;

/**
 * Base class for every keyed element of the project model.
 */
@Data
@NoArgsConstructor
public abstract class Entity {
    protected String name;
    protected String description;
    @EqualsAndHashCode.Exclude
    protected int sourceLine;

    protected Entity(String name) {
        this.name = name;
    }

    public abstract EntityKind getKind();

    public abstract void accept(EntityVisitor visitor);

    public EntityKey getKey() {
        return EntityKey.of(getKind(), name);
    }

    public String getDisplayName() {
        return name;
    }
}
