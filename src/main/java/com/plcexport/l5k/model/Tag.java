package com.plcexport.l5k.model;

import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;
import lombok.ToString;

/**
 * A controller-scoped or program-scoped tag. Initial values are never kept.
 */
@Data
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
@NoArgsConstructor
public class Tag extends Entity {
    private String declaredType;
    private String dimensions = "";
    private String resolvedBaseType;
    private AttributeList attributes = AttributeList.empty();
    /** Owning program, or null for a controller tag. */
    private String program;

    public Tag(String name, String declaredType) {
        super(name);
        this.declaredType = declaredType;
    }

    public boolean isProgramTag() {
        return program != null;
    }

    @Override
    public EntityKind getKind() {
        return program == null ? EntityKind.CONTROLLER_TAG : EntityKind.PROGRAM_TAG;
    }

    @Override
    public EntityKey getKey() {
        return program == null ? EntityKey.controllerTag(name) : EntityKey.programTag(program, name);
    }

    @Override
    public String getDisplayName() {
        return dimensions == null ? name : name + dimensions;
    }

    @Override
    public void accept(EntityVisitor visitor) {
        visitor.visit(this);
    }
}
