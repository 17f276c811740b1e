package com.plcexport.l5k.model;

import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;

/**
 * A typed declaration owned by a UDT or an add-on instruction. Declarations
 * are not filterable on their own; they travel with their owner.
 */
@Data
@NoArgsConstructor
public abstract class FieldDeclaration {
    protected String name;
    protected String declaredType;
    /** Raw bracketed dimension text such as {@code [20]} or {@code [2,3]}; empty for scalars. */
    protected String dimensions = "";
    protected String resolvedBaseType;
    protected String description;
    protected AttributeList attributes = AttributeList.empty();
    @EqualsAndHashCode.Exclude
    protected int sourceLine;

    /**
     * Element count across all dimensions, 0 for a scalar.
     */
    public int getArrayLength() {
        if (dimensions == null || dimensions.isEmpty()) {
            return 0;
        }
        String inner = dimensions.substring(1, dimensions.length() - 1);
        int length = 1;
        for (String part : inner.split(",")) {
            length *= Integer.parseInt(part.trim());
        }
        return length;
    }

    /**
     * Label shown to users, e.g. {@code DATA[20]}. Never use it as a lookup key.
     */
    public String getDisplayLabel() {
        return dimensions == null ? name : name + dimensions;
    }
}
