package com.plcexport.l5k.model;

import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;
import lombok.ToString;

/**
 * Add-on instruction parameter. A parameter declared {@code Name OF Tag.3}
 * carries a cross-reference instead of a declared type.
 */
@Data
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
@NoArgsConstructor
public class AoiParameter extends FieldDeclaration {
    private CrossReference crossReference;

    public AoiParameter(String name, String declaredType) {
        this.name = name;
        this.declaredType = declaredType;
    }

    public static AoiParameter alias(String name, CrossReference crossReference) {
        AoiParameter parameter = new AoiParameter(name, null);
        parameter.crossReference = crossReference;
        return parameter;
    }

    public boolean isCrossReference() {
        return crossReference != null;
    }
}
