package com.plcexport.l5k.model;

import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;
import lombok.ToString;

@Data
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
@NoArgsConstructor
public class AoiLocalTag extends FieldDeclaration {

    public AoiLocalTag(String name, String declaredType) {
        this.name = name;
        this.declaredType = declaredType;
    }
}
