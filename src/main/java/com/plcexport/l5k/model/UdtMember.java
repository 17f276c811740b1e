package com.plcexport.l5k.model;

import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;
import lombok.ToString;

/**
 * Member of a user-defined type. Bit members ({@code BIT Run ZZZZZZZZZZMotor0 : 0})
 * name their host word and bit index.
 */
@Data
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
@NoArgsConstructor
public class UdtMember extends FieldDeclaration {
    private boolean hidden;
    private String hostWord;
    private Integer bitIndex;

    public UdtMember(String name, String declaredType) {
        this.name = name;
        this.declaredType = declaredType;
    }

    public static UdtMember bit(String name, String hostWord, int bitIndex) {
        UdtMember member = new UdtMember(name, BaseTypes.BOOL);
        member.hostWord = hostWord;
        member.bitIndex = bitIndex;
        member.resolvedBaseType = BaseTypes.BOOL;
        return member;
    }

    public boolean isBitMember() {
        return hostWord != null;
    }
}
