package com.plcexport.l5k.model;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;
import lombok.ToString;

/**
 * A DATATYPE definition and its ordered members, keyed by member base name.
 */
@Data
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
@NoArgsConstructor
public class UserDefinedType extends Entity {
    public static final String DEFAULT_FAMILY_TYPE = "NoFamily";

    private String familyType;
    private Map<String, UdtMember> members = new LinkedHashMap<>();

    public UserDefinedType(String name) {
        super(name);
    }

    /**
     * @return false when a member with the same base name already exists
     */
    public boolean addMember(UdtMember member) {
        if (members.containsKey(member.getName())) {
            return false;
        }
        members.put(member.getName(), member);
        return true;
    }

    /**
     * Looks a member up by base name. {@code DATA[20]} does not match member {@code DATA}.
     */
    public Optional<UdtMember> findMember(String key) {
        return Optional.ofNullable(members.get(key));
    }

    public List<UdtMember> getMemberList() {
        return new ArrayList<>(members.values());
    }

    /**
     * Bit members hosted by the given hidden word, in declaration order.
     */
    public List<UdtMember> bitMembersOf(String hostWord) {
        List<UdtMember> bits = new ArrayList<>();
        for (UdtMember m : members.values()) {
            if (hostWord.equals(m.getHostWord())) {
                bits.add(m);
            }
        }
        return bits;
    }

    public String getEffectiveFamilyType() {
        return familyType != null && !familyType.isBlank() ? familyType : DEFAULT_FAMILY_TYPE;
    }

    @Override
    public EntityKind getKind() {
        return EntityKind.UDT;
    }

    @Override
    public void accept(EntityVisitor visitor) {
        visitor.visit(this);
    }
}
