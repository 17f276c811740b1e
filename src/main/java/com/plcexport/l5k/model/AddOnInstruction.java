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
 * An add-on instruction definition: ordered parameters and local tags.
 */
@Data
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
@NoArgsConstructor
public class AddOnInstruction extends Entity {
    private String familyType;
    private Map<String, AoiParameter> parameters = new LinkedHashMap<>();
    private Map<String, AoiLocalTag> localTags = new LinkedHashMap<>();

    public AddOnInstruction(String name) {
        super(name);
    }

    public boolean addParameter(AoiParameter parameter) {
        if (parameters.containsKey(parameter.getName())) {
            return false;
        }
        parameters.put(parameter.getName(), parameter);
        return true;
    }

    public boolean addLocalTag(AoiLocalTag localTag) {
        if (localTags.containsKey(localTag.getName())) {
            return false;
        }
        localTags.put(localTag.getName(), localTag);
        return true;
    }

    public Optional<AoiParameter> findParameter(String name) {
        return Optional.ofNullable(parameters.get(name));
    }

    public Optional<AoiLocalTag> findLocalTag(String name) {
        return Optional.ofNullable(localTags.get(name));
    }

    /**
     * A parameter or local tag with the given name, parameters first.
     */
    public Optional<FieldDeclaration> findField(String name) {
        FieldDeclaration field = parameters.get(name);
        if (field == null) {
            field = localTags.get(name);
        }
        return Optional.ofNullable(field);
    }

    public List<AoiParameter> getParameterList() {
        return new ArrayList<>(parameters.values());
    }

    public List<AoiLocalTag> getLocalTagList() {
        return new ArrayList<>(localTags.values());
    }

    @Override
    public EntityKind getKind() {
        return EntityKind.AOI;
    }

    @Override
    public void accept(EntityVisitor visitor) {
        visitor.visit(this);
    }
}
