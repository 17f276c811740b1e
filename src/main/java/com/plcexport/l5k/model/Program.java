package com.plcexport.l5k.model;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

import com.plcexport.l5k.exception.KeyCollisionException;

import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;
import lombok.ToString;

/**
 * A program and the tags scoped to it. Routines are not modelled.
 */
@Data
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
@NoArgsConstructor
public class Program extends Entity {
    private Map<String, Tag> tags = new LinkedHashMap<>();

    public Program(String name) {
        super(name);
    }

    public void addTag(Tag tag) {
        tag.setProgram(name);
        if (tags.containsKey(tag.getName())) {
            throw new KeyCollisionException(tag.getKey(), tag.getSourceLine());
        }
        tags.put(tag.getName(), tag);
    }

    public Optional<Tag> findTag(String tagName) {
        return Optional.ofNullable(tags.get(tagName));
    }

    public boolean removeTag(String tagName) {
        return tags.remove(tagName) != null;
    }

    /**
     * Same name and description, no tags.
     */
    public Program emptyCopy() {
        Program copy = new Program(name);
        copy.setDescription(description);
        copy.setSourceLine(sourceLine);
        return copy;
    }

    @Override
    public EntityKind getKind() {
        return EntityKind.PROGRAM;
    }

    @Override
    public void accept(EntityVisitor visitor) {
        visitor.visit(this);
    }
}
