package com.plcexport.l5k.model;

import java.util.ArrayList;
import java.util.List;

import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;
import lombok.ToString;

/**
 * Everything ahead of the first definition: the comment banner and version line,
 * and the controller's own header lines. Always exported, never filtered.
 */
@Data
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
@NoArgsConstructor
public class L5kHeader extends Entity {
    private String preamble = "";
    private List<String> controllerHeaderLines = new ArrayList<>();

    public L5kHeader(String preamble, String controllerName, List<String> controllerHeaderLines) {
        super(controllerName);
        this.preamble = preamble != null ? preamble : "";
        this.controllerHeaderLines = controllerHeaderLines != null
                ? new ArrayList<>(controllerHeaderLines) : new ArrayList<>();
    }

    public String getControllerName() {
        return name;
    }

    @Override
    public EntityKind getKind() {
        return EntityKind.HEADER;
    }

    @Override
    public void accept(EntityVisitor visitor) {
        visitor.visit(this);
    }
}
