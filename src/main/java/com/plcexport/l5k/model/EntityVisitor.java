package com.plcexport.l5k.model;

/**
 * Visitor over the entity variants of an L5K project.
 */
public interface EntityVisitor {
    void visit(L5kHeader header);
    void visit(UserDefinedType udt);
    void visit(AddOnInstruction aoi);
    void visit(Tag tag);
    void visit(Program program);
}
