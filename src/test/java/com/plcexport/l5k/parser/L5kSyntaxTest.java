package com.plcexport.l5k.parser;

import static org.assertj.core.api.Assertions.*;

import org.junit.jupiter.api.Test;

import com.plcexport.l5k.model.AttributeList;

class L5kSyntaxTest {

    @Test
    void testParseAttributesKeepsOrderAndRawValues() {
        AttributeList attributes = L5kSyntax.parseAttributes("Description := \"a, b\", Radix := Decimal, Usage := Input");

        assertThat(attributes.size()).isEqualTo(3);
        assertThat(attributes.get("Description")).contains("\"a, b\"");
        assertThat(attributes.get("radix")).contains("Decimal");
        assertThat(attributes.render()).isEqualTo("Description := \"a, b\", Radix := Decimal, Usage := Input");
    }

    @Test
    void testStripValueDropsInitialValue() {
        assertThat(L5kSyntax.stripValue("Count : DINT (RADIX := Decimal) := 0;"))
                .isEqualTo("Count : DINT (RADIX := Decimal)");
        assertThat(L5kSyntax.stripValue("Step : DINT;")).isEqualTo("Step : DINT");
    }

    @Test
    void testSplitOuterAttrs() {
        L5kSyntax.OuterSplit split = L5kSyntax.splitOuterAttrs("DINT Speed (Description := \"x (y)\")");

        assertThat(split.getPrefix()).isEqualTo("DINT Speed");
        assertThat(split.getAttributes()).isEqualTo("Description := \"x (y)\"");

        assertThat(L5kSyntax.splitOuterAttrs("REAL DATA[20]").hasAttributes()).isFalse();
    }

    @Test
    void testStripCommentsOutsideLiterals() {
        assertThat(L5kSyntax.stripComments("DINT A (* note *) (Description := \"(* kept *)\")"))
                .isEqualTo("DINT A  (Description := \"(* kept *)\")");
    }

    @Test
    void testDecodeString() {
        assertThat(L5kSyntax.decodeString("\"Line 1$NLine 2\"")).isEqualTo("Line 1\nLine 2");
        assertThat(L5kSyntax.decodeString("\"say $\"hi$\"\"")).isEqualTo("say \"hi\"");
        assertThat(L5kSyntax.decodeString("\"cost $$5\"")).isEqualTo("cost $5");
        assertThat(L5kSyntax.decodeString("\"tab$Tend\"")).isEqualTo("tab\tend");
        assertThat(L5kSyntax.decodeString("'x$41y'")).isEqualTo("xAy");
        assertThat(L5kSyntax.decodeString("Decimal")).isEqualTo("Decimal");
    }

    @Test
    void testEncodeString() {
        assertThat(L5kSyntax.encodeString("Line 1\nsay \"hi\" $5")).isEqualTo("\"Line 1$Nsay $\"hi$\" $$5\"");
    }

    @Test
    void testTakeDescriptionRemovesAttribute() {
        AttributeList attributes = L5kSyntax.parseAttributes("Description := \"rpm\", Radix := Decimal");

        assertThat(L5kSyntax.takeDescription(attributes)).contains("rpm");
        assertThat(attributes.contains("Description")).isFalse();
        assertThat(attributes.size()).isEqualTo(1);
    }
}
