package com.plcexport.l5k.parser;

import static org.assertj.core.api.Assertions.*;

import org.junit.jupiter.api.Test;

import com.plcexport.l5k.L5kSamples;
import com.plcexport.l5k.exception.KeyCollisionException;
import com.plcexport.l5k.exception.ScanException;
import com.plcexport.l5k.model.AddOnInstruction;
import com.plcexport.l5k.model.AoiParameter;
import com.plcexport.l5k.model.EntityKey;
import com.plcexport.l5k.model.EntityKind;
import com.plcexport.l5k.model.L5kProject;
import com.plcexport.l5k.model.Program;
import com.plcexport.l5k.model.Tag;
import com.plcexport.l5k.model.UdtMember;
import com.plcexport.l5k.model.UserDefinedType;

/**
 * Unit tests for L5kParser and the block extractors.
 */
class L5kParserTest {

    @Test
    void testParseHeader() {
        L5kProject project = parse(L5kSamples.PLANT, new ParseDiagnostics());

        assertThat(project.getHeader().getControllerName()).isEqualTo("Line1");
        assertThat(project.getHeader().getPreamble())
                .startsWith("(*****")
                .endsWith("IE_VER := 2.11;");
        assertThat(project.getHeader().getControllerHeaderLines()).hasSize(3);
        assertThat(project.getHeader().getControllerHeaderLines().get(0))
                .isEqualTo("CONTROLLER Line1 (ProcessorType := \"1756-L71\",");
    }

    @Test
    void testParseUdtWithHiddenHostAndBitMembers() {
        L5kProject project = parse(L5kSamples.PLANT, new ParseDiagnostics());

        UserDefinedType udt = project.findUdt("MOTOR_DATA").orElseThrow();
        assertThat(udt.getDescription()).isEqualTo("Motor (drive) data");
        assertThat(udt.getFamilyType()).isEqualTo("NoFamily");
        assertThat(udt.getMembers().keySet())
                .containsExactly("ZZZZZZZZZZMOTOR_DATA0", "Running", "Faulted", "Speed", "DATA");

        assertThat(udt.findMember("ZZZZZZZZZZMOTOR_DATA0").orElseThrow().isHidden()).isTrue();

        UdtMember running = udt.findMember("Running").orElseThrow();
        assertThat(running.isBitMember()).isTrue();
        assertThat(running.getHostWord()).isEqualTo("ZZZZZZZZZZMOTOR_DATA0");
        assertThat(running.getBitIndex()).isEqualTo(0);
        assertThat(running.getDescription()).isEqualTo("Running");
        assertThat(udt.bitMembersOf("ZZZZZZZZZZMOTOR_DATA0")).hasSize(2);

        UdtMember speed = udt.findMember("Speed").orElseThrow();
        assertThat(speed.getDescription()).isEqualTo("rpm");
        assertThat(speed.getAttributes().get("Radix")).contains("Decimal");
        assertThat(speed.getAttributes().contains("Description")).isFalse();

        UdtMember data = udt.findMember("DATA").orElseThrow();
        assertThat(data.getDimensions()).isEqualTo("[20]");
        assertThat(data.getArrayLength()).isEqualTo(20);
        assertThat(udt.findMember("DATA[20]")).isEmpty();
    }

    @Test
    void testParseAoiSections() {
        L5kProject project = parse(L5kSamples.PLANT, new ParseDiagnostics());

        AddOnInstruction aoi = project.findAoi("MotorCtl").orElseThrow();
        assertThat(aoi.getDescription()).isEqualTo("Motor control");
        assertThat(aoi.getParameters().keySet()).containsExactly("EnableIn", "Motor", "Status");
        assertThat(aoi.getLocalTags().keySet()).containsExactly("Timer1");

        AoiParameter enableIn = aoi.findParameter("EnableIn").orElseThrow();
        assertThat(enableIn.getDeclaredType()).isEqualTo("BOOL");
        assertThat(enableIn.getDescription()).isEqualTo("Enable Input");
        assertThat(enableIn.getAttributes().render()).isEqualTo("Usage := Input");
        assertThat(aoi.findLocalTag("Timer1").orElseThrow().getAttributes().isEmpty()).isTrue();
    }

    @Test
    void testParseTagsDropsValues() {
        L5kProject project = parse(L5kSamples.PLANT, new ParseDiagnostics());

        assertThat(project.getControllerTags().keySet()).containsExactly("Line", "Count", "Flags");
        Tag line = project.getControllerTags().get("Line");
        assertThat(line.getDeclaredType()).isEqualTo("LINE_DATA");
        assertThat(line.getDescription()).isEqualTo("Main line");
        assertThat(line.isProgramTag()).isFalse();

        Tag count = project.getControllerTags().get("Count");
        assertThat(count.getAttributes().render()).isEqualTo("RADIX := Decimal");

        Tag flags = project.getControllerTags().get("Flags");
        assertThat(flags.getDimensions()).isEqualTo("[32]");
        assertThat(flags.getKey()).isEqualTo(EntityKey.controllerTag("Flags"));
        assertThat(flags.getDisplayName()).isEqualTo("Flags[32]");
    }

    @Test
    void testParseProgramWithTags() {
        L5kProject project = parse(L5kSamples.PLANT, new ParseDiagnostics());

        Program program = project.findProgram("MainProgram").orElseThrow();
        assertThat(program.getDescription()).isEqualTo("Main");
        assertThat(program.getTags().keySet()).containsExactly("Step", "Drive");
        assertThat(program.findTag("Step").orElseThrow().getKey())
                .isEqualTo(EntityKey.programTag("MainProgram", "Step"));
        assertThat(project.keys(EntityKind.PROGRAM_TAG)).hasSize(2);
        assertThat(project.allKeys()).hasSize(9);
    }

    @Test
    void testUnrecognizedControllerBlockIsWarningOnly() {
        ParseDiagnostics diagnostics = new ParseDiagnostics();

        parse(L5kSamples.PLANT, diagnostics);

        assertThat(diagnostics.hasErrors()).isFalse();
        assertThat(diagnostics.getWarnings()).hasSize(1);
        assertThat(diagnostics.getWarnings().get(0)).startsWith("Unrecognized block TASK");
    }

    @Test
    void testMalformedMemberSkippedRestKept() {
        String text = """
                CONTROLLER C ()
                \tDATATYPE D (FamilyType := NoFamily)
                \t\tDINT First;
                \t\tthis is not a member;
                \t\tDINT Second;
                \tEND_DATATYPE
                END_CONTROLLER
                """;
        ParseDiagnostics diagnostics = new ParseDiagnostics();

        L5kProject project = parse(text, diagnostics);

        assertThat(project.findUdt("D").orElseThrow().getMembers().keySet()).containsExactly("First", "Second");
        assertThat(diagnostics.getWarnings()).hasSize(1);
        assertThat(diagnostics.getWarnings().get(0)).startsWith("Unrecognized line 4:");
    }

    @Test
    void testOversizedBitIndexIsUnrecognizedLine() {
        String text = """
                CONTROLLER C ()
                \tDATATYPE D (FamilyType := NoFamily)
                \t\tSINT ZZZZZZZZZZD0 (Hidden := 1);
                \t\tBIT Huge ZZZZZZZZZZD0 : 99999999999999;
                \t\tBIT Ok ZZZZZZZZZZD0 : 1;
                \tEND_DATATYPE
                END_CONTROLLER
                """;
        ParseDiagnostics diagnostics = new ParseDiagnostics();

        L5kProject project = parse(text, diagnostics);

        assertThat(project.findUdt("D").orElseThrow().getMembers().keySet()).containsExactly("ZZZZZZZZZZD0", "Ok");
        assertThat(diagnostics.getWarnings()).hasSize(1);
        assertThat(diagnostics.getWarnings().get(0)).startsWith("Unrecognized line 4:");
    }

    @Test
    void testParseCrossReferenceParameters() {
        L5kProject project = parse(L5kSamples.NESTED_AOIS, new ParseDiagnostics());

        AddOnInstruction child = project.findAoi("Child").orElseThrow();
        AoiParameter bitParam = child.findParameter("BitParam").orElseThrow();
        assertThat(bitParam.isCrossReference()).isTrue();
        assertThat(bitParam.getCrossReference().getTarget()).isEqualTo("LocWord");
        assertThat(bitParam.getCrossReference().getBitIndex()).isEqualTo(3);
        assertThat(bitParam.getDescription()).isEqualTo("bit ref");

        AoiParameter ref = child.findParameter("Ref").orElseThrow();
        assertThat(ref.getCrossReference().getPath()).isEqualTo("InnerInst.X");
        assertThat(ref.getCrossReference().isBit()).isFalse();

        assertThat(project.findAoi("Inner").orElseThrow().getLocalTags()).isEmpty();
    }

    @Test
    void testEncodedAddOnInstruction() {
        String text = """
                CONTROLLER C ()
                \tENCODED_DATA (EncodedType := ADD_ON_INSTRUCTION_DEFINITION, Name := "Sealed", Revision := "1.0")
                \t\tPARAMETERS
                \t\t\tIn : DINT (Usage := Input);
                \t\tEND_PARAMETERS
                \t\tAbCdEf0123456789
                \t\tabcdef9876543210
                \tEND_ENCODED_DATA
                END_CONTROLLER
                """;
        ParseDiagnostics diagnostics = new ParseDiagnostics();

        L5kProject project = parse(text, diagnostics);

        AddOnInstruction sealed = project.findAoi("Sealed").orElseThrow();
        assertThat(sealed.getParameters().keySet()).containsExactly("In");
        assertThat(diagnostics.getWarnings()).isEmpty();
    }

    @Test
    void testDuplicateKeyAborts() {
        String text = """
                CONTROLLER C ()
                \tDATATYPE D (FamilyType := NoFamily)
                \t\tDINT A;
                \tEND_DATATYPE
                \tDATATYPE D (FamilyType := NoFamily)
                \t\tDINT B;
                \tEND_DATATYPE
                END_CONTROLLER
                """;

        assertThatThrownBy(() -> parse(text, new ParseDiagnostics()))
                .isInstanceOfSatisfying(KeyCollisionException.class,
                        e -> assertThat(e.getKey()).isEqualTo(EntityKey.udt("D")));
    }

    @Test
    void testMissingEndControllerAborts() {
        String text = """
                CONTROLLER C ()
                \tTAG
                \t\tX : DINT;
                \tEND_TAG
                """;

        assertThatThrownBy(() -> parse(text, new ParseDiagnostics()))
                .isInstanceOf(ScanException.class)
                .hasMessageContaining("END_CONTROLLER");
    }

    @Test
    void testNoControllerBlock() {
        ParseDiagnostics diagnostics = new ParseDiagnostics();

        L5kProject project = parse("(* empty *)\nIE_VER := 2.11;\n", diagnostics);

        assertThat(project.allKeys()).isEmpty();
        assertThat(diagnostics.getWarnings()).containsExactly("No CONTROLLER block found");
    }

    @Test
    void testTabOnlyAndIrregularWhitespace() {
        String text = "CONTROLLER C ()\n\tTAG\n\t\tA:DINT;\n\t\tB   :   REAL [ 4 ];\n\tEND_TAG\nEND_CONTROLLER\n";

        L5kProject project = parse(text, new ParseDiagnostics());

        assertThat(project.getControllerTags().get("A").getDeclaredType()).isEqualTo("DINT");
        assertThat(project.getControllerTags().get("B").getDimensions()).isEqualTo("[4]");
    }

    private L5kProject parse(String text, ParseDiagnostics diagnostics) {
        return new L5kParser(text, "test.L5K").parse(diagnostics);
    }
}
