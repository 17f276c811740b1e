package com.plcexport.l5k.cli;

import static org.assertj.core.api.Assertions.*;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.plcexport.l5k.L5kSamples;
import com.plcexport.l5k.model.EntityKey;
import com.plcexport.l5k.state.ProjectSnapshot;
import com.plcexport.l5k.state.SnapshotStore;

import picocli.CommandLine;

class TunerCommandTest {

    @TempDir
    Path tempDir;

    @Test
    void testExportWithExclusionAndSavedState() throws Exception {
        Path input = Files.writeString(tempDir.resolve("plant.L5K"), L5kSamples.PLANT);
        Path output = tempDir.resolve("out/filtered.L5K");
        Path state = tempDir.resolve("state.json");

        int exit = execute("export", input.toString(), "-o", output.toString(),
                "--exclude", "UDT:LINE_DATA", "--save-state", state.toString());

        assertThat(exit).isZero();
        String exported = Files.readString(output);
        assertThat(exported).contains("DATATYPE MOTOR_DATA").doesNotContain("DATATYPE LINE_DATA");

        ProjectSnapshot snapshot = new SnapshotStore().read(state);
        assertThat(snapshot.getEntries())
                .filteredOn(e -> !e.isIncluded())
                .extracting(e -> e.toKey())
                .containsExactly(EntityKey.udt("LINE_DATA"));
    }

    @Test
    void testExportAppliesStateFile() throws Exception {
        Path input = Files.writeString(tempDir.resolve("plant.L5K"), L5kSamples.PLANT);
        Path state = tempDir.resolve("state.json");
        Path output = tempDir.resolve("filtered.L5K");
        assertThat(execute("export", input.toString(), "-o", tempDir.resolve("first.L5K").toString(),
                "--exclude", "PROGRAM:MainProgram", "--save-state", state.toString())).isZero();

        int exit = execute("export", input.toString(), "-o", output.toString(), "--state", state.toString());

        assertThat(exit).isZero();
        assertThat(Files.readString(output)).doesNotContain("PROGRAM MainProgram");
    }

    @Test
    void testDiffApplyWritesMergedExport() throws Exception {
        Path current = Files.writeString(tempDir.resolve("current.L5K"), L5kSamples.PLANT);
        Path updated = Files.writeString(tempDir.resolve("updated.L5K"), L5kSamples.PLANT_UPDATED);
        Path merged = tempDir.resolve("merged.L5K");

        int exit = execute("diff", current.toString(), updated.toString(), "--apply",
                "--accept-added", "PROGRAM:Packaging,PROGRAM_TAG:Packaging/Cartons", "-o", merged.toString());

        assertThat(exit).isZero();
        String text = Files.readString(merged);
        assertThat(text).contains("PROGRAM Packaging", "Cartons : DINT;");
        assertThat(text).contains("Flags : BOOL[32];");
    }

    @Test
    void testInvalidOptionsFail() {
        int exit = execute("diff", tempDir.resolve("a.L5K").toString(), tempDir.resolve("b.L5K").toString());

        assertThat(exit).isEqualTo(1);
    }

    @Test
    void testMalformedExportFailsWithoutStackTrace() throws Exception {
        Path input = Files.writeString(tempDir.resolve("broken.L5K"),
                "CONTROLLER C ()\n\tTAG\n\t\tX : DINT (Description := \"oops);\n\tEND_TAG\nEND_CONTROLLER\n");
        Path output = tempDir.resolve("out.L5K");
        StringWriter err = new StringWriter();
        CommandLine commandLine = new CommandLine(new TunerCommand());
        commandLine.setErr(new PrintWriter(err));

        int exit = commandLine.execute("export", input.toString(), "-o", output.toString());

        assertThat(exit).isEqualTo(1);
        assertThat(err.toString()).doesNotContain("\tat ");
        assertThat(output).doesNotExist();
    }

    @Test
    void testDiffOfMalformedExportFails() throws Exception {
        Path current = Files.writeString(tempDir.resolve("current.L5K"), L5kSamples.PLANT);
        Path updated = Files.writeString(tempDir.resolve("updated.L5K"), "CONTROLLER C ()\n\tDATATYPE X ()\n");

        int exit = execute("diff", current.toString(), updated.toString());

        assertThat(exit).isEqualTo(1);
    }

    @Test
    void testNoSubcommandPrintsUsage() {
        assertThat(execute()).isEqualTo(CommandLine.ExitCode.USAGE);
    }

    private static int execute(String... args) {
        return new CommandLine(new TunerCommand()).execute(args);
    }
}
