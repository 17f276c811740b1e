package com.plcexport.l5k.cli.validation;

import static org.assertj.core.api.Assertions.*;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.plcexport.l5k.cli.exception.OptionsValidationException;
import com.plcexport.l5k.cli.model.ExportOptions;
import com.plcexport.l5k.cli.model.ValidatedExportOptions;
import com.plcexport.l5k.model.EntityKey;

import picocli.CommandLine;

class ExportOptionsValidatorTest {

    private final ExportOptionsValidator validator = new ExportOptionsValidator();

    @TempDir
    Path tempDir;

    private Path input;

    @BeforeEach
    void setUp() throws Exception {
        input = Files.writeString(tempDir.resolve("plant.L5K"), "CONTROLLER C ()\nEND_CONTROLLER\n");
    }

    @Test
    void testValidOptions() {
        ExportOptions options = parse(input.toString(),
                "--exclude", "UDT:LINE_DATA,PROGRAM_TAG:MainProgram/Step",
                "--include-only", "PROGRAM:MainProgram",
                "--charset", "ISO-8859-1");

        ValidatedExportOptions validated = validator.validate(options);

        assertThat(validated.getExcluded()).containsExactly(
                EntityKey.udt("LINE_DATA"), EntityKey.programTag("MainProgram", "Step"));
        assertThat(validated.getIncludeOnly()).containsExactly(EntityKey.program("MainProgram"));
        assertThat(validated.getCharset()).isEqualTo(StandardCharsets.ISO_8859_1);
    }

    @Test
    void testCollectsAllErrors() {
        ExportOptions options = parse(tempDir.resolve("missing.L5K").toString(),
                "--exclude", "LINE_DATA",
                "--include-only", "HEADER:C",
                "--charset", "no-such-charset",
                "--state", tempDir.resolve("missing.json").toString());

        assertThatThrownBy(() -> validator.validate(options))
                .isInstanceOfSatisfying(OptionsValidationException.class, e -> {
                    assertThat(e.getCommand()).isEqualTo("export");
                    assertThat(e.getErrors()).hasSize(5);
                    assertThat(e.getErrors()).anyMatch(m -> m.startsWith("Input export does not exist"));
                    assertThat(e.getErrors()).anyMatch(m -> m.startsWith("State file (--state) does not exist"));
                    assertThat(e.getErrors()).anyMatch(m -> m.startsWith("--exclude: Entity key must look like KIND:name"));
                    assertThat(e.getErrors()).anyMatch(m -> m.startsWith("--include-only: the header cannot be selected"));
                    assertThat(e.getErrors()).contains("Unsupported charset: no-such-charset");
                });
    }

    @Test
    void testKeyBothExcludedAndIncluded() {
        ExportOptions options = parse(input.toString(),
                "--exclude", "UDT:LINE_DATA", "--include-only", "UDT:LINE_DATA");

        assertThatThrownBy(() -> validator.validate(options))
                .isInstanceOf(OptionsValidationException.class)
                .hasMessageContaining("both excluded and included: UDT:LINE_DATA");
    }

    @Test
    void testOutputMustNotOverwriteInput() {
        ExportOptions options = parse(input.toString(), "-o", input.toString());

        assertThatThrownBy(() -> validator.validate(options))
                .isInstanceOf(OptionsValidationException.class)
                .hasMessageContaining("must not overwrite");
    }

    private static ExportOptions parse(String... args) {
        ExportOptions options = new ExportOptions();
        new CommandLine(options).parseArgs(args);
        return options;
    }
}
