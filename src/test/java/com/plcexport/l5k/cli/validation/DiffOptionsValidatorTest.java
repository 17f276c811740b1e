package com.plcexport.l5k.cli.validation;

import static org.assertj.core.api.Assertions.*;

import java.nio.file.Files;
import java.nio.file.Path;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.plcexport.l5k.cli.exception.OptionsValidationException;
import com.plcexport.l5k.cli.model.DiffOptions;
import com.plcexport.l5k.cli.model.ValidatedDiffOptions;
import com.plcexport.l5k.model.EntityKey;

import picocli.CommandLine;

class DiffOptionsValidatorTest {

    private final DiffOptionsValidator validator = new DiffOptionsValidator();

    @TempDir
    Path tempDir;

    private Path current;
    private Path updated;

    @BeforeEach
    void setUp() throws Exception {
        current = Files.writeString(tempDir.resolve("current.L5K"), "CONTROLLER C ()\nEND_CONTROLLER\n");
        updated = Files.writeString(tempDir.resolve("updated.L5K"), "CONTROLLER C ()\nEND_CONTROLLER\n");
    }

    @Test
    void testDiffOnly() {
        ValidatedDiffOptions validated = validator.validate(parse(current.toString(), updated.toString()));

        assertThat(validated.getAcceptAdded()).isEmpty();
        assertThat(validated.getAcceptRemoved()).isEmpty();
    }

    @Test
    void testApplyWithSelection() {
        DiffOptions options = parse(current.toString(), updated.toString(), "--apply",
                "--accept-added", "PROGRAM:Packaging", "--accept-removed", "CONTROLLER_TAG:Flags",
                "-o", tempDir.resolve("merged.L5K").toString());

        ValidatedDiffOptions validated = validator.validate(options);

        assertThat(options.hasExplicitSelection()).isTrue();
        assertThat(validated.getAcceptAdded()).containsExactly(EntityKey.program("Packaging"));
        assertThat(validated.getAcceptRemoved()).containsExactly(EntityKey.controllerTag("Flags"));
    }

    @Test
    void testMergeOptionsRequireApply() {
        DiffOptions options = parse(current.toString(), updated.toString(),
                "--accept-added", "PROGRAM:Packaging",
                "-o", tempDir.resolve("merged.L5K").toString(),
                "--save-state", tempDir.resolve("state.json").toString());

        assertThatThrownBy(() -> validator.validate(options))
                .isInstanceOfSatisfying(OptionsValidationException.class, e -> assertThat(e.getErrors())
                        .containsExactly(
                                "--accept-added and --accept-removed require --apply.",
                                "--output requires --apply.",
                                "--save-state requires --apply."));
    }

    @Test
    void testMissingUpdatedExport() {
        DiffOptions options = parse(current.toString(), tempDir.resolve("nope.L5K").toString());

        assertThatThrownBy(() -> validator.validate(options))
                .isInstanceOfSatisfying(OptionsValidationException.class, e -> {
                    assertThat(e.getCommand()).isEqualTo("diff");
                    assertThat(e.getMessage()).startsWith("Invalid diff options:");
                    assertThat(e.getErrors()).hasSize(1);
                    assertThat(e.getErrors().get(0)).startsWith("Updated export does not exist or is not a file");
                });
    }

    private static DiffOptions parse(String... args) {
        DiffOptions options = new DiffOptions();
        new CommandLine(options).parseArgs(args);
        return options;
    }
}
