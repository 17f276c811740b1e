package com.plcexport.l5k.state;

import static org.assertj.core.api.Assertions.*;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.plcexport.l5k.model.EntityKey;
import com.plcexport.l5k.model.EntityKind;

class SnapshotStoreTest {

    private final SnapshotStore store = new SnapshotStore();

    @TempDir
    Path tempDir;

    @Test
    void testWriteThenRead() throws Exception {
        ProjectSnapshot snapshot = ProjectSnapshot.builder()
                .sourceName("plant.L5K")
                .controllerName("Line1")
                .entries(List.of(
                        SnapshotEntry.builder().kind(EntityKind.UDT).name("LINE_DATA").included(false).build(),
                        SnapshotEntry.builder().kind(EntityKind.PROGRAM_TAG).parent("MainProgram").name("Step")
                                .included(true).description("Sequence step").build()))
                .build();
        Path file = tempDir.resolve("nested/state.json");

        store.write(file, snapshot);
        ProjectSnapshot read = store.read(file);

        assertThat(read).isEqualTo(snapshot);
        assertThat(read.getEntries().get(1).toKey()).isEqualTo(EntityKey.programTag("MainProgram", "Step"));
        assertThat(Files.readString(file)).contains("\"source_name\"", "\"controller_name\"");
    }

    @Test
    void testReadToleratesUnknownFields() throws Exception {
        Path file = tempDir.resolve("state.json");
        Files.writeString(file, """
                {
                  "version": 1,
                  "controller_name": "Line1",
                  "written_by": "someone else",
                  "entries": [
                    { "kind": "CONTROLLER_TAG", "name": "Count", "included": false, "color": "red" }
                  ]
                }
                """);

        ProjectSnapshot read = store.read(file);

        assertThat(read.getSourceName()).isNull();
        assertThat(read.getEntries()).hasSize(1);
        assertThat(read.getEntries().get(0).toKey()).isEqualTo(EntityKey.controllerTag("Count"));
        assertThat(read.getEntries().get(0).isIncluded()).isFalse();
    }
}
