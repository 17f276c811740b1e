package com.plcexport.l5k.merge;

import static org.assertj.core.api.Assertions.*;

import java.util.List;

import org.junit.jupiter.api.Test;

import com.plcexport.l5k.L5kSamples;
import com.plcexport.l5k.config.TunerConfig;
import com.plcexport.l5k.model.EntityKey;
import com.plcexport.l5k.model.EntityKind;
import com.plcexport.l5k.model.L5kProject;
import com.plcexport.l5k.model.Tag;
import com.plcexport.l5k.service.L5kLoadingService;

class DiffEngineTest {

    private final L5kLoadingService loader = new L5kLoadingService(TunerConfig.defaults());
    private final DiffEngine diffEngine = new DiffEngine();

    @Test
    void testSameModelHasNoChanges() {
        L5kProject project = load(L5kSamples.PLANT);

        assertThat(diffEngine.diff(project, project).isEmpty()).isTrue();
        assertThat(diffEngine.diff(project, load(L5kSamples.PLANT)).isEmpty()).isTrue();
    }

    @Test
    void testAddedProgramAndRemovedControllerTag() {
        L5kProject current = load(L5kSamples.PLANT);
        L5kProject updated = load(L5kSamples.PLANT_UPDATED);

        ChangeSet changes = diffEngine.diff(current, updated);

        assertThat(changes.getAdded(EntityKind.PROGRAM)).containsExactly(EntityKey.program("Packaging"));
        assertThat(changes.getAdded(EntityKind.PROGRAM_TAG))
                .containsExactly(EntityKey.programTag("Packaging", "Cartons"));
        assertThat(changes.getRemoved(EntityKind.CONTROLLER_TAG)).containsExactly(EntityKey.controllerTag("Flags"));
        assertThat(changes.allAdded()).hasSize(2);
        assertThat(changes.allRemoved()).hasSize(1);
        assertThat(changes.getAdded(EntityKind.UDT)).isEmpty();
    }

    @Test
    void testAddedEmptyProgramIsTheOnlyChange() {
        L5kProject current = load(L5kSamples.PLANT);
        L5kProject updated = load(L5kSamples.PLANT.replace("END_CONTROLLER",
                "\tPROGRAM Spare (Description := \"Reserved\")\n\tEND_PROGRAM\nEND_CONTROLLER"));

        ChangeSet changes = diffEngine.diff(current, updated);

        assertThat(changes.getAdded(EntityKind.PROGRAM)).containsExactly(EntityKey.program("Spare"));
        for (EntityKind kind : EntityKind.values()) {
            if (!kind.isFilterable()) {
                continue;
            }
            assertThat(changes.getRemoved(kind)).as("removed %s", kind).isEmpty();
            if (kind != EntityKind.PROGRAM) {
                assertThat(changes.getAdded(kind)).as("added %s", kind).isEmpty();
            }
        }
        assertThat(changes.getSkipped()).isEmpty();
    }

    @Test
    void testReverseDiffSwapsSides() {
        ChangeSet changes = diffEngine.diff(load(L5kSamples.PLANT_UPDATED), load(L5kSamples.PLANT));

        assertThat(changes.allAdded()).containsExactly(EntityKey.controllerTag("Flags"));
        assertThat(changes.allRemoved()).containsExactly(
                EntityKey.program("Packaging"), EntityKey.programTag("Packaging", "Cartons"));
    }

    @Test
    void testChangedContentIsNotReported() {
        L5kProject current = load(L5kSamples.PLANT);
        L5kProject updated = load(L5kSamples.PLANT.replace("Count : DINT (RADIX", "Count : INT (RADIX"));

        assertThat(diffEngine.diff(current, updated).isEmpty()).isTrue();
    }

    @Test
    void testSameNameInDifferentNamespaces() {
        L5kProject current = load(L5kSamples.PLANT);
        L5kProject updated = load(L5kSamples.PLANT);
        updated.insert(new Tag("MainProgram", "DINT"));

        ChangeSet changes = diffEngine.diff(current, updated);

        assertThat(changes.allAdded()).containsExactly(EntityKey.controllerTag("MainProgram"));
    }

    @Test
    void testInputsAreNotModified() {
        L5kProject current = load(L5kSamples.PLANT);
        L5kProject updated = load(L5kSamples.PLANT_UPDATED);
        List<EntityKey> currentKeys = current.allKeys();
        List<EntityKey> updatedKeys = updated.allKeys();

        diffEngine.diff(current, updated);

        assertThat(current.allKeys()).isEqualTo(currentKeys);
        assertThat(updated.allKeys()).isEqualTo(updatedKeys);
    }

    @Test
    void testUnreadableKeysAreSkipped() {
        L5kProject current = load(L5kSamples.PLANT);
        L5kProject updated = load(L5kSamples.PLANT);
        updated.getControllerTags().put("", new Tag("", "DINT"));

        ChangeSet changes = diffEngine.diff(current, updated);

        assertThat(changes.isEmpty()).isTrue();
        assertThat(changes.getSkipped()).hasSize(1);
    }

    private L5kProject load(String text) {
        return loader.load(text, "test.L5K").getProject();
    }
}
