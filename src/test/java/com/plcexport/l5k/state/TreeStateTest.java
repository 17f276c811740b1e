package com.plcexport.l5k.state;

import static org.assertj.core.api.Assertions.*;

import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.plcexport.l5k.L5kSamples;
import com.plcexport.l5k.config.TunerConfig;
import com.plcexport.l5k.model.EntityKey;
import com.plcexport.l5k.model.EntityKind;
import com.plcexport.l5k.model.L5kProject;
import com.plcexport.l5k.model.Tag;
import com.plcexport.l5k.service.L5kLoadingService;

class TreeStateTest {

    private L5kProject project;
    private TreeState state;

    @BeforeEach
    void setUp() {
        project = new L5kLoadingService(TunerConfig.defaults()).load(L5kSamples.PLANT, "plant.L5K").getProject();
        state = new TreeState(project);
    }

    @Test
    void testEverythingIncludedByDefault() {
        assertThat(state.keys(FilterMode.ALL)).hasSize(9);
        assertThat(state.keys(FilterMode.ENABLED)).hasSize(9);
        assertThat(state.keys(FilterMode.DISABLED)).isEmpty();
        assertThat(state.isIncluded(project.getHeader())).isTrue();
    }

    @Test
    void testFlagsAreIndependent() {
        state.setIncluded(EntityKey.program("MainProgram"), false);

        assertThat(state.isIncluded(EntityKey.program("MainProgram"))).isFalse();
        assertThat(state.isIncluded(EntityKey.programTag("MainProgram", "Step"))).isTrue();
        assertThat(state.keys(FilterMode.DISABLED)).containsExactly(EntityKey.program("MainProgram"));
        assertThat(state.keys(EntityKind.PROGRAM_TAG, FilterMode.ENABLED)).hasSize(2);
    }

    @Test
    void testUnknownAndHeaderKeysRejected() {
        assertThatThrownBy(() -> state.setIncluded(EntityKey.udt("Nope"), false))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> state.setIncluded(project.getHeader().getKey(), false))
                .isInstanceOf(IllegalArgumentException.class);
        assertThat(state.isIncluded(EntityKey.udt("Nope"))).isFalse();
    }

    @Test
    void testDisplayLabelIsNotAKey() {
        assertThat(state.isIncluded(EntityKey.controllerTag("Flags"))).isTrue();
        assertThat(state.hasState(EntityKey.controllerTag("Flags[32]"))).isFalse();
    }

    @Test
    void testSelectAndDeselectAll() {
        state.deselectAll();
        assertThat(state.keys(FilterMode.ENABLED)).isEmpty();
        assertThat(state.isIncluded(project.getHeader())).isTrue();

        state.selectAll();
        assertThat(state.keys(FilterMode.DISABLED)).isEmpty();
    }

    @Test
    void testDescriptionOverride() {
        Tag line = project.getControllerTags().get("Line");

        state.setDescription(line.getKey(), "Renamed");
        assertThat(state.effectiveDescription(line)).isEqualTo("Renamed");
        assertThat(line.getDescription()).isEqualTo("Main line");

        state.setDescription(line.getKey(), null);
        assertThat(state.effectiveDescription(line)).isEqualTo("Main line");
    }

    @Test
    void testSyncKeepsStateAndFollowsProject() {
        state.setIncluded(EntityKey.udt("LINE_DATA"), false);
        project.remove(EntityKey.controllerTag("Flags"));
        project.insert(new Tag("Extra", "DINT"));

        state.sync();

        assertThat(state.isIncluded(EntityKey.udt("LINE_DATA"))).isFalse();
        assertThat(state.hasState(EntityKey.controllerTag("Flags"))).isFalse();
        assertThat(state.isIncluded(EntityKey.controllerTag("Extra"))).isTrue();
    }

    @Test
    void testSnapshotRoundTrip() {
        state.setIncluded(EntityKey.udt("LINE_DATA"), false);
        state.setDescription(EntityKey.controllerTag("Count"), "Parts");
        ProjectSnapshot snapshot = state.extractSnapshot("plant.L5K");

        TreeState fresh = new TreeState(project);
        int applied = fresh.applySnapshot(snapshot);

        assertThat(snapshot.getControllerName()).isEqualTo("Line1");
        assertThat(applied).isEqualTo(9);
        assertThat(fresh.keys(FilterMode.DISABLED)).containsExactly(EntityKey.udt("LINE_DATA"));
        assertThat(fresh.getDescriptionOverride(EntityKey.controllerTag("Count"))).contains("Parts");
    }

    @Test
    void testSnapshotIgnoresUnknownEntries() {
        ProjectSnapshot snapshot = ProjectSnapshot.builder()
                .controllerName("Line1")
                .entries(List.of(
                        SnapshotEntry.builder().kind(EntityKind.UDT).name("Gone").included(false).build(),
                        SnapshotEntry.builder().kind(EntityKind.PROGRAM_TAG).parent("MainProgram").name("Step")
                                .included(false).build()))
                .build();

        int applied = state.applySnapshot(snapshot);

        assertThat(applied).isEqualTo(1);
        assertThat(state.keys(FilterMode.DISABLED)).containsExactly(EntityKey.programTag("MainProgram", "Step"));
    }
}
