package com.plcexport.l5k.export;

import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.plcexport.l5k.config.TunerConfig;
import com.plcexport.l5k.exception.MissingRequiredFieldException;
import com.plcexport.l5k.model.Entity;
import com.plcexport.l5k.model.L5kProject;
import com.plcexport.l5k.model.Program;
import com.plcexport.l5k.model.Tag;
import com.plcexport.l5k.state.TreeState;

/**
 * Writes the included part of a project back out as L5K text.
 *
 * <p>Runs through {@link ExportPhase} in order: header, UDTs, AOIs, controller
 * tags, programs, footer. Each entity is rendered on its own, so excluding one
 * leaves every other block byte-identical, and an entity missing a required
 * field is reported in the result while the rest still exports.</p>
 *
 * Always applied:
 * - {@code Name OF Tag.3} parameters become {@code Name : BOOL}
 * - PARAMETERS and LOCAL_TAGS sections are written even when empty
 * - tag values and force data are never written
 */
public class L5kExporter {
    private static final Logger log = LoggerFactory.getLogger(L5kExporter.class);

    private final TunerConfig config;

    public L5kExporter(TunerConfig config) {
        this.config = config;
    }

    /**
     * Exports every entity, ignoring any inclusion state.
     */
    public ExportResult exportAll(L5kProject project) {
        return export(new TreeState(project));
    }

    public ExportResult export(TreeState state) {
        Run run = new Run(state);
        ExportPhase phase = ExportPhase.HEADER;
        while (phase != ExportPhase.DONE) {
            run.emit(phase);
            phase = phase.next();
        }

        String sep = config.getLineSeparator();
        String text = String.join(sep, run.out) + sep;
        log.info("Exported {} entities ({} skipped with errors)", run.emitted, run.errors.size());
        return ExportResult.builder()
                .text(text)
                .entitiesEmitted(run.emitted)
                .errors(run.errors)
                .build();
    }

    /**
     * Output and bookkeeping of one export.
     */
    private final class Run {
        private final TreeState state;
        private final L5kProject project;
        private final List<String> out = new ArrayList<>();
        private final List<ExportError> errors = new ArrayList<>();
        private int emitted;

        private Run(TreeState state) {
            this.state = state;
            this.project = state.getProject();
        }

        private void emit(ExportPhase phase) {
            switch (phase) {
                case HEADER -> write(project.getHeader(), out, false);
                case UDTS -> project.getUdts().values().stream()
                        .filter(state::isIncluded)
                        .forEach(u -> write(u, out, true));
                case AOIS -> project.getAois().values().stream()
                        .filter(state::isIncluded)
                        .forEach(a -> write(a, out, true));
                case CONTROLLER_TAGS -> emitControllerTags();
                case PROGRAMS -> project.getPrograms().values().stream()
                        .filter(state::isIncluded)
                        .forEach(this::writeProgram);
                case FOOTER -> out.add("END_CONTROLLER");
                case DONE -> {
                    // nothing left
                }
            }
        }

        private void emitControllerTags() {
            List<String> tagLines = new ArrayList<>();
            for (Tag tag : project.getControllerTags().values()) {
                if (state.isIncluded(tag)) {
                    write(tag, tagLines, false);
                }
            }
            if (tagLines.isEmpty()) {
                return;
            }
            out.add(config.getIndent() + "TAG");
            out.addAll(tagLines);
            out.add(config.getIndent() + "END_TAG");
            out.add("");
        }

        private void writeProgram(Program program) {
            BlockWriter writer = write(program, out, true);
            if (writer != null) {
                emitted += writer.getProgramTagsWritten();
                errors.addAll(writer.getNestedErrors());
            }
        }

        /**
         * Renders one entity; on success its lines are appended to {@code target}.
         *
         * @return the writer, or null when the entity was dropped
         */
        private BlockWriter write(Entity entity, List<String> target, boolean blankLineAfter) {
            BlockWriter writer = new BlockWriter(config, state);
            try {
                entity.accept(writer);
            } catch (MissingRequiredFieldException e) {
                log.error("Skipping {} in export: {}", entity.getKey(), e.getMessage());
                errors.add(ExportError.of(e));
                return null;
            }
            target.addAll(writer.getLines());
            if (blankLineAfter) {
                target.add("");
            }
            if (entity.getKind().isFilterable()) {
                emitted++;
            }
            return writer;
        }
    }
}
