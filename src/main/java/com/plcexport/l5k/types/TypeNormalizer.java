package com.plcexport.l5k.types;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.plcexport.l5k.exception.CyclicTypeReferenceException;
import com.plcexport.l5k.exception.L5kException;
import com.plcexport.l5k.exception.TypeResolutionException;
import com.plcexport.l5k.model.AddOnInstruction;
import com.plcexport.l5k.model.AoiLocalTag;
import com.plcexport.l5k.model.AoiParameter;
import com.plcexport.l5k.model.BaseTypes;
import com.plcexport.l5k.model.CrossReference;
import com.plcexport.l5k.model.FieldDeclaration;
import com.plcexport.l5k.model.L5kProject;
import com.plcexport.l5k.model.Program;
import com.plcexport.l5k.model.Tag;
import com.plcexport.l5k.model.UdtMember;
import com.plcexport.l5k.model.UserDefinedType;
import com.plcexport.l5k.parser.ParseDiagnostics;

import lombok.NoArgsConstructor;

/**
 * Resolves declared types to base types.
 *
 * <p>A user-defined type resolves to the base type of its first visible member once
 * all of its members are resolved; hidden host words only count when nothing else
 * is declared. Names that are not user-defined types (atomic, predefined and
 * add-on instruction types) are terminals and resolve to themselves.</p>
 *
 * <p>Resolution walks the type graph with an explicit stack and tracks the path in
 * progress, so a cycle is reported as {@link CyclicTypeReferenceException} instead
 * of recursing forever. A failed type leaves its unresolved members with a null
 * base type; every other type still resolves.</p>
 */
@NoArgsConstructor
public class TypeNormalizer {
    private static final Logger log = LoggerFactory.getLogger(TypeNormalizer.class);

    /**
     * Resolves one declared type against a table of user-defined types, filling in
     * the base types of every member visited on the way.
     *
     * @throws CyclicTypeReferenceException if the type graph reachable from it has a cycle
     * @throws TypeResolutionException if a reachable type has no members
     */
    public String resolve(String declaredType, Map<String, UserDefinedType> udts) {
        return new Resolution(udts).resolve(declaredType);
    }

    /**
     * Normalizes a whole project: UDT members, tags, AOI parameters and local tags,
     * then AOI cross-references. Failures are recorded in the diagnostics.
     */
    public void normalize(L5kProject project, ParseDiagnostics diagnostics) {
        Resolution resolution = new Resolution(project.getUdts());

        for (UserDefinedType udt : project.getUdts().values()) {
            resolveRecorded(resolution, udt.getName(), udt.getName(), diagnostics);
        }

        for (Tag tag : project.getControllerTags().values()) {
            tag.setResolvedBaseType(resolveRecorded(resolution, tag.getDeclaredType(), tag.getKey().toString(), diagnostics));
        }
        for (Program program : project.getPrograms().values()) {
            for (Tag tag : program.getTags().values()) {
                tag.setResolvedBaseType(resolveRecorded(resolution, tag.getDeclaredType(), tag.getKey().toString(), diagnostics));
            }
        }

        for (AddOnInstruction aoi : project.getAois().values()) {
            for (AoiLocalTag local : aoi.getLocalTags().values()) {
                local.setResolvedBaseType(resolveRecorded(resolution, local.getDeclaredType(),
                        aoi.getName() + "." + local.getName(), diagnostics));
            }
            for (AoiParameter parameter : aoi.getParameters().values()) {
                if (!parameter.isCrossReference()) {
                    parameter.setResolvedBaseType(resolveRecorded(resolution, parameter.getDeclaredType(),
                            aoi.getName() + "." + parameter.getName(), diagnostics));
                }
            }
        }

        CrossReferenceResolver crossReferences = new CrossReferenceResolver(project, resolution);
        for (AddOnInstruction aoi : project.getAois().values()) {
            for (AoiParameter parameter : aoi.getParameters().values()) {
                if (parameter.isCrossReference()) {
                    resolveCrossReference(crossReferences, aoi, parameter, diagnostics);
                }
            }
        }
    }

    private String resolveRecorded(Resolution resolution, String type, String owner, ParseDiagnostics diagnostics) {
        if (type == null) {
            return null;
        }
        try {
            return resolution.resolve(type);
        } catch (CyclicTypeReferenceException e) {
            String msg = e.getPath().contains(owner)
                    ? e.getMessage()
                    : owner + " depends on a cyclic type: " + e.getMessage();
            record(diagnostics, msg);
            return null;
        } catch (TypeResolutionException e) {
            record(diagnostics, owner.equals(type) ? e.getMessage() : owner + ": " + e.getMessage());
            return null;
        }
    }

    private void resolveCrossReference(CrossReferenceResolver resolver, AddOnInstruction aoi,
                                       AoiParameter parameter, ParseDiagnostics diagnostics) {
        CrossReference ref = parameter.getCrossReference();
        String base;
        try {
            base = resolver.resolve(aoi, ref);
        } catch (L5kException e) {
            record(diagnostics, aoi.getName() + "." + parameter.getName() + ": " + e.getMessage());
            return;
        }
        if (base == null) {
            if (ref.isBit()) {
                // still a single bit, whatever it aliases
                parameter.setResolvedBaseType(BaseTypes.BOOL);
            }
            String msg = "Could not resolve " + aoi.getName() + "." + parameter.getName() + " OF " + ref.getPath();
            log.warn(msg);
            diagnostics.getWarnings().add(msg);
            return;
        }
        parameter.setResolvedBaseType(base);
        String correction = "Corrected " + aoi.getName() + "." + parameter.getName()
                + ": from \"" + ref.getPath() + "\" to \"" + base + "\"";
        log.info(correction);
        diagnostics.getCorrections().add(correction);
    }

    private static void record(ParseDiagnostics diagnostics, String msg) {
        if (!diagnostics.getErrors().contains(msg)) {
            diagnostics.getErrors().add(msg);
            log.error(msg);
        }
    }

    /**
     * One resolution pass. Results are memoized per type name.
     */
    static final class Resolution {
        private final Map<String, UserDefinedType> udts;
        private final Map<String, String> resolved = new HashMap<>();

        Resolution(Map<String, UserDefinedType> udts) {
            this.udts = udts;
        }

        boolean isUdt(String type) {
            return type != null && udts.containsKey(type);
        }

        UserDefinedType udt(String type) {
            return udts.get(type);
        }

        String resolve(String type) {
            if (!isUdt(type)) {
                return type;
            }
            String known = resolved.get(type);
            if (known != null) {
                return known;
            }

            Deque<Frame> stack = new ArrayDeque<>();
            List<String> path = new ArrayList<>();
            stack.push(new Frame(udts.get(type)));
            path.add(type);

            while (!stack.isEmpty()) {
                Frame frame = stack.peek();
                if (frame.next < frame.members.size()) {
                    UdtMember member = frame.members.get(frame.next);
                    String memberType = member.getDeclaredType();
                    if (!isUdt(memberType)) {
                        member.setResolvedBaseType(memberType);
                        frame.next++;
                    } else if (resolved.containsKey(memberType)) {
                        member.setResolvedBaseType(resolved.get(memberType));
                        frame.next++;
                    } else if (path.contains(memberType)) {
                        List<String> cycle = new ArrayList<>(path.subList(path.indexOf(memberType), path.size()));
                        cycle.add(memberType);
                        throw new CyclicTypeReferenceException(cycle);
                    } else {
                        stack.push(new Frame(udts.get(memberType)));
                        path.add(memberType);
                    }
                    continue;
                }

                stack.pop();
                path.remove(path.size() - 1);
                String name = frame.udt.getName();
                if (frame.members.isEmpty()) {
                    throw new TypeResolutionException("UDT " + name + " has no members to resolve");
                }
                String base = firstVisible(frame.members).getResolvedBaseType();
                resolved.put(name, base);
                log.trace("UDT {} resolves to {}", name, base);
            }
            return resolved.get(type);
        }

        private static UdtMember firstVisible(List<UdtMember> members) {
            for (UdtMember member : members) {
                if (!member.isHidden()) {
                    return member;
                }
            }
            return members.get(0);
        }
    }

    private static final class Frame {
        private final UserDefinedType udt;
        private final List<UdtMember> members;
        private int next;

        private Frame(UserDefinedType udt) {
            this.udt = udt;
            this.members = udt.getMemberList();
        }
    }

    /**
     * Follows {@code OF <field>.<path>} parameter aliases through integer words,
     * add-on instruction parameters and UDT members.
     */
    static final class CrossReferenceResolver {
        private final L5kProject project;
        private final Resolution resolution;
        private final Set<String> inProgress = new HashSet<>();

        CrossReferenceResolver(L5kProject project, Resolution resolution) {
            this.project = project;
            this.resolution = resolution;
        }

        /**
         * @return the declared type at the end of the path ({@code BOOL} for an integer bit),
         *         or null when some step of the path is unknown
         */
        String resolve(AddOnInstruction aoi, CrossReference ref) {
            String guard = aoi.getName() + ":" + ref.getPath();
            if (!inProgress.add(guard)) {
                List<String> cycle = new ArrayList<>(inProgress);
                cycle.add(guard);
                throw new CyclicTypeReferenceException(cycle);
            }
            try {
                FieldDeclaration field = aoi.findField(ref.getTarget()).orElse(null);
                if (field == null) {
                    return null;
                }
                if (ref.getMember() == null) {
                    return typeOf(aoi, field);
                }
                return walk(aoi, field, ref.getMember().split("\\."));
            } finally {
                inProgress.remove(guard);
            }
        }

        private String walk(AddOnInstruction aoi, FieldDeclaration root, String[] steps) {
            String currentType = root instanceof AoiParameter p && p.isCrossReference()
                    ? resolve(aoi, p.getCrossReference())
                    : root.getDeclaredType();
            for (String step : steps) {
                if (currentType == null) {
                    return null;
                }
                if (!step.isEmpty() && step.chars().allMatch(Character::isDigit)) {
                    return BaseTypes.isInteger(currentType) ? BaseTypes.BOOL : null;
                }
                AddOnInstruction owner = project.getAois().get(currentType);
                if (owner != null) {
                    AoiParameter next = owner.getParameters().get(step);
                    if (next == null) {
                        return null;
                    }
                    currentType = typeOf(owner, next);
                } else if (resolution.isUdt(currentType)) {
                    UdtMember member = resolution.udt(currentType).findMember(step).orElse(null);
                    currentType = member == null ? null : member.getDeclaredType();
                } else {
                    return null;
                }
            }
            // a whole structure keeps its declared type; only integer bits collapse to BOOL
            return currentType;
        }

        private String typeOf(AddOnInstruction owner, FieldDeclaration field) {
            if (field instanceof AoiParameter p && p.isCrossReference()) {
                return resolve(owner, p.getCrossReference());
            }
            return field.getDeclaredType();
        }
    }
}
