package net.vortexdevelopment.vattribute.source;

import net.vortexdevelopment.vattribute.model.AttachedMarker;
import net.vortexdevelopment.vattribute.model.ComponentDescriptor;
import net.vortexdevelopment.vattribute.model.ComponentKind;
import net.vortexdevelopment.vattribute.model.MarkerTarget;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory structure source fed with {@link StructureDescriptor}s, for metadata that does not
 * come from loaded classes (parsed sources, schemas, IDL definitions).
 * <p>
 * References to structures that were never registered are treated as unknown: they contribute
 * no ancestors, contracts or markers. Members declared on ancestor classes are visible on
 * subclasses; contracts contribute no members to the classes implementing them.
 */
public class DescriptorStructureSource implements StructureSource {

    private final Map<String, StructureDescriptor> structures;

    public DescriptorStructureSource() {
        this.structures = new ConcurrentHashMap<>();
    }

    public DescriptorStructureSource(Collection<StructureDescriptor> descriptors) {
        this();
        descriptors.forEach(this::register);
    }

    public DescriptorStructureSource register(StructureDescriptor descriptor) {
        if (structures.putIfAbsent(descriptor.getName(), descriptor) != null) {
            throw new IllegalArgumentException("Structure " + descriptor.getName() + " is already registered");
        }
        return this;
    }

    @Override
    public boolean isKnown(String structure) {
        return structure != null && structures.containsKey(structure);
    }

    @Override
    public boolean isContract(String structure) {
        StructureDescriptor descriptor = structures.get(structure);
        return descriptor != null && descriptor.isContract();
    }

    @Override
    public List<String> ancestors(String structure) {
        List<String> ancestors = new ArrayList<>();
        Set<String> seen = new LinkedHashSet<>();
        seen.add(structure);
        StructureDescriptor current = structures.get(structure);
        while (current != null && current.getParent() != null) {
            String parent = current.getParent();
            if (!seen.add(parent)) {
                throw new IllegalStateException("Cyclic ancestry for " + structure + " via " + parent);
            }
            ancestors.add(parent);
            current = structures.get(parent);
        }
        return ancestors;
    }

    /**
     * Own contracts and their super-contracts first, then those of each ancestor.
     */
    @Override
    public List<String> implementedContracts(String structure) {
        Set<String> contracts = new LinkedHashSet<>();
        collectContracts(structures.get(structure), contracts);
        for (String ancestor : ancestors(structure)) {
            collectContracts(structures.get(ancestor), contracts);
        }
        contracts.remove(structure);
        return new ArrayList<>(contracts);
    }

    private void collectContracts(@Nullable StructureDescriptor descriptor, Set<String> into) {
        if (descriptor == null) {
            return;
        }
        for (String contract : descriptor.getContracts()) {
            if (into.add(contract)) {
                collectContracts(structures.get(contract), into);
            }
        }
    }

    @Override
    public List<ComponentDescriptor> components(String structure, ComponentKind kind) {
        if (kind == ComponentKind.STRUCTURE || kind == ComponentKind.PARAMETER) {
            throw new IllegalArgumentException("Not a member kind: " + kind);
        }
        return visibleMembers(structure, kind).values().stream()
                .map(StructureDescriptor.Member::getDescriptor)
                .toList();
    }

    @Override
    public List<ComponentDescriptor> parameters(String structure, String method) {
        StructureDescriptor.Member member = member(structure, ComponentKind.METHOD, method);
        if (member == null) {
            return List.of();
        }
        return member.getParameters().values().stream()
                .map(StructureDescriptor.Member::getDescriptor)
                .toList();
    }

    @Override
    public List<AttachedMarker> attachedMarkers(MarkerTarget target, Class<?> markerType) {
        List<AttachedMarker> markers = switch (target.kind()) {
            case STRUCTURE -> {
                StructureDescriptor descriptor = structures.get(target.structure());
                yield descriptor == null ? List.of() : descriptor.getMarkers();
            }
            case PARAMETER -> {
                StructureDescriptor.Member method = member(target.structure(), ComponentKind.METHOD, target.method());
                StructureDescriptor.Member parameter = method == null ? null : method.getParameters().get(target.name());
                yield parameter == null ? List.of() : parameter.getMarkers();
            }
            default -> {
                StructureDescriptor.Member member = member(target.structure(), target.kind(), target.name());
                yield member == null ? List.of() : member.getMarkers();
            }
        };
        return markers.stream()
                .filter(marker -> markerType.isAssignableFrom(marker.type()))
                .toList();
    }

    @Nullable
    private StructureDescriptor.Member member(String structure, ComponentKind kind, String name) {
        return visibleMembers(structure, kind).get(name);
    }

    /**
     * Members declared on the structure and its ancestor classes, nearest declaration first.
     * A member hides same-named members of farther ancestors.
     */
    private Map<String, StructureDescriptor.Member> visibleMembers(String structure, ComponentKind kind) {
        Map<String, StructureDescriptor.Member> visible = new LinkedHashMap<>();
        addMembers(structures.get(structure), kind, visible);
        for (String ancestor : ancestors(structure)) {
            addMembers(structures.get(ancestor), kind, visible);
        }
        return visible;
    }

    private void addMembers(@Nullable StructureDescriptor descriptor, ComponentKind kind,
                            Map<String, StructureDescriptor.Member> into) {
        if (descriptor != null) {
            descriptor.members(kind).forEach(into::putIfAbsent);
        }
    }
}
