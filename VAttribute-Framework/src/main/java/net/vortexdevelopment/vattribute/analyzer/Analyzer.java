package net.vortexdevelopment.vattribute.analyzer;

import net.vortexdevelopment.vattribute.capability.CustomResolution;
import net.vortexdevelopment.vattribute.capability.Excludable;
import net.vortexdevelopment.vattribute.capability.Finalizable;
import net.vortexdevelopment.vattribute.capability.HasSubMarkers;
import net.vortexdevelopment.vattribute.capability.ParsesConstants;
import net.vortexdevelopment.vattribute.capability.ParsesMethods;
import net.vortexdevelopment.vattribute.capability.ParsesParameters;
import net.vortexdevelopment.vattribute.capability.ParsesProperties;
import net.vortexdevelopment.vattribute.capability.Reflectable;
import net.vortexdevelopment.vattribute.capability.SubMarkers;
import net.vortexdevelopment.vattribute.debug.DebugLogger;
import net.vortexdevelopment.vattribute.exception.AmbiguousAttachmentException;
import net.vortexdevelopment.vattribute.exception.MarkerDefinitionException;
import net.vortexdevelopment.vattribute.exception.ResolutionDepthExceededException;
import net.vortexdevelopment.vattribute.instantiate.Capability;
import net.vortexdevelopment.vattribute.instantiate.MarkerInstantiator;
import net.vortexdevelopment.vattribute.instantiate.MarkerTypeDescriptor;
import net.vortexdevelopment.vattribute.instantiate.MarkerTypeRegistry;
import net.vortexdevelopment.vattribute.model.AttachedMarker;
import net.vortexdevelopment.vattribute.model.ComponentDescriptor;
import net.vortexdevelopment.vattribute.model.ComponentKind;
import net.vortexdevelopment.vattribute.model.MarkerTarget;
import net.vortexdevelopment.vattribute.model.ReflectionFacts;
import net.vortexdevelopment.vattribute.source.StructureSource;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The resolution engine.
 * <p>
 * For one structure and marker type it finds the attached marker (falling back to ancestors for
 * {@code Inheritable} types, or a default instance), then lets the marker's capabilities drive the
 * remaining steps in a fixed order:
 * <ol>
 *   <li>reflection facts ({@code Reflectable})</li>
 *   <li>sub-marker folding ({@code HasSubMarkers})</li>
 *   <li>child components: properties, methods, constants, and parameters of methods ({@code Parses*})</li>
 *   <li>custom resolution ({@code CustomResolution})</li>
 *   <li>finish ({@code Finalizable})</li>
 * </ol>
 * The engine keeps no state between calls; wrap it in a {@link MemoryCacheAnalyzer} to memoize.
 */
public class Analyzer implements ClassAnalyzer {

    private final StructureSource source;
    private final MarkerTypeRegistry markerTypes;
    private final MarkerInstantiator instantiator;
    private final int customMaxDepth;

    public Analyzer(StructureSource source) {
        this(source, new MarkerTypeRegistry(), 0);
    }

    /**
     * @param customMaxDepth how deep custom resolution hooks may nest calls back into the analyzer, 0 for unlimited
     */
    public Analyzer(StructureSource source, MarkerTypeRegistry markerTypes, int customMaxDepth) {
        this(source, markerTypes, new MarkerInstantiator(markerTypes), customMaxDepth);
    }

    public Analyzer(StructureSource source, MarkerTypeRegistry markerTypes, MarkerInstantiator instantiator, int customMaxDepth) {
        if (customMaxDepth < 0) {
            throw new IllegalArgumentException("customMaxDepth must not be negative");
        }
        this.source = source;
        this.markerTypes = markerTypes;
        this.instantiator = instantiator;
        this.customMaxDepth = customMaxDepth;
    }

    @Override
    public <T> T analyze(Object subject, Class<T> markerType) {
        return analyze(ClassAnalyzer.structureName(subject), markerType, 0);
    }

    private <T> T analyze(String structure, Class<T> markerType, int depth) {
        if (!source.isKnown(structure)) {
            throw new IllegalArgumentException("Unknown structure: " + structure);
        }
        MarkerTypeDescriptor descriptor = markerTypes.describe(markerType);
        MarkerTarget target = MarkerTarget.structure(structure);

        Object marker = findStructureMarker(structure, descriptor);
        if (marker == null) {
            DebugLogger.log(Analyzer.class, "No %s on %s, using defaults", markerType.getSimpleName(), structure);
            marker = instantiator.instantiate(markerType);
        }
        populate(marker, target, null, depth);
        return markerType.cast(marker);
    }

    // Lookup

    /**
     * Places to look for a marker, nearest first. Without inheritance that is only the target itself.
     * Components never look at contracts, since contracts cannot carry them.
     */
    private List<MarkerTarget> searchOrder(MarkerTarget target, MarkerTypeDescriptor descriptor) {
        if (!descriptor.has(Capability.INHERITABLE)) {
            return List.of(target);
        }
        List<MarkerTarget> order = new ArrayList<>();
        order.add(target);
        for (String ancestor : source.ancestors(target.structure())) {
            order.add(target.retarget(ancestor));
        }
        if (target.kind() == ComponentKind.STRUCTURE) {
            for (String contract : source.implementedContracts(target.structure())) {
                order.add(target.retarget(contract));
            }
        }
        return order;
    }

    @Nullable
    private Object findStructureMarker(String structure, MarkerTypeDescriptor descriptor) {
        return findFirst(MarkerTarget.structure(structure), descriptor);
    }

    @Nullable
    private Object findFirst(MarkerTarget target, MarkerTypeDescriptor descriptor) {
        for (MarkerTarget candidate : searchOrder(target, descriptor)) {
            Object found = single(candidate, descriptor);
            if (found != null) {
                if (!candidate.equals(target)) {
                    DebugLogger.log(Analyzer.class, "%s for %s inherited from %s",
                            descriptor.getType().getSimpleName(), target, candidate.structure());
                }
                return found;
            }
        }
        return null;
    }

    @Nullable
    private Object findComponentMarker(MarkerTarget target, ComponentDescriptor component, MarkerTypeDescriptor descriptor) {
        Object found = findFirst(target, descriptor);
        if (found != null) {
            return found;
        }
        if (descriptor.has(Capability.TRANSITIVE)
                && (target.kind() == ComponentKind.PROPERTY || target.kind() == ComponentKind.PARAMETER)) {
            String declaredType = component.declaredType();
            if (declaredType != null && source.isKnown(declaredType)) {
                found = findStructureMarker(declaredType, descriptor);
                if (found != null) {
                    DebugLogger.log(Analyzer.class, "%s for %s taken from its type %s",
                            descriptor.getType().getSimpleName(), target, declaredType);
                }
            }
        }
        return found;
    }

    /**
     * The one marker of the type attached directly to the target, or null.
     */
    @Nullable
    private Object single(MarkerTarget target, MarkerTypeDescriptor descriptor) {
        List<AttachedMarker> attached = source.attachedMarkers(target, descriptor.getType());
        if (attached.isEmpty()) {
            return null;
        }
        if (attached.size() > 1) {
            throw new AmbiguousAttachmentException(target, descriptor.getType(), attached.size());
        }
        AttachedMarker marker = attached.get(0);
        return instantiator.instantiate(marker.type(), marker.arguments());
    }

    /**
     * All markers of a multi-value type from the nearest place carrying at least one.
     */
    private List<Object> all(MarkerTarget target, MarkerTypeDescriptor descriptor) {
        for (MarkerTarget candidate : searchOrder(target, descriptor)) {
            List<AttachedMarker> attached = source.attachedMarkers(candidate, descriptor.getType());
            if (!attached.isEmpty()) {
                List<Object> result = new ArrayList<>(attached.size());
                for (AttachedMarker marker : attached) {
                    result.add(instantiator.instantiate(marker.type(), marker.arguments()));
                }
                return result;
            }
        }
        return List.of();
    }

    // Population

    private void populate(Object marker, MarkerTarget target, @Nullable ComponentDescriptor component, int depth) {
        MarkerTypeDescriptor descriptor = markerTypes.describe(marker.getClass());

        if (descriptor.has(Capability.REFLECTABLE)) {
            ((Reflectable) marker).fromReflection(facts(target, component));
        }
        if (descriptor.has(Capability.HAS_SUB_MARKERS)) {
            foldSubMarkers((HasSubMarkers) marker, target, component);
        }
        parseChildren(marker, descriptor, target, depth);
        if (descriptor.has(Capability.CUSTOM_RESOLUTION)) {
            ((CustomResolution) marker).customResolve(hookAnalyzer(depth));
        }
        if (descriptor.has(Capability.FINALIZABLE)) {
            ((Finalizable) marker).finish();
        }
    }

    @SuppressWarnings({"unchecked", "rawtypes"})
    private void parseChildren(Object marker, MarkerTypeDescriptor descriptor, MarkerTarget target, int depth) {
        if (target.kind() == ComponentKind.STRUCTURE) {
            if (descriptor.has(Capability.PARSES_PROPERTIES)) {
                ParsesProperties parser = (ParsesProperties) marker;
                parser.setProperties(parseMembers(target, ComponentKind.PROPERTY, parser.propertyMarker(),
                        parser.includePropertiesByDefault(), parser.includeStaticProperties(), depth));
            }
            if (descriptor.has(Capability.PARSES_METHODS)) {
                ParsesMethods parser = (ParsesMethods) marker;
                parser.setMethods(parseMembers(target, ComponentKind.METHOD, parser.methodMarker(),
                        parser.includeMethodsByDefault(), parser.includeStaticMethods(), depth));
            }
            if (descriptor.has(Capability.PARSES_CONSTANTS)) {
                ParsesConstants parser = (ParsesConstants) marker;
                parser.setConstants(parseMembers(target, ComponentKind.CONSTANT, parser.constantMarker(),
                        parser.includeConstantsByDefault(), true, depth));
            }
        } else if (target.kind() == ComponentKind.METHOD && descriptor.has(Capability.PARSES_PARAMETERS)) {
            ParsesParameters parser = (ParsesParameters) marker;
            parser.setParameters(parseMembers(target, ComponentKind.PARAMETER, parser.parameterMarker(),
                    parser.includeParametersByDefault(), true, depth));
        }
    }

    private Map<String, Object> parseMembers(MarkerTarget owner, ComponentKind kind, Class<?> childType,
                                             boolean includeByDefault, boolean includeStatic, int depth) {
        MarkerTypeDescriptor childDescriptor = markerTypes.describe(childType);
        List<ComponentDescriptor> components = kind == ComponentKind.PARAMETER
                ? source.parameters(owner.structure(), owner.name())
                : source.components(owner.structure(), kind);

        Map<String, Object> result = new LinkedHashMap<>();
        for (ComponentDescriptor component : components) {
            if (component.isStatic() && !includeStatic) {
                continue;
            }
            MarkerTarget childTarget = owner.child(kind, component.name());
            Object child = findComponentMarker(childTarget, component, childDescriptor);
            if (child == null) {
                if (!includeByDefault) {
                    continue;
                }
                child = instantiator.instantiate(childType);
            }
            populate(child, childTarget, component, depth);

            if (child instanceof Excludable excludable && excludable.exclude()) {
                DebugLogger.log(Analyzer.class, "Excluded %s", childTarget);
                continue;
            }
            result.put(component.name(), child);
        }
        return Collections.unmodifiableMap(result);
    }

    private void foldSubMarkers(HasSubMarkers marker, MarkerTarget target, @Nullable ComponentDescriptor component) {
        for (SubMarkers.Binding<?> binding : marker.subMarkers().getBindings()) {
            MarkerTypeDescriptor subDescriptor = markerTypes.describe(binding.getType());
            boolean multivalue = subDescriptor.has(Capability.MULTIVALUE);
            if (binding.isMultiple() != multivalue) {
                throw new MarkerDefinitionException(marker.getClass().getName() + " binds sub-marker "
                        + binding.getType().getName() + (multivalue
                        ? " as single although it is Multivalue"
                        : " as multiple although it is not Multivalue"));
            }

            if (multivalue) {
                List<Object> values = all(target, subDescriptor);
                for (Object value : values) {
                    enrichSubMarker(value, target, component);
                }
                binding.acceptAll(values);
            } else {
                Object value = findFirst(target, subDescriptor);
                if (value != null) {
                    enrichSubMarker(value, target, component);
                }
                binding.accept(value);
            }
        }
    }

    /**
     * Sub-markers get reflection facts and their own sub-markers, but no children.
     */
    private void enrichSubMarker(Object subMarker, MarkerTarget target, @Nullable ComponentDescriptor component) {
        MarkerTypeDescriptor descriptor = markerTypes.describe(subMarker.getClass());
        if (descriptor.has(Capability.REFLECTABLE)) {
            ((Reflectable) subMarker).fromReflection(facts(target, component));
        }
        if (descriptor.has(Capability.HAS_SUB_MARKERS)) {
            foldSubMarkers((HasSubMarkers) subMarker, target, component);
        }
        if (descriptor.has(Capability.FINALIZABLE)) {
            ((Finalizable) subMarker).finish();
        }
    }

    private ReflectionFacts facts(MarkerTarget target, @Nullable ComponentDescriptor component) {
        String structure = target.structure();
        ReflectionFacts.ReflectionFactsBuilder builder = ReflectionFacts.builder()
                .kind(target.kind())
                .structure(structure)
                .contract(source.isContract(structure));
        if (target.kind() == ComponentKind.STRUCTURE || component == null) {
            return builder
                    .name(target.kind() == ComponentKind.STRUCTURE ? source.shortName(structure) : target.name())
                    .method(target.method())
                    .ancestors(List.copyOf(source.ancestors(structure)))
                    .contracts(List.copyOf(source.implementedContracts(structure)))
                    .build();
        }
        return builder
                .name(component.name())
                .method(target.method())
                .declaredType(component.declaredType())
                .isStatic(component.isStatic())
                .position(component.position())
                .build();
    }

    // Custom resolution

    private ClassAnalyzer hookAnalyzer(int depth) {
        if (customMaxDepth == 0) {
            return this;
        }
        return new DepthGuard(depth + 1);
    }

    /**
     * Hands custom hooks an analyzer that counts how deep they have nested.
     */
    private final class DepthGuard implements ClassAnalyzer {
        private final int depth;

        private DepthGuard(int depth) {
            this.depth = depth;
        }

        @Override
        public <T> T analyze(Object subject, Class<T> markerType) {
            String structure = ClassAnalyzer.structureName(subject);
            if (depth > customMaxDepth) {
                throw new ResolutionDepthExceededException(structure, markerType, customMaxDepth);
            }
            return Analyzer.this.analyze(structure, markerType, depth);
        }
    }
}
