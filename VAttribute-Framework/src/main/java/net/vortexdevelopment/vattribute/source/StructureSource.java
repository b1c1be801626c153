package net.vortexdevelopment.vattribute.source;

import net.vortexdevelopment.vattribute.model.AttachedMarker;
import net.vortexdevelopment.vattribute.model.ComponentDescriptor;
import net.vortexdevelopment.vattribute.model.ComponentKind;
import net.vortexdevelopment.vattribute.model.MarkerTarget;

import java.util.List;

/**
 * Read-only view of the structures under analysis.
 * <p>
 * Implementations must be side-effect free and return the same answers for the same
 * questions for as long as an analyzer uses them.
 */
public interface StructureSource {

    /**
     * Whether the name denotes a structure this source can describe.
     */
    boolean isKnown(String structure);

    /**
     * Whether the structure is a contract (interface) rather than a class.
     */
    boolean isContract(String structure);

    /**
     * Ancestor classes, immediate parent first.
     */
    List<String> ancestors(String structure);

    /**
     * Every contract implemented directly or transitively, in the order the source reports them.
     */
    List<String> implementedContracts(String structure);

    /**
     * Child components of one kind, including those inherited from ancestor classes.
     * Components of the structure itself come first; a component hides same-named ones
     * of farther ancestors. Properties and constants keep declaration order, methods of
     * one class are ordered by name. Kind must not be {@link ComponentKind#STRUCTURE} or
     * {@link ComponentKind#PARAMETER}.
     */
    List<ComponentDescriptor> components(String structure, ComponentKind kind);

    /**
     * Parameters of a method, in positional order.
     */
    List<ComponentDescriptor> parameters(String structure, String method);

    /**
     * Markers attached to the target whose class is the requested type or a subtype of it,
     * in declaration order.
     */
    List<AttachedMarker> attachedMarkers(MarkerTarget target, Class<?> markerType);

    /**
     * Short display name of a structure, the qualified name without package or enclosing types.
     */
    default String shortName(String structure) {
        int cut = Math.max(structure.lastIndexOf('.'), structure.lastIndexOf('$'));
        return cut < 0 ? structure : structure.substring(cut + 1);
    }

}
