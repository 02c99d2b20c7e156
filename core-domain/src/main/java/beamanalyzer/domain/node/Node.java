package beamanalyzer.domain.node;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * Coordenada estructuralmente significativa con los sucesos que ocurren en ella
 * y los saltos exactos que provocan en cortante y momento.
 *
 * @param position   Coordenada [m].
 * @param events     Sucesos del nodo.
 * @param shearJump  Salto de V al cruzar el nodo (+R de apoyos, -P de fuerzas).
 * @param momentJump Salto de M al cruzar el nodo (+M0 de momentos puntuales).
 */
public record Node(double position, Set<NodeEvent> events, double shearJump, double momentJump) {

    public Node {
        events = events.isEmpty()
                ? Collections.unmodifiableSet(EnumSet.noneOf(NodeEvent.class))
                : Collections.unmodifiableSet(EnumSet.copyOf(events));
    }

    public boolean hasEvent(NodeEvent event) {
        return events.contains(event);
    }

    public boolean hasJump() {
        return shearJump != 0.0 || momentJump != 0.0;
    }
}
