package beamanalyzer.domain.diagram;

import beamanalyzer.domain.node.NodeEvent;
import lombok.Builder;
import lombok.Value;

import java.util.Set;

/**
 * Valores exactos a izquierda y derecha de un nodo. Giro y flecha son continuos.
 */
@Value
@Builder
public class NodeSample {
    double position;
    Set<NodeEvent> events;
    double shearLeft;
    double shearRight;
    double momentLeft;
    double momentRight;
    double rotation;
    double deflection;

    public double shearJump() {
        return shearRight - shearLeft;
    }

    public double momentJump() {
        return momentRight - momentLeft;
    }
}
