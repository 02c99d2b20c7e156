package beamanalyzer.physics.model;

import beamanalyzer.domain.node.NodeSet;
import lombok.Builder;
import lombok.Value;
import lombok.With;

/**
 * Salida interna del integrador: muestras densas y la posición de cada nodo
 * dentro de ellas. {@code nodeLeftIndex[k]} y {@code nodeRightIndex[k]} coinciden
 * salvo que el nodo k tenga salto.
 */
@Value
@Builder
@With
public class RawDiagram {
    double[] x;
    double[] shear;
    double[] moment;
    double[] rotation;
    double[] deflection;
    NodeSet nodes;
    int[] nodeLeftIndex;
    int[] nodeRightIndex;

    public int sampleCount() {
        return x.length;
    }

    /**
     * Flecha en el nodo k (continua, da igual el lado).
     */
    public double deflectionAtNode(int k) {
        return deflection[nodeLeftIndex[k]];
    }
}
