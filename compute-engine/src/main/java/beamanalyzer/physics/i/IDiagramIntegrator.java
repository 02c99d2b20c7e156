package beamanalyzer.physics.i;

import beamanalyzer.domain.beam.Beam;
import beamanalyzer.domain.node.NodeSet;
import beamanalyzer.physics.model.RawDiagram;

/**
 * Integra V, M, θ e y a lo largo de la viga a partir de su conjunto de nodos.
 */
public interface IDiagramIntegrator extends ISolverComponent {

    RawDiagram integrate(Beam beam, NodeSet nodes);
}
