package beamanalyzer.physics.impl;

import beamanalyzer.config.AnalysisConfig;
import beamanalyzer.domain.beam.Beam;
import beamanalyzer.domain.beam.Support;
import beamanalyzer.domain.diagram.WarningType;
import beamanalyzer.domain.load.DistributedLoad;
import beamanalyzer.domain.load.PointForce;
import beamanalyzer.domain.node.Node;
import beamanalyzer.domain.node.NodeEvent;
import beamanalyzer.domain.node.NodeSet;
import beamanalyzer.factory.NodeSetFactory;
import beamanalyzer.physics.model.RawDiagram;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class BoundaryCorrectorTest {

    private static final double EI = 2.0e6;

    private AnalysisConfig config;
    private BoundaryCorrector corrector;
    private PiecewiseDiagramIntegrator integrator;
    private NodeSetFactory nodeSetFactory;

    @BeforeEach
    void setUp() {
        config = AnalysisConfig.defaults();
        corrector = new BoundaryCorrector(config);
        integrator = new PiecewiseDiagramIntegrator(config);
        nodeSetFactory = new NodeSetFactory(config);
    }

    @Test
    @DisplayName("Un residuo de momento artificial se elimina y se notifica")
    void correct_removesArtificialMomentResidual() {
        // ARRANGE: M crece linealmente hasta 2 en x=L aunque debería anularse.
        Beam beam = Beam.ofRigidity(2.0, EI, List.of(Support.at(0.0), Support.at(2.0)), List.of());
        NodeSet nodes = new NodeSet(List.of(
                new Node(0.0, EnumSet.of(NodeEvent.BEAM_END, NodeEvent.SUPPORT), 0.0, 0.0),
                new Node(2.0, EnumSet.of(NodeEvent.BEAM_END, NodeEvent.SUPPORT), 0.0, 0.0)));
        RawDiagram raw = RawDiagram.builder()
                .x(new double[]{0.0, 1.0, 2.0})
                .shear(new double[]{1.0, 1.0, 1.0})
                .moment(new double[]{0.0, 1.0, 2.0})
                .rotation(new double[3])
                .deflection(new double[3])
                .nodes(nodes)
                .nodeLeftIndex(new int[]{0, 2})
                .nodeRightIndex(new int[]{0, 2})
                .build();

        // ACT
        BoundaryCorrector.Result result = corrector.correct(beam, raw);

        // ASSERT
        assertArrayEquals(new double[]{0.0, 0.0, 0.0}, result.getDiagram().getMoment(), 1e-15);
        assertEquals(2.0, result.getMomentResidual(), 1e-15);
        assertTrue(result.getWarnings().stream().anyMatch(w -> w.type() == WarningType.MOMENT_CORRECTION_EXCEEDED));
        assertArrayEquals(new double[]{1.0, 1.0, 1.0}, result.getDiagram().getShear(), "El cortante no se corrige.");
        assertArrayEquals(new double[]{0.0, 1.0, 2.0}, raw.getMoment(), "La entrada no se modifica.");
    }

    @Test
    @DisplayName("Viga biapoyada: flecha exactamente nula en los apoyos y PL³/48EI en el centro")
    void correct_simplySupported_matchesClosedForm() {
        Beam beam = Beam.ofRigidity(6.0, EI, List.of(Support.at(0.0), Support.at(6.0)),
                List.of(new PointForce(3.0, 10.0)));
        Map<String, Double> reactions = new StaticEquilibriumReactionSolver().solveReactions(beam);
        RawDiagram raw = integrator.integrate(beam, nodeSetFactory.create(beam, reactions));

        BoundaryCorrector.Result result = corrector.correct(beam, raw);
        RawDiagram corrected = result.getDiagram();

        assertEquals(0.0, corrected.deflectionAtNode(0), 0.0);
        assertEquals(0.0, corrected.deflectionAtNode(2), 0.0);
        assertEquals(-10.0 * 216.0 / (48.0 * EI), corrected.deflectionAtNode(1), 1e-10);
        assertEquals(0.0, corrected.getRotation()[corrected.getNodeLeftIndex()[1]], 1e-10, "Giro nulo por simetría.");
        assertTrue(result.getWarnings().isEmpty());
    }

    @Test
    @DisplayName("Con tres apoyos la flecha se ancla en todos, aunque las reacciones sean incompatibles")
    void correct_threeSupports_anchorsEverySupport() {
        // Reacciones en equilibrio pero sin compatibilidad: el apoyo central no trabaja.
        Beam beam = Beam.ofRigidity(10.0, EI,
                List.of(new Support("A", 0.0), new Support("B", 5.0), new Support("C", 10.0)),
                List.of(DistributedLoad.uniform(0.0, 10.0, 3.0)));
        Map<String, Double> reactions = new LinkedHashMap<>();
        reactions.put("A", 15.0);
        reactions.put("B", 0.0);
        reactions.put("C", 15.0);
        RawDiagram raw = integrator.integrate(beam, nodeSetFactory.create(beam, reactions));

        BoundaryCorrector.Result result = corrector.correct(beam, raw);

        RawDiagram corrected = result.getDiagram();
        NodeSet nodes = corrected.getNodes();
        for (Support s : beam.getSupports()) {
            int k = nodes.indexOf(s.position(), 1e-9);
            assertEquals(0.0, corrected.deflectionAtNode(k), 0.0, "y debe ser cero en " + s.name());
        }
        assertTrue(result.getDeflectionResidual() > 0.0);
        assertTrue(result.getWarnings().stream().anyMatch(w -> w.type() == WarningType.DEFLECTION_CORRECTION_EXCEEDED),
                "Un residuo grande en un apoyo intermedio debe avisarse.");
    }
}
