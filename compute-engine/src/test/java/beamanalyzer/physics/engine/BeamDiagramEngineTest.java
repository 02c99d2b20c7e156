package beamanalyzer.physics.engine;

import beamanalyzer.config.AnalysisConfig;
import beamanalyzer.domain.beam.Beam;
import beamanalyzer.domain.beam.Support;
import beamanalyzer.domain.beam.SystemClassification;
import beamanalyzer.domain.diagram.DiagramQuantity;
import beamanalyzer.domain.diagram.DiagramResult;
import beamanalyzer.domain.diagram.NodeSample;
import beamanalyzer.domain.diagram.WarningType;
import beamanalyzer.domain.exception.BeamSolveException;
import beamanalyzer.domain.exception.BeamValidationException;
import beamanalyzer.domain.exception.SolveFailure;
import beamanalyzer.domain.exception.ValidationFailure;
import beamanalyzer.domain.load.DistributedLoad;
import beamanalyzer.domain.load.PointForce;
import beamanalyzer.domain.load.PointMoment;
import beamanalyzer.domain.node.NodeEvent;
import beamanalyzer.factory.NodeSetFactory;
import beamanalyzer.physics.i.IReactionSolver;
import beamanalyzer.physics.impl.BoundaryCorrector;
import beamanalyzer.physics.impl.ContinuousFallbackIntegrator;
import beamanalyzer.physics.impl.PiecewiseDiagramIntegrator;
import beamanalyzer.physics.impl.StaticEquilibriumReactionSolver;
import lombok.extern.slf4j.Slf4j;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

/**
 * Pruebas de extremo a extremo del motor de diagramas.
 */
@Slf4j
@ExtendWith(MockitoExtension.class)
class BeamDiagramEngineTest {

    private static final double E = 200e9;
    private static final double I = 1e-5;
    private static final double EI = E * I;

    @Mock
    private IReactionSolver failingSolver;
    @Mock
    private ContinuousFallbackIntegrator unusedFallback;

    private BeamDiagramEngine engine;

    @BeforeEach
    void setUp() {
        engine = new BeamDiagramEngine();
    }

    private static void assertZeroDeflectionAtSupports(DiagramResult result) {
        long supportNodes = 0;
        for (NodeSample sample : result.getNodeSamples()) {
            if (sample.getEvents().contains(NodeEvent.SUPPORT)) {
                supportNodes++;
                assertEquals(0.0, sample.getDeflection(), 0.0, "y debe ser exactamente 0 en x=" + sample.getPosition());
            }
        }
        assertTrue(supportNodes >= 2);
    }

    private static NodeSample nodeAt(DiagramResult result, double position) {
        return result.getNodeSamples().stream()
                .filter(s -> s.getPosition() == position)
                .findFirst()
                .orElseThrow();
    }

    @Nested
    @DisplayName("Vigas isostáticas")
    class Determinate {

        @Test
        @DisplayName("Escenario A: P=10 en el centro de L=6")
        void scenarioA() {
            // ARRANGE
            Beam beam = Beam.simplySupported(6.0, E, I).withLoad(new PointForce(3.0, 10.0));

            // ACT
            DiagramResult result = engine.analyze(beam);

            // ASSERT
            assertEquals(SystemClassification.DETERMINATE, result.getClassification());
            assertFalse(result.isFallbackUsed());
            assertTrue(result.getWarnings().isEmpty(), "No se esperan avisos: " + result.getWarnings());
            assertEquals(5.0, result.reaction("A"), 1e-12);
            assertEquals(5.0, result.reaction("B"), 1e-12);
            assertEquals(15.0, result.valueAt(DiagramQuantity.MOMENT, 3.0), 1e-9);
            assertEquals(0.0, result.valueAt(DiagramQuantity.MOMENT, 0.0), 1e-12);
            assertEquals(0.0, result.valueAt(DiagramQuantity.MOMENT, 6.0), 1e-12);
            assertEquals(-10.0 * 216.0 / (48.0 * EI), result.valueAt(DiagramQuantity.DEFLECTION, 3.0), 1e-10);

            NodeSample load = nodeAt(result, 3.0);
            assertEquals(-10.0, load.shearJump(), 1e-12);
            assertEquals(5.0, nodeAt(result, 0.0).shearJump(), 1e-12);
            assertEquals(5.0, nodeAt(result, 6.0).shearJump(), 1e-12);
            assertZeroDeflectionAtSupports(result);
        }

        @Test
        @DisplayName("Escenario B: carga uniforme w=2 en L=10")
        void scenarioB() {
            Beam beam = Beam.simplySupported(10.0, E, I).withLoad(DistributedLoad.uniform(0.0, 10.0, 2.0));

            DiagramResult result = engine.analyze(beam);

            assertEquals(10.0, result.reaction("A"), 1e-12);
            assertEquals(10.0, result.reaction("B"), 1e-12);
            assertEquals(25.0, result.valueAt(DiagramQuantity.MOMENT, 5.0), 1e-6);
            assertEquals(25.0, result.maximum(DiagramQuantity.MOMENT).value(), 1e-4);
            double expected = -5.0 * 2.0 * Math.pow(10.0, 4) / (384.0 * EI);
            assertEquals(expected, result.valueAt(DiagramQuantity.DEFLECTION, 5.0), Math.abs(expected) * 1e-4);
            assertEquals(0.0, result.valueAt(DiagramQuantity.ROTATION, 5.0), 1e-10);
            assertZeroDeflectionAtSupports(result);
            log.info("Escenario B: {} muestras, flecha máxima {}", result.sampleCount(),
                    result.maximum(DiagramQuantity.DEFLECTION));
        }

        @Test
        @DisplayName("Escenario D: momento M0=+1000 en x=3, V continuo y salto +M0")
        void scenarioD() {
            Beam beam = Beam.simplySupported(6.0, E, I).withLoad(new PointMoment(3.0, 1000.0));

            DiagramResult result = engine.analyze(beam);

            NodeSample node = nodeAt(result, 3.0);
            assertEquals(1000.0, node.momentJump(), 1e-9);
            assertEquals(0.0, node.shearJump(), 0.0);
            assertEquals(0.0, result.totalReaction(), 1e-12);
            assertEquals(-500.0, node.getMomentLeft(), 1e-9);
            assertEquals(500.0, node.getMomentRight(), 1e-9);
            assertZeroDeflectionAtSupports(result);
        }

        @Test
        @DisplayName("Voladizo con carga en el extremo libre")
        void overhangBeam() {
            Beam beam = new Beam(8.0, E, I)
                    .withSupport(new Support("A", 0.0))
                    .withSupport(new Support("B", 6.0))
                    .withLoad(new PointForce(8.0, 6.0));

            DiagramResult result = engine.analyze(beam);

            assertEquals(-2.0, result.reaction("A"), 1e-12);
            assertEquals(8.0, result.reaction("B"), 1e-12);
            assertEquals(-12.0, result.valueAt(DiagramQuantity.MOMENT, 6.0), 1e-9, "M en el apoyo B = -P·a.");
            assertTrue(result.valueAt(DiagramQuantity.DEFLECTION, 8.0) < 0.0, "El extremo libre baja.");
            assertZeroDeflectionAtSupports(result);
        }

        @Test
        @DisplayName("Sin cargas: diagramas nulos y aviso")
        void noLoads_warns() {
            DiagramResult result = engine.analyze(Beam.simplySupported(4.0, E, I));

            assertTrue(result.hasWarning(WarningType.NO_LOADS));
            assertEquals(0.0, result.maximum(DiagramQuantity.MOMENT).magnitude(), 0.0);
            assertEquals(0.0, result.maximum(DiagramQuantity.DEFLECTION).magnitude(), 0.0);
        }
    }

    @Nested
    @DisplayName("Vigas hiperestáticas")
    class Indeterminate {

        @Test
        @DisplayName("Escenario C: tres apoyos, carga uniforme w=3, ΣR = 30 y central positiva")
        void scenarioC() {
            Beam beam = Beam.simplySupported(10.0, E, I)
                    .withSupport(new Support("M", 5.0))
                    .withLoad(DistributedLoad.uniform(0.0, 10.0, 3.0));

            DiagramResult result = engine.analyze(beam);
            log.info("Escenario C: reacciones {}", result.getReactions());

            assertEquals(SystemClassification.INDETERMINATE, result.getClassification());
            assertEquals(List.of("A", "M", "B"), List.copyOf(result.getReactions().keySet()));
            assertEquals(30.0, result.totalReaction(), 1e-9);
            assertTrue(result.reaction("M") > 0.0);
            assertEquals(18.75, result.reaction("M"), 1e-4);
            // Momento negativo sobre el apoyo central: -wl²/8
            assertEquals(-3.0 * 25.0 / 8.0, result.valueAt(DiagramQuantity.MOMENT, 5.0), 1e-3);
            assertFalse(result.hasWarning(WarningType.DEFLECTION_CORRECTION_EXCEEDED));
            assertZeroDeflectionAtSupports(result);
        }

        @Test
        @DisplayName("Cinco apoyos con cargas mixtas: equilibrio y flecha nula en todos")
        void fiveSupports_mixedLoads() {
            Beam beam = Beam.simplySupported(12.0, E, I)
                    .withSupport(Support.at(3.0))
                    .withSupport(Support.at(6.5))
                    .withSupport(Support.at(9.0))
                    .withLoad(DistributedLoad.trapezoidal(1.0, 11.0, 2.0, 5.0))
                    .withLoad(new PointForce(4.0, 12.0))
                    .withLoad(new PointMoment(7.5, -40.0));

            DiagramResult result = engine.analyze(beam);

            assertEquals(5, result.getReactions().size());
            assertEquals(beam.totalAppliedForce(), result.totalReaction(), 1e-8);
            assertFalse(result.hasWarning(WarningType.EQUILIBRIUM_RESIDUAL));
            assertFalse(result.isFallbackUsed());
            assertZeroDeflectionAtSupports(result);
        }

        @Test
        @DisplayName("solveReactions devuelve solo las reacciones")
        void solveReactions_only() {
            Beam beam = Beam.simplySupported(10.0, E, I)
                    .withSupport(new Support("M", 5.0))
                    .withLoad(DistributedLoad.uniform(0.0, 10.0, 3.0));

            Map<String, Double> reactions = engine.solveReactions(beam);

            assertEquals(5.625, reactions.get("A"), 1e-4);
            assertEquals(5.625, reactions.get("B"), 1e-4);
        }
    }

    @Nested
    @DisplayName("Errores y respaldo")
    class Failures {

        @Test
        @DisplayName("Una viga con un solo apoyo se rechaza antes de calcular")
        void underconstrained_isRejected() {
            Beam beam = new Beam(5.0, E, I).withSupport(Support.at(0.0)).withLoad(new PointForce(2.0, 1.0));

            BeamValidationException ex = assertThrows(BeamValidationException.class, () -> engine.analyze(beam));
            assertEquals(ValidationFailure.UNDERCONSTRAINED_SYSTEM, ex.getFailure());
        }

        @Test
        @DisplayName("Demasiados apoyos para la configuración se rechazan")
        void tooManySupports_isRejected() {
            BeamDiagramEngine strict = new BeamDiagramEngine(AnalysisConfig.defaults().withMaxSupports(2));
            Beam beam = Beam.simplySupported(6.0, E, I).withSupport(Support.at(3.0)).withLoad(new PointForce(1.0, 1.0));

            BeamValidationException ex = assertThrows(BeamValidationException.class, () -> strict.analyze(beam));
            assertEquals(ValidationFailure.TOO_MANY_ELEMENTS, ex.getFailure());
        }

        @Test
        @DisplayName("Un fallo numérico del solver activa el integrador de respaldo")
        void numericalFailure_engagesFallback() {
            // ARRANGE
            AnalysisConfig config = AnalysisConfig.defaults();
            when(failingSolver.supports(any())).thenReturn(true);
            when(failingSolver.solveReactions(any())).thenThrow(
                    new BeamSolveException(SolveFailure.NON_FINITE_RESULT, "reacción NaN simulada"));
            BeamDiagramEngine fragile = new BeamDiagramEngine(config, List.of(failingSolver), new NodeSetFactory(config),
                    new PiecewiseDiagramIntegrator(config), new BoundaryCorrector(config),
                    new ContinuousFallbackIntegrator(config, new StaticEquilibriumReactionSolver()));
            Beam beam = Beam.simplySupported(6.0, E, I).withLoad(new PointForce(3.0, 10.0));

            // ACT
            DiagramResult result = fragile.analyze(beam);

            // ASSERT
            verify(failingSolver).solveReactions(beam);
            assertTrue(result.isFallbackUsed());
            assertTrue(result.hasWarning(WarningType.FALLBACK_ENGAGED));
            assertEquals(5.0, result.reaction("A"), 1e-12);
            assertEquals(10.0, result.totalReaction(), 1e-12);
        }

        @Test
        @DisplayName("Los errores de validación del solver no se desvían al respaldo")
        void validationErrorFromSolver_propagates() {
            AnalysisConfig config = AnalysisConfig.defaults();
            when(failingSolver.supports(any())).thenReturn(true);
            when(failingSolver.solveReactions(any())).thenThrow(
                    new BeamValidationException(ValidationFailure.INVALID_RANGE, "error estructural simulado"));
            BeamDiagramEngine fragile = new BeamDiagramEngine(config, List.of(failingSolver), new NodeSetFactory(config),
                    new PiecewiseDiagramIntegrator(config), new BoundaryCorrector(config), unusedFallback);

            assertThrows(BeamValidationException.class,
                    () -> fragile.analyze(Beam.simplySupported(6.0, E, I).withLoad(new PointForce(3.0, 10.0))));
            verifyNoInteractions(unusedFallback);
        }
    }
}
