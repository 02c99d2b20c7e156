package beamanalyzer.physics.impl;

import beamanalyzer.config.AnalysisConfig;
import beamanalyzer.domain.beam.Beam;
import beamanalyzer.domain.beam.Support;
import beamanalyzer.domain.diagram.DiagramResult;
import beamanalyzer.domain.diagram.WarningType;
import beamanalyzer.domain.load.DistributedLoad;
import beamanalyzer.factory.NodeSetFactory;
import beamanalyzer.physics.engine.BeamDiagramEngine;
import lombok.extern.slf4j.Slf4j;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Spy;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.atLeastOnce;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.verify;

/**
 * Motor completo con una matriz de flexibilidad forzada a rango 1: el cálculo debe
 * terminar en el integrador de respaldo con reacciones de norma mínima.
 */
@Slf4j
@ExtendWith(MockitoExtension.class)
class SingularFlexibilityFallbackTest {

    private static final double E = 200e9;
    private static final double I = 1e-5;

    private final AnalysisConfig config = AnalysisConfig.defaults();

    @Spy
    private FlexibilityReactionSolver flexibility = new FlexibilityReactionSolver(config);

    private BeamDiagramEngine engine;

    @BeforeEach
    void setUp() {
        engine = new BeamDiagramEngine(config,
                List.of(new StaticEquilibriumReactionSolver(), flexibility), new NodeSetFactory(config),
                new PiecewiseDiagramIntegrator(config), new BoundaryCorrector(config),
                new ContinuousFallbackIntegrator(config, new StaticEquilibriumReactionSolver()));
    }

    @Test
    @DisplayName("Matriz singular: respaldo con redundantes de norma mínima y equilibrio global")
    void singularFlexibility_engagesFallbackWithEquilibrium() {
        // ARRANGE: todas las flechas de sondeo iguales hacen f de rango 1.
        doReturn(new double[]{-1e-3, -1e-3}).when(flexibility).deflectionsAt(any(Beam.class), any(double[].class));
        Beam beam = Beam.simplySupported(9.0, E, I)
                .withSupport(new Support("C", 3.0))
                .withSupport(new Support("D", 6.0))
                .withLoad(DistributedLoad.uniform(0.0, 9.0, 2.0));

        // ACT
        DiagramResult result = engine.analyze(beam);
        log.info("Reacciones de respaldo: {}", result.getReactions());

        // ASSERT
        verify(flexibility, atLeastOnce()).deflectionsAt(any(Beam.class), any(double[].class));
        assertTrue(result.isFallbackUsed());
        assertTrue(result.hasWarning(WarningType.FALLBACK_ENGAGED));
        assertEquals(List.of("A", "C", "D", "B"), List.copyOf(result.getReactions().keySet()));
        assertEquals(-0.5, result.reaction("C"), 1e-9);
        assertEquals(-0.5, result.reaction("D"), 1e-9);
        assertEquals(18.0, result.totalReaction(), 1e-9);
    }
}
