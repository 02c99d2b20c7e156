package beamanalyzer.physics.engine;

import beamanalyzer.config.AnalysisConfig;
import beamanalyzer.domain.beam.Beam;
import beamanalyzer.domain.beam.SystemClassification;
import beamanalyzer.domain.diagram.DiagramResult;
import beamanalyzer.domain.diagram.NodeSample;
import beamanalyzer.domain.diagram.NumericalWarning;
import beamanalyzer.domain.diagram.WarningType;
import beamanalyzer.domain.exception.BeamSolveException;
import beamanalyzer.domain.exception.BeamValidationException;
import beamanalyzer.domain.node.Node;
import beamanalyzer.domain.node.NodeSet;
import beamanalyzer.factory.NodeSetFactory;
import beamanalyzer.physics.i.IDiagramIntegrator;
import beamanalyzer.physics.i.IReactionSolver;
import beamanalyzer.physics.impl.BoundaryCorrector;
import beamanalyzer.physics.impl.ContinuousFallbackIntegrator;
import beamanalyzer.physics.impl.FlexibilityReactionSolver;
import beamanalyzer.physics.impl.PiecewiseDiagramIntegrator;
import beamanalyzer.physics.impl.StaticEquilibriumReactionSolver;
import beamanalyzer.physics.model.RawDiagram;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Orquesta el cálculo completo de una viga:
 * validar → reacciones → nodos → integración → corrección → resultado.
 * <p>
 * Los errores de validación se propagan siempre al llamante. Los fallos numéricos
 * ({@link BeamSolveException}) desvían el cálculo al integrador de respaldo, cuyo
 * resultado lleva el aviso {@link WarningType#FALLBACK_ENGAGED}.
 * <p>
 * No tiene estado mutable: cada llamada trabaja sobre una viga inmutable y devuelve
 * un resultado nuevo.
 */
@Slf4j
public class BeamDiagramEngine {

    @Getter
    private final AnalysisConfig config;
    private final List<IReactionSolver> reactionSolvers;
    private final NodeSetFactory nodeSetFactory;
    private final IDiagramIntegrator integrator;
    private final BoundaryCorrector corrector;
    private final ContinuousFallbackIntegrator fallbackIntegrator;

    public BeamDiagramEngine() {
        this(AnalysisConfig.defaults());
    }

    public BeamDiagramEngine(AnalysisConfig config) {
        this(config, defaultSolvers(config), new NodeSetFactory(config), new PiecewiseDiagramIntegrator(config),
                new BoundaryCorrector(config),
                new ContinuousFallbackIntegrator(config, new StaticEquilibriumReactionSolver()));
    }

    public BeamDiagramEngine(AnalysisConfig config, List<IReactionSolver> reactionSolvers,
                             NodeSetFactory nodeSetFactory, IDiagramIntegrator integrator,
                             BoundaryCorrector corrector, ContinuousFallbackIntegrator fallbackIntegrator) {
        this.config = config;
        this.reactionSolvers = List.copyOf(reactionSolvers);
        this.nodeSetFactory = nodeSetFactory;
        this.integrator = integrator;
        this.corrector = corrector;
        this.fallbackIntegrator = fallbackIntegrator;
    }

    private static List<IReactionSolver> defaultSolvers(AnalysisConfig config) {
        return List.of(new StaticEquilibriumReactionSolver(), new FlexibilityReactionSolver(config));
    }

    /**
     * Calcula diagramas y reacciones de la viga.
     *
     * @throws BeamValidationException si la viga no es resoluble.
     */
    public DiagramResult analyze(Beam beam) {
        beam.validateForSolve();
        nodeSetFactory.requireWithinLimits(beam);
        SystemClassification classification = beam.classify();

        List<NumericalWarning> warnings = new ArrayList<>();
        if (beam.getLoads().isEmpty()) {
            warnings.add(new NumericalWarning(WarningType.NO_LOADS, "La viga no tiene cargas: todos los diagramas son nulos."));
        }

        try {
            IReactionSolver solver = solverFor(classification);
            log.debug("Analizando {} con {} ({}).", beam, solver.traceLabel(), classification);

            Map<String, Double> reactions = solver.solveReactions(beam);
            NodeSet nodes = nodeSetFactory.create(beam, reactions);
            RawDiagram raw = integrator.integrate(beam, nodes);
            BoundaryCorrector.Result corrected = corrector.correct(beam, raw);
            warnings.addAll(corrected.getWarnings());
            checkEquilibrium(beam, reactions, warnings);

            RawDiagram diagram = corrected.getDiagram();
            return DiagramResult.builder()
                    .x(diagram.getX())
                    .shear(diagram.getShear())
                    .moment(diagram.getMoment())
                    .rotation(diagram.getRotation())
                    .deflection(diagram.getDeflection())
                    .reactions(reactions)
                    .classification(classification)
                    .warnings(warnings)
                    .fallbackUsed(false)
                    .nodeSamples(nodeSamples(diagram))
                    .build();
        } catch (BeamSolveException e) {
            log.debug("Fallo numérico ({}), se recurre a {}.", e.getFailure(), fallbackIntegrator.traceLabel(), e);
            DiagramResult fallback = fallbackIntegrator.integrate(beam, e);
            if (warnings.isEmpty()) {
                return fallback;
            }
            warnings.addAll(fallback.getWarnings());
            return DiagramResult.builder()
                    .x(fallback.getX())
                    .shear(fallback.getShear())
                    .moment(fallback.getMoment())
                    .rotation(fallback.getRotation())
                    .deflection(fallback.getDeflection())
                    .reactions(fallback.getReactions())
                    .classification(fallback.getClassification())
                    .warnings(warnings)
                    .fallbackUsed(true)
                    .nodeSamples(fallback.getNodeSamples())
                    .build();
        }
    }

    /**
     * Solo las reacciones, sin diagramas. Los fallos numéricos se propagan.
     */
    public Map<String, Double> solveReactions(Beam beam) {
        beam.validateForSolve();
        nodeSetFactory.requireWithinLimits(beam);
        return solverFor(beam.classify()).solveReactions(beam);
    }

    private IReactionSolver solverFor(SystemClassification classification) {
        for (IReactionSolver solver : reactionSolvers) {
            if (solver.supports(classification)) {
                return solver;
            }
        }
        throw new IllegalStateException("No hay ninguna estrategia de reacciones para sistemas " + classification);
    }

    private void checkEquilibrium(Beam beam, Map<String, Double> reactions, List<NumericalWarning> warnings) {
        double applied = beam.totalAppliedForce();
        double resisted = 0.0;
        for (double r : reactions.values()) {
            resisted += r;
        }
        double residual = Math.abs(resisted - applied);
        if (residual > config.getEquilibriumTolerance() * Math.max(1.0, Math.abs(applied))) {
            warnings.add(new NumericalWarning(WarningType.EQUILIBRIUM_RESIDUAL, String.format(Locale.ROOT,
                    "ΣR = %.6f N no equilibra ΣF = %.6f N.", resisted, applied)));
        }
    }

    private static List<NodeSample> nodeSamples(RawDiagram diagram) {
        NodeSet nodes = diagram.getNodes();
        List<NodeSample> samples = new ArrayList<>(nodes.size());
        for (int k = 0; k < nodes.size(); k++) {
            Node node = nodes.get(k);
            int l = diagram.getNodeLeftIndex()[k];
            int r = diagram.getNodeRightIndex()[k];
            samples.add(NodeSample.builder()
                    .position(node.position())
                    .events(node.events())
                    .shearLeft(diagram.getShear()[l])
                    .shearRight(diagram.getShear()[r])
                    .momentLeft(diagram.getMoment()[l])
                    .momentRight(diagram.getMoment()[r])
                    .rotation(diagram.getRotation()[l])
                    .deflection(diagram.getDeflection()[l])
                    .build());
        }
        return samples;
    }
}
