package beamanalyzer.physics.impl;

import beamanalyzer.config.AnalysisConfig;
import beamanalyzer.domain.beam.Beam;
import beamanalyzer.domain.beam.Support;
import beamanalyzer.domain.beam.SystemClassification;
import beamanalyzer.domain.exception.BeamSolveException;
import beamanalyzer.domain.exception.SingularFlexibilityMatrixException;
import beamanalyzer.domain.exception.SolveFailure;
import beamanalyzer.domain.load.PointForce;
import beamanalyzer.domain.node.NodeSet;
import beamanalyzer.factory.NodeSetFactory;
import beamanalyzer.physics.i.IDiagramIntegrator;
import beamanalyzer.physics.i.IReactionSolver;
import beamanalyzer.physics.model.RawDiagram;
import lombok.extern.slf4j.Slf4j;
import org.ejml.data.DMatrixRMaj;
import org.ejml.dense.row.NormOps_DDRM;
import org.ejml.dense.row.factory.LinearSolverFactory_DDRM;
import org.ejml.interfaces.linsol.LinearSolverDense;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Reacciones de una viga continua (tres o más apoyos) por el método de flexibilidad.
 *
 * <ol>
 *   <li>Estructura primaria: solo los apoyos extremos. Las reacciones de los apoyos
 *       intermedios son las incógnitas redundantes.</li>
 *   <li>δ[i]: flecha en el redundante i de la estructura primaria bajo las cargas reales.</li>
 *   <li>f[i][j]: flecha en el redundante i bajo una fuerza unitaria ascendente en j.</li>
 *   <li>Compatibilidad: f·R + δ = 0, resuelto por LU.</li>
 *   <li>Superposición: reacciones extremas = las de las cargas reales más las inducidas
 *       por cada redundante, tratado como fuerza puntual ascendente.</li>
 * </ol>
 *
 * <p>Convenio de signos: flecha positiva hacia arriba, reacciones positivas hacia arriba
 * y la carga de prueba es una fuerza unitaria ascendente (magnitud -1 en el convenio de
 * cargas). Con este convenio f es definida positiva y, en una viga continua cargada
 * hacia abajo, δ &lt; 0, de modo que los redundantes salen positivos. En la viga de dos
 * vanos iguales con carga uniforme el apoyo central recibe 5/8·wL.</p>
 *
 * <p>Las flechas se obtienen con el mismo integrador y corrector que los diagramas
 * finales; las posiciones de los redundantes se añaden como nodos de sondeo para
 * leerlas exactamente.</p>
 */
@Slf4j
public class FlexibilityReactionSolver implements IReactionSolver {

    private final AnalysisConfig config;
    private final StaticEquilibriumReactionSolver statics;
    private final NodeSetFactory nodeSetFactory;
    private final IDiagramIntegrator integrator;
    private final BoundaryCorrector corrector;

    public FlexibilityReactionSolver(AnalysisConfig config) {
        this(config, new StaticEquilibriumReactionSolver(), new NodeSetFactory(config),
                new PiecewiseDiagramIntegrator(config), new BoundaryCorrector(config));
    }

    public FlexibilityReactionSolver(AnalysisConfig config, StaticEquilibriumReactionSolver statics,
                                     NodeSetFactory nodeSetFactory, IDiagramIntegrator integrator,
                                     BoundaryCorrector corrector) {
        this.config = config;
        this.statics = statics;
        this.nodeSetFactory = nodeSetFactory;
        this.integrator = integrator;
        this.corrector = corrector;
    }

    @Override
    public String getName() {
        return "Flexibilidad";
    }

    @Override
    public String getDescription() {
        return "Método de las fuerzas: compatibilidad de flechas en los apoyos redundantes sobre la estructura primaria.";
    }

    @Override
    public boolean supports(SystemClassification classification) {
        return classification == SystemClassification.INDETERMINATE;
    }

    @Override
    public Map<String, Double> solveReactions(Beam beam) {
        List<Support> supports = beam.getSupports();
        Support left = supports.get(0);
        Support right = supports.get(supports.size() - 1);
        List<Support> redundants = supports.subList(1, supports.size() - 1);
        int n = redundants.size();

        double[] probes = new double[n];
        for (int i = 0; i < n; i++) {
            probes[i] = redundants.get(i).position();
        }

        // 1-2. Estructura primaria bajo las cargas reales
        Beam primary = beam.withSupports(List.of(left, right));
        double[] delta = deflectionsAt(primary, probes);

        // 3. Coeficientes de flexibilidad
        Beam unloadedPrimary = primary.withoutLoads();
        double[][] f = new double[n][n];
        for (int j = 0; j < n; j++) {
            Beam unitCase = unloadedPrimary.withLoad(new PointForce(probes[j], -1.0));
            double[] column = deflectionsAt(unitCase, probes);
            for (int i = 0; i < n; i++) {
                f[i][j] = column[i];
            }
        }
        log.debug("Flexibilidad: δ={} f={}", Arrays.toString(delta), Arrays.deepToString(f));

        // 4. Compatibilidad f·R = -δ
        double[] redundant = solveCompatibility(f, delta);

        // 5. Superposición sobre la estructura primaria
        double[] extremes = statics.solve(left.position(), right.position(), beam.getLoads());
        for (int j = 0; j < n; j++) {
            // Un redundante R hacia arriba equivale a una fuerza puntual -R.
            double[] induced = statics.solveForPointForce(left.position(), right.position(), probes[j], -redundant[j]);
            extremes[0] += induced[0];
            extremes[1] += induced[1];
        }

        Map<String, Double> reactions = new LinkedHashMap<>();
        reactions.put(left.name(), extremes[0]);
        for (int i = 0; i < n; i++) {
            reactions.put(redundants.get(i).name(), redundant[i]);
        }
        reactions.put(right.name(), extremes[1]);

        for (Map.Entry<String, Double> e : reactions.entrySet()) {
            if (!Double.isFinite(e.getValue())) {
                throw new BeamSolveException(SolveFailure.NON_FINITE_RESULT,
                        "La reacción del apoyo " + e.getKey() + " no es finita.");
            }
        }
        log.debug("Reacciones hiperestáticas (grado {}): {}", n, reactions);
        return reactions;
    }

    /**
     * Resuelve f·R = -δ. Lanza {@link SingularFlexibilityMatrixException} si la matriz
     * está mal condicionada o la factorización LU falla.
     */
    double[] solveCompatibility(double[][] f, double[] delta) {
        int n = delta.length;
        DMatrixRMaj flexibility = new DMatrixRMaj(f);
        double condition = NormOps_DDRM.conditionP2(flexibility);
        if (!Double.isFinite(condition) || condition > config.getMaxConditionNumber()) {
            throw new SingularFlexibilityMatrixException(String.format(Locale.ROOT,
                    "Matriz de flexibilidad mal condicionada (cond=%.3e, límite %.1e).",
                    condition, config.getMaxConditionNumber()), f, delta, condition);
        }

        LinearSolverDense<DMatrixRMaj> solver = LinearSolverFactory_DDRM.lu(n);
        DMatrixRMaj a = solver.modifiesA() ? flexibility.copy() : flexibility;
        if (!solver.setA(a)) {
            throw new SingularFlexibilityMatrixException(
                    "La factorización LU de la matriz de flexibilidad ha fallado.", f, delta, condition);
        }
        DMatrixRMaj rhs = new DMatrixRMaj(n, 1);
        for (int i = 0; i < n; i++) {
            rhs.set(i, 0, -delta[i]);
        }
        DMatrixRMaj solution = new DMatrixRMaj(n, 1);
        solver.solve(rhs, solution);

        double[] out = new double[n];
        for (int i = 0; i < n; i++) {
            out[i] = solution.get(i, 0);
        }
        return out;
    }

    /**
     * Flecha corregida en cada coordenada de sondeo de una viga biapoyada.
     */
    double[] deflectionsAt(Beam twoSupportBeam, double[] probes) {
        Map<String, Double> reactions = statics.solveReactions(twoSupportBeam);
        NodeSet nodes = nodeSetFactory.create(twoSupportBeam, reactions, probes);
        RawDiagram corrected = corrector.correct(twoSupportBeam, integrator.integrate(twoSupportBeam, nodes)).getDiagram();

        double[] out = new double[probes.length];
        for (int i = 0; i < probes.length; i++) {
            int k = nodes.indexOf(probes[i], config.getNodeMergeTolerance());
            out[i] = corrected.deflectionAtNode(k);
        }
        return out;
    }
}
