package beamanalyzer.physics.impl;

import beamanalyzer.config.AnalysisConfig;
import beamanalyzer.domain.beam.Beam;
import beamanalyzer.domain.beam.Support;
import beamanalyzer.domain.beam.SystemClassification;
import beamanalyzer.domain.diagram.DiagramResult;
import beamanalyzer.domain.diagram.NumericalWarning;
import beamanalyzer.domain.diagram.WarningType;
import beamanalyzer.domain.exception.BeamSolveException;
import beamanalyzer.domain.exception.SingularFlexibilityMatrixException;
import beamanalyzer.domain.load.Load;
import beamanalyzer.physics.i.ISolverComponent;
import beamanalyzer.physics.solver.CumulativeTrapezoid;
import lombok.extern.slf4j.Slf4j;
import org.ejml.data.DMatrixRMaj;
import org.ejml.dense.row.factory.LinearSolverFactory_DDRM;
import org.ejml.interfaces.linsol.LinearSolverDense;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Integración continua de respaldo sobre una malla uniforme, sin tratamiento
 * explícito de nodos. Solo se usa cuando la vía principal falla numéricamente.
 * <p>
 * Los saltos se modelan con escalones de Heaviside (H(0) = ½), por lo que pierden
 * nitidez en la malla. Solo se fuerza y = 0 en el último apoyo. La integración parte
 * de y = 0 en x = 0, de modo que ese extremo también queda a cero aunque sea un
 * voladizo sin apoyo; el primer apoyo no se ancla. El resultado lleva siempre el aviso
 * {@link WarningType#FALLBACK_ENGAGED}.
 * <p>
 * Reacciones: equilibrio estático si hay dos apoyos; con una matriz de flexibilidad
 * singular, la solución de norma mínima (pseudoinversa por SVD); en cualquier otro
 * caso, las reacciones de la estructura primaria con los redundantes a cero.
 */
@Slf4j
public class ContinuousFallbackIntegrator implements ISolverComponent {

    private final AnalysisConfig config;
    private final StaticEquilibriumReactionSolver statics;

    public ContinuousFallbackIntegrator(AnalysisConfig config, StaticEquilibriumReactionSolver statics) {
        this.config = config;
        this.statics = statics;
    }

    @Override
    public String getName() {
        return "Integración continua de respaldo";
    }

    public DiagramResult integrate(Beam beam, BeamSolveException cause) {
        log.debug("Integrador de respaldo activado: {}", cause.getMessage());

        Map<String, Double> reactions = fallbackReactions(beam, cause);
        int n = Math.max(2, config.getFallbackSampleCount());
        double length = beam.getLength();
        double ei = beam.flexuralRigidity();

        double[] x = new double[n];
        double[] w = new double[n];
        for (int i = 0; i < n; i++) {
            x[i] = (i == n - 1) ? length : length * i / (n - 1);
            // La última muestra toma el límite por la izquierda para incluir cargas que acaban en L.
            double probe = (i == n - 1) ? Math.nextDown(length) : x[i];
            for (Load load : beam.getLoads()) {
                w[i] += load.intensityAt(probe);
            }
        }

        double[] distributed = CumulativeTrapezoid.integrate(w, x, 0.0);
        double[] shear = new double[n];
        for (int i = 0; i < n; i++) {
            double v = -distributed[i];
            for (Support support : beam.getSupports()) {
                v += reactions.get(support.name()) * heaviside(x[i] - support.position());
            }
            for (Load load : beam.getLoads()) {
                if (load.shearJump() != 0.0) {
                    v += load.shearJump() * heaviside(x[i] - load.breakpoints()[0]);
                }
            }
            shear[i] = v;
        }

        double[] moment = CumulativeTrapezoid.integrate(shear, x, 0.0);
        for (Load load : beam.getLoads()) {
            if (load.momentJump() != 0.0) {
                for (int i = 0; i < n; i++) {
                    moment[i] += load.momentJump() * heaviside(x[i] - load.breakpoints()[0]);
                }
            }
        }

        double[] rotation = CumulativeTrapezoid.integrateScaled(moment, x, ei, 0.0);
        double[] deflection = CumulativeTrapezoid.integrate(rotation, x, 0.0);

        int anchor = nearestIndex(x, beam.lastSupport().position());
        if (x[anchor] > 0.0) {
            double slope = deflection[anchor] / x[anchor];
            for (int i = 0; i < n; i++) {
                deflection[i] -= slope * x[i];
                rotation[i] -= slope;
            }
            deflection[anchor] = 0.0;
        }

        List<NumericalWarning> warnings = new ArrayList<>();
        warnings.add(new NumericalWarning(WarningType.FALLBACK_ENGAGED, String.format(Locale.ROOT,
                "Se usó la integración continua de respaldo (%s): %s", cause.getFailure(), cause.getMessage())));

        return DiagramResult.builder()
                .x(x)
                .shear(shear)
                .moment(moment)
                .rotation(rotation)
                .deflection(deflection)
                .reactions(reactions)
                .classification(beam.classify())
                .warnings(warnings)
                .fallbackUsed(true)
                .nodeSamples(List.of())
                .build();
    }

    /**
     * Reacciones usadas por la vía de respaldo, en el orden de los apoyos.
     */
    Map<String, Double> fallbackReactions(Beam beam, BeamSolveException cause) {
        if (beam.classify() == SystemClassification.DETERMINATE) {
            return statics.solveReactions(beam);
        }
        List<Support> supports = beam.getSupports();
        Support left = supports.get(0);
        Support right = supports.get(supports.size() - 1);
        int redundantCount = supports.size() - 2;

        double[] redundant = new double[redundantCount];
        if (cause instanceof SingularFlexibilityMatrixException) {
            SingularFlexibilityMatrixException singular = (SingularFlexibilityMatrixException) cause;
            double[] candidate = minimumNormSolution(singular.getFlexibility(), singular.getLoadDeflections());
            if (candidate.length == redundantCount && allFinite(candidate)) {
                redundant = candidate;
            }
        }

        double[] extremes = statics.solve(left.position(), right.position(), beam.getLoads());
        for (int j = 0; j < redundantCount; j++) {
            double[] induced = statics.solveForPointForce(left.position(), right.position(),
                    supports.get(j + 1).position(), -redundant[j]);
            extremes[0] += induced[0];
            extremes[1] += induced[1];
        }

        Map<String, Double> reactions = new LinkedHashMap<>();
        reactions.put(left.name(), extremes[0]);
        for (int j = 0; j < redundantCount; j++) {
            reactions.put(supports.get(j + 1).name(), redundant[j]);
        }
        reactions.put(right.name(), extremes[1]);
        return reactions;
    }

    /**
     * R = pinv(f)·(-δ): solución de mínimos cuadrados y norma mínima.
     */
    static double[] minimumNormSolution(double[][] f, double[] delta) {
        int n = delta.length;
        LinearSolverDense<DMatrixRMaj> solver = LinearSolverFactory_DDRM.pseudoInverse(true);
        if (!solver.setA(new DMatrixRMaj(f))) {
            return new double[n];
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

    private static double heaviside(double z) {
        if (z > 0.0) {
            return 1.0;
        }
        return z == 0.0 ? 0.5 : 0.0;
    }

    private static int nearestIndex(double[] x, double position) {
        int best = 0;
        for (int i = 1; i < x.length; i++) {
            if (Math.abs(x[i] - position) < Math.abs(x[best] - position)) {
                best = i;
            }
        }
        return best;
    }

    private static boolean allFinite(double[] values) {
        for (double v : values) {
            if (!Double.isFinite(v)) {
                return false;
            }
        }
        return true;
    }
}
