package beamanalyzer.physics.impl;

import beamanalyzer.config.AnalysisConfig;
import beamanalyzer.domain.beam.Beam;
import beamanalyzer.domain.exception.BeamSolveException;
import beamanalyzer.domain.exception.SolveFailure;
import beamanalyzer.domain.load.Load;
import beamanalyzer.domain.node.Node;
import beamanalyzer.domain.node.NodeSet;
import beamanalyzer.physics.i.IDiagramIntegrator;
import beamanalyzer.physics.model.RawDiagram;
import beamanalyzer.physics.solver.CumulativeTrapezoid;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Locale;

/**
 * Integrador por tramos con saltos exactos en los nodos.
 * <p>
 * Recorre los nodos de izquierda a derecha. En cada nodo se registra el límite por
 * la izquierda, se aplican los saltos (reacciones y fuerzas en V, momentos en M) y,
 * si hubo salto, se registra una segunda muestra con el límite por la derecha.
 * Entre nodos se integra con la regla del trapecio sobre una submalla:
 * <ul>
 *   <li>dV/dx = -w</li>
 *   <li>dM/dx = V</li>
 *   <li>dθ/dx = M / EI</li>
 *   <li>dy/dx = θ</li>
 * </ul>
 * Se parte de V = M = θ = y = 0 en x = 0. Las constantes de integración de θ e y
 * no se resuelven aquí: las impone después {@link BoundaryCorrector}.
 */
@Slf4j
public class PiecewiseDiagramIntegrator implements IDiagramIntegrator {

    private final AnalysisConfig config;

    public PiecewiseDiagramIntegrator(AnalysisConfig config) {
        this.config = config;
    }

    @Override
    public String getName() {
        return "Trapecios por tramos";
    }

    @Override
    public String getDescription() {
        return "Regla del trapecio entre nodos con saltos exactos de cortante y momento en cada nodo.";
    }

    @Override
    public RawDiagram integrate(Beam beam, NodeSet nodes) {
        final double length = beam.getLength();
        final double ei = beam.flexuralRigidity();
        final List<Load> loads = beam.getLoads();
        final int nodeCount = nodes.size();

        // 1. Reserva exacta de muestras
        int[] steps = new int[nodeCount - 1];
        int total = 0;
        for (int k = 0; k < nodeCount; k++) {
            Node node = nodes.get(k);
            total += node.hasJump() ? 2 : 1;
            if (k < nodeCount - 1) {
                steps[k] = stepsFor(nodes.get(k + 1).position() - node.position(), length);
                total += steps[k] - 1;
            }
        }

        double[] x = new double[total];
        double[] v = new double[total];
        double[] m = new double[total];
        double[] theta = new double[total];
        double[] y = new double[total];
        int[] left = new int[nodeCount];
        int[] right = new int[nodeCount];

        // 2. Recorrido
        double vCur = 0.0;
        double mCur = 0.0;
        double thetaCur = 0.0;
        double yCur = 0.0;
        int idx = 0;

        for (int k = 0; k < nodeCount; k++) {
            Node node = nodes.get(k);
            double xn = node.position();

            left[k] = idx;
            x[idx] = xn;
            v[idx] = vCur;
            m[idx] = mCur;
            theta[idx] = thetaCur;
            y[idx] = yCur;
            idx++;

            if (node.hasJump()) {
                vCur += node.shearJump();
                mCur += node.momentJump();
                x[idx] = xn;
                v[idx] = vCur;
                m[idx] = mCur;
                theta[idx] = thetaCur;
                y[idx] = yCur;
                idx++;
            }
            right[k] = idx - 1;

            if (k == nodeCount - 1) {
                break;
            }

            // Tramo [xn, xNext]
            double xNext = nodes.get(k + 1).position();
            int n = steps[k];
            double h = (xNext - xn) / n;
            double xPrev = xn;
            double wPrev = intensity(loads, xn, xNext, xn);
            for (int j = 1; j <= n; j++) {
                double xj = (j == n) ? xNext : xn + j * h;
                double dx = xj - xPrev;
                double wj = intensity(loads, xn, xNext, xj);

                double vNext = vCur - CumulativeTrapezoid.step(wPrev, wj, dx);
                double mNext = mCur + CumulativeTrapezoid.step(vCur, vNext, dx);
                double thetaNext = thetaCur + CumulativeTrapezoid.step(mCur, mNext, dx) / ei;
                double yNext = yCur + CumulativeTrapezoid.step(thetaCur, thetaNext, dx);

                vCur = vNext;
                mCur = mNext;
                thetaCur = thetaNext;
                yCur = yNext;
                xPrev = xj;
                wPrev = wj;

                // El último subpaso es el límite izquierdo del nodo siguiente.
                if (j < n) {
                    x[idx] = xj;
                    v[idx] = vCur;
                    m[idx] = mCur;
                    theta[idx] = thetaCur;
                    y[idx] = yCur;
                    idx++;
                }
            }
        }

        requireFinite(v, "cortante");
        requireFinite(m, "momento");
        requireFinite(y, "flecha");

        log.trace("Integración por tramos: {} nodos, {} muestras.", nodeCount, total);

        return RawDiagram.builder()
                .x(x)
                .shear(v)
                .moment(m)
                .rotation(theta)
                .deflection(y)
                .nodes(nodes)
                .nodeLeftIndex(left)
                .nodeRightIndex(right)
                .build();
    }

    /**
     * Subpasos de un tramo: proporcionales a su longitud, nunca menos de {@code minStepsPerSegment}.
     */
    int stepsFor(double segmentLength, double beamLength) {
        int proportional = (int) Math.ceil(config.getTargetSampleCount() * segmentLength / beamLength);
        return Math.max(config.getMinStepsPerSegment(), proportional);
    }

    private static double intensity(List<Load> loads, double from, double to, double x) {
        double w = 0.0;
        for (Load load : loads) {
            w += load.segmentIntensity(from, to, x);
        }
        return w;
    }

    private static void requireFinite(double[] values, String what) {
        for (double value : values) {
            if (!Double.isFinite(value)) {
                throw new BeamSolveException(SolveFailure.NON_FINITE_RESULT,
                        String.format(Locale.ROOT, "La integración produjo valores no finitos en el diagrama de %s.", what));
            }
        }
    }
}
