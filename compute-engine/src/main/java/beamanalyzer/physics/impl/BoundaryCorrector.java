package beamanalyzer.physics.impl;

import beamanalyzer.config.AnalysisConfig;
import beamanalyzer.domain.beam.Beam;
import beamanalyzer.domain.beam.Support;
import beamanalyzer.domain.diagram.NumericalWarning;
import beamanalyzer.domain.diagram.WarningType;
import beamanalyzer.domain.node.NodeSet;
import beamanalyzer.physics.i.ISolverComponent;
import beamanalyzer.physics.model.RawDiagram;
import beamanalyzer.physics.solver.CumulativeTrapezoid;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Impone las condiciones de contorno sobre la salida del integrador.
 *
 * <p><b>Momento.</b> M es nulo a la izquierda de x = 0 por construcción y debe serlo
 * a la derecha de x = L. El residuo final se reparte linealmente en x y se resta de
 * todo el diagrama. Después θ e y se vuelven a integrar a partir del M corregido.</p>
 *
 * <p><b>Flecha.</b> y debe ser exactamente cero en todos los apoyos. Primero se resta
 * la recta que pasa por los apoyos extremos (esa pendiente es la constante de integración
 * de θ y se aplica también al giro). Con más de dos apoyos queda un residuo de
 * cuadratura en los apoyos intermedios, que se elimina con una corrección lineal a
 * trozos anclada en todos los apoyos. Por último se fijan a 0.0 las muestras de los apoyos.</p>
 */
@Slf4j
public class BoundaryCorrector implements ISolverComponent {

    private final AnalysisConfig config;

    public BoundaryCorrector(AnalysisConfig config) {
        this.config = config;
    }

    @Override
    public String getName() {
        return "Corrección de contorno";
    }

    public Result correct(Beam beam, RawDiagram raw) {
        double[] x = raw.getX();
        int n = x.length;
        double length = beam.getLength();
        double ei = beam.flexuralRigidity();
        List<NumericalWarning> warnings = new ArrayList<>();

        // 1. Momento: anclado en los extremos de la viga
        double[] moment = raw.getMoment().clone();
        double momentResidual = moment[n - 1];
        // x[n-1] == L, así que la última muestra queda exactamente a cero.
        for (int i = 0; i < n; i++) {
            moment[i] -= momentResidual * (x[i] / length);
        }

        double momentPeak = peak(moment);
        if (exceeds(momentResidual, momentPeak)) {
            warnings.add(new NumericalWarning(WarningType.MOMENT_CORRECTION_EXCEEDED, String.format(Locale.ROOT,
                    "Residuo de momento en x=L de %.3e N·m (pico %.3e N·m).", momentResidual, momentPeak)));
        }

        // 2. Giro y flecha desde el M corregido
        double[] rotation = CumulativeTrapezoid.integrateScaled(moment, x, ei, 0.0);
        double[] deflection = CumulativeTrapezoid.integrate(rotation, x, 0.0);

        // 3. Flecha: recta por los apoyos extremos
        int[] supportIdx = supportSampleIndices(beam, raw);
        int first = supportIdx[0];
        int last = supportIdx[supportIdx.length - 1];
        double x0 = x[first];
        double y0 = deflection[first];
        double slope = (deflection[last] - y0) / (x[last] - x0);
        for (int i = 0; i < n; i++) {
            deflection[i] -= y0 + slope * (x[i] - x0);
            rotation[i] -= slope;
        }

        // 4. Residuo en apoyos intermedios: lineal a trozos entre apoyos consecutivos
        double deflectionResidual = 0.0;
        if (supportIdx.length > 2) {
            double[] residual = new double[supportIdx.length];
            for (int s = 1; s < supportIdx.length - 1; s++) {
                residual[s] = deflection[supportIdx[s]];
                deflectionResidual = Math.max(deflectionResidual, Math.abs(residual[s]));
            }
            int s = 0;
            for (int i = 0; i < n; i++) {
                if (x[i] <= x[first] || x[i] >= x[last]) {
                    continue;
                }
                while (x[supportIdx[s + 1]] < x[i]) {
                    s++;
                }
                double xa = x[supportIdx[s]];
                double xb = x[supportIdx[s + 1]];
                double t = (x[i] - xa) / (xb - xa);
                deflection[i] -= residual[s] + t * (residual[s + 1] - residual[s]);
            }
        }
        for (int k = 0; k < supportIdx.length; k++) {
            zeroAtNode(deflection, x, supportIdx[k]);
        }

        double deflectionPeak = peak(deflection);
        if (exceeds(deflectionResidual, deflectionPeak)) {
            warnings.add(new NumericalWarning(WarningType.DEFLECTION_CORRECTION_EXCEEDED, String.format(Locale.ROOT,
                    "Residuo de flecha en apoyos intermedios de %.3e m (pico %.3e m).", deflectionResidual, deflectionPeak)));
        }

        log.trace("Corrección de contorno: residuo M={}, residuo y={}, pendiente={}.",
                momentResidual, deflectionResidual, slope);

        RawDiagram corrected = raw.withMoment(moment).withRotation(rotation).withDeflection(deflection);
        return new Result(corrected, warnings, momentResidual, deflectionResidual);
    }

    private boolean exceeds(double residual, double peak) {
        double magnitude = Math.abs(residual);
        return magnitude > 1e-12 && magnitude > config.getCorrectionWarningRatio() * peak;
    }

    // Índice de la muestra izquierda del nodo de cada apoyo, en orden de posición.
    private int[] supportSampleIndices(Beam beam, RawDiagram raw) {
        NodeSet nodes = raw.getNodes();
        List<Support> supports = beam.getSupports();
        int[] out = new int[supports.size()];
        for (int s = 0; s < supports.size(); s++) {
            int k = nodes.indexOf(supports.get(s).position(), config.getNodeMergeTolerance());
            if (k < 0) {
                throw new IllegalStateException("El apoyo " + supports.get(s).name() + " no tiene nodo asociado.");
            }
            out[s] = raw.getNodeLeftIndex()[k];
        }
        return out;
    }

    // Pone a cero todas las muestras que comparten la abscisa de index.
    private static void zeroAtNode(double[] values, double[] x, int index) {
        int i = index;
        while (i < x.length && x[i] == x[index]) {
            values[i] = 0.0;
            i++;
        }
    }

    private static double peak(double[] values) {
        double max = 0.0;
        for (double v : values) {
            max = Math.max(max, Math.abs(v));
        }
        return max;
    }

    /**
     * Diagrama corregido y residuos eliminados.
     */
    @Value
    public static class Result {
        RawDiagram diagram;
        List<NumericalWarning> warnings;
        double momentResidual;
        double deflectionResidual;
    }
}
