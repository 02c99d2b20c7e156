package beamanalyzer.domain.load;

import beamanalyzer.domain.exception.BeamValidationException;
import beamanalyzer.domain.exception.ValidationFailure;
import beamanalyzer.domain.node.NodeEvent;

import java.util.Locale;

/**
 * Carga repartida de variación lineal entre {@code start} y {@code end}.
 * Cubre los casos uniforme, triangular y trapezoidal.
 *
 * @param start          Inicio del tramo cargado [m].
 * @param end            Fin del tramo cargado [m], estrictamente mayor que {@code start}.
 * @param startIntensity Intensidad en el inicio [N/m], positiva hacia abajo.
 * @param endIntensity   Intensidad en el fin [N/m], positiva hacia abajo.
 *
 * @since 0.1
 */
public record DistributedLoad(double start, double end, double startIntensity, double endIntensity) implements Load {

    public DistributedLoad {
        if (!Double.isFinite(start) || !Double.isFinite(end) || start < 0.0) {
            throw new BeamValidationException(ValidationFailure.OUT_OF_DOMAIN_LOAD,
                    String.format(Locale.ROOT, "El tramo [%s, %s] de la carga repartida debe ser finito y no negativo.", start, end));
        }
        if (start >= end) {
            throw new BeamValidationException(ValidationFailure.INVALID_RANGE,
                    String.format(Locale.ROOT, "El inicio de la carga repartida (%.6f m) debe ser menor que el fin (%.6f m).", start, end));
        }
        if (!Double.isFinite(startIntensity) || !Double.isFinite(endIntensity)) {
            throw new BeamValidationException(ValidationFailure.INSIGNIFICANT_MAGNITUDE,
                    "Las intensidades de la carga repartida deben ser finitas.");
        }
        if (Math.abs(startIntensity) < PointForce.MIN_MAGNITUDE && Math.abs(endIntensity) < PointForce.MIN_MAGNITUDE) {
            throw new BeamValidationException(ValidationFailure.INSIGNIFICANT_MAGNITUDE,
                    String.format(Locale.ROOT, "La carga repartida en [%.3f, %.3f] m tiene intensidad nula.", start, end));
        }
    }

    /**
     * Carga uniforme de intensidad {@code intensity} sobre [start, end].
     */
    public static DistributedLoad uniform(double start, double end, double intensity) {
        return new DistributedLoad(start, end, intensity, intensity);
    }

    /**
     * Carga triangular: uno de los extremos debe ser exactamente cero.
     */
    public static DistributedLoad triangular(double start, double end, double startIntensity, double endIntensity) {
        if (startIntensity != 0.0 && endIntensity != 0.0) {
            throw new BeamValidationException(ValidationFailure.INVALID_RANGE,
                    String.format(Locale.ROOT, "Una carga triangular necesita intensidad nula en un extremo (w1=%.3f, w2=%.3f).",
                            startIntensity, endIntensity));
        }
        return new DistributedLoad(start, end, startIntensity, endIntensity);
    }

    public static DistributedLoad trapezoidal(double start, double end, double startIntensity, double endIntensity) {
        return new DistributedLoad(start, end, startIntensity, endIntensity);
    }

    public double length() {
        return end - start;
    }

    /** Pendiente dw/dx de la intensidad. */
    public double slope() {
        return (endIntensity - startIntensity) / (end - start);
    }

    @Override
    public double totalForce() {
        return 0.5 * (startIntensity + endIntensity) * length();
    }

    /**
     * Posición absoluta del centroide de la carga. Para una resultante nula
     * (intensidades opuestas) el centroide no está definido y se devuelve el punto medio.
     */
    public double centroid() {
        double sum = startIntensity + endIntensity;
        if (Math.abs(sum) < PointForce.MIN_MAGNITUDE) {
            return 0.5 * (start + end);
        }
        return start + length() * (startIntensity + 2.0 * endIntensity) / (3.0 * sum);
    }

    /**
     * Integral exacta de w(x)·(x - origin) sobre el tramo; sigue siendo correcta
     * cuando la resultante es nula pero el par no.
     */
    @Override
    public double momentAbout(double origin) {
        double l = length();
        double offset = start - origin;
        double k = slope();
        return startIntensity * (l * l / 2.0 + offset * l)
                + k * (l * l * l / 3.0 + offset * l * l / 2.0);
    }

    @Override
    public double intensityAt(double x) {
        if (x < start || x >= end) {
            return 0.0;
        }
        return startIntensity + slope() * (x - start);
    }

    @Override
    public double segmentIntensity(double from, double to, double x) {
        double mid = 0.5 * (from + to);
        if (mid < start || mid > end) {
            return 0.0;
        }
        return startIntensity + slope() * (x - start);
    }

    @Override
    public double[] breakpoints() {
        return new double[]{start, end};
    }

    @Override
    public NodeEvent eventAt(double breakpoint) {
        return breakpoint == start ? NodeEvent.LOAD_SEGMENT_START : NodeEvent.LOAD_SEGMENT_END;
    }

    @Override
    public String describe() {
        if (startIntensity == endIntensity) {
            return String.format(Locale.ROOT, "Carga uniforme w=%.2f N/m en [%.3f, %.3f] m", startIntensity, start, end);
        }
        String kind = (startIntensity == 0.0 || endIntensity == 0.0) ? "triangular" : "trapezoidal";
        return String.format(Locale.ROOT, "Carga %s w1=%.2f, w2=%.2f N/m en [%.3f, %.3f] m",
                kind, startIntensity, endIntensity, start, end);
    }
}
