package beamanalyzer.domain.load;

import beamanalyzer.domain.exception.BeamValidationException;
import beamanalyzer.domain.exception.ValidationFailure;
import beamanalyzer.domain.node.NodeEvent;

import java.util.Locale;

/**
 * Fuerza puntual vertical.
 *
 * @param position  Coordenada de aplicación [m].
 * @param magnitude Módulo [N], positivo hacia abajo.
 */
public record PointForce(double position, double magnitude) implements Load {

    /** Por debajo de este módulo la carga se considera nula y se rechaza. */
    public static final double MIN_MAGNITUDE = 1e-12;

    public PointForce {
        if (!Double.isFinite(position) || position < 0.0) {
            throw new BeamValidationException(ValidationFailure.OUT_OF_DOMAIN_LOAD,
                    String.format(Locale.ROOT, "La posición de la carga puntual (%.6f m) debe ser finita y no negativa.", position));
        }
        if (!Double.isFinite(magnitude) || Math.abs(magnitude) < MIN_MAGNITUDE) {
            throw new BeamValidationException(ValidationFailure.INSIGNIFICANT_MAGNITUDE,
                    String.format(Locale.ROOT, "La magnitud de la carga puntual en x=%.3f m no es significativa: %s", position, magnitude));
        }
    }

    @Override
    public double totalForce() {
        return magnitude;
    }

    @Override
    public double momentAbout(double origin) {
        return magnitude * (position - origin);
    }

    @Override
    public double shearJump() {
        return -magnitude;
    }

    @Override
    public double[] breakpoints() {
        return new double[]{position};
    }

    @Override
    public NodeEvent eventAt(double breakpoint) {
        return NodeEvent.POINT_FORCE;
    }

    @Override
    public String describe() {
        return String.format(Locale.ROOT, "Carga puntual P=%.2f N en x=%.3f m", magnitude, position);
    }
}
