package beamanalyzer.domain.load;

import beamanalyzer.domain.exception.BeamValidationException;
import beamanalyzer.domain.exception.ValidationFailure;
import beamanalyzer.domain.node.NodeEvent;

import java.util.Locale;

/**
 * Momento concentrado. Vector libre: no altera la resultante vertical,
 * solo el equilibrio de momentos y el diagrama de flectores.
 *
 * @param position  Coordenada de aplicación [m].
 * @param magnitude Módulo [N·m], positivo antihorario.
 */
public record PointMoment(double position, double magnitude) implements Load {

    public PointMoment {
        if (!Double.isFinite(position) || position < 0.0) {
            throw new BeamValidationException(ValidationFailure.OUT_OF_DOMAIN_LOAD,
                    String.format(Locale.ROOT, "La posición del momento puntual (%.6f m) debe ser finita y no negativa.", position));
        }
        if (!Double.isFinite(magnitude) || Math.abs(magnitude) < PointForce.MIN_MAGNITUDE) {
            throw new BeamValidationException(ValidationFailure.INSIGNIFICANT_MAGNITUDE,
                    String.format(Locale.ROOT, "La magnitud del momento en x=%.3f m no es significativa: %s", position, magnitude));
        }
    }

    @Override
    public double totalForce() {
        return 0.0;
    }

    @Override
    public double momentAbout(double origin) {
        return magnitude;
    }

    @Override
    public double momentJump() {
        return magnitude;
    }

    @Override
    public double[] breakpoints() {
        return new double[]{position};
    }

    @Override
    public NodeEvent eventAt(double breakpoint) {
        return NodeEvent.POINT_MOMENT;
    }

    @Override
    public String describe() {
        return String.format(Locale.ROOT, "Momento M=%.2f N·m en x=%.3f m", magnitude, position);
    }
}
