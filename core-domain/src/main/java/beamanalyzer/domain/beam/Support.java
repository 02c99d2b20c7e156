package beamanalyzer.domain.beam;

import beamanalyzer.domain.exception.BeamValidationException;
import beamanalyzer.domain.exception.ValidationFailure;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Locale;

/**
 * Apoyo simple (rodillo): una reacción vertical, sin restricción al giro.
 *
 * @param name     Nombre único del apoyo; si se deja vacío se genera como {@code R_<x>}.
 * @param position Coordenada del apoyo [m].
 */
public record Support(String name, double position) {

    @JsonCreator
    public Support(@JsonProperty("name") String name, @JsonProperty("position") double position) {
        if (!Double.isFinite(position) || position < 0.0) {
            throw new BeamValidationException(ValidationFailure.OUT_OF_DOMAIN_SUPPORT,
                    String.format(Locale.ROOT, "La posición del apoyo (%s m) debe ser finita y no negativa.", position));
        }
        this.name = (name == null || name.isBlank()) ? defaultName(position) : name;
        this.position = position;
    }

    /**
     * Apoyo con nombre generado a partir de su posición.
     */
    public static Support at(double position) {
        return new Support(null, position);
    }

    static String defaultName(double position) {
        return String.format(Locale.ROOT, "R_%.2f", position);
    }
}
