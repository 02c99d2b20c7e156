package beamanalyzer.domain.exception;

import lombok.Getter;

/**
 * Error estructural de entrada. Se lanza antes de cualquier cálculo:
 * nunca se resuelve una viga parcial o inconsistente.
 */
@Getter
public class BeamValidationException extends IllegalArgumentException {

    private final ValidationFailure failure;

    public BeamValidationException(ValidationFailure failure, String message) {
        super(message);
        this.failure = failure;
    }
}
