package beamanalyzer.domain.exception;

import lombok.Getter;

/**
 * Fallo de origen numérico durante la resolución. El motor de diagramas lo
 * captura y recurre al integrador de respaldo.
 */
@Getter
public class BeamSolveException extends RuntimeException {

    private final SolveFailure failure;

    public BeamSolveException(SolveFailure failure, String message) {
        super(message);
        this.failure = failure;
    }

    public BeamSolveException(SolveFailure failure, String message, Throwable cause) {
        super(message, cause);
        this.failure = failure;
    }
}
