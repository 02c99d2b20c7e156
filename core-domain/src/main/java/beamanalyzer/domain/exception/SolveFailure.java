package beamanalyzer.domain.exception;

public enum SolveFailure {
    /** Matriz de flexibilidad singular o mal condicionada. */
    SINGULAR_FLEXIBILITY_MATRIX,
    /** Aparecen NaN o infinitos en las reacciones o en los diagramas. */
    NON_FINITE_RESULT
}
