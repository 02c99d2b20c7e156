package beamanalyzer.domain.exception;

/**
 * Motivo por el que una viga, apoyo o carga no supera la validación estructural.
 */
public enum ValidationFailure {
    DUPLICATE_SUPPORT,
    OUT_OF_DOMAIN_LOAD,
    OUT_OF_DOMAIN_SUPPORT,
    INVALID_RANGE,
    NON_POSITIVE_PROPERTY,
    UNDERCONSTRAINED_SYSTEM,
    INSIGNIFICANT_MAGNITUDE,
    TOO_MANY_ELEMENTS
}
