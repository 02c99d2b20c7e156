package beamanalyzer.domain.diagram;

public enum WarningType {
    /** El residuo de M en los extremos superó el umbral relativo. */
    MOMENT_CORRECTION_EXCEEDED,
    /** El residuo de y en algún apoyo intermedio superó el umbral relativo. */
    DEFLECTION_CORRECTION_EXCEEDED,
    /** El resultado procede del integrador de respaldo. */
    FALLBACK_ENGAGED,
    NO_LOADS,
    /** ΣR difiere de ΣF más de lo tolerado. */
    EQUILIBRIUM_RESIDUAL
}
