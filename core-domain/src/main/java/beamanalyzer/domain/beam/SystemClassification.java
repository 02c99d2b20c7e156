package beamanalyzer.domain.beam;

/**
 * Clasificación estática de la viga según su número de apoyos simples.
 */
public enum SystemClassification {
    /** Menos de dos apoyos: mecanismo, no resoluble. */
    UNDERCONSTRAINED,
    /** Exactamente dos apoyos: isostática. */
    DETERMINATE,
    /** Tres o más apoyos: hiperestática. */
    INDETERMINATE;

    public static SystemClassification ofSupportCount(int supportCount) {
        if (supportCount < 2) {
            return UNDERCONSTRAINED;
        }
        return supportCount == 2 ? DETERMINATE : INDETERMINATE;
    }
}
