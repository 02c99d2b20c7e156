package beamanalyzer.domain.diagram;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Magnitudes muestreadas en un {@link DiagramResult}.
 */
@Getter
@RequiredArgsConstructor
public enum DiagramQuantity {
    SHEAR("V", "N"),
    MOMENT("M", "N·m"),
    ROTATION("θ", "rad"),
    DEFLECTION("y", "m");

    private final String symbol;
    private final String unit;
}
