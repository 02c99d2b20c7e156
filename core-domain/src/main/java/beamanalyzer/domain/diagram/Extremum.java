package beamanalyzer.domain.diagram;

/**
 * Valor de mayor módulo de un diagrama y su posición.
 */
public record Extremum(DiagramQuantity quantity, double position, double value) {

    public double magnitude() {
        return Math.abs(value);
    }
}
