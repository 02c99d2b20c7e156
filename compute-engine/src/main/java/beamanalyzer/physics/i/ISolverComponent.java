package beamanalyzer.physics.i;

/**
 * Pieza del cálculo de una viga (reacciones, integración, corrección o respaldo).
 * El motor solo la identifica por su nombre en las trazas.
 */
public interface ISolverComponent {

    /** Nombre corto, p. ej. "Flexibilidad". */
    String getName();

    default String getDescription() {
        return "";
    }

    /**
     * Etiqueta para trazas: el nombre y, si existe, la descripción entre corchetes.
     */
    default String traceLabel() {
        String description = getDescription();
        if (description == null || description.isBlank()) {
            return getName();
        }
        return getName() + " [" + description + "]";
    }
}
