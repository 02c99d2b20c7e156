package beamanalyzer.domain.node;

/**
 * Sucesos que hacen estructuralmente significativa una coordenada de la viga.
 */
public enum NodeEvent {
    BEAM_END,
    SUPPORT,
    LOAD_SEGMENT_START,
    LOAD_SEGMENT_END,
    POINT_FORCE,
    POINT_MOMENT,
    /** Coordenada donde se necesita una muestra exacta aunque no haya salto (método de flexibilidad). */
    PROBE
}
