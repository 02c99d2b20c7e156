package beamanalyzer.config;

import lombok.Builder;
import lombok.Value;
import lombok.With;

/**
 * Parámetros numéricos de un análisis de viga.
 * Todos los valores tienen un defecto razonable para vigas de edificación en SI.
 */
@Value
@Builder
@With
public class AnalysisConfig {

    /**
     * Número aproximado de subpasos de cuadratura a lo largo de toda la viga.
     * Cada tramo entre nodos recibe una parte proporcional a su longitud.
     */
    @Builder.Default
    int targetSampleCount = 2400;

    /**
     * Mínimo de subpasos entre dos nodos consecutivos, por corto que sea el tramo.
     */
    @Builder.Default
    int minStepsPerSegment = 16;

    /**
     * Distancia [m] por debajo de la cual dos coordenadas significativas se funden en un solo nodo.
     */
    @Builder.Default
    double nodeMergeTolerance = 1e-9;

    /**
     * Residuo relativo (respecto al pico del diagrama) a partir del cual
     * una corrección de contorno se notifica como aviso.
     */
    @Builder.Default
    double correctionWarningRatio = 1e-3;

    /**
     * Número de condición máximo admitido para la matriz de flexibilidad.
     */
    @Builder.Default
    double maxConditionNumber = 1e12;

    /**
     * Tolerancia relativa en la comprobación ΣR = ΣF.
     */
    @Builder.Default
    double equilibriumTolerance = 1e-6;

    @Builder.Default
    int maxSupports = 64;

    @Builder.Default
    int maxLoads = 512;

    /**
     * Tamaño de la malla uniforme del integrador de respaldo.
     */
    @Builder.Default
    int fallbackSampleCount = 400;

    /**
     * Configuración por defecto.
     */
    public static AnalysisConfig defaults() {
        return AnalysisConfig.builder().build();
    }
}
