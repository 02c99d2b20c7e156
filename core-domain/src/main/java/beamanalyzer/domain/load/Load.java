package beamanalyzer.domain.load;

import beamanalyzer.domain.node.NodeEvent;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * Carga aplicada sobre la viga. Conjunto cerrado de variantes con una
 * interfaz uniforme, de modo que el integrador no necesita conocer el tipo concreto.
 *
 * <p>Convenios de signo: fuerzas hacia abajo positivas, momentos antihorarios positivos.
 * Un momento puntual M0 incrementa el diagrama de momentos en +M0.</p>
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = PointForce.class, name = "pointForce"),
        @JsonSubTypes.Type(value = PointMoment.class, name = "pointMoment"),
        @JsonSubTypes.Type(value = DistributedLoad.class, name = "distributed")
})
public interface Load {

    /**
     * Resultante vertical de la carga (positiva hacia abajo).
     */
    double totalForce();

    /**
     * Momento de la carga respecto a {@code origin}, en el mismo convenio que el
     * diagrama de momentos: una fuerza P en x aporta P·(x - origin) y un momento puntual aporta M0.
     */
    double momentAbout(double origin);

    /**
     * Intensidad de carga repartida en {@code x}, con rango semiabierto [inicio, fin).
     */
    default double intensityAt(double x) {
        return 0.0;
    }

    /**
     * Intensidad dentro del tramo [from, to] entre dos nodos. Devuelve cero salvo que
     * el tramo completo esté cubierto por la carga, lo que evita asignar a un tramo la
     * intensidad de una carga que empieza o termina justo en su extremo.
     */
    default double segmentIntensity(double from, double to, double x) {
        return 0.0;
    }

    /** Salto que la carga provoca en el cortante en su posición. */
    default double shearJump() {
        return 0.0;
    }

    /** Salto que la carga provoca en el momento flector en su posición. */
    default double momentJump() {
        return 0.0;
    }

    /**
     * Coordenadas donde la carga introduce un nodo.
     */
    double[] breakpoints();

    /**
     * Suceso asociado a uno de los {@link #breakpoints()}.
     */
    NodeEvent eventAt(double breakpoint);

    /**
     * Indica si todas las coordenadas de la carga caen en [0, length].
     */
    default boolean within(double length) {
        for (double x : breakpoints()) {
            if (x < 0.0 || x > length) {
                return false;
            }
        }
        return true;
    }

    /**
     * Descripción legible de la carga.
     */
    String describe();
}
