package beamanalyzer.domain.diagram;

import beamanalyzer.domain.beam.SystemClassification;
import lombok.Builder;
import lombok.Getter;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Diagramas muestreados de una viga y sus reacciones.
 * <p>
 * Las abscisas {@code x} son no decrecientes. Una coordenada con salto en cortante o
 * momento aparece dos veces seguidas: primero el límite por la izquierda y después
 * el límite por la derecha. Los cuatro arrays de valores son paralelos a {@code x}.
 * <p>
 * Los arrays se exponen sin copia para no duplicar memoria en mallas densas; el
 * llamante es el propietario del resultado y no debe modificarlos.
 */
@Getter
public class DiagramResult {

    private final double[] x;
    private final double[] shear;
    private final double[] moment;
    private final double[] rotation;
    private final double[] deflection;

    /** Reacciones por nombre de apoyo, en el orden de los apoyos (positivas hacia arriba). */
    private final Map<String, Double> reactions;
    private final SystemClassification classification;
    private final List<NumericalWarning> warnings;
    private final boolean fallbackUsed;
    private final List<NodeSample> nodeSamples;

    @Builder
    private DiagramResult(double[] x, double[] shear, double[] moment, double[] rotation, double[] deflection,
                          Map<String, Double> reactions, SystemClassification classification,
                          List<NumericalWarning> warnings, boolean fallbackUsed, List<NodeSample> nodeSamples) {
        Objects.requireNonNull(x, "El array de abscisas no puede ser nulo.");
        Objects.requireNonNull(shear, "El array de cortantes no puede ser nulo.");
        Objects.requireNonNull(moment, "El array de momentos no puede ser nulo.");
        Objects.requireNonNull(rotation, "El array de giros no puede ser nulo.");
        Objects.requireNonNull(deflection, "El array de flechas no puede ser nulo.");
        int n = x.length;
        if (n == 0 || shear.length != n || moment.length != n || rotation.length != n || deflection.length != n) {
            throw new IllegalArgumentException("Todos los arrays del diagrama deben tener la misma longitud no nula.");
        }
        this.x = x;
        this.shear = shear;
        this.moment = moment;
        this.rotation = rotation;
        this.deflection = deflection;
        this.reactions = Collections.unmodifiableMap(new LinkedHashMap<>(reactions == null ? Map.of() : reactions));
        this.classification = classification;
        this.warnings = warnings == null ? List.of() : List.copyOf(warnings);
        this.fallbackUsed = fallbackUsed;
        this.nodeSamples = nodeSamples == null ? List.of() : List.copyOf(nodeSamples);
    }

    public int sampleCount() {
        return x.length;
    }

    public double[] values(DiagramQuantity quantity) {
        switch (quantity) {
            case SHEAR:
                return shear;
            case MOMENT:
                return moment;
            case ROTATION:
                return rotation;
            case DEFLECTION:
                return deflection;
            default:
                throw new IllegalArgumentException("Magnitud desconocida: " + quantity);
        }
    }

    /**
     * Valor de una magnitud en {@code position} por interpolación lineal. En una
     * coordenada con salto devuelve el límite por la derecha; fuera del dominio,
     * el valor del extremo más cercano.
     */
    public double valueAt(DiagramQuantity quantity, double position) {
        double[] v = values(quantity);
        int n = x.length;
        if (position <= x[0]) {
            // Justo en x[0] se toma la última repetición (límite por la derecha).
            int i = 0;
            while (i + 1 < n && x[i + 1] == x[0] && position == x[0]) {
                i++;
            }
            return v[i];
        }
        if (position >= x[n - 1]) {
            return v[n - 1];
        }
        int i = lastIndexAtOrBefore(position);
        if (x[i] == position) {
            return v[i];
        }
        double t = (position - x[i]) / (x[i + 1] - x[i]);
        return v[i] + t * (v[i + 1] - v[i]);
    }

    /**
     * Muestra de mayor valor absoluto de una magnitud.
     */
    public Extremum maximum(DiagramQuantity quantity) {
        double[] v = values(quantity);
        int best = 0;
        for (int i = 1; i < v.length; i++) {
            if (Math.abs(v[i]) > Math.abs(v[best])) {
                best = i;
            }
        }
        return new Extremum(quantity, x[best], v[best]);
    }

    public double totalReaction() {
        double total = 0.0;
        for (double r : reactions.values()) {
            total += r;
        }
        return total;
    }

    public double reaction(String supportName) {
        Double r = reactions.get(supportName);
        if (r == null) {
            throw new IllegalArgumentException("No existe ningún apoyo llamado " + supportName);
        }
        return r;
    }

    public boolean hasWarning(WarningType type) {
        return warnings.stream().anyMatch(w -> w.type() == type);
    }

    // Último índice i con x[i] <= position; requiere x[0] < position < x[n-1].
    private int lastIndexAtOrBefore(double position) {
        int lo = 0;
        int hi = x.length - 1;
        while (hi - lo > 1) {
            int mid = (lo + hi) >>> 1;
            if (x[mid] <= position) {
                lo = mid;
            } else {
                hi = mid;
            }
        }
        return lo;
    }
}
