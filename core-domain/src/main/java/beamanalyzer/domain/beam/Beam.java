package beamanalyzer.domain.beam;

import beamanalyzer.domain.exception.BeamValidationException;
import beamanalyzer.domain.exception.ValidationFailure;
import beamanalyzer.domain.load.Load;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Getter;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Viga prismática Euler-Bernoulli: longitud, rigidez, apoyos simples y cargas.
 * <p>
 * Es inmutable: cada modificación devuelve una nueva instancia validada. Las
 * reglas estructurales se comprueban en cada construcción y de nuevo en
 * {@link #validateForSolve()} antes de cualquier cálculo.
 * <p>
 * Los apoyos se mantienen ordenados por posición; las cargas, en orden de inserción.
 *
 * @since 0.1
 */
@Getter
public class Beam {

    /** Separación mínima vinculante entre dos apoyos [m]. */
    public static final double SUPPORT_MIN_SEPARATION = 1e-3;

    private final double length;
    private final double elasticModulus;
    private final double inertia;
    private final List<Support> supports;
    private final List<Load> loads;

    @JsonCreator
    public Beam(
            @JsonProperty("length") double length,
            @JsonProperty("elasticModulus") double elasticModulus,
            @JsonProperty("inertia") double inertia,
            @JsonProperty("supports") List<Support> supports,
            @JsonProperty("loads") List<Load> loads) {

        requirePositive(length, "La longitud");
        requirePositive(elasticModulus, "El módulo elástico");
        requirePositive(inertia, "La inercia");

        List<Support> sorted = new ArrayList<>(supports == null ? List.of() : supports);
        sorted.forEach(s -> Objects.requireNonNull(s, "La lista de apoyos no puede contener nulos."));
        sorted.sort(Comparator.comparingDouble(Support::position));
        List<Load> loadList = new ArrayList<>(loads == null ? List.of() : loads);
        loadList.forEach(l -> Objects.requireNonNull(l, "La lista de cargas no puede contener nulos."));

        validateSupports(length, sorted);
        for (Load load : loadList) {
            validateLoad(length, load);
        }

        this.length = length;
        this.elasticModulus = elasticModulus;
        this.inertia = inertia;
        this.supports = Collections.unmodifiableList(sorted);
        this.loads = Collections.unmodifiableList(loadList);
    }

    /**
     * Viga sin apoyos ni cargas.
     */
    public Beam(double length, double elasticModulus, double inertia) {
        this(length, elasticModulus, inertia, List.of(), List.of());
    }

    /**
     * Viga biapoyada con apoyos "A" en x=0 y "B" en x=L.
     */
    public static Beam simplySupported(double length, double elasticModulus, double inertia) {
        return new Beam(length, elasticModulus, inertia,
                List.of(new Support("A", 0.0), new Support("B", length)), List.of());
    }

    /**
     * Viga definida directamente por su rigidez a flexión E·I (se toma I = 1).
     */
    public static Beam ofRigidity(double length, double flexuralRigidity, List<Support> supports, List<Load> loads) {
        return new Beam(length, flexuralRigidity, 1.0, supports, loads);
    }

    // --- Modificaciones (devuelven nuevas instancias) ---

    public Beam withSupport(Support support) {
        Objects.requireNonNull(support, "El apoyo no puede ser nulo.");
        List<Support> next = new ArrayList<>(supports);
        next.add(support);
        return new Beam(length, elasticModulus, inertia, next, loads);
    }

    /**
     * Sustituye el conjunto completo de apoyos, conservando las cargas.
     */
    public Beam withSupports(List<Support> replacement) {
        return new Beam(length, elasticModulus, inertia, replacement, loads);
    }

    public Beam withLoad(Load load) {
        Objects.requireNonNull(load, "La carga no puede ser nula.");
        List<Load> next = new ArrayList<>(loads);
        next.add(load);
        return new Beam(length, elasticModulus, inertia, supports, next);
    }

    public Beam withoutSupports() {
        return new Beam(length, elasticModulus, inertia, List.of(), loads);
    }

    public Beam withoutLoads() {
        return new Beam(length, elasticModulus, inertia, supports, List.of());
    }

    // --- Consultas ---

    /** Rigidez a flexión E·I [N·m²]. */
    public double flexuralRigidity() {
        return elasticModulus * inertia;
    }

    public SystemClassification classify() {
        return SystemClassification.ofSupportCount(supports.size());
    }

    public int degreeOfIndeterminacy() {
        return supports.size() - 2;
    }

    /**
     * Suma de las resultantes verticales de todas las cargas (positiva hacia abajo).
     */
    public double totalAppliedForce() {
        double total = 0.0;
        for (Load load : loads) {
            total += load.totalForce();
        }
        return total;
    }

    public List<String> describeLoads() {
        return loads.stream().map(Load::describe).collect(Collectors.toList());
    }

    public Support firstSupport() {
        requireSupports();
        return supports.get(0);
    }

    public Support lastSupport() {
        requireSupports();
        return supports.get(supports.size() - 1);
    }

    // --- Validación ---

    /**
     * Repite todas las comprobaciones estructurales y exige al menos dos apoyos.
     *
     * @throws BeamValidationException si la viga no es resoluble.
     */
    public void validateForSolve() {
        requirePositive(length, "La longitud");
        requirePositive(elasticModulus, "El módulo elástico");
        requirePositive(inertia, "La inercia");
        validateSupports(length, supports);
        for (Load load : loads) {
            validateLoad(length, load);
        }
        if (supports.size() < 2) {
            throw new BeamValidationException(ValidationFailure.UNDERCONSTRAINED_SYSTEM,
                    String.format(Locale.ROOT, "Se necesitan al menos 2 apoyos; la viga tiene %d.", supports.size()));
        }
    }

    /**
     * Diagnóstico sin excepciones del sistema, útil para interfaces que quieren
     * mostrar todos los problemas a la vez.
     */
    public SystemDiagnosis diagnose() {
        SystemDiagnosis.SystemDiagnosisBuilder diagnosis = SystemDiagnosis.builder()
                .classification(classify())
                .degreeOfIndeterminacy(degreeOfIndeterminacy());
        boolean valid = true;
        try {
            validateForSolve();
        } catch (BeamValidationException e) {
            valid = false;
            diagnosis.error(e.getMessage());
        }
        if (loads.isEmpty()) {
            diagnosis.note("La viga no tiene cargas aplicadas: todos los diagramas serán nulos.");
        }
        if (classify() == SystemClassification.INDETERMINATE) {
            diagnosis.note(String.format(Locale.ROOT,
                    "Sistema hiperestático de grado %d: se resolverá por el método de flexibilidad.",
                    degreeOfIndeterminacy()));
        }
        return diagnosis.valid(valid).build();
    }

    private void requireSupports() {
        if (supports.isEmpty()) {
            throw new BeamValidationException(ValidationFailure.UNDERCONSTRAINED_SYSTEM, "La viga no tiene apoyos.");
        }
    }

    private static void requirePositive(double value, String property) {
        if (!Double.isFinite(value) || value <= 0.0) {
            throw new BeamValidationException(ValidationFailure.NON_POSITIVE_PROPERTY,
                    String.format(Locale.ROOT, "%s de la viga debe ser un valor finito mayor que cero (valor: %s).", property, value));
        }
    }

    private static void validateSupports(double length, List<Support> sorted) {
        Set<String> names = new HashSet<>();
        for (int i = 0; i < sorted.size(); i++) {
            Support s = sorted.get(i);
            if (s.position() > length) {
                throw new BeamValidationException(ValidationFailure.OUT_OF_DOMAIN_SUPPORT,
                        String.format(Locale.ROOT, "El apoyo %s (x=%.4f m) está fuera de la viga [0, %.4f].",
                                s.name(), s.position(), length));
            }
            if (!names.add(s.name())) {
                throw new BeamValidationException(ValidationFailure.DUPLICATE_SUPPORT,
                        String.format(Locale.ROOT, "Ya existe un apoyo con el nombre %s.", s.name()));
            }
            if (i > 0 && s.position() - sorted.get(i - 1).position() < SUPPORT_MIN_SEPARATION) {
                throw new BeamValidationException(ValidationFailure.DUPLICATE_SUPPORT,
                        String.format(Locale.ROOT, "Los apoyos %s y %s están a menos de 1 mm (x=%.4f m).",
                                sorted.get(i - 1).name(), s.name(), s.position()));
            }
        }
    }

    private static void validateLoad(double length, Load load) {
        if (!load.within(length)) {
            throw new BeamValidationException(ValidationFailure.OUT_OF_DOMAIN_LOAD,
                    String.format(Locale.ROOT, "La carga '%s' queda fuera de la viga [0, %.4f].", load.describe(), length));
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Beam)) return false;
        Beam beam = (Beam) o;
        return Double.compare(beam.length, length) == 0
                && Double.compare(beam.elasticModulus, elasticModulus) == 0
                && Double.compare(beam.inertia, inertia) == 0
                && supports.equals(beam.supports)
                && loads.equals(beam.loads);
    }

    @Override
    public int hashCode() {
        return Objects.hash(length, elasticModulus, inertia, supports, loads);
    }

    @Override
    public String toString() {
        return String.format(Locale.ROOT, "Beam[L=%.3f m, EI=%.4e N·m², apoyos=%d, cargas=%d]",
                length, flexuralRigidity(), supports.size(), loads.size());
    }
}
