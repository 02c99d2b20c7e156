package beamanalyzer.domain.beam;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Resultado de {@link Beam#diagnose()}: validez del sistema sin lanzar excepciones.
 */
@Value
@Builder
public class SystemDiagnosis {

    boolean valid;

    SystemClassification classification;

    /** Grado de hiperestaticidad (apoyos - 2), negativo si faltan apoyos. */
    int degreeOfIndeterminacy;

    /** Problemas que impiden el cálculo. */
    @Singular
    List<String> errors;

    /** Situaciones calculables pero dudosas (por ejemplo, viga sin cargas). */
    @Singular
    List<String> notes;
}
