package beamanalyzer.physics.impl;

import beamanalyzer.domain.beam.Beam;
import beamanalyzer.domain.beam.Support;
import beamanalyzer.domain.beam.SystemClassification;
import beamanalyzer.domain.exception.BeamValidationException;
import beamanalyzer.domain.exception.ValidationFailure;
import beamanalyzer.domain.load.Load;
import beamanalyzer.physics.i.IReactionSolver;
import lombok.extern.slf4j.Slf4j;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Reacciones de una viga isostática (dos apoyos) por equilibrio global:
 * <pre>
 *   ΣF = 0:          R_izq + R_der = ΣP
 *   ΣM (apoyo izq):  R_der · d     = Σ momentAbout(x_izq)
 * </pre>
 * Las cargas repartidas entran por su momento exacto (resultante por centroide) y los
 * momentos puntuales como vectores libres.
 */
@Slf4j
public class StaticEquilibriumReactionSolver implements IReactionSolver {

    @Override
    public String getName() {
        return "Equilibrio estático";
    }

    @Override
    public String getDescription() {
        return "Solución cerrada de ΣF = 0 y ΣM = 0 para dos apoyos simples.";
    }

    @Override
    public boolean supports(SystemClassification classification) {
        return classification == SystemClassification.DETERMINATE;
    }

    @Override
    public Map<String, Double> solveReactions(Beam beam) {
        List<Support> supports = beam.getSupports();
        if (supports.size() != 2) {
            throw new BeamValidationException(ValidationFailure.UNDERCONSTRAINED_SYSTEM, String.format(Locale.ROOT,
                    "El equilibrio estático necesita exactamente 2 apoyos; la viga tiene %d.", supports.size()));
        }
        Support left = supports.get(0);
        Support right = supports.get(1);
        double[] r = solve(left.position(), right.position(), beam.getLoads());

        Map<String, Double> reactions = new LinkedHashMap<>();
        reactions.put(left.name(), r[0]);
        reactions.put(right.name(), r[1]);
        log.debug("Reacciones isostáticas: {}", reactions);
        return reactions;
    }

    /**
     * Reacciones {izquierda, derecha} de dos apoyos en {@code xLeft} y {@code xRight}
     * bajo un conjunto de cargas.
     */
    public double[] solve(double xLeft, double xRight, List<Load> loads) {
        double force = 0.0;
        double moment = 0.0;
        for (Load load : loads) {
            force += load.totalForce();
            moment += load.momentAbout(xLeft);
        }
        double rightReaction = moment / (xRight - xLeft);
        return new double[]{force - rightReaction, rightReaction};
    }

    /**
     * Reacciones {izquierda, derecha} debidas a una única fuerza puntual (positiva hacia abajo)
     * en {@code position}. No construye una carga, así que admite magnitudes nulas.
     */
    public double[] solveForPointForce(double xLeft, double xRight, double position, double magnitude) {
        double rightReaction = magnitude * (position - xLeft) / (xRight - xLeft);
        return new double[]{magnitude - rightReaction, rightReaction};
    }
}
