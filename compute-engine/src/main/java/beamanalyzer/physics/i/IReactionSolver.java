package beamanalyzer.physics.i;

import beamanalyzer.domain.beam.Beam;
import beamanalyzer.domain.beam.SystemClassification;

import java.util.Map;

/**
 * Estrategia de cálculo de reacciones en los apoyos.
 */
public interface IReactionSolver extends ISolverComponent {

    /**
     * Indica si la estrategia resuelve sistemas de la clasificación dada.
     */
    boolean supports(SystemClassification classification);

    /**
     * Calcula las reacciones (positivas hacia arriba) de una viga ya validada.
     *
     * @return Mapa nombre de apoyo → reacción, en el orden de los apoyos.
     * @throws beamanalyzer.domain.exception.BeamSolveException si el cálculo falla numéricamente.
     */
    Map<String, Double> solveReactions(Beam beam);
}
