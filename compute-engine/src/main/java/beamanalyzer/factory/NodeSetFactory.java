package beamanalyzer.factory;

import beamanalyzer.config.AnalysisConfig;
import beamanalyzer.domain.beam.Beam;
import beamanalyzer.domain.beam.Support;
import beamanalyzer.domain.exception.BeamValidationException;
import beamanalyzer.domain.exception.ValidationFailure;
import beamanalyzer.domain.load.Load;
import beamanalyzer.domain.node.Node;
import beamanalyzer.domain.node.NodeEvent;
import beamanalyzer.domain.node.NodeSet;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Fábrica del conjunto de nodos de una viga.
 * <p>
 * Reúne {0, L}, las posiciones de los apoyos, los extremos de las cargas repartidas,
 * las posiciones de fuerzas y momentos puntuales y las coordenadas de sondeo pedidas.
 * Las coordenadas a menos de {@link AnalysisConfig#getNodeMergeTolerance()} se funden
 * en un solo nodo, que acumula los sucesos y los saltos de todas ellas. Así cada
 * discontinuidad cae exactamente en una muestra en lugar de repartirse en una malla fija.
 */
@Slf4j
public class NodeSetFactory {

    private final AnalysisConfig config;

    public NodeSetFactory(AnalysisConfig config) {
        this.config = config;
    }

    /**
     * Rechaza vigas con más apoyos o cargas de los admitidos por la configuración.
     */
    public void requireWithinLimits(Beam beam) {
        if (beam.getSupports().size() > config.getMaxSupports()) {
            throw new BeamValidationException(ValidationFailure.TOO_MANY_ELEMENTS,
                    String.format(Locale.ROOT, "La viga tiene %d apoyos; el máximo admitido es %d.",
                            beam.getSupports().size(), config.getMaxSupports()));
        }
        if (beam.getLoads().size() > config.getMaxLoads()) {
            throw new BeamValidationException(ValidationFailure.TOO_MANY_ELEMENTS,
                    String.format(Locale.ROOT, "La viga tiene %d cargas; el máximo admitido es %d.",
                            beam.getLoads().size(), config.getMaxLoads()));
        }
    }

    /**
     * Construye los nodos de la viga.
     *
     * @param beam      Viga validada.
     * @param reactions Reacción (positiva hacia arriba) de cada apoyo, por nombre.
     * @param probes    Coordenadas adicionales donde se necesita una muestra exacta.
     * @return Nodos ordenados y sin duplicados, con sus saltos exactos.
     */
    public NodeSet create(Beam beam, Map<String, Double> reactions, double... probes) {
        requireWithinLimits(beam);
        double length = beam.getLength();
        List<Mark> marks = new ArrayList<>();

        marks.add(new Mark(0.0, NodeEvent.BEAM_END, 0.0, 0.0));
        marks.add(new Mark(length, NodeEvent.BEAM_END, 0.0, 0.0));

        for (Support support : beam.getSupports()) {
            Double reaction = reactions.get(support.name());
            if (reaction == null) {
                throw new IllegalArgumentException("Falta la reacción del apoyo " + support.name());
            }
            marks.add(new Mark(support.position(), NodeEvent.SUPPORT, reaction, 0.0));
        }

        for (Load load : beam.getLoads()) {
            double[] points = load.breakpoints();
            for (int i = 0; i < points.length; i++) {
                // Los saltos de una carga puntual se asignan a su único punto.
                double shear = i == 0 ? load.shearJump() : 0.0;
                double moment = i == 0 ? load.momentJump() : 0.0;
                marks.add(new Mark(points[i], load.eventAt(points[i]), shear, moment));
            }
        }

        for (double probe : probes) {
            if (probe < 0.0 || probe > length) {
                throw new IllegalArgumentException(String.format(Locale.ROOT,
                        "La coordenada de sondeo %.6f está fuera de la viga [0, %.6f].", probe, length));
            }
            marks.add(new Mark(probe, NodeEvent.PROBE, 0.0, 0.0));
        }

        marks.sort(Comparator.comparingDouble(Mark::position));
        List<Node> nodes = merge(marks, config.getNodeMergeTolerance());
        log.trace("Conjunto de nodos: {} nodos a partir de {} marcas.", nodes.size(), marks.size());
        return new NodeSet(nodes);
    }

    private static List<Node> merge(List<Mark> sorted, double tolerance) {
        List<Node> nodes = new ArrayList<>();
        int i = 0;
        while (i < sorted.size()) {
            int j = i;
            while (j + 1 < sorted.size() && sorted.get(j + 1).position() - sorted.get(i).position() <= tolerance) {
                j++;
            }
            Set<NodeEvent> events = EnumSet.noneOf(NodeEvent.class);
            double shear = 0.0;
            double moment = 0.0;
            double position = sorted.get(i).position();
            int anchorRank = Integer.MAX_VALUE;
            for (int k = i; k <= j; k++) {
                Mark m = sorted.get(k);
                events.add(m.event());
                shear += m.shearJump();
                moment += m.momentJump();
                // Extremos y apoyos fijan la coordenada del grupo.
                int rank = rank(m.event());
                if (rank < anchorRank) {
                    anchorRank = rank;
                    position = m.position();
                }
            }
            nodes.add(new Node(position, events, shear, moment));
            i = j + 1;
        }
        return nodes;
    }

    private static int rank(NodeEvent event) {
        switch (event) {
            case BEAM_END:
                return 0;
            case SUPPORT:
                return 1;
            default:
                return 2;
        }
    }

    private record Mark(double position, NodeEvent event, double shearJump, double momentJump) {
    }
}
