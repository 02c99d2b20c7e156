package beamanalyzer.domain.node;

import java.util.List;

/**
 * Lista ordenada y sin duplicados de nodos de una viga. Se construye para cada cálculo.
 */
public record NodeSet(List<Node> nodes) {

    public NodeSet {
        if (nodes.size() < 2) {
            throw new IllegalArgumentException("Un conjunto de nodos necesita al menos los dos extremos de la viga.");
        }
        for (int i = 1; i < nodes.size(); i++) {
            if (nodes.get(i).position() <= nodes.get(i - 1).position()) {
                throw new IllegalArgumentException("Los nodos deben estar estrictamente ordenados por posición.");
            }
        }
        nodes = List.copyOf(nodes);
    }

    public int size() {
        return nodes.size();
    }

    public Node get(int index) {
        return nodes.get(index);
    }

    /**
     * Índice del nodo situado a menos de {@code tolerance} de {@code position}, o -1.
     */
    public int indexOf(double position, double tolerance) {
        int lo = 0;
        int hi = nodes.size() - 1;
        while (lo <= hi) {
            int mid = (lo + hi) >>> 1;
            double x = nodes.get(mid).position();
            if (Math.abs(x - position) <= tolerance) {
                return mid;
            }
            if (x < position) {
                lo = mid + 1;
            } else {
                hi = mid - 1;
            }
        }
        return -1;
    }
}
