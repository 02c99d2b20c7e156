package beamanalyzer.domain.exception;

/**
 * La matriz de flexibilidad ensamblada no admite solución única.
 * Conserva el sistema f·R = -δ para que el integrador de respaldo pueda
 * obtener al menos la solución de norma mínima.
 */
public class SingularFlexibilityMatrixException extends BeamSolveException {

    private final double[][] flexibility;
    private final double[] loadDeflections;
    private final double conditionNumber;

    public SingularFlexibilityMatrixException(String message, double[][] flexibility,
                                              double[] loadDeflections, double conditionNumber) {
        super(SolveFailure.SINGULAR_FLEXIBILITY_MATRIX, message);
        this.flexibility = copy(flexibility);
        this.loadDeflections = loadDeflections.clone();
        this.conditionNumber = conditionNumber;
    }

    /**
     * Copia de la matriz f[i][j]: flecha en el redundante i por carga unitaria ascendente en j.
     */
    public double[][] getFlexibility() {
        return copy(flexibility);
    }

    /**
     * Copia del vector δ: flecha en cada redundante bajo las cargas reales sobre la estructura primaria.
     */
    public double[] getLoadDeflections() {
        return loadDeflections.clone();
    }

    public double getConditionNumber() {
        return conditionNumber;
    }

    private static double[][] copy(double[][] matrix) {
        double[][] out = new double[matrix.length][];
        for (int i = 0; i < matrix.length; i++) {
            out[i] = matrix[i].clone();
        }
        return out;
    }
}
