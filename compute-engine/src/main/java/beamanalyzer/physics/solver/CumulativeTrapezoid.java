package beamanalyzer.physics.solver;

/**
 * Utilidades de cuadratura por la regla del trapecio.
 * <p>
 * Clase de utilidad sin estado. No puede ser instanciada.
 */
public final class CumulativeTrapezoid {

    private CumulativeTrapezoid() {}

    /**
     * Integral acumulada de {@code f} sobre las abscisas {@code x}, partiendo de {@code initial}.
     * Admite abscisas repetidas (saltos): el incremento entre ellas es nulo.
     */
    public static double[] integrate(double[] f, double[] x, double initial) {
        if (f.length != x.length) {
            throw new IllegalArgumentException(String.format(
                    "Los arrays deben tener la misma longitud (f=%d, x=%d).", f.length, x.length));
        }
        double[] out = new double[f.length];
        if (out.length == 0) {
            return out;
        }
        out[0] = initial;
        for (int i = 1; i < f.length; i++) {
            out[i] = out[i - 1] + step(f[i - 1], f[i], x[i] - x[i - 1]);
        }
        return out;
    }

    /**
     * Área de un trapecio de altura {@code dx} entre {@code f0} y {@code f1}.
     */
    public static double step(double f0, double f1, double dx) {
        return 0.5 * (f0 + f1) * dx;
    }

    /**
     * Versión escalada: integra {@code f / divisor}. Usada para θ = ∫M/EI.
     */
    public static double[] integrateScaled(double[] f, double[] x, double divisor, double initial) {
        if (divisor == 0.0) {
            throw new IllegalArgumentException("El divisor no puede ser cero.");
        }
        double[] out = integrate(f, x, 0.0);
        for (int i = 0; i < out.length; i++) {
            out[i] = initial + out[i] / divisor;
        }
        return out;
    }
}
