package biodigester.physics.solver;

/**
 * Sistema de ecuaciones diferenciales ordinarias y' = f(t, y).
 */
@FunctionalInterface
public interface OdeSystem {

    /**
     * Evalúa f(t, y) y escribe el resultado en {@code derivatives}. No debe modificar {@code state}.
     */
    void computeDerivatives(double time, double[] state, double[] derivatives);
}
