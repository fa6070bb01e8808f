package biodigester.physics.model;

/**
 * Convierte la velocidad R de una ley cinética en las derivadas (dS/dt, dB/dt, dG/dt).
 */
@FunctionalInterface
public interface MassBalance {

    /**
     * Escribe las tres derivadas en {@code derivatives}, indexadas como
     * {@link biodigester.domain.reactor.StateVector#SUBSTRATE}, {@code BIOMASS} y {@code BIOGAS}.
     *
     * @param rate        R, velocidad de formación de biomasa.
     * @param derivatives array de destino de longitud 3.
     */
    void computeDerivatives(double rate, double[] derivatives);
}
