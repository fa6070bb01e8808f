package biodigester.physics.model;

import biodigester.domain.exception.DomainException;

/**
 * Base de las leyes con forma "velocidad específica × biomasa": R = μ(S, B) · B.
 * <p>
 * Las subclases solo implementan μ. La comprobación de entradas y de resultados no finitos
 * se hace aquí, una sola vez.
 */
public abstract class SpecificGrowthKinetics implements KineticsLaw {

    /**
     * Velocidad específica μ (1/día).
     */
    public abstract double specificRate(double substrate, double biomass);

    @Override
    public final double rate(double substrate, double biomass) {
        if (!Double.isFinite(substrate) || !Double.isFinite(biomass)) {
            throw new DomainException("Estado no finito en la ley " + getVariant().getTag(), substrate, biomass);
        }
        double mu = specificRate(substrate, biomass);
        double r = mu * biomass;
        if (!Double.isFinite(r)) {
            throw new DomainException("La ley " + getVariant().getTag() + " produjo una velocidad no finita", substrate, biomass);
        }
        return r;
    }
}
