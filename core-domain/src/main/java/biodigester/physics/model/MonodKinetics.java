package biodigester.physics.model;

import biodigester.config.KineticParameters;
import biodigester.config.KineticsVariant;

/**
 * Monod: μ = μmax·S/(K_S+S)
 */
public class MonodKinetics extends SpecificGrowthKinetics {

    private final double muMax;
    private final double halfSaturation;

    public MonodKinetics(KineticParameters.Monod params) {
        this.muMax = params.muMax();
        this.halfSaturation = params.halfSaturation();
    }

    @Override
    public KineticsVariant getVariant() {
        return KineticsVariant.MONOD;
    }

    @Override
    public double specificRate(double substrate, double biomass) {
        return muMax * substrate / (halfSaturation + substrate);
    }
}
