package biodigester.physics.model;

import biodigester.config.KineticParameters;
import biodigester.config.KineticsVariant;

/**
 * Haldane (forma producto): μ = μmax·(S/(K_S+S))·(K_I/(K_I+S))
 */
public class HaldaneKinetics extends SpecificGrowthKinetics {

    private final double muMax;
    private final double halfSaturation;
    private final double inhibition;

    public HaldaneKinetics(KineticParameters.Haldane params) {
        this.muMax = params.muMax();
        this.halfSaturation = params.halfSaturation();
        this.inhibition = params.inhibition();
    }

    @Override
    public KineticsVariant getVariant() {
        return KineticsVariant.HALDANE;
    }

    @Override
    public double specificRate(double substrate, double biomass) {
        double saturation = substrate / (halfSaturation + substrate);
        double inhibitionFactor = inhibition / (inhibition + substrate);
        return muMax * saturation * inhibitionFactor;
    }
}
