package biodigester.physics.model;

import biodigester.config.KineticParameters;
import biodigester.config.KineticsVariant;

/**
 * Andrews: μ = μmax·S/(K_S+S+S²/K_I). Inhibición por sustrato con denominador cuadrático.
 */
public class AndrewsKinetics extends SpecificGrowthKinetics {

    private final double muMax;
    private final double halfSaturation;
    private final double inhibition;

    public AndrewsKinetics(KineticParameters.Andrews params) {
        this.muMax = params.muMax();
        this.halfSaturation = params.halfSaturation();
        this.inhibition = params.inhibition();
    }

    @Override
    public KineticsVariant getVariant() {
        return KineticsVariant.ANDREWS;
    }

    @Override
    public double specificRate(double substrate, double biomass) {
        return muMax * substrate / (halfSaturation + substrate + substrate * substrate / inhibition);
    }

    /**
     * Concentración de sustrato a la que μ es máxima: √(K_S·K_I).
     */
    public double optimalSubstrate() {
        return Math.sqrt(halfSaturation * inhibition);
    }
}
