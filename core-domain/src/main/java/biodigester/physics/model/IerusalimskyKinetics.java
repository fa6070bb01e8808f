package biodigester.physics.model;

import biodigester.config.KineticParameters;
import biodigester.config.KineticsVariant;

/**
 * Ierusalimsky: μ = μmax·(S/(K_S+S))·(K_P/(K_P+S))
 */
public class IerusalimskyKinetics extends SpecificGrowthKinetics {

    private final double muMax;
    private final double halfSaturation;
    private final double productInhibition;

    public IerusalimskyKinetics(KineticParameters.Ierusalimsky params) {
        this.muMax = params.muMax();
        this.halfSaturation = params.halfSaturation();
        this.productInhibition = params.productInhibition();
    }

    @Override
    public KineticsVariant getVariant() {
        return KineticsVariant.IERUSALIMSKY;
    }

    @Override
    public double specificRate(double substrate, double biomass) {
        return muMax * (substrate / (halfSaturation + substrate)) * (productInhibition / (productInhibition + substrate));
    }
}
