package biodigester.physics.model;

import biodigester.config.KineticParameters;
import biodigester.config.KineticsVariant;
import biodigester.domain.exception.DomainException;

/**
 * Teissier: μ = μmax·(1 − e^(−S/K_T))
 */
public class TeissierKinetics extends SpecificGrowthKinetics {

    private final double muMax;
    private final double teissierConstant;

    public TeissierKinetics(KineticParameters.Teissier params) {
        this.muMax = params.muMax();
        this.teissierConstant = params.teissierConstant();
    }

    @Override
    public KineticsVariant getVariant() {
        return KineticsVariant.TEISSIER;
    }

    @Override
    public double specificRate(double substrate, double biomass) {
        if (teissierConstant == 0.0) {
            throw new DomainException("Teissier requiere K_T distinta de cero", substrate, biomass);
        }
        return muMax * (1.0 - Math.exp(-substrate / teissierConstant));
    }
}
