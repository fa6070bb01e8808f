package biodigester.physics.model;

import biodigester.config.KineticParameters;
import biodigester.config.KineticsVariant;
import biodigester.domain.exception.DomainException;

/**
 * Contois: μ = μmax·(S/B)/(K_C+S/B). La saturación depende de la densidad de biomasa.
 */
public class ContoisKinetics extends SpecificGrowthKinetics {

    private final double muMax;
    private final double contoisConstant;

    public ContoisKinetics(KineticParameters.Contois params) {
        this.muMax = params.muMax();
        this.contoisConstant = params.contoisConstant();
    }

    @Override
    public KineticsVariant getVariant() {
        return KineticsVariant.CONTOIS;
    }

    @Override
    public double specificRate(double substrate, double biomass) {
        if (biomass <= 0.0) {
            throw new DomainException("Contois requiere biomasa estrictamente positiva", substrate, biomass);
        }
        double ratio = substrate / biomass;
        return muMax * ratio / (contoisConstant + ratio);
    }
}
