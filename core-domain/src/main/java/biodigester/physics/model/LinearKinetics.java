package biodigester.physics.model;

import biodigester.config.KineticParameters;
import biodigester.config.KineticsVariant;
import biodigester.domain.exception.DomainException;

/**
 * Cinética lineal de primer orden en sustrato: R = k·S.
 * <p>
 * Es la única ley que no pasa por una velocidad específica: R no depende de la biomasa.
 */
public class LinearKinetics implements KineticsLaw {

    private final double rateConstant;

    public LinearKinetics(KineticParameters.Linear params) {
        this.rateConstant = params.rateConstant();
    }

    @Override
    public KineticsVariant getVariant() {
        return KineticsVariant.LINEAR;
    }

    @Override
    public double rate(double substrate, double biomass) {
        if (!Double.isFinite(substrate)) {
            throw new DomainException("Sustrato no finito en la ley linear", substrate, biomass);
        }
        return rateConstant * substrate;
    }
}
