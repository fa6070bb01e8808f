package biodigester.physics.model;

import biodigester.config.KineticParameters;
import biodigester.config.KineticsVariant;
import biodigester.domain.exception.DomainException;

/**
 * Chen-Hashimoto: con r = S/S0, μ = μmax·r/(k_CH + r·(1−r)).
 * <p>
 * S0 es una concentración de referencia (normalmente el sustrato de alimentación). Para r por
 * encima de (1 + √(1 + 4·k_CH))/2 el denominador deja de ser positivo y la fórmula no es válida.
 */
public class ChenHashimotoKinetics extends SpecificGrowthKinetics {

    private final double muMax;
    private final double referenceSubstrate;
    private final double chenHashimotoConstant;

    public ChenHashimotoKinetics(KineticParameters.ChenHashimoto params) {
        this.muMax = params.muMax();
        this.referenceSubstrate = params.referenceSubstrate();
        this.chenHashimotoConstant = params.chenHashimotoConstant();
    }

    @Override
    public KineticsVariant getVariant() {
        return KineticsVariant.CHEN_HASHIMOTO;
    }

    @Override
    public double specificRate(double substrate, double biomass) {
        if (referenceSubstrate == 0.0) {
            throw new DomainException("Chen-Hashimoto requiere S0 de referencia distinta de cero", substrate, biomass);
        }
        double r = substrate / referenceSubstrate;
        double denominator = chenHashimotoConstant + r * (1.0 - r);
        if (denominator <= 0.0) {
            throw new DomainException("Chen-Hashimoto fuera de dominio: denominador k_CH + r(1-r) <= 0 para r=" + r, substrate, biomass);
        }
        return muMax * r / denominator;
    }
}
