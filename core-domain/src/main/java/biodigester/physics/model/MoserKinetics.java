package biodigester.physics.model;

import biodigester.config.KineticParameters;
import biodigester.config.KineticsVariant;

/**
 * Moser: μ = μmax·Sⁿ/(K_S+Sⁿ). Monod generalizado; con n = 1 coincide con Monod.
 * <p>
 * Con exponente no entero Sⁿ no está definido para S &lt; 0. Como S0 &gt;= 0 está validado, un S negativo
 * solo aparece en las etapas de prueba del integrador al agotarse el sustrato; ahí se toma S = 0, que es
 * el límite físico (μ = 0 con el sustrato agotado).
 */
public class MoserKinetics extends SpecificGrowthKinetics {

    private final double muMax;
    private final double halfSaturation;
    private final double exponent;
    private final boolean integerExponent;

    public MoserKinetics(KineticParameters.Moser params) {
        this.muMax = params.muMax();
        this.halfSaturation = params.halfSaturation();
        this.exponent = params.exponent();
        this.integerExponent = exponent == Math.rint(exponent);
    }

    @Override
    public KineticsVariant getVariant() {
        return KineticsVariant.MOSER;
    }

    @Override
    public double specificRate(double substrate, double biomass) {
        double base = integerExponent ? substrate : Math.max(substrate, 0.0);
        double powered = Math.pow(base, exponent);
        return muMax * powered / (halfSaturation + powered);
    }
}
