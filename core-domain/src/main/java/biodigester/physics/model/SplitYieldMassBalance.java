package biodigester.physics.model;

import biodigester.config.YieldCoefficients;
import biodigester.domain.reactor.StateVector;
import lombok.Getter;

/**
 * Balance de masa con reparto de rendimiento.
 * <p>
 * El sustrato consumido, R_sub = R/Y_b, se reparte entre biomasa (R) y gas (Y_g·R_sub, con
 * Y_g = 1 − Y_b):
 * <pre>
 *   dS/dt = −R/Y_b
 *   dB/dt =  R
 *   dG/dt =  (1 − Y_b)·R/Y_b
 * </pre>
 * La suma de las tres derivadas es cero, así que S + B + G se conserva exactamente.
 */
@Getter
public class SplitYieldMassBalance implements MassBalance {

    private final double biomassYield;
    private final double gasYield;

    public SplitYieldMassBalance(YieldCoefficients yields) {
        this.biomassYield = yields.biomassYield();
        this.gasYield = yields.gasYield();
    }

    @Override
    public void computeDerivatives(double rate, double[] derivatives) {
        double substrateUptake = rate / biomassYield;
        derivatives[StateVector.SUBSTRATE] = -substrateUptake;
        derivatives[StateVector.BIOMASS] = rate;
        derivatives[StateVector.BIOGAS] = gasYield * substrateUptake;
    }
}
