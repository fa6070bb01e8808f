package biodigester.physics.solver.impl;

import biodigester.domain.reactor.StateVector;
import biodigester.physics.model.KineticsLaw;
import biodigester.physics.model.MassBalance;
import biodigester.physics.solver.OdeSystem;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Sistema ODE del digestor por lotes: enlaza una ley cinética con un balance de masa.
 * <p>
 * f(t, [S, B, G]) = balance(ley(S, B)). El sistema es autónomo; t no interviene.
 */
@Getter
@RequiredArgsConstructor
public class ReactorOdeSystem implements OdeSystem {

    private final KineticsLaw kineticsLaw;
    private final MassBalance massBalance;

    @Override
    public void computeDerivatives(double time, double[] state, double[] derivatives) {
        double rate = kineticsLaw.rate(state[StateVector.SUBSTRATE], state[StateVector.BIOMASS]);
        massBalance.computeDerivatives(rate, derivatives);
    }
}
