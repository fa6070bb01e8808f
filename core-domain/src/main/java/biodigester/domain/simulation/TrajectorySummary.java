package biodigester.domain.simulation;

import biodigester.config.KineticsVariant;
import biodigester.domain.reactor.StateVector;

/**
 * Indicadores agregados de una trayectoria, pensados para la capa de informes.
 *
 * @param kinetics            Etiqueta de la ley cinética usada.
 * @param sampleCount         Número de muestras de la trayectoria.
 * @param finalTime           t1.
 * @param finalSubstrate      S(t1).
 * @param finalBiomass        B(t1).
 * @param finalBiogas         G(t1).
 * @param substrateConversion Fracción de sustrato consumido, (S0 − S(t1)) / S0. 0 si S0 = 0.
 * @param peakBiomass         Máximo de B en las muestras.
 * @param peakBiomassTime     Instante de ese máximo.
 * @param massBalanceDrift    Máxima desviación de S + B + G respecto a su valor inicial.
 */
public record TrajectorySummary(
        String kinetics,
        int sampleCount,
        double finalTime,
        double finalSubstrate,
        double finalBiomass,
        double finalBiogas,
        double substrateConversion,
        double peakBiomass,
        double peakBiomassTime,
        double massBalanceDrift
) {

    public static TrajectorySummary of(KineticsVariant variant, Trajectory trajectory) {
        StateVector first = trajectory.getInitialState();
        StateVector last = trajectory.getFinalState();
        double initialMass = first.totalMass();

        int peakIndex = 0;
        double drift = 0.0;
        for (int i = 0; i < trajectory.size(); i++) {
            StateVector state = trajectory.getStateAt(i);
            if (state.biomass() > trajectory.getStateAt(peakIndex).biomass()) {
                peakIndex = i;
            }
            drift = Math.max(drift, Math.abs(state.totalMass() - initialMass));
        }

        double conversion = first.substrate() > 0.0
                ? (first.substrate() - last.substrate()) / first.substrate()
                : 0.0;

        return new TrajectorySummary(
                variant.getTag(),
                trajectory.size(),
                trajectory.timeAt(trajectory.size() - 1),
                last.substrate(),
                last.biomass(),
                last.biogas(),
                conversion,
                trajectory.getStateAt(peakIndex).biomass(),
                trajectory.timeAt(peakIndex),
                drift
        );
    }
}
