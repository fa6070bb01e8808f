package biodigester.physics.model;

import biodigester.config.KineticsVariant;
import biodigester.config.KineticsVariant.RateShape;

/**
 * Ley cinética microbiana: transforma el estado del digestor en la velocidad R de formación de
 * biomasa (g/L/día), que el balance de masa reparte entre sustrato, biomasa y gas.
 * <p>
 * Implementaciones puras, sin estado mutable y thread-safe.
 */
public interface KineticsLaw {

    KineticsVariant getVariant();

    /**
     * Calcula R para el estado (S, B).
     *
     * @throws biodigester.domain.exception.DomainException si la fórmula no está definida en (S, B).
     */
    double rate(double substrate, double biomass);

    default RateShape getShape() {
        return getVariant().getShape();
    }
}
