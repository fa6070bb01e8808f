package biodigester.config;

import biodigester.domain.exception.ConfigurationException;

/**
 * Coeficientes de rendimiento del balance de masa con reparto de rendimiento.
 * <p>
 * Solo se especifica el rendimiento en biomasa; el rendimiento en gas es su complemento,
 * {@code Y_g = 1 − Y_b}. Con este convenio S + B + G se conserva a lo largo de la trayectoria.
 *
 * @param biomassYield Y_b, fracción del sustrato consumido que se convierte en biomasa. Debe estar en (0, 1].
 */
public record YieldCoefficients(double biomassYield) {

    public static YieldCoefficients ofBiomassYield(double biomassYield) {
        return new YieldCoefficients(biomassYield);
    }

    /**
     * Y_g = 1 − Y_b
     */
    public double gasYield() {
        return 1.0 - biomassYield;
    }

    public void validate() {
        if (!Double.isFinite(biomassYield) || biomassYield <= 0.0 || biomassYield > 1.0) {
            throw new ConfigurationException("El rendimiento en biomasa Y_b debe estar en (0, 1] (valor: " + biomassYield + ").");
        }
    }
}
