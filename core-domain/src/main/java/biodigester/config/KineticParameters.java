package biodigester.config;

import biodigester.domain.exception.ConfigurationException;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Parámetros de una ley cinética. Cada variante tiene su propio record con únicamente los
 * parámetros que su fórmula necesita, de forma que ninguna ley puede leer un campo ausente.
 * <p>
 * Unidades de referencia: concentraciones en g/L, tiempos en días.
 */
public interface KineticParameters {

    KineticsVariant variant();

    /**
     * Parámetros con su nombre externo, en el orden de {@link KineticsVariant#getRequiredParameters()}.
     */
    Map<String, Double> asMap();

    /**
     * Comprueba que todos los valores sean finitos y estén dentro del dominio de la fórmula.
     *
     * @throws ConfigurationException en el primer parámetro inválido.
     */
    void validate();

    default String describe() {
        return asMap().entrySet().stream()
                .map(e -> e.getKey() + "=" + e.getValue())
                .collect(Collectors.joining(", "));
    }

    // --- Variantes ---

    /**
     * μ = μmax·S/(K_S+S)
     */
    record Monod(double muMax, double halfSaturation) implements KineticParameters {
        @Override
        public KineticsVariant variant() {
            return KineticsVariant.MONOD;
        }

        @Override
        public Map<String, Double> asMap() {
            return ordered("mu_max", muMax, "K_S", halfSaturation);
        }

        @Override
        public void validate() {
            requireNonNegative("mu_max", muMax);
            requirePositive("K_S", halfSaturation);
        }
    }

    /**
     * R = k·S, sin biomasa.
     */
    record Linear(double rateConstant) implements KineticParameters {
        @Override
        public KineticsVariant variant() {
            return KineticsVariant.LINEAR;
        }

        @Override
        public Map<String, Double> asMap() {
            return ordered("k", rateConstant);
        }

        @Override
        public void validate() {
            requireNonNegative("k", rateConstant);
        }
    }

    /**
     * μ = μmax·(S/(K_S+S))·(K_I/(K_I+S))
     */
    record Haldane(double muMax, double halfSaturation, double inhibition) implements KineticParameters {
        @Override
        public KineticsVariant variant() {
            return KineticsVariant.HALDANE;
        }

        @Override
        public Map<String, Double> asMap() {
            return ordered("mu_max", muMax, "K_S", halfSaturation, "K_I", inhibition);
        }

        @Override
        public void validate() {
            requireNonNegative("mu_max", muMax);
            requirePositive("K_S", halfSaturation);
            requirePositive("K_I", inhibition);
        }
    }

    /**
     * μ = μmax·(S/B)/(K_C+S/B)
     */
    record Contois(double muMax, double contoisConstant) implements KineticParameters {
        @Override
        public KineticsVariant variant() {
            return KineticsVariant.CONTOIS;
        }

        @Override
        public Map<String, Double> asMap() {
            return ordered("mu_max", muMax, "K_C", contoisConstant);
        }

        @Override
        public void validate() {
            requireNonNegative("mu_max", muMax);
            requirePositive("K_C", contoisConstant);
        }
    }

    /**
     * μ = μmax·(1 − e^(−S/K_T))
     */
    record Teissier(double muMax, double teissierConstant) implements KineticParameters {
        @Override
        public KineticsVariant variant() {
            return KineticsVariant.TEISSIER;
        }

        @Override
        public Map<String, Double> asMap() {
            return ordered("mu_max", muMax, "K_T", teissierConstant);
        }

        @Override
        public void validate() {
            requireNonNegative("mu_max", muMax);
            requirePositive("K_T", teissierConstant);
        }
    }

    /**
     * μ = μmax·Sⁿ/(K_S+Sⁿ)
     */
    record Moser(double muMax, double halfSaturation, double exponent) implements KineticParameters {
        @Override
        public KineticsVariant variant() {
            return KineticsVariant.MOSER;
        }

        @Override
        public Map<String, Double> asMap() {
            return ordered("mu_max", muMax, "K_S", halfSaturation, "n", exponent);
        }

        @Override
        public void validate() {
            requireNonNegative("mu_max", muMax);
            requirePositive("K_S", halfSaturation);
            requirePositive("n", exponent);
        }
    }

    /**
     * r = S/S0; μ = μmax·r/(k_CH + r·(1−r))
     */
    record ChenHashimoto(double muMax, double referenceSubstrate, double chenHashimotoConstant) implements KineticParameters {
        @Override
        public KineticsVariant variant() {
            return KineticsVariant.CHEN_HASHIMOTO;
        }

        @Override
        public Map<String, Double> asMap() {
            return ordered("mu_max", muMax, "S0", referenceSubstrate, "k_CH", chenHashimotoConstant);
        }

        @Override
        public void validate() {
            requireNonNegative("mu_max", muMax);
            requirePositive("S0", referenceSubstrate);
            requirePositive("k_CH", chenHashimotoConstant);
        }
    }

    /**
     * μ = μmax·S/(K_S+S+S²/K_I)
     */
    record Andrews(double muMax, double halfSaturation, double inhibition) implements KineticParameters {
        @Override
        public KineticsVariant variant() {
            return KineticsVariant.ANDREWS;
        }

        @Override
        public Map<String, Double> asMap() {
            return ordered("mu_max", muMax, "K_S", halfSaturation, "K_I", inhibition);
        }

        @Override
        public void validate() {
            requireNonNegative("mu_max", muMax);
            requirePositive("K_S", halfSaturation);
            requirePositive("K_I", inhibition);
        }
    }

    /**
     * μ = μmax·(S/(K_S+S))·(K_P/(K_P+S))
     */
    record Ierusalimsky(double muMax, double halfSaturation, double productInhibition) implements KineticParameters {
        @Override
        public KineticsVariant variant() {
            return KineticsVariant.IERUSALIMSKY;
        }

        @Override
        public Map<String, Double> asMap() {
            return ordered("mu_max", muMax, "K_S", halfSaturation, "K_P", productInhibition);
        }

        @Override
        public void validate() {
            requireNonNegative("mu_max", muMax);
            requirePositive("K_S", halfSaturation);
            requirePositive("K_P", productInhibition);
        }
    }

    // --- Helpers de validación ---

    private static Map<String, Double> ordered(Object... namesAndValues) {
        Map<String, Double> map = new LinkedHashMap<>();
        for (int i = 0; i < namesAndValues.length; i += 2) {
            map.put((String) namesAndValues[i], (Double) namesAndValues[i + 1]);
        }
        return map;
    }

    private static void requireFinite(String name, double value) {
        if (!Double.isFinite(value)) {
            throw new ConfigurationException("El parámetro " + name + " debe ser un número finito (valor: " + value + ").");
        }
    }

    private static void requirePositive(String name, double value) {
        requireFinite(name, value);
        if (value <= 0.0) {
            throw new ConfigurationException("El parámetro " + name + " debe ser estrictamente positivo (valor: " + value + ").");
        }
    }

    private static void requireNonNegative(String name, double value) {
        requireFinite(name, value);
        if (value < 0.0) {
            throw new ConfigurationException("El parámetro " + name + " no puede ser negativo (valor: " + value + ").");
        }
    }
}
