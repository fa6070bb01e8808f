package biodigester.config;

import biodigester.domain.exception.ConfigurationException;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;

/**
 * Conjunto cerrado de leyes cinéticas soportadas por el digestor.
 * <p>
 * Cada variante declara los nombres de los parámetros que necesita (tal como llegan desde la capa de
 * presentación) y la forma funcional de su velocidad: todas son "velocidad específica × biomasa"
 * salvo {@link #LINEAR}, que es de orden cero en biomasa.
 */
@Getter
@RequiredArgsConstructor
public enum KineticsVariant {

    MONOD("monod", RateShape.BIOMASS_COUPLED, List.of("mu_max", "K_S")),
    LINEAR("linear", RateShape.DIRECT, List.of("k")),
    HALDANE("haldane", RateShape.BIOMASS_COUPLED, List.of("mu_max", "K_S", "K_I")),
    CONTOIS("contois", RateShape.BIOMASS_COUPLED, List.of("mu_max", "K_C")),
    TEISSIER("teissier", RateShape.BIOMASS_COUPLED, List.of("mu_max", "K_T")),
    MOSER("moser", RateShape.BIOMASS_COUPLED, List.of("mu_max", "K_S", "n")),
    CHEN_HASHIMOTO("chen-hashimoto", RateShape.BIOMASS_COUPLED, List.of("mu_max", "S0", "k_CH")),
    ANDREWS("andrews", RateShape.BIOMASS_COUPLED, List.of("mu_max", "K_S", "K_I")),
    IERUSALIMSKY("ierusalimsky", RateShape.BIOMASS_COUPLED, List.of("mu_max", "K_S", "K_P"));

    /**
     * Etiqueta externa de la variante (la que usa el formulario del operador).
     */
    private final String tag;

    private final RateShape shape;

    /**
     * Nombres de los parámetros obligatorios, en el orden en que se documentan.
     */
    private final List<String> requiredParameters;

    /**
     * Resuelve una etiqueta externa. Acepta mayúsculas/minúsculas y '_' en lugar de '-'.
     *
     * @throws ConfigurationException si la etiqueta es nula o no corresponde a ninguna variante.
     */
    public static KineticsVariant fromTag(String tag) {
        if (tag == null || tag.isBlank()) {
            throw new ConfigurationException("No se ha indicado ninguna ley cinética.");
        }
        String normalized = tag.trim().toLowerCase(Locale.ROOT).replace('_', '-');
        return Arrays.stream(values())
                .filter(v -> v.tag.equals(normalized))
                .findFirst()
                .orElseThrow(() -> new ConfigurationException(
                        "Ley cinética desconocida: '" + tag + "'. Valores admitidos: " + Arrays.toString(tags())));
    }

    private static String[] tags() {
        return Arrays.stream(values()).map(KineticsVariant::getTag).toArray(String[]::new);
    }

    /**
     * Forma funcional de la velocidad que produce una ley cinética.
     */
    public enum RateShape {
        /**
         * R = μ(S, B) · B
         */
        BIOMASS_COUPLED,
        /**
         * R calculada directamente, sin acoplamiento a la biomasa.
         */
        DIRECT
    }
}
