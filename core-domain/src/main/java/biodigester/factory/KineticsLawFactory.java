package biodigester.factory;

import biodigester.config.KineticParameters;
import biodigester.domain.exception.ConfigurationException;
import biodigester.physics.model.*;

/**
 * Fábrica de leyes cinéticas a partir de sus parámetros.
 * <p>
 * El despacho se hace sobre la variante que declara cada record de parámetros, de modo que cada
 * ley recibe exactamente los parámetros de su fórmula. Los parámetros se validan aquí, antes de
 * que el integrador evalúe la ley por primera vez.
 */
public final class KineticsLawFactory {

    private KineticsLawFactory() {}

    /**
     * @throws ConfigurationException si los parámetros son nulos, inconsistentes con su variante o
     *                                están fuera del dominio de la fórmula.
     */
    public static KineticsLaw create(KineticParameters params) {
        if (params == null || params.variant() == null) {
            throw new ConfigurationException("No se ha indicado ninguna ley cinética.");
        }
        params.validate();

        return switch (params.variant()) {
            case MONOD -> new MonodKinetics(cast(params, KineticParameters.Monod.class));
            case LINEAR -> new LinearKinetics(cast(params, KineticParameters.Linear.class));
            case HALDANE -> new HaldaneKinetics(cast(params, KineticParameters.Haldane.class));
            case CONTOIS -> new ContoisKinetics(cast(params, KineticParameters.Contois.class));
            case TEISSIER -> new TeissierKinetics(cast(params, KineticParameters.Teissier.class));
            case MOSER -> new MoserKinetics(cast(params, KineticParameters.Moser.class));
            case CHEN_HASHIMOTO -> new ChenHashimotoKinetics(cast(params, KineticParameters.ChenHashimoto.class));
            case ANDREWS -> new AndrewsKinetics(cast(params, KineticParameters.Andrews.class));
            case IERUSALIMSKY -> new IerusalimskyKinetics(cast(params, KineticParameters.Ierusalimsky.class));
        };
    }

    private static <T extends KineticParameters> T cast(KineticParameters params, Class<T> expected) {
        if (!expected.isInstance(params)) {
            throw new ConfigurationException(String.format(
                    "Los parámetros %s no corresponden a la variante %s.",
                    params.getClass().getSimpleName(), params.variant().getTag()));
        }
        return expected.cast(params);
    }
}
