package biodigester.factory;

import biodigester.config.KineticParameters;
import biodigester.config.KineticsVariant;
import biodigester.config.SimulationConfig;
import biodigester.config.SolverSettings;
import biodigester.config.YieldCoefficients;
import biodigester.domain.exception.ConfigurationException;
import biodigester.domain.reactor.StateVector;
import biodigester.domain.simulation.SimulationRequestDTO;

import java.util.Map;

/**
 * Traduce la petición plana de la capa de presentación a una {@link SimulationConfig} validada.
 * <p>
 * Aquí es donde una etiqueta desconocida o un parámetro ausente se convierten en
 * {@link ConfigurationException}, antes de construir nada que pueda integrarse.
 */
public final class SimulationConfigFactory {

    private SimulationConfigFactory() {}

    public static SimulationConfig fromRequest(SimulationRequestDTO request) {
        return fromRequest(request, SolverSettings.defaults());
    }

    public static SimulationConfig fromRequest(SimulationRequestDTO request, SolverSettings solverSettings) {
        if (request == null) {
            throw new ConfigurationException("La petición de simulación es nula.");
        }
        KineticsVariant variant = KineticsVariant.fromTag(request.kinetics());
        KineticParameters kinetics = buildParameters(variant, request.parameters());

        SimulationConfig config = SimulationConfig.builder()
                .kinetics(kinetics)
                .yields(YieldCoefficients.ofBiomassYield(request.biomassYield()))
                .initialState(new StateVector(request.initialSubstrate(), request.initialBiomass(), request.initialBiogas()))
                .startTime(request.startTime())
                .endTime(request.endTime())
                .sampleCount(request.sampleCount())
                .solverSettings(solverSettings)
                .build();

        config.validate();
        return config;
    }

    /**
     * Extrae del mapa solo los parámetros que la variante necesita.
     */
    public static KineticParameters buildParameters(KineticsVariant variant, Map<String, Double> values) {
        ParameterReader p = new ParameterReader(variant, values);
        return switch (variant) {
            case MONOD -> new KineticParameters.Monod(p.get("mu_max"), p.get("K_S"));
            case LINEAR -> new KineticParameters.Linear(p.get("k"));
            case HALDANE -> new KineticParameters.Haldane(p.get("mu_max"), p.get("K_S"), p.get("K_I"));
            case CONTOIS -> new KineticParameters.Contois(p.get("mu_max"), p.get("K_C"));
            case TEISSIER -> new KineticParameters.Teissier(p.get("mu_max"), p.get("K_T"));
            case MOSER -> new KineticParameters.Moser(p.get("mu_max"), p.get("K_S"), p.get("n"));
            case CHEN_HASHIMOTO -> new KineticParameters.ChenHashimoto(p.get("mu_max"), p.get("S0"), p.get("k_CH"));
            case ANDREWS -> new KineticParameters.Andrews(p.get("mu_max"), p.get("K_S"), p.get("K_I"));
            case IERUSALIMSKY -> new KineticParameters.Ierusalimsky(p.get("mu_max"), p.get("K_S"), p.get("K_P"));
        };
    }

    private record ParameterReader(KineticsVariant variant, Map<String, Double> values) {

        double get(String name) {
            Double value = values == null ? null : values.get(name);
            if (value == null) {
                throw new ConfigurationException(String.format(
                        "Falta el parámetro %s, obligatorio para la cinética %s (requeridos: %s).",
                        name, variant.getTag(), variant.getRequiredParameters()));
            }
            return value;
        }
    }
}
