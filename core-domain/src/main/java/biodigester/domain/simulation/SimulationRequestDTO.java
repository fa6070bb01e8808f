package biodigester.domain.simulation;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Petición plana tal como la envía la capa de presentación: etiqueta de la ley cinética,
 * parámetros por nombre y condiciones iniciales. Se convierte en una configuración validada con
 * {@code SimulationConfigFactory}.
 *
 * @param kinetics         Etiqueta de la ley ("monod", "contois", ...).
 * @param parameters       Parámetros cinéticos por nombre externo ("mu_max", "K_S", ...). Puede incluir
 *                         parámetros que la ley elegida no usa; se ignoran.
 * @param biomassYield     Y_b.
 * @param initialSubstrate S0 (g/L).
 * @param initialBiomass   B0 (g/L).
 * @param initialBiogas    G0 (g/L).
 * @param startTime        t0 (días).
 * @param endTime          t1 (días).
 * @param sampleCount      N.
 */
public record SimulationRequestDTO(
        String kinetics,
        Map<String, Double> parameters,
        double biomassYield,
        double initialSubstrate,
        double initialBiomass,
        double initialBiogas,
        double startTime,
        double endTime,
        int sampleCount
) {

    /**
     * Valores por defecto del formulario del operador.
     */
    public static SimulationRequestDTO defaults() {
        Map<String, Double> params = new LinkedHashMap<>();
        params.put("mu_max", 0.4);
        params.put("K_S", 20.0);
        params.put("K_I", 250.0);
        params.put("K_C", 5.0);
        params.put("K_T", 15.0);
        params.put("k", 0.05);
        return new SimulationRequestDTO("monod", params, 0.3, 100.0, 1.0, 0.0, 0.0, 50.0, 300);
    }

    public SimulationRequestDTO withKinetics(String newKinetics) {
        return new SimulationRequestDTO(newKinetics, parameters, biomassYield, initialSubstrate,
                initialBiomass, initialBiogas, startTime, endTime, sampleCount);
    }

    /**
     * Copia con un parámetro cinético añadido o sustituido.
     */
    public SimulationRequestDTO withParameter(String name, double value) {
        Map<String, Double> copy = parameters == null ? new LinkedHashMap<>() : new LinkedHashMap<>(parameters);
        copy.put(name, value);
        return new SimulationRequestDTO(kinetics, copy, biomassYield, initialSubstrate,
                initialBiomass, initialBiogas, startTime, endTime, sampleCount);
    }

    public SimulationRequestDTO withInitialBiomass(double newInitialBiomass) {
        return new SimulationRequestDTO(kinetics, parameters, biomassYield, initialSubstrate,
                newInitialBiomass, initialBiogas, startTime, endTime, sampleCount);
    }
}
