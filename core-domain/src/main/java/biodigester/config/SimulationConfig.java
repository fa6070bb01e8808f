package biodigester.config;

import biodigester.domain.exception.ConfigurationException;
import biodigester.domain.reactor.StateVector;
import lombok.Builder;
import lombok.Value;
import lombok.With;

/**
 * Contenedor inmutable con todo lo necesario para una ejecución del digestor por lotes:
 * ley cinética y sus parámetros, rendimientos, estado inicial, intervalo de tiempo y número de muestras.
 * <p>
 * Se construye una vez por ejecución y no se modifica; {@link #validate()} se llama antes de integrar.
 */
@Value
@Builder
@With
public class SimulationConfig {

    /**
     * Ley cinética seleccionada junto con sus parámetros propios.
     */
    KineticParameters kinetics;

    YieldCoefficients yields;

    /**
     * Estado en t0. B0 debe ser estrictamente positiva.
     */
    StateVector initialState;

    /**
     * Instante inicial (días).
     */
    @Builder.Default
    double startTime = 0.0;

    /**
     * Instante final (días), incluido en la salida.
     */
    double endTime;

    /**
     * Número de muestras equiespaciadas en [t0, t1], extremos incluidos.
     */
    @Builder.Default
    int sampleCount = 300;

    @Builder.Default
    SolverSettings solverSettings = SolverSettings.defaults();

    public KineticsVariant getKineticsVariant() {
        return kinetics == null ? null : kinetics.variant();
    }

    /**
     * Resumen legible de la configuración, usado para anotar errores.
     */
    public String describe() {
        return String.format("%s, Y_b=%s, S0=%s, B0=%s, G0=%s, t=[%s, %s], N=%d",
                kinetics == null ? "-" : kinetics.describe(),
                yields == null ? "-" : yields.biomassYield(),
                initialState == null ? "-" : initialState.substrate(),
                initialState == null ? "-" : initialState.biomass(),
                initialState == null ? "-" : initialState.biogas(),
                startTime, endTime, sampleCount);
    }

    /**
     * Comprueba todos los invariantes de la configuración.
     *
     * @throws ConfigurationException en la primera violación encontrada.
     */
    public void validate() {
        if (kinetics == null) {
            throw new ConfigurationException("No se ha indicado ninguna ley cinética.");
        }
        kinetics.validate();

        if (yields == null) {
            throw new ConfigurationException("Faltan los coeficientes de rendimiento.");
        }
        yields.validate();

        if (initialState == null) {
            throw new ConfigurationException("Falta el estado inicial del digestor.");
        }
        validateInitialState();

        if (!Double.isFinite(startTime) || !Double.isFinite(endTime)) {
            throw new ConfigurationException("El intervalo de tiempo debe ser finito.");
        }
        if (endTime <= startTime) {
            throw new ConfigurationException("El tiempo final (" + endTime + ") debe ser mayor que el inicial (" + startTime + ").");
        }
        if (sampleCount < 2) {
            throw new ConfigurationException("Se necesitan al menos 2 muestras (valor: " + sampleCount + ").");
        }

        if (solverSettings == null) {
            throw new ConfigurationException("Faltan los ajustes del integrador.");
        }
        solverSettings.validate();
    }

    private void validateInitialState() {
        double s = initialState.substrate();
        double b = initialState.biomass();
        double g = initialState.biogas();

        if (!Double.isFinite(s) || s < 0.0) {
            throw new ConfigurationException("El sustrato inicial S0 debe ser finito y no negativo (valor: " + s + ").");
        }
        if (!Double.isFinite(b) || b <= 0.0) {
            throw new ConfigurationException("La biomasa inicial B0 debe ser estrictamente positiva (valor: " + b + ").");
        }
        if (!Double.isFinite(g) || g < 0.0) {
            throw new ConfigurationException("El biogás inicial G0 debe ser finito y no negativo (valor: " + g + ").");
        }
    }
}
