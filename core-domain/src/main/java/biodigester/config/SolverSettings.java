package biodigester.config;

import biodigester.domain.exception.ConfigurationException;
import lombok.Builder;
import lombok.Value;
import lombok.With;

/**
 * Control del paso adaptativo del integrador.
 */
@Value
@Builder
@With
public class SolverSettings {

    /**
     * Tolerancia relativa por componente.
     */
    @Builder.Default
    double relativeTolerance = 1e-6;

    /**
     * Tolerancia absoluta por componente.
     */
    @Builder.Default
    double absoluteTolerance = 1e-9;

    /**
     * Paso mínimo admitido, relativo a la longitud del intervalo. Por debajo se aborta.
     */
    @Builder.Default
    double minimumStepFraction = 1e-12;

    /**
     * Presupuesto de pasos (aceptados + rechazados) antes de abortar.
     */
    @Builder.Default
    int maxSteps = 100_000;

    public static SolverSettings defaults() {
        return SolverSettings.builder().build();
    }

    public void validate() {
        if (!(relativeTolerance > 0.0) || !(absoluteTolerance > 0.0)) {
            throw new ConfigurationException("Las tolerancias del integrador deben ser positivas.");
        }
        if (!(minimumStepFraction > 0.0) || minimumStepFraction >= 1.0) {
            throw new ConfigurationException("La fracción de paso mínimo debe estar en (0, 1).");
        }
        if (maxSteps <= 0) {
            throw new ConfigurationException("El presupuesto de pasos debe ser > 0.");
        }
    }
}
