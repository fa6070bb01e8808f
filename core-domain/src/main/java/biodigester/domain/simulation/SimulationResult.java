package biodigester.domain.simulation;

import biodigester.config.KineticsVariant;

/**
 * Resultado completo de una ejecución: la trayectoria más las métricas del integrador.
 *
 * @param variant         Ley cinética usada.
 * @param trajectory      Serie temporal muestreada.
 * @param acceptedSteps   Pasos adaptativos aceptados.
 * @param rejectedSteps   Pasos rechazados por el control de error.
 * @param evaluations     Evaluaciones de la función derivada.
 * @param executionTimeMs Tiempo de cómputo (métrica de rendimiento).
 */
public record SimulationResult(
        KineticsVariant variant,
        Trajectory trajectory,
        int acceptedSteps,
        int rejectedSteps,
        int evaluations,
        long executionTimeMs
) {

    public TrajectorySummary summarize() {
        return TrajectorySummary.of(variant, trajectory);
    }
}
