package biodigester.physics.solver;

/**
 * Integrador de paso adaptativo intercambiable.
 * <p>
 * El integrador elige sus propios pasos internos y, por separado, produce exactamente las muestras
 * pedidas por el llamador. El número de muestras no afecta a la precisión de la solución.
 */
public interface OdeIntegrator {

    String getName();

    /**
     * Integra el sistema en [startTime, endTime] y muestrea la solución en {@code sampleCount} instantes
     * equiespaciados, extremos incluidos.
     *
     * @throws biodigester.domain.exception.IntegrationException si el paso colapsa o se agota el presupuesto.
     * @throws biodigester.domain.exception.DomainException      si el sistema falla al evaluarse.
     */
    IntegrationResult integrate(OdeSystem system, double[] initialState, double startTime, double endTime, int sampleCount);
}
