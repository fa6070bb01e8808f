package biodigester.physics.simulator;

import biodigester.config.KineticsVariant;
import biodigester.config.SimulationConfig;
import biodigester.config.SolverSettings;
import biodigester.domain.exception.ConfigurationException;
import biodigester.domain.exception.SimulationException;
import biodigester.domain.simulation.SimulationResult;
import biodigester.domain.simulation.Trajectory;
import biodigester.factory.KineticsLawFactory;
import biodigester.physics.model.KineticsLaw;
import biodigester.physics.model.SplitYieldMassBalance;
import biodigester.physics.solver.IntegrationResult;
import biodigester.physics.solver.OdeIntegrator;
import biodigester.physics.solver.impl.DormandPrinceIntegrator;
import biodigester.physics.solver.impl.ReactorOdeSystem;
import lombok.extern.slf4j.Slf4j;

import java.util.function.Function;

/**
 * Punto de entrada único para los colaboradores externos.
 * <p>
 * Orquesta: validación de la configuración → ley cinética + balance de masa → sistema ODE →
 * integración adaptativa → trayectoria muestreada.
 * <p>
 * Sin estado entre ejecuciones: una instancia puede compartirse entre hilos.
 * Los errores de configuración, dominio e integración se propagan sin recuperación, anotados con la
 * variante cinética y los parámetros de la ejecución.
 */
@Slf4j
public class SimulationRunner {

    private final Function<SolverSettings, OdeIntegrator> integratorProvider;

    /**
     * Constructor por defecto: Dormand-Prince 5(4) con los ajustes de cada configuración.
     */
    public SimulationRunner() {
        this(DormandPrinceIntegrator::new);
    }

    /**
     * @param integratorProvider Construye el integrador a partir de los ajustes de la configuración.
     */
    public SimulationRunner(Function<SolverSettings, OdeIntegrator> integratorProvider) {
        this.integratorProvider = integratorProvider;
    }

    /**
     * Ejecuta la simulación y devuelve solo la trayectoria.
     */
    public Trajectory run(SimulationConfig config) {
        return execute(config).trajectory();
    }

    /**
     * Ejecuta la simulación y devuelve la trayectoria junto con las métricas del integrador.
     */
    public SimulationResult execute(SimulationConfig config) {
        if (config == null) {
            throw new ConfigurationException("La configuración de la simulación es nula.");
        }
        KineticsVariant variant = config.getKineticsVariant();

        try {
            // 1. Validación completa antes de cualquier paso de integración
            config.validate();

            // 2. Construcción del sistema físico
            KineticsLaw law = KineticsLawFactory.create(config.getKinetics());
            ReactorOdeSystem system = new ReactorOdeSystem(law, new SplitYieldMassBalance(config.getYields()));
            OdeIntegrator integrator = integratorProvider.apply(config.getSolverSettings());

            log.info("Iniciando simulación: cinética={}, integrador={}, t=[{}, {}], N={}",
                    variant.getTag(), integrator.getName(), config.getStartTime(), config.getEndTime(), config.getSampleCount());

            // 3. Integración
            long startTime = System.currentTimeMillis();
            IntegrationResult raw = integrator.integrate(
                    system,
                    config.getInitialState().toArray(),
                    config.getStartTime(),
                    config.getEndTime(),
                    config.getSampleCount());
            long elapsed = System.currentTimeMillis() - startTime;

            Trajectory trajectory = Trajectory.fromStates(raw.times(), raw.states());

            log.info("Simulación finalizada en {}ms: {} pasos aceptados, {} rechazados, {} evaluaciones. Estado final: {}",
                    elapsed, raw.acceptedSteps(), raw.rejectedSteps(), raw.evaluations(), trajectory.getFinalState());

            return new SimulationResult(variant, trajectory, raw.acceptedSteps(), raw.rejectedSteps(), raw.evaluations(), elapsed);

        } catch (SimulationException e) {
            log.error("Simulación abortada ({}): {}", e.getClass().getSimpleName(), e.getMessage());
            throw e.annotate(variant, config.describe());
        }
    }
}
