package biodigester.physics.simulator;

import biodigester.config.SimulationConfig;
import biodigester.domain.exception.SimulationException;
import biodigester.domain.simulation.SimulationResult;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * Ejecuta barridos de parámetros en paralelo.
 * <p>
 * Cada configuración es independiente e inmutable, así que no hace falta coordinación entre hilos.
 * Un fallo en una ejecución se registra como resultado de esa configuración y no afecta al resto.
 * Los resultados se devuelven en el orden de entrada.
 */
@Slf4j
public class ParameterSweepRunner implements AutoCloseable {

    private final SimulationRunner runner;
    private final ExecutorService threadPool;

    public ParameterSweepRunner(SimulationRunner runner, int processorCount) {
        this.runner = runner;
        this.threadPool = Executors.newFixedThreadPool(Math.max(processorCount, 1));
        log.info("ParameterSweepRunner inicializado con {} hilos.", Math.max(processorCount, 1));
    }

    public ParameterSweepRunner(int processorCount) {
        this(new SimulationRunner(), processorCount);
    }

    public List<SweepOutcome> runAll(List<SimulationConfig> configs) {
        List<Callable<SimulationResult>> tasks = new ArrayList<>(configs.size());
        for (SimulationConfig config : configs) {
            tasks.add(() -> runner.execute(config));
        }

        List<Future<SimulationResult>> futures;
        try {
            futures = threadPool.invokeAll(tasks);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Barrido de parámetros interrumpido.", e);
        }

        List<SweepOutcome> outcomes = new ArrayList<>(configs.size());
        int failures = 0;
        for (int i = 0; i < futures.size(); i++) {
            SimulationConfig config = configs.get(i);
            try {
                outcomes.add(SweepOutcome.success(config, futures.get(i).get()));
            } catch (ExecutionException e) {
                if (e.getCause() instanceof SimulationException simulationError) {
                    failures++;
                    outcomes.add(SweepOutcome.failure(config, simulationError));
                } else {
                    throw new IllegalStateException("Error inesperado en la ejecución " + i + " del barrido.", e.getCause());
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new IllegalStateException("Barrido de parámetros interrumpido.", e);
            }
        }

        log.info("Barrido completado: {} ejecuciones, {} fallidas.", outcomes.size(), failures);
        return outcomes;
    }

    @Override
    public void close() {
        if (threadPool != null && !threadPool.isShutdown()) {
            threadPool.shutdown();
        }
        log.info("ParameterSweepRunner cerrado.");
    }

    /**
     * Resultado de una configuración del barrido: o bien un resultado, o bien el error que la abortó.
     */
    public record SweepOutcome(SimulationConfig config, SimulationResult result, SimulationException error) {

        static SweepOutcome success(SimulationConfig config, SimulationResult result) {
            return new SweepOutcome(config, result, null);
        }

        static SweepOutcome failure(SimulationConfig config, SimulationException error) {
            return new SweepOutcome(config, null, error);
        }

        public boolean isSuccess() {
            return error == null;
        }
    }
}
