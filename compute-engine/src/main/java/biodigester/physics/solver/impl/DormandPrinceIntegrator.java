package biodigester.physics.solver.impl;

import biodigester.config.SolverSettings;
import biodigester.domain.exception.ConfigurationException;
import biodigester.domain.exception.IntegrationException;
import biodigester.domain.exception.SimulationException;
import biodigester.physics.solver.IntegrationResult;
import biodigester.physics.solver.OdeIntegrator;
import biodigester.physics.solver.OdeSystem;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

/**
 * Runge-Kutta explícito embebido de Dormand-Prince 5(4) con control de paso adaptativo.
 * <p>
 * Características:
 * 1. FSAL: la última etapa de un paso aceptado es la primera del siguiente (6 evaluaciones por paso).
 * 2. Error local estimado con la solución embebida de orden 4, norma RMS escalada con atol + rtol·|y|.
 * 3. Salida densa de orden 4 (extensión continua de Hairer) para producir las muestras pedidas sin
 *    forzar al integrador a detenerse en ellas.
 * <p>
 * Sin estado entre llamadas: una misma instancia puede usarse desde varios hilos.
 */
@Slf4j
@Getter
public class DormandPrinceIntegrator implements OdeIntegrator {

    // --- Tablero de Butcher ---
    private static final double C2 = 1.0 / 5.0;
    private static final double C3 = 3.0 / 10.0;
    private static final double C4 = 4.0 / 5.0;
    private static final double C5 = 8.0 / 9.0;

    private static final double A21 = 1.0 / 5.0;
    private static final double A31 = 3.0 / 40.0, A32 = 9.0 / 40.0;
    private static final double A41 = 44.0 / 45.0, A42 = -56.0 / 15.0, A43 = 32.0 / 9.0;
    private static final double A51 = 19372.0 / 6561.0, A52 = -25360.0 / 2187.0, A53 = 64448.0 / 6561.0, A54 = -212.0 / 729.0;
    private static final double A61 = 9017.0 / 3168.0, A62 = -355.0 / 33.0, A63 = 46732.0 / 5247.0, A64 = 49.0 / 176.0, A65 = -5103.0 / 18656.0;
    // Pesos de orden 5 (coinciden con la fila 7: FSAL)
    private static final double B1 = 35.0 / 384.0, B3 = 500.0 / 1113.0, B4 = 125.0 / 192.0, B5 = -2187.0 / 6784.0, B6 = 11.0 / 84.0;

    // Diferencia entre orden 5 y orden 4
    private static final double E1 = 71.0 / 57600.0, E3 = -71.0 / 16695.0, E4 = 71.0 / 1920.0,
            E5 = -17253.0 / 339200.0, E6 = 22.0 / 525.0, E7 = -1.0 / 40.0;

    // Coeficientes de la salida densa
    private static final double D1 = -12715105075.0 / 11282082432.0, D3 = 87487479700.0 / 32700410799.0,
            D4 = -10690763975.0 / 1880347072.0, D5 = 701980252875.0 / 199316789632.0,
            D6 = -1453857185.0 / 822651844.0, D7 = 69997945.0 / 29380423.0;

    // --- Control de paso ---
    private static final double SAFETY = 0.9;
    private static final double MIN_SCALE = 0.2;
    private static final double MAX_SCALE = 10.0;
    private static final double ORDER_EXPONENT = 1.0 / 5.0;

    private final SolverSettings settings;

    public DormandPrinceIntegrator() {
        this(SolverSettings.defaults());
    }

    public DormandPrinceIntegrator(SolverSettings settings) {
        if (settings == null) {
            throw new ConfigurationException("Los ajustes del integrador no pueden ser nulos.");
        }
        settings.validate();
        this.settings = settings;
    }

    @Override
    public String getName() {
        return "DOPRI5(4)_Dense";
    }

    @Override
    public IntegrationResult integrate(OdeSystem system, double[] initialState, double startTime, double endTime, int sampleCount) {
        if (!(endTime > startTime)) {
            throw new ConfigurationException("El intervalo de integración debe cumplir t1 > t0.");
        }
        if (sampleCount < 2) {
            throw new ConfigurationException("Se necesitan al menos 2 muestras.");
        }

        final int n = initialState.length;
        final double span = endTime - startTime;
        final double minStep = settings.getMinimumStepFraction() * span;

        double[] sampleTimes = IntegrationResult.linearGrid(startTime, endTime, sampleCount);
        double[][] samples = new double[sampleCount][];
        samples[0] = initialState.clone();
        int nextSample = 1;

        // Etapas y buffers reutilizados durante todo el bucle
        double[] y = initialState.clone();
        double[] yNew = new double[n];
        double[] yStage = new double[n];
        double[] k1 = new double[n], k2 = new double[n], k3 = new double[n], k4 = new double[n],
                k5 = new double[n], k6 = new double[n], k7 = new double[n];
        double[] errorEstimate = new double[n];
        double[][] dense = new double[5][n];

        Counters counters = new Counters();
        double t = startTime;

        evaluate(system, t, y, k1, counters);
        double h = initialStepSize(system, t, y, k1, span, counters);

        boolean lastStepRejected = false;

        while (t < endTime) {
            if (counters.accepted + counters.rejected >= settings.getMaxSteps()) {
                throw new IntegrationException(String.format(
                        "Presupuesto de %d pasos agotado en t=%.6g sin alcanzar t1=%.6g.", settings.getMaxSteps(), t, endTime), t);
            }
            if (!Double.isFinite(h) || h < minStep) {
                throw new IntegrationException(String.format(
                        "El paso adaptativo colapsó (h=%.3e < h_min=%.3e) en t=%.6g. Sistema rígido o mal planteado.", h, minStep, t), t);
            }

            boolean finalStep = t + h >= endTime;
            if (finalStep) {
                h = endTime - t;
            }

            // --- Etapas 2..7 ---
            for (int i = 0; i < n; i++) yStage[i] = y[i] + h * A21 * k1[i];
            evaluate(system, t + C2 * h, yStage, k2, counters);

            for (int i = 0; i < n; i++) yStage[i] = y[i] + h * (A31 * k1[i] + A32 * k2[i]);
            evaluate(system, t + C3 * h, yStage, k3, counters);

            for (int i = 0; i < n; i++) yStage[i] = y[i] + h * (A41 * k1[i] + A42 * k2[i] + A43 * k3[i]);
            evaluate(system, t + C4 * h, yStage, k4, counters);

            for (int i = 0; i < n; i++) yStage[i] = y[i] + h * (A51 * k1[i] + A52 * k2[i] + A53 * k3[i] + A54 * k4[i]);
            evaluate(system, t + C5 * h, yStage, k5, counters);

            for (int i = 0; i < n; i++) yStage[i] = y[i] + h * (A61 * k1[i] + A62 * k2[i] + A63 * k3[i] + A64 * k4[i] + A65 * k5[i]);
            double tNew = finalStep ? endTime : t + h;
            evaluate(system, tNew, yStage, k6, counters);

            for (int i = 0; i < n; i++) yNew[i] = y[i] + h * (B1 * k1[i] + B3 * k3[i] + B4 * k4[i] + B5 * k5[i] + B6 * k6[i]);
            evaluate(system, tNew, yNew, k7, counters);

            // --- Estimación del error ---
            for (int i = 0; i < n; i++) {
                errorEstimate[i] = h * (E1 * k1[i] + E3 * k3[i] + E4 * k4[i] + E5 * k5[i] + E6 * k6[i] + E7 * k7[i]);
            }
            double error = errorNorm(errorEstimate, y, yNew);

            if (!Double.isFinite(error)) {
                // Estado no representable: solo se puede reducir el paso
                counters.rejected++;
                lastStepRejected = true;
                h *= MIN_SCALE;
                log.debug("Paso rechazado por error no finito en t={}. Nuevo h={}", t, h);
                continue;
            }

            if (error <= 1.0) {
                // --- Paso aceptado: preparar salida densa y emitir muestras ---
                prepareDenseOutput(dense, y, yNew, k1, k3, k4, k5, k6, k7, h);

                while (nextSample < sampleCount && sampleTimes[nextSample] <= tNew) {
                    if (nextSample == sampleCount - 1 && finalStep) {
                        samples[nextSample] = yNew.clone();
                    } else {
                        samples[nextSample] = interpolate(dense, (sampleTimes[nextSample] - t) / h);
                    }
                    nextSample++;
                }

                t = tNew;
                System.arraycopy(yNew, 0, y, 0, n);
                System.arraycopy(k7, 0, k1, 0, n); // FSAL
                counters.accepted++;

                double scale = error == 0.0 ? MAX_SCALE : SAFETY * Math.pow(error, -ORDER_EXPONENT);
                scale = Math.min(MAX_SCALE, Math.max(MIN_SCALE, scale));
                if (lastStepRejected) {
                    scale = Math.min(1.0, scale);
                }
                h = Math.min(h * scale, span);
                lastStepRejected = false;
            } else {
                counters.rejected++;
                lastStepRejected = true;
                double scale = Math.max(MIN_SCALE, SAFETY * Math.pow(error, -ORDER_EXPONENT));
                h *= scale;
                if (counters.rejected % 50 == 0) {
                    log.warn("DOPRI5: {} pasos rechazados hasta t={} (h={})", counters.rejected, t, h);
                }
            }
        }

        // Muestras pendientes por redondeo de la malla
        while (nextSample < sampleCount) {
            samples[nextSample++] = y.clone();
        }

        log.debug("DOPRI5 completado: {} aceptados, {} rechazados, {} evaluaciones.",
                counters.accepted, counters.rejected, counters.evaluations);

        return new IntegrationResult(sampleTimes, samples, counters.accepted, counters.rejected, counters.evaluations);
    }

    // --- Helpers numéricos ---

    private void evaluate(OdeSystem system, double t, double[] state, double[] out, Counters counters) {
        counters.evaluations++;
        try {
            system.computeDerivatives(t, state, out);
        } catch (SimulationException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new IntegrationException("La función derivada falló en t=" + t + ": " + e.getMessage(), t, e);
        }
    }

    /**
     * Estimación inicial del paso (Hairer, Nørsett y Wanner, algoritmo II.4).
     */
    private double initialStepSize(OdeSystem system, double t0, double[] y0, double[] f0, double span, Counters counters) {
        int n = y0.length;
        double d0 = 0.0, d1 = 0.0;
        for (int i = 0; i < n; i++) {
            double sc = settings.getAbsoluteTolerance() + settings.getRelativeTolerance() * Math.abs(y0[i]);
            d0 += (y0[i] / sc) * (y0[i] / sc);
            d1 += (f0[i] / sc) * (f0[i] / sc);
        }
        d0 = Math.sqrt(d0 / n);
        d1 = Math.sqrt(d1 / n);

        double h0 = (d0 < 1e-5 || d1 < 1e-5) ? 1e-6 : 0.01 * d0 / d1;
        h0 = Math.min(h0, span);

        double[] y1 = new double[n];
        double[] f1 = new double[n];
        for (int i = 0; i < n; i++) y1[i] = y0[i] + h0 * f0[i];
        evaluate(system, t0 + h0, y1, f1, counters);

        double d2 = 0.0;
        for (int i = 0; i < n; i++) {
            double sc = settings.getAbsoluteTolerance() + settings.getRelativeTolerance() * Math.abs(y0[i]);
            d2 += ((f1[i] - f0[i]) / sc) * ((f1[i] - f0[i]) / sc);
        }
        d2 = Math.sqrt(d2 / n) / h0;

        double maxD = Math.max(d1, d2);
        double h1 = maxD <= 1e-15
                ? Math.max(1e-6, h0 * 1e-3)
                : Math.pow(0.01 / maxD, ORDER_EXPONENT);

        double h = Math.min(Math.min(100.0 * h0, h1), span);
        log.debug("Paso inicial estimado: h={} (d0={}, d1={}, d2={})", h, d0, d1, d2);
        return h;
    }

    private double errorNorm(double[] errorEstimate, double[] y, double[] yNew) {
        double sum = 0.0;
        for (int i = 0; i < y.length; i++) {
            double sc = settings.getAbsoluteTolerance()
                    + settings.getRelativeTolerance() * Math.max(Math.abs(y[i]), Math.abs(yNew[i]));
            double ratio = errorEstimate[i] / sc;
            sum += ratio * ratio;
        }
        return Math.sqrt(sum / y.length);
    }

    private static void prepareDenseOutput(double[][] dense, double[] y, double[] yNew,
                                           double[] k1, double[] k3, double[] k4, double[] k5,
                                           double[] k6, double[] k7, double h) {
        for (int i = 0; i < y.length; i++) {
            double yDiff = yNew[i] - y[i];
            double bSpline = h * k1[i] - yDiff;
            dense[0][i] = y[i];
            dense[1][i] = yDiff;
            dense[2][i] = bSpline;
            dense[3][i] = yDiff - h * k7[i] - bSpline;
            dense[4][i] = h * (D1 * k1[i] + D3 * k3[i] + D4 * k4[i] + D5 * k5[i] + D6 * k6[i] + D7 * k7[i]);
        }
    }

    private static double[] interpolate(double[][] dense, double theta) {
        int n = dense[0].length;
        double theta1 = 1.0 - theta;
        double[] out = new double[n];
        for (int i = 0; i < n; i++) {
            out[i] = dense[0][i] + theta * (dense[1][i] + theta1 * (dense[2][i] + theta * (dense[3][i] + theta1 * dense[4][i])));
        }
        return out;
    }

    private static final class Counters {
        int accepted;
        int rejected;
        int evaluations;
    }
}
