package biodigester.domain.simulation;

import biodigester.domain.reactor.StateVector;

/**
 * Serie temporal producida por una ejecución: N instantes equiespaciados en [t0, t1] y las
 * tres concentraciones en cada uno.
 * <p>
 * Inmutable. Los getters devuelven copias, de modo que el llamador puede modificarlas libremente.
 */
public final class Trajectory {

    private final double[] times;
    private final double[] substrate;
    private final double[] biomass;
    private final double[] biogas;

    public Trajectory(double[] times, double[] substrate, double[] biomass, double[] biogas) {
        if (times == null || substrate == null || biomass == null || biogas == null) {
            throw new IllegalArgumentException("Ninguna serie de la trayectoria puede ser nula.");
        }
        int n = times.length;
        if (substrate.length != n || biomass.length != n || biogas.length != n) {
            throw new IllegalArgumentException("Todas las series de la trayectoria deben tener la misma longitud.");
        }
        for (int i = 1; i < n; i++) {
            if (!(times[i] > times[i - 1])) {
                throw new IllegalArgumentException("La malla temporal debe ser estrictamente creciente (índice " + i + ").");
            }
        }
        this.times = times.clone();
        this.substrate = substrate.clone();
        this.biomass = biomass.clone();
        this.biogas = biogas.clone();
    }

    /**
     * Construye la trayectoria a partir de la malla y una matriz de estados [N][3].
     */
    public static Trajectory fromStates(double[] times, double[][] states) {
        int n = times.length;
        if (states.length != n) {
            throw new IllegalArgumentException("Se esperaban " + n + " estados y se recibieron " + states.length + ".");
        }
        double[] s = new double[n];
        double[] b = new double[n];
        double[] g = new double[n];
        for (int i = 0; i < n; i++) {
            StateVector state = StateVector.of(states[i]);
            s[i] = state.substrate();
            b[i] = state.biomass();
            g[i] = state.biogas();
        }
        return new Trajectory(times, s, b, g);
    }

    public int size() {
        return times.length;
    }

    public double[] getTimes() {
        return times.clone();
    }

    public double[] getSubstrate() {
        return substrate.clone();
    }

    public double[] getBiomass() {
        return biomass.clone();
    }

    public double[] getBiogas() {
        return biogas.clone();
    }

    public double timeAt(int index) {
        return times[index];
    }

    public StateVector getStateAt(int index) {
        return new StateVector(substrate[index], biomass[index], biogas[index]);
    }

    public StateVector getInitialState() {
        return getStateAt(0);
    }

    public StateVector getFinalState() {
        return getStateAt(times.length - 1);
    }
}
