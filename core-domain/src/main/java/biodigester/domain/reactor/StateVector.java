package biodigester.domain.reactor;

/**
 * Estado del digestor en un instante.
 *
 * @param substrate S, concentración de sustrato (g/L).
 * @param biomass   B, concentración de biomasa (g/L). Estrictamente positiva durante la simulación.
 * @param biogas    G, biogás acumulado (g/L). No decrece en el tiempo.
 */
public record StateVector(double substrate, double biomass, double biogas) {

    public static final int DIMENSION = 3;

    public static final int SUBSTRATE = 0;
    public static final int BIOMASS = 1;
    public static final int BIOGAS = 2;

    public static StateVector of(double[] values) {
        if (values == null || values.length != DIMENSION) {
            throw new IllegalArgumentException("Un estado del digestor tiene exactamente " + DIMENSION + " componentes.");
        }
        return new StateVector(values[SUBSTRATE], values[BIOMASS], values[BIOGAS]);
    }

    public double[] toArray() {
        return new double[]{substrate, biomass, biogas};
    }

    /**
     * Masa total S + B + G. Se conserva con el balance de reparto de rendimiento.
     */
    public double totalMass() {
        return substrate + biomass + biogas;
    }
}
