package biodigester.physics.solver;

/**
 * Salida del integrador: malla de muestreo, estados muestreados ([N][dimensión]) y estadísticas.
 */
public record IntegrationResult(
        double[] times,
        double[][] states,
        int acceptedSteps,
        int rejectedSteps,
        int evaluations
) {

    public int sampleCount() {
        return times.length;
    }

    /**
     * Malla equiespaciada con extremos exactos.
     */
    public static double[] linearGrid(double startTime, double endTime, int sampleCount) {
        double[] grid = new double[sampleCount];
        double spacing = (endTime - startTime) / (sampleCount - 1);
        for (int i = 0; i < sampleCount; i++) {
            grid[i] = startTime + i * spacing;
        }
        grid[sampleCount - 1] = endTime;
        return grid;
    }
}
