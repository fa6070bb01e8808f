package biodigester.io;

import biodigester.domain.simulation.Trajectory;
import lombok.extern.slf4j.Slf4j;

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.StringWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;

/**
 * Exporta una trayectoria a CSV con cabecera {@code t,S,B,G}.
 */
@Slf4j
public final class TrajectoryCsvExporter {

    public static final String HEADER = "t,S,B,G";

    private TrajectoryCsvExporter() {}

    public static void write(Trajectory trajectory, Path path) throws IOException {
        Path parent = path.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        try (BufferedWriter w = Files.newBufferedWriter(path, StandardCharsets.UTF_8)) {
            write(trajectory, w);
        }
        log.info("Trayectoria de {} muestras exportada a {}", trajectory.size(), path.toAbsolutePath());
    }

    public static String toCsv(Trajectory trajectory) {
        StringWriter out = new StringWriter();
        try {
            write(trajectory, out);
        } catch (IOException e) {
            throw new IllegalStateException("Error inesperado escribiendo en memoria", e);
        }
        return out.toString();
    }

    private static void write(Trajectory trajectory, Writer w) throws IOException {
        w.write(HEADER);
        w.write('\n');
        double[] t = trajectory.getTimes();
        double[] s = trajectory.getSubstrate();
        double[] b = trajectory.getBiomass();
        double[] g = trajectory.getBiogas();
        for (int i = 0; i < t.length; i++) {
            w.write(String.format(Locale.ROOT, "%.6g,%.9g,%.9g,%.9g\n", t[i], s[i], b[i], g[i]));
        }
    }
}
