package biodigester.io;

import biodigester.domain.simulation.Trajectory;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

class TrajectoryCsvExporterTest {

    @TempDir
    Path tempDir;

    private static Trajectory sample() {
        return new Trajectory(
                new double[]{0.0, 25.0, 50.0},
                new double[]{100.0, 40.5, 0.25},
                new double[]{1.0, 18.85, 30.925},
                new double[]{0.0, 41.65, 69.825});
    }

    @Test
    @DisplayName("CSV: cabecera t,S,B,G y una fila por muestra")
    void toCsv_shouldWriteHeaderAndRows() {
        String csv = TrajectoryCsvExporter.toCsv(sample());
        String[] lines = csv.split("\n");

        assertEquals(4, lines.length);
        assertEquals(TrajectoryCsvExporter.HEADER, lines[0]);
        String[] firstRow = lines[1].split(",");
        assertEquals(4, firstRow.length);
        assertEquals(100.0, Double.parseDouble(firstRow[1]), 1e-9);
        assertEquals(50.0, Double.parseDouble(lines[3].split(",")[0]), 1e-9);
    }

    @Test
    @DisplayName("Archivo: se crean los directorios y se escribe el contenido")
    void write_shouldCreateFile() throws IOException {
        Path file = tempDir.resolve("exports/run.csv");

        TrajectoryCsvExporter.write(sample(), file);

        List<String> lines = Files.readAllLines(file);
        assertThat(lines).hasSize(4).first().isEqualTo("t,S,B,G");
    }
}
