package biodigester.io;

import biodigester.domain.simulation.SimulationRequestDTO;
import biodigester.domain.simulation.Trajectory;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Serializa y deserializa objetos del digestor hacia y desde archivos JSON
 * (peticiones de simulación, trayectorias, resúmenes).
 * <p>
 * Es un colaborador externo del núcleo: el núcleo nunca lee ni escribe archivos.
 */
@Slf4j
public class JsonFileHandler {

    // Costoso de crear y thread-safe: se comparte
    private static final ObjectMapper objectMapper = createConfiguredObjectMapper();

    private static ObjectMapper createConfiguredObjectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.enable(SerializationFeature.INDENT_OUTPUT);
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        mapper.findAndRegisterModules();
        return mapper;
    }

    /**
     * Serializa un objeto a un archivo JSON. Si el archivo ya existe, se sobrescribe.
     *
     * @throws IOException si ocurre un error durante la escritura.
     */
    public <T> void writeToFile(T data, Path path) throws IOException {
        log.info("Serializando {} a archivo: {}", data.getClass().getSimpleName(), path.toAbsolutePath());
        try {
            Path parent = path.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            objectMapper.writeValue(path.toFile(), data);
            log.debug("Escritura a JSON completada.");
        } catch (IOException e) {
            log.error("Error al escribir el archivo JSON en {}", path.toAbsolutePath(), e);
            throw e;
        }
    }

    /**
     * Deserializa un archivo JSON a un objeto del tipo indicado.
     *
     * @throws IOException si el archivo no existe o no se puede parsear.
     */
    public <T> T readFromFile(Path path, Class<T> objectType) throws IOException {
        log.info("Deserializando {} a {}", path.toAbsolutePath(), objectType.getSimpleName());
        if (!Files.exists(path)) {
            throw new IOException("El archivo especificado no existe: " + path.toAbsolutePath());
        }
        try {
            return objectMapper.readValue(path.toFile(), objectType);
        } catch (IOException e) {
            log.error("Error al leer o parsear el archivo JSON {}", path.toAbsolutePath(), e);
            throw e;
        }
    }

    public SimulationRequestDTO readRequest(Path path) throws IOException {
        return readFromFile(path, SimulationRequestDTO.class);
    }

    /**
     * Escribe la trayectoria como cuatro series paralelas ({@code times}, {@code substrate}, {@code biomass},
     * {@code biogas}) más los estados inicial y final, que son informativos.
     */
    public void writeTrajectory(Trajectory trajectory, Path path) throws IOException {
        writeToFile(trajectory, path);
    }

    /**
     * Reconstruye una trayectoria escrita con {@link #writeTrajectory}. Solo se leen las cuatro series;
     * la coherencia (longitudes iguales, malla creciente) la valida {@link Trajectory}.
     *
     * @throws IOException si falta alguna serie o el contenido no forma una trayectoria válida.
     */
    public Trajectory readTrajectory(Path path) throws IOException {
        JsonNode root = readFromFile(path, JsonNode.class);
        try {
            return new Trajectory(
                    readSeries(root, "times", path),
                    readSeries(root, "substrate", path),
                    readSeries(root, "biomass", path),
                    readSeries(root, "biogas", path));
        } catch (IllegalArgumentException e) {
            throw new IOException("Trayectoria inválida en " + path.toAbsolutePath() + ": " + e.getMessage(), e);
        }
    }

    private static double[] readSeries(JsonNode root, String field, Path path) throws IOException {
        JsonNode node = root.get(field);
        if (node == null || !node.isArray()) {
            throw new IOException("Falta la serie '" + field + "' en " + path.toAbsolutePath());
        }
        return objectMapper.treeToValue(node, double[].class);
    }
}
