package biodigester.domain.exception;

/**
 * Variante cinética desconocida, o parámetro ausente o fuera del dominio válido de su fórmula.
 * Se detecta siempre antes del primer paso de integración.
 */
public class ConfigurationException extends SimulationException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
