package biodigester.domain.exception;

import lombok.Getter;

/**
 * El integrador adaptativo no pudo alcanzar el final del intervalo: el paso colapsó por debajo
 * del mínimo, se agotó el presupuesto de pasos o la función derivada falló.
 */
@Getter
public class IntegrationException extends SimulationException {

    /**
     * Instante alcanzado por el integrador antes del fallo.
     */
    private final double failureTime;

    public IntegrationException(String message, double failureTime) {
        super(message);
        this.failureTime = failureTime;
    }

    public IntegrationException(String message, double failureTime, Throwable cause) {
        super(message, cause);
        this.failureTime = failureTime;
    }
}
