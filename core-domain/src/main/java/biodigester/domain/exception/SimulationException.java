package biodigester.domain.exception;

import biodigester.config.KineticsVariant;
import lombok.Getter;

/**
 * Raíz de la taxonomía de errores del núcleo cinético.
 * <p>
 * Las tres subclases ({@link ConfigurationException}, {@link DomainException} e
 * {@link IntegrationException}) se propagan al llamador sin recuperación ni valores por defecto.
 * El orquestador puede anotarlas con la variante cinética y los parámetros que las provocaron,
 * sin alterar el mensaje original ni la causa.
 */
@Getter
public abstract class SimulationException extends RuntimeException {

    private KineticsVariant variant;
    private String parameterDescription;

    protected SimulationException(String message) {
        super(message);
    }

    protected SimulationException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Adjunta el contexto de la ejecución fallida. Solo se anota una vez: la primera anotación gana.
     *
     * @return la misma excepción, para poder relanzarla directamente.
     */
    public SimulationException annotate(KineticsVariant variant, String parameterDescription) {
        if (this.variant == null) {
            this.variant = variant;
            this.parameterDescription = parameterDescription;
        }
        return this;
    }

    public boolean isAnnotated() {
        return variant != null;
    }

    @Override
    public String getMessage() {
        String base = super.getMessage();
        if (variant == null) {
            return base;
        }
        return String.format("%s [cinética=%s, parámetros=%s]", base, variant.getTag(), parameterDescription);
    }
}
