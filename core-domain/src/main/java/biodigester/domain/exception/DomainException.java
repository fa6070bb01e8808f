package biodigester.domain.exception;

import lombok.Getter;

/**
 * Una ley cinética encontró una operación indefinida al evaluarse (división por B=0,
 * base negativa con exponente no entero...). Aborta la ejecución en el paso donde ocurre.
 */
@Getter
public class DomainException extends SimulationException {

    private final double substrate;
    private final double biomass;

    public DomainException(String message, double substrate, double biomass) {
        super(String.format("%s (S=%s, B=%s)", message, substrate, biomass));
        this.substrate = substrate;
        this.biomass = biomass;
    }
}
