package biodigester.physics.solver.impl;

import biodigester.config.KineticParameters;
import biodigester.config.YieldCoefficients;
import biodigester.domain.exception.DomainException;
import biodigester.physics.model.KineticsLaw;
import biodigester.physics.model.MassBalance;
import biodigester.physics.model.MonodKinetics;
import biodigester.physics.model.SplitYieldMassBalance;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyDouble;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class ReactorOdeSystemTest {

    @Mock
    private KineticsLaw mockLaw;

    @Mock
    private MassBalance mockBalance;

    @Test
    @DisplayName("Cableado: la ley recibe (S, B) y el balance recibe su velocidad")
    void computeDerivatives_shouldChainLawAndBalance() {
        when(mockLaw.rate(50.0, 2.0)).thenReturn(1.5);
        ReactorOdeSystem system = new ReactorOdeSystem(mockLaw, mockBalance);
        double[] derivatives = new double[3];

        system.computeDerivatives(7.0, new double[]{50.0, 2.0, 3.0}, derivatives);

        verify(mockLaw).rate(50.0, 2.0);
        verify(mockBalance).computeDerivatives(1.5, derivatives);
        verifyNoMoreInteractions(mockLaw, mockBalance);
    }

    @Test
    @DisplayName("El biogás acumulado no interviene en la cinética")
    void computeDerivatives_shouldIgnoreBiogasAndTime() {
        when(mockLaw.rate(anyDouble(), anyDouble())).thenReturn(0.0);
        ReactorOdeSystem system = new ReactorOdeSystem(mockLaw, mockBalance);

        system.computeDerivatives(0.0, new double[]{10.0, 1.0, 0.0}, new double[3]);
        system.computeDerivatives(99.0, new double[]{10.0, 1.0, 500.0}, new double[3]);

        verify(mockLaw, times(2)).rate(10.0, 1.0);
    }

    @Test
    @DisplayName("DomainException de la ley: no llega al balance")
    void computeDerivatives_domainError_shouldAbortBeforeBalance() {
        when(mockLaw.rate(anyDouble(), anyDouble())).thenThrow(new DomainException("fuera de dominio", 1.0, 0.0));
        ReactorOdeSystem system = new ReactorOdeSystem(mockLaw, mockBalance);

        assertThrows(DomainException.class, () -> system.computeDerivatives(0.0, new double[]{1.0, 0.0, 0.0}, new double[3]));
        verifyNoInteractions(mockBalance);
    }

    @Test
    @DisplayName("Con componentes reales: Monod + reparto de rendimiento")
    void computeDerivatives_realComponents() {
        ReactorOdeSystem system = new ReactorOdeSystem(
                new MonodKinetics(new KineticParameters.Monod(0.4, 20.0)),
                new SplitYieldMassBalance(YieldCoefficients.ofBiomassYield(0.3)));
        double[] d = new double[3];

        system.computeDerivatives(0.0, new double[]{100.0, 1.0, 0.0}, d);

        double r = 0.4 * 100.0 / 120.0;
        assertEquals(-r / 0.3, d[0], 1e-12);
        assertEquals(r, d[1], 1e-12);
        assertEquals(0.7 * r / 0.3, d[2], 1e-12);
    }
}
