package biodigester.factory;

import biodigester.config.KineticParameters;
import biodigester.config.KineticsVariant;
import biodigester.domain.exception.ConfigurationException;
import biodigester.physics.model.*;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class KineticsLawFactoryTest {

    @Test
    @DisplayName("Despacho: cada record de parámetros produce la ley de su variante")
    void create_shouldDispatchOnVariant() {
        assertInstanceOf(MonodKinetics.class, KineticsLawFactory.create(new KineticParameters.Monod(0.4, 20)));
        assertInstanceOf(LinearKinetics.class, KineticsLawFactory.create(new KineticParameters.Linear(0.05)));
        assertInstanceOf(HaldaneKinetics.class, KineticsLawFactory.create(new KineticParameters.Haldane(0.4, 20, 250)));
        assertInstanceOf(ContoisKinetics.class, KineticsLawFactory.create(new KineticParameters.Contois(0.4, 5)));
        assertInstanceOf(TeissierKinetics.class, KineticsLawFactory.create(new KineticParameters.Teissier(0.4, 15)));
        assertInstanceOf(MoserKinetics.class, KineticsLawFactory.create(new KineticParameters.Moser(0.4, 20, 2)));
        assertInstanceOf(ChenHashimotoKinetics.class, KineticsLawFactory.create(new KineticParameters.ChenHashimoto(0.4, 100, 0.5)));
        assertInstanceOf(AndrewsKinetics.class, KineticsLawFactory.create(new KineticParameters.Andrews(0.4, 20, 250)));
        assertInstanceOf(IerusalimskyKinetics.class, KineticsLawFactory.create(new KineticParameters.Ierusalimsky(0.4, 20, 50)));
    }

    @Test
    @DisplayName("La variante de la ley coincide con la de sus parámetros")
    void create_variantShouldMatch() {
        KineticsLaw law = KineticsLawFactory.create(new KineticParameters.ChenHashimoto(0.4, 100, 0.5));
        assertEquals(KineticsVariant.CHEN_HASHIMOTO, law.getVariant());
    }

    @Test
    @DisplayName("Parámetros nulos o fuera de dominio: ConfigurationException")
    void create_invalidParameters_shouldFail() {
        assertThrows(ConfigurationException.class, () -> KineticsLawFactory.create(null));
        assertThrows(ConfigurationException.class, () -> KineticsLawFactory.create(new KineticParameters.Contois(0.4, -5)));
    }

    @Test
    @DisplayName("Record que declara una variante ajena: ConfigurationException, no ClassCastException")
    void create_inconsistentRecord_shouldFail() {
        KineticParameters impostor = mock(KineticParameters.class);
        when(impostor.variant()).thenReturn(KineticsVariant.MONOD);

        assertThrows(ConfigurationException.class, () -> KineticsLawFactory.create(impostor));
        verify(impostor).validate();
    }
}
