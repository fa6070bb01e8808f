package biodigester.factory;

import biodigester.config.KineticParameters;
import biodigester.config.KineticsVariant;
import biodigester.config.SimulationConfig;
import biodigester.domain.exception.ConfigurationException;
import biodigester.domain.simulation.SimulationRequestDTO;
import lombok.extern.slf4j.Slf4j;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

@Slf4j
class SimulationConfigFactoryTest {

    @Test
    @DisplayName("Petición por defecto: Monod con los valores del formulario")
    void fromRequest_defaults_shouldBuildMonodConfig() {
        SimulationConfig config = SimulationConfigFactory.fromRequest(SimulationRequestDTO.defaults());

        assertEquals(KineticsVariant.MONOD, config.getKineticsVariant());
        assertEquals(new KineticParameters.Monod(0.4, 20.0), config.getKinetics());
        assertEquals(0.3, config.getYields().biomassYield());
        assertEquals(0.7, config.getYields().gasYield(), 1e-12);
        assertEquals(100.0, config.getInitialState().substrate());
        assertEquals(1.0, config.getInitialState().biomass());
        assertEquals(0.0, config.getInitialState().biogas());
        assertEquals(50.0, config.getEndTime());
        assertEquals(300, config.getSampleCount());
    }

    @Test
    @DisplayName("Solo se leen los parámetros de la variante elegida")
    void fromRequest_shouldPickOnlyRequiredParameters() {
        SimulationConfig config = SimulationConfigFactory.fromRequest(SimulationRequestDTO.defaults().withKinetics("contois"));

        assertThat(config.getKinetics()).isInstanceOf(KineticParameters.Contois.class);
        assertThat(config.getKinetics().asMap()).containsOnlyKeys("mu_max", "K_C");
    }

    @Test
    @DisplayName("Etiqueta desconocida: ConfigurationException")
    void fromRequest_unknownKinetics_shouldFail() {
        SimulationRequestDTO request = SimulationRequestDTO.defaults().withKinetics("unknown");
        ConfigurationException e = assertThrows(ConfigurationException.class, () -> SimulationConfigFactory.fromRequest(request));
        log.info("Mensaje: {}", e.getMessage());
        assertThat(e.getMessage()).contains("unknown");
    }

    @Test
    @DisplayName("Parámetro obligatorio ausente: ConfigurationException que lo nombra")
    void fromRequest_missingParameter_shouldFail() {
        // Moser necesita 'n', que el formulario por defecto no incluye
        SimulationRequestDTO request = SimulationRequestDTO.defaults().withKinetics("moser");
        ConfigurationException e = assertThrows(ConfigurationException.class, () -> SimulationConfigFactory.fromRequest(request));
        assertThat(e.getMessage()).contains("n").contains("moser");

        SimulationConfig fixed = SimulationConfigFactory.fromRequest(request.withParameter("n", 2.0));
        assertEquals(new KineticParameters.Moser(0.4, 20.0, 2.0), fixed.getKinetics());
    }

    @Test
    @DisplayName("Contois con B0 = 0: ConfigurationException antes de integrar")
    void fromRequest_contoisWithZeroBiomass_shouldFail() {
        SimulationRequestDTO request = SimulationRequestDTO.defaults().withKinetics("contois").withInitialBiomass(0.0);
        assertThrows(ConfigurationException.class, () -> SimulationConfigFactory.fromRequest(request));
    }

    @Test
    @DisplayName("Mapa de parámetros nulo: ConfigurationException")
    void buildParameters_nullMap_shouldFail() {
        assertThrows(ConfigurationException.class,
                () -> SimulationConfigFactory.buildParameters(KineticsVariant.LINEAR, null));
        assertEquals(new KineticParameters.Linear(0.1),
                SimulationConfigFactory.buildParameters(KineticsVariant.LINEAR, Map.of("k", 0.1)));
    }
}
