package dopplerimaging.io;

import dopplerimaging.ForwardModelApplication;
import dopplerimaging.config.ObservationConfig;
import dopplerimaging.domain.spectrum.WavelengthGrid;
import dopplerimaging.domain.star.VisibilityModel;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class JsonFileHandlerTest {

    @TempDir
    Path tempDir;

    private final JsonFileHandler handler = new JsonFileHandler();

    @Test
    @DisplayName("Una configuración escrita y releída es igual a la original")
    void writeThenRead_shouldPreserveConfig() throws IOException {
        ObservationConfig original = ObservationConfig.defaults()
                .withPhaseCount(6)
                .withVisibilityModel(VisibilityModel.LEGACY_ABSOLUTE);
        Path file = tempDir.resolve("configs/observation.json");

        handler.writeConfig(original, file);
        ObservationConfig read = handler.readConfig(file);

        assertThat(Files.exists(file)).isTrue();
        assertThat(read).isEqualTo(original);
        assertThat(read.getStar().spot()).isNotNull();
    }

    @Test
    @DisplayName("Los campos ausentes se completan con los valores por defecto")
    void partialConfig_shouldBeCompletedWithDefaults() throws IOException {
        Path file = tempDir.resolve("partial.json");
        Files.writeString(file, "{ \"phaseCount\": 4, \"maxWavelength\": 2.5, \"unknownField\": true }");

        ObservationConfig read = handler.readConfig(file);
        ObservationConfig defaults = ObservationConfig.defaults();

        assertThat(read.getPhaseCount()).isEqualTo(4);
        assertThat(read.getMaxWavelength()).isEqualTo(2.5);
        assertThat(read.getNumWavelengths()).isEqualTo(defaults.getNumWavelengths());
        assertThat(read.getStar()).isEqualTo(defaults.getStar());
        assertThat(read.getRadiation()).isEqualTo(defaults.getRadiation());
        assertThat(read.getVisibilityModel()).isEqualTo(VisibilityModel.BACK_FACE_CULLING);
        assertThat(read.getBroadeningPolicy()).isEqualTo(defaults.getBroadeningPolicy());
    }

    @Test
    @DisplayName("Un valor explícito inválido se conserva y la simulación lo rechaza")
    void explicitInvalidValues_shouldNotBeReplacedByDefaults() throws IOException {
        Path file = tempDir.resolve("invalid.json");
        Files.writeString(file, "{ \"numWavelengths\": -3, \"maxWavelength\": -5.0, \"phaseCount\": 0 }");

        ObservationConfig read = handler.readConfig(file);

        assertThat(read.getNumWavelengths()).isEqualTo(-3);
        assertThat(read.getMaxWavelength()).isEqualTo(-5.0);
        assertThat(read.getPhaseCount()).isZero();
        assertThatThrownBy(() -> ForwardModelApplication.simulate(read))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Una rejilla con numWavelengths negativo llega a la validación de la rejilla")
    void negativeWavelengthCount_shouldFailOnGridConstruction() throws IOException {
        Path file = tempDir.resolve("negative.json");
        Files.writeString(file, "{ \"numWavelengths\": -3 }");

        ObservationConfig read = handler.readConfig(file);

        assertThat(read.getPhaseCount()).isEqualTo(ObservationConfig.defaults().getPhaseCount());
        assertThatThrownBy(() -> WavelengthGrid.of(read.getNumWavelengths(), read.getMaxWavelength()))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Un JSON que no es un objeto produce IOException")
    void nonObjectJson_shouldThrow() throws IOException {
        Path file = tempDir.resolve("array.json");
        Files.writeString(file, "[1, 2, 3]");

        assertThatThrownBy(() -> handler.readConfig(file)).isInstanceOf(IOException.class);
    }

    @Test
    @DisplayName("Un fichero inexistente produce IOException")
    void missingFile_shouldThrow() {
        assertThatThrownBy(() -> handler.readConfig(tempDir.resolve("missing.json")))
                .isInstanceOf(IOException.class)
                .hasMessageContaining("no existe");
    }

    @Test
    @DisplayName("Un JSON mal formado produce IOException")
    void malformedJson_shouldThrow() throws IOException {
        Path file = tempDir.resolve("broken.json");
        Files.writeString(file, "{ \"phaseCount\": ");

        assertThatThrownBy(() -> handler.readConfig(file)).isInstanceOf(IOException.class);
    }
}
