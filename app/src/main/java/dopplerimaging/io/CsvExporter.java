package dopplerimaging.io;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.databind.SequenceWriter;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import dopplerimaging.domain.spectrum.LineSpectrum;
import dopplerimaging.domain.spectrum.ObservationMatrix;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Exporta los artefactos numéricos del modelo a CSV: el vector de brillo, la
 * matriz de observación completa y los pares (longitud de onda, flujo) del espectro.
 */
@Slf4j
public class CsvExporter {

    private static final CsvMapper csvMapper = new CsvMapper();

    @JsonPropertyOrder({"index", "brightness"})
    public record BrightnessRow(int index, double brightness) {
    }

    @JsonPropertyOrder({"wavelength", "flux"})
    public record SpectrumRow(double wavelength, double flux) {
    }

    /**
     * Columnas {@code index,brightness}, una fila por elemento.
     */
    public void writeBrightness(double[] brightness, Path path) throws IOException {
        CsvSchema schema = csvMapper.schemaFor(BrightnessRow.class).withHeader();
        prepare(path);
        try (SequenceWriter writer = csvMapper.writer(schema).writeValues(path.toFile())) {
            for (int i = 0; i < brightness.length; i++) {
                writer.write(new BrightnessRow(i, brightness[i]));
            }
        } catch (IOException e) {
            log.error("Error al escribir el vector de brillo en {}", path.toAbsolutePath(), e);
            throw e;
        }
        log.info("Vector de brillo ({} elementos) escrito en {}", brightness.length, path.toAbsolutePath());
    }

    /**
     * Una fila por elemento de superficie y una columna por (fase, longitud de onda), sin cabecera.
     */
    public void writeMatrix(ObservationMatrix matrix, Path path) throws IOException {
        prepare(path);
        try (SequenceWriter writer = csvMapper.writer(CsvSchema.emptySchema()).writeValues(path.toFile())) {
            for (double[] row : matrix.toArray()) {
                writer.write(row);
            }
        } catch (IOException e) {
            log.error("Error al escribir la matriz de observación en {}", path.toAbsolutePath(), e);
            throw e;
        }
        log.info("Matriz de observación {}x{} escrita en {}",
                matrix.getElementCount(), matrix.getColumnCount(), path.toAbsolutePath());
    }

    /**
     * Columnas {@code wavelength,flux}; las longitudes de onda se repiten en cada fase.
     */
    public void writeSpectrum(LineSpectrum spectrum, Path path) throws IOException {
        CsvSchema schema = csvMapper.schemaFor(SpectrumRow.class).withHeader();
        prepare(path);
        double[] wavelengths = spectrum.wavelengths();
        double[] flux = spectrum.flux();
        try (SequenceWriter writer = csvMapper.writer(schema).writeValues(path.toFile())) {
            for (int k = 0; k < flux.length; k++) {
                writer.write(new SpectrumRow(wavelengths[k], flux[k]));
            }
        } catch (IOException e) {
            log.error("Error al escribir el espectro en {}", path.toAbsolutePath(), e);
            throw e;
        }
        log.info("Espectro ({} muestras) escrito en {}", spectrum.size(), path.toAbsolutePath());
    }

    private static void prepare(Path path) throws IOException {
        Path parent = path.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
    }
}
