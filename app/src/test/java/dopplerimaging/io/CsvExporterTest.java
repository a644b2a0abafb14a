package dopplerimaging.io;

import dopplerimaging.domain.spectrum.LineSpectrum;
import dopplerimaging.domain.spectrum.ObservationMatrix;
import dopplerimaging.domain.spectrum.ResponseMatrix;
import dopplerimaging.domain.spectrum.WavelengthGrid;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class CsvExporterTest {

    @TempDir
    Path tempDir;

    private final CsvExporter exporter = new CsvExporter();

    private static List<String> nonBlankLines(Path path) throws IOException {
        return Files.readAllLines(path).stream().filter(line -> !line.isBlank()).collect(Collectors.toList());
    }

    @Test
    void writeBrightness_shouldWriteHeaderAndOneRowPerElement() throws IOException {
        Path file = tempDir.resolve("out/brightness.csv");

        exporter.writeBrightness(new double[]{1.0, 0.25, 0.0}, file);

        List<String> lines = nonBlankLines(file);
        assertThat(lines).hasSize(4);
        assertThat(lines.get(0)).isEqualTo("index,brightness");
        String[] second = lines.get(2).split(",");
        assertThat(Integer.parseInt(second[0])).isEqualTo(1);
        assertThat(Double.parseDouble(second[1])).isEqualTo(0.25);
    }

    @Test
    void writeMatrix_shouldWriteOneRowPerElementWithoutHeader() throws IOException {
        WavelengthGrid grid = WavelengthGrid.of(2, 1.0);
        ObservationMatrix matrix = ObservationMatrix.concatenate(List.of(
                new ResponseMatrix(0.5, grid, new double[][]{{1.0, 2.0}, {3.0, 4.0}, {5.0, 6.0}}),
                new ResponseMatrix(1.0, grid, new double[][]{{7.0, 8.0}, {9.0, 10.0}, {11.0, 12.0}})));
        Path file = tempDir.resolve("response_matrix.csv");

        exporter.writeMatrix(matrix, file);

        List<String> lines = nonBlankLines(file);
        assertThat(lines).hasSize(3);
        String[] firstRow = lines.get(0).split(",");
        assertThat(firstRow).hasSize(4);
        assertThat(Double.parseDouble(firstRow[2])).isEqualTo(7.0);
        assertThat(Double.parseDouble(lines.get(2).split(",")[3])).isEqualTo(12.0);
    }

    @Test
    void writeSpectrum_shouldRepeatWavelengthsPerPhase() throws IOException {
        WavelengthGrid grid = WavelengthGrid.of(3, 1.0);
        LineSpectrum spectrum = LineSpectrum.fromSegments(grid, new double[][]{{1, 2, 3}, {4, 5, 6}});
        Path file = tempDir.resolve("flux_vs_wavelength.csv");

        exporter.writeSpectrum(spectrum, file);

        List<String> lines = nonBlankLines(file);
        assertThat(lines).hasSize(7);
        assertThat(lines.get(0)).isEqualTo("wavelength,flux");
        double firstPhaseStart = Double.parseDouble(lines.get(1).split(",")[0]);
        double secondPhaseStart = Double.parseDouble(lines.get(4).split(",")[0]);
        assertThat(secondPhaseStart).isEqualTo(firstPhaseStart);
        assertThat(firstPhaseStart).isCloseTo(WavelengthGrid.MIN_WAVELENGTH, within(1e-15));
        assertThat(Double.parseDouble(lines.get(6).split(",")[1])).isEqualTo(6.0);
    }
}
