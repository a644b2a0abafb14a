package dopplerimaging.io;

import dopplerimaging.domain.spectrum.LineSpectrum;
import lombok.extern.slf4j.Slf4j;
import org.knowm.xchart.BitmapEncoder;
import org.knowm.xchart.XYChart;
import org.knowm.xchart.XYChartBuilder;
import org.knowm.xchart.XYSeries;
import org.knowm.xchart.style.markers.SeriesMarkers;

import java.awt.Color;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Gráfica del espectro sintético: flujo normalizado frente a longitud de onda,
 * con el eje x logarítmico.
 */
@Slf4j
public class SpectrumPlotter {

    public static final String SERIES_NAME = "Flux";

    private static final int WIDTH = 1000;
    private static final int HEIGHT = 600;

    public XYChart buildChart(LineSpectrum spectrum) {
        XYChart chart = new XYChartBuilder()
                .width(WIDTH)
                .height(HEIGHT)
                .title(String.format("Espectro sintético (%d fases)", spectrum.phaseCount()))
                .xAxisTitle("Wavelength")
                .yAxisTitle("Normalized Flux")
                .build();

        chart.getStyler().setXAxisLogarithmic(true);
        chart.getStyler().setLegendVisible(false);
        chart.getStyler().setPlotGridLinesVisible(true);
        chart.getStyler().setDefaultSeriesRenderStyle(XYSeries.XYSeriesRenderStyle.Scatter);
        chart.getStyler().setMarkerSize(4);

        XYSeries series = chart.addSeries(SERIES_NAME, spectrum.wavelengths(), spectrum.flux());
        series.setMarker(SeriesMarkers.CIRCLE);
        series.setMarkerColor(new Color(255, 0, 0, 80));
        return chart;
    }

    /**
     * Guarda la gráfica como PNG en {@code path}.
     */
    public void savePng(LineSpectrum spectrum, Path path) throws IOException {
        Path parent = path.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        try {
            BitmapEncoder.saveBitmap(buildChart(spectrum), path.toString(), BitmapEncoder.BitmapFormat.PNG);
        } catch (IOException e) {
            log.error("Error al guardar la gráfica del espectro en {}", path.toAbsolutePath(), e);
            throw e;
        }
        log.info("Gráfica del espectro guardada en {}", path.toAbsolutePath());
    }
}
