package dopplerimaging;

import dopplerimaging.config.ObservationConfig;
import dopplerimaging.domain.simulation.ForwardModelResult;
import dopplerimaging.domain.star.SurfaceMap;
import dopplerimaging.exception.ForwardModelException;
import dopplerimaging.exception.ResponseBuildException;
import dopplerimaging.factory.SurfaceMapFactory;
import dopplerimaging.io.CsvExporter;
import dopplerimaging.io.JsonFileHandler;
import dopplerimaging.io.SpectrumPlotter;
import dopplerimaging.physics.impl.RotationalBroadeningCalculator;
import dopplerimaging.physics.simulator.PhaseAggregator;
import dopplerimaging.physics.simulator.ResponseMatrixBuilder;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Arrays;

/**
 * Punto de entrada por línea de comandos.
 * <p>
 * Uso: {@code ForwardModelApplication [config.json] [directorio-salida]}. Sin
 * argumentos usa {@link ObservationConfig#defaults()} y escribe en {@code output/}.
 */
@Slf4j
public final class ForwardModelApplication {

    static final String BRIGHTNESS_FILE = "brightness.csv";
    static final String MATRIX_FILE = "response_matrix.csv";
    static final String SPECTRUM_FILE = "flux_vs_wavelength.csv";
    static final String PLOT_FILE = "spectrum.png";

    private ForwardModelApplication() {
    }

    public static void main(String[] args) {
        try {
            ObservationConfig config = args.length > 0
                    ? new JsonFileHandler().readConfig(Paths.get(args[0]))
                    : ObservationConfig.defaults();
            Path outputDir = Paths.get(args.length > 1 ? args[1] : "output");
            run(config, outputDir);
        } catch (ResponseBuildException e) {
            log.error("Fallo en el elemento {} (fase {} rad, etapa {}).",
                    e.getElementIndex(), e.getPhase(), e.getStage(), e);
            System.exit(1);
        } catch (ForwardModelException | IOException | IllegalArgumentException e) {
            log.error("La ejecución del modelo directo ha fallado.", e);
            System.exit(1);
        }
    }

    /**
     * Ejecuta la secuencia de fases y escribe los cuatro artefactos en {@code outputDir}.
     */
    public static ForwardModelResult run(ObservationConfig config, Path outputDir) throws IOException {
        ForwardModelResult result = simulate(config);

        CsvExporter exporter = new CsvExporter();
        exporter.writeBrightness(result.getInitialMap().brightnessVector(), outputDir.resolve(BRIGHTNESS_FILE));
        exporter.writeMatrix(result.getObservationMatrix(), outputDir.resolve(MATRIX_FILE));
        exporter.writeSpectrum(result.getLineSpectrum(), outputDir.resolve(SPECTRUM_FILE));
        new SpectrumPlotter().savePng(result.getLineSpectrum(), outputDir.resolve(PLOT_FILE));
        return result;
    }

    /**
     * Construye la estrella de la configuración y ejecuta la secuencia de fases sin escribir nada.
     */
    public static ForwardModelResult simulate(ObservationConfig config) {
        SurfaceMap map = SurfaceMapFactory.createStar(config.getStar());
        try (ResponseMatrixBuilder builder = ResponseMatrixBuilder.fromConfig(config)) {
            logBroadening(builder, map, config);
            return new PhaseAggregator(builder).run(map, config);
        }
    }

    private static void logBroadening(ResponseMatrixBuilder builder, SurfaceMap map, ObservationConfig config) {
        double[] factors = new RotationalBroadeningCalculator(builder.getKernel(), config.getBroadeningPolicy())
                .factors(map);
        double min = Arrays.stream(factors).min().orElse(1.0);
        double mean = Arrays.stream(factors).average().orElse(1.0);
        log.info("Ensanchamiento rotacional de la fase inicial: mínimo {}, medio {}.", min, mean);
    }
}
