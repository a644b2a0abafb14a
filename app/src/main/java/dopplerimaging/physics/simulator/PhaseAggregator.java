package dopplerimaging.physics.simulator;

import dopplerimaging.config.ObservationConfig;
import dopplerimaging.domain.simulation.ForwardModelResult;
import dopplerimaging.domain.spectrum.LineSpectrum;
import dopplerimaging.domain.spectrum.ObservationMatrix;
import dopplerimaging.domain.spectrum.ResponseMatrix;
import dopplerimaging.domain.star.SurfaceMap;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Orquestador de la secuencia de fases.
 * <p>
 * En cada fase avanza la rotación del mapa un paso fijo, construye la matriz de
 * respuesta de esa instantánea y proyecta sus filas sobre el brillo de la misma
 * instantánea. Al final concatena las matrices en orden de fase y ensambla el
 * espectro de líneas.
 */
@Slf4j
@RequiredArgsConstructor
public class PhaseAggregator {

    private final ResponseMatrixBuilder builder;

    public ForwardModelResult run(SurfaceMap initialMap, ObservationConfig config) {
        return run(initialMap, config.getPhaseCount(), config.getPhaseStep(),
                config.getNumWavelengths(), config.getMaxWavelength());
    }

    /**
     * Ejecuta la secuencia de fases.
     *
     * @param initialMap     Mapa de partida; no se modifica.
     * @param phaseCount     Número de fases (> 0).
     * @param phaseStep      Avance de fase antes de cada observación [rad].
     * @param numWavelengths Muestras de longitud de onda por fase.
     * @param maxWavelength  Extremo superior de la rejilla.
     * @return Las instantáneas, la matriz de observación (E × phaseCount·numWavelengths) y el espectro.
     */
    public ForwardModelResult run(SurfaceMap initialMap, int phaseCount, double phaseStep,
                                  int numWavelengths, double maxWavelength) {
        Objects.requireNonNull(initialMap, "El mapa inicial no puede ser nulo.");
        if (phaseCount <= 0) {
            throw new IllegalArgumentException("El número de fases debe ser positivo: " + phaseCount);
        }
        long startTime = System.currentTimeMillis();
        log.info("Iniciando secuencia de {} fases (paso {} rad, {} longitudes de onda, λmax = {}).",
                phaseCount, phaseStep, numWavelengths, maxWavelength);

        ForwardModelResult.ForwardModelResultBuilder result = ForwardModelResult.builder().initialMap(initialMap);
        List<ResponseMatrix> matrices = new ArrayList<>(phaseCount);
        double[][] segments = new double[phaseCount][];

        SurfaceMap current = initialMap;
        for (int p = 0; p < phaseCount; p++) {
            current = current.rotate(phaseStep);
            ResponseMatrix matrix = builder.build(current, numWavelengths, maxWavelength);
            matrices.add(matrix);
            segments[p] = matrix.project(current.brightnessVector());
            result.snapshot(current);
            log.info("Fase {}/{} completada (φ = {} rad).", p + 1, phaseCount, current.getPhase());
        }

        ObservationMatrix observation = ObservationMatrix.concatenate(matrices);
        LineSpectrum spectrum = LineSpectrum.fromSegments(matrices.get(0).getGrid(), segments);
        long elapsed = System.currentTimeMillis() - startTime;
        log.info("Secuencia completada en {} ms. Matriz de observación {}x{}.",
                elapsed, observation.getElementCount(), observation.getColumnCount());

        return result
                .grid(matrices.get(0).getGrid())
                .observationMatrix(observation)
                .lineSpectrum(spectrum)
                .executionTimeMs(elapsed)
                .build();
    }
}
