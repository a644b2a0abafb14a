package dopplerimaging.physics.simulator;

import dopplerimaging.config.ObservationConfig;
import dopplerimaging.domain.spectrum.ResponseMatrix;
import dopplerimaging.domain.spectrum.WavelengthGrid;
import dopplerimaging.domain.star.SurfaceMap;
import dopplerimaging.exception.ForwardModelException;
import dopplerimaging.exception.ResponseBuildException;
import dopplerimaging.physics.geometry.SurfaceGeometryKernel;
import dopplerimaging.physics.i.IDopplerShifter;
import dopplerimaging.physics.i.IRadiationLaw;
import dopplerimaging.physics.impl.LinearDopplerShifter;
import dopplerimaging.physics.impl.PlanckRadiationLaw;
import dopplerimaging.physics.impl.ResponseRowTask;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * Construye la matriz de respuesta (elementos × longitudes de onda) de una fase.
 * <p>
 * Responsabilidades:
 * 1. Generar la rejilla de longitudes de onda compartida.
 * 2. Lanzar una {@link ResponseRowTask} por elemento en el pool de hilos.
 * 3. Recoger las filas en orden de elemento y propagar el primer fallo.
 */
@Slf4j
public class ResponseMatrixBuilder implements AutoCloseable {

    @Getter
    private final IRadiationLaw radiationLaw;
    @Getter
    private final IDopplerShifter dopplerShifter;
    @Getter
    private final SurfaceGeometryKernel kernel;
    private final ExecutorService threadPool;

    public ResponseMatrixBuilder(IRadiationLaw radiationLaw, IDopplerShifter dopplerShifter,
                                 SurfaceGeometryKernel kernel, int processorCount) {
        this.radiationLaw = Objects.requireNonNull(radiationLaw, "La ley de radiación no puede ser nula.");
        this.dopplerShifter = Objects.requireNonNull(dopplerShifter, "El desplazador Doppler no puede ser nulo.");
        this.kernel = Objects.requireNonNull(kernel, "El núcleo geométrico no puede ser nulo.");
        this.threadPool = Executors.newFixedThreadPool(Math.max(processorCount, 1));
        log.info("ResponseMatrixBuilder inicializado. (Radiación: {}, Doppler: {}, Geometría: {}, Hilos: {})",
                radiationLaw.getName(), dopplerShifter.getName(), kernel.getName(), Math.max(processorCount, 1));
    }

    public static ResponseMatrixBuilder fromConfig(ObservationConfig config) {
        return new ResponseMatrixBuilder(
                new PlanckRadiationLaw(config.getRadiation()),
                new LinearDopplerShifter(),
                new SurfaceGeometryKernel(config.getVisibilityModel()),
                config.getCpuProcessorCount());
    }

    /**
     * Construye la matriz de respuesta del mapa en su fase actual.
     *
     * @param map            Instantánea del mapa; no se modifica.
     * @param numWavelengths Número de muestras de longitud de onda (> 0).
     * @param maxWavelength  Extremo superior de la rejilla (> 0.01).
     * @return La matriz con una fila por elemento, en orden de elemento.
     * @throws IllegalArgumentException si los parámetros de la rejilla no son válidos.
     * @throws ResponseBuildException   si falla la fila de algún elemento.
     */
    public ResponseMatrix build(SurfaceMap map, int numWavelengths, double maxWavelength) {
        Objects.requireNonNull(map, "El mapa de superficie no puede ser nulo.");
        WavelengthGrid grid = WavelengthGrid.of(numWavelengths, maxWavelength);
        int elementCount = map.getElementCount();
        long startTime = System.currentTimeMillis();

        List<ResponseRowTask> tasks = new ArrayList<>(elementCount);
        for (int i = 0; i < elementCount; i++) {
            tasks.add(new ResponseRowTask(map, i, grid, radiationLaw, dopplerShifter, kernel));
        }

        List<Future<double[]>> futures;
        try {
            futures = threadPool.invokeAll(tasks);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ForwardModelException("Construcción de la matriz de respuesta interrumpida.", e);
        }

        double[][] rows = new double[elementCount][];
        for (int i = 0; i < elementCount; i++) {
            try {
                rows[i] = futures.get(i).get();
            } catch (ExecutionException e) {
                cancelAll(futures);
                if (e.getCause() instanceof ForwardModelException fme) {
                    throw fme;
                }
                throw new ForwardModelException("Error inesperado en la fila del elemento " + i, e.getCause());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                cancelAll(futures);
                throw new ForwardModelException("Construcción de la matriz de respuesta interrumpida.", e);
            }
        }

        log.debug("Matriz de respuesta {}x{} construida en {} ms (fase {} rad).",
                elementCount, numWavelengths, System.currentTimeMillis() - startTime, map.getPhase());
        return new ResponseMatrix(map.getPhase(), grid, rows);
    }

    private static void cancelAll(List<Future<double[]>> futures) {
        for (Future<double[]> future : futures) {
            future.cancel(true);
        }
    }

    @Override
    public void close() {
        threadPool.shutdown();
        log.debug("Pool de hilos del ResponseMatrixBuilder cerrado.");
    }
}
