package dopplerimaging.physics.impl;

import dopplerimaging.domain.spectrum.WavelengthGrid;
import dopplerimaging.domain.star.SurfaceMap;
import dopplerimaging.exception.ResponseBuildException;
import dopplerimaging.exception.ResponseBuildException.Stage;
import dopplerimaging.physics.geometry.SurfaceGeometryKernel;
import dopplerimaging.physics.i.IDopplerShifter;
import dopplerimaging.physics.i.IRadiationLaw;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

import java.util.concurrent.Callable;

/**
 * Tarea ejecutable que calcula la fila de la matriz de respuesta de un único
 * elemento de superficie. Está diseñada para ser ejecutada en un pool de hilos:
 * sólo lee el mapa (inmutable) y no comparte estado con otras filas.
 */
@Getter
@RequiredArgsConstructor
public class ResponseRowTask implements Callable<double[]> {

    // --- Entradas para la tarea ---
    private final SurfaceMap map;
    private final int elementIndex;
    private final WavelengthGrid grid;
    private final IRadiationLaw radiationLaw;
    private final IDopplerShifter dopplerShifter;
    private final SurfaceGeometryKernel kernel;

    /**
     * @return La fila normalizada, desplazada y ponderada por el área proyectada.
     * @throws ResponseBuildException con el elemento, la fase y la etapa si algún paso falla.
     */
    @Override
    public double[] call() {
        final int n = grid.getSize();
        final double brightness = map.getBrightnessAt(elementIndex);

        // Sin emisión no hay nada que integrar (y T = 0 sería singular).
        if (brightness == 0.0) {
            return new double[n];
        }

        double area = projectedArea();
        // Elemento oculto: la fila es nula sea cual sea su espectro.
        if (area == 0.0) {
            return new double[n];
        }

        double[] row = integrate(brightness);
        row = shift(row);
        for (int j = 0; j < n; j++) {
            row[j] *= area;
        }
        return row;
    }

    private double[] integrate(double brightness) {
        try {
            double temperature = radiationLaw.temperatureOf(brightness);
            double bandWidth = grid.getBandWidth();
            double[] row = new double[grid.getSize()];
            for (int j = 0; j < row.length; j++) {
                row[j] = radiationLaw.integrateRadiance(grid.getValueAt(j), bandWidth, temperature) / brightness;
            }
            return row;
        } catch (RuntimeException e) {
            throw new ResponseBuildException(elementIndex, map.getPhase(), Stage.INTEGRATION, e);
        }
    }

    private double[] shift(double[] row) {
        try {
            double radialVelocity = kernel.radialVelocity(map, elementIndex);
            return dopplerShifter.shiftSpectrum(row, radialVelocity, grid.getValues());
        } catch (RuntimeException e) {
            throw new ResponseBuildException(elementIndex, map.getPhase(), Stage.DOPPLER_SHIFT, e);
        }
    }

    private double projectedArea() {
        try {
            return kernel.projectedArea(map, elementIndex);
        } catch (RuntimeException e) {
            throw new ResponseBuildException(elementIndex, map.getPhase(), Stage.VISIBILITY, e);
        }
    }
}
