package dopplerimaging.domain.spectrum;

import lombok.Getter;

import java.util.List;

/**
 * Matriz de observación completa: las matrices de respuesta de todas las fases
 * concatenadas a lo largo del eje de longitud de onda, en orden de fase.
 * Su forma es (elementos, fases · longitudes de onda).
 */
public final class ObservationMatrix {

    @Getter
    private final int elementCount;
    @Getter
    private final int phaseCount;
    @Getter
    private final int wavelengthsPerPhase;
    private final double[] phases;
    private final double[][] rows;

    private ObservationMatrix(double[] phases, int wavelengthsPerPhase, double[][] rows) {
        this.elementCount = rows.length;
        this.phaseCount = phases.length;
        this.wavelengthsPerPhase = wavelengthsPerPhase;
        this.phases = phases;
        this.rows = rows;
    }

    /**
     * Concatena horizontalmente las matrices en el orden recibido.
     *
     * @throws IllegalArgumentException si la lista está vacía o las dimensiones no coinciden.
     */
    public static ObservationMatrix concatenate(List<ResponseMatrix> matrices) {
        if (matrices == null || matrices.isEmpty()) {
            throw new IllegalArgumentException("Se necesita al menos una matriz de respuesta.");
        }
        int elements = matrices.get(0).getElementCount();
        int wavelengths = matrices.get(0).getWavelengthCount();
        double[] phases = new double[matrices.size()];
        double[][] rows = new double[elements][wavelengths * matrices.size()];

        for (int p = 0; p < matrices.size(); p++) {
            ResponseMatrix matrix = matrices.get(p);
            if (matrix.getElementCount() != elements || matrix.getWavelengthCount() != wavelengths) {
                throw new IllegalArgumentException(String.format(
                        "La matriz de la fase %d tiene forma %dx%d, se esperaba %dx%d.",
                        p, matrix.getElementCount(), matrix.getWavelengthCount(), elements, wavelengths));
            }
            phases[p] = matrix.getPhase();
            for (int i = 0; i < elements; i++) {
                System.arraycopy(matrix.getRow(i), 0, rows[i], p * wavelengths, wavelengths);
            }
        }
        return new ObservationMatrix(phases, wavelengths, rows);
    }

    public int getColumnCount() {
        return phaseCount * wavelengthsPerPhase;
    }

    public double get(int elementIndex, int column) {
        return rows[elementIndex][column];
    }

    public double getPhaseAt(int phaseIndex) {
        return phases[phaseIndex];
    }

    /**
     * Espectro completo fullMatrixᵀ · b para un único vector de brillo.
     */
    public double[] project(double[] brightness) {
        if (brightness.length != elementCount) {
            throw new IllegalArgumentException(String.format(
                    "El vector de brillo tiene %d elementos y la matriz %d filas.", brightness.length, elementCount));
        }
        double[] flux = new double[getColumnCount()];
        for (int i = 0; i < elementCount; i++) {
            double weight = brightness[i];
            if (weight == 0.0) {
                continue;
            }
            for (int c = 0; c < flux.length; c++) {
                flux[c] += rows[i][c] * weight;
            }
        }
        return flux;
    }

    public double[][] toArray() {
        double[][] copy = new double[elementCount][];
        for (int i = 0; i < elementCount; i++) {
            copy[i] = rows[i].clone();
        }
        return copy;
    }
}
