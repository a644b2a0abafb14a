package dopplerimaging.domain.spectrum;

import lombok.Getter;

import java.util.Objects;

/**
 * Matriz de respuesta de una fase: filas = elementos de superficie, columnas =
 * muestras de longitud de onda. Cada entrada es la contribución normalizada del
 * elemento, ya desplazada por efecto Doppler y ponderada por su área proyectada.
 */
public final class ResponseMatrix {

    @Getter
    private final double phase;
    @Getter
    private final WavelengthGrid grid;
    private final double[][] rows;

    public ResponseMatrix(double phase, WavelengthGrid grid, double[][] rows) {
        Objects.requireNonNull(grid, "La rejilla de longitudes de onda no puede ser nula.");
        Objects.requireNonNull(rows, "Las filas de la matriz no pueden ser nulas.");
        this.phase = phase;
        this.grid = grid;
        this.rows = new double[rows.length][];
        for (int i = 0; i < rows.length; i++) {
            if (rows[i] == null || rows[i].length != grid.getSize()) {
                throw new IllegalArgumentException(String.format(
                        "La fila %d no tiene %d columnas.", i, grid.getSize()));
            }
            this.rows[i] = rows[i].clone();
        }
    }

    public int getElementCount() {
        return rows.length;
    }

    public int getWavelengthCount() {
        return grid.getSize();
    }

    public double get(int elementIndex, int wavelengthIndex) {
        return rows[elementIndex][wavelengthIndex];
    }

    public double[] getRow(int elementIndex) {
        return rows[elementIndex].clone();
    }

    /**
     * Combinación lineal de las filas ponderada por el brillo: Rᵀ · b.
     *
     * @param brightness Un peso por elemento.
     * @return Flujo por longitud de onda.
     */
    public double[] project(double[] brightness) {
        if (brightness.length != rows.length) {
            throw new IllegalArgumentException(String.format(
                    "El vector de brillo tiene %d elementos y la matriz %d filas.", brightness.length, rows.length));
        }
        double[] flux = new double[grid.getSize()];
        for (int i = 0; i < rows.length; i++) {
            double weight = brightness[i];
            if (weight == 0.0) {
                continue;
            }
            double[] row = rows[i];
            for (int j = 0; j < flux.length; j++) {
                flux[j] += row[j] * weight;
            }
        }
        return flux;
    }

    public double[][] toArray() {
        double[][] copy = new double[rows.length][];
        for (int i = 0; i < rows.length; i++) {
            copy[i] = rows[i].clone();
        }
        return copy;
    }
}
