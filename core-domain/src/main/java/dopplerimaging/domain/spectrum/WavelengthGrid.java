package dopplerimaging.domain.spectrum;

import lombok.Getter;

/**
 * Rejilla de longitudes de onda equiespaciadas compartida por todos los elementos
 * de una misma matriz de respuesta.
 * <p>
 * El extremo inferior es estrictamente positivo para evitar la singularidad de la
 * ley de Planck en λ = 0.
 */
@Getter
public final class WavelengthGrid {

    /**
     * Límite inferior fijo de la rejilla.
     */
    public static final double MIN_WAVELENGTH = 0.01;

    private final double minWavelength;
    private final double maxWavelength;
    private final int size;
    private final double bandWidth;
    private final double[] values;

    private WavelengthGrid(double minWavelength, double maxWavelength, int size) {
        this.minWavelength = minWavelength;
        this.maxWavelength = maxWavelength;
        this.size = size;
        // Anchura de integración de cada muestra: λ_max / N, no el espaciado entre muestras.
        this.bandWidth = maxWavelength / size;
        this.values = new double[size];
        if (size == 1) {
            values[0] = minWavelength;
        } else {
            double spacing = (maxWavelength - minWavelength) / (size - 1);
            for (int j = 0; j < size; j++) {
                values[j] = minWavelength + j * spacing;
            }
            values[size - 1] = maxWavelength;
        }
    }

    /**
     * Construye la rejilla de {@code numWavelengths} muestras en [0.01, maxWavelength].
     *
     * @throws IllegalArgumentException si {@code numWavelengths <= 0} o {@code maxWavelength} no supera el mínimo.
     */
    public static WavelengthGrid of(int numWavelengths, double maxWavelength) {
        if (numWavelengths <= 0) {
            throw new IllegalArgumentException("El número de longitudes de onda debe ser positivo: " + numWavelengths);
        }
        if (!(maxWavelength > 0)) {
            throw new IllegalArgumentException("La longitud de onda máxima debe ser positiva: " + maxWavelength);
        }
        if (!(maxWavelength > MIN_WAVELENGTH) || Double.isInfinite(maxWavelength)) {
            throw new IllegalArgumentException(String.format(
                    "La longitud de onda máxima (%s) debe ser finita y mayor que el mínimo de la rejilla (%s).",
                    maxWavelength, MIN_WAVELENGTH));
        }
        return new WavelengthGrid(MIN_WAVELENGTH, maxWavelength, numWavelengths);
    }

    public double getValueAt(int index) {
        if (index < 0 || index >= size) {
            throw new IndexOutOfBoundsException("Índice de longitud de onda fuera de rango: " + index);
        }
        return values[index];
    }

    /**
     * Copia de las muestras de la rejilla.
     */
    public double[] getValues() {
        return values.clone();
    }
}
