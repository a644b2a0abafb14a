package dopplerimaging.domain.spectrum;

import java.util.Objects;

/**
 * Espectro sintético observado: una secuencia de flujo indexada por (fase, longitud de onda).
 * <p>
 * Las longitudes de onda se repiten una vez por fase, de modo que
 * {@code wavelengths[k]} y {@code flux[k]} forman siempre un par.
 *
 * @param wavelengths         Longitud de onda de cada muestra (fases · longitudes de onda).
 * @param flux                Flujo de cada muestra.
 * @param phaseCount          Número de fases.
 * @param wavelengthsPerPhase Muestras por fase.
 */
public record LineSpectrum(
        double[] wavelengths,
        double[] flux,
        int phaseCount,
        int wavelengthsPerPhase
) {
    public LineSpectrum {
        Objects.requireNonNull(wavelengths, "El array de longitudes de onda no puede ser nulo.");
        Objects.requireNonNull(flux, "El array de flujo no puede ser nulo.");
        int expected = phaseCount * wavelengthsPerPhase;
        if (wavelengths.length != expected || flux.length != expected) {
            throw new IllegalArgumentException(String.format(
                    "El espectro debe tener %d muestras (%d fases x %d longitudes de onda).",
                    expected, phaseCount, wavelengthsPerPhase));
        }
        wavelengths = wavelengths.clone();
        flux = flux.clone();
    }

    /**
     * Ensambla el espectro a partir de los segmentos de cada fase sobre una misma rejilla.
     */
    public static LineSpectrum fromSegments(WavelengthGrid grid, double[][] phaseSegments) {
        int n = grid.getSize();
        double[] wavelengths = new double[phaseSegments.length * n];
        double[] flux = new double[phaseSegments.length * n];
        double[] gridValues = grid.getValues();
        for (int p = 0; p < phaseSegments.length; p++) {
            if (phaseSegments[p].length != n) {
                throw new IllegalArgumentException("El segmento de la fase " + p + " no coincide con la rejilla.");
            }
            System.arraycopy(gridValues, 0, wavelengths, p * n, n);
            System.arraycopy(phaseSegments[p], 0, flux, p * n, n);
        }
        return new LineSpectrum(wavelengths, flux, phaseSegments.length, n);
    }

    @Override
    public double[] wavelengths() {
        return wavelengths.clone();
    }

    @Override
    public double[] flux() {
        return flux.clone();
    }

    public int size() {
        return flux.length;
    }

    public double fluxAt(int phaseIndex, int wavelengthIndex) {
        if (phaseIndex < 0 || phaseIndex >= phaseCount || wavelengthIndex < 0 || wavelengthIndex >= wavelengthsPerPhase) {
            throw new IndexOutOfBoundsException(String.format(
                    "Muestra (%d, %d) fuera del espectro %dx%d.", phaseIndex, wavelengthIndex, phaseCount, wavelengthsPerPhase));
        }
        return flux[phaseIndex * wavelengthsPerPhase + wavelengthIndex];
    }
}
