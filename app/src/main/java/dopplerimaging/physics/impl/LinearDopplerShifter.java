package dopplerimaging.physics.impl;

import dopplerimaging.physics.i.IDopplerShifter;

/**
 * Desplazamiento Doppler no relativista por interpolación lineal.
 * <p>
 * El espectro se considera emitido en λ y observado en λ' = λ·(1 + v/c); los
 * valores sobre la rejilla original se obtienen interpolando linealmente entre las
 * posiciones desplazadas. Fuera del rango desplazado se repite el primer o el
 * último valor del espectro.
 */
public class LinearDopplerShifter implements IDopplerShifter {

    /**
     * Velocidad de la luz en el vacío [km/s].
     */
    public static final double SPEED_OF_LIGHT_KMS = 299792.458;

    private final double speedOfLight;

    public LinearDopplerShifter() {
        this(SPEED_OF_LIGHT_KMS);
    }

    /**
     * @param speedOfLight Velocidad de la luz en las mismas unidades que las velocidades radiales.
     */
    public LinearDopplerShifter(double speedOfLight) {
        if (!(speedOfLight > 0) || Double.isInfinite(speedOfLight)) {
            throw new IllegalArgumentException("La velocidad de la luz debe ser positiva y finita.");
        }
        this.speedOfLight = speedOfLight;
    }

    @Override
    public String getName() {
        return "LinearDopplerShift";
    }

    @Override
    public String getDescription() {
        return "λ' = λ(1 + v/c) con interpolación lineal y extensión primer/último valor en los bordes";
    }

    @Override
    public double[] shiftSpectrum(double[] spectrum, double radialVelocity, double[] wavelengths) {
        int n = spectrum.length;
        if (wavelengths.length != n) {
            throw new IllegalArgumentException(String.format(
                    "El espectro (%d) y la rejilla (%d) deben tener la misma longitud.", n, wavelengths.length));
        }
        if (!Double.isFinite(radialVelocity)) {
            throw new IllegalArgumentException("La velocidad radial debe ser finita: " + radialVelocity);
        }
        for (int j = 1; j < n; j++) {
            if (!(wavelengths[j] > wavelengths[j - 1])) {
                throw new IllegalArgumentException("La rejilla de longitudes de onda debe ser estrictamente creciente.");
            }
        }
        if (radialVelocity == 0.0 || n < 2) {
            return spectrum.clone();
        }

        double factor = 1.0 + radialVelocity / speedOfLight;
        if (!(factor > 0)) {
            throw new IllegalArgumentException(String.format(
                    "Velocidad radial no física: %s km/s (c = %s km/s).", radialVelocity, speedOfLight));
        }

        double[] shifted = new double[n];
        for (int j = 0; j < n; j++) {
            shifted[j] = wavelengths[j] * factor;
        }

        double[] result = new double[n];
        int k = 0;
        for (int j = 0; j < n; j++) {
            double target = wavelengths[j];
            if (target <= shifted[0]) {
                result[j] = spectrum[0];
                continue;
            }
            if (target >= shifted[n - 1]) {
                result[j] = spectrum[n - 1];
                continue;
            }
            // La rejilla objetivo es creciente: el índice de búsqueda sólo avanza.
            while (shifted[k + 1] < target) {
                k++;
            }
            double t = (target - shifted[k]) / (shifted[k + 1] - shifted[k]);
            result[j] = spectrum[k] + t * (spectrum[k + 1] - spectrum[k]);
        }
        return result;
    }
}
