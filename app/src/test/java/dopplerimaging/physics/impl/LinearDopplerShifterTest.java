package dopplerimaging.physics.impl;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class LinearDopplerShifterTest {

    private final LinearDopplerShifter shifter = new LinearDopplerShifter();

    private static double[] grid(int n) {
        double[] wavelengths = new double[n];
        for (int j = 0; j < n; j++) {
            wavelengths[j] = 1.0 + j;
        }
        return wavelengths;
    }

    @Test
    @DisplayName("Velocidad nula: el espectro no cambia")
    void zeroVelocity_isIdentity() {
        double[] wavelengths = grid(10);
        double[] spectrum = {3, 1, 4, 1, 5, 9, 2, 6, 5, 3};

        double[] shifted = shifter.shiftSpectrum(spectrum, 0.0, wavelengths);

        assertThat(shifted).containsExactly(spectrum);
        assertThat(shifted).isNotSameAs(spectrum);
    }

    @Test
    @DisplayName("Un espectro constante es invariante bajo el desplazamiento")
    void constantSpectrum_isInvariant() {
        double[] wavelengths = grid(20);
        double[] spectrum = new double[20];
        java.util.Arrays.fill(spectrum, 2.5);

        assertThat(shifter.shiftSpectrum(spectrum, 150.0, wavelengths)).containsOnly(2.5);
        assertThat(shifter.shiftSpectrum(spectrum, -150.0, wavelengths)).containsOnly(2.5);
    }

    @Test
    @DisplayName("Espectro lineal: los puntos interiores valen λ / (1 + v/c)")
    void linearSpectrum_interiorPoints() {
        double[] wavelengths = grid(10);
        double[] spectrum = wavelengths.clone();
        double velocity = 0.05 * LinearDopplerShifter.SPEED_OF_LIGHT_KMS;
        double factor = 1.05;

        double[] shifted = shifter.shiftSpectrum(spectrum, velocity, wavelengths);

        for (int j = 1; j < wavelengths.length; j++) {
            assertThat(shifted[j]).isCloseTo(wavelengths[j] / factor, within(1e-12));
        }
    }

    @Test
    @DisplayName("Fuera del rango desplazado se repite el primer o el último valor")
    void edges_useFirstAndLastValue() {
        double[] wavelengths = grid(10);
        double[] spectrum = wavelengths.clone();
        double c = LinearDopplerShifter.SPEED_OF_LIGHT_KMS;

        double[] redshifted = shifter.shiftSpectrum(spectrum, 0.1 * c, wavelengths);
        double[] blueshifted = shifter.shiftSpectrum(spectrum, -0.1 * c, wavelengths);

        assertThat(redshifted[0]).isEqualTo(spectrum[0]);
        assertThat(blueshifted[9]).isEqualTo(spectrum[9]);
        assertThat(blueshifted[0]).isCloseTo(1.0 / 0.9, within(1e-12));
    }

    @Test
    @DisplayName("Con un único punto no hay nada que interpolar")
    void singleSample_isReturnedUnchanged() {
        assertThat(shifter.shiftSpectrum(new double[]{7.0}, 100.0, new double[]{0.5})).containsExactly(7.0);
    }

    @Test
    @DisplayName("Entradas inválidas se rechazan")
    void invalidInputs_areRejected() {
        double[] wavelengths = grid(4);
        double[] spectrum = {1, 2, 3, 4};

        assertThatThrownBy(() -> shifter.shiftSpectrum(new double[3], 1.0, wavelengths))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> shifter.shiftSpectrum(spectrum, Double.NaN, wavelengths))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> shifter.shiftSpectrum(spectrum, 1.0, new double[]{1, 3, 2, 4}))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> shifter.shiftSpectrum(spectrum, -LinearDopplerShifter.SPEED_OF_LIGHT_KMS, wavelengths))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new LinearDopplerShifter(0.0))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
