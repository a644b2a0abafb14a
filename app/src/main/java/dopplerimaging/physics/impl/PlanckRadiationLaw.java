package dopplerimaging.physics.impl;

import dopplerimaging.config.RadiationConfig;
import dopplerimaging.exception.QuadratureConvergenceException;
import dopplerimaging.physics.i.IRadiationLaw;
import dopplerimaging.physics.solver.AdaptiveQuadratureSolver;
import lombok.Getter;

import java.util.Objects;

/**
 * Ley de Planck para la emisión continua de cuerpo negro:
 * B(λ, T) = 2hc² / λ⁵ · 1 / (exp(hc / (λkT)) − 1).
 * <p>
 * Las constantes se inyectan con {@link RadiationConfig}, de modo que el sistema de
 * unidades se puede cambiar sin tocar el código (por defecto h = c = k = 1).
 */
public class PlanckRadiationLaw implements IRadiationLaw {

    @Getter
    private final RadiationConfig config;
    private final double radianceScale;   // 2hc²
    private final double exponentScale;   // hc / k
    private final double totalScale;      // 2k⁴ / (h³c²)

    public PlanckRadiationLaw(RadiationConfig config) {
        this.config = Objects.requireNonNull(config, "La configuración de radiación no puede ser nula.");
        double h = config.planckConstant();
        double c = config.speedOfLight();
        double k = config.boltzmannConstant();
        this.radianceScale = 2.0 * h * c * c;
        this.exponentScale = h * c / k;
        this.totalScale = 2.0 * Math.pow(k, 4) / (Math.pow(h, 3) * c * c);
    }

    @Override
    public String getName() {
        return "Planck";
    }

    @Override
    public String getDescription() {
        return "Radiancia de cuerpo negro integrada con cuadratura adaptativa Gauss-Kronrod 7/15";
    }

    @Override
    public double spectralRadiance(double wavelength, double temperature) {
        validatePositive(wavelength, "longitud de onda");
        validatePositive(temperature, "temperatura");
        return radiance(wavelength, temperature);
    }

    @Override
    public double integrateRadiance(double wavelengthStart, double bandWidth, double temperature) {
        validatePositive(wavelengthStart, "longitud de onda inicial");
        validatePositive(bandWidth, "anchura de banda");
        validatePositive(temperature, "temperatura");
        try {
            return AdaptiveQuadratureSolver.integrate(
                    lambda -> radiance(lambda, temperature),
                    wavelengthStart,
                    wavelengthStart + bandWidth);
        } catch (QuadratureConvergenceException e) {
            throw e.withTemperature(temperature);
        }
    }

    /**
     * Con x = hc / (λkT) la integral queda 2k⁴T⁴ / (h³c²) · ∫ x³ / (eˣ − 1) dx,
     * cuyo valor exacto es π⁴/15.
     */
    @Override
    public double totalRadiance(double temperature) {
        validatePositive(temperature, "temperatura");
        double integral = AdaptiveQuadratureSolver.integrateToInfinity(
                x -> x == 0.0 ? 0.0 : x * x * x / Math.expm1(x), 0.0);
        return totalScale * Math.pow(temperature, 4) * integral;
    }

    /**
     * T = I^0.25 / σ.
     */
    @Override
    public double temperatureOf(double brightness) {
        if (!(brightness >= 0) || Double.isInfinite(brightness)) {
            throw new IllegalArgumentException("El brillo debe ser finito y no negativo: " + brightness);
        }
        return Math.pow(brightness, 0.25) / config.temperatureScale();
    }

    private double radiance(double wavelength, double temperature) {
        double exponent = exponentScale / (wavelength * temperature);
        double lambda5 = Math.pow(wavelength, 5);
        // expm1 conserva la precisión cuando hc/λkT es pequeño (régimen de Rayleigh-Jeans).
        return radianceScale / (lambda5 * Math.expm1(exponent));
    }

    private static void validatePositive(double value, String name) {
        if (!(value > 0) || Double.isInfinite(value)) {
            throw new IllegalArgumentException(String.format("La %s debe ser positiva y finita: %s", name, value));
        }
    }
}
