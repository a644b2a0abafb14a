package dopplerimaging.physics.i;

/**
 * Emisión continua de un elemento de superficie en función de la longitud de onda
 * y la temperatura.
 */
public interface IRadiationLaw extends ISolverComponent {

    /**
     * Radiancia espectral B(λ, T).
     *
     * @throws IllegalArgumentException si λ <= 0 o T <= 0.
     */
    double spectralRadiance(double wavelength, double temperature);

    /**
     * Integral definida de B(λ, T) sobre [λStart, λStart + Δλ] a temperatura fija.
     *
     * @throws dopplerimaging.exception.QuadratureConvergenceException si la cuadratura no converge.
     */
    double integrateRadiance(double wavelengthStart, double bandWidth, double temperature);

    /**
     * Integral de B(λ, T) sobre todo el espectro, (0, ∞).
     */
    double totalRadiance(double temperature);

    /**
     * Temperatura efectiva de un elemento a partir de su brillo.
     */
    double temperatureOf(double brightness);
}
