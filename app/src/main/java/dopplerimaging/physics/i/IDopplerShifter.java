package dopplerimaging.physics.i;

public interface IDopplerShifter extends ISolverComponent {
    /**
     * Remuestrea sobre la misma rejilla un espectro desplazado por una velocidad radial.
     *
     * @param spectrum       Espectro muestreado en {@code wavelengths}.
     * @param radialVelocity Velocidad radial [km/s], positiva en alejamiento.
     * @param wavelengths    Rejilla estrictamente creciente, de la misma longitud que el espectro.
     * @return Un nuevo array con el espectro desplazado.
     */
    double[] shiftSpectrum(double[] spectrum, double radialVelocity, double[] wavelengths);
}
