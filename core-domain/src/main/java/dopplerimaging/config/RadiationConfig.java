package dopplerimaging.config;

import lombok.Builder;
import lombok.With;

/**
 * Sistema de unidades de la ley de radiación de cuerpo negro.
 * <p>
 * Con las constantes del SI los valores intermedios desbordan a la escala de trabajo,
 * así que por defecto se usan unidades normalizadas (h = c = k = 1).
 *
 * @param planckConstant    Constante de Planck (h).
 * @param speedOfLight      Velocidad de la luz (c) de la ley de Planck.
 * @param boltzmannConstant Constante de Boltzmann (k).
 * @param temperatureScale  Constante σ de la conversión brillo → temperatura, T = I^0.25 / σ.
 */
@Builder
@With
public record RadiationConfig(
        double planckConstant,
        double speedOfLight,
        double boltzmannConstant,
        double temperatureScale
) {

    /**
     * Valor SI de la constante de Stefan-Boltzmann [W m⁻² K⁻⁴].
     */
    public static final double STEFAN_BOLTZMANN = 5.670374419e-8;

    public RadiationConfig {
        if (!(planckConstant > 0) || !(speedOfLight > 0) || !(boltzmannConstant > 0)) {
            throw new IllegalArgumentException("Las constantes de radiación deben ser positivas.");
        }
        if (!(temperatureScale > 0)) {
            throw new IllegalArgumentException("La escala de temperatura (σ) debe ser positiva.");
        }
    }

    public static RadiationConfig normalizedUnits() {
        return new RadiationConfig(1.0, 1.0, 1.0, STEFAN_BOLTZMANN);
    }
}
