package dopplerimaging.config;

import lombok.Builder;
import lombok.With;

/**
 * Mancha circular sobre la superficie estelar.
 *
 * @param colatitude    Colatitud del centro de la mancha [rad], 0 en el polo visible.
 * @param longitude     Longitud del centro de la mancha [rad].
 * @param angularRadius Radio angular de la mancha [rad] (> 0).
 * @param brightness    Brillo de los elementos cubiertos por la mancha (>= 0).
 */
@Builder
@With
public record SpotConfig(
        double colatitude,
        double longitude,
        double angularRadius,
        double brightness
) {
    public SpotConfig {
        if (!(angularRadius > 0)) {
            throw new IllegalArgumentException("El radio angular de la mancha debe ser positivo.");
        }
        if (brightness < 0 || Double.isNaN(brightness)) {
            throw new IllegalArgumentException("El brillo de la mancha no puede ser negativo.");
        }
    }
}
