package dopplerimaging.config;

import lombok.Builder;
import lombok.With;

/**
 * Un objeto de valor inmutable con todos los parámetros necesarios para construir
 * una estrella sintética y su mapa de brillo superficial.
 * <p>
 * Agrupa la geometría estelar (radio, rotación, inclinación), la teselación de la
 * superficie y la distribución de brillo (base más una mancha opcional).
 *
 * @param inclinationAngle   Ángulo de inclinación del eje de rotación respecto a la línea de visión [rad].
 * @param numLatitudes       Número de bandas de latitud de la teselación (>= 1).
 * @param radius             Radio estelar [m].
 * @param equatorialVelocity Velocidad de rotación ecuatorial [m/s].
 * @param zoneCount          Número total de elementos de superficie (>= numLatitudes).
 * @param initialPhase       Fase de rotación inicial [rad].
 * @param baseBrightness     Brillo de fondo de cada elemento (>= 0).
 * @param spot               Mancha circular opcional; {@code null} para una estrella uniforme.
 */
@Builder
@With
public record StarConfig(
        double inclinationAngle,
        int numLatitudes,
        double radius,
        double equatorialVelocity,
        int zoneCount,
        double initialPhase,
        double baseBrightness,
        SpotConfig spot
) {

    public StarConfig {
        if (numLatitudes < 1) {
            throw new IllegalArgumentException("El número de bandas de latitud debe ser al menos 1.");
        }
        if (zoneCount < numLatitudes) {
            throw new IllegalArgumentException(String.format(
                    "El número de zonas (%d) no puede ser menor que el número de bandas de latitud (%d).",
                    zoneCount, numLatitudes));
        }
        if (!(radius > 0)) {
            throw new IllegalArgumentException("El radio estelar debe ser positivo.");
        }
        if (equatorialVelocity < 0 || Double.isNaN(equatorialVelocity)) {
            throw new IllegalArgumentException("La velocidad ecuatorial no puede ser negativa.");
        }
        if (baseBrightness < 0 || Double.isNaN(baseBrightness)) {
            throw new IllegalArgumentException("El brillo base no puede ser negativo.");
        }
    }

    /**
     * Estrella de referencia usada por los tests y por la ejecución por defecto:
     * inclinación π/4.2, 700 zonas y una mancha fría en latitudes medias.
     */
    public static StarConfig getTestingStar() {
        return StarConfig.builder()
                .inclinationAngle(Math.PI / 4.2)
                .numLatitudes(20)
                .radius(3.4e6)
                .equatorialVelocity(5.0e4)
                .zoneCount(700)
                .initialPhase(0.0)
                .baseBrightness(1.0)
                .spot(SpotConfig.builder()
                        .colatitude(Math.PI / 3)
                        .longitude(0.0)
                        .angularRadius(0.4)
                        .brightness(0.25)
                        .build())
                .build();
    }
}
