package dopplerimaging.domain.star;

import lombok.Builder;
import lombok.With;

/**
 * Geometría inmutable de una estrella en rotación en una fase concreta.
 * <p>
 * Radio, velocidad, inclinación y teselación son fijos durante la vida de la
 * estrella; sólo la fase cambia, y cada avance produce una instancia nueva
 * mediante {@code withPhase}.
 *
 * @param radius             Radio estelar [m] (> 0).
 * @param equatorialVelocity Velocidad de rotación ecuatorial [m/s] (>= 0).
 * @param inclinationAngle   Inclinación del eje de rotación respecto a la línea de visión [rad].
 * @param numLatitudes       Número de bandas de latitud.
 * @param zoneCount          Número de elementos de superficie.
 * @param phase              Fase de rotación acumulada [rad].
 */
@Builder
@With
public record StellarGeometry(
        double radius,
        double equatorialVelocity,
        double inclinationAngle,
        int numLatitudes,
        int zoneCount,
        double phase
) {

    public StellarGeometry {
        if (!(radius > 0)) {
            throw new IllegalArgumentException("El radio estelar debe ser positivo.");
        }
        if (equatorialVelocity < 0 || Double.isNaN(equatorialVelocity)) {
            throw new IllegalArgumentException("La velocidad ecuatorial no puede ser negativa.");
        }
        if (Double.isNaN(inclinationAngle) || Double.isNaN(phase)) {
            throw new IllegalArgumentException("La inclinación y la fase deben ser números finitos.");
        }
        if (numLatitudes < 1 || zoneCount < numLatitudes) {
            throw new IllegalArgumentException(String.format(
                    "Teselación inválida: %d zonas en %d bandas de latitud.", zoneCount, numLatitudes));
        }
    }

    /**
     * Velocidad angular de rotación ω = v_e / R [rad/s].
     */
    public double angularVelocity() {
        return equatorialVelocity / radius;
    }
}
