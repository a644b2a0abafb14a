package dopplerimaging.physics.impl;

import dopplerimaging.domain.star.BroadeningPolicy;
import dopplerimaging.domain.star.StellarGeometry;
import dopplerimaging.domain.star.SurfaceMap;
import dopplerimaging.exception.UndefinedGeometryException;
import dopplerimaging.physics.geometry.SurfaceGeometryKernel;
import dopplerimaging.physics.i.ISolverComponent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Factor de escala del ensanchamiento rotacional de cada elemento:
 * sqrt(1 − l² / (v_e² · sin²i)), con l = v_r / c y v_e = v_eq / c.
 * <p>
 * Es un diagnóstico: no interviene en el espectro final. Nunca devuelve NaN; los
 * casos no definidos se resuelven según la {@link BroadeningPolicy}.
 * <p>
 * Ambas velocidades se pasan a m/s antes de dividir por c, así que el limbo de un
 * ecuador visto de canto da factor 0. Si la velocidad radial en km/s se divide
 * directamente por c en m/s, los factores quedan pegados a 1 y no son comparables
 * con estos.
 */
@Slf4j
@RequiredArgsConstructor
public class RotationalBroadeningCalculator implements ISolverComponent {

    /**
     * Velocidad de la luz [m/s].
     */
    public static final double SPEED_OF_LIGHT_MS = 299_792_458.0;

    private static final double METERS_PER_KILOMETER = 1000.0;
    private static final double MIN_SIN_INCLINATION = 1e-12;

    private final SurfaceGeometryKernel kernel;
    private final BroadeningPolicy policy;

    @Override
    public String getName() {
        return "RotationalBroadening";
    }

    /**
     * Calcula el factor de todos los elementos del mapa, en orden de elemento.
     *
     * @throws UndefinedGeometryException si sin(i) = 0 o v_e = 0 con velocidad radial no nula,
     *                                    o si el radicando es negativo con la política {@code REJECT}.
     */
    public double[] factors(SurfaceMap map) {
        StellarGeometry geometry = map.getGeometry();
        double ve = geometry.equatorialVelocity() / SPEED_OF_LIGHT_MS;
        double sinI = Math.sin(geometry.inclinationAngle());

        double[] factors = new double[map.getElementCount()];
        int clamped = 0;
        for (int i = 0; i < factors.length; i++) {
            double l = kernel.radialVelocity(map, i) * METERS_PER_KILOMETER / SPEED_OF_LIGHT_MS;
            if (l == 0.0) {
                factors[i] = 1.0;
                continue;
            }
            if (Math.abs(sinI) < MIN_SIN_INCLINATION || ve == 0.0) {
                throw new UndefinedGeometryException(i, String.format(
                        "Factor de ensanchamiento no definido en el elemento %d: sin(i) = %s, v_e = %s.", i, sinI, ve));
            }

            double radicand = 1.0 - (l * l) / (ve * ve * sinI * sinI);
            if (radicand < 0.0) {
                if (policy == BroadeningPolicy.REJECT) {
                    throw new UndefinedGeometryException(i, String.format(
                            "Radicando negativo (%.3e) en el factor de ensanchamiento del elemento %d.", radicand, i));
                }
                radicand = 0.0;
                clamped++;
            }
            factors[i] = Math.sqrt(radicand);
        }
        if (clamped > 0) {
            log.debug("{} factores de ensanchamiento recortados a 0.", clamped);
        }
        return factors;
    }
}
