package dopplerimaging;

import dopplerimaging.config.StarConfig;
import dopplerimaging.domain.star.StellarGeometry;
import dopplerimaging.domain.star.SurfaceMap;

/**
 * Estrellas pequeñas para pruebas rápidas.
 */
public final class StarFixtures {

    private StarFixtures() {
    }

    /**
     * 60 zonas en 6 bandas, sin mancha.
     */
    public static StarConfig smallStar(double inclination, double equatorialVelocity) {
        return StarConfig.builder()
                .inclinationAngle(inclination)
                .numLatitudes(6)
                .radius(3.4e6)
                .equatorialVelocity(equatorialVelocity)
                .zoneCount(60)
                .initialPhase(0.0)
                .baseBrightness(1.0)
                .build();
    }

    /**
     * Mapa de elementos colocados a mano en el ecuador (colatitud π/2).
     */
    public static SurfaceMap equatorialMap(double inclination, double equatorialVelocity,
                                           double[] longitudes, double[] brightness) {
        StellarGeometry geometry = StellarGeometry.builder()
                .radius(1.0e6)
                .equatorialVelocity(equatorialVelocity)
                .inclinationAngle(inclination)
                .numLatitudes(1)
                .zoneCount(longitudes.length)
                .phase(0.0)
                .build();
        double[] colatitudes = new double[longitudes.length];
        java.util.Arrays.fill(colatitudes, Math.PI / 2);
        return new SurfaceMap(geometry, brightness, colatitudes, longitudes);
    }
}
