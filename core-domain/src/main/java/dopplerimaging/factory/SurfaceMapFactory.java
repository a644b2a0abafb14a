package dopplerimaging.factory;

import dopplerimaging.config.SpotConfig;
import dopplerimaging.config.StarConfig;
import dopplerimaging.domain.star.StellarGeometry;
import dopplerimaging.domain.star.SurfaceMap;
import lombok.extern.slf4j.Slf4j;

import java.util.Arrays;
import java.util.Comparator;
import java.util.stream.IntStream;

/**
 * Fábrica responsable de la creación de instancias de {@link SurfaceMap}.
 * <p>
 * La superficie se tesela en bandas de latitud; cada banda recibe un número de
 * elementos proporcional a sin(θ) de su centro, de forma que los elementos tienen
 * un área aproximadamente igual. Dentro de una banda los elementos se reparten
 * uniformemente en longitud. Los elementos se numeran banda a banda desde el polo
 * visible (θ = 0) hacia el opuesto.
 */
@Slf4j
public final class SurfaceMapFactory {

    /**
     * Prohibido construir esta clase utilidad
     */
    private SurfaceMapFactory() {
    }

    /**
     * Crea el mapa de superficie descrito por la configuración, en su fase inicial.
     *
     * @param config La configuración de la estrella.
     * @return Un mapa inmutable con brillo base y, si procede, la mancha aplicada.
     */
    public static SurfaceMap createStar(StarConfig config) {
        StellarGeometry geometry = StellarGeometry.builder()
                .radius(config.radius())
                .equatorialVelocity(config.equatorialVelocity())
                .inclinationAngle(config.inclinationAngle())
                .numLatitudes(config.numLatitudes())
                .zoneCount(config.zoneCount())
                .phase(config.initialPhase())
                .build();

        int[] bandCounts = distributeZones(config.zoneCount(), config.numLatitudes());
        int n = config.zoneCount();
        double[] colatitudes = new double[n];
        double[] longitudes = new double[n];
        double[] brightness = new double[n];

        int index = 0;
        for (int band = 0; band < bandCounts.length; band++) {
            double colatitude = bandCenter(band, bandCounts.length);
            int count = bandCounts[band];
            for (int k = 0; k < count; k++) {
                colatitudes[index] = colatitude;
                longitudes[index] = 2.0 * Math.PI * k / count;
                brightness[index] = config.baseBrightness();
                index++;
            }
        }

        SpotConfig spot = config.spot();
        if (spot != null) {
            int covered = applySpot(spot, colatitudes, longitudes, brightness);
            log.debug("Mancha aplicada sobre {} de {} elementos.", covered, n);
        }

        log.info("Mapa de superficie creado: {} elementos en {} bandas de latitud (i = {} rad).",
                n, bandCounts.length, config.inclinationAngle());
        return new SurfaceMap(geometry, brightness, colatitudes, longitudes);
    }

    /**
     * Mapa con el mismo brillo en todos los elementos, sin mancha.
     */
    public static SurfaceMap createUniformStar(StarConfig config, double brightness) {
        return createStar(config.withBaseBrightness(brightness).withSpot(null));
    }

    /**
     * Reparte {@code zoneCount} elementos entre las bandas de latitud por el método
     * del mayor resto, con al menos un elemento por banda.
     */
    static int[] distributeZones(int zoneCount, int numLatitudes) {
        double[] weights = new double[numLatitudes];
        for (int band = 0; band < numLatitudes; band++) {
            weights[band] = Math.sin(bandCenter(band, numLatitudes));
        }
        double totalWeight = Arrays.stream(weights).sum();

        int[] counts = new int[numLatitudes];
        double[] remainders = new double[numLatitudes];
        int assigned = 0;
        for (int band = 0; band < numLatitudes; band++) {
            double quota = zoneCount * weights[band] / totalWeight;
            counts[band] = Math.max(1, (int) Math.floor(quota));
            remainders[band] = quota - Math.floor(quota);
            assigned += counts[band];
        }

        // Faltan elementos: se asignan a las bandas con mayor resto.
        Integer[] byRemainder = IntStream.range(0, numLatitudes).boxed()
                .sorted(Comparator.comparingDouble((Integer b) -> remainders[b]).reversed())
                .toArray(Integer[]::new);
        for (int k = 0; assigned < zoneCount; k = (k + 1) % numLatitudes) {
            counts[byRemainder[k]]++;
            assigned++;
        }

        // Sobran elementos (por el mínimo de uno por banda): se retiran de las bandas más pobladas.
        while (assigned > zoneCount) {
            int largest = 0;
            for (int band = 1; band < numLatitudes; band++) {
                if (counts[band] > counts[largest]) {
                    largest = band;
                }
            }
            counts[largest]--;
            assigned--;
        }
        return counts;
    }

    private static double bandCenter(int band, int numLatitudes) {
        return (band + 0.5) * Math.PI / numLatitudes;
    }

    private static int applySpot(SpotConfig spot, double[] colatitudes, double[] longitudes, double[] brightness) {
        double cosRadius = Math.cos(spot.angularRadius());
        double sinSpot = Math.sin(spot.colatitude());
        double cosSpot = Math.cos(spot.colatitude());
        int covered = 0;
        for (int i = 0; i < brightness.length; i++) {
            // Distancia angular por la ley de cosenos esférica.
            double cosDistance = cosSpot * Math.cos(colatitudes[i])
                    + sinSpot * Math.sin(colatitudes[i]) * Math.cos(longitudes[i] - spot.longitude());
            if (cosDistance >= cosRadius) {
                brightness[i] = spot.brightness();
                covered++;
            }
        }
        return covered;
    }
}
