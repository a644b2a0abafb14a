package dopplerimaging.domain.star;

import lombok.Getter;

import java.util.Arrays;
import java.util.Objects;

/**
 * Instantánea inmutable del mapa de brillo de una estrella en una fase.
 * <p>
 * Cada elemento de superficie tiene un brillo y unas coordenadas fijas en el
 * sistema que gira con la estrella. Rotar no modifica la instancia: devuelve una
 * nueva instantánea con la fase avanzada, de modo que varias fases pueden
 * procesarse a la vez sin coordinación entre hilos.
 */
public final class SurfaceMap {

    @Getter
    private final StellarGeometry geometry;
    private final double[] brightness;
    private final double[] colatitudes;
    private final double[] longitudes;

    /**
     * @param geometry    Geometría de la estrella; {@code zoneCount} fija la longitud de los arrays.
     * @param brightness  Brillo de cada elemento (valores finitos >= 0).
     * @param colatitudes Colatitud de cada elemento [rad].
     * @param longitudes  Longitud de cada elemento [rad].
     */
    public SurfaceMap(StellarGeometry geometry, double[] brightness, double[] colatitudes, double[] longitudes) {
        Objects.requireNonNull(geometry, "La geometría estelar no puede ser nula.");
        Objects.requireNonNull(brightness, "El vector de brillo no puede ser nulo.");
        Objects.requireNonNull(colatitudes, "El array de colatitudes no puede ser nulo.");
        Objects.requireNonNull(longitudes, "El array de longitudes no puede ser nulo.");

        int n = geometry.zoneCount();
        if (brightness.length != n || colatitudes.length != n || longitudes.length != n) {
            throw new IllegalArgumentException(String.format(
                    "Todos los arrays del mapa deben tener longitud zoneCount (%d).", n));
        }
        for (int i = 0; i < n; i++) {
            if (!(brightness[i] >= 0) || Double.isInfinite(brightness[i])) {
                throw new IllegalArgumentException(String.format(
                        "El brillo del elemento %d no es válido: %s", i, brightness[i]));
            }
        }

        this.geometry = geometry;
        this.brightness = brightness.clone();
        this.colatitudes = colatitudes.clone();
        this.longitudes = longitudes.clone();
    }

    // Los arrays ya son privados e inmutables, se comparten entre instantáneas.
    private SurfaceMap(SurfaceMap source, StellarGeometry geometry) {
        this.geometry = geometry;
        this.brightness = source.brightness;
        this.colatitudes = source.colatitudes;
        this.longitudes = source.longitudes;
    }

    public int getElementCount() {
        return brightness.length;
    }

    public double getPhase() {
        return geometry.phase();
    }

    /**
     * Devuelve una copia del vector de brillo actual.
     */
    public double[] brightnessVector() {
        return brightness.clone();
    }

    public double getBrightnessAt(int elementIndex) {
        validateElementIndex(elementIndex);
        return brightness[elementIndex];
    }

    /**
     * Coordenadas (colatitud, longitud) del elemento en el sistema de la estrella.
     * No incluyen la fase de rotación.
     */
    public SurfaceCoordinate latLon(int elementIndex) {
        validateElementIndex(elementIndex);
        return new SurfaceCoordinate(colatitudes[elementIndex], longitudes[elementIndex]);
    }

    /**
     * Avanza la rotación de la estrella.
     *
     * @param phaseStep Incremento de fase [rad].
     * @return Una nueva instantánea con la fase avanzada; el brillo en el sistema de la estrella no cambia.
     */
    public SurfaceMap rotate(double phaseStep) {
        if (Double.isNaN(phaseStep) || Double.isInfinite(phaseStep)) {
            throw new IllegalArgumentException("El paso de fase debe ser finito.");
        }
        return new SurfaceMap(this, geometry.withPhase(geometry.phase() + phaseStep));
    }

    /**
     * Suma del brillo de todos los elementos.
     */
    public double totalBrightness() {
        return Arrays.stream(brightness).sum();
    }

    private void validateElementIndex(int elementIndex) {
        if (elementIndex < 0 || elementIndex >= brightness.length) {
            throw new IndexOutOfBoundsException("El índice de elemento " + elementIndex
                    + " está fuera de los límites [0, " + (brightness.length - 1) + "].");
        }
    }
}
