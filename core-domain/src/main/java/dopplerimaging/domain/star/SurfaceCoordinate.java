package dopplerimaging.domain.star;

/**
 * Posición de un elemento de superficie en el sistema de referencia de la estrella.
 *
 * @param colatitude Ángulo polar medido desde el polo de rotación [rad], en [0, π].
 * @param longitude  Longitud en el sistema que gira con la estrella [rad].
 */
public record SurfaceCoordinate(double colatitude, double longitude) {
}
