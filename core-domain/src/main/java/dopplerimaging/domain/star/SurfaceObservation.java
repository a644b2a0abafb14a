package dopplerimaging.domain.star;

/**
 * Lo que el observador ve de un elemento de superficie en una fase concreta.
 * Se recalcula en cada consulta y nunca se reutiliza entre fases.
 *
 * @param elementIndex   Índice del elemento en el mapa.
 * @param position       Vector de posición (x, y, z) [m].
 * @param radialVelocity Velocidad radial [km/s]; positiva cuando el elemento se aleja.
 * @param projectedArea  Factor de área proyectada en [0, 1].
 */
public record SurfaceObservation(
        int elementIndex,
        double[] position,
        double radialVelocity,
        double projectedArea
) {
    public SurfaceObservation {
        position = position.clone();
    }

    @Override
    public double[] position() {
        return position.clone();
    }

    public boolean isVisible() {
        return projectedArea > 0.0;
    }
}
