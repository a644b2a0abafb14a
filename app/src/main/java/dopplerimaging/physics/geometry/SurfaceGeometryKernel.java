package dopplerimaging.physics.geometry;

import dopplerimaging.domain.star.StellarGeometry;
import dopplerimaging.domain.star.SurfaceCoordinate;
import dopplerimaging.domain.star.SurfaceMap;
import dopplerimaging.domain.star.SurfaceObservation;
import dopplerimaging.domain.star.VisibilityModel;
import dopplerimaging.physics.i.ISolverComponent;
import lombok.Getter;

import java.util.Objects;

/**
 * Geometría de observación de los elementos de superficie.
 * <p>
 * El eje de rotación es z y el observador está en la dirección
 * n = (0, sin i, cos i). La longitud de cada elemento se desplaza con la fase
 * actual de la estrella (φ' = φ + fase) tanto para la velocidad como para la
 * visibilidad. Sin estado: cada consulta se recalcula a partir del mapa.
 */
public class SurfaceGeometryKernel implements ISolverComponent {

    private static final double METERS_PER_KILOMETER = 1000.0;

    @Getter
    private final VisibilityModel visibilityModel;

    public SurfaceGeometryKernel(VisibilityModel visibilityModel) {
        this.visibilityModel = Objects.requireNonNull(visibilityModel, "El modelo de visibilidad no puede ser nulo.");
    }

    @Override
    public String getName() {
        return "RigidRotationGeometry";
    }

    @Override
    public String getDescription() {
        return "Rotación rígida alrededor de z, observador en (0, sin i, cos i), visibilidad " + visibilityModel;
    }

    /**
     * Vector de posición p = R·(sinθ·cosφ', sinθ·sinφ', cosθ) [m].
     */
    public double[] position(SurfaceMap map, int elementIndex) {
        StellarGeometry geometry = map.getGeometry();
        SurfaceCoordinate coordinate = map.latLon(elementIndex);
        double theta = coordinate.colatitude();
        double phi = coordinate.longitude() + geometry.phase();
        double r = geometry.radius();
        return new double[]{
                r * Math.sin(theta) * Math.cos(phi),
                r * Math.sin(theta) * Math.sin(phi),
                r * Math.cos(theta)
        };
    }

    /**
     * Velocidad radial −(ω⃗ × p)·n del elemento, convertida de m/s a km/s.
     * Positiva cuando el elemento se aleja del observador.
     */
    public double radialVelocity(SurfaceMap map, int elementIndex) {
        StellarGeometry geometry = map.getGeometry();
        double[] p = position(map, elementIndex);
        double[] omega = {0.0, 0.0, geometry.angularVelocity()};
        double[] n = lineOfSight(geometry);
        double[] v = cross(omega, p);
        return -dot(v, n) / METERS_PER_KILOMETER;
    }

    /**
     * Factor de área proyectada a partir de d = sinθ·sinφ'·sin i + cosθ·cos i.
     *
     * @return Un valor en [0, 1]; exactamente 0 para la cara oculta con {@link VisibilityModel#BACK_FACE_CULLING}.
     */
    public double projectedArea(SurfaceMap map, int elementIndex) {
        StellarGeometry geometry = map.getGeometry();
        SurfaceCoordinate coordinate = map.latLon(elementIndex);
        double theta = coordinate.colatitude();
        double phi = coordinate.longitude() + geometry.phase();
        double inclination = geometry.inclinationAngle();

        double d = Math.sin(theta) * Math.sin(phi) * Math.sin(inclination)
                + Math.cos(theta) * Math.cos(inclination);
        // |d| <= 1 salvo por redondeo.
        d = Math.max(-1.0, Math.min(1.0, d));

        return switch (visibilityModel) {
            case BACK_FACE_CULLING -> d > 0.0 ? d : 0.0;
            case LEGACY_ABSOLUTE -> Math.abs(d);
        };
    }

    public SurfaceObservation observe(SurfaceMap map, int elementIndex) {
        return new SurfaceObservation(
                elementIndex,
                position(map, elementIndex),
                radialVelocity(map, elementIndex),
                projectedArea(map, elementIndex));
    }

    /**
     * Suma de las áreas proyectadas de todos los elementos.
     */
    public double totalProjectedArea(SurfaceMap map) {
        double total = 0.0;
        for (int i = 0; i < map.getElementCount(); i++) {
            total += projectedArea(map, i);
        }
        return total;
    }

    private static double[] lineOfSight(StellarGeometry geometry) {
        double inclination = geometry.inclinationAngle();
        return new double[]{0.0, Math.sin(inclination), Math.cos(inclination)};
    }

    private static double[] cross(double[] a, double[] b) {
        return new double[]{
                a[1] * b[2] - a[2] * b[1],
                a[2] * b[0] - a[0] * b[2],
                a[0] * b[1] - a[1] * b[0]
        };
    }

    private static double dot(double[] a, double[] b) {
        return a[0] * b[0] + a[1] * b[1] + a[2] * b[2];
    }
}
