package dopplerimaging.exception;

import lombok.Getter;

/**
 * La cuadratura adaptativa no alcanzó la tolerancia pedida antes de agotar el
 * número máximo de subintervalos. La temperatura es NaN mientras el fallo no se
 * ha asociado a una banda de la ley de radiación.
 */
@Getter
public class QuadratureConvergenceException extends ForwardModelException {

    private final double lowerBound;
    private final double upperBound;
    private final double estimatedError;
    private final int subintervals;
    private final double temperature;

    public QuadratureConvergenceException(double lowerBound, double upperBound, double estimatedError, int subintervals) {
        super(String.format("La cuadratura no converge en [%s, %s]: error estimado %.3e tras %d subintervalos.",
                lowerBound, upperBound, estimatedError, subintervals));
        this.lowerBound = lowerBound;
        this.upperBound = upperBound;
        this.estimatedError = estimatedError;
        this.subintervals = subintervals;
        this.temperature = Double.NaN;
    }

    private QuadratureConvergenceException(QuadratureConvergenceException source, double temperature) {
        super(String.format("La integral de radiancia no converge en la banda [%s, %s] a T = %s: error estimado %.3e tras %d subintervalos.",
                source.lowerBound, source.upperBound, temperature, source.estimatedError, source.subintervals), source);
        this.lowerBound = source.lowerBound;
        this.upperBound = source.upperBound;
        this.estimatedError = source.estimatedError;
        this.subintervals = source.subintervals;
        this.temperature = temperature;
    }

    /**
     * Copia del fallo asociada a la temperatura de la banda que se integraba.
     */
    public QuadratureConvergenceException withTemperature(double temperature) {
        return new QuadratureConvergenceException(this, temperature);
    }
}
