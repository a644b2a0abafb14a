package dopplerimaging.domain.star;

/**
 * Tratamiento de un radicando negativo en el factor de ensanchamiento rotacional.
 */
public enum BroadeningPolicy {
    CLAMP_TO_ZERO,
    REJECT
}
