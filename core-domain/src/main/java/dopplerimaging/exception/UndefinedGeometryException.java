package dopplerimaging.exception;

import lombok.Getter;

/**
 * Una magnitud geométrica no está definida para la configuración dada
 * (p. ej. sin(i) = 0 o un radicando negativo con política de rechazo).
 */
@Getter
public class UndefinedGeometryException extends ForwardModelException {

    private final int elementIndex;

    public UndefinedGeometryException(int elementIndex, String message) {
        super(message);
        this.elementIndex = elementIndex;
    }
}
