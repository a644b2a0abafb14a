package dopplerimaging.exception;

/**
 * Raíz de los fallos numéricos del modelo directo. Son errores deterministas:
 * repetir la misma llamada produce el mismo fallo.
 */
public class ForwardModelException extends RuntimeException {

    public ForwardModelException(String message) {
        super(message);
    }

    public ForwardModelException(String message, Throwable cause) {
        super(message, cause);
    }
}
