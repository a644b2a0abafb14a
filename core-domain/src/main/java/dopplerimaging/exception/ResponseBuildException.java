package dopplerimaging.exception;

import lombok.Getter;

/**
 * Fallo al construir la fila de un elemento de superficie. Lleva el elemento, la
 * fase y la etapa para que el llamador decida si aborta toda la secuencia de fases.
 */
@Getter
public class ResponseBuildException extends ForwardModelException {

    /**
     * Etapa de la construcción de la fila en la que se produjo el fallo.
     */
    public enum Stage {
        INTEGRATION,
        DOPPLER_SHIFT,
        VISIBILITY
    }

    private final int elementIndex;
    private final double phase;
    private final Stage stage;

    public ResponseBuildException(int elementIndex, double phase, Stage stage, Throwable cause) {
        super(String.format("Error construyendo la fila del elemento %d (fase %.4f rad, etapa %s): %s",
                elementIndex, phase, stage, cause.getMessage()), cause);
        this.elementIndex = elementIndex;
        this.phase = phase;
        this.stage = stage;
    }
}
