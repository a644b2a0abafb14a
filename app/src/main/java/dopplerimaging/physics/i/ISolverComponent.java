package dopplerimaging.physics.i;

/**
 * Contrato base para cualquier componente numérico del modelo directo.
 * Permite tratar a todos los componentes de forma polimórfica para tareas
 * de logging, identificación y depuración, sin importar su física.
 */
public interface ISolverComponent {
    /**
     * Nombre corto del algoritmo (ej: "Planck", "LinearDopplerShift").
     */
    String getName();

    /**
     * Descripción técnica detallada.
     */
    default String getDescription() {
        return "Sin descripción disponible.";
    }
}
