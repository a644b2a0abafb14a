package dopplerimaging.domain.star;

/**
 * Criterio para convertir el producto escalar normal·observador de un elemento
 * en su factor de área proyectada.
 */
public enum VisibilityModel {
    /**
     * El factor es el propio producto escalar si es positivo; los elementos de la
     * cara oculta devuelven exactamente 0.
     */
    BACK_FACE_CULLING,
    /**
     * El factor es el valor absoluto del producto escalar para todos los elementos,
     * incluidos los de la cara oculta.
     */
    LEGACY_ABSOLUTE
}
