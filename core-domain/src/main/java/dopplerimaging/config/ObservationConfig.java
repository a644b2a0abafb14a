package dopplerimaging.config;

import com.fasterxml.jackson.annotation.JsonIgnore;
import dopplerimaging.domain.star.BroadeningPolicy;
import dopplerimaging.domain.star.VisibilityModel;
import lombok.Builder;
import lombok.Value;
import lombok.With;
import lombok.extern.jackson.Jacksonized;

/**
 * Contenedor principal para todas las configuraciones de una observación sintética.
 * Agrupa la estrella, el sistema de unidades radiativo y los parámetros de la
 * rejilla espectral y de la secuencia de fases.
 */
@Value
@Builder
@With
@Jacksonized
public class ObservationConfig {

    /**
     * Configuración de la estrella y de su mapa de brillo.
     */
    StarConfig star;

    /**
     * Constantes de la ley de radiación.
     */
    RadiationConfig radiation;

    /**
     * Número de muestras de longitud de onda por fase.
     */
    int numWavelengths;

    /**
     * Extremo superior de la rejilla de longitudes de onda (unidades normalizadas).
     */
    double maxWavelength;

    /**
     * Número de fases observadas a lo largo de una rotación completa.
     */
    int phaseCount;

    /**
     * Número de núcleos CPU a utilizar al construir las matrices de respuesta.
     */
    int cpuProcessorCount;

    /**
     * Criterio de visibilidad de los elementos de superficie.
     */
    VisibilityModel visibilityModel;

    /**
     * Política ante radicandos negativos del factor de ensanchamiento rotacional.
     */
    BroadeningPolicy broadeningPolicy;

    /**
     * Paso angular entre dos fases consecutivas, 2π / phaseCount.
     */
    @JsonIgnore
    public double getPhaseStep() {
        return 2.0 * Math.PI / phaseCount;
    }

    public static ObservationConfig defaults() {
        return ObservationConfig.builder()
                .star(StarConfig.getTestingStar())
                .radiation(RadiationConfig.normalizedUnits())
                .numWavelengths(400)
                .maxWavelength(5.0)
                .phaseCount(10)
                .cpuProcessorCount(Runtime.getRuntime().availableProcessors())
                .visibilityModel(VisibilityModel.BACK_FACE_CULLING)
                .broadeningPolicy(BroadeningPolicy.CLAMP_TO_ZERO)
                .build();
    }
}
