package dopplerimaging.domain.simulation;

import dopplerimaging.domain.spectrum.LineSpectrum;
import dopplerimaging.domain.spectrum.ObservationMatrix;
import dopplerimaging.domain.spectrum.WavelengthGrid;
import dopplerimaging.domain.star.SurfaceMap;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Resultado de una secuencia de fases del modelo directo.
 */
@Value
@Builder
public class ForwardModelResult {

    /**
     * Mapa antes de la primera rotación.
     */
    SurfaceMap initialMap;

    /**
     * Instantánea del mapa usada en cada fase, en orden de fase.
     */
    @Singular
    List<SurfaceMap> snapshots;

    WavelengthGrid grid;

    ObservationMatrix observationMatrix;

    LineSpectrum lineSpectrum;

    long executionTimeMs;

    public int getPhaseCount() {
        return snapshots.size();
    }

    /**
     * Mapa tras la última rotación.
     */
    public SurfaceMap getFinalMap() {
        return snapshots.isEmpty() ? initialMap : snapshots.get(snapshots.size() - 1);
    }
}
