package dopplerimaging.physics.simulator;

import dopplerimaging.StarFixtures;
import dopplerimaging.config.RadiationConfig;
import dopplerimaging.config.SpotConfig;
import dopplerimaging.domain.simulation.ForwardModelResult;
import dopplerimaging.domain.spectrum.LineSpectrum;
import dopplerimaging.domain.spectrum.ObservationMatrix;
import dopplerimaging.domain.spectrum.ResponseMatrix;
import dopplerimaging.domain.spectrum.WavelengthGrid;
import dopplerimaging.domain.star.SurfaceMap;
import dopplerimaging.domain.star.VisibilityModel;
import dopplerimaging.factory.SurfaceMapFactory;
import dopplerimaging.physics.geometry.SurfaceGeometryKernel;
import dopplerimaging.physics.impl.LinearDopplerShifter;
import dopplerimaging.physics.impl.PlanckRadiationLaw;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class PhaseAggregatorTest {

    private static final int N = 8;
    private static final double MAX_WAVELENGTH = 2.0;

    private PlanckRadiationLaw law;
    private SurfaceGeometryKernel kernel;
    private ResponseMatrixBuilder builder;

    @BeforeEach
    void setUp() {
        law = new PlanckRadiationLaw(RadiationConfig.normalizedUnits());
        kernel = new SurfaceGeometryKernel(VisibilityModel.BACK_FACE_CULLING);
        builder = new ResponseMatrixBuilder(law, new LinearDopplerShifter(), kernel, 4);
    }

    @AfterEach
    void tearDown() {
        builder.close();
    }

    @Test
    @DisplayName("10 fases: la matriz de observación tiene 10·N columnas en orden de fase")
    void tenPhases_shouldConcatenateInPhaseOrder() {
        SurfaceMap map = SurfaceMapFactory.createStar(StarFixtures.smallStar(Math.PI / 3, 5.0e4));
        double step = 2 * Math.PI / 10;

        ForwardModelResult result = new PhaseAggregator(builder).run(map, 10, step, N, MAX_WAVELENGTH);

        ObservationMatrix observation = result.getObservationMatrix();
        assertThat(observation.getElementCount()).isEqualTo(map.getElementCount());
        assertThat(observation.getColumnCount()).isEqualTo(10 * N);
        assertThat(result.getPhaseCount()).isEqualTo(10);
        double previous = map.getPhase();
        for (int p = 0; p < 10; p++) {
            assertThat(observation.getPhaseAt(p)).isGreaterThan(previous);
            assertThat(observation.getPhaseAt(p)).isCloseTo((p + 1) * step, within(1e-12));
            previous = observation.getPhaseAt(p);
        }
        // El mapa de partida no se modifica.
        assertThat(result.getInitialMap().getPhase()).isEqualTo(0.0);
        assertThat(result.getFinalMap().getPhase()).isCloseTo(2 * Math.PI, within(1e-12));
    }

    @Test
    @DisplayName("El espectro coincide con la proyección de la matriz completa sobre el brillo")
    void spectrum_equalsFullMatrixProjection() {
        SurfaceMap map = SurfaceMapFactory.createStar(StarFixtures.smallStar(Math.PI / 4.2, 5.0e4)
                .withSpot(SpotConfig.builder()
                        .colatitude(Math.PI / 3).longitude(0.0).angularRadius(0.5).brightness(0.25).build()));

        ForwardModelResult result = new PhaseAggregator(builder).run(map, 4, Math.PI / 2, N, MAX_WAVELENGTH);

        double[] projected = result.getObservationMatrix().project(map.brightnessVector());
        LineSpectrum spectrum = result.getLineSpectrum();
        assertThat(spectrum.size()).isEqualTo(4 * N);
        for (int k = 0; k < projected.length; k++) {
            assertThat(spectrum.flux()[k]).isCloseTo(projected[k], within(Math.abs(projected[k]) * 1e-12));
        }
    }

    @Test
    @DisplayName("Estrella uniforme sin rotación (i = π/2): cada segmento es el espectro de un elemento por el área visible")
    void uniformNonRotatingStar_spectrumIsScaledSingleSpectrum() {
        SurfaceMap map = SurfaceMapFactory.createStar(StarFixtures.smallStar(Math.PI / 2, 0.0));
        WavelengthGrid grid = WavelengthGrid.of(N, MAX_WAVELENGTH);
        double temperature = law.temperatureOf(1.0);

        ForwardModelResult result = new PhaseAggregator(builder).run(map, 3, 2 * Math.PI / 3, N, MAX_WAVELENGTH);

        for (int p = 0; p < 3; p++) {
            double visibleArea = kernel.totalProjectedArea(result.getSnapshots().get(p));
            for (int j = 0; j < N; j++) {
                double single = law.integrateRadiance(grid.getValueAt(j), grid.getBandWidth(), temperature);
                double expected = single * visibleArea;
                assertThat(result.getLineSpectrum().fluxAt(p, j)).isCloseTo(expected, within(expected * 1e-9));
            }
        }
    }

    @Test
    @DisplayName("Cada fase se construye sobre una instantánea nueva avanzada un paso")
    void eachPhase_buildsOnRotatedSnapshot() {
        ResponseMatrixBuilder mockBuilder = mock(ResponseMatrixBuilder.class);
        SurfaceMap map = StarFixtures.equatorialMap(Math.PI / 2, 1.0e4,
                new double[]{0.0, Math.PI}, new double[]{1.0, 2.0});
        WavelengthGrid grid = WavelengthGrid.of(2, 1.0);
        when(mockBuilder.build(any(SurfaceMap.class), eq(2), eq(1.0))).thenAnswer(invocation -> {
            SurfaceMap snapshot = invocation.getArgument(0);
            return new ResponseMatrix(snapshot.getPhase(), grid, new double[][]{{1.0, 0.0}, {0.0, 1.0}});
        });

        ForwardModelResult result = new PhaseAggregator(mockBuilder).run(map, 3, 0.5, 2, 1.0);

        ArgumentCaptor<SurfaceMap> captor = ArgumentCaptor.forClass(SurfaceMap.class);
        verify(mockBuilder, times(3)).build(captor.capture(), eq(2), eq(1.0));
        List<SurfaceMap> snapshots = captor.getAllValues();
        assertThat(snapshots).extracting(SurfaceMap::getPhase).containsExactly(0.5, 1.0, 1.5);
        assertThat(snapshots).doesNotContain(map);
        assertThat(map.getPhase()).isEqualTo(0.0);
        // Segmento de cada fase = Rᵀ·b = (1, 2).
        assertThat(result.getLineSpectrum().flux()).containsExactly(1.0, 2.0, 1.0, 2.0, 1.0, 2.0);
        assertThat(result.getSnapshots()).containsExactlyElementsOf(snapshots);
    }

    @Test
    @DisplayName("Un número de fases no positivo se rechaza")
    void nonPositivePhaseCount_isRejected() {
        SurfaceMap map = SurfaceMapFactory.createStar(StarFixtures.smallStar(Math.PI / 3, 5.0e4));
        PhaseAggregator aggregator = new PhaseAggregator(builder);

        assertThatThrownBy(() -> aggregator.run(map, 0, 0.1, N, MAX_WAVELENGTH))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
