package me.golemcore.observatory.adapter.outbound.observability;

import feign.FeignException;
import feign.Request;
import feign.Response;
import feign.codec.ErrorDecoder;
import me.golemcore.observatory.domain.model.Observability;
import me.golemcore.observatory.domain.model.ObservationQuery;
import me.golemcore.observatory.domain.model.Target;
import me.golemcore.observatory.infrastructure.config.ObservatoryProperties;
import me.golemcore.observatory.infrastructure.http.FeignClientFactory;
import me.golemcore.observatory.port.outbound.ObservabilityException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class RemoteObservabilityAdapterTest {

    private static final Instant NIGHT = Instant.parse("2024-01-01T22:00:00Z");
    private static final ObservationQuery QUERY = new ObservationQuery(52.37, 4.9, NIGHT);
    private static final Target M57 = Target.builder()
            .id("m57")
            .name("Ring Nebula")
            .type(Target.TargetType.DSO)
            .coordinates(new Target.Coordinates(18.893, 33.029))
            .build();

    private FeignClientFactory feignClientFactory;
    private RemoteObservabilityAdapter.ObservabilityApi observabilityApi;
    private ObservatoryProperties properties;
    private RemoteObservabilityAdapter adapter;

    @BeforeEach
    void setUp() {
        feignClientFactory = mock(FeignClientFactory.class);
        observabilityApi = mock(RemoteObservabilityAdapter.ObservabilityApi.class);
        when(feignClientFactory.create(eq(RemoteObservabilityAdapter.ObservabilityApi.class), anyString(),
                any(ErrorDecoder.class))).thenReturn(observabilityApi);

        properties = new ObservatoryProperties();
        properties.getObservability().setBaseUrl("http://oracle.test:8090");

        adapter = new RemoteObservabilityAdapter(feignClientFactory, properties);
        adapter.init();
    }

    @Test
    void shouldCreateClientForConfiguredBaseUrl() {
        verify(feignClientFactory).create(eq(RemoteObservabilityAdapter.ObservabilityApi.class),
                eq("http://oracle.test:8090"), any(ErrorDecoder.class));
    }

    @Test
    void shouldForwardCoordinatesSiteAndInstant() {
        when(observabilityApi.compute(anyDouble(), anyDouble(), anyDouble(), anyDouble(), anyString()))
                .thenReturn(response(62.5, 1.13));

        Observability observability = adapter.computeObservability(M57, QUERY);

        assertEquals(62.5, observability.getAltitude());
        assertEquals(1.13, observability.getAirmass());
        verify(observabilityApi).compute(18.893, 33.029, 52.37, 4.9, "2024-01-01T22:00:00Z");
    }

    @Test
    void shouldKeepMissingFieldsNull() {
        when(observabilityApi.compute(anyDouble(), anyDouble(), anyDouble(), anyDouble(), anyString()))
                .thenReturn(response(-4.0, null));

        Observability observability = adapter.computeObservability(M57, QUERY);

        assertEquals(-4.0, observability.getAltitude());
        assertNull(observability.getAirmass());
    }

    @Test
    void shouldReturnUnknownForEmptyBody() {
        when(observabilityApi.compute(anyDouble(), anyDouble(), anyDouble(), anyDouble(), anyString()))
                .thenReturn(null);

        Observability observability = adapter.computeObservability(M57, QUERY);

        assertNull(observability.getAltitude());
        assertNull(observability.getAirmass());
    }

    @Test
    void shouldNotCallOracleForTargetWithoutCoordinates() {
        Target comet = Target.builder()
                .id("c2023a3")
                .name("Tsuchinshan-ATLAS")
                .type(Target.TargetType.CUSTOM)
                .build();

        Observability observability = adapter.computeObservability(comet, QUERY);

        assertNull(observability.getAltitude());
        verifyNoInteractions(observabilityApi);
    }

    @Test
    void shouldWrapTransportFailure() {
        FeignException failure = mock(FeignException.class);
        when(observabilityApi.compute(anyDouble(), anyDouble(), anyDouble(), anyDouble(), anyString()))
                .thenThrow(failure);

        ObservabilityException thrown = assertThrows(ObservabilityException.class,
                () -> adapter.computeObservability(M57, QUERY));

        assertSame(failure, thrown.getCause());
        assertTrue(thrown.getMessage().contains("m57"));
    }

    @Test
    void shouldDecodeErrorStatusIntoObservabilityException() {
        ArgumentCaptor<ErrorDecoder> decoderCaptor = ArgumentCaptor.forClass(ErrorDecoder.class);
        verify(feignClientFactory).create(eq(RemoteObservabilityAdapter.ObservabilityApi.class), anyString(),
                decoderCaptor.capture());

        Response response = Response.builder()
                .status(503)
                .reason("Service Unavailable")
                .request(Request.create(Request.HttpMethod.GET, "/api/v1/observability", Map.of(), null,
                        StandardCharsets.UTF_8, null))
                .headers(Map.of())
                .build();

        Exception decoded = decoderCaptor.getValue().decode("ObservabilityApi#compute", response);

        assertInstanceOf(ObservabilityException.class, decoded);
        assertEquals("Observability oracle returned HTTP 503 for ObservabilityApi#compute", decoded.getMessage());
    }

    private static RemoteObservabilityAdapter.ObservabilityResponse response(Double altitude, Double airmass) {
        RemoteObservabilityAdapter.ObservabilityResponse response = new RemoteObservabilityAdapter.ObservabilityResponse();
        response.setAltitude(altitude);
        response.setAirmass(airmass);
        return response;
    }
}
