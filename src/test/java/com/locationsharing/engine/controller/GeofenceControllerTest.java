package com.locationsharing.engine.controller;

import com.locationsharing.engine.dto.GeofenceRegionRequest;
import com.locationsharing.engine.entity.GeofenceRegion;
import com.locationsharing.engine.service.geofence.GeofenceService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.GeometryFactory;
import org.locationtech.jts.geom.PrecisionModel;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

class GeofenceControllerTest {

    private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");

    private final GeometryFactory geometryFactory = new GeometryFactory(new PrecisionModel(), 4326);

    private GeofenceService geofenceService;
    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        geofenceService = mock(GeofenceService.class);
        Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
        mockMvc = MockMvcBuilders.standaloneSetup(new GeofenceController(geofenceService, clock))
                .setControllerAdvice(new ApiExceptionHandler(clock))
                .build();
    }

    @Test
    void shouldCreateRegion() throws Exception {
        when(geofenceService.createRegion(any(GeofenceRegionRequest.class))).thenReturn(region(7L, "Home"));

        mockMvc.perform(post("/api/geofences")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"ownerId\":\"alice\",\"label\":\"Home\",\"latitude\":52.52,"
                                + "\"longitude\":13.405,\"radiusMeters\":150}"))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.id").value(7))
                .andExpect(jsonPath("$.latitude").value(52.52))
                .andExpect(jsonPath("$.longitude").value(13.405));
    }

    @Test
    void shouldRejectRegionWithTinyRadius() throws Exception {
        mockMvc.perform(post("/api/geofences")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"ownerId\":\"alice\",\"label\":\"Home\",\"latitude\":52.52,"
                                + "\"longitude\":13.405,\"radiusMeters\":1}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("VALIDATION_FAILED"));
    }

    @Test
    void shouldListRegionsOfOwner() throws Exception {
        when(geofenceService.getRegions("alice")).thenReturn(List.of(region(1L, "Home"), region(2L, "Office")));

        mockMvc.perform(get("/api/geofences").param("ownerId", "alice"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.length()").value(2))
                .andExpect(jsonPath("$[1].label").value("Office"));
    }

    @Test
    void shouldReturnNotFoundWhenDeletingUnknownRegion() throws Exception {
        when(geofenceService.deleteRegion(9L)).thenReturn(false);

        mockMvc.perform(delete("/api/geofences/9"))
                .andExpect(status().isNotFound());
    }

    @Test
    void shouldRefreshRegionCache() throws Exception {
        when(geofenceService.refreshRegions()).thenReturn(3);

        mockMvc.perform(post("/api/geofences/cache/refresh"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.regionsRefreshed").value(3));
    }

    @Test
    void shouldDefaultTransitionWindowToLastDay() throws Exception {
        when(geofenceService.getRecentTransitions(any(Instant.class))).thenReturn(List.of());

        mockMvc.perform(get("/api/geofences/transitions"))
                .andExpect(status().isOk());

        verify(geofenceService).getRecentTransitions(Instant.parse("2026-02-28T10:00:00Z"));
    }

    private GeofenceRegion region(Long id, String label) {
        return GeofenceRegion.builder()
                .id(id)
                .ownerId("alice")
                .label(label)
                .center(geometryFactory.createPoint(new Coordinate(13.405, 52.52)))
                .radiusMeters(150.0)
                .build();
    }
}
