package com.example.Microgrid_Dispatch.controller;

import com.example.Microgrid_Dispatch.config.DispatchProperties;
import com.example.Microgrid_Dispatch.dto.DispatchRequest;
import com.example.Microgrid_Dispatch.dto.DispatchResponse;
import com.example.Microgrid_Dispatch.dto.SweepRequest;
import com.example.Microgrid_Dispatch.dto.SweepResponse;
import com.example.Microgrid_Dispatch.exception.DispatchConfigurationException;
import com.example.Microgrid_Dispatch.exception.InfeasibleModelException;
import com.example.Microgrid_Dispatch.exception.InternalConsistencyException;
import com.example.Microgrid_Dispatch.model.AssetConfig;
import com.example.Microgrid_Dispatch.model.DispatchResult;
import com.example.Microgrid_Dispatch.model.DispatchSummary;
import com.example.Microgrid_Dispatch.model.HorizonInput;
import com.example.Microgrid_Dispatch.model.SweepJob;
import com.example.Microgrid_Dispatch.model.SweepOutcome;
import com.example.Microgrid_Dispatch.service.DispatchOptimizer;
import com.example.Microgrid_Dispatch.service.HorizonSweepService;
import com.example.Microgrid_Dispatch.service.SolverAdapter;
import com.example.Microgrid_Dispatch.solver.SolveStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.*;

/**
 * Tests for DispatchController
 *
 * Tests cover:
 * - Request to horizon and asset mapping
 * - Error code to HTTP status mapping
 * - Sweep, defaults and health endpoints
 */
@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class DispatchControllerTest {

    @Mock
    private DispatchOptimizer optimizer;

    @Mock
    private HorizonSweepService sweepService;

    @Mock
    private SolverAdapter solverAdapter;

    private AssetConfig defaults;
    private DispatchController controller;

    @BeforeEach
    void setUp() {
        defaults = AssetConfig.builder()
                .dieselCapacityKW(500.0)
                .dieselMinLoadFraction(0.3)
                .fuelCostPerKWh(0.528)
                .batteryCapacityKWh(1000.0)
                .batteryPowerKW(250.0)
                .batteryRoundTripEfficiency(0.95)
                .batteryInitialSoCKWh(500.0)
                .build();
        controller = new DispatchController(optimizer, sweepService, solverAdapter, defaults, new DispatchProperties());
    }

    @Test
    void testOptimize_Success() {
        // Given
        DispatchResult result = result(SolveStatus.OPTIMAL, 180.0);
        when(optimizer.optimize(any(HorizonInput.class), any(AssetConfig.class))).thenReturn(result);

        // When
        ResponseEntity<DispatchResponse> response = controller.optimize(
                new DispatchRequest(new double[]{100, 100, 100}, new double[]{0, 0, 0}));

        // Then
        assertEquals(HttpStatus.OK, response.getStatusCode());
        assertNotNull(response.getBody());
        assertEquals("OPTIMAL", response.getBody().status);
        assertSame(result, response.getBody().result);
        assertNull(response.getBody().errorCode);
    }

    @Test
    void testOptimize_AssetOverridesMergedOverDefaults() {
        // Given
        when(optimizer.optimize(any(HorizonInput.class), any(AssetConfig.class))).thenReturn(result(SolveStatus.OPTIMAL, 1.0));
        DispatchRequest request = new DispatchRequest(new double[]{100}, new double[]{0});
        request.assets = new DispatchRequest.AssetParameters();
        request.assets.batteryCapacityKWh = 2000.0;
        request.assets.curtailmentPenaltyPerKWh = 0.05;

        // When
        controller.optimize(request);

        // Then
        ArgumentCaptor<AssetConfig> captor = ArgumentCaptor.forClass(AssetConfig.class);
        verify(optimizer).optimize(any(HorizonInput.class), captor.capture());
        AssetConfig used = captor.getValue();
        assertEquals(2000.0, used.getBatteryCapacityKWh());
        assertEquals(0.05, used.getCurtailmentPenaltyPerKWh());
        assertEquals(500.0, used.getDieselCapacityKW());
        assertEquals(250.0, used.getBatteryMaxChargeKW());
    }

    @Test
    void testOptimize_PerUnitSolarUsesDefaultNameplate() {
        // Given
        when(optimizer.optimize(any(HorizonInput.class), any(AssetConfig.class))).thenReturn(result(SolveStatus.OPTIMAL, 1.0));
        DispatchRequest request = new DispatchRequest();
        request.load = new double[]{100, 100};
        request.solarPerUnit = new double[]{0.0, 0.5};

        // When
        controller.optimize(request);

        // Then
        ArgumentCaptor<HorizonInput> captor = ArgumentCaptor.forClass(HorizonInput.class);
        verify(optimizer).optimize(captor.capture(), any(AssetConfig.class));
        assertEquals(200.0, captor.getValue().getSolarAvailable(1), 1e-9);
        assertEquals(400.0, captor.getValue().getSolarCapacityKW(), 1e-9);
    }

    @Test
    void testOptimize_MissingSolarIsBadRequest() {
        // Given
        DispatchRequest request = new DispatchRequest();
        request.load = new double[]{100};

        // When
        ResponseEntity<DispatchResponse> response = controller.optimize(request);

        // Then
        assertEquals(HttpStatus.BAD_REQUEST, response.getStatusCode());
        assertEquals("CONFIGURATION_ERROR", response.getBody().errorCode);
        verify(optimizer, never()).optimize(any(HorizonInput.class), any(AssetConfig.class));
    }

    @Test
    void testOptimize_ConfigurationErrorIsBadRequest() {
        // Given
        when(optimizer.optimize(any(HorizonInput.class), any(AssetConfig.class)))
                .thenThrow(new DispatchConfigurationException(List.of("dieselCapacityKW must be > 0 (was 0.0)")));

        // When
        ResponseEntity<DispatchResponse> response = controller.optimize(
                new DispatchRequest(new double[]{100}, new double[]{0}));

        // Then
        assertEquals(HttpStatus.BAD_REQUEST, response.getStatusCode());
        assertEquals(1, response.getBody().details.size());
    }

    @Test
    void testOptimize_InfeasibleIsUnprocessable() {
        // Given
        when(optimizer.optimize(any(HorizonInput.class), any(AssetConfig.class)))
                .thenThrow(new InfeasibleModelException("No feasible dispatch", List.of("hour 0: capacity shortfall")));

        // When
        ResponseEntity<DispatchResponse> response = controller.optimize(
                new DispatchRequest(new double[]{9999}, new double[]{0}));

        // Then
        assertEquals(HttpStatus.UNPROCESSABLE_ENTITY, response.getStatusCode());
        assertEquals("INFEASIBLE", response.getBody().status);
        assertEquals(List.of("hour 0: capacity shortfall"), response.getBody().details);
    }

    @Test
    void testOptimize_InternalErrorIsServerError() {
        // Given
        when(optimizer.optimize(any(HorizonInput.class), any(AssetConfig.class)))
                .thenThrow(new InternalConsistencyException(List.of("hour 0: energy balance off")));

        // When
        ResponseEntity<DispatchResponse> response = controller.optimize(
                new DispatchRequest(new double[]{100}, new double[]{0}));

        // Then
        assertEquals(HttpStatus.INTERNAL_SERVER_ERROR, response.getStatusCode());
        assertEquals("INTERNAL_CONSISTENCY_ERROR", response.getBody().errorCode);
    }

    @Test
    void testSweep_PointPerCapacity() {
        // Given
        HorizonInput horizon = HorizonInput.of(new double[]{100}, new double[]{0});
        SweepOutcome ok = SweepOutcome.success(
                new SweepJob("battery_0.0kWh", horizon, defaults.toBuilder().batteryCapacityKWh(0.0).batteryInitialSoCKWh(0.0).build()),
                result(SolveStatus.OPTIMAL, 120.0));
        SweepOutcome failed = SweepOutcome.failure(
                new SweepJob("battery_500.0kWh", horizon, defaults.toBuilder().batteryCapacityKWh(500.0).build()),
                "INFEASIBLE", "No feasible dispatch");
        when(sweepService.sweepBatteryCapacities(any(HorizonInput.class), any(AssetConfig.class), anyList()))
                .thenReturn(List.of(ok, failed));

        SweepRequest request = new SweepRequest();
        request.load = new double[]{100};
        request.solarAvailable = new double[]{0};
        request.batteryCapacitiesKWh = List.of(0.0, 500.0);

        // When
        ResponseEntity<SweepResponse> response = controller.sweep(request);

        // Then
        assertEquals(HttpStatus.OK, response.getStatusCode());
        SweepResponse body = response.getBody();
        assertNotNull(body);
        assertEquals("COMPLETED", body.status);
        assertNull(body.errorCode);
        assertEquals(2, body.points.size());
        assertEquals(1, body.succeeded);
        assertEquals(1, body.failed);
        assertEquals(120.0, body.points.get(0).totalCost, 1e-9);
        assertEquals("FAILED", body.points.get(1).status);
        assertEquals("INFEASIBLE", body.points.get(1).errorCode);
        assertEquals(500.0, body.points.get(1).batteryCapacityKWh, 1e-9);
    }

    @Test
    void testSweep_NullCapacityIsBadRequest() {
        // Given - real sweep service, so the request goes through capacity checking
        ExecutorService executor = Executors.newSingleThreadExecutor();
        try {
            DispatchController sweepController = new DispatchController(optimizer,
                    new HorizonSweepService(optimizer, executor), solverAdapter, defaults, new DispatchProperties());
            SweepRequest request = new SweepRequest();
            request.load = new double[]{100};
            request.solarAvailable = new double[]{0};
            request.batteryCapacitiesKWh = Arrays.asList(0.0, null);

            // When
            ResponseEntity<SweepResponse> response = sweepController.sweep(request);

            // Then
            assertEquals(HttpStatus.BAD_REQUEST, response.getStatusCode());
            assertNotNull(response.getBody());
            assertEquals("REJECTED", response.getBody().status);
            assertEquals("CONFIGURATION_ERROR", response.getBody().errorCode);
            assertEquals(List.of("batteryCapacitiesKWh[1] is missing"), response.getBody().details);
            verify(optimizer, never()).optimize(any(HorizonInput.class), any(AssetConfig.class));
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    void testSweep_MissingSolarReturnsErrorBody() {
        // Given
        SweepRequest request = new SweepRequest();
        request.load = new double[]{100};
        request.batteryCapacitiesKWh = List.of(500.0);

        // When
        ResponseEntity<SweepResponse> response = controller.sweep(request);

        // Then
        assertEquals(HttpStatus.BAD_REQUEST, response.getStatusCode());
        assertEquals("CONFIGURATION_ERROR", response.getBody().errorCode);
        assertEquals(List.of("either solarAvailable or solarPerUnit is required"), response.getBody().details);
        assertTrue(response.getBody().points.isEmpty());
    }

    @Test
    void testSweep_UnexpectedErrorReturnsErrorBody() {
        // Given
        when(sweepService.sweepBatteryCapacities(any(HorizonInput.class), any(AssetConfig.class), anyList()))
                .thenThrow(new IllegalStateException("Interrupted while waiting for sweep results"));
        SweepRequest request = new SweepRequest();
        request.load = new double[]{100};
        request.solarAvailable = new double[]{0};
        request.batteryCapacitiesKWh = List.of(500.0);

        // When
        ResponseEntity<SweepResponse> response = controller.sweep(request);

        // Then
        assertEquals(HttpStatus.INTERNAL_SERVER_ERROR, response.getStatusCode());
        assertEquals("FAILED", response.getBody().status);
        assertEquals("INTERNAL_ERROR", response.getBody().errorCode);
        assertEquals("Interrupted while waiting for sweep results", response.getBody().message);
    }

    @Test
    void testGetDefaultAssetConfig() {
        ResponseEntity<AssetConfig> response = controller.getDefaultAssetConfig();

        assertEquals(HttpStatus.OK, response.getStatusCode());
        assertSame(defaults, response.getBody());
    }

    @Test
    void testHealthCheck() {
        // Given
        when(solverAdapter.getBackendName()).thenReturn("SCIP");
        when(solverAdapter.getMaxConcurrentSolves()).thenReturn(2);
        when(solverAdapter.getAvailableSlots()).thenReturn(2);

        // When
        ResponseEntity<Map<String, Object>> response = controller.healthCheck();

        // Then
        assertEquals(HttpStatus.OK, response.getStatusCode());
        assertEquals("UP", response.getBody().get("status"));
        assertEquals("SCIP", response.getBody().get("solverBackend"));
        assertEquals(2, response.getBody().get("maxConcurrentSolves"));
    }

    private static DispatchResult result(SolveStatus status, double cost) {
        DispatchSummary summary = new DispatchSummary();
        summary.totalCost = cost;
        return new DispatchResult(status, cost, cost, 1L, Collections.emptyList(), summary, null);
    }
}
