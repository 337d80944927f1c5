package com.example.Microgrid_Dispatch.controller;

import com.example.Microgrid_Dispatch.config.DispatchProperties;
import com.example.Microgrid_Dispatch.dto.DispatchRequest;
import com.example.Microgrid_Dispatch.dto.DispatchResponse;
import com.example.Microgrid_Dispatch.dto.SweepRequest;
import com.example.Microgrid_Dispatch.dto.SweepResponse;
import com.example.Microgrid_Dispatch.exception.DispatchConfigurationException;
import com.example.Microgrid_Dispatch.exception.DispatchException;
import com.example.Microgrid_Dispatch.exception.InfeasibleModelException;
import com.example.Microgrid_Dispatch.model.AssetConfig;
import com.example.Microgrid_Dispatch.model.DispatchResult;
import com.example.Microgrid_Dispatch.model.HorizonInput;
import com.example.Microgrid_Dispatch.model.SweepOutcome;
import com.example.Microgrid_Dispatch.service.DispatchOptimizer;
import com.example.Microgrid_Dispatch.service.HorizonSweepService;
import com.example.Microgrid_Dispatch.service.SolverAdapter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import jakarta.validation.Valid;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * REST API Controller for dispatch optimisation
 *
 * Provides synchronous endpoints for:
 * - Single-horizon optimisation with optional asset overrides
 * - Battery capacity sweeps over one horizon
 * - Default asset configuration and health queries
 *
 * Error mapping: configuration errors 400, infeasible horizons 422,
 * solver and consistency failures 500.
 */
@RestController
@RequestMapping("/api/v1/dispatch")
@CrossOrigin(origins = "*")
public class DispatchController {

    private static final Logger logger = LoggerFactory.getLogger(DispatchController.class);

    private final DispatchOptimizer optimizer;
    private final HorizonSweepService sweepService;
    private final SolverAdapter solverAdapter;
    private final AssetConfig defaultAssetConfig;
    private final DispatchProperties properties;

    public DispatchController(DispatchOptimizer optimizer,
                              HorizonSweepService sweepService,
                              SolverAdapter solverAdapter,
                              AssetConfig defaultAssetConfig,
                              DispatchProperties properties) {
        this.optimizer = optimizer;
        this.sweepService = sweepService;
        this.solverAdapter = solverAdapter;
        this.defaultAssetConfig = defaultAssetConfig;
        this.properties = properties;
    }

    /**
     * Optimise one horizon
     *
     * POST /api/v1/dispatch/optimize
     * Body: {"load": [...], "solarAvailable": [...], "assets": {"batteryCapacityKWh": 500}}
     */
    @PostMapping("/optimize")
    public ResponseEntity<DispatchResponse> optimize(@Valid @RequestBody DispatchRequest request) {

        logger.info("Optimisation request: {} hours", request.load == null ? 0 : request.load.length);

        try {
            HorizonInput horizon = toHorizon(request);
            AssetConfig config = toAssetConfig(request);

            DispatchResult result = optimizer.optimize(horizon, config);
            return ResponseEntity.ok(new DispatchResponse(result));
        } catch (DispatchConfigurationException error) {
            return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                    .body(new DispatchResponse("REJECTED", error.getErrorCode(), error.getMessage(), error.getViolations()));
        } catch (InfeasibleModelException error) {
            return ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY)
                    .body(new DispatchResponse("INFEASIBLE", error.getErrorCode(), error.getMessage(),
                            error.getSuspectedCauses()));
        } catch (DispatchException error) {
            logger.error("Optimisation failed: {}", error.getErrorCode(), error);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                    .body(new DispatchResponse("FAILED", error.getErrorCode(), error.getMessage(), null));
        } catch (Exception error) {
            logger.error("Error during optimisation", error);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                    .body(new DispatchResponse("FAILED", "INTERNAL_ERROR", error.getMessage(), null));
        }
    }

    /**
     * Optimise one horizon for several battery capacities
     *
     * POST /api/v1/dispatch/sweep
     * Body: same as /optimize plus {"batteryCapacitiesKWh": [0, 500, 1000]}
     *
     * Individual failures (e.g. an infeasible small battery) are reported per point.
     */
    @PostMapping("/sweep")
    public ResponseEntity<SweepResponse> sweep(@Valid @RequestBody SweepRequest request) {

        logger.info("Sweep request: {} hours, capacities {}",
                request.load == null ? 0 : request.load.length, request.batteryCapacitiesKWh);

        try {
            HorizonInput horizon = toHorizon(request);
            AssetConfig base = toAssetConfig(request);

            List<SweepOutcome> outcomes = sweepService.sweepBatteryCapacities(horizon, base, request.batteryCapacitiesKWh);
            List<SweepResponse.SweepPoint> points = outcomes.stream()
                    .map(SweepResponse.SweepPoint::new)
                    .collect(Collectors.toList());

            return ResponseEntity.ok(new SweepResponse(points));
        } catch (DispatchConfigurationException error) {
            logger.warn("Rejected sweep request: {}", error.getViolations());
            return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                    .body(new SweepResponse("REJECTED", error.getErrorCode(), error.getMessage(), error.getViolations()));
        } catch (DispatchException error) {
            logger.error("Sweep failed: {}", error.getErrorCode(), error);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                    .body(new SweepResponse("FAILED", error.getErrorCode(), error.getMessage(), null));
        } catch (Exception error) {
            logger.error("Error during sweep", error);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                    .body(new SweepResponse("FAILED", "INTERNAL_ERROR", error.getMessage(), null));
        }
    }

    /**
     * Default asset configuration applied to fields a request leaves out
     *
     * GET /api/v1/dispatch/config/defaults
     */
    @GetMapping("/config/defaults")
    public ResponseEntity<AssetConfig> getDefaultAssetConfig() {
        return ResponseEntity.ok(defaultAssetConfig);
    }

    /**
     * Health check endpoint
     *
     * GET /api/v1/dispatch/health
     */
    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> healthCheck() {

        try {
            Map<String, Object> health = new HashMap<>();
            health.put("status", "UP");
            health.put("solverBackend", solverAdapter.getBackendName());
            health.put("maxConcurrentSolves", solverAdapter.getMaxConcurrentSolves());
            health.put("availableSolveSlots", solverAdapter.getAvailableSlots());
            health.put("timestamp", System.currentTimeMillis());

            return ResponseEntity.ok(health);
        } catch (Exception error) {
            logger.error("Health check failed", error);
            return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                    .body(Map.<String, Object>of(
                            "status", "DOWN",
                            "error", String.valueOf(error.getMessage()),
                            "timestamp", System.currentTimeMillis()
                    ));
        }
    }

    private HorizonInput toHorizon(DispatchRequest request) {
        if (request.solarAvailable != null) {
            return request.solarCapacityKW == null
                    ? HorizonInput.of(request.load, request.solarAvailable)
                    : new HorizonInput(request.load, request.solarAvailable, request.solarCapacityKW);
        }
        if (request.solarPerUnit != null) {
            double capacity = request.solarCapacityKW != null
                    ? request.solarCapacityKW
                    : properties.getDefaultSolarCapacityKw();
            return HorizonInput.fromPerUnitSolar(request.load, request.solarPerUnit, capacity);
        }
        throw new DispatchConfigurationException(List.of("either solarAvailable or solarPerUnit is required"));
    }

    private AssetConfig toAssetConfig(DispatchRequest request) {
        return request.assets == null ? defaultAssetConfig : request.assets.applyTo(defaultAssetConfig);
    }
}
