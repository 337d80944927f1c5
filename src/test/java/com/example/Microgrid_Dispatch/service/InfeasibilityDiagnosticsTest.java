package com.example.Microgrid_Dispatch.service;

import com.example.Microgrid_Dispatch.model.AssetConfig;
import com.example.Microgrid_Dispatch.model.FormulationOptions;
import com.example.Microgrid_Dispatch.model.HorizonInput;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for InfeasibilityDiagnostics
 *
 * 100kW diesel without a stable minimum, 100kWh / 100kW lossless battery
 * starting full.
 */
class InfeasibilityDiagnosticsTest {

    private InfeasibilityDiagnostics diagnostics;
    private AssetConfig config;

    @BeforeEach
    void setUp() {
        diagnostics = new InfeasibilityDiagnostics();
        config = AssetConfig.builder()
                .dieselCapacityKW(100.0)
                .fuelCostPerKWh(0.5)
                .batteryCapacityKWh(100.0)
                .batteryPowerKW(100.0)
                .batteryRoundTripEfficiency(1.0)
                .batteryInitialSoCKWh(100.0)
                .build();
    }

    @Test
    void testDiagnose_CapacityShortfall() {
        // Given
        HorizonInput horizon = HorizonInput.of(new double[]{150, 400}, new double[]{0, 50});

        // When
        List<String> causes = diagnostics.diagnose(horizon, config, FormulationOptions.defaults());

        // Then
        assertTrue(causes.get(0).startsWith("hour 1: capacity shortfall"));
    }

    @Test
    void testDiagnose_DeficitsSeparatedByRechargeAreNotABatteryEnergyCause() {
        // Given - 80kWh deficits in hours 0 and 2 each fit the battery, solar surplus in hour 1, overload in hour 3
        HorizonInput horizon = HorizonInput.of(new double[]{180, 0, 180, 400}, new double[]{0, 200, 0, 0});

        // When
        List<String> causes = diagnostics.diagnose(horizon, config, FormulationOptions.defaults());

        // Then
        assertTrue(causes.stream().anyMatch(cause -> cause.startsWith("hour 3: capacity shortfall")));
        assertTrue(causes.stream().noneMatch(cause -> cause.contains("battery energy")));
    }

    @Test
    void testDiagnose_ConsecutiveDeficitsBeyondCapacity() {
        // Given - three 80kWh deficit hours in a row against 100kWh of storage
        HorizonInput horizon = HorizonInput.of(new double[]{180, 180, 180, 50}, new double[]{0, 0, 0, 0});

        // When
        List<String> causes = diagnostics.diagnose(horizon, config, FormulationOptions.defaults());

        // Then
        assertTrue(causes.stream().anyMatch(cause -> cause.startsWith("hours 0-2: battery energy")));
    }

    @Test
    void testDiagnose_TerminalStateOfCharge() {
        // Given - 80kWh drawn in hour 0, only 30kW of surplus afterwards
        HorizonInput horizon = HorizonInput.of(new double[]{180, 70}, new double[]{0, 0});

        // When
        List<String> causes = diagnostics.diagnose(horizon, config, FormulationOptions.defaults());

        // Then
        assertEquals(1, causes.size());
        assertTrue(causes.get(0).startsWith("horizon: terminal state of charge"));
    }

    @Test
    void testDiagnose_NoSingleCauseFallsBackToGenericMessage() {
        // Given
        HorizonInput horizon = HorizonInput.of(new double[]{50}, new double[]{0});

        // When
        List<String> causes = diagnostics.diagnose(horizon, config, FormulationOptions.defaults());

        // Then
        assertEquals(1, causes.size());
        assertTrue(causes.get(0).startsWith("no single-hour cause found"));
    }
}
