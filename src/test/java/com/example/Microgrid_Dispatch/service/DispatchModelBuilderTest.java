package com.example.Microgrid_Dispatch.service;

import com.example.Microgrid_Dispatch.model.AssetConfig;
import com.example.Microgrid_Dispatch.model.EfficiencySplit;
import com.example.Microgrid_Dispatch.model.FormulationOptions;
import com.example.Microgrid_Dispatch.model.HorizonInput;
import com.example.Microgrid_Dispatch.model.SimultaneityPolicy;
import com.example.Microgrid_Dispatch.solver.LinearModel;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Structural tests for the dispatch MILP: variable bounds, constraint rows and objective coefficients
 */
class DispatchModelBuilderTest {

    private DispatchModelBuilder builder;
    private AssetConfig config;
    private HorizonInput horizon;

    @BeforeEach
    void setUp() {
        builder = new DispatchModelBuilder();
        config = AssetConfig.builder()
                .dieselCapacityKW(500.0)
                .dieselMinLoadFraction(0.3)
                .fuelCostPerKWh(0.5)
                .carbonTaxPerKWh(0.1)
                .dieselNoLoadCostPerHour(40.0)
                .batteryCapacityKWh(1000.0)
                .batteryMaxChargeKW(200.0)
                .batteryMaxDischargeKW(250.0)
                .batteryRoundTripEfficiency(0.81)
                .batteryInitialSoCKWh(400.0)
                .curtailmentPenaltyPerKWh(0.02)
                .build();
        horizon = HorizonInput.of(new double[]{100, 200, 300}, new double[]{0, 150, 50});
    }

    @Test
    void testBuild_ModelSizeWithIndicator() {
        // When
        DispatchModel model = builder.build(horizon, config, FormulationOptions.defaults());
        LinearModel lp = model.getLinearModel();

        // Then - 7 variables and 6 rows per hour, plus the terminal row
        assertEquals(21, lp.getVariableCount());
        assertEquals(6, lp.getIntegerVariableCount());
        assertEquals(19, lp.getConstraintCount());
        assertTrue(model.hasChargeModeIndicator());
    }

    @Test
    void testBuild_CostDominanceHasNoIndicator() {
        // Given
        FormulationOptions options = new FormulationOptions(EfficiencySplit.SYMMETRIC_SQRT, SimultaneityPolicy.COST_DOMINANCE);

        // When
        DispatchModel model = builder.build(horizon, config, options);

        // Then
        assertFalse(model.hasChargeModeIndicator());
        assertEquals(18, model.getLinearModel().getVariableCount());
        assertEquals(3, model.getLinearModel().getIntegerVariableCount());
        assertEquals(13, model.getLinearModel().getConstraintCount());
        assertNull(model.getLinearModel().findConstraint("charge_mode_0"));
        assertThrows(IllegalStateException.class, () -> model.chargeModeVar(0));
    }

    @Test
    void testBuild_VariableBounds() {
        // When
        DispatchModel model = builder.build(horizon, config, FormulationOptions.defaults());
        LinearModel lp = model.getLinearModel();

        // Then
        assertEquals(500.0, lp.getVariable(model.dieselOutputVar(0)).getUpper());
        assertEquals(200.0, lp.getVariable(model.batteryChargeVar(1)).getUpper());
        assertEquals(250.0, lp.getVariable(model.batteryDischargeVar(1)).getUpper());
        assertEquals(1000.0, lp.getVariable(model.socVar(2)).getUpper());
        assertEquals(150.0, lp.getVariable(model.solarUsedVar(1)).getUpper());
        assertEquals(0.0, lp.getVariable(model.solarUsedVar(0)).getUpper());
        assertTrue(lp.getVariable(model.dieselOnVar(2)).isInteger());
        assertEquals("soc_2", lp.getVariable(model.socVar(2)).getName());
    }

    @Test
    void testBuild_BalanceRow() {
        // When
        DispatchModel model = builder.build(horizon, config, FormulationOptions.defaults());
        LinearModel.Constraint balance = model.getLinearModel().findConstraint("balance_1");

        // Then
        assertNotNull(balance);
        assertEquals(200.0, balance.getLower());
        assertEquals(200.0, balance.getUpper());
        assertEquals(1.0, balance.getCoefficient(model.dieselOutputVar(1)));
        assertEquals(1.0, balance.getCoefficient(model.batteryDischargeVar(1)));
        assertEquals(1.0, balance.getCoefficient(model.solarUsedVar(1)));
        assertEquals(-1.0, balance.getCoefficient(model.batteryChargeVar(1)));
    }

    @Test
    void testBuild_DieselGatingRows() {
        // When
        DispatchModel model = builder.build(horizon, config, FormulationOptions.defaults());
        LinearModel.Constraint min = model.getLinearModel().findConstraint("diesel_min_0");
        LinearModel.Constraint max = model.getLinearModel().findConstraint("diesel_max_0");

        // Then
        assertEquals(0.0, min.getLower());
        assertEquals(-150.0, min.getCoefficient(model.dieselOnVar(0)), 1e-9);
        assertEquals(0.0, max.getUpper());
        assertEquals(-500.0, max.getCoefficient(model.dieselOnVar(0)), 1e-9);
    }

    @Test
    void testBuild_SocContinuitySymmetricSplit() {
        // When
        DispatchModel model = builder.build(horizon, config, FormulationOptions.defaults());
        LinearModel.Constraint first = model.getLinearModel().findConstraint("soc_0");
        LinearModel.Constraint second = model.getLinearModel().findConstraint("soc_1");

        // Then - sqrt(0.81) = 0.9 on each leg
        assertEquals(0.9, model.getChargeEfficiency(), 1e-12);
        assertEquals(400.0, first.getLower());
        assertEquals(400.0, first.getUpper());
        assertEquals(-0.9, first.getCoefficient(model.batteryChargeVar(0)), 1e-12);
        assertEquals(1.0 / 0.9, first.getCoefficient(model.batteryDischargeVar(0)), 1e-12);

        assertEquals(0.0, second.getLower());
        assertEquals(-1.0, second.getCoefficient(model.socVar(0)));
        assertEquals(1.0, second.getCoefficient(model.socVar(1)));
    }

    @Test
    void testBuild_SocContinuityChargeLegSplit() {
        // Given
        FormulationOptions options = new FormulationOptions(EfficiencySplit.CHARGE_LEG, SimultaneityPolicy.BINARY_INDICATOR);

        // When
        DispatchModel model = builder.build(horizon, config, options);
        LinearModel.Constraint row = model.getLinearModel().findConstraint("soc_0");

        // Then
        assertEquals(-0.81, row.getCoefficient(model.batteryChargeVar(0)), 1e-12);
        assertEquals(1.0, row.getCoefficient(model.batteryDischargeVar(0)), 1e-12);
    }

    @Test
    void testBuild_ChargeModeRows() {
        // When
        DispatchModel model = builder.build(horizon, config, FormulationOptions.defaults());
        LinearModel.Constraint charge = model.getLinearModel().findConstraint("charge_mode_2");
        LinearModel.Constraint discharge = model.getLinearModel().findConstraint("discharge_mode_2");

        // Then - charge <= 200 * mode, discharge <= 250 * (1 - mode)
        assertEquals(-200.0, charge.getCoefficient(model.chargeModeVar(2)));
        assertEquals(0.0, charge.getUpper());
        assertEquals(250.0, discharge.getCoefficient(model.chargeModeVar(2)));
        assertEquals(250.0, discharge.getUpper());
    }

    @Test
    void testBuild_TerminalSocRow() {
        // When
        DispatchModel model = builder.build(horizon, config, FormulationOptions.defaults());
        LinearModel.Constraint terminal = model.getLinearModel().findConstraint("terminal_soc");

        // Then
        assertEquals(400.0, terminal.getLower());
        assertEquals(Double.POSITIVE_INFINITY, terminal.getUpper());
        assertEquals(1.0, terminal.getCoefficient(model.socVar(2)));
    }

    @Test
    void testBuild_ObjectiveCoefficientsAndOffset() {
        // When
        DispatchModel model = builder.build(horizon, config, FormulationOptions.defaults());
        LinearModel lp = model.getLinearModel();

        // Then
        assertEquals(0.6, lp.getObjective().get(model.dieselOutputVar(0)).doubleValue(), 1e-12);
        assertEquals(40.0, lp.getObjective().get(model.dieselOnVar(1)).doubleValue(), 1e-12);
        assertEquals(-0.02, lp.getObjective().get(model.solarUsedVar(2)).doubleValue(), 1e-12);
        assertNull(lp.getObjective().get(model.socVar(0)));
        assertEquals(0.02 * 200.0, lp.getObjectiveOffset(), 1e-12);
    }

    @Test
    void testBuild_ObjectiveEqualsCostOfAssignment() {
        // Given - diesel covers the load in every hour, all solar curtailed
        DispatchModel model = builder.build(horizon, config, FormulationOptions.defaults());
        double[] values = new double[model.getLinearModel().getVariableCount()];
        for (int h = 0; h < 3; h++) {
            values[model.dieselOutputVar(h)] = horizon.getLoad(h);
            values[model.dieselOnVar(h)] = 1.0;
            values[model.socVar(h)] = 400.0;
        }

        // When
        double objective = model.getLinearModel().evaluateObjective(values);

        // Then
        assertEquals(600.0 * 0.6 + 3 * 40.0 + 200.0 * 0.02, objective, 1e-9);
    }
}
