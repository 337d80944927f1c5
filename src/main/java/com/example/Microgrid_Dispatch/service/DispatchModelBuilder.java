package com.example.Microgrid_Dispatch.service;

import com.example.Microgrid_Dispatch.model.AssetConfig;
import com.example.Microgrid_Dispatch.model.FormulationOptions;
import com.example.Microgrid_Dispatch.model.HorizonInput;
import com.example.Microgrid_Dispatch.model.SimultaneityPolicy;
import com.example.Microgrid_Dispatch.solver.LinearModel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Hourly dispatch MILP construction
 *
 * Variables per hour h:
 * - dieselOutput[h] in [0, capacity], dieselOn[h] binary
 * - batteryCharge[h] in [0, maxCharge], batteryDischarge[h] in [0, maxDischarge]
 * - solarUsed[h] in [0, solarAvailable[h]]
 * - soc[h] in [0, batteryCapacity], energy stored at the end of hour h
 * - chargeMode[h] binary, only with {@link SimultaneityPolicy#BINARY_INDICATOR}
 *
 * Constraints per hour:
 * - balance:    diesel + discharge + solarUsed - charge = load
 * - diesel_min: diesel - minStable * on >= 0
 * - diesel_max: diesel - capacity * on <= 0
 * - soc:        soc[h] - soc[h-1] - etaC * charge + discharge / etaD = 0  (soc[-1] = initial SoC)
 * - charge_mode / discharge_mode: charge <= maxCharge * mode, discharge <= maxDischarge * (1 - mode)
 * plus terminal_soc: soc[H-1] >= initial SoC.
 *
 * Objective: (fuel + carbon) * diesel + noLoad * on + penalty * (solarAvailable - solarUsed).
 * The constant penalty * solarAvailable goes into the objective offset so the
 * reported objective equals the full cost.
 *
 * Stateless; every call builds an independent model.
 */
@Component
public class DispatchModelBuilder {

    private static final Logger logger = LoggerFactory.getLogger(DispatchModelBuilder.class);

    public DispatchModel build(HorizonInput horizon, AssetConfig config, FormulationOptions options) {
        long startTime = System.currentTimeMillis();
        int hours = horizon.getHours();

        double etaCharge = options.getEfficiencySplit().chargeEfficiency(config.getBatteryRoundTripEfficiency());
        double etaDischarge = options.getEfficiencySplit().dischargeEfficiency(config.getBatteryRoundTripEfficiency());
        boolean chargeModeIndicator = options.getSimultaneityPolicy() == SimultaneityPolicy.BINARY_INDICATOR;

        LinearModel model = new LinearModel(String.format("dispatch_%dh", hours));

        int[] dieselOutput = new int[hours];
        int[] dieselOn = new int[hours];
        int[] batteryCharge = new int[hours];
        int[] batteryDischarge = new int[hours];
        int[] solarUsed = new int[hours];
        int[] soc = new int[hours];
        int[] chargeMode = chargeModeIndicator ? new int[hours] : null;

        // Decision variables
        for (int h = 0; h < hours; h++) {
            dieselOutput[h] = model.addContinuous("diesel_output_" + h, 0.0, config.getDieselCapacityKW());
            dieselOn[h] = model.addBinary("diesel_on_" + h);
            batteryCharge[h] = model.addContinuous("battery_charge_" + h, 0.0, config.getBatteryMaxChargeKW());
            batteryDischarge[h] = model.addContinuous("battery_discharge_" + h, 0.0, config.getBatteryMaxDischargeKW());
            solarUsed[h] = model.addContinuous("solar_used_" + h, 0.0, horizon.getSolarAvailable(h));
            soc[h] = model.addContinuous("soc_" + h, 0.0, config.getBatteryCapacityKWh());
            if (chargeModeIndicator) {
                chargeMode[h] = model.addBinary("charge_mode_" + h);
            }
        }

        for (int h = 0; h < hours; h++) {
            // Energy balance: the only constraint coupling all assets
            model.addEquality(DispatchModel.rowName(DispatchModel.BALANCE, h), horizon.getLoad(h))
                    .term(dieselOutput[h], 1.0)
                    .term(batteryDischarge[h], 1.0)
                    .term(solarUsed[h], 1.0)
                    .term(batteryCharge[h], -1.0);

            // Diesel on/off gating; both bounds force zero output when off
            model.addGreaterOrEqual(DispatchModel.rowName(DispatchModel.DIESEL_MIN, h), 0.0)
                    .term(dieselOutput[h], 1.0)
                    .term(dieselOn[h], -config.getDieselMinStableKW());
            model.addLessOrEqual(DispatchModel.rowName(DispatchModel.DIESEL_MAX, h), 0.0)
                    .term(dieselOutput[h], 1.0)
                    .term(dieselOn[h], -config.getDieselCapacityKW());

            // State of charge continuity, seeded by the initial SoC at h = 0
            LinearModel.Constraint continuity = model.addEquality(
                    DispatchModel.rowName(DispatchModel.SOC_CONTINUITY, h),
                    h == 0 ? config.getBatteryInitialSoCKWh() : 0.0)
                    .term(soc[h], 1.0)
                    .term(batteryCharge[h], -etaCharge)
                    .term(batteryDischarge[h], 1.0 / etaDischarge);
            if (h > 0) {
                continuity.term(soc[h - 1], -1.0);
            }

            if (chargeModeIndicator) {
                model.addLessOrEqual(DispatchModel.rowName(DispatchModel.CHARGE_MODE, h), 0.0)
                        .term(batteryCharge[h], 1.0)
                        .term(chargeMode[h], -config.getBatteryMaxChargeKW());
                model.addLessOrEqual(DispatchModel.rowName(DispatchModel.DISCHARGE_MODE, h),
                                config.getBatteryMaxDischargeKW())
                        .term(batteryDischarge[h], 1.0)
                        .term(chargeMode[h], config.getBatteryMaxDischargeKW());
            }
        }

        // No net depletion over the horizon
        model.addGreaterOrEqual(DispatchModel.TERMINAL_SOC, config.getBatteryInitialSoCKWh())
                .term(soc[hours - 1], 1.0);

        // Objective
        double dieselMarginalCost = config.getDieselMarginalCostPerKWh();
        double curtailmentPenalty = config.getCurtailmentPenaltyPerKWh();
        for (int h = 0; h < hours; h++) {
            model.addObjectiveTerm(dieselOutput[h], dieselMarginalCost);
            model.addObjectiveTerm(dieselOn[h], config.getDieselNoLoadCostPerHour());
            model.addObjectiveTerm(solarUsed[h], -curtailmentPenalty);
            model.addObjectiveConstant(curtailmentPenalty * horizon.getSolarAvailable(h));
        }

        logger.debug("Built {} in {}ms ({})", model, System.currentTimeMillis() - startTime, options);

        return new DispatchModel(model, horizon, config, options, etaCharge, etaDischarge,
                dieselOutput, dieselOn, batteryCharge, batteryDischarge, solarUsed, soc, chargeMode);
    }
}
