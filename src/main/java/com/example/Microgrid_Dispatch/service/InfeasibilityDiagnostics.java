package com.example.Microgrid_Dispatch.service;

import com.example.Microgrid_Dispatch.model.AssetConfig;
import com.example.Microgrid_Dispatch.model.FormulationOptions;
import com.example.Microgrid_Dispatch.model.HorizonInput;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Explains a proven infeasibility in terms of the inputs.
 *
 * Only run after the solver has reported INFEASIBLE. Each check is a
 * necessary condition for feasibility, so every cause it reports is real,
 * but an empty list does not mean the model is feasible: the cause may lie in
 * the inter-hour coupling of the battery, which is reported generically.
 *
 * Battery energy is checked per run of consecutive deficit hours (load above
 * diesel capacity plus solar). No hour in such a run has surplus to charge
 * from, so the whole run must be served from energy already stored.
 */
@Component
public class InfeasibilityDiagnostics {

    private static final double EPSILON = 1e-9;

    public List<String> diagnose(HorizonInput horizon, AssetConfig config, FormulationOptions options) {
        List<String> causes = new ArrayList<>();
        double etaCharge = options.getEfficiencySplit().chargeEfficiency(config.getBatteryRoundTripEfficiency());
        double etaDischarge = options.getEfficiencySplit().dischargeEfficiency(config.getBatteryRoundTripEfficiency());

        double requiredDischargeEnergy = 0.0;
        double rechargeableEnergy = 0.0;
        double runDeficit = 0.0;
        int runStart = -1;

        for (int h = 0; h < horizon.getHours(); h++) {
            double load = horizon.getLoad(h);
            double solar = horizon.getSolarAvailable(h);
            double maxSupply = config.getDieselCapacityKW() + config.getBatteryMaxDischargeKW() + solar;

            if (load > maxSupply + EPSILON) {
                causes.add(String.format("hour %d: capacity shortfall, load %.2fkW exceeds diesel + battery + solar "
                        + "capacity %.2fkW", h, load, maxSupply));
                continue;
            }

            // Diesel is unavoidable when solar and battery cannot cover the load alone
            boolean dieselRequired = load > solar + config.getBatteryMaxDischargeKW() + EPSILON;
            double absorbable = load + config.getBatteryMaxChargeKW();
            if (dieselRequired && config.getDieselMinStableKW() > absorbable + EPSILON) {
                causes.add(String.format("hour %d: diesel minimum load, generator must run but its %.2fkW stable "
                        + "minimum exceeds load plus charge headroom %.2fkW", h, config.getDieselMinStableKW(), absorbable));
            }

            double deficit = load - config.getDieselCapacityKW() - solar;
            if (deficit > 0) {
                requiredDischargeEnergy += deficit;
                if (runStart < 0) {
                    runStart = h;
                }
                runDeficit += deficit;
            } else {
                rechargeableEnergy += Math.min(config.getBatteryMaxChargeKW(), -deficit);
                checkDeficitRun(causes, config, etaDischarge, runStart, h - 1, runDeficit);
                runStart = -1;
                runDeficit = 0.0;
            }
        }
        checkDeficitRun(causes, config, etaDischarge, runStart, horizon.getHours() - 1, runDeficit);

        if (requiredDischargeEnergy > EPSILON) {
            double storedNeeded = requiredDischargeEnergy / etaDischarge;
            double restorable = rechargeableEnergy * etaCharge;
            if (storedNeeded > restorable + EPSILON) {
                causes.add(String.format("horizon: terminal state of charge, %.2fkWh drawn from storage but at most "
                        + "%.2fkWh can be recharged", storedNeeded, restorable));
            }
        }

        if (causes.isEmpty()) {
            causes.add("no single-hour cause found; check battery energy limits across hours "
                    + "together with the terminal state of charge requirement");
        }
        return causes;
    }

    private static void checkDeficitRun(List<String> causes, AssetConfig config, double etaDischarge,
                                        int fromHour, int toHour, double deficit) {
        if (fromHour < 0 || deficit <= EPSILON) {
            return;
        }
        double storedNeeded = deficit / etaDischarge;
        if (storedNeeded > config.getBatteryCapacityKWh() + EPSILON) {
            causes.add(String.format("hours %d-%d: battery energy, %.2fkWh of discharge without a chance to "
                            + "recharge needs %.2fkWh stored but capacity is %.2fkWh",
                    fromHour, toHour, deficit, storedNeeded, config.getBatteryCapacityKWh()));
        }
    }
}
