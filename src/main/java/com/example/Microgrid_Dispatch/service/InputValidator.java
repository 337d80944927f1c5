package com.example.Microgrid_Dispatch.service;

import com.example.Microgrid_Dispatch.exception.DispatchConfigurationException;
import com.example.Microgrid_Dispatch.model.AssetConfig;
import com.example.Microgrid_Dispatch.model.HorizonInput;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Sign and range checks on a run's inputs, applied before any model is built.
 *
 * Collects every violation instead of stopping at the first, so a caller
 * fixing a request sees the whole list at once. A battery with zero capacity
 * is accepted and means "no battery"; the diesel generator must exist.
 */
@Component
public class InputValidator {

    private static final Logger logger = LoggerFactory.getLogger(InputValidator.class);

    public void validate(HorizonInput horizon, AssetConfig config) {
        List<String> violations = new ArrayList<>();
        if (horizon == null) {
            violations.add("horizon input is required");
        } else {
            collectHorizonViolations(horizon, violations);
        }
        if (config == null) {
            violations.add("asset configuration is required");
        } else {
            collectConfigViolations(config, violations);
        }

        if (!violations.isEmpty()) {
            logger.warn("Rejected dispatch inputs: {}", violations);
            throw new DispatchConfigurationException(violations);
        }
    }

    void collectHorizonViolations(HorizonInput horizon, List<String> violations) {
        double[] load = horizon.getLoad();
        double[] solar = horizon.getSolarAvailable();

        if (load.length == 0) {
            violations.add("horizon must contain at least one hour");
        }
        if (load.length != solar.length) {
            violations.add(String.format("load series has %d hours but solar series has %d",
                    load.length, solar.length));
        }
        for (int h = 0; h < load.length; h++) {
            if (!isFinite(load[h]) || load[h] < 0) {
                violations.add(String.format("load[%d] must be a finite value >= 0 (was %s)", h, load[h]));
            }
        }
        for (int h = 0; h < solar.length; h++) {
            if (!isFinite(solar[h]) || solar[h] < 0) {
                violations.add(String.format("solarAvailable[%d] must be a finite value >= 0 (was %s)", h, solar[h]));
            }
        }
        if (!isFinite(horizon.getSolarCapacityKW()) || horizon.getSolarCapacityKW() < 0) {
            violations.add("solarCapacityKW must be >= 0");
        }
    }

    void collectConfigViolations(AssetConfig config, List<String> violations) {
        requirePositive("dieselCapacityKW", config.getDieselCapacityKW(), violations);
        if (!isFinite(config.getDieselMinLoadFraction())
                || config.getDieselMinLoadFraction() < 0 || config.getDieselMinLoadFraction() >= 1) {
            violations.add("dieselMinLoadFraction must be in [0, 1) (was " + config.getDieselMinLoadFraction() + ")");
        }
        requireNonNegative("fuelCostPerKWh", config.getFuelCostPerKWh(), violations);
        requireNonNegative("carbonTaxPerKWh", config.getCarbonTaxPerKWh(), violations);
        requireNonNegative("dieselNoLoadCostPerHour", config.getDieselNoLoadCostPerHour(), violations);

        requireNonNegative("batteryCapacityKWh", config.getBatteryCapacityKWh(), violations);
        requireNonNegative("batteryMaxChargeKW", config.getBatteryMaxChargeKW(), violations);
        requireNonNegative("batteryMaxDischargeKW", config.getBatteryMaxDischargeKW(), violations);
        double efficiency = config.getBatteryRoundTripEfficiency();
        if (!isFinite(efficiency) || efficiency <= 0 || efficiency > 1) {
            violations.add("batteryRoundTripEfficiency must be in (0, 1] (was " + efficiency + ")");
        }
        double initialSoc = config.getBatteryInitialSoCKWh();
        if (!isFinite(initialSoc) || initialSoc < 0 || initialSoc > config.getBatteryCapacityKWh()) {
            violations.add(String.format("batteryInitialSoCKWh must be in [0, %s] (was %s)",
                    config.getBatteryCapacityKWh(), initialSoc));
        }

        requireNonNegative("curtailmentPenaltyPerKWh", config.getCurtailmentPenaltyPerKWh(), violations);
    }

    private static void requirePositive(String name, double value, List<String> violations) {
        if (!isFinite(value) || value <= 0) {
            violations.add(name + " must be > 0 (was " + value + ")");
        }
    }

    private static void requireNonNegative(String name, double value, List<String> violations) {
        if (!isFinite(value) || value < 0) {
            violations.add(name + " must be >= 0 (was " + value + ")");
        }
    }

    private static boolean isFinite(double value) {
        return !Double.isNaN(value) && !Double.isInfinite(value);
    }
}
