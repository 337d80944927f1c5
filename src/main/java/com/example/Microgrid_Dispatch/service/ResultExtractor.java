package com.example.Microgrid_Dispatch.service;

import com.example.Microgrid_Dispatch.config.DispatchProperties;
import com.example.Microgrid_Dispatch.exception.InternalConsistencyException;
import com.example.Microgrid_Dispatch.model.AssetConfig;
import com.example.Microgrid_Dispatch.model.DispatchDecision;
import com.example.Microgrid_Dispatch.model.DispatchResult;
import com.example.Microgrid_Dispatch.model.DispatchSummary;
import com.example.Microgrid_Dispatch.model.HorizonInput;
import com.example.Microgrid_Dispatch.solver.SolveStatus;
import com.example.Microgrid_Dispatch.solver.SolverOutcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Turns a raw solver assignment into an hourly schedule and summary economics
 *
 * The assignment is not trusted: before a result is returned every hour is
 * checked for energy balance, lower and upper bounds on every flow and on the
 * SoC, diesel gating, SoC continuity and the terminal SoC. Tolerances are relative to the magnitude of the quantities
 * involved, with an absolute floor of the same value.
 *
 * Values within tolerance of a bound are clamped onto it (a solver may report
 * -1e-12 for a variable bounded at zero), so the returned schedule is clean.
 */
@Service
public class ResultExtractor {

    private static final Logger logger = LoggerFactory.getLogger(ResultExtractor.class);

    private final double tolerance;

    @Autowired
    public ResultExtractor(DispatchProperties properties) {
        this(properties.getValidation().getTolerance());
    }

    public ResultExtractor(double tolerance) {
        this.tolerance = tolerance;
    }

    public DispatchResult extract(DispatchModel model, SolverOutcome outcome) {
        if (!outcome.hasSolution()) {
            throw new IllegalArgumentException("Cannot extract a dispatch from outcome " + outcome);
        }

        HorizonInput horizon = model.getHorizon();
        AssetConfig config = model.getConfig();
        double[] values = outcome.getValues();

        List<DispatchDecision> decisions = new ArrayList<>(model.getHours());
        for (int h = 0; h < model.getHours(); h++) {
            decisions.add(new DispatchDecision(
                    h,
                    horizon.getLoad(h),
                    horizon.getSolarAvailable(h),
                    clampNonNegative(values[model.dieselOutputVar(h)]),
                    values[model.dieselOnVar(h)] > 0.5,
                    clampNonNegative(values[model.batteryChargeVar(h)]),
                    clampNonNegative(values[model.batteryDischargeVar(h)]),
                    clampNonNegative(values[model.solarUsedVar(h)]),
                    clampNonNegative(values[model.socVar(h)])));
        }

        List<String> violations = validate(decisions, model);
        if (!violations.isEmpty()) {
            logger.error("Consistency check failed for {} with {}: {}", model.getLinearModel(), outcome, violations);
            logger.error("Variable dump:\n{}", dumpVariables(model, values));
            throw new InternalConsistencyException(violations);
        }

        DispatchSummary summary = summarize(decisions, horizon, config);

        List<String> warnings = new ArrayList<>();
        if (outcome.getStatus() == SolveStatus.FEASIBLE) {
            String warning = String.format("Solver time limit reached: solution is feasible but not proven optimal "
                    + "(objective %.4f, best bound %.4f)", outcome.getObjectiveValue(), outcome.getBestBound());
            warnings.add(warning);
            logger.warn(warning);
        }
        return new DispatchResult(outcome.getStatus(), outcome.getObjectiveValue(), outcome.getBestBound(),
                outcome.getWallTimeMillis(), decisions, summary, warnings);
    }

    List<String> validate(List<DispatchDecision> decisions, DispatchModel model) {
        AssetConfig config = model.getConfig();
        List<String> violations = new ArrayList<>();

        for (DispatchDecision decision : decisions) {
            int h = decision.getHour();

            double scale = decision.getLoad() + decision.getBatteryCharge();
            if (Math.abs(decision.getBalanceResidual()) > scaledTolerance(scale)) {
                violations.add(String.format("hour %d: energy balance off by %.3ekW", h, decision.getBalanceResidual()));
            }

            if (decision.getSolarUsed() < -scaledTolerance(0.0)) {
                violations.add(String.format("hour %d: solar used %.6fkW is negative", h, decision.getSolarUsed()));
            }
            if (decision.getSolarUsed() > decision.getSolarAvailable() + scaledTolerance(decision.getSolarAvailable())) {
                violations.add(String.format("hour %d: solar used %.6f exceeds available %.6f",
                        h, decision.getSolarUsed(), decision.getSolarAvailable()));
            }

            if (decision.getSoc() < -scaledTolerance(0.0)) {
                violations.add(String.format("hour %d: SoC %.6fkWh is negative", h, decision.getSoc()));
            }
            if (decision.getSoc() > config.getBatteryCapacityKWh() + scaledTolerance(config.getBatteryCapacityKWh())) {
                violations.add(String.format("hour %d: SoC %.6fkWh exceeds capacity %.6fkWh",
                        h, decision.getSoc(), config.getBatteryCapacityKWh()));
            }

            checkPowerBound(violations, h, "battery charge", decision.getBatteryCharge(), config.getBatteryMaxChargeKW());
            checkPowerBound(violations, h, "battery discharge", decision.getBatteryDischarge(),
                    config.getBatteryMaxDischargeKW());
            if (decision.getDieselOutput() < -scaledTolerance(0.0)) {
                violations.add(String.format("hour %d: diesel output %.6fkW is negative", h, decision.getDieselOutput()));
            }

            if (!decision.isDieselOn() && decision.getDieselOutput() > scaledTolerance(0.0)) {
                violations.add(String.format("hour %d: diesel off but producing %.6fkW", h, decision.getDieselOutput()));
            }
            if (decision.isDieselOn()) {
                double minStable = config.getDieselMinStableKW();
                if (decision.getDieselOutput() < minStable - scaledTolerance(minStable)) {
                    violations.add(String.format("hour %d: diesel output %.6fkW below stable minimum %.6fkW",
                            h, decision.getDieselOutput(), minStable));
                }
                if (decision.getDieselOutput() > config.getDieselCapacityKW() + scaledTolerance(config.getDieselCapacityKW())) {
                    violations.add(String.format("hour %d: diesel output %.6fkW above capacity", h, decision.getDieselOutput()));
                }
            }

            double previousSoc = h == 0 ? config.getBatteryInitialSoCKWh() : decisions.get(h - 1).getSoc();
            double expectedSoc = previousSoc
                    + decision.getBatteryCharge() * model.getChargeEfficiency()
                    - decision.getBatteryDischarge() / model.getDischargeEfficiency();
            if (Math.abs(decision.getSoc() - expectedSoc) > scaledTolerance(Math.max(previousSoc, decision.getSoc()))) {
                violations.add(String.format("hour %d: SoC %.6fkWh breaks continuity (expected %.6fkWh)",
                        h, decision.getSoc(), expectedSoc));
            }
        }

        if (!decisions.isEmpty()) {
            double terminal = decisions.get(decisions.size() - 1).getSoc();
            double initial = config.getBatteryInitialSoCKWh();
            if (terminal < initial - scaledTolerance(initial)) {
                violations.add(String.format("terminal SoC %.6fkWh below initial %.6fkWh", terminal, initial));
            }
        }
        return violations;
    }

    DispatchSummary summarize(List<DispatchDecision> decisions, HorizonInput horizon, AssetConfig config) {
        DispatchSummary summary = new DispatchSummary();
        int hours = decisions.size();

        for (DispatchDecision decision : decisions) {
            summary.totalLoadKWh += decision.getLoad();
            summary.totalDieselKWh += decision.getDieselOutput();
            summary.totalSolarUsedKWh += decision.getSolarUsed();
            summary.totalCurtailedKWh += decision.getCurtailed();
            summary.totalChargeKWh += decision.getBatteryCharge();
            summary.totalDischargeKWh += decision.getBatteryDischarge();
            if (decision.isDieselOn()) {
                summary.dieselRunHours++;
            }
        }

        summary.totalFuelCost = summary.totalDieselKWh * config.getFuelCostPerKWh();
        summary.totalCarbonCost = summary.totalDieselKWh * config.getCarbonTaxPerKWh();
        summary.totalNoLoadCost = summary.dieselRunHours * config.getDieselNoLoadCostPerHour();
        summary.totalCurtailmentPenalty = summary.totalCurtailedKWh * config.getCurtailmentPenaltyPerKWh();
        summary.totalCost = summary.totalFuelCost + summary.totalCarbonCost
                + summary.totalNoLoadCost + summary.totalCurtailmentPenalty;

        summary.terminalSocKWh = hours > 0 ? decisions.get(hours - 1).getSoc() : config.getBatteryInitialSoCKWh();

        summary.dieselCapacityFactor = ratio(summary.totalDieselKWh, config.getDieselCapacityKW() * hours);
        summary.batteryCapacityFactor = ratio(summary.totalDischargeKWh, config.getBatteryMaxDischargeKW() * hours);
        summary.solarCapacityFactor = ratio(summary.totalSolarUsedKWh, horizon.getSolarCapacityKW() * hours);

        // Diesel carries the whole load every hour, generator always on
        summary.baselineCost = summary.totalLoadKWh * config.getDieselMarginalCostPerKWh()
                + hours * config.getDieselNoLoadCostPerHour();
        summary.savings = summary.baselineCost - summary.totalCost;

        return summary;
    }

    private void checkPowerBound(List<String> violations, int hour, String quantity, double value, double max) {
        if (value < -scaledTolerance(0.0)) {
            violations.add(String.format("hour %d: %s %.6fkW is negative", hour, quantity, value));
        } else if (value > max + scaledTolerance(max)) {
            violations.add(String.format("hour %d: %s %.6fkW exceeds limit %.6fkW", hour, quantity, value, max));
        }
    }

    private double scaledTolerance(double magnitude) {
        return tolerance * Math.max(1.0, Math.abs(magnitude));
    }

    private double clampNonNegative(double value) {
        return value < 0 && value > -scaledTolerance(0.0) ? 0.0 : value;
    }

    private static double ratio(double numerator, double denominator) {
        return denominator > 0 ? numerator / denominator : 0.0;
    }

    private static String dumpVariables(DispatchModel model, double[] values) {
        StringBuilder dump = new StringBuilder();
        model.getLinearModel().getVariables().forEach(variable ->
                dump.append(String.format("  %-24s = %.9f%n", variable.getName(), values[variable.getIndex()])));
        return dump.toString();
    }
}
