package com.example.Microgrid_Dispatch.simulator;

import com.example.Microgrid_Dispatch.config.DispatchProperties;
import com.example.Microgrid_Dispatch.input.CsvHorizonReader;
import com.example.Microgrid_Dispatch.input.HourlyRecord;
import com.example.Microgrid_Dispatch.model.AssetConfig;
import com.example.Microgrid_Dispatch.model.DispatchSummary;
import com.example.Microgrid_Dispatch.model.HorizonInput;
import com.example.Microgrid_Dispatch.model.SweepOutcome;
import com.example.Microgrid_Dispatch.service.HorizonSweepService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.YearMonth;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Annual Feasibility Analysis
 *
 * Reads a year of hourly load and solar data, optimises every calendar month
 * as its own horizon and compares the hybrid dispatch against running the
 * diesel generator alone all year.
 *
 * Design:
 * - Months are independent runs, executed in parallel by the sweep service
 * - A month that fails (e.g. infeasible) is reported and left out of the totals
 * - Baseline: generator on every hour carrying the whole load
 *
 * Run with: --simulator.enabled=true --simulator.data-file=data/microgrid_data.csv
 */
@Component
@ConditionalOnProperty(name = "simulator.enabled", havingValue = "true", matchIfMissing = false)
public class AnnualAnalysisRunner implements CommandLineRunner {

    private static final Logger logger = LoggerFactory.getLogger(AnnualAnalysisRunner.class);

    private final CsvHorizonReader csvReader;
    private final HorizonSweepService sweepService;
    private final AssetConfig assetConfig;
    private final DispatchProperties properties;
    private final String dataFile;

    public AnnualAnalysisRunner(CsvHorizonReader csvReader,
                                HorizonSweepService sweepService,
                                AssetConfig assetConfig,
                                DispatchProperties properties,
                                @Value("${simulator.data-file:data/microgrid_data.csv}") String dataFile) {
        this.csvReader = csvReader;
        this.sweepService = sweepService;
        this.assetConfig = assetConfig;
        this.properties = properties;
        this.dataFile = dataFile;
    }

    @Override
    public void run(String... args) throws Exception {
        logger.info("=".repeat(80));
        logger.info("MICROGRID DISPATCH - ANNUAL FEASIBILITY ANALYSIS");
        logger.info("=".repeat(80));

        Path path = Path.of(dataFile);
        if (!Files.exists(path)) {
            logger.error("Data file not found: {}", path.toAbsolutePath());
            return;
        }

        List<HourlyRecord> records = csvReader.read(path);
        Map<YearMonth, HorizonInput> months = csvReader.splitByMonth(records, properties.getDefaultSolarCapacityKw());
        logger.info("Assets: {}", assetConfig);
        logger.info("Optimising {} months ({} hours)", months.size(), records.size());

        AnnualReport report = analyse(months);
        logReport(report);
    }

    AnnualReport analyse(Map<YearMonth, HorizonInput> months) {
        Map<String, HorizonInput> labelled = new LinkedHashMap<>();
        months.forEach((month, horizon) -> labelled.put(month.toString(), horizon));

        List<SweepOutcome> outcomes = sweepService.runHorizons(labelled, assetConfig);

        AnnualReport report = new AnnualReport();
        for (SweepOutcome outcome : outcomes) {
            if (!outcome.isSuccess()) {
                report.failedMonths.add(outcome.getLabel() + " (" + outcome.getErrorCode() + ")");
                continue;
            }
            DispatchSummary summary = outcome.getResult().getSummary();
            report.monthly.put(outcome.getLabel(), summary);
            report.baselineCost += summary.baselineCost;
            report.optimisedCost += summary.totalCost;
            report.dieselKWh += summary.totalDieselKWh;
            report.solarUsedKWh += summary.totalSolarUsedKWh;
            report.curtailedKWh += summary.totalCurtailedKWh;
            report.dieselRunHours += summary.dieselRunHours;
        }
        return report;
    }

    private void logReport(AnnualReport report) {
        logger.info("-".repeat(60));
        logger.info(String.format("%-10s %14s %14s %14s %8s", "Month", "Baseline", "Optimised", "Savings", "Diesel h"));
        report.monthly.forEach((month, summary) -> logger.info(String.format("%-10s %14.0f %14.0f %14.0f %8d",
                month, summary.baselineCost, summary.totalCost, summary.savings, summary.dieselRunHours)));
        logger.info("-".repeat(60));

        for (String failed : report.failedMonths) {
            logger.warn("Month not optimised: {}", failed);
        }

        logger.info("=".repeat(60));
        logger.info("ANNUAL FEASIBILITY RESULTS");
        logger.info("=".repeat(60));
        logger.info(String.format("Baseline Cost:   %,.0f", report.baselineCost));
        logger.info(String.format("Optimised Cost:  %,.0f", report.optimisedCost));
        logger.info(String.format("Savings:         %,.0f (%.1f%%)", report.getSavings(), report.getSavingsFraction() * 100.0));
        logger.info(String.format("Diesel: %,.0fkWh over %dh, solar used %,.0fkWh, curtailed %,.0fkWh",
                report.dieselKWh, report.dieselRunHours, report.solarUsedKWh, report.curtailedKWh));
        logger.info("=".repeat(60));
    }

    /**
     * Year totals over the months that solved
     */
    static class AnnualReport {
        final Map<String, DispatchSummary> monthly = new LinkedHashMap<>();
        final List<String> failedMonths = new ArrayList<>();
        double baselineCost;
        double optimisedCost;
        double dieselKWh;
        double solarUsedKWh;
        double curtailedKWh;
        int dieselRunHours;

        double getSavings() {
            return baselineCost - optimisedCost;
        }

        double getSavingsFraction() {
            return baselineCost > 0 ? getSavings() / baselineCost : 0.0;
        }
    }
}
