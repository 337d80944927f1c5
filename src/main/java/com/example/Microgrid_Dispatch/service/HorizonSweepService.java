package com.example.Microgrid_Dispatch.service;

import com.example.Microgrid_Dispatch.exception.DispatchConfigurationException;
import com.example.Microgrid_Dispatch.exception.DispatchException;
import com.example.Microgrid_Dispatch.model.AssetConfig;
import com.example.Microgrid_Dispatch.model.HorizonInput;
import com.example.Microgrid_Dispatch.model.SweepJob;
import com.example.Microgrid_Dispatch.model.SweepOutcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;

/**
 * Runs independent optimisation jobs in parallel
 *
 * Design decisions:
 * - Fixed worker pool; the number of solves actually running at once is
 *   further bounded by {@link SolverAdapter}
 * - Every job owns its horizon and asset configuration, nothing is shared
 *   between jobs apart from the solver slots
 * - A failing job becomes a failed {@link SweepOutcome}; the other jobs
 *   keep running
 * - Outcomes are returned in the order the jobs were given
 */
@Service
public class HorizonSweepService {

    private static final Logger logger = LoggerFactory.getLogger(HorizonSweepService.class);

    private final DispatchOptimizer optimizer;
    private final ExecutorService sweepExecutor;

    public HorizonSweepService(DispatchOptimizer optimizer,
                               @Qualifier("sweepExecutor") ExecutorService sweepExecutor) {
        this.optimizer = optimizer;
        this.sweepExecutor = sweepExecutor;
    }

    public List<SweepOutcome> runAll(List<SweepJob> jobs) {
        long startTime = System.currentTimeMillis();
        logger.info("Starting sweep of {} jobs", jobs.size());

        List<Future<SweepOutcome>> futures = new ArrayList<>(jobs.size());
        for (SweepJob job : jobs) {
            futures.add(sweepExecutor.submit(() -> runJob(job)));
        }

        List<SweepOutcome> outcomes = new ArrayList<>(jobs.size());
        try {
            for (Future<SweepOutcome> future : futures) {
                outcomes.add(future.get());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            futures.forEach(future -> future.cancel(true));
            throw new IllegalStateException("Interrupted while waiting for sweep results", e);
        } catch (ExecutionException e) {
            // runJob catches everything it can recover from
            futures.forEach(future -> future.cancel(true));
            throw new IllegalStateException("Sweep job failed unexpectedly", e.getCause());
        }

        long failed = outcomes.stream().filter(outcome -> !outcome.isSuccess()).count();
        logger.info("Sweep of {} jobs completed in {}ms ({} failed)",
                jobs.size(), System.currentTimeMillis() - startTime, failed);
        return outcomes;
    }

    /**
     * One run per battery capacity, all other assets unchanged. The initial
     * state of charge is kept in kWh and clamped to each capacity.
     *
     * @throws DispatchConfigurationException if a capacity is null; no job is started
     */
    public List<SweepOutcome> sweepBatteryCapacities(HorizonInput horizon, AssetConfig base, List<Double> capacitiesKWh) {
        List<String> violations = new ArrayList<>();
        for (int i = 0; i < capacitiesKWh.size(); i++) {
            if (capacitiesKWh.get(i) == null) {
                violations.add(String.format("batteryCapacitiesKWh[%d] is missing", i));
            }
        }
        if (!violations.isEmpty()) {
            throw new DispatchConfigurationException(violations);
        }

        List<SweepJob> jobs = new ArrayList<>(capacitiesKWh.size());
        for (Double capacity : capacitiesKWh) {
            AssetConfig sized = base.toBuilder()
                    .batteryCapacityKWh(capacity)
                    .batteryInitialSoCKWh(Math.min(base.getBatteryInitialSoCKWh(), capacity))
                    .build();
            jobs.add(new SweepJob(String.format("battery_%.1fkWh", capacity), horizon, sized));
        }
        return runAll(jobs);
    }

    /**
     * One run per labelled horizon (e.g. calendar months), iteration order preserved.
     */
    public List<SweepOutcome> runHorizons(Map<String, HorizonInput> horizons, AssetConfig config) {
        List<SweepJob> jobs = new ArrayList<>(horizons.size());
        horizons.forEach((label, horizon) -> jobs.add(new SweepJob(label, horizon, config)));
        return runAll(jobs);
    }

    private SweepOutcome runJob(SweepJob job) {
        try {
            return SweepOutcome.success(job, optimizer.optimize(job.getHorizon(), job.getConfig()));
        } catch (DispatchException error) {
            logger.warn("Sweep job '{}' failed: {} {}", job.getLabel(), error.getErrorCode(), error.getMessage());
            return SweepOutcome.failure(job, error.getErrorCode(), error.getMessage());
        } catch (RuntimeException error) {
            logger.error("Sweep job '{}' failed unexpectedly", job.getLabel(), error);
            return SweepOutcome.failure(job, "INTERNAL_ERROR", error.getMessage());
        }
    }
}
