package com.example.Microgrid_Dispatch.service;

import com.example.Microgrid_Dispatch.config.DispatchProperties;
import com.example.Microgrid_Dispatch.solver.LinearModel;
import com.example.Microgrid_Dispatch.solver.MilpSolver;
import com.example.Microgrid_Dispatch.solver.SolveStatus;
import com.example.Microgrid_Dispatch.solver.SolverOptions;
import com.example.Microgrid_Dispatch.solver.SolverOutcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.concurrent.Semaphore;

/**
 * Gatekeeper between dispatch runs and the MILP solver
 *
 * - Bounds the number of solves in flight across all concurrent runs
 *   (fair semaphore, so sweep jobs are served in arrival order)
 * - Retries once, with a relaxed time limit, when the solver reports ERROR
 * - Never retries INFEASIBLE or UNBOUNDED; those are properties of the model
 */
@Service
public class SolverAdapter {

    private static final Logger logger = LoggerFactory.getLogger(SolverAdapter.class);

    private final MilpSolver solver;
    private final Semaphore solveSlots;
    private final int maxConcurrentSolves;
    private final double retryTimeLimitFactor;

    @Autowired
    public SolverAdapter(MilpSolver solver, DispatchProperties properties) {
        this(solver, properties.getSolver().getMaxConcurrentSolves(), properties.getSolver().getRetryTimeLimitFactor());
    }

    public SolverAdapter(MilpSolver solver, int maxConcurrentSolves, double retryTimeLimitFactor) {
        if (maxConcurrentSolves < 1) {
            throw new IllegalArgumentException("maxConcurrentSolves must be at least 1");
        }
        this.solver = solver;
        this.maxConcurrentSolves = maxConcurrentSolves;
        this.solveSlots = new Semaphore(maxConcurrentSolves, true);
        this.retryTimeLimitFactor = retryTimeLimitFactor;

        logger.info("SolverAdapter initialized: backend={}, maxConcurrentSolves={}, retryFactor={}",
                solver.getBackendName(), maxConcurrentSolves, retryTimeLimitFactor);
    }

    /**
     * Solve a model, blocking until a solve slot is free.
     *
     * @return the solver outcome; ERROR only if the retry failed too
     */
    public SolverOutcome solve(LinearModel model, SolverOptions options) {
        SolverOutcome outcome = solveWithSlot(model, options);

        if (outcome.getStatus() == SolveStatus.ERROR) {
            SolverOptions relaxed = options.withRelaxedTimeLimit(retryTimeLimitFactor);
            logger.warn("Solver error on '{}' ({}), retrying once with {}",
                    model.getName(), outcome.getMessage(), relaxed);
            outcome = solveWithSlot(model, relaxed);
        }

        return outcome;
    }

    private SolverOutcome solveWithSlot(LinearModel model, SolverOptions options) {
        try {
            solveSlots.acquire();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return SolverOutcome.failed(SolveStatus.ERROR, 0L, "Interrupted while waiting for a solver slot");
        }
        try {
            return solver.solve(model, options);
        } finally {
            solveSlots.release();
        }
    }

    public String getBackendName() {
        return solver.getBackendName();
    }

    public int getMaxConcurrentSolves() {
        return maxConcurrentSolves;
    }

    /** Slots currently free; for monitoring. */
    public int getAvailableSlots() {
        return solveSlots.availablePermits();
    }
}
