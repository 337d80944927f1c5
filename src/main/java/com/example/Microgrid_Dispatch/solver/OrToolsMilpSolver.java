package com.example.Microgrid_Dispatch.solver;

import com.google.ortools.Loader;
import com.google.ortools.linearsolver.MPConstraint;
import com.google.ortools.linearsolver.MPObjective;
import com.google.ortools.linearsolver.MPSolver;
import com.google.ortools.linearsolver.MPSolverParameters;
import com.google.ortools.linearsolver.MPVariable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;

/**
 * {@link MilpSolver} backed by the Google OR-Tools linear solver wrapper.
 *
 * Each call creates, solves and deletes its own native {@code MPSolver}, so
 * concurrent calls share nothing but the loaded native library.
 */
public class OrToolsMilpSolver implements MilpSolver {

    private static final Logger logger = LoggerFactory.getLogger(OrToolsMilpSolver.class);

    private static volatile boolean nativesLoaded = false;

    private final String backend;

    public OrToolsMilpSolver(String backend) {
        this.backend = backend;
    }

    @Override
    public String getBackendName() {
        return backend;
    }

    @Override
    public SolverOutcome solve(LinearModel model, SolverOptions options) {
        long startTime = System.currentTimeMillis();

        MPSolver solver;
        try {
            ensureNativesLoaded();
            solver = MPSolver.createSolver(backend);
        } catch (RuntimeException | UnsatisfiedLinkError error) {
            logger.error("Failed to initialise OR-Tools backend {}", backend, error);
            return SolverOutcome.failed(SolveStatus.ERROR, elapsedSince(startTime),
                    "Solver initialisation failed: " + error.getMessage());
        }

        if (solver == null) {
            return SolverOutcome.failed(SolveStatus.ERROR, elapsedSince(startTime),
                    "OR-Tools backend not available: " + backend);
        }

        try {
            MPVariable[] variables = translate(solver, model);

            solver.setTimeLimit(options.getTimeLimit().toMillis());
            MPSolverParameters parameters = new MPSolverParameters();
            parameters.setDoubleParam(MPSolverParameters.DoubleParam.RELATIVE_MIP_GAP, options.getRelativeGap());

            logger.debug("Solving {} with {} ({})", model, backend, options);
            MPSolver.ResultStatus resultStatus = solver.solve(parameters);
            SolveStatus status = mapStatus(resultStatus);
            long wallTime = elapsedSince(startTime);

            if (!status.hasSolution()) {
                logger.debug("Solve of '{}' ended with {} after {}ms", model.getName(), resultStatus, wallTime);
                return SolverOutcome.failed(status, wallTime, "OR-Tools status " + resultStatus);
            }

            double[] values = new double[variables.length];
            for (int i = 0; i < variables.length; i++) {
                values[i] = variables[i].solutionValue();
            }
            MPObjective objective = solver.objective();
            double objectiveValue = objective.value();
            double bestBound = model.getIntegerVariableCount() > 0 ? objective.bestBound() : objectiveValue;

            logger.debug("Solve of '{}' ended with {} after {}ms, objective={}",
                    model.getName(), resultStatus, wallTime, objectiveValue);
            return SolverOutcome.solved(status, values, objectiveValue, bestBound, wallTime);
        } catch (RuntimeException error) {
            logger.warn("OR-Tools failed while solving '{}'", model.getName(), error);
            return SolverOutcome.failed(SolveStatus.ERROR, elapsedSince(startTime),
                    "Solver failure: " + error.getMessage());
        } finally {
            solver.delete();
        }
    }

    private MPVariable[] translate(MPSolver solver, LinearModel model) {
        MPVariable[] variables = new MPVariable[model.getVariableCount()];
        for (LinearModel.Variable variable : model.getVariables()) {
            variables[variable.getIndex()] = solver.makeVar(
                    toSolverBound(variable.getLower()),
                    toSolverBound(variable.getUpper()),
                    variable.isInteger(),
                    variable.getName());
        }

        for (LinearModel.Constraint constraint : model.getConstraints()) {
            MPConstraint row = solver.makeConstraint(
                    toSolverBound(constraint.getLower()),
                    toSolverBound(constraint.getUpper()),
                    constraint.getName());
            for (Map.Entry<Integer, Double> term : constraint.getCoefficients().entrySet()) {
                row.setCoefficient(variables[term.getKey()], term.getValue());
            }
        }

        MPObjective objective = solver.objective();
        for (Map.Entry<Integer, Double> term : model.getObjective().entrySet()) {
            objective.setCoefficient(variables[term.getKey()], term.getValue());
        }
        objective.setOffset(model.getObjectiveOffset());
        objective.setMinimization();

        return variables;
    }

    private static double toSolverBound(double bound) {
        if (bound == Double.POSITIVE_INFINITY) return MPSolver.infinity();
        if (bound == Double.NEGATIVE_INFINITY) return -MPSolver.infinity();
        return bound;
    }

    static SolveStatus mapStatus(MPSolver.ResultStatus status) {
        switch (status) {
            case OPTIMAL:
                return SolveStatus.OPTIMAL;
            case FEASIBLE:
                return SolveStatus.FEASIBLE;
            case INFEASIBLE:
                return SolveStatus.INFEASIBLE;
            case UNBOUNDED:
                return SolveStatus.UNBOUNDED;
            default:
                // ABNORMAL, MODEL_INVALID, NOT_SOLVED (time limit without incumbent)
                return SolveStatus.ERROR;
        }
    }

    private static void ensureNativesLoaded() {
        if (!nativesLoaded) {
            synchronized (OrToolsMilpSolver.class) {
                if (!nativesLoaded) {
                    Loader.loadNativeLibraries();
                    nativesLoaded = true;
                    logger.info("OR-Tools native libraries loaded");
                }
            }
        }
    }

    private static long elapsedSince(long startTime) {
        return System.currentTimeMillis() - startTime;
    }
}
