package com.example.Microgrid_Dispatch.service;

import com.example.Microgrid_Dispatch.exception.InfeasibleModelException;
import com.example.Microgrid_Dispatch.exception.SolverFailureException;
import com.example.Microgrid_Dispatch.model.AssetConfig;
import com.example.Microgrid_Dispatch.model.DispatchResult;
import com.example.Microgrid_Dispatch.model.DispatchSummary;
import com.example.Microgrid_Dispatch.model.FormulationOptions;
import com.example.Microgrid_Dispatch.model.HorizonInput;
import com.example.Microgrid_Dispatch.solver.SolverOptions;
import com.example.Microgrid_Dispatch.solver.SolverOutcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Hourly dispatch optimisation pipeline
 *
 * validate inputs -> build MILP -> solve -> extract and check schedule
 *
 * Design decisions:
 * - One synchronous run per call; no state is kept between runs, so the
 *   optimizer is safe to call from any number of threads
 * - Solver outcomes are mapped onto the exception hierarchy here and nowhere
 *   else: INFEASIBLE becomes {@link InfeasibleModelException} with diagnosed
 *   causes, UNBOUNDED and persistent ERROR become {@link SolverFailureException}
 * - A time-limited FEASIBLE solve is returned as a result with a warning
 */
@Service
public class DispatchOptimizer {

    private static final Logger logger = LoggerFactory.getLogger(DispatchOptimizer.class);

    private final InputValidator inputValidator;
    private final DispatchModelBuilder modelBuilder;
    private final SolverAdapter solverAdapter;
    private final ResultExtractor resultExtractor;
    private final InfeasibilityDiagnostics diagnostics;
    private final FormulationOptions defaultFormulation;
    private final SolverOptions defaultSolverOptions;

    public DispatchOptimizer(InputValidator inputValidator,
                             DispatchModelBuilder modelBuilder,
                             SolverAdapter solverAdapter,
                             ResultExtractor resultExtractor,
                             InfeasibilityDiagnostics diagnostics,
                             FormulationOptions defaultFormulation,
                             SolverOptions defaultSolverOptions) {
        this.inputValidator = inputValidator;
        this.modelBuilder = modelBuilder;
        this.solverAdapter = solverAdapter;
        this.resultExtractor = resultExtractor;
        this.diagnostics = diagnostics;
        this.defaultFormulation = defaultFormulation;
        this.defaultSolverOptions = defaultSolverOptions;
    }

    /**
     * Optimise one horizon with the configured formulation and solver limits.
     */
    public DispatchResult optimize(HorizonInput horizon, AssetConfig config) {
        return optimize(horizon, config, defaultFormulation, defaultSolverOptions);
    }

    /**
     * Optimise one horizon.
     *
     * @throws com.example.Microgrid_Dispatch.exception.DispatchConfigurationException on invalid inputs
     * @throws InfeasibleModelException when no dispatch satisfies the constraints
     * @throws SolverFailureException on an unbounded model or a solver error that survived the retry
     * @throws com.example.Microgrid_Dispatch.exception.InternalConsistencyException when the solved schedule breaks a physical invariant
     */
    public DispatchResult optimize(HorizonInput horizon, AssetConfig config,
                                   FormulationOptions formulation, SolverOptions solverOptions) {
        long startTime = System.currentTimeMillis();

        inputValidator.validate(horizon, config);

        DispatchModel model = modelBuilder.build(horizon, config, formulation);
        SolverOutcome outcome = solverAdapter.solve(model.getLinearModel(), solverOptions);

        switch (outcome.getStatus()) {
            case INFEASIBLE: {
                List<String> causes = diagnostics.diagnose(horizon, config, formulation);
                logger.warn("Dispatch over {} hours is infeasible: {}", horizon.getHours(), causes);
                throw new InfeasibleModelException(
                        String.format("No feasible dispatch for %d-hour horizon", horizon.getHours()), causes);
            }
            case UNBOUNDED:
                logger.error("Dispatch model {} reported unbounded", model.getLinearModel());
                throw new SolverFailureException(outcome.getStatus(),
                        "Dispatch model is unbounded; this indicates a modelling defect");
            case ERROR:
                logger.error("Solver failed on {} after retry: {}", model.getLinearModel(), outcome.getMessage());
                throw new SolverFailureException(outcome.getStatus(),
                        "Solver failed: " + outcome.getMessage());
            case FEASIBLE:
                logger.warn("Solver time limit {}ms reached on {}; returning best incumbent",
                        solverOptions.getTimeLimit().toMillis(), model.getLinearModel());
                break;
            default:
                break;
        }

        DispatchResult result = resultExtractor.extract(model, outcome);
        DispatchSummary summary = result.getSummary();

        logger.info("Dispatch {}h {}: cost={} (baseline {}, savings {}), diesel {}h / {}kWh, "
                        + "solar {}kWh used, {}kWh curtailed, solve {}ms, total {}ms",
                horizon.getHours(), result.getStatus(),
                String.format("%.2f", summary.totalCost),
                String.format("%.2f", summary.baselineCost),
                String.format("%.2f", summary.savings),
                summary.dieselRunHours,
                String.format("%.1f", summary.totalDieselKWh),
                String.format("%.1f", summary.totalSolarUsedKWh),
                String.format("%.1f", summary.totalCurtailedKWh),
                result.getSolveTimeMillis(),
                System.currentTimeMillis() - startTime);

        return result;
    }
}
