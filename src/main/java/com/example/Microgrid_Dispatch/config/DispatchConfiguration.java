package com.example.Microgrid_Dispatch.config;

import com.example.Microgrid_Dispatch.model.AssetConfig;
import com.example.Microgrid_Dispatch.model.FormulationOptions;
import com.example.Microgrid_Dispatch.model.FuelEconomics;
import com.example.Microgrid_Dispatch.solver.MilpSolver;
import com.example.Microgrid_Dispatch.solver.OrToolsMilpSolver;
import com.example.Microgrid_Dispatch.solver.SolverOptions;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Configuration class for the Microgrid Dispatch engine
 *
 * Provides the default asset set, the solver and the sweep worker pool.
 * Default assets describe a remote northern community: 500kW diesel with a
 * 150kW stable minimum, 1MWh / 250kW battery and a 400kW solar array.
 */
@Configuration
@EnableConfigurationProperties(DispatchProperties.class)
public class DispatchConfiguration {

    /**
     * Default fuel curve: 2.20/L diesel, 0.24 L/kWh slope, 15 L/h intercept, 95/t carbon tax
     */
    @Bean
    public FuelEconomics fuelEconomics() {
        return new FuelEconomics(2.20, 0.24, 15.0, 95.0);
    }

    /**
     * Default asset configuration, used for every field a request leaves out
     */
    @Bean
    public AssetConfig defaultAssetConfig(FuelEconomics fuelEconomics) {
        return AssetConfig.builder()
                .dieselCapacityKW(500.0)
                .dieselMinLoadFraction(0.3)        // 150kW minimum stable load
                .fuelEconomics(fuelEconomics)
                .batteryCapacityKWh(1000.0)
                .batteryPowerKW(250.0)
                .batteryRoundTripEfficiency(0.95)
                .batteryInitialSoCKWh(500.0)       // start half full
                .curtailmentPenaltyPerKWh(0.01)
                .build();
    }

    @Bean
    public FormulationOptions formulationOptions(DispatchProperties properties) {
        return new FormulationOptions(
                properties.getFormulation().getEfficiencySplit(),
                properties.getFormulation().getSimultaneityPolicy());
    }

    @Bean
    public SolverOptions solverOptions(DispatchProperties properties) {
        return new SolverOptions(
                properties.getSolver().getRelativeGap(),
                properties.getSolver().getTimeLimit());
    }

    @Bean
    public MilpSolver milpSolver(DispatchProperties properties) {
        return new OrToolsMilpSolver(properties.getSolver().getBackend());
    }

    @Bean(destroyMethod = "shutdown")
    public ExecutorService sweepExecutor(DispatchProperties properties) {
        AtomicInteger counter = new AtomicInteger();
        ThreadFactory threadFactory = runnable -> {
            Thread thread = new Thread(runnable, "dispatch-sweep-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
        return Executors.newFixedThreadPool(properties.getSweep().getWorkerThreads(), threadFactory);
    }
}
