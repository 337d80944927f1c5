package com.example.Microgrid_Dispatch.service;

import com.example.Microgrid_Dispatch.model.AssetConfig;
import com.example.Microgrid_Dispatch.model.FormulationOptions;
import com.example.Microgrid_Dispatch.model.HorizonInput;
import com.example.Microgrid_Dispatch.solver.LinearModel;

/**
 * A built dispatch MILP together with the variable layout needed to read a solution back.
 *
 * Index arrays hold, per hour, the position of each decision variable in
 * {@link #getLinearModel()}. {@code chargeMode} is {@code null} when the
 * formulation does not use a charge-mode indicator.
 */
public class DispatchModel {

    static final String BALANCE = "balance";
    static final String DIESEL_MIN = "diesel_min";
    static final String DIESEL_MAX = "diesel_max";
    static final String SOC_CONTINUITY = "soc";
    static final String CHARGE_MODE = "charge_mode";
    static final String DISCHARGE_MODE = "discharge_mode";
    static final String TERMINAL_SOC = "terminal_soc";

    private final LinearModel linearModel;
    private final HorizonInput horizon;
    private final AssetConfig config;
    private final FormulationOptions options;
    private final double chargeEfficiency;
    private final double dischargeEfficiency;

    final int[] dieselOutput;
    final int[] dieselOn;
    final int[] batteryCharge;
    final int[] batteryDischarge;
    final int[] solarUsed;
    final int[] soc;
    final int[] chargeMode;

    DispatchModel(LinearModel linearModel, HorizonInput horizon, AssetConfig config, FormulationOptions options,
                  double chargeEfficiency, double dischargeEfficiency,
                  int[] dieselOutput, int[] dieselOn, int[] batteryCharge, int[] batteryDischarge,
                  int[] solarUsed, int[] soc, int[] chargeMode) {
        this.linearModel = linearModel;
        this.horizon = horizon;
        this.config = config;
        this.options = options;
        this.chargeEfficiency = chargeEfficiency;
        this.dischargeEfficiency = dischargeEfficiency;
        this.dieselOutput = dieselOutput;
        this.dieselOn = dieselOn;
        this.batteryCharge = batteryCharge;
        this.batteryDischarge = batteryDischarge;
        this.solarUsed = solarUsed;
        this.soc = soc;
        this.chargeMode = chargeMode;
    }

    static String rowName(String family, int hour) {
        return family + "_" + hour;
    }

    public LinearModel getLinearModel() { return linearModel; }
    public HorizonInput getHorizon() { return horizon; }
    public AssetConfig getConfig() { return config; }
    public FormulationOptions getOptions() { return options; }
    public double getChargeEfficiency() { return chargeEfficiency; }
    public double getDischargeEfficiency() { return dischargeEfficiency; }

    public int getHours() {
        return horizon.getHours();
    }

    public int dieselOutputVar(int hour) { return dieselOutput[hour]; }
    public int dieselOnVar(int hour) { return dieselOn[hour]; }
    public int batteryChargeVar(int hour) { return batteryCharge[hour]; }
    public int batteryDischargeVar(int hour) { return batteryDischarge[hour]; }
    public int solarUsedVar(int hour) { return solarUsed[hour]; }
    public int socVar(int hour) { return soc[hour]; }

    public boolean hasChargeModeIndicator() {
        return chargeMode != null;
    }

    public int chargeModeVar(int hour) {
        if (chargeMode == null) {
            throw new IllegalStateException("Formulation has no charge-mode indicator");
        }
        return chargeMode[hour];
    }
}
