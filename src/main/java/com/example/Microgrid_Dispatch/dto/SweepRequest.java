package com.example.Microgrid_Dispatch.dto;

import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;

import java.util.List;

/**
 * Data Transfer Object for a battery capacity sweep over one horizon
 */
public class SweepRequest extends DispatchRequest {

    @NotEmpty
    public List<@NotNull Double> batteryCapacitiesKWh;

    public SweepRequest() {}
}
