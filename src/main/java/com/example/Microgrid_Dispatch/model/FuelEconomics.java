package com.example.Microgrid_Dispatch.model;

/**
 * Diesel fuel curve and carbon pricing.
 *
 * Fuel burn is modelled as an affine curve: {@code intercept [L/h]} whenever
 * the generator runs plus {@code slope [L/kWh]} per unit of output. Carbon is
 * priced per litre burned through a fixed intensity.
 */
public class FuelEconomics {

    public static final double DIESEL_CARBON_INTENSITY_TONNES_PER_LITRE = 0.00268;

    private final double fuelPricePerLitre;
    private final double slopeLitresPerKWh;
    private final double interceptLitresPerHour;
    private final double carbonTaxPerTonne;
    private final double carbonIntensityTonnesPerLitre;

    public FuelEconomics(double fuelPricePerLitre, double slopeLitresPerKWh,
                         double interceptLitresPerHour, double carbonTaxPerTonne) {
        this(fuelPricePerLitre, slopeLitresPerKWh, interceptLitresPerHour, carbonTaxPerTonne,
                DIESEL_CARBON_INTENSITY_TONNES_PER_LITRE);
    }

    public FuelEconomics(double fuelPricePerLitre, double slopeLitresPerKWh, double interceptLitresPerHour,
                         double carbonTaxPerTonne, double carbonIntensityTonnesPerLitre) {
        this.fuelPricePerLitre = fuelPricePerLitre;
        this.slopeLitresPerKWh = slopeLitresPerKWh;
        this.interceptLitresPerHour = interceptLitresPerHour;
        this.carbonTaxPerTonne = carbonTaxPerTonne;
        this.carbonIntensityTonnesPerLitre = carbonIntensityTonnesPerLitre;
    }

    /** Carbon cost per litre burned. */
    public double getCarbonCostPerLitre() {
        return carbonIntensityTonnesPerLitre * carbonTaxPerTonne;
    }

    public double getFuelCostPerKWh() {
        return slopeLitresPerKWh * fuelPricePerLitre;
    }

    public double getCarbonTaxPerKWh() {
        return slopeLitresPerKWh * getCarbonCostPerLitre();
    }

    /** Fuel plus carbon cost of the curve intercept, charged per running hour. */
    public double getNoLoadCostPerHour() {
        return interceptLitresPerHour * (fuelPricePerLitre + getCarbonCostPerLitre());
    }

    public double getFuelPricePerLitre() { return fuelPricePerLitre; }
    public double getSlopeLitresPerKWh() { return slopeLitresPerKWh; }
    public double getInterceptLitresPerHour() { return interceptLitresPerHour; }
    public double getCarbonTaxPerTonne() { return carbonTaxPerTonne; }
    public double getCarbonIntensityTonnesPerLitre() { return carbonIntensityTonnesPerLitre; }

    @Override
    public String toString() {
        return String.format("FuelEconomics{price=%.2f/L, slope=%.3fL/kWh, intercept=%.1fL/h, carbonTax=%.1f/t}",
                fuelPricePerLitre, slopeLitresPerKWh, interceptLitresPerHour, carbonTaxPerTonne);
    }
}
