package com.example.acfeed;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.function.BiConsumer;

/**
 * Rows of the storefront's per-product feature table ({@code table.prod-list-features}) and the
 * {@link ProductRecord} field each one fills. Labels are matched exactly, as the site prints them.
 */
public enum FeatureRow {
    PRODUCT_CODE("Cod produs:", (p, v) -> p.productCode = v),
    COOLING_CAPACITY("Capacitate racire:", (p, v) -> p.coolingBtuCapacity = v),
    HEATING_CAPACITY("Capacitate incalzire:", (p, v) -> p.heatingBtuCapacity = v),
    COOLING_ENERGY_CLASS("Clasa energetica racire:", (p, v) -> p.coolingEnergyClass = v),
    HEATING_ENERGY_CLASS("Clasa energetica incalzire:", (p, v) -> p.heatingEnergyClass = v),
    MAINS_VOLTAGE("Tensiune alimentare:", (p, v) -> p.mainsVoltage = v),
    COOLING_NOISE_LEVEL("Nivel de zgomot racire:", (p, v) -> p.coolingNoiseLevel = v),
    HEATING_NOISE_LEVEL("Nivel de zgomot incalzire:", (p, v) -> p.heatingNoiseLevel = v),
    INTERNAL_UNIT_LENGTH("Lungime unitate interna:", (p, v) -> p.internalUnitLength = v),
    WIFI_CONNECTION("Conexiune Wi-Fi:", (p, v) -> p.hasWifiConnection = isAffirmative(v));

    /**
     * First letter of "Da". Any value starting with it counts as yes, so a value such as "Disponibil
     * optional" is read as yes too.
     */
    static final String AFFIRMATIVE_PREFIX = "D";

    private static final Map<String, FeatureRow> BY_LABEL = new HashMap<>();

    static {
        for (FeatureRow row : values()) {
            BY_LABEL.put(row.label, row);
        }
    }

    private final String label;
    private final BiConsumer<ProductRecord, String> setter;

    FeatureRow(String label, BiConsumer<ProductRecord, String> setter) {
        this.label = label;
        this.setter = setter;
    }

    public void apply(ProductRecord record, String value) {
        setter.accept(record, value);
    }

    /** Unknown labels yield empty; the table may grow rows we don't map. */
    public static Optional<FeatureRow> forLabel(String label) {
        return Optional.ofNullable(BY_LABEL.get(label));
    }

    static boolean isAffirmative(String value) {
        return value != null && value.startsWith(AFFIRMATIVE_PREFIX);
    }
}
