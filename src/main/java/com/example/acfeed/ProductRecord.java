package com.example.acfeed;

import java.util.ArrayList;
import java.util.List;

/**
 * One air-conditioning unit as listed by the storefront. Text fields start out empty and stay
 * empty when the listing doesn't show them.
 */
public class ProductRecord {
    public String name = "";
    public String manufacturer = "";

    // unique per product, also the export file name
    public String productCode = "";
    public String productUrl = "";

    public String resellerProductPageUrl = "";
    public String manufacturerProductPageUrl = "";

    public String listingImagePath = "";
    public String listingImageUrl = "";

    public float price;
    public Currency currency = Currency.RON;

    public boolean hasWifiConnection;
    public String mainsVoltage = "";
    // main dimension when checking whether the unit fits a mounting place
    public String internalUnitLength = "";

    public String heatingNoiseLevel = "";
    public String coolingNoiseLevel = "";

    public String heatingEnergyClass = "";
    public String coolingEnergyClass = "";

    public String heatingBtuCapacity = "";
    public String coolingBtuCapacity = "";

    /** Root to leaf, e.g. {@code ["Rezidential", "Aer conditionat", "Caseta"]}. */
    public List<String> categoryDrillDown = new ArrayList<>();

    public ProductRecord() {
    }

    @Override
    public String toString() {
        return "ProductRecord{" +
               "name='" + name + '\'' +
               ", manufacturer='" + manufacturer + '\'' +
               ", productCode='" + productCode + '\'' +
               ", productUrl='" + productUrl + '\'' +
               ", listingImageUrl='" + listingImageUrl + '\'' +
               ", price=" + price + " " + currency +
               ", hasWifiConnection=" + hasWifiConnection +
               ", mainsVoltage='" + mainsVoltage + '\'' +
               ", internalUnitLength='" + internalUnitLength + '\'' +
               ", heatingNoiseLevel='" + heatingNoiseLevel + '\'' +
               ", coolingNoiseLevel='" + coolingNoiseLevel + '\'' +
               ", heatingEnergyClass='" + heatingEnergyClass + '\'' +
               ", coolingEnergyClass='" + coolingEnergyClass + '\'' +
               ", heatingBtuCapacity='" + heatingBtuCapacity + '\'' +
               ", coolingBtuCapacity='" + coolingBtuCapacity + '\'' +
               ", categoryDrillDown=" + categoryDrillDown +
               '}';
    }
}
