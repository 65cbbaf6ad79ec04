package com.example.acfeed;

/**
 * Columns of the product-catalog import file, in file order.
 */
public enum ExportColumn {
    HANDLE("Handle"),
    TITLE("Title"),
    BODY_HTML("Body (HTML)"),
    VENDOR("Vendor"),
    TYPE("Type"),
    TAGS("Tags"),
    PUBLISHED("Published"),
    OPTION1_NAME("Option1 Name"),
    OPTION1_VALUE("Option1 Value"),
    OPTION2_NAME("Option2 Name"),
    OPTION2_VALUE("Option2 Value"),
    OPTION3_NAME("Option3 Name"),
    OPTION3_VALUE("Option3 Value"),
    VARIANT_SKU("Variant SKU"),
    VARIANT_GRAMS("Variant Grams"),
    VARIANT_INVENTORY_TRACKER("Variant Inventory Tracker"),
    VARIANT_INVENTORY_QTY("Variant Inventory Qty"),
    VARIANT_INVENTORY_POLICY("Variant Inventory Policy"),
    VARIANT_FULFILLMENT_SERVICE("Variant Fulfillment Service"),
    VARIANT_PRICE("Variant Price"),
    VARIANT_COMPARE_AT_PRICE("Variant Compare At Price"),
    VARIANT_REQUIRES_SHIPPING("Variant Requires Shipping"),
    VARIANT_TAXABLE("Variant Taxable"),
    VARIANT_BARCODE("Variant Barcode"),
    IMAGE_SRC("Image Src"),
    IMAGE_POSITION("Image Position"),
    IMAGE_ALT_TEXT("Image Alt Text"),
    GIFT_CARD("Gift Card"),
    SEO_TITLE("SEO Title"),
    SEO_DESCRIPTION("SEO Description"),
    GOOGLE_PRODUCT_CATEGORY("Google Shopping / Google Product Category"),
    GOOGLE_GENDER("Google Shopping / Gender"),
    GOOGLE_AGE_GROUP("Google Shopping / Age Group"),
    GOOGLE_MPN("Google Shopping / MPN"),
    GOOGLE_ADWORDS_GROUPING("Google Shopping / AdWords Grouping"),
    GOOGLE_ADWORDS_LABELS("Google Shopping / AdWords Labels"),
    GOOGLE_CONDITION("Google Shopping / Condition"),
    GOOGLE_CUSTOM_PRODUCT("Google Shopping / Custom Product"),
    GOOGLE_CUSTOM_LABEL_0("Google Shopping / Custom Label 0"),
    GOOGLE_CUSTOM_LABEL_1("Google Shopping / Custom Label 1"),
    GOOGLE_CUSTOM_LABEL_2("Google Shopping / Custom Label 2"),
    GOOGLE_CUSTOM_LABEL_3("Google Shopping / Custom Label 3"),
    GOOGLE_CUSTOM_LABEL_4("Google Shopping / Custom Label 4"),
    VARIANT_IMAGE("Variant Image"),
    VARIANT_WEIGHT_UNIT("Variant Weight Unit"),
    VARIANT_TAX_CODE("Variant Tax Code"),
    COST_PER_ITEM("Cost per item");

    private final String header;

    ExportColumn(String header) {
        this.header = header;
    }

    public String getHeader() {
        return header;
    }
}
