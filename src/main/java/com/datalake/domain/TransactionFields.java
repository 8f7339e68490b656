package com.datalake.domain;

import java.util.List;

/**
 * Column names of the cleaned transaction records produced by the ingestion pipeline.
 */
public final class TransactionFields {

    public static final String TRANSACTION_ID = "TRANSACTION_ID";
    public static final String TIMESTAMP = "TIMESTAMP";
    public static final String USER_ID = "USER_ID";
    public static final String USER_NAME = "USER_NAME";
    public static final String PRODUCT_ID = "PRODUCT_ID";
    public static final String AMOUNT_USD = "AMOUNT_USD";
    public static final String CURRENCY = "CURRENCY";
    public static final String TRANSACTION_TYPE = "TRANSACTION_TYPE";
    public static final String STATUS = "STATUS";
    public static final String LOCATION_CITY = "LOCATION_CITY";
    public static final String LOCATION_COUNTRY = "LOCATION_COUNTRY";
    public static final String PAYMENT_METHOD = "PAYMENT_METHOD";
    public static final String PRODUCT_CATEGORY = "PRODUCT_CATEGORY";
    public static final String QUANTITY = "QUANTITY";
    public static final String DEVICE_OS = "DEVICE_OS";
    public static final String CUSTOMER_RATING = "CUSTOMER_RATING";
    public static final String DISCOUNT_CODE = "DISCOUNT_CODE";
    public static final String TAX_AMOUNT = "TAX_AMOUNT";
    public static final String TIMESTAMP_OF_RECEPTION_LOG = "TIMESTAMP_OF_RECEPTION_LOG";

    /**
     * Timestamp columns rewritten by the normalizer, event time first
     */
    public static final List<String> TIMESTAMP_FIELDS = List.of(TIMESTAMP, TIMESTAMP_OF_RECEPTION_LOG);

    public static final String TYPE_PURCHASE = "purchase";
    public static final String TYPE_PAYMENT = "payment";

    private TransactionFields() {
    }
}
