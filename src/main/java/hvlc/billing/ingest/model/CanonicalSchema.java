package hvlc.billing.ingest.model;

import java.util.List;

/**
 * The normalized transaction shape every report format converges to.
 * Downstream import expects exactly these columns in this order.
 */
public final class CanonicalSchema {

    public static final String TRANSACTION_ID = "transaction_id";
    public static final String TRANSACTION_DATE = "transaction_date";
    public static final String PATIENT_ID = "patient_id";
    public static final String PROVIDER_ID = "provider_id";
    public static final String PROVIDER_NAME = "provider_name";
    public static final String CASH_APPLIED = "cash_applied";
    public static final String INSURANCE_PAYMENT = "insurance_payment";
    public static final String PATIENT_PAYMENT = "patient_payment";
    public static final String ADJUSTMENT_AMOUNT = "adjustment_amount";
    public static final String PAYER_NAME = "payer_name";
    public static final String PAYMENT_TYPE = "payment_type";
    public static final String CLAIM_NUMBER = "claim_number";
    public static final String CPT_CODE = "cpt_code";
    public static final String DIAGNOSIS_CODE = "diagnosis_code";
    public static final String SERVICE_DATE = "service_date";
    public static final String NOTES = "notes";

    public static final List<String> COLUMNS = List.of(
            TRANSACTION_ID, TRANSACTION_DATE, PATIENT_ID, PROVIDER_ID,
            PROVIDER_NAME, CASH_APPLIED, INSURANCE_PAYMENT, PATIENT_PAYMENT,
            ADJUSTMENT_AMOUNT, PAYER_NAME, PAYMENT_TYPE, CLAIM_NUMBER,
            CPT_CODE, DIAGNOSIS_CODE, SERVICE_DATE, NOTES);

    /** Columns that must hold a value on every transformed row. */
    public static final List<String> REQUIRED_COLUMNS = List.of(TRANSACTION_DATE, CASH_APPLIED, PROVIDER_NAME);

    public static final List<String> DATE_COLUMNS = List.of(TRANSACTION_DATE, SERVICE_DATE);

    private CanonicalSchema() {
    }
}
