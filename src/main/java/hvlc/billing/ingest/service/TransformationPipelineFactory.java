package hvlc.billing.ingest.service;

import hvlc.billing.ingest.model.CanonicalSchema;
import hvlc.billing.ingest.transformer.AddConstantRule;
import hvlc.billing.ingest.transformer.DateFormatRule;
import hvlc.billing.ingest.transformer.ForwardFillRule;
import hvlc.billing.ingest.transformer.MergeColumnsRule;
import hvlc.billing.ingest.transformer.NumberFormatRule;
import hvlc.billing.ingest.transformer.RenameColumnsRule;
import hvlc.billing.ingest.transformer.TransformationRule;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

import static hvlc.billing.ingest.model.CanonicalSchema.CASH_APPLIED;
import static hvlc.billing.ingest.model.CanonicalSchema.INSURANCE_PAYMENT;
import static hvlc.billing.ingest.model.CanonicalSchema.PATIENT_ID;
import static hvlc.billing.ingest.model.CanonicalSchema.PAYER_NAME;
import static hvlc.billing.ingest.model.CanonicalSchema.PAYMENT_TYPE;
import static hvlc.billing.ingest.model.CanonicalSchema.PROVIDER_NAME;
import static hvlc.billing.ingest.model.CanonicalSchema.TRANSACTION_DATE;
import static hvlc.billing.ingest.model.CanonicalSchema.TRANSACTION_ID;

/**
 * Holds the curated rule pipeline of every report format.
 *
 * Built-in pipelines:
 * - credit_card_payment: settlement exports, one row per card transaction
 * - insurance_claims: check/ERA exports, payment split over Cash Applied and Check Amount
 * - hendersonville_payments: continuation exports where only the first row of
 *   a check carries the shared fields
 *
 * Further pipelines can be registered at runtime. A format with a registry
 * profile but no pipeline can be detected, not transformed.
 */
@Service
@Slf4j
public class TransformationPipelineFactory {

    public static final String CREDIT_CARD_PAYMENT = FormatRegistry.CREDIT_CARD_PAYMENT;
    public static final String INSURANCE_CLAIMS = FormatRegistry.INSURANCE_CLAIMS;
    public static final String HENDERSONVILLE_PAYMENTS = "hendersonville_payments";

    public static final String POSTED_DATE = "posted_date";
    public static final String CHECK_NUMBER = "check_number";
    public static final String REFERENCE = "reference";
    public static final String CHECK_AMOUNT = "check_amount";

    // format name -> ordered rules
    private final Map<String, List<TransformationRule>> pipelines = new ConcurrentHashMap<>();

    public TransformationPipelineFactory() {
        pipelines.put(CREDIT_CARD_PAYMENT, creditCardPipeline());
        pipelines.put(INSURANCE_CLAIMS, insuranceClaimsPipeline());
        pipelines.put(HENDERSONVILLE_PAYMENTS, hendersonvillePipeline());
        log.info("Registered built-in transformation pipelines: {}", pipelines.keySet());
    }

    /**
     * @return the pipeline for the format, empty if none is registered
     */
    public Optional<List<TransformationRule>> getPipeline(String formatName) {
        if (formatName == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(pipelines.get(formatName));
    }

    public boolean hasPipeline(String formatName) {
        return formatName != null && pipelines.containsKey(formatName);
    }

    public List<String> getPipelineNames() {
        return new ArrayList<>(pipelines.keySet());
    }

    /**
     * Add or replace the pipeline of a format.
     *
     * @throws IllegalArgumentException if the name is blank or the rule list empty
     */
    public void registerPipeline(String formatName, List<TransformationRule> rules) {
        if (formatName == null || formatName.trim().isEmpty()) {
            throw new IllegalArgumentException("Pipeline format name must not be empty");
        }
        if (rules == null || rules.isEmpty()) {
            throw new IllegalArgumentException("Pipeline for " + formatName + " must have at least one rule");
        }
        boolean replaced = pipelines.put(formatName, List.copyOf(rules)) != null;
        log.info("{} transformation pipeline for {} ({} rules)",
                replaced ? "Replaced" : "Registered", formatName, rules.size());
    }

    private List<TransformationRule> creditCardPipeline() {
        Map<String, String> renames = new LinkedHashMap<>();
        renames.put("Trans. #", TRANSACTION_ID);
        renames.put("Trans. Date", TRANSACTION_DATE);
        renames.put("Gross Amt", CASH_APPLIED);
        renames.put("Acct Type", PAYMENT_TYPE);
        renames.put("Client Name", PATIENT_ID);
        renames.put("Provider", PROVIDER_NAME);

        return List.of(
                new RenameColumnsRule(renames),
                new DateFormatRule(List.of(TRANSACTION_DATE)),
                new NumberFormatRule(List.of(CASH_APPLIED)),
                new AddConstantRule(PAYMENT_TYPE, "credit_card"));
    }

    private List<TransformationRule> insuranceClaimsPipeline() {
        Map<String, String> renames = new LinkedHashMap<>();
        renames.put("RowId", TRANSACTION_ID);
        renames.put("Check Date", TRANSACTION_DATE);
        renames.put("Check Amount", INSURANCE_PAYMENT);
        renames.put("Cash Applied", CASH_APPLIED);
        renames.put("Payment From", PAYER_NAME);
        renames.put("Provider", PROVIDER_NAME);

        return List.of(
                new RenameColumnsRule(renames),
                new DateFormatRule(List.of(TRANSACTION_DATE)),
                new NumberFormatRule(List.of(CASH_APPLIED, INSURANCE_PAYMENT)),
                new MergeColumnsRule(List.of(CASH_APPLIED, INSURANCE_PAYMENT), CASH_APPLIED),
                new AddConstantRule(PAYMENT_TYPE, "insurance"));
    }

    private List<TransformationRule> hendersonvillePipeline() {
        Map<String, String> renames = new LinkedHashMap<>();
        renames.put("Check Date", TRANSACTION_DATE);
        renames.put("Date Posted", POSTED_DATE);
        renames.put("Check Number", CHECK_NUMBER);
        renames.put("Payment From", PAYER_NAME);
        renames.put("Reference", REFERENCE);
        renames.put("Check Amount", CHECK_AMOUNT);
        renames.put("Cash Applied", CASH_APPLIED);
        renames.put("Provider", PROVIDER_NAME);

        return List.of(
                new RenameColumnsRule(renames),
                new DateFormatRule(List.of(TRANSACTION_DATE, POSTED_DATE)),
                new NumberFormatRule(List.of(CHECK_AMOUNT, CASH_APPLIED)),
                new ForwardFillRule(List.of(TRANSACTION_DATE, POSTED_DATE, CHECK_NUMBER,
                        PAYER_NAME, PROVIDER_NAME, CHECK_AMOUNT)),
                new MergeColumnsRule(List.of(CASH_APPLIED, CHECK_AMOUNT), CASH_APPLIED),
                new AddConstantRule(CanonicalSchema.PAYMENT_TYPE, "insurance"));
    }
}
