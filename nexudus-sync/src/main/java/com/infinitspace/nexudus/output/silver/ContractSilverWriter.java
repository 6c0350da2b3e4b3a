package com.infinitspace.nexudus.output.silver;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.infinitspace.nexudus.model.NexudusEntity;
import com.infinitspace.nexudus.model.silver.ContractRow;
import com.infinitspace.nexudus.output.SqlClient;
import com.infinitspace.nexudus.transform.ContractTransformer;
import com.infinitspace.nexudus.transform.EntityTransformer;
import org.springframework.stereotype.Component;

import java.util.List;

@Component
public class ContractSilverWriter extends AbstractSilverWriter<ContractRow> {

    private static final MergeStatement MERGE = MergeStatement.onSourceId(
            "silver.nexudus_contracts",
            List.of("unique_id", "bronze_id", "sync_run_id",
                    "active", "cancelled", "main_contract", "in_paused_period",
                    "coworker_id", "coworker_name", "coworker_email", "coworker_company",
                    "coworker_billing_name", "coworker_type", "coworker_active",
                    "location_source_id", "location_name",
                    "tariff_id", "tariff_name", "tariff_price", "currency_code",
                    "next_tariff_id", "next_tariff_name",
                    "floor_plan_desk_ids", "floor_plan_desk_names",
                    "price", "price_with_products", "unit_price", "quantity", "billing_day",
                    "apply_pro_rating", "pro_rate_cancellation", "include_signup_fee", "cancellation_limit_days",
                    "start_date", "contract_term", "renewal_date", "cancellation_date", "invoiced_period",
                    "term_duration_months", "notes", "updated_by", "created_on", "updated_on"));

    private final ContractTransformer transformer;

    public ContractSilverWriter(SqlClient sqlClient, ObjectMapper objectMapper, ContractTransformer transformer) {
        super(sqlClient, objectMapper);
        this.transformer = transformer;
    }

    @Override
    public NexudusEntity entity() {
        return NexudusEntity.CONTRACTS;
    }

    @Override
    protected EntityTransformer<ContractRow> transformer() {
        return transformer;
    }

    @Override
    protected void upsert(ContractRow r) {
        sqlClient.executeNonQuery(MERGE.sql(), MERGE.bind(
                new Object[]{r.getSourceId()},
                new Object[]{r.getUniqueId(), r.getBronzeId(), r.getSyncRunId(),
                        r.getActive(), r.getCancelled(), r.getMainContract(), r.getInPausedPeriod(),
                        r.getCoworkerId(), r.getCoworkerName(), r.getCoworkerEmail(), r.getCoworkerCompany(),
                        r.getCoworkerBillingName(), r.getCoworkerType(), r.getCoworkerActive(),
                        r.getLocationSourceId(), r.getLocationName(),
                        r.getTariffId(), r.getTariffName(), r.getTariffPrice(), r.getCurrencyCode(),
                        r.getNextTariffId(), r.getNextTariffName(),
                        r.getFloorPlanDeskIds(), r.getFloorPlanDeskNames(),
                        r.getPrice(), r.getPriceWithProducts(), r.getUnitPrice(), r.getQuantity(), r.getBillingDay(),
                        r.getApplyProRating(), r.getProRateCancellation(), r.getIncludeSignupFee(),
                        r.getCancellationLimitDays(),
                        r.getStartDate(), r.getContractTerm(), r.getRenewalDate(), r.getCancellationDate(),
                        r.getInvoicedPeriod(),
                        r.getTermDurationMonths(), r.getNotes(), r.getUpdatedBy(), r.getCreatedOn(), r.getUpdatedOn()}));
    }
}
