package com.infinitspace.nexudus.output.silver;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.infinitspace.nexudus.model.NexudusEntity;
import com.infinitspace.nexudus.model.silver.ExtraServiceRow;
import com.infinitspace.nexudus.output.SqlClient;
import com.infinitspace.nexudus.transform.EntityTransformer;
import com.infinitspace.nexudus.transform.ExtraServiceTransformer;
import org.springframework.stereotype.Component;

import java.util.List;

@Component
public class ExtraServiceSilverWriter extends AbstractSilverWriter<ExtraServiceRow> {

    private static final MergeStatement MERGE = MergeStatement.onSourceId(
            "silver.nexudus_extra_services",
            List.of("unique_id", "bronze_id", "sync_run_id", "location_source_id", "name", "description",
                    "price", "currency_code", "charge_period", "credit_price", "fixed_cost_price",
                    "fixed_cost_length_minutes", "maximum_price", "min_length_minutes", "max_length_minutes",
                    "is_default_price", "is_printing_credit", "only_for_contacts", "only_for_members",
                    "apply_charge_to_visitors", "use_per_night_pricing", "last_minute_adjustment_type",
                    "apply_from", "apply_to", "resource_type_names",
                    "tax_rate_id", "reduced_tax_rate_id", "exempt_tax_rate_id", "financial_account_id",
                    "updated_by", "created_on", "updated_on"));

    private final ExtraServiceTransformer transformer;

    public ExtraServiceSilverWriter(SqlClient sqlClient, ObjectMapper objectMapper,
                                    ExtraServiceTransformer transformer) {
        super(sqlClient, objectMapper);
        this.transformer = transformer;
    }

    @Override
    public NexudusEntity entity() {
        return NexudusEntity.EXTRA_SERVICES;
    }

    @Override
    protected EntityTransformer<ExtraServiceRow> transformer() {
        return transformer;
    }

    @Override
    protected void upsert(ExtraServiceRow r) {
        sqlClient.executeNonQuery(MERGE.sql(), MERGE.bind(
                new Object[]{r.getSourceId()},
                new Object[]{r.getUniqueId(), r.getBronzeId(), r.getSyncRunId(), r.getLocationSourceId(),
                        r.getName(), r.getDescription(), r.getPrice(), r.getCurrencyCode(), r.getChargePeriod(),
                        r.getCreditPrice(), r.getFixedCostPrice(), r.getFixedCostLengthMinutes(),
                        r.getMaximumPrice(), r.getMinLengthMinutes(), r.getMaxLengthMinutes(),
                        r.getIsDefaultPrice(), r.getIsPrintingCredit(), r.getOnlyForContacts(),
                        r.getOnlyForMembers(), r.getApplyChargeToVisitors(), r.getUsePerNightPricing(),
                        r.getLastMinuteAdjustmentType(), r.getApplyFrom(), r.getApplyTo(),
                        r.getResourceTypeNames(), r.getTaxRateId(), r.getReducedTaxRateId(),
                        r.getExemptTaxRateId(), r.getFinancialAccountId(), r.getUpdatedBy(),
                        r.getCreatedOn(), r.getUpdatedOn()}));
    }
}
