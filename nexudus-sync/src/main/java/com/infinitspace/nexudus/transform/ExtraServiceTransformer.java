package com.infinitspace.nexudus.transform;

import com.fasterxml.jackson.databind.JsonNode;
import com.infinitspace.nexudus.model.silver.ExtraServiceRow;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.Optional;

import static com.infinitspace.nexudus.transform.PayloadValues.*;

/**
 * Maps a Nexudus ExtraService (day passes, room rates) to a silver row.
 *
 * Fields Nexudus always leaves null or constant (added/removed lists, price
 * factors, time slots, display order, visibility) are not carried.
 */
@Component
public class ExtraServiceTransformer implements EntityTransformer<ExtraServiceRow> {

    @Override
    public Optional<ExtraServiceRow> transform(JsonNode raw, long bronzeId, String syncRunId) {
        long sourceId = requireLong(raw, "Id");
        long locationId = requireLong(raw, "BusinessId");

        String name = firstText(raw.get("Name"), raw.get("ToStringText"));
        BigDecimal price = decimal(raw.get("Price"));

        return Optional.of(ExtraServiceRow.builder()
                .sourceId(sourceId)
                .uniqueId(str(raw.get("UniqueId")))
                .bronzeId(bronzeId)
                .syncRunId(syncRunId)
                .locationSourceId(locationId)
                .name(name != null ? name : "")
                .description(str(raw.get("Description")))
                .price(price != null ? price : BigDecimal.ZERO)
                .currencyCode(str(raw.get("CurrencyCode")))
                .chargePeriod(toInt(raw.get("ChargePeriod")))
                .creditPrice(decimal(raw.get("CreditPrice")))
                .fixedCostPrice(decimal(raw.get("FixedCostPrice")))
                .fixedCostLengthMinutes(toInt(raw.get("FixedCostLength")))
                .maximumPrice(decimal(raw.get("MaximumPrice")))
                .minLengthMinutes(toInt(raw.get("MinLength")))
                .maxLengthMinutes(toInt(raw.get("MaxLength")))
                .isDefaultPrice(bitOrZero(raw.get("IsDefaultPrice")))
                .isPrintingCredit(bitOrZero(raw.get("IsPrintingCredit")))
                .onlyForContacts(bitOrZero(raw.get("OnlyForContacts")))
                .onlyForMembers(bitOrZero(raw.get("OnlyForMembers")))
                .applyChargeToVisitors(bitOrZero(raw.get("ApplyChargeToVisitors")))
                .usePerNightPricing(bitOrZero(raw.get("UsePerNightPricing")))
                .lastMinuteAdjustmentType(toInt(raw.get("LastMinuteAdjustmentType")))
                .applyFrom(dateTime(raw.get("ApplyFrom")))
                .applyTo(dateTime(raw.get("ApplyTo")))
                .resourceTypeNames(str(raw.get("ResourceTypeNames")))
                .taxRateId(toInt(raw.get("TaxRateId")))
                .reducedTaxRateId(toInt(raw.get("ReducedTaxRateId")))
                .exemptTaxRateId(toInt(raw.get("ExemptTaxRateId")))
                .financialAccountId(toInt(raw.get("FinancialAccountId")))
                .updatedBy(str(raw.get("UpdatedBy")))
                .createdOn(dateTime(raw.get("CreatedOn")))
                .updatedOn(dateTime(raw.get("UpdatedOn")))
                .build());
    }
}
