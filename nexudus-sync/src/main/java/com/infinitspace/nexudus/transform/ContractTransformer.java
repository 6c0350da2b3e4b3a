package com.infinitspace.nexudus.transform;

import com.fasterxml.jackson.databind.JsonNode;
import com.infinitspace.nexudus.model.NexudusEntity;
import com.infinitspace.nexudus.model.silver.ContractRow;
import org.springframework.stereotype.Component;

import java.util.Optional;

import static com.infinitspace.nexudus.transform.PayloadValues.*;

/**
 * Maps a Nexudus CoworkerContract to a silver contract row.
 *
 * Durations derivable from dates, always-zero desk figures, duplicate totals,
 * deposit and proposal fields are not carried.
 */
@Component
public class ContractTransformer implements EntityTransformer<ContractRow> {

    @Override
    public Optional<ContractRow> transform(JsonNode raw, long bronzeId, String syncRunId) {
        return Optional.of(ContractRow.builder()
                .sourceId(NexudusEntity.CONTRACTS.naturalId(raw))
                .uniqueId(str(raw.get("UniqueId")))
                .bronzeId(bronzeId)
                .syncRunId(syncRunId)
                .active(bitOrZero(raw.get("Active")))
                .cancelled(bitOrZero(raw.get("Cancelled")))
                .mainContract(bitOrZero(raw.get("MainContract")))
                .inPausedPeriod(bitOrZero(raw.get("InPausedPeriod")))
                .coworkerId(toLong(raw.get("CoworkerId")))
                .coworkerName(str(raw.get("CoworkerFullName")))
                .coworkerEmail(str(raw.get("CoworkerEmail")))
                .coworkerCompany(str(raw.get("CoworkerCompanyName")))
                .coworkerBillingName(str(raw.get("CoworkerBillingName")))
                .coworkerType(toInt(raw.get("CoworkerCoworkerType")))
                .coworkerActive(bit(raw.get("CoworkerActive")))
                .locationSourceId(toLong(raw.get("IssuedById")))
                .locationName(str(raw.get("IssuedByName")))
                .tariffId(toLong(raw.get("TariffId")))
                .tariffName(str(raw.get("TariffName")))
                .tariffPrice(decimal(raw.get("TariffPrice")))
                .currencyCode(str(raw.get("TariffCurrencyCode")))
                .nextTariffId(toLong(raw.get("NextTariffId")))
                .nextTariffName(str(raw.get("NextTariffName")))
                .floorPlanDeskIds(str(raw.get("FloorPlanDeskIds")))
                .floorPlanDeskNames(str(raw.get("FloorPlanDeskNames")))
                .price(decimal(raw.get("Price")))
                .priceWithProducts(decimal(raw.get("PriceWithProducts")))
                .unitPrice(decimal(raw.get("UnitPrice")))
                .quantity(toInt(raw.get("Quantity")))
                .billingDay(toInt(raw.get("BillingDay")))
                .applyProRating(bit(raw.get("ApplyProRating")))
                .proRateCancellation(bit(raw.get("ProRateCancellation")))
                .includeSignupFee(bit(raw.get("IncludeSignupFee")))
                .cancellationLimitDays(toInt(raw.get("CancellationLimitDays")))
                .startDate(dateTime(raw.get("StartDate")))
                .contractTerm(dateTime(raw.get("ContractTerm")))
                .renewalDate(dateTime(raw.get("RenewalDate")))
                .cancellationDate(dateTime(raw.get("CancellationDate")))
                .invoicedPeriod(dateTime(raw.get("InvoicedPeriod")))
                .termDurationMonths(toInt(raw.get("TermDurationInMonths")))
                .notes(str(raw.get("Notes")))
                .updatedBy(str(raw.get("UpdatedBy")))
                .createdOn(dateTime(raw.get("CreatedOn")))
                .updatedOn(dateTime(raw.get("UpdatedOn")))
                .build());
    }
}
