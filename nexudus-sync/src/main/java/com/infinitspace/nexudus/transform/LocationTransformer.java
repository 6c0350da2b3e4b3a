package com.infinitspace.nexudus.transform;

import com.fasterxml.jackson.databind.JsonNode;
import com.infinitspace.nexudus.model.silver.LocationHoursRow;
import com.infinitspace.nexudus.model.silver.LocationRow;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static com.infinitspace.nexudus.transform.PayloadValues.*;

/**
 * Maps a Nexudus business to a silver location row and its seven opening-hours rows.
 * Non-physical businesses (see {@link ExcludedLocations}) produce neither.
 */
@Component
public class LocationTransformer implements EntityTransformer<LocationRow> {

    private static final String[] DAY_NAMES = {
            "Monday", "Tuesday", "Wednesday", "Thursday", "Friday", "Saturday", "Sunday"
    };

    @Override
    public Optional<LocationRow> transform(JsonNode raw, long bronzeId, String syncRunId) {
        long sourceId = requireLong(raw, "Id");
        if (ExcludedLocations.contains(sourceId)) {
            return Optional.empty();
        }

        String name = firstText(raw.get("Name"), raw.get("ToStringText"));

        return Optional.of(LocationRow.builder()
                .sourceId(sourceId)
                .bronzeId(bronzeId)
                .syncRunId(syncRunId)
                .nexudusUuid(str(raw.get("UniqueId")))
                .name(name != null ? name : "Unknown")
                .webAddress(str(raw.get("WebAddress")))
                .address(str(raw.get("Address")))
                .postalCode(str(raw.get("PostalCode")))
                .city(str(raw.get("TownCity")))
                .state(str(raw.get("State")))
                .countryName(str(raw.get("CountryName")))
                .countryId(toInt(raw.get("CountryId")))
                .latitude(toDouble(raw.get("Latitude")))
                .longitude(toDouble(raw.get("Longitude")))
                .phone(str(raw.get("Phone")))
                .email(str(raw.get("EmailContact")))
                .webContact(str(raw.get("WebContact")))
                .currencyCode(str(raw.get("CurrencyCode")))
                .description(stripHtml(raw.get("AboutUs")))
                .shortIntro(stripHtml(raw.get("ShortIntroduction")))
                .createdOn(dateTime(raw.get("CreatedOn")))
                .updatedOn(dateTime(raw.get("UpdatedOn")))
                .build());
    }

    /**
     * One row per weekday, Monday first. Times are minutes since midnight;
     * Nexudus sends 0/0 for "not set", which becomes null/null.
     */
    public Optional<List<LocationHoursRow>> transformHours(JsonNode raw) {
        long sourceId = requireLong(raw, "Id");
        if (ExcludedLocations.contains(sourceId)) {
            return Optional.empty();
        }

        List<LocationHoursRow> rows = new ArrayList<>(DAY_NAMES.length);
        for (int i = 0; i < DAY_NAMES.length; i++) {
            String day = DAY_NAMES[i];
            Integer open = toInt(raw.get(day + "OpenTime"));
            Integer close = toInt(raw.get(day + "CloseTime"));
            if (Integer.valueOf(0).equals(open) && Integer.valueOf(0).equals(close)) {
                open = null;
                close = null;
            }
            rows.add(LocationHoursRow.builder()
                    .locationSourceId(sourceId)
                    .dayOfWeek(i + 1)
                    .dayName(day)
                    .isClosed(bitOrZero(raw.get(day + "Closed")))
                    .openTime(open)
                    .closeTime(close)
                    .build());
        }
        return Optional.of(rows);
    }
}
