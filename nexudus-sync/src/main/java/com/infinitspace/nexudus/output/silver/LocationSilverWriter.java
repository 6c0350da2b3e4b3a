package com.infinitspace.nexudus.output.silver;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.infinitspace.nexudus.model.NexudusEntity;
import com.infinitspace.nexudus.model.silver.LocationHoursRow;
import com.infinitspace.nexudus.model.silver.LocationRow;
import com.infinitspace.nexudus.output.SqlClient;
import com.infinitspace.nexudus.run.RunTracker;
import com.infinitspace.nexudus.transform.EntityTransformer;
import com.infinitspace.nexudus.transform.LocationTransformer;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * silver.nexudus_locations plus the seven silver.nexudus_location_hours rows per location.
 */
@Component
public class LocationSilverWriter extends AbstractSilverWriter<LocationRow> {

    private static final MergeStatement LOCATION_MERGE = MergeStatement.onSourceId(
            "silver.nexudus_locations",
            List.of("bronze_id", "sync_run_id", "nexudus_uuid", "name", "web_address",
                    "address", "postal_code", "city", "state", "country_name", "country_id",
                    "latitude", "longitude", "phone", "email", "web_contact", "currency_code",
                    "description", "short_intro", "created_on", "updated_on"));

    private static final MergeStatement HOURS_MERGE = MergeStatement.on(
            "silver.nexudus_location_hours",
            List.of(new MergeStatement.KeyColumn("location_source_id", "BIGINT"),
                    new MergeStatement.KeyColumn("day_of_week", "INT")),
            List.of("day_name", "is_closed", "open_time", "close_time"));

    private final LocationTransformer transformer;

    public LocationSilverWriter(SqlClient sqlClient, ObjectMapper objectMapper, LocationTransformer transformer) {
        super(sqlClient, objectMapper);
        this.transformer = transformer;
    }

    @Override
    public NexudusEntity entity() {
        return NexudusEntity.LOCATIONS;
    }

    @Override
    protected EntityTransformer<LocationRow> transformer() {
        return transformer;
    }

    @Override
    protected void upsert(LocationRow r) {
        sqlClient.executeNonQuery(LOCATION_MERGE.sql(), LOCATION_MERGE.bind(
                new Object[]{r.getSourceId()},
                new Object[]{r.getBronzeId(), r.getSyncRunId(), r.getNexudusUuid(), r.getName(),
                        r.getWebAddress(), r.getAddress(), r.getPostalCode(), r.getCity(), r.getState(),
                        r.getCountryName(), r.getCountryId(), r.getLatitude(), r.getLongitude(),
                        r.getPhone(), r.getEmail(), r.getWebContact(), r.getCurrencyCode(),
                        r.getDescription(), r.getShortIntro(), r.getCreatedOn(), r.getUpdatedOn()}));
    }

    @Override
    protected int writeSatellites(JsonNode raw, RunTracker run) {
        List<LocationHoursRow> hours = transformer.transformHours(raw).orElse(List.of());
        for (LocationHoursRow h : hours) {
            sqlClient.executeNonQuery(HOURS_MERGE.sql(), HOURS_MERGE.bind(
                    new Object[]{h.getLocationSourceId(), h.getDayOfWeek()},
                    new Object[]{h.getDayName(), h.getIsClosed(), h.getOpenTime(), h.getCloseTime()}));
        }
        return hours.size();
    }
}
