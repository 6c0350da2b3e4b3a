package com.infinitspace.nexudus.transform;

import com.fasterxml.jackson.databind.JsonNode;
import com.infinitspace.nexudus.model.silver.ResourceRow;
import org.springframework.stereotype.Component;

import java.util.Optional;

import static com.infinitspace.nexudus.transform.PayloadValues.*;

@Component
public class ResourceTransformer implements EntityTransformer<ResourceRow> {

    @Override
    public Optional<ResourceRow> transform(JsonNode raw, long bronzeId, String syncRunId) {
        return Optional.of(ResourceRow.builder()
                .sourceId(requireLong(raw, "Id"))
                .bronzeId(bronzeId)
                .syncRunId(syncRunId)
                .locationSourceId(toLong(raw.get("BusinessId")))
                .nexudusUuid(str(raw.get("UniqueId")))
                .name(str(raw.get("Name")))
                .description(str(raw.get("Description")))
                .resourceTypeId(toLong(raw.get("ResourceTypeId")))
                .resourceTypeName(str(raw.get("ResourceTypeName")))
                .groupId(toLong(raw.get("GroupId")))
                .groupName(str(raw.get("GroupName")))
                .visible(bitOrZero(raw.get("Visible")))
                .online(bitOrZero(raw.get("Online")))
                .visibleToOthers(bitOrZero(raw.get("VisibleToOthers")))
                .available(bitOrZero(raw.get("Available")))
                .capacity(toInt(raw.get("Capacity")))
                .size(decimal(raw.get("Size")))
                .floorNumber(toInt(raw.get("FloorNumber")))
                .accessible(bitOrZero(raw.get("Accessible")))
                .createdOn(dateTime(raw.get("CreatedOn")))
                .updatedOn(dateTime(raw.get("UpdatedOn")))
                .build());
    }
}
