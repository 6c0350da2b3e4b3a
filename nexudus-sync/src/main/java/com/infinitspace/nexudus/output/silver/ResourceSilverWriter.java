package com.infinitspace.nexudus.output.silver;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.infinitspace.nexudus.model.NexudusEntity;
import com.infinitspace.nexudus.model.silver.ResourceRow;
import com.infinitspace.nexudus.output.SqlClient;
import com.infinitspace.nexudus.transform.EntityTransformer;
import com.infinitspace.nexudus.transform.ResourceTransformer;
import org.springframework.stereotype.Component;

import java.util.List;

@Component
public class ResourceSilverWriter extends AbstractSilverWriter<ResourceRow> {

    private static final MergeStatement MERGE = MergeStatement.onSourceId(
            "silver.nexudus_resources",
            List.of("bronze_id", "sync_run_id", "location_source_id", "nexudus_uuid", "name", "description",
                    "resource_type_id", "resource_type_name", "group_id", "group_name",
                    "visible", "online", "visible_to_others", "available",
                    "capacity", "size", "floor_number", "accessible", "created_on", "updated_on"));

    private final ResourceTransformer transformer;

    public ResourceSilverWriter(SqlClient sqlClient, ObjectMapper objectMapper, ResourceTransformer transformer) {
        super(sqlClient, objectMapper);
        this.transformer = transformer;
    }

    @Override
    public NexudusEntity entity() {
        return NexudusEntity.RESOURCES;
    }

    @Override
    protected EntityTransformer<ResourceRow> transformer() {
        return transformer;
    }

    @Override
    protected void upsert(ResourceRow r) {
        sqlClient.executeNonQuery(MERGE.sql(), MERGE.bind(
                new Object[]{r.getSourceId()},
                new Object[]{r.getBronzeId(), r.getSyncRunId(), r.getLocationSourceId(), r.getNexudusUuid(),
                        r.getName(), r.getDescription(), r.getResourceTypeId(), r.getResourceTypeName(),
                        r.getGroupId(), r.getGroupName(), r.getVisible(), r.getOnline(), r.getVisibleToOthers(),
                        r.getAvailable(), r.getCapacity(), r.getSize(), r.getFloorNumber(), r.getAccessible(),
                        r.getCreatedOn(), r.getUpdatedOn()}));
    }
}
