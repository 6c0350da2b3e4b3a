package com.infinitspace.nexudus.model.silver;

import lombok.Builder;
import lombok.Data;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * Typed row for silver.nexudus_resources (meeting rooms, phone booths).
 * Gives products their ResourceTypeId and GroupName.
 */
@Data
@Builder
public class ResourceRow {

    private long sourceId;
    private long bronzeId;
    private String syncRunId;

    private Long locationSourceId;
    private String nexudusUuid;
    private String name;
    private String description;
    private Long resourceTypeId;
    private String resourceTypeName;
    private Long groupId;
    private String groupName;

    private int visible;
    private int online;
    private int visibleToOthers;
    private int available;

    private Integer capacity;
    private BigDecimal size;
    private Integer floorNumber;
    private int accessible;

    private LocalDateTime createdOn;
    private LocalDateTime updatedOn;
}
