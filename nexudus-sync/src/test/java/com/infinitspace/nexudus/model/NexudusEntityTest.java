package com.infinitspace.nexudus.model;

import org.junit.jupiter.api.Test;

import static com.infinitspace.nexudus.support.Payloads.json;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class NexudusEntityTest {

    @Test
    void routingValues_ProductsComeFromThePayload() {
        Object[] values = NexudusEntity.PRODUCTS.routingValues(
                json("{\"Id\": 1, \"FloorPlanBusinessId\": \"1001\", \"ItemType\": 5}"), RoutingContext.none());

        assertThat(values).containsExactly(1001L, 5);
    }

    @Test
    void routingValues_ResourcesComeFromTheCaller() {
        Object[] values = NexudusEntity.RESOURCES.routingValues(
                json("{\"Id\": 88, \"BusinessId\": 5}"), RoutingContext.forLocation(1001L));

        assertThat(values).containsExactly(1001L);
    }

    @Test
    void routingValues_NullContextTreatedAsNone() {
        Object[] values = NexudusEntity.CONTRACTS.routingValues(json("{\"Id\": 1}"), null);

        assertThat(values).containsExactly(null, null);
    }

    @Test
    void naturalId_ContractsAcceptLowercaseId() {
        assertThat(NexudusEntity.CONTRACTS.naturalId(json("{\"id\": 12}"))).isEqualTo(12L);
        assertThatThrownBy(() -> NexudusEntity.LOCATIONS.naturalId(json("{\"id\": 12}")))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("locations");
    }

    @Test
    void naturalIdOrNull_MissingId_ReturnsNull() {
        assertThat(NexudusEntity.PRODUCTS.naturalIdOrNull(json("{\"Name\": \"Office\"}"))).isNull();
        assertThat(NexudusEntity.CONTRACTS.naturalIdOrNull(json("{\"id\": \"12\"}"))).isEqualTo(12L);
    }
}
