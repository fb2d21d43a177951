package com.fieldforce.fieldexecutionbackend.store;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fieldforce.fieldexecutionbackend.config.RedisConfig;
import com.fieldforce.fieldexecutionbackend.model.MediaRef;
import com.fieldforce.fieldexecutionbackend.model.ProgressRecord;
import com.fieldforce.fieldexecutionbackend.model.UnitKind;
import com.fieldforce.fieldexecutionbackend.model.result.ActivityResult;
import com.fieldforce.fieldexecutionbackend.model.result.OpaqueResult;
import com.fieldforce.fieldexecutionbackend.model.result.OrderResult;
import com.fieldforce.fieldexecutionbackend.model.result.StockCountResult;
import org.junit.jupiter.api.Test;
import org.springframework.data.redis.serializer.Jackson2JsonRedisSerializer;

import java.time.LocalDateTime;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ProgressRecordSerializationTest {

    @Test
    void testRecordSurvivesRedisSerializer() {
        Jackson2JsonRedisSerializer<ProgressRecord> serializer = RedisConfig.progressRecordSerializer();
        ProgressRecord record = new ProgressRecord("VISIT-1", UnitKind.VISIT);
        record.markCompleted("photos");
        record.markCompleted("stock_opname");
        record.markSkipped("payment");
        record.markConfirmed("photos");
        record.addMedia(new MediaRef("img-1", "/files/img-1.jpg", "img-1.jpg", LocalDateTime.of(2024, 3, 4, 9, 15)));
        record.putResult("stock_opname",
                new StockCountResult(List.of(new StockCountResult.StockCount("SKU-1", 12))));
        record.putResult("sales_order", new OrderResult("SO-0042"));

        ProgressRecord restored = serializer.deserialize(serializer.serialize(record));

        assertNotNull(restored);
        assertEquals(record.getCompletedActivities(), restored.getCompletedActivities());
        assertEquals(record.getSkippedActivities(), restored.getSkippedActivities());
        assertEquals(record.getConfirmedActivities(), restored.getConfirmedActivities());
        assertEquals(record.getCapturedMedia(), restored.getCapturedMedia());
        assertEquals(record.getActivityResults(), restored.getActivityResults());
        assertEquals(UnitKind.VISIT, restored.getUnitKind());
        assertInstanceOf(StockCountResult.class, restored.getActivityResults().get("stock_opname"));
    }

    @Test
    void testUnknownResultKindKeptAsOpaque() throws Exception {
        ObjectMapper mapper = RedisConfig.createRedisObjectMapper();

        ActivityResult result = mapper.readValue(
                "{\"kind\":\"signature\",\"signedBy\":\"Store owner\",\"strokes\":14}", ActivityResult.class);

        OpaqueResult opaque = assertInstanceOf(OpaqueResult.class, result);
        assertEquals("Store owner", opaque.getData().get("signedBy"));
        assertEquals(14, opaque.getData().get("strokes"));
    }
}
