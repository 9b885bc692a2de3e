package com.acme.asuc.governor.util;

import com.fasterxml.jackson.databind.JsonNode;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;

class JsonCodecTest {

    @Test
    void shouldWriteMapEntriesSortedByKey() throws Exception {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("zeta", 1);
        payload.put("alpha", "a");
        assertEquals("{\"alpha\":\"a\",\"zeta\":1}", JsonCodec.writeString(payload));
    }

    @Test
    void shouldReadTree() throws Exception {
        JsonNode node = JsonCodec.readTree("{\"total\":3,\"suspicious\":false}");
        assertEquals(3, node.get("total").asInt());
        assertEquals(false, node.get("suspicious").asBoolean());
    }
}
