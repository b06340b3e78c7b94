package com.bmsedge.production.util;

import com.bmsedge.production.dto.RowUpdateRequest;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static org.junit.jupiter.api.Assertions.*;

class BigDecimalDeserializerTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    @Test
    @DisplayName("Should read quantities sent as numbers or formatted text")
    void testQuantityFormats() throws Exception {
        assertEquals(0, new BigDecimal("310").compareTo(
                objectMapper.readValue("{\"newRemaining\":310}", RowUpdateRequest.class).getNewRemaining()));
        assertEquals(0, new BigDecimal("1250.5").compareTo(
                objectMapper.readValue("{\"newRemaining\":\"1,250.5\"}", RowUpdateRequest.class).getNewRemaining()));
        assertEquals(0, new BigDecimal("40").compareTo(
                objectMapper.readValue("{\"newRemaining\":\"40 kg\"}", RowUpdateRequest.class).getNewRemaining()));
    }

    @Test
    @DisplayName("Should treat unreadable quantities as absent")
    void testUnreadableQuantity() throws Exception {
        assertNull(objectMapper.readValue("{\"newRemaining\":\"abc\"}", RowUpdateRequest.class).getNewRemaining());
        assertNull(objectMapper.readValue("{\"newRemaining\":{}}", RowUpdateRequest.class).getNewRemaining());
        assertNull(BigDecimalDeserializer.parseQuantity("  "));
    }
}
