package com.dcruver.compass.store;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class JsonRecordCodecTest {

    private JsonRecordCodec codec;

    @BeforeEach
    void setUp() {
        codec = new JsonRecordCodec();
    }

    @Test
    void testBlankContainerDecodesEmpty() throws Exception {
        assertTrue(codec.decode(new byte[0]).isEmpty());
        assertTrue(codec.decode("  \n".getBytes(StandardCharsets.UTF_8)).isEmpty());
        assertTrue(codec.decode("[]".getBytes(StandardCharsets.UTF_8)).isEmpty());
    }

    @Test
    void testUnknownKeysSurviveInOrder() throws Exception {
        byte[] bytes = """
            [{"zeta": 1, "alpha": "x", "nested": {"k": [1, 2]}}]
            """.getBytes(StandardCharsets.UTF_8);

        List<Map<String, Object>> records = codec.decode(bytes);

        assertEquals(1, records.size());
        assertEquals(List.of("zeta", "alpha", "nested"), new ArrayList<>(records.get(0).keySet()));
        assertEquals(records, codec.decode(codec.encode(records)));
    }

    @Test
    void testTruncatedJsonIsCorrupt() {
        byte[] bytes = "[{\"id\": \"a\"".getBytes(StandardCharsets.UTF_8);
        assertThrows(CorruptContainerException.class, () -> codec.decode(bytes));
    }

    @Test
    void testNonArrayRootIsCorrupt() {
        byte[] bytes = "{\"id\": \"a\"}".getBytes(StandardCharsets.UTF_8);
        CorruptContainerException e = assertThrows(CorruptContainerException.class, () -> codec.decode(bytes));
        assertTrue(e.getMessage().contains("array"));
    }

    @Test
    void testNonObjectElementIsCorrupt() {
        byte[] bytes = "[{\"id\": \"a\"}, 42]".getBytes(StandardCharsets.UTF_8);
        CorruptContainerException e = assertThrows(CorruptContainerException.class, () -> codec.decode(bytes));
        assertTrue(e.getMessage().contains("Element 1"));
    }
}
