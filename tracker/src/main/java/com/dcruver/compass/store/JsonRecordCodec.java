package com.dcruver.compass.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Converts a container file's bytes to raw records and back.
 *
 * A container is a UTF-8 JSON array of objects. Raw records are insertion-ordered
 * maps so every key survives a decode/encode round-trip.
 */
@Slf4j
public class JsonRecordCodec {

    private static final TypeReference<LinkedHashMap<String, Object>> RAW_RECORD = new TypeReference<>() {};

    private final ObjectMapper objectMapper;

    public JsonRecordCodec() {
        this(defaultObjectMapper());
    }

    public JsonRecordCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public static ObjectMapper defaultObjectMapper() {
        return JsonMapper.builder()
            .addModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS)
            .build();
    }

    /**
     * Decode container bytes into raw records, in file order.
     * Blank content decodes to an empty collection.
     */
    public List<Map<String, Object>> decode(byte[] bytes) throws CorruptContainerException {
        if (new String(bytes, StandardCharsets.UTF_8).isBlank()) {
            return new ArrayList<>();
        }

        JsonNode root;
        try {
            root = objectMapper.readTree(bytes);
        } catch (IOException e) {
            throw new CorruptContainerException("Container is not valid JSON: " + e.getMessage(), e);
        }

        if (root == null || !root.isArray()) {
            throw new CorruptContainerException("Container must be a JSON array");
        }

        List<Map<String, Object>> records = new ArrayList<>(root.size());
        int index = 0;
        for (JsonNode element : root) {
            if (!element.isObject()) {
                throw new CorruptContainerException("Element " + index + " is not a JSON object");
            }
            records.add(objectMapper.convertValue(element, RAW_RECORD));
            index++;
        }

        log.debug("Decoded {} raw records", records.size());
        return records;
    }

    /**
     * Encode raw records as a pretty-printed container.
     */
    public byte[] encode(List<Map<String, Object>> records) throws JsonProcessingException {
        return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsBytes(records);
    }

    /**
     * Flatten a typed record into the raw shape it is stored in.
     */
    public Map<String, Object> toRaw(Object record) {
        return objectMapper.convertValue(record, RAW_RECORD);
    }

    public ObjectMapper getObjectMapper() {
        return objectMapper;
    }
}
