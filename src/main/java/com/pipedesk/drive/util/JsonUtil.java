package com.pipedesk.drive.util;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.type.TypeFactory;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.pipedesk.drive.exception.JsonException;
import org.apache.commons.lang3.StringUtils;

import java.util.Collections;
import java.util.List;

public class JsonUtil {

    private static final ObjectMapper objectMapper = new ObjectMapper()
            .registerModule(new JavaTimeModule()) // jackson to handle field to Instant
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    private static final TypeFactory typeFactory = objectMapper.getTypeFactory();

    private JsonUtil() {}

    public static String serializeToString(Object object) throws JsonException {
        try {
            return objectMapper.writeValueAsString(object);
        } catch (JsonProcessingException e) {
            throw new JsonException("serializeToString failed. object is %s".formatted(object), e);
        }
    }

    public static <T> T deserialize(String jsonString, Class<T> clazz) throws JsonException {
        if (StringUtils.isBlank(jsonString)) {
            return null;
        }
        try {
            return objectMapper.readValue(jsonString, clazz);
        } catch (JsonProcessingException e) {
            throw new JsonException("deserialize failed. jsonString is %s".formatted(jsonString), e);
        }
    }

    public static <T> List<T> deserToList(String jsonString, Class<T> elementType) throws JsonException {
        if (StringUtils.isBlank(jsonString)) {
            return Collections.emptyList();
        }
        try {
            return objectMapper.readValue(
                    jsonString,
                    typeFactory.constructCollectionType(List.class, elementType)
            );
        } catch (JsonProcessingException e) {
            throw new JsonException("deserToList failed. jsonString is %s".formatted(jsonString), e);
        }
    }
}
