package org.spatial.io;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.xml.XmlMapper;

import java.io.UncheckedIOException;
import java.util.Objects;

/**
 * Ready-made mappers with {@link SpatialModule} registered, plus string helpers
 * that wrap Jackson's checked exceptions.
 */
public final class SpatialMappers {

    private static final ObjectMapper JSON = json();
    private static final XmlMapper XML = xml();

    private SpatialMappers() {
    }

    /**
     * @return a new JSON mapper; callers may configure it further
     */
    public static ObjectMapper json() {
        return new ObjectMapper().registerModule(new SpatialModule());
    }

    /**
     * @return a new XML mapper; callers may configure it further
     */
    public static XmlMapper xml() {
        XmlMapper mapper = new XmlMapper();
        mapper.registerModule(new SpatialModule());
        return mapper;
    }

    public static String toJson(Object value) {
        try {
            return JSON.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Failed to write JSON for " + value, e);
        }
    }

    public static <T> T fromJson(String json, Class<T> type) {
        Objects.requireNonNull(json, "json must not be null");
        try {
            return JSON.readValue(json, type);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Failed to read " + type.getSimpleName() + " from JSON", e);
        }
    }

    public static String toXml(Object value) {
        try {
            return XML.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Failed to write XML for " + value, e);
        }
    }

    public static <T> T fromXml(String xml, Class<T> type) {
        Objects.requireNonNull(xml, "xml must not be null");
        try {
            return XML.readValue(xml, type);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Failed to read " + type.getSimpleName() + " from XML", e);
        }
    }
}
