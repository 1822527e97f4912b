package org.spatial.io;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.spatial.euclidean.DegenerateGeometryException;
import org.spatial.euclidean.Line3D;
import org.spatial.euclidean.Point3D;

import java.io.IOException;

import static org.spatial.io.Line3DSerializer.END_POINT;
import static org.spatial.io.Line3DSerializer.START_POINT;

/**
 * Reads the two children written by {@link Line3DSerializer}.
 *
 * Expected shape:
 * <pre>
 *   { "StartPoint": { ... }, "EndPoint": { ... } }
 * </pre>
 * An object child seen before {@code StartPoint} is taken as a wrapper
 * (for example {@code {"Line3D": {...}}} or an enclosing XML element) when a {@code StartPoint}
 * appears somewhere inside it; otherwise it is skipped like any other unknown child.
 * Both children are required, StartPoint must come first and neither may repeat.
 * The line is rebuilt through its constructor, so a document with coinciding points is rejected.
 */
public final class Line3DDeserializer extends StdDeserializer<Line3D> {

    private static final Logger log = LoggerFactory.getLogger(Line3DDeserializer.class);

    public Line3DDeserializer() {
        super(Line3D.class);
    }

    @Override
    public Line3D deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
        if (p.currentToken() == JsonToken.START_OBJECT) {
            p.nextToken();
        }
        if (p.currentToken() != JsonToken.FIELD_NAME && p.currentToken() != JsonToken.END_OBJECT) {
            return (Line3D) ctxt.handleUnexpectedToken(Line3D.class, p);
        }
        return readFields(p, ctxt);
    }

    /**
     * Parser is positioned on the first FIELD_NAME of an object (or its END_OBJECT).
     * Returns with the parser on that object's END_OBJECT.
     */
    private Line3D readFields(JsonParser p, DeserializationContext ctxt) throws IOException {
        Point3D start = null;
        Point3D end = null;
        Line3D wrapped = null;

        for (; p.currentToken() == JsonToken.FIELD_NAME; p.nextToken()) {
            String field = p.currentName();
            p.nextToken(); // move to value

            if (START_POINT.equals(field)) {
                if (start != null || end != null || wrapped != null) {
                    return ctxt.reportInputMismatch(this, "Unexpected '%s': it must be the first child and appear once",
                            START_POINT);
                }
                start = ctxt.readValue(p, Point3D.class);
            } else if (END_POINT.equals(field)) {
                if (start == null) {
                    return ctxt.reportInputMismatch(this, "'%s' must follow '%s'", END_POINT, START_POINT);
                }
                if (end != null) {
                    return ctxt.reportInputMismatch(this, "'%s' appears more than once", END_POINT);
                }
                end = ctxt.readValue(p, Point3D.class);
            } else if (start == null && wrapped == null && p.currentToken() == JsonToken.START_OBJECT) {
                JsonNode child = ctxt.readTree(p);
                if (child.findValue(START_POINT) != null) {
                    log.debug("Unwrapping '{}' while reading Line3D", field);
                    wrapped = ctxt.readTreeAsValue(child, Line3D.class);
                } else {
                    log.debug("Skipping '{}' while reading Line3D", field);
                }
            } else {
                p.skipChildren();
            }
        }

        if (wrapped != null) {
            return wrapped;
        }
        if (start == null || end == null) {
            return ctxt.reportInputMismatch(this, "Line3D requires both '%s' and '%s'", START_POINT, END_POINT);
        }

        try {
            return new Line3D(start, end);
        } catch (DegenerateGeometryException e) {
            throw JsonMappingException.from(p, "Cannot rebuild Line3D: " + e.getMessage(), e);
        }
    }
}
