package org.spatial.io;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;
import org.spatial.euclidean.Point3D;
import org.spatial.euclidean.Vector3D;

import java.io.IOException;

/**
 * Serializers for three-component values. Both points and vectors are written as
 * children {@code X}, {@code Y}, {@code Z}:
 * <pre>
 *   { "X": 1.0, "Y": 2.0, "Z": 3.0 }
 *   &lt;Point3D&gt;&lt;X&gt;1.0&lt;/X&gt;&lt;Y&gt;2.0&lt;/Y&gt;&lt;Z&gt;3.0&lt;/Z&gt;&lt;/Point3D&gt;
 * </pre>
 */
final class CoordinateCodecs {

    static final String X = "X";
    static final String Y = "Y";
    static final String Z = "Z";

    private CoordinateCodecs() {
    }

    private static void writeXyz(JsonGenerator gen, double x, double y, double z) throws IOException {
        gen.writeStartObject();
        gen.writeNumberField(X, x);
        gen.writeNumberField(Y, y);
        gen.writeNumberField(Z, z);
        gen.writeEndObject();
    }

    /**
     * Reads X, Y and Z in any order. Unknown children are skipped; a missing one is an error.
     */
    private static double[] readXyz(XyzDeserializer<?> owner, JsonParser p, DeserializationContext ctxt)
            throws IOException {
        if (p.currentToken() != JsonToken.START_OBJECT) {
            return (double[]) ctxt.handleUnexpectedToken(double[].class, p);
        }

        double[] xyz = new double[3];
        boolean[] seen = new boolean[3];

        while (p.nextToken() == JsonToken.FIELD_NAME) {
            String field = p.currentName();
            p.nextToken(); // move to value

            int index = switch (field) {
                case X -> 0;
                case Y -> 1;
                case Z -> 2;
                default -> -1;
            };
            if (index < 0) {
                p.skipChildren();
                continue;
            }
            xyz[index] = owner.parseDouble(p, ctxt);
            seen[index] = true;
        }

        if (!seen[0] || !seen[1] || !seen[2]) {
            ctxt.reportInputMismatch(owner, "%s requires %s, %s and %s",
                    owner.handledType().getSimpleName(), X, Y, Z);
        }
        return xyz;
    }

    static final class PointSerializer extends StdSerializer<Point3D> {

        PointSerializer() {
            super(Point3D.class);
        }

        @Override
        public void serialize(Point3D value, JsonGenerator gen, SerializerProvider provider) throws IOException {
            writeXyz(gen, value.x(), value.y(), value.z());
        }
    }

    static final class PointDeserializer extends XyzDeserializer<Point3D> {

        PointDeserializer() {
            super(Point3D.class);
        }

        @Override
        public Point3D deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
            double[] xyz = readXyz(this, p, ctxt);
            try {
                return new Point3D(xyz[0], xyz[1], xyz[2]);
            } catch (IllegalArgumentException e) {
                throw JsonMappingException.from(p, "Cannot rebuild Point3D: " + e.getMessage(), e);
            }
        }
    }

    static final class VectorSerializer extends StdSerializer<Vector3D> {

        VectorSerializer() {
            super(Vector3D.class);
        }

        @Override
        public void serialize(Vector3D value, JsonGenerator gen, SerializerProvider provider) throws IOException {
            writeXyz(gen, value.x(), value.y(), value.z());
        }
    }

    static final class VectorDeserializer extends XyzDeserializer<Vector3D> {

        VectorDeserializer() {
            super(Vector3D.class);
        }

        @Override
        public Vector3D deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
            double[] xyz = readXyz(this, p, ctxt);
            try {
                return new Vector3D(xyz[0], xyz[1], xyz[2]);
            } catch (IllegalArgumentException e) {
                throw JsonMappingException.from(p, "Cannot rebuild Vector3D: " + e.getMessage(), e);
            }
        }
    }

    /**
     * Opens up StdDeserializer's number coercion, which accepts both JSON numbers and the
     * text values an XML parser reports.
     */
    abstract static class XyzDeserializer<T> extends StdDeserializer<T> {

        XyzDeserializer(Class<T> type) {
            super(type);
        }

        double parseDouble(JsonParser p, DeserializationContext ctxt) throws IOException {
            return _parseDoublePrimitive(p, ctxt);
        }
    }
}
