package org.spatial.io;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;
import org.spatial.euclidean.Line3D;

import java.io.IOException;

/**
 * Writes a line as two ordered children, {@code StartPoint} then {@code EndPoint}.
 */
public final class Line3DSerializer extends StdSerializer<Line3D> {

    static final String START_POINT = "StartPoint";
    static final String END_POINT = "EndPoint";

    public Line3DSerializer() {
        super(Line3D.class);
    }

    @Override
    public void serialize(Line3D value, JsonGenerator gen, SerializerProvider provider) throws IOException {
        gen.writeStartObject();
        gen.writeFieldName(START_POINT);
        provider.defaultSerializeValue(value.start(), gen);
        gen.writeFieldName(END_POINT);
        provider.defaultSerializeValue(value.end(), gen);
        gen.writeEndObject();
    }
}
