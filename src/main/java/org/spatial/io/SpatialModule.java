package org.spatial.io;

import com.fasterxml.jackson.databind.module.SimpleModule;
import org.spatial.euclidean.Line3D;
import org.spatial.euclidean.Point3D;
import org.spatial.euclidean.Vector3D;

/**
 * Jackson module for the euclidean value types. Works with both {@code ObjectMapper} and {@code XmlMapper}.
 */
public final class SpatialModule extends SimpleModule {

    public SpatialModule() {
        super("SpatialModule");

        addSerializer(Point3D.class, new CoordinateCodecs.PointSerializer());
        addDeserializer(Point3D.class, new CoordinateCodecs.PointDeserializer());

        addSerializer(Vector3D.class, new CoordinateCodecs.VectorSerializer());
        addDeserializer(Vector3D.class, new CoordinateCodecs.VectorDeserializer());

        addSerializer(Line3D.class, new Line3DSerializer());
        addDeserializer(Line3D.class, new Line3DDeserializer());
    }
}
