package novt.tools.geometry;

import java.util.List;

/**
 * An implicitly closed sky polygon. Vertex order is kept exactly as produced.
 */
public record PolygonRegion(String apertureName, List<SkyCoordinate> vertices) implements FootprintRegion {

    public PolygonRegion {
        if (vertices.size() < 3) {
            throw new IllegalArgumentException("Polygon " + apertureName + " needs at least 3 vertices, got " + vertices.size());
        }
        vertices = List.copyOf(vertices);
    }

    @Override
    public List<SkyCoordinate> coordinates() {
        return vertices;
    }
}
