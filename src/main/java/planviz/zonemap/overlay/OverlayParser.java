package planviz.zonemap.overlay;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Lenient readers for the polygon and road-network JSON documents. Malformed input never
 * throws: it yields null bounds or an empty network and a warning.
 */
public final class OverlayParser {

    private static final Logger logger = LoggerFactory.getLogger(OverlayParser.class);

    private OverlayParser() {}

    // ==========================================================
    // Polygon
    // ==========================================================

    /**
     * Bounds of a polygon document's outer ring. Accepts {@code {geojson: {...}}},
     * {@code {geometry: {...}}} or a bare geometry object.
     */
    public static GeoBounds parsePolygonBounds(String json) {
        JsonObject root = parseObject(json, "polygon");
        if (root == null) return null;

        JsonObject geom = optObject(root, "geojson");
        if (geom == null) geom = optObject(root, "geometry");
        if (geom == null && root.has("coordinates")) geom = root;
        if (geom == null || !geom.has("coordinates") || !geom.get("coordinates").isJsonArray()) {
            logger.warn("Polygon document has no coordinates");
            return null;
        }

        JsonArray coords = geom.getAsJsonArray("coordinates");
        JsonArray ring = coords;
        if (coords.size() > 0 && coords.get(0).isJsonArray()
                && coords.get(0).getAsJsonArray().size() > 0
                && coords.get(0).getAsJsonArray().get(0).isJsonArray()) {
            ring = coords.get(0).getAsJsonArray();
        }

        GeoBounds.Builder b = new GeoBounds.Builder();
        for (JsonElement el : ring) {
            double[] c = lonLat(el);
            if (c != null) b.add(c[0], c[1]);
        }
        GeoBounds out = b.build();
        if (out == null || !out.isUsable()) {
            logger.warn("Polygon ring has no usable extent");
            return null;
        }
        return out;
    }

    // ==========================================================
    // Road network
    // ==========================================================

    /** Accepts the network object itself or a wrapper with a {@code road_network} member. */
    public static RoadNetwork parseRoadNetwork(String json) {
        JsonObject root = parseObject(json, "road network");
        if (root == null) return RoadNetwork.empty();
        JsonObject inner = optObject(root, "road_network");
        return readNetwork(inner != null ? inner : root);
    }

    /**
     * Picks the entry for {@code polygonId} out of a result list (a JSON array or an object with
     * a {@code road_networks} array). Ids compare as strings. Null when none matches.
     */
    public static RoadNetwork selectForPolygon(String json, String polygonId) {
        if (json == null || polygonId == null) return null;

        JsonElement root;
        try {
            root = JsonParser.parseString(json);
        } catch (JsonParseException ex) {
            logger.warn("Road network list is not valid JSON: {}", ex.getMessage());
            return null;
        }

        JsonArray list = null;
        if (root.isJsonArray()) {
            list = root.getAsJsonArray();
        } else if (root.isJsonObject() && root.getAsJsonObject().has("road_networks")
                && root.getAsJsonObject().get("road_networks").isJsonArray()) {
            list = root.getAsJsonObject().getAsJsonArray("road_networks");
        }
        if (list == null) return null;

        String want = polygonId.trim();
        for (JsonElement el : list) {
            if (!el.isJsonObject()) continue;
            JsonObject o = el.getAsJsonObject();
            String id = optString(o, "polygon_id");
            if (id == null || !id.trim().equals(want)) continue;

            JsonObject net = optObject(o, "road_network");
            if (net == null) continue;
            RoadNetwork rn = readNetwork(net);
            logger.info("Road network for polygon {}: {} primary, {} secondary, {} local",
                    want, rn.count(RoadClass.PRIMARY), rn.count(RoadClass.SECONDARY), rn.count(RoadClass.LOCAL));
            return rn;
        }
        logger.info("No road network found for polygon {}", want);
        return null;
    }

    private static RoadNetwork readNetwork(JsonObject net) {
        Map<RoadClass, List<RoadFeature>> out = new EnumMap<>(RoadClass.class);
        int skipped = 0;

        for (RoadClass category : RoadClass.values()) {
            JsonObject fc = optObject(net, category.getKey());
            if (fc == null) continue;
            if (!fc.has("features") || !fc.get("features").isJsonArray()) continue;

            List<RoadFeature> list = new ArrayList<>();
            for (JsonElement el : fc.getAsJsonArray("features")) {
                RoadFeature f = readFeature(category, el);
                if (f == null) skipped++;
                else list.add(f);
            }
            out.put(category, list);
        }

        if (skipped > 0) logger.debug("Ignored {} road features with missing or non-finite geometry", skipped);
        return new RoadNetwork(out);
    }

    private static RoadFeature readFeature(RoadClass category, JsonElement el) {
        if (el == null || !el.isJsonObject()) return null;
        JsonObject f = el.getAsJsonObject();

        JsonObject geom = optObject(f, "geometry");
        if (geom == null) return null;
        GeometryKind kind = GeometryKind.fromGeoJson(optString(geom, "type"));
        if (kind == null) return null;
        if (!geom.has("coordinates") || !geom.get("coordinates").isJsonArray()) return null;
        JsonArray coords = geom.getAsJsonArray("coordinates");

        List<List<double[]>> parts = new ArrayList<>();
        if (kind == GeometryKind.LINE_STRING) {
            List<double[]> line = readLine(coords);
            if (line == null) return null;
            parts.add(line);
        } else {
            for (JsonElement lineEl : coords) {
                if (!lineEl.isJsonArray()) return null;
                List<double[]> line = readLine(lineEl.getAsJsonArray());
                if (line == null) return null;
                parts.add(line);
            }
        }
        if (parts.isEmpty()) return null;

        JsonObject props = optObject(f, "properties");
        RoadClass style = RoadClass.fromTag(props == null ? null : optString(props, "road_type"));
        return new RoadFeature(category, style, kind, parts);
    }

    /** Null when empty or when any point is missing or non-finite. */
    private static List<double[]> readLine(JsonArray arr) {
        if (arr.size() == 0) return null;
        List<double[]> line = new ArrayList<>(arr.size());
        for (JsonElement el : arr) {
            double[] c = lonLat(el);
            if (c == null) return null;
            line.add(c);
        }
        return line;
    }

    // ==========================================================
    // Json helpers
    // ==========================================================

    private static JsonObject parseObject(String json, String what) {
        if (json == null || json.trim().isEmpty()) return null;
        try {
            JsonElement el = JsonParser.parseString(json);
            if (!el.isJsonObject()) {
                logger.warn("Expected a JSON object for the {} document", what);
                return null;
            }
            return el.getAsJsonObject();
        } catch (JsonParseException ex) {
            logger.warn("Could not parse {} JSON: {}", what, ex.getMessage());
            return null;
        }
    }

    private static double[] lonLat(JsonElement el) {
        if (el == null || !el.isJsonArray()) return null;
        JsonArray a = el.getAsJsonArray();
        if (a.size() < 2) return null;
        Double lon = optDouble(a.get(0));
        Double lat = optDouble(a.get(1));
        if (lon == null || lat == null) return null;
        if (!Double.isFinite(lon) || !Double.isFinite(lat)) return null;
        return new double[]{lon, lat};
    }

    private static Double optDouble(JsonElement el) {
        if (el == null || !el.isJsonPrimitive() || !el.getAsJsonPrimitive().isNumber()) return null;
        try {
            return el.getAsDouble();
        } catch (NumberFormatException ex) {
            return null;
        }
    }

    private static JsonObject optObject(JsonObject o, String key) {
        if (o == null || !o.has(key)) return null;
        JsonElement el = o.get(key);
        return el.isJsonObject() ? el.getAsJsonObject() : null;
    }

    private static String optString(JsonObject o, String key) {
        if (o == null || !o.has(key)) return null;
        JsonElement el = o.get(key);
        if (!el.isJsonPrimitive()) return null;
        return el.getAsString();
    }
}
