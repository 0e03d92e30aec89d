package planviz.zonemap.io;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;
import com.google.gson.annotations.SerializedName;

/** What the editor hands to its host on save. */
public final class SavePayload {

    private static final Gson GSON = new GsonBuilder().disableHtmlEscaping().create();

    @SerializedName("target_id")
    private final String targetId;

    @SerializedName("image_data")
    private final String imageData;

    private final double scale;

    /** Epoch millis. */
    private final long timestamp;

    public SavePayload(String targetId, String imageData, double scale, long timestamp) {
        if (imageData == null || !imageData.startsWith(ImageExporter.DATA_URI_PREFIX)) {
            throw new IllegalArgumentException("imageData must be a PNG data URI");
        }
        this.targetId = targetId;
        this.imageData = imageData;
        this.scale = scale;
        this.timestamp = timestamp;
    }

    public String getTargetId() { return targetId; }
    public String getImageData() { return imageData; }
    public double getScale() { return scale; }
    public long getTimestamp() { return timestamp; }

    public String toJson() {
        return GSON.toJson(this);
    }

    public static SavePayload fromJson(String json) {
        SavePayload p;
        try {
            p = GSON.fromJson(json, SavePayload.class);
        } catch (JsonParseException ex) {
            throw new IllegalArgumentException("Malformed save payload", ex);
        }
        if (p == null || p.imageData == null) throw new IllegalArgumentException("Save payload has no image_data");
        return p;
    }
}
