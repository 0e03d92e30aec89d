package planviz.zonemap.io;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.File;
import java.io.IOException;
import java.util.Base64;
import java.util.Locale;

public final class ImageExporter {

    public static final String DATA_URI_PREFIX = "data:image/png;base64,";

    private ImageExporter() {}

    public static byte[] toPngBytes(BufferedImage img) throws IOException {
        if (img == null) throw new IllegalArgumentException("img is null");
        ByteArrayOutputStream baos = new ByteArrayOutputStream();
        if (!ImageIO.write(img, "png", baos)) {
            throw new IOException("PNG writer not available");
        }
        return baos.toByteArray();
    }

    public static String toDataUri(BufferedImage img) throws IOException {
        return DATA_URI_PREFIX + Base64.getEncoder().encodeToString(toPngBytes(img));
    }

    /** Decodes a PNG data URI produced by {@link #toDataUri}. */
    public static BufferedImage fromDataUri(String uri) throws IOException {
        if (uri == null || !uri.startsWith(DATA_URI_PREFIX)) throw new IOException("Not a PNG data URI");
        byte[] bytes;
        try {
            bytes = Base64.getDecoder().decode(uri.substring(DATA_URI_PREFIX.length()));
        } catch (IllegalArgumentException ex) {
            throw new IOException("Malformed base64 in data URI", ex);
        }
        return fromPngBytes(bytes);
    }

    public static BufferedImage fromPngBytes(byte[] bytes) throws IOException {
        if (bytes == null) throw new IllegalArgumentException("bytes is null");
        BufferedImage img = ImageIO.read(new ByteArrayInputStream(bytes));
        if (img == null) throw new IOException("Bytes do not hold a PNG");
        return img;
    }

    /** {@code customized_polygon_<target>_<millis>.png} */
    public static String downloadFileName(String targetId, long millis) {
        String t = (targetId == null || targetId.trim().isEmpty()) ? "unknown" : targetId.trim();
        t = t.replaceAll("[^A-Za-z0-9._-]", "_");
        return "customized_polygon_" + t + "_" + millis + ".png";
    }

    /** Writes a PNG, appending ".png" when the name has no extension. */
    public static File writePng(BufferedImage img, File file) throws IOException {
        if (file == null) throw new IllegalArgumentException("file is null");
        if (!file.getName().toLowerCase(Locale.ROOT).endsWith(".png")) {
            file = new File(file.getParentFile(), file.getName() + ".png");
        }
        File parent = file.getParentFile();
        if (parent != null && !parent.exists()) parent.mkdirs();

        if (!ImageIO.write(img, "png", file)) {
            throw new IOException("PNG writer not available");
        }
        return file;
    }
}
