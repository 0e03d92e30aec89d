package planviz.zonemap.io;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import planviz.zonemap.model.PixelBuffer;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.BufferedInputStream;
import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.net.HttpURLConnection;
import java.net.MalformedURLException;
import java.net.URL;
import java.net.URLConnection;
import java.util.Locale;

/**
 * Decodes the editor's source image from a URL, an image file or a PDF page.
 * URLs are tried first as a cross-origin request and then once more as a plain download.
 */
public class RasterSource {

    private static final Logger logger = LoggerFactory.getLogger(RasterSource.class);

    private int connectTimeoutMs = 10_000;
    private int readTimeoutMs = 30_000;
    private String origin = "http://localhost";
    private int pdfDpi = PdfRasterImporter.DEFAULT_DPI;

    public RasterSource() {}

    public RasterSource(int connectTimeoutMs, int readTimeoutMs, String origin, int pdfDpi) {
        this.connectTimeoutMs = connectTimeoutMs;
        this.readTimeoutMs = readTimeoutMs;
        this.origin = origin;
        this.pdfDpi = pdfDpi;
    }

    /** URL (http, https, file) or local path; {@code .pdf} renders page 1. */
    public PixelBuffer load(String location) throws IOException {
        if (location == null || location.trim().isEmpty()) {
            throw new IllegalArgumentException("Image location is blank.");
        }
        String loc = location.trim();
        if (looksLikeUrl(loc)) {
            return loadUrl(new URL(loc));
        }
        return loadFile(new File(loc));
    }

    public PixelBuffer loadFile(File file) throws IOException {
        if (file == null) throw new IllegalArgumentException("file is null");
        if (!file.isFile()) throw new RasterLoadException(file.getPath(), "File not found.");

        if (file.getName().toLowerCase(Locale.ROOT).endsWith(".pdf")) {
            BufferedImage page = PdfRasterImporter.renderPage(file, 0, pdfDpi);
            logger.info("Rendered PDF {} at {} dpi: {}x{}", file.getName(), pdfDpi, page.getWidth(), page.getHeight());
            return PixelBuffer.fromImage(page);
        }

        BufferedImage img = ImageIO.read(file);
        if (img == null) throw new RasterLoadException(file.getPath(), "Not a PNG/JPEG image.");
        logger.info("Loaded {}: {}x{}", file.getName(), img.getWidth(), img.getHeight());
        return PixelBuffer.fromImage(img);
    }

    public PixelBuffer loadUrl(URL url) throws RasterLoadException {
        if (url == null) throw new IllegalArgumentException("url is null");

        IOException corsFailure;
        try {
            BufferedImage img = readCrossOrigin(url);
            logger.info("Loaded {}: {}x{}", url, img.getWidth(), img.getHeight());
            return PixelBuffer.fromImage(img);
        } catch (IOException ex) {
            corsFailure = ex;
            logger.warn("Cross-origin load of {} failed ({}); retrying without it", url, ex.getMessage());
        }

        try {
            BufferedImage img = readPlain(url);
            logger.info("Loaded {} without cross-origin mode: {}x{}", url, img.getWidth(), img.getHeight());
            return PixelBuffer.fromImage(img);
        } catch (IOException ex) {
            ex.addSuppressed(corsFailure);
            logger.error("Image failed to load from {}", url, ex);
            throw new RasterLoadException(url.toString(), ex);
        }
    }

    // ==========================================================
    // Attempts
    // ==========================================================

    private BufferedImage readCrossOrigin(URL url) throws IOException {
        URLConnection conn = url.openConnection();
        conn.setConnectTimeout(connectTimeoutMs);
        conn.setReadTimeout(readTimeoutMs);
        conn.setUseCaches(false);
        if (origin != null) conn.setRequestProperty("Origin", origin);
        conn.setRequestProperty("Accept", "image/png,image/jpeg,image/*");

        if (conn instanceof HttpURLConnection) {
            HttpURLConnection http = (HttpURLConnection) conn;
            http.setInstanceFollowRedirects(true);
            int status = http.getResponseCode();
            if (status / 100 != 2) {
                http.disconnect();
                throw new IOException("HTTP " + status);
            }
        }
        try (InputStream in = new BufferedInputStream(conn.getInputStream())) {
            return decode(in);
        }
    }

    private BufferedImage readPlain(URL url) throws IOException {
        URLConnection conn = url.openConnection();
        conn.setConnectTimeout(connectTimeoutMs);
        conn.setReadTimeout(readTimeoutMs);
        try (InputStream in = new BufferedInputStream(conn.getInputStream())) {
            return decode(in);
        }
    }

    private static BufferedImage decode(InputStream in) throws IOException {
        BufferedImage img = ImageIO.read(in);
        if (img == null) throw new IOException("Response is not a decodable image");
        return img;
    }

    static boolean looksLikeUrl(String loc) {
        String l = loc.toLowerCase(Locale.ROOT);
        if (!(l.startsWith("http://") || l.startsWith("https://") || l.startsWith("file:"))) return false;
        try {
            new URL(loc);
            return true;
        } catch (MalformedURLException ex) {
            return false;
        }
    }
}
