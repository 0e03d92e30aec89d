package planviz.zonemap.io;

import java.io.IOException;

/** An image could not be read from any of the attempted routes. */
public class RasterLoadException extends IOException {

    private final String location;

    public RasterLoadException(String location, Throwable cause) {
        super(buildMessage(location), cause);
        this.location = location;
    }

    public RasterLoadException(String location, String detail) {
        super(detail == null ? buildMessage(location) : buildMessage(location) + "\n\n" + detail);
        this.location = location;
    }

    public String getLocation() { return location; }

    private static String buildMessage(String location) {
        return "Failed to load image from: " + location + "\n\n"
                + "Please check:\n"
                + "1. The image URL or path is correct\n"
                + "2. The backend serving the image is running\n"
                + "3. Cross-origin (CORS) access is enabled on the server";
    }
}
