package planviz.zonemap.io;

import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.rendering.ImageType;
import org.apache.pdfbox.rendering.PDFRenderer;

import java.awt.image.BufferedImage;
import java.io.File;
import java.io.IOException;

/** Renders a page of an exported zoning PDF as the editor's raster. */
public class PdfRasterImporter {

    public static final int DEFAULT_DPI = 150;

    /**
     * @param pageIndex 0-based, clamped to the document
     * @param dpi       e.g. 100 / 150 / 300
     */
    public static BufferedImage renderPage(File pdfFile, int pageIndex, int dpi) throws IOException {
        if (pdfFile == null) throw new IllegalArgumentException("pdfFile is null");
        if (!pdfFile.isFile()) throw new IOException("PDF does not exist: " + pdfFile.getAbsolutePath());
        if (dpi <= 0) throw new IllegalArgumentException("dpi must be > 0");

        try (PDDocument doc = PDDocument.load(pdfFile)) {
            int pages = doc.getNumberOfPages();
            if (pages <= 0) throw new IOException("PDF has no pages: " + pdfFile.getName());

            int idx = Math.max(0, Math.min(pageIndex, pages - 1));
            // ARGB so transparent page areas stay distinguishable from white zones
            return new PDFRenderer(doc).renderImageWithDPI(idx, dpi, ImageType.ARGB);
        }
    }
}
