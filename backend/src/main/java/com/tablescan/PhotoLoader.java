package com.tablescan;

import com.drew.imaging.ImageMetadataReader;
import com.drew.imaging.ImageProcessingException;
import com.drew.metadata.Metadata;
import com.drew.metadata.MetadataException;
import com.drew.metadata.exif.ExifIFD0Directory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.imageio.ImageIO;
import java.awt.geom.AffineTransform;
import java.awt.image.AffineTransformOp;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Decodes a photograph and undoes the camera's EXIF orientation flag, so the pixels are
 * upright before the table is located.
 */
public final class PhotoLoader {

    private static final Logger log = LoggerFactory.getLogger(PhotoLoader.class);

    private PhotoLoader() {
    }

    public static BufferedImage load(Path path) throws IOException {
        return load(Files.readAllBytes(path));
    }

    /**
     * @return upright {@code TYPE_INT_RGB} image
     * @throws IOException when the bytes are not a supported image
     */
    public static BufferedImage load(byte[] bytes) throws IOException {
        BufferedImage decoded = ImageIO.read(new ByteArrayInputStream(bytes));
        if (decoded == null) {
            throw new IOException("Unsupported or corrupt image (" + bytes.length + " bytes)");
        }
        int orientation = readOrientation(bytes);
        BufferedImage upright = applyOrientation(ImageProcessor.toRgb(decoded), orientation);
        log.debug("Loaded {}x{} photo, EXIF orientation {}, upright {}x{}", decoded.getWidth(), decoded.getHeight(),
                orientation, upright.getWidth(), upright.getHeight());
        return upright;
    }

    static int readOrientation(byte[] bytes) {
        try {
            Metadata metadata = ImageMetadataReader.readMetadata(new ByteArrayInputStream(bytes));
            ExifIFD0Directory dir = metadata.getFirstDirectoryOfType(ExifIFD0Directory.class);
            if (dir != null && dir.containsTag(ExifIFD0Directory.TAG_ORIENTATION)) {
                return dir.getInt(ExifIFD0Directory.TAG_ORIENTATION);
            }
            log.debug("No EXIF orientation tag, assuming upright");
        } catch (ImageProcessingException | MetadataException | IOException e) {
            log.info("Could not read image metadata, assuming upright: {}", e.getMessage());
        }
        return 1;
    }

    /** Applies EXIF orientation 1-8; values 5-8 swap width and height. */
    public static BufferedImage applyOrientation(BufferedImage src, int orientation) {
        int w = src.getWidth();
        int h = src.getHeight();
        AffineTransform tx = new AffineTransform();

        switch (orientation) {
            case 2: // flip X
                tx.scale(-1.0, 1.0);
                tx.translate(-w, 0);
                break;
            case 3: // PI rotation
                tx.translate(w, h);
                tx.rotate(Math.PI);
                break;
            case 4: // flip Y
                tx.scale(1.0, -1.0);
                tx.translate(0, -h);
                break;
            case 5: // -PI/2 and flip X
                tx.rotate(-Math.PI / 2);
                tx.scale(-1.0, 1.0);
                break;
            case 6: // -PI/2
                tx.translate(h, 0);
                tx.rotate(Math.PI / 2);
                break;
            case 7: // PI/2 and flip
                tx.scale(-1.0, 1.0);
                tx.translate(-h, 0);
                tx.translate(0, w);
                tx.rotate(3 * Math.PI / 2);
                break;
            case 8: // PI/2
                tx.translate(0, w);
                tx.rotate(3 * Math.PI / 2);
                break;
            default:
                return src;
        }

        boolean swapsAxes = orientation >= 5 && orientation <= 8;
        AffineTransformOp op = new AffineTransformOp(tx, AffineTransformOp.TYPE_NEAREST_NEIGHBOR);
        BufferedImage dst = new BufferedImage(swapsAxes ? h : w, swapsAxes ? w : h, BufferedImage.TYPE_INT_RGB);
        op.filter(src, dst);
        return dst;
    }
}
