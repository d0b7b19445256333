package com.keypointcensus.core.traversal;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.awt.image.WritableRaster;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/**
 * {@link ImageSource} backed by {@link ImageIO}.
 *
 * <p>
 * Colour images are reduced to 8-bit luminance with the ITU-R BT.601 weights
 * ({@code 0.299 R + 0.587 G + 0.114 B}), the conversion feature detectors
 * conventionally expect.
 * </p>
 *
 * <p>
 * Any failure to read or convert a file, checked or not, surfaces as an
 * {@link ImageDecodeException}.
 * </p>
 *
 * @since 1.0.0
 */
public class ImageIoImageSource implements ImageSource {

    @Override
    public BufferedImage load(Path path) throws ImageDecodeException {
        Objects.requireNonNull(path, "Image path must not be null");
        if (!Files.isRegularFile(path)) {
            throw new ImageDecodeException(path, "not a readable file");
        }

        BufferedImage image;
        try {
            image = ImageIO.read(path.toFile());
        } catch (IOException e) {
            throw new ImageDecodeException(path, e.getMessage(), e);
        } catch (RuntimeException e) {
            // ImageIO readers report some corrupt content unchecked, e.g. "Empty region!"
            throw new ImageDecodeException(path, e.toString(), e);
        }
        if (image == null) {
            throw new ImageDecodeException(path, "no decoder accepts this content");
        }
        try {
            return toGray(image);
        } catch (RuntimeException e) {
            throw new ImageDecodeException(path, "cannot convert to gray: " + e, e);
        }
    }

    /**
     * Convert an image to {@link BufferedImage#TYPE_BYTE_GRAY}.
     *
     * @param image source image
     * @return {@code image} itself if already gray, otherwise a new image
     */
    static BufferedImage toGray(BufferedImage image) {
        if (image.getType() == BufferedImage.TYPE_BYTE_GRAY) {
            return image;
        }
        int width = image.getWidth();
        int height = image.getHeight();
        BufferedImage gray = new BufferedImage(width, height, BufferedImage.TYPE_BYTE_GRAY);
        WritableRaster raster = gray.getRaster();
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                int rgb = image.getRGB(x, y);
                int r = (rgb >> 16) & 0xFF;
                int g = (rgb >> 8) & 0xFF;
                int b = rgb & 0xFF;
                raster.setSample(x, y, 0, (299 * r + 587 * g + 114 * b + 500) / 1000);
            }
        }
        return gray;
    }
}
