package com.keypointcensus.core.traversal;

import com.keypointcensus.core.detection.DetectorType;
import com.keypointcensus.core.model.Keypoint;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.imageio.ImageIO;
import java.awt.BasicStroke;
import java.awt.Color;
import java.awt.Graphics2D;
import java.awt.RenderingHints;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;

/**
 * Draws keypoints as circles scaled to their size, with a radius marking the
 * orientation where the detector provides one, and writes the result as
 * {@code <stem>__<DETECTOR>.jpg}.
 *
 * @since 1.0.0
 */
public class Java2dAnnotator implements Annotator {

    private static final Logger LOG = LoggerFactory.getLogger(Java2dAnnotator.class);

    private static final Color KEYPOINT_COLOR = new Color(0, 0, 255);

    private final OutputLayout layout;

    /**
     * @param layout decides which directory receives each annotated image
     */
    public Java2dAnnotator(OutputLayout layout) {
        this.layout = Objects.requireNonNull(layout, "Output layout must not be null");
    }

    @Override
    public void annotate(Path image, BufferedImage grayImage, DetectorType detector, List<Keypoint> keypoints)
            throws IOException {
        Path dir = layout.outputDirectoryFor(image.getParent());
        Files.createDirectories(dir);
        Path target = dir.resolve(annotationFileName(image, detector));

        BufferedImage canvas = new BufferedImage(
                grayImage.getWidth(), grayImage.getHeight(), BufferedImage.TYPE_INT_RGB);
        Graphics2D g = canvas.createGraphics();
        try {
            g.drawImage(grayImage, 0, 0, null);
            g.setRenderingHint(RenderingHints.KEY_ANTIALIASING, RenderingHints.VALUE_ANTIALIAS_ON);
            g.setColor(KEYPOINT_COLOR);
            g.setStroke(new BasicStroke(1f));
            for (Keypoint kp : keypoints) {
                drawKeypoint(g, kp);
            }
        } finally {
            g.dispose();
        }

        if (!ImageIO.write(canvas, "jpg", target.toFile())) {
            throw new IOException("No JPEG writer available for " + target);
        }
        LOG.debug("Wrote {} keypoint(s) to {}", keypoints.size(), target);
    }

    /**
     * @param image    source image
     * @param detector detector whose keypoints are drawn
     * @return e.g. {@code photo__SIFT.jpg} for {@code photo.jpg}
     */
    static String annotationFileName(Path image, DetectorType detector) {
        String name = image.getFileName().toString();
        int dot = name.lastIndexOf('.');
        String stem = dot > 0 ? name.substring(0, dot) : name;
        return stem + "__" + detector.canonicalName() + ".jpg";
    }

    /**
     * @param file any file
     * @return {@code true} if the name has the shape of an annotation written
     *         by this class, e.g. {@code photo__SIFT.jpg}
     */
    static boolean isAnnotationFile(Path file) {
        String name = file.getFileName().toString();
        for (DetectorType type : DetectorType.values()) {
            String suffix = "__" + type.canonicalName() + ".jpg";
            if (name.length() > suffix.length() && name.endsWith(suffix)) {
                return true;
            }
        }
        return false;
    }

    private static void drawKeypoint(Graphics2D g, Keypoint kp) {
        double radius = Math.max(1.0, kp.getSize() / 2.0);
        double cx = kp.getX();
        double cy = kp.getY();
        int diameter = (int) Math.round(radius * 2);
        g.drawOval((int) Math.round(cx - radius), (int) Math.round(cy - radius), diameter, diameter);
        if (kp.getAngle() >= 0) {
            double rad = Math.toRadians(kp.getAngle());
            g.drawLine((int) Math.round(cx), (int) Math.round(cy),
                    (int) Math.round(cx + radius * Math.cos(rad)),
                    (int) Math.round(cy + radius * Math.sin(rad)));
        }
    }
}
