package de.mirkosertic.imagemonitor.monitor;

import javax.imageio.ImageIO;
import java.awt.Color;
import java.awt.Graphics2D;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;

/**
 * Writes small image fixtures for tests.
 */
final class ImageFixtures {

    private ImageFixtures() {
    }

    static Path createImage(final Path file, final String format) throws IOException {
        final BufferedImage image = new BufferedImage(16, 12, BufferedImage.TYPE_INT_RGB);
        final Graphics2D graphics = image.createGraphics();
        try {
            graphics.setColor(Color.ORANGE);
            graphics.fillRect(0, 0, 16, 12);
        } finally {
            graphics.dispose();
        }
        if (!ImageIO.write(image, format, file.toFile())) {
            throw new IOException("No ImageIO writer for " + format);
        }
        return file;
    }

    static Path createPng(final Path file) throws IOException {
        return createImage(file, "png");
    }

    /**
     * A PNG cut off right after its signature.
     */
    static Path createTruncatedPng(final Path file) throws IOException {
        final Path full = createPng(file.resolveSibling("full-" + file.getFileName()));
        final byte[] bytes = Files.readAllBytes(full);
        Files.write(file, Arrays.copyOf(bytes, 8));
        Files.delete(full);
        return file;
    }

    static Path createTextFile(final Path file) throws IOException {
        Files.writeString(file, "This is definitely not an image, just some plain text.\n", StandardCharsets.UTF_8);
        return file;
    }
}
