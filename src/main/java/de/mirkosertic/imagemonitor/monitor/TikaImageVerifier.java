package de.mirkosertic.imagemonitor.monitor;

import org.apache.tika.io.TikaInputStream;
import org.apache.tika.metadata.Metadata;
import org.apache.tika.mime.MediaType;
import org.apache.tika.mime.MimeTypes;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.imageio.ImageIO;
import javax.imageio.ImageReader;
import javax.imageio.stream.ImageInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Iterator;

/**
 * Verifies images by their content instead of their name.
 * <p>
 * The media type is detected from magic bytes only, the file name is not passed to Tika.
 * For types the JDK can read, the header of the first image is parsed to check its
 * dimensions, which catches files truncated right after the signature. Pixel data is
 * never decoded.
 */
public class TikaImageVerifier implements ImageVerifier {

    private static final Logger logger = LoggerFactory.getLogger(TikaImageVerifier.class);

    private final MimeTypes mimeTypes;

    public TikaImageVerifier() {
        this(MimeTypes.getDefaultMimeTypes());
    }

    TikaImageVerifier(final MimeTypes mimeTypes) {
        this.mimeTypes = mimeTypes;
    }

    @Override
    public void verify(final Path file) throws IOException, InvalidImageException {
        if (Files.size(file) == 0) {
            throw new InvalidImageException("File is empty");
        }

        final MediaType mediaType = detect(file);
        if (!"image".equals(mediaType.getType())) {
            throw new InvalidImageException("Content is " + mediaType + ", not an image");
        }

        final String mimeType = mediaType.getBaseType().toString();
        final Iterator<ImageReader> readers = ImageIO.getImageReadersByMIMEType(mimeType);
        if (!readers.hasNext()) {
            logger.debug("No ImageIO reader for {}, accepting {} on signature alone", mimeType, file);
            return;
        }
        readHeader(file, readers.next());
    }

    private MediaType detect(final Path file) throws IOException {
        try (InputStream stream = TikaInputStream.get(file)) {
            return mimeTypes.detect(stream, new Metadata());
        }
    }

    private void readHeader(final Path file, final ImageReader reader) throws IOException, InvalidImageException {
        try (ImageInputStream input = ImageIO.createImageInputStream(file.toFile())) {
            if (input == null) {
                throw new IOException("Cannot open image stream for " + file);
            }
            reader.setInput(input, true, true);
            final int width;
            final int height;
            try {
                width = reader.getWidth(0);
                height = reader.getHeight(0);
            } catch (final IOException e) {
                throw new InvalidImageException("Unreadable image header: " + e.getMessage(), e);
            }
            if (width <= 0 || height <= 0) {
                throw new InvalidImageException("Invalid image dimensions " + width + "x" + height);
            }
            logger.debug("Verified {} ({}x{})", file, width, height);
        } finally {
            reader.dispose();
        }
    }
}
