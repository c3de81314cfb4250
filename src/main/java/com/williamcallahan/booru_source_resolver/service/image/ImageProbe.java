/**
 * Reads the true type and dimensions of image bytes from their headers
 *
 * @author William Callahan
 *
 * Features:
 * - Header-only probing through ImageIO readers, pixels are never decoded
 * - Normalized type names (jpg, png, gif, bmp)
 * - Declared quarter-turn rotations swap width and height
 * - Fetch-and-probe composition keeping fetch and decode failures distinct
 * - Single acceptance gate shared by every acquisition strategy
 */
package com.williamcallahan.booru_source_resolver.service.image;

import com.williamcallahan.booru_source_resolver.model.image.OriginalFileDescriptor;
import com.williamcallahan.booru_source_resolver.model.image.ProbeResult;
import com.williamcallahan.booru_source_resolver.model.image.SourceImage;
import com.williamcallahan.booru_source_resolver.service.fetch.RateLimitedFetchClient;
import com.williamcallahan.booru_source_resolver.types.DecodeException;
import com.williamcallahan.booru_source_resolver.util.ImageTypeUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import javax.imageio.ImageIO;
import javax.imageio.ImageReader;
import javax.imageio.stream.ImageInputStream;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.util.Iterator;
import java.util.Map;

@Service
public class ImageProbe {

    private static final Logger logger = LoggerFactory.getLogger(ImageProbe.class);

    private final RateLimitedFetchClient fetchClient;
    private final ImageValidator validator;

    public ImageProbe(RateLimitedFetchClient fetchClient, ImageValidator validator) {
        this.fetchClient = fetchClient;
        this.validator = validator;
    }

    public ProbeResult probe(byte[] bytes) {
        return probe(bytes, 0);
    }

    /**
     * Probes image bytes
     *
     * @param bytes image payload
     * @param declaredRotationDegrees rotation declared by the platform; 90 and 270 swap the axes
     * @return type and dimensions read from the header
     * @throws DecodeException if no reader recognizes the header or the header is unreadable
     */
    public ProbeResult probe(byte[] bytes, int declaredRotationDegrees) {
        if (bytes == null || bytes.length == 0) {
            throw new DecodeException("Cannot probe an empty payload");
        }
        try (ImageInputStream input = ImageIO.createImageInputStream(new ByteArrayInputStream(bytes))) {
            if (input == null) {
                throw new DecodeException("No image input stream available for " + bytes.length + " bytes");
            }
            Iterator<ImageReader> readers = ImageIO.getImageReaders(input);
            if (!readers.hasNext()) {
                throw new DecodeException("Unrecognized image header (" + bytes.length + " bytes)");
            }
            ImageReader reader = readers.next();
            try {
                reader.setInput(input, true, true);
                String type = ImageTypeUtils.normalize(reader.getFormatName());
                int width = reader.getWidth(0);
                int height = reader.getHeight(0);
                if (width <= 0 || height <= 0) {
                    throw new DecodeException("Indeterminate dimensions " + width + "x" + height + " in " + type + " header");
                }
                return new ProbeResult(type, width, height).rotated(declaredRotationDegrees);
            } finally {
                reader.dispose();
            }
        } catch (IOException | RuntimeException e) {
            if (e instanceof DecodeException decodeException) {
                throw decodeException;
            }
            throw new DecodeException("Unreadable image header: " + e.getMessage(), e);
        }
    }

    /**
     * Probes bytes and checks them against the descriptor
     *
     * @return the accepted image
     * @throws DecodeException if the header is unreadable
     * @throws com.williamcallahan.booru_source_resolver.types.ValidationException if type, size or byte length differ
     */
    public SourceImage accept(byte[] bytes, String url, String filename, OriginalFileDescriptor descriptor) {
        return accept(bytes, url, filename, descriptor, 0);
    }

    /**
     * Same as {@link #accept(byte[], String, String, OriginalFileDescriptor)} for a platform that
     * declares the stored file rotated
     */
    public SourceImage accept(byte[] bytes, String url, String filename, OriginalFileDescriptor descriptor,
                              int declaredRotationDegrees) {
        ProbeResult probe = probe(bytes, declaredRotationDegrees);
        validator.validate(probe, bytes.length, descriptor);
        logger.debug("Accepted {} {} from {}", probe.getType(), probe.dimensions(), url != null ? url : "local bytes");
        return SourceImage.of(bytes, url, filename, probe);
    }

    /**
     * Fetches a URL on the API pool and probes the body without validating it
     * FetchException and DecodeException stay distinct in the error signal
     */
    public Mono<SourceImage> probeFromUrl(String url, Map<String, String> headers) {
        return fetchClient.getBytes(url, headers)
            .map(bytes -> SourceImage.of(bytes, url, null, probe(bytes)));
    }

    /**
     * Fetches a URL, probes it and checks it against the descriptor
     */
    public Mono<SourceImage> fetchAndAccept(String url, Map<String, String> headers, String filename,
                                           OriginalFileDescriptor descriptor, int declaredRotationDegrees) {
        return fetchClient.getBytes(url, headers)
            .map(bytes -> accept(bytes, url, filename, descriptor, declaredRotationDegrees));
    }
}
