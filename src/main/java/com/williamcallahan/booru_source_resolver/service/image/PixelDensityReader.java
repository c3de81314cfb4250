package com.williamcallahan.booru_source_resolver.service.image;

import com.williamcallahan.booru_source_resolver.types.DecodeException;
import org.springframework.stereotype.Component;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Optional;

/**
 * Reads the physical pixel density ({@code pHYs} chunk) of a PNG.
 * Genuine crop tiles carry a density; placeholder tiles served for missing chunks do not.
 */
@Component
public class PixelDensityReader {

    private static final byte[] PNG_SIGNATURE = {(byte) 0x89, 'P', 'N', 'G', '\r', '\n', 0x1A, '\n'};

    public record PixelDensity(long pixelsPerUnitX, long pixelsPerUnitY, int unit) {
        public boolean isDefault() {
            return pixelsPerUnitX == 0 || pixelsPerUnitY == 0;
        }
    }

    /**
     * @throws DecodeException if the bytes are not a well-formed PNG chunk stream
     */
    public Optional<PixelDensity> read(byte[] png) {
        if (png == null || png.length < PNG_SIGNATURE.length
            || !Arrays.equals(Arrays.copyOf(png, PNG_SIGNATURE.length), PNG_SIGNATURE)) {
            throw new DecodeException("Not a PNG stream");
        }
        ByteBuffer buffer = ByteBuffer.wrap(png);
        buffer.position(PNG_SIGNATURE.length);
        while (buffer.remaining() >= 12) {
            long length = Integer.toUnsignedLong(buffer.getInt());
            byte[] typeBytes = new byte[4];
            buffer.get(typeBytes);
            String type = new String(typeBytes, StandardCharsets.US_ASCII);
            if (length > buffer.remaining() - 4) {
                throw new DecodeException("Truncated PNG chunk " + type);
            }
            if ("pHYs".equals(type) && length >= 9) {
                long x = Integer.toUnsignedLong(buffer.getInt());
                long y = Integer.toUnsignedLong(buffer.getInt());
                int unit = buffer.get() & 0xFF;
                return Optional.of(new PixelDensity(x, y, unit));
            }
            if ("IDAT".equals(type) || "IEND".equals(type)) {
                return Optional.empty(); // pHYs must precede image data
            }
            buffer.position(buffer.position() + (int) length + 4);
        }
        return Optional.empty();
    }

    /**
     * True when the PNG declares a non-zero density on both axes
     */
    public boolean hasNonDefaultDensity(byte[] png) {
        return read(png).map(density -> !density.isDefault()).orElse(false);
    }
}
