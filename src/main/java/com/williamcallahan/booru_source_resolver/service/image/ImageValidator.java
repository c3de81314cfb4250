package com.williamcallahan.booru_source_resolver.service.image;

import com.williamcallahan.booru_source_resolver.model.image.OriginalFileDescriptor;
import com.williamcallahan.booru_source_resolver.model.image.ProbeResult;
import com.williamcallahan.booru_source_resolver.types.ValidationException;
import org.springframework.stereotype.Component;

/**
 * Compares a probe against the caller-known descriptor. Absent descriptor fields are not checked.
 */
@Component
public class ImageValidator {

    public void validate(ProbeResult probe, long byteLength, OriginalFileDescriptor descriptor) {
        if (descriptor == null) {
            return;
        }
        if (descriptor.getType() != null && !descriptor.getType().equals(probe.getType())) {
            throw new ValidationException("Unexpected image type: \"" + probe.getType()
                + "\" (expected \"" + descriptor.getType() + "\")");
        }
        if (descriptor.getWidth() != null && descriptor.getWidth() != probe.getWidth()
            || descriptor.getHeight() != null && descriptor.getHeight() != probe.getHeight()) {
            throw new ValidationException("Unexpected image size: " + probe.dimensions()
                + " (expected " + orUnknown(descriptor.getWidth()) + "x" + orUnknown(descriptor.getHeight()) + ")");
        }
        if (descriptor.getSize() != null && descriptor.getSize() != byteLength) {
            throw new ValidationException("Unexpected file size: " + byteLength
                + " bytes (expected " + descriptor.getSize() + " bytes)");
        }
    }

    private static String orUnknown(Integer value) {
        return value != null ? value.toString() : "?";
    }
}
