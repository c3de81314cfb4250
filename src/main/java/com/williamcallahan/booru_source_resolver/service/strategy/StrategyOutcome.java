package com.williamcallahan.booru_source_resolver.service.strategy;

import com.williamcallahan.booru_source_resolver.model.image.SourceImage;

/**
 * Result of a strategy that did not fail: either an accepted image or a reason it does not apply.
 */
public final class StrategyOutcome {

    private final SourceImage image;
    private final String reason;

    private StrategyOutcome(SourceImage image, String reason) {
        this.image = image;
        this.reason = reason;
    }

    public static StrategyOutcome accepted(SourceImage image) {
        return new StrategyOutcome(image, null);
    }

    public static StrategyOutcome notApplicable(String reason) {
        return new StrategyOutcome(null, reason);
    }

    public boolean isAccepted() {
        return image != null;
    }

    public SourceImage getImage() {
        return image;
    }

    public String getReason() {
        return reason;
    }

    @Override
    public String toString() {
        return isAccepted() ? "Accepted(" + image + ")" : "NotApplicable(" + reason + ")";
    }
}
