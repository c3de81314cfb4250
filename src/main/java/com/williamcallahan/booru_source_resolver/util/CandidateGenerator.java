/**
 * Pure candidate generation for the historical locator and the tile reconstructor
 *
 * @author William Callahan
 *
 * Features:
 * - Day offsets searched outward from the publish date, never past today
 * - 512 storage-path candidates per day (2 directory flags x 16 x 16 shards)
 * - Row-major tile grid with truncated edge tiles
 * - Crop and fullview URL construction from viewer metadata
 */
package com.williamcallahan.booru_source_resolver.util;

import com.williamcallahan.booru_source_resolver.model.image.TileSpec;
import com.williamcallahan.booru_source_resolver.model.locator.CandidateUrl;
import com.williamcallahan.booru_source_resolver.model.source.HistoricalSeed;
import com.williamcallahan.booru_source_resolver.model.source.ViewerMedia;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

public final class CandidateGenerator {

    public static final String FLAG_DOWNLOADABLE = "f";
    public static final String FLAG_VIEW_ONLY = "i";
    public static final int SHARD_RANGE = 16;
    public static final int CANDIDATES_PER_DAY = 2 * SHARD_RANGE * SHARD_RANGE;

    private CandidateGenerator() {
    }

    /**
     * Offsets in search order: 0, -1..-radius, +1..+radius
     */
    public static List<Integer> dayOffsets(int radius) {
        List<Integer> offsets = new ArrayList<>(2 * radius + 1);
        offsets.add(0);
        for (int i = 1; i <= radius; i++) {
            offsets.add(-i);
        }
        for (int i = 1; i <= radius; i++) {
            offsets.add(i);
        }
        return offsets;
    }

    /**
     * Days to search around a publish date in search order, skipping any day after {@code today}
     */
    public static List<LocalDate> searchDays(LocalDate publishDate, int radius, LocalDate today) {
        List<LocalDate> days = new ArrayList<>();
        for (int offset : dayOffsets(radius)) {
            LocalDate day = publishDate.plusDays(offset);
            if (!day.isAfter(today)) {
                days.add(day);
            }
        }
        return days;
    }

    /**
     * Directory flags ordered by the downloadable hint
     */
    public static List<String> flagOrder(boolean downloadableHint) {
        return downloadableHint
            ? List.of(FLAG_DOWNLOADABLE, FLAG_VIEW_ONLY)
            : List.of(FLAG_VIEW_ONLY, FLAG_DOWNLOADABLE);
    }

    /**
     * All storage candidates for one day, flag-major then shard A then shard B
     *
     * @example
     * <pre>
     * {base}/f/2015/032/0/0{suffix}, {base}/f/2015/032/0/1{suffix}, ..., {base}/i/2015/032/f/f{suffix}
     * </pre>
     */
    public static List<CandidateUrl> candidatesForDay(HistoricalSeed seed, LocalDate day) {
        String base = stripTrailingSlash(seed.getBaseUrl());
        String suffix = seed.getSuffix() != null ? seed.getSuffix() : "";
        String datePath = day.getYear() + "/" + String.format("%03d", day.getDayOfYear());
        List<CandidateUrl> candidates = new ArrayList<>(CANDIDATES_PER_DAY);
        for (String flag : flagOrder(seed.isDownloadableHint())) {
            for (int a = 0; a < SHARD_RANGE; a++) {
                for (int b = 0; b < SHARD_RANGE; b++) {
                    String url = base + "/" + flag + "/" + datePath + "/"
                        + Integer.toHexString(a) + "/" + Integer.toHexString(b) + suffix;
                    candidates.add(new CandidateUrl(url, day, flag, a, b));
                }
            }
        }
        return candidates;
    }

    /**
     * Row-major tiles covering the canvas; the last column and row are truncated to fit
     */
    public static List<TileSpec> tileGrid(int imageWidth, int imageHeight, int chunkWidth, int chunkHeight) {
        if (imageWidth <= 0 || imageHeight <= 0 || chunkWidth <= 0 || chunkHeight <= 0) {
            throw new IllegalArgumentException("Tile grid needs positive sizes, got canvas "
                + imageWidth + "x" + imageHeight + " and chunk " + chunkWidth + "x" + chunkHeight);
        }
        List<TileSpec> tiles = new ArrayList<>();
        for (int y = 0; y < imageHeight; y += chunkHeight) {
            for (int x = 0; x < imageWidth; x += chunkWidth) {
                tiles.add(new TileSpec(x, y, Math.min(chunkWidth, imageWidth - x), Math.min(chunkHeight, imageHeight - y)));
            }
        }
        return tiles;
    }

    /**
     * Fills the crop command template for one tile and appends the rendition token
     */
    public static String cropUrl(ViewerMedia media, TileSpec tile) {
        String command = media.getCropCommand()
            .replace(ViewerMedia.PLACEHOLDER_WIDTH, Integer.toString(tile.width()))
            .replace(ViewerMedia.PLACEHOLDER_HEIGHT, Integer.toString(tile.height()))
            .replace(ViewerMedia.PLACEHOLDER_X, Integer.toString(tile.x()))
            .replace(ViewerMedia.PLACEHOLDER_Y, Integer.toString(tile.y()))
            .replace(ViewerMedia.PLACEHOLDER_NAME, media.getPrettyName() != null ? media.getPrettyName() : "");
        return withToken(stripTrailingSlash(media.getBaseUri()) + ensureLeadingSlash(command), media.token());
    }

    /**
     * URL of the stored rendition itself, authorized by its token
     */
    public static String fullviewUrl(ViewerMedia media) {
        return withToken(media.getBaseUri(), media.token());
    }

    private static String withToken(String url, String token) {
        if (token == null || token.isBlank()) {
            return url;
        }
        return url + (url.contains("?") ? "&" : "?") + "token=" + token;
    }

    private static String stripTrailingSlash(String value) {
        return value.endsWith("/") ? value.substring(0, value.length() - 1) : value;
    }

    private static String ensureLeadingSlash(String value) {
        return value.startsWith("/") ? value : "/" + value;
    }
}
