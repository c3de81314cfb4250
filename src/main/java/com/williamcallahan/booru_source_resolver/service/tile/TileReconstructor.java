/**
 * Rebuilds an original PNG from crop tiles of its stored canvas
 *
 * @author William Callahan
 *
 * Features:
 * - Computes the tile grid from the canonical size and the viewer chunk size
 * - Fetches tiles concurrently on the API pool
 * - Rejects placeholder tiles (no pixel density), unreadable tiles and mis-sized tiles
 * - Any bad tile aborts the whole reconstruction, no partial image is produced
 * - Composites onto one canvas, encodes a single PNG and probes it
 */
package com.williamcallahan.booru_source_resolver.service.tile;

import com.williamcallahan.booru_source_resolver.model.image.OriginalFileDescriptor;
import com.williamcallahan.booru_source_resolver.model.image.SourceImage;
import com.williamcallahan.booru_source_resolver.model.image.TileSpec;
import com.williamcallahan.booru_source_resolver.model.source.ViewerMedia;
import com.williamcallahan.booru_source_resolver.service.fetch.FetchPool;
import com.williamcallahan.booru_source_resolver.service.fetch.RateLimitedFetchClient;
import com.williamcallahan.booru_source_resolver.service.image.ImageProbe;
import com.williamcallahan.booru_source_resolver.service.image.PixelDensityReader;
import com.williamcallahan.booru_source_resolver.types.BadChunkException;
import com.williamcallahan.booru_source_resolver.types.DecodeException;
import com.williamcallahan.booru_source_resolver.types.FetchException;
import com.williamcallahan.booru_source_resolver.types.NotApplicableException;
import com.williamcallahan.booru_source_resolver.util.CandidateGenerator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import javax.imageio.ImageIO;
import java.awt.Graphics2D;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.List;
import java.util.Map;

@Service
public class TileReconstructor {

    private static final Logger logger = LoggerFactory.getLogger(TileReconstructor.class);
    private static final String PNG = "png";

    private final RateLimitedFetchClient fetchClient;
    private final ImageProbe imageProbe;
    private final PixelDensityReader densityReader;

    public TileReconstructor(RateLimitedFetchClient fetchClient, ImageProbe imageProbe, PixelDensityReader densityReader) {
        this.fetchClient = fetchClient;
        this.imageProbe = imageProbe;
        this.densityReader = densityReader;
    }

    private record FetchedTile(TileSpec spec, BufferedImage image) {
    }

    /**
     * Reconstructs the original image
     *
     * @param media viewer rendition carrying the crop command, chunk size and token
     * @param descriptor canonical type and size; must be a PNG with known dimensions
     * @param headers headers attached to every tile request
     * @param filename filename for the result, may be null
     * @return the composited image, NotApplicableException when preconditions fail,
     *         or BadChunkException when any tile is bad
     */
    public Mono<SourceImage> reconstruct(ViewerMedia media, OriginalFileDescriptor descriptor,
                                         Map<String, String> headers, String filename) {
        if (media == null || !media.hasCropCommand()) {
            return Mono.error(new NotApplicableException("No crop command available for tile reconstruction"));
        }
        if (descriptor == null || !PNG.equals(descriptor.getType()) || !descriptor.hasDimensions()) {
            return Mono.error(new NotApplicableException("Tile reconstruction needs a PNG descriptor with dimensions, got " + descriptor));
        }

        if (media.effectiveChunkWidth() <= 0 || media.effectiveChunkHeight() <= 0) {
            return Mono.error(new NotApplicableException("Viewer media has no usable chunk size, got "
                + media.effectiveChunkWidth() + "x" + media.effectiveChunkHeight()));
        }

        int width = descriptor.getWidth();
        int height = descriptor.getHeight();
        List<TileSpec> tiles = CandidateGenerator.tileGrid(width, height, media.effectiveChunkWidth(), media.effectiveChunkHeight());
        logger.info("Reconstructing {}x{} PNG from {} tiles of {}x{}", width, height, tiles.size(),
            media.effectiveChunkWidth(), media.effectiveChunkHeight());

        int concurrency = fetchClient.capacity(FetchPool.API);
        return Flux.fromIterable(tiles)
            .flatMap(tile -> fetchTile(media, tile, headers), concurrency)
            .collectList()
            .publishOn(Schedulers.boundedElastic())
            .map(fetched -> composite(fetched, width, height))
            .map(bytes -> imageProbe.accept(bytes, null, filename, descriptor));
    }

    private Mono<FetchedTile> fetchTile(ViewerMedia media, TileSpec tile, Map<String, String> headers) {
        String url = CandidateGenerator.cropUrl(media, tile);
        return fetchClient.getBytes(url, headers)
            .onErrorMap(FetchException.class, e -> new BadChunkException(tile, "fetch failed: " + e.getMessage(), e))
            .switchIfEmpty(Mono.error(() -> new BadChunkException(tile, "no response")))
            .flatMap(bytes -> Mono.fromCallable(() -> new FetchedTile(tile, decodeTile(tile, bytes)))
                .subscribeOn(Schedulers.boundedElastic()));
    }

    BufferedImage decodeTile(TileSpec tile, byte[] bytes) {
        try {
            if (!densityReader.hasNonDefaultDensity(bytes)) {
                throw new BadChunkException(tile, "placeholder tile without pixel density");
            }
        } catch (DecodeException e) {
            throw new BadChunkException(tile, "not a PNG tile", e);
        }
        BufferedImage image;
        try {
            image = ImageIO.read(new ByteArrayInputStream(bytes));
        } catch (IOException e) {
            throw new BadChunkException(tile, "unreadable tile", e);
        }
        if (image == null) {
            throw new BadChunkException(tile, "unreadable tile");
        }
        if (image.getWidth() != tile.width() || image.getHeight() != tile.height()) {
            throw new BadChunkException(tile, "tile is " + image.getWidth() + "x" + image.getHeight());
        }
        return image;
    }

    private byte[] composite(List<FetchedTile> fetched, int width, int height) {
        BufferedImage canvas = new BufferedImage(width, height, BufferedImage.TYPE_INT_ARGB);
        Graphics2D g2d = canvas.createGraphics();
        try {
            for (FetchedTile tile : fetched) {
                g2d.drawImage(tile.image(), tile.spec().x(), tile.spec().y(), null);
            }
        } finally {
            g2d.dispose();
        }
        try (ByteArrayOutputStream out = new ByteArrayOutputStream()) {
            if (!ImageIO.write(canvas, PNG, out)) {
                throw new IllegalStateException("No PNG writer available");
            }
            return out.toByteArray();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to encode reconstructed PNG", e);
        }
    }
}
