package com.williamcallahan.booru_source_resolver.service.tile;

import com.williamcallahan.booru_source_resolver.model.image.OriginalFileDescriptor;
import com.williamcallahan.booru_source_resolver.model.image.TileSpec;
import com.williamcallahan.booru_source_resolver.model.source.ViewerMedia;
import com.williamcallahan.booru_source_resolver.service.fetch.FetchRequest;
import com.williamcallahan.booru_source_resolver.service.fetch.FetchResponse;
import com.williamcallahan.booru_source_resolver.service.fetch.RateLimitedFetchClient;
import com.williamcallahan.booru_source_resolver.service.image.ImageProbe;
import com.williamcallahan.booru_source_resolver.service.image.ImageValidator;
import com.williamcallahan.booru_source_resolver.service.image.PixelDensityReader;
import com.williamcallahan.booru_source_resolver.testutil.ImageTestData;
import com.williamcallahan.booru_source_resolver.testutil.ResolverTestProperties;
import com.williamcallahan.booru_source_resolver.testutil.ScriptedHttpFetcher;
import com.williamcallahan.booru_source_resolver.types.BadChunkException;
import com.williamcallahan.booru_source_resolver.types.NotApplicableException;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import javax.imageio.ImageIO;
import java.awt.Color;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import static org.assertj.core.api.Assertions.assertThat;

class TileReconstructorTest {

    private static final Pattern CROP = Pattern.compile("w_(\\d+),h_(\\d+),x_(\\d+),y_(\\d+)");
    private static final int DENSITY = 2835;

    private final ViewerMedia media = ViewerMedia.builder()
        .baseUri("https://images.example/f/abc/def.png")
        .prettyName("night_sky")
        .tokens(List.of("tok0"))
        .tokenIndex(0)
        .width(50)
        .height(35)
        .cropCommand("v1/crop/w_{width},h_{height},x_{x},y_{y}/<prettyName>.png")
        .chunkWidth(40)
        .chunkHeight(30)
        .build();

    private final OriginalFileDescriptor descriptor = OriginalFileDescriptor.of("png", 100, 70);

    private TileReconstructor reconstructor(ScriptedHttpFetcher fetcher) {
        RateLimitedFetchClient client = new RateLimitedFetchClient(fetcher, ResolverTestProperties.fast(), ResolverTestProperties.bulkheads());
        return new TileReconstructor(client, new ImageProbe(client, new ImageValidator()), new PixelDensityReader());
    }

    /**
     * Serves each crop as a tile of the requested size colored by its offset
     */
    private static Function<FetchRequest, Mono<FetchResponse>> tiles(Function<int[], byte[]> override) {
        return request -> {
            Matcher matcher = CROP.matcher(request.getUrl());
            if (!matcher.find()) {
                return ScriptedHttpFetcher.status(404);
            }
            int[] crop = {
                Integer.parseInt(matcher.group(1)), Integer.parseInt(matcher.group(2)),
                Integer.parseInt(matcher.group(3)), Integer.parseInt(matcher.group(4))
            };
            byte[] custom = override.apply(crop);
            if (custom != null) {
                return ScriptedHttpFetcher.ok(custom);
            }
            return ScriptedHttpFetcher.ok(ImageTestData.pngWithDensity(crop[0], crop[1], new Color(crop[2], crop[3], 100), DENSITY));
        };
    }

    @Test
    void reconstruct_compositesEveryTile() throws IOException {
        ScriptedHttpFetcher fetcher = new ScriptedHttpFetcher(tiles(crop -> null));

        var result = reconstructor(fetcher).reconstruct(media, descriptor, Map.of(), "def.png").block();

        assertThat(result).isNotNull();
        assertThat(result.getType()).isEqualTo("png");
        assertThat(result.getWidth()).isEqualTo(100);
        assertThat(result.getHeight()).isEqualTo(70);
        assertThat(result.getFilename()).isEqualTo("def.png");
        assertThat(fetcher.requests()).hasSize(9);
        assertThat(fetcher.urls())
            .contains("https://images.example/f/abc/def.png/v1/crop/w_20,h_10,x_80,y_60/night_sky.png?token=tok0")
            .allMatch(url -> url.endsWith("?token=tok0"));

        BufferedImage image = ImageIO.read(new ByteArrayInputStream(result.getBytes()));
        assertThat(image.getRGB(50, 35) & 0xFFFFFF).isEqualTo(new Color(40, 30, 100).getRGB() & 0xFFFFFF);
        assertThat(image.getRGB(99, 69) & 0xFFFFFF).isEqualTo(new Color(80, 60, 100).getRGB() & 0xFFFFFF);
    }

    @Test
    void reconstruct_placeholderTileAbortsWithBadChunk() {
        ScriptedHttpFetcher fetcher = new ScriptedHttpFetcher(tiles(crop ->
            crop[2] == 40 && crop[3] == 30 ? ImageTestData.png(crop[0], crop[1]) : null));

        StepVerifier.create(reconstructor(fetcher).reconstruct(media, descriptor, Map.of(), null))
            .expectErrorSatisfies(error -> {
                assertThat(error).isInstanceOf(BadChunkException.class);
                assertThat(((BadChunkException) error).getTile().x()).isEqualTo(40);
            })
            .verify();
    }

    @Test
    void reconstruct_wrongSizedTileAbortsWithBadChunk() {
        ScriptedHttpFetcher fetcher = new ScriptedHttpFetcher(tiles(crop ->
            crop[2] == 0 && crop[3] == 0 ? ImageTestData.pngWithDensity(39, 30, Color.RED, DENSITY) : null));

        StepVerifier.create(reconstructor(fetcher).reconstruct(media, descriptor, Map.of(), null))
            .expectError(BadChunkException.class)
            .verify();
    }

    @Test
    void reconstruct_failedTileFetchAbortsWithBadChunk() {
        ScriptedHttpFetcher fetcher = new ScriptedHttpFetcher(request -> request.getUrl().contains("x_80,y_0")
            ? ScriptedHttpFetcher.status(403)
            : tiles(crop -> null).apply(request));

        StepVerifier.create(reconstructor(fetcher).reconstruct(media, descriptor, Map.of(), null))
            .expectError(BadChunkException.class)
            .verify();
    }

    @Test
    void reconstruct_nonPngDescriptorIsNotApplicable() {
        ScriptedHttpFetcher fetcher = new ScriptedHttpFetcher(tiles(crop -> null));

        StepVerifier.create(reconstructor(fetcher).reconstruct(media, OriginalFileDescriptor.of("jpg", 100, 70), Map.of(), null))
            .expectError(NotApplicableException.class)
            .verify();

        assertThat(fetcher.requests()).isEmpty();
    }

    @Test
    void reconstruct_missingCropCommandIsNotApplicable() {
        ViewerMedia plain = ViewerMedia.builder().baseUri("https://images.example/f/abc/def.png").width(50).height(35).tokenIndex(-1).build();

        StepVerifier.create(reconstructor(new ScriptedHttpFetcher(tiles(crop -> null))).reconstruct(plain, descriptor, Map.of(), null))
            .expectError(NotApplicableException.class)
            .verify();
    }

    @Test
    void reconstruct_missingChunkAndRenditionSizeIsNotApplicable() {
        ViewerMedia unsized = ViewerMedia.builder()
            .baseUri("https://images.example/f/abc/def.png")
            .prettyName("night_sky")
            .tokenIndex(-1)
            .cropCommand("v1/crop/w_{width},h_{height},x_{x},y_{y}/<prettyName>.png")
            .build();
        ScriptedHttpFetcher fetcher = new ScriptedHttpFetcher(tiles(crop -> null));

        StepVerifier.create(reconstructor(fetcher).reconstruct(unsized, descriptor, Map.of(), null))
            .expectErrorSatisfies(error -> {
                assertThat(error).isInstanceOf(NotApplicableException.class);
                assertThat(error.getMessage()).contains("0x0");
            })
            .verify();

        assertThat(fetcher.requests()).isEmpty();
    }

    @Test
    void reconstruct_decodesTilesOffTheFetchThread() {
        ScriptedHttpFetcher fetcher = new ScriptedHttpFetcher(tiles(crop -> null));
        RateLimitedFetchClient client = new RateLimitedFetchClient(fetcher, ResolverTestProperties.fast(),
            ResolverTestProperties.bulkheads());
        Set<String> decodeThreads = ConcurrentHashMap.newKeySet();
        TileReconstructor recording = new TileReconstructor(client, new ImageProbe(client, new ImageValidator()),
            new PixelDensityReader()) {
            @Override
            BufferedImage decodeTile(TileSpec tile, byte[] bytes) {
                decodeThreads.add(Thread.currentThread().getName());
                return super.decodeTile(tile, bytes);
            }
        };

        StepVerifier.create(recording.reconstruct(media, descriptor, Map.of(), null))
            .assertNext(image -> assertThat(image.getWidth()).isEqualTo(100))
            .verifyComplete();

        assertThat(decodeThreads).isNotEmpty().allMatch(name -> name.startsWith("boundedElastic"));
    }
}
