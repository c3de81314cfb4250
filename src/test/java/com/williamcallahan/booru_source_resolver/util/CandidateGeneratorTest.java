package com.williamcallahan.booru_source_resolver.util;

import com.williamcallahan.booru_source_resolver.model.image.TileSpec;
import com.williamcallahan.booru_source_resolver.model.locator.CandidateUrl;
import com.williamcallahan.booru_source_resolver.model.source.HistoricalSeed;
import com.williamcallahan.booru_source_resolver.model.source.ViewerMedia;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.HashSet;
import java.util.List;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

class CandidateGeneratorTest {

    private static final HistoricalSeed SEED = HistoricalSeed.builder()
        .baseUrl("https://orig.example/storage/")
        .suffix("/art_by_someone-d8x.png")
        .downloadableHint(false)
        .build();

    @Test
    void dayOffsets_searchBackwardsBeforeForwards() {
        assertThat(CandidateGenerator.dayOffsets(3)).containsExactly(0, -1, -2, -3, 1, 2, 3);
        assertThat(CandidateGenerator.dayOffsets(27)).hasSize(55);
    }

    @Test
    void searchDays_neverExceedsToday() {
        LocalDate today = LocalDate.of(2015, 3, 10);
        List<LocalDate> days = CandidateGenerator.searchDays(LocalDate.of(2015, 3, 9), 3, today);

        assertThat(days).containsExactly(
            LocalDate.of(2015, 3, 9),
            LocalDate.of(2015, 3, 8),
            LocalDate.of(2015, 3, 7),
            LocalDate.of(2015, 3, 6),
            LocalDate.of(2015, 3, 10));
    }

    @Test
    void candidatesForDay_covers512DistinctPaths() {
        List<CandidateUrl> candidates = CandidateGenerator.candidatesForDay(SEED, LocalDate.of(2015, 2, 1));

        assertThat(candidates).hasSize(512);
        assertThat(candidates.stream().map(CandidateUrl::url).collect(Collectors.toSet())).hasSize(512);
        assertThat(candidates.get(0).url()).isEqualTo("https://orig.example/storage/i/2015/032/0/0/art_by_someone-d8x.png");
        assertThat(candidates.get(511).url()).isEqualTo("https://orig.example/storage/f/2015/032/f/f/art_by_someone-d8x.png");
        assertThat(candidates.get(17).shardPath()).isEqualTo("i/1/1");
    }

    @Test
    void candidatesForDay_downloadableHintPutsDownloadableFlagFirst() {
        HistoricalSeed downloadable = HistoricalSeed.builder().baseUrl("https://orig.example").suffix(".png").downloadableHint(true).build();

        List<CandidateUrl> candidates = CandidateGenerator.candidatesForDay(downloadable, LocalDate.of(2012, 12, 31));

        assertThat(candidates.get(0).flag()).isEqualTo("f");
        assertThat(candidates.get(256).flag()).isEqualTo("i");
        assertThat(candidates.get(0).url()).isEqualTo("https://orig.example/f/2012/366/0/0.png");
    }

    @Test
    void tileGrid_isRowMajorAndCoversCanvasExactly() {
        List<TileSpec> tiles = CandidateGenerator.tileGrid(4000, 3000, 400, 300);

        assertThat(tiles).hasSize(100);
        assertThat(tiles.get(0)).isEqualTo(new TileSpec(0, 0, 400, 300));
        assertThat(tiles.get(1)).isEqualTo(new TileSpec(400, 0, 400, 300));
        assertThat(tiles.get(10)).isEqualTo(new TileSpec(0, 300, 400, 300));
        assertThat(tiles.stream().mapToLong(tile -> (long) tile.width() * tile.height()).sum()).isEqualTo(4000L * 3000L);
    }

    @Test
    void tileGrid_truncatesEdgeTiles() {
        List<TileSpec> tiles = CandidateGenerator.tileGrid(1000, 700, 400, 300);

        assertThat(tiles).hasSize(9);
        assertThat(tiles.get(2)).isEqualTo(new TileSpec(800, 0, 200, 300));
        assertThat(tiles.get(8)).isEqualTo(new TileSpec(800, 600, 200, 100));
        assertThat(new HashSet<>(tiles)).hasSize(9);
    }

    @Test
    void tileGrid_rejectsNonPositiveSizes() {
        assertThrows(IllegalArgumentException.class, () -> CandidateGenerator.tileGrid(100, 100, 0, 10));
    }

    @Test
    void cropUrl_fillsTemplateAndAppendsToken() {
        ViewerMedia media = ViewerMedia.builder()
            .baseUri("https://images.example/f/abc/def.png")
            .prettyName("art_by_someone")
            .tokens(List.of("tok-0", "tok-1"))
            .tokenIndex(1)
            .width(1200)
            .height(900)
            .cropCommand("/v1/crop/w_{width},h_{height},x_{x},y_{y}/<prettyName>.png")
            .build();

        String url = CandidateGenerator.cropUrl(media, new TileSpec(800, 600, 200, 100));

        assertThat(url).isEqualTo("https://images.example/f/abc/def.png/v1/crop/w_200,h_100,x_800,y_600/art_by_someone.png?token=tok-1");
    }

    @Test
    void fullviewUrl_omitsTokenWhenRenditionNeedsNone() {
        ViewerMedia media = ViewerMedia.builder()
            .baseUri("https://images.example/f/abc/def.png")
            .tokens(List.of("tok-0"))
            .tokenIndex(-1)
            .build();

        assertThat(CandidateGenerator.fullviewUrl(media)).isEqualTo("https://images.example/f/abc/def.png");
    }
}
