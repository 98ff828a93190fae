package com.chartclips.pipeline;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Turns noisy chart rows into a 1:1 mapping between track url and (title, artist).
 * <p>
 * Two sources of noise exist in chart data:
 * <ul>
 *   <li>Metadata drift: one url listed under several title/artist spellings.</li>
 *   <li>Re-releases: one (title, artist) listed under several urls (regional variants, reissues).</li>
 * </ul>
 * Both are fixed by two passes that run once each, in this order:
 * <ol>
 *   <li>{@link UrlMetadataIndex}: the first-seen (title, artist) of each url becomes canonical.</li>
 *   <li>{@link #canonicalUrlByTitleArtist}: the first url (in first-seen url order) of each canonical
 *       (title, artist) becomes canonical.</li>
 * </ol>
 * The second pass groups by the output of the first, so swapping them does not give the same table.
 * First-seen order is carried by insertion-ordered maps, making the result reproducible across runs.
 *
 * @author Chart Clips Team
 * @since 1.0
 */
public class CanonicalizerService {
    private static final Logger logger = LoggerFactory.getLogger(CanonicalizerService.class);

    private static final Comparator<Track> TRACK_ORDER = Comparator.comparing(Track::url)
        .thenComparing(Track::title)
        .thenComparing(Track::artist);

    /**
     * Canonicalizes an in-memory raw table.
     * @param rows Raw rows in source order
     * @return Canonical tracks in first-seen order
     */
    public List<Track> canonicalize(Iterable<Track> rows) {
        return canonicalize(UrlMetadataIndex.of(rows));
    }

    /**
     * Canonicalizes a raw table that has already been streamed through the first pass.
     * @param index Result of the first pass
     * @return Canonical tracks in first-seen order
     */
    public List<Track> canonicalize(UrlMetadataIndex index) {
        Map<String, TitleArtist> metadataByUrl = index.canonicalMetadataByUrl();
        Map<TitleArtist, String> urlByTitleArtist = canonicalUrlByTitleArtist(metadataByUrl);

        // Replace each url with its pair's canonical url and keep distinct triples
        Set<Track> canonical = new LinkedHashSet<>();
        for (TitleArtist pair : metadataByUrl.values()) {
            canonical.add(new Track(urlByTitleArtist.get(pair), pair.title(), pair.artist()));
        }
        logger.info("Canonicalized {} rows: {} urls -> {} tracks",
            index.rowCount(), metadataByUrl.size(), canonical.size());
        return new ArrayList<>(canonical);
    }

    /**
     * Second pass: picks one url per canonical (title, artist).
     * @param metadataByUrl Output of the first pass, in first-seen url order
     * @return (title, artist) to canonical url, in first-seen order
     */
    public Map<TitleArtist, String> canonicalUrlByTitleArtist(Map<String, TitleArtist> metadataByUrl) {
        Map<TitleArtist, String> urlByTitleArtist = new LinkedHashMap<>();
        metadataByUrl.forEach((url, pair) -> urlByTitleArtist.putIfAbsent(pair, url));
        return urlByTitleArtist;
    }

    /**
     * Lists the (url, title, artist) triples of every url that appears with more than one
     * (title, artist) in the raw data, sorted by url, title, artist. Used to audit how much
     * the first pass changes.
     * @param index Result of the first pass
     * @return Sorted drift triples
     */
    public List<Track> metadataDrift(UrlMetadataIndex index) {
        List<Track> drift = new ArrayList<>();
        index.driftingUrls().forEach((url, spellings) -> {
            for (TitleArtist pair : spellings) {
                drift.add(new Track(url, pair.title(), pair.artist()));
            }
        });
        drift.sort(TRACK_ORDER);
        return drift;
    }
}
