package com.chartclips.pipeline;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;

/**
 * First canonicalization pass: groups raw rows by url and keeps the first-seen (title, artist) of each url.
 * <p>
 * Rows are fed one at a time (it is a {@link Consumer} so {@link CsvService#forEachTrack} can stream into it),
 * so memory grows with the number of distinct urls rather than the number of rows. Urls are kept in first-seen
 * order, which is the order the second pass relies on.
 * <p>
 * Every distinct spelling seen for a url is kept as well, so the metadata drift of the raw table can be exported.
 */
public class UrlMetadataIndex implements Consumer<Track> {

    // url -> distinct (title, artist) spellings in first-seen order; element 0 is canonical
    private final Map<String, List<TitleArtist>> spellingsByUrl = new LinkedHashMap<>();
    private long rows;

    @Override
    public void accept(Track track) {
        if (track.url() == null || track.title() == null || track.artist() == null) {
            throw new IllegalArgumentException("Track fields cannot be null: " + track);
        }
        rows++;
        List<TitleArtist> spellings = spellingsByUrl.computeIfAbsent(track.url(), url -> new ArrayList<>(1));
        TitleArtist pair = track.titleArtist();
        if (!spellings.contains(pair)) {
            spellings.add(pair);
        }
    }

    /**
     * Indexes every row of an in-memory table.
     * @param rows Raw rows in source order
     * @return Populated index
     */
    public static UrlMetadataIndex of(Iterable<Track> rows) {
        UrlMetadataIndex index = new UrlMetadataIndex();
        rows.forEach(index);
        return index;
    }

    /**
     * Returns the canonical (title, artist) of every url, in first-seen url order.
     * @return Unmodifiable url to TitleArtist mapping
     */
    public Map<String, TitleArtist> canonicalMetadataByUrl() {
        Map<String, TitleArtist> canonical = new LinkedHashMap<>();
        spellingsByUrl.forEach((url, spellings) -> canonical.put(url, spellings.get(0)));
        return Collections.unmodifiableMap(canonical);
    }

    /**
     * Returns every distinct spelling of the urls that appear with more than one (title, artist).
     * @return url to spellings (first-seen order), only for drifting urls
     */
    public Map<String, List<TitleArtist>> driftingUrls() {
        Map<String, List<TitleArtist>> drifting = new LinkedHashMap<>();
        spellingsByUrl.forEach((url, spellings) -> {
            if (spellings.size() > 1) drifting.put(url, List.copyOf(spellings));
        });
        return drifting;
    }

    public long rowCount() {
        return rows;
    }

    public int urlCount() {
        return spellingsByUrl.size();
    }
}
