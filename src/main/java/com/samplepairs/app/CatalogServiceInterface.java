package com.samplepairs.app;

import com.samplepairs.pairing.Track;

import java.io.IOException;
import java.util.List;

/**
 * Interface for the external music catalog that supplies playlist tracks and track lookups.
 */
public interface CatalogServiceInterface {

    /**
     * Result of a single-track lookup.
     * @param found whether the catalog returned a match
     * @param url catalog URL of the match, null if not found
     * @param album album name of the match, null if not found
     */
    record CatalogMatch(boolean found, String url, String album) {
        public static CatalogMatch notFound() {
            return new CatalogMatch(false, null, null);
        }
    }

    /**
     * Fetches every track of a playlist, in playlist order.
     * @param playlistId catalog playlist id
     * @return tracks with title and artist
     * @throws IOException if authentication or any page request fails
     */
    List<Track> fetchPlaylistTracks(String playlistId) throws IOException;

    /**
     * Looks up the best catalog match for a title and artist. A failed lookup is reported as not found.
     * @param title track title
     * @param artist track artist
     * @return match, never null
     * @throws IOException if the catalog cannot be used at all (e.g. authentication is rejected)
     */
    CatalogMatch searchTrack(String title, String artist) throws IOException;
}
