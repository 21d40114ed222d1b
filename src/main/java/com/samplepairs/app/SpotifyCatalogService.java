package com.samplepairs.app;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.samplepairs.pairing.Track;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Base64;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Spotify Web API client for playlist tracks and track search.
 * <p>
 * Workflow:
 * <ul>
 *   <li>Obtains an app token with the client-credentials grant once and reuses it until shortly before it expires.</li>
 *   <li>Pages through playlist tracks 100 at a time, skipping entries without a track name.</li>
 *   <li>Joins multiple artists with {@code ", "}.</li>
 *   <li>Searches with {@code track:<title> artist:<artist>} and keeps the first hit.</li>
 * </ul>
 * Failed requests are not retried. Authentication failures always propagate; a failed search
 * request is reported as not found.
 *
 * @author Sample Pairs Team
 * @since 1.0
 */
public class SpotifyCatalogService implements CatalogServiceInterface {
    private static final Logger logger = LoggerFactory.getLogger(SpotifyCatalogService.class);

    private static final String TOKEN_URL = "https://accounts.spotify.com/api/token";
    private static final String API_URL = "https://api.spotify.com/v1";
    private static final int PAGE_LIMIT = 100;
    private static final Pattern PLAYLIST_ID = Pattern.compile("playlist[/:]([a-zA-Z0-9]+)");
    private static final long DEFAULT_TOKEN_TTL_SECONDS = 3600;
    private static final long TOKEN_EXPIRY_MARGIN_SECONDS = 60;

    private final String clientId;
    private final String clientSecret;
    private final HttpClient client;
    private final ObjectMapper mapper;

    private String accessToken;
    private Instant tokenExpiresAt = Instant.EPOCH;

    public SpotifyCatalogService(String clientId, String clientSecret) {
        this(clientId, clientSecret, HttpClient.newHttpClient(), new ObjectMapper());
    }

    public SpotifyCatalogService(String clientId, String clientSecret, HttpClient client, ObjectMapper mapper) {
        if (clientId == null || clientId.isBlank() || clientSecret == null || clientSecret.isBlank()) {
            throw new IllegalArgumentException("Spotify client id and secret are required (SPOTIFY_CLIENT_ID / SPOTIFY_CLIENT_SECRET)");
        }
        this.clientId = clientId;
        this.clientSecret = clientSecret;
        this.client = client;
        this.mapper = mapper;
    }

    /**
     * Extracts the playlist id from {@code https://open.spotify.com/playlist/<id>} or {@code spotify:playlist:<id>}.
     * @param input URL or URI
     * @return playlist id, or null if the input names no playlist
     */
    public static String parsePlaylistId(String input) {
        if (input == null) return null;
        Matcher m = PLAYLIST_ID.matcher(input);
        return m.find() ? m.group(1) : null;
    }

    @Override
    public List<Track> fetchPlaylistTracks(String playlistId) throws IOException {
        if (playlistId == null || playlistId.isBlank()) {
            throw new IllegalArgumentException("Playlist id cannot be empty");
        }
        String token = accessToken();
        List<Track> tracks = new ArrayList<>();
        String fields = URLEncoder.encode("items(track(name,artists)),total", StandardCharsets.UTF_8);
        int offset = 0;
        int total;
        do {
            String url = String.format("%s/playlists/%s/tracks?offset=%d&limit=%d&fields=%s",
                API_URL, URLEncoder.encode(playlistId, StandardCharsets.UTF_8), offset, PAGE_LIMIT, fields);
            JsonNode page = getJson(url, token);
            total = page.path("total").asInt(0);
            tracks.addAll(parseTracksPage(page));
            offset += PAGE_LIMIT;
        } while (offset < total);
        logger.info("Fetched {} track(s) from playlist {}", tracks.size(), playlistId);
        return tracks;
    }

    /**
     * {@inheritDoc}
     * @throws CatalogException if the app token cannot be obtained
     */
    @Override
    public CatalogMatch searchTrack(String title, String artist) throws IOException {
        String token = accessToken();
        try {
            String query = URLEncoder.encode("track:" + title + " artist:" + artist, StandardCharsets.UTF_8);
            JsonNode result = getJson(API_URL + "/search?type=track&limit=1&q=" + query, token);
            return parseSearchResult(result);
        } catch (IOException e) {
            logger.error("Error searching for \"{}\" by {}: {}", title, artist, e.getMessage());
            return CatalogMatch.notFound();
        }
    }

    /**
     * Converts one page of playlist items. Items whose track or track name is missing are skipped.
     */
    static List<Track> parseTracksPage(JsonNode page) {
        List<Track> tracks = new ArrayList<>();
        for (JsonNode item : page.path("items")) {
            JsonNode track = item.path("track");
            String name = track.path("name").asText("");
            if (track.isMissingNode() || track.isNull() || name.isEmpty()) continue;
            List<String> artists = new ArrayList<>();
            for (JsonNode a : track.path("artists")) {
                artists.add(a.path("name").asText(""));
            }
            tracks.add(Track.of(name, String.join(", ", artists)));
        }
        return tracks;
    }

    /**
     * Reads the first track of a search response.
     */
    static CatalogMatch parseSearchResult(JsonNode result) {
        JsonNode items = result.path("tracks").path("items");
        if (!items.isArray() || items.isEmpty()) {
            return CatalogMatch.notFound();
        }
        JsonNode first = items.get(0);
        return new CatalogMatch(true,
            first.path("external_urls").path("spotify").asText(""),
            first.path("album").path("name").asText(""));
    }

    private synchronized String accessToken() throws IOException {
        if (accessToken == null || !Instant.now().isBefore(tokenExpiresAt)) {
            requestAccessToken();
        }
        return accessToken;
    }

    private void requestAccessToken() throws IOException {
        String basic = Base64.getEncoder().encodeToString((clientId + ":" + clientSecret).getBytes(StandardCharsets.UTF_8));
        HttpRequest request = HttpRequest.newBuilder()
            .uri(URI.create(TOKEN_URL))
            .header("Authorization", "Basic " + basic)
            .header("Content-Type", "application/x-www-form-urlencoded")
            .POST(HttpRequest.BodyPublishers.ofString("grant_type=client_credentials"))
            .build();
        HttpResponse<String> response = send(request);
        if (response.statusCode() != 200) {
            throw new CatalogException("Failed to authenticate with Spotify API (HTTP " + response.statusCode() + ")", response.statusCode());
        }
        JsonNode body = mapper.readTree(response.body());
        String token = body.path("access_token").asText("");
        if (token.isEmpty()) {
            throw new CatalogException("Spotify token response carried no access_token", response.statusCode());
        }
        long ttl = body.path("expires_in").asLong(DEFAULT_TOKEN_TTL_SECONDS);
        accessToken = token;
        tokenExpiresAt = Instant.now().plusSeconds(Math.max(0, ttl - TOKEN_EXPIRY_MARGIN_SECONDS));
        logger.debug("Obtained Spotify app token valid for {}s", ttl);
    }

    private JsonNode getJson(String url, String token) throws IOException {
        HttpRequest request = HttpRequest.newBuilder()
            .uri(URI.create(url))
            .header("Authorization", "Bearer " + token)
            .GET()
            .build();
        HttpResponse<String> response = send(request);
        if (response.statusCode() == 404) {
            throw new CatalogException("Playlist not found", 404);
        }
        if (response.statusCode() != 200) {
            throw new CatalogException("Spotify API request failed (HTTP " + response.statusCode() + "): " + url, response.statusCode());
        }
        return mapper.readTree(response.body());
    }

    private HttpResponse<String> send(HttpRequest request) throws IOException {
        try {
            return client.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IOException("Interrupted while calling " + request.uri(), e);
        }
    }
}
