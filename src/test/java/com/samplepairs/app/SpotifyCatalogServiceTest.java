package com.samplepairs.app;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.samplepairs.pairing.Pair;
import com.samplepairs.pairing.Track;
import org.junit.jupiter.api.Test;

import javax.net.ssl.SSLContext;
import javax.net.ssl.SSLParameters;
import javax.net.ssl.SSLSession;
import java.net.Authenticator;
import java.net.CookieHandler;
import java.net.ProxySelector;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpHeaders;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.function.Function;

import static org.junit.jupiter.api.Assertions.*;

public class SpotifyCatalogServiceTest {
    private final ObjectMapper mapper = new ObjectMapper();

    /** Canned status and body for one request. */
    record Reply(int status, String body) {}

    /** HttpClient answering every request from a function, recording what was sent. */
    static class ScriptedHttpClient extends HttpClient {
        final List<HttpRequest> requests = new ArrayList<>();
        private final Function<HttpRequest, Reply> script;

        ScriptedHttpClient(Function<HttpRequest, Reply> script) {
            this.script = script;
        }

        long tokenRequests() {
            return requests.stream().filter(r -> r.uri().getHost().equals("accounts.spotify.com")).count();
        }

        @Override
        @SuppressWarnings("unchecked")
        public <T> HttpResponse<T> send(HttpRequest request, HttpResponse.BodyHandler<T> handler) {
            requests.add(request);
            Reply reply = script.apply(request);
            return (HttpResponse<T>) new StringResponse(request, reply);
        }

        @Override
        public <T> CompletableFuture<HttpResponse<T>> sendAsync(HttpRequest request, HttpResponse.BodyHandler<T> handler) {
            return CompletableFuture.completedFuture(send(request, handler));
        }

        @Override
        public <T> CompletableFuture<HttpResponse<T>> sendAsync(HttpRequest request, HttpResponse.BodyHandler<T> handler,
                                                                HttpResponse.PushPromiseHandler<T> pushPromiseHandler) {
            return sendAsync(request, handler);
        }

        @Override public Optional<CookieHandler> cookieHandler() { return Optional.empty(); }
        @Override public Optional<Duration> connectTimeout() { return Optional.empty(); }
        @Override public Redirect followRedirects() { return Redirect.NEVER; }
        @Override public Optional<ProxySelector> proxy() { return Optional.empty(); }
        @Override public SSLContext sslContext() { return null; }
        @Override public SSLParameters sslParameters() { return null; }
        @Override public Optional<Authenticator> authenticator() { return Optional.empty(); }
        @Override public Version version() { return Version.HTTP_1_1; }
        @Override public Optional<Executor> executor() { return Optional.empty(); }
    }

    record StringResponse(HttpRequest request, Reply reply) implements HttpResponse<String> {
        @Override public int statusCode() { return reply.status(); }
        @Override public Optional<HttpResponse<String>> previousResponse() { return Optional.empty(); }
        @Override public HttpHeaders headers() { return HttpHeaders.of(Map.of(), (name, value) -> true); }
        @Override public String body() { return reply.body(); }
        @Override public Optional<SSLSession> sslSession() { return Optional.empty(); }
        @Override public URI uri() { return request.uri(); }
        @Override public HttpClient.Version version() { return HttpClient.Version.HTTP_1_1; }
    }

    private static final Reply TOKEN = new Reply(200, "{\"access_token\": \"tok\", \"expires_in\": 3600}");
    private static final Reply HIT = new Reply(200,
        "{\"tracks\": {\"items\": [{\"external_urls\": {\"spotify\": \"https://open.spotify.com/track/1\"}, \"album\": {\"name\": \"Meteora\"}}]}}");

    private static List<Pair> twoPairs() {
        return List.of(
            new Pair(Track.of("Numb", "Linkin Park"), Track.of("Numb/Encore", "Jay-Z"), null, null),
            new Pair(Track.of("Hey Jude", "The Beatles"), Track.of("Broken", "Nobody"), null, null));
    }

    @Test
    void testParsePlaylistId() {
        assertEquals("37i9dQZF1DXcBWIGoYBM5M",
            SpotifyCatalogService.parsePlaylistId("https://open.spotify.com/playlist/37i9dQZF1DXcBWIGoYBM5M?si=abc123"));
        assertEquals("abc123", SpotifyCatalogService.parsePlaylistId("spotify:playlist:abc123"));
        assertNull(SpotifyCatalogService.parsePlaylistId("https://open.spotify.com/album/xyz"));
        assertNull(SpotifyCatalogService.parsePlaylistId(null));
    }

    @Test
    void testParseTracksPage() throws Exception {
        List<Track> tracks = SpotifyCatalogService.parseTracksPage(mapper.readTree("{\"total\": 4, \"items\": ["
            + "{\"track\": {\"name\": \"Numb/Encore\", \"artists\": [{\"name\": \"Jay-Z\"}, {\"name\": \"Linkin Park\"}]}},"
            + "{\"track\": null},"
            + "{\"track\": {\"name\": \"\", \"artists\": []}},"
            + "{\"track\": {\"name\": \"Solo\", \"artists\": [{\"name\": \"One\"}]}}"
            + "]}"));
        assertEquals(List.of(Track.of("Numb/Encore", "Jay-Z, Linkin Park"), Track.of("Solo", "One")), tracks);
    }

    @Test
    void testParseSearchResult() throws Exception {
        CatalogServiceInterface.CatalogMatch match = SpotifyCatalogService.parseSearchResult(mapper.readTree(
            "{\"tracks\": {\"items\": [{\"external_urls\": {\"spotify\": \"https://open.spotify.com/track/1\"},"
                + " \"album\": {\"name\": \"Meteora\"}}]}}"));
        assertTrue(match.found());
        assertEquals("https://open.spotify.com/track/1", match.url());
        assertEquals("Meteora", match.album());

        CatalogServiceInterface.CatalogMatch none = SpotifyCatalogService.parseSearchResult(mapper.readTree(
            "{\"tracks\": {\"items\": []}}"));
        assertFalse(none.found());
        assertNull(none.url());
    }

    @Test
    void testTokenIsRequestedOnceForManySearches() throws Exception {
        ScriptedHttpClient http = new ScriptedHttpClient(request -> {
            if (request.uri().getHost().equals("accounts.spotify.com")) return TOKEN;
            return request.uri().getRawQuery().contains("Broken") ? new Reply(500, "oops") : HIT;
        });
        SpotifyCatalogService catalog = new SpotifyCatalogService("id", "secret", http, mapper);

        List<Pair> enriched = new PairingService().enrichPairs(twoPairs(), catalog);

        assertEquals(1, http.tokenRequests());
        assertEquals(5, http.requests.size());
        assertEquals("Meteora", enriched.get(0).originalTrack().detail("album"));
        assertEquals(Boolean.TRUE, enriched.get(1).sampledTrack().detail("placeholder"));
        assertEquals("Bearer tok", http.requests.get(1).headers().firstValue("Authorization").orElse(""));
    }

    @Test
    void testRejectedCredentialsAbortEnrichment() {
        ScriptedHttpClient http = new ScriptedHttpClient(request -> new Reply(401, "{\"error\": \"invalid_client\"}"));
        SpotifyCatalogService catalog = new SpotifyCatalogService("id", "wrong", http, mapper);

        CatalogException e = assertThrows(CatalogException.class,
            () -> new PairingService().enrichPairs(twoPairs(), catalog));
        assertEquals(401, e.getStatusCode());
        assertTrue(e.getMessage().startsWith("Failed to authenticate with Spotify API"));
        assertEquals(1, http.requests.size());
    }

    @Test
    void testMissingPlaylistIsReportedAsNotFound() {
        ScriptedHttpClient http = new ScriptedHttpClient(request ->
            request.uri().getHost().equals("accounts.spotify.com") ? TOKEN : new Reply(404, "{}"));
        SpotifyCatalogService catalog = new SpotifyCatalogService("id", "secret", http, mapper);

        CatalogException e = assertThrows(CatalogException.class, () -> catalog.fetchPlaylistTracks("abc123"));
        assertTrue(e.isNotFound());
    }

    @Test
    void testCredentialsAreRequired() {
        assertThrows(IllegalArgumentException.class, () -> new SpotifyCatalogService(null, "secret"));
        assertThrows(IllegalArgumentException.class, () -> new SpotifyCatalogService("id", " "));
    }

    @Test
    void testCatalogExceptionStatus() {
        CatalogException notFound = new CatalogException("Playlist not found", 404);
        assertTrue(notFound.isNotFound());
        assertEquals(404, notFound.getStatusCode());
        assertFalse(new CatalogException("boom", 500).isNotFound());
    }
}
