package com.samplepairs.app;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.samplepairs.pairing.Pair;
import com.samplepairs.pairing.Track;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Converts tracks and pairs to and from JSON.
 * <p>
 * Pair records exist in two shapes: {@code originalTrack}/{@code sampledTrack} (store format, with
 * positions) and {@code original}/{@code sampled} (export format, with a {@code pairIndex}). Both are
 * read into the single {@link Pair} type here, so nothing past this class deals with field names.
 * <p>
 * Track fields other than {@code title} and {@code artist} are read into {@link Track#details()} and
 * written back in the same order.
 *
 * @author Sample Pairs Team
 * @since 1.0
 */
public class PairJsonMapper {
    private static final Logger logger = LoggerFactory.getLogger(PairJsonMapper.class);

    private final ObjectMapper mapper;

    public PairJsonMapper() {
        this(new ObjectMapper());
    }

    public PairJsonMapper(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public ObjectMapper getMapper() {
        return mapper;
    }

    /**
     * Reads a track object. Returns null for a missing, null or non-object node.
     */
    public Track readTrack(JsonNode node) {
        if (node == null || !node.isObject()) return null;
        Map<String, Object> details = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            if (field.getKey().equals("title") || field.getKey().equals("artist")) continue;
            details.put(field.getKey(), mapper.convertValue(field.getValue(), Object.class));
        }
        return new Track(textOrNull(node, "title"), textOrNull(node, "artist"), details);
    }

    public ObjectNode writeTrack(Track track) {
        ObjectNode node = mapper.createObjectNode();
        node.put("title", track.title());
        node.put("artist", track.artist());
        for (Map.Entry<String, Object> detail : track.details().entrySet()) {
            node.set(detail.getKey(), mapper.valueToTree(detail.getValue()));
        }
        return node;
    }

    /**
     * Reads a JSON array of track objects. Entries that are not objects are skipped.
     */
    public List<Track> readTracks(JsonNode array) {
        List<Track> tracks = new ArrayList<>();
        if (array == null || !array.isArray()) return tracks;
        for (JsonNode element : array) {
            Track track = readTrack(element);
            if (track == null) {
                logger.warn("Skipping non-object track entry: {}", element);
                continue;
            }
            tracks.add(track);
        }
        return tracks;
    }

    /**
     * Reads a pair in either shape. Missing tracks stay null, missing positions stay null.
     */
    public Pair readPair(JsonNode node) {
        if (node == null || !node.isObject()) return null;
        JsonNode original = node.hasNonNull("original") ? node.get("original") : node.get("originalTrack");
        JsonNode sampled = node.hasNonNull("sampled") ? node.get("sampled") : node.get("sampledTrack");
        return new Pair(readTrack(original), readTrack(sampled), intOrNull(node, "originalPos"), intOrNull(node, "sampledPos"));
    }

    /**
     * Reads a flat array of pair records. Non-object entries are skipped.
     */
    public List<Pair> readPairs(JsonNode array) {
        List<Pair> pairs = new ArrayList<>();
        if (array == null || !array.isArray()) return pairs;
        for (JsonNode element : array) {
            Pair pair = readPair(element);
            if (pair != null) pairs.add(pair);
        }
        return pairs;
    }

    /**
     * Writes a pair in store format: originalTrack, sampledTrack, originalPos, sampledPos.
     */
    public ObjectNode writePair(Pair pair) {
        ObjectNode node = mapper.createObjectNode();
        node.set("originalTrack", pair.originalTrack() == null ? node.nullNode() : writeTrack(pair.originalTrack()));
        node.set("sampledTrack", pair.sampledTrack() == null ? node.nullNode() : writeTrack(pair.sampledTrack()));
        if (pair.originalPos() != null) node.put("originalPos", pair.originalPos());
        if (pair.sampledPos() != null) node.put("sampledPos", pair.sampledPos());
        return node;
    }

    public ArrayNode writePairs(List<Pair> pairs) {
        ArrayNode array = mapper.createArrayNode();
        for (Pair pair : pairs) array.add(writePair(pair));
        return array;
    }

    /**
     * Writes a pair in export format: pairIndex, original, sampled.
     */
    public ObjectNode writeExportPair(int pairIndex, Pair pair) {
        ObjectNode node = mapper.createObjectNode();
        node.put("pairIndex", pairIndex);
        node.set("original", pair.originalTrack() == null ? node.nullNode() : writeTrack(pair.originalTrack()));
        node.set("sampled", pair.sampledTrack() == null ? node.nullNode() : writeTrack(pair.sampledTrack()));
        return node;
    }

    /**
     * Converts an export document {@code {"pairs": [{pairIndex, original, sampled}, ...]}} into store
     * pairs. Pair {@code i} gets positions {@code 2i+1} and {@code 2i+2}; each track keeps title,
     * artist, spotifyUrl, youtubeId and startSec (0 when absent).
     */
    public List<Pair> readImportedPairs(JsonNode root) {
        List<Pair> pairs = new ArrayList<>();
        JsonNode exported = root == null ? null : root.get("pairs");
        if (exported == null || !exported.isArray()) return pairs;
        for (JsonNode element : exported) {
            Integer pairIndex = intOrNull(element, "pairIndex");
            if (pairIndex == null) {
                logger.warn("Skipping exported pair without pairIndex: {}", element);
                continue;
            }
            pairs.add(new Pair(
                importedTrack(element.get("original")),
                importedTrack(element.get("sampled")),
                pairIndex * 2 + 1,
                pairIndex * 2 + 2));
        }
        return pairs;
    }

    private Track importedTrack(JsonNode node) {
        if (node == null || !node.isObject()) return null;
        Map<String, Object> details = new LinkedHashMap<>();
        for (String field : List.of("spotifyUrl", "youtubeId")) {
            if (node.has(field)) details.put(field, mapper.convertValue(node.get(field), Object.class));
        }
        JsonNode startSec = node.get("startSec");
        details.put("startSec", startSec != null && startSec.isNumber() && startSec.asDouble() != 0 ? startSec.numberValue() : 0);
        return new Track(textOrNull(node, "title"), textOrNull(node, "artist"), details);
    }

    private static String textOrNull(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value == null || value.isNull() ? null : value.asText();
    }

    private static Integer intOrNull(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value != null && value.isNumber() && value.canConvertToInt() ? value.asInt() : null;
    }
}
