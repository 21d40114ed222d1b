package com.samplepairs.pairing;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.OptionalInt;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Coerces caller-supplied plan input into a well-typed {@link PairingPlan}.
 * <p>
 * Normalization is permissive and never fails:
 * <ul>
 *   <li>Missing or non-array {@code trios}/{@code ranges} become empty lists.</li>
 *   <li>Numbers may arrive as JSON numbers or strings; the leading integer is used.</li>
 *   <li>A trio or range with any unparseable position, or a range with an unknown mapping, is dropped.</li>
 *   <li>Positions are clamped into {@code [1, trackCount]}; reversed ranges are swapped first.</li>
 *   <li>Ranges come back sorted by start.</li>
 * </ul>
 * Whatever survives is checked strictly by {@link PlanValidator}.
 *
 * @author Sample Pairs Team
 * @since 1.0
 */
public class PlanNormalizer {
    private static final Logger logger = LoggerFactory.getLogger(PlanNormalizer.class);

    private static final Pattern LEADING_INT = Pattern.compile("^[+-]?\\d+");
    private static final BigInteger INT_MAX = BigInteger.valueOf(Integer.MAX_VALUE);
    private static final BigInteger INT_MIN = BigInteger.valueOf(Integer.MIN_VALUE);

    private final ObjectMapper mapper;

    public PlanNormalizer() {
        this(new ObjectMapper());
    }

    public PlanNormalizer(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    /**
     * Normalizes a plan given as a plain map (e.g. deserialized request body).
     * @param rawPlan raw plan map (may be null)
     * @param trackCount number of tracks in the playlist
     * @return normalized plan
     */
    public PairingPlan normalize(Map<String, ?> rawPlan, int trackCount) {
        JsonNode tree = rawPlan == null ? null : mapper.valueToTree(rawPlan);
        return normalize(tree, trackCount);
    }

    /**
     * Normalizes a plan given as a JSON tree.
     * @param rawPlan raw plan node (may be null)
     * @param trackCount number of tracks in the playlist
     * @return normalized plan, never null
     */
    public PairingPlan normalize(JsonNode rawPlan, int trackCount) {
        List<TrioOverride> trios = new ArrayList<>();
        List<RangeRule> ranges = new ArrayList<>();
        if (rawPlan == null || !rawPlan.isObject()) {
            return new PairingPlan(trios, ranges);
        }

        JsonNode rawTrios = rawPlan.path("trios");
        if (rawTrios.isArray()) {
            for (JsonNode trio : rawTrios) {
                TrioOverride normalized = normalizeTrio(trio, trackCount);
                if (normalized != null) trios.add(normalized);
            }
        }

        JsonNode rawRanges = rawPlan.path("ranges");
        if (rawRanges.isArray()) {
            for (JsonNode range : rawRanges) {
                RangeRule normalized = normalizeRange(range, trackCount);
                if (normalized != null) ranges.add(normalized);
            }
        }
        ranges.sort(Comparator.comparingInt(RangeRule::start));

        int droppedTrios = rawTrios.isArray() ? rawTrios.size() - trios.size() : 0;
        int droppedRanges = rawRanges.isArray() ? rawRanges.size() - ranges.size() : 0;
        if (droppedTrios > 0 || droppedRanges > 0) {
            logger.debug("Dropped {} malformed trio(s) and {} malformed range(s) during normalization", droppedTrios, droppedRanges);
        }
        return new PairingPlan(trios, ranges);
    }

    private TrioOverride normalizeTrio(JsonNode trio, int trackCount) {
        OptionalInt original = parseLeadingInt(trio.get("original"));
        OptionalInt sampleA = parseLeadingInt(trio.get("sampleA"));
        OptionalInt sampleB = parseLeadingInt(trio.get("sampleB"));
        if (original.isEmpty() || sampleA.isEmpty() || sampleB.isEmpty()) {
            return null;
        }
        return new TrioOverride(
            clamp(original.getAsInt(), trackCount),
            clamp(sampleA.getAsInt(), trackCount),
            clamp(sampleB.getAsInt(), trackCount)
        );
    }

    private RangeRule normalizeRange(JsonNode range, int trackCount) {
        OptionalInt rawStart = parseLeadingInt(range.get("start"));
        OptionalInt rawEnd = parseLeadingInt(range.get("end"));
        if (rawStart.isEmpty() || rawEnd.isEmpty()) {
            return null;
        }
        int start = rawStart.getAsInt();
        int end = rawEnd.getAsInt();
        if (start > end) {
            int tmp = start;
            start = end;
            end = tmp;
        }
        start = clamp(start, trackCount);
        end = clamp(end, trackCount);

        JsonNode mappingNode = range.get("mapping");
        MappingType mapping = mappingNode == null || mappingNode.isNull() ? null : MappingType.parse(mappingNode.asText());
        if (mapping == null) {
            return null;
        }
        return new RangeRule(start, end, mapping);
    }

    private static int clamp(int value, int trackCount) {
        return Math.max(1, Math.min(trackCount, value));
    }

    /**
     * Reads the leading integer of a JSON value: {@code 7}, {@code "7"}, {@code " 7 "}, {@code "7th"} and
     * {@code 7.9} all give 7. Null, booleans, containers and text without leading digits give empty.
     * Values outside the int range saturate.
     */
    public static OptionalInt parseLeadingInt(JsonNode node) {
        if (node == null || node.isNull() || node.isContainerNode() || node.isBoolean()) {
            return OptionalInt.empty();
        }
        if (node.isNumber()) {
            if (node.isFloatingPointNumber() && !Double.isFinite(node.doubleValue())) {
                return OptionalInt.empty();
            }
            return OptionalInt.of(saturate(node.decimalValue().toBigInteger()));
        }
        Matcher m = LEADING_INT.matcher(node.asText().trim());
        if (!m.find()) {
            return OptionalInt.empty();
        }
        return OptionalInt.of(saturate(new BigInteger(m.group())));
    }

    private static int saturate(BigInteger value) {
        if (value.compareTo(INT_MAX) > 0) return Integer.MAX_VALUE;
        if (value.compareTo(INT_MIN) < 0) return Integer.MIN_VALUE;
        return value.intValue();
    }
}
