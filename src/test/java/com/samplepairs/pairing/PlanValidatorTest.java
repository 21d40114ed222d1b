package com.samplepairs.pairing;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class PlanValidatorTest {
    private final PlanValidator validator = new PlanValidator();

    private static RangeRule range(int start, int end, MappingType mapping) {
        return new RangeRule(start, end, mapping);
    }

    @Test
    void testTrioWithTwoRangesIsValid() {
        PairingPlan plan = new PairingPlan(
            List.of(new TrioOverride(5, 6, 7)),
            List.of(range(1, 4, MappingType.EVEN_ORIGINAL), range(8, 10, MappingType.ODD_ORIGINAL)));
        ValidationResult result = validator.validate(plan, 10);
        assertTrue(result.isOk(), result.getErrorMessage());
        assertTrue(result.getErrors().isEmpty());
    }

    @Test
    void testTouchingRangesDoNotOverlap() {
        PairingPlan plan = new PairingPlan(List.of(),
            List.of(range(1, 5, MappingType.EVEN_ORIGINAL), range(6, 10, MappingType.ODD_ORIGINAL)));
        assertTrue(validator.validate(plan, 10).isOk());
    }

    @Test
    void testSharedPositionIsAnOverlap() {
        PairingPlan plan = new PairingPlan(List.of(),
            List.of(range(1, 5, MappingType.EVEN_ORIGINAL), range(5, 10, MappingType.ODD_ORIGINAL)));
        ValidationResult result = validator.validate(plan, 10);
        assertFalse(result.isOk());
        assertEquals(List.of(
            "Ranges 1 [1..5] and 2 [5..10] overlap",
            "Track 5 is covered by multiple ranges (only one allowed)"), result.getErrors());
    }

    @Test
    void testAtLeastOneRangeIsRequired() {
        PairingPlan plan = new PairingPlan(
            List.of(new TrioOverride(1, 2, 3), new TrioOverride(4, 5, 6)), List.of());
        ValidationResult result = validator.validate(plan, 6);
        assertEquals(List.of("Pairing plan must have at least one range rule"), result.getErrors());
    }

    @Test
    void testRepeatedPositionInsideOneTrio() {
        PairingPlan plan = new PairingPlan(
            List.of(new TrioOverride(5, 5, 7)),
            List.of(range(1, 4, MappingType.EVEN_ORIGINAL), range(6, 6, MappingType.EVEN_ORIGINAL),
                range(8, 10, MappingType.ODD_ORIGINAL)));
        ValidationResult result = validator.validate(plan, 10);
        assertEquals(List.of("Trio 1: must contain 3 distinct track numbers (got: 5, 5, 7)"), result.getErrors());
    }

    @Test
    void testPositionReusedAcrossTrios() {
        PairingPlan plan = new PairingPlan(
            List.of(new TrioOverride(1, 2, 3), new TrioOverride(3, 4, 5)),
            List.of(range(6, 10, MappingType.EVEN_ORIGINAL)));
        ValidationResult result = validator.validate(plan, 10);
        assertEquals(List.of("Track 3 appears in multiple trios"), result.getErrors());
    }

    @Test
    void testUncoveredTrackIsReported() {
        PairingPlan plan = new PairingPlan(List.of(),
            List.of(range(1, 5, MappingType.EVEN_ORIGINAL), range(7, 10, MappingType.ODD_ORIGINAL)));
        ValidationResult result = validator.validate(plan, 10);
        assertEquals(List.of("Track 6 is not covered by any range and is not in a trio"), result.getErrors());
    }

    @Test
    void testOutOfBoundsPositions() {
        PairingPlan plan = new PairingPlan(
            List.of(new TrioOverride(0, 2, 11)),
            List.of(range(0, 12, MappingType.EVEN_ORIGINAL)));
        List<String> errors = validator.validate(plan, 10).getErrors();
        assertTrue(errors.contains("Trio 1: track 0 is out of range [1..10]"));
        assertTrue(errors.contains("Trio 1: track 11 is out of range [1..10]"));
        assertTrue(errors.contains("Range 1: start 0 is out of range [1..10]"));
        assertTrue(errors.contains("Range 1: end 12 is out of range [1..10]"));
    }

    @Test
    void testReversedRange() {
        PairingPlan plan = new PairingPlan(List.of(),
            List.of(range(1, 4, MappingType.EVEN_ORIGINAL), range(8, 5, MappingType.EVEN_ORIGINAL)));
        List<String> errors = validator.validate(plan, 4).getErrors();
        assertTrue(errors.contains("Range 2: start (8) must be <= end (5)"));
        assertTrue(errors.contains("Range 2: start 8 is out of range [1..4]"));
        assertTrue(errors.contains("Range 2: end 5 is out of range [1..4]"));
    }

    @Test
    void testErrorsAccumulateAndJoin() {
        PairingPlan plan = new PairingPlan(List.of(new TrioOverride(1, 1, 1)), List.of());
        ValidationResult result = validator.validate(plan, 4);
        assertEquals(List.of(
            "Pairing plan must have at least one range rule",
            "Trio 1: must contain 3 distinct track numbers (got: 1, 1, 1)",
            "Track 2 is not covered by any range and is not in a trio",
            "Track 3 is not covered by any range and is not in a trio",
            "Track 4 is not covered by any range and is not in a trio"), result.getErrors());
        assertTrue(result.getErrorMessage().startsWith("Pairing plan must have at least one range rule; Trio 1:"));
    }

    @Test
    void testNullPlanIsRejected() {
        ValidationResult result = validator.validate(null, 2);
        assertFalse(result.isOk());
        assertEquals("Pairing plan must have at least one range rule", result.getErrors().get(0));
    }
}
