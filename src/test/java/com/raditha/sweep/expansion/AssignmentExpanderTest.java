package com.raditha.sweep.expansion;

import com.raditha.sweep.model.Assignment;
import com.raditha.sweep.model.ValueDescriptor;
import com.raditha.sweep.model.VariableSpec;
import net.jqwik.api.ForAll;
import net.jqwik.api.Property;
import net.jqwik.api.constraints.IntRange;
import net.jqwik.api.constraints.Size;
import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class AssignmentExpanderTest {

    private final AssignmentExpander expander = new AssignmentExpander();

    @Test
    void testCartesianProductInSpecOrder() {
        VariableSpec spec = VariableSpec.builder()
                .put("project", "A", new ValueDescriptor.ValueList(List.of("1", "2")))
                .put("project", "B", new ValueDescriptor.ValueList(List.of("x", "y", "z")))
                .build();

        List<Assignment> assignments = expander.expand(spec);

        assertEquals(6, assignments.size());
        assertEquals("A=1, B=x", assignments.get(0).label());
        assertEquals("A=1, B=y", assignments.get(1).label());
        assertEquals("A=1, B=z", assignments.get(2).label());
        assertEquals("A=2, B=x", assignments.get(3).label());
        assertEquals("A=2, B=z", assignments.get(5).label());
    }

    @Test
    void testRangeWithStep() {
        VariableSpec spec = VariableSpec.builder()
                .put("project", "TIMESLOT", new ValueDescriptor.IntRange(5, 20, 5))
                .build();

        List<Assignment> assignments = expander.expand(spec);

        assertEquals(List.of("5", "10", "15"),
                assignments.stream().map(a -> a.valueOf("project", "TIMESLOT")).toList());
    }

    @Test
    void testRangeDefaultStepExcludesEnd() {
        assertEquals(List.of("0", "1", "2", "3", "4", "5", "6", "7", "8"),
                expander.resolve("project", "N", new ValueDescriptor.IntRange(0, 9)));
    }

    @Test
    void testNegativeStep() {
        assertEquals(List.of("10", "7", "4", "1"),
                expander.resolve("project", "N", new ValueDescriptor.IntRange(10, 0, -3)));
    }

    @Test
    void testRangesAtTheLongBounds() {
        assertEquals(List.of(Long.toString(Long.MAX_VALUE - 10), Long.toString(Long.MAX_VALUE - 3)),
                expander.resolve("project", "N", new ValueDescriptor.IntRange(Long.MAX_VALUE - 10, Long.MAX_VALUE, 7)));
        assertEquals(List.of(Long.toString(Long.MIN_VALUE + 10), Long.toString(Long.MIN_VALUE + 3)),
                expander.resolve("project", "N", new ValueDescriptor.IntRange(Long.MIN_VALUE + 10, Long.MIN_VALUE, -7)));
    }

    @Test
    void testOversizedRangeRejectedBeforeEnumeration() {
        assertThrows(InvalidRangeException.class,
                () -> expander.resolve("project", "N", new ValueDescriptor.IntRange(0, 5_000_000_000L, 1)));
        assertThrows(InvalidRangeException.class,
                () -> expander.resolve("project", "N", new ValueDescriptor.IntRange(Long.MIN_VALUE, Long.MAX_VALUE, 1)));
    }

    @Test
    void testRangeSize() {
        assertEquals(3, AssignmentExpander.rangeSize("project", "N", new ValueDescriptor.IntRange(5, 20, 5)));
        assertEquals(4, AssignmentExpander.rangeSize("project", "N", new ValueDescriptor.IntRange(5, 21, 5)));
        assertEquals(4, AssignmentExpander.rangeSize("project", "N", new ValueDescriptor.IntRange(10, 0, -3)));
        assertEquals(3, AssignmentExpander.rangeSize("project", "N",
                new ValueDescriptor.IntRange(Long.MIN_VALUE, Long.MAX_VALUE, Long.MAX_VALUE)));
        assertEquals(List.of(Long.toString(Long.MIN_VALUE), "-1", Long.toString(Long.MAX_VALUE - 1)),
                expander.resolve("project", "N",
                        new ValueDescriptor.IntRange(Long.MIN_VALUE, Long.MAX_VALUE, Long.MAX_VALUE)));
    }

    @Test
    void testZeroStepRejected() {
        InvalidRangeException e = assertThrows(InvalidRangeException.class,
                () -> expander.resolve("project", "N", new ValueDescriptor.IntRange(0, 10, 0)));
        assertEquals("project", e.getSection());
        assertEquals("N", e.getVariable());
    }

    @Test
    void testEmptyRangesRejected() {
        assertThrows(InvalidRangeException.class,
                () -> expander.resolve("project", "N", new ValueDescriptor.IntRange(5, 5)));
        assertThrows(InvalidRangeException.class,
                () -> expander.resolve("project", "N", new ValueDescriptor.IntRange(10, 0, 1)));
        assertThrows(InvalidRangeException.class,
                () -> expander.resolve("project", "N", new ValueDescriptor.IntRange(0, 10, -1)));
    }

    @Test
    void testInvalidRangeFailsWholeExpansion() {
        VariableSpec spec = VariableSpec.builder()
                .literal("project", "A", "1")
                .put("project", "B", new ValueDescriptor.IntRange(3, 1))
                .build();

        assertThrows(InvalidVariableDescriptorException.class, () -> expander.expand(spec));
    }

    @Test
    void testEmptySpecYieldsNoAssignments() {
        assertTrue(expander.expand(VariableSpec.empty()).isEmpty());
        assertTrue(expander.expand(VariableSpec.builder().build()).isEmpty());
    }

    @Test
    void testLiteralIsUsedVerbatim() {
        VariableSpec spec = VariableSpec.builder()
                .literal("system", "sender", "SenderShifting(qbit, X0, Z0)")
                .build();

        List<Assignment> assignments = expander.expand(spec);

        assertEquals(1, assignments.size());
        assertEquals("SenderShifting(qbit, X0, Z0)", assignments.get(0).valueOf("system", "sender"));
    }

    @Test
    void testFreeTextSplitsOnCommas() {
        assertEquals(List.of("1", "2", "3"),
                expander.resolve("project", "X", new ValueDescriptor.FreeText(" 1, 2,,3 ")));
    }

    @Test
    void testEmptyFreeTextAndEmptyListRejected() {
        assertThrows(InvalidVariableDescriptorException.class,
                () -> expander.resolve("project", "X", new ValueDescriptor.FreeText(" , ")));
        assertThrows(InvalidVariableDescriptorException.class,
                () -> expander.resolve("project", "X", new ValueDescriptor.ValueList(List.of())));
    }

    @Test
    void testExpansionIsDeterministic() {
        VariableSpec spec = VariableSpec.builder()
                .put("project", "A", new ValueDescriptor.IntRange(0, 4))
                .put("Sender", "B", new ValueDescriptor.ValueList(List.of("p", "q")))
                .literal("system", "C", "c")
                .build();

        assertEquals(expander.expand(spec), expander.expand(spec));
    }

    @Test
    void testBindingsCarryTheirSection() {
        VariableSpec spec = VariableSpec.builder()
                .literal("project", "T", "1")
                .literal("Sender", "T", "2")
                .build();

        Assignment only = expander.expand(spec).get(0);

        assertEquals("1", only.valueOf("project", "T"));
        assertEquals("2", only.valueOf("Sender", "T"));
        assertEquals(2, only.bySection().size());
    }

    @Property(tries = 50)
    void cardinalityIsProductOfOptionCounts(
            @ForAll @Size(min = 1, max = 4) List<@IntRange(min = 1, max = 5) Integer> optionCounts) {
        VariableSpec.Builder builder = VariableSpec.builder();
        long expected = 1;
        for (int i = 0; i < optionCounts.size(); i++) {
            builder.put("project", "V" + i, new ValueDescriptor.IntRange(0, optionCounts.get(i)));
            expected *= optionCounts.get(i);
        }

        List<Assignment> assignments = expander.expand(builder.build());

        assertEquals(expected, assignments.size());
        Set<Assignment> distinct = new HashSet<>(assignments);
        assertEquals(assignments.size(), distinct.size());
        assignments.forEach(a -> assertEquals(optionCounts.size(), a.size()));
    }
}
