package com.raditha.sweep.analysis;

import com.raditha.sweep.model.Assignment;
import com.raditha.sweep.model.EngineResult;
import com.raditha.sweep.model.FailureKind;
import com.raditha.sweep.model.FormulaResult;
import com.raditha.sweep.model.Sample;
import com.raditha.sweep.model.Satisfaction;
import com.raditha.sweep.model.SweepResult;
import com.raditha.sweep.model.SweepState;
import com.raditha.sweep.model.VariableBinding;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ResultAggregatorTest {

    private final ResultAggregator aggregator = new ResultAggregator();

    private static EngineResult run(int id, String slot, String seed, double... finals) {
        Assignment assignment = new Assignment(List.of(
                new VariableBinding("project", "TIMESLOT", slot),
                new VariableBinding("project", "SEED", seed)));
        Map<String, List<Sample>> traces = new LinkedHashMap<>();
        for (int i = 0; i < finals.length; i++) {
            traces.put("[" + i + "]", List.of(new Sample(0L, 0L), new Sample(10L, finals[i])));
        }
        return EngineResult.finished(id, assignment, 0, "",
                List.of(new FormulaResult("1", Satisfaction.SATISFIED)), List.of(traces));
    }

    private static SweepResult sweep(EngineResult... results) {
        return SweepResult.of(SweepState.COMPLETED, List.of(results), results.length, 0, 1);
    }

    @Test
    void testGroupsOrderedNumerically() {
        SweepResult result = sweep(
                run(0, "10", "a", 4.0),
                run(1, "5", "a", 1.0, 3.0),
                run(2, "10", "b", 6.0),
                run(3, "5", "b", 2.0));

        Map<String, List<Double>> groups = aggregator.finalValuesBy(result, "project", "TIMESLOT", 0);

        assertEquals(List.of("5", "10"), new ArrayList<>(groups.keySet()));
        assertEquals(List.of(1.0, 3.0, 2.0), groups.get("5"));
        assertEquals(List.of(4.0, 6.0), groups.get("10"));
    }

    @Test
    void testStatistics() {
        SweepResult result = sweep(run(0, "5", "a", 1.0, 3.0), run(1, "5", "b", 2.0));

        GroupStatistics stats = aggregator.statisticsBy(result, "project", "TIMESLOT", 0).get("5");

        assertEquals(3, stats.count());
        assertEquals(1.0, stats.min());
        assertEquals(3.0, stats.max());
        assertEquals(2.0, stats.mean(), 1e-9);
    }

    @Test
    void testNonNumericGroupsOrderedLexically() {
        SweepResult result = sweep(run(0, "5", "b", 1.0), run(1, "5", "a", 2.0));

        assertEquals(List.of("a", "b"),
                new ArrayList<>(aggregator.finalValuesBy(result, "project", "SEED", 0).keySet()));
    }

    @Test
    void testFailedRunsAndMissingFormulasSkipped() {
        Assignment failedAssignment = new Assignment(List.of(
                new VariableBinding("project", "TIMESLOT", "99"),
                new VariableBinding("project", "SEED", "a")));
        SweepResult result = sweep(
                run(0, "5", "a", 1.0),
                EngineResult.failed(1, failedAssignment, FailureKind.TIMEOUT, "timeout"));

        assertEquals(List.of("5"),
                new ArrayList<>(aggregator.finalValuesBy(result, "project", "TIMESLOT", 0).keySet()));
        assertTrue(aggregator.finalValuesBy(result, "project", "TIMESLOT", 1).isEmpty());
        assertTrue(aggregator.finalValuesBy(result, "project", "NOPE", 0).isEmpty());
    }

    @Test
    void testNonNumericSamplesIgnored() {
        Assignment assignment = new Assignment(List.of(new VariableBinding("project", "TIMESLOT", "5")));
        EngineResult raw = EngineResult.finished(0, assignment, 0, "",
                List.of(new FormulaResult("1", Satisfaction.SATISFIED)),
                List.of(Map.of("[0]", List.of(new Sample("t", "v")))));

        List<Double> values = aggregator.finalValuesBy(sweep(raw), "project", "TIMESLOT", 0).get("5");

        assertTrue(values.isEmpty());
        assertEquals(0, GroupStatistics.of(values).count());
        assertTrue(Double.isNaN(GroupStatistics.of(values).mean()));
    }

    @Test
    void testNegativeFormulaIndexRejected() {
        assertThrows(IllegalArgumentException.class,
                () -> aggregator.finalValuesBy(sweep(), "project", "TIMESLOT", -1));
    }
}
