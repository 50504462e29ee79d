package com.raditha.sweep.scheduler;

import com.raditha.sweep.TestModels;
import com.raditha.sweep.config.SweepConfig;
import com.raditha.sweep.engine.EngineInvoker;
import com.raditha.sweep.engine.EngineLaunchException;
import com.raditha.sweep.engine.EngineTimeoutException;
import com.raditha.sweep.engine.OutputParser;
import com.raditha.sweep.engine.ProcessEngineInvoker;
import com.raditha.sweep.engine.RawEngineOutput;
import com.raditha.sweep.expansion.AssignmentExpander;
import com.raditha.sweep.expansion.InvalidRangeException;
import com.raditha.sweep.model.EngineResult;
import com.raditha.sweep.model.FailureKind;
import com.raditha.sweep.model.Satisfaction;
import com.raditha.sweep.model.SweepResult;
import com.raditha.sweep.model.SweepState;
import com.raditha.sweep.model.ValueDescriptor;
import com.raditha.sweep.model.VariableSpec;
import com.raditha.sweep.model.VariantTask;
import com.raditha.sweep.variant.DeclarationTextMaterializer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class SweepSchedulerTest {

    @TempDir
    Path tempDir;

    @Mock
    private EngineInvoker invoker;

    private SweepConfig config;
    private SweepRequest request;

    @BeforeEach
    void setUp() throws Exception {
        config = SweepConfig.defaults().withThreads(1).withWorkDirectory(tempDir.resolve("work"));
        request = request(VariableSpec.builder()
                .put("project", "T1", new ValueDescriptor.IntRange(0, 5))
                .build());

        when(invoker.invoke(any(), any(), anyLong(), any())).thenAnswer(inv -> {
            VariantTask task = inv.getArgument(0);
            return satisfiedOutput(task);
        });
    }

    private SweepRequest request(VariableSpec spec) throws IOException {
        return new SweepRequest(spec, TestModels.slot(), tempDir.resolve("slot.q"));
    }

    private static RawEngineOutput satisfiedOutput(VariantTask task) {
        String t1 = task.assignment().valueOf("project", "T1");
        return new RawEngineOutput(
                "Verifying formula 1 at slot.q:1\n -- Formula is satisfied.\n[T1]: (0," + t1 + ")\n", "", 0);
    }

    private SweepScheduler scheduler(SweepConfig cfg) {
        return new SweepScheduler(cfg, new AssignmentExpander(), new DeclarationTextMaterializer(), invoker,
                new OutputParser());
    }

    @Test
    void testEveryVariationProducesOneResult() {
        SweepResult result = scheduler(config).run(request);

        assertEquals(SweepState.COMPLETED, result.state());
        assertEquals(5, result.size());
        assertEquals(List.of("variation_0", "variation_1", "variation_2", "variation_3", "variation_4"),
                List.copyOf(result.results().keySet()));
        EngineResult third = result.result(2);
        assertTrue(third.success());
        assertEquals("2", third.assignment().valueOf("project", "T1"));
        assertEquals(Satisfaction.SATISFIED, third.formulas().get(0).satisfaction());
        assertEquals(2L, third.dataPoints().get(0).get("[T1]").get(0).value());
        assertEquals(5, result.statistics().successfulRuns());
    }

    @Test
    void testVariantTextCarriesTheAssignedValue() throws Exception {
        scheduler(config).run(request);

        verify(invoker, times(5)).invoke(argThat(task -> task.modelText()
                .contains("const int T1 = " + task.assignment().valueOf("project", "T1") + ";")),
                any(), anyLong(), any());
    }

    @Test
    void testFailedLaunchesAreIsolated() throws Exception {
        when(invoker.invoke(any(), any(), anyLong(), any())).thenAnswer(inv -> {
            VariantTask task = inv.getArgument(0);
            if (task.variationId() == 1 || task.variationId() == 3) {
                throw new EngineLaunchException("engine not found", new IOException("ENOENT"));
            }
            return satisfiedOutput(task);
        });

        SweepResult result = scheduler(config).run(request);

        assertEquals(5, result.size());
        assertEquals(5, result.statistics().totalVariations());
        assertEquals(3, result.statistics().successfulRuns());
        assertEquals(2, result.statistics().failedRuns());
        EngineResult failed = result.result(1);
        assertFalse(failed.success());
        assertEquals(FailureKind.LAUNCH, failed.failureKind());
        assertNull(failed.exitCode());
        assertTrue(failed.error().contains("engine not found"));
        assertTrue(result.result(2).success());
    }

    @Test
    void testTimeoutIsRecordedPerVariation() throws Exception {
        when(invoker.invoke(any(), any(), anyLong(), any())).thenAnswer(inv -> {
            VariantTask task = inv.getArgument(0);
            if (task.variationId() == 4) {
                throw new EngineTimeoutException(Duration.ofSeconds(1));
            }
            return satisfiedOutput(task);
        });

        SweepResult result = scheduler(config.withTimeout(Duration.ofSeconds(1))).run(request);

        assertEquals(1, result.statistics().timedOutRuns());
        assertEquals(1, result.statistics().failedRuns());
        assertEquals(FailureKind.TIMEOUT, result.result(4).failureKind());
    }

    @Test
    void testNonZeroExitIsAFailure() throws Exception {
        when(invoker.invoke(any(), any(), anyLong(), any()))
                .thenReturn(new RawEngineOutput("", "syntax error at line 3", 1));

        SweepResult result = scheduler(config).run(request);

        EngineResult first = result.result(0);
        assertFalse(first.success());
        assertEquals(1, first.exitCode());
        assertEquals(FailureKind.NONZERO_EXIT, first.failureKind());
        assertEquals("syntax error at line 3", first.stderr());
        assertEquals(5, result.statistics().failedRuns());
    }

    @Test
    void testUnknownSectionFailsEachVariationWithoutRunningEngine() throws Exception {
        SweepResult result = scheduler(config).run(request(VariableSpec.builder()
                .put("Nobody", "x", new ValueDescriptor.ValueList(List.of("1", "2")))
                .build()));

        assertEquals(SweepState.COMPLETED, result.state());
        assertEquals(2, result.size());
        result.results().values().forEach(r -> {
            assertEquals(FailureKind.MATERIALIZATION, r.failureKind());
            assertTrue(r.error().contains("Nobody"));
        });
        verify(invoker, never()).invoke(any(), any(), anyLong(), any());
    }

    @Test
    void testInvalidSpecFailsBeforeAnyTask() throws Exception {
        SweepScheduler scheduler = scheduler(config);
        SweepRequest bad = request(VariableSpec.builder()
                .put("project", "T1", new ValueDescriptor.IntRange(0, 5, 0))
                .build());

        assertThrows(InvalidRangeException.class, () -> scheduler.run(bad));
        assertEquals(SweepState.FAILED, scheduler.getState());
        verify(invoker, never()).invoke(any(), any(), anyLong(), any());
    }

    @Test
    void testEmptySpecCompletesWithoutRuns() throws Exception {
        SweepScheduler scheduler = scheduler(config);

        SweepResult result = scheduler.run(request(VariableSpec.empty()));

        assertEquals(SweepState.COMPLETED, result.state());
        assertEquals(0, result.size());
        assertEquals(0, result.statistics().totalVariations());
        assertEquals(SweepState.COMPLETED, scheduler.getState());
        verify(invoker, never()).invoke(any(), any(), anyLong(), any());
    }

    @Test
    void testSeedAndTimeoutArePassedToEngine() throws Exception {
        SweepConfig seeded = config.withSeed(428094).withTimeout(Duration.ofSeconds(600));

        SweepResult result = scheduler(seeded).run(request);

        verify(invoker, times(5)).invoke(any(), eq(request.queryFile()), eq(428094L), eq(Duration.ofSeconds(600)));
        assertEquals(428094L, result.statistics().seedUsed());
    }

    @Test
    void testRunsAreRepeatable() {
        SweepScheduler scheduler = scheduler(config.withThreads(3));

        SweepResult first = scheduler.run(request);
        SweepResult second = scheduler.run(request);

        assertEquals(first.results(), second.results());
        assertEquals(first.statistics(), second.statistics());
    }

    @Test
    void testParallelRunCollectsEverything() {
        Set<String> threads = ConcurrentHashMap.newKeySet();
        SweepConfig parallel = config.withThreads(4);
        SweepRequest wide = new SweepRequest(VariableSpec.builder()
                .put("project", "T1", new ValueDescriptor.IntRange(0, 4))
                .put("project", "TIMESLOT", new ValueDescriptor.ValueList(List.of("5", "10", "15")))
                .build(), request.model(), request.queryFile());

        SweepResult result = scheduler(parallel).run(wide, (done, total) -> threads.add(Thread.currentThread().getName()),
                new SweepCancellation());

        assertEquals(12, result.size());
        assertEquals(12, result.statistics().successfulRuns());
        assertEquals(4, result.statistics().threadsUsed());
        assertEquals(1, threads.size(), "progress is reported from the collecting thread");
    }

    @Test
    void testProgressIsReportedPerCollectedVariation() {
        List<Integer> progress = new ArrayList<>();

        scheduler(config).run(request, (done, total) -> {
            assertEquals(5, total);
            progress.add(done);
        }, new SweepCancellation());

        assertEquals(List.of(1, 2, 3, 4, 5), progress);
    }

    @Test
    void testFailingListenerDoesNotStopTheRun() {
        SweepResult result = scheduler(config).run(request, (done, total) -> {
            throw new IllegalStateException("listener broke");
        }, new SweepCancellation());

        assertEquals(SweepState.COMPLETED, result.state());
        assertEquals(5, result.size());
    }

    @Test
    void testCancelKeepsCollectedResults() {
        SweepCancellation cancellation = new SweepCancellation();

        SweepResult result = scheduler(config).run(request, (done, total) -> {
            if (done == 2) {
                cancellation.cancel();
            }
        }, cancellation);

        assertEquals(SweepState.CANCELLED, result.state());
        assertEquals(2, result.size());
        assertNotNull(result.result(0));
        assertNotNull(result.result(1));
        assertEquals(5, result.statistics().totalVariations());
    }

    @Test
    void testCancelledBeforeStartRunsNothing() throws Exception {
        SweepCancellation cancellation = new SweepCancellation();
        cancellation.cancel();

        SweepResult result = scheduler(config).run(request, SweepProgressListener.NONE, cancellation);

        assertEquals(SweepState.CANCELLED, result.state());
        assertEquals(0, result.size());
        verify(invoker, never()).invoke(any(), any(), anyLong(), any());
    }

    @Test
    @EnabledOnOs({OS.LINUX, OS.MAC})
    void testCancelKillsRunningEnginesAndLeavesNoFiles() throws Exception {
        Path engine = tempDir.resolve("slow-engine.sh");
        Files.writeString(engine, "#!/bin/sh\nexec sleep 30\n");
        assertTrue(engine.toFile().setExecutable(true));
        SweepConfig cfg = config.withThreads(2);
        SweepScheduler scheduler = new SweepScheduler(cfg, new AssignmentExpander(),
                new DeclarationTextMaterializer(),
                new ProcessEngineInvoker(engine.toString(), cfg.workDirectory()),
                new OutputParser());
        SweepCancellation cancellation = new SweepCancellation();

        Thread canceller = new Thread(() -> {
            try {
                Thread.sleep(500);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            cancellation.cancel();
        });
        canceller.start();
        long start = System.nanoTime();
        SweepResult result = scheduler.run(request, SweepProgressListener.NONE, cancellation);
        canceller.join();

        assertEquals(SweepState.CANCELLED, result.state());
        assertEquals(0, result.size());
        assertTrue(Duration.ofNanos(System.nanoTime() - start).toSeconds() < 20);
        if (Files.exists(cfg.workDirectory())) {
            try (Stream<Path> left = Files.list(cfg.workDirectory())) {
                assertEquals(0, left.count(), "no transient file may outlive a cancelled run");
            }
        }
    }
}
