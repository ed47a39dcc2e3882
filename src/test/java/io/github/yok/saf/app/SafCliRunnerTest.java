package io.github.yok.saf.app;

import static org.junit.jupiter.api.Assertions.*;

import io.github.yok.saf.core.field.VectorialFieldAssembler;
import io.github.yok.saf.core.linearalgebra.EjmlLeastSquaresPolynomialFitBackend;
import io.github.yok.saf.core.model.OpticalParameters;
import io.github.yok.saf.core.optics.InterfaceOpticsModel;
import io.github.yok.saf.core.solver.FocusOptimizer;
import io.github.yok.saf.core.solver.PeakRefiner;
import io.github.yok.saf.core.solver.StrehlFocusOptimizer;
import io.github.yok.saf.core.solver.StrehlScanner;
import io.github.yok.saf.out.CsvResultWriter;
import io.github.yok.saf.out.ResultWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

/**
 * SafCliRunner のテストです。
 */
class SafCliRunnerTest {

    @TempDir
    Path tempDir;

    private static FocusOptimizer optimizer() {
        return new StrehlFocusOptimizer(new InterfaceOpticsModel(), new VectorialFieldAssembler(),
                new StrehlScanner(), new PeakRefiner(new EjmlLeastSquaresPolynomialFitBackend()));
    }

    private SafProperties properties(boolean debug, List<Double> depths) {
        SafProperties p = new SafProperties();
        p.getPupil().setSize(8);
        p.getDepthScan().setValues(depths);
        p.setDebug(debug);
        p.getOutput().setDir(tempDir.toString());
        return p;
    }

    @Test
    void testRun_DebugWritesCurvesPerDepth() throws Exception {
        SafProperties p = properties(true, List.of(0.0, 2000.0));
        new SafCliRunner(p, optimizer(), new CsvResultWriter(p.getOutput().getDir())).run();

        assertTrue(Files.exists(tempDir.resolve("saf_strehl_depth=0.0.csv")));
        assertTrue(Files.exists(tempDir.resolve("saf_meta_depth=0.0.csv")));
        assertTrue(Files.exists(tempDir.resolve("saf_strehl_depth=2000.0.csv")));
        assertTrue(Files.exists(tempDir.resolve("saf_meta_depth=2000.0.csv")));
    }

    @Test
    void testRun_WithoutDebugWritesNothing() throws Exception {
        List<Double> written = new ArrayList<>();
        ResultWriter recorder = (params, result) -> written.add(params.getDepth());

        SafProperties p = properties(false, List.of(0.0, 2000.0));
        new SafCliRunner(p, optimizer(), recorder).run();

        assertTrue(written.isEmpty());
    }

    @Test
    void testRun_OptimizesEachDepthInOrder() throws Exception {
        List<Double> depths = new ArrayList<>();
        FocusOptimizer delegate = optimizer();
        FocusOptimizer recording = (OpticalParameters params) -> {
            depths.add(params.getDepth());
            return delegate.optimize(params);
        };

        SafProperties p = properties(false, List.of(2000.0, 0.0, 1000.0));
        new SafCliRunner(p, recording, (params, result) -> {
        }).run();

        assertEquals(List.of(2000.0, 0.0, 1000.0), depths);
    }

    @Test
    void testRun_EmptyDepthList() {
        SafProperties p = properties(false, List.of());
        SafCliRunner runner = new SafCliRunner(p, optimizer(), (params, result) -> {
        });

        assertThrows(IllegalStateException.class, () -> runner.run());
    }

    @Test
    void testRun_NullDepth() {
        SafProperties p = properties(false, Arrays.asList(0.0, null));
        SafCliRunner runner = new SafCliRunner(p, optimizer(), (params, result) -> {
        });

        assertThrows(IllegalStateException.class, () -> runner.run());
    }
}
