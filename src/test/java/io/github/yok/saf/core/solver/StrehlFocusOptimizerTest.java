package io.github.yok.saf.core.solver;

import static org.junit.jupiter.api.Assertions.*;

import io.github.yok.saf.core.field.VectorialFieldAssembler;
import io.github.yok.saf.core.linearalgebra.EjmlLeastSquaresPolynomialFitBackend;
import io.github.yok.saf.core.model.OpticalParameters;
import io.github.yok.saf.core.optics.InterfaceOpticsModel;
import org.junit.jupiter.api.Test;

/**
 * StrehlFocusOptimizer のテストです。
 */
class StrehlFocusOptimizerTest {

    private final FocusOptimizer optimizer = new StrehlFocusOptimizer(new InterfaceOpticsModel(),
            new VectorialFieldAssembler(), new StrehlScanner(),
            new PeakRefiner(new EjmlLeastSquaresPolynomialFitBackend()));

    private static OpticalParameters.OpticalParametersBuilder base() {
        return OpticalParameters.builder().numericalAperture(1.2).refmed(1.33).refcov(1.52)
                .refimm(1.51).refimmnom(1.51).lambda(680.0).npupil(16).fwd(150000.0).depth(0.0)
                .zspreadLow(-1000.0).zspreadHigh(1000.0);
    }

    @Test
    void testOptimize_MatchedIndexAtZeroDepth() {
        FocusOptimizer.FocusResult r = optimizer.optimize(base().build());

        assertEquals(150000.0, r.getStagePosition(), 1e-3);
        assertEquals(150000.0, r.getFreeWorkingDistance(), 0.0);
        assertEquals(0.0, r.getImagePlaneZ(), 0.0);
        assertTrue(r.getMaxStrehl() <= 1.0);
        assertTrue(r.getMaxStrehl() > 0.9999);
        assertTrue(r.getWrms() >= 0.0);
        assertTrue(r.getWrms() < 0.01);
    }

    @Test
    void testOptimize_DeepImagingMovesStageTowardsSample() {
        FocusOptimizer.FocusResult r = optimizer.optimize(base().depth(5000.0).build());

        assertEquals(143705.26, r.getStagePosition(), 1.0);
        assertEquals(0.84809, r.getMaxStrehl(), 1e-3);
        assertEquals(17.832, r.getWrms(), 0.05);
        assertEquals(-5000.0, r.getImagePlaneZ(), 0.0);
        assertTrue(r.getStagePosition() < r.getFreeWorkingDistance());

        double[] zvals = r.zvals();
        assertEquals(3, zvals.length);
        assertEquals(r.getStagePosition(), zvals[0], 0.0);
        assertEquals(150000.0, zvals[1], 0.0);
        assertEquals(-5000.0, zvals[2], 0.0);
    }

    @Test
    void testOptimize_StageFollowsBaselinePlusFittedOffset() {
        OpticalParameters p = base().depth(5000.0).build();
        FocusOptimizer.FocusResult r = optimizer.optimize(p);

        assertEquals(p.baselineStagePosition() + r.getPeak().getOffset(), r.getStagePosition(),
                1e-9);
        assertEquals(p.getLambda() / (2.0 * Math.PI) * Math.log(1.0 / r.getMaxStrehl()),
                r.getWrms(), 1e-12);
        assertEquals(101, r.getScan().size());
    }

    @Test
    void testOptimize_EvanescentApertureGivesSmallNegativeWrms() {
        FocusOptimizer.FocusResult r =
                optimizer.optimize(base().numericalAperture(1.49).build());

        // エバネッセント成分で Strehl 比が 1 をわずかに超えるため Wrms は負になります
        assertTrue(r.getMaxStrehl() > 1.0);
        assertTrue(r.getWrms() < 0.0);
        assertTrue(Math.abs(r.getWrms()) < 0.01 * 680.0);
        assertTrue(Math.abs(r.getStagePosition() - 150000.0) < 60.0);
    }

    @Test
    void testOptimize_LargerImmersionMismatchLowersPeak() {
        double[] nominal = {1.51, 1.50, 1.49, 1.48};
        double previousStrehl = Double.POSITIVE_INFINITY;
        double previousWrms = Double.NEGATIVE_INFINITY;
        for (double refimmnom : nominal) {
            FocusOptimizer.FocusResult r =
                    optimizer.optimize(base().fwd(5000.0).refimmnom(refimmnom).build());

            assertTrue(r.getMaxStrehl() < previousStrehl, "refimmnom=" + refimmnom);
            assertTrue(r.getWrms() > previousWrms, "refimmnom=" + refimmnom);
            previousStrehl = r.getMaxStrehl();
            previousWrms = r.getWrms();
        }
    }

    @Test
    void testOptimize_ParallelScanGivesSameResult() {
        FocusOptimizer parallel = new StrehlFocusOptimizer(new InterfaceOpticsModel(),
                new VectorialFieldAssembler(), new StrehlScanner(3),
                new PeakRefiner(new EjmlLeastSquaresPolynomialFitBackend()));
        OpticalParameters p = base().npupil(8).depth(2000.0).build();

        FocusOptimizer.FocusResult a = optimizer.optimize(p);
        FocusOptimizer.FocusResult b = parallel.optimize(p);

        assertEquals(a.getStagePosition(), b.getStagePosition(), 0.0);
        assertEquals(a.getWrms(), b.getWrms(), 0.0);
    }

    @Test
    void testOptimize_DebugModeDoesNotChangeResult() {
        OpticalParameters p = base().npupil(8).depth(2000.0).build();

        FocusOptimizer.FocusResult quiet = optimizer.optimize(p);
        FocusOptimizer.FocusResult verbose = optimizer.optimize(p.toBuilder().debugMode(true).build());

        assertEquals(quiet.getStagePosition(), verbose.getStagePosition(), 0.0);
        assertEquals(quiet.getWrms(), verbose.getWrms(), 0.0);
    }

    @Test
    void testOptimize_SingleSamplePupilIsDegenerate() {
        // 1 点の瞳では Strehl 比が一定になり頂点が定まりません
        assertThrows(IllegalStateException.class, () -> optimizer.optimize(base().npupil(1).build()));
    }

    @Test
    void testOptimize_ZeroSpreadIsDegenerate() {
        assertThrows(IllegalStateException.class,
                () -> optimizer.optimize(base().zspreadLow(0.0).zspreadHigh(0.0).build()));
    }

    @Test
    void testOptimize_InvalidParametersAreRejectedBeforeSolving() {
        assertThrows(IllegalArgumentException.class,
                () -> optimizer.optimize(base().numericalAperture(1.49).refimmnom(1.33).build()));
        assertThrows(NullPointerException.class, () -> optimizer.optimize(null));
    }
}
