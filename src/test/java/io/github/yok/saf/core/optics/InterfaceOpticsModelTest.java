package io.github.yok.saf.core.optics;

import static org.junit.jupiter.api.Assertions.*;

import io.github.yok.saf.core.model.OpticalParameters;
import io.github.yok.saf.core.pupil.PupilGrid;
import org.ejml.data.Complex_F64;
import org.ejml.data.ZMatrixRMaj;
import org.junit.jupiter.api.Test;

/**
 * InterfaceOpticsModel のテストです。
 */
class InterfaceOpticsModelTest {

    private final InterfaceOpticsModel model = new InterfaceOpticsModel();

    private static OpticalParameters params(double na, int npupil) {
        return OpticalParameters.builder().numericalAperture(na).refmed(1.33).refcov(1.52)
                .refimm(1.51).refimmnom(1.51).lambda(680.0).npupil(npupil).fwd(150000.0)
                .depth(0.0).zspreadLow(-1000.0).zspreadHigh(1000.0).build();
    }

    @Test
    void testEvanescentCosine_PositiveArgument() {
        Complex_F64 out = new Complex_F64();
        InterfaceOpticsModel.evanescentCosine(0.36, out);

        assertEquals(0.6, out.real, 1e-15);
        assertEquals(0.0, out.imaginary, 1e-15);
    }

    @Test
    void testEvanescentCosine_NegativeArgumentIsNegativeImaginary() {
        Complex_F64 out = new Complex_F64();
        InterfaceOpticsModel.evanescentCosine(-0.25, out);

        assertEquals(0.0, out.real, 1e-15);
        assertEquals(-0.5, out.imaginary, 1e-15);
    }

    @Test
    void testCompute_OnAxisFresnelCoefficients() {
        PupilGrid grid = PupilGrid.build(3);
        InterfaceOptics optics = model.compute(params(1.2, 3), grid);

        double tpMedCov = 2.0 * 1.33 / (1.33 + 1.52);
        double tpCovImm = 2.0 * 1.52 / (1.52 + 1.51);

        // 中心サンプル (1, 1) は光軸上
        assertEquals(1.0, optics.getCosMed().getReal(1, 1), 1e-15);
        assertEquals(1.0, optics.getCosImm().getReal(1, 1), 1e-15);
        assertEquals(tpMedCov, optics.getFresnelPMedCov().getReal(1, 1), 1e-12);
        assertEquals(tpMedCov, optics.getFresnelSMedCov().getReal(1, 1), 1e-12);
        assertEquals(tpCovImm, optics.getFresnelPCovImm().getReal(1, 1), 1e-12);
        assertEquals(tpMedCov * tpCovImm, optics.getFresnelP().getReal(1, 1), 1e-12);
        assertEquals(tpMedCov * tpCovImm, optics.getFresnelS().getReal(1, 1), 1e-12);
        assertEquals(0.0, optics.getFresnelP().getImag(1, 1), 1e-15);
    }

    @Test
    void testCompute_PropagatingCosines() {
        PupilGrid grid = PupilGrid.build(4);
        InterfaceOptics optics = model.compute(params(1.2, 4), grid);

        double r2 = grid.radiusSquaredAt(1, 2);
        assertEquals(Math.sqrt(1.0 - r2 * 1.44 / (1.33 * 1.33)), optics.getCosMed().getReal(1, 2),
                1e-14);
        assertEquals(Math.sqrt(1.0 - r2 * 1.44 / (1.52 * 1.52)), optics.getCosCov().getReal(1, 2),
                1e-14);
        assertEquals(Math.sqrt(1.0 - r2 * 1.44 / (1.51 * 1.51)),
                optics.getCosImmNom().getReal(1, 2), 1e-14);
        assertEquals(0.0, optics.getCosMed().getImag(1, 2), 0.0);
    }

    @Test
    void testCompute_OutsideApertureIsZero() {
        PupilGrid grid = PupilGrid.build(4);
        InterfaceOptics optics = model.compute(params(1.2, 4), grid);

        ZMatrixRMaj[] maps = {optics.getCosMed(), optics.getCosCov(), optics.getCosImm(),
                optics.getCosImmNom(), optics.getFresnelP(), optics.getFresnelS()};
        for (ZMatrixRMaj m : maps) {
            assertEquals(0.0, m.getReal(0, 0), 0.0);
            assertEquals(0.0, m.getImag(0, 0), 0.0);
            assertEquals(0.0, m.getReal(3, 3), 0.0);
        }
    }

    @Test
    void testCompute_EvanescentSamplesBeyondSampleIndex() {
        PupilGrid grid = PupilGrid.build(16);
        InterfaceOptics optics = model.compute(params(1.49, 16), grid);

        // (0.9375, 0.0625): NA·r > refmed
        double r2 = grid.radiusSquaredAt(15, 8);
        double arg = 1.0 - r2 * 1.49 * 1.49 / (1.33 * 1.33);
        assertTrue(arg < 0.0);

        assertEquals(0.0, optics.getCosMed().getReal(15, 8), 1e-12);
        assertEquals(-Math.sqrt(-arg), optics.getCosMed().getImag(15, 8), 1e-14);
        assertTrue(optics.getCosCov().getReal(15, 8) > 0.0);
        assertTrue(Double.isFinite(optics.getFresnelP().getReal(15, 8)));
        assertTrue(Double.isFinite(optics.getFresnelS().getImag(15, 8)));

        // 中心付近は伝搬光のまま
        assertTrue(optics.getCosMed().getReal(8, 8) > 0.9);
        assertEquals(0.0, optics.getCosMed().getImag(8, 8), 0.0);
    }

    @Test
    void testCompute_NullArguments() {
        PupilGrid grid = PupilGrid.build(4);
        assertThrows(NullPointerException.class, () -> model.compute(null, grid));
        assertThrows(NullPointerException.class, () -> model.compute(params(1.2, 4), null));
    }
}
