package io.github.yok.saf.core.optics;

import com.google.common.base.Preconditions;
import io.github.yok.saf.core.model.OpticalParameters;
import io.github.yok.saf.core.pupil.PupilGrid;
import lombok.extern.slf4j.Slf4j;
import org.ejml.data.Complex_F64;
import org.ejml.data.ZMatrixRMaj;

/**
 * 瞳サンプルごとの伝搬角余弦と Fresnel 透過係数を計算するクラスです。
 *
 * <p>
 * 試料媒質の cosθ だけは、引数が負（エバネッセント領域）でも {@link #evanescentCosine(double, Complex_F64)}
 * の分岐で複素数として計算します。 その他の 3 媒質は実数の平方根で計算し、引数が非負であることは
 * {@link OpticalParameters} の検証（NA ≤ 屈折率）で保証します。
 * </p>
 */
@Slf4j
public final class InterfaceOpticsModel {

    /**
     * 界面光学量を計算します。
     *
     * @param params 光学パラメータです（null 不可）
     * @param grid 瞳格子です（null 不可）
     * @return 界面光学量です
     * @throws NullPointerException 引数が null の場合に発生します
     */
    public InterfaceOptics compute(OpticalParameters params, PupilGrid grid) {
        Preconditions.checkNotNull(params, "光学パラメータが null です。");
        Preconditions.checkNotNull(grid, "瞳格子が null です。");

        final int n = grid.size();
        final double na = params.getNumericalAperture();
        final double refmed = params.getRefmed();
        final double refcov = params.getRefcov();
        final double refimm = params.getRefimm();
        final double refimmnom = params.getRefimmnom();

        ZMatrixRMaj cosMed = new ZMatrixRMaj(n, n);
        ZMatrixRMaj cosCov = new ZMatrixRMaj(n, n);
        ZMatrixRMaj cosImm = new ZMatrixRMaj(n, n);
        ZMatrixRMaj cosImmNom = new ZMatrixRMaj(n, n);
        ZMatrixRMaj pMedCov = new ZMatrixRMaj(n, n);
        ZMatrixRMaj sMedCov = new ZMatrixRMaj(n, n);
        ZMatrixRMaj pCovImm = new ZMatrixRMaj(n, n);
        ZMatrixRMaj sCovImm = new ZMatrixRMaj(n, n);
        ZMatrixRMaj fresnelP = new ZMatrixRMaj(n, n);
        ZMatrixRMaj fresnelS = new ZMatrixRMaj(n, n);

        Complex_F64 cm = new Complex_F64();
        int evanescentCount = 0;

        for (int i = 0; i < n; i++) {
            for (int j = 0; j < n; j++) {
                if (!grid.insideAperture(i, j)) {
                    continue;
                }
                double r2 = grid.radiusSquaredAt(i, j);

                // 試料媒質（エバネッセント分岐あり）
                double argMed = 1.0 - r2 * na * na / (refmed * refmed);
                evanescentCosine(argMed, cm);
                if (argMed < 0.0) {
                    evanescentCount++;
                }

                // 他の 3 媒質は伝搬光のみ
                Complex_F64 cc = new Complex_F64(propagatingCosine(r2, na, refcov), 0.0);
                Complex_F64 ci = new Complex_F64(propagatingCosine(r2, na, refimm), 0.0);
                Complex_F64 cn = new Complex_F64(propagatingCosine(r2, na, refimmnom), 0.0);

                // 2*n1*cos1 / (n1*cos2 + n2*cos1)（P）、2*n1*cos1 / (n1*cos1 + n2*cos2)（S）
                Complex_F64 numMed = scale(cm, 2.0 * refmed);
                Complex_F64 pmc = numMed.divide(scale(cc, refmed).plus(scale(cm, refcov)));
                Complex_F64 smc = numMed.divide(scale(cm, refmed).plus(scale(cc, refcov)));

                Complex_F64 numCov = scale(cc, 2.0 * refcov);
                Complex_F64 pci = numCov.divide(scale(ci, refcov).plus(scale(cc, refimm)));
                Complex_F64 sci = numCov.divide(scale(cc, refcov).plus(scale(ci, refimm)));

                Complex_F64 fp = pmc.times(pci);
                Complex_F64 fs = smc.times(sci);

                cosMed.set(i, j, cm.real, cm.imaginary);
                cosCov.set(i, j, cc.real, cc.imaginary);
                cosImm.set(i, j, ci.real, ci.imaginary);
                cosImmNom.set(i, j, cn.real, cn.imaginary);
                pMedCov.set(i, j, pmc.real, pmc.imaginary);
                sMedCov.set(i, j, smc.real, smc.imaginary);
                pCovImm.set(i, j, pci.real, pci.imaginary);
                sCovImm.set(i, j, sci.real, sci.imaginary);
                fresnelP.set(i, j, fp.real, fp.imaginary);
                fresnelS.set(i, j, fs.real, fs.imaginary);
            }
        }

        log.debug("界面光学量を計算しました。瞳={}x{}、開口内サンプル={}、エバネッセント領域={}", n, n,
                grid.apertureCount(), evanescentCount);

        return new InterfaceOptics(cosMed, cosCov, cosImm, cosImmNom, pMedCov, sMedCov, pCovImm,
                sCovImm, fresnelP, fresnelS);
    }

    /**
     * 試料媒質の cosθ を、負の引数に対する分岐を含めて計算します。
     *
     * <p>
     * {@code sqrt(|arg|) * (cos(φ/2) - i sin(φ/2))}、{@code φ = atan2(0, arg)} です。 arg ≥ 0 では非負の実数、arg &lt; 0
     * では虚部が負の純虚数になります。 汎用の複素平方根（主値）とは負の引数で符号が逆になるため、置き換えてはいけません。
     * </p>
     *
     * @param arg {@code 1 - (X²+Y²)·NA²/n²} です
     * @param out 結果の格納先です
     */
    public static void evanescentCosine(double arg, Complex_F64 out) {
        double phi = Math.atan2(0.0, arg);
        double magnitude = Math.sqrt(Math.abs(arg));
        out.real = magnitude * Math.cos(phi / 2.0);
        out.imaginary = -magnitude * Math.sin(phi / 2.0);
    }

    /**
     * 伝搬光の cosθ を実数の平方根で計算します。
     *
     * @param r2 動径の 2 乗です
     * @param na 開口数です
     * @param index 屈折率です
     * @return cosθ です
     */
    private static double propagatingCosine(double r2, double na, double index) {
        return Math.sqrt(1.0 - r2 * na * na / (index * index));
    }

    /**
     * 複素数を実数倍した新しい値を返します。
     *
     * @param c 複素数です
     * @param s 実数倍率です
     * @return c*s です
     */
    private static Complex_F64 scale(Complex_F64 c, double s) {
        return new Complex_F64(c.real * s, c.imaginary * s);
    }
}
