package io.github.yok.saf.core.field;

import com.google.common.base.Preconditions;
import io.github.yok.saf.core.model.OpticalParameters;
import io.github.yok.saf.core.optics.InterfaceOptics;
import io.github.yok.saf.core.pupil.PupilGrid;
import lombok.extern.slf4j.Slf4j;
import org.ejml.data.Complex_F64;
import org.ejml.data.ZMatrixRMaj;
import org.ejml.ops.ComplexMath_F64;

/**
 * 界面光学量から偏光分解した瞳面ベクトル場を組み立てるクラスです。
 *
 * <p>
 * p 偏光ベクトル {@code FresnelP·[cosθ cosφ, cosθ sinφ, -sinθ]} と s 偏光ベクトル {@code FresnelS·[-sinφ, cosφ, 0]}
 * を方位角で回して 2 つの出力偏光チャネルにし、 振幅因子 {@code sqrt(cosImm) / (refmed·cosMed)} を開口マスク付きで掛けます。
 * </p>
 */
@Slf4j
public final class VectorialFieldAssembler {

    /**
     * ベクトル場を組み立てます。
     *
     * @param params 光学パラメータです（null 不可）
     * @param grid 瞳格子です（null 不可）
     * @param optics 界面光学量です（null 不可）
     * @return ベクトル場です
     * @throws NullPointerException 引数が null の場合に発生します
     * @throws IllegalStateException 正規化定数が正にならない場合に発生します
     */
    public VectorialField assemble(OpticalParameters params, PupilGrid grid,
            InterfaceOptics optics) {
        Preconditions.checkNotNull(params, "光学パラメータが null です。");
        Preconditions.checkNotNull(grid, "瞳格子が null です。");
        Preconditions.checkNotNull(optics, "界面光学量が null です。");

        final int n = grid.size();
        final double refmed = params.getRefmed();

        ZMatrixRMaj[][] polarization =
                new ZMatrixRMaj[VectorialField.POLARIZATIONS][VectorialField.COMPONENTS];
        for (int itel = 0; itel < VectorialField.POLARIZATIONS; itel++) {
            for (int jtel = 0; jtel < VectorialField.COMPONENTS; jtel++) {
                polarization[itel][jtel] = new ZMatrixRMaj(n, n);
            }
        }
        ZMatrixRMaj amplitude = new ZMatrixRMaj(n, n);

        Complex_F64 cosTheta = new Complex_F64();
        Complex_F64 fp = new Complex_F64();
        Complex_F64 fs = new Complex_F64();
        Complex_F64 cosImm = new Complex_F64();
        Complex_F64 sinTheta = new Complex_F64();
        Complex_F64 sqrtCosImm = new Complex_F64();

        Complex_F64[] pvec = new Complex_F64[VectorialField.COMPONENTS];
        Complex_F64[] svec = new Complex_F64[VectorialField.COMPONENTS];

        for (int i = 0; i < n; i++) {
            for (int j = 0; j < n; j++) {
                if (!grid.insideAperture(i, j)) {
                    continue;
                }

                double phi = Math.atan2(grid.yAt(i, j), grid.xAt(i, j));
                double cosPhi = Math.cos(phi);
                double sinPhi = Math.sin(phi);

                optics.getCosMed().get(i, j, cosTheta);
                optics.getFresnelP().get(i, j, fp);
                optics.getFresnelS().get(i, j, fs);
                optics.getCosImm().get(i, j, cosImm);

                // sinθ = sqrt(1 - cos²θ)（cosθ が純虚数のときも 1 - cos²θ は正の実数）
                Complex_F64 cos2 = cosTheta.times(cosTheta);
                ComplexMath_F64.sqrt(new Complex_F64(1.0 - cos2.real, -cos2.imaginary), sinTheta);

                Complex_F64 fpCos = fp.times(cosTheta);
                pvec[0] = scale(fpCos, cosPhi);
                pvec[1] = scale(fpCos, sinPhi);
                pvec[2] = scale(fp.times(sinTheta), -1.0);

                svec[0] = scale(fs, -sinPhi);
                svec[1] = scale(fs, cosPhi);
                svec[2] = new Complex_F64(0.0, 0.0);

                for (int k = 0; k < VectorialField.COMPONENTS; k++) {
                    Complex_F64 out0 = scale(pvec[k], cosPhi).minus(scale(svec[k], sinPhi));
                    Complex_F64 out1 = scale(pvec[k], sinPhi).plus(scale(svec[k], cosPhi));
                    polarization[0][k].set(i, j, out0.real, out0.imaginary);
                    polarization[1][k].set(i, j, out1.real, out1.imaginary);
                }

                // アプラナティック振幅因子（開口外は 0 のまま）
                ComplexMath_F64.sqrt(cosImm, sqrtCosImm);
                Complex_F64 amp = sqrtCosImm.divide(scale(cosTheta, refmed));
                amplitude.set(i, j, amp.real, amp.imaginary);
            }
        }

        VectorialField field = new VectorialField(grid, polarization, amplitude);

        if (!(field.strehlNormalization() > 0.0)) {
            throw new IllegalStateException(
                    "Strehl 比の正規化定数が正になりません: " + field.strehlNormalization());
        }

        log.debug("ベクトル場を組み立てました。開口内サンプル={}、正規化定数={}", field.sampleCount(),
                field.strehlNormalization());

        return field;
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
