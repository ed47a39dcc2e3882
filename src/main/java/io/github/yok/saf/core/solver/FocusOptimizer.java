package io.github.yok.saf.core.solver;

import io.github.yok.saf.core.model.OpticalParameters;
import io.github.yok.saf.core.solver.PeakRefiner.PeakEstimate;
import lombok.Value;

/**
 * 屈折率不整合条件のもとで、Strehl 比が最大となるステージ位置と RMS 波面収差を求めるインタフェースです。
 */
public interface FocusOptimizer {

    /**
     * 最適ステージ位置と RMS 波面収差を計算します。
     *
     * @param params 光学パラメータです
     * @return 計算結果です
     */
    FocusResult optimize(OpticalParameters params);

    /**
     * 計算結果を表すクラスです。
     */
    @Value
    class FocusResult {

        /**
         * 最適（公称）ステージ位置です。
         */
        double stagePosition;

        /**
         * フリーワーキングディスタンスです。
         */
        double freeWorkingDistance;

        /**
         * カバーガラスから見た像面の z 位置（-depth）です。
         */
        double imagePlaneZ;

        /**
         * 屈折率不整合による RMS 波面収差（波長と同じ単位）です。結像深さ 0 では負になり得ます。
         */
        double wrms;

        /**
         * フィットした頂点での Strehl 比です。
         */
        double maxStrehl;

        /**
         * Strehl 比の走査結果です。
         */
        StrehlScan scan;

        /**
         * 最大点近傍の 2 次フィット結果です。
         */
        PeakEstimate peak;

        /**
         * {@code [stagePosition, freeWorkingDistance, -depth]} を返します。
         *
         * @return z 位置の 3 要素配列です
         */
        public double[] zvals() {
            return new double[] {stagePosition, freeWorkingDistance, imagePlaneZ};
        }
    }
}
