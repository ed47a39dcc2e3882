package io.github.yok.saf.core.solver;

import lombok.Value;

/**
 * ステージ位置の候補オフセットと、それぞれの Strehl 比を順に保持するクラスです。
 *
 * <p>
 * 候補ステージ位置は {@code baselineStagePosition + offsets[k]} です。
 * </p>
 */
@Value
public class StrehlScan {

    /**
     * 基準ステージ位置 {@code fwd - 1.25·refimm/refmed·depth} です。
     */
    double baselineStagePosition;

    /**
     * 基準からのオフセット（昇順）です。
     */
    double[] offsets;

    /**
     * 各オフセットでの Strehl 比です。
     */
    double[] strehl;

    /**
     * 走査点数を返します。
     *
     * @return 走査点数です
     */
    public int size() {
        return offsets.length;
    }

    /**
     * k 番目の候補ステージ位置を返します。
     *
     * @param k 走査インデックスです
     * @return ステージ位置です
     */
    public double stagePositionAt(int k) {
        return baselineStagePosition + offsets[k];
    }

    /**
     * Strehl 比が最大となる最初のインデックスを返します。
     *
     * @return インデックスです
     */
    public int indexOfMaximum() {
        int best = 0;
        for (int k = 1; k < strehl.length; k++) {
            if (strehl[k] > strehl[best]) {
                best = k;
            }
        }
        return best;
    }
}
