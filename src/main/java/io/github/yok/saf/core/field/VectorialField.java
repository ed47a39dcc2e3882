package io.github.yok.saf.core.field;

import io.github.yok.saf.core.pupil.PupilGrid;
import org.ejml.data.ZMatrixRMaj;

/**
 * 偏光・成分ごとに分解した瞳面の複素振幅と、アプラナティック振幅因子を保持するクラスです。
 *
 * <p>
 * 偏光ベクトルは出力偏光 {@code itel ∈ {0,1}} と電場成分 {@code jtel ∈ {0,1,2}} の 6 チャネルです。 焦点中心の強度は
 * 6 チャネルそれぞれについて瞳全体で積分した値の絶対値 2 乗の和です。
 * </p>
 */
public final class VectorialField {

    /**
     * 出力偏光の数です。
     */
    public static final int POLARIZATIONS = 2;

    /**
     * 電場成分の数です。
     */
    public static final int COMPONENTS = 3;

    private final PupilGrid grid;

    /**
     * 偏光ベクトル [itel][jtel] です。
     */
    private final ZMatrixRMaj[][] polarization;

    /**
     * 開口マスク込みのアプラナティック振幅因子です。
     */
    private final ZMatrixRMaj amplitude;

    /**
     * 位相差 0 のときの焦点中心強度（Strehl 比の正規化定数）です。
     */
    private final double strehlNormalization;

    /**
     * 開口内サンプルの行インデックスです。
     */
    private final int[] rows;

    /**
     * 開口内サンプルの列インデックスです。
     */
    private final int[] cols;

    /**
     * 開口内サンプルごとの {@code amplitude * polarization} です。[channel][2*sample + (0: 実部, 1: 虚部)]
     */
    private final double[][] weights;

    /**
     * ベクトル場を生成します。
     *
     * @param grid 瞳格子です
     * @param polarization 偏光ベクトル [2][3] です
     * @param amplitude 振幅因子です
     */
    VectorialField(PupilGrid grid, ZMatrixRMaj[][] polarization, ZMatrixRMaj amplitude) {
        this.grid = grid;
        this.polarization = polarization;
        this.amplitude = amplitude;

        int count = grid.apertureCount();
        this.rows = new int[count];
        this.cols = new int[count];
        this.weights = new double[POLARIZATIONS * COMPONENTS][2 * count];

        int s = 0;
        for (int i = 0; i < grid.size(); i++) {
            for (int j = 0; j < grid.size(); j++) {
                if (!grid.insideAperture(i, j)) {
                    continue;
                }
                rows[s] = i;
                cols[s] = j;
                double ar = amplitude.getReal(i, j);
                double ai = amplitude.getImag(i, j);
                for (int itel = 0; itel < POLARIZATIONS; itel++) {
                    for (int jtel = 0; jtel < COMPONENTS; jtel++) {
                        double pr = polarization[itel][jtel].getReal(i, j);
                        double pi = polarization[itel][jtel].getImag(i, j);
                        double[] w = weights[itel * COMPONENTS + jtel];
                        w[2 * s] = ar * pr - ai * pi;
                        w[2 * s + 1] = ar * pi + ai * pr;
                    }
                }
                s++;
            }
        }

        this.strehlNormalization = peakIntensity(null);
    }

    /**
     * 瞳面の位相因子を掛けたときの焦点中心強度を計算します。
     *
     * <p>
     * {@code Σ_{itel,jtel} |Σ_pupil amplitude · phasor · P[itel][jtel]|²}
     * </p>
     *
     * @param phasor 開口内サンプルごとの複素位相因子 [2*sample + (0: 実部, 1: 虚部)] です。null の場合は 1 とみなします
     * @return 焦点中心強度です
     * @throws IllegalArgumentException phasor の長さが開口内サンプル数と一致しない場合に発生します
     */
    public double peakIntensity(double[] phasor) {
        int count = rows.length;
        if (phasor != null && phasor.length != 2 * count) {
            throw new IllegalArgumentException(
                    "位相因子の長さが開口内サンプル数と一致しません: " + phasor.length + " vs " + (2 * count));
        }

        double intensity = 0.0;
        for (double[] w : weights) {
            double sumRe = 0.0;
            double sumIm = 0.0;
            for (int s = 0; s < count; s++) {
                double wr = w[2 * s];
                double wi = w[2 * s + 1];
                if (phasor == null) {
                    sumRe += wr;
                    sumIm += wi;
                } else {
                    double er = phasor[2 * s];
                    double ei = phasor[2 * s + 1];
                    sumRe += wr * er - wi * ei;
                    sumIm += wr * ei + wi * er;
                }
            }
            intensity += sumRe * sumRe + sumIm * sumIm;
        }
        return intensity;
    }

    /**
     * 瞳格子を返します。
     *
     * @return 瞳格子です
     */
    public PupilGrid grid() {
        return grid;
    }

    /**
     * 偏光ベクトルの 1 チャネルを返します。
     *
     * @param itel 出力偏光です（0 または 1）
     * @param jtel 電場成分です（0, 1, 2）
     * @return 複素行列です
     */
    public ZMatrixRMaj polarization(int itel, int jtel) {
        return polarization[itel][jtel];
    }

    /**
     * アプラナティック振幅因子を返します。
     *
     * @return 複素行列です
     */
    public ZMatrixRMaj amplitude() {
        return amplitude;
    }

    /**
     * Strehl 比の正規化定数を返します。
     *
     * @return 正規化定数です
     */
    public double strehlNormalization() {
        return strehlNormalization;
    }

    /**
     * 開口内サンプル数を返します。
     *
     * @return サンプル数です
     */
    public int sampleCount() {
        return rows.length;
    }

    /**
     * 開口内の s 番目のサンプルの行を返します。
     *
     * @param s サンプル番号です
     * @return 行インデックスです
     */
    public int rowOf(int s) {
        return rows[s];
    }

    /**
     * 開口内の s 番目のサンプルの列を返します。
     *
     * @param s サンプル番号です
     * @return 列インデックスです
     */
    public int colOf(int s) {
        return cols[s];
    }
}
