package io.github.yok.saf.core.solver;

import com.google.common.base.Preconditions;
import io.github.yok.saf.core.linearalgebra.PolynomialFitBackend;
import java.util.Arrays;
import java.util.Locale;
import lombok.RequiredArgsConstructor;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;

/**
 * Strehl 比の走査結果から、最大点近傍の 2 次フィットでサブサンプル精度の最適オフセットを求めるクラスです。
 *
 * <p>
 * 最大インデックスを、両側に 2 点ずつ確保できる範囲（0 始まりで [2, N-4]）に丸め、 5 点窓に {@code S(z) = a·z² + b·z + c}
 * を最小二乗フィットして頂点 {@code -b/(2a)} とそこでの値を返します。フィットは窓中心からの相対座標で行い、係数はオフセット座標に戻して返します。
 * </p>
 */
@Slf4j
@RequiredArgsConstructor
public final class PeakRefiner {

    /**
     * フィット窓の片側の点数です。
     */
    public static final int HALF_WINDOW = 2;

    /**
     * 2 次係数を退化とみなす相対閾値です（|a|·半幅² と max|S| の比）。
     */
    static final double DEGENERACY_EPS = 1e-12;

    /**
     * 多項式フィットのバックエンドです。
     */
    private final PolynomialFitBackend fitBackend;

    /**
     * 走査結果の最大点を 2 次フィットで精密化します。
     *
     * @param scan 走査結果です（null 不可、5 点以上）
     * @return 精密化した頂点です
     * @throws NullPointerException scan が null の場合に発生します
     * @throws IllegalArgumentException 走査点数が 5 未満の場合に発生します
     * @throws IllegalStateException フィットが退化している、または頂点での値が正でない場合に発生します
     */
    public PeakEstimate refine(StrehlScan scan) {
        Preconditions.checkNotNull(scan, "走査結果が null です。");
        final int nz = scan.size();
        Preconditions.checkArgument(nz >= 2 * HALF_WINDOW + 1, "走査点数が不足しています。N=%s", nz);

        int peakIndex = scan.indexOfMaximum();
        int center = clampWindowCenter(peakIndex, nz);
        if (center != peakIndex) {
            log.warn("Strehl 比の最大が走査端にあるため、フィット窓を丸めました。最大インデックス={}、窓中心={}", peakIndex, center);
        }

        int from = center - HALF_WINDOW;
        int to = center + HALF_WINDOW + 1;
        double[] z = Arrays.copyOfRange(scan.getOffsets(), from, to);
        double[] s = Arrays.copyOfRange(scan.getStrehl(), from, to);

        double halfSpan = 0.5 * (z[z.length - 1] - z[0]);
        if (!(halfSpan > 0.0)) {
            throw new IllegalStateException("フィット窓の幅が 0 のため 2 次フィットが退化しています: z=" + Arrays.toString(z));
        }

        // 窓中心からの相対座標でフィットします
        double zc = z[HALF_WINDOW];
        double[] u = new double[z.length];
        for (int k = 0; k < z.length; k++) {
            u[k] = z[k] - zc;
        }

        double[] p = fitBackend.fit(u, s, 2);
        double a = p[0];
        double bu = p[1];
        double cu = p[2];

        double scale = 0.0;
        for (double v : s) {
            scale = Math.max(scale, Math.abs(v));
        }
        if (!Double.isFinite(a) || !Double.isFinite(bu) || !Double.isFinite(cu)
                || !(Math.abs(a) * halfSpan * halfSpan > DEGENERACY_EPS * scale)) {
            throw new IllegalStateException(
                    "2 次フィットの 2 次係数が 0 とみなせるため頂点を決められません: a=" + a + ", b=" + bu + ", c=" + cu);
        }

        double uOpt = -bu / (2.0 * a);
        double zOpt = zc + uOpt;
        double maxStrehl = a * uOpt * uOpt + bu * uOpt + cu;
        if (!(maxStrehl > 0.0)) {
            throw new IllegalStateException("フィットした頂点での Strehl 比が正ではありません: " + maxStrehl);
        }

        // オフセット座標での係数に戻します
        double b = bu - 2.0 * a * zc;
        double c = cu - bu * zc + a * zc * zc;

        log.debug("2 次フィット：窓=[{}, {}]、a={}、b={}、c={}、頂点オフセット={}、最大 Strehl={}", from, to - 1,
                a, b, c, fmt3(zOpt), maxStrehl);

        return new PeakEstimate(from, a, b, c, zOpt, maxStrehl);
    }

    /**
     * 5 点窓が走査範囲に収まるように窓中心を丸めます。
     *
     * <p>
     * 1 始まりで [3, N-3] に丸める規約を 0 始まりに直したもので、[2, N-4] になります（最後の点は窓に入りません）。
     * </p>
     *
     * @param peakIndex 最大インデックスです
     * @param nz 走査点数です
     * @return 窓中心です
     */
    static int clampWindowCenter(int peakIndex, int nz) {
        if (peakIndex <= HALF_WINDOW) {
            return HALF_WINDOW;
        }
        if (peakIndex > nz - 4) {
            return nz - 4;
        }
        return peakIndex;
    }

    /**
     * 数値を小数点以下3桁までの文字列に整形します。
     *
     * @param v 数値です
     * @return 整形した文字列です
     */
    private static String fmt3(double v) {
        return String.format(Locale.ROOT, "%.3f", v);
    }

    /**
     * 2 次フィットの結果を表すクラスです。
     */
    @Value
    public static class PeakEstimate {

        /**
         * フィット窓の先頭インデックスです。
         */
        int windowStart;

        /**
         * 2 次の係数 a です。
         */
        double a;

        /**
         * 1 次の係数 b です。
         */
        double b;

        /**
         * 定数項 c です。
         */
        double c;

        /**
         * 頂点のオフセット {@code -b/(2a)} です。
         */
        double offset;

        /**
         * 頂点での Strehl 比です。
         */
        double maxStrehl;
    }
}
