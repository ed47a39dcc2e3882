package io.github.yok.saf.core.solver;

import com.google.common.base.Preconditions;
import io.github.yok.saf.core.field.VectorialField;
import io.github.yok.saf.core.model.OpticalParameters;
import io.github.yok.saf.core.optics.InterfaceOptics;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

/**
 * 候補ステージ位置を走査して、各位置の Strehl 比（焦点中心強度の比）を計算するクラスです。
 *
 * <p>
 * 各オフセットで光路差 {@code W = zStage·refimm·cosImm - fwd·refimmnom·cosImmNom + depth·refmed·cosMed} を求め、
 * {@code exp(i·2π·W/λ)} を掛けた瞳積分の強度を正規化定数で割ります。 cosMed が純虚数となるサンプルでは W も複素数になります。
 * </p>
 *
 * <p>
 * 各オフセットの計算は独立しているため、threads &gt; 1 の場合は固定サイズのスレッドプールで並列に評価し、 結果はオフセット順に格納します。
 * </p>
 */
@Getter
@Slf4j
public final class StrehlScanner {

    /**
     * 走査点数です。
     */
    public static final int SCAN_POINTS = 101;

    /**
     * 走査幅（zspread）に掛ける倍率です。
     */
    public static final double SPREAD_FACTOR = 1.5;

    /**
     * 走査に用いるスレッド数です（1 以下なら逐次実行）。
     */
    private final int threads;

    /**
     * 逐次実行の走査器を生成します。
     */
    public StrehlScanner() {
        this(1);
    }

    /**
     * 走査器を生成します。
     *
     * @param threads スレッド数です（1 以上）
     * @throws IllegalArgumentException threads が 1 未満の場合に発生します
     */
    public StrehlScanner(int threads) {
        if (threads <= 0) {
            throw new IllegalArgumentException("threads は 1 以上が必要です: " + threads);
        }
        this.threads = threads;
    }

    /**
     * 走査オフセット {@code linspace(1.5·zspreadLow, 1.5·zspreadHigh, 101)} を返します。
     *
     * @param params 光学パラメータです（null 不可）
     * @return オフセット列です（最後の値は上限に一致します）
     */
    public static double[] offsets(OpticalParameters params) {
        Preconditions.checkNotNull(params, "光学パラメータが null です。");
        double lo = SPREAD_FACTOR * params.getZspreadLow();
        double hi = SPREAD_FACTOR * params.getZspreadHigh();
        double[] z = new double[SCAN_POINTS];
        for (int k = 0; k < SCAN_POINTS - 1; k++) {
            z[k] = lo + k * (hi - lo) / (SCAN_POINTS - 1);
        }
        z[SCAN_POINTS - 1] = hi;
        return z;
    }

    /**
     * 候補ステージ位置を走査して Strehl 比の列を返します。
     *
     * @param params 光学パラメータです（null 不可）
     * @param optics 界面光学量です（null 不可）
     * @param field ベクトル場です（null 不可）
     * @return 走査結果です
     * @throws NullPointerException 引数が null の場合に発生します
     * @throws IllegalStateException 並列実行が中断または失敗した場合に発生します
     */
    public StrehlScan scan(OpticalParameters params, InterfaceOptics optics,
            VectorialField field) {
        Preconditions.checkNotNull(params, "光学パラメータが null です。");
        Preconditions.checkNotNull(optics, "界面光学量が null です。");
        Preconditions.checkNotNull(field, "ベクトル場が null です。");

        final double baseline = params.baselineStagePosition();
        final double[] offsets = offsets(params);
        final double[] strehl = new double[offsets.length];
        final PhaseModel phaseModel = new PhaseModel(params, optics, field);

        long t0 = System.nanoTime();

        if (threads <= 1) {
            for (int k = 0; k < offsets.length; k++) {
                strehl[k] = strehlAt(baseline + offsets[k], phaseModel, field);
            }
        } else {
            scanInParallel(baseline, offsets, strehl, phaseModel, field);
        }

        long elapsedMs = (System.nanoTime() - t0) / 1_000_000L;
        log.debug("Strehl 走査が完了しました。点数={}、範囲=[{}, {}]、基準位置={}、スレッド数={}、所要時間={}ms",
                offsets.length, fmt3(offsets[0]), fmt3(offsets[offsets.length - 1]),
                fmt3(baseline), threads, elapsedMs);

        return new StrehlScan(baseline, offsets, strehl);
    }

    /**
     * 固定サイズのスレッドプールで走査します。各タスクは自分のインデックスにのみ書き込みます。
     *
     * @param baseline 基準ステージ位置です
     * @param offsets オフセット列です
     * @param strehl 結果の格納先です
     * @param phaseModel 光路差モデルです
     * @param field ベクトル場です
     * @throws IllegalStateException 中断または失敗した場合に発生します
     */
    private void scanInParallel(double baseline, double[] offsets, double[] strehl,
            PhaseModel phaseModel, VectorialField field) {
        ExecutorService service = Executors.newFixedThreadPool(threads);
        try {
            List<Future<Double>> futures = new ArrayList<>(offsets.length);
            for (int k = 0; k < offsets.length; k++) {
                final double zStage = baseline + offsets[k];
                futures.add(service.submit(() -> strehlAt(zStage, phaseModel, field)));
            }
            for (int k = 0; k < futures.size(); k++) {
                strehl[k] = futures.get(k).get();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Strehl 走査が中断されました", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            }
            throw new IllegalStateException("Strehl 走査に失敗しました", cause);
        } finally {
            service.shutdownNow();
        }
    }

    /**
     * 1 つの候補ステージ位置での Strehl 比を計算します。
     *
     * @param zStage 候補ステージ位置です
     * @param phaseModel 光路差モデルです
     * @param field ベクトル場です
     * @return Strehl 比です
     */
    private static double strehlAt(double zStage, PhaseModel phaseModel, VectorialField field) {
        double[] phasor = phaseModel.phasor(zStage);
        return field.peakIntensity(phasor) / field.strehlNormalization();
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
     * 開口内サンプルごとの光路差の係数を保持し、ステージ位置から位相因子を計算するクラスです。
     *
     * <p>
     * {@code W(zStage) = zStage·A + C}、A = refimm·cosImm、C = -fwd·refimmnom·cosImmNom + depth·refmed·cosMed です。
     * </p>
     */
    private static final class PhaseModel {

        /**
         * 波数 2π/λ です。
         */
        private final double waveNumber;

        /**
         * zStage に掛かる係数（実数）です。
         */
        private final double[] stageCoefficient;

        /**
         * 定数項の実部です。
         */
        private final double[] constantRe;

        /**
         * 定数項の虚部です。
         */
        private final double[] constantIm;

        PhaseModel(OpticalParameters params, InterfaceOptics optics, VectorialField field) {
            int count = field.sampleCount();
            this.waveNumber = 2.0 * Math.PI / params.getLambda();
            this.stageCoefficient = new double[count];
            this.constantRe = new double[count];
            this.constantIm = new double[count];

            double refimm = params.getRefimm();
            double refimmnom = params.getRefimmnom();
            double refmed = params.getRefmed();
            double fwd = params.getFwd();
            double depth = params.getDepth();

            for (int s = 0; s < count; s++) {
                int i = field.rowOf(s);
                int j = field.colOf(s);
                stageCoefficient[s] = refimm * optics.getCosImm().getReal(i, j);
                // -fwd·refimmnom·cosImmNom - (-depth)·refmed·cosMed
                constantRe[s] = -fwd * refimmnom * optics.getCosImmNom().getReal(i, j)
                        + depth * refmed * optics.getCosMed().getReal(i, j);
                constantIm[s] = depth * refmed * optics.getCosMed().getImag(i, j);
            }
        }

        /**
         * {@code exp(i·2π·W/λ)} をサンプルごとに計算します。
         *
         * @param zStage 候補ステージ位置です
         * @return 位相因子 [2*sample + (0: 実部, 1: 虚部)] です
         */
        double[] phasor(double zStage) {
            int count = stageCoefficient.length;
            double[] out = new double[2 * count];
            for (int s = 0; s < count; s++) {
                double wRe = zStage * stageCoefficient[s] + constantRe[s];
                double wIm = constantIm[s];
                // exp(i·k·(wRe + i·wIm)) = exp(-k·wIm)·(cos(k·wRe) + i·sin(k·wRe))
                double magnitude = Math.exp(-waveNumber * wIm);
                double angle = waveNumber * wRe;
                out[2 * s] = magnitude * Math.cos(angle);
                out[2 * s + 1] = magnitude * Math.sin(angle);
            }
            return out;
        }
    }
}
