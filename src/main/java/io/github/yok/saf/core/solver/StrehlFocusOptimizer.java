package io.github.yok.saf.core.solver;

import com.google.common.base.Preconditions;
import io.github.yok.saf.core.field.VectorialField;
import io.github.yok.saf.core.field.VectorialFieldAssembler;
import io.github.yok.saf.core.model.OpticalParameters;
import io.github.yok.saf.core.optics.InterfaceOptics;
import io.github.yok.saf.core.optics.InterfaceOpticsModel;
import io.github.yok.saf.core.pupil.PupilGrid;
import io.github.yok.saf.core.solver.PeakRefiner.PeakEstimate;
import java.util.Locale;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Strehl 比の走査と 2 次フィットによって最適ステージ位置を求めます。
 *
 * <p>
 * 瞳格子 → 界面光学量 → ベクトル場（正規化定数） → Strehl 走査 → 頂点の精密化、の順に一度だけ実行します。 RMS 波面収差は
 * {@code Wrms = λ/(2π)·ln(1/S_max)} です。
 * </p>
 */
@Slf4j
@RequiredArgsConstructor
public final class StrehlFocusOptimizer implements FocusOptimizer {

    /**
     * 界面光学量の計算ロジックです。
     */
    private final InterfaceOpticsModel interfaceOpticsModel;

    /**
     * ベクトル場の組み立てロジックです。
     */
    private final VectorialFieldAssembler fieldAssembler;

    /**
     * Strehl 走査ロジックです。
     */
    private final StrehlScanner scanner;

    /**
     * 頂点の精密化ロジックです。
     */
    private final PeakRefiner peakRefiner;

    /**
     * 最適ステージ位置と RMS 波面収差を計算します。
     *
     * @param params 光学パラメータです
     * @return 計算結果です
     * @throws NullPointerException params が null の場合
     * @throws IllegalStateException 2 次フィットが退化している場合
     */
    @Override
    public FocusResult optimize(OpticalParameters params) {
        Preconditions.checkNotNull(params, "光学パラメータが null です。");

        log.info("焦点探索を開始します。NA={}、屈折率(med/cov/imm/immnom)={}/{}/{}/{}、λ={}、瞳={}、fwd={}、depth={}、"
                + "走査幅=[{}, {}]", params.getNumericalAperture(), params.getRefmed(),
                params.getRefcov(), params.getRefimm(), params.getRefimmnom(), params.getLambda(),
                params.getNpupil(), params.getFwd(), params.getDepth(), params.getZspreadLow(),
                params.getZspreadHigh());

        // 1) 瞳格子
        PupilGrid grid = PupilGrid.build(params.getNpupil());

        // 2) 界面光学量（cosθ と Fresnel 係数）
        InterfaceOptics optics = interfaceOpticsModel.compute(params, grid);

        // 3) ベクトル場と正規化定数
        VectorialField field = fieldAssembler.assemble(params, grid, optics);

        // 4) Strehl 走査
        StrehlScan scan = scanner.scan(params, optics, field);

        // 5) 頂点の精密化と RMS 波面収差
        PeakEstimate peak = peakRefiner.refine(scan);

        double stagePosition = scan.getBaselineStagePosition() + peak.getOffset();
        double wrms = params.getLambda() / (2.0 * Math.PI) * Math.log(1.0 / peak.getMaxStrehl());

        FocusResult result = new FocusResult(stagePosition, params.getFwd(), -params.getDepth(),
                wrms, peak.getMaxStrehl(), scan, peak);

        log.info("焦点探索が完了しました。ステージ位置={}、最大 Strehl={}、Wrms={}", fmt3(stagePosition),
                fmt5(peak.getMaxStrehl()), fmt3(wrms));

        if (params.isDebugMode()) {
            report(params, result);
        }
        return result;
    }

    /**
     * 診断用に主要な数値を人が読める形で出力します。戻り値には影響しません。
     *
     * @param params 光学パラメータです
     * @param result 計算結果です
     */
    private static void report(OpticalParameters params, FocusResult result) {
        log.info("カバーガラスからの像面深さ = {} nm",
                String.format(Locale.ROOT, "%4.0f", -result.getImagePlaneZ()));
        log.info("フリーワーキングディスタンス = {} µm",
                String.format(Locale.ROOT, "%6.3f", 1e-3 * result.getFreeWorkingDistance()));
        log.info("公称ステージ位置 = {} µm",
                String.format(Locale.ROOT, "%6.3f", 1e-3 * result.getStagePosition()));
        log.info("屈折率不整合による RMS 収差 = {} mλ",
                String.format(Locale.ROOT, "%4.1f", 1e3 * result.getWrms() / params.getLambda()));
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
     * 数値を小数点以下5桁までの文字列に整形します。
     *
     * @param v 数値です
     * @return 整形した文字列です
     */
    private static String fmt5(double v) {
        return String.format(Locale.ROOT, "%.5f", v);
    }
}
