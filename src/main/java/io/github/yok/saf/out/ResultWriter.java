package io.github.yok.saf.out;

import io.github.yok.saf.core.model.OpticalParameters;
import io.github.yok.saf.core.solver.FocusOptimizer;

/**
 * 計算結果を出力する処理のインタフェースです。
 *
 * <p>
 * 結像深さをスキャンして計算することを前提とし、出力の命名規約には {@code depth} を用います。
 * </p>
 */
public interface ResultWriter {

    /**
     * 焦点探索の結果（Strehl 曲線とメタ情報）を出力します。
     *
     * @param params 計算に用いた光学パラメータです
     * @param result 焦点探索の結果です
     */
    void write(OpticalParameters params, FocusOptimizer.FocusResult result);
}
