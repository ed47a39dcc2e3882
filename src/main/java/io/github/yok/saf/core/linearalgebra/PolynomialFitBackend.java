package io.github.yok.saf.core.linearalgebra;

/**
 * 多項式の最小二乗フィットを提供するバックエンドを表すインタフェースです。
 *
 * <p>
 * 使用する線形代数ライブラリを差し替えやすくするためのインタフェースです。
 * </p>
 */
public interface PolynomialFitBackend {

    /**
     * 点列に degree 次多項式を最小二乗フィットし、係数を高次から順に返します。
     *
     * <p>
     * 戻り値 {@code p} は {@code y ≈ p[0]·x^degree + ... + p[degree]} を満たします。
     * </p>
     *
     * @param x 横軸の値です
     * @param y 縦軸の値です（x と同じ長さ）
     * @param degree 多項式の次数です（0 以上、点数未満）
     * @return 高次から順に並べた係数です（長さ degree + 1）
     * @throws IllegalArgumentException 引数が不正な場合に発生します
     * @throws IllegalStateException 最小二乗問題が解けない場合に発生します
     */
    double[] fit(double[] x, double[] y, int degree);
}
