package io.github.yok.saf.core.linearalgebra;

import org.ejml.data.DMatrixRMaj;
import org.ejml.dense.row.factory.LinearSolverFactory_DDRM;
import org.ejml.interfaces.linsol.LinearSolverDense;

/**
 * EJML の QR 分解による最小二乗ソルバで多項式フィットを行うクラスです。
 *
 * <p>
 * Vandermonde 行列 {@code A[i][k] = x_i^(degree-k)} を組み立て、{@code A·p ≈ y} を解きます。
 * </p>
 */
public final class EjmlLeastSquaresPolynomialFitBackend implements PolynomialFitBackend {

    /**
     * 点列に degree 次多項式を最小二乗フィットし、係数を高次から順に返します。
     *
     * @param x 横軸の値です
     * @param y 縦軸の値です（x と同じ長さ）
     * @param degree 多項式の次数です（0 以上、点数未満）
     * @return 高次から順に並べた係数です（長さ degree + 1）
     * @throws IllegalArgumentException 引数が null、長さ不一致、または次数が不正な場合に発生します
     * @throws IllegalStateException 最小二乗問題が解けない場合に発生します
     */
    @Override
    public double[] fit(double[] x, double[] y, int degree) {
        if (x == null || y == null) {
            throw new IllegalArgumentException("x/y は null 不可です");
        }
        if (x.length != y.length) {
            throw new IllegalArgumentException("x と y の長さが一致しません: " + x.length + " vs " + y.length);
        }
        if (degree < 0 || degree >= x.length) {
            throw new IllegalArgumentException(
                    "次数は 0 以上かつ点数未満である必要があります: degree=" + degree + ", points=" + x.length);
        }

        int rows = x.length;
        int cols = degree + 1;

        // Vandermonde 行列（高次から順）と右辺
        DMatrixRMaj a = new DMatrixRMaj(rows, cols);
        DMatrixRMaj b = new DMatrixRMaj(rows, 1);
        for (int i = 0; i < rows; i++) {
            double power = 1.0;
            for (int k = cols - 1; k >= 0; k--) {
                a.set(i, k, power);
                power *= x[i];
            }
            b.set(i, 0, y[i]);
        }

        LinearSolverDense<DMatrixRMaj> solver = LinearSolverFactory_DDRM.leastSquares(rows, cols);
        if (!solver.setA(a)) {
            throw new IllegalStateException("最小二乗問題の分解に失敗しました（EJML）");
        }

        DMatrixRMaj p = new DMatrixRMaj(cols, 1);
        solver.solve(b, p);

        double[] coefficients = new double[cols];
        for (int k = 0; k < cols; k++) {
            coefficients[k] = p.get(k, 0);
        }
        return coefficients;
    }
}
