package io.github.yok.saf.core.pupil;

import org.ejml.data.DMatrixRMaj;

/**
 * 単位円の瞳を含む [-1,1]×[-1,1] 上の 2 次元サンプリング格子を表すクラスです。
 *
 * <p>
 * 刻みは {@code step = 2 / size} で、各軸のサンプルは画素中心 {@code -1 + step/2 + k*step} に置きます。 行方向（第 1
 * 添字）が X、列方向（第 2 添字）が Y です。
 * </p>
 */
public final class PupilGrid {

    /**
     * 1 軸あたりのサンプル数です。
     */
    private final int size;

    /**
     * サンプル間隔です。
     */
    private final double step;

    /**
     * 1 軸分の座標値です。
     */
    private final double[] axis;

    /**
     * X 座標です。
     */
    private final DMatrixRMaj x;

    /**
     * Y 座標です。
     */
    private final DMatrixRMaj y;

    /**
     * 開口マスク（X²+Y² &lt; 1 で 1、それ以外で 0）です。
     */
    private final DMatrixRMaj apertureMask;

    /**
     * 開口内のサンプル数です。
     */
    private final int apertureCount;

    private PupilGrid(int size) {
        this.size = size;
        this.step = 2.0 / size;
        this.axis = new double[size];
        for (int k = 0; k < size; k++) {
            axis[k] = -1.0 + step / 2.0 + k * step;
        }

        this.x = new DMatrixRMaj(size, size);
        this.y = new DMatrixRMaj(size, size);
        this.apertureMask = new DMatrixRMaj(size, size);

        int count = 0;
        for (int i = 0; i < size; i++) {
            for (int j = 0; j < size; j++) {
                x.set(i, j, axis[i]);
                y.set(i, j, axis[j]);
                if (axis[i] * axis[i] + axis[j] * axis[j] < 1.0) {
                    apertureMask.set(i, j, 1.0);
                    count++;
                }
            }
        }
        this.apertureCount = count;
    }

    /**
     * 瞳格子を生成します。
     *
     * @param size 1 軸あたりのサンプル数です（1 以上）
     * @return 瞳格子です
     * @throws IllegalArgumentException size が 1 未満の場合に発生します
     */
    public static PupilGrid build(int size) {
        if (size <= 0) {
            throw new IllegalArgumentException("瞳サンプリング数は 1 以上が必要です: " + size);
        }
        return new PupilGrid(size);
    }

    /**
     * 1 軸あたりのサンプル数を返します。
     *
     * @return サンプル数です
     */
    public int size() {
        return size;
    }

    /**
     * サンプル間隔を返します。
     *
     * @return サンプル間隔です
     */
    public double step() {
        return step;
    }

    /**
     * k 番目の軸座標を返します。
     *
     * @param k 軸インデックスです（0 以上 size 未満）
     * @return 座標です
     */
    public double axisAt(int k) {
        return axis[k];
    }

    /**
     * (i, j) の X 座標を返します。
     *
     * @param i 行です
     * @param j 列です
     * @return X 座標です
     */
    public double xAt(int i, int j) {
        return x.get(i, j);
    }

    /**
     * (i, j) の Y 座標を返します。
     *
     * @param i 行です
     * @param j 列です
     * @return Y 座標です
     */
    public double yAt(int i, int j) {
        return y.get(i, j);
    }

    /**
     * (i, j) の動径の 2 乗 X²+Y² を返します。
     *
     * @param i 行です
     * @param j 列です
     * @return 動径の 2 乗です
     */
    public double radiusSquaredAt(int i, int j) {
        double xv = x.get(i, j);
        double yv = y.get(i, j);
        return xv * xv + yv * yv;
    }

    /**
     * (i, j) が開口内かどうかを返します。
     *
     * @param i 行です
     * @param j 列です
     * @return 開口内なら true です
     */
    public boolean insideAperture(int i, int j) {
        return apertureMask.get(i, j) != 0.0;
    }

    /**
     * 開口内のサンプル数を返します。
     *
     * @return 開口内のサンプル数です
     */
    public int apertureCount() {
        return apertureCount;
    }

    /**
     * 開口マスクの複製を返します。
     *
     * @return 開口マスクです
     */
    public DMatrixRMaj apertureMask() {
        return apertureMask.copy();
    }
}
