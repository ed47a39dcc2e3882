package io.github.yok.saf.core.model;

import static com.google.common.base.Preconditions.*;

import lombok.Builder;
import lombok.Value;

/**
 * 焦点探索に用いる光学パラメータ一式を保持する不変クラスです。
 *
 * <p>
 * 屈折率は試料媒質（refmed）、カバーガラス（refcov）、実際の液浸媒質（refimm）、設計上の液浸媒質（refimmnom）の 4 種です。
 * 長さ（波長、作動距離、深さ、走査幅）はすべて同じ単位（通常は nm）で与えます。
 * </p>
 *
 * <p>
 * 試料媒質については NA が屈折率を超えてもかまいません（エバネッセント領域として扱います）。 それ以外の 3 媒質は NA 以下である必要があります。
 * </p>
 */
@Value
public class OpticalParameters {

    /**
     * 開口数 NA です。
     */
    double numericalAperture;

    /**
     * 試料媒質の屈折率です。
     */
    double refmed;

    /**
     * カバーガラスの屈折率です。
     */
    double refcov;

    /**
     * 実際の液浸媒質の屈折率です。
     */
    double refimm;

    /**
     * 設計上（公称）の液浸媒質の屈折率です。
     */
    double refimmnom;

    /**
     * 真空中の波長です。
     */
    double lambda;

    /**
     * 瞳の 1 軸あたりのサンプリング数です。
     */
    int npupil;

    /**
     * 公称のフリーワーキングディスタンスです。
     */
    double fwd;

    /**
     * カバーガラスからの結像深さです（0 以上）。
     */
    double depth;

    /**
     * z 走査幅の下限です。
     */
    double zspreadLow;

    /**
     * z 走査幅の上限です。
     */
    double zspreadHigh;

    /**
     * 診断出力（レポートと Strehl 曲線）を行うかどうかです。
     */
    boolean debugMode;

    /**
     * 光学パラメータを生成します。
     *
     * @param numericalAperture 開口数です（正）
     * @param refmed 試料媒質の屈折率です（正）
     * @param refcov カバーガラスの屈折率です（NA 以上）
     * @param refimm 液浸媒質の屈折率です（NA 以上）
     * @param refimmnom 公称の液浸媒質の屈折率です（NA 以上）
     * @param lambda 波長です（正）
     * @param npupil 瞳サンプリング数です（1 以上）
     * @param fwd フリーワーキングディスタンスです（有限値）
     * @param depth 結像深さです（0 以上）
     * @param zspreadLow 走査幅の下限です
     * @param zspreadHigh 走査幅の上限です（下限以上）
     * @param debugMode 診断出力を行う場合は true です
     * @throws IllegalArgumentException 値が不正な場合に発生します
     */
    @Builder(toBuilder = true)
    public OpticalParameters(double numericalAperture, double refmed, double refcov,
            double refimm, double refimmnom, double lambda, int npupil, double fwd, double depth,
            double zspreadLow, double zspreadHigh, boolean debugMode) {

        checkArgument(numericalAperture > 0.0 && Double.isFinite(numericalAperture),
                "NA は正の有限値である必要があります: %s", numericalAperture);
        checkPositive("refmed", refmed);
        checkPositive("refcov", refcov);
        checkPositive("refimm", refimm);
        checkPositive("refimmnom", refimmnom);
        checkPositive("lambda", lambda);
        checkArgument(npupil >= 1, "npupil は 1 以上である必要があります: %s", npupil);
        checkArgument(Double.isFinite(fwd), "fwd は有限値である必要があります: %s", fwd);
        checkArgument(Double.isFinite(depth) && depth >= 0.0, "depth は 0 以上の有限値である必要があります: %s",
                depth);
        checkArgument(Double.isFinite(zspreadLow) && Double.isFinite(zspreadHigh),
                "zspread は有限値である必要があります: [%s, %s]", zspreadLow, zspreadHigh);
        checkArgument(zspreadLow <= zspreadHigh, "zspread の下限が上限を超えています: [%s, %s]", zspreadLow,
                zspreadHigh);

        // 試料媒質以外は伝搬光のみを扱うため、NA がそれぞれの屈折率を超えてはいけません
        checkArgument(numericalAperture <= refcov, "NA が refcov を超えています: NA=%s, refcov=%s",
                numericalAperture, refcov);
        checkArgument(numericalAperture <= refimm, "NA が refimm を超えています: NA=%s, refimm=%s",
                numericalAperture, refimm);
        checkArgument(numericalAperture <= refimmnom,
                "NA が refimmnom を超えています: NA=%s, refimmnom=%s", numericalAperture, refimmnom);

        this.numericalAperture = numericalAperture;
        this.refmed = refmed;
        this.refcov = refcov;
        this.refimm = refimm;
        this.refimmnom = refimmnom;
        this.lambda = lambda;
        this.npupil = npupil;
        this.fwd = fwd;
        this.depth = depth;
        this.zspreadLow = zspreadLow;
        this.zspreadHigh = zspreadHigh;
        this.debugMode = debugMode;
    }

    /**
     * 屈折率の不整合に対する焦点移動の一次近似を含めた、走査の基準ステージ位置を返します。
     *
     * <p>
     * {@code fwd - 1.25 * refimm / refmed * depth}
     * </p>
     *
     * @return 基準ステージ位置です
     */
    public double baselineStagePosition() {
        return fwd - 1.25 * refimm / refmed * depth;
    }

    /**
     * 正の有限値であることを検証します。
     *
     * @param name パラメータ名です
     * @param value 値です
     * @throws IllegalArgumentException 正の有限値でない場合に発生します
     */
    private static void checkPositive(String name, double value) {
        checkArgument(value > 0.0 && Double.isFinite(value), "%s は正の有限値である必要があります: %s", name,
                value);
    }
}
