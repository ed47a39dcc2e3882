package io.github.yok.saf.app;

import io.github.yok.saf.core.model.OpticalParameters;
import java.util.List;
import javax.validation.Valid;
import javax.validation.constraints.NotEmpty;
import lombok.Data;
import lombok.ToString;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * saf-focus-solver の設定値（saf.*）を保持するクラスです。
 *
 * <p>
 * application.yml などから読み込まれ、CLI 実行時の初期化に使用します。
 * </p>
 */
@Data
@ToString(onlyExplicitlyIncluded = true)
@Validated
@ConfigurationProperties(prefix = "saf")
public class SafProperties {

    /**
     * 光学系（NA、屈折率、波長）の設定です。
     */
    private Optics optics = new Optics();

    /**
     * 瞳サンプリングの設定です。
     */
    private Pupil pupil = new Pupil();

    /**
     * ステージ（作動距離、走査幅）の設定です。
     */
    private Stage stage = new Stage();

    /**
     * 結像深さのスキャン設定です。
     */
    @Valid
    private DepthScan depthScan = new DepthScan();

    /**
     * Strehl 走査の実行設定です。
     */
    private Scan scan = new Scan();

    /**
     * 診断出力（レポートと Strehl 曲線 CSV）を行うかどうかです。
     */
    private boolean debug = false;

    /**
     * 出力設定です。
     */
    private Output output = new Output();

    /**
     * 指定した結像深さでの光学パラメータを生成します。
     *
     * @param depth 結像深さです
     * @return 光学パラメータです
     * @throws IllegalArgumentException 設定値が不正な場合に発生します
     */
    public OpticalParameters toOpticalParameters(double depth) {
        Optics o = getOptics();
        Stage s = getStage();
        return OpticalParameters.builder()
                .numericalAperture(o.getNumericalAperture())
                .refmed(o.getRefmed())
                .refcov(o.getRefcov())
                .refimm(o.getRefimm())
                .refimmnom(o.getRefimmnom())
                .lambda(o.getLambda())
                .npupil(getPupil().getSize())
                .fwd(s.getFreeWorkingDistance())
                .depth(depth)
                .zspreadLow(s.getZspreadLow())
                .zspreadHigh(s.getZspreadHigh())
                .debugMode(isDebug())
                .build();
    }

    /**
     * 設定値を YAML 風の複数行文字列に整形して返します。
     *
     * @return 設定値の整形文字列です
     */
    @ToString.Include(name = "saf")
    public String toMultilineString() {
        String nl = System.lineSeparator();

        Optics o = getOptics();
        Stage s = getStage();

        // 先頭改行を入れて、ログの可読性を上げます。
        StringBuilder sb = new StringBuilder(256).append(nl);

        appendSection(sb, nl, "optics",
                // numericalAperture: 開口数
                "numericalAperture", o.getNumericalAperture(),
                // refmed: 試料媒質の屈折率
                "refmed", o.getRefmed(),
                // refcov: カバーガラスの屈折率
                "refcov", o.getRefcov(),
                // refimm: 液浸媒質の屈折率
                "refimm", o.getRefimm(),
                // refimmnom: 公称の液浸媒質の屈折率
                "refimmnom", o.getRefimmnom(),
                // lambda: 波長
                "lambda", o.getLambda());

        appendSection(sb, nl, "pupil",
                // size: 瞳の 1 軸あたりのサンプル数
                "size", getPupil().getSize());

        appendSection(sb, nl, "stage",
                // freeWorkingDistance: フリーワーキングディスタンス
                "freeWorkingDistance", s.getFreeWorkingDistance(),
                // zspreadLow / zspreadHigh: 走査幅（実際の走査は 1.5 倍）
                "zspreadLow", s.getZspreadLow(), "zspreadHigh", s.getZspreadHigh());

        appendSection(sb, nl, "depthScan",
                // values: 計算する結像深さの一覧
                "values", getDepthScan().getValues());

        appendSection(sb, nl, "scan",
                // threads: Strehl 走査のスレッド数
                "threads", getScan().getThreads());

        appendSection(sb, nl, "debug", "enabled", isDebug());

        appendSection(sb, nl, "output",
                // dir: 出力先ディレクトリ
                "dir", getOutput().getDir());

        return sb.toString();
    }

    /**
     * セクション名と (key, value) ペア列を、YAML 風の複数行テキストとして追記します。
     *
     * @param sb 追記先バッファです
     * @param nl 改行文字列です
     * @param section セクション名です
     * @param kvPairs key1, value1, key2, value2, ... の順で渡すペア列です
     */
    private static void appendSection(StringBuilder sb, String nl, String section,
            Object... kvPairs) {
        sb.append("  ").append(section).append(":").append(nl);
        for (int i = 0; i < kvPairs.length; i += 2) {
            String key = String.valueOf(kvPairs[i]);
            Object val = (i + 1 < kvPairs.length) ? kvPairs[i + 1] : null;
            sb.append("    ").append(key).append(": ").append(val).append(nl);
        }
    }

    @Data
    public static class Optics {

        /**
         * 開口数 NA です。
         */
        private double numericalAperture = 1.2;

        /**
         * 試料媒質の屈折率です。
         */
        private double refmed = 1.33;

        /**
         * カバーガラスの屈折率です。
         */
        private double refcov = 1.52;

        /**
         * 液浸媒質の屈折率です。
         */
        private double refimm = 1.51;

        /**
         * 公称（設計）の液浸媒質の屈折率です。
         */
        private double refimmnom = 1.51;

        /**
         * 真空中の波長（nm）です。
         */
        private double lambda = 680.0;
    }

    @Data
    public static class Pupil {

        /**
         * 瞳の 1 軸あたりのサンプル数です。
         */
        private int size = 64;
    }

    @Data
    public static class Stage {

        /**
         * 公称のフリーワーキングディスタンス（nm）です。
         */
        private double freeWorkingDistance = 150000.0;

        /**
         * 走査幅の下限（nm）です。
         */
        private double zspreadLow = -1000.0;

        /**
         * 走査幅の上限（nm）です。
         */
        private double zspreadHigh = 1000.0;
    }

    @Data
    public static class DepthScan {

        /**
         * 計算する結像深さ（nm）の一覧です。
         */
        @NotEmpty
        private List<Double> values = List.of();
    }

    @Data
    public static class Scan {

        /**
         * Strehl 走査に用いるスレッド数です（1 なら逐次）。
         */
        private int threads = 1;
    }

    @Data
    public static class Output {

        /**
         * 出力先ディレクトリです。
         */
        private String dir = "./out";
    }
}
