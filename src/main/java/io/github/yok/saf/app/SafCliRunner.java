package io.github.yok.saf.app;

import io.github.yok.saf.core.model.OpticalParameters;
import io.github.yok.saf.core.solver.FocusOptimizer;
import io.github.yok.saf.out.ResultWriter;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.CommandLineRunner;
import org.springframework.stereotype.Component;

/**
 * CLI で saf-focus-solver を実行するクラスです。
 *
 * <p>
 * 結像深さ depth をスキャンし、各 depth について Strehl 比が最大となるステージ位置と RMS 波面収差を求めます。
 * </p>
 */
@Component
@RequiredArgsConstructor
public class SafCliRunner implements CommandLineRunner {

    /**
     * saf-focus-solver の設定値（saf.*）です。
     */
    private final SafProperties properties;

    /**
     * 焦点探索ロジックです。
     */
    private final FocusOptimizer focusOptimizer;

    /**
     * 結果出力ロジックです。
     */
    private final ResultWriter resultWriter;

    /**
     * CLI 実行を開始します。
     *
     * @param args 起動引数です
     */
    @Override
    public void run(String... args) {
        System.out.println("=== saf-focus-solver start: optimize stage position ===");
        System.out.print(properties.toMultilineString());

        // depth の一覧（結像深さ）
        List<Double> depths = properties.getDepthScan().getValues();
        if (depths == null || depths.isEmpty()) {
            throw new IllegalStateException("depthScan.values は必須です（depth の一覧を指定してください）");
        }

        for (int i = 0; i < depths.size(); i++) {
            Double depthObj = depths.get(i);
            if (depthObj == null) {
                throw new IllegalStateException("depthScan.values に null が含まれています");
            }
            double depth = depthObj.doubleValue();

            OpticalParameters params = properties.toOpticalParameters(depth);

            System.out.println("=== 結像深さごとの計算 ===");
            System.out.println("入力: depth=" + fmt5(depth) + ", fwd=" + fmt5(params.getFwd())
                    + "（step=" + (i + 1) + "/" + depths.size() + "）");

            FocusOptimizer.FocusResult result = focusOptimizer.optimize(params);

            // Strehl 曲線とメタ情報は診断モードのときだけ出力
            if (params.isDebugMode()) {
                resultWriter.write(params, result);
            }

            double[] zvals = result.zvals();
            System.out.println("結果: zvals=[" + fmt5(zvals[0]) + ", " + fmt5(zvals[1]) + ", "
                    + fmt5(zvals[2]) + "]");
            System.out.println("結果: Wrms=" + fmt5(result.getWrms()) + ", maxStrehl="
                    + fmt5(result.getMaxStrehl()));
        }
    }

    /**
     * 数値を小数点以下5桁までの文字列に整形します。
     *
     * @param v 数値です
     * @return 整形した文字列です
     */
    private static String fmt5(double v) {
        return String.format(java.util.Locale.ROOT, "%.5f", v);
    }
}
