package io.github.yok.saf.app;

import io.github.yok.saf.core.field.VectorialFieldAssembler;
import io.github.yok.saf.core.linearalgebra.EjmlLeastSquaresPolynomialFitBackend;
import io.github.yok.saf.core.linearalgebra.PolynomialFitBackend;
import io.github.yok.saf.core.optics.InterfaceOpticsModel;
import io.github.yok.saf.core.solver.FocusOptimizer;
import io.github.yok.saf.core.solver.PeakRefiner;
import io.github.yok.saf.core.solver.StrehlFocusOptimizer;
import io.github.yok.saf.core.solver.StrehlScanner;
import io.github.yok.saf.out.CsvResultWriter;
import io.github.yok.saf.out.ResultWriter;
import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * 屈折率不整合下の焦点探索（Strehl 走査 + 2 次フィット）の Bean 定義を行う設定クラスです。
 */
@Configuration
@RequiredArgsConstructor
public class SafFocusConfiguration {

    /**
     * saf-focus-solver の設定値（saf.*）です。
     */
    private final SafProperties p;

    /**
     * 界面光学量（cosθ と Fresnel 係数）の計算ロジックを生成します。
     *
     * @return 界面光学量の計算ロジックです
     */
    @Bean
    public InterfaceOpticsModel interfaceOpticsModel() {
        return new InterfaceOpticsModel();
    }

    /**
     * ベクトル場の組み立てロジックを生成します。
     *
     * @return ベクトル場の組み立てロジックです
     */
    @Bean
    public VectorialFieldAssembler vectorialFieldAssembler() {
        return new VectorialFieldAssembler();
    }

    /**
     * Strehl 走査ロジックを生成します。
     *
     * @return Strehl 走査ロジックです
     */
    @Bean
    public StrehlScanner strehlScanner() {
        return new StrehlScanner(Math.max(1, p.getScan().getThreads()));
    }

    /**
     * 多項式フィットのバックエンドを生成します。
     *
     * @return 多項式フィットのバックエンドです
     */
    @Bean
    public PolynomialFitBackend polynomialFitBackend() {
        return new EjmlLeastSquaresPolynomialFitBackend();
    }

    /**
     * 頂点の精密化ロジックを生成します。
     *
     * @param fitBackend 多項式フィットのバックエンドです
     * @return 頂点の精密化ロジックです
     */
    @Bean
    public PeakRefiner peakRefiner(PolynomialFitBackend fitBackend) {
        return new PeakRefiner(fitBackend);
    }

    /**
     * 焦点探索ロジックを生成します。
     *
     * @param opticsModel 界面光学量の計算ロジックです
     * @param assembler ベクトル場の組み立てロジックです
     * @param scanner Strehl 走査ロジックです
     * @param refiner 頂点の精密化ロジックです
     * @return 焦点探索ロジックです
     */
    @Bean
    public FocusOptimizer focusOptimizer(InterfaceOpticsModel opticsModel,
            VectorialFieldAssembler assembler, StrehlScanner scanner, PeakRefiner refiner) {
        return new StrehlFocusOptimizer(opticsModel, assembler, scanner, refiner);
    }

    /**
     * 結果出力ロジックを生成します。
     *
     * @return 結果出力ロジックです
     */
    @Bean
    public ResultWriter resultWriter() {
        return new CsvResultWriter(p.getOutput().getDir());
    }
}
