package io.github.yok.saf.out;

import io.github.yok.saf.core.model.OpticalParameters;
import io.github.yok.saf.core.solver.FocusOptimizer;
import io.github.yok.saf.core.solver.StrehlScan;
import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Locale;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVPrinter;

/**
 * 計算結果を CSV に出力するクラスです。
 *
 * <p>
 * 出力ファイル名は、以下の命名規約に従います（depth は結像深さ）。
 * </p>
 *
 * <ul>
 * <li>{@code saf_strehl_depth=5000.0.csv}（Strehl 比とステージ位置の曲線）</li>
 * <li>{@code saf_meta_depth=5000.0.csv}（入力パラメータ、最適ステージ位置、Wrms など）</li>
 * </ul>
 */
public final class CsvResultWriter implements ResultWriter {

    /**
     * ファイル名の先頭固定文字列です。
     */
    private static final String FILE_HEAD = "saf";

    /**
     * 出力先ディレクトリです。
     */
    private final Path outputDir;

    /**
     * CSV 出力を生成します。
     *
     * @param outputDir 出力先ディレクトリです
     * @throws IllegalArgumentException 引数が不正な場合に発生します
     */
    public CsvResultWriter(String outputDir) {
        if (outputDir == null || outputDir.isEmpty()) {
            throw new IllegalArgumentException("output.dir は必須です");
        }
        this.outputDir = Paths.get(outputDir);
    }

    /**
     * 焦点探索の結果を出力します。
     *
     * @param params 計算に用いた光学パラメータです
     * @param result 焦点探索の結果です
     * @throws IllegalArgumentException 引数が不正な場合に発生します
     * @throws IllegalStateException 出力に失敗した場合に発生します
     */
    @Override
    public void write(OpticalParameters params, FocusOptimizer.FocusResult result) {
        if (params == null) {
            throw new IllegalArgumentException("params は null 不可です");
        }
        if (result == null) {
            throw new IllegalArgumentException("result は null 不可です");
        }
        if (result.getScan() == null) {
            throw new IllegalArgumentException("result.scan は null 不可です");
        }

        try {
            Files.createDirectories(outputDir);

            // 1) Strehl 曲線
            writeStrehlCsv(params, result.getScan());

            // 2) メタ（入力、ステージ位置、Wrms など）
            writeMetaCsv(params, result);

        } catch (IOException e) {
            throw new IllegalStateException("CSV 出力に失敗しました: " + outputDir, e);
        }
    }

    /**
     * Strehl 曲線を出力します。
     *
     * <p>
     * stageShift は {@code offset - 1.25·refimm/refmed·depth}（fwd からのずれ）です。
     * </p>
     *
     * @param params 光学パラメータです
     * @param scan 走査結果です
     * @throws IOException 出力に失敗した場合に発生します
     */
    private void writeStrehlCsv(OpticalParameters params, StrehlScan scan) throws IOException {
        Path file = outputDir.resolve(buildFileName("strehl", params.getDepth()));

        double focalShift = params.baselineStagePosition() - params.getFwd();
        double[] offsets = scan.getOffsets();
        double[] strehl = scan.getStrehl();

        try (Writer w = Files.newBufferedWriter(file, StandardCharsets.UTF_8);
                CSVPrinter pr = CSVFormat.Builder.create(CSVFormat.DEFAULT)
                        .setHeader("k", "offset", "stageShift", "stagePosition", "strehl").build()
                        .print(w)) {

            for (int k = 0; k < scan.size(); k++) {
                pr.printRecord(k, offsets[k], offsets[k] + focalShift, scan.stagePositionAt(k),
                        strehl[k]);
            }
        }
    }

    /**
     * メタ情報を出力します。
     *
     * @param params 光学パラメータです
     * @param result 焦点探索の結果です
     * @throws IOException 出力に失敗した場合に発生します
     */
    private void writeMetaCsv(OpticalParameters params, FocusOptimizer.FocusResult result)
            throws IOException {
        Path file = outputDir.resolve(buildFileName("meta", params.getDepth()));

        try (Writer w = Files.newBufferedWriter(file, StandardCharsets.UTF_8);
                CSVPrinter pr = CSVFormat.Builder.create(CSVFormat.DEFAULT)
                        .setHeader("key", "value").build().print(w)) {

            pr.printRecord("input.NA", params.getNumericalAperture());
            pr.printRecord("input.refmed", params.getRefmed());
            pr.printRecord("input.refcov", params.getRefcov());
            pr.printRecord("input.refimm", params.getRefimm());
            pr.printRecord("input.refimmnom", params.getRefimmnom());
            pr.printRecord("input.lambda", params.getLambda());
            pr.printRecord("input.npupil", params.getNpupil());
            pr.printRecord("input.fwd", params.getFwd());
            pr.printRecord("input.depth", params.getDepth());
            pr.printRecord("input.zspreadLow", params.getZspreadLow());
            pr.printRecord("input.zspreadHigh", params.getZspreadHigh());

            pr.printRecord("zvals.stagePosition", result.getStagePosition());
            pr.printRecord("zvals.freeWorkingDistance", result.getFreeWorkingDistance());
            pr.printRecord("zvals.imagePlaneZ", result.getImagePlaneZ());

            pr.printRecord("maxStrehl", result.getMaxStrehl());
            pr.printRecord("Wrms", result.getWrms());
            pr.printRecord("Wrms.mlambda", 1e3 * result.getWrms() / params.getLambda());
        }
    }

    /**
     * 命名規約に従ってファイル名を作成します。
     *
     * <p>
     * 例: {@code saf_strehl_depth=5000.0.csv}
     * </p>
     *
     * @param kind 量の識別子（strehl/meta）
     * @param depth 結像深さです
     * @return ファイル名です
     */
    static String buildFileName(String kind, double depth) {
        return FILE_HEAD + "_" + kind + "_depth=" + formatDepth(depth) + ".csv";
    }

    /**
     * 結像深さを小数点以下1桁に整形します（ファイル名用）。
     *
     * @param depth 結像深さです
     * @return 整形文字列（例: 5000.0）
     */
    private static String formatDepth(double depth) {
        return String.format(Locale.ROOT, "%.1f", depth);
    }
}
