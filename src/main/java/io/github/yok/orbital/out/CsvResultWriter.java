package io.github.yok.orbital.out;

import io.github.yok.orbital.core.density.DensityField;
import io.github.yok.orbital.core.density.DensityResult;
import io.github.yok.orbital.core.density.VisibilityMask;
import io.github.yok.orbital.core.grid.GridSpec;
import io.github.yok.orbital.core.grid.SpatialGrid;
import io.github.yok.orbital.core.state.QuantumState;
import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVPrinter;

/**
 * 密度計算の結果を CSV に出力するクラスです。
 *
 * <p>
 * 出力ファイル名は、以下の命名規約に従います（副殻ラベルと量子数 n, l, m）。
 * </p>
 *
 * <ul>
 * <li>{@code orbital_density_2p_n=2_l=1_m=-1.csv}（x, y, z, i, density）</li>
 * <li>{@code orbital_meta_2p_n=2_l=1_m=-1.csv}（最大値・等値面しきい値などの補助情報）</li>
 * </ul>
 *
 * <p>
 * 3 次元空間（x, y, z）で可視化する前提のため、密度 CSV は座標と平坦化インデックス i を必ず含みます。
 * </p>
 */
@Getter
@Slf4j
public final class CsvResultWriter implements ResultWriter {

    /**
     * ファイル名の先頭固定文字列です。
     */
    private static final String FILE_HEAD = "orbital";

    /**
     * 出力先ディレクトリです。
     */
    private final Path outputDir;

    /**
     * マスクで隠された格子点の出力を省略するかどうかです。
     */
    private final boolean skipMasked;

    /**
     * 省略対象の判定に使う可視化マスクです。
     */
    private final VisibilityMask mask;

    /**
     * CSV 出力を生成します。
     *
     * @param outputDir 出力先ディレクトリです
     * @param skipMasked マスクで隠された格子点の出力を省略するかどうかです
     * @param mask 密度計算で適用した可視化マスクです（null 不可）
     * @throws IllegalArgumentException 引数が不正な場合に発生します
     */
    public CsvResultWriter(String outputDir, boolean skipMasked, VisibilityMask mask) {
        if (outputDir == null || outputDir.isEmpty()) {
            throw new IllegalArgumentException("output.dir は必須です");
        }
        this.outputDir = Paths.get(outputDir);
        this.skipMasked = skipMasked;
        if (mask == null) {
            throw new IllegalArgumentException("mask は null 不可です");
        }
        this.mask = mask;
    }

    /**
     * 密度計算の結果を出力します。
     *
     * @param result 密度計算の結果です
     * @param isosurfaceLevel 等値面の表示しきい値です
     * @throws IllegalArgumentException 引数が不正な場合に発生します
     * @throws IllegalStateException 出力に失敗した場合に発生します
     */
    @Override
    public void write(DensityResult result, IsosurfaceLevel isosurfaceLevel) {
        if (result == null) {
            throw new IllegalArgumentException("result は null 不可です");
        }
        if (isosurfaceLevel == null) {
            throw new IllegalArgumentException("isosurfaceLevel は null 不可です");
        }

        try {
            Files.createDirectories(outputDir);

            // 1) 格子座標と密度
            Path densityFile = writeDensityCsv(result);

            // 2) メタ（最大値、等値面しきい値、格子指定など）
            Path metaFile = writeMetaCsv(result, isosurfaceLevel);

            log.debug("CSV を出力しました: {}, {}", densityFile, metaFile);

        } catch (IOException e) {
            throw new IllegalStateException("CSV 出力に失敗しました: " + outputDir, e);
        }
    }

    /**
     * 格子座標と密度を出力します。
     *
     * @param result 密度計算の結果です
     * @return 出力したファイルです
     * @throws IOException 出力に失敗した場合に発生します
     */
    private Path writeDensityCsv(DensityResult result) throws IOException {
        Path file = outputDir.resolve(buildFileName("density", result.getState()));

        SpatialGrid grid = result.getGrid();
        DensityField field = result.getField();

        try (Writer w = Files.newBufferedWriter(file, StandardCharsets.UTF_8);
                CSVPrinter pr = CSVFormat.Builder.create(CSVFormat.DEFAULT)
                        .setHeader("x", "y", "z", "i", "density").build().print(w)) {

            for (int i = 0; i < field.size(); i++) {
                // 遠方でアンダーフローした 0 は省略しません
                if (skipMasked && mask.hides(grid, i)) {
                    continue;
                }
                pr.printRecord(grid.xAt(i), grid.yAt(i), grid.zAt(i), i, field.valueAt(i));
            }
        }
        return file;
    }

    /**
     * メタ情報を出力します。
     *
     * @param result 密度計算の結果です
     * @param isosurfaceLevel 等値面の表示しきい値です
     * @return 出力したファイルです
     * @throws IOException 出力に失敗した場合に発生します
     */
    private Path writeMetaCsv(DensityResult result, IsosurfaceLevel isosurfaceLevel)
            throws IOException {
        QuantumState state = result.getState();
        GridSpec spec = result.getSpec();
        DensityField field = result.getField();

        Path file = outputDir.resolve(buildFileName("meta", state));

        try (Writer w = Files.newBufferedWriter(file, StandardCharsets.UTF_8);
                CSVPrinter pr = CSVFormat.Builder.create(CSVFormat.DEFAULT)
                        .setHeader("key", "value").build().print(w)) {

            pr.printRecord("n", state.getN());
            pr.printRecord("l", state.getL());
            pr.printRecord("m", state.getM());
            pr.printRecord("label", state.label());

            pr.printRecord("extent", spec.getExtent());
            pr.printRecord("resolution", spec.getResolution());
            pr.printRecord("points", field.size());
            pr.printRecord("nonZero", field.getNonZeroCount());

            pr.printRecord("maxValue", field.maxValue());
            pr.printRecord("isoPercent", isosurfaceLevel.getPercent());
            pr.printRecord("isoValue", isosurfaceLevel.isoValue(field.maxValue()));
        }
        return file;
    }

    /**
     * 命名規約に従ってファイル名を作成します。
     *
     * <p>
     * 例: {@code orbital_density_3d_n=3_l=2_m=-1.csv}
     * </p>
     *
     * @param kind 出力の識別子（density/meta）
     * @param state 量子数の組です
     * @return ファイル名です
     */
    static String buildFileName(String kind, QuantumState state) {
        return FILE_HEAD + "_" + kind + "_" + state.subshellLabel() + "_n=" + state.getN() + "_l="
                + state.getL() + "_m=" + state.getM() + ".csv";
    }
}
