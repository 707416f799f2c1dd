package io.github.yok.orbital.app;

import javax.validation.Valid;
import javax.validation.constraints.Max;
import javax.validation.constraints.Min;
import javax.validation.constraints.NotNull;
import javax.validation.constraints.Positive;
import lombok.Data;
import lombok.ToString;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * orbital-density の設定値（orbital.*）を保持するクラスです。
 *
 * <p>
 * application.yml などから読み込まれ、CLI 実行時の初期化に使用します。 量子数の制約（l は n-1 以下など）はここでは検査せず、
 * 計算の直前に {@link io.github.yok.orbital.core.state.QuantumStateValidator} で検査します。
 * </p>
 */
@Data
@ToString(onlyExplicitlyIncluded = true)
@Validated
@ConfigurationProperties(prefix = "orbital")
public class OrbitalProperties {

    /**
     * 実行モードです。
     */
    @NotNull
    private Mode mode = Mode.SINGLE;

    /**
     * 量子状態の設定です（SINGLE モードで使用）。
     */
    @Valid
    private State state = new State();

    /**
     * 元素名です（ELEMENT モードで使用、例: Carbon）。
     */
    private String element = "Hydrogen";

    /**
     * 格子設定です。
     */
    @Valid
    private Grid grid = new Grid();

    /**
     * 計算設定です。
     */
    @Valid
    private Compute compute = new Compute();

    /**
     * 表示設定です。
     */
    @Valid
    private Render render = new Render();

    /**
     * 出力設定です。
     */
    @Valid
    private Output output = new Output();

    /**
     * 設定値を YAML 風の複数行文字列に整形して返します。
     *
     * @return 設定値の整形文字列です
     */
    @ToString.Include(name = "orbital")
    public String toMultilineString() {
        String nl = System.lineSeparator();

        // 先頭改行を入れて、ログの可読性を上げます。
        StringBuilder sb = new StringBuilder(256).append(nl);

        appendSection(sb, nl, "run",
                // mode: SINGLE / SEQUENCE / ELEMENT
                "mode", mode,
                // element: ELEMENT モードの元素名
                "element", element);

        appendSection(sb, nl, "state",
                // n, l, m: SINGLE モードの量子数
                "n", state.getN(), "l", state.getL(), "m", state.getM());

        appendSection(sb, nl, "grid",
                // extent: 各軸方向の範囲（ボーア半径単位）
                "extent", grid.getExtent(),
                // resolution: 1 軸あたりの点数
                "resolution", grid.getResolution());

        appendSection(sb, nl, "compute",
                // parallel: 格子を区間に分けて並列評価するかどうか
                "parallel", compute.isParallel(),
                // chunkSize: 1 区間あたりの要素数
                "chunkSize", compute.getChunkSize(),
                // cacheSize: 計算結果キャッシュの最大保持数
                "cacheSize", compute.getCacheSize());

        appendSection(sb, nl, "render",
                // isoPercent: 等値面しきい値（最大密度に対する %）
                "isoPercent", render.getIsoPercent());

        appendSection(sb, nl, "output",
                // dir: 出力先ディレクトリ
                "dir", output.getDir(),
                // skipMasked: マスクで隠された格子点を省略するかどうか
                "skipMasked", output.isSkipMasked());

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

    /**
     * 実行モードです。
     */
    public enum Mode {

        /**
         * 設定した 1 つの量子状態を計算します。
         */
        SINGLE,

        /**
         * 既定の軌道の並び（1s から 4f まで）を順に計算します。
         */
        SEQUENCE,

        /**
         * 元素の電子配置で占有されている副殻の全軌道を計算します。
         */
        ELEMENT
    }

    @Data
    public static class State {

        /**
         * 主量子数 n です。
         */
        private int n = 1;

        /**
         * 方位量子数 l です。
         */
        private int l = 0;

        /**
         * 磁気量子数 m です。
         */
        private int m = 0;
    }

    @Data
    public static class Grid {

        /**
         * 各軸方向の範囲（ボーア半径単位）です。
         */
        @Positive
        private double extent = 20.0;

        /**
         * 1 軸あたりの点数です。
         */
        @Min(2)
        private int resolution = 100;
    }

    @Data
    public static class Compute {

        /**
         * 格子を区間に分けて並列評価するかどうかです。
         */
        private boolean parallel = true;

        /**
         * 1 区間あたりの要素数です。
         */
        @Min(1)
        private int chunkSize = 16384;

        /**
         * 計算結果キャッシュの最大保持数です。
         */
        @Min(1)
        private long cacheSize = 8;
    }

    @Data
    public static class Render {

        /**
         * 等値面しきい値（最大密度に対する %）です。
         */
        @Min(1)
        @Max(100)
        private int isoPercent = 1;
    }

    @Data
    public static class Output {

        /**
         * 出力先ディレクトリです。
         */
        private String dir = "./out";

        /**
         * 可視化マスクで隠された格子点の出力を省略するかどうかです。
         */
        private boolean skipMasked = false;
    }
}
