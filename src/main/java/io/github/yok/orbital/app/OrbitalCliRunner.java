package io.github.yok.orbital.app;

import io.github.yok.orbital.core.catalog.Element;
import io.github.yok.orbital.core.catalog.OrbitalSequence;
import io.github.yok.orbital.core.density.DensityCalculator;
import io.github.yok.orbital.core.density.DensityResult;
import io.github.yok.orbital.core.grid.GridSpec;
import io.github.yok.orbital.core.state.QuantumState;
import io.github.yok.orbital.core.state.QuantumStateValidator;
import io.github.yok.orbital.out.IsosurfaceLevel;
import io.github.yok.orbital.out.ResultWriter;
import java.util.List;
import java.util.Locale;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.CommandLineRunner;
import org.springframework.stereotype.Component;

/**
 * CLI で orbital-density を実行するクラスです。
 *
 * <p>
 * 実行モードに応じて量子状態の一覧を決め、各状態について密度場を計算して出力します。 不正な量子状態が含まれる場合は、計算を始める前に例外で終了します。
 * </p>
 */
@Component
@RequiredArgsConstructor
public class OrbitalCliRunner implements CommandLineRunner {

    /**
     * orbital-density の設定値（orbital.*）です。
     */
    private final OrbitalProperties properties;

    /**
     * 密度計算ロジックです。
     */
    private final DensityCalculator densityCalculator;

    /**
     * 等値面の表示しきい値です。
     */
    private final IsosurfaceLevel isosurfaceLevel;

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
        System.out.println("=== orbital-density start: compute probability density fields ===");
        System.out.print(properties.toMultilineString());

        List<QuantumState> states = resolveStates();
        if (properties.getMode() == OrbitalProperties.Mode.ELEMENT) {
            Element element = Element.fromName(properties.getElement());
            System.out.println("元素: " + element.getDisplayName() + " (Z=" + element.atomicNumber()
                    + ", " + element.getConfiguration() + ")");
        }

        // 計算前にすべての状態を検証（途中まで出力して失敗することを避けます）
        for (QuantumState s : states) {
            QuantumStateValidator.validate(s);
        }

        GridSpec spec = GridSpec.of(properties.getGrid().getExtent(),
                properties.getGrid().getResolution());

        for (int i = 0; i < states.size(); i++) {
            QuantumState state = states.get(i);

            System.out.println("=== 状態ごとの計算 ===");
            System.out.println("入力: " + state.label() + " (n=" + state.getN() + ", l="
                    + state.getL() + ", m=" + state.getM() + ", step=" + (i + 1) + "/"
                    + states.size() + ")");

            DensityResult result = densityCalculator.computeDensity(state, spec);
            resultWriter.write(result, isosurfaceLevel);

            double max = result.getField().maxValue();
            System.out.println("結果: max=" + fmt(max) + ", isoValue="
                    + fmt(isosurfaceLevel.isoValue(max)) + " (" + isosurfaceLevel.getPercent()
                    + "%)" + ", nonZero=" + result.getField().getNonZeroCount() + "/"
                    + result.getField().size());
        }
    }

    /**
     * 実行モードに応じた量子状態の一覧を返します（未検証）。
     *
     * @return 量子状態の一覧です
     * @throws IllegalArgumentException ELEMENT モードで元素名が不正な場合に発生します
     */
    public List<QuantumState> resolveStates() {
        switch (properties.getMode()) {
            case SEQUENCE:
                return OrbitalSequence.defaultSequence();
            case ELEMENT:
                return Element.fromName(properties.getElement()).getConfiguration()
                        .occupiedStates();
            case SINGLE:
            default:
                OrbitalProperties.State s = properties.getState();
                return List.of(QuantumState.of(s.getN(), s.getL(), s.getM()));
        }
    }

    /**
     * 数値を指数表記の文字列に整形します。
     *
     * @param v 数値です
     * @return 整形した文字列です
     */
    private static String fmt(double v) {
        return String.format(Locale.ROOT, "%.5e", v);
    }
}
