package io.github.yok.orbital.core.density;

import static com.google.common.base.Preconditions.checkNotNull;
import io.github.yok.orbital.core.grid.GridSampler;
import io.github.yok.orbital.core.grid.GridSpec;
import io.github.yok.orbital.core.grid.GridSpecValidator;
import io.github.yok.orbital.core.grid.SpatialGrid;
import io.github.yok.orbital.core.state.QuantumState;
import io.github.yok.orbital.core.state.QuantumStateValidator;
import java.util.Locale;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * 確率密度場の計算の入口となるクラスです。
 *
 * <p>
 * 量子数と格子指定を検証してから（配列の確保や特殊関数の評価より前）、格子を生成し、密度場を合成します。 状態を持たない純粋な計算です。
 * </p>
 */
@Getter
@Slf4j
@RequiredArgsConstructor
public final class OrbitalDensityCalculator implements DensityCalculator {

    /**
     * 格子生成ロジックです。
     */
    private final GridSampler gridSampler;

    /**
     * 密度の合成ロジックです。
     */
    private final DensityCompositor compositor;

    /**
     * 既定の構成（逐次評価、X >= 0 の半空間マスク）で生成します。
     */
    public OrbitalDensityCalculator() {
        this(new GridSampler(), DensityCompositor.withHalfSpaceCutaway());
    }

    /**
     * 確率密度場を計算します。
     *
     * @param state 量子数の組です（null 不可）
     * @param spec 格子指定です（null 不可）
     * @return 空間格子と密度場の組です
     * @throws io.github.yok.orbital.core.exception.InvalidQuantumStateException 量子数が不正な場合に発生します
     * @throws io.github.yok.orbital.core.exception.InvalidGridSpecException 格子指定が不正な場合に発生します
     */
    @Override
    public DensityResult computeDensity(QuantumState state, GridSpec spec) {
        checkNotNull(state, "state は null 不可です");
        checkNotNull(spec, "spec は null 不可です");

        QuantumStateValidator.validate(state);
        GridSpecValidator.validate(spec);

        long t0 = System.nanoTime();

        SpatialGrid grid = gridSampler.sample(spec);
        DensityField field = compositor.compose(state, grid);

        long elapsedMs = (System.nanoTime() - t0) / 1_000_000L;
        log.info("密度場を計算しました。状態={}（n={} l={} m={}）、extent={}、resolution={}、最大値={}、所要時間={}ms",
                state.label(), state.getN(), state.getL(), state.getM(), spec.getExtent(),
                spec.getResolution(), fmt(field.maxValue()), elapsedMs);
        if (field.maxValue() == 0.0) {
            log.warn("密度場がすべて 0 です。格子が軌道の広がりに対して粗すぎるか、マスクで全体が隠れています。状態={}、extent={}、resolution={}",
                    state.label(), spec.getExtent(), spec.getResolution());
        }

        return new DensityResult(state, grid, field);
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
