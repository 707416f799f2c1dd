package io.github.yok.orbital.app;

import io.github.yok.orbital.core.density.CachingDensityCalculator;
import io.github.yok.orbital.core.density.DensityCalculator;
import io.github.yok.orbital.core.density.DensityCompositor;
import io.github.yok.orbital.core.density.HalfSpaceCutawayMask;
import io.github.yok.orbital.core.density.OrbitalDensityCalculator;
import io.github.yok.orbital.core.density.VisibilityMask;
import io.github.yok.orbital.core.grid.GridSampler;
import io.github.yok.orbital.out.CsvResultWriter;
import io.github.yok.orbital.out.IsosurfaceLevel;
import io.github.yok.orbital.out.ResultWriter;
import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * 格子生成 + 波動関数合成 + キャッシュ層 + CSV 出力の Bean 定義を行う設定クラスです。
 */
@Configuration
@RequiredArgsConstructor
public class OrbitalDensityConfiguration {

    /**
     * orbital-density の設定値（orbital.*）です。
     */
    private final OrbitalProperties p;

    /**
     * 格子生成ロジックを生成します。
     *
     * @return 格子生成ロジックです
     */
    @Bean
    public GridSampler gridSampler() {
        return new GridSampler();
    }

    /**
     * 可視化マスク（X >= 0 の半空間を隠す）を生成します。
     *
     * @return 可視化マスクです
     */
    @Bean
    public VisibilityMask visibilityMask() {
        return HalfSpaceCutawayMask.INSTANCE;
    }

    /**
     * 密度の合成ロジックを生成します。
     *
     * @param mask 可視化マスクです
     * @return 合成ロジックです
     */
    @Bean
    public DensityCompositor densityCompositor(VisibilityMask mask) {
        OrbitalProperties.Compute c = p.getCompute();
        return new DensityCompositor(mask, c.isParallel(), c.getChunkSize());
    }

    /**
     * 密度計算（キャッシュ層つき）を生成します。
     *
     * @param gridSampler 格子生成ロジックです
     * @param compositor 合成ロジックです
     * @return 密度計算です
     */
    @Bean
    public DensityCalculator densityCalculator(GridSampler gridSampler,
            DensityCompositor compositor) {
        return new CachingDensityCalculator(new OrbitalDensityCalculator(gridSampler, compositor),
                p.getCompute().getCacheSize());
    }

    /**
     * 等値面の表示しきい値を生成します。
     *
     * @return 等値面の表示しきい値です
     */
    @Bean
    public IsosurfaceLevel isosurfaceLevel() {
        return IsosurfaceLevel.ofPercent(p.getRender().getIsoPercent());
    }

    /**
     * 結果出力ロジックを生成します。
     *
     * @param mask 密度計算と共有する可視化マスクです
     * @return 結果出力ロジックです
     */
    @Bean
    public ResultWriter resultWriter(VisibilityMask mask) {
        return new CsvResultWriter(p.getOutput().getDir(), p.getOutput().isSkipMasked(), mask);
    }
}
