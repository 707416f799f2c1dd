package io.github.yok.orbital.core.density;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.stats.CacheStats;
import io.github.yok.orbital.core.grid.GridSpec;
import io.github.yok.orbital.core.state.QuantumState;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;

/**
 * (量子状態, 格子指定) をキーとして計算結果を保持するキャッシュ層です。
 *
 * <p>
 * 入力が変わらない場合の再計算を避けます。 計算本体は純粋関数のまま委譲先に置き、キャッシュはこの層だけが持ちます。
 * 不正な入力による例外はそのまま伝播し、キャッシュには残りません。
 * </p>
 */
@Slf4j
public final class CachingDensityCalculator implements DensityCalculator {

    /**
     * 委譲先の計算ロジックです。
     */
    private final DensityCalculator delegate;

    /**
     * 計算結果のキャッシュです。
     */
    private final Cache<CacheKey, DensityResult> cache;

    /**
     * キャッシュ層を生成します。
     *
     * @param delegate 委譲先の計算ロジックです（null 不可）
     * @param maximumSize 保持する結果の最大数です（1 以上）
     * @throws IllegalArgumentException 引数が不正な場合に発生します
     */
    public CachingDensityCalculator(DensityCalculator delegate, long maximumSize) {
        this.delegate = checkNotNull(delegate, "delegate は null 不可です");
        checkArgument(maximumSize > 0, "maximumSize は 1 以上が必要です: %s", maximumSize);
        this.cache = Caffeine.newBuilder().maximumSize(maximumSize).recordStats().build();
    }

    /**
     * キャッシュに結果があればそれを返し、なければ計算して保持します。
     *
     * @param state 量子数の組です（null 不可）
     * @param spec 格子指定です（null 不可）
     * @return 空間格子と密度場の組です
     */
    @Override
    public DensityResult computeDensity(QuantumState state, GridSpec spec) {
        checkNotNull(state, "state は null 不可です");
        checkNotNull(spec, "spec は null 不可です");

        DensityResult result = cache.get(new CacheKey(state, spec),
                k -> delegate.computeDensity(k.getState(), k.getSpec()));

        CacheStats s = cache.stats();
        log.debug("キャッシュ参照：状態={}、extent={}、resolution={}（ヒット={}、ミス={}）", state.label(),
                spec.getExtent(), spec.getResolution(), s.hitCount(), s.missCount());
        return result;
    }

    /**
     * キャッシュの統計情報を返します。
     *
     * @return 統計情報です
     */
    public CacheStats stats() {
        return cache.stats();
    }

    /**
     * 保持している結果の数（概算）を返します。
     *
     * @return 保持数です
     */
    public long size() {
        return cache.estimatedSize();
    }

    /**
     * 保持している結果をすべて破棄します。
     */
    public void invalidateAll() {
        cache.invalidateAll();
    }

    /**
     * キャッシュのキーです。
     */
    @Value
    static class CacheKey {

        QuantumState state;

        GridSpec spec;
    }
}
