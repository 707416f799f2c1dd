package io.github.yok.orbital.core.density;

import io.github.yok.orbital.core.grid.GridSpec;
import io.github.yok.orbital.core.state.QuantumState;

/**
 * 量子状態と格子指定から確率密度場を計算するインタフェースです。
 *
 * <p>
 * キャッシュ層などの差し替えを容易にするための境界です。
 * </p>
 */
public interface DensityCalculator {

    /**
     * 確率密度場を計算します。
     *
     * @param state 量子数の組です
     * @param spec 格子指定です
     * @return 空間格子と密度場の組です
     * @throws io.github.yok.orbital.core.exception.InvalidQuantumStateException 量子数が不正な場合に発生します
     * @throws io.github.yok.orbital.core.exception.InvalidGridSpecException 格子指定が不正な場合に発生します
     */
    DensityResult computeDensity(QuantumState state, GridSpec spec);
}
