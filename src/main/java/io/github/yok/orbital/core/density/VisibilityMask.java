package io.github.yok.orbital.core.density;

import io.github.yok.orbital.core.grid.SpatialGrid;

/**
 * 確率密度を計算した後に適用する可視化用のマスクです。
 *
 * <p>
 * 物理的な性質ではなく表示上の後処理です。 密度の計算式には組み込まず、計算済みの密度に対してのみ適用します。
 * </p>
 */
public interface VisibilityMask {

    /**
     * 何も隠さないマスクです。
     */
    VisibilityMask NONE = (grid, index) -> false;

    /**
     * 指定格子点の密度を 0 にするかどうかを返します。
     *
     * @param grid 空間格子です
     * @param index 平坦化したインデックスです
     * @return 隠す場合は true です
     */
    boolean hides(SpatialGrid grid, int index);
}
