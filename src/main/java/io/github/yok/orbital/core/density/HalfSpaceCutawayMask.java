package io.github.yok.orbital.core.density;

import io.github.yok.orbital.core.grid.SpatialGrid;

/**
 * {@code X >= 0} の半空間を隠し、軌道の内部構造を断面として見せるマスクです。
 */
public final class HalfSpaceCutawayMask implements VisibilityMask {

    /**
     * 共有インスタンスです（状態を持ちません）。
     */
    public static final HalfSpaceCutawayMask INSTANCE = new HalfSpaceCutawayMask();

    private HalfSpaceCutawayMask() {}

    @Override
    public boolean hides(SpatialGrid grid, int index) {
        return grid.xAt(index) >= 0.0;
    }
}
