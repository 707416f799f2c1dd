package io.github.yok.orbital.core.density;

import io.github.yok.orbital.core.grid.GridSpec;
import io.github.yok.orbital.core.grid.SpatialGrid;
import io.github.yok.orbital.core.state.QuantumState;
import lombok.Value;

/**
 * 密度計算の結果（空間格子と密度場の組）を保持するクラスです。
 */
@Value
public class DensityResult {

    /**
     * 計算した量子数の組です。
     */
    QuantumState state;

    /**
     * 空間格子です。
     */
    SpatialGrid grid;

    /**
     * 密度場です（可視化マスク適用済み）。
     */
    DensityField field;

    /**
     * 格子指定を返します。
     *
     * @return 格子指定です
     */
    public GridSpec getSpec() {
        return grid.getSpec();
    }
}
