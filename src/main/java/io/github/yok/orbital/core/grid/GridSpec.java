package io.github.yok.orbital.core.grid;

import lombok.Value;

/**
 * 立方体のサンプリング領域 {@code [-extent, extent]^3} と 1 軸あたりの点数を表す値オブジェクトです。
 *
 * <p>
 * 各軸は両端を含む等間隔の {@code resolution} 点でサンプリングします。 制約（{@code extent > 0}, {@code resolution >= 2}）は
 * {@link GridSpecValidator} で検査します。
 * </p>
 */
@Value
public class GridSpec {

    /**
     * 各軸方向の範囲（原子単位、ボーア半径 = 1）です。
     */
    double extent;

    /**
     * 1 軸あたりの点数です。
     */
    int resolution;

    /**
     * 格子指定を生成します。
     *
     * @param extent 各軸方向の範囲です
     * @param resolution 1 軸あたりの点数です
     * @return 格子指定です（未検証）
     */
    public static GridSpec of(double extent, int resolution) {
        return new GridSpec(extent, resolution);
    }

    /**
     * 格子点の総数 {@code resolution^3} を返します。
     *
     * @return 格子点の総数です
     */
    public long pointCount() {
        long r = resolution;
        return r * r * r;
    }

    /**
     * 隣接格子点の間隔 {@code 2 * extent / (resolution - 1)} を返します。
     *
     * @return 格子間隔です
     */
    public double spacing() {
        return 2.0 * extent / (resolution - 1);
    }
}
