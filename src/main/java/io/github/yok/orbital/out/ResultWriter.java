package io.github.yok.orbital.out;

import io.github.yok.orbital.core.density.DensityResult;

/**
 * 密度計算の結果を出力する処理のインタフェースです。
 *
 * <p>
 * 外部の描画処理（等値面表示など）に渡すため、格子座標・密度・最大値と表示しきい値を出力します。
 * </p>
 */
public interface ResultWriter {

    /**
     * 密度計算の結果を出力します。
     *
     * @param result 密度計算の結果です
     * @param isosurfaceLevel 等値面の表示しきい値です
     */
    void write(DensityResult result, IsosurfaceLevel isosurfaceLevel);
}
