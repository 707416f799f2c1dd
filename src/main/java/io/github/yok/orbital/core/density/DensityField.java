package io.github.yok.orbital.core.density;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkElementIndex;
import static com.google.common.base.Preconditions.checkNotNull;
import lombok.Getter;

/**
 * 空間格子と同じインデックスを持つ確率密度 |ψ|^2 の場です（非負の実数）。
 *
 * <p>
 * 可視化マスク適用後の値を保持し、最大値を生成時に 1 回だけ求めます。 生成後は変更されません。
 * </p>
 */
public final class DensityField {

    /**
     * 1 軸あたりの点数です。
     */
    @Getter
    private final int resolution;

    /**
     * 密度値（長さ {@code resolution^3}）です。
     */
    private final double[] values;

    /**
     * 密度の最大値です。
     */
    private final double maxValue;

    /**
     * 0 でない要素の数です。
     */
    @Getter
    private final int nonZeroCount;

    /**
     * 密度場を生成します。 配列は所有権ごと受け取り、コピーしません。
     *
     * @param resolution 1 軸あたりの点数です
     * @param values 密度値です（長さ {@code resolution^3}、非負）
     * @throws IllegalArgumentException 配列長が一致しない場合に発生します
     */
    DensityField(int resolution, double[] values) {
        checkNotNull(values, "values は null 不可です");
        checkArgument((long) resolution * resolution * resolution == values.length,
                "values の長さが resolution^3 と一致しません: resolution=%s, length=%s", resolution,
                values.length);
        this.resolution = resolution;
        this.values = values;

        double max = 0.0;
        int nonZero = 0;
        for (double v : values) {
            if (v > max) {
                max = v;
            }
            if (v != 0.0) {
                nonZero++;
            }
        }
        this.maxValue = max;
        this.nonZeroCount = nonZero;
    }

    /**
     * 密度の最大値を返します。
     *
     * @return 最大値です（すべて 0 の場合は 0）
     */
    public double maxValue() {
        return maxValue;
    }

    /**
     * 要素数 {@code resolution^3} を返します。
     *
     * @return 要素数です
     */
    public int size() {
        return values.length;
    }

    /**
     * 平坦化したインデックスの密度を返します。
     *
     * @param index インデックスです
     * @return 密度です
     */
    public double valueAt(int index) {
        return values[index];
    }

    /**
     * 軸インデックス (i, j, k) の密度を返します。
     *
     * @param i x 軸のインデックスです
     * @param j y 軸のインデックスです
     * @param k z 軸のインデックスです
     * @return 密度です
     */
    public double valueAt(int i, int j, int k) {
        checkElementIndex(i, resolution, "i");
        checkElementIndex(j, resolution, "j");
        checkElementIndex(k, resolution, "k");
        return values[(i * resolution + j) * resolution + k];
    }

    /**
     * 密度値のコピーを返します。
     *
     * @return 密度値です
     */
    public double[] values() {
        return values.clone();
    }
}
