package io.github.yok.orbital.core.grid;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkElementIndex;
import static com.google.common.base.Preconditions.checkNotNull;
import lombok.Getter;

/**
 * 3 次元直交格子の各点の直交座標 (X, Y, Z) と球座標 (r, θ, φ) を保持するクラスです。
 *
 * <p>
 * 配列はすべて長さ {@code resolution^3} で、インデックス変換は {@code index = (i * res + j) * res + k} です（i, j, k はそれぞれ
 * x, y, z 軸のインデックス）。 生成後は変更されません。配列の取得はコピーを返し、要素単位の参照はコピーなしで行えます。
 * </p>
 */
public final class SpatialGrid {

    /**
     * 生成元の格子指定です。
     */
    @Getter
    private final GridSpec spec;

    /**
     * 1 軸あたりの点数です。
     */
    @Getter
    private final int resolution;

    /**
     * 1 軸分の座標値（x, y, z で共通）です。
     */
    private final double[] axis;

    /**
     * X 座標です。
     */
    private final double[] x;

    /**
     * Y 座標です。
     */
    private final double[] y;

    /**
     * Z 座標です。
     */
    private final double[] z;

    /**
     * 動径 r です（下限 {@code 1e-10} で切り上げ済み）。
     */
    private final double[] r;

    /**
     * 極角 θ（0 以上 π 以下）です。
     */
    private final double[] theta;

    /**
     * 方位角 φ（-π より大きく π 以下）です。
     */
    private final double[] phi;

    /**
     * 空間格子を生成します。 配列は所有権ごと受け取り、コピーしません。
     *
     * @param spec 格子指定です（null 不可）
     * @param axis 1 軸分の座標値です（長さ resolution）
     * @param x X 座標です
     * @param y Y 座標です
     * @param z Z 座標です
     * @param r 動径です
     * @param theta 極角です
     * @param phi 方位角です
     * @throws IllegalArgumentException 配列長が格子指定と一致しない場合に発生します
     */
    SpatialGrid(GridSpec spec, double[] axis, double[] x, double[] y, double[] z, double[] r,
            double[] theta, double[] phi) {
        this.spec = checkNotNull(spec, "spec は null 不可です");
        this.resolution = spec.getResolution();
        int size = (int) spec.pointCount();

        checkArgument(axis.length == resolution, "axis の長さが resolution と一致しません: %s",
                axis.length);
        checkArgument(x.length == size && y.length == size && z.length == size,
                "直交座標配列の長さが resolution^3 と一致しません");
        checkArgument(r.length == size && theta.length == size && phi.length == size,
                "球座標配列の長さが resolution^3 と一致しません");

        this.axis = axis;
        this.x = x;
        this.y = y;
        this.z = z;
        this.r = r;
        this.theta = theta;
        this.phi = phi;
    }

    /**
     * 格子点の総数を返します。
     *
     * @return 格子点の総数です
     */
    public int size() {
        return x.length;
    }

    /**
     * 軸インデックス (i, j, k) を平坦化したインデックスに変換します。
     *
     * @param i x 軸のインデックスです
     * @param j y 軸のインデックスです
     * @param k z 軸のインデックスです
     * @return 平坦化したインデックスです
     */
    public int indexOf(int i, int j, int k) {
        checkElementIndex(i, resolution, "i");
        checkElementIndex(j, resolution, "j");
        checkElementIndex(k, resolution, "k");
        return (i * resolution + j) * resolution + k;
    }

    /**
     * 1 軸分の座標値のコピーを返します。
     *
     * @return 座標値です
     */
    public double[] axis() {
        return axis.clone();
    }

    /**
     * 平坦化したインデックスのX 座標を返します（コピーなし）。
     *
     * @param index インデックスです
     * @return X 座標です
     */
    public double xAt(int index) {
        return x[index];
    }

    /**
     * 平坦化したインデックスのY 座標を返します（コピーなし）。
     *
     * @param index インデックスです
     * @return Y 座標です
     */
    public double yAt(int index) {
        return y[index];
    }

    /**
     * 平坦化したインデックスのZ 座標を返します（コピーなし）。
     *
     * @param index インデックスです
     * @return Z 座標です
     */
    public double zAt(int index) {
        return z[index];
    }

    /**
     * 平坦化したインデックスの動径 rを返します（コピーなし）。
     *
     * @param index インデックスです
     * @return 動径 rです
     */
    public double rAt(int index) {
        return r[index];
    }

    /**
     * 平坦化したインデックスの極角 θを返します（コピーなし）。
     *
     * @param index インデックスです
     * @return 極角 θです
     */
    public double thetaAt(int index) {
        return theta[index];
    }

    /**
     * 平坦化したインデックスの方位角 φを返します（コピーなし）。
     *
     * @param index インデックスです
     * @return 方位角 φです
     */
    public double phiAt(int index) {
        return phi[index];
    }

    /**
     * X 座標配列のコピーを返します。
     *
     * @return X 座標です
     */
    public double[] x() {
        return x.clone();
    }

    /**
     * Y 座標配列のコピーを返します。
     *
     * @return Y 座標です
     */
    public double[] y() {
        return y.clone();
    }

    /**
     * Z 座標配列のコピーを返します。
     *
     * @return Z 座標です
     */
    public double[] z() {
        return z.clone();
    }

    /**
     * 動径配列のコピーを返します。
     *
     * @return 動径です
     */
    public double[] r() {
        return r.clone();
    }

    /**
     * 極角配列のコピーを返します。
     *
     * @return 極角です
     */
    public double[] theta() {
        return theta.clone();
    }

    /**
     * 方位角配列のコピーを返します。
     *
     * @return 方位角です
     */
    public double[] phi() {
        return phi.clone();
    }
}
