package io.github.yok.orbital.core.grid;

import lombok.extern.slf4j.Slf4j;

/**
 * 格子指定から 3 次元直交格子を生成し、各点を球座標に変換するクラスです。
 *
 * <p>
 * 各軸は {@code x_i = -extent + i * step}（{@code step = 2 * extent / (resolution - 1)}）で、 最終点は
 * {@code +extent} に一致させます。 格子は x, y, z 軸の直積（ij 順）で、点数は {@code resolution^3} です。
 * </p>
 *
 * <p>
 * 球座標は次のとおりです。
 * </p>
 * <ul>
 * <li>{@code r = max(sqrt(X^2 + Y^2 + Z^2), 1e-10)}（原点の座標特異点を避けるための下限）</li>
 * <li>{@code θ = acos(clip(Z / r, -1, 1))}</li>
 * <li>{@code φ = atan2(Y, X)}</li>
 * </ul>
 */
@Slf4j
public final class GridSampler {

    /**
     * 動径の下限です。
     */
    public static final double RADIUS_FLOOR = 1e-10;

    /**
     * 格子指定から空間格子を生成します。
     *
     * @param spec 格子指定です
     * @return 空間格子です
     * @throws io.github.yok.orbital.core.exception.InvalidGridSpecException 格子指定が不正な場合に発生します
     */
    public SpatialGrid sample(GridSpec spec) {
        GridSpecValidator.validate(spec);

        long t0 = System.nanoTime();

        int res = spec.getResolution();
        int size = (int) spec.pointCount();
        double[] axis = linspace(-spec.getExtent(), spec.getExtent(), res);

        double[] x = new double[size];
        double[] y = new double[size];
        double[] z = new double[size];
        double[] r = new double[size];
        double[] theta = new double[size];
        double[] phi = new double[size];

        // 直積格子（ij 順）。最内側が z 軸です。
        int idx = 0;
        for (int i = 0; i < res; i++) {
            double xi = axis[i];
            for (int j = 0; j < res; j++) {
                double yj = axis[j];
                for (int k = 0; k < res; k++) {
                    x[idx] = xi;
                    y[idx] = yj;
                    z[idx] = axis[k];
                    idx++;
                }
            }
        }

        toSpherical(x, y, z, r, theta, phi);

        log.debug("格子を生成しました。extent={}、resolution={}、点数={}、所要時間={}ms", spec.getExtent(), res,
                size, (System.nanoTime() - t0) / 1_000_000L);

        return new SpatialGrid(spec, axis, x, y, z, r, theta, phi);
    }

    /**
     * 両端を含む等間隔の点列を返します。
     *
     * @param start 始点です
     * @param stop 終点です
     * @param num 点数です（2 以上）
     * @return 点列です
     */
    static double[] linspace(double start, double stop, int num) {
        double[] out = new double[num];
        double step = (stop - start) / (num - 1);
        for (int i = 0; i < num; i++) {
            out[i] = i * step + start;
        }
        out[num - 1] = stop;
        return out;
    }

    /**
     * 直交座標を球座標に変換します（要素ごと）。
     *
     * @param x X 座標です
     * @param y Y 座標です
     * @param z Z 座標です
     * @param r 動径の出力先です
     * @param theta 極角の出力先です
     * @param phi 方位角の出力先です
     */
    private static void toSpherical(double[] x, double[] y, double[] z, double[] r,
            double[] theta, double[] phi) {
        for (int i = 0; i < x.length; i++) {
            double ri = Math.sqrt(x[i] * x[i] + y[i] * y[i] + z[i] * z[i]);
            ri = Math.max(ri, RADIUS_FLOOR);

            // 丸め誤差で |Z/r| が 1 をわずかに超える場合があるため切り詰めます。
            double cosTheta = Math.max(-1.0, Math.min(1.0, z[i] / ri));

            r[i] = ri;
            theta[i] = Math.acos(cosTheta);
            phi[i] = Math.atan2(y[i], x[i]);
        }
    }
}
