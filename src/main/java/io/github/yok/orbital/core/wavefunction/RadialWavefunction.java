package io.github.yok.orbital.core.wavefunction;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;
import static org.apache.commons.math3.util.FastMath.exp;
import static org.apache.commons.math3.util.FastMath.log;
import static org.apache.commons.math3.util.FastMath.max;
import lombok.Getter;
import org.apache.commons.math3.util.CombinatoricsUtils;

/**
 * 水素様原子の動径波動関数 {@code R(n, l, r)} を評価するクラスです（原子単位、ボーア半径 = 1）。
 *
 * <p>
 * {@code R = norm * exp(-ρ/2) * ρ^l * L_{n-l-1}^(2l+1)(ρ)}、{@code ρ = 2r/n}、
 * {@code norm = sqrt((2/n)^3 * (n-l-1)! / (2n * (n+l)!))} です。
 * </p>
 *
 * <h2>数値安定性</h2>
 * <ul>
 * <li>正規化定数は対数階乗で {@code log norm} として計算し、階乗そのものは作りません（n≈30 で {@code (n+l)!} は 10^76 を超えます）。</li>
 * <li>{@code norm * exp(-ρ/2) * ρ^l} は対数領域でまとめてから指数をとり、途中のオーバーフロー・アンダーフローを避けます。</li>
 * <li>r は {@code 1e-10} を下限として切り上げます（原点の近似。解析的な極限値には置き換えません）。</li>
 * </ul>
 *
 * <p>
 * 量子数の制約（{@code n > l >= 0}）は呼び出し側で検証済みであることを前提とします。
 * </p>
 */
@Getter
public final class RadialWavefunction {

    /**
     * 動径の下限です。
     */
    public static final double RADIUS_FLOOR = 1e-10;

    /**
     * これ以下の対数では {@code exp} が 0 にアンダーフローします。
     */
    static final double LOG_UNDERFLOW = -746.0;

    /**
     * 主量子数 n です。
     */
    private final int n;

    /**
     * 方位量子数 l です。
     */
    private final int l;

    /**
     * 正規化定数の自然対数です。
     */
    private final double logNorm;

    /**
     * 一般化ラゲール多項式 {@code L_{n-l-1}^(2l+1)} です。
     */
    private final GeneralizedLaguerrePolynomial laguerre;

    /**
     * 動径波動関数を生成します（正規化定数の前計算を含む）。
     *
     * @param n 主量子数です（検証済み）
     * @param l 方位量子数です（検証済み）
     * @throws IllegalArgumentException {@code n < 1} または l が 0..n-1 の範囲外の場合に発生します
     */
    public RadialWavefunction(int n, int l) {
        checkArgument(n >= 1 && l >= 0 && l < n, "(n, l) が不正です: n=%s, l=%s", n, l);
        this.n = n;
        this.l = l;
        this.logNorm = logNormalization(n, l);
        this.laguerre = new GeneralizedLaguerrePolynomial(n - l - 1, 2 * l + 1);
    }

    /**
     * 正規化定数 {@code norm} を返します。
     *
     * @return 正規化定数です
     */
    public double normalization() {
        return exp(logNorm);
    }

    /**
     * {@code R(n, l, r)} を返します。
     *
     * @param r 動径です（0 以上）
     * @return 動径波動関数の値です
     */
    public double valueAt(double r) {
        double rho = 2.0 * max(r, RADIUS_FLOOR) / n;
        double exponent = logNorm - 0.5 * rho + l * log(rho);
        // ρ が無限大のときは NaN になるため、否定形で比較します
        if (!(exponent > LOG_UNDERFLOW)) {
            return 0.0;
        }
        double polynomial = laguerre.valueAt(rho);
        if (polynomial == 0.0) {
            return 0.0;
        }
        return polynomial * exp(exponent);
    }

    /**
     * 動径の配列に対して要素ごとに {@code R(n, l, r)} を評価します。
     *
     * @param r 動径の配列です（null 不可）
     * @return 入力と同じ長さの配列です
     */
    public double[] evaluate(double[] r) {
        checkNotNull(r, "r は null 不可です");
        double[] out = new double[r.length];
        evaluate(r, out, 0, r.length);
        return out;
    }

    /**
     * 動径の配列の区間 {@code [from, to)} を評価し、出力配列の同じ位置に書き込みます。
     *
     * @param r 動径の配列です
     * @param out 出力先です（r と同じ長さ）
     * @param from 開始インデックス（含む）です
     * @param to 終了インデックス（含まない）です
     */
    public void evaluate(double[] r, double[] out, int from, int to) {
        checkArgument(out.length == r.length, "out の長さが r と一致しません: %s != %s", out.length,
                r.length);
        for (int i = from; i < to; i++) {
            out[i] = valueAt(r[i]);
        }
    }

    /**
     * 正規化定数の自然対数を返します。
     *
     * <p>
     * {@code log norm = 1/2 * (3 log(2/n) + log (n-l-1)! - log 2n - log (n+l)!)}
     * </p>
     *
     * @param n 主量子数です
     * @param l 方位量子数です
     * @return 正規化定数の自然対数です
     */
    static double logNormalization(int n, int l) {
        double logRatio = CombinatoricsUtils.factorialLog(n - l - 1)
                - CombinatoricsUtils.factorialLog(n + l);
        return 0.5 * (3.0 * log(2.0 / n) + logRatio - log(2.0 * n));
    }
}
