package io.github.yok.orbital.core.wavefunction;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;
import static org.apache.commons.math3.util.FastMath.PI;
import static org.apache.commons.math3.util.FastMath.cos;
import static org.apache.commons.math3.util.FastMath.sin;
import static org.apache.commons.math3.util.FastMath.sqrt;
import lombok.Getter;
import org.ejml.data.Complex_F64;

/**
 * 複素球面調和関数 {@code Y_l^m(θ, φ)} を評価するクラスです。
 *
 * <p>
 * 物理学の規約に従います（球面上で正規直交、Condon–Shortley 位相を含む）。
 * </p>
 *
 * <pre>
 *   Y_l^m(θ, φ) = s * P̄_l^|m|(cos θ) * exp(i m φ)
 * </pre>
 *
 * <p>
 * P̄ は {@code (-1)^|m|} を含む正規化ルジャンドル陪関数、s は m が負かつ |m| が奇数のとき -1、それ以外は 1 です （すなわち
 * {@code Y_l^-m = (-1)^m conj(Y_l^m)}）。 P̄ は {@code P̄_|m|^|m|} から l 方向への漸化式で求め、漸化式の係数は (l, m)
 * ごとに 1 回だけ前計算します。
 * </p>
 */
@Getter
public final class SphericalHarmonic {

    /**
     * 方位量子数 l です。
     */
    private final int l;

    /**
     * 磁気量子数 m です。
     */
    private final int m;

    /**
     * |m| です。
     */
    private final int absM;

    /**
     * {@code P̄_|m|^|m|} の係数 {@code (-1)^|m| sqrt((2|m|+1)/(4π) Π (2i-1)/(2i))} に、負の m の符号 s を掛けた値です。
     */
    private final double seed;

    /**
     * 漸化式の係数 {@code sqrt((4k^2 - 1)/(k^2 - m^2))}（k = |m|+1 .. l）です。
     *
     * <p>
     * k = |m|+1 の要素は {@code sqrt(2|m| + 3)} に一致します。
     * </p>
     */
    private final double[] recurrence;

    /**
     * 球面調和関数を生成します（係数の前計算を含む）。
     *
     * @param l 方位量子数です（検証済み）
     * @param m 磁気量子数です（検証済み）
     * @throws IllegalArgumentException {@code l < 0} または {@code |m| > l} の場合に発生します
     */
    public SphericalHarmonic(int l, int m) {
        checkArgument(l >= 0 && m >= -l && m <= l, "(l, m) が不正です: l=%s, m=%s", l, m);
        this.l = l;
        this.m = m;
        this.absM = Math.abs(m);

        double product = 1.0;
        for (int i = 1; i <= absM; i++) {
            product *= (2.0 * i - 1.0) / (2.0 * i);
        }
        double value = sqrt((2.0 * absM + 1.0) * product / (4.0 * PI));
        if ((absM & 1) == 1) {
            value = -value;
        }
        if (m < 0 && (absM & 1) == 1) {
            value = -value;
        }
        this.seed = value;

        this.recurrence = new double[Math.max(0, l - absM)];
        for (int k = absM + 1; k <= l; k++) {
            double kk = (double) k * k;
            recurrence[k - absM - 1] = sqrt((4.0 * kk - 1.0) / (kk - (double) absM * absM));
        }
    }

    /**
     * 偏角の関数 {@code s * P̄_l^|m|(cos θ)} を返します（実数部分）。
     *
     * @param theta 極角 θ です
     * @return 実数の振幅です
     */
    public double amplitudeAt(double theta) {
        double x = cos(theta);
        double sinTheta = sin(theta);

        double pmm = seed;
        for (int i = 0; i < absM; i++) {
            pmm *= sinTheta;
        }
        if (l == absM) {
            return pmm;
        }

        double pmmp1 = x * recurrence[0] * pmm;
        double oldFactor = recurrence[0];
        for (int k = absM + 2; k <= l; k++) {
            double factor = recurrence[k - absM - 1];
            double pll = (x * pmmp1 - pmm / oldFactor) * factor;
            oldFactor = factor;
            pmm = pmmp1;
            pmmp1 = pll;
        }
        return pmmp1;
    }

    /**
     * {@code Y_l^m(θ, φ)} を返します。
     *
     * @param theta 極角 θ です
     * @param phi 方位角 φ です
     * @return 複素数値です
     */
    public Complex_F64 valueAt(double theta, double phi) {
        double amplitude = amplitudeAt(theta);
        return new Complex_F64(amplitude * cos(m * phi), amplitude * sin(m * phi));
    }

    /**
     * 角度の配列に対して要素ごとに {@code Y_l^m} を評価し、実部と虚部を別々の配列で返します。
     *
     * @param theta 極角の配列です（null 不可）
     * @param phi 方位角の配列です（null 不可、theta と同じ長さ）
     * @return {@code [実部, 虚部]} です
     */
    public double[][] evaluate(double[] theta, double[] phi) {
        checkNotNull(theta, "theta は null 不可です");
        checkNotNull(phi, "phi は null 不可です");
        double[] re = new double[theta.length];
        double[] im = new double[theta.length];
        evaluate(theta, phi, re, im, 0, theta.length);
        return new double[][] {re, im};
    }

    /**
     * 角度の配列の区間 {@code [from, to)} を評価し、実部・虚部の出力配列の同じ位置に書き込みます。
     *
     * @param theta 極角の配列です
     * @param phi 方位角の配列です
     * @param re 実部の出力先です
     * @param im 虚部の出力先です
     * @param from 開始インデックス（含む）です
     * @param to 終了インデックス（含まない）です
     */
    public void evaluate(double[] theta, double[] phi, double[] re, double[] im, int from,
            int to) {
        checkArgument(
                phi.length == theta.length && re.length == theta.length
                        && im.length == theta.length,
                "配列長が一致しません: theta=%s, phi=%s, re=%s, im=%s", theta.length, phi.length,
                re.length, im.length);

        for (int i = from; i < to; i++) {
            double amplitude = amplitudeAt(theta[i]);
            if (m == 0) {
                re[i] = amplitude;
                im[i] = 0.0;
            } else {
                double angle = m * phi[i];
                re[i] = amplitude * cos(angle);
                im[i] = amplitude * sin(angle);
            }
        }
    }
}
