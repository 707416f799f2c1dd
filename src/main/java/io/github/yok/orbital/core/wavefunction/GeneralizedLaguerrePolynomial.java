package io.github.yok.orbital.core.wavefunction;

import static com.google.common.base.Preconditions.checkArgument;
import lombok.Getter;

/**
 * 一般化ラゲール多項式 {@code L_k^(α)(x)} を評価するクラスです。
 *
 * <p>
 * 3 項漸化式
 * {@code (i+1) L_{i+1} = (2i + 1 + α - x) L_i - (i + α) L_{i-1}}（{@code L_0 = 1}, {@code L_1 = 1 + α - x}）
 * で評価します。 正規化は {@code L_k^(α)(0) = C(k + α, k)} となる標準形です。
 * </p>
 */
@Getter
public final class GeneralizedLaguerrePolynomial {

    /**
     * 次数 k です。
     */
    private final int degree;

    /**
     * パラメータ α です。
     */
    private final double alpha;

    /**
     * 一般化ラゲール多項式を生成します。
     *
     * @param degree 次数です（0 以上）
     * @param alpha パラメータです（-1 より大きい）
     * @throws IllegalArgumentException 引数が範囲外の場合に発生します
     */
    public GeneralizedLaguerrePolynomial(int degree, double alpha) {
        checkArgument(degree >= 0, "degree は 0 以上が必要です: %s", degree);
        checkArgument(alpha > -1.0, "alpha は -1 より大きい必要があります: %s", alpha);
        this.degree = degree;
        this.alpha = alpha;
    }

    /**
     * {@code L_k^(α)(x)} を返します。
     *
     * @param x 評価点です
     * @return 多項式の値です
     */
    public double valueAt(double x) {
        if (degree == 0) {
            return 1.0;
        }

        double previous = 1.0;
        double current = 1.0 + alpha - x;
        for (int i = 1; i < degree; i++) {
            double next = ((2 * i + 1 + alpha - x) * current - (i + alpha) * previous) / (i + 1);
            previous = current;
            current = next;
        }
        return current;
    }
}
