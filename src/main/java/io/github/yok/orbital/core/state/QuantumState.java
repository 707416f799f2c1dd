package io.github.yok.orbital.core.state;

import io.github.yok.orbital.core.catalog.OrbitalLabel;
import lombok.Value;

/**
 * 水素様原子の束縛状態を表す量子数の組 (n, l, m) です。
 *
 * <p>
 * 値オブジェクトとして扱い、等価性とハッシュ値は 3 つの量子数のみで決まります。 量子数の制約（{@code n >= 1}, {@code 0 <= l <= n-1},
 * {@code -l <= m <= l}）はここでは検査しません。 波動関数の評価前に {@link QuantumStateValidator} を通してください。
 * </p>
 */
@Value
public class QuantumState {

    /**
     * 主量子数 n です。
     */
    int n;

    /**
     * 方位量子数 l です。
     */
    int l;

    /**
     * 磁気量子数 m です。
     */
    int m;

    /**
     * 量子数の組を生成します。
     *
     * @param n 主量子数です
     * @param l 方位量子数です
     * @param m 磁気量子数です
     * @return 量子数の組です（未検証）
     */
    public static QuantumState of(int n, int l, int m) {
        return new QuantumState(n, l, m);
    }

    /**
     * 分光学的表記（例: {@code 2p}）を返します。
     *
     * @return 副殻ラベルです
     */
    public String subshellLabel() {
        return OrbitalLabel.subshell(n, l);
    }

    /**
     * m を含めた表記（例: {@code 3d(m=-1)}）を返します。
     *
     * @return 軌道ラベルです
     */
    public String label() {
        return OrbitalLabel.orbital(n, l, m);
    }
}
