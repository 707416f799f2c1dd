package io.github.yok.orbital.core.state;

import static com.google.common.base.Preconditions.checkNotNull;
import io.github.yok.orbital.core.exception.InvalidQuantumStateException;
import io.github.yok.orbital.core.exception.InvalidQuantumStateException.Violation;

/**
 * 量子数 (n, l, m) の制約を検査するクラスです。
 *
 * <p>
 * 制約は n, l, m の順に検査し、最初に違反したものを報告します。 副作用はありません。
 * </p>
 */
public final class QuantumStateValidator {

    private QuantumStateValidator() {}

    /**
     * 量子数の組を検査し、妥当であればそのまま返します。
     *
     * @param state 量子数の組です（null 不可）
     * @return 引数と同じインスタンスです
     * @throws InvalidQuantumStateException 制約に違反した場合に発生します
     */
    public static QuantumState validate(QuantumState state) {
        checkNotNull(state, "state は null 不可です");

        if (state.getN() < 1) {
            throw new InvalidQuantumStateException(Violation.PRINCIPAL, state);
        }
        if (state.getL() < 0 || state.getL() > state.getN() - 1) {
            throw new InvalidQuantumStateException(Violation.AZIMUTHAL, state);
        }
        if (state.getM() < -state.getL() || state.getM() > state.getL()) {
            throw new InvalidQuantumStateException(Violation.MAGNETIC, state);
        }
        return state;
    }

    /**
     * 量子数を検査し、妥当であれば量子数の組を返します。
     *
     * @param n 主量子数です
     * @param l 方位量子数です
     * @param m 磁気量子数です
     * @return 検証済みの量子数の組です
     * @throws InvalidQuantumStateException 制約に違反した場合に発生します
     */
    public static QuantumState validate(int n, int l, int m) {
        return validate(QuantumState.of(n, l, m));
    }
}
