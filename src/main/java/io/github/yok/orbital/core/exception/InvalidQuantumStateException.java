package io.github.yok.orbital.core.exception;

import io.github.yok.orbital.core.state.QuantumState;
import lombok.Getter;

/**
 * 量子数 (n, l, m) が量子力学的な制約を満たさない場合に送出される例外です。
 *
 * <p>
 * どの制約に違反したかを {@link #getViolation()} で取得できます。
 * </p>
 */
@Getter
public class InvalidQuantumStateException extends IllegalArgumentException {

    private static final long serialVersionUID = 1L;

    /**
     * 違反した制約です。
     */
    private final Violation violation;

    /**
     * 違反した量子数の組です。
     */
    private final transient QuantumState state;

    /**
     * 例外を生成します。
     *
     * @param violation 違反した制約です
     * @param state 違反した量子数の組です
     */
    public InvalidQuantumStateException(Violation violation, QuantumState state) {
        super("不正な量子状態です（" + violation.getDescription() + "）: n=" + state.getN() + ", l="
                + state.getL() + ", m=" + state.getM());
        this.violation = violation;
        this.state = state;
    }

    /**
     * 量子数の制約の種類です。
     */
    @Getter
    public enum Violation {

        /**
         * n は 1 以上です。
         */
        PRINCIPAL("n は 1 以上が必要です"),

        /**
         * l は 0 以上 n-1 以下です。
         */
        AZIMUTHAL("l は 0 以上 n-1 以下が必要です"),

        /**
         * m は -l 以上 l 以下です。
         */
        MAGNETIC("m は -l 以上 l 以下が必要です");

        /**
         * 制約の説明です。
         */
        private final String description;

        Violation(String description) {
            this.description = description;
        }
    }
}
