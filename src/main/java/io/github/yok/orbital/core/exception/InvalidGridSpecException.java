package io.github.yok.orbital.core.exception;

import lombok.Getter;

/**
 * サンプリング格子の指定（範囲と分割数）が不正な場合に送出される例外です。
 */
@Getter
public class InvalidGridSpecException extends IllegalArgumentException {

    private static final long serialVersionUID = 1L;

    /**
     * 違反した制約です。
     */
    private final Violation violation;

    /**
     * 例外を生成します。
     *
     * @param violation 違反した制約です
     * @param extent 指定された範囲です
     * @param resolution 指定された 1 軸あたりの点数です
     */
    public InvalidGridSpecException(Violation violation, double extent, int resolution) {
        super("不正な格子指定です（" + violation.getDescription() + "）: extent=" + extent
                + ", resolution=" + resolution);
        this.violation = violation;
    }

    /**
     * 格子指定の制約の種類です。
     */
    @Getter
    public enum Violation {

        /**
         * extent は 0 より大きい有限値です。
         */
        EXTENT("extent は 0 より大きい有限値が必要です"),

        /**
         * resolution は 2 以上です。
         */
        RESOLUTION("resolution は 2 以上が必要です"),

        /**
         * resolution^3 は 1 つの配列に収まる必要があります。
         */
        POINT_COUNT("resolution^3 が配列長の上限を超えています");

        /**
         * 制約の説明です。
         */
        private final String description;

        Violation(String description) {
            this.description = description;
        }
    }
}
