package io.github.yok.orbital.core.catalog;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * 量子数を分光学的表記（1s, 2p, 3d, ...）に変換するユーティリティです。
 *
 * <p>
 * l の記号は s, p, d, f の後はアルファベット順（j と、既出の p, s を除く）です。 記号表を超える l は {@code [l=21]} のように表記します。
 * </p>
 */
public final class OrbitalLabel {

    /**
     * l = 0, 1, 2, ... に対応する記号です。
     */
    private static final String LETTERS = "spdfghiklmnoqrtuvwxyz";

    private OrbitalLabel() {}

    /**
     * l の記号を返します。
     *
     * @param l 方位量子数です（0 以上）
     * @return 記号です
     * @throws IllegalArgumentException l が負の場合に発生します
     */
    public static String letter(int l) {
        checkArgument(l >= 0, "l は 0 以上が必要です: %s", l);
        if (l < LETTERS.length()) {
            return String.valueOf(LETTERS.charAt(l));
        }
        return "[l=" + l + "]";
    }

    /**
     * 記号から l を返します。
     *
     * @param letter 記号です（大文字小文字を区別しません）
     * @return 方位量子数です
     * @throws IllegalArgumentException 記号表にない文字の場合に発生します
     */
    public static int azimuthalOf(char letter) {
        int l = LETTERS.indexOf(Character.toLowerCase(letter));
        checkArgument(l >= 0, "副殻の記号が不正です: %s", letter);
        return l;
    }

    /**
     * 副殻の表記（例: {@code 2p}）を返します。
     *
     * @param n 主量子数です
     * @param l 方位量子数です
     * @return 副殻の表記です
     */
    public static String subshell(int n, int l) {
        return n + letter(l);
    }

    /**
     * m を含めた軌道の表記を返します。 {@code l = 0} の場合は m を省略します（例: {@code 1s}, {@code 3d(m=-1)}）。
     *
     * @param n 主量子数です
     * @param l 方位量子数です
     * @param m 磁気量子数です
     * @return 軌道の表記です
     */
    public static String orbital(int n, int l, int m) {
        if (l == 0 && m == 0) {
            return subshell(n, l);
        }
        return subshell(n, l) + "(m=" + m + ")";
    }
}
