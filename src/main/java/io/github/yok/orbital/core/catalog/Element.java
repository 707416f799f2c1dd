package io.github.yok.orbital.core.catalog;

import java.util.Locale;
import lombok.Getter;

/**
 * 水素からネオンまでの基底状態の電子配置です。
 */
@Getter
public enum Element {

    HYDROGEN("Hydrogen", "1s1"),
    HELIUM("Helium", "1s2"),
    LITHIUM("Lithium", "1s2 2s1"),
    BERYLLIUM("Beryllium", "1s2 2s2"),
    BORON("Boron", "1s2 2s2 2p1"),
    CARBON("Carbon", "1s2 2s2 2p2"),
    NITROGEN("Nitrogen", "1s2 2s2 2p3"),
    OXYGEN("Oxygen", "1s2 2s2 2p4"),
    FLUORINE("Fluorine", "1s2 2s2 2p5"),
    NEON("Neon", "1s2 2s2 2p6");

    /**
     * 表示名です。
     */
    private final String displayName;

    /**
     * 電子配置です。
     */
    private final ElectronConfiguration configuration;

    Element(String displayName, String notation) {
        this.displayName = displayName;
        this.configuration = ElectronConfiguration.parse(notation);
    }

    /**
     * 原子番号（= 総電子数）を返します。
     *
     * @return 原子番号です
     */
    public int atomicNumber() {
        return ordinal() + 1;
    }

    /**
     * 表示名から元素を返します（前後の空白を除き、大文字小文字を区別しません）。
     *
     * @param name 元素名です（例: {@code Carbon}）
     * @return 元素です
     * @throws IllegalArgumentException 該当する元素がない場合に発生します
     */
    public static Element fromName(String name) {
        if (name != null) {
            String key = name.trim().toLowerCase(Locale.ROOT);
            for (Element e : values()) {
                if (e.displayName.toLowerCase(Locale.ROOT).equals(key)) {
                    return e;
                }
            }
        }
        throw new IllegalArgumentException("対応していない元素です: " + name);
    }
}
