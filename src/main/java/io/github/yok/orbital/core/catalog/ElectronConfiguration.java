package io.github.yok.orbital.core.catalog;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;
import io.github.yok.orbital.core.state.QuantumState;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import lombok.Value;

/**
 * 電子配置（例: {@code 1s2 2s2 2p3}）を表すクラスです。
 *
 * <p>
 * 各項は「主量子数 + 副殻記号 + 電子数」で、空白で区切ります。 電子数は 1 以上 {@code 2(2l+1)} 以下です。
 * </p>
 */
@Value
public class ElectronConfiguration {

    private static final Pattern TERM = Pattern.compile("(\\d+)([a-zA-Z])(\\d+)");

    /**
     * 副殻の並び（記述順）です。
     */
    List<Subshell> subshells;

    /**
     * 電子配置の文字列を解析します。
     *
     * @param notation 電子配置の文字列です（null 不可）
     * @return 電子配置です
     * @throws IllegalArgumentException 書式または量子数が不正な場合に発生します
     */
    public static ElectronConfiguration parse(String notation) {
        checkNotNull(notation, "notation は null 不可です");
        String trimmed = notation.trim();
        checkArgument(!trimmed.isEmpty(), "電子配置が空です");

        List<Subshell> subshells = new ArrayList<>();
        for (String token : trimmed.split("\\s+")) {
            Matcher matcher = TERM.matcher(token);
            checkArgument(matcher.matches(), "電子配置の項が不正です: %s", token);

            int n = Integer.parseInt(matcher.group(1));
            int l = OrbitalLabel.azimuthalOf(matcher.group(2).charAt(0));
            int electrons = Integer.parseInt(matcher.group(3));

            checkArgument(n >= 1 && l <= n - 1, "副殻 %s は存在しません（l は n-1 以下）", token);
            checkArgument(electrons >= 1 && electrons <= 2 * (2 * l + 1),
                    "副殻 %s の電子数は 1 以上 %s 以下が必要です", token, 2 * (2 * l + 1));

            subshells.add(new Subshell(n, l, electrons));
        }
        return new ElectronConfiguration(Collections.unmodifiableList(subshells));
    }

    /**
     * 総電子数を返します。
     *
     * @return 総電子数です
     */
    public int totalElectrons() {
        int total = 0;
        for (Subshell s : subshells) {
            total += s.getElectrons();
        }
        return total;
    }

    /**
     * 占有されている副殻の全軌道（m = -l .. l）を記述順に返します。
     *
     * @return 量子状態のリストです
     */
    public List<QuantumState> occupiedStates() {
        List<QuantumState> states = new ArrayList<>();
        for (Subshell s : subshells) {
            for (int m = -s.getL(); m <= s.getL(); m++) {
                states.add(QuantumState.of(s.getN(), s.getL(), m));
            }
        }
        return states;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        for (Subshell s : subshells) {
            if (sb.length() > 0) {
                sb.append(' ');
            }
            sb.append(s.label()).append(s.getElectrons());
        }
        return sb.toString();
    }

    /**
     * 副殻 (n, l) とその電子数です。
     */
    @Value
    public static class Subshell {

        int n;

        int l;

        int electrons;

        /**
         * 副殻の表記（例: {@code 2p}）を返します。
         *
         * @return 副殻の表記です
         */
        public String label() {
            return OrbitalLabel.subshell(n, l);
        }
    }
}
