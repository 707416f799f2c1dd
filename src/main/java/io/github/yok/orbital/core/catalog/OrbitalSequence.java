package io.github.yok.orbital.core.catalog;

import io.github.yok.orbital.core.state.QuantumState;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 軌道を順に表示するための既定の並び（1s, 2s, 2p, 3s, 3p, 3d, 4s, 4p, 4d, 4f）です。
 *
 * <p>
 * 各副殻について m を -l から l まで並べます（計 30 状態）。 表示用の並びであり、構成原理によるエネルギー順（4s が 3d より先）とは異なります。
 * </p>
 */
public final class OrbitalSequence {

    /**
     * 副殻 (n, l) の並びです。
     */
    private static final int[][] SUBSHELLS = {{1, 0}, {2, 0}, {2, 1}, {3, 0}, {3, 1}, {3, 2},
            {4, 0}, {4, 1}, {4, 2}, {4, 3}};

    /**
     * 既定の並びです。
     */
    private static final List<QuantumState> DEFAULT = Collections.unmodifiableList(build());

    private OrbitalSequence() {}

    /**
     * 既定の並びを返します。
     *
     * @return 変更不可の量子状態のリストです
     */
    public static List<QuantumState> defaultSequence() {
        return DEFAULT;
    }

    /**
     * 副殻の並びを m まで展開します。
     *
     * @return 量子状態のリストです
     */
    private static List<QuantumState> build() {
        List<QuantumState> states = new ArrayList<>();
        for (int[] subshell : SUBSHELLS) {
            int n = subshell[0];
            int l = subshell[1];
            for (int m = -l; m <= l; m++) {
                states.add(QuantumState.of(n, l, m));
            }
        }
        return states;
    }
}
