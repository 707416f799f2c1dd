package io.github.yok.orbital.core.density;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;
import io.github.yok.orbital.core.grid.SpatialGrid;
import io.github.yok.orbital.core.state.QuantumState;
import io.github.yok.orbital.core.wavefunction.RadialWavefunction;
import io.github.yok.orbital.core.wavefunction.SphericalHarmonic;
import java.util.stream.IntStream;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

/**
 * 動径波動関数と球面調和関数を合成し、確率密度場を作るクラスです。
 *
 * <p>
 * 処理は次の順です。
 * </p>
 * <ol>
 * <li>{@code R = R(n, l, r)}</li>
 * <li>{@code Y = Y_l^m(θ, φ)}</li>
 * <li>{@code ψ = R * Y}（複素数）</li>
 * <li>{@code density = |ψ|^2}</li>
 * <li>可視化マスクで隠す格子点の密度を 0 にする（物理量の計算とは分離した後処理）</li>
 * </ol>
 *
 * <p>
 * 配列は {@code chunkSize} 要素ずつの区間に分けて評価します。 {@code parallel=true} の場合は区間を共通 ForkJoinPool
 * で並列に評価します。各要素は独立に計算されるため、並列・逐次で結果は一致します。
 * </p>
 */
@Getter
@Slf4j
public final class DensityCompositor {

    /**
     * 区間の既定の要素数です。
     */
    public static final int DEFAULT_CHUNK_SIZE = 1 << 14;

    /**
     * 密度計算後に適用する可視化マスクです。
     */
    private final VisibilityMask mask;

    /**
     * 区間を並列に評価するかどうかです。
     */
    private final boolean parallel;

    /**
     * 1 区間あたりの要素数です。
     */
    private final int chunkSize;

    /**
     * 合成処理を生成します。
     *
     * @param mask 可視化マスクです（null 不可）
     * @param parallel 区間を並列に評価するかどうかです
     * @param chunkSize 1 区間あたりの要素数です（1 以上）
     * @throws IllegalArgumentException 引数が不正な場合に発生します
     */
    public DensityCompositor(VisibilityMask mask, boolean parallel, int chunkSize) {
        this.mask = checkNotNull(mask, "mask は null 不可です");
        checkArgument(chunkSize > 0, "chunkSize は 1 以上が必要です: %s", chunkSize);
        this.parallel = parallel;
        this.chunkSize = chunkSize;
    }

    /**
     * X >= 0 の半空間を隠す逐次評価の合成処理を生成します。
     *
     * @return 合成処理です
     */
    public static DensityCompositor withHalfSpaceCutaway() {
        return new DensityCompositor(HalfSpaceCutawayMask.INSTANCE, false, DEFAULT_CHUNK_SIZE);
    }

    /**
     * マスク適用後の密度場を返します。
     *
     * @param state 検証済みの量子数の組です
     * @param grid 空間格子です
     * @return 密度場です
     */
    public DensityField compose(QuantumState state, SpatialGrid grid) {
        double[] density = probabilityDensity(state, grid);
        int hidden = applyMask(grid, density);
        log.debug("可視化マスクを適用しました。状態={}、マスク点数={} / {}", state.label(), hidden,
                density.length);
        return new DensityField(grid.getResolution(), density);
    }

    /**
     * マスクを適用しない物理的な確率密度 |ψ|^2 を返します。
     *
     * @param state 検証済みの量子数の組です（null 不可）
     * @param grid 空間格子です（null 不可）
     * @return 格子と同じインデックスの密度配列です
     */
    public double[] probabilityDensity(QuantumState state, SpatialGrid grid) {
        checkNotNull(state, "state は null 不可です");
        checkNotNull(grid, "grid は null 不可です");

        long t0 = System.nanoTime();

        RadialWavefunction radial = new RadialWavefunction(state.getN(), state.getL());
        SphericalHarmonic angular = new SphericalHarmonic(state.getL(), state.getM());

        double[] r = grid.r();
        double[] theta = grid.theta();
        double[] phi = grid.phi();
        int size = r.length;

        double[] radialValues = new double[size];
        double[] angularRe = new double[size];
        double[] angularIm = new double[size];
        double[] density = new double[size];

        int chunks = (int) ((size + (long) chunkSize - 1) / chunkSize);
        IntStream range = IntStream.range(0, chunks);
        if (parallel) {
            range = range.parallel();
        }
        range.forEach(c -> {
            int from = c * chunkSize;
            int to = (int) Math.min(size, (long) from + chunkSize);

            // 1) 動径部分、2) 角度部分
            radial.evaluate(r, radialValues, from, to);
            angular.evaluate(theta, phi, angularRe, angularIm, from, to);

            // 3) ψ = R * Y、4) |ψ|^2
            for (int i = from; i < to; i++) {
                double psiRe = radialValues[i] * angularRe[i];
                double psiIm = radialValues[i] * angularIm[i];
                density[i] = psiRe * psiRe + psiIm * psiIm;
            }
        });

        log.debug("確率密度を計算しました。状態={}、点数={}、区間数={}、並列={}、所要時間={}ms", state.label(), size,
                chunks, parallel, (System.nanoTime() - t0) / 1_000_000L);
        return density;
    }

    /**
     * 可視化マスクで隠す格子点の密度を 0 にします。
     *
     * @param grid 空間格子です
     * @param density 密度配列です（上書きします）
     * @return 0 にした格子点の数です
     */
    private int applyMask(SpatialGrid grid, double[] density) {
        int hidden = 0;
        for (int i = 0; i < density.length; i++) {
            if (mask.hides(grid, i)) {
                density[i] = 0.0;
                hidden++;
            }
        }
        return hidden;
    }
}
