package io.github.yok.orbital.core.grid;

import static com.google.common.base.Preconditions.checkNotNull;
import io.github.yok.orbital.core.exception.InvalidGridSpecException;
import io.github.yok.orbital.core.exception.InvalidGridSpecException.Violation;

/**
 * 格子指定 (extent, resolution) の制約を検査するクラスです。
 */
public final class GridSpecValidator {

    /**
     * 1 軸あたりの点数の上限です。
     *
     * <p>
     * {@code resolution^3} が Java 配列の長さに収まる最大値です。
     * </p>
     */
    public static final int MAX_RESOLUTION = 1290;

    private GridSpecValidator() {}

    /**
     * 格子指定を検査し、妥当であればそのまま返します。
     *
     * @param spec 格子指定です（null 不可）
     * @return 引数と同じインスタンスです
     * @throws InvalidGridSpecException 制約に違反した場合に発生します
     */
    public static GridSpec validate(GridSpec spec) {
        checkNotNull(spec, "spec は null 不可です");

        double extent = spec.getExtent();
        int resolution = spec.getResolution();

        if (!Double.isFinite(extent) || extent <= 0.0) {
            throw new InvalidGridSpecException(Violation.EXTENT, extent, resolution);
        }
        if (resolution < 2) {
            throw new InvalidGridSpecException(Violation.RESOLUTION, extent, resolution);
        }
        if (resolution > MAX_RESOLUTION) {
            throw new InvalidGridSpecException(Violation.POINT_COUNT, extent, resolution);
        }
        return spec;
    }
}
