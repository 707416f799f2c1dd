package io.github.yok.orbital.out;

import static com.google.common.base.Preconditions.checkArgument;
import lombok.Value;

/**
 * 等値面の表示しきい値（最大密度に対する百分率）です。
 *
 * <p>
 * {@code isoValue = percent / 100 * maxValue} です。 表示側の設定であり、密度の計算には関与しません。
 * </p>
 */
@Value
public class IsosurfaceLevel {

    /**
     * 百分率（1 以上 100 以下）です。
     */
    int percent;

    /**
     * しきい値を生成します。
     *
     * @param percent 百分率です（1 以上 100 以下）
     * @return しきい値です
     * @throws IllegalArgumentException 範囲外の場合に発生します
     */
    public static IsosurfaceLevel ofPercent(int percent) {
        checkArgument(percent >= 1 && percent <= 100, "等値面の百分率は 1 以上 100 以下が必要です: %s",
                percent);
        return new IsosurfaceLevel(percent);
    }

    /**
     * 最大密度に対するしきい値を返します。
     *
     * @param maxValue 最大密度です
     * @return しきい値です
     */
    public double isoValue(double maxValue) {
        return percent / 100.0 * maxValue;
    }
}
