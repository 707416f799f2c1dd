package io.github.yok.orbital.core.wavefunction;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import org.apache.commons.math3.util.CombinatoricsUtils;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class GeneralizedLaguerrePolynomialTest {

    @Test
    @DisplayName("低次の多項式は閉じた式に一致する")
    void lowDegreesMatchClosedForm() {
        double alpha = 3.0;
        for (double x = 0.0; x <= 12.0; x += 0.75) {
            assertEquals(1.0, new GeneralizedLaguerrePolynomial(0, alpha).valueAt(x));
            assertEquals(1.0 + alpha - x, new GeneralizedLaguerrePolynomial(1, alpha).valueAt(x),
                    1e-12);
            double l2 = x * x / 2.0 - (alpha + 2.0) * x + (alpha + 2.0) * (alpha + 1.0) / 2.0;
            assertEquals(l2, new GeneralizedLaguerrePolynomial(2, alpha).valueAt(x), 1e-12);
        }
    }

    @Test
    @DisplayName("x=0 での値は二項係数 C(k+α, k) になる")
    void valueAtZeroIsBinomial() {
        for (int k = 0; k <= 20; k++) {
            int alpha = 5;
            double expected = CombinatoricsUtils.binomialCoefficientDouble(k + alpha, k);
            assertEquals(expected, new GeneralizedLaguerrePolynomial(k, alpha).valueAt(0.0),
                    expected * 1e-12);
        }
    }

    @Test
    @DisplayName("2s の動径部分に現れる L_1^1(ρ) = 2 - ρ")
    void hydrogen2sPolynomial() {
        GeneralizedLaguerrePolynomial p = new GeneralizedLaguerrePolynomial(1, 1);
        assertEquals(0.0, p.valueAt(2.0));
        assertEquals(2.0, p.valueAt(0.0));
    }

    @Test
    @DisplayName("高次でも有限値を返す")
    void highDegreeStaysFinite() {
        GeneralizedLaguerrePolynomial p = new GeneralizedLaguerrePolynomial(28, 1);
        for (double x = 0.0; x < 2000.0; x += 13.7) {
            assertEquals(true, Double.isFinite(p.valueAt(x)), "x=" + x);
        }
    }

    @Test
    @DisplayName("不正な次数・パラメータは拒否する")
    void rejectsInvalidArguments() {
        assertThrows(IllegalArgumentException.class, () -> new GeneralizedLaguerrePolynomial(-1, 1));
        assertThrows(IllegalArgumentException.class, () -> new GeneralizedLaguerrePolynomial(2, -1));
    }
}
