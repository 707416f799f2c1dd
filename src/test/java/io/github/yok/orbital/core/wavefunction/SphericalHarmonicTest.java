package io.github.yok.orbital.core.wavefunction;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import org.ejml.data.Complex_F64;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class SphericalHarmonicTest {

    private static final double TOL = 1e-13;

    private static final double[] THETAS = {0.0, 0.1, 0.7, Math.PI / 3, Math.PI / 2, 2.2, 3.0,
            Math.PI};

    private static final double[] PHIS = {-Math.PI + 1e-9, -2.0, -0.4, 0.0, 0.9, 2.5, Math.PI};

    @Nested
    @DisplayName("閉じた式との比較（Condon–Shortley 位相を含む）")
    class ClosedForms {

        @Test
        @DisplayName("Y_0^0 = 1 / (2√π)")
        void y00() {
            assertAll(new SphericalHarmonic(0, 0), (t, p) -> new Complex_F64(
                    0.5 / Math.sqrt(Math.PI), 0.0));
        }

        @Test
        @DisplayName("Y_1^0 = √(3/4π) cos θ")
        void y10() {
            assertAll(new SphericalHarmonic(1, 0),
                    (t, p) -> new Complex_F64(Math.sqrt(3.0 / (4.0 * Math.PI)) * Math.cos(t), 0.0));
        }

        @Test
        @DisplayName("Y_1^1 = -√(3/8π) sin θ e^{iφ}")
        void y11() {
            assertAll(new SphericalHarmonic(1, 1), (t, p) -> polar(
                    -Math.sqrt(3.0 / (8.0 * Math.PI)) * Math.sin(t), p));
        }

        @Test
        @DisplayName("Y_1^-1 = √(3/8π) sin θ e^{-iφ}")
        void y1m1() {
            assertAll(new SphericalHarmonic(1, -1), (t, p) -> polar(
                    Math.sqrt(3.0 / (8.0 * Math.PI)) * Math.sin(t), -p));
        }

        @Test
        @DisplayName("Y_2^0 = (1/4)√(5/π) (3cos²θ - 1)")
        void y20() {
            assertAll(new SphericalHarmonic(2, 0), (t, p) -> new Complex_F64(
                    0.25 * Math.sqrt(5.0 / Math.PI) * (3.0 * Math.cos(t) * Math.cos(t) - 1.0),
                    0.0));
        }

        @Test
        @DisplayName("Y_2^1 = -(1/2)√(15/2π) sin θ cos θ e^{iφ}")
        void y21() {
            assertAll(new SphericalHarmonic(2, 1), (t, p) -> polar(
                    -0.5 * Math.sqrt(15.0 / (2.0 * Math.PI)) * Math.sin(t) * Math.cos(t), p));
        }

        @Test
        @DisplayName("Y_2^±2 = (1/4)√(15/2π) sin²θ e^{±2iφ}")
        void y2pm2() {
            double c = 0.25 * Math.sqrt(15.0 / (2.0 * Math.PI));
            assertAll(new SphericalHarmonic(2, 2),
                    (t, p) -> polar(c * Math.sin(t) * Math.sin(t), 2.0 * p));
            assertAll(new SphericalHarmonic(2, -2),
                    (t, p) -> polar(c * Math.sin(t) * Math.sin(t), -2.0 * p));
        }

        @Test
        @DisplayName("Y_3^-3 = (1/8)√(35/π) sin³θ e^{-3iφ}")
        void y3m3() {
            double c = 0.125 * Math.sqrt(35.0 / Math.PI);
            assertAll(new SphericalHarmonic(3, -3),
                    (t, p) -> polar(c * Math.pow(Math.sin(t), 3), -3.0 * p));
        }
    }

    @Nested
    @DisplayName("恒等式")
    class Identities {

        @Test
        @DisplayName("Y_l^-m = (-1)^m conj(Y_l^m)")
        void conjugateSymmetry() {
            for (int l = 0; l <= 12; l++) {
                for (int m = 1; m <= l; m++) {
                    SphericalHarmonic plus = new SphericalHarmonic(l, m);
                    SphericalHarmonic minus = new SphericalHarmonic(l, -m);
                    double sign = (m % 2 == 0) ? 1.0 : -1.0;
                    for (double t : THETAS) {
                        for (double p : PHIS) {
                            Complex_F64 a = plus.valueAt(t, p);
                            Complex_F64 b = minus.valueAt(t, p);
                            assertEquals(sign * a.getReal(), b.getReal(), 1e-12);
                            assertEquals(-sign * a.getImaginary(), b.getImaginary(), 1e-12);
                        }
                    }
                }
            }
        }

        @Test
        @DisplayName("Σ_m |Y_l^m|^2 = (2l+1)/(4π)（l=28 まで）")
        void additionTheorem() {
            for (int l = 0; l <= 28; l++) {
                SphericalHarmonic[] ys = new SphericalHarmonic[2 * l + 1];
                for (int m = -l; m <= l; m++) {
                    ys[m + l] = new SphericalHarmonic(l, m);
                }
                double expected = (2.0 * l + 1.0) / (4.0 * Math.PI);
                for (double t : THETAS) {
                    double sum = 0.0;
                    for (SphericalHarmonic y : ys) {
                        sum += y.valueAt(t, 0.3).getMagnitude2();
                    }
                    assertEquals(expected, sum, expected * 1e-10, "l=" + l + " θ=" + t);
                }
            }
        }

        @Test
        @DisplayName("球面上の積分 ∫|Y_l^m|^2 dΩ = 1")
        void unitNormOnSphere() {
            int steps = 2000;
            double h = Math.PI / steps;
            int[][] cases = {{0, 0}, {1, 1}, {3, -2}, {6, 4}, {10, -10}};
            for (int[] c : cases) {
                SphericalHarmonic y = new SphericalHarmonic(c[0], c[1]);
                double sum = 0.0;
                for (int i = 1; i < steps; i++) {
                    double t = i * h;
                    double a = y.amplitudeAt(t);
                    sum += a * a * Math.sin(t);
                }
                // |Y|^2 は φ に依存しないため φ 方向は 2π
                assertEquals(1.0, 2.0 * Math.PI * sum * h, 1e-5, "l=" + c[0] + " m=" + c[1]);
            }
        }
    }

    @Test
    @DisplayName("配列評価はスカラー評価と一致する")
    void arrayEvaluationMatchesScalar() {
        SphericalHarmonic y = new SphericalHarmonic(4, -3);
        double[] theta = {0.2, 1.0, 1.7, 2.9};
        double[] phi = {-3.0, -0.5, 0.5, 3.0};
        double[][] out = y.evaluate(theta, phi);
        for (int i = 0; i < theta.length; i++) {
            Complex_F64 expected = y.valueAt(theta[i], phi[i]);
            assertEquals(expected.getReal(), out[0][i], TOL);
            assertEquals(expected.getImaginary(), out[1][i], TOL);
        }
    }

    @Test
    @DisplayName("|m| > l は拒否する")
    void rejectsInvalidOrder() {
        assertThrows(IllegalArgumentException.class, () -> new SphericalHarmonic(2, 3));
        assertThrows(IllegalArgumentException.class, () -> new SphericalHarmonic(-1, 0));
    }

    private interface Expected {
        Complex_F64 at(double theta, double phi);
    }

    private static Complex_F64 polar(double amplitude, double angle) {
        return new Complex_F64(amplitude * Math.cos(angle), amplitude * Math.sin(angle));
    }

    private static void assertAll(SphericalHarmonic y, Expected expected) {
        for (double t : THETAS) {
            for (double p : PHIS) {
                Complex_F64 e = expected.at(t, p);
                Complex_F64 a = y.valueAt(t, p);
                assertEquals(e.getReal(), a.getReal(), TOL, "θ=" + t + " φ=" + p);
                assertEquals(e.getImaginary(), a.getImaginary(), TOL, "θ=" + t + " φ=" + p);
            }
        }
    }
}
