package io.github.yok.orbital.core.state;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import io.github.yok.orbital.core.exception.InvalidQuantumStateException;
import io.github.yok.orbital.core.exception.InvalidQuantumStateException.Violation;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

class QuantumStateValidatorTest {

    @Test
    @DisplayName("妥当な量子数はそのまま返る")
    void validStateIsReturnedUnchanged() {
        QuantumState state = QuantumState.of(3, 2, -2);
        assertSame(state, QuantumStateValidator.validate(state));
    }

    @ParameterizedTest(name = "n={0}, l={1}, m={2}")
    @CsvSource({"1, 0, 0", "2, 1, -1", "2, 1, 1", "4, 3, 3", "29, 28, -28", "30, 0, 0"})
    @DisplayName("制約の境界にある量子数は受け付ける")
    void boundaryStatesAreAccepted(int n, int l, int m) {
        QuantumState state = QuantumStateValidator.validate(n, l, m);
        assertEquals(n, state.getN());
        assertEquals(l, state.getL());
        assertEquals(m, state.getM());
    }

    @ParameterizedTest(name = "n={0}, l={1}, m={2} -> {3}")
    @CsvSource({"0, 0, 0, PRINCIPAL", "-3, 0, 0, PRINCIPAL", "1, 1, 0, AZIMUTHAL",
            "3, 3, 0, AZIMUTHAL", "2, -1, 0, AZIMUTHAL", "3, 2, 3, MAGNETIC", "3, 2, -3, MAGNETIC",
            "1, 0, 1, MAGNETIC", "2, 1, -2147483648, MAGNETIC"})
    @DisplayName("違反した制約が例外で識別される")
    void violationIsIdentified(int n, int l, int m, Violation expected) {
        InvalidQuantumStateException e = assertThrows(InvalidQuantumStateException.class,
                () -> QuantumStateValidator.validate(n, l, m));
        assertEquals(expected, e.getViolation());
        assertEquals(QuantumState.of(n, l, m), e.getState());
        assertTrue(e.getMessage().contains("n=" + n), e.getMessage());
    }

    @Test
    @DisplayName("n の違反は l や m の違反より先に報告される")
    void principalViolationIsReportedFirst() {
        InvalidQuantumStateException e = assertThrows(InvalidQuantumStateException.class,
                () -> QuantumStateValidator.validate(0, 5, 9));
        assertEquals(Violation.PRINCIPAL, e.getViolation());
    }

    @Test
    @DisplayName("例外は IllegalArgumentException として扱える")
    void exceptionIsIllegalArgument() {
        assertThrows(IllegalArgumentException.class, () -> QuantumStateValidator.validate(1, 1, 0));
    }

    @Test
    @DisplayName("量子状態のラベルは分光学的表記になる")
    void labels() {
        assertEquals("1s", QuantumState.of(1, 0, 0).label());
        assertEquals("2p(m=-1)", QuantumState.of(2, 1, -1).label());
        assertEquals("3d", QuantumState.of(3, 2, 1).subshellLabel());
    }
}
