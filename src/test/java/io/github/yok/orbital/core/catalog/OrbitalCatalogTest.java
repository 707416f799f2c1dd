package io.github.yok.orbital.core.catalog;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import io.github.yok.orbital.core.state.QuantumState;
import io.github.yok.orbital.core.state.QuantumStateValidator;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class OrbitalCatalogTest {

    @Nested
    @DisplayName("分光学的表記")
    class Labels {

        @Test
        @DisplayName("l=0..3 は s, p, d, f")
        void lowLetters() {
            assertEquals("s", OrbitalLabel.letter(0));
            assertEquals("p", OrbitalLabel.letter(1));
            assertEquals("d", OrbitalLabel.letter(2));
            assertEquals("f", OrbitalLabel.letter(3));
            assertEquals("g", OrbitalLabel.letter(4));
        }

        @Test
        @DisplayName("記号の表を超える l は数値で表す")
        void beyondTable() {
            assertEquals("[l=28]", OrbitalLabel.letter(28));
            assertEquals("29[l=28](m=-3)", OrbitalLabel.orbital(29, 28, -3));
        }

        @Test
        @DisplayName("記号から l に戻せる（大文字も可）")
        void azimuthalFromLetter() {
            assertEquals(0, OrbitalLabel.azimuthalOf('s'));
            assertEquals(2, OrbitalLabel.azimuthalOf('D'));
            assertThrows(IllegalArgumentException.class, () -> OrbitalLabel.azimuthalOf('j'));
        }

        @Test
        @DisplayName("s 軌道の m=0 は m を省略する")
        void orbitalLabels() {
            assertEquals("1s", OrbitalLabel.orbital(1, 0, 0));
            assertEquals("2p(m=0)", OrbitalLabel.orbital(2, 1, 0));
            assertEquals("4f(m=3)", OrbitalLabel.orbital(4, 3, 3));
        }
    }

    @Nested
    @DisplayName("既定の軌道列")
    class Sequence {

        @Test
        @DisplayName("1s から 4f までの 30 状態で、すべて妥当かつ重複しない")
        void thirtyDistinctValidStates() {
            List<QuantumState> states = OrbitalSequence.defaultSequence();
            assertEquals(30, states.size());
            assertEquals(30, new HashSet<>(states).size());
            for (QuantumState s : states) {
                QuantumStateValidator.validate(s);
            }
            assertEquals(QuantumState.of(1, 0, 0), states.get(0));
            assertEquals(QuantumState.of(2, 1, -1), states.get(2));
            assertEquals(QuantumState.of(4, 3, 3), states.get(29));
        }

        @Test
        @DisplayName("変更できない")
        void unmodifiable() {
            assertThrows(UnsupportedOperationException.class,
                    () -> OrbitalSequence.defaultSequence().add(QuantumState.of(5, 0, 0)));
        }
    }

    @Nested
    @DisplayName("電子配置")
    class Configurations {

        @Test
        @DisplayName("副殻ごとの電子数を解析し、占有軌道を列挙できる")
        void parse() {
            ElectronConfiguration c = ElectronConfiguration.parse(" 1s2  2s2 2p3 ");
            assertEquals(3, c.getSubshells().size());
            assertEquals(7, c.totalElectrons());
            assertEquals("1s2 2s2 2p3", c.toString());

            List<QuantumState> states = c.occupiedStates();
            assertEquals(5, states.size());
            assertEquals(QuantumState.of(2, 1, -1), states.get(2));
            assertEquals(QuantumState.of(2, 1, 1), states.get(4));
        }

        @ParameterizedTest
        @ValueSource(strings = {"", "   ", "1s", "1p1", "2s3", "2p7", "1s0", "1x1", "s2"})
        @DisplayName("不正な表記は拒否する")
        void rejectsInvalidNotation(String notation) {
            assertThrows(IllegalArgumentException.class, () -> ElectronConfiguration.parse(notation));
        }
    }

    @Nested
    @DisplayName("元素")
    class Elements {

        @Test
        @DisplayName("原子番号と電子数が一致する")
        void atomicNumberMatchesElectronCount() {
            for (Element e : Element.values()) {
                assertEquals(e.atomicNumber(), e.getConfiguration().totalElectrons(), e.name());
            }
            assertEquals(10, Element.NEON.atomicNumber());
        }

        @Test
        @DisplayName("名前は大文字小文字を区別せずに解決する")
        void fromName() {
            assertEquals(Element.CARBON, Element.fromName("carbon"));
            assertEquals(Element.HYDROGEN, Element.fromName(" Hydrogen "));
            assertThrows(IllegalArgumentException.class, () -> Element.fromName("Sodium"));
            assertThrows(IllegalArgumentException.class, () -> Element.fromName(null));
        }

        @Test
        @DisplayName("表示名からすべての元素を解決できる")
        void resolvesByDisplayName() {
            for (Element e : Element.values()) {
                assertEquals(e, Element.fromName(e.getDisplayName()));
                assertEquals(e, Element.fromName(e.getDisplayName().toUpperCase(Locale.ROOT)));
            }
            assertEquals("Fluorine", Element.FLUORINE.getDisplayName());
        }

        @Test
        @DisplayName("炭素の占有軌道は 1s, 2s と 2p の 3 状態")
        void carbonOccupiedStates() {
            List<QuantumState> states = Element.CARBON.getConfiguration().occupiedStates();
            assertEquals(5, states.size());
            assertTrue(states.contains(QuantumState.of(2, 1, 0)));
        }
    }
}
