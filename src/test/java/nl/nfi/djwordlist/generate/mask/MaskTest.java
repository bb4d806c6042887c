package nl.nfi.djwordlist.generate.mask;

import nl.nfi.djwordlist.generate.config.ConfigException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class MaskTest {

    @Test
    void slotsFollowFirstAppearance() {
        final Mask mask = Mask.parse("{sym}{camel}{num}");

        assertThat(mask.slots()).containsExactly(Placeholder.SYMBOL, Placeholder.CAMEL, Placeholder.NUMBER);
        assertThat(mask.uses(Placeholder.YEAR)).isFalse();
        assertThat(mask.render(new String[]{"!", "Red", "12"})).isEqualTo("!Red12");
    }

    @Test
    void repeatedPlaceholderSharesSlot() {
        final Mask mask = Mask.parse("{sym}{base}{sym}");

        assertThat(mask.slots()).containsExactly(Placeholder.SYMBOL, Placeholder.BASE);
        assertThat(mask.render(new String[]{"#", "fox"})).isEqualTo("#fox#");
    }

    @Test
    void placeholderNamesAreCaseSensitive() {
        assertThat(Mask.parse("{base}{Base}{BASE}").slots())
                .containsExactly(Placeholder.BASE, Placeholder.CAPITALIZED, Placeholder.UPPER);
    }

    @Test
    void literalTextIsKept() {
        final Mask mask = Mask.parse("my-{base}!{year}?");
        assertThat(mask.render(new String[]{"cat", "1999"})).isEqualTo("my-cat!1999?");
    }

    @Test
    void unpairedBracesAreLiteral() {
        assertThat(Mask.parse("{{base}}").render(new String[]{"x"})).isEqualTo("{x}");
        assertThat(Mask.parse("}pass{").slots()).isEmpty();
        assertThat(Mask.parse("}pass{").render(new String[0])).isEqualTo("}pass{");
    }

    @ParameterizedTest
    @ValueSource(strings = {"{base}{1}", "{base}{my-num}", "pass{}word", "{ base }", "{num}{Num}"})
    void anyBracedNameThatIsNoPlaceholderIsRejected(final String template) {
        assertThatThrownBy(() -> Mask.parse(template))
                .isInstanceOf(InvalidMaskException.class)
                .satisfies(e -> assertThat(((InvalidMaskException) e).template()).isEqualTo(template));
    }

    @Test
    void unknownPlaceholderIsRejected() {
        assertThatThrownBy(() -> Mask.parse("{base}{color}"))
                .isInstanceOf(InvalidMaskException.class)
                .isInstanceOf(ConfigException.class)
                .hasMessageContaining("{color}")
                .satisfies(e -> assertThat(((InvalidMaskException) e).template()).isEqualTo("{base}{color}"));
    }

    @Test
    void masksWithSameTemplateAreEqual() {
        assertThat(Mask.parse("{base}{num}")).isEqualTo(Mask.parse("{base}{num}"));
        assertThat(Mask.parse("{base}{num}")).isNotEqualTo(Mask.parse("{num}{base}"));
    }
}
