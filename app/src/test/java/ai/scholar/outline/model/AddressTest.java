package ai.scholar.outline.model;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;

class AddressTest {

    @Test
    void parsesDottedAddressWithOptionalTrailingPeriod() {
        assertThat(Address.parse("2.1.3")).contains(Address.of(2, 1, 3));
        assertThat(Address.parse(" 4. ")).contains(Address.of(4));
        assertThat(Address.of(2, 1, 3)).hasToString("2.1.3");
    }

    @Test
    void rejectsMalformedComponents() {
        assertThat(Address.parse("1.a")).isEmpty();
        assertThat(Address.parse("1..2")).isEmpty();
        assertThat(Address.parse("")).isEmpty();
        assertThat(Address.parse(null)).isEmpty();
        assertThat(Address.parse("99999999999")).isEmpty();
        assertThat(Address.parse("-1")).isEmpty();
    }

    @Test
    void comparesPrefixes() {
        Address parent = Address.of(1, 2);

        assertThat(parent.isProperPrefixOf(Address.of(1, 2, 1))).isTrue();
        assertThat(parent.isProperPrefixOf(Address.of(1, 2))).isFalse();
        assertThat(parent.isProperPrefixOf(Address.of(1, 3, 1))).isFalse();
        assertThat(Address.root().isProperPrefixOf(parent)).isTrue();
        assertThat(parent.firstDifference(Address.of(1, 3))).isEqualTo(1);
        assertThat(parent.firstDifference(Address.of(1, 2, 5))).isEqualTo(-1);
        assertThat(Address.of(1, 2, 3).prefix(2)).isEqualTo(parent);
        assertThat(parent.child(1)).isEqualTo(Address.of(1, 2, 1));
    }

    @Test
    void rootHasNoLastComponent() {
        assertThat(Address.root().isRoot()).isTrue();
        assertThatThrownBy(() -> Address.root().last()).isInstanceOf(IllegalStateException.class);
    }
}
