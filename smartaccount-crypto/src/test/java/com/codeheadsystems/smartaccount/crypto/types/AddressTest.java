package com.codeheadsystems.smartaccount.crypto.types;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.HashMap;
import java.util.Map;
import org.junit.jupiter.api.Test;

class AddressTest {

  @Test
  void equalsAndHashCode_compareContent() {
    Address a = Address.of("0x00000000000000000000000000000000000000aa");
    Address b = Address.of("00000000000000000000000000000000000000AA");
    Map<Address, String> map = new HashMap<>();
    map.put(a, "value");
    assertThat(a).isEqualTo(b);
    assertThat(map).containsEntry(b, "value");
  }

  @Test
  void wrongLength_throws() {
    assertThatThrownBy(() -> Address.of("0x1234")).isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void bytes_isDefensiveCopy() {
    Address a = Address.of("0x00000000000000000000000000000000000000aa");
    a.bytes()[19] = 0;
    assertThat(a.toHex()).isEqualTo("0x00000000000000000000000000000000000000aa");
  }

  @Test
  void word_roundTrip() {
    Address a = Address.of("0x1111111111111111111111111111111111111111");
    assertThat(a.toWord()).hasSize(32);
    assertThat(Address.fromWord(a.toWord())).isEqualTo(a);
  }

  @Test
  void zero_isZero() {
    assertThat(Address.ZERO.isZero()).isTrue();
    assertThat(Address.of("0x0000000000000000000000000000000000000001").isZero()).isFalse();
  }
}
