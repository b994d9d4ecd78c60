package com.codeheadsystems.smartaccount.crypto.common;

import static org.assertj.core.api.Assertions.assertThat;

import java.security.SecureRandom;
import org.junit.jupiter.api.Test;

class RandomProviderTest {

  @Test
  void customRandom_isPreserved() {
    SecureRandom custom = new SecureRandom();
    RandomProvider rp = new RandomProvider(custom);
    assertThat(rp.random()).isSameAs(custom);
  }

  @Test
  void randomBytes_returnsCorrectLength() {
    RandomProvider rp = new RandomProvider();
    assertThat(rp.randomBytes(0)).hasSize(0);
    assertThat(rp.randomBytes(32)).hasSize(32);
  }
}
