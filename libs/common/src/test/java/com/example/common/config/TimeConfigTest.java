package com.example.common.config;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Clock;
import java.time.ZoneOffset;
import org.junit.jupiter.api.Test;

class TimeConfigTest {

  @Test
  void clockIsUtc() {
    final Clock clock = new TimeConfig().clock();

    assertThat(clock.getZone()).isEqualTo(ZoneOffset.UTC);
  }
}
