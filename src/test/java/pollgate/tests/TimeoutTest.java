/*
 * Copyright © Chris Vest (mr.chrisvest@gmail.com)
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package pollgate.tests;

import org.junit.jupiter.api.Test;
import pollgate.Timeout;

import java.time.Duration;
import java.util.Locale;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TimeoutTest {
  @Test
  void timeUnitCannotBeNull() {
    assertThrows(NullPointerException.class, () -> new Timeout(1, null));
  }

  @Test
  void durationCannotBeNull() {
    assertThrows(NullPointerException.class, () -> new Timeout(null));
  }

  @Test
  void timeoutCanBeZeroOrLess() {
    // Wait loops poll once and give up.
    assertThat(new Timeout(0, TimeUnit.DAYS).getTimeoutInNanos()).isZero();
    assertThat(new Timeout(-1, TimeUnit.DAYS).getTimeoutInNanos()).isNegative();
  }

  @Test
  void valueAndUnitMustBeReproducible() {
    Timeout timeout = new Timeout(13, TimeUnit.MILLISECONDS);
    assertThat(timeout.getTimeout()).isEqualTo(13L);
    assertThat(timeout.getUnit()).isEqualTo(TimeUnit.MILLISECONDS);
    assertThat(timeout.getTimeoutInNanos()).isEqualTo(13_000_000L);
  }

  @Test
  void timeoutsWithEqualValueButDifferentUnitsAreEqual() {
    Timeout a = new Timeout(1, TimeUnit.SECONDS);
    Timeout b = new Timeout(1000, TimeUnit.MILLISECONDS);
    Timeout c = new Timeout(Duration.ofSeconds(1));
    assertThat(a).isEqualTo(b).isEqualTo(c);
    assertEquals(a.hashCode(), b.hashCode());
    assertEquals(a.hashCode(), c.hashCode());
  }

  @Test
  void differentTimeoutValuesAreNotEqual() {
    Timeout a = new Timeout(1, TimeUnit.SECONDS);
    Timeout b = new Timeout(1, TimeUnit.MILLISECONDS);
    assertThat(a).isNotEqualTo(b);
    assertTrue(a.hashCode() != b.hashCode());
  }

  @Test
  void timeoutsAreNotEqualToNullOrOtherTypes() {
    Timeout a = new Timeout(1, TimeUnit.SECONDS);
    //noinspection SimplifiableJUnitAssertion,ConstantConditions
    assertFalse(a.equals(null));
    assertThat((Object) a).isNotEqualTo("poke");
  }

  @Test
  void deadlineMustBeInTheFutureForPositiveTimeouts() {
    Timeout timeout = new Timeout(1, TimeUnit.HOURS);
    long deadline = timeout.getDeadline();
    assertThat(timeout.getTimeLeft(deadline)).isPositive().isLessThanOrEqualTo(timeout.getTimeoutInNanos());
  }

  @Test
  void deadlineMustHavePassedForNegativeTimeouts() {
    Timeout timeout = new Timeout(-1, TimeUnit.SECONDS);
    assertThat(timeout.getTimeLeft(timeout.getDeadline())).isNegative();
  }

  @Test
  void mustConvertToDuration() {
    assertThat(new Timeout(1500, TimeUnit.MILLISECONDS).toDuration()).isEqualTo(Duration.ofMillis(1500));
  }

  @Test
  void toStringMustShowValueAndUnit() {
    assertThat(new Timeout(10, TimeUnit.SECONDS)).hasToString("10 seconds");
  }

  @Test
  void toStringMustNotDependOnDefaultLocale() {
    Locale defaultLocale = Locale.getDefault();
    Locale.setDefault(new Locale("tr", "TR"));
    try {
      assertThat(new Timeout(100, TimeUnit.MILLISECONDS)).hasToString("100 milliseconds");
    } finally {
      Locale.setDefault(defaultLocale);
    }
  }

  @Test
  void hugeDurationsMustSaturateLikeHugeValues() {
    Timeout fromDuration = new Timeout(Duration.ofDays(365L * 1000));
    Timeout fromUnit = new Timeout(365L * 1000, TimeUnit.DAYS);
    assertThat(fromDuration.getTimeoutInNanos()).isEqualTo(Long.MAX_VALUE);
    assertThat(fromDuration).isEqualTo(fromUnit);
  }
}
