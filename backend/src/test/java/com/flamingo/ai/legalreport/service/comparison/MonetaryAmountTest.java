package com.flamingo.ai.legalreport.service.comparison;

import static org.assertj.core.api.Assertions.assertThat;

import java.math.BigDecimal;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("MonetaryAmount Tests")
class MonetaryAmountTest {

  @Test
  @DisplayName("Should read Chilean thousands and decimal separators")
  void shouldParseChileanNotation() {
    MonetaryAmount amount = MonetaryAmount.parse("$ 1.000.000,50 pesos").orElseThrow();

    assertThat(amount.amount()).isEqualByComparingTo(new BigDecimal("1000000.50"));
    assertThat(amount.currency()).isEqualTo("CLP");
  }

  @Test
  @DisplayName("Should detect UF and dollar amounts")
  void shouldDetectCurrency() {
    assertThat(MonetaryAmount.parse("1.500 UF").orElseThrow().currency()).isEqualTo("UF");
    assertThat(MonetaryAmount.parse("500 Unidades de Fomento").orElseThrow().currency())
        .isEqualTo("UF");
    assertThat(MonetaryAmount.parse("US$ 20.000").orElseThrow().currency()).isEqualTo("USD");
    assertThat(MonetaryAmount.parse("20.000 dólares").orElseThrow().currency()).isEqualTo("USD");
  }

  @Test
  @DisplayName("Should return empty for text without digits")
  void shouldRejectTextWithoutNumber() {
    assertThat(MonetaryAmount.parse("no informado")).isEmpty();
    assertThat(MonetaryAmount.parse(null)).isEmpty();
  }

  @Test
  @DisplayName("Should compare within tolerance and only in the same currency")
  void shouldMatchWithinTolerance() {
    MonetaryAmount pesos = MonetaryAmount.parse("$ 1.000.000").orElseThrow();

    assertThat(pesos.matches(MonetaryAmount.parse("1.000.000,75").orElseThrow(), 1.0)).isTrue();
    assertThat(pesos.matches(MonetaryAmount.parse("1.000.002").orElseThrow(), 1.0)).isFalse();
    assertThat(pesos.matches(MonetaryAmount.parse("1.000.000 UF").orElseThrow(), 1.0)).isFalse();
  }
}
