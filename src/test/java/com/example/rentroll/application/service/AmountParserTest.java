package com.example.rentroll.application.service;

import com.example.rentroll.domain.model.CellValue;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for the amount parsing rules applied to charge cells.
 */
class AmountParserTest {

    @Test
    void nullAndEmptyValuesParseToZero() {
        assertThat(AmountParser.parse((Object) null)).isZero();
        assertThat(AmountParser.parse(CellValue.EMPTY)).isZero();
        assertThat(AmountParser.parse("   ")).isZero();
    }

    @Test
    void numbersAreReturnedAsIs() {
        assertThat(AmountParser.parse(42)).isEqualTo(42.0);
        assertThat(AmountParser.parse(CellValue.number(-12.75))).isEqualTo(-12.75);
    }

    @Test
    void accountingParenthesesBecomeNegative() {
        assertThat(AmountParser.parse("(1,234.50)")).isEqualTo(-1234.5);
    }

    @Test
    void currencySymbolsAndGroupingAreStripped() {
        assertThat(AmountParser.parse("$2,000")).isEqualTo(2000.0);
        assertThat(AmountParser.parse(CellValue.text("1 500.25"))).isEqualTo(1500.25);
    }

    @Test
    void unreadableTextParsesToZero() {
        assertThat(AmountParser.parse("abc")).isZero();
        assertThat(AmountParser.parse("$$")).isZero();
        assertThat(AmountParser.parse("1.2.3")).isZero();
        assertThat(AmountParser.parse("()")).isZero();
    }

    @Test
    void nonFiniteValuesParseToZero() {
        assertThat(AmountParser.parse(Double.NaN)).isZero();
        assertThat(AmountParser.parse("9".repeat(400))).isZero();
    }

    @Test
    void booleansGoThroughTheTextPath() {
        assertThat(AmountParser.parse(Boolean.TRUE)).isZero();
    }
}
