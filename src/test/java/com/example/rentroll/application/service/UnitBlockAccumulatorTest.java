package com.example.rentroll.application.service;

import com.example.rentroll.domain.model.RentRollExtraction;
import com.example.rentroll.domain.model.UnitRecord;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.entry;

/**
 * Unit tests for the open/closed unit state machine, independent of any sheet.
 */
class UnitBlockAccumulatorTest {

    private final UnitBlockAccumulator accumulator = new UnitBlockAccumulator();

    @Test
    void startsWithoutAnOpenUnit() {
        assertThat(accumulator.state()).isEqualTo(UnitBlockAccumulator.State.NO_OPEN_UNIT);
    }

    @Test
    void chargesAndTotalsWithoutAnOpenUnitAreIgnored() {
        accumulator.applyCharge("rent", 10);
        accumulator.applyTotal(10);

        RentRollExtraction extraction = accumulator.finish();

        assertThat(extraction.units()).isEmpty();
        assertThat(extraction.chargeCodes()).isEmpty();
    }

    @Test
    void totalRowClosesTheOpenUnit() {
        accumulator.startUnit("101", "Jane");
        accumulator.applyCharge(" Rent ", 1000);
        assertThat(accumulator.state()).isEqualTo(UnitBlockAccumulator.State.OPEN_UNIT);

        accumulator.applyTotal(1000);

        assertThat(accumulator.state()).isEqualTo(UnitBlockAccumulator.State.NO_OPEN_UNIT);
        UnitRecord unit = accumulator.finish().units().get(0);
        assertThat(unit.charges()).containsExactly(entry("rent", 1000.0));
        assertThat(unit.total()).isEqualTo(1000.0);
    }

    @Test
    void startingANewUnitClosesThePreviousOne() {
        accumulator.startUnit("101", "");
        accumulator.applyCharge("rent", 5);
        accumulator.startUnit("102", "");

        RentRollExtraction extraction = accumulator.finish();

        assertThat(extraction.units()).extracting(UnitRecord::unit).containsExactly("101", "102");
        assertThat(extraction.units().get(0).total()).isZero();
    }

    @Test
    void repeatedCodesAreSummed() {
        accumulator.startUnit("101", "");
        accumulator.applyCharge("fee", 10);
        accumulator.applyCharge("FEE", 2.5);

        assertThat(accumulator.finish().units().get(0).chargeFor("fee")).isEqualTo(12.5);
    }

    @Test
    void blankCodesAreIgnored() {
        accumulator.startUnit("101", "");
        accumulator.applyCharge("   ", 10);

        RentRollExtraction extraction = accumulator.finish();

        assertThat(extraction.units().get(0).charges()).isEmpty();
        assertThat(extraction.chargeCodes()).isEmpty();
    }
}
