package com.example.paybill.application.parser;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class PayScaleFilterTest {

    @Test
    void recognizesPayBandContinuationLines() {
        assertThat(PayScaleFilter.isPayScaleLine("PB-3 (15600-39100)/5400")).isTrue();
        assertThat(PayScaleFilter.isPayScaleLine("39100)/6600")).isTrue();
        assertThat(PayScaleFilter.isPayScaleLine("Dr. Asha Patel")).isFalse();
    }

    @Test
    void stripsPayBandButKeepsSurroundingText() {
        assertThat(PayScaleFilter.strip("Staff Nurse PB-1 (5200-20200)/2800")).isEqualTo("Staff Nurse");
        assertThat(PayScaleFilter.strip("Peon 4440-7440/1300")).isEqualTo("Peon");
    }

    @Test
    void amountsOnTheDataLineSurvive() {
        assertThat(LineRules.extractNumbers("Peon 10000 -250.50 7"))
                .extracting(Object::toString)
                .containsExactly("10000", "-250.50", "7");
    }
}
