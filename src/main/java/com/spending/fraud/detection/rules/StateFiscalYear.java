package com.spending.fraud.detection.rules;

import java.time.LocalDate;
import java.time.Month;

/**
 * Texas state fiscal year: FY N runs from September 1 of N-1 through August 31 of N.
 */
public final class StateFiscalYear {

    private StateFiscalYear() {
    }

    public static int of(LocalDate date) {
        return date.getMonthValue() >= Month.SEPTEMBER.getValue() ? date.getYear() + 1 : date.getYear();
    }

    public static LocalDate start(int fiscalYear) {
        return LocalDate.of(fiscalYear - 1, Month.SEPTEMBER, 1);
    }

    public static LocalDate end(int fiscalYear) {
        return LocalDate.of(fiscalYear, Month.AUGUST, 31);
    }

    /**
     * First day of the final two months (July and August).
     */
    public static LocalDate finalMonthsStart(int fiscalYear) {
        return LocalDate.of(fiscalYear, Month.JULY, 1);
    }

    public static LocalDate augustStart(int fiscalYear) {
        return LocalDate.of(fiscalYear, Month.AUGUST, 1);
    }

    /**
     * First of the last five days (August 27).
     */
    public static LocalDate finalDaysStart(int fiscalYear) {
        return LocalDate.of(fiscalYear, Month.AUGUST, 27);
    }
}
