package com.spreadsheet.calc.functions;

import com.spreadsheet.calc.exceptions.FormulaErrorException;
import com.spreadsheet.calc.models.CellValue;
import com.spreadsheet.calc.models.ErrorCode;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;

import static com.spreadsheet.calc.functions.FunctionCategory.DATE;

/**
 * Dates as serial numbers in the 1900 date system: 1 is 1900-01-01 and
 * serial 60 is the non-existent 1900-02-29 kept for compatibility, so
 * serials from 61 on count days from 1899-12-30.
 */
final class DateFunctions {

    private static final LocalDate EPOCH = LocalDate.of(1899, 12, 30);
    private static final LocalDate FIRST_REAL_LEAP_SHIFT = LocalDate.of(1900, 3, 1);
    private static final int MAX_YEAR = 9999;

    private DateFunctions() {
    }

    static void register(FunctionRegistry registry) {
        registry.register(FunctionDefinition.scalar("DATE", DATE, 3, 3, args -> {
            int year = args.integer(0);
            int month = args.integer(1);
            int day = args.integer(2);
            if (year >= 0 && year < 1900) {
                year += 1900;
            }
            if (year < 1900 || year > MAX_YEAR) {
                throw new FormulaErrorException(ErrorCode.NUM);
            }
            LocalDate date = LocalDate.of(year, 1, 1).plusMonths(month - 1L).plusDays(day - 1L);
            return CellValue.number(toSerial(date));
        }));
        registry.register(FunctionDefinition.scalar("YEAR", DATE, 1, 1,
                args -> CellValue.number(fromSerial(args.number(0)).getYear())));
        registry.register(FunctionDefinition.scalar("MONTH", DATE, 1, 1,
                args -> CellValue.number(fromSerial(args.number(0)).getMonthValue())));
        registry.register(FunctionDefinition.scalar("DAY", DATE, 1, 1, args -> {
            BigDecimal serial = args.number(0);
            if (serial.setScale(0, RoundingMode.FLOOR).compareTo(BigDecimal.valueOf(60)) == 0) {
                return CellValue.number(29);
            }
            return CellValue.number(fromSerial(serial).getDayOfMonth());
        }));
        registry.register(FunctionDefinition.scalar("EDATE", DATE, 2, 2,
                args -> CellValue.number(toSerial(fromSerial(args.number(0)).plusMonths(args.integer(1))))));
        registry.register(FunctionDefinition.scalar("EOMONTH", DATE, 2, 2, args -> {
            LocalDate shifted = fromSerial(args.number(0)).plusMonths(args.integer(1));
            return CellValue.number(toSerial(shifted.withDayOfMonth(shifted.lengthOfMonth())));
        }));
    }

    static long toSerial(LocalDate date) {
        long days = ChronoUnit.DAYS.between(EPOCH, date);
        if (date.isBefore(FIRST_REAL_LEAP_SHIFT)) {
            days--;
        }
        if (days < 0) {
            throw new FormulaErrorException(ErrorCode.NUM);
        }
        return days;
    }

    static LocalDate fromSerial(BigDecimal serial) {
        if (serial.signum() < 0 || serial.compareTo(BigDecimal.valueOf(2_958_465L)) > 0) {
            throw new FormulaErrorException(ErrorCode.NUM);
        }
        long day = serial.setScale(0, RoundingMode.FLOOR).longValue();
        if (day >= 61) {
            return EPOCH.plusDays(day);
        }
        if (day == 60) {
            // 1900-02-29 does not exist; February 28 carries its year and month
            return LocalDate.of(1900, 2, 28);
        }
        return EPOCH.plusDays(day + 1);
    }
}
