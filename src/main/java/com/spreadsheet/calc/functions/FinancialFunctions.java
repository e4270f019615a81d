package com.spreadsheet.calc.functions;

import com.spreadsheet.calc.exceptions.FormulaErrorException;
import com.spreadsheet.calc.models.CalculationSettings;
import com.spreadsheet.calc.models.CellValue;
import com.spreadsheet.calc.models.ErrorCode;
import com.spreadsheet.calc.models.ValueType;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

import static com.spreadsheet.calc.functions.FunctionCategory.FINANCIAL;
import static com.spreadsheet.calc.functions.FunctionDefinition.VARIADIC;

/**
 * Time-value-of-money functions with the usual sign convention: money paid
 * out is negative. {@code type} 1 means payments at the start of each period.
 * RATE and IRR solve by Newton's method at 34 significant digits.
 */
final class FinancialFunctions {

    private static final int MAX_NEWTON_STEPS = 100;
    private static final BigDecimal NEWTON_TOLERANCE = new BigDecimal("1E-12");
    private static final BigDecimal DEFAULT_GUESS = new BigDecimal("0.1");

    private FinancialFunctions() {
    }

    static void register(FunctionRegistry registry) {
        registry.register(FunctionDefinition.scalar("PMT", FINANCIAL, 3, 5, FinancialFunctions::pmt));
        registry.register(FunctionDefinition.scalar("PV", FINANCIAL, 3, 5, FinancialFunctions::pv));
        registry.register(FunctionDefinition.scalar("FV", FINANCIAL, 3, 5, FinancialFunctions::fv));
        registry.register(FunctionDefinition.scalar("NPER", FINANCIAL, 3, 5, FinancialFunctions::nper));
        registry.register(FunctionDefinition.scalar("RATE", FINANCIAL, 3, 6, FinancialFunctions::rate));
        registry.register(FunctionDefinition.strict("NPV", FINANCIAL, 2, VARIADIC, FinancialFunctions::npv,
                ArgumentKind.SCALAR, ArgumentKind.RANGE));
        registry.register(FunctionDefinition.strict("IRR", FINANCIAL, 1, 2, FinancialFunctions::irr,
                ArgumentKind.RANGE, ArgumentKind.SCALAR));
    }

    private static CellValue pmt(Arguments args) {
        BigDecimal rate = args.number(0);
        BigDecimal periods = args.number(1);
        BigDecimal present = args.number(2);
        BigDecimal future = args.number(3, BigDecimal.ZERO);
        BigDecimal timing = timing(args, 4);
        if (rate.signum() == 0) {
            return CellValue.number(DecimalMath.divide(present.add(future).negate(), periods, args.settings()));
        }
        BigDecimal growth = growth(rate, periods, args.settings());
        BigDecimal numerator = rate.multiply(present.multiply(growth).add(future));
        BigDecimal denominator = BigDecimal.ONE.add(rate.multiply(timing)).multiply(growth.subtract(BigDecimal.ONE));
        return CellValue.number(DecimalMath.divide(numerator.negate(), denominator, args.settings()));
    }

    private static CellValue pv(Arguments args) {
        BigDecimal rate = args.number(0);
        BigDecimal periods = args.number(1);
        BigDecimal payment = args.number(2);
        BigDecimal future = args.number(3, BigDecimal.ZERO);
        BigDecimal timing = timing(args, 4);
        if (rate.signum() == 0) {
            return CellValue.number(args.round(future.add(payment.multiply(periods)).negate()));
        }
        BigDecimal growth = growth(rate, periods, args.settings());
        BigDecimal annuity = payment.multiply(BigDecimal.ONE.add(rate.multiply(timing)))
                .multiply(growth.subtract(BigDecimal.ONE)).divide(rate, DecimalMath.PRECISION);
        return CellValue.number(DecimalMath.divide(future.add(annuity).negate(), growth, args.settings()));
    }

    private static CellValue fv(Arguments args) {
        BigDecimal rate = args.number(0);
        BigDecimal periods = args.number(1);
        BigDecimal payment = args.number(2);
        BigDecimal present = args.number(3, BigDecimal.ZERO);
        BigDecimal timing = timing(args, 4);
        if (rate.signum() == 0) {
            return CellValue.number(args.round(present.add(payment.multiply(periods)).negate()));
        }
        BigDecimal growth = growth(rate, periods, args.settings());
        BigDecimal annuity = payment.multiply(BigDecimal.ONE.add(rate.multiply(timing)))
                .multiply(growth.subtract(BigDecimal.ONE)).divide(rate, DecimalMath.PRECISION);
        return CellValue.number(args.round(present.multiply(growth).add(annuity).negate()));
    }

    private static CellValue nper(Arguments args) {
        BigDecimal rate = args.number(0);
        BigDecimal payment = args.number(1);
        BigDecimal present = args.number(2);
        BigDecimal future = args.number(3, BigDecimal.ZERO);
        BigDecimal timing = timing(args, 4);
        if (rate.signum() == 0) {
            if (payment.signum() == 0) {
                throw new FormulaErrorException(ErrorCode.NUM);
            }
            return CellValue.number(DecimalMath.divide(present.add(future).negate(), payment, args.settings()));
        }
        BigDecimal adjusted = payment.multiply(BigDecimal.ONE.add(rate.multiply(timing)));
        BigDecimal numerator = adjusted.subtract(future.multiply(rate));
        BigDecimal denominator = present.multiply(rate).add(adjusted);
        if (denominator.signum() == 0) {
            throw new FormulaErrorException(ErrorCode.NUM);
        }
        BigDecimal ratio = numerator.divide(denominator, DecimalMath.PRECISION);
        if (ratio.signum() <= 0 || rate.compareTo(BigDecimal.ONE.negate()) <= 0) {
            throw new FormulaErrorException(ErrorCode.NUM);
        }
        double periods = StrictMath.log(ratio.doubleValue()) / StrictMath.log1p(rate.doubleValue());
        return CellValue.number(DecimalMath.fromDouble(periods, args.settings()));
    }

    private static CellValue rate(Arguments args) {
        BigDecimal periods = args.number(0);
        BigDecimal payment = args.number(1);
        BigDecimal present = args.number(2);
        BigDecimal future = args.number(3, BigDecimal.ZERO);
        BigDecimal timing = timing(args, 4);
        BigDecimal guess = args.number(5, DEFAULT_GUESS);
        int n = DecimalMath.toInt(periods);
        if (n <= 0) {
            throw new FormulaErrorException(ErrorCode.NUM);
        }
        BigDecimal step = new BigDecimal("1E-10");
        BigDecimal r = guess;
        for (int i = 0; i < MAX_NEWTON_STEPS; i++) {
            BigDecimal value = annuityBalance(r, n, payment, present, future, timing);
            BigDecimal slope = annuityBalance(r.add(step), n, payment, present, future, timing)
                    .subtract(value).divide(step, DecimalMath.PRECISION);
            if (slope.signum() == 0) {
                break;
            }
            BigDecimal next = r.subtract(value.divide(slope, DecimalMath.PRECISION), DecimalMath.PRECISION);
            if (next.subtract(r).abs().compareTo(NEWTON_TOLERANCE) < 0) {
                return CellValue.number(args.round(next));
            }
            if (next.compareTo(BigDecimal.ONE.negate()) <= 0) {
                break;
            }
            r = next;
        }
        throw new FormulaErrorException(ErrorCode.NUM);
    }

    /**
     * pv*(1+r)^n + pmt*(1+r*type)*((1+r)^n - 1)/r + fv, which RATE drives to zero.
     */
    private static BigDecimal annuityBalance(BigDecimal r, int n, BigDecimal payment, BigDecimal present,
                                             BigDecimal future, BigDecimal timing) {
        if (r.signum() == 0) {
            return present.add(payment.multiply(BigDecimal.valueOf(n))).add(future);
        }
        BigDecimal growth = DecimalMath.integerPower(BigDecimal.ONE.add(r), n);
        BigDecimal annuity = payment.multiply(BigDecimal.ONE.add(r.multiply(timing)))
                .multiply(growth.subtract(BigDecimal.ONE)).divide(r, DecimalMath.PRECISION);
        return present.multiply(growth, DecimalMath.PRECISION).add(annuity).add(future);
    }

    private static CellValue npv(Arguments args) {
        BigDecimal rate = args.number(0);
        BigDecimal base = BigDecimal.ONE.add(rate);
        if (base.signum() == 0) {
            throw new FormulaErrorException(ErrorCode.DIV_ZERO);
        }
        List<BigDecimal> flows = Aggregates.numbers(args, 1);
        BigDecimal total = BigDecimal.ZERO;
        BigDecimal discount = BigDecimal.ONE;
        for (BigDecimal flow : flows) {
            discount = discount.multiply(base, DecimalMath.PRECISION);
            total = total.add(flow.divide(discount, DecimalMath.PRECISION));
        }
        return CellValue.number(args.round(total));
    }

    private static CellValue irr(Arguments args) {
        List<BigDecimal> flows = new ArrayList<>();
        for (CellValue value : args.range(0)) {
            if (value.getType() == ValueType.NUMBER) {
                flows.add(((CellValue.NumberValue) value).getValue());
            } else {
                ValueCoercion.requireNonError(value);
            }
        }
        boolean positive = false;
        boolean negative = false;
        for (BigDecimal flow : flows) {
            positive |= flow.signum() > 0;
            negative |= flow.signum() < 0;
        }
        if (!positive || !negative) {
            throw new FormulaErrorException(ErrorCode.NUM);
        }
        BigDecimal r = args.number(1, DEFAULT_GUESS);
        for (int i = 0; i < MAX_NEWTON_STEPS; i++) {
            BigDecimal base = BigDecimal.ONE.add(r);
            if (base.signum() <= 0) {
                break;
            }
            BigDecimal value = BigDecimal.ZERO;
            BigDecimal slope = BigDecimal.ZERO;
            BigDecimal discount = BigDecimal.ONE;
            for (int t = 0; t < flows.size(); t++) {
                BigDecimal term = flows.get(t).divide(discount, DecimalMath.PRECISION);
                value = value.add(term);
                slope = slope.subtract(term.multiply(BigDecimal.valueOf(t)).divide(base, DecimalMath.PRECISION));
                discount = discount.multiply(base, DecimalMath.PRECISION);
            }
            if (slope.signum() == 0) {
                break;
            }
            BigDecimal next = r.subtract(value.divide(slope, DecimalMath.PRECISION), DecimalMath.PRECISION);
            if (next.subtract(r).abs().compareTo(NEWTON_TOLERANCE) < 0) {
                return CellValue.number(args.round(next));
            }
            r = next;
        }
        throw new FormulaErrorException(ErrorCode.NUM);
    }

    private static BigDecimal growth(BigDecimal rate, BigDecimal periods, CalculationSettings settings) {
        if (DecimalMath.isInteger(periods)) {
            return DecimalMath.integerPower(BigDecimal.ONE.add(rate), DecimalMath.toInt(periods));
        }
        return DecimalMath.power(BigDecimal.ONE.add(rate), periods, settings);
    }

    private static BigDecimal timing(Arguments args, int index) {
        return args.number(index, BigDecimal.ZERO).signum() != 0 ? BigDecimal.ONE : BigDecimal.ZERO;
    }
}
