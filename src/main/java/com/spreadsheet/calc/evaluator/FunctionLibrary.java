package com.spreadsheet.calc.evaluator;

import com.spreadsheet.calc.exceptions.InvalidArgumentsException;
import com.spreadsheet.calc.models.CellValue;
import com.spreadsheet.calc.models.ErrorKind;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Built-in spreadsheet functions. Arguments arrive already evaluated;
 * a range argument arrives as an array value.
 *
 * <p>A wrong number of arguments is an engine fault ({@link InvalidArgumentsException});
 * every other failure is returned as an error value.
 */
public class FunctionLibrary {

    private static final int ROUND_PLACES_LIMIT = 400;

    public CellValue call(String name, List<CellValue> args) {
        BuiltinFunction function = BuiltinFunction.lookup(name);
        if (function == null) {
            return CellValue.error(ErrorKind.nameError(name));
        }
        if (!function.acceptsArgumentCount(args.size())) {
            throw new InvalidArgumentsException(function.name(),
                    "expects " + function.describeArity() + ", got " + args.size());
        }
        try {
            return dispatch(function, args);
        } catch (CoercionException e) {
            return e.toValue();
        }
    }

    public boolean isDefined(String name) {
        return BuiltinFunction.lookup(name) != null;
    }

    private CellValue dispatch(BuiltinFunction function, List<CellValue> args) throws CoercionException {
        switch (function) {
            case SUM:
                return CellValue.number(sum(numbers(args)));
            case AVERAGE:
                return average(numbers(args));
            case MIN:
                return extreme(numbers(args), true);
            case MAX:
                return extreme(numbers(args), false);
            case COUNT:
                return count(args);
            case ROUND:
                return round(args.get(0), args.get(1));
            case ABS:
                return CellValue.number(Math.abs(Coercion.toNumber(args.get(0))));
            case SQRT:
                return sqrt(args.get(0));
            case CONCATENATE:
                return concatenate(args);
            case LEN:
                return CellValue.number(Coercion.toText(args.get(0)).length());
            case UPPER:
                return CellValue.string(Coercion.toText(args.get(0)).toUpperCase(Locale.ROOT));
            case LOWER:
                return CellValue.string(Coercion.toText(args.get(0)).toLowerCase(Locale.ROOT));
            case TRIM:
                return CellValue.string(Coercion.toText(args.get(0)).trim());
            case IF:
                return ifValue(args);
            case AND:
                return and(args);
            case OR:
                return or(args);
            case NOT:
                return CellValue.bool(!Coercion.toBoolean(args.get(0)));
            default:
                throw new IllegalStateException("No implementation for " + function);
        }
    }

    /**
     * Flattens scalar and array arguments into the numbers they hold.
     * Array members that are not numbers are skipped; a scalar argument must
     * coerce to a number. The first error seen is rethrown.
     */
    private static List<Double> numbers(List<CellValue> args) throws CoercionException {
        List<Double> result = new ArrayList<>();
        for (CellValue arg : args) {
            if (arg.isArray()) {
                for (CellValue item : arg.getItems()) {
                    if (item.isError()) {
                        throw new CoercionException(item.getError());
                    }
                    if (item.isNumber()) {
                        result.add(item.getNumber());
                    }
                }
            } else if (!arg.isEmpty()) {
                result.add(Coercion.toNumber(arg));
            }
        }
        return result;
    }

    private static double sum(List<Double> numbers) {
        double total = 0d;
        for (double n : numbers) {
            total += n;
        }
        return total;
    }

    private static CellValue average(List<Double> numbers) {
        if (numbers.isEmpty()) {
            return CellValue.error(ErrorKind.divideByZero());
        }
        return CellValue.number(sum(numbers) / numbers.size());
    }

    private static CellValue extreme(List<Double> numbers, boolean min) {
        if (numbers.isEmpty()) {
            return CellValue.number(0d);
        }
        double best = numbers.get(0);
        for (double n : numbers) {
            best = min ? Math.min(best, n) : Math.max(best, n);
        }
        return CellValue.number(best);
    }

    // COUNT never fails on text: it just does not count it
    private static CellValue count(List<CellValue> args) throws CoercionException {
        int count = 0;
        for (CellValue arg : args) {
            List<CellValue> items = arg.isArray() ? arg.getItems() : List.of(arg);
            for (CellValue item : items) {
                if (item.isError()) {
                    throw new CoercionException(item.getError());
                }
                if (item.isNumber()) {
                    count++;
                }
            }
        }
        return CellValue.number(count);
    }

    private static CellValue round(CellValue value, CellValue digits) throws CoercionException {
        double number = Coercion.toNumber(value);
        double places = Coercion.toNumber(digits);
        if (Double.isNaN(number) || Double.isInfinite(number) || Double.isNaN(places)) {
            return CellValue.error(ErrorKind.numError());
        }
        // no double carries more than ROUND_PLACES_LIMIT places on either side of the point
        if (places >= ROUND_PLACES_LIMIT) {
            return CellValue.number(number);
        }
        if (places <= -ROUND_PLACES_LIMIT) {
            return CellValue.number(0);
        }
        double rounded = BigDecimal.valueOf(number).setScale((int) places, RoundingMode.HALF_UP).doubleValue();
        return Double.isInfinite(rounded) ? CellValue.error(ErrorKind.numError()) : CellValue.number(rounded);
    }

    private static CellValue sqrt(CellValue value) throws CoercionException {
        double number = Coercion.toNumber(value);
        if (number < 0) {
            return CellValue.error(ErrorKind.numError());
        }
        return CellValue.number(Math.sqrt(number));
    }

    private static CellValue concatenate(List<CellValue> args) throws CoercionException {
        StringBuilder sb = new StringBuilder();
        for (CellValue arg : args) {
            if (arg.isError()) {
                return arg;
            }
            sb.append(Coercion.toText(arg));
        }
        return CellValue.string(sb.toString());
    }

    // both branches were already evaluated by the caller
    private static CellValue ifValue(List<CellValue> args) throws CoercionException {
        if (Coercion.toBoolean(args.get(0))) {
            return args.get(1);
        }
        return args.size() > 2 ? args.get(2) : CellValue.FALSE;
    }

    private static CellValue and(List<CellValue> args) throws CoercionException {
        boolean result = true;
        for (CellValue arg : args) {
            result &= Coercion.toBoolean(arg);
        }
        return CellValue.bool(result);
    }

    private static CellValue or(List<CellValue> args) throws CoercionException {
        boolean result = false;
        for (CellValue arg : args) {
            result |= Coercion.toBoolean(arg);
        }
        return CellValue.bool(result);
    }
}
