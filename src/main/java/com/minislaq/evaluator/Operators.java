package com.minislaq.evaluator;

import com.minislaq.common.Constants;
import com.minislaq.common.EvaluationException;
import com.minislaq.common.NetworkUtils;
import com.minislaq.parser.ast.Operator;
import com.minislaq.value.Value;
import com.minislaq.value.Value.ValueType;
import com.minislaq.value.ValueComparator;

import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Operator library
 *
 * Operand values are already evaluated. Compiled LIKE and MATCHES patterns
 * are cached by pattern text.
 *
 * @author Mini-SLAQ
 */
public final class Operators {

    private static final Map<String, Pattern> LIKE_PATTERNS = new ConcurrentHashMap<>();
    private static final Map<String, Pattern> REGEX_PATTERNS = new ConcurrentHashMap<>();

    private Operators() {
    }

    /**
     * Apply a binary operator
     */
    public static Value applyBinary(Operator operator, Value left, Value right) throws EvaluationException {
        switch (operator) {
            case EQUALS:
                return Value.of(ValueComparator.compare(left, right) == 0);
            case NOT_EQUALS:
                return Value.of(ValueComparator.compare(left, right) != 0);
            case LESS_THAN:
                return Value.of(ValueComparator.compare(left, right) < 0);
            case LESS_THAN_OR_EQUAL:
                return Value.of(ValueComparator.compare(left, right) <= 0);
            case GREATER_THAN:
                return Value.of(ValueComparator.compare(left, right) > 0);
            case GREATER_THAN_OR_EQUAL:
                return Value.of(ValueComparator.compare(left, right) >= 0);

            case LIKE:
                return Value.of(likePattern(requireString(operator, right))
                        .matcher(requireString(operator, left)).matches());
            case MATCHES:
                return Value.of(regexPattern(requireString(operator, right))
                        .matcher(requireString(operator, left)).find());
            case CONTAINS:
                return Value.of(requireString(operator, left).contains(requireString(operator, right)));
            case STARTS_WITH:
                return Value.of(requireString(operator, left).startsWith(requireString(operator, right)));
            case ENDS_WITH:
                return Value.of(requireString(operator, left).endsWith(requireString(operator, right)));

            case IN:
                return Value.of(in(left, right));
            case IN_RANGE:
                return Value.of(inRange(left, right));

            case AND: {
                boolean l = ValueComparator.toBoolean(left);
                boolean r = ValueComparator.toBoolean(right);
                return Value.of(l && r);
            }
            case OR: {
                boolean l = ValueComparator.toBoolean(left);
                boolean r = ValueComparator.toBoolean(right);
                return Value.of(l || r);
            }

            default:
                throw new EvaluationException("Not a binary operator: " + operator);
        }
    }

    /**
     * Apply a unary operator
     */
    public static Value applyUnary(Operator operator, Value operand) throws EvaluationException {
        switch (operator) {
            case NOT:
                return Value.of(!ValueComparator.toBoolean(operand));
            case IS_BOT:
                return Value.of(isBot(requireString(operator, operand)));
            case IS_ERROR: {
                long status = requireInteger(operator, operand);
                return Value.of(status >= Constants.ERROR_STATUS_MIN && status <= Constants.ERROR_STATUS_MAX);
            }
            case IS_SUCCESS: {
                long status = requireInteger(operator, operand);
                return Value.of(status >= Constants.SUCCESS_STATUS_MIN && status <= Constants.SUCCESS_STATUS_MAX);
            }
            default:
                throw new EvaluationException("Not a unary operator: " + operator);
        }
    }

    // ==================== Membership ====================

    /**
     * Elements whose type cannot be compared with the left value never match
     */
    private static boolean in(Value left, Value right) throws EvaluationException {
        if (right.getType() != ValueType.LIST) {
            throw new EvaluationException("IN requires a list, got " + right.getType());
        }
        for (Value element : right.asList()) {
            if (comparable(left, element) && ValueComparator.equal(left, element)) {
                return true;
            }
        }
        return false;
    }

    private static boolean comparable(Value left, Value right) {
        Value[] coerced = ValueComparator.coerce(left, right);
        return coerced[0].getType() == coerced[1].getType() && coerced[0].getType() != ValueType.LIST;
    }

    private static boolean inRange(Value left, Value right) throws EvaluationException {
        String address = requireString(Operator.IN_RANGE, left);
        String range = requireString(Operator.IN_RANGE, right);

        byte[] ip = NetworkUtils.parseAddress(address);
        if (ip == null) {
            throw new EvaluationException("Invalid IP address: " + address);
        }
        NetworkUtils.Cidr cidr = NetworkUtils.parseCidr(range);
        if (cidr == null) {
            throw new EvaluationException("Invalid CIDR range: " + range);
        }
        return cidr.contains(ip);
    }

    // ==================== Record predicates ====================

    public static boolean isBot(String userAgent) {
        String lower = userAgent.toLowerCase(Locale.ROOT);
        for (String pattern : Constants.BOT_PATTERNS) {
            if (lower.contains(pattern)) {
                return true;
            }
        }
        return false;
    }

    // ==================== Patterns ====================

    /**
     * Glob to anchored regex: * any run, ? any character, everything else literal
     */
    static Pattern likePattern(String glob) {
        return LIKE_PATTERNS.computeIfAbsent(glob, Operators::compileGlob);
    }

    private static Pattern compileGlob(String glob) {
        StringBuilder regex = new StringBuilder();
        StringBuilder literal = new StringBuilder();
        for (int i = 0; i < glob.length(); i++) {
            char c = glob.charAt(i);
            if (c == '*' || c == '?') {
                if (literal.length() > 0) {
                    regex.append(Pattern.quote(literal.toString()));
                    literal.setLength(0);
                }
                regex.append(c == '*' ? ".*" : ".");
            } else {
                literal.append(c);
            }
        }
        if (literal.length() > 0) {
            regex.append(Pattern.quote(literal.toString()));
        }
        return Pattern.compile(regex.toString(), Pattern.DOTALL);
    }

    static Pattern regexPattern(String regex) throws EvaluationException {
        Pattern pattern = REGEX_PATTERNS.get(regex);
        if (pattern != null) {
            return pattern;
        }
        try {
            pattern = Pattern.compile(regex);
        } catch (PatternSyntaxException e) {
            throw new EvaluationException("Invalid regular expression: " + regex, e);
        }
        REGEX_PATTERNS.putIfAbsent(regex, pattern);
        return pattern;
    }

    // ==================== Operand checks ====================

    private static String requireString(Operator operator, Value value) throws EvaluationException {
        if (value.getType() != ValueType.STRING) {
            throw new EvaluationException(operator + " requires a string operand, got " + value.getType());
        }
        return value.asString();
    }

    private static long requireInteger(Operator operator, Value value) throws EvaluationException {
        if (value.getType() != ValueType.INTEGER) {
            throw new EvaluationException(operator + " requires an integer operand, got " + value.getType());
        }
        return value.asLong();
    }
}
