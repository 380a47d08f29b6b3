package org.snowlite.engine.template;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;

/**
 * Evaluates the condition of an {@code {% if %}} block.
 *
 * A tokenizer plus a recursive-descent parser over a closed grammar; it can read
 * variables, target fields and the environment, and nothing else.
 * <pre>
 * or         := and ('or' and)*
 * and        := not ('and' not)*
 * not        := 'not' not | comparison
 * comparison := primary (('==' | '!=' | '<' | '<=' | '>' | '>=' | 'in' | 'not' 'in') primary)?
 * primary    := literal | list | '(' or ')' | call | 'target' '.' name
 * call       := 'var' '(' string [',' or] ')' | 'env_var' '(' string [',' or] ')' | 'is_incremental' '(' ')'
 * literal    := string | number | true | false | none
 * </pre>
 * Truthiness follows the template language: null, false, zero, empty strings and
 * empty lists are false.
 */
public final class ConditionEvaluator {

    /**
     * The condition could not be parsed or referenced something unknown.
     */
    public static class EvaluationException extends RuntimeException {
        public EvaluationException(String message) {
            super(message);
        }
    }

    private enum Kind { STRING, NUMBER, NAME, OP, LPAREN, RPAREN, LBRACKET, RBRACKET, COMMA, DOT, EOF }

    private record Tok(Kind kind, String text) {}

    private final Map<String, Object> vars;
    private final TargetConfig target;
    private final Function<String, String> environment;
    private final boolean incremental;

    private List<Tok> tokens;
    private int pos;

    public ConditionEvaluator(Map<String, Object> vars, TargetConfig target,
                              Function<String, String> environment, boolean incremental) {
        this.vars = vars;
        this.target = target;
        this.environment = environment;
        this.incremental = incremental;
    }

    public boolean evaluate(String condition) {
        tokens = tokenize(condition);
        pos = 0;
        Object value = parseOr();
        if (peek().kind() != Kind.EOF) {
            throw new EvaluationException("Unexpected '" + peek().text() + "' in condition: " + condition);
        }
        return truthy(value);
    }

    // ==================== Parser ====================

    private Object parseOr() {
        Object left = parseAnd();
        while (peekName("or")) {
            pos++;
            Object right = parseAnd();
            left = truthy(left) ? left : right;
        }
        return left;
    }

    private Object parseAnd() {
        Object left = parseNot();
        while (peekName("and")) {
            pos++;
            Object right = parseNot();
            left = truthy(left) ? right : left;
        }
        return left;
    }

    private Object parseNot() {
        if (peekName("not")) {
            pos++;
            return !truthy(parseNot());
        }
        return parseComparison();
    }

    private Object parseComparison() {
        Object left = parsePrimary();
        Tok t = peek();
        if (t.kind() == Kind.OP) {
            pos++;
            Object right = parsePrimary();
            return compare(left, t.text(), right);
        }
        if (peekName("in")) {
            pos++;
            return contains(parsePrimary(), left);
        }
        if (peekName("not") && pos + 1 < tokens.size() && isName(tokens.get(pos + 1), "in")) {
            pos += 2;
            return !contains(parsePrimary(), left);
        }
        return left;
    }

    private Object parsePrimary() {
        Tok t = next();
        switch (t.kind()) {
            case STRING:
                return t.text();
            case NUMBER:
                return number(t.text());
            case LPAREN: {
                Object inner = parseOr();
                expect(Kind.RPAREN);
                return inner;
            }
            case LBRACKET: {
                List<Object> items = new ArrayList<>();
                if (peek().kind() != Kind.RBRACKET) {
                    items.add(parseOr());
                    while (peek().kind() == Kind.COMMA) {
                        pos++;
                        items.add(parseOr());
                    }
                }
                expect(Kind.RBRACKET);
                return items;
            }
            case NAME:
                return parseName(t.text());
            default:
                throw new EvaluationException("Unexpected '" + t.text() + "'");
        }
    }

    private Object parseName(String name) {
        switch (name.toLowerCase(Locale.ROOT)) {
            case "true":
                return Boolean.TRUE;
            case "false":
                return Boolean.FALSE;
            case "none":
            case "null":
                return null;
            default:
                break;
        }
        if (name.equals("target")) {
            expect(Kind.DOT);
            String field = expect(Kind.NAME).text();
            if (!target.has(field)) {
                throw new EvaluationException("Unknown target field: " + field);
            }
            return target.field(field);
        }
        if (peek().kind() != Kind.LPAREN) {
            throw new EvaluationException("Unknown name in condition: " + name);
        }
        pos++;
        List<Object> args = new ArrayList<>();
        if (peek().kind() != Kind.RPAREN) {
            args.add(parseOr());
            while (peek().kind() == Kind.COMMA) {
                pos++;
                args.add(parseOr());
            }
        }
        expect(Kind.RPAREN);

        switch (name) {
            case "is_incremental":
                return incremental;
            case "var":
                return lookup(name, args, vars::get, vars::containsKey);
            case "env_var":
                return lookup(name, args, environment, key -> environment.apply(key) != null);
            default:
                throw new EvaluationException("Unknown function in condition: " + name);
        }
    }

    private static Object lookup(String function, List<Object> args, Function<String, ?> getter,
                                 Function<String, Boolean> present) {
        if (args.isEmpty() || args.size() > 2 || !(args.get(0) instanceof String key)) {
            throw new EvaluationException(function + "() takes a name and an optional default");
        }
        if (present.apply(key)) {
            return getter.apply(key);
        }
        if (args.size() == 2) {
            return args.get(1);
        }
        throw new EvaluationException("Undefined " + function + ": " + key);
    }

    private static Object number(String text) {
        try {
            return text.contains(".") ? (Object) Double.parseDouble(text) : (Object) Long.parseLong(text);
        } catch (NumberFormatException e) {
            throw new EvaluationException("Invalid number in condition: " + text);
        }
    }

    // ==================== Semantics ====================

    static boolean truthy(Object value) {
        if (value == null) {
            return false;
        }
        if (value instanceof Boolean b) {
            return b;
        }
        if (value instanceof Number n) {
            return n.doubleValue() != 0;
        }
        if (value instanceof String s) {
            return !s.isEmpty();
        }
        if (value instanceof List<?> l) {
            return !l.isEmpty();
        }
        return true;
    }

    private static boolean compare(Object left, String op, Object right) {
        if (op.equals("==")) {
            return equal(left, right);
        }
        if (op.equals("!=")) {
            return !equal(left, right);
        }
        int cmp;
        if (left instanceof Number l && right instanceof Number r) {
            cmp = Double.compare(l.doubleValue(), r.doubleValue());
        } else if (left instanceof String l && right instanceof String r) {
            cmp = l.compareTo(r);
        } else {
            throw new EvaluationException("Cannot compare " + left + " " + op + " " + right);
        }
        return switch (op) {
            case "<" -> cmp < 0;
            case "<=" -> cmp <= 0;
            case ">" -> cmp > 0;
            case ">=" -> cmp >= 0;
            default -> throw new EvaluationException("Unknown operator: " + op);
        };
    }

    private static boolean equal(Object left, Object right) {
        if (left instanceof Number l && right instanceof Number r) {
            return l.doubleValue() == r.doubleValue();
        }
        return Objects.equals(left, right);
    }

    private static boolean contains(Object container, Object item) {
        if (container instanceof List<?> list) {
            return list.stream().anyMatch(e -> equal(e, item));
        }
        if (container instanceof String s && item instanceof String i) {
            return s.contains(i);
        }
        throw new EvaluationException("'in' needs a list or string, got " + container);
    }

    // ==================== Tokenizer ====================

    private Tok peek() {
        return tokens.get(pos);
    }

    private Tok next() {
        Tok t = tokens.get(pos);
        if (t.kind() != Kind.EOF) {
            pos++;
        }
        return t;
    }

    private Tok expect(Kind kind) {
        Tok t = next();
        if (t.kind() != kind) {
            throw new EvaluationException("Expected " + kind + " but found '" + t.text() + "'");
        }
        return t;
    }

    private boolean peekName(String word) {
        return isName(peek(), word);
    }

    private static boolean isName(Tok t, String word) {
        return t.kind() == Kind.NAME && t.text().equals(word);
    }

    private static List<Tok> tokenize(String text) {
        List<Tok> out = new ArrayList<>();
        int i = 0;
        while (i < text.length()) {
            char c = text.charAt(i);
            if (Character.isWhitespace(c)) {
                i++;
            } else if (c == '\'' || c == '"') {
                int end = text.indexOf(c, i + 1);
                if (end < 0) {
                    throw new EvaluationException("Unterminated string in condition: " + text);
                }
                out.add(new Tok(Kind.STRING, text.substring(i + 1, end)));
                i = end + 1;
            } else if (Character.isDigit(c)) {
                int start = i;
                while (i < text.length() && (Character.isDigit(text.charAt(i)) || text.charAt(i) == '.')) i++;
                out.add(new Tok(Kind.NUMBER, text.substring(start, i)));
            } else if (Character.isLetter(c) || c == '_') {
                int start = i;
                while (i < text.length() && (Character.isLetterOrDigit(text.charAt(i)) || text.charAt(i) == '_')) i++;
                out.add(new Tok(Kind.NAME, text.substring(start, i)));
            } else if (text.startsWith("==", i) || text.startsWith("!=", i)
                    || text.startsWith("<=", i) || text.startsWith(">=", i)) {
                out.add(new Tok(Kind.OP, text.substring(i, i + 2)));
                i += 2;
            } else {
                Kind kind = switch (c) {
                    case '<', '>' -> Kind.OP;
                    case '(' -> Kind.LPAREN;
                    case ')' -> Kind.RPAREN;
                    case '[' -> Kind.LBRACKET;
                    case ']' -> Kind.RBRACKET;
                    case ',' -> Kind.COMMA;
                    case '.' -> Kind.DOT;
                    default -> throw new EvaluationException("Unexpected character '" + c + "' in condition: " + text);
                };
                out.add(new Tok(kind, String.valueOf(c)));
                i++;
            }
        }
        out.add(new Tok(Kind.EOF, "<end>"));
        return out;
    }
}
