package io.fhirrules.core.path;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import io.fhirrules.core.error.InvalidPathExpressionException;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Recursive-descent parser for the constrained predicate grammar used by
 * custom-expression rules:
 *
 * <pre>
 * expr    := andExpr ('or' andExpr)*
 * andExpr := notExpr ('and' notExpr)*
 * notExpr := 'not' notExpr | '(' expr ')' | test
 * test    := path '.exists()' | path '.empty()'
 *          | path '.count()' op number | path op literal
 * op      := '=' | '!=' | '&gt;' | '&gt;=' | '&lt;' | '&lt;='
 * literal := 'text' | number | true | false
 * </pre>
 *
 * <p>
 * Thread-safe and stateless.
 */
public final class PredicateParser {

    private static final Pattern PATH_TOKEN = Pattern.compile(
            "[A-Za-z_][A-Za-z0-9_]*(?:\\[(?:\\d+|\\*)])?"
                    + "(?:\\.(?!(?:exists|empty|count)\\(\\))[A-Za-z_][A-Za-z0-9_]*(?:\\[(?:\\d+|\\*)])?)*"
                    + "(?:\\.(exists|empty|count)\\(\\))?");
    private static final Pattern NUMBER_TOKEN = Pattern.compile("-?\\d+(?:\\.\\d+)?");
    private static final Pattern OPERATOR_TOKEN = Pattern.compile("!=|>=|<=|=|>|<");

    private enum Kind {
        PATH,
        STRING,
        NUMBER,
        BOOLEAN,
        OPERATOR,
        AND,
        OR,
        NOT,
        LPAREN,
        RPAREN
    }

    private record Token(Kind kind, String text, String function, int position) {}

    private final String source;
    private final List<Token> tokens;
    private int pos;

    private PredicateParser(String source, List<Token> tokens) {
        this.source = source;
        this.tokens = tokens;
    }

    /**
     * Parses a predicate.
     *
     * @throws InvalidPathExpressionException if the text is not in the grammar
     */
    public static Predicate parse(String expression) {
        if (expression == null || expression.isBlank()) {
            throw new InvalidPathExpressionException("Expression must not be blank", expression);
        }
        PredicateParser parser = new PredicateParser(expression, tokenize(expression));
        Predicate result = parser.parseOr();
        if (parser.pos < parser.tokens.size()) {
            throw parser.error("unexpected '" + parser.tokens.get(parser.pos).text() + "'");
        }
        return result;
    }

    // --- Grammar ---

    private Predicate parseOr() {
        List<Predicate> operands = new ArrayList<>();
        operands.add(parseAnd());
        while (accept(Kind.OR)) {
            operands.add(parseAnd());
        }
        return operands.size() == 1 ? operands.get(0) : new Predicate.Or(operands);
    }

    private Predicate parseAnd() {
        List<Predicate> operands = new ArrayList<>();
        operands.add(parseNot());
        while (accept(Kind.AND)) {
            operands.add(parseNot());
        }
        return operands.size() == 1 ? operands.get(0) : new Predicate.And(operands);
    }

    private Predicate parseNot() {
        if (accept(Kind.NOT)) {
            return new Predicate.Not(parseNot());
        }
        if (accept(Kind.LPAREN)) {
            Predicate inner = parseOr();
            expect(Kind.RPAREN, "')'");
            return inner;
        }
        return parseTest();
    }

    private Predicate parseTest() {
        Token pathToken = expect(Kind.PATH, "a path");
        PathExpression path = PathExpression.parse(pathToken.text());
        if ("exists".equals(pathToken.function())) {
            return new Predicate.Exists(path);
        }
        if ("empty".equals(pathToken.function())) {
            return new Predicate.Empty(path);
        }
        Predicate.Operator operator = Predicate.Operator.fromSymbol(expect(Kind.OPERATOR, "an operator").text());
        if ("count".equals(pathToken.function())) {
            Token number = expect(Kind.NUMBER, "a number after count()");
            return new Predicate.Count(path, operator, new BigDecimal(number.text()));
        }
        return new Predicate.Compare(path, operator, parseLiteral());
    }

    private JsonNode parseLiteral() {
        if (pos >= tokens.size()) {
            throw error("expected a literal but reached the end");
        }
        Token t = tokens.get(pos++);
        return switch (t.kind()) {
            case STRING -> JsonNodeFactory.instance.textNode(t.text());
            case NUMBER -> JsonNodeFactory.instance.numberNode(new BigDecimal(t.text()));
            case BOOLEAN -> JsonNodeFactory.instance.booleanNode(Boolean.parseBoolean(t.text()));
            default -> throw error("expected a literal but found '" + t.text() + "'");
        };
    }

    private boolean accept(Kind kind) {
        if (pos < tokens.size() && tokens.get(pos).kind() == kind) {
            pos++;
            return true;
        }
        return false;
    }

    private Token expect(Kind kind, String description) {
        if (pos >= tokens.size()) {
            throw error("expected " + description + " but reached the end");
        }
        Token t = tokens.get(pos);
        if (t.kind() != kind) {
            throw error("expected " + description + " but found '" + t.text() + "' at " + t.position());
        }
        pos++;
        return t;
    }

    private InvalidPathExpressionException error(String reason) {
        return new InvalidPathExpressionException("Expression '" + source + "': " + reason, source);
    }

    // --- Tokenizer ---

    private static List<Token> tokenize(String text) {
        List<Token> tokens = new ArrayList<>();
        int i = 0;
        while (i < text.length()) {
            char c = text.charAt(i);
            if (Character.isWhitespace(c)) {
                i++;
            } else if (c == '(') {
                tokens.add(new Token(Kind.LPAREN, "(", null, i++));
            } else if (c == ')') {
                tokens.add(new Token(Kind.RPAREN, ")", null, i++));
            } else if (c == '\'') {
                int end = text.indexOf('\'', i + 1);
                if (end < 0) {
                    throw new InvalidPathExpressionException(
                            "Expression '" + text + "': unterminated string at " + i, text);
                }
                tokens.add(new Token(Kind.STRING, text.substring(i + 1, end), null, i));
                i = end + 1;
            } else {
                i = scanWord(text, i, tokens);
            }
        }
        return tokens;
    }

    private static int scanWord(String text, int start, List<Token> tokens) {
        Matcher op = OPERATOR_TOKEN.matcher(text).region(start, text.length());
        if (op.lookingAt()) {
            tokens.add(new Token(Kind.OPERATOR, op.group(), null, start));
            return op.end();
        }
        Matcher number = NUMBER_TOKEN.matcher(text).region(start, text.length());
        if (number.lookingAt()) {
            tokens.add(new Token(Kind.NUMBER, number.group(), null, start));
            return number.end();
        }
        Matcher path = PATH_TOKEN.matcher(text).region(start, text.length());
        if (path.lookingAt()) {
            String word = path.group();
            String function = path.group(1);
            if (function != null) {
                String bare = word.substring(0, word.length() - function.length() - 3);
                tokens.add(new Token(Kind.PATH, bare, function, start));
            } else {
                tokens.add(new Token(keywordKind(word), word, null, start));
            }
            return path.end();
        }
        throw new InvalidPathExpressionException(
                "Expression '" + text + "': unexpected character '" + text.charAt(start) + "' at " + start, text);
    }

    private static Kind keywordKind(String word) {
        return switch (word) {
            case "and" -> Kind.AND;
            case "or" -> Kind.OR;
            case "not" -> Kind.NOT;
            case "true", "false" -> Kind.BOOLEAN;
            default -> Kind.PATH;
        };
    }
}
