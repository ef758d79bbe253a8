// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package scribe.fragment;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import scribe.util.condition.ConditionContext;
import scribe.util.condition.UnhandledErrorError;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * The fragment parser: a recursive descent parser turning fragment source text into a {@link Program}.
 */
public final class Parser {
    private Parser(final List<Token> tokens, final String sourceName) {
        this.tokens = tokens;
        this.sourceName = sourceName;
    }

    /**
     * Parses the given fragment source.
     * <p>
     * {@code firstLine} is the line number of the first line of {@code source} within the unit's file, so that
     * syntax tree nodes and errors refer to lines of the file rather than of the fragment.
     * <p>
     * If the source is malformed, a fatal {@link FragmentParseErrorCondition} is signaled.
     */
    public static Program parse(final String source, final String sourceName, final int firstLine) {
        final var tokens = new Lexer(source, sourceName, firstLine).tokenize();
        return new Parser(tokens, sourceName).parseProgram();
    }

    private Program parseProgram() {
        final var body = new ArrayList<Statement>();
        while (peek().kind() != Token.Kind.END) {
            if (peek().kind() == Token.Kind.NEWLINE) {
                advance();
                continue;
            }
            if (peek().kind() == Token.Kind.INDENT) {
                throw signalError("Unexpected indentation");
            }
            parseStatement(body);
        }
        return new Program(sourceName, body);
    }

    private void parseStatement(final List<Statement> into) {
        final var token = peek();
        if (token.kind() == Token.Kind.KEYWORD) {
            switch (token.text()) {
                case "if" -> {
                    into.add(parseIf());
                    return;
                }
                case "for" -> {
                    into.add(parseFor());
                    return;
                }
                case "while" -> {
                    into.add(parseWhile());
                    return;
                }
                case "def" -> {
                    into.add(parseFunctionDefinition(List.of()));
                    return;
                }
                case "class" -> {
                    into.add(parseClassDefinition(List.of()));
                    return;
                }
                default -> {
                }
            }
        } else if (token.isOperator("@")) {
            into.add(parseDecorated());
            return;
        }
        parseSimpleStatements(into);
    }

    private void parseSimpleStatements(final List<Statement> into) {
        while (true) {
            into.add(parseSmallStatement());
            if (!accept(Token.Kind.OPERATOR, ";")) {
                break;
            }
            if (peek().kind() == Token.Kind.NEWLINE) {
                break;
            }
        }
        expectNewline();
    }

    private Statement parseSmallStatement() {
        final var token = peek();
        final var line = token.line();
        if (token.kind() == Token.Kind.KEYWORD) {
            switch (token.text()) {
                case "pass" -> {
                    advance();
                    return new Statement.Simple(Statement.Simple.Kind.PASS, line);
                }
                case "break" -> {
                    advance();
                    return new Statement.Simple(Statement.Simple.Kind.BREAK, line);
                }
                case "continue" -> {
                    advance();
                    return new Statement.Simple(Statement.Simple.Kind.CONTINUE, line);
                }
                case "return" -> {
                    advance();
                    final var value = atStatementEnd() ? null : parseTestList();
                    return new Statement.Return(value, line);
                }
                case "assert" -> {
                    advance();
                    final var condition = parseTest();
                    final var message = accept(Token.Kind.OPERATOR, ",") ? parseTest() : null;
                    return new Statement.Assert(condition, message, line);
                }
                default -> {
                }
            }
        }
        return parseExpressionStatement();
    }

    private Statement parseExpressionStatement() {
        final var line = peek().line();
        final var first = parseTestList();
        final var next = peek();
        if (next.kind() == Token.Kind.OPERATOR) {
            final var augmented = Expression.BinaryOperator.fromAugmentedAssignment(next.text());
            if (augmented != null) {
                advance();
                checkAssignable(first, false);
                return new Statement.AugmentedAssignment(first, augmented, parseTestList(), line);
            }
            if (next.text().equals("=")) {
                final var targets = new ArrayList<Expression>();
                var value = first;
                while (accept(Token.Kind.OPERATOR, "=")) {
                    checkAssignable(value, true);
                    targets.add(value);
                    value = parseTestList();
                }
                return new Statement.Assignment(targets, value, line);
            }
        }
        return new Statement.ExpressionStatement(first, line);
    }

    private Statement parseIf() {
        final var line = advance().line();
        final var branches = new ArrayList<Statement.Branch>();
        final var condition = parseTest();
        branches.add(new Statement.Branch(condition, parseSuite()));
        List<Statement> orElse = List.of();
        while (true) {
            if (accept(Token.Kind.KEYWORD, "elif")) {
                final var elifCondition = parseTest();
                branches.add(new Statement.Branch(elifCondition, parseSuite()));
            } else if (accept(Token.Kind.KEYWORD, "else")) {
                orElse = parseSuite();
                break;
            } else {
                break;
            }
        }
        return new Statement.If(branches, orElse, line);
    }

    private Statement parseFor() {
        final var line = advance().line();
        final var target = parseTargetList();
        expect(Token.Kind.KEYWORD, "in");
        final var iterable = parseTestList();
        final var body = parseSuite();
        final var orElse = accept(Token.Kind.KEYWORD, "else") ? parseSuite() : List.<Statement>of();
        return new Statement.For(target, iterable, body, orElse, line);
    }

    private Statement parseWhile() {
        final var line = advance().line();
        final var condition = parseTest();
        final var body = parseSuite();
        final var orElse = accept(Token.Kind.KEYWORD, "else") ? parseSuite() : List.<Statement>of();
        return new Statement.While(condition, body, orElse, line);
    }

    private Statement parseDecorated() {
        final var decorators = new ArrayList<Expression>();
        while (accept(Token.Kind.OPERATOR, "@")) {
            decorators.add(parseTest());
            expectNewline();
        }
        final var token = peek();
        if (token.isKeyword("def")) {
            return parseFunctionDefinition(decorators);
        } else if (token.isKeyword("class")) {
            return parseClassDefinition(decorators);
        }
        throw signalError("Expected 'def' or 'class' after decorators, but found " + token.describe());
    }

    private Statement parseFunctionDefinition(final List<Expression> decorators) {
        final var line = advance().line();
        final var name = expectName();
        expect(Token.Kind.OPERATOR, "(");
        final var parameters = parseParameters(")");
        expect(Token.Kind.OPERATOR, ")");
        final var body = parseSuite();
        return new Statement.FunctionDefinition(name, parameters, body, decorators, line);
    }

    private Statement parseClassDefinition(final List<Expression> decorators) {
        final var line = advance().line();
        final var name = expectName();
        @Nullable Expression base = null;
        if (accept(Token.Kind.OPERATOR, "(")) {
            if (!peek().isOperator(")")) {
                base = parseTest();
            }
            expect(Token.Kind.OPERATOR, ")");
        }
        final var body = parseSuite();
        return new Statement.ClassDefinition(name, base, body, decorators, line);
    }

    private List<Expression.Parameter> parseParameters(final String terminator) {
        final var parameters = new ArrayList<Expression.Parameter>();
        final var seen = new HashSet<String>();
        var defaultsStarted = false;
        while (!peek().isOperator(terminator)) {
            final var name = expectName();
            if (!seen.add(name)) {
                throw signalError("Duplicate parameter " + name);
            }
            @Nullable Expression defaultValue = null;
            if (accept(Token.Kind.OPERATOR, "=")) {
                defaultValue = parseTest();
                defaultsStarted = true;
            } else if (defaultsStarted) {
                throw signalError("Parameter " + name + " without a default follows a parameter with one");
            }
            parameters.add(new Expression.Parameter(name, defaultValue));
            if (!accept(Token.Kind.OPERATOR, ",")) {
                break;
            }
        }
        return parameters;
    }

    private List<Statement> parseSuite() {
        expect(Token.Kind.OPERATOR, ":");
        final var body = new ArrayList<Statement>();
        if (peek().kind() != Token.Kind.NEWLINE) {
            parseSimpleStatements(body);
            return body;
        }
        advance();
        if (peek().kind() != Token.Kind.INDENT) {
            throw signalError("Expected an indented block, but found " + peek().describe());
        }
        advance();
        enterNesting();
        try {
            while (peek().kind() != Token.Kind.DEDENT && peek().kind() != Token.Kind.END) {
                parseStatement(body);
            }
        } finally {
            currentDepth -= 1;
        }
        accept(Token.Kind.DEDENT, "");
        return body;
    }

    private Expression parseTargetList() {
        final var line = peek().line();
        final var first = parseTargetAtom();
        if (!peek().isOperator(",")) {
            return first;
        }
        final var elements = new ArrayList<Expression>();
        elements.add(first);
        while (accept(Token.Kind.OPERATOR, ",")) {
            if (peek().isKeyword("in") || peek().isOperator("=")) {
                break;
            }
            elements.add(parseTargetAtom());
        }
        return new Expression.TupleDisplay(elements, line);
    }

    private Expression parseTargetAtom() {
        final var target = parseOperand();
        checkAssignable(target, true);
        return target;
    }

    private Expression parseTestList() {
        final var line = peek().line();
        final var first = parseTest();
        if (!peek().isOperator(",")) {
            return first;
        }
        final var elements = new ArrayList<Expression>();
        elements.add(first);
        while (accept(Token.Kind.OPERATOR, ",")) {
            if (atStatementEnd() || peek().isOperator("=") || peek().isOperator(")")) {
                break;
            }
            elements.add(parseTest());
        }
        return new Expression.TupleDisplay(elements, line);
    }

    private Expression parseTest() {
        enterNesting();
        try {
            if (peek().isKeyword("lambda")) {
                return parseLambda();
            }
            final var line = peek().line();
            final var value = parseOr();
            if (peek().isKeyword("if") && !inComprehensionCondition) {
                advance();
                final var condition = parseOr();
                expect(Token.Kind.KEYWORD, "else");
                final var otherwise = parseTest();
                return new Expression.Conditional(condition, value, otherwise, line);
            }
            return value;
        } finally {
            currentDepth -= 1;
        }
    }

    private Expression parseLambda() {
        final var line = advance().line();
        final var parameters = parseParameters(":");
        expect(Token.Kind.OPERATOR, ":");
        return new Expression.Lambda(parameters, parseTest(), line);
    }

    private Expression parseOr() {
        var left = parseAnd();
        while (peek().isKeyword("or")) {
            final var line = advance().line();
            left = new Expression.Logical(false, left, parseAnd(), line);
        }
        return left;
    }

    private Expression parseAnd() {
        var left = parseNot();
        while (peek().isKeyword("and")) {
            final var line = advance().line();
            left = new Expression.Logical(true, left, parseNot(), line);
        }
        return left;
    }

    private Expression parseNot() {
        if (peek().isKeyword("not")) {
            final var line = advance().line();
            enterNesting();
            try {
                return new Expression.Unary(Expression.UnaryOperator.NOT, parseNot(), line);
            } finally {
                currentDepth -= 1;
            }
        }
        return parseComparison();
    }

    private Expression parseComparison() {
        final var line = peek().line();
        final var first = parseArithmetic();
        final var operators = new ArrayList<Expression.ComparisonOperator>();
        final var rest = new ArrayList<Expression>();
        while (true) {
            final var operator = parseComparisonOperator();
            if (operator == null) {
                break;
            }
            operators.add(operator);
            rest.add(parseArithmetic());
        }
        return operators.isEmpty() ? first : new Expression.Comparison(first, operators, rest, line);
    }

    private Expression.@Nullable ComparisonOperator parseComparisonOperator() {
        final var token = peek();
        if (token.kind() == Token.Kind.OPERATOR) {
            final Expression.@Nullable ComparisonOperator operator = switch (token.text()) {
                case "<" -> Expression.ComparisonOperator.LESS;
                case ">" -> Expression.ComparisonOperator.GREATER;
                case "<=" -> Expression.ComparisonOperator.LESS_OR_EQUAL;
                case ">=" -> Expression.ComparisonOperator.GREATER_OR_EQUAL;
                case "==" -> Expression.ComparisonOperator.EQUAL;
                case "!=" -> Expression.ComparisonOperator.NOT_EQUAL;
                default -> null;
            };
            if (operator != null) {
                advance();
            }
            return operator;
        }
        if (token.isKeyword("in")) {
            advance();
            return Expression.ComparisonOperator.IN;
        }
        if (token.isKeyword("not") && peekAt(1).isKeyword("in")) {
            advance();
            advance();
            return Expression.ComparisonOperator.NOT_IN;
        }
        if (token.isKeyword("is")) {
            advance();
            return accept(Token.Kind.KEYWORD, "not")
                ? Expression.ComparisonOperator.IS_NOT
                : Expression.ComparisonOperator.IS;
        }
        return null;
    }

    private Expression parseArithmetic() {
        var left = parseTerm();
        while (true) {
            final var token = peek();
            final Expression.BinaryOperator operator;
            if (token.isOperator("+")) {
                operator = Expression.BinaryOperator.ADD;
            } else if (token.isOperator("-")) {
                operator = Expression.BinaryOperator.SUBTRACT;
            } else {
                return left;
            }
            advance();
            left = new Expression.Binary(operator, left, parseTerm(), token.line());
        }
    }

    private Expression parseTerm() {
        var left = parseFactor();
        while (true) {
            final var token = peek();
            final Expression.BinaryOperator operator;
            if (token.isOperator("*")) {
                operator = Expression.BinaryOperator.MULTIPLY;
            } else if (token.isOperator("/")) {
                operator = Expression.BinaryOperator.DIVIDE;
            } else if (token.isOperator("//")) {
                operator = Expression.BinaryOperator.FLOOR_DIVIDE;
            } else if (token.isOperator("%")) {
                operator = Expression.BinaryOperator.MODULO;
            } else {
                return left;
            }
            advance();
            left = new Expression.Binary(operator, left, parseFactor(), token.line());
        }
    }

    private Expression parseFactor() {
        final var token = peek();
        if (token.isOperator("-") || token.isOperator("+")) {
            advance();
            enterNesting();
            try {
                final var operator = token.isOperator("-")
                    ? Expression.UnaryOperator.NEGATE
                    : Expression.UnaryOperator.PLUS;
                return new Expression.Unary(operator, parseFactor(), token.line());
            } finally {
                currentDepth -= 1;
            }
        }
        return parsePower();
    }

    private Expression parsePower() {
        final var base = parseOperand();
        if (peek().isOperator("**")) {
            final var line = advance().line();
            return new Expression.Binary(Expression.BinaryOperator.POWER, base, parseFactor(), line);
        }
        return base;
    }

    // An atom followed by any number of calls, subscripts and attribute accesses.
    private Expression parseOperand() {
        var expression = parseAtom();
        while (true) {
            final var token = peek();
            if (token.isOperator("(")) {
                advance();
                expression = parseCall(expression, token.line());
            } else if (token.isOperator("[")) {
                advance();
                final var index = parseSubscriptIndex();
                expect(Token.Kind.OPERATOR, "]");
                expression = new Expression.Subscript(expression, index, token.line());
            } else if (token.isOperator(".")) {
                advance();
                expression = new Expression.Attribute(expression, expectName(), token.line());
            } else {
                return expression;
            }
        }
    }

    private Expression parseCall(final Expression function, final int line) {
        final var arguments = new ArrayList<Expression>();
        final var keywordArguments = new ArrayList<Expression.KeywordArgument>();
        final var seenKeywords = new HashSet<String>();
        while (!peek().isOperator(")")) {
            if (peek().kind() == Token.Kind.NAME && peekAt(1).isOperator("=")) {
                final var name = advance().text();
                advance();
                if (!seenKeywords.add(name)) {
                    throw signalError("Keyword argument " + name + " repeated");
                }
                keywordArguments.add(new Expression.KeywordArgument(name, parseTest()));
            } else {
                if (!keywordArguments.isEmpty()) {
                    throw signalError("Positional argument follows keyword argument");
                }
                arguments.add(parseTest());
            }
            if (!accept(Token.Kind.OPERATOR, ",")) {
                break;
            }
        }
        expect(Token.Kind.OPERATOR, ")");
        return new Expression.Call(function, arguments, keywordArguments, line);
    }

    private Expression parseSubscriptIndex() {
        final var line = peek().line();
        @Nullable Expression lower = null;
        if (!peek().isOperator(":")) {
            lower = parseTest();
            if (!peek().isOperator(":")) {
                return lower;
            }
        }
        advance();
        final var upper = peek().isOperator("]") ? null : parseTest();
        return new Expression.Slice(lower, upper, line);
    }

    private Expression parseAtom() {
        final var token = advance();
        final var line = token.line();
        switch (token.kind()) {
            case NAME:
                return new Expression.Name(token.text(), line);
            case INTEGER:
            case DECIMAL:
                return new Expression.Literal(token.value(), line);
            case STRING: {
                final var builder = new StringBuilder(token.text());
                while (peek().kind() == Token.Kind.STRING) {
                    builder.append(advance().text());
                }
                return new Expression.Literal(builder.toString(), line);
            }
            case KEYWORD:
                switch (token.text()) {
                    case "True":
                        return new Expression.Literal(Boolean.TRUE, line);
                    case "False":
                        return new Expression.Literal(Boolean.FALSE, line);
                    case "None":
                        return new Expression.Literal(null, line);
                    default:
                        break;
                }
                break;
            case OPERATOR:
                switch (token.text()) {
                    case "(":
                        return parseParenthesized(line);
                    case "[":
                        return parseListDisplay(line);
                    case "{":
                        return parseDictDisplay(line);
                    default:
                        break;
                }
                break;
            default:
                break;
        }
        throw signalError("Expected an expression, but found " + token.describe(), line);
    }

    private Expression parseParenthesized(final int line) {
        enterNesting();
        try {
            if (accept(Token.Kind.OPERATOR, ")")) {
                return new Expression.TupleDisplay(List.of(), line);
            }
            final var first = parseTest();
            if (accept(Token.Kind.OPERATOR, ")")) {
                return first;
            }
            final var elements = new ArrayList<Expression>();
            elements.add(first);
            while (accept(Token.Kind.OPERATOR, ",")) {
                if (peek().isOperator(")")) {
                    break;
                }
                elements.add(parseTest());
            }
            expect(Token.Kind.OPERATOR, ")");
            return new Expression.TupleDisplay(elements, line);
        } finally {
            currentDepth -= 1;
        }
    }

    private Expression parseListDisplay(final int line) {
        enterNesting();
        try {
            final var elements = new ArrayList<Expression>();
            if (accept(Token.Kind.OPERATOR, "]")) {
                return new Expression.ListDisplay(elements, line);
            }
            final var first = parseTest();
            if (peek().isKeyword("for")) {
                final var clauses = parseComprehensionClauses();
                expect(Token.Kind.OPERATOR, "]");
                return new Expression.ListComprehension(first, clauses, line);
            }
            elements.add(first);
            while (accept(Token.Kind.OPERATOR, ",")) {
                if (peek().isOperator("]")) {
                    break;
                }
                elements.add(parseTest());
            }
            expect(Token.Kind.OPERATOR, "]");
            return new Expression.ListDisplay(elements, line);
        } finally {
            currentDepth -= 1;
        }
    }

    private List<Expression.Comprehension> parseComprehensionClauses() {
        final var clauses = new ArrayList<Expression.Comprehension>();
        while (accept(Token.Kind.KEYWORD, "for")) {
            final var target = parseTargetList();
            expect(Token.Kind.KEYWORD, "in");
            final var iterable = parseOr();
            final var conditions = new ArrayList<Expression>();
            while (accept(Token.Kind.KEYWORD, "if")) {
                final var saved = inComprehensionCondition;
                inComprehensionCondition = true;
                try {
                    conditions.add(parseTest());
                } finally {
                    inComprehensionCondition = saved;
                }
            }
            clauses.add(new Expression.Comprehension(target, iterable, conditions));
        }
        return clauses;
    }

    private Expression parseDictDisplay(final int line) {
        enterNesting();
        try {
            final var keys = new ArrayList<Expression>();
            final var values = new ArrayList<Expression>();
            while (!peek().isOperator("}")) {
                keys.add(parseTest());
                expect(Token.Kind.OPERATOR, ":");
                values.add(parseTest());
                if (!accept(Token.Kind.OPERATOR, ",")) {
                    break;
                }
            }
            expect(Token.Kind.OPERATOR, "}");
            return new Expression.DictDisplay(keys, values, line);
        } finally {
            currentDepth -= 1;
        }
    }

    private void checkAssignable(final Expression target, final boolean allowTuples) {
        if (target instanceof Expression.Name
            || target instanceof Expression.Attribute
            || target instanceof Expression.Subscript) {
            return;
        }
        if (allowTuples && target instanceof final Expression.TupleDisplay tuple && !tuple.elements().isEmpty()) {
            for (final var element : tuple.elements()) {
                checkAssignable(element, true);
            }
            return;
        }
        if (allowTuples && target instanceof final Expression.ListDisplay list && !list.elements().isEmpty()) {
            for (final var element : list.elements()) {
                checkAssignable(element, true);
            }
            return;
        }
        throw signalError("Cannot assign to this expression", target.line());
    }

    private boolean atStatementEnd() {
        final var token = peek();
        return token.kind() == Token.Kind.NEWLINE || token.kind() == Token.Kind.END || token.isOperator(";");
    }

    private void expectNewline() {
        final var token = peek();
        if (token.kind() == Token.Kind.NEWLINE) {
            advance();
        } else if (token.kind() != Token.Kind.END && token.kind() != Token.Kind.DEDENT) {
            throw signalError("Expected end of line, but found " + token.describe());
        }
    }

    private String expectName() {
        final var token = peek();
        if (token.kind() != Token.Kind.NAME) {
            throw signalError("Expected a name, but found " + token.describe());
        }
        advance();
        return token.text();
    }

    private void expect(final Token.Kind kind, final String text) {
        if (!accept(kind, text)) {
            throw signalError("Expected '" + text + "', but found " + peek().describe());
        }
    }

    private boolean accept(final Token.Kind kind, final String text) {
        if (peek().is(kind, text)) {
            advance();
            return true;
        }
        return false;
    }

    private Token peek() {
        return tokens.get(position);
    }

    private Token peekAt(final int offset) {
        return tokens.get(Math.min(position + offset, tokens.size() - 1));
    }

    private Token advance() {
        final var token = tokens.get(position);
        if (position < tokens.size() - 1) {
            position += 1;
        }
        return token;
    }

    private void enterNesting() {
        currentDepth += 1;
        if (currentDepth > maxDepth) {
            throw signalError("Nesting limit reached, try to limit nesting");
        }
    }

    private UnhandledErrorError signalError(final String message) {
        throw signalError(message, peek().line());
    }

    private UnhandledErrorError signalError(final String message, final int line) {
        throw ConditionContext.error(new FragmentParseErrorCondition(message, new SourceLocation(sourceName, line)));
    }

    private static final int maxDepth = 200;

    private final List<Token> tokens;
    private final String sourceName;
    private int position = 0;
    private int currentDepth = 0;
    private boolean inComprehensionCondition = false;
}
