package com.complexity.analyzer.parser;

import com.complexity.analyzer.ast.ArrayAccess;
import com.complexity.analyzer.ast.ArrayCreation;
import com.complexity.analyzer.ast.Assignment;
import com.complexity.analyzer.ast.BinaryOperation;
import com.complexity.analyzer.ast.BooleanLiteral;
import com.complexity.analyzer.ast.CallExpression;
import com.complexity.analyzer.ast.CallStatement;
import com.complexity.analyzer.ast.ClassDefinition;
import com.complexity.analyzer.ast.Declaration;
import com.complexity.analyzer.ast.Expression;
import com.complexity.analyzer.ast.FieldAccess;
import com.complexity.analyzer.ast.ForLoop;
import com.complexity.analyzer.ast.Identifier;
import com.complexity.analyzer.ast.IfStatement;
import com.complexity.analyzer.ast.LengthCall;
import com.complexity.analyzer.ast.NoOp;
import com.complexity.analyzer.ast.NullLiteral;
import com.complexity.analyzer.ast.NumberLiteral;
import com.complexity.analyzer.ast.Parameter;
import com.complexity.analyzer.ast.PrintStatement;
import com.complexity.analyzer.ast.Procedure;
import com.complexity.analyzer.ast.Program;
import com.complexity.analyzer.ast.RangeExpression;
import com.complexity.analyzer.ast.RepeatUntilLoop;
import com.complexity.analyzer.ast.ReturnStatement;
import com.complexity.analyzer.ast.Statement;
import com.complexity.analyzer.ast.StringLiteral;
import com.complexity.analyzer.ast.UnaryOperation;
import com.complexity.analyzer.ast.WhileLoop;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Recursive-descent parser for the pseudocode dialect.
 *
 * The grammar is deliberately relaxed: loop and branch bodies may be a {@code begin ... end}
 * block or an inline statement run closed by {@code end}, and {@code let}/{@code declare}
 * lines are tolerated as no-ops. There is no error recovery; the first unmatched rule
 * raises a {@link ParserException} with the offending token's position.
 */
public class Parser {

    private static final Logger logger = LoggerFactory.getLogger(Parser.class);

    private static final Set<String> PROCEDURE_KEYWORDS = Set.of(
            "procedure", "procedimiento", "function", "funcion", "algorithm", "algoritmo");
    private static final Set<String> HEADER_KEYWORDS = Set.of("algorithm", "algoritmo");
    private static final Set<String> TOLERATED_KEYWORDS = Set.of("let", "declare");

    private static final Set<String> BLOCK_STOP = Set.of("end");
    private static final Set<String> THEN_STOP = Set.of("else", "end", "until");
    private static final Set<String> INLINE_LOOP_STOP = Set.of("end", "else", "until");
    private static final Set<String> REPEAT_STOP = Set.of("until");

    private final List<Token> tokens;
    private int index = 0;

    public Parser(List<Token> tokens) {
        if (tokens.isEmpty() || tokens.get(tokens.size() - 1).getKind() != TokenKind.EOF) {
            throw new IllegalArgumentException("Token stream must end with an EOF token");
        }
        this.tokens = tokens;
    }

    /**
     * Tokenizes and parses a complete pseudocode unit.
     *
     * @param source the pseudocode text
     * @return the program tree
     * @throws SyntaxException if the source cannot be tokenized or parsed
     */
    public static Program parse(String source) throws SyntaxException {
        List<Token> tokens = new Lexer(source).tokenize();
        return new Parser(tokens).parseProgram();
    }

    /**
     * Parses the token stream as a full program: class definitions, declarations,
     * an optional header, procedures and the main block.
     *
     * @return the program tree
     * @throws ParserException on the first grammar violation
     */
    public Program parseProgram() throws ParserException {
        List<ClassDefinition> classDefinitions = new ArrayList<>();
        List<Declaration> declarations = new ArrayList<>();
        List<Procedure> procedures = new ArrayList<>();
        String name = null;

        while (current().isKeyword("class")) {
            classDefinitions.add(parseClassDefinition());
        }
        parseDeclarations(declarations);

        // "algorithm NAME" without parameters names the main block; with parameters it is a procedure
        if (isKeywordIn(current(), HEADER_KEYWORDS)
                && peek(1).getKind() == TokenKind.IDENTIFIER
                && !peek(2).isSymbol("(")) {
            advance();
            name = advance().getLexeme();
            parseDeclarations(declarations);
        }

        parseProcedures(procedures);

        List<Statement> body = new ArrayList<>();
        if (current().getKind() == TokenKind.EOF) {
            if (procedures.isEmpty()) {
                throw new ParserException("Expected 'begin' to open the main block", current());
            }
        } else {
            body = parseBeginEndBlock();
            parseProcedures(procedures);
            if (current().getKind() != TokenKind.EOF) {
                throw new ParserException("Unexpected input after the main block", current());
            }
        }

        logger.debug("Parsed program '{}' with {} procedures and {} main statements",
                name, procedures.size(), body.size());
        return new Program(name, classDefinitions, declarations, procedures, body);
    }

    // ---------------------------------------------------------------- top level

    private ClassDefinition parseClassDefinition() throws ParserException {
        Token start = advance();
        String className = expectIdentifier("Expected class name").getLexeme();
        expectSymbol("{", "Expected '{' after class name");

        List<String> attributes = new ArrayList<>();
        while (!current().isSymbol("}")) {
            if (current().getKind() == TokenKind.EOF) {
                throw new ParserException("Unterminated class definition", current());
            }
            Token attribute = advance();
            if (attribute.getKind() == TokenKind.IDENTIFIER) {
                attributes.add(attribute.getLexeme());
            }
        }
        advance();
        return new ClassDefinition(className, attributes, start.getLine(), start.getColumn());
    }

    private void parseDeclarations(List<Declaration> declarations) {
        while (isKeywordIn(current(), TOLERATED_KEYWORDS)) {
            Token start = advance();
            String declared = current().getKind() == TokenKind.IDENTIFIER ? current().getLexeme() : "";
            String text = start.getLexeme() + " " + skipRestOfLine(start.getLine());
            declarations.add(new Declaration(declared, text.trim(), start.getLine(), start.getColumn()));
        }
    }

    private void parseProcedures(List<Procedure> procedures) throws ParserException {
        Procedure procedure = tryParseProcedure();
        while (procedure != null) {
            procedures.add(procedure);
            procedure = tryParseProcedure();
        }
    }

    /**
     * Parses a procedure definition if one starts here. A keyword-introduced header commits
     * the parser; a bare {@code NAME(} header is speculative and rewinds when no
     * {@code begin} follows.
     */
    private Procedure tryParseProcedure() throws ParserException {
        int saved = index;
        Token start = current();
        boolean keywordForm = isKeywordIn(start, PROCEDURE_KEYWORDS) && peek(1).getKind() == TokenKind.IDENTIFIER;
        boolean bareForm = start.getKind() == TokenKind.IDENTIFIER && peek(1).isSymbol("(");
        if (!keywordForm && !bareForm) {
            return null;
        }

        try {
            if (keywordForm) {
                advance();
            }
            Token nameToken = advance();
            List<Parameter> parameters = new ArrayList<>();
            if (matchSymbol("(")) {
                parameters = parseParameters();
            }
            if (matchKeyword("returns")) {
                skipRestOfLine(previous().getLine());
            }
            if (!current().isKeyword("begin")) {
                if (keywordForm) {
                    throw new ParserException("Expected 'begin' after procedure header", current());
                }
                index = saved;
                return null;
            }
            List<Statement> body = parseBeginEndBlock();
            return new Procedure(nameToken.getLexeme(), parameters, body, start.getLine(), start.getColumn());
        } catch (ParserException e) {
            if (keywordForm) {
                throw e;
            }
            logger.trace("Backtracking from speculative procedure header at {}:{}", start.getLine(), start.getColumn());
            index = saved;
            return null;
        }
    }

    private List<Parameter> parseParameters() throws ParserException {
        List<Parameter> parameters = new ArrayList<>();
        if (matchSymbol(")")) {
            return parameters;
        }
        do {
            Token nameToken = advance();
            if (nameToken.getKind() != TokenKind.IDENTIFIER && nameToken.getKind() != TokenKind.KEYWORD) {
                throw new ParserException("Expected parameter name", nameToken);
            }
            String annotation = parseArrayAnnotation();
            parameters.add(new Parameter(nameToken.getLexeme(), annotation, nameToken.getLine(), nameToken.getColumn()));
        } while (matchSymbol(","));
        expectSymbol(")", "Expected ')' after parameters");
        return parameters;
    }

    /**
     * Reads shape hints like {@code [n]}, {@code [1..n]} or {@code [n]..[m]} as raw text.
     */
    private String parseArrayAnnotation() throws ParserException {
        if (!current().isSymbol("[")) {
            return null;
        }
        StringBuilder annotation = new StringBuilder();
        while (current().isSymbol("[")) {
            int depth = 0;
            do {
                Token token = advance();
                if (token.getKind() == TokenKind.EOF) {
                    throw new ParserException("Unterminated parameter annotation", token);
                }
                if (token.isSymbol("[")) {
                    depth++;
                } else if (token.isSymbol("]")) {
                    depth--;
                }
                annotation.append(token.getLexeme());
            } while (depth > 0);

            if (current().isSymbol("..") && peek(1).isSymbol("[")) {
                annotation.append(advance().getLexeme());
            }
        }
        return annotation.toString();
    }

    // ---------------------------------------------------------------- blocks

    private List<Statement> parseBeginEndBlock() throws ParserException {
        expectKeyword("begin", "Expected 'begin'");
        List<Statement> statements = parseStatements(BLOCK_STOP);
        expectKeyword("end", "Expected 'end' to close block");
        return statements;
    }

    private List<Statement> parseStatements(Set<String> stopKeywords) throws ParserException {
        List<Statement> statements = new ArrayList<>();
        while (current().getKind() != TokenKind.EOF && !isKeywordIn(current(), stopKeywords)) {
            statements.add(parseStatement());
        }
        return statements;
    }

    /**
     * Parses either a {@code begin ... end} block or an inline statement run.
     *
     * @param stopKeywords keywords that end an inline run
     * @param consumeEnd whether an inline run swallows a closing {@code end}
     */
    private Block parseRelaxedBlock(Set<String> stopKeywords, boolean consumeEnd) throws ParserException {
        if (current().isKeyword("begin")) {
            return new Block(parseBeginEndBlock(), true);
        }
        List<Statement> statements = parseStatements(stopKeywords);
        if (consumeEnd) {
            matchKeyword("end");
        }
        return new Block(statements, false);
    }

    private static final class Block {
        final List<Statement> statements;
        final boolean delimited;

        Block(List<Statement> statements, boolean delimited) {
            this.statements = statements;
            this.delimited = delimited;
        }
    }

    // ---------------------------------------------------------------- statements

    private Statement parseStatement() throws ParserException {
        Token token = current();

        if (token.getKind() == TokenKind.KEYWORD) {
            switch (token.getLexeme()) {
                case "for":
                    return parseFor();
                case "while":
                    return parseWhile();
                case "repeat":
                    return parseRepeat();
                case "if":
                    return parseIf();
                case "call":
                    return parseCallStatement();
                case "swap":
                    return parseSwap();
                case "let":
                case "declare":
                    advance();
                    skipRestOfLine(token.getLine());
                    return new NoOp(token.getLine(), token.getColumn());
                case "return":
                    return parseReturn();
                case "print":
                    advance();
                    return new PrintStatement(parseExpression(), token.getLine(), token.getColumn());
                default:
                    throw new ParserException("Unexpected keyword at start of statement", token);
            }
        }

        if (token.getKind() == TokenKind.IDENTIFIER) {
            if (peek(1).isSymbol("(")) {
                advance();
                advance();
                List<Expression> arguments = parseArguments();
                return new CallStatement(token.getLexeme(), arguments, token.getLine(), token.getColumn());
            }
            return parseAssignment();
        }

        throw new ParserException("Expected a statement", token);
    }

    private Statement parseFor() throws ParserException {
        Token start = advance();
        Token iterator = expectIdentifier("Expected loop variable after 'for'");
        expectAssignmentOperator();
        Expression from = parseExpression();

        boolean descending;
        if (matchKeyword("to")) {
            descending = false;
        } else if (matchKeyword("downto")) {
            descending = true;
        } else {
            throw new ParserException("Expected 'to' or 'downto' in for loop", current());
        }

        Expression to = parseExpression();
        expectKeyword("do", "Expected 'do' after for loop bounds");
        Block body = parseRelaxedBlock(INLINE_LOOP_STOP, true);
        return new ForLoop(iterator.getLexeme(), from, to, descending, body.statements,
                start.getLine(), start.getColumn());
    }

    private Statement parseWhile() throws ParserException {
        Token start = advance();
        Expression condition = parseExpression();
        expectKeyword("do", "Expected 'do' after while condition");
        Block body = parseRelaxedBlock(INLINE_LOOP_STOP, true);
        return new WhileLoop(condition, body.statements, start.getLine(), start.getColumn());
    }

    private Statement parseRepeat() throws ParserException {
        Token start = advance();
        List<Statement> body = parseStatements(REPEAT_STOP);
        expectKeyword("until", "Expected 'until' to close repeat");
        Expression condition = parseExpression();
        return new RepeatUntilLoop(body, condition, start.getLine(), start.getColumn());
    }

    private Statement parseIf() throws ParserException {
        Token start = advance();
        Expression condition = parseExpression();
        expectKeyword("then", "Expected 'then' after if condition");
        Block thenBlock = parseRelaxedBlock(THEN_STOP, false);

        List<Statement> elseBranch = new ArrayList<>();
        if (matchKeyword("else")) {
            if (current().isKeyword("if")) {
                // else-if chains nest without touching the enclosing block's end
                elseBranch.add(parseIf());
            } else {
                elseBranch = parseRelaxedBlock(BLOCK_STOP, true).statements;
            }
        } else if (!thenBlock.delimited) {
            matchKeyword("end");
        }

        return new IfStatement(condition, thenBlock.statements, elseBranch, start.getLine(), start.getColumn());
    }

    private Statement parseCallStatement() throws ParserException {
        Token start = advance();
        Token name = expectIdentifier("Expected procedure name after 'call'");
        expectSymbol("(", "Expected '(' after procedure name");
        List<Expression> arguments = parseArguments();
        return new CallStatement(name.getLexeme(), arguments, start.getLine(), start.getColumn());
    }

    private Statement parseSwap() throws ParserException {
        Token start = advance();
        Expression first = parseExpression();
        expectKeyword("with", "Expected 'with' in swap statement");
        Expression second = parseExpression();
        return new CallStatement("swap", List.of(first, second), start.getLine(), start.getColumn());
    }

    private Statement parseReturn() throws ParserException {
        Token start = advance();
        Token next = current();
        boolean hasValue = next.getKind() != TokenKind.EOF
                && next.getLine() == start.getLine()
                && !next.isKeyword("end")
                && !next.isKeyword("else")
                && !next.isKeyword("until");
        Expression value = hasValue ? parseExpression() : null;
        return new ReturnStatement(value, start.getLine(), start.getColumn());
    }

    private Statement parseAssignment() throws ParserException {
        Token start = current();
        Expression target = parseLValue();
        expectAssignmentOperator();
        Expression value = parseExpression();
        return new Assignment(target, value, start.getLine(), start.getColumn());
    }

    private Expression parseLValue() throws ParserException {
        Token name = expectIdentifier("Expected assignment target");
        Expression target = new Identifier(name.getLexeme(), name.getLine(), name.getColumn());
        while (true) {
            if (matchSymbol("[")) {
                target = parseIndexSuffix(target);
            } else if (matchSymbol(".")) {
                Token field = expectIdentifier("Expected field name after '.'");
                target = new FieldAccess(target, field.getLexeme(), field.getLine(), field.getColumn());
            } else {
                return target;
            }
        }
    }

    private void expectAssignmentOperator() throws ParserException {
        if (!matchSymbol(Token.ASSIGN) && !matchSymbol("=")) {
            throw new ParserException("Expected assignment operator", current());
        }
    }

    // ---------------------------------------------------------------- expressions

    /**
     * Entry point of the precedence climb. Ranges bind loosest so {@code mid+1..n} works.
     */
    private Expression parseExpression() throws ParserException {
        Expression expression = parseOr();
        if (current().isSymbol("..")) {
            Token range = advance();
            Expression end = parseOr();
            return new RangeExpression(expression, end, range.getLine(), range.getColumn());
        }
        return expression;
    }

    private Expression parseOr() throws ParserException {
        Expression left = parseAnd();
        while (current().isKeyword("or")) {
            Token operator = advance();
            left = new BinaryOperation("or", left, parseAnd(), operator.getLine(), operator.getColumn());
        }
        return left;
    }

    private Expression parseAnd() throws ParserException {
        Expression left = parseEquality();
        while (current().isKeyword("and")) {
            Token operator = advance();
            left = new BinaryOperation("and", left, parseEquality(), operator.getLine(), operator.getColumn());
        }
        return left;
    }

    private Expression parseEquality() throws ParserException {
        Expression left = parseComparison();
        while (current().isSymbol("=") || current().isSymbol("<>")) {
            Token operator = advance();
            left = new BinaryOperation(operator.getLexeme(), left, parseComparison(),
                    operator.getLine(), operator.getColumn());
        }
        return left;
    }

    private Expression parseComparison() throws ParserException {
        Expression left = parseAdditive();
        while (current().isSymbol("<") || current().isSymbol(">")
                || current().isSymbol("<=") || current().isSymbol(">=")) {
            Token operator = advance();
            left = new BinaryOperation(operator.getLexeme(), left, parseAdditive(),
                    operator.getLine(), operator.getColumn());
        }
        return left;
    }

    private Expression parseAdditive() throws ParserException {
        Expression left = parseMultiplicative();
        while (current().isSymbol("+") || current().isSymbol("-")) {
            Token operator = advance();
            left = new BinaryOperation(operator.getLexeme(), left, parseMultiplicative(),
                    operator.getLine(), operator.getColumn());
        }
        return left;
    }

    private Expression parseMultiplicative() throws ParserException {
        Expression left = parseUnary();
        while (current().isSymbol("*") || current().isSymbol("/") || current().isSymbol("%")
                || current().isKeyword("mod") || current().isKeyword("div")) {
            Token operator = advance();
            String lexeme = operator.isSymbol("%") ? "mod" : operator.getLexeme();
            left = new BinaryOperation(lexeme, left, parseUnary(), operator.getLine(), operator.getColumn());
        }
        return left;
    }

    private Expression parseUnary() throws ParserException {
        Token token = current();
        if (token.isSymbol("-") || token.isSymbol("+") || token.isKeyword("not")) {
            advance();
            return new UnaryOperation(token.getLexeme(), parseUnary(), token.getLine(), token.getColumn());
        }
        return parsePrimary();
    }

    private Expression parsePrimary() throws ParserException {
        Token token = current();

        switch (token.getKind()) {
            case NUMBER:
                advance();
                try {
                    return new NumberLiteral(Long.parseLong(token.getLexeme()), token.getLine(), token.getColumn());
                } catch (NumberFormatException e) {
                    throw new ParserException("Number literal out of range", token);
                }
            case STRING:
                advance();
                return new StringLiteral(token.getLexeme(), token.getLine(), token.getColumn());
            case IDENTIFIER:
                advance();
                return parsePostfix(new Identifier(token.getLexeme(), token.getLine(), token.getColumn()));
            case KEYWORD:
                return parseKeywordPrimary(token);
            case SYMBOL:
                if (token.isSymbol("(")) {
                    advance();
                    Expression inner = parseExpression();
                    expectSymbol(")", "Expected ')'");
                    return inner;
                }
                throw new ParserException("Unexpected symbol in expression", token);
            default:
                throw new ParserException("Unexpected end of input in expression", token);
        }
    }

    private Expression parseKeywordPrimary(Token token) throws ParserException {
        switch (token.getLexeme()) {
            case "null":
                advance();
                return new NullLiteral(token.getLine(), token.getColumn());
            case "true":
            case "false":
                advance();
                return new BooleanLiteral(token.getLexeme().equals("true"), token.getLine(), token.getColumn());
            case "length": {
                advance();
                expectSymbol("(", "Expected '(' after 'length'");
                Token array = expectIdentifier("Expected array name in length()");
                // length(A[i]) reads the row length of A; the shape is irrelevant for cost
                while (!current().isSymbol(")") && current().getKind() != TokenKind.EOF) {
                    advance();
                }
                expectSymbol(")", "Expected ')' after length argument");
                return new LengthCall(array.getLexeme(), token.getLine(), token.getColumn());
            }
            case "call": {
                advance();
                Token name = expectIdentifier("Expected procedure name after 'call'");
                expectSymbol("(", "Expected '(' after procedure name");
                List<Expression> arguments = parseArguments();
                return new CallExpression(name.getLexeme(), arguments, token.getLine(), token.getColumn());
            }
            case "new": {
                advance();
                if (current().isKeyword("array") || current().getKind() == TokenKind.IDENTIFIER) {
                    advance();
                }
                Token open = current();
                if (!matchSymbol("[") && !matchSymbol("(")) {
                    throw new ParserException("Expected array size after 'new'", current());
                }
                Expression size = parseExpression();
                expectSymbol(open.isSymbol("[") ? "]" : ")", "Expected closing bracket after array size");
                return new ArrayCreation(size, token.getLine(), token.getColumn());
            }
            default:
                throw new ParserException("Unexpected keyword in expression", token);
        }
    }

    private Expression parsePostfix(Expression base) throws ParserException {
        Expression expression = base;
        while (true) {
            Token token = current();
            if (matchSymbol("[")) {
                expression = parseIndexSuffix(expression);
            } else if (matchSymbol(".")) {
                Token field = expectIdentifier("Expected field name after '.'");
                expression = new FieldAccess(expression, field.getLexeme(), field.getLine(), field.getColumn());
            } else if (token.isSymbol("(")) {
                advance();
                List<Expression> arguments = parseArguments();
                expression = new CallExpression(calleeName(expression, token), arguments,
                        base.getLine(), base.getColumn());
            } else {
                return expression;
            }
        }
    }

    /**
     * Parses the rest of an index after {@code [}. {@code C[i, j]} nests as {@code C[i][j]}.
     */
    private Expression parseIndexSuffix(Expression base) throws ParserException {
        Expression result = base;
        do {
            Expression index = parseExpression();
            result = new ArrayAccess(result, index, index.getLine(), index.getColumn());
        } while (matchSymbol(","));
        expectSymbol("]", "Expected ']' after index");
        return result;
    }

    private String calleeName(Expression callee, Token at) throws ParserException {
        if (callee instanceof Identifier) {
            return ((Identifier) callee).getName();
        }
        if (callee instanceof FieldAccess) {
            FieldAccess access = (FieldAccess) callee;
            return calleeName(access.getBase(), at) + "." + access.getField();
        }
        throw new ParserException("Only named procedures can be called", at);
    }

    /**
     * Parses a comma-separated argument list; the opening parenthesis is already consumed.
     */
    private List<Expression> parseArguments() throws ParserException {
        List<Expression> arguments = new ArrayList<>();
        if (matchSymbol(")")) {
            return arguments;
        }
        do {
            arguments.add(parseExpression());
        } while (matchSymbol(","));
        expectSymbol(")", "Expected ')' after arguments");
        return arguments;
    }

    // ---------------------------------------------------------------- token helpers

    private String skipRestOfLine(int line) {
        StringBuilder text = new StringBuilder();
        while (current().getKind() != TokenKind.EOF && current().getLine() == line) {
            if (text.length() > 0) {
                text.append(' ');
            }
            text.append(advance().getLexeme());
        }
        return text.toString();
    }

    private Token current() {
        return tokens.get(index);
    }

    private Token peek(int offset) {
        int target = Math.min(index + offset, tokens.size() - 1);
        return tokens.get(target);
    }

    private Token previous() {
        return tokens.get(Math.max(index - 1, 0));
    }

    private Token advance() {
        Token token = tokens.get(index);
        if (token.getKind() != TokenKind.EOF) {
            index++;
        }
        return token;
    }

    private boolean matchKeyword(String keyword) {
        if (current().isKeyword(keyword)) {
            advance();
            return true;
        }
        return false;
    }

    private boolean matchSymbol(String symbol) {
        if (current().isSymbol(symbol)) {
            advance();
            return true;
        }
        return false;
    }

    private void expectKeyword(String keyword, String message) throws ParserException {
        if (!matchKeyword(keyword)) {
            throw new ParserException(message, current());
        }
    }

    private void expectSymbol(String symbol, String message) throws ParserException {
        if (!matchSymbol(symbol)) {
            throw new ParserException(message, current());
        }
    }

    private Token expectIdentifier(String message) throws ParserException {
        if (current().getKind() != TokenKind.IDENTIFIER) {
            throw new ParserException(message, current());
        }
        return advance();
    }

    private static boolean isKeywordIn(Token token, Set<String> keywords) {
        return token.getKind() == TokenKind.KEYWORD && keywords.contains(token.getLexeme());
    }
}
