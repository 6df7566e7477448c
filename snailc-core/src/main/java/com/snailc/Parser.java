package com.snailc;

import com.snailc.ast.*;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Supplier;

public class Parser {
    // ========================================================================
    // Binding Power Constants for Pratt Parser
    // ========================================================================
    // Higher binding power = tighter binding (higher precedence)
    private static final int BP_CONDITIONAL = 1;    // a if c else b - right-associative
    private static final int BP_OR = 2;             // or
    private static final int BP_AND = 3;            // and
    private static final int BP_NOT = 4;            // prefix not
    private static final int BP_PIPELINE = 5;       // |
    private static final int BP_COMPARE = 6;        // == != < <= > >= in not in is is not
    private static final int BP_ADDITIVE = 7;       // + -
    private static final int BP_MULTIPLICATIVE = 8; // * / // %
    private static final int BP_UNARY = 9;          // prefix + - ++ --
    private static final int BP_POWER = 10;         // ** - right-associative
    private static final int BP_TRY = 11;           // expr? and expr:fallback?
    private static final int BP_POSTFIX = 12;       // call, member access, index, postfix ++/--

    private final String source;
    private final LineIndex lineIndex;
    private final List<Token> tokens;
    private final int maxDepth;
    private int current = 0;
    private int depth;

    // Context flags, saved and restored around nested constructs
    private boolean tryAllowed = true;          // false while parsing a compact try fallback
    private boolean colonTryAllowed = true;     // false in dict keys and slice lower bounds
    private boolean patternActions = false;     // inside awk mode or a lines block
    private boolean awkRules = false;           // awk top level: bare expressions are patterns

    private Parser(String source, int start, int end, LineIndex lineIndex, int maxDepth, int depth) {
        this.source = source;
        this.lineIndex = lineIndex;
        this.maxDepth = maxDepth;
        this.depth = depth;
        this.tokens = new Lexer(source, start, end, lineIndex).tokenize();
    }

    public static Program parse(String source) {
        return parse(source, CompileOptions.defaults());
    }

    public static Program parse(String source, CompileMode mode) {
        return parse(source, CompileOptions.of(mode));
    }

    /**
     * Preprocesses and parses a whole program. Awk and map modes wrap the body in an
     * implicit {@code lines { }} or {@code files { }} block.
     */
    public static Program parse(String source, CompileOptions options) {
        String processed = Preprocessor.preprocess(source);
        Parser parser = new Parser(processed, 0, processed.length(), LineIndex.of(source),
            options.maxNestingDepth(), 0);
        return parser.parseProgram(options.mode());
    }

    /**
     * Parses a single expression, e.g. for tests or tooling. Trailing separators are ignored.
     */
    public static Expression parseExpression(String source) {
        String processed = Preprocessor.preprocess(source);
        Parser parser = new Parser(processed, 0, processed.length(), LineIndex.of(source),
            CompileOptions.DEFAULT_MAX_NESTING_DEPTH, 0);
        Expression expr = parser.expression();
        parser.skipSeparators();
        if (!parser.isAtEnd()) {
            throw parser.unexpected("end of expression");
        }
        return expr;
    }

    private Program parseProgram(CompileMode mode) {
        SourceSpan all = lineIndex.span(0, source.length());
        switch (mode) {
            case AWK -> {
                patternActions = true;
                awkRules = true;
                List<Statement> body = parseStatements(TokenType.EOF);
                return new Program(all, List.of(new LinesStatement(all, List.of(), body)));
            }
            case MAP -> {
                List<Statement> body = parseStatements(TokenType.EOF);
                return new Program(all, List.of(new FilesStatement(all, List.of(), body)));
            }
            default -> {
                return new Program(all, parseStatements(TokenType.EOF));
            }
        }
    }

    // ========================================================================
    // Statements
    // ========================================================================

    private List<Statement> parseStatements(TokenType end) {
        List<Statement> body = new ArrayList<>();
        while (true) {
            skipSeparators();
            if (check(end) || isAtEnd()) {
                break;
            }
            body.add(parseStatement());
            if (check(TokenType.NEWLINE) || check(TokenType.SEMICOLON) || check(end) || isAtEnd()) {
                continue;
            }
            // A compound statement may be followed directly by the next one
            if (previous().type() == TokenType.RBRACE) {
                continue;
            }
            throw unexpected("newline or ';' after statement");
        }
        return body;
    }

    private List<Statement> parseBlock() {
        consume(TokenType.LBRACE, "expected '{'");
        boolean savedTry = tryAllowed;
        boolean savedColonTry = colonTryAllowed;
        boolean savedAwkRules = awkRules;
        tryAllowed = true;
        colonTryAllowed = true;
        awkRules = false;
        enter();
        try {
            List<Statement> body = parseStatements(TokenType.RBRACE);
            consume(TokenType.RBRACE, "expected '}' to close block");
            return body;
        } finally {
            exit();
            tryAllowed = savedTry;
            colonTryAllowed = savedColonTry;
            awkRules = savedAwkRules;
        }
    }

    // Function, class and lambda bodies do not inherit the line-iteration context
    private List<Statement> parseFunctionBody() {
        boolean savedPatternActions = patternActions;
        patternActions = false;
        try {
            return parseBlock();
        } finally {
            patternActions = savedPatternActions;
        }
    }

    private Statement parseStatement() {
        enter();
        try {
            Token token = peek();
            return switch (token.type()) {
                case IF -> parseIf();
                case WHILE -> parseWhile();
                case FOR -> parseFor();
                case DEF -> checkAhead(1, TokenType.IDENTIFIER) ? parseDef() : parseSimpleStatement();
                case CLASS -> parseClass();
                case TRY -> parseTry();
                case WITH -> parseWith();
                case RETURN -> parseReturn();
                case RAISE -> parseRaise();
                case ASSERT -> parseAssert();
                case DEL -> parseDelete();
                case BREAK -> {
                    advance();
                    yield new BreakStatement(token.span());
                }
                case CONTINUE -> {
                    advance();
                    yield new ContinueStatement(token.span());
                }
                case PASS -> {
                    advance();
                    yield new PassStatement(token.span());
                }
                case IMPORT -> parseImport();
                case FROM -> parseImportFrom();
                case LBRACE -> parseBareAction();
                case IDENTIFIER -> {
                    if (token.lexeme().equals("lines") && isIterationHeader()) {
                        yield parseLines();
                    }
                    if (token.lexeme().equals("files") && isIterationHeader()) {
                        yield parseFiles();
                    }
                    yield parseSimpleStatement();
                }
                default -> parseSimpleStatement();
            };
        } finally {
            exit();
        }
    }

    private Statement parseIf() {
        Token start = advance();
        Condition condition = parseCondition();
        List<Statement> body = parseBlock();
        List<ElifClause> elifs = new ArrayList<>();
        while (skipNewlinesBefore(TokenType.ELIF)) {
            Token elifToken = advance();
            Condition elifCondition = parseCondition();
            List<Statement> elifBody = parseBlock();
            elifs.add(new ElifClause(span(elifToken), elifCondition, elifBody));
        }
        List<Statement> elseBody = null;
        if (skipNewlinesBefore(TokenType.ELSE)) {
            advance();
            elseBody = parseBlock();
        }
        return new IfStatement(span(start), condition, body, elifs, elseBody);
    }

    private Statement parseWhile() {
        Token start = advance();
        Condition condition = parseCondition();
        List<Statement> body = parseBlock();
        List<Statement> elseBody = parseOptionalElse();
        return new WhileStatement(span(start), condition, body, elseBody);
    }

    private Statement parseFor() {
        Token start = advance();
        AssignTarget target = parseTargetList();
        consume(TokenType.IN, "expected 'in' in for statement");
        Expression iter = parseExpressionList();
        List<Statement> body = parseBlock();
        List<Statement> elseBody = parseOptionalElse();
        return new ForStatement(span(start), target, iter, body, elseBody);
    }

    private List<Statement> parseOptionalElse() {
        if (skipNewlinesBefore(TokenType.ELSE)) {
            advance();
            return parseBlock();
        }
        return null;
    }

    private Condition parseCondition() {
        Token start = peek();
        if (match(TokenType.LET)) {
            AssignTarget target = parseTargetList();
            consume(TokenType.ASSIGN, "expected '=' in let condition");
            Expression value = expression();
            Expression guard = null;
            if (match(TokenType.SEMICOLON)) {
                guard = expression();
            }
            return new LetCondition(span(start), target, value, guard);
        }
        Expression expr = expression();
        return new ExpressionCondition(expr.span(), expr);
    }

    private Statement parseDef() {
        Token start = advance();
        String name = consume(TokenType.IDENTIFIER, "expected function name").lexeme();
        List<Parameter> params = parseParameters();
        List<Statement> body = parseFunctionBody();
        return new DefStatement(span(start), name, params, body);
    }

    private List<Parameter> parseParameters() {
        consume(TokenType.LPAREN, "expected '(' before parameters");
        List<Parameter> params = new ArrayList<>();
        while (!check(TokenType.RPAREN)) {
            Token paramStart = peek();
            if (match(TokenType.STAR)) {
                String name = consume(TokenType.IDENTIFIER, "expected parameter name after '*'").lexeme();
                params.add(new Parameter(span(paramStart), ParameterKind.VAR_ARGS, name, null));
            } else if (match(TokenType.STAR_STAR)) {
                String name = consume(TokenType.IDENTIFIER, "expected parameter name after '**'").lexeme();
                params.add(new Parameter(span(paramStart), ParameterKind.KW_ARGS, name, null));
            } else {
                String name = consume(TokenType.IDENTIFIER, "expected parameter name").lexeme();
                Expression defaultValue = null;
                if (match(TokenType.ASSIGN)) {
                    defaultValue = nested(this::expression);
                }
                params.add(new Parameter(span(paramStart), ParameterKind.REGULAR, name, defaultValue));
            }
            if (!match(TokenType.COMMA)) {
                break;
            }
        }
        consume(TokenType.RPAREN, "expected ')' after parameters");
        return params;
    }

    private Statement parseClass() {
        Token start = advance();
        String name = consume(TokenType.IDENTIFIER, "expected class name").lexeme();
        List<Statement> body = parseFunctionBody();
        return new ClassStatement(span(start), name, body);
    }

    private Statement parseTry() {
        Token start = advance();
        List<Statement> body = parseBlock();
        List<ExceptHandler> handlers = new ArrayList<>();
        while (skipNewlinesBefore(TokenType.EXCEPT)) {
            Token handlerStart = advance();
            Expression type = null;
            String name = null;
            if (!check(TokenType.LBRACE)) {
                type = expression();
                if (match(TokenType.AS)) {
                    name = consume(TokenType.IDENTIFIER, "expected name after 'as'").lexeme();
                }
            }
            List<Statement> handlerBody = parseBlock();
            handlers.add(new ExceptHandler(span(handlerStart), type, name, handlerBody));
        }
        List<Statement> elseBody = null;
        if (!handlers.isEmpty() && skipNewlinesBefore(TokenType.ELSE)) {
            advance();
            elseBody = parseBlock();
        }
        List<Statement> finallyBody = null;
        if (skipNewlinesBefore(TokenType.FINALLY)) {
            advance();
            finallyBody = parseBlock();
        }
        if (handlers.isEmpty() && finallyBody == null) {
            throw new SnailSyntaxException("try statement requires an except or finally clause", span(start));
        }
        return new TryStatement(span(start), body, handlers, elseBody, finallyBody);
    }

    private Statement parseWith() {
        Token start = advance();
        List<WithItem> items = new ArrayList<>();
        do {
            Token itemStart = peek();
            Expression context = expression();
            AssignTarget target = null;
            if (match(TokenType.AS)) {
                target = toTarget(parseExpr(BP_ADDITIVE), "with target");
            }
            items.add(new WithItem(span(itemStart), context, target));
        } while (match(TokenType.COMMA));
        List<Statement> body = parseBlock();
        return new WithStatement(span(start), items, body);
    }

    private Statement parseReturn() {
        Token start = advance();
        Expression value = canStartExpression(peek().type()) ? parseExpressionList() : null;
        return new ReturnStatement(span(start), value);
    }

    private Statement parseRaise() {
        Token start = advance();
        Expression value = null;
        Expression cause = null;
        if (canStartExpression(peek().type())) {
            value = expression();
            if (match(TokenType.FROM)) {
                cause = expression();
            }
        }
        return new RaiseStatement(span(start), value, cause);
    }

    private Statement parseAssert() {
        Token start = advance();
        Expression test = expression();
        Expression message = match(TokenType.COMMA) ? expression() : null;
        return new AssertStatement(span(start), test, message);
    }

    private Statement parseDelete() {
        Token start = advance();
        List<AssignTarget> targets = new ArrayList<>();
        do {
            targets.add(toTarget(parseExpr(BP_OR), "del target"));
        } while (match(TokenType.COMMA) && canStartExpression(peek().type()));
        return new DeleteStatement(span(start), targets);
    }

    private Statement parseImport() {
        Token start = advance();
        List<ImportItem> items = new ArrayList<>();
        do {
            items.add(parseImportItem(true));
        } while (match(TokenType.COMMA));
        return new ImportStatement(span(start), items);
    }

    private Statement parseImportFrom() {
        Token start = advance();
        int level = 0;
        while (match(TokenType.DOT)) {
            level++;
        }
        String module = null;
        if (check(TokenType.IDENTIFIER)) {
            module = parseDottedName();
        } else if (level == 0) {
            throw unexpected("module name after 'from'");
        }
        consume(TokenType.IMPORT, "expected 'import'");
        if (match(TokenType.STAR)) {
            return new ImportFromStatement(span(start), level, module, List.of(), true);
        }
        boolean parenthesized = match(TokenType.LPAREN);
        List<ImportItem> items = new ArrayList<>();
        do {
            if (parenthesized && check(TokenType.RPAREN)) {
                break;
            }
            items.add(parseImportItem(false));
        } while (match(TokenType.COMMA));
        if (parenthesized) {
            consume(TokenType.RPAREN, "expected ')' after imported names");
        }
        return new ImportFromStatement(span(start), level, module, items, false);
    }

    private ImportItem parseImportItem(boolean dotted) {
        Token start = peek();
        String name = dotted
            ? parseDottedName()
            : consume(TokenType.IDENTIFIER, "expected imported name").lexeme();
        String alias = null;
        if (match(TokenType.AS)) {
            alias = consume(TokenType.IDENTIFIER, "expected alias after 'as'").lexeme();
        }
        return new ImportItem(span(start), name, alias);
    }

    private String parseDottedName() {
        StringBuilder name = new StringBuilder(consume(TokenType.IDENTIFIER, "expected module name").lexeme());
        while (match(TokenType.DOT)) {
            name.append('.').append(consume(TokenType.IDENTIFIER, "expected name after '.'").lexeme());
        }
        return name.toString();
    }

    // `lines` and `files` are ordinary names unless a block or a source list follows
    private boolean isIterationHeader() {
        return switch (tokens.get(current + 1).type()) {
            case LBRACE, STRING, IDENTIFIER, DOLLAR_NAME, FIELD, SUBPROCESS_CAPTURE, ACCESSOR -> true;
            default -> false;
        };
    }

    private Statement parseLines() {
        Token start = advance();
        List<Expression> sources = parseIterationSources();
        boolean savedPatternActions = patternActions;
        patternActions = true;
        try {
            List<Statement> body = parseBlock();
            return new LinesStatement(span(start), sources, body);
        } finally {
            patternActions = savedPatternActions;
        }
    }

    private Statement parseFiles() {
        Token start = advance();
        List<Expression> sources = parseIterationSources();
        boolean savedPatternActions = patternActions;
        patternActions = false;
        try {
            List<Statement> body = parseBlock();
            return new FilesStatement(span(start), sources, body);
        } finally {
            patternActions = savedPatternActions;
        }
    }

    private List<Expression> parseIterationSources() {
        List<Expression> sources = new ArrayList<>();
        while (!check(TokenType.LBRACE)) {
            sources.add(expression());
            if (!match(TokenType.COMMA)) {
                break;
            }
        }
        return sources;
    }

    private Statement parseBareAction() {
        if (!patternActions) {
            throw new SnailSyntaxException(
                "unexpected '{': pattern/action blocks are only valid in awk mode or inside a lines block", peek());
        }
        Token start = peek();
        List<Statement> action = parseBlock();
        return new PatternActionStatement(span(start), null, action);
    }

    /**
     * Expression statements, assignment chains and pattern/action rules.
     */
    private Statement parseSimpleStatement() {
        Token start = peek();
        ExprList first = parseTargetOrExpressionList();

        if (check(TokenType.ASSIGN)) {
            List<AssignTarget> targets = new ArrayList<>();
            ExprList value = first;
            while (match(TokenType.ASSIGN)) {
                targets.add(value.toTarget(this));
                value = parseTargetOrExpressionList();
            }
            return new AssignStatement(span(start), targets, value.toExpression(this));
        }

        Expression expr = first.toExpression(this);
        if (patternActions && check(TokenType.LBRACE)) {
            List<Statement> action = parseBlock();
            return new PatternActionStatement(span(start), expr, action);
        }
        if (patternActions && (awkRules || expr instanceof RegexLiteral)) {
            return new PatternActionStatement(span(start), expr, null);
        }
        return new ExpressionStatement(span(start), expr, check(TokenType.SEMICOLON));
    }

    /**
     * Comma-separated items at statement level; {@code *name} items are kept for assignment targets.
     *
     * @param starOffsets offset of the {@code *} before each item, or -1
     */
    private record ExprList(List<Expression> items, List<Integer> starOffsets, boolean tuple, int start, int end) {

        private int firstStar() {
            for (int i = 0; i < items.size(); i++) {
                if (starOffsets.get(i) >= 0) {
                    return i;
                }
            }
            return -1;
        }

        Expression toExpression(Parser p) {
            int star = firstStar();
            if (star >= 0) {
                throw new SnailSyntaxException("starred expression is only allowed in an assignment target",
                    p.lineIndex.span(starOffsets.get(star), items.get(star).end()));
            }
            if (!tuple) {
                return items.get(0);
            }
            return new TupleExpression(p.lineIndex.span(start, end), items);
        }

        AssignTarget toTarget(Parser p) {
            if (!tuple) {
                if (firstStar() >= 0) {
                    throw new SnailSyntaxException("starred assignment target must be in a list or tuple",
                        p.lineIndex.span(start, end));
                }
                return p.toTarget(items.get(0), "assignment target");
            }
            List<AssignTarget> elements = new ArrayList<>();
            for (int i = 0; i < items.size(); i++) {
                AssignTarget target = p.toTarget(items.get(i), "assignment target");
                int starOffset = starOffsets.get(i);
                elements.add(starOffset >= 0
                    ? new StarredTarget(p.lineIndex.span(starOffset, items.get(i).end()), target)
                    : target);
            }
            return new TupleTarget(p.lineIndex.span(start, end), elements);
        }
    }

    private ExprList parseTargetOrExpressionList() {
        int start = peek().position();
        List<Expression> items = new ArrayList<>();
        List<Integer> starOffsets = new ArrayList<>();
        boolean tuple = false;
        while (true) {
            starOffsets.add(check(TokenType.STAR) ? advance().position() : -1);
            items.add(expression());
            if (!check(TokenType.COMMA)) {
                break;
            }
            advance();
            tuple = true;
            if (!canStartExpression(peek().type()) && !check(TokenType.STAR)) {
                break;
            }
        }
        return new ExprList(items, starOffsets, tuple, start, previous().endPosition());
    }

    // ========================================================================
    // Assignment targets
    // ========================================================================

    /**
     * Targets of {@code for}, comprehensions and {@code let}: stops before {@code in} and {@code =}.
     */
    private AssignTarget parseTargetList() {
        Token start = peek();
        List<AssignTarget> elements = new ArrayList<>();
        boolean tuple = false;
        while (true) {
            Token itemStart = peek();
            if (match(TokenType.STAR)) {
                AssignTarget inner = toTarget(parseExpr(BP_ADDITIVE), "assignment target");
                elements.add(new StarredTarget(span(itemStart), inner));
            } else {
                elements.add(toTarget(parseExpr(BP_ADDITIVE), "assignment target"));
            }
            if (!match(TokenType.COMMA)) {
                break;
            }
            tuple = true;
            if (check(TokenType.IN) || check(TokenType.ASSIGN)) {
                break;
            }
        }
        if (!tuple) {
            if (elements.get(0) instanceof StarredTarget starred) {
                throw new SnailSyntaxException("starred assignment target must be in a list or tuple", starred.span());
            }
            return elements.get(0);
        }
        return new TupleTarget(span(start), elements);
    }

    private AssignTarget toTarget(Expression expr, String what) {
        if (expr instanceof Identifier id) {
            if (id.name().startsWith("$")) {
                throw new SnailSyntaxException("cannot assign to '" + id.name() + "'", id.span());
            }
            return new NameTarget(id.span(), id.name());
        }
        if (expr instanceof Placeholder placeholder) {
            return new NameTarget(placeholder.span(), "_");
        }
        if (expr instanceof AttributeExpression attr) {
            return new AttributeTarget(attr.span(), attr.object(), attr.attribute());
        }
        if (expr instanceof IndexExpression index) {
            return new IndexTarget(index.span(), index.object(), index.index());
        }
        if (expr instanceof TupleExpression tuple) {
            return new TupleTarget(tuple.span(), toTargets(tuple.elements(), what));
        }
        if (expr instanceof ListExpression list) {
            return new ListTarget(list.span(), toTargets(list.elements(), what));
        }
        throw new SnailSyntaxException("invalid " + what, expr.span());
    }

    private List<AssignTarget> toTargets(List<Expression> elements, String what) {
        List<AssignTarget> targets = new ArrayList<>();
        for (Expression element : elements) {
            targets.add(toTarget(element, what));
        }
        return targets;
    }

    // Augmented assignment and ++/-- only bind simple targets
    private static AssignTarget toSimpleTarget(Expression expr, String message) {
        if (expr instanceof Identifier id && !id.name().startsWith("$")) {
            return new NameTarget(id.span(), id.name());
        }
        if (expr instanceof AttributeExpression attr) {
            return new AttributeTarget(attr.span(), attr.object(), attr.attribute());
        }
        if (expr instanceof IndexExpression index) {
            return new IndexTarget(index.span(), index.object(), index.index());
        }
        throw new SnailSyntaxException(message, expr.span());
    }

    // ========================================================================
    // Expressions
    // ========================================================================

    /**
     * A full expression, including augmented assignment which sits above the precedence ladder.
     */
    private Expression expression() {
        Expression left = parseExpr(BP_CONDITIONAL);
        TokenType tt = peek().type();
        switch (tt) {
            case PLUS_ASSIGN, MINUS_ASSIGN, STAR_ASSIGN, SLASH_ASSIGN, SLASH_SLASH_ASSIGN,
                 PERCENT_ASSIGN, STAR_STAR_ASSIGN -> {
                Token op = advance();
                AssignTarget target = toSimpleTarget(left,
                    "augmented assignment target must be a name, attribute, or index");
                Expression value = expression();
                return new AugAssignExpression(spanFrom(left.start()), target,
                    AugOperator.fromSymbol(op.lexeme()), value);
            }
            default -> {
                return left;
            }
        }
    }

    private Expression parseExpressionList() {
        Token start = peek();
        Expression first = expression();
        if (!check(TokenType.COMMA)) {
            return first;
        }
        List<Expression> items = new ArrayList<>();
        items.add(first);
        while (match(TokenType.COMMA)) {
            if (!canStartExpression(peek().type())) {
                break;
            }
            items.add(expression());
        }
        return new TupleExpression(span(start), items);
    }

    private Expression parseExpr(int minBp) {
        enter();
        // each infix application deepens the left spine of the result by one
        int applied = 0;
        try {
            Token token = advance();

            // ========================================================================
            // Prefix (NUD - Null Denotation)
            // ========================================================================
            Expression left = switch (token.type()) {
                // Literals
                case NUMBER -> new NumberLiteral(token.span(), token.lexeme());
                case STRING -> prefixString(this, token);
                case REGEX -> prefixRegex(this, token);
                case TRUE -> new BooleanLiteral(token.span(), true);
                case FALSE -> new BooleanLiteral(token.span(), false);
                case NONE -> new NoneLiteral(token.span());

                // Names
                case IDENTIFIER -> token.lexeme().equals("_")
                    ? new Placeholder(token.span())
                    : new Identifier(token.span(), token.lexeme());
                case DOLLAR_NAME -> new Identifier(token.span(), token.lexeme());
                case FIELD -> new FieldIndex(token.span(), token.lexeme().substring(1));

                // Special forms
                case SUBPROCESS_CAPTURE -> prefixSubprocess(this, token, SubprocessKind.CAPTURE);
                case SUBPROCESS_STATUS -> prefixSubprocess(this, token, SubprocessKind.STATUS);
                case ACCESSOR -> new StructuredAccessor(token.span(), ((Token.BodyToken) token.literal()).content());

                // Grouping and collections
                case LPAREN -> prefixParen(this, token);
                case LBRACKET -> prefixList(this, token);
                case SET_LBRACE -> prefixSet(this, token);
                case DICT_LBRACE -> prefixDict(this, token);

                // Functions and generators
                case DEF -> prefixLambda(this, token);
                case YIELD -> prefixYield(this, token);

                // Unary operators
                case NOT -> prefixNot(this, token);
                case PLUS, MINUS -> prefixUnary(this, token);
                case INCREMENT, DECREMENT -> prefixUpdate(this, token);

                default -> throw new SnailSyntaxException("expected expression, found " + describe(token), token);
            };

            // ========================================================================
            // Infix loop (LED - Left Denotation)
            // ========================================================================
            while (true) {
                TokenType tt = peek().type();
                int lbp = switch (tt) {
                    case IF -> BP_CONDITIONAL;
                    case OR -> BP_OR;
                    case AND -> BP_AND;
                    case NOT -> checkAhead(1, TokenType.IN) ? BP_COMPARE : -1;
                    case PIPE -> BP_PIPELINE;
                    case EQ, NE, LT, LE, GT, GE, IN, IS -> BP_COMPARE;
                    case PLUS, MINUS -> BP_ADDITIVE;
                    case STAR, SLASH, SLASH_SLASH, PERCENT -> BP_MULTIPLICATIVE;
                    case STAR_STAR -> BP_POWER;
                    case QUESTION -> tryAllowed ? BP_TRY : -1;
                    case COLON -> tryAllowed && colonTryAllowed && fallbackFollows() ? BP_TRY : -1;
                    case LPAREN, LBRACKET, DOT, INCREMENT, DECREMENT -> BP_POSTFIX;
                    default -> -1; // Not an infix operator
                };

                if (lbp < 0 || lbp < minBp) {
                    break;
                }

                enter();
                applied++;
                Token opToken = advance();
                left = switch (tt) {
                    case IF -> infixConditional(this, left, opToken);
                    case OR, AND, PIPE, PLUS, MINUS, STAR, SLASH, SLASH_SLASH, PERCENT -> infixBinary(this, left, opToken);
                    case STAR_STAR -> infixPower(this, left, opToken);
                    case NOT, EQ, NE, LT, LE, GT, GE, IN, IS -> infixCompare(this, left, opToken);
                    case QUESTION -> infixTry(this, left, opToken);
                    case COLON -> infixTryFallback(this, left, opToken);
                    case LPAREN -> infixCall(this, left, opToken);
                    case LBRACKET -> infixIndex(this, left, opToken);
                    case DOT -> infixAttribute(this, left, opToken);
                    case INCREMENT, DECREMENT -> infixUpdate(this, left, opToken);
                    default -> throw new IllegalStateException("Unexpected infix operator: " + tt);
                };
            }
            return left;
        } finally {
            depth -= applied;
            exit();
        }
    }

    // ========================================================================
    // Prefix handlers
    // ========================================================================

    private static Expression prefixString(Parser p, Token token) {
        Token.StringToken string = (Token.StringToken) token.literal();
        if (string.raw()) {
            return new StringLiteral(token.span(), string.content(), true, string.bytes());
        }
        java.util.function.UnaryOperator<String> unescape = string.bytes()
            ? Templates::decodeBytesEscapes
            : Templates::decodeStringEscapes;
        List<FStringPart> parts = Templates.parseParts(p.source, string.contentStart(),
            string.contentStart() + string.content().length(), p::parseEmbedded, unescape, p.lineIndex);
        if (parts.stream().noneMatch(part -> part instanceof InterpolationPart)) {
            return new StringLiteral(token.span(), Templates.joinText(parts), false, string.bytes());
        }
        return new FormattedString(token.span(), parts, string.bytes());
    }

    private static Expression prefixRegex(Parser p, Token token) {
        Token.BodyToken body = (Token.BodyToken) token.literal();
        List<FStringPart> parts = Templates.parseParts(p.source, body.contentStart(),
            body.contentStart() + body.content().length(), p::parseEmbedded, Templates::unescapeRegex, p.lineIndex);
        return new RegexLiteral(token.span(), parts);
    }

    private static Expression prefixSubprocess(Parser p, Token token, SubprocessKind kind) {
        Token.BodyToken body = (Token.BodyToken) token.literal();
        List<FStringPart> parts = Templates.parseParts(p.source, body.contentStart(),
            body.contentStart() + body.content().length(), p::parseEmbedded, text -> text, p.lineIndex);
        if (parts.isEmpty()) {
            throw new SnailSyntaxException("missing subprocess command", token);
        }
        return new SubprocessExpression(token.span(), kind, parts);
    }

    private static Expression prefixParen(Parser p, Token token) {
        return p.nested(() -> {
            if (p.match(TokenType.RPAREN)) {
                return new TupleExpression(p.span(token), List.of());
            }
            if (p.check(TokenType.SEMICOLON)) {
                throw new SnailSyntaxException("compound expression requires at least one expression", p.peek());
            }
            Expression first = p.expression();
            if (p.check(TokenType.SEMICOLON)) {
                List<Expression> expressions = new ArrayList<>();
                expressions.add(first);
                while (p.match(TokenType.SEMICOLON)) {
                    if (p.check(TokenType.RPAREN)) {
                        break;
                    }
                    expressions.add(p.expression());
                }
                p.consume(TokenType.RPAREN, "expected ')' to close compound expression");
                return new CompoundExpression(p.span(token), expressions);
            }
            if (p.check(TokenType.COMMA)) {
                List<Expression> elements = new ArrayList<>();
                elements.add(first);
                while (p.match(TokenType.COMMA)) {
                    if (p.check(TokenType.RPAREN)) {
                        break;
                    }
                    elements.add(p.expression());
                }
                p.consume(TokenType.RPAREN, "expected ')' to close tuple");
                return new TupleExpression(p.span(token), elements);
            }
            if (p.check(TokenType.FOR)) {
                throw new SnailSyntaxException("generator expressions are not supported; use a list comprehension", p.peek());
            }
            p.consume(TokenType.RPAREN, "expected ')'");
            return first;
        });
    }

    private static Expression prefixList(Parser p, Token token) {
        return p.nested(() -> {
            if (p.match(TokenType.RBRACKET)) {
                return new ListExpression(p.span(token), List.of());
            }
            Expression first = p.expression();
            if (p.match(TokenType.FOR)) {
                Comprehension clause = p.parseComprehension();
                p.consume(TokenType.RBRACKET, "expected ']' to close list comprehension");
                return new ListComprehension(p.span(token), first, clause.target(), clause.iter(), clause.conditions());
            }
            List<Expression> elements = p.parseRemainingElements(first, TokenType.RBRACKET);
            p.consume(TokenType.RBRACKET, "expected ']' to close list");
            return new ListExpression(p.span(token), elements);
        });
    }

    private static Expression prefixSet(Parser p, Token token) {
        return p.nested(() -> {
            if (p.match(TokenType.RBRACE)) {
                return new SetExpression(p.span(token), List.of());
            }
            List<Expression> elements = p.parseRemainingElements(p.expression(), TokenType.RBRACE);
            p.consume(TokenType.RBRACE, "expected '}' to close set");
            return new SetExpression(p.span(token), elements);
        });
    }

    private static Expression prefixDict(Parser p, Token token) {
        return p.nested(() -> {
            List<DictEntry> entries = new ArrayList<>();
            while (!p.check(TokenType.RBRACE)) {
                Token entryStart = p.peek();
                Expression key = p.parseDictKey();
                p.consume(TokenType.COLON, "expected ':' after dict key");
                Expression value = p.expression();
                if (entries.isEmpty() && p.match(TokenType.FOR)) {
                    Comprehension clause = p.parseComprehension();
                    p.consume(TokenType.RBRACE, "expected '}' to close dict comprehension");
                    return new DictComprehension(p.span(token), key, value,
                        clause.target(), clause.iter(), clause.conditions());
                }
                entries.add(new DictEntry(p.span(entryStart), key, value));
                if (!p.match(TokenType.COMMA)) {
                    break;
                }
            }
            p.consume(TokenType.RBRACE, "expected '}' to close dict");
            return new DictExpression(p.span(token), entries);
        });
    }

    private static Expression prefixLambda(Parser p, Token token) {
        List<Parameter> params = p.check(TokenType.LPAREN) ? p.parseParameters() : List.of();
        List<Statement> body = p.parseFunctionBody();
        return new LambdaExpression(p.span(token), params, body);
    }

    private static Expression prefixYield(Parser p, Token token) {
        if (p.match(TokenType.FROM)) {
            Expression value = p.expression();
            return new YieldFromExpression(p.span(token), value);
        }
        Expression value = canStartExpression(p.peek().type()) ? p.expression() : null;
        return new YieldExpression(p.span(token), value);
    }

    private static Expression prefixNot(Parser p, Token token) {
        Expression operand = p.parseExpr(BP_NOT);
        return new UnaryExpression(p.span(token), UnaryOperator.NOT, operand);
    }

    private static Expression prefixUnary(Parser p, Token token) {
        UnaryOperator op = token.type() == TokenType.PLUS ? UnaryOperator.PLUS : UnaryOperator.MINUS;
        Expression operand = p.parseExpr(BP_UNARY);
        return new UnaryExpression(p.span(token), op, operand);
    }

    private static Expression prefixUpdate(Parser p, Token token) {
        Expression operand = p.parseExpr(BP_UNARY);
        AssignTarget target = toSimpleTarget(operand, "increment/decrement target must be a name, attribute, or index");
        return new UpdateExpression(p.span(token), token.lexeme(), true, target);
    }

    // ========================================================================
    // Infix handlers
    // ========================================================================

    private static Expression infixConditional(Parser p, Expression body, Token op) {
        Expression test = p.parseExpr(BP_OR);
        p.consume(TokenType.ELSE, "expected 'else' in conditional expression");
        Expression orElse = p.parseExpr(BP_CONDITIONAL);
        return new ConditionalExpression(p.spanFrom(body.start()), body, test, orElse);
    }

    private static Expression infixBinary(Parser p, Expression left, Token op) {
        BinaryOperator operator = switch (op.type()) {
            case OR -> BinaryOperator.OR;
            case AND -> BinaryOperator.AND;
            case PIPE -> BinaryOperator.PIPELINE;
            case PLUS -> BinaryOperator.ADD;
            case MINUS -> BinaryOperator.SUB;
            case STAR -> BinaryOperator.MUL;
            case SLASH -> BinaryOperator.DIV;
            case SLASH_SLASH -> BinaryOperator.FLOOR_DIV;
            case PERCENT -> BinaryOperator.MOD;
            default -> throw new IllegalStateException("Not a binary operator: " + op.type());
        };
        int bp = switch (operator) {
            case OR -> BP_OR;
            case AND -> BP_AND;
            case PIPELINE -> BP_PIPELINE;
            case ADD, SUB -> BP_ADDITIVE;
            default -> BP_MULTIPLICATIVE;
        };
        // Left-associative: the right operand binds strictly tighter
        Expression right = p.parseExpr(bp + 1);
        return new BinaryExpression(p.spanFrom(left.start()), left, operator, right);
    }

    private static Expression infixPower(Parser p, Expression left, Token op) {
        // Right-associative: 2**3**2 is 2**(3**2)
        Expression right = p.parseExpr(BP_POWER);
        return new BinaryExpression(p.spanFrom(left.start()), left, BinaryOperator.POW, right);
    }

    private static Expression infixCompare(Parser p, Expression left, Token op) {
        List<CompareOperator> operators = new ArrayList<>();
        List<Expression> comparators = new ArrayList<>();
        operators.add(p.compareOperator(op));
        comparators.add(p.parseExpr(BP_COMPARE + 1));
        while (p.atCompareOperator()) {
            operators.add(p.compareOperator(p.advance()));
            comparators.add(p.parseExpr(BP_COMPARE + 1));
        }
        SourceSpan span = p.spanFrom(left.start());

        // x in /re/ is a regex search rather than a membership test
        if (operators.size() == 1 && comparators.get(0) instanceof RegexLiteral regex) {
            if (operators.get(0) == CompareOperator.IN) {
                return new RegexMatchExpression(span, left, regex);
            }
            if (operators.get(0) == CompareOperator.NOT_IN) {
                return new UnaryExpression(span, UnaryOperator.NOT, new RegexMatchExpression(span, left, regex));
            }
        }
        return new CompareExpression(span, left, operators, comparators);
    }

    private boolean atCompareOperator() {
        return switch (peek().type()) {
            case EQ, NE, LT, LE, GT, GE, IN, IS -> true;
            case NOT -> checkAhead(1, TokenType.IN);
            default -> false;
        };
    }

    private CompareOperator compareOperator(Token op) {
        return switch (op.type()) {
            case EQ -> CompareOperator.EQ;
            case NE -> CompareOperator.NOT_EQ;
            case LT -> CompareOperator.LT;
            case LE -> CompareOperator.LT_EQ;
            case GT -> CompareOperator.GT;
            case GE -> CompareOperator.GT_EQ;
            case IN -> CompareOperator.IN;
            case NOT -> {
                consume(TokenType.IN, "expected 'in' after 'not'");
                yield CompareOperator.NOT_IN;
            }
            case IS -> match(TokenType.NOT) ? CompareOperator.IS_NOT : CompareOperator.IS;
            default -> throw new IllegalStateException("Not a comparison operator: " + op.type());
        };
    }

    private static Expression infixTry(Parser p, Expression left, Token op) {
        checkTryOperand(left);
        return new TryExpression(p.spanFrom(left.start()), left, null);
    }

    private static Expression infixTryFallback(Parser p, Expression left, Token op) {
        checkTryOperand(left);
        boolean saved = p.tryAllowed;
        p.tryAllowed = false;
        Expression fallback;
        try {
            fallback = p.parseExpr(BP_UNARY);
        } finally {
            p.tryAllowed = saved;
        }
        p.consume(TokenType.QUESTION, "expected '?' after compact try fallback");
        return new TryExpression(p.spanFrom(left.start()), left, fallback);
    }

    private static void checkTryOperand(Expression operand) {
        if (operand instanceof AugAssignExpression || operand instanceof UpdateExpression) {
            throw new SnailSyntaxException("compact try cannot wrap a binding expression", operand.span());
        }
    }

    // After ':' a fallback must reach a '?' before anything that ends the enclosing construct
    private boolean fallbackFollows() {
        int nesting = 0;
        for (int i = current + 1; i < tokens.size(); i++) {
            switch (tokens.get(i).type()) {
                case LPAREN, LBRACKET, SET_LBRACE, DICT_LBRACE -> nesting++;
                case RPAREN, RBRACKET, RBRACE -> {
                    if (nesting == 0) {
                        return false;
                    }
                    nesting--;
                }
                case QUESTION -> {
                    if (nesting == 0) {
                        return true;
                    }
                }
                case LBRACE, COMMA, COLON, SEMICOLON, NEWLINE, EOF, ASSIGN -> {
                    if (nesting == 0) {
                        return false;
                    }
                }
                default -> {
                }
            }
        }
        return false;
    }

    private static Expression infixCall(Parser p, Expression callee, Token op) {
        List<Argument> arguments = p.nested(() -> {
            List<Argument> args = new ArrayList<>();
            while (!p.check(TokenType.RPAREN)) {
                args.add(p.parseArgument());
                if (!p.match(TokenType.COMMA)) {
                    break;
                }
            }
            return args;
        });
        p.consume(TokenType.RPAREN, "expected ')' after arguments");
        return new CallExpression(p.spanFrom(callee.start()), callee, arguments);
    }

    private Argument parseArgument() {
        Token start = peek();
        if (match(TokenType.STAR)) {
            Expression value = expression();
            return new Argument(span(start), ArgumentKind.STAR, null, value);
        }
        if (match(TokenType.STAR_STAR)) {
            Expression value = expression();
            return new Argument(span(start), ArgumentKind.KWSTAR, null, value);
        }
        if (check(TokenType.IDENTIFIER) && checkAhead(1, TokenType.ASSIGN)) {
            String name = advance().lexeme();
            advance();
            Expression value = expression();
            return new Argument(span(start), ArgumentKind.KEYWORD, name, value);
        }
        Expression value = expression();
        if (check(TokenType.FOR)) {
            throw new SnailSyntaxException("generator expressions are not supported; use a list comprehension", peek());
        }
        return new Argument(span(start), ArgumentKind.POSITIONAL, null, value);
    }

    private static Expression infixIndex(Parser p, Expression object, Token op) {
        Expression index = p.nested(() -> {
            Token start = p.peek();
            Expression lower = null;
            if (!p.check(TokenType.COLON)) {
                p.colonTryAllowed = false;
                lower = p.expression();
                p.colonTryAllowed = true;
            }
            if (p.match(TokenType.COLON)) {
                Expression upper = p.check(TokenType.RBRACKET) ? null : p.expression();
                return new SliceExpression(p.span(start), lower, upper);
            }
            if (p.check(TokenType.COMMA)) {
                List<Expression> elements = p.parseRemainingElements(lower, TokenType.RBRACKET);
                return new TupleExpression(p.span(start), elements);
            }
            return lower;
        });
        p.consume(TokenType.RBRACKET, "expected ']' after index");
        return new IndexExpression(p.spanFrom(object.start()), object, index);
    }

    private static Expression infixAttribute(Parser p, Expression object, Token op) {
        Token name = p.advance();
        return switch (name.type()) {
            case IDENTIFIER -> new AttributeExpression(p.spanFrom(object.start()), object, name.lexeme());
            // t.0 indexes a tuple
            case NUMBER -> {
                if (name.lexeme().indexOf('.') >= 0) {
                    throw new SnailSyntaxException("expected integer index after '.'", name);
                }
                yield new IndexExpression(p.spanFrom(object.start()), object,
                    new NumberLiteral(name.span(), name.lexeme()));
            }
            default -> throw new SnailSyntaxException("expected attribute name after '.', found " + describe(name), name);
        };
    }

    private static Expression infixUpdate(Parser p, Expression operand, Token op) {
        AssignTarget target = toSimpleTarget(operand, "increment/decrement target must be a name, attribute, or index");
        Expression update = new UpdateExpression(p.spanFrom(operand.start()), op.lexeme(), false, target);
        switch (p.peek().type()) {
            case LPAREN, LBRACKET, DOT, INCREMENT, DECREMENT ->
                throw new SnailSyntaxException("postfix increment/decrement must be the final suffix", p.peek());
            default -> {
                return update;
            }
        }
    }

    // ========================================================================
    // Shared pieces
    // ========================================================================

    private record Comprehension(AssignTarget target, Expression iter, List<Expression> conditions) {
    }

    // Called after `for`
    private Comprehension parseComprehension() {
        AssignTarget target = parseTargetList();
        consume(TokenType.IN, "expected 'in' in comprehension");
        Expression iter = parseExpr(BP_OR);
        List<Expression> conditions = new ArrayList<>();
        while (match(TokenType.IF)) {
            conditions.add(parseExpr(BP_OR));
        }
        if (check(TokenType.FOR)) {
            throw new SnailSyntaxException("comprehensions support a single 'for' clause", peek());
        }
        return new Comprehension(target, iter, conditions);
    }

    private List<Expression> parseRemainingElements(Expression first, TokenType close) {
        List<Expression> elements = new ArrayList<>();
        elements.add(first);
        while (match(TokenType.COMMA)) {
            if (check(close)) {
                break;
            }
            elements.add(expression());
        }
        return elements;
    }

    private Expression parseDictKey() {
        boolean saved = colonTryAllowed;
        colonTryAllowed = false;
        try {
            return expression();
        } finally {
            colonTryAllowed = saved;
        }
    }

    // Brackets reset the restrictions of the surrounding context
    private <T> T nested(Supplier<T> body) {
        boolean savedTry = tryAllowed;
        boolean savedColonTry = colonTryAllowed;
        tryAllowed = true;
        colonTryAllowed = true;
        try {
            return body.get();
        } finally {
            tryAllowed = savedTry;
            colonTryAllowed = savedColonTry;
        }
    }

    /**
     * Parses the interpolated expression in {@code source[start, end)} with a nested parser that
     * shares this parser's line index, so spans stay absolute.
     */
    private Expression parseEmbedded(int start, int end) {
        Parser inner = new Parser(source, start, end, lineIndex, maxDepth, depth);
        Expression expr = inner.expression();
        if (!inner.isAtEnd()) {
            throw new SnailSyntaxException(
                "unexpected characters in f-string expression: " + source.substring(inner.peek().position(), end).strip(),
                inner.peek());
        }
        return expr;
    }

    private static boolean canStartExpression(TokenType type) {
        return switch (type) {
            case NUMBER, STRING, REGEX, IDENTIFIER, DOLLAR_NAME, FIELD, SUBPROCESS_CAPTURE, SUBPROCESS_STATUS,
                 ACCESSOR, TRUE, FALSE, NONE, LPAREN, LBRACKET, SET_LBRACE, DICT_LBRACE, DEF, YIELD, NOT,
                 PLUS, MINUS, INCREMENT, DECREMENT -> true;
            default -> false;
        };
    }

    private void enter() {
        if (++depth > maxDepth) {
            throw new SnailSyntaxException("maximum nesting depth of " + maxDepth + " exceeded", peek());
        }
    }

    private void exit() {
        depth--;
    }

    // Helper methods

    private boolean match(TokenType... types) {
        for (TokenType type : types) {
            if (check(type)) {
                advance();
                return true;
            }
        }
        return false;
    }

    private boolean check(TokenType type) {
        return peek().type() == type;
    }

    private boolean checkAhead(int offset, TokenType type) {
        int index = current + offset;
        if (index >= tokens.size()) {
            return false;
        }
        return tokens.get(index).type() == type;
    }

    // The separator injected before else/elif/except/finally does not end the statement
    private boolean skipNewlinesBefore(TokenType type) {
        int index = current;
        while (index < tokens.size() - 1 && tokens.get(index).type() == TokenType.NEWLINE) {
            index++;
        }
        if (tokens.get(index).type() != type) {
            return false;
        }
        current = index;
        return true;
    }

    private void skipSeparators() {
        while (check(TokenType.NEWLINE) || check(TokenType.SEMICOLON)) {
            advance();
        }
    }

    private Token advance() {
        if (!isAtEnd()) current++;
        return previous();
    }

    private boolean isAtEnd() {
        return current >= tokens.size() - 1;
    }

    private Token peek() {
        return tokens.get(current);
    }

    private Token previous() {
        return tokens.get(Math.max(0, current - 1));
    }

    private Token consume(TokenType type, String message) {
        if (check(type)) return advance();
        throw new SnailSyntaxException(message + ", found " + describe(peek()), peek());
    }

    private SnailSyntaxException unexpected(String expected) {
        return new SnailSyntaxException("expected " + expected + ", found " + describe(peek()), peek());
    }

    private static String describe(Token token) {
        return switch (token.type()) {
            case EOF -> "end of input";
            case NEWLINE -> "end of line";
            default -> "'" + token.lexeme() + "'";
        };
    }

    private SourceSpan span(Token start) {
        return spanFrom(start.position());
    }

    private SourceSpan spanFrom(int start) {
        return lineIndex.span(start, Math.max(start, previous().endPosition()));
    }
}
