package com.pinery.converter.python;

import com.pinery.converter.python.PythonTokenizer.Kind;
import com.pinery.converter.python.PythonTokenizer.Tok;

import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Checks Python 3 source against the language grammar without executing it.
 *
 * Covers simple statements, compound statements (if/while/for/try/with/def/class, decorators,
 * async forms), lambdas, comprehensions, f-string replacement fields and assignment-target
 * rules. {@code return}, {@code yield}, {@code break} and {@code continue} are checked against
 * their enclosing function or loop. The match statement is not recognized.
 *
 * Thread-safe: every call works on its own parser state.
 */
public class PythonSyntaxValidator {

    private static final Set<String> KEYWORDS = Set.of(
        "False", "None", "True", "and", "as", "assert", "async", "await", "break", "class", "continue",
        "def", "del", "elif", "else", "except", "finally", "for", "from", "global", "if", "import", "in",
        "is", "lambda", "nonlocal", "not", "or", "pass", "raise", "return", "try", "while", "with", "yield"
    );
    private static final Set<String> AUGMENTED = Set.of(
        "+=", "-=", "*=", "/=", "//=", "%=", "**=", ">>=", "<<=", "&=", "|=", "^=", "@="
    );
    private static final Set<String> COMPARISONS = Set.of("<", ">", "==", ">=", "<=", "!=");

    /**
     * Validate a whole module.
     */
    public SyntaxCheckResult validate(String code) {
        if (code == null) {
            return SyntaxCheckResult.error("No code", 0);
        }
        try {
            new Parser(PythonTokenizer.tokenize(code)).module();
            return SyntaxCheckResult.ok();
        } catch (PythonSyntaxException e) {
            return SyntaxCheckResult.error(e.getMessage(), e.getLine());
        }
    }

    /**
     * Validate a single expression, as accepted by Python's {@code eval}.
     */
    public SyntaxCheckResult validateExpression(String expression) {
        if (expression == null || expression.isBlank()) {
            return SyntaxCheckResult.error("Empty expression", 0);
        }
        try {
            new Parser(PythonTokenizer.tokenize(expression.strip())).expressionInput();
            return SyntaxCheckResult.ok();
        } catch (PythonSyntaxException e) {
            return SyntaxCheckResult.error(e.getMessage(), e.getLine());
        }
    }

    public boolean isValid(String code) {
        return validate(code).valid();
    }

    // ===== Expression shapes =====

    private enum Shape { NAME, ATTRIBUTE, SUBSCRIPT, STARRED, TUPLE, LIST, LITERAL, CALL, OTHER }

    /**
     * What an expression is, as far as assignment rules care.
     */
    private record Expr(Shape shape, boolean assignable) {

        static final Expr OTHER = new Expr(Shape.OTHER, false);

        static Expr of(Shape shape) {
            boolean target = shape == Shape.NAME || shape == Shape.ATTRIBUTE || shape == Shape.SUBSCRIPT;
            return new Expr(shape, target);
        }

        boolean isSingleTarget() {
            return shape == Shape.NAME || shape == Shape.ATTRIBUTE || shape == Shape.SUBSCRIPT;
        }
    }

    // ===== Parser =====

    private static final class Parser {

        private final List<Tok> tokens;
        private int pos = 0;
        private int functionDepth = 0;
        private int loopDepth = 0;

        Parser(List<Tok> tokens) {
            this.tokens = tokens;
        }

        void module() {
            while (!check(Kind.END)) {
                if (check(Kind.NEWLINE)) {
                    advance();
                } else {
                    statement();
                }
            }
        }

        void expressionInput() {
            while (check(Kind.NEWLINE)) {
                advance();
            }
            starExpressions();
            while (check(Kind.NEWLINE)) {
                advance();
            }
            if (!check(Kind.END)) {
                throw unexpected();
            }
        }

        // ===== Statements =====

        private void statement() {
            Tok tok = current();
            if (tok.kind() == Kind.INDENT) {
                throw new PythonSyntaxException("unexpected indent", tok.line());
            }
            if (tok.kind() == Kind.NAME) {
                switch (tok.text()) {
                    case "if" -> { ifStatement(); return; }
                    case "while" -> { whileStatement(); return; }
                    case "for" -> { forStatement(); return; }
                    case "try" -> { tryStatement(); return; }
                    case "with" -> { withStatement(); return; }
                    case "def" -> { functionDef(false); return; }
                    case "class" -> { classDef(); return; }
                    case "async" -> { asyncStatement(); return; }
                    default -> {
                    }
                }
            }
            if (tok.is("@")) {
                decorated();
                return;
            }
            simpleStatements();
        }

        private void simpleStatements() {
            simpleStatement();
            while (acceptOp(";")) {
                if (check(Kind.NEWLINE)) {
                    break;
                }
                simpleStatement();
            }
            expect(Kind.NEWLINE);
        }

        private void simpleStatement() {
            Tok tok = current();
            if (tok.kind() == Kind.NAME) {
                switch (tok.text()) {
                    case "pass" -> { advance(); return; }
                    case "break", "continue" -> {
                        if (loopDepth == 0) {
                            throw new PythonSyntaxException("'" + tok.text() + "' outside loop", tok.line());
                        }
                        advance();
                        return;
                    }
                    case "return" -> {
                        if (functionDepth == 0) {
                            throw new PythonSyntaxException("'return' outside function", tok.line());
                        }
                        advance();
                        if (!atStatementEnd()) {
                            starExpressions();
                        }
                        return;
                    }
                    case "raise" -> {
                        advance();
                        if (!atStatementEnd()) {
                            expression();
                            if (acceptName("from")) {
                                expression();
                            }
                        }
                        return;
                    }
                    case "global", "nonlocal" -> {
                        advance();
                        identifier();
                        while (acceptOp(",")) {
                            identifier();
                        }
                        return;
                    }
                    case "del" -> {
                        advance();
                        Expr target = starExpressions();
                        requireTarget(target, tok, "delete");
                        return;
                    }
                    case "assert" -> {
                        advance();
                        expression();
                        if (acceptOp(",")) {
                            expression();
                        }
                        return;
                    }
                    case "import" -> { importName(); return; }
                    case "from" -> { importFrom(); return; }
                    default -> {
                    }
                }
            }
            expressionStatement();
        }

        private void expressionStatement() {
            Tok first = current();
            Expr target = yieldOrStarExpressions();

            if (checkOp(":")) {
                if (!target.isSingleTarget()) {
                    throw new PythonSyntaxException("only single target (not tuple) can be annotated", first.line());
                }
                advance();
                expression();
                if (acceptOp("=")) {
                    yieldOrStarExpressions();
                }
                return;
            }
            if (current().kind() == Kind.OP && AUGMENTED.contains(current().text())) {
                if (!target.isSingleTarget()) {
                    throw new PythonSyntaxException("'" + describe(target) + "' is an illegal expression for augmented assignment",
                        first.line());
                }
                advance();
                yieldOrStarExpressions();
                return;
            }
            while (checkOp("=")) {
                requireTarget(target, first, "assign to");
                advance();
                first = current();
                target = yieldOrStarExpressions();
            }
        }

        private void importName() {
            advance();
            dottedAsName();
            while (acceptOp(",")) {
                dottedAsName();
            }
        }

        private void dottedAsName() {
            dottedName();
            if (acceptName("as")) {
                identifier();
            }
        }

        private void dottedName() {
            identifier();
            while (acceptOp(".")) {
                identifier();
            }
        }

        private void importFrom() {
            Tok from = advance();
            boolean relative = false;
            while (checkOp(".") || checkOp("...")) {
                advance();
                relative = true;
            }
            if (!checkName("import")) {
                dottedName();
            } else if (!relative) {
                throw new PythonSyntaxException("invalid syntax", from.line());
            }
            expectName("import");
            if (acceptOp("*")) {
                return;
            }
            if (acceptOp("(")) {
                importAsName();
                while (acceptOp(",")) {
                    if (checkOp(")")) {
                        break;
                    }
                    importAsName();
                }
                expectOp(")");
                return;
            }
            importAsName();
            while (acceptOp(",")) {
                importAsName();
            }
        }

        private void importAsName() {
            identifier();
            if (acceptName("as")) {
                identifier();
            }
        }

        // ===== Compound statements =====

        private void ifStatement() {
            advance();
            namedExpression();
            block();
            while (checkName("elif")) {
                advance();
                namedExpression();
                block();
            }
            if (acceptName("else")) {
                block();
            }
        }

        private void whileStatement() {
            advance();
            namedExpression();
            loopBlock();
            if (acceptName("else")) {
                block();
            }
        }

        private void forStatement() {
            advance();
            Tok first = current();
            Expr target = targetList();
            requireTarget(target, first, "assign to");
            expectName("in");
            starExpressions();
            loopBlock();
            if (acceptName("else")) {
                block();
            }
        }

        private void tryStatement() {
            Tok tryTok = advance();
            block();
            boolean handled = false;
            while (checkName("except")) {
                advance();
                acceptOp("*");
                if (!checkOp(":")) {
                    expression();
                    if (acceptName("as")) {
                        identifier();
                    }
                }
                block();
                handled = true;
            }
            if (handled && acceptName("else")) {
                block();
            }
            if (acceptName("finally")) {
                block();
                handled = true;
            }
            if (!handled) {
                throw new PythonSyntaxException("expected 'except' or 'finally' block", tryTok.line());
            }
        }

        private void withStatement() {
            advance();
            if (checkOp("(") && parenthesizedWithItems()) {
                advance();
                withItem();
                while (acceptOp(",")) {
                    if (checkOp(")")) {
                        break;
                    }
                    withItem();
                }
                expectOp(")");
            } else {
                withItem();
                while (acceptOp(",")) {
                    withItem();
                }
            }
            block();
        }

        /**
         * True if the "(" at the current position opens a group of with-items followed by ":".
         */
        private boolean parenthesizedWithItems() {
            int depth = 0;
            boolean sawAs = false;
            for (int i = pos; i < tokens.size(); i++) {
                Tok tok = tokens.get(i);
                if (tok.kind() == Kind.OP && (tok.text().equals("(") || tok.text().equals("[") || tok.text().equals("{"))) {
                    depth++;
                } else if (tok.kind() == Kind.OP && (tok.text().equals(")") || tok.text().equals("]") || tok.text().equals("}"))) {
                    depth--;
                    if (depth == 0) {
                        return sawAs && i + 1 < tokens.size() && tokens.get(i + 1).is(":");
                    }
                } else if (depth == 1 && tok.kind() == Kind.NAME && tok.text().equals("as")) {
                    sawAs = true;
                } else if (tok.kind() == Kind.NEWLINE || tok.kind() == Kind.END) {
                    return false;
                }
            }
            return false;
        }

        private void withItem() {
            expression();
            if (acceptName("as")) {
                Tok first = current();
                Expr target = starTarget();
                requireTarget(target, first, "assign to");
            }
        }

        private void functionDef(boolean async) {
            advance();
            identifier();
            expectOp("(");
            parameters(")", true);
            expectOp(")");
            if (acceptOp("->")) {
                expression();
            }
            int savedLoops = loopDepth;
            loopDepth = 0;
            functionDepth++;
            block();
            functionDepth--;
            loopDepth = savedLoops;
        }

        private void classDef() {
            advance();
            identifier();
            if (acceptOp("(")) {
                arguments();
                expectOp(")");
            }
            int savedLoops = loopDepth;
            int savedFunctions = functionDepth;
            loopDepth = 0;
            functionDepth = 0;
            block();
            loopDepth = savedLoops;
            functionDepth = savedFunctions;
        }

        private void asyncStatement() {
            advance();
            if (checkName("def")) {
                functionDef(true);
            } else if (checkName("for")) {
                forStatement();
            } else if (checkName("with")) {
                withStatement();
            } else {
                throw unexpected();
            }
        }

        private void decorated() {
            while (acceptOp("@")) {
                namedExpression();
                expect(Kind.NEWLINE);
            }
            if (checkName("def")) {
                functionDef(false);
            } else if (checkName("class")) {
                classDef();
            } else if (checkName("async")) {
                advance();
                if (!checkName("def")) {
                    throw unexpected();
                }
                functionDef(true);
            } else {
                throw unexpected();
            }
        }

        private void loopBlock() {
            loopDepth++;
            block();
            loopDepth--;
        }

        private void block() {
            expectOp(":");
            if (check(Kind.NEWLINE)) {
                Tok newline = advance();
                if (!check(Kind.INDENT)) {
                    throw new PythonSyntaxException("expected an indented block", newline.line() + 1);
                }
                advance();
                while (!check(Kind.DEDENT) && !check(Kind.END)) {
                    statement();
                }
                expect(Kind.DEDENT);
            } else {
                simpleStatements();
            }
        }

        /**
         * Parameter list up to (not including) {@code closing}; annotations only for def.
         */
        private void parameters(String closing, boolean annotations) {
            boolean sawDefault = false;
            boolean sawStar = false;
            boolean sawSlash = false;
            boolean sawAny = false;
            while (!checkOp(closing)) {
                Tok tok = current();
                if (acceptOp("/")) {
                    if (!sawAny || sawSlash || sawStar) {
                        throw new PythonSyntaxException("invalid syntax at '/'", tok.line());
                    }
                    sawSlash = true;
                } else if (acceptOp("**")) {
                    identifier();
                    annotation(annotations);
                    acceptOp(",");
                    if (!checkOp(closing)) {
                        throw new PythonSyntaxException("arguments cannot follow var-keyword argument", tok.line());
                    }
                    return;
                } else if (acceptOp("*")) {
                    if (sawStar) {
                        throw new PythonSyntaxException("* argument may appear only once", tok.line());
                    }
                    sawStar = true;
                    if (check(Kind.NAME)) {
                        identifier();
                        annotation(annotations);
                    }
                } else {
                    identifier();
                    annotation(annotations);
                    if (acceptOp("=")) {
                        expression();
                        sawDefault = true;
                    } else if (sawDefault && !sawStar) {
                        throw new PythonSyntaxException("non-default argument follows default argument", tok.line());
                    }
                }
                sawAny = true;
                if (!acceptOp(",")) {
                    break;
                }
            }
        }

        private void annotation(boolean allowed) {
            if (allowed && acceptOp(":")) {
                expression();
            }
        }

        // ===== Expressions =====

        private Expr yieldOrStarExpressions() {
            if (checkName("yield")) {
                return yieldExpression();
            }
            return starExpressions();
        }

        private Expr yieldExpression() {
            Tok tok = advance();
            if (functionDepth == 0) {
                throw new PythonSyntaxException("'yield' outside function", tok.line());
            }
            if (acceptName("from")) {
                expression();
            } else if (!atStatementEnd() && !checkOp(")") && !checkOp("=")) {
                starExpressions();
            }
            return Expr.OTHER;
        }

        private Expr starExpressions() {
            Expr first = starExpression();
            if (!checkOp(",")) {
                return first;
            }
            boolean assignable = first.assignable();
            while (acceptOp(",")) {
                if (!atExpressionStart()) {
                    break;
                }
                assignable &= starExpression().assignable();
            }
            return new Expr(Shape.TUPLE, assignable);
        }

        private Expr starExpression() {
            if (acceptOp("*")) {
                Expr inner = bitwiseOr();
                return new Expr(Shape.STARRED, inner.assignable());
            }
            return expression();
        }

        private Expr starNamedExpression() {
            if (acceptOp("*")) {
                Expr inner = bitwiseOr();
                return new Expr(Shape.STARRED, inner.assignable());
            }
            return namedExpression();
        }

        private Expr namedExpression() {
            if (check(Kind.NAME) && peek(1).is(":=")) {
                identifier();
                advance();
                expression();
                return Expr.OTHER;
            }
            Tok first = current();
            Expr expr = expression();
            if (checkOp(":=")) {
                throw new PythonSyntaxException("cannot use assignment expressions with " + describe(expr), first.line());
            }
            return expr;
        }

        private Expr expression() {
            if (checkName("lambda")) {
                return lambda();
            }
            Expr body = disjunction();
            if (acceptName("if")) {
                disjunction();
                expectName("else");
                expression();
                return Expr.OTHER;
            }
            return body;
        }

        private Expr expressionNoConditional() {
            return checkName("lambda") ? lambda() : disjunction();
        }

        private Expr lambda() {
            advance();
            parameters(":", false);
            expectOp(":");
            int savedLoops = loopDepth;
            loopDepth = 0;
            expression();
            loopDepth = savedLoops;
            return Expr.OTHER;
        }

        private Expr disjunction() {
            Expr left = conjunction();
            if (!checkName("or")) {
                return left;
            }
            while (acceptName("or")) {
                conjunction();
            }
            return Expr.OTHER;
        }

        private Expr conjunction() {
            Expr left = inversion();
            if (!checkName("and")) {
                return left;
            }
            while (acceptName("and")) {
                inversion();
            }
            return Expr.OTHER;
        }

        private Expr inversion() {
            if (acceptName("not")) {
                inversion();
                return Expr.OTHER;
            }
            return comparison();
        }

        private Expr comparison() {
            Expr left = bitwiseOr();
            boolean compared = false;
            while (true) {
                if (current().kind() == Kind.OP && COMPARISONS.contains(current().text())) {
                    advance();
                } else if (checkName("in")) {
                    advance();
                } else if (checkName("not") && peek(1).is("in")) {
                    advance();
                    advance();
                } else if (checkName("is")) {
                    advance();
                    acceptName("not");
                } else {
                    break;
                }
                bitwiseOr();
                compared = true;
            }
            return compared ? Expr.OTHER : left;
        }

        private Expr bitwiseOr() {
            return binaryLevel(0);
        }

        private static final List<Set<String>> BINARY_LEVELS = List.of(
            Set.of("|"), Set.of("^"), Set.of("&"), Set.of("<<", ">>"), Set.of("+", "-"),
            Set.of("*", "/", "//", "%", "@")
        );

        private Expr binaryLevel(int level) {
            if (level == BINARY_LEVELS.size()) {
                return factor();
            }
            Expr left = binaryLevel(level + 1);
            boolean combined = false;
            while (current().kind() == Kind.OP && BINARY_LEVELS.get(level).contains(current().text())) {
                advance();
                binaryLevel(level + 1);
                combined = true;
            }
            return combined ? Expr.OTHER : left;
        }

        private Expr factor() {
            if (checkOp("+") || checkOp("-") || checkOp("~")) {
                advance();
                factor();
                return Expr.OTHER;
            }
            return power();
        }

        private Expr power() {
            boolean awaited = acceptName("await");
            Expr base = primary();
            if (acceptOp("**")) {
                factor();
                return Expr.OTHER;
            }
            return awaited ? Expr.OTHER : base;
        }

        private Expr primary() {
            Expr expr = atom();
            while (true) {
                if (acceptOp(".")) {
                    identifier();
                    expr = Expr.of(Shape.ATTRIBUTE);
                } else if (acceptOp("(")) {
                    arguments();
                    expectOp(")");
                    expr = Expr.of(Shape.CALL);
                } else if (acceptOp("[")) {
                    slices();
                    expectOp("]");
                    expr = Expr.of(Shape.SUBSCRIPT);
                } else {
                    return expr;
                }
            }
        }

        private Expr atom() {
            Tok tok = current();
            switch (tok.kind()) {
                case NAME -> {
                    if (tok.text().equals("True") || tok.text().equals("False") || tok.text().equals("None")) {
                        advance();
                        return Expr.of(Shape.LITERAL);
                    }
                    if (KEYWORDS.contains(tok.text())) {
                        throw unexpected();
                    }
                    advance();
                    return Expr.of(Shape.NAME);
                }
                case NUMBER -> {
                    advance();
                    return Expr.of(Shape.LITERAL);
                }
                case STRING -> {
                    while (check(Kind.STRING)) {
                        Tok string = advance();
                        FStrings.check(string.text(), string.line());
                    }
                    return Expr.of(Shape.LITERAL);
                }
                case OP -> {
                    switch (tok.text()) {
                        case "(" -> { return parenthesized(); }
                        case "[" -> { return listDisplay(); }
                        case "{" -> { return dictOrSet(); }
                        case "..." -> {
                            advance();
                            return Expr.of(Shape.LITERAL);
                        }
                        default -> throw unexpected();
                    }
                }
                default -> throw unexpected();
            }
        }

        private Expr parenthesized() {
            advance();
            if (acceptOp(")")) {
                return new Expr(Shape.TUPLE, true);
            }
            if (checkName("yield")) {
                yieldExpression();
                expectOp(")");
                return Expr.OTHER;
            }
            Expr first = starNamedExpression();
            if (checkName("for") || checkName("async")) {
                comprehension();
                expectOp(")");
                return Expr.OTHER;
            }
            if (!checkOp(",")) {
                expectOp(")");
                if (first.shape() == Shape.STARRED) {
                    throw new PythonSyntaxException("cannot use starred expression here", tok(-1).line());
                }
                return first;
            }
            boolean assignable = first.assignable();
            while (acceptOp(",")) {
                if (checkOp(")")) {
                    break;
                }
                assignable &= starNamedExpression().assignable();
            }
            expectOp(")");
            return new Expr(Shape.TUPLE, assignable);
        }

        private Expr listDisplay() {
            advance();
            if (acceptOp("]")) {
                return new Expr(Shape.LIST, true);
            }
            Expr first = starNamedExpression();
            if (checkName("for") || checkName("async")) {
                comprehension();
                expectOp("]");
                return Expr.OTHER;
            }
            boolean assignable = first.assignable();
            while (acceptOp(",")) {
                if (checkOp("]")) {
                    break;
                }
                assignable &= starNamedExpression().assignable();
            }
            expectOp("]");
            return new Expr(Shape.LIST, assignable);
        }

        private Expr dictOrSet() {
            advance();
            if (acceptOp("}")) {
                return Expr.OTHER;
            }
            boolean dict;
            if (acceptOp("**")) {
                bitwiseOr();
                dict = true;
            } else {
                starNamedExpression();
                dict = acceptOp(":");
                if (dict) {
                    expression();
                }
                if (checkName("for") || checkName("async")) {
                    comprehension();
                    expectOp("}");
                    return Expr.OTHER;
                }
            }
            while (acceptOp(",")) {
                if (checkOp("}")) {
                    break;
                }
                if (dict) {
                    if (acceptOp("**")) {
                        bitwiseOr();
                    } else {
                        expression();
                        expectOp(":");
                        expression();
                    }
                } else {
                    starNamedExpression();
                }
            }
            expectOp("}");
            return Expr.OTHER;
        }

        private void comprehension() {
            do {
                acceptName("async");
                expectName("for");
                Tok first = current();
                Expr target = targetList();
                requireTarget(target, first, "assign to");
                expectName("in");
                disjunction();
                while (acceptName("if")) {
                    expressionNoConditional();
                }
            } while (checkName("for") || checkName("async"));
        }

        /**
         * Targets of for-loops and comprehensions: stops before "in".
         */
        private Expr targetList() {
            Expr first = starTarget();
            if (!checkOp(",")) {
                return first;
            }
            boolean assignable = first.assignable();
            while (acceptOp(",")) {
                if (checkName("in")) {
                    break;
                }
                assignable &= starTarget().assignable();
            }
            return new Expr(Shape.TUPLE, assignable);
        }

        private Expr starTarget() {
            if (acceptOp("*")) {
                return new Expr(Shape.STARRED, bitwiseOr().assignable());
            }
            return bitwiseOr();
        }

        private void arguments() {
            while (!checkOp(")")) {
                if (acceptOp("*") || acceptOp("**")) {
                    expression();
                } else if (check(Kind.NAME) && peek(1).is("=")) {
                    identifier();
                    advance();
                    expression();
                } else {
                    namedExpression();
                    if (checkName("for") || checkName("async")) {
                        comprehension();
                    }
                }
                if (!acceptOp(",")) {
                    break;
                }
            }
        }

        private void slices() {
            slice();
            while (acceptOp(",")) {
                if (checkOp("]")) {
                    break;
                }
                slice();
            }
        }

        private void slice() {
            if (acceptOp("*")) {
                bitwiseOr();
                return;
            }
            if (!checkOp(":")) {
                namedExpression();
                if (!checkOp(":")) {
                    return;
                }
            }
            expectOp(":");
            if (!checkOp(":") && !checkOp(",") && !checkOp("]")) {
                expression();
            }
            if (acceptOp(":") && !checkOp(",") && !checkOp("]")) {
                expression();
            }
        }

        // ===== Helpers =====

        private void requireTarget(Expr target, Tok at, String verb) {
            if (!target.assignable()) {
                throw new PythonSyntaxException("cannot " + verb + " " + describe(target), at.line());
            }
        }

        private static String describe(Expr expr) {
            return switch (expr.shape()) {
                case CALL -> "function call";
                case LITERAL -> "literal";
                case TUPLE -> "tuple";
                case LIST -> "list";
                case STARRED -> "starred";
                default -> "expression";
            };
        }

        private boolean atStatementEnd() {
            return check(Kind.NEWLINE) || checkOp(";") || check(Kind.END);
        }

        private boolean atExpressionStart() {
            Tok tok = current();
            return switch (tok.kind()) {
                case NUMBER, STRING -> true;
                case NAME -> !KEYWORDS.contains(tok.text()) || Set.of("lambda", "not", "await", "True", "False", "None")
                    .contains(tok.text());
                case OP -> Set.of("(", "[", "{", "-", "+", "~", "*", "...").contains(tok.text());
                default -> false;
            };
        }

        private void identifier() {
            Tok tok = current();
            if (tok.kind() != Kind.NAME || KEYWORDS.contains(tok.text())) {
                throw unexpected();
            }
            advance();
        }

        private Tok current() {
            return tokens.get(Math.min(pos, tokens.size() - 1));
        }

        private Tok peek(int offset) {
            return tokens.get(Math.min(pos + offset, tokens.size() - 1));
        }

        private Tok tok(int offset) {
            return tokens.get(Math.max(0, Math.min(pos + offset, tokens.size() - 1)));
        }

        private Tok advance() {
            Tok tok = current();
            if (pos < tokens.size() - 1) {
                pos++;
            }
            return tok;
        }

        private boolean check(Kind kind) {
            return current().kind() == kind;
        }

        private boolean checkOp(String op) {
            return current().kind() == Kind.OP && current().text().equals(op);
        }

        private boolean checkName(String name) {
            return current().kind() == Kind.NAME && current().text().equals(name);
        }

        private boolean acceptOp(String op) {
            if (checkOp(op)) {
                advance();
                return true;
            }
            return false;
        }

        private boolean acceptName(String name) {
            if (checkName(name)) {
                advance();
                return true;
            }
            return false;
        }

        private void expect(Kind kind) {
            if (!check(kind)) {
                throw unexpected();
            }
            advance();
        }

        private void expectOp(String op) {
            if (!checkOp(op)) {
                throw new PythonSyntaxException("expected '" + op + "'" + near(), current().line());
            }
            advance();
        }

        private void expectName(String name) {
            if (!checkName(name)) {
                throw new PythonSyntaxException("expected '" + name + "'" + near(), current().line());
            }
            advance();
        }

        private PythonSyntaxException unexpected() {
            Tok tok = current();
            return switch (tok.kind()) {
                case INDENT -> new PythonSyntaxException("unexpected indent", tok.line());
                case DEDENT -> new PythonSyntaxException("unindent does not match any outer indentation level", tok.line());
                case END -> new PythonSyntaxException("unexpected EOF while parsing", tok.line());
                default -> new PythonSyntaxException("invalid syntax" + near(), tok.line());
            };
        }

        private String near() {
            Tok tok = current();
            return switch (tok.kind()) {
                case NEWLINE -> " at end of line";
                case END -> " at end of input";
                case INDENT, DEDENT -> "";
                default -> " at '" + tok.text() + "'";
            };
        }
    }

    // ===== f-strings =====

    /**
     * Checks the replacement fields of f-string literals.
     */
    private static final class FStrings {

        static void check(String literal, int line) {
            int quoteAt = 0;
            while (quoteAt < literal.length() && literal.charAt(quoteAt) != '"' && literal.charAt(quoteAt) != '\'') {
                quoteAt++;
            }
            String prefix = literal.substring(0, quoteAt).toLowerCase(Locale.ROOT);
            if (!prefix.contains("f")) {
                return;
            }
            char quote = literal.charAt(quoteAt);
            int quoteLength = literal.startsWith(String.valueOf(quote).repeat(3), quoteAt) ? 3 : 1;
            String body = literal.substring(quoteAt + quoteLength, literal.length() - quoteLength);
            fields(body, line);
        }

        private static void fields(String body, int line) {
            int i = 0;
            while (i < body.length()) {
                char c = body.charAt(i);
                if (c == '{') {
                    if (i + 1 < body.length() && body.charAt(i + 1) == '{') {
                        i += 2;
                        continue;
                    }
                    i = field(body, i + 1, line);
                } else if (c == '}') {
                    if (i + 1 < body.length() && body.charAt(i + 1) == '}') {
                        i += 2;
                        continue;
                    }
                    throw new PythonSyntaxException("f-string: single '}' is not allowed", line);
                } else {
                    i++;
                }
            }
        }

        /**
         * Check one replacement field starting after its "{"; returns the index after its "}".
         */
        private static int field(String body, int start, int line) {
            int depth = 0;
            int exprEnd = -1;
            int i = start;
            while (i < body.length()) {
                char c = body.charAt(i);
                if (c == '"' || c == '\'') {
                    int close = body.indexOf(c, i + 1);
                    if (close < 0) {
                        throw new PythonSyntaxException("f-string: unterminated string", line);
                    }
                    i = close + 1;
                    continue;
                }
                if (c == '(' || c == '[' || c == '{') {
                    depth++;
                } else if (c == ')' || c == ']' || (c == '}' && depth > 0)) {
                    depth--;
                } else if (depth == 0 && c == '}') {
                    if (exprEnd < 0) {
                        exprEnd = i;
                    }
                    expression(body.substring(start, exprEnd), line);
                    return i + 1;
                } else if (depth == 0 && exprEnd < 0 && c == '!' && (i + 1 >= body.length() || body.charAt(i + 1) != '=')) {
                    exprEnd = i;
                } else if (depth == 0 && exprEnd < 0 && c == ':') {
                    exprEnd = i;
                    return formatSpec(body, start, exprEnd, i + 1, line);
                }
                i++;
            }
            throw new PythonSyntaxException("f-string: expecting '}'", line);
        }

        private static int formatSpec(String body, int exprStart, int exprEnd, int specStart, int line) {
            expression(body.substring(exprStart, exprEnd), line);
            int i = specStart;
            while (i < body.length()) {
                char c = body.charAt(i);
                if (c == '{') {
                    i = field(body, i + 1, line);
                    continue;
                }
                if (c == '}') {
                    return i + 1;
                }
                i++;
            }
            throw new PythonSyntaxException("f-string: expecting '}'", line);
        }

        private static void expression(String text, int line) {
            String expr = text.strip();
            if (expr.endsWith("=") && !expr.endsWith("==") && !expr.endsWith("!=")
                && !expr.endsWith("<=") && !expr.endsWith(">=")) {
                expr = expr.substring(0, expr.length() - 1).strip();
            }
            if (expr.isEmpty()) {
                throw new PythonSyntaxException("f-string: empty expression not allowed", line);
            }
            SyntaxCheckResult result = new PythonSyntaxValidator().validateExpression("(" + expr + ")");
            if (!result.valid()) {
                throw new PythonSyntaxException("f-string: " + result.message(), line);
            }
        }
    }
}
