package com.analysis.nodeflow.infer;

import com.analysis.nodeflow.infer.PythonLexer.Token;
import com.analysis.nodeflow.infer.PythonLexer.Type;

import java.util.*;

/**
 * Structured scan of notebook code: tells names that are read apart from
 * names that are bound.
 *
 * <p>
 * The token stream is split into logical statements (on NEWLINE, and on
 * {@code ;} and the header colon of compound statements). Each statement is
 * then classified by its leading keyword or by the top-level assignment
 * operators it contains. Only the context of each name is needed, so there is
 * no full expression tree.
 */
public final class CodeScanner {

    static final Set<String> KEYWORDS = Set.of("False", "None", "True", "and", "as", "assert", "async", "await",
            "break", "class", "continue", "def", "del", "elif", "else", "except", "finally", "for", "from", "global",
            "if", "import", "in", "is", "lambda", "nonlocal", "not", "or", "pass", "raise", "return", "try", "while",
            "with", "yield");

    private static final Set<String> AUGMENTED = Set.of("+=", "-=", "*=", "/=", "//=", "%=", "@=", "&=", "|=", "^=",
            ">>=", "<<=", "**=");

    private static final Set<String> COMPOUND = Set.of("if", "elif", "while", "else", "try", "finally", "except",
            "for", "with", "def", "class");

    private static final Set<String> SOFT_KEYWORDS = Set.of("match", "case");

    /**
     * @throws CodeSyntaxException if the code is malformed
     */
    public ScanResult scan(String code) {
        Scan scan = new Scan();
        for (List<Token> statement : statements(PythonLexer.tokenize(code)))
            scan.statement(statement);
        return new ScanResult(scan.reads, scan.assigned, scan.defined, scan.bound);
    }

    private static List<List<Token>> statements(List<Token> tokens) {
        List<List<Token>> out = new ArrayList<>();
        List<Token> current = new ArrayList<>();
        int depth = 0;
        for (Token t : tokens) {
            if (t.opens())
                depth++;
            else if (t.closes())
                depth--;
            if (t.type() == Type.NEWLINE || (depth == 0 && t.is(";"))) {
                if (!current.isEmpty())
                    out.add(current);
                current = new ArrayList<>();
            } else {
                current.add(t);
            }
        }
        if (!current.isEmpty())
            out.add(current);
        return out;
    }

    private static boolean isIdentifier(Token t) {
        return t != null && t.isName() && !KEYWORDS.contains(t.text());
    }

    private static int matching(List<Token> tokens, int open) {
        int depth = 0;
        for (int i = open; i < tokens.size(); i++) {
            if (tokens.get(i).opens())
                depth++;
            else if (tokens.get(i).closes() && --depth == 0)
                return i;
        }
        throw new CodeSyntaxException("'" + tokens.get(open).text() + "' was never closed", tokens.get(open).line());
    }

    private static CodeSyntaxException invalid(List<Token> statement) {
        return new CodeSyntaxException("invalid syntax", statement.isEmpty() ? 0 : statement.get(0).line());
    }

    /** Mutable state for one scan. */
    private static final class Scan {
        final Set<String> reads = new LinkedHashSet<>();
        final Set<String> assigned = new LinkedHashSet<>();
        final Set<String> defined = new LinkedHashSet<>();
        final Set<String> bound = new LinkedHashSet<>();

        void statement(List<Token> s) {
            if (s.isEmpty())
                return;
            Token first = s.get(0);
            if (first.is("@")) {
                expression(s, 1);
                return;
            }
            if (first.isName()) {
                String kw = first.text();
                if (kw.equals("async")) {
                    statement(s.subList(1, s.size()));
                    return;
                }
                if (COMPOUND.contains(kw) || softKeywordStatement(s)) {
                    compound(kw, s);
                    return;
                }
                switch (kw) {
                    case "import" -> importNames(s.subList(1, s.size()));
                    case "from" -> fromImport(s);
                    case "del" -> target(s.subList(1, s.size()), null);
                    case "global", "nonlocal", "pass", "break", "continue" -> {
                        // nothing read or bound here
                    }
                    case "return", "yield", "raise", "assert", "await" -> expression(s, 1);
                    default -> simple(s);
                }
                return;
            }
            simple(s);
        }

        private void compound(String keyword, List<Token> s) {
            int colon = headerColon(s);
            if (colon < 0)
                throw new CodeSyntaxException("expected ':'", s.get(0).line());
            List<Token> header = s.subList(1, colon);
            switch (keyword) {
                case "else", "try", "finally" -> {
                    if (!header.isEmpty())
                        throw invalid(s);
                }
                case "for" -> forHeader(header, s);
                case "def" -> defHeader(header, s);
                case "class" -> classHeader(header, s);
                case "case" -> casePattern(header, s);
                default -> expression(header, 0);
            }
            statement(s.subList(colon + 1, s.size()));
        }

        /**
         * {@code match} and {@code case} only start a compound statement when
         * followed by an operand and a header colon; otherwise they are plain
         * names ({@code match = ...}, {@code match(x)}).
         */
        private boolean softKeywordStatement(List<Token> s) {
            if (!SOFT_KEYWORDS.contains(s.get(0).text()) || s.size() < 3)
                return false;
            Token second = s.get(1);
            boolean operand = second.type() != Type.OP || second.opens() || second.is("-") || second.is("*");
            return operand && headerColon(s) > 1;
        }

        /**
         * Capture names in a pattern bind; dotted value patterns and class
         * patterns read their leading name; the guard is an ordinary expression.
         */
        private void casePattern(List<Token> header, List<Token> s) {
            if (header.isEmpty())
                throw invalid(s);
            int guard = topLevel(header, t -> t.isKeyword("if"));
            List<Token> pattern = guard >= 0 ? header.subList(0, guard) : header;
            for (int i = 0; i < pattern.size(); i++) {
                Token t = pattern.get(i);
                Token prev = i > 0 ? pattern.get(i - 1) : null;
                Token next = i + 1 < pattern.size() ? pattern.get(i + 1) : null;
                if (!isIdentifier(t) || t.text().equals("_") || (prev != null && prev.is(".")))
                    continue;
                if (next != null && (next.is(".") || next.is("(")))
                    reads.add(t.text());
                else if (next != null && next.is("=") && prev != null && (prev.is("(") || prev.is(",")))
                    continue;
                else
                    bound.add(t.text());
            }
            if (guard >= 0)
                expression(header.subList(guard + 1, header.size()), 0);
        }

        private int headerColon(List<Token> s) {
            int depth = 0;
            int lambdas = 0;
            for (int i = 1; i < s.size(); i++) {
                Token t = s.get(i);
                if (t.opens())
                    depth++;
                else if (t.closes())
                    depth--;
                else if (depth == 0 && t.isKeyword("lambda"))
                    lambdas++;
                else if (depth == 0 && t.is(":")) {
                    if (lambdas == 0)
                        return i;
                    lambdas--;
                }
            }
            return -1;
        }

        private void forHeader(List<Token> header, List<Token> s) {
            int in = topLevel(header, t -> t.isKeyword("in"));
            if (in <= 0)
                throw invalid(s);
            target(header.subList(0, in), bound);
            expression(header.subList(in + 1, header.size()), 0);
        }

        private void defHeader(List<Token> header, List<Token> s) {
            if (header.isEmpty() || !isIdentifier(header.get(0)))
                throw invalid(s);
            defined.add(header.get(0).text());
            int i = 1;
            if (i < header.size() && header.get(i).is("["))
                i = matching(header, i) + 1;
            if (i >= header.size() || !header.get(i).is("("))
                throw new CodeSyntaxException("expected '('", header.get(0).line());
            int close = matching(header, i);
            parameters(header.subList(i + 1, close));
            expression(header.subList(close + 1, header.size()), 0);
        }

        private void classHeader(List<Token> header, List<Token> s) {
            if (header.isEmpty() || !isIdentifier(header.get(0)))
                throw invalid(s);
            defined.add(header.get(0).text());
            expression(header, 1);
        }

        /** Parameter names bind; annotations and defaults are read. */
        private void parameters(List<Token> params) {
            for (List<Token> param : splitTopLevel(params, ",")) {
                int i = 0;
                while (i < param.size() && (param.get(i).is("*") || param.get(i).is("**") || param.get(i).is("/")))
                    i++;
                if (i >= param.size())
                    continue;
                if (!isIdentifier(param.get(i)))
                    throw invalid(param);
                List<Token> rest = param.subList(i + 1, param.size());
                int colon = topLevel(rest, t -> t.is(":"));
                int eq = topLevel(rest, t -> t.is("="));
                if (colon >= 0)
                    expression(rest.subList(colon + 1, eq >= 0 ? eq : rest.size()), 0);
                if (eq >= 0)
                    expression(rest.subList(eq + 1, rest.size()), 0);
            }
        }

        private void importNames(List<Token> names) {
            for (List<Token> item : splitTopLevel(names, ",")) {
                if (item.isEmpty() || !isIdentifier(item.get(0)))
                    throw invalid(names);
                int as = topLevel(item, t -> t.isKeyword("as"));
                if (as >= 0) {
                    if (as + 1 >= item.size() || !isIdentifier(item.get(as + 1)))
                        throw invalid(item);
                    bound.add(item.get(as + 1).text());
                } else {
                    // import a.b.c binds a
                    bound.add(item.get(0).text());
                }
            }
        }

        private void fromImport(List<Token> s) {
            int imp = topLevel(s, t -> t.isKeyword("import"));
            if (imp < 2)
                throw invalid(s);
            List<Token> names = new ArrayList<>();
            for (Token t : s.subList(imp + 1, s.size()))
                if (!t.is("(") && !t.is(")"))
                    names.add(t);
            if (names.size() == 1 && names.get(0).is("*"))
                return;
            importNames(names);
        }

        /** Assignments, annotated declarations and bare expression statements. */
        private void simple(List<Token> s) {
            List<Integer> equals = new ArrayList<>();
            int augmented = -1;
            int annotation = -1;
            int depth = 0;
            int lambdas = 0;
            for (int i = 0; i < s.size() && augmented < 0; i++) {
                Token t = s.get(i);
                if (t.opens())
                    depth++;
                else if (t.closes())
                    depth--;
                else if (depth != 0)
                    continue;
                else if (t.isKeyword("lambda"))
                    lambdas++;
                else if (t.is(":")) {
                    if (lambdas > 0)
                        lambdas--;
                    else if (annotation < 0 && equals.isEmpty())
                        annotation = i;
                } else if (t.is("=") && lambdas == 0)
                    equals.add(i);
                else if (t.type() == Type.OP && AUGMENTED.contains(t.text()) && equals.isEmpty())
                    augmented = i;
            }

            if (augmented >= 0) {
                if (augmented == 0 || augmented == s.size() - 1)
                    throw invalid(s);
                target(s.subList(0, augmented), assigned);
                expression(s.subList(augmented + 1, s.size()), 0);
                return;
            }
            if (!equals.isEmpty()) {
                int start = 0;
                for (int eq : equals) {
                    if (eq == start)
                        throw invalid(s);
                    if (start == 0 && annotation >= 0 && annotation < eq) {
                        annotatedTarget(s.subList(0, annotation), s);
                        expression(s.subList(annotation + 1, eq), 0);
                    } else {
                        target(s.subList(start, eq), assigned);
                    }
                    start = eq + 1;
                }
                if (start >= s.size())
                    throw invalid(s);
                expression(s.subList(start, s.size()), 0);
                return;
            }
            if (annotation >= 0) {
                annotatedTarget(s.subList(0, annotation), s);
                expression(s.subList(annotation + 1, s.size()), 0);
                return;
            }
            expression(s, 0);
        }

        private void annotatedTarget(List<Token> target, List<Token> s) {
            if (target.isEmpty())
                throw invalid(s);
            target(target, assigned);
        }

        /**
         * Walks an assignment target. Bare names bind into {@code into} (nothing
         * for {@code del}); names that own an attribute, subscript or call, and
         * everything inside a subscript or call, are read.
         */
        private void target(List<Token> tokens, Set<String> into) {
            Deque<Boolean> inExpression = new ArrayDeque<>();
            for (int i = 0; i < tokens.size(); i++) {
                Token t = tokens.get(i);
                Token prev = i > 0 ? tokens.get(i - 1) : null;
                Token next = i + 1 < tokens.size() ? tokens.get(i + 1) : null;
                if (t.opens()) {
                    boolean nested = !inExpression.isEmpty() && inExpression.peek();
                    inExpression.push(nested || (!t.is("{") && continuesPrimary(prev)));
                    continue;
                }
                if (t.closes()) {
                    if (!inExpression.isEmpty())
                        inExpression.pop();
                    continue;
                }
                if (t.type() == Type.STRING) {
                    fields(t);
                    continue;
                }
                if (!isIdentifier(t) || (prev != null && prev.is(".")))
                    continue;
                boolean owner = next != null && (next.is(".") || next.is("[") || next.is("("));
                boolean nested = !inExpression.isEmpty() && inExpression.peek();
                if (owner || nested)
                    reads.add(t.text());
                else if (into != null)
                    into.add(t.text());
            }
        }

        /**
         * Walks an expression from index {@code from}; earlier tokens are only
         * used as context.
         */
        private void expression(List<Token> tokens, int from) {
            Deque<Boolean> calls = new ArrayDeque<>();
            Deque<Integer> lambdas = new ArrayDeque<>();
            Deque<Integer> comprehensions = new ArrayDeque<>();
            int depth = 0;
            boolean asTarget = false;

            for (int i = from; i < tokens.size(); i++) {
                Token t = tokens.get(i);
                Token prev = i > 0 ? tokens.get(i - 1) : null;
                Token next = i + 1 < tokens.size() ? tokens.get(i + 1) : null;

                if (t.type() == Type.OP) {
                    if (t.opens()) {
                        calls.push(t.is("(") && continuesPrimary(prev));
                        depth++;
                    } else if (t.closes()) {
                        if (!calls.isEmpty())
                            calls.pop();
                        depth--;
                        while (!lambdas.isEmpty() && lambdas.peek() > depth)
                            lambdas.pop();
                        while (!comprehensions.isEmpty() && comprehensions.peek() > depth)
                            comprehensions.pop();
                    } else if (t.is(":") && !lambdas.isEmpty() && lambdas.peek() == depth) {
                        lambdas.pop();
                    }
                    continue;
                }
                if (t.type() == Type.STRING) {
                    fields(t);
                    continue;
                }
                if (t.type() != Type.NAME)
                    continue;

                switch (t.text()) {
                    case "lambda" -> {
                        lambdas.push(depth);
                        continue;
                    }
                    case "for" -> {
                        comprehensions.push(depth);
                        continue;
                    }
                    case "in" -> {
                        if (!comprehensions.isEmpty() && comprehensions.peek() == depth)
                            comprehensions.pop();
                        continue;
                    }
                    case "as" -> {
                        if (next != null && (next.is("(") || next.is("["))) {
                            // as (a, b): every name in the target binds
                            int close = matching(tokens, i + 1);
                            for (Token name : tokens.subList(i + 2, close))
                                if (isIdentifier(name))
                                    bound.add(name.text());
                            i = close;
                        } else {
                            asTarget = true;
                        }
                        continue;
                    }
                    default -> {
                        if (KEYWORDS.contains(t.text()))
                            continue;
                    }
                }

                if (prev != null && prev.is("."))
                    continue;
                if (asTarget) {
                    bound.add(t.text());
                    asTarget = false;
                    continue;
                }
                if (!comprehensions.isEmpty() && comprehensions.peek() <= depth) {
                    bound.add(t.text());
                    continue;
                }
                if (!lambdas.isEmpty() && lambdas.peek() == depth && startsParameter(prev))
                    continue;
                if (!calls.isEmpty() && calls.peek() && next != null && next.is("=")
                        && prev != null && (prev.is("(") || prev.is(",")))
                    continue;
                if (next != null && next.is(":=")) {
                    bound.add(t.text());
                    continue;
                }
                reads.add(t.text());
            }
        }

        private void fields(Token string) {
            for (String field : string.fields())
                expression(PythonLexer.tokenize(field).stream()
                        .filter(t -> t.type() != Type.NEWLINE)
                        .toList(), 0);
        }

        private static boolean startsParameter(Token prev) {
            return prev != null && (prev.isKeyword("lambda") || prev.is(",") || prev.is("*") || prev.is("**"));
        }

        private static boolean continuesPrimary(Token prev) {
            return isIdentifier(prev) || (prev != null && (prev.is(")") || prev.is("]")
                    || prev.type() == Type.STRING));
        }

        private static int topLevel(List<Token> tokens, java.util.function.Predicate<Token> test) {
            int depth = 0;
            for (int i = 0; i < tokens.size(); i++) {
                Token t = tokens.get(i);
                if (t.opens())
                    depth++;
                else if (t.closes())
                    depth--;
                else if (depth == 0 && test.test(t))
                    return i;
            }
            return -1;
        }

        private static List<List<Token>> splitTopLevel(List<Token> tokens, String separator) {
            List<List<Token>> parts = new ArrayList<>();
            int depth = 0;
            int start = 0;
            for (int i = 0; i < tokens.size(); i++) {
                Token t = tokens.get(i);
                if (t.opens())
                    depth++;
                else if (t.closes())
                    depth--;
                else if (depth == 0 && t.is(separator)) {
                    parts.add(tokens.subList(start, i));
                    start = i + 1;
                }
            }
            if (start < tokens.size())
                parts.add(tokens.subList(start, tokens.size()));
            return parts;
        }
    }
}
