package com.analysis.nodeflow.infer;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Set;

/**
 * Tokenizer for Python-flavoured notebook code.
 *
 * <p>
 * Produces names, numbers, strings, operators and logical-line NEWLINE
 * tokens. Line breaks inside brackets or after a backslash do not end a
 * logical line. Comments are dropped. Indentation is not tracked. For
 * f-strings the expressions inside {@code {}} fields are extracted so callers
 * can scan them like ordinary code.
 */
final class PythonLexer {

    enum Type {
        NAME, NUMBER, STRING, OP, NEWLINE
    }

    record Token(Type type, String text, int line, List<String> fields) {
        boolean is(String op) {
            return type == Type.OP && text.equals(op);
        }

        boolean isName() {
            return type == Type.NAME;
        }

        boolean isKeyword(String keyword) {
            return type == Type.NAME && text.equals(keyword);
        }

        boolean opens() {
            return type == Type.OP && (text.equals("(") || text.equals("[") || text.equals("{"));
        }

        boolean closes() {
            return type == Type.OP && (text.equals(")") || text.equals("]") || text.equals("}"));
        }
    }

    private static final String[] OPS3 = { "**=", "//=", ">>=", "<<=", "..." };
    private static final String[] OPS2 = { "==", "!=", "<=", ">=", "+=", "-=", "*=", "/=", "%=", "&=", "|=", "^=",
            "@=", "->", ":=", "**", "//", "<<", ">>" };
    private static final String OPS1 = "+-*/%@&|^~<>=.,:;";
    private static final Set<String> STRING_PREFIXES = Set.of("r", "u", "b", "f", "br", "rb", "fr", "rf");

    private final String src;
    private final List<Token> tokens = new ArrayList<>();
    private final Deque<Character> brackets = new ArrayDeque<>();
    private final Deque<Integer> bracketLines = new ArrayDeque<>();
    private int pos;
    private int line = 1;

    private PythonLexer(String src) {
        this.src = src;
    }

    /**
     * @throws CodeSyntaxException on unterminated strings, unbalanced brackets
     *                             or characters that cannot start a token
     */
    static List<Token> tokenize(String src) {
        return new PythonLexer(src).run();
    }

    private List<Token> run() {
        while (pos < src.length()) {
            char c = src.charAt(pos);
            if (c == '#') {
                while (pos < src.length() && src.charAt(pos) != '\n')
                    pos++;
            } else if (c == '\\') {
                continuation();
            } else if (c == '\n') {
                if (brackets.isEmpty())
                    newline();
                line++;
                pos++;
            } else if (c == ' ' || c == '\t' || c == '\r' || c == '\f') {
                pos++;
            } else if (Character.isLetter(c) || c == '_') {
                readName();
            } else if (isDigit(c) || (c == '.' && pos + 1 < src.length() && isDigit(src.charAt(pos + 1)))) {
                readNumber();
            } else if (c == '"' || c == '\'') {
                readString("");
            } else {
                readOperator();
            }
        }
        if (!brackets.isEmpty())
            throw new CodeSyntaxException("'" + brackets.peek() + "' was never closed", bracketLines.peek());
        newline();
        return tokens;
    }

    private void continuation() {
        int next = pos + 1;
        if (next < src.length() && src.charAt(next) == '\r')
            next++;
        if (next >= src.length() || src.charAt(next) != '\n')
            throw new CodeSyntaxException("unexpected character after line continuation character", line);
        pos = next + 1;
        line++;
    }

    private void newline() {
        if (!tokens.isEmpty() && tokens.get(tokens.size() - 1).type() != Type.NEWLINE)
            tokens.add(new Token(Type.NEWLINE, "", line, List.of()));
    }

    private void readName() {
        int start = pos;
        while (pos < src.length() && (Character.isLetterOrDigit(src.charAt(pos)) || src.charAt(pos) == '_'))
            pos++;
        String name = src.substring(start, pos);
        if (pos < src.length() && (src.charAt(pos) == '"' || src.charAt(pos) == '\'')
                && STRING_PREFIXES.contains(name.toLowerCase())) {
            readString(name.toLowerCase());
            return;
        }
        tokens.add(new Token(Type.NAME, name, line, List.of()));
    }

    private void readNumber() {
        int start = pos;
        boolean hex = src.startsWith("0x", pos) || src.startsWith("0X", pos);
        while (pos < src.length()) {
            char c = src.charAt(pos);
            if (Character.isLetterOrDigit(c) || c == '_' || c == '.') {
                pos++;
                if (!hex && (c == 'e' || c == 'E') && pos < src.length()
                        && (src.charAt(pos) == '+' || src.charAt(pos) == '-'))
                    pos++;
            } else {
                break;
            }
        }
        tokens.add(new Token(Type.NUMBER, src.substring(start, pos), line, List.of()));
    }

    private void readString(String prefix) {
        char quote = src.charAt(pos);
        String triple = String.valueOf(quote).repeat(3);
        boolean isTriple = src.startsWith(triple, pos);
        int startLine = line;
        pos += isTriple ? 3 : 1;
        int contentStart = pos;
        String content;
        while (true) {
            if (pos >= src.length())
                throw new CodeSyntaxException("unterminated string literal", startLine);
            char c = src.charAt(pos);
            if (c == '\\') {
                if (pos + 1 < src.length() && src.charAt(pos + 1) == '\n')
                    line++;
                pos += 2;
            } else if (c == '\n') {
                if (!isTriple)
                    throw new CodeSyntaxException("unterminated string literal", startLine);
                line++;
                pos++;
            } else if (c == quote && (!isTriple || src.startsWith(triple, pos))) {
                content = src.substring(contentStart, pos);
                pos += isTriple ? 3 : 1;
                break;
            } else {
                pos++;
            }
        }
        List<String> fields = prefix.contains("f") ? fStringFields(content, startLine) : List.of();
        tokens.add(new Token(Type.STRING, content, startLine, fields));
    }

    private void readOperator() {
        for (String op : OPS3)
            if (src.startsWith(op, pos)) {
                addOp(op);
                return;
            }
        for (String op : OPS2)
            if (src.startsWith(op, pos)) {
                addOp(op);
                return;
            }
        char c = src.charAt(pos);
        switch (c) {
            case '(', '[', '{' -> {
                brackets.push(c);
                bracketLines.push(line);
            }
            case ')', ']', '}' -> {
                if (brackets.isEmpty())
                    throw new CodeSyntaxException("unmatched '" + c + "'", line);
                char open = brackets.pop();
                bracketLines.pop();
                if (open != opening(c))
                    throw new CodeSyntaxException(
                            "closing parenthesis '" + c + "' does not match opening parenthesis '" + open + "'", line);
            }
            default -> {
                if (OPS1.indexOf(c) < 0)
                    throw new CodeSyntaxException("invalid character '" + c + "'", line);
            }
        }
        addOp(String.valueOf(c));
    }

    private void addOp(String op) {
        tokens.add(new Token(Type.OP, op, line, List.of()));
        pos += op.length();
    }

    private static char opening(char close) {
        return close == ')' ? '(' : close == ']' ? '[' : '{';
    }

    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    /** Expressions of the replacement fields in an f-string body, including nested format-spec fields. */
    static List<String> fStringFields(String content, int line) {
        List<String> fields = new ArrayList<>();
        int i = 0;
        while (i < content.length()) {
            char c = content.charAt(i);
            if (c == '{') {
                if (i + 1 < content.length() && content.charAt(i + 1) == '{') {
                    i += 2;
                    continue;
                }
                int end = closingBrace(content, i, line);
                addField(content.substring(i + 1, end), fields, line);
                i = end + 1;
            } else {
                i++;
            }
        }
        return fields;
    }

    private static int closingBrace(String s, int open, int line) {
        int depth = 0;
        char quote = 0;
        for (int j = open; j < s.length(); j++) {
            char c = s.charAt(j);
            if (quote != 0) {
                if (c == quote)
                    quote = 0;
            } else if (c == '\'' || c == '"') {
                quote = c;
            } else if (c == '{' || c == '[' || c == '(') {
                depth++;
            } else if (c == '}' || c == ']' || c == ')') {
                depth--;
                if (depth == 0 && c == '}')
                    return j;
            }
        }
        throw new CodeSyntaxException("f-string: expecting '}'", line);
    }

    private static void addField(String body, List<String> fields, int line) {
        int depth = 0;
        char quote = 0;
        int cut = body.length();
        for (int j = 0; j < body.length() && cut == body.length(); j++) {
            char c = body.charAt(j);
            if (quote != 0) {
                if (c == quote)
                    quote = 0;
            } else if (c == '\'' || c == '"') {
                quote = c;
            } else if (c == '{' || c == '[' || c == '(') {
                depth++;
            } else if (c == '}' || c == ']' || c == ')') {
                depth--;
            } else if (depth == 0 && (c == ':' || (c == '!' && (j + 1 >= body.length() || body.charAt(j + 1) != '=')))) {
                cut = j;
            }
        }
        String expr = body.substring(0, cut).strip();
        // {value=} debug form
        if (expr.endsWith("=") && expr.length() > 1 && "=!<>".indexOf(expr.charAt(expr.length() - 2)) < 0)
            expr = expr.substring(0, expr.length() - 1).strip();
        if (expr.isEmpty())
            throw new CodeSyntaxException("f-string: empty expression not allowed", line);
        fields.add(expr);
        if (cut < body.length())
            fields.addAll(fStringFields(body.substring(cut + 1), line));
    }
}
