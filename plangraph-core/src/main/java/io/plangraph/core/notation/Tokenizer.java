package io.plangraph.core.notation;

import com.google.common.collect.ImmutableList;

import java.util.List;

/**
 * Splits the graph-description and structured notations into tokens.
 * Comments ({@code //}, {@code #} and {@code /* *}{@code /}) and whitespace are skipped.
 */
class Tokenizer
{
    enum Type
    {
        IDENTIFIER,
        QUOTED,
        LBRACE,
        RBRACE,
        LBRACKET,
        RBRACKET,
        COMMA,
        SEMICOLON,
        EQUALS,
        ARROW,
        UNDIRECTED_EDGE,
        EOF;
    }

    static class Token
    {
        private final Type type;
        private final String text;
        private final int line;
        private final int column;

        Token(Type type, String text, int line, int column)
        {
            this.type = type;
            this.text = text;
            this.line = line;
            this.column = column;
        }

        Type getType()
        {
            return type;
        }

        String getText()
        {
            return text;
        }

        int getLine()
        {
            return line;
        }

        int getColumn()
        {
            return column;
        }

        boolean is(Type type)
        {
            return this.type == type;
        }

        boolean isKeyword(String keyword)
        {
            return type == Type.IDENTIFIER && text.equals(keyword);
        }

        boolean isName()
        {
            return type == Type.IDENTIFIER || type == Type.QUOTED;
        }

        String describe()
        {
            switch (type) {
            case EOF:
                return "end of input";
            case QUOTED:
                return "\"" + text + "\"";
            default:
                return "'" + text + "'";
            }
        }
    }

    static boolean isIdentifierChar(char c)
    {
        return Character.isLetterOrDigit(c) || c == '_' || c == '.';
    }

    private final String input;
    private int pos = 0;
    private int line = 1;
    private int column = 1;

    private Tokenizer(String input)
    {
        this.input = input;
    }

    static List<Token> tokenize(String input)
    {
        return new Tokenizer(input).run();
    }

    private List<Token> run()
    {
        ImmutableList.Builder<Token> tokens = ImmutableList.builder();
        while (true) {
            skipWhitespaceAndComments();
            if (pos >= input.length()) {
                tokens.add(new Token(Type.EOF, "", line, column));
                return tokens.build();
            }
            tokens.add(next());
        }
    }

    private Token next()
    {
        int startLine = line;
        int startColumn = column;
        char c = input.charAt(pos);
        switch (c) {
        case '{':
            advance(1);
            return new Token(Type.LBRACE, "{", startLine, startColumn);
        case '}':
            advance(1);
            return new Token(Type.RBRACE, "}", startLine, startColumn);
        case '[':
            advance(1);
            return new Token(Type.LBRACKET, "[", startLine, startColumn);
        case ']':
            advance(1);
            return new Token(Type.RBRACKET, "]", startLine, startColumn);
        case ',':
            advance(1);
            return new Token(Type.COMMA, ",", startLine, startColumn);
        case ';':
            advance(1);
            return new Token(Type.SEMICOLON, ";", startLine, startColumn);
        case '=':
            advance(1);
            return new Token(Type.EQUALS, "=", startLine, startColumn);
        case '"':
            return quoted(startLine, startColumn);
        case '-':
            if (input.startsWith("->", pos)) {
                advance(2);
                return new Token(Type.ARROW, "->", startLine, startColumn);
            }
            if (input.startsWith("--", pos)) {
                advance(2);
                return new Token(Type.UNDIRECTED_EDGE, "--", startLine, startColumn);
            }
            if (pos + 1 < input.length() && isIdentifierChar(input.charAt(pos + 1))) {
                // negative numeral in an attribute value
                advance(1);
                return new Token(Type.IDENTIFIER, "-" + identifierText(), startLine, startColumn);
            }
            break;
        default:
            if (isIdentifierChar(c)) {
                return new Token(Type.IDENTIFIER, identifierText(), startLine, startColumn);
            }
        }
        throw new NotationException("Unexpected character '" + c + "'", startLine, startColumn);
    }

    private String identifierText()
    {
        int start = pos;
        while (pos < input.length() && isIdentifierChar(input.charAt(pos))) {
            advance(1);
        }
        return input.substring(start, pos);
    }

    private Token quoted(int startLine, int startColumn)
    {
        advance(1);
        StringBuilder sb = new StringBuilder();
        while (pos < input.length()) {
            char c = input.charAt(pos);
            if (c == '"') {
                advance(1);
                return new Token(Type.QUOTED, sb.toString(), startLine, startColumn);
            }
            if (c == '\\' && pos + 1 < input.length()) {
                sb.append(input.charAt(pos + 1));
                advance(2);
                continue;
            }
            sb.append(c);
            advance(1);
        }
        throw new NotationException("Unterminated quoted string", startLine, startColumn);
    }

    private void skipWhitespaceAndComments()
    {
        while (pos < input.length()) {
            char c = input.charAt(pos);
            if (Character.isWhitespace(c)) {
                advance(1);
            }
            else if (c == '#' || input.startsWith("//", pos)) {
                while (pos < input.length() && input.charAt(pos) != '\n') {
                    advance(1);
                }
            }
            else if (input.startsWith("/*", pos)) {
                int startLine = line;
                int startColumn = column;
                int end = input.indexOf("*/", pos + 2);
                if (end < 0) {
                    throw new NotationException("Unterminated comment", startLine, startColumn);
                }
                advance(end + 2 - pos);
            }
            else {
                return;
            }
        }
    }

    private void advance(int count)
    {
        for (int i = 0; i < count; i++) {
            if (input.charAt(pos) == '\n') {
                line++;
                column = 1;
            }
            else {
                column++;
            }
            pos++;
        }
    }
}
