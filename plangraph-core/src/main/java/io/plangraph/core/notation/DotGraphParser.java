package io.plangraph.core.notation;

import io.plangraph.core.graph.DependencyGraph;
import io.plangraph.core.notation.Tokenizer.Token;
import io.plangraph.core.notation.Tokenizer.Type;

import java.util.ArrayList;
import java.util.List;

import static java.util.Locale.ENGLISH;

/**
 * Reads the DOT subset used as graph-description notation.
 *
 * <pre>
 * digraph ExecutionGraph {
 *   a;
 *   a -&gt; b -&gt; c;
 *   b -&gt; d [color=red];
 * }
 * </pre>
 *
 * The {@code digraph} wrapper is optional. Attribute lists and graph
 * attributes are accepted and ignored. Tasks referenced by an edge are
 * declared implicitly.
 */
public class DotGraphParser
{
    public DependencyGraph parse(String text)
    {
        return new Context(Tokenizer.tokenize(text)).parseDocument();
    }

    private static class Context
    {
        private final List<Token> tokens;
        private final DependencyGraph.Builder builder = DependencyGraph.builder();
        private int index = 0;

        private Context(List<Token> tokens)
        {
            this.tokens = tokens;
        }

        private DependencyGraph parseDocument()
        {
            if (isKeyword(peek(), "strict")) {
                index++;
            }
            if (isKeyword(peek(), "graph") && !peekAhead(1).is(Type.LBRACKET)) {
                throw error(peek(), "Undirected graphs are not supported; use 'digraph'");
            }
            if (isKeyword(peek(), "digraph")) {
                index++;
                if (peek().isName()) {
                    index++;
                }
                expect(Type.LBRACE);
                while (!peek().is(Type.RBRACE)) {
                    if (peek().is(Type.EOF)) {
                        throw error(peek(), "Missing '}' at the end of the graph");
                    }
                    statement();
                }
                index++;
            }
            else {
                while (!peek().is(Type.EOF)) {
                    statement();
                }
            }
            if (!peek().is(Type.EOF)) {
                throw error(peek(), "Unexpected " + peek().describe() + " after the graph");
            }
            return builder.build();
        }

        private void statement()
        {
            Token token = peek();
            if (token.is(Type.SEMICOLON)) {
                index++;
                return;
            }
            if (isKeyword(token, "subgraph") || token.is(Type.LBRACE)) {
                throw error(token, "Subgraphs are not supported");
            }
            if ((isKeyword(token, "graph") || isKeyword(token, "node") || isKeyword(token, "edge"))
                    && peekAhead(1).is(Type.LBRACKET)) {
                index++;
                skipAttributes();
                optionalSemicolon();
                return;
            }

            String first = name();
            if (peek().is(Type.EQUALS)) {
                // graph attribute: key = value
                index++;
                name();
                optionalSemicolon();
                return;
            }

            List<String> chain = new ArrayList<>();
            chain.add(first);
            while (peek().is(Type.ARROW) || peek().is(Type.UNDIRECTED_EDGE)) {
                if (peek().is(Type.UNDIRECTED_EDGE)) {
                    throw error(peek(), "Undirected edge '--' is not supported; use '->'");
                }
                index++;
                chain.add(name());
            }
            if (peek().is(Type.LBRACKET)) {
                skipAttributes();
            }
            optionalSemicolon();

            if (chain.size() == 1) {
                builder.addTask(first);
            }
            else {
                for (int i = 0; i + 1 < chain.size(); i++) {
                    builder.addDependency(chain.get(i), chain.get(i + 1));
                }
            }
        }

        private String name()
        {
            Token token = peek();
            if (!token.isName() || token.getText().isEmpty()) {
                throw error(token, "Expected a task name but got " + token.describe());
            }
            index++;
            return token.getText();
        }

        private void skipAttributes()
        {
            Token open = expect(Type.LBRACKET);
            while (!peek().is(Type.RBRACKET)) {
                if (peek().is(Type.EOF)) {
                    throw error(open, "Unterminated attribute list");
                }
                index++;
            }
            index++;
        }

        private void optionalSemicolon()
        {
            if (peek().is(Type.SEMICOLON)) {
                index++;
            }
        }

        private Token expect(Type type)
        {
            Token token = peek();
            if (!token.is(type)) {
                throw error(token, "Expected " + type.name().toLowerCase(ENGLISH) + " but got " + token.describe());
            }
            index++;
            return token;
        }

        private Token peek()
        {
            return tokens.get(index);
        }

        private Token peekAhead(int offset)
        {
            return tokens.get(Math.min(index + offset, tokens.size() - 1));
        }

        private static boolean isKeyword(Token token, String keyword)
        {
            return token.is(Type.IDENTIFIER) && token.getText().equalsIgnoreCase(keyword);
        }

        private static NotationException error(Token token, String message)
        {
            return new NotationException(message, token.getLine(), token.getColumn());
        }
    }
}
