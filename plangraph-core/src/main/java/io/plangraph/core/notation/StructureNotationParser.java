package io.plangraph.core.notation;

import io.plangraph.core.notation.Tokenizer.Token;
import io.plangraph.core.notation.Tokenizer.Type;
import io.plangraph.core.structure.ExpressionTree;

import java.util.ArrayList;
import java.util.List;

/**
 * Reads the structured notation:
 *
 * <pre>
 * Sequence {
 *   q1,
 *   Parallel {
 *     Sequence { q2, q4 },
 *     q3,
 *   },
 *   q5
 * }
 * </pre>
 *
 * {@code Sequence} and {@code Parallel} are keywords only when followed by an
 * opening brace; otherwise they are task names. A trailing comma before a closing
 * brace is allowed.
 */
public class StructureNotationParser
{
    static final String SEQUENCE = "Sequence";
    static final String PARALLEL = "Parallel";

    /**
     * @throws NotationException on a syntax error
     * @throws io.plangraph.core.structure.StructureException on an empty block
     */
    public ExpressionTree parse(String text)
    {
        List<Token> tokens = Tokenizer.tokenize(text);
        Context context = new Context(tokens);
        ExpressionTree tree = context.tree();
        Token rest = context.peek();
        if (!rest.is(Type.EOF)) {
            throw new NotationException("Unexpected " + rest.describe() + " after the structure", rest.getLine(), rest.getColumn());
        }
        return tree;
    }

    private static class Context
    {
        private final List<Token> tokens;
        private int index = 0;

        private Context(List<Token> tokens)
        {
            this.tokens = tokens;
        }

        private Token peek()
        {
            return tokens.get(index);
        }

        private Token peekAhead(int offset)
        {
            return tokens.get(Math.min(index + offset, tokens.size() - 1));
        }

        private ExpressionTree tree()
        {
            Token token = peek();
            if (token.is(Type.IDENTIFIER) && peekAhead(1).is(Type.LBRACE)) {
                if (token.getText().equals(SEQUENCE)) {
                    index += 2;
                    return ExpressionTree.sequence(children(token));
                }
                if (token.getText().equals(PARALLEL)) {
                    index += 2;
                    return ExpressionTree.parallel(children(token));
                }
                throw new NotationException("Unknown block type '" + token.getText() + "'; expected Sequence or Parallel",
                        token.getLine(), token.getColumn());
            }
            if (token.isName() && !token.getText().isEmpty()) {
                index++;
                return ExpressionTree.leaf(token.getText());
            }
            throw new NotationException("Expected a task name or a Sequence/Parallel block but got " + token.describe(),
                    token.getLine(), token.getColumn());
        }

        private List<ExpressionTree> children(Token block)
        {
            List<ExpressionTree> children = new ArrayList<>();
            while (!peek().is(Type.RBRACE)) {
                if (peek().is(Type.EOF)) {
                    throw new NotationException("Missing '}' for " + block.getText() + " block",
                            block.getLine(), block.getColumn());
                }
                children.add(tree());
                Token separator = peek();
                if (separator.is(Type.COMMA)) {
                    index++;
                }
                else if (!separator.is(Type.RBRACE)) {
                    throw new NotationException("Expected ',' or '}' but got " + separator.describe(),
                            separator.getLine(), separator.getColumn());
                }
            }
            index++;
            return children;
        }
    }
}
