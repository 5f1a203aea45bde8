package io.plangraph.core.notation;

import com.google.common.base.Strings;
import io.plangraph.core.structure.ExpressionTree;

import java.util.List;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * Writes an expression tree in structured notation, one child per line.
 * Output always parses back with {@link StructureNotationParser} to an equal tree.
 */
public class StructureNotationPrinter
{
    public static final int DEFAULT_INDENT = 2;

    private final int indentWidth;

    public StructureNotationPrinter()
    {
        this(DEFAULT_INDENT);
    }

    public StructureNotationPrinter(int indentWidth)
    {
        checkArgument(indentWidth >= 0, "indent width must not be negative");
        this.indentWidth = indentWidth;
    }

    public String print(ExpressionTree tree)
    {
        StringBuilder sb = new StringBuilder();
        format(tree, 0, sb);
        return sb.toString();
    }

    private void format(ExpressionTree tree, int level, StringBuilder sb)
    {
        String indent = Strings.repeat(" ", indentWidth * level);
        tree.accept(new ExpressionTree.Visitor<Void>()
        {
            @Override
            public Void visitLeaf(ExpressionTree.Leaf leaf)
            {
                sb.append(indent).append(DotGraphPrinter.quoteIfNeeded(leaf.getName()));
                return null;
            }

            @Override
            public Void visitSequence(ExpressionTree.Sequence sequence)
            {
                block(StructureNotationParser.SEQUENCE, sequence.getChildren());
                return null;
            }

            @Override
            public Void visitParallel(ExpressionTree.Parallel parallel)
            {
                block(StructureNotationParser.PARALLEL, parallel.getChildren());
                return null;
            }

            private void block(String type, List<ExpressionTree> children)
            {
                sb.append(indent).append(type).append(" {\n");
                for (int i = 0; i < children.size(); i++) {
                    format(children.get(i), level + 1, sb);
                    sb.append(i + 1 < children.size() ? ",\n" : "\n");
                }
                sb.append(indent).append("}");
            }
        });
    }
}
