package io.plangraph.core.structure;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMultiset;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Structured execution plan. A tree is exactly one of {@link Leaf},
 * {@link Sequence} or {@link Parallel}; the constructor is private so there are
 * no other subclasses. Dispatch with {@link Visitor}.
 *
 * Trees are immutable values.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "type")
@JsonSubTypes({
    @JsonSubTypes.Type(value = ExpressionTree.Leaf.class, name = "Leaf"),
    @JsonSubTypes.Type(value = ExpressionTree.Sequence.class, name = "Sequence"),
    @JsonSubTypes.Type(value = ExpressionTree.Parallel.class, name = "Parallel"),
})
public abstract class ExpressionTree
{
    public enum Kind
    {
        LEAF,
        SEQUENCE,
        PARALLEL;
    }

    public interface Visitor<R>
    {
        R visitLeaf(Leaf leaf);

        R visitSequence(Sequence sequence);

        R visitParallel(Parallel parallel);
    }

    private ExpressionTree()
    { }

    @JsonIgnore
    public abstract Kind getKind();

    public abstract <R> R accept(Visitor<R> visitor);

    /**
     * Task names of all leaves, in tree order.
     */
    @JsonIgnore
    public List<String> getTaskNames()
    {
        ImmutableList.Builder<String> builder = ImmutableList.builder();
        collectTaskNames(this, builder);
        return builder.build();
    }

    private static void collectTaskNames(ExpressionTree tree, ImmutableList.Builder<String> builder)
    {
        tree.accept(new Visitor<Void>()
        {
            @Override
            public Void visitLeaf(Leaf leaf)
            {
                builder.add(leaf.getName());
                return null;
            }

            @Override
            public Void visitSequence(Sequence sequence)
            {
                sequence.getChildren().forEach(child -> collectTaskNames(child, builder));
                return null;
            }

            @Override
            public Void visitParallel(Parallel parallel)
            {
                parallel.getChildren().forEach(child -> collectTaskNames(child, builder));
                return null;
            }
        });
    }

    public static Leaf leaf(String name)
    {
        return Leaf.of(name);
    }

    public static Sequence sequence(ExpressionTree... children)
    {
        return Sequence.of(Arrays.asList(children));
    }

    public static Sequence sequence(List<? extends ExpressionTree> children)
    {
        return Sequence.of(children);
    }

    public static Parallel parallel(ExpressionTree... children)
    {
        return Parallel.of(Arrays.asList(children));
    }

    public static Parallel parallel(List<? extends ExpressionTree> children)
    {
        return Parallel.of(children);
    }

    public static final class Leaf
            extends ExpressionTree
    {
        private final String name;

        private Leaf(String name)
        {
            this.name = name;
        }

        @JsonCreator
        public static Leaf of(@JsonProperty("name") String name)
        {
            if (name == null || name.isEmpty()) {
                throw new StructureException("Task name of a leaf must not be empty");
            }
            return new Leaf(name);
        }

        @JsonProperty("name")
        public String getName()
        {
            return name;
        }

        @Override
        public Kind getKind()
        {
            return Kind.LEAF;
        }

        @Override
        public <R> R accept(Visitor<R> visitor)
        {
            return visitor.visitLeaf(this);
        }

        @Override
        public boolean equals(Object other)
        {
            return other instanceof Leaf && name.equals(((Leaf) other).name);
        }

        @Override
        public int hashCode()
        {
            return name.hashCode();
        }

        @Override
        public String toString()
        {
            return name;
        }
    }

    public abstract static class Composite
            extends ExpressionTree
    {
        private final List<ExpressionTree> children;

        private Composite(String typeName, List<? extends ExpressionTree> children)
        {
            if (children == null || children.isEmpty()) {
                throw new StructureException(typeName + " must have at least one child");
            }
            this.children = ImmutableList.copyOf(children);
        }

        @JsonProperty("children")
        public List<ExpressionTree> getChildren()
        {
            return children;
        }

        @Override
        public String toString()
        {
            return getClass().getSimpleName() + children.stream()
                .map(Object::toString)
                .collect(Collectors.joining(", ", "{", "}"));
        }
    }

    /**
     * Children run one after another. A child starts only when every exit
     * point of the previous child has completed.
     */
    public static final class Sequence
            extends Composite
    {
        private Sequence(List<? extends ExpressionTree> children)
        {
            super("Sequence", children);
        }

        @JsonCreator
        public static Sequence of(@JsonProperty("children") List<? extends ExpressionTree> children)
        {
            return new Sequence(children);
        }

        @Override
        public Kind getKind()
        {
            return Kind.SEQUENCE;
        }

        @Override
        public <R> R accept(Visitor<R> visitor)
        {
            return visitor.visitSequence(this);
        }

        @Override
        public boolean equals(Object other)
        {
            return other instanceof Sequence && getChildren().equals(((Sequence) other).getChildren());
        }

        @Override
        public int hashCode()
        {
            return Objects.hash(Kind.SEQUENCE, getChildren());
        }
    }

    /**
     * Children run without ordering constraints between them. Child order is
     * not significant for equality.
     */
    public static final class Parallel
            extends Composite
    {
        private Parallel(List<? extends ExpressionTree> children)
        {
            super("Parallel", children);
        }

        @JsonCreator
        public static Parallel of(@JsonProperty("children") List<? extends ExpressionTree> children)
        {
            return new Parallel(children);
        }

        @Override
        public Kind getKind()
        {
            return Kind.PARALLEL;
        }

        @Override
        public <R> R accept(Visitor<R> visitor)
        {
            return visitor.visitParallel(this);
        }

        @Override
        public boolean equals(Object other)
        {
            return other instanceof Parallel &&
                ImmutableMultiset.copyOf(getChildren()).equals(ImmutableMultiset.copyOf(((Parallel) other).getChildren()));
        }

        @Override
        public int hashCode()
        {
            return Objects.hash(Kind.PARALLEL, ImmutableMultiset.copyOf(getChildren()));
        }
    }
}
