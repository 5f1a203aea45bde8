package io.plangraph.core.graph;

import com.google.common.collect.ComparisonChain;
import org.immutables.value.Value;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * A "must happen before" constraint: {@code from} completes before {@code to} starts.
 */
@Value.Immutable
public abstract class Dependency
        implements Comparable<Dependency>
{
    public abstract String getFrom();

    public abstract String getTo();

    public static Dependency of(String from, String to)
    {
        return ImmutableDependency.builder()
            .from(from)
            .to(to)
            .build();
    }

    @Override
    public int compareTo(Dependency other)
    {
        return ComparisonChain.start()
            .compare(getFrom(), other.getFrom())
            .compare(getTo(), other.getTo())
            .result();
    }

    @Value.Check
    protected void check()
    {
        checkArgument(!getFrom().isEmpty(), "dependency source must not be empty");
        checkArgument(!getTo().isEmpty(), "dependency target must not be empty");
    }
}
