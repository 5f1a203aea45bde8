package io.plangraph.core.notation;

import com.fasterxml.jackson.core.JsonLocation;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.google.common.base.Throwables;
import io.plangraph.core.structure.ExpressionTree;
import io.plangraph.core.structure.StructureException;

/**
 * JSON form of an expression tree:
 * {@code {"type":"Sequence","children":[{"type":"Leaf","name":"a"}, ...]}}.
 */
public class JsonStructureNotation
{
    private final ObjectMapper mapper;

    public JsonStructureNotation()
    {
        this(new ObjectMapper());
    }

    public JsonStructureNotation(ObjectMapper mapper)
    {
        this.mapper = mapper.copy().enable(SerializationFeature.INDENT_OUTPUT);
    }

    public String print(ExpressionTree tree)
    {
        try {
            return mapper.writerFor(ExpressionTree.class).writeValueAsString(tree);
        }
        catch (JsonProcessingException ex) {
            throw new IllegalStateException("Failed to serialize structure " + tree, ex);
        }
    }

    /**
     * @throws NotationException if the text isn't a valid JSON tree
     * @throws StructureException if a composite has no children
     */
    public ExpressionTree parse(String text)
    {
        ExpressionTree tree;
        try {
            tree = mapper.readValue(text, ExpressionTree.class);
        }
        catch (JsonProcessingException ex) {
            for (Throwable cause : Throwables.getCausalChain(ex)) {
                if (cause instanceof StructureException) {
                    throw (StructureException) cause;
                }
            }
            JsonLocation location = ex.getLocation();
            if (location != null) {
                throw new NotationException("Invalid JSON structure: " + ex.getOriginalMessage(),
                        location.getLineNr(), location.getColumnNr());
            }
            throw new NotationException("Invalid JSON structure: " + ex.getOriginalMessage(), ex);
        }
        if (tree == null) {
            throw new NotationException("JSON structure is empty", 1, 1);
        }
        return tree;
    }
}
