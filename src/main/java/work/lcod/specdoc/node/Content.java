package work.lcod.specdoc.node;

/**
 * What a primitive or a chapter hands back: either a single {@link ContentNode} or an ordered
 * {@link Fragment} of nodes.
 */
public sealed interface Content permits ContentNode, Fragment {}
