package com.vidnyan.uast.domain.annotation;

/**
 * A validation rule matched: the tree violates a structural invariant of its rule table
 * (for instance the root is not a module). Annotation of the whole tree is abandoned.
 */
public class StructuralException extends Exception {

    private final String nodeKind;
    private final String nodePath;

    public StructuralException(String message, String nodeKind, String nodePath) {
        super(message);
        this.nodeKind = nodeKind;
        this.nodePath = nodePath;
    }

    /**
     * Kind of the node the validation rule matched.
     */
    public String getNodeKind() {
        return nodeKind;
    }

    /**
     * Path from the root to the offending node, e.g. {@code Expression} or {@code Module/body[0]}.
     */
    public String getNodePath() {
        return nodePath;
    }
}
