package com.driftql.exception;

/**
 * Exception thrown when an execution plan violates a structural invariant.
 *
 * <p>These are malformation bugs in the plan handed to the optimizer, not
 * conditions a rule can recover from. Common causes:
 * <ul>
 *   <li>A filter node consuming more or fewer than one variable</li>
 *   <li>A calculation node defining more or fewer than one variable</li>
 *   <li>A node replaced through a parent it is not exclusively attached to</li>
 *   <li>A node unlinked while it has no single dependency</li>
 *   <li>A variable defined by more than one node</li>
 * </ul>
 *
 * <p>Example usage:
 * <pre>
 *   try {
 *       plan.replaceNode(oldNode, newNode, parent);
 *   } catch (PlanInvariantException e) {
 *       System.err.println("Malformed plan at node " + e.getNodeId());
 *   }
 * </pre>
 *
 * @see com.driftql.validation.PlanValidator
 */
public class PlanInvariantException extends RuntimeException {

    /** Marker for violations that are not attached to a single node. */
    public static final int NO_NODE = -1;

    private final int nodeId;

    /**
     * Creates a plan invariant exception that is not tied to a node.
     *
     * @param message the error message
     */
    public PlanInvariantException(String message) {
        this(message, NO_NODE);
    }

    /**
     * Creates a plan invariant exception for a specific node.
     *
     * @param message the error message
     * @param nodeId the id of the offending node
     */
    public PlanInvariantException(String message, int nodeId) {
        super(nodeId == NO_NODE ? message : message + " (node id: " + nodeId + ")");
        this.nodeId = nodeId;
    }

    /**
     * Returns the id of the node that violated the invariant.
     *
     * @return the node id, or {@link #NO_NODE} if not available
     */
    public int getNodeId() {
        return nodeId;
    }
}
