package com.driftql.plan;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Base class for all execution plan nodes.
 *
 * <p>Nodes are owned by exactly one {@link ExecutionPlan}, which assigns their
 * id on registration. Edges are stored as node ids and resolved through the
 * owning plan:
 * <ul>
 *   <li>dependencies - the nodes this node reads its rows from (upstream)</li>
 *   <li>parents - the nodes reading rows from this node (downstream)</li>
 * </ul>
 * Edges are only changed through the plan's structural edit operations.
 *
 * @see ExecutionPlan
 */
public abstract class ExecutionNode {

    /** Id of a node that has not been registered with a plan yet. */
    public static final int UNREGISTERED = -1;

    private int id = UNREGISTERED;

    /** Upstream node ids, in order */
    private final List<Integer> dependencies = new ArrayList<>();

    /** Downstream node ids, in order of attachment */
    private final List<Integer> parents = new ArrayList<>();

    /**
     * Returns the kind of this node.
     *
     * @return the node type
     */
    public abstract NodeType type();

    /**
     * Returns the variables this node reads.
     *
     * @return the consumed variables
     */
    public abstract List<Variable> variablesUsedHere();

    /**
     * Returns the variables this node defines.
     *
     * @return the defined variables
     */
    public abstract List<Variable> variablesSetHere();

    /**
     * Creates a detached copy of this node's payload (no id, no edges).
     *
     * @return the copy
     */
    protected abstract ExecutionNode copyPayload();

    /**
     * Returns a short description of the node's payload for plan explains.
     *
     * @return the description
     */
    public abstract String describe();

    public int id() {
        return id;
    }

    /**
     * Returns the ids of this node's dependencies.
     *
     * @return an unmodifiable list of node ids
     */
    public List<Integer> dependencies() {
        return Collections.unmodifiableList(dependencies);
    }

    /**
     * Returns the ids of this node's parents.
     *
     * @return an unmodifiable list of node ids
     */
    public List<Integer> parents() {
        return Collections.unmodifiableList(parents);
    }

    /**
     * Copies this node including its id and edges, for cloning a plan.
     */
    final ExecutionNode copy() {
        ExecutionNode copy = copyPayload();
        copy.id = id;
        copy.dependencies.addAll(dependencies);
        copy.parents.addAll(parents);
        return copy;
    }

    // ==================== Edge maintenance (plan only) ====================

    void assignId(int newId) {
        this.id = newId;
    }

    void addDependency(int nodeId) {
        dependencies.add(nodeId);
    }

    void replaceDependency(int oldId, int newId) {
        int index = dependencies.indexOf(oldId);
        if (index >= 0) {
            if (dependencies.contains(newId)) {
                dependencies.remove(index);
            } else {
                dependencies.set(index, newId);
            }
        }
    }

    void addParent(int nodeId) {
        if (!parents.contains(nodeId)) {
            parents.add(nodeId);
        }
    }

    void removeParent(int nodeId) {
        parents.remove(Integer.valueOf(nodeId));
    }

    void replaceParent(int oldId, int newId) {
        int index = parents.indexOf(oldId);
        if (index >= 0) {
            if (parents.contains(newId)) {
                parents.remove(index);
            } else {
                parents.set(index, newId);
            }
        }
    }

    @Override
    public String toString() {
        String details = describe();
        return type().typeName() + "#" + id + (details.isEmpty() ? "" : "(" + details + ")");
    }
}
