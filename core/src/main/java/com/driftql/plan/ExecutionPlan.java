package com.driftql.plan;

import com.driftql.exception.PlanInvariantException;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;

/**
 * Owns the node graph of one query execution plan.
 *
 * <p>Every node belongs to exactly one plan, which assigns its id on
 * {@link #registerNode(ExecutionNode) registration}. Edges between nodes are
 * node ids resolved through the plan, so structural edits and
 * {@link #clone() cloning} never leave a node pointing into another plan.
 *
 * <p>The plan provides:
 * <ul>
 *   <li>Structural queries: {@link #findNodesOfType(NodeType, boolean)},
 *       {@link #getVarSetBy(int)}, {@link #getVarsUsedAfter(ExecutionNode)}</li>
 *   <li>Structural edits: {@link #registerNode(ExecutionNode)},
 *       {@link #addDependency(ExecutionNode, ExecutionNode)},
 *       {@link #replaceNode(ExecutionNode, ExecutionNode, ExecutionNode)},
 *       {@link #unlinkNode(ExecutionNode)}, {@link #unlinkNodes(Collection)}</li>
 *   <li>Deep copies: {@link #clone()}</li>
 * </ul>
 *
 * <p>The variable-producer index and the liveness index are derived from the
 * graph. They are computed lazily and dropped by every structural edit; a
 * caller that changes nodes by other means must call
 * {@link #invalidateCaches()} before querying again.
 *
 * <p>Plans are not thread-safe; a plan is mutated by one rule at a time.
 */
public class ExecutionPlan {

    /** Marker for a plan without a root node. */
    public static final int NO_ROOT = -1;

    /** Registered nodes by id */
    private final Map<Integer, ExecutionNode> nodes = new TreeMap<>();

    private final List<String> appliedRules = new ArrayList<>();

    private int rootId = NO_ROOT;
    private int nextId = 1;

    /** Variable id to defining node id; null when stale */
    private Map<Integer, Integer> varSetBy;

    /** Node id to ids of variables consumed downstream; null when stale */
    private Map<Integer, Set<Integer>> varsUsedLater;

    /**
     * Returns a fresh plan-unique node id.
     *
     * @return the id
     */
    public int nextId() {
        return nextId++;
    }

    /**
     * Takes ownership of a node and assigns it a plan-unique id.
     *
     * @param node a node that is not registered with any plan
     * @return the assigned id
     * @throws PlanInvariantException if the node is already registered
     */
    public int registerNode(ExecutionNode node) {
        Objects.requireNonNull(node, "node must not be null");
        if (node.id() != ExecutionNode.UNREGISTERED) {
            throw new PlanInvariantException("node is already registered", node.id());
        }
        int id = nextId();
        node.assignId(id);
        nodes.put(id, node);
        invalidateCaches();
        return id;
    }

    /**
     * Returns the node with the given id.
     *
     * @param id the node id
     * @return the node
     * @throws PlanInvariantException if no such node is registered
     */
    public ExecutionNode getNodeById(int id) {
        ExecutionNode node = nodes.get(id);
        if (node == null) {
            throw new PlanInvariantException("unknown node", id);
        }
        return node;
    }

    /**
     * Returns whether the given node object is registered with this plan.
     *
     * @param node the node
     * @return true if the node belongs to this plan
     */
    public boolean contains(ExecutionNode node) {
        return node != null && nodes.get(node.id()) == node;
    }

    /**
     * Returns all registered nodes in id order.
     *
     * @return an unmodifiable collection of nodes
     */
    public Collection<ExecutionNode> nodes() {
        return Collections.unmodifiableCollection(nodes.values());
    }

    public int size() {
        return nodes.size();
    }

    /**
     * Makes a registered node the root (final output node) of the plan.
     *
     * @param root the root node
     */
    public void setRoot(ExecutionNode root) {
        requireOwned(root);
        this.rootId = root.id();
        invalidateCaches();
    }

    /**
     * Returns the root node.
     *
     * @return the root node
     * @throws PlanInvariantException if no root is set
     */
    public ExecutionNode root() {
        if (rootId == NO_ROOT) {
            throw new PlanInvariantException("plan has no root");
        }
        return getNodeById(rootId);
    }

    public boolean hasRoot() {
        return rootId != NO_ROOT;
    }

    /**
     * Connects {@code node} to read from {@code dependency}.
     *
     * @param node the downstream node
     * @param dependency the upstream node
     */
    public void addDependency(ExecutionNode node, ExecutionNode dependency) {
        requireOwned(node);
        requireOwned(dependency);
        if (node.dependencies().contains(dependency.id())) {
            return;
        }
        node.addDependency(dependency.id());
        dependency.addParent(node.id());
        invalidateCaches();
    }

    /**
     * Returns the dependency nodes of a node.
     *
     * @param node the node
     * @return the upstream nodes, in dependency order
     */
    public List<ExecutionNode> getDependencies(ExecutionNode node) {
        requireOwned(node);
        List<ExecutionNode> result = new ArrayList<>();
        for (int id : node.dependencies()) {
            result.add(getNodeById(id));
        }
        return result;
    }

    /**
     * Returns the parent nodes of a node.
     *
     * @param node the node
     * @return the downstream nodes
     */
    public List<ExecutionNode> getParents(ExecutionNode node) {
        requireOwned(node);
        List<ExecutionNode> result = new ArrayList<>();
        for (int id : node.parents()) {
            result.add(getNodeById(id));
        }
        return result;
    }

    // ==================== Structural queries ====================

    /**
     * Finds all nodes of a type reachable from the root.
     *
     * <p>Nodes are returned in pre-order depth-first order from the root,
     * following dependencies in their declared order, so results run from the
     * end of the plan towards its start. With {@code recursive}, the nodes of a
     * subquery are visited right after its {@link SubqueryNode}; otherwise
     * subqueries are not entered.
     *
     * @param type the node type
     * @param recursive whether to descend into subqueries
     * @return the matching nodes, in traversal order
     */
    public List<ExecutionNode> findNodesOfType(NodeType type, boolean recursive) {
        Objects.requireNonNull(type, "type must not be null");
        List<ExecutionNode> result = new ArrayList<>();
        for (ExecutionNode node : traverse(root(), recursive)) {
            if (node.type() == type) {
                result.add(node);
            }
        }
        return result;
    }

    /**
     * Returns the nodes reachable from {@code start} in pre-order.
     */
    private List<ExecutionNode> traverse(ExecutionNode start, boolean recursive) {
        List<ExecutionNode> order = new ArrayList<>();
        Set<Integer> visited = new HashSet<>();
        Deque<ExecutionNode> stack = new ArrayDeque<>();
        stack.push(start);

        while (!stack.isEmpty()) {
            ExecutionNode current = stack.pop();
            if (!visited.add(current.id())) {
                continue;
            }
            order.add(current);

            List<Integer> deps = current.dependencies();
            for (int i = deps.size() - 1; i >= 0; i--) {
                stack.push(getNodeById(deps.get(i)));
            }
            if (recursive && current instanceof SubqueryNode sub) {
                // pushed last so the subquery is visited before the dependencies
                stack.push(getNodeById(sub.subqueryRootId()));
            }
        }
        return order;
    }

    /**
     * Returns the node defining a variable.
     *
     * @param variableId the variable id
     * @return the defining node, or empty if no node of this plan defines it
     * @throws PlanInvariantException if two nodes define the variable
     */
    public Optional<ExecutionNode> getVarSetBy(int variableId) {
        if (varSetBy == null) {
            varSetBy = computeVarSetBy();
        }
        Integer nodeId = varSetBy.get(variableId);
        return nodeId == null ? Optional.empty() : Optional.of(getNodeById(nodeId));
    }

    private Map<Integer, Integer> computeVarSetBy() {
        Map<Integer, Integer> result = new HashMap<>();
        for (ExecutionNode node : nodes.values()) {
            for (Variable variable : node.variablesSetHere()) {
                Integer previous = result.put(variable.id(), node.id());
                if (previous != null) {
                    throw new PlanInvariantException("variable " + variable
                        + " is also defined by node #" + previous, node.id());
                }
            }
        }
        return result;
    }

    /**
     * Returns the variables consumed downstream of a node.
     *
     * <p>A variable defined by the node and missing from this set is dead.
     *
     * @param node the node
     * @return the ids of all variables used by any node reachable through parents
     */
    public Set<Integer> getVarsUsedAfter(ExecutionNode node) {
        requireOwned(node);
        if (varsUsedLater == null) {
            varsUsedLater = new HashMap<>();
        }
        return Collections.unmodifiableSet(computeVarsUsedAfter(node));
    }

    private Set<Integer> computeVarsUsedAfter(ExecutionNode node) {
        Set<Integer> cached = varsUsedLater.get(node.id());
        if (cached != null) {
            return cached;
        }
        Set<Integer> result = new HashSet<>();
        for (int parentId : node.parents()) {
            ExecutionNode parent = getNodeById(parentId);
            result.addAll(computeVarsUsedAfter(parent));
            for (Variable variable : getVariablesUsedBy(parent)) {
                result.add(variable.id());
            }
        }
        varsUsedLater.put(node.id(), result);
        return result;
    }

    /**
     * Returns the variables a node consumes.
     *
     * <p>For a {@link SubqueryNode} these are the variables used inside the
     * subquery that the subquery does not define itself.
     *
     * @param node the node
     * @return the consumed variables
     */
    public Set<Variable> getVariablesUsedBy(ExecutionNode node) {
        requireOwned(node);
        if (!(node instanceof SubqueryNode sub)) {
            return new LinkedHashSet<>(node.variablesUsedHere());
        }
        Set<Variable> used = new LinkedHashSet<>();
        Set<Variable> defined = new HashSet<>();
        for (ExecutionNode inner : traverse(getNodeById(sub.subqueryRootId()), true)) {
            used.addAll(inner.variablesUsedHere());
            defined.addAll(inner.variablesSetHere());
        }
        used.removeAll(defined);
        return used;
    }

    /**
     * Visits {@code start} and then each node along its dependency chain.
     *
     * <p>The walk stops after visiting a node that has no dependency or more
     * than one, which includes the {@link SingletonNode} at the start of the
     * plan.
     *
     * @param start the first node to visit
     * @param walker the callback
     */
    public void walk(ExecutionNode start, PlanWalker walker) {
        requireOwned(start);
        Objects.requireNonNull(walker, "walker must not be null");
        ExecutionNode current = start;
        while (true) {
            walker.before(current);
            List<Integer> deps = current.dependencies();
            if (deps.size() != 1) {
                break;
            }
            current = getNodeById(deps.get(0));
        }
    }

    // ==================== Structural edits ====================

    /**
     * Puts {@code newNode} in the position of {@code oldNode}.
     *
     * <p>{@code newNode} takes over the dependencies of {@code oldNode}, and
     * {@code parent} reads from {@code newNode} instead. {@code oldNode} is
     * removed from the plan.
     *
     * @param oldNode the node to replace; its only parent must be {@code parent}
     * @param newNode a registered node without edges
     * @param parent the single parent of {@code oldNode}
     * @throws PlanInvariantException if {@code oldNode} has parents other than
     *         exactly {@code parent}, or {@code newNode} is already connected
     */
    public void replaceNode(ExecutionNode oldNode, ExecutionNode newNode, ExecutionNode parent) {
        requireOwned(oldNode);
        requireOwned(newNode);
        requireOwned(parent);
        if (!oldNode.parents().equals(List.of(parent.id()))) {
            throw new PlanInvariantException("replaced node must have exactly the parent #"
                + parent.id() + " but has " + oldNode.parents(), oldNode.id());
        }
        if (!newNode.dependencies().isEmpty() || !newNode.parents().isEmpty()) {
            throw new PlanInvariantException("replacement node must not be connected", newNode.id());
        }

        for (int depId : oldNode.dependencies()) {
            getNodeById(depId).replaceParent(oldNode.id(), newNode.id());
            newNode.addDependency(depId);
        }
        parent.replaceDependency(oldNode.id(), newNode.id());
        newNode.addParent(parent.id());

        nodes.remove(oldNode.id());
        invalidateCaches();
    }

    /**
     * Removes a node, connecting its parents directly to its dependency.
     *
     * @param node a node with exactly one dependency
     * @throws PlanInvariantException if the node does not have exactly one dependency
     */
    public void unlinkNode(ExecutionNode node) {
        requireOwned(node);
        if (node.dependencies().size() != 1) {
            throw new PlanInvariantException("only nodes with exactly one dependency can be unlinked, found "
                + node.dependencies().size(), node.id());
        }

        ExecutionNode dependency = getNodeById(node.dependencies().get(0));
        dependency.removeParent(node.id());
        for (int parentId : node.parents()) {
            ExecutionNode parent = getNodeById(parentId);
            parent.replaceDependency(node.id(), dependency.id());
            dependency.addParent(parentId);
        }

        if (rootId == node.id()) {
            rootId = dependency.id();
        }
        for (ExecutionNode other : nodes.values()) {
            if (other instanceof SubqueryNode sub && sub.subqueryRootId() == node.id()) {
                sub.setSubqueryRootId(dependency.id());
            }
        }

        nodes.remove(node.id());
        invalidateCaches();
    }

    /**
     * Removes a set of nodes; equivalent to unlinking them one by one in id order.
     *
     * @param toUnlink the nodes to remove
     * @throws PlanInvariantException if one of the nodes does not have exactly one dependency
     */
    public void unlinkNodes(Collection<? extends ExecutionNode> toUnlink) {
        Objects.requireNonNull(toUnlink, "toUnlink must not be null");
        List<ExecutionNode> ordered = new ArrayList<>(toUnlink);
        ordered.sort((a, b) -> Integer.compare(a.id(), b.id()));
        for (ExecutionNode node : ordered) {
            unlinkNode(node);
        }
    }

    /**
     * Drops the derived variable indexes so they are recomputed on the next query.
     */
    public void invalidateCaches() {
        varSetBy = null;
        varsUsedLater = null;
    }

    /**
     * Creates a deep copy of this plan.
     *
     * <p>The copy has the same topology and node ids but its own node objects,
     * so edits to either plan never affect the other. Expressions are immutable
     * and shared.
     *
     * @return the copy
     */
    @Override
    public ExecutionPlan clone() {
        ExecutionPlan copy = new ExecutionPlan();
        for (ExecutionNode node : nodes.values()) {
            copy.nodes.put(node.id(), node.copy());
        }
        copy.rootId = rootId;
        copy.nextId = nextId;
        copy.appliedRules.addAll(appliedRules);
        return copy;
    }

    // ==================== Bookkeeping ====================

    /**
     * Returns the names of the rules applied to this plan, in order.
     *
     * @return an unmodifiable list of rule names
     */
    public List<String> appliedRules() {
        return Collections.unmodifiableList(appliedRules);
    }

    public void addAppliedRule(String ruleName) {
        appliedRules.add(Objects.requireNonNull(ruleName, "ruleName must not be null"));
    }

    private void requireOwned(ExecutionNode node) {
        Objects.requireNonNull(node, "node must not be null");
        if (!contains(node)) {
            throw new PlanInvariantException("node does not belong to this plan", node.id());
        }
    }

    @Override
    public String toString() {
        return "ExecutionPlan(" + nodes.size() + " nodes, root #" + rootId + ")";
    }
}
