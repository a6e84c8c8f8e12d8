package io.github.eutro.livevars.core.util;

import io.github.eutro.livevars.core.ssa.BasicBlock;
import io.github.eutro.livevars.core.ssa.Function;

import java.util.*;

/**
 * Walks a graph depth-first from a root, in post-order.
 * Nodes unreachable from the root are not visited.
 *
 * @param <T> The type of a node in the graph.
 */
public class GraphWalker<T> {
    private final T root;
    private final F<? super T, ? extends Iterable<? extends T>> getChildren;

    /**
     * Construct a graph walker from a root node and a successor function.
     *
     * @param root        The root of the graph to walk from.
     * @param getChildren The successor function of the graph.
     */
    public GraphWalker(T root, F<? super T, ? extends Iterable<? extends T>> getChildren) {
        this.root = root;
        this.getChildren = getChildren;
    }

    /**
     * Create a graph walker over the control flow graph of a function, from its entry block.
     *
     * @param func The function.
     * @return The graph walker.
     */
    public static GraphWalker<BasicBlock> blockWalker(Function func) {
        return new GraphWalker<>(func.getEntry(), BasicBlock::getSuccessors);
    }

    /**
     * Get the nodes in post-order: every node comes after all the nodes
     * it discovered, children in the order the successor function yields them.
     *
     * @return The nodes.
     */
    public List<T> postOrder() {
        List<T> order = new ArrayList<>();
        Set<T> seen = new HashSet<>();
        Deque<Iterator<? extends T>> stack = new ArrayDeque<>();
        Deque<T> path = new ArrayDeque<>();
        seen.add(root);
        path.push(root);
        stack.push(getChildren.apply(root).iterator());
        while (!stack.isEmpty()) {
            Iterator<? extends T> children = stack.peek();
            if (children.hasNext()) {
                T next = children.next();
                if (seen.add(next)) {
                    path.push(next);
                    stack.push(getChildren.apply(next).iterator());
                }
            } else {
                stack.pop();
                order.add(path.pop());
            }
        }
        return order;
    }
}
