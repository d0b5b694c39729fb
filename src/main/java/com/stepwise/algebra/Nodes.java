package com.stepwise.algebra;

import java.util.ArrayList;
import java.util.List;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Tree walking helpers shared by the canonicalizer and the pattern detector.
 */
public final class Nodes {

    private Nodes() {
    }

    /**
     * @return Every node of the tree in pre-order, the root first.
     */
    public static List<Node> preOrder(Node root) {
        List<Node> out = new ArrayList<>();
        collect(root, out);
        return out;
    }

    private static void collect(Node node, List<Node> out) {
        out.add(node);
        for (Node child : node.children()) {
            collect(child, out);
        }
    }

    /**
     * @return The names of all variables in the tree, sorted.
     */
    public static SortedSet<String> variables(Node root) {
        SortedSet<String> names = new TreeSet<>();
        for (Node node : preOrder(root)) {
            if (node instanceof Symbol symbol) {
                names.add(symbol.name());
            }
        }
        return names;
    }

    /**
     * @return {@code true} if the tree contains no variables.
     */
    public static boolean isConstantExpression(Node root) {
        return variables(root).isEmpty();
    }

    /**
     * Flattens a left- or right-nested chain of binary multiplications into its factors, left to right.
     * Parentheses around a factor are kept.
     */
    public static List<Node> factors(Node node) {
        List<Node> out = new ArrayList<>();
        flattenProduct(node, out);
        return out;
    }

    private static void flattenProduct(Node node, List<Node> out) {
        if (node instanceof Operator op && op.isMultiplication()) {
            flattenProduct(op.left(), out);
            flattenProduct(op.right(), out);
        } else {
            out.add(node);
        }
    }

    /**
     * Removes any number of enclosing {@link Parenthesis} nodes.
     */
    public static Node unwrap(Node node) {
        Node current = node;
        while (current instanceof Parenthesis parenthesis) {
            current = parenthesis.content();
        }
        return current;
    }
}
