/* (C)2026 */
package com.ammann.metrictester.model;

import com.ammann.metrictester.exception.ValidationException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Rooted phylogenetic tree with branch lengths.
 *
 * <p>Nodes are immutable value objects, parent links and root distances are indexed by the
 * tree. A tree whose branch lengths are all absent gets unit lengths; a tree with only some
 * lengths absent is rejected. The length of the root's own edge is ignored.
 */
public final class PhylogeneticTree {

    private final Node root;
    private final Map<String, Node> tips = new LinkedHashMap<>();
    private final Map<Node, Node> parents = new IdentityHashMap<>();
    private final Map<Node, Double> depths = new IdentityHashMap<>();

    private PhylogeneticTree(Node root) {
        this.root = root;
        index(root, null, 0.0);
    }

    /**
     * Builds a tree from its root node.
     *
     * @param root root of the tree
     * @return the indexed tree
     * @throws ValidationException if tips are unlabelled or repeated, or branch lengths are
     *     only partially given
     */
    public static PhylogeneticTree of(Node root) {
        if (root == null) {
            throw new ValidationException("Phylogenetic tree requires a root node");
        }
        int[] counts = new int[2];
        countLengths(root, true, counts);
        Node effective = root;
        if (counts[0] == 0 && counts[1] > 0) {
            effective = withUnitLengths(root);
        } else if (counts[1] > 0) {
            throw new ValidationException(String.format(
                    "Phylogenetic tree has %d edges without branch length and %d with; give all or none",
                    counts[1], counts[0]));
        }
        return new PhylogeneticTree(effective);
    }

    /**
     * Parses a Newick string such as {@code ((a:1,b:1):2,c:3);}.
     *
     * @throws ValidationException if the text is not valid Newick
     */
    public static PhylogeneticTree fromNewick(String newick) {
        return of(new NewickParser(newick).parse());
    }

    private static void countLengths(Node node, boolean isRoot, int[] counts) {
        if (!isRoot) {
            counts[Double.isNaN(node.branchLength()) ? 1 : 0]++;
        }
        for (Node child : node.children()) {
            countLengths(child, false, counts);
        }
    }

    private static Node withUnitLengths(Node node) {
        List<Node> children = new ArrayList<>(node.children().size());
        for (Node child : node.children()) {
            children.add(withUnitLengths(child));
        }
        return new Node(node.label(), 1.0, children);
    }

    private void index(Node node, Node parent, double depth) {
        if (parent != null) {
            parents.put(node, parent);
        }
        depths.put(node, depth);
        if (node.isTip()) {
            String label = node.label();
            if (label == null || label.isBlank()) {
                throw new ValidationException("Phylogenetic tree contains an unlabelled tip");
            }
            if (tips.put(label, node) != null) {
                throw ValidationException.invalidParameter("tip label", label, "unique label");
            }
            return;
        }
        for (Node child : node.children()) {
            double length = child.branchLength();
            if (length < 0) {
                throw ValidationException.invalidParameter("branch length", length, "non-negative value");
            }
            index(child, node, depth + length);
        }
    }

    public Node root() {
        return root;
    }

    /** Tip labels in traversal order. */
    public Set<String> tipLabels() {
        return Collections.unmodifiableSet(tips.keySet());
    }

    public int tipCount() {
        return tips.size();
    }

    public boolean containsTip(String label) {
        return tips.containsKey(label);
    }

    /** Distance from the root to the given tip. */
    public double rootDistance(String label) {
        return depths.get(requireTip(label));
    }

    /**
     * Returns the subtree spanning the given tips. Nodes left with a single child are collapsed
     * into their child's edge, and the root moves to the most recent common ancestor of the kept
     * tips.
     *
     * @param keep labels to retain, all of which must be tips of this tree
     * @return the pruned tree
     */
    public PhylogeneticTree prune(Collection<String> keep) {
        if (keep == null || keep.isEmpty()) {
            throw new ValidationException("Cannot prune a phylogenetic tree to zero tips");
        }
        for (String label : keep) {
            requireTip(label);
        }
        Set<String> retained = Set.copyOf(keep);
        Node pruned = pruneNode(root, retained);
        return new PhylogeneticTree(new Node(pruned.label(), 0.0, pruned.children()));
    }

    private static Node pruneNode(Node node, Set<String> keep) {
        if (node.isTip()) {
            return keep.contains(node.label()) ? node : null;
        }
        List<Node> children = new ArrayList<>();
        for (Node child : node.children()) {
            Node copy = pruneNode(child, keep);
            if (copy != null) {
                children.add(copy);
            }
        }
        if (children.isEmpty()) {
            return null;
        }
        if (children.size() == 1) {
            Node only = children.get(0);
            return new Node(only.label(), only.branchLength() + node.branchLength(), only.children());
        }
        return new Node(node.label(), node.branchLength(), children);
    }

    /**
     * Shared path length from the root for every pair of tips (the phylogenetic
     * variance-covariance matrix). The diagonal holds root-to-tip distances.
     *
     * @param order tip labels defining row and column order
     */
    public double[][] sharedPathLengths(List<String> order) {
        int n = order.size();
        List<List<Node>> lineages = new ArrayList<>(n);
        for (String label : order) {
            lineages.add(lineage(requireTip(label)));
        }
        double[][] matrix = new double[n][n];
        for (int i = 0; i < n; i++) {
            matrix[i][i] = depths.get(lineages.get(i).get(0));
            Set<Node> ancestors = Collections.newSetFromMap(new IdentityHashMap<>());
            ancestors.addAll(lineages.get(i));
            for (int j = i + 1; j < n; j++) {
                double shared = depths.get(firstCommon(ancestors, lineages.get(j)));
                matrix[i][j] = shared;
                matrix[j][i] = shared;
            }
        }
        return matrix;
    }

    /**
     * Variance-covariance matrix rescaled to correlations. Tips at zero distance from the root
     * are uncorrelated with every other tip.
     */
    public double[][] correlationMatrix(List<String> order) {
        double[][] vcv = sharedPathLengths(order);
        int n = order.size();
        double[][] correlation = new double[n][n];
        for (int i = 0; i < n; i++) {
            for (int j = 0; j < n; j++) {
                double scale = Math.sqrt(vcv[i][i] * vcv[j][j]);
                if (i == j) {
                    correlation[i][j] = 1.0;
                } else {
                    correlation[i][j] = scale > 0 ? vcv[i][j] / scale : 0.0;
                }
            }
        }
        return correlation;
    }

    /** Patristic (cophenetic) distance between every pair of tips. */
    public double[][] copheneticDistances(List<String> order) {
        double[][] vcv = sharedPathLengths(order);
        int n = order.size();
        double[][] distances = new double[n][n];
        for (int i = 0; i < n; i++) {
            for (int j = 0; j < n; j++) {
                distances[i][j] = i == j ? 0.0 : vcv[i][i] + vcv[j][j] - 2 * vcv[i][j];
            }
        }
        return distances;
    }

    /**
     * Faith's phylogenetic diversity: total branch length of the union of root-to-tip paths of
     * the given tips, root included.
     */
    public double phylogeneticDiversity(Collection<String> labels) {
        Set<Node> visited = Collections.newSetFromMap(new IdentityHashMap<>());
        double total = 0.0;
        for (String label : labels) {
            for (Node node : lineage(requireTip(label))) {
                if (node == root || !visited.add(node)) {
                    break;
                }
                total += node.branchLength();
            }
        }
        return total;
    }

    private Node requireTip(String label) {
        Node tip = tips.get(label);
        if (tip == null) {
            throw ValidationException.invalidParameter("tip label", label, "a tip of the tree");
        }
        return tip;
    }

    /** The node followed by its ancestors up to and including the root. */
    private List<Node> lineage(Node node) {
        List<Node> path = new ArrayList<>();
        for (Node current = node; current != null; current = parents.get(current)) {
            path.add(current);
        }
        return path;
    }

    private static Node firstCommon(Set<Node> ancestors, List<Node> lineage) {
        for (Node node : lineage) {
            if (ancestors.contains(node)) {
                return node;
            }
        }
        throw new IllegalStateException("Tips do not share a root");
    }

    /**
     * Tree node: optional label, length of the edge to its parent ({@code NaN} if absent), and
     * ordered children. A node without children is a tip.
     */
    public record Node(String label, double branchLength, List<Node> children) {

        public Node {
            children = children == null ? List.of() : List.copyOf(children);
        }

        public static Node tip(String label, double branchLength) {
            return new Node(label, branchLength, List.of());
        }

        public static Node internal(double branchLength, Node... children) {
            return new Node(null, branchLength, List.of(children));
        }

        public boolean isTip() {
            return children.isEmpty();
        }
    }
}
