package com.yongkangl.labeling.enumeration;

import com.yongkangl.labeling.io.RootedTree;
import com.yongkangl.labeling.io.SequenceValidator;
import com.yongkangl.labeling.tree.BalancedSequence;
import com.yongkangl.labeling.tree.CenterLocator;
import com.yongkangl.labeling.tree.EdgeSubdivision;
import com.yongkangl.labeling.tree.EquivalenceTree;
import com.yongkangl.labeling.tree.EquivalenceTreeBuilder;
import com.yongkangl.labeling.tree.Rebalancer;
import org.apache.commons.math3.util.Pair;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * Generates all labelings of a free tree with the labels {@code 0..maxLabel-1}, one per
 * automorphism class. Labels go on the nodes, or on the edges in edge mode.
 * <p>
 * The arguments are validated up front. Each {@link #iterator()} call starts an independent
 * enumeration session on a freshly built tree.
 */
public class TreeLabeler implements Iterable<int[]> {
    private static final Logger logger = LoggerFactory.getLogger(TreeLabeler.class);

    public static final int DEFAULT_MAX_LABEL = 2;

    private final int[] sequence;
    private final int maxLabel;
    private final boolean edgeMode;
    private final NodeOrder nodeOrder;
    private final List<Pair<Integer, Integer>> centers;
    private final BalancedSequence balanced;

    public TreeLabeler(int[] sequence) {
        this(sequence, DEFAULT_MAX_LABEL);
    }

    public TreeLabeler(int[] sequence, int maxLabel) {
        this(sequence, maxLabel, false);
    }

    public TreeLabeler(int[] sequence, int maxLabel, boolean edgeMode) {
        this(sequence, maxLabel, edgeMode, NodeOrder.ORIGINAL);
    }

    public TreeLabeler(List<Integer> sequence, int maxLabel, boolean edgeMode) {
        this(SequenceValidator.requireValidSequence(sequence), maxLabel, edgeMode, NodeOrder.ORIGINAL);
    }

    public TreeLabeler(int[] sequence, int maxLabel, boolean edgeMode, NodeOrder nodeOrder) {
        this.sequence = SequenceValidator.requireValidSequence(sequence);
        this.maxLabel = SequenceValidator.requireValidAlphabetSize(maxLabel);
        this.edgeMode = edgeMode;
        this.nodeOrder = nodeOrder == null ? NodeOrder.ORIGINAL : nodeOrder;

        int[] working = edgeMode ? EdgeSubdivision.subdivide(this.sequence) : this.sequence;
        this.centers = Collections.unmodifiableList(new ArrayList<>(CenterLocator.findCenters(working)));
        this.balanced = Rebalancer.balance(working, centers);
        logger.debug("Centers {} of {}, balanced sequence {}", centers, working, balanced);
    }

    public static LabelingIterator enumerateLabelings(int[] sequence) {
        return new TreeLabeler(sequence).iterator();
    }

    public static LabelingIterator enumerateLabelings(int[] sequence, int maxLabel) {
        return new TreeLabeler(sequence, maxLabel).iterator();
    }

    public static LabelingIterator enumerateLabelings(int[] sequence, int maxLabel, boolean edgeMode) {
        return new TreeLabeler(sequence, maxLabel, edgeMode).iterator();
    }

    @Override
    public LabelingIterator iterator() {
        RootedTree tree = RootedTree.fromSequence(balanced.getDistances());
        EquivalenceTree equivalenceTree = EquivalenceTreeBuilder.build(tree, centers.size());
        return new LabelingIterator(new LabelingEnumerator(tree, equivalenceTree, alphabetSizes(tree)), outputIds());
    }

    public Stream<int[]> stream() {
        return StreamSupport.stream(Spliterators.spliteratorUnknownSize(iterator(), Spliterator.ORDERED | Spliterator.NONNULL), false);
    }

    /** Collects every labeling of a fresh session. */
    public List<int[]> toList() {
        List<int[]> labelings = new ArrayList<>();
        for (int[] labeling : this) {
            labelings.add(labeling);
        }
        return labelings;
    }

    private int[] alphabetSizes(RootedTree tree) {
        int[] sizes = new int[tree.size()];
        for (int id = 0; id < tree.size(); id++) {
            boolean vertexInEdgeMode = edgeMode && id < tree.getRealNodeCount()
                    && !EdgeSubdivision.isEdgeNode(balanced.getOrigin(id));
            sizes[id] = vertexInEdgeMode ? 1 : maxLabel;
        }
        return sizes;
    }

    /**
     * Node ids whose labels make up an emitted vector: every real node (or every edge node in
     * edge mode), ordered by original or balanced pre-order id.
     */
    private int[] outputIds() {
        List<Integer> ids = new ArrayList<>();
        if (nodeOrder == NodeOrder.BALANCED) {
            for (int id = 0; id < balanced.length(); id++) {
                if (!edgeMode || EdgeSubdivision.isEdgeNode(balanced.getOrigin(id))) {
                    ids.add(id);
                }
            }
        } else {
            int[] positions = balanced.positionsByOrigin();
            for (int origin = 0; origin < positions.length; origin++) {
                if (!edgeMode || EdgeSubdivision.isEdgeNode(origin)) {
                    ids.add(positions[origin]);
                }
            }
        }
        return ids.stream().mapToInt(Integer::intValue).toArray();
    }

    /** The traversal re-rooted at the center (of the subdivided tree in edge mode). */
    public int[] getBalancedSequence() {
        return balanced.getDistances();
    }

    /** (distance, index) pairs of the one or two centers. */
    public List<Pair<Integer, Integer>> getCenters() {
        return centers;
    }

    public boolean isBicentral() {
        return centers.size() == 2;
    }

    /** Length of every emitted vector: the number of nodes, or of edges in edge mode. */
    public int getLabelLength() {
        return edgeMode ? sequence.length - 1 : sequence.length;
    }

    public int[] getSequence() {
        return sequence.clone();
    }

    public int getMaxLabel() {
        return maxLabel;
    }

    public boolean isEdgeMode() {
        return edgeMode;
    }

    public NodeOrder getNodeOrder() {
        return nodeOrder;
    }
}
