package com.yongkangl.labeling.io;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

public class TreeNode {
    public static final int NO_PARENT = -1;

    private int parent;
    private List<Integer> children;
    private final int distance;
    private int[] orderVector = new int[]{0};
    private int label;
    private int multiplicity = 1;
    private boolean symmetric;

    public TreeNode(int parent, int distance) {
        this.parent = parent;
        this.distance = distance;
        this.children = new ArrayList<>();
    }

    public int getParent() {
        return parent;
    }

    public void setParent(int parent) {
        this.parent = parent;
    }

    public int getDistance() {
        return distance;
    }

    public void addChild(int child) {
        children.add(child);
    }

    public void removeChild(int child) {
        children.remove(Integer.valueOf(child));
    }

    public int getChild(int i) {
        return children.get(i);
    }

    public int getChildCount() {
        return children.size();
    }

    public List<Integer> getChildren() {
        return children;
    }

    public void setChildren(List<Integer> children) {
        this.children = new ArrayList<>(children);
    }

    public boolean isTip() {
        return children.isEmpty();
    }

    /**
     * The node's child count followed by the order-vectors of its children, flattened in
     * canonical child order. Two subtrees are isomorphic iff their order-vectors are equal.
     */
    public int[] getOrderVector() {
        return orderVector;
    }

    public void setOrderVector(int[] orderVector) {
        this.orderVector = orderVector;
    }

    public int getLabel() {
        return label;
    }

    public void setLabel(int label) {
        this.label = label;
    }

    public int getMultiplicity() {
        return multiplicity;
    }

    public void setMultiplicity(int multiplicity) {
        this.multiplicity = multiplicity;
    }

    public boolean isSymmetric() {
        return symmetric;
    }

    public void setSymmetric(boolean symmetric) {
        this.symmetric = symmetric;
    }

    @Override
    public String toString() {
        return "parent: " + parent + ", multiplicity: " + multiplicity + ", distance: " + distance
                + ", children: " + children + ", orderVector: " + Arrays.toString(orderVector);
    }
}
