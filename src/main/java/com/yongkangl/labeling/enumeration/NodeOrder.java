package com.yongkangl.labeling.enumeration;

/**
 * Numbering the emitted label vectors follow.
 */
public enum NodeOrder {
    /** Pre-order ids of the traversal the caller passed in. */
    ORIGINAL,
    /** Pre-order ids of the traversal re-rooted at the center. */
    BALANCED
}
