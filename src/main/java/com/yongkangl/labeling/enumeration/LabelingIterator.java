package com.yongkangl.labeling.enumeration;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Iterator;
import java.util.NoSuchElementException;

/**
 * Pull-driven cursor over the labelings of one enumeration session. The first labeling is the
 * all-zero one; every later call to {@link #hasNext()} advances the odometer once.
 */
public class LabelingIterator implements Iterator<int[]> {
    private static final Logger logger = LoggerFactory.getLogger(LabelingIterator.class);

    private final LabelingEnumerator enumerator;
    private final int[] ids;
    private boolean started;
    private boolean ready;
    private boolean exhausted;
    private long count;

    /**
     * @param ids node ids to read the labels from, in output order
     */
    public LabelingIterator(LabelingEnumerator enumerator, int[] ids) {
        this.enumerator = enumerator;
        this.ids = ids;
    }

    @Override
    public boolean hasNext() {
        if (!ready && !exhausted) {
            if (!started) {
                started = true;
                ready = true;
            } else if (enumerator.advance()) {
                ready = true;
            } else {
                exhausted = true;
                logger.debug("Enumeration finished after {} labelings", count);
            }
        }
        return ready;
    }

    @Override
    public int[] next() {
        if (!hasNext()) {
            throw new NoSuchElementException("All labelings have been generated");
        }
        ready = false;
        count++;
        return enumerator.labels(ids);
    }

    /** Number of labelings returned so far. */
    public long getCount() {
        return count;
    }
}
