package net.langexplorer.util.features;

/**
 * The order in which a node's neighbourhood is fed into the hash of one
 * WL relabelling round.
 */
public enum HashingOrder {

    /* Own bytes, sorted child labels, parent label. */
    SELF_CHILDREN_PARENT,

    /* Parent label, own bytes, sorted child labels. */
    PARENT_SELF_CHILDREN,

    /* Sorted child labels only. */
    TOTAL_ORDERED

}
