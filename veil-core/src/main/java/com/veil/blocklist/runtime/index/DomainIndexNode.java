package com.veil.blocklist.runtime.index;

import it.unimi.dsi.fastutil.objects.Object2ObjectAVLTreeMap;
import it.unimi.dsi.fastutil.objects.Object2ObjectSortedMap;

/**
 * One label of the domain index.
 *
 * <p>The terminal mark is a reference count so that two patterns naming the
 * same domain can be removed independently.
 */
final class DomainIndexNode {

    private Object2ObjectSortedMap<String, DomainIndexNode> children;
    private int terminalRefs;

    DomainIndexNode child(String childLabel) {
        return children == null ? null : children.get(childLabel);
    }

    DomainIndexNode getOrCreateChild(String childLabel) {
        if (children == null) {
            children = new Object2ObjectAVLTreeMap<>();
        }
        DomainIndexNode child = children.get(childLabel);
        if (child == null) {
            child = new DomainIndexNode();
            children.put(childLabel, child);
        }
        return child;
    }

    boolean isTerminal() {
        return terminalRefs > 0;
    }

    /**
     * @return true if this call turned a non-terminal node terminal
     */
    boolean markTerminal() {
        return terminalRefs++ == 0;
    }

    /**
     * @return true if this call turned a terminal node non-terminal
     */
    boolean unmarkTerminal() {
        if (terminalRefs == 0) {
            return false;
        }
        return --terminalRefs == 0;
    }

    void clearChildren() {
        children = null;
        terminalRefs = 0;
    }
}
