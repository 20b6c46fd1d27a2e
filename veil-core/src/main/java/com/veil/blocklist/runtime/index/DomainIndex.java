package com.veil.blocklist.runtime.index;

import com.veil.blocklist.runtime.url.DomainNames;

/**
 * Label-wise tree for parent-domain lookups.
 *
 * <p>Domains are stored top-level label first, so {@code ads.tracker.com} is the
 * path {@code com -> tracker -> ads} and every domain under {@code tracker.com}
 * shares that prefix. A lookup walks the host's labels in the same order and
 * stops at the first terminal node: an indexed ancestor blocks all of its
 * subdomains.
 *
 * <p>Matching is on whole labels only. {@code tracker.com} matches
 * {@code sub.tracker.com} but neither {@code trackerx.com} nor
 * {@code not-tracker.com}.
 *
 * <p>Removal clears the terminal mark and leaves the branch in place. The
 * number of nodes is bounded by the patterns ever inserted, not by lookups.
 */
public final class DomainIndex {

    private final DomainIndexNode root = new DomainIndexNode();
    private int terminalDomains;

    /**
     * @param domain lowercased, syntactically valid domain
     * @return true if the domain was not indexed before
     */
    public boolean insert(String domain) {
        String[] labels = DomainNames.labelsTopLevelFirst(domain);
        DomainIndexNode node = root;
        for (String label : labels) {
            node = node.getOrCreateChild(label);
        }
        boolean added = node.markTerminal();
        if (added) {
            terminalDomains++;
        }
        return added;
    }

    /**
     * Drops one reference to {@code domain}. Nodes are never pruned.
     *
     * @return true if the domain is no longer indexed after this call
     */
    public boolean remove(String domain) {
        String[] labels = DomainNames.labelsTopLevelFirst(domain);
        DomainIndexNode node = root;
        for (String label : labels) {
            node = node.child(label);
            if (node == null) {
                return false;
            }
        }
        boolean removed = node.unmarkTerminal();
        if (removed) {
            terminalDomains--;
        }
        return removed;
    }

    /**
     * @param host lowercased host name
     * @return true if the host or one of its parent domains is indexed
     */
    public boolean query(String host) {
        if (host == null || host.isEmpty() || terminalDomains == 0) {
            return false;
        }
        DomainIndexNode node = root;
        int end = host.length();
        for (int i = end - 1; i >= -1; i--) {
            if (i >= 0 && host.charAt(i) != '.') {
                continue;
            }
            node = node.child(host.substring(i + 1, end));
            if (node == null) {
                return false;
            }
            if (node.isTerminal()) {
                return true;
            }
            end = i;
        }
        return false;
    }

    /**
     * @return true if exactly this domain is indexed
     */
    public boolean contains(String domain) {
        String[] labels = DomainNames.labelsTopLevelFirst(domain);
        DomainIndexNode node = root;
        for (String label : labels) {
            node = node.child(label);
            if (node == null) {
                return false;
            }
        }
        return node.isTerminal();
    }

    /**
     * @return number of distinct indexed domains
     */
    public int size() {
        return terminalDomains;
    }

    public void clear() {
        root.clearChildren();
        terminalDomains = 0;
    }
}
