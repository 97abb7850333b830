package com.pascalite.compiler.tree;

import java.util.List;

/** Label, optional payload and children of one syntax tree node, as shown to the user. */
public final class DisplayNode {
    public final String node;
    /** Null when the construct has no payload. */
    public final String value;
    public final List<DisplayNode> children;

    public DisplayNode(String node, String value, List<DisplayNode> children) {
        this.node = node;
        this.value = value;
        this.children = List.copyOf(children);
    }

    public String label() {
        return (value == null) ? node : node + " " + value;
    }
}
