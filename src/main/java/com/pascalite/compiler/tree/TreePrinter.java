package com.pascalite.compiler.tree;

import com.pascalite.compiler.parser.Declaration;

/**
 * Renders a syntax tree as indented text: one node per line, two spaces of
 * indentation per level, children in source order.
 */
public final class TreePrinter {

    private static final String INDENT = "  ";

    private TreePrinter() {}

    public static String print(Declaration.Program root) {
        StringBuilder sb = new StringBuilder();
        printRec(new TreeLabeler().program(root), 0, sb);
        return sb.toString();
    }

    public static DisplayNode describe(Declaration.Program root) {
        return new TreeLabeler().program(root);
    }

    private static void printRec(DisplayNode node, int depth, StringBuilder out) {
        for (int i = 0; i < depth; i++) out.append(INDENT);
        out.append(node.label()).append('\n');
        for (DisplayNode child : node.children) {
            printRec(child, depth + 1, out);
        }
    }
}
