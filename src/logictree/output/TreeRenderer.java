package logictree.output;

import logictree.parsing.Node;

import java.util.List;

/**
 * Renders a tree depth first, one node per line, with box-drawing connectors.
 */
public final class TreeRenderer
{
    private static final String LAST_CONNECTOR = "└── ";
    private static final String MID_CONNECTOR  = "├── ";
    private static final String LAST_INDENT    = "    ";
    private static final String MID_INDENT     = "│   ";

    private TreeRenderer() {}

    public static String render(Node root)
    {
        StringBuilder sb = new StringBuilder();
        render(root, "", true, sb);
        return sb.toString();
    }

    private static void render(Node node, String prefix, boolean isTail, StringBuilder sb)
    {
        sb.append(prefix).append(isTail ? LAST_CONNECTOR : MID_CONNECTOR).append(node.getLabel()).append('\n');

        String childPrefix = prefix + (isTail ? LAST_INDENT : MID_INDENT);
        List<Node> children = node.getChildren();
        for (int i = 0; i < children.size(); i++)
            render(children.get(i), childPrefix, i == children.size() - 1, sb);
    }
}
