package io;

import cpg.CPGEdge;
import cpg.CPGNode;
import cpg.CodePropertyGraph;
import cpg.CpgEdgeKind;
import errors.CpgIoException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Renders a CPG as a Graphviz digraph: one shape per origin, one edge style per kind.
 */
public class CpgDotExporter {
    private static final Logger logger = LoggerFactory.getLogger(CpgDotExporter.class);

    public String toDot(CodePropertyGraph cpg) {
        StringWriter buffer = new StringWriter();
        try (PrintWriter writer = new PrintWriter(buffer)) {
            writer.printf("digraph \"%s\" {%n", escape(cpg.getName()));
            writer.println("  node [fontname=\"Helvetica\", fontsize=10];");
            for (CPGNode node : cpg.getNodes()) {
                String label = node.getRole() + (node.getLabel() == null ? "" : "\\n" + escape(node.getLabel()));
                writer.printf("  \"%s\" [label=\"%s\", shape=%s];%n", escape(node.getId()), label, shape(node));
            }
            for (CPGEdge edge : cpg.getEdges()) {
                writer.printf("  \"%s\" -> \"%s\" [%s];%n", escape(edge.getFrom()), escape(edge.getTo()), style(edge));
            }
            writer.println("}");
        }
        return buffer.toString();
    }

    public void write(CodePropertyGraph cpg, Path path) {
        try {
            if (path.getParent() != null) {
                Files.createDirectories(path.getParent());
            }
            Files.write(path, toDot(cpg).getBytes(StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new CpgIoException("Error exporting " + cpg.getName() + " to " + path + ": " + e.getMessage(), e);
        }
        logger.info("CPG {} exported to {}", cpg.getName(), path);
    }

    private static String shape(CPGNode node) {
        switch (node.getOrigin()) {
            case CFG:
                return "box";
            case DFG:
                return "ellipse";
            case SYNTHETIC:
                return "doubleoctagon";
            default:
                return "plaintext";
        }
    }

    private static String style(CPGEdge edge) {
        CpgEdgeKind kind = edge.getKind();
        String label = edge.getLabel() == null ? kind.name() : edge.getLabel();
        switch (kind) {
            case PARENT_CHILD:
                return "color=gray, arrowhead=none";
            case CONTAINS:
                return "style=dotted";
            case DATA_REACHES:
            case DATA_DEPENDS:
                return "color=blue, label=\"" + escape(label) + "\"";
            case CALLS:
                return "color=red, style=bold, label=\"" + escape(label) + "\"";
            default:
                return "label=\"" + escape(label) + "\"";
        }
    }

    private static String escape(String text) {
        return text.replace("\\", "\\\\").replace("\"", "\\\"");
    }
}
