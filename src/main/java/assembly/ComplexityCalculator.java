package assembly;

import ast.AstKind;
import ast.AstNode;
import sanalysis.CFGNode;
import sanalysis.CFGNodeKind;
import sanalysis.ControlFlowGraph;
import sanalysis.DataFlowGraph;

import java.util.EnumSet;
import java.util.Set;

/**
 * Computes {@link ComplexityMetrics}. Cognitive complexity follows the SonarSource rules:
 * a structural increment (plus the current nesting level) for each if, switch, loop and catch,
 * a flat increment for else branches, labeled jumps, each run of like boolean operators and each
 * recursive call. Nesting grows inside those structures and inside lambdas.
 */
public class ComplexityCalculator {

    private static final Set<AstKind> STATEMENTS = EnumSet.of(
            AstKind.EXPRESSION_STATEMENT, AstKind.LABELED, AstKind.IF, AstKind.WHILE, AstKind.DO_WHILE,
            AstKind.FOR, AstKind.FOR_EACH, AstKind.SWITCH, AstKind.TRY, AstKind.SYNCHRONIZED,
            AstKind.RETURN, AstKind.BREAK, AstKind.CONTINUE, AstKind.THROW);

    public ComplexityMetrics calculate(AstNode function, ControlFlowGraph cfg, DataFlowGraph dfg) {
        int cyclomatic = cyclomatic(cfg);
        Cognitive cognitive = new Cognitive(function);
        cognitive.visit(function, 0, null);

        int decisions = 0;
        for (CFGNode node : cfg.getNodes()) {
            if (node.getKind() == CFGNodeKind.DECISION) {
                decisions++;
            }
        }
        int statements = 0;
        int parameters = 0;
        for (AstNode node : function.preorder()) {
            if (STATEMENTS.contains(node.getKind())) {
                statements++;
            }
        }
        for (AstNode child : function.getChildren()) {
            if (child.is(AstKind.PARAMETER)) {
                parameters++;
            }
        }
        return new ComplexityMetrics(cyclomatic, cognitive.score, cognitive.maxDepth, decisions, statements,
                parameters, dfg.getVariableVersions().size(), dfg.getPhiNodes().size());
    }

    public static int cyclomatic(ControlFlowGraph cfg) {
        return cfg.getEdges().size() - cfg.getNodes().size() + 2;
    }

    private static final class Cognitive {
        private final String name;
        private final int arity;
        int score;
        int maxDepth;

        Cognitive(AstNode function) {
            this.name = function.getName();
            int params = 0;
            for (AstNode child : function.getChildren()) {
                if (child.is(AstKind.PARAMETER)) params++;
            }
            this.arity = params;
        }

        void visit(AstNode node, int nesting, String parentOperator) {
            switch (node.getKind()) {
                case IF:
                    structural(nesting);
                    ifBranches(node, nesting);
                    return;
                case WHILE:
                case DO_WHILE:
                case FOR:
                case FOR_EACH:
                case SWITCH:
                case CATCH:
                    structural(nesting);
                    children(node, nesting + 1);
                    return;
                case LAMBDA:
                    children(node, nesting + 1);
                    return;
                case BREAK:
                case CONTINUE:
                    if (node.getName() != null) score++;
                    return;
                case OPERATOR:
                    String operator = node.getAttribute("operator");
                    boolean logical = "&&".equals(operator) || "||".equals(operator);
                    if (logical && !operator.equals(parentOperator)) {
                        score++;
                    }
                    for (AstNode child : node.getChildren()) {
                        visit(child, nesting, logical ? operator : null);
                    }
                    return;
                case CALL:
                    if (isRecursive(node)) score++;
                    children(node, nesting);
                    return;
                default:
                    children(node, nesting);
            }
        }

        // Condition at the if's level, branches one deeper; else-if chains stay flat.
        private void ifBranches(AstNode ifNode, int nesting) {
            visit(ifNode.getChild(0), nesting, null);
            if (ifNode.getChildCount() > 1) {
                visit(ifNode.getChild(1), nesting + 1, null);
            }
            if (ifNode.getChildCount() > 2) {
                AstNode elseBranch = ifNode.getChild(2);
                score++;
                if (elseBranch.is(AstKind.IF)) {
                    ifBranches(elseBranch, nesting);
                } else {
                    visit(elseBranch, nesting + 1, null);
                }
            }
        }

        private void structural(int nesting) {
            score += 1 + nesting;
            maxDepth = Math.max(maxDepth, nesting + 1);
        }

        private void children(AstNode node, int nesting) {
            for (AstNode child : node.getChildren()) {
                visit(child, nesting, null);
            }
        }

        private boolean isRecursive(AstNode call) {
            String receiver = call.getAttribute("receiver");
            return name != null && name.equals(call.getName())
                    && Integer.toString(arity).equals(call.getAttribute("arity"))
                    && (receiver == null || "this".equals(receiver));
        }
    }
}
