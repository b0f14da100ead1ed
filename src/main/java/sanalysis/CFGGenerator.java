package sanalysis;

import ast.AstKind;
import ast.AstNode;
import ast.FunctionSource;
import ast.SourcePositionId;
import errors.MalformedControlStructureException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Builds the control flow graph of one function from its AST.
 *
 * Steps:
 *   1. Create the entry node (holding the parameters) and the exit node.
 *   2. Walk the body recursively. Consecutive simple statements share one basic block; every
 *      branch outcome and loop header gets a decision node.
 *   3. Route returns to the exit, throws to the innermost catch test (or the exit), and
 *      break/continue to the construct they leave or repeat.
 *
 * The walk carries "pending" edges: the control transfers that still need a target. A statement
 * reached by no pending edge is unreachable and gets no node, so every node except the entry has
 * at least one incoming edge.
 */
public class CFGGenerator {
    private static final Logger logger = LoggerFactory.getLogger(CFGGenerator.class);

    public ControlFlowGraph generate(FunctionSource function) throws MalformedControlStructureException {
        return generate(function.getAst(), function.getQualifiedName());
    }

    public ControlFlowGraph generate(AstNode function, String qualifiedName) throws MalformedControlStructureException {
        if (!function.is(AstKind.FUNCTION)) {
            throw new MalformedControlStructureException(qualifiedName,
                    "Expected a FUNCTION node but got " + function.getKind());
        }
        ControlFlowGraph cfg = new Walk(qualifiedName).run(function);
        logger.debug("CFG for {}: {} nodes, {} edges", qualifiedName, cfg.getNodes().size(), cfg.getEdges().size());
        return cfg;
    }

    // Node under construction.
    private static class Draft {
        final int id;
        CFGNodeKind kind;
        SourcePositionId source;
        final List<SourcePositionId> contained = new ArrayList<>();
        final List<String> statementLabels = new ArrayList<>();
        final String label;

        Draft(int id, CFGNodeKind kind, SourcePositionId source, String label) {
            this.id = id;
            this.kind = kind;
            this.source = source;
            this.label = label;
        }

        void add(AstNode statement) {
            if (source == null) {
                source = statement.getId();
            }
            contained.add(statement.getId());
            statementLabels.add(statement.getLabel());
        }

        CFGNode freeze() {
            String text = statementLabels.isEmpty() || kind == CFGNodeKind.DECISION
                    || kind == CFGNodeKind.ENTRY ? label : String.join("; ", statementLabels);
            return new CFGNode(id, kind, source, contained, text);
        }
    }

    // A control transfer out of "from" whose target is not known yet.
    private static class Pending {
        final Draft from;
        final CFGEdgeKind kind;

        Pending(Draft from, CFGEdgeKind kind) {
            this.from = from;
            this.kind = kind;
        }
    }

    // For handling break/continue.
    private static class JumpTarget {
        final String label;
        final boolean loop;
        // Loops and switches take an unlabeled break; labeled blocks only a labeled one.
        final boolean breakable;
        final List<Pending> breaks = new ArrayList<>();
        final List<Pending> continues = new ArrayList<>();

        JumpTarget(String label, boolean loop, boolean breakable) {
            this.label = label;
            this.loop = loop;
            this.breakable = breakable;
        }
    }

    // Exceptions raised inside a try body that has catch clauses.
    private static class Handler {
        final List<Pending> raised = new ArrayList<>();
    }

    private static final class Walk {
        private final String function;
        private final List<Draft> nodes = new ArrayList<>();
        private final List<CFGEdge> edges = new ArrayList<>();
        private final Deque<JumpTarget> jumpTargets = new ArrayDeque<>();
        private final Deque<Handler> handlers = new ArrayDeque<>();
        private Draft exit;
        // Block that may still absorb the next simple statement.
        private Draft open;
        private int unreachable;

        Walk(String function) {
            this.function = function;
        }

        ControlFlowGraph run(AstNode fn) throws MalformedControlStructureException {
            if (fn.getChildCount() == 0 || !fn.getChild(fn.getChildCount() - 1).is(AstKind.BLOCK)) {
                throw malformed(fn, "function has no body");
            }
            Draft entry = node(CFGNodeKind.ENTRY, fn.getId(), "entry: " + fn.getName());
            for (AstNode child : fn.getChildren()) {
                if (child.is(AstKind.PARAMETER)) {
                    entry.contained.add(child.getId());
                }
            }
            exit = node(CFGNodeKind.EXIT, fn.getId(), "exit: " + fn.getName());

            List<Pending> out = statement(fn.getChild(fn.getChildCount() - 1), single(entry, CFGEdgeKind.SEQUENTIAL), null);
            connect(out, exit);
            if (unreachable > 0) {
                logger.debug("{}: skipped {} unreachable statement(s)", function, unreachable);
            }

            List<CFGNode> frozen = new ArrayList<>();
            for (Draft draft : nodes) {
                frozen.add(draft.freeze());
            }
            return new ControlFlowGraph(function, frozen, edges);
        }

        private List<Pending> statement(AstNode stmt, List<Pending> in, String label) throws MalformedControlStructureException {
            if (in.isEmpty()) {
                unreachable++;
                return in;
            }
            switch (stmt.getKind()) {
                case BLOCK:
                    return sequence(stmt.getChildren(), in);
                case EMPTY:
                    return in;
                case IF:
                    return ifStatement(stmt, in);
                case WHILE:
                    return whileLoop(stmt, in, label);
                case DO_WHILE:
                    return doWhileLoop(stmt, in, label);
                case FOR:
                    return forLoop(stmt, in, label);
                case FOR_EACH:
                    return forEachLoop(stmt, in, label);
                case SWITCH:
                    return switchStatement(stmt, in, label);
                case TRY:
                    return tryStatement(stmt, in);
                case SYNCHRONIZED:
                    return synchronizedStatement(stmt, in);
                case LABELED:
                    return labeledStatement(stmt, in);
                case RETURN:
                    return returnStatement(stmt, in);
                case THROW:
                    return throwStatement(stmt, in);
                case BREAK:
                    return breakStatement(stmt, in);
                case CONTINUE:
                    return continueStatement(stmt, in);
                default:
                    Draft block = absorb(stmt, in);
                    return single(block, CFGEdgeKind.SEQUENTIAL);
            }
        }

        private List<Pending> sequence(List<AstNode> statements, List<Pending> in) throws MalformedControlStructureException {
            List<Pending> current = in;
            for (AstNode stmt : statements) {
                current = statement(stmt, current, null);
            }
            return current;
        }

        private List<Pending> ifStatement(AstNode ifStmt, List<Pending> in) throws MalformedControlStructureException {
            if (ifStmt.getChildCount() < 2) {
                throw malformed(ifStmt, "if statement without a then branch");
            }
            Draft decision = decision(ifStmt, ifStmt.getChild(0), in);
            List<Pending> out = new ArrayList<>(statement(ifStmt.getChild(1), single(decision, CFGEdgeKind.BRANCH_TRUE), null));
            if (ifStmt.getChildCount() > 2) {
                out.addAll(statement(ifStmt.getChild(2), single(decision, CFGEdgeKind.BRANCH_FALSE), null));
            } else {
                // No else: the false outcome falls through to whatever follows.
                out.add(new Pending(decision, CFGEdgeKind.BRANCH_FALSE));
            }
            return out;
        }

        private List<Pending> whileLoop(AstNode loop, List<Pending> in, String label) throws MalformedControlStructureException {
            if (loop.getChildCount() < 2) {
                throw malformed(loop, "while loop without condition or body");
            }
            Draft header = decision(loop, loop.getChild(0), in);
            JumpTarget target = push(label, true);
            List<Pending> bodyOut = statement(loop.getChild(1), single(header, CFGEdgeKind.BRANCH_TRUE), null);
            jumpTargets.pop();
            loopBack(concat(bodyOut, target.continues), header);
            return concat(single(header, CFGEdgeKind.BRANCH_FALSE), target.breaks);
        }

        private List<Pending> doWhileLoop(AstNode loop, List<Pending> in, String label) throws MalformedControlStructureException {
            if (loop.getChildCount() < 2) {
                throw malformed(loop, "do-while loop without body or condition");
            }
            Draft header = node(CFGNodeKind.BLOCK, null, "do");
            connect(in, header);
            open = header;
            JumpTarget target = push(label, true);
            List<Pending> bodyOut = statement(loop.getChild(0), single(header, CFGEdgeKind.SEQUENTIAL), null);
            jumpTargets.pop();
            List<Pending> conditionIn = concat(bodyOut, target.continues);
            if (conditionIn.isEmpty()) {
                return target.breaks;
            }
            Draft condition = decision(loop, loop.getChild(1), conditionIn);
            Draft latch = node(CFGNodeKind.BLOCK, null, "do-latch");
            edge(condition, latch, CFGEdgeKind.BRANCH_TRUE);
            edge(latch, header, CFGEdgeKind.LOOP_BACK);
            return concat(single(condition, CFGEdgeKind.BRANCH_FALSE), target.breaks);
        }

        private List<Pending> forLoop(AstNode loop, List<Pending> in, String label) throws MalformedControlStructureException {
            if (loop.getChildCount() < 4) {
                throw malformed(loop, "for loop needs init, condition, update and body slots");
            }
            AstNode init = loop.getChild(0);
            AstNode compare = loop.getChild(1);
            AstNode update = loop.getChild(2);

            List<Pending> afterInit = statement(init, in, null);
            if (afterInit.isEmpty()) {
                return afterInit;
            }
            Draft header;
            List<Pending> bodyIn;
            List<Pending> exits = new ArrayList<>();
            if (compare.is(AstKind.EMPTY)) {
                header = node(CFGNodeKind.BLOCK, loop.getId(), loop.getLabel());
                connect(afterInit, header);
                open = null;
                bodyIn = single(header, CFGEdgeKind.SEQUENTIAL);
            } else {
                header = decision(loop, compare, afterInit);
                bodyIn = single(header, CFGEdgeKind.BRANCH_TRUE);
                exits.add(new Pending(header, CFGEdgeKind.BRANCH_FALSE));
            }

            JumpTarget target = push(label, true);
            List<Pending> bodyOut = statement(loop.getChild(3), bodyIn, null);
            jumpTargets.pop();

            List<Pending> tail = concat(bodyOut, target.continues);
            if (!tail.isEmpty() && update.getChildCount() > 0) {
                Draft updateBlock = node(CFGNodeKind.BLOCK, null, "for-update");
                connect(tail, updateBlock);
                open = updateBlock;
                tail = sequence(update.getChildren(), single(updateBlock, CFGEdgeKind.SEQUENTIAL));
            }
            loopBack(tail, header);
            exits.addAll(target.breaks);
            return exits;
        }

        private List<Pending> forEachLoop(AstNode loop, List<Pending> in, String label) throws MalformedControlStructureException {
            if (loop.getChildCount() < 3 || !loop.getChild(0).is(AstKind.BINDING)) {
                throw malformed(loop, "for-each loop needs a variable, an iterable and a body");
            }
            Draft header = node(CFGNodeKind.DECISION, loop.getId(), loop.getLabel());
            header.contained.add(loop.getChild(1).getId());
            header.contained.add(loop.getChild(0).getId());
            connect(in, header);
            open = null;

            JumpTarget target = push(label, true);
            List<Pending> bodyOut = statement(loop.getChild(2), single(header, CFGEdgeKind.BRANCH_TRUE), null);
            jumpTargets.pop();
            loopBack(concat(bodyOut, target.continues), header);
            return concat(single(header, CFGEdgeKind.BRANCH_FALSE), target.breaks);
        }

        private List<Pending> switchStatement(AstNode switchStmt, List<Pending> in, String label) throws MalformedControlStructureException {
            List<AstNode> cases = new ArrayList<>();
            for (int i = 1; i < switchStmt.getChildCount(); i++) {
                AstNode clause = switchStmt.getChild(i);
                if (!clause.is(AstKind.CASE)) {
                    throw malformed(clause, "switch may only contain case clauses");
                }
                cases.add(clause);
            }
            if (switchStmt.getChildCount() == 0 || cases.isEmpty()) {
                throw malformed(switchStmt, "switch without any case clause");
            }

            // The selector is evaluated once, before the first test.
            Draft selectorBlock = absorb(switchStmt.getChild(0), in);
            List<Pending> next = single(selectorBlock, CFGEdgeKind.SEQUENTIAL);

            JumpTarget target = push(label, false);
            List<List<Pending>> entries = new ArrayList<>();
            int defaultIndex = -1;
            for (int i = 0; i < cases.size(); i++) {
                AstNode clause = cases.get(i);
                if (clause.hasFlag("default")) {
                    defaultIndex = i;
                    entries.add(null);
                    continue;
                }
                Draft test = node(CFGNodeKind.DECISION, clause.getId(), clause.getLabel());
                connect(next, test);
                open = null;
                entries.add(single(test, CFGEdgeKind.BRANCH_TRUE));
                next = single(test, CFGEdgeKind.BRANCH_FALSE);
            }

            List<Pending> exits = new ArrayList<>();
            if (defaultIndex >= 0) {
                entries.set(defaultIndex, next);
            } else {
                exits.addAll(next);
            }

            List<Pending> fallthrough = new ArrayList<>();
            for (int i = 0; i < cases.size(); i++) {
                AstNode clause = cases.get(i);
                boolean arrow = clause.hasFlag("arrow");
                List<Pending> entry = arrow ? entries.get(i) : concat(entries.get(i), fallthrough);
                if (arrow) {
                    exits.addAll(fallthrough);
                }
                List<Pending> out = sequence(clause.getChildren(), entry);
                if (arrow) {
                    exits.addAll(out);
                    fallthrough = new ArrayList<>();
                } else {
                    fallthrough = out;
                }
            }
            exits.addAll(fallthrough);
            jumpTargets.pop();
            exits.addAll(target.breaks);
            return exits;
        }

        private List<Pending> tryStatement(AstNode tryStmt, List<Pending> in) throws MalformedControlStructureException {
            if (tryStmt.getChildCount() == 0 || !tryStmt.getChild(0).is(AstKind.BLOCK)) {
                throw malformed(tryStmt, "try statement without a body");
            }
            List<AstNode> catches = new ArrayList<>();
            AstNode finallyClause = null;
            for (int i = 1; i < tryStmt.getChildCount(); i++) {
                AstNode clause = tryStmt.getChild(i);
                if (clause.is(AstKind.CATCH)) {
                    if (clause.getChildCount() < 2 || !clause.getChild(0).is(AstKind.BINDING)) {
                        throw malformed(clause, "catch clause needs an exception parameter and a body");
                    }
                    catches.add(clause);
                } else if (clause.is(AstKind.FINALLY)) {
                    finallyClause = clause;
                }
            }
            if (catches.isEmpty() && finallyClause == null) {
                throw malformed(tryStmt, "try statement without catch or finally");
            }

            Handler handler = null;
            if (!catches.isEmpty()) {
                handler = new Handler();
                handlers.push(handler);
                // The guarded body starts its own block.
                open = null;
            }
            List<Pending> out = new ArrayList<>(statement(tryStmt.getChild(0), in, null));
            if (handler != null) {
                handlers.pop();
            }

            if (handler != null && !handler.raised.isEmpty()) {
                List<Pending> next = handler.raised;
                for (int i = 0; i < catches.size(); i++) {
                    AstNode clause = catches.get(i);
                    Draft test = node(CFGNodeKind.DECISION, clause.getId(), clause.getLabel());
                    test.contained.add(clause.getChild(0).getId());
                    connect(next, test);
                    open = null;
                    out.addAll(statement(clause.getChild(1), single(test, CFGEdgeKind.BRANCH_TRUE), null));
                    if (i == catches.size() - 1) {
                        // Not caught here: the exception keeps propagating.
                        raise(test);
                    } else {
                        next = single(test, CFGEdgeKind.BRANCH_FALSE);
                    }
                }
            }

            if (finallyClause != null && finallyClause.getChildCount() > 0) {
                // Finally is modelled on the normal completion path only.
                return statement(finallyClause.getChild(0), out, null);
            }
            return out;
        }

        private List<Pending> synchronizedStatement(AstNode stmt, List<Pending> in) throws MalformedControlStructureException {
            if (stmt.getChildCount() < 2) {
                throw malformed(stmt, "synchronized statement without lock or body");
            }
            Draft lock = absorb(stmt.getChild(0), in);
            return statement(stmt.getChild(1), single(lock, CFGEdgeKind.SEQUENTIAL), null);
        }

        private List<Pending> labeledStatement(AstNode stmt, List<Pending> in) throws MalformedControlStructureException {
            if (stmt.getChildCount() == 0) {
                return in;
            }
            AstNode body = stmt.getChild(0);
            if (body.getKind().isLoop() || body.is(AstKind.SWITCH)) {
                return statement(body, in, stmt.getName());
            }
            JumpTarget target = push(stmt.getName(), false, false);
            List<Pending> out = statement(body, in, null);
            jumpTargets.pop();
            return concat(out, target.breaks);
        }

        private List<Pending> returnStatement(AstNode stmt, List<Pending> in) {
            Draft block = absorb(stmt, in);
            edge(block, exit, CFGEdgeKind.SEQUENTIAL);
            return List.of();
        }

        private List<Pending> throwStatement(AstNode stmt, List<Pending> in) {
            Draft block = openBlock(in);
            block.add(stmt);
            block.kind = CFGNodeKind.EXCEPTION_EDGE_SOURCE;
            raise(block);
            return List.of();
        }

        private List<Pending> breakStatement(AstNode stmt, List<Pending> in) throws MalformedControlStructureException {
            JumpTarget target = findTarget(stmt.getName(), false);
            if (target == null) {
                throw malformed(stmt, stmt.getName() == null ? "break outside loop or switch"
                        : "break to unknown label " + stmt.getName());
            }
            Draft block = absorb(stmt, in);
            target.breaks.add(new Pending(block, CFGEdgeKind.SEQUENTIAL));
            open = null;
            return List.of();
        }

        private List<Pending> continueStatement(AstNode stmt, List<Pending> in) throws MalformedControlStructureException {
            JumpTarget target = findTarget(stmt.getName(), true);
            if (target == null) {
                throw malformed(stmt, stmt.getName() == null ? "continue outside loop"
                        : "continue to unknown loop label " + stmt.getName());
            }
            Draft block = absorb(stmt, in);
            target.continues.add(new Pending(block, CFGEdgeKind.SEQUENTIAL));
            open = null;
            return List.of();
        }

        /**
         * Appends a simple statement to the open block. Inside a try with catch clauses a statement
         * that calls something may throw, so it closes its block with an exception edge.
         */
        private Draft absorb(AstNode stmt, List<Pending> in) {
            Draft block = openBlock(in);
            block.add(stmt);
            if (!handlers.isEmpty() && containsCall(stmt)) {
                block.kind = CFGNodeKind.EXCEPTION_EDGE_SOURCE;
                handlers.peek().raised.add(new Pending(block, CFGEdgeKind.EXCEPTION));
                open = null;
            }
            return block;
        }

        private Draft openBlock(List<Pending> in) {
            if (open != null && in.size() == 1 && in.get(0).from == open && in.get(0).kind == CFGEdgeKind.SEQUENTIAL) {
                return open;
            }
            Draft block = node(CFGNodeKind.BLOCK, null, "block");
            connect(in, block);
            open = block;
            return block;
        }

        private Draft decision(AstNode construct, AstNode condition, List<Pending> in) {
            Draft decision = node(CFGNodeKind.DECISION, construct.getId(), construct.getLabel());
            decision.contained.add(condition.getId());
            connect(in, decision);
            open = null;
            return decision;
        }

        // Sends an exception out of "source" to the innermost handler, or to the exit.
        private void raise(Draft source) {
            if (handlers.isEmpty()) {
                edge(source, exit, CFGEdgeKind.EXCEPTION);
            } else {
                handlers.peek().raised.add(new Pending(source, CFGEdgeKind.EXCEPTION));
            }
            if (open == source) {
                open = null;
            }
        }

        /**
         * Connects the body tail back to the loop header. Decision outcomes keep their branch kind,
         * so they go through a latch block that carries the single loop-back edge.
         */
        private void loopBack(List<Pending> tail, Draft header) {
            if (tail.isEmpty()) {
                return;
            }
            boolean plain = tail.stream().allMatch(p -> p.kind == CFGEdgeKind.SEQUENTIAL);
            if (plain) {
                for (Pending p : tail) {
                    edge(p.from, header, CFGEdgeKind.LOOP_BACK);
                }
                return;
            }
            Draft latch = node(CFGNodeKind.BLOCK, null, "loop-latch");
            connect(tail, latch);
            edge(latch, header, CFGEdgeKind.LOOP_BACK);
            open = null;
        }

        private JumpTarget push(String label, boolean loop) {
            return push(label, loop, true);
        }

        private JumpTarget push(String label, boolean loop, boolean breakable) {
            JumpTarget target = new JumpTarget(label, loop, breakable);
            jumpTargets.push(target);
            return target;
        }

        private JumpTarget findTarget(String label, boolean needLoop) {
            for (JumpTarget target : jumpTargets) {
                if (label == null) {
                    // Unlabeled break leaves the innermost loop or switch, continue the innermost loop.
                    if (!needLoop && target.breakable) return target;
                    if (needLoop && target.loop) return target;
                } else if (label.equals(target.label)) {
                    return needLoop && !target.loop ? null : target;
                }
            }
            return null;
        }

        private Draft node(CFGNodeKind kind, SourcePositionId source, String label) {
            Draft draft = new Draft(nodes.size(), kind, source, label);
            nodes.add(draft);
            return draft;
        }

        private void connect(List<Pending> in, Draft to) {
            for (Pending p : in) {
                edge(p.from, to, p.kind);
            }
        }

        private void edge(Draft from, Draft to, CFGEdgeKind kind) {
            edges.add(new CFGEdge(edges.size(), from.id, to.id, kind));
            if (from == open) {
                open = null;
            }
        }

        private MalformedControlStructureException malformed(AstNode at, String what) {
            return new MalformedControlStructureException(function,
                    function + ": " + what + " (" + at.getId() + ", line " + at.getStartLine() + ")");
        }
    }

    private static List<Pending> single(Draft from, CFGEdgeKind kind) {
        List<Pending> list = new ArrayList<>(1);
        list.add(new Pending(from, kind));
        return list;
    }

    private static List<Pending> concat(List<Pending> first, List<Pending> second) {
        List<Pending> all = new ArrayList<>(first);
        all.addAll(second);
        return all;
    }

    static boolean containsCall(AstNode node) {
        for (AstNode n : node.preorder()) {
            if (n.is(AstKind.CALL)) {
                return true;
            }
        }
        return false;
    }
}
