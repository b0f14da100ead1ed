package ast;

import com.github.javaparser.JavaParser;
import com.github.javaparser.ParseProblemException;
import com.github.javaparser.ParseResult;
import com.github.javaparser.ParserConfiguration;
import com.github.javaparser.Range;
import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.body.CallableDeclaration;
import com.github.javaparser.ast.body.ConstructorDeclaration;
import com.github.javaparser.ast.body.MethodDeclaration;
import com.github.javaparser.ast.body.Parameter;
import com.github.javaparser.ast.body.TypeDeclaration;
import com.github.javaparser.ast.body.VariableDeclarator;
import com.github.javaparser.ast.expr.AssignExpr;
import com.github.javaparser.ast.expr.BinaryExpr;
import com.github.javaparser.ast.expr.ClassExpr;
import com.github.javaparser.ast.expr.ConditionalExpr;
import com.github.javaparser.ast.expr.EnclosedExpr;
import com.github.javaparser.ast.expr.Expression;
import com.github.javaparser.ast.expr.FieldAccessExpr;
import com.github.javaparser.ast.expr.LambdaExpr;
import com.github.javaparser.ast.expr.LiteralExpr;
import com.github.javaparser.ast.expr.MethodCallExpr;
import com.github.javaparser.ast.expr.NameExpr;
import com.github.javaparser.ast.expr.ObjectCreationExpr;
import com.github.javaparser.ast.expr.SuperExpr;
import com.github.javaparser.ast.expr.SwitchExpr;
import com.github.javaparser.ast.expr.ThisExpr;
import com.github.javaparser.ast.expr.UnaryExpr;
import com.github.javaparser.ast.expr.VariableDeclarationExpr;
import com.github.javaparser.ast.stmt.BlockStmt;
import com.github.javaparser.ast.stmt.BreakStmt;
import com.github.javaparser.ast.stmt.CatchClause;
import com.github.javaparser.ast.stmt.ContinueStmt;
import com.github.javaparser.ast.stmt.DoStmt;
import com.github.javaparser.ast.stmt.EmptyStmt;
import com.github.javaparser.ast.stmt.ExplicitConstructorInvocationStmt;
import com.github.javaparser.ast.stmt.ExpressionStmt;
import com.github.javaparser.ast.stmt.ForEachStmt;
import com.github.javaparser.ast.stmt.ForStmt;
import com.github.javaparser.ast.stmt.IfStmt;
import com.github.javaparser.ast.stmt.LabeledStmt;
import com.github.javaparser.ast.stmt.ReturnStmt;
import com.github.javaparser.ast.stmt.Statement;
import com.github.javaparser.ast.stmt.SwitchEntry;
import com.github.javaparser.ast.stmt.SwitchStmt;
import com.github.javaparser.ast.stmt.SynchronizedStmt;
import com.github.javaparser.ast.stmt.ThrowStmt;
import com.github.javaparser.ast.stmt.TryStmt;
import com.github.javaparser.ast.stmt.WhileStmt;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Lowers the methods and constructors of a Java compilation unit into {@link FunctionSource}s.
 *
 * Simple names that resolve, by lexical scope, to a parameter or to a local, catch or for-each
 * variable declared before them become NAME_REFs; any other simple name is treated as a field, or
 * as a type when it starts with an upper case letter. Lambdas, anonymous class bodies and switch expressions are not lowered statement by
 * statement: they become a single node whose children are the outer locals they read.
 */
public class JavaAstAdapter {
    private static final Logger logger = LoggerFactory.getLogger(JavaAstAdapter.class);

    private static final String CONSTRUCTOR = "<init>";

    private final SourcePositionRegistry registry;
    private final JavaParser parser;

    public JavaAstAdapter(SourcePositionRegistry registry) {
        this.registry = registry;
        this.parser = new JavaParser(new ParserConfiguration()
                .setLanguageLevel(ParserConfiguration.LanguageLevel.JAVA_17));
    }

    public List<FunctionSource> parse(Path file) throws IOException {
        String code = new String(Files.readAllBytes(file), StandardCharsets.UTF_8);
        return parse(code, file.toString());
    }

    /**
     * @throws ParseProblemException if the code does not parse
     */
    public List<FunctionSource> parse(String code, String path) {
        ParseResult<CompilationUnit> result = parser.parse(code);
        if (!result.isSuccessful() || !result.getResult().isPresent()) {
            throw new ParseProblemException(result.getProblems());
        }
        CompilationUnit cu = result.getResult().get();
        AstFactory factory = new AstFactory(registry, path);

        List<FunctionSource> functions = new ArrayList<>();
        for (CallableDeclaration<?> callable : cu.findAll(CallableDeclaration.class)) {
            // Members of anonymous classes have no stable owner.
            if (!(callable.getParentNode().orElse(null) instanceof TypeDeclaration)) {
                continue;
            }
            Optional<BlockStmt> body = bodyOf(callable);
            if (!body.isPresent()) {
                continue;
            }
            String owner = ownerOf(callable);
            String name = callable instanceof ConstructorDeclaration ? CONSTRUCTOR : callable.getNameAsString();
            String signature = callable.getParameters().stream()
                    .map(p -> p.getType().asString() + (p.isVarArgs() ? "..." : ""))
                    .collect(Collectors.joining(","));
            String qualifiedName = owner + "." + name + "(" + signature + ")";

            AstNode ast = new Lowering(factory, callable, body.get()).function(owner, name);
            functions.add(new FunctionSource(qualifiedName, owner, ast));
        }
        logger.info("Lowered {} function(s) from {}", functions.size(), path);
        return functions;
    }

    private static Optional<BlockStmt> bodyOf(CallableDeclaration<?> callable) {
        if (callable instanceof MethodDeclaration) {
            return ((MethodDeclaration) callable).getBody();
        }
        return Optional.of(((ConstructorDeclaration) callable).getBody());
    }

    private static String ownerOf(Node member) {
        List<String> names = new ArrayList<>();
        Optional<Node> current = member.getParentNode();
        while (current.isPresent()) {
            if (current.get() instanceof TypeDeclaration) {
                names.add(0, ((TypeDeclaration<?>) current.get()).getNameAsString());
            }
            current = current.get().getParentNode();
        }
        return String.join(".", names);
    }

    /** Lowers one function; holds the set of local names. */
    private static final class Lowering {
        private final AstFactory factory;
        private final CallableDeclaration<?> callable;
        private final BlockStmt body;
        private final Set<String> locals = new HashSet<>();

        Lowering(AstFactory factory, CallableDeclaration<?> callable, BlockStmt body) {
            this.factory = factory;
            this.callable = callable;
            this.body = body;
            for (Parameter parameter : callable.getParameters()) {
                locals.add(parameter.getNameAsString());
            }
            collectLocals(body, locals);
        }

        AstNode function(String owner, String name) {
            List<AstNode> parameters = new ArrayList<>();
            for (Parameter parameter : callable.getParameters()) {
                at(parameter);
                parameters.add(factory.parameter(parameter.getNameAsString()));
            }
            AstNode loweredBody = block(body);
            at(callable);
            AstNode fn = factory.function(owner, name, parameters, loweredBody);
            factory.clearPosition();
            return fn;
        }

        // Statements

        private AstNode block(BlockStmt block) {
            List<AstNode> statements = new ArrayList<>();
            for (Statement statement : block.getStatements()) {
                statements.addAll(statements(statement));
            }
            at(block);
            return factory.block(statements.toArray(new AstNode[0]));
        }

        private AstNode single(Statement statement) {
            List<AstNode> lowered = statements(statement);
            if (lowered.size() == 1) {
                return lowered.get(0);
            }
            at(statement);
            return factory.block(lowered.toArray(new AstNode[0]));
        }

        private List<AstNode> statements(Statement statement) {
            List<AstNode> out = new ArrayList<>();
            if (statement instanceof BlockStmt) {
                out.add(block((BlockStmt) statement));
            } else if (statement instanceof ExpressionStmt) {
                out.addAll(expressionStatements(((ExpressionStmt) statement).getExpression(), statement));
            } else if (statement instanceof IfStmt) {
                IfStmt s = (IfStmt) statement;
                AstNode condition = expression(s.getCondition());
                AstNode thenBranch = single(s.getThenStmt());
                AstNode elseBranch = s.getElseStmt().isPresent() ? single(s.getElseStmt().get()) : null;
                at(s);
                out.add(factory.ifStmt(condition, thenBranch, elseBranch));
            } else if (statement instanceof WhileStmt) {
                WhileStmt s = (WhileStmt) statement;
                AstNode condition = expression(s.getCondition());
                AstNode loopBody = single(s.getBody());
                at(s);
                out.add(factory.whileStmt(condition, loopBody));
            } else if (statement instanceof DoStmt) {
                DoStmt s = (DoStmt) statement;
                AstNode loopBody = single(s.getBody());
                AstNode condition = expression(s.getCondition());
                at(s);
                out.add(factory.doWhile(loopBody, condition));
            } else if (statement instanceof ForStmt) {
                out.add(forLoop((ForStmt) statement));
            } else if (statement instanceof ForEachStmt) {
                ForEachStmt s = (ForEachStmt) statement;
                AstNode iterable = expression(s.getIterable());
                AstNode loopBody = single(s.getBody());
                at(s);
                out.add(factory.forEach(s.getVariableDeclarator().getNameAsString(), iterable, loopBody));
            } else if (statement instanceof SwitchStmt) {
                out.add(switchStatement((SwitchStmt) statement));
            } else if (statement instanceof TryStmt) {
                out.addAll(tryStatement((TryStmt) statement));
            } else if (statement instanceof SynchronizedStmt) {
                SynchronizedStmt s = (SynchronizedStmt) statement;
                AstNode lock = expression(s.getExpression());
                AstNode lockedBody = block(s.getBody());
                at(s);
                out.add(factory.create(AstKind.SYNCHRONIZED).text("synchronized (" + lock.getLabel() + ")")
                        .child(lock).child(lockedBody).build());
            } else if (statement instanceof LabeledStmt) {
                LabeledStmt s = (LabeledStmt) statement;
                AstNode inner = single(s.getStatement());
                at(s);
                out.add(factory.labeled(s.getLabel().asString(), inner));
            } else if (statement instanceof ReturnStmt) {
                ReturnStmt s = (ReturnStmt) statement;
                AstNode value = s.getExpression().isPresent() ? expression(s.getExpression().get()) : null;
                at(s);
                out.add(factory.returnStmt(value));
            } else if (statement instanceof ThrowStmt) {
                ThrowStmt s = (ThrowStmt) statement;
                AstNode value = expression(s.getExpression());
                at(s);
                out.add(factory.throwStmt(value));
            } else if (statement instanceof BreakStmt) {
                BreakStmt s = (BreakStmt) statement;
                at(s);
                out.add(factory.breakStmt(s.getLabel().isPresent() ? s.getLabel().get().asString() : null));
            } else if (statement instanceof ContinueStmt) {
                ContinueStmt s = (ContinueStmt) statement;
                at(s);
                out.add(factory.continueStmt(s.getLabel().isPresent() ? s.getLabel().get().asString() : null));
            } else if (statement instanceof ExplicitConstructorInvocationStmt) {
                ExplicitConstructorInvocationStmt s = (ExplicitConstructorInvocationStmt) statement;
                List<AstNode> arguments = expressions(s.getArguments());
                at(s);
                AstNode receiver = factory.create(AstKind.EXPRESSION).text(s.isThis() ? "this" : "super").build();
                out.add(factory.stmt(factory.call(CONSTRUCTOR, receiver, arguments.toArray(new AstNode[0]))));
            } else if (statement instanceof EmptyStmt) {
                at(statement);
                out.add(factory.create(AstKind.EMPTY).build());
            } else {
                // assert, yield, local type declarations: keep the locals they read
                at(statement);
                out.add(factory.stmt(opaque(statement, statement.toString())));
            }
            return out;
        }

        private List<AstNode> expressionStatements(Expression expression, Node at) {
            List<AstNode> out = new ArrayList<>();
            if (expression instanceof VariableDeclarationExpr) {
                for (VariableDeclarator declarator : ((VariableDeclarationExpr) expression).getVariables()) {
                    AstNode initializer = declarator.getInitializer().isPresent()
                            ? expression(declarator.getInitializer().get()) : null;
                    at(declarator);
                    out.add(factory.local(declarator.getNameAsString(), initializer));
                }
                return out;
            }
            AstNode lowered = expression(expression);
            at(at);
            out.add(factory.stmt(lowered));
            return out;
        }

        private AstNode forLoop(ForStmt s) {
            List<AstNode> init = new ArrayList<>();
            for (Expression expression : s.getInitialization()) {
                init.addAll(expressionStatements(expression, expression));
            }
            AstNode condition = s.getCompare().isPresent() ? expression(s.getCompare().get()) : null;
            List<AstNode> update = new ArrayList<>();
            for (Expression expression : s.getUpdate()) {
                update.addAll(expressionStatements(expression, expression));
            }
            AstNode loopBody = single(s.getBody());
            at(s);
            return factory.forStmt(factory.block(init.toArray(new AstNode[0])), condition,
                    factory.block(update.toArray(new AstNode[0])), loopBody);
        }

        private AstNode switchStatement(SwitchStmt s) {
            AstNode selector = expression(s.getSelector());
            if (s.getEntries().isEmpty()) {
                at(s);
                return factory.stmt(selector);
            }
            List<AstNode> cases = new ArrayList<>();
            for (SwitchEntry entry : s.getEntries()) {
                boolean arrow = entry.getType() != SwitchEntry.Type.STATEMENT_GROUP;
                List<AstNode> statements = new ArrayList<>();
                for (Statement statement : entry.getStatements()) {
                    statements.addAll(statements(statement));
                }
                at(entry);
                AstNode[] body = statements.toArray(new AstNode[0]);
                if (entry.getLabels().isEmpty()) {
                    cases.add(factory.defaultClause(arrow, body));
                } else {
                    String labels = entry.getLabels().stream().map(Node::toString).collect(Collectors.joining(", "));
                    cases.add(factory.caseClause(labels, arrow, body));
                }
            }
            at(s);
            return factory.switchStmt(selector, cases.toArray(new AstNode[0]));
        }

        private List<AstNode> tryStatement(TryStmt s) {
            List<AstNode> resources = new ArrayList<>();
            for (Expression resource : s.getResources()) {
                resources.addAll(expressionStatements(resource, resource));
            }
            AstNode tryBody = block(s.getTryBlock());
            List<AstNode> bodyStatements = new ArrayList<>(resources);
            bodyStatements.add(tryBody);
            at(s.getTryBlock());
            AstNode guarded = resources.isEmpty() ? tryBody : factory.block(bodyStatements.toArray(new AstNode[0]));

            List<AstNode> catches = new ArrayList<>();
            for (CatchClause clause : s.getCatchClauses()) {
                AstNode handler = block(clause.getBody());
                at(clause);
                catches.add(factory.catchClause(clause.getParameter().getNameAsString(),
                        clause.getParameter().getType().asString(), handler));
            }
            AstNode finallyBlock = s.getFinallyBlock().isPresent() ? block(s.getFinallyBlock().get()) : null;

            List<AstNode> out = new ArrayList<>();
            if (catches.isEmpty() && finallyBlock == null) {
                // try-with-resources alone only scopes the resources
                out.add(guarded);
                return out;
            }
            at(s);
            out.add(factory.tryStmt(guarded, catches, finallyBlock));
            return out;
        }

        // Expressions

        private List<AstNode> expressions(List<Expression> expressions) {
            List<AstNode> out = new ArrayList<>();
            for (Expression expression : expressions) {
                out.add(expression(expression));
            }
            return out;
        }

        private AstNode expression(Expression e) {
            if (e instanceof EnclosedExpr) {
                return expression(((EnclosedExpr) e).getInner());
            }
            if (e instanceof NameExpr) {
                String name = ((NameExpr) e).getNameAsString();
                at(e);
                if (isLocal((NameExpr) e)) {
                    return factory.ref(name);
                }
                if (Character.isUpperCase(name.charAt(0))) {
                    return factory.create(AstKind.TYPE_REF).name(name).text(name).build();
                }
                return factory.field(name);
            }
            if (e instanceof FieldAccessExpr) {
                FieldAccessExpr f = (FieldAccessExpr) e;
                AstNode scope = expression(f.getScope());
                at(e);
                return factory.create(AstKind.FIELD_REF).name(f.getNameAsString()).text(e.toString()).child(scope).build();
            }
            if (e instanceof LiteralExpr) {
                at(e);
                return factory.literal(e.toString());
            }
            if (e instanceof ClassExpr) {
                at(e);
                return factory.create(AstKind.TYPE_REF).name(((ClassExpr) e).getType().asString()).text(e.toString()).build();
            }
            if (e instanceof ThisExpr || e instanceof SuperExpr) {
                at(e);
                return factory.create(AstKind.EXPRESSION).text(e instanceof ThisExpr ? "this" : "super").build();
            }
            if (e instanceof MethodCallExpr) {
                MethodCallExpr call = (MethodCallExpr) e;
                AstNode receiver = call.getScope().isPresent() ? expression(call.getScope().get()) : null;
                List<AstNode> arguments = expressions(call.getArguments());
                at(e);
                return factory.call(call.getNameAsString(), receiver, arguments.toArray(new AstNode[0]));
            }
            if (e instanceof AssignExpr) {
                AssignExpr assign = (AssignExpr) e;
                AstNode value = expression(assign.getValue());
                Expression target = assign.getTarget();
                if (target instanceof NameExpr && isLocal((NameExpr) target)) {
                    at(e);
                    return factory.assignment(((NameExpr) target).getNameAsString(), assign.getOperator().asString(), value);
                }
                AstNode lhs = expression(target);
                at(e);
                return factory.create(AstKind.EXPRESSION).text(e.toString()).child(lhs).child(value).build();
            }
            if (e instanceof UnaryExpr) {
                UnaryExpr unary = (UnaryExpr) e;
                Expression operand = unary.getExpression();
                boolean step = unary.getOperator().isPrefix() || unary.getOperator().isPostfix();
                boolean increment = step && unary.getOperator() != UnaryExpr.Operator.PLUS
                        && unary.getOperator() != UnaryExpr.Operator.MINUS
                        && unary.getOperator() != UnaryExpr.Operator.LOGICAL_COMPLEMENT
                        && unary.getOperator() != UnaryExpr.Operator.BITWISE_COMPLEMENT;
                if (increment && operand instanceof NameExpr && isLocal((NameExpr) operand)) {
                    at(e);
                    return factory.assignment(((NameExpr) operand).getNameAsString(), unary.getOperator().asString(), null);
                }
                AstNode lowered = expression(operand);
                at(e);
                return factory.op(unary.getOperator().asString(), lowered);
            }
            if (e instanceof BinaryExpr) {
                BinaryExpr binary = (BinaryExpr) e;
                AstNode left = expression(binary.getLeft());
                AstNode right = expression(binary.getRight());
                at(e);
                return factory.op(binary.getOperator().asString(), left, right);
            }
            if (e instanceof ConditionalExpr) {
                ConditionalExpr conditional = (ConditionalExpr) e;
                AstNode condition = expression(conditional.getCondition());
                AstNode then = expression(conditional.getThenExpr());
                AstNode otherwise = expression(conditional.getElseExpr());
                at(e);
                return factory.create(AstKind.OPERATOR).attribute("operator", "?:").text(e.toString())
                        .child(condition).child(then).child(otherwise).build();
            }
            if (e instanceof LambdaExpr) {
                Set<String> parameters = new HashSet<>();
                for (Parameter parameter : ((LambdaExpr) e).getParameters()) {
                    parameters.add(parameter.getNameAsString());
                }
                return captured(AstKind.LAMBDA, e, ((LambdaExpr) e).getBody(), parameters);
            }
            if (e instanceof SwitchExpr) {
                SwitchExpr switchExpr = (SwitchExpr) e;
                AstNode selector = expression(switchExpr.getSelector());
                AstNode arms = captured(AstKind.LAMBDA, e, switchExpr, new HashSet<>());
                at(e);
                return factory.create(AstKind.EXPRESSION).text(e.toString()).child(selector).child(arms).build();
            }
            if (e instanceof ObjectCreationExpr) {
                ObjectCreationExpr creation = (ObjectCreationExpr) e;
                List<AstNode> children = new ArrayList<>();
                if (creation.getScope().isPresent()) {
                    children.add(expression(creation.getScope().get()));
                }
                children.addAll(expressions(creation.getArguments()));
                if (creation.getAnonymousClassBody().isPresent()) {
                    children.add(captured(AstKind.LAMBDA, e, creation, new HashSet<>()));
                }
                at(e);
                return factory.create(AstKind.EXPRESSION).name("new " + creation.getType().getNameAsString())
                        .text(e.toString()).children(children).build();
            }
            return opaque(e, e.toString());
        }

        // Anything else keeps the shape of its child expressions.
        private AstNode opaque(Node node, String text) {
            List<AstNode> children = new ArrayList<>();
            for (Node child : node.getChildNodes()) {
                if (child instanceof Expression) {
                    children.add(expression((Expression) child));
                }
            }
            at(node);
            return factory.create(AstKind.EXPRESSION).text(text).children(children).build();
        }

        /**
         * A construct lowered as one node whose children are the outer locals read inside it.
         */
        private AstNode captured(AstKind kind, Node construct, Node inside, Set<String> ownNames) {
            Set<String> declaredInside = new HashSet<>(ownNames);
            collectLocals(inside, declaredInside);
            Set<String> reads = new LinkedHashSet<>();
            for (NameExpr name : inside.findAll(NameExpr.class)) {
                String id = name.getNameAsString();
                if (!declaredInside.contains(id) && isLocal(name)) {
                    reads.add(id);
                }
            }
            List<AstNode> refs = new ArrayList<>();
            for (String read : reads) {
                at(construct);
                refs.add(factory.ref(read));
            }
            at(construct);
            return factory.create(kind).text(construct.toString()).children(refs).build();
        }

        /**
         * Whether {@code name} reads a parameter or a local declared in an enclosing scope before
         * it; anything else is a field or a type.
         */
        private boolean isLocal(NameExpr name) {
            String id = name.getNameAsString();
            if (!locals.contains(id)) {
                return false;
            }
            Node child = name;
            Optional<Node> parent = name.getParentNode();
            while (parent.isPresent()) {
                Node scope = parent.get();
                if (scope instanceof CallableDeclaration) {
                    for (Parameter parameter : ((CallableDeclaration<?>) scope).getParameters()) {
                        if (parameter.getNameAsString().equals(id)) {
                            return true;
                        }
                    }
                    if (scope == callable) {
                        return false;
                    }
                } else if (declaresBefore(scope, child, id)) {
                    return true;
                }
                child = scope;
                parent = scope.getParentNode();
            }
            return false;
        }

        private void at(Node node) {
            Optional<Range> range = node.getRange();
            if (range.isPresent()) {
                Range r = range.get();
                factory.at(r.begin.line, r.begin.column, r.end.line, r.end.column);
            }
        }
    }

    /**
     * Whether {@code scope} declares {@code id} so that it is visible inside its part {@code child}.
     */
    static boolean declaresBefore(Node scope, Node child, String id) {
        if (scope instanceof BlockStmt) {
            return declaredAhead(((BlockStmt) scope).getStatements(), child, id);
        }
        if (scope instanceof SwitchEntry) {
            return declaredAhead(((SwitchEntry) scope).getStatements(), child, id);
        }
        if (scope instanceof SwitchStmt) {
            // Declarations of earlier statement groups stay in scope for later ones.
            for (SwitchEntry entry : ((SwitchStmt) scope).getEntries()) {
                if (entry == child) {
                    return false;
                }
                for (Statement statement : entry.getStatements()) {
                    if (declares(statement, id)) {
                        return true;
                    }
                }
            }
            return false;
        }
        if (scope instanceof VariableDeclarationExpr) {
            for (VariableDeclarator declarator : ((VariableDeclarationExpr) scope).getVariables()) {
                if (declarator == child) {
                    return false;
                }
                if (declarator.getNameAsString().equals(id)) {
                    return true;
                }
            }
            return false;
        }
        if (scope instanceof ForStmt) {
            for (Expression init : ((ForStmt) scope).getInitialization()) {
                if (init == child) {
                    return false;
                }
                if (init instanceof VariableDeclarationExpr && declares((VariableDeclarationExpr) init, id)) {
                    return true;
                }
            }
            return false;
        }
        if (scope instanceof ForEachStmt) {
            ForEachStmt s = (ForEachStmt) scope;
            return s.getBody() == child && s.getVariableDeclarator().getNameAsString().equals(id);
        }
        if (scope instanceof CatchClause) {
            CatchClause clause = (CatchClause) scope;
            return clause.getBody() == child && clause.getParameter().getNameAsString().equals(id);
        }
        if (scope instanceof TryStmt) {
            TryStmt s = (TryStmt) scope;
            boolean inResources = false;
            for (Expression resource : s.getResources()) {
                if (resource == child) {
                    inResources = true;
                    break;
                }
            }
            if (!inResources && s.getTryBlock() != child) {
                return false;
            }
            for (Expression resource : s.getResources()) {
                if (resource == child) {
                    return false;
                }
                if (resource instanceof VariableDeclarationExpr && declares((VariableDeclarationExpr) resource, id)) {
                    return true;
                }
            }
        }
        return false;
    }

    private static boolean declaredAhead(List<Statement> statements, Node child, String id) {
        for (Statement statement : statements) {
            if (statement == child) {
                return false;
            }
            if (declares(statement, id)) {
                return true;
            }
        }
        return false;
    }

    private static boolean declares(Statement statement, String id) {
        return statement instanceof ExpressionStmt
                && ((ExpressionStmt) statement).getExpression() instanceof VariableDeclarationExpr
                && declares((VariableDeclarationExpr) ((ExpressionStmt) statement).getExpression(), id);
    }

    private static boolean declares(VariableDeclarationExpr declaration, String id) {
        for (VariableDeclarator declarator : declaration.getVariables()) {
            if (declarator.getNameAsString().equals(id)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Names declared in {@code root}, not descending into lambdas, switch expressions, anonymous
     * classes or local types, whose declarations are not lowered.
     */
    static void collectLocals(Node root, Set<String> out) {
        for (Node child : root.getChildNodes()) {
            if (child instanceof LambdaExpr || child instanceof SwitchExpr || child instanceof TypeDeclaration
                    || (child instanceof ObjectCreationExpr && ((ObjectCreationExpr) child).getAnonymousClassBody().isPresent())) {
                continue;
            }
            if (child instanceof VariableDeclarator) {
                out.add(((VariableDeclarator) child).getNameAsString());
            } else if (child instanceof CatchClause) {
                out.add(((CatchClause) child).getParameter().getNameAsString());
            }
            collectLocals(child, out);
        }
    }
}
