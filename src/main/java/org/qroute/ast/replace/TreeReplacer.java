package org.qroute.ast.replace;

import org.qroute.ast.BarrierGate;
import org.qroute.ast.BinaryExpr;
import org.qroute.ast.CNOTGate;
import org.qroute.ast.DeclaredGate;
import org.qroute.ast.Expr;
import org.qroute.ast.Gate;
import org.qroute.ast.GateDecl;
import org.qroute.ast.IfStmt;
import org.qroute.ast.MeasureStmt;
import org.qroute.ast.Program;
import org.qroute.ast.QuantumOp;
import org.qroute.ast.ResetStmt;
import org.qroute.ast.Stmt;
import org.qroute.ast.UGate;
import org.qroute.ast.UnaryExpr;
import org.qroute.ast.VarAccess;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Order-preserving, copy-on-change tree rewriter.
 *
 * <p>Traversal contract:</p>
 * <ul>
 * <li>Top-level statements are visited in declaration order, each one completely
 * (children, then the statement itself) before the next.</li>
 * <li>Composite nodes are visited post-order: register references and parameter
 * expressions first (left to right), gate declaration bodies statement by statement,
 * the operation under an {@code if} before the {@code if} itself.</li>
 * <li>Nodes produced by a replacement are spliced in place and never revisited.</li>
 * <li>A statement the transformation declines to descend into is offered as is;
 * nothing inside it is visited.</li>
 * <li>A node whose children are all unchanged is reused, not copied.</li>
 * </ul>
 *
 * <p>This class is NOT thread-safe: the transformation usually carries mutable state
 * that depends on visit order.</p>
 */
public final class TreeReplacer {
    private final Transformation transformation;

    /**
     * Creates an engine driving the given rules.
     *
     * @param transformation per-node rewrite rules.
     */
    public TreeReplacer(Transformation transformation) {
        this.transformation = Objects.requireNonNull(transformation, "transformation");
    }

    /**
     * Rewrites the program's top-level statement list in place.
     *
     * @param program program to rewrite.
     * @throws IllegalStateException when a rule breaks a structural invariant.
     */
    public void rewrite(Program program) {
        Objects.requireNonNull(program, "program");
        List<Stmt> body = program.body();
        List<Stmt> rewritten = rewriteSequence(body, Stmt.class, "program body");
        if (rewritten != body) {
            body.clear();
            body.addAll(rewritten);
        }
    }

    /**
     * Rewrites a statement sequence, returning the same instance when nothing changed.
     */
    private <T extends Stmt> List<T> rewriteSequence(List<T> sequence, Class<T> allowed, String context) {
        List<T> result = new ArrayList<>(sequence.size());
        boolean changed = false;
        for (T stmt : sequence) {
            Stmt withChildren = transformation.descendInto(stmt) ? rewriteChildren(stmt) : stmt;
            Replacement<Stmt> decision = Objects.requireNonNull(
                    transformation.replaceStmt(withChildren),
                    "transformation returned null for " + withChildren.kind()
            );
            switch (decision.kind()) {
                case KEEP -> {
                    result.add(allowed.cast(withChildren));
                    changed |= withChildren != stmt;
                }
                case ONE, MANY -> {
                    for (Stmt node : decision.nodes()) {
                        result.add(requireAllowed(node, allowed, context));
                    }
                    changed = true;
                }
                case REMOVE -> changed = true;
            }
        }
        return changed ? result : sequence;
    }

    private Stmt rewriteChildren(Stmt stmt) {
        return switch (stmt.kind()) {
            case REGISTER_DECL, ANCILLA_DECL, ORACLE_DECL -> stmt;
            case GATE_DECL -> {
                GateDecl decl = (GateDecl) stmt;
                List<Gate> body = rewriteSequence(decl.body(), Gate.class, "gate declaration body");
                yield body == decl.body() ? decl : decl.withBody(body);
            }
            case CNOT_GATE -> {
                CNOTGate cnot = (CNOTGate) stmt;
                VarAccess ctrl = rewriteAccess(cnot.ctrl());
                VarAccess tgt = rewriteAccess(cnot.tgt());
                yield ctrl == cnot.ctrl() && tgt == cnot.tgt() ? cnot : new CNOTGate(cnot.pos(), ctrl, tgt);
            }
            case U_GATE -> {
                UGate u = (UGate) stmt;
                Expr theta = rewriteExpr(u.theta());
                Expr phi = rewriteExpr(u.phi());
                Expr lambda = rewriteExpr(u.lambda());
                VarAccess arg = rewriteAccess(u.arg());
                boolean same = theta == u.theta() && phi == u.phi() && lambda == u.lambda() && arg == u.arg();
                yield same ? u : new UGate(u.pos(), theta, phi, lambda, arg);
            }
            case BARRIER_GATE -> {
                BarrierGate barrier = (BarrierGate) stmt;
                List<VarAccess> args = rewriteAccesses(barrier.args());
                yield args == barrier.args() ? barrier : new BarrierGate(barrier.pos(), args);
            }
            case DECLARED_GATE -> {
                DeclaredGate gate = (DeclaredGate) stmt;
                List<Expr> classicalArgs = rewriteExprs(gate.classicalArgs());
                List<VarAccess> quantumArgs = rewriteAccesses(gate.quantumArgs());
                boolean same = classicalArgs == gate.classicalArgs() && quantumArgs == gate.quantumArgs();
                yield same ? gate : new DeclaredGate(gate.pos(), gate.name(), classicalArgs, quantumArgs);
            }
            case MEASURE -> {
                MeasureStmt measure = (MeasureStmt) stmt;
                VarAccess qArg = rewriteAccess(measure.qArg());
                VarAccess cArg = rewriteAccess(measure.cArg());
                boolean same = qArg == measure.qArg() && cArg == measure.cArg();
                yield same ? measure : new MeasureStmt(measure.pos(), qArg, cArg);
            }
            case RESET -> {
                ResetStmt reset = (ResetStmt) stmt;
                VarAccess arg = rewriteAccess(reset.arg());
                yield arg == reset.arg() ? reset : new ResetStmt(reset.pos(), arg);
            }
            case IF -> {
                IfStmt ifStmt = (IfStmt) stmt;
                // rewriteChildren preserves the node kind, so the cast cannot fail
                QuantumOp then = (QuantumOp) rewriteChildren(ifStmt.then());
                yield then == ifStmt.then() ? ifStmt : ifStmt.withThen(then);
            }
        };
    }

    private List<VarAccess> rewriteAccesses(List<VarAccess> accesses) {
        List<VarAccess> result = new ArrayList<>(accesses.size());
        boolean changed = false;
        for (VarAccess access : accesses) {
            VarAccess rewritten = rewriteAccess(access);
            changed |= rewritten != access;
            result.add(rewritten);
        }
        return changed ? result : accesses;
    }

    private VarAccess rewriteAccess(VarAccess access) {
        Replacement<VarAccess> decision = Objects.requireNonNull(
                transformation.replaceAccess(access),
                "transformation returned null for access " + access
        );
        return switch (decision.kind()) {
            case KEEP -> access;
            case ONE -> decision.single();
            case MANY, REMOVE -> throw new IllegalStateException(
                    "register reference " + access + " can only be kept or replaced by one node, got "
                            + decision.kind());
        };
    }

    private List<Expr> rewriteExprs(List<Expr> exprs) {
        List<Expr> result = new ArrayList<>(exprs.size());
        boolean changed = false;
        for (Expr expr : exprs) {
            Expr rewritten = rewriteExpr(expr);
            changed |= rewritten != expr;
            result.add(rewritten);
        }
        return changed ? result : exprs;
    }

    private Expr rewriteExpr(Expr expr) {
        Expr withChildren = switch (expr.kind()) {
            case INT, REAL, PI, VAR -> expr;
            case BINARY -> {
                BinaryExpr binary = (BinaryExpr) expr;
                Expr lexp = rewriteExpr(binary.lexp());
                Expr rexp = rewriteExpr(binary.rexp());
                boolean same = lexp == binary.lexp() && rexp == binary.rexp();
                yield same ? binary : new BinaryExpr(binary.pos(), lexp, binary.op(), rexp);
            }
            case UNARY -> {
                UnaryExpr unary = (UnaryExpr) expr;
                Expr subexp = rewriteExpr(unary.subexp());
                yield subexp == unary.subexp() ? unary : new UnaryExpr(unary.pos(), unary.op(), subexp);
            }
        };
        Replacement<Expr> decision = Objects.requireNonNull(
                transformation.replaceExpr(withChildren),
                "transformation returned null for expression " + withChildren
        );
        return switch (decision.kind()) {
            case KEEP -> withChildren;
            case ONE -> decision.single();
            case MANY, REMOVE -> throw new IllegalStateException(
                    "expression " + withChildren + " can only be kept or replaced by one node, got "
                            + decision.kind());
        };
    }

    private static <T extends Stmt> T requireAllowed(Stmt node, Class<T> allowed, String context) {
        if (!allowed.isInstance(node)) {
            throw new IllegalStateException(
                    node.kind() + " is not allowed in a " + context);
        }
        return allowed.cast(node);
    }
}
