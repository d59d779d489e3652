package co.fanki.blueprintmcp.analysis.domain.ast;

/**
 * Visitor over the logical tree, one method per concrete node type.
 *
 * @param <T> the result type
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public interface AstVisitor<T> {

    // -- Statements -------------------------------------------------------

    T visitEvent(EventNode node);

    T visitAssignment(AssignmentNode node);

    T visitFunctionCall(FunctionCallNode node);

    T visitGenericCall(GenericCallNode node);

    T visitBranch(BranchNode node);

    T visitSequence(SequenceNode node);

    T visitSwitch(SwitchNode node);

    T visitLoop(LoopNode node);

    T visitLatentAction(LatentActionNode node);

    T visitEventSubscription(EventSubscriptionNode node);

    T visitVariableDeclaration(VariableDeclaration node);

    T visitReturn(ReturnNode node);

    T visitFallback(FallbackNode node);

    T visitTraversalBoundary(TraversalBoundaryNode node);

    // -- Expressions ------------------------------------------------------

    T visitLiteral(LiteralExpression node);

    T visitVariableGet(VariableGetExpression node);

    T visitFunctionCallExpression(FunctionCallExpression node);

    T visitPropertyAccess(PropertyAccessNode node);

    T visitCast(CastExpression node);

    T visitEventReference(EventReferenceExpression node);

    T visitLoopVariable(LoopVariableExpression node);

    T visitUnsupported(UnsupportedExpression node);

}
