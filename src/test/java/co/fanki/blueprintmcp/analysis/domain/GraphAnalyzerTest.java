package co.fanki.blueprintmcp.analysis.domain;

import co.fanki.blueprintmcp.Fixtures;
import co.fanki.blueprintmcp.analysis.domain.ast.Argument;
import co.fanki.blueprintmcp.analysis.domain.ast.AssignmentNode;
import co.fanki.blueprintmcp.analysis.domain.ast.BranchNode;
import co.fanki.blueprintmcp.analysis.domain.ast.CallbackBlock;
import co.fanki.blueprintmcp.analysis.domain.ast.CaseBlock;
import co.fanki.blueprintmcp.analysis.domain.ast.CastExpression;
import co.fanki.blueprintmcp.analysis.domain.ast.EventNode;
import co.fanki.blueprintmcp.analysis.domain.ast.EventReferenceExpression;
import co.fanki.blueprintmcp.analysis.domain.ast.EventSubscriptionNode;
import co.fanki.blueprintmcp.analysis.domain.ast.FallbackNode;
import co.fanki.blueprintmcp.analysis.domain.ast.FunctionCallExpression;
import co.fanki.blueprintmcp.analysis.domain.ast.FunctionCallNode;
import co.fanki.blueprintmcp.analysis.domain.ast.GenericCallNode;
import co.fanki.blueprintmcp.analysis.domain.ast.LatentActionNode;
import co.fanki.blueprintmcp.analysis.domain.ast.LiteralExpression;
import co.fanki.blueprintmcp.analysis.domain.ast.LoopNode;
import co.fanki.blueprintmcp.analysis.domain.ast.LoopVariableExpression;
import co.fanki.blueprintmcp.analysis.domain.ast.SequenceNode;
import co.fanki.blueprintmcp.analysis.domain.ast.Statement;
import co.fanki.blueprintmcp.analysis.domain.ast.SwitchNode;
import co.fanki.blueprintmcp.analysis.domain.ast.TraversalBoundaryNode;
import co.fanki.blueprintmcp.analysis.domain.ast.UnsupportedExpression;
import co.fanki.blueprintmcp.analysis.domain.ast.VariableDeclaration;
import co.fanki.blueprintmcp.analysis.domain.ast.VariableGetExpression;
import co.fanki.blueprintmcp.analysis.domain.processor.FallbackProcessor;
import co.fanki.blueprintmcp.analysis.domain.processor.StandardProcessors;
import co.fanki.blueprintmcp.graph.domain.BlueprintGraph;
import co.fanki.blueprintmcp.graph.domain.GraphBuilder;
import co.fanki.blueprintmcp.graph.domain.GraphNode;
import co.fanki.blueprintmcp.parsing.domain.RawObjectParser;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Unit tests for {@link GraphAnalyzer}, driven by the blueprint fixtures.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
class GraphAnalyzerTest {

    private GraphAnalyzer analyzer;

    @BeforeEach
    void setUp() {
        analyzer = new GraphAnalyzer(StandardProcessors.create(),
                GraphAnalyzer.DEFAULT_MAX_NODE_VISITS);
    }

    private static BlueprintGraph graph(final String fixture) {
        return new GraphBuilder().build(new RawObjectParser().parse(
                Fixtures.load(fixture)));
    }

    private List<Statement> body(final String fixture) {
        final List<Statement> roots = analyzer.analyze(graph(fixture));
        final EventNode event = assertInstanceOf(EventNode.class,
                roots.get(0));
        return event.body().statements();
    }

    // -- Entries ----------------------------------------------------------

    @Test
    void whenAnalyzing_givenNullGraph_shouldThrowException() {
        assertThrows(IllegalArgumentException.class,
                () -> analyzer.analyze(null));
    }

    @Test
    void whenAnalyzing_givenEngineEvent_shouldStripReceivePrefix() {
        final List<Statement> roots = analyzer.analyze(
                graph("set_health.txt"));

        assertEquals(1, roots.size());
        final EventNode event = (EventNode) roots.get(0);
        assertEquals("BeginPlay", event.eventName());
        assertTrue(event.parameters().isEmpty());
        assertEquals("K2Node_Event_0", event.location().nodeName());
    }

    @Test
    void whenAnalyzing_givenEventWithOutputs_shouldExposeParameters() {
        final EventNode event = (EventNode) analyzer.analyze(
                graph("exec_cycle.txt")).get(0);

        assertEquals("Tick", event.eventName());
        assertEquals(List.of("DeltaSeconds"), event.parameters().stream()
                .map(EventNode.Parameter::name).toList());
    }

    @Test
    void whenAnalyzing_givenOnlyUnknownNodes_shouldReturnNoStatements() {
        assertTrue(analyzer.analyze(graph("only_unknown.txt")).isEmpty());
    }

    @Test
    void whenAnalyzing_givenSameGraphTwice_shouldProduceEqualTrees() {
        final BlueprintGraph graph = graph("shared_location.txt");

        assertEquals(analyzer.analyze(graph), analyzer.analyze(graph));
    }

    // -- Statements -------------------------------------------------------

    @Test
    void whenAnalyzing_givenVariableSet_shouldProduceAssignment() {
        final List<Statement> body = body("set_health.txt");

        assertEquals(1, body.size());
        final AssignmentNode assignment = assertInstanceOf(
                AssignmentNode.class, body.get(0));
        final VariableGetExpression target = assertInstanceOf(
                VariableGetExpression.class, assignment.target());
        assertEquals("Health", target.name());
    }

    @Test
    void whenAnalyzing_givenPureOutputReadTwice_shouldExtractOneTemporary() {
        final List<Statement> body = body("shared_location.txt");

        assertEquals(3, body.size());
        final VariableDeclaration declaration = assertInstanceOf(
                VariableDeclaration.class, body.get(0));
        assertEquals("temp_getactorlocation", declaration.name());
        assertEquals(VariableDeclaration.Kind.TEMPORARY, declaration.kind());
        assertEquals(1, body.stream()
                .filter(VariableDeclaration.class::isInstance).count());

        final AssignmentNode second = (AssignmentNode) body.get(2);
        final VariableGetExpression value = assertInstanceOf(
                VariableGetExpression.class, second.value());
        assertEquals("temp_getactorlocation", value.name());
    }

    @Test
    void whenAnalyzing_givenPureOutputReadInBothArms_shouldDeclareItOnce() {
        final List<Statement> body = body("branch_shared_location.txt");

        assertEquals(2, body.size());
        final VariableDeclaration declaration = assertInstanceOf(
                VariableDeclaration.class, body.get(0));
        assertEquals("temp_getactorlocation", declaration.name());
        assertEquals(VariableDeclaration.Kind.TEMPORARY, declaration.kind());

        final BranchNode branch = assertInstanceOf(BranchNode.class,
                body.get(1));
        final AssignmentNode spawn = assertInstanceOf(AssignmentNode.class,
                branch.trueBranch().statements().get(0));
        final AssignmentNode last = assertInstanceOf(AssignmentNode.class,
                branch.falseBranch().statements().get(0));
        assertEquals(1, branch.trueBranch().statements().size());
        assertEquals(1, branch.falseBranch().statements().size());
        assertEquals("temp_getactorlocation",
                ((VariableGetExpression) spawn.value()).name());
        assertEquals("temp_getactorlocation",
                ((VariableGetExpression) last.value()).name());
    }

    @Test
    void whenAnalyzing_givenPureOutputReadOnce_shouldInlineIt() {
        final BranchNode branch = assertInstanceOf(BranchNode.class,
                body("branch_aliases.txt").get(0));

        final AssignmentNode opened = assertInstanceOf(AssignmentNode.class,
                branch.trueBranch().statements().get(0));
        final FunctionCallExpression call = assertInstanceOf(
                FunctionCallExpression.class, opened.value());
        assertEquals("GetGameTimeInSeconds", call.functionName());
    }

    @Test
    void whenCountingUsage_givenOutputFeedingTwoInputs_shouldCountBoth() {
        final Map<String, Integer> usage = GraphAnalyzer.countPinUsage(
                graph("shared_location.txt"));

        assertEquals(2, usage.get("5E0000000000000000000000000000FF:"
                + "5E000000000000000000000000000002"));
    }

    @Test
    void whenAnalyzing_givenInterfaceMessage_shouldUseGenericCall() {
        final List<Statement> body = body("generic_message.txt");

        final GenericCallNode call = assertInstanceOf(GenericCallNode.class,
                body.get(0));
        assertEquals("Interact", call.functionName());
        assertEquals("Door",
                ((VariableGetExpression) call.target()).name());
        assertEquals(List.of("Strength"), call.arguments().stream()
                .map(a -> a.name()).toList());
    }

    @Test
    void whenAnalyzing_givenUnknownNode_shouldFallBackAndContinue() {
        final List<Statement> body = body("unknown_node.txt");

        assertEquals(2, body.size());
        final FallbackNode fallback = assertInstanceOf(FallbackNode.class,
                body.get(0));
        assertEquals("K2Node_Timeline", fallback.nodeKind());
        assertEquals("K2Node_Timeline_0", fallback.nodeName());
        assertEquals("\"DoorTimeline\"",
                fallback.properties().get("TimelineName"));
        final FunctionCallNode print = assertInstanceOf(
                FunctionCallNode.class, body.get(1));
        assertEquals("PrintString", print.functionName());
    }

    @Test
    void whenAnalyzing_givenDelegateBinding_shouldSubscribeHandler() {
        final List<Statement> roots = analyzer.analyze(
                graph("bind_click.txt"));

        assertEquals(2, roots.size());
        final EventSubscriptionNode subscription = assertInstanceOf(
                EventSubscriptionNode.class,
                ((EventNode) roots.get(0)).body().statements().get(0));
        assertEquals("OnClicked", subscription.delegateName());
        assertEquals("+=", subscription.operator());
        assertEquals("HandlePlayClicked", ((EventReferenceExpression)
                subscription.handler()).eventName());
        assertEquals("HandlePlayClicked",
                ((EventNode) roots.get(1)).eventName());
    }

    @Test
    void whenAnalyzing_givenForEachMacro_shouldBuildLoopWithScopedElement() {
        final List<Statement> body = body("for_each.txt");

        assertEquals(2, body.size());
        final LoopNode loop = assertInstanceOf(LoopNode.class, body.get(0));
        assertEquals(LoopNode.Kind.FOR_EACH, loop.kind());
        assertEquals(List.of("ArrayElement", "ArrayIndex"), loop.variables()
                .stream().map(VariableDeclaration::name).toList());

        final FunctionCallNode open = assertInstanceOf(FunctionCallNode.class,
                loop.body().statements().get(0));
        assertInstanceOf(LoopVariableExpression.class, open.target());
        assertEquals("PrintString",
                ((FunctionCallNode) body.get(1)).functionName());
    }

    // -- Control flow -----------------------------------------------------

    @Test
    void whenAnalyzing_givenBranchWithTrueFalsePins_shouldFillBothArms() {
        final List<Statement> body = body("branch_aliases.txt");

        assertEquals(1, body.size());
        final BranchNode branch = assertInstanceOf(BranchNode.class,
                body.get(0));
        assertEquals("bOpen",
                ((VariableGetExpression) branch.condition()).name());
        assertEquals(1, branch.trueBranch().statements().size());
        final FunctionCallNode print = assertInstanceOf(
                FunctionCallNode.class,
                branch.falseBranch().statements().get(0));
        assertEquals("PrintString", print.functionName());
    }

    @Test
    void whenAnalyzing_givenBranchWithThenElsePins_shouldFillBothArms() {
        final BranchNode branch = assertInstanceOf(BranchNode.class,
                body("branch_shared_location.txt").get(1));

        assertInstanceOf(LiteralExpression.class, branch.condition());
        assertEquals("SpawnLocation", ((VariableGetExpression)
                ((AssignmentNode) branch.trueBranch().statements().get(0))
                        .target()).name());
        assertEquals("LastLocation", ((VariableGetExpression)
                ((AssignmentNode) branch.falseBranch().statements().get(0))
                        .target()).name());
    }

    @Test
    void whenAnalyzing_givenInputLinkedToMissingNode_shouldMarkUnsupported() {
        final BranchNode branch = assertInstanceOf(BranchNode.class,
                body("branch_aliases.txt").get(0));
        final FunctionCallNode print = (FunctionCallNode)
                branch.falseBranch().statements().get(0);

        assertEquals("InString", print.arguments().get(0).name());
        final UnsupportedExpression missing = assertInstanceOf(
                UnsupportedExpression.class,
                print.arguments().get(0).value());
        assertTrue(missing.reason().contains("InString"));
    }

    @Test
    void whenAnalyzing_givenLatentAction_shouldScopePayloadToCallback() {
        final List<Statement> body = body("latent_payload.txt");

        assertEquals(2, body.size());
        final LatentActionNode latent = assertInstanceOf(
                LatentActionNode.class, body.get(0));
        assertEquals("WaitGameplayEvent", latent.call().functionName());
        assertEquals(List.of("EventTag"), latent.call().arguments().stream()
                .map(Argument::name).toList());

        assertEquals(1, latent.callbacks().size());
        final CallbackBlock callback = latent.callbacks().get(0);
        assertEquals("EventReceived", callback.triggerName());
        assertEquals(List.of("Payload"), callback.payload().stream()
                .map(VariableDeclaration::name).toList());
        final AssignmentNode inside = assertInstanceOf(AssignmentNode.class,
                callback.body().statements().get(0));
        assertEquals("Payload",
                ((VariableGetExpression) inside.value()).name());

        final AssignmentNode after = assertInstanceOf(AssignmentNode.class,
                body.get(1));
        assertEquals("StalePayload",
                ((VariableGetExpression) after.target()).name());
        assertInstanceOf(UnsupportedExpression.class, after.value());
    }

    @Test
    void whenAnalyzing_givenSequence_shouldOrderStepsByIndex() {
        final List<Statement> body = body("sequence.txt");

        assertEquals(1, body.size());
        final SequenceNode sequence = assertInstanceOf(SequenceNode.class,
                body.get(0));
        assertEquals(List.of("then_0", "then_1"), sequence.steps().stream()
                .map(CaseBlock::label).toList());
        assertEquals("First", printed(sequence.steps().get(0)));
        assertEquals("Second", printed(sequence.steps().get(1)));
    }

    @Test
    void whenAnalyzing_givenIntegerSwitch_shouldKeepLinkedCasesOnly() {
        final List<Statement> body = body("switch_level.txt");

        assertEquals(1, body.size());
        final SwitchNode switchNode = assertInstanceOf(SwitchNode.class,
                body.get(0));
        assertEquals("Level",
                ((VariableGetExpression) switchNode.selector()).name());
        assertEquals(List.of("1", "Default"), switchNode.cases().stream()
                .map(CaseBlock::label).toList());
        assertEquals("One", printed(switchNode.cases().get(0)));
        assertEquals("Other", printed(switchNode.cases().get(1)));
    }

    @Test
    void whenAnalyzing_givenImpureCast_shouldDeclareResultInSuccessArm() {
        final List<Statement> body = body("cast_door.txt");

        assertEquals(1, body.size());
        final BranchNode branch = assertInstanceOf(BranchNode.class,
                body.get(0));
        final CastExpression cast = assertInstanceOf(CastExpression.class,
                branch.condition());
        assertEquals("BP_Door", cast.targetType());
        assertEquals("Target",
                ((VariableGetExpression) cast.source()).name());

        final List<Statement> success = branch.trueBranch().statements();
        assertEquals(2, success.size());
        final VariableDeclaration result = assertInstanceOf(
                VariableDeclaration.class, success.get(0));
        assertEquals("AsBPDoor", result.name());
        assertEquals(VariableDeclaration.Kind.CAST, result.kind());
        final FunctionCallNode open = assertInstanceOf(FunctionCallNode.class,
                success.get(1));
        assertEquals("Open", open.functionName());
        assertEquals("AsBPDoor",
                ((VariableGetExpression) open.target()).name());

        final FunctionCallNode failed = assertInstanceOf(
                FunctionCallNode.class,
                branch.falseBranch().statements().get(0));
        assertEquals("Not a door", ((LiteralExpression)
                failed.arguments().get(0).value()).value());
    }

    private static String printed(final CaseBlock block) {
        final FunctionCallNode print = assertInstanceOf(
                FunctionCallNode.class, block.body().statements().get(0));
        return ((LiteralExpression) print.arguments().get(0).value())
                .value();
    }

    // -- Traversal guards -------------------------------------------------

    @Test
    void whenAnalyzing_givenExecCycle_shouldStopAtBoundary() {
        final List<Statement> body = body("exec_cycle.txt");

        assertEquals(3, body.size());
        final TraversalBoundaryNode boundary = assertInstanceOf(
                TraversalBoundaryNode.class, body.get(2));
        assertEquals(TraversalBoundaryNode.Reason.CYCLE, boundary.reason());
        assertEquals("K2Node_CallFunction_0", boundary.targetNodeName());
    }

    @Test
    void whenAnalyzing_givenTinyBudget_shouldStopWithBudgetBoundary() {
        final GraphAnalyzer limited = new GraphAnalyzer(
                StandardProcessors.create(), 1);

        final EventNode event = (EventNode) limited.analyze(
                graph("set_health.txt")).get(0);

        final TraversalBoundaryNode boundary = assertInstanceOf(
                TraversalBoundaryNode.class,
                event.body().statements().get(0));
        assertEquals(TraversalBoundaryNode.Reason.BUDGET_EXHAUSTED,
                boundary.reason());
        assertEquals("K2Node_VariableSet_0", boundary.targetNodeName());
    }

    @Test
    void whenAnalyzing_givenProcessorReturningNothing_shouldThrow() {
        final NodeProcessor broken = new NodeProcessor() {
            @Override
            public NodeProcessingResult processStatement(
                    final GraphAnalyzer theAnalyzer,
                    final AnalysisContext context, final GraphNode node) {
                return null;
            }
        };
        final ProcessorRegistry registry = ProcessorRegistry.builder()
                .register(broken, "K2Node_Event")
                .fallback(new FallbackProcessor())
                .build();

        final GraphAnalyzer strict = new GraphAnalyzer(registry, 100);

        assertThrows(ProcessorContractException.class,
                () -> strict.analyze(graph("set_health.txt")));
    }

    // -- Dispatch ---------------------------------------------------------

    @Test
    void whenResolvingTier_givenNodeKinds_shouldPickMostSpecificTier() {
        final BlueprintGraph graph = graph("generic_message.txt");
        final ProcessorRegistry registry = analyzer.registry();

        final GraphNode message = graph.node(
                "720000000000000000000000000000FF").orElseThrow();
        final GraphNode get = graph.node(
                "730000000000000000000000000000FF").orElseThrow();
        final GraphNode timeline = graph("unknown_node.txt").node(
                "820000000000000000000000000000FF").orElseThrow();

        assertEquals(ProcessorRegistry.Tier.GENERIC,
                registry.tierOf(message));
        assertEquals(ProcessorRegistry.Tier.SPECIALIZED,
                registry.tierOf(get));
        assertEquals(ProcessorRegistry.Tier.FALLBACK,
                registry.tierOf(timeline));
    }

    @Test
    void whenDescribing_givenStandardRegistry_shouldListSpecializedKinds() {
        final Map<String, String> description = analyzer.registry()
                .describe();

        assertEquals("VariableSetProcessor",
                description.get("K2Node_VariableSet"));
        assertEquals("LoopMacroProcessor",
                description.get("K2Node_MacroInstance:ForEachLoop"));
    }

}
