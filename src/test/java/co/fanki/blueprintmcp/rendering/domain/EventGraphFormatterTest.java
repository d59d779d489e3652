package co.fanki.blueprintmcp.rendering.domain;

import co.fanki.blueprintmcp.Fixtures;
import co.fanki.blueprintmcp.analysis.domain.GraphAnalyzer;
import co.fanki.blueprintmcp.analysis.domain.ast.AssignmentNode;
import co.fanki.blueprintmcp.analysis.domain.ast.BranchNode;
import co.fanki.blueprintmcp.analysis.domain.ast.EventNode;
import co.fanki.blueprintmcp.analysis.domain.ast.ExecutionBlock;
import co.fanki.blueprintmcp.analysis.domain.ast.LiteralExpression.LiteralType;
import co.fanki.blueprintmcp.analysis.domain.ast.LiteralExpression;
import co.fanki.blueprintmcp.analysis.domain.ast.SourceLocation;
import co.fanki.blueprintmcp.analysis.domain.ast.Statement;
import co.fanki.blueprintmcp.analysis.domain.ast.VariableGetExpression;
import co.fanki.blueprintmcp.analysis.domain.processor.StandardProcessors;
import co.fanki.blueprintmcp.graph.domain.BlueprintGraph;
import co.fanki.blueprintmcp.graph.domain.GraphBuilder;
import co.fanki.blueprintmcp.parsing.domain.RawObjectParser;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Unit tests for {@link EventGraphFormatter}.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
class EventGraphFormatterTest {

    private static String render(final String fixture,
            final RenderStyle style) {
        final BlueprintGraph graph = new GraphBuilder().build(
                new RawObjectParser().parse(Fixtures.load(fixture)));
        final List<Statement> statements = new GraphAnalyzer(
                StandardProcessors.create(),
                GraphAnalyzer.DEFAULT_MAX_NODE_VISITS).analyze(graph);
        return new EventGraphFormatter(style).format(graph.graphName(),
                statements);
    }

    // -- Fixtures ---------------------------------------------------------

    @Test
    void whenFormatting_givenVariableSet_shouldRenderAssignment() {
        assertEquals("""
                # BP_Door EventGraph

                #### Event: BeginPlay

                  Health = 100.0
                """, render("set_health.txt", RenderStyle.CONCISE));
    }

    @Test
    void whenFormatting_givenVerboseStyle_shouldAddNodeReferences() {
        assertEquals("""
                # BP_Door EventGraph

                #### Event: BeginPlay

                    Health = 100.0  // K2Node_VariableSet_0
                """, render("set_health.txt", RenderStyle.VERBOSE));
    }

    @Test
    void whenFormatting_givenSharedPureValue_shouldDeclareItOnce() {
        assertEquals("""
                # EventGraph

                #### Event: BeginPlay

                  declare temp_getactorlocation = K2_GetActorLocation()
                  SpawnLocation = temp_getactorlocation
                  LastLocation = temp_getactorlocation
                """, render("shared_location.txt", RenderStyle.CONCISE));
    }

    @Test
    void whenFormatting_givenValueSharedByBothArms_shouldDeclareItBeforeIf() {
        assertEquals("""
                # EventGraph

                #### Event: BeginPlay

                  declare temp_getactorlocation = K2_GetActorLocation()
                  if (true):
                    SpawnLocation = temp_getactorlocation
                  else:
                    LastLocation = temp_getactorlocation
                """, render("branch_shared_location.txt",
                RenderStyle.CONCISE));
    }

    @Test
    void whenFormatting_givenLatentAction_shouldRenderCallbackScope() {
        final String markdown = render("latent_payload.txt",
                RenderStyle.CONCISE);

        assertTrue(markdown.contains("  await WaitGameplayEvent(EventTag: "));
        assertTrue(markdown.contains(
                "  // on EventReceived(Payload):\n    LastPayload = Payload\n"));
        assertTrue(markdown.contains("\n  StalePayload = <unsupported: "));
    }

    @Test
    void whenFormatting_givenInterfaceMessage_shouldRenderTargetedCall() {
        assertTrue(render("generic_message.txt", RenderStyle.CONCISE)
                .contains("\n  Door.Interact(Strength: 3)\n"));
    }

    @Test
    void whenFormatting_givenUnknownNode_shouldRenderFallbackComment() {
        final String markdown = render("unknown_node.txt",
                RenderStyle.CONCISE);

        assertTrue(markdown.contains(
                "  // Fallback: K2Node_Timeline (K2Node_Timeline_0)"
                        + " [TimelineName=\"DoorTimeline\""));
        assertTrue(markdown.contains("{NewTime=0.0}"));
        assertTrue(markdown.contains("\n  PrintString(InString: \"Opened\")"));
    }

    @Test
    void whenFormatting_givenDelegateBinding_shouldRenderBothEvents() {
        final String markdown = render("bind_click.txt", RenderStyle.CONCISE);

        assertTrue(markdown.endsWith("""
                #### Event: Construct

                  PlayButton.OnClicked += HandlePlayClicked

                #### Event: HandlePlayClicked

                  // (empty)
                """));
    }

    @Test
    void whenFormatting_givenExecCycle_shouldRenderCycleComment() {
        assertTrue(render("exec_cycle.txt", RenderStyle.CONCISE).endsWith("""
                #### Event: Tick(DeltaSeconds)

                  Step()
                  StepAgain()
                  // cycle: back to K2Node_CallFunction_0
                """));
    }

    @Test
    void whenFormatting_givenForEachLoop_shouldNestLoopBody() {
        assertEquals("""
                # BP_Door EventGraph

                #### Event: BeginPlay

                  for each (ArrayElement, ArrayIndex) in Doors:
                    ArrayElement.Open()
                  PrintString(InString: "Done")
                """, render("for_each.txt", RenderStyle.CONCISE));
    }

    @Test
    void whenFormatting_givenNoEntries_shouldRenderPlaceholder() {
        assertEquals("""
                # EventGraph

                _No entry nodes found in this graph._
                """, render("only_unknown.txt", RenderStyle.CONCISE));
    }

    // -- Hand built trees -------------------------------------------------

    @Test
    void whenFormatting_givenDiagnostics_shouldRenderWarningsFirst() {
        final SourceLocation location = new SourceLocation("G", "Set_0",
                List.of("link A.X -> B.Y ignored: both pins are inputs"));
        final Statement assignment = new AssignmentNode(
                new VariableGetExpression("Health", true, location),
                new LiteralExpression("1", LiteralType.INT, location),
                "=", false, location);
        final EventNode event = new EventNode("BeginPlay", List.of(),
                new ExecutionBlock(List.of(assignment)),
                SourceLocation.SYNTHETIC);

        final String markdown = new EventGraphFormatter(RenderStyle.CONCISE)
                .format("EventGraph", List.of(event));

        assertTrue(markdown.contains("""
                  // warning: link A.X -> B.Y ignored: both pins are inputs
                  Health = 1
                """));
    }

    @Test
    void whenFormatting_givenEmptyBranches_shouldMarkEmptyBlockOnly() {
        final Statement branch = new BranchNode(
                new VariableGetExpression("bOpen", true, null),
                new ExecutionBlock(List.of()), new ExecutionBlock(List.of()),
                null);
        final EventNode event = new EventNode("Tick",
                List.of(new EventNode.Parameter("DeltaSeconds", "float")),
                new ExecutionBlock(List.of(branch)), null);

        assertEquals("""
                # EventGraph

                #### Event: Tick(DeltaSeconds: float)

                    if (bOpen):
                        // (empty)
                """,
                new EventGraphFormatter(RenderStyle.VERBOSE)
                        .format("EventGraph", List.of(event)));
    }

    @Test
    void whenFormatting_givenSameFormatterTwice_shouldNotKeepState() {
        final EventGraphFormatter formatter = new EventGraphFormatter(
                RenderStyle.CONCISE);
        final EventNode event = new EventNode("BeginPlay", List.of(),
                new ExecutionBlock(List.of()), null);

        final String first = formatter.format("EventGraph", List.of(event));

        assertEquals(first, formatter.format("EventGraph", List.of(event)));
    }

    @Test
    void whenCreating_givenNullStyle_shouldThrowException() {
        assertThrows(IllegalArgumentException.class,
                () -> new EventGraphFormatter(null));
    }

    // -- literal ----------------------------------------------------------

    @Test
    void whenRenderingLiteral_givenFloat_shouldStripTrailingZeros() {
        assertEquals("100.0", EventGraphFormatter.literal("100.000000",
                LiteralType.FLOAT));
        assertEquals("0.25", EventGraphFormatter.literal("0.250000",
                LiteralType.FLOAT));
        assertEquals("abc", EventGraphFormatter.literal("abc",
                LiteralType.FLOAT));
    }

    @Test
    void whenRenderingLiteral_givenBoolean_shouldLowerCase() {
        assertEquals("true", EventGraphFormatter.literal("True",
                LiteralType.BOOL));
    }

    @Test
    void whenRenderingLiteral_givenText_shouldQuoteDisplayString() {
        assertEquals("\"Hello\"", EventGraphFormatter.literal("Hello",
                LiteralType.STRING));
        assertEquals("\"Play\"", EventGraphFormatter.literal(
                "NSLOCTEXT(\"Menu\", \"PlayLabel\", \"Play\")",
                LiteralType.TEXT));
    }

    @Test
    void whenRenderingLiteral_givenObjectPath_shouldShowAssetName() {
        assertEquals("BP_Door", EventGraphFormatter.literal(
                "/Game/Blueprints/BP_Door.BP_Door_C", LiteralType.OBJECT));
    }

    @Test
    void whenRenderingLiteral_givenMissingValue_shouldRenderNone() {
        assertEquals("None", EventGraphFormatter.literal(null,
                LiteralType.INT));
        assertEquals("None", EventGraphFormatter.literal("",
                LiteralType.INT));
    }

}
