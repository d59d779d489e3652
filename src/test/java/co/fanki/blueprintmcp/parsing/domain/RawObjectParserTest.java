package co.fanki.blueprintmcp.parsing.domain;

import co.fanki.blueprintmcp.Fixtures;
import co.fanki.blueprintmcp.shared.DomainException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Unit tests for {@link RawObjectParser}.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
class RawObjectParserTest {

    private RawObjectParser parser;

    @BeforeEach
    void setUp() {
        parser = new RawObjectParser();
    }

    // -- Input validation -------------------------------------------------

    @Test
    void whenParsing_givenBlankText_shouldThrowInvalidInput() {
        final DomainException ex = assertThrows(DomainException.class,
                () -> parser.parse("   \n  "));

        assertEquals(DomainException.INVALID_INPUT, ex.getErrorCode());
    }

    @Test
    void whenParsing_givenNull_shouldThrowInvalidInput() {
        assertThrows(DomainException.class, () -> parser.parse(null));
    }

    // -- Blocks -----------------------------------------------------------

    @Test
    void whenParsing_givenByteOrderMark_shouldReadFirstHeader() {
        final List<RawObject> roots = parser.parse(
                "\uFEFFBegin Object Class=/Script/BlueprintGraph.K2Node_Event"
                        + " Name=\"K2Node_Event_0\"\nEnd Object\n");

        assertEquals(1, roots.size());
        assertEquals("K2Node_Event_0", roots.get(0).name());
        assertEquals("K2Node_Event", roots.get(0).shortClassName());
    }

    @Test
    void whenParsing_givenNestedBlocks_shouldBuildTree() {
        final List<RawObject> roots = parser.parse("""
                Begin Object Class=/Script/UMG.WidgetTree Name="WidgetTree"
                   Begin Object Class=/Script/UMG.CanvasPanel Name="Root"
                      Begin Object Class=/Script/UMG.Button Name="Play"
                      End Object
                   End Object
                End Object
                """);

        assertEquals(1, roots.size());
        final RawObject root = roots.get(0).children().get(0);
        assertEquals("Root", root.name());
        assertEquals("Play", root.children().get(0).name());
        assertEquals(3, roots.get(0).flatten().size());
    }

    @Test
    void whenParsing_givenBlockReopenedByName_shouldMergeIntoDeclaration() {
        final List<RawObject> roots = parser.parse("""
                Begin Object Class=/Script/UMG.WidgetTree Name="WidgetTree"
                   Begin Object Class=/Script/UMG.Button Name="Play"
                   End Object
                   Begin Object Name="Play"
                      bIsEnabled=True
                   End Object
                End Object
                """);

        final RawObject tree = roots.get(0);
        assertEquals(1, tree.children().size());
        assertEquals("True", tree.children().get(0).text("bIsEnabled"));
    }

    @Test
    void whenParsing_givenMalformedHeader_shouldKeepPlaceholder() {
        final List<RawObject> roots = parser.parse("""
                Begin Object this is not a header
                End Object
                Begin Object Class=/Script/BlueprintGraph.K2Node_Knot Name="K"
                End Object
                """);

        assertEquals(2, roots.size());
        assertEquals("Malformed_1", roots.get(0).name());
        assertEquals("Begin Object this is not a header",
                roots.get(0).text(RawObjectParser.RAW_TEXT_PROPERTY));
        assertEquals("K", roots.get(1).name());
    }

    @Test
    void whenParsing_givenStrayEndObject_shouldIgnoreIt() {
        final List<RawObject> roots = parser.parse("""
                End Object
                Begin Object Class=/Script/BlueprintGraph.K2Node_Knot Name="K"
                End Object
                End Object
                """);

        assertEquals(1, roots.size());
    }

    @Test
    void whenParsing_givenUnclosedBlock_shouldCloseItAtEnd() {
        final List<RawObject> roots = parser.parse("""
                Begin Object Class=/Script/BlueprintGraph.K2Node_Knot Name="K"
                   NodePosX=10
                """);

        assertEquals(1, roots.size());
        assertEquals("10", roots.get(0).text("NodePosX"));
    }

    // -- Properties -------------------------------------------------------

    @Test
    void whenParsing_givenValueSpanningLines_shouldJoinUntilBalanced() {
        final List<RawObject> roots = parser.parse("""
                Begin Object Class=/Script/BlueprintGraph.K2Node_Knot Name="K"
                   Data=(A=1,
                   B=2)
                   After=3
                End Object
                """);

        final RawObject node = roots.get(0);
        assertEquals("1", node.property("Data").memberText("A"));
        assertEquals("2", node.property("Data").memberText("B"));
        assertEquals("3", node.text("After"));
    }

    @Test
    void whenParsing_givenIndexedProperties_shouldReturnThemInOrder() {
        final List<RawObject> roots = parser.parse("""
                Begin Object Class=/Script/UMG.CanvasPanel Name="Root"
                   Slots(1)=CanvasPanelSlot'"Second"'
                   Slots(0)=CanvasPanelSlot'"First"'
                End Object
                """);

        final List<PropertyValue> slots = roots.get(0).indexed("Slots");
        assertEquals(2, slots.size());
        assertEquals("First", slots.get(0).text());
        assertEquals("Second", slots.get(1).text());
    }

    @Test
    void whenParsing_givenUnrecognizedLine_shouldKeepRawText() {
        final List<RawObject> roots = parser.parse("""
                Begin Object Class=/Script/BlueprintGraph.K2Node_Knot Name="K"
                   ??? garbage
                End Object
                """);

        assertEquals("??? garbage",
                roots.get(0).text(RawObjectParser.RAW_TEXT_PROPERTY));
    }

    @Test
    void whenParsing_givenSeveralUnrecognizedLines_shouldKeepEveryLine() {
        final List<RawObject> roots = parser.parse("""
                Begin Object Class=/Script/BlueprintGraph.K2Node_Knot Name="K"
                   ??? first garbage line
                   NodeGuid=AB
                   ??? second garbage line
                End Object
                """);

        final RawObject knot = roots.get(0);
        assertEquals("??? first garbage line\n??? second garbage line",
                knot.text(RawObjectParser.RAW_TEXT_PROPERTY));
        assertEquals("AB", knot.text("NodeGuid"));
    }

    // -- Pins -------------------------------------------------------------

    @Test
    void whenParsing_givenPinLines_shouldCreatePinChildren() {
        final List<RawObject> roots = parser.parse(
                Fixtures.load("set_health.txt"));

        assertEquals(2, roots.size());
        final RawObject event = roots.get(0);
        assertEquals(2, event.children().size());

        final RawObject then = event.children().get(1);
        assertEquals(RawObjectParser.PIN_CLASS, then.classType());
        assertEquals("then", then.name());
        assertEquals("exec", then.text("PinType.PinCategory"));
        assertNotNull(then.property("LinkedTo"));
        assertEquals("K2Node_VariableSet_0 2B000000000000000000000000000001",
                then.property("LinkedTo").items().get(0).text());
    }

    @Test
    void whenParsing_givenEventReference_shouldExposeMembers() {
        final RawObject event = parser.parse(
                Fixtures.load("set_health.txt")).get(0);

        assertEquals("ReceiveBeginPlay",
                event.property("EventReference").memberText("MemberName"));
        assertTrue(event.flatten().size() > 1);
    }

}
