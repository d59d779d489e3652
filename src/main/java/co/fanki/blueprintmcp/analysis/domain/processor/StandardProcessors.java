package co.fanki.blueprintmcp.analysis.domain.processor;

import co.fanki.blueprintmcp.analysis.domain.ProcessorRegistry;
import co.fanki.blueprintmcp.analysis.domain.ast.EventSubscriptionNode;
import co.fanki.blueprintmcp.analysis.domain.ast.LoopNode;
import co.fanki.blueprintmcp.graph.domain.NodeKinds;

/**
 * The processors shipped with the analyzer, wired to the node kinds
 * they handle.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class StandardProcessors {

    private static final String MACRO = NodeKinds.MACRO_INSTANCE + ":";

    private StandardProcessors() {
    }

    /**
     * Builds the default registry.
     *
     * @return the registry, with the generic callable and fallback tiers
     */
    public static ProcessorRegistry create() {
        return ProcessorRegistry.builder()
                .register(new EventProcessor(),
                        NodeKinds.EVENT, NodeKinds.CUSTOM_EVENT,
                        NodeKinds.COMPONENT_BOUND_EVENT,
                        NodeKinds.INPUT_ACTION, NodeKinds.INPUT_KEY,
                        NodeKinds.INPUT_AXIS_EVENT,
                        NodeKinds.ENHANCED_INPUT_ACTION,
                        NodeKinds.FUNCTION_ENTRY)
                .register(new VariableSetProcessor(), "K2Node_VariableSet")
                .register(new VariableGetProcessor(), "K2Node_VariableGet")
                .register(new CallFunctionProcessor(),
                        "K2Node_CallFunction",
                        CallFunctionProcessor.CALL_ARRAY_FUNCTION,
                        CallFunctionProcessor.CALL_PARENT_FUNCTION,
                        "K2Node_CommutativeAssociativeBinaryOperator")
                .register(new BranchProcessor(), "K2Node_IfThenElse")
                .register(new SequenceProcessor(),
                        "K2Node_ExecutionSequence")
                .register(new SwitchProcessor(),
                        "K2Node_SwitchEnum", "K2Node_SwitchInteger",
                        "K2Node_SwitchString", "K2Node_SwitchName")
                .register(new DynamicCastProcessor(),
                        "K2Node_DynamicCast", "K2Node_ClassDynamicCast")
                .register(new LoopMacroProcessor(LoopNode.Kind.FOR_EACH),
                        MACRO + "ForEachLoop",
                        MACRO + "ForEachLoopWithBreak")
                .register(new LoopMacroProcessor(LoopNode.Kind.FOR),
                        MACRO + "ForLoop", MACRO + "ForLoopWithBreak")
                .register(new LoopMacroProcessor(LoopNode.Kind.WHILE),
                        MACRO + "WhileLoop")
                .register(new IsValidMacroProcessor(), MACRO + "IsValid")
                .register(new MacroInstanceProcessor(),
                        NodeKinds.MACRO_INSTANCE)
                .register(new KnotProcessor(), "K2Node_Knot")
                .register(new SelfProcessor(), "K2Node_Self")
                .register(new LiteralProcessor(), "K2Node_Literal")
                .register(new MathExpressionProcessor(),
                        "K2Node_MathExpression")
                .register(new GetArrayItemProcessor(),
                        "K2Node_GetArrayItem", "K2Node_ArrayGet")
                .register(new BreakStructProcessor(), "K2Node_BreakStruct")
                .register(new MakeStructProcessor(), "K2Node_MakeStruct")
                .register(new DelegateBindingProcessor(
                        EventSubscriptionNode.BIND),
                        "K2Node_AssignDelegate", "K2Node_AddDelegate")
                .register(new DelegateBindingProcessor(
                        EventSubscriptionNode.UNBIND),
                        "K2Node_RemoveDelegate")
                .register(new CreateDelegateProcessor(),
                        "K2Node_CreateDelegate")
                .register(new LatentActionProcessor(),
                        "K2Node_LatentAbilityCall", "K2Node_AsyncAction",
                        "K2Node_BaseAsyncTask",
                        "K2Node_LatentGameplayTaskCall", "K2Node_AIMoveTo",
                        "K2Node_PlayMontage")
                .register(new ConstructionProcessor(),
                        "K2Node_SpawnActorFromClass", "K2Node_CreateWidget",
                        "K2Node_ConstructObjectFromClass",
                        "K2Node_GetSubsystem")
                .register(new FunctionResultProcessor(),
                        "K2Node_FunctionResult")
                .generic(new GenericCallableProcessor())
                .fallback(new FallbackProcessor())
                .build();
    }

}
