package com.fppast.jackson;

import com.fasterxml.jackson.annotation.JsonTypeInfo;
import com.fasterxml.jackson.core.Version;
import com.fasterxml.jackson.databind.module.SimpleModule;
import com.fppast.ast.*;

/**
 * Jackson module that configures serialization of the typed AST.
 *
 * This module handles:
 * - Writing each variant of a closed family wrapped in its simple class name
 * - Writing enumeration constants as tag objects
 */
public class AstModule extends SimpleModule {

    public AstModule() {
        super("AstModule", new Version(1, 0, 0, null, "com.fppast", "fpp-ast-jackson"));
        addSerializer(WireEnum.class, new WireEnumSerializer());
    }

    @Override
    public void setupModule(SetupContext context) {
        super.setupModule(context);

        context.setMixInAnnotations(ModuleMember.Node.class, VariantMixin.class);
        context.setMixInAnnotations(ComponentMember.Node.class, VariantMixin.class);
        context.setMixInAnnotations(StateMachineMember.Node.class, VariantMixin.class);
        context.setMixInAnnotations(StateMember.Node.class, VariantMixin.class);
        context.setMixInAnnotations(InterfaceMember.Node.class, VariantMixin.class);
        context.setMixInAnnotations(TopologyMember.Node.class, VariantMixin.class);
        context.setMixInAnnotations(TlmPacketSetMember.Node.class, VariantMixin.class);
        context.setMixInAnnotations(TlmPacketMember.class, VariantMixin.class);
        context.setMixInAnnotations(SpecPortInstance.class, VariantMixin.class);
        context.setMixInAnnotations(SpecConnectionGraph.class, VariantMixin.class);
        context.setMixInAnnotations(TransitionOrDo.class, VariantMixin.class);
        context.setMixInAnnotations(TypeName.class, VariantMixin.class);
        context.setMixInAnnotations(Expr.class, VariantMixin.class);
        context.setMixInAnnotations(QualIdent.class, VariantMixin.class);
    }

    @JsonTypeInfo(use = JsonTypeInfo.Id.SIMPLE_NAME, include = JsonTypeInfo.As.WRAPPER_OBJECT)
    private interface VariantMixin {
    }
}
