package com.cywriter.jackson;

import com.cywriter.ast.*;
import com.cywriter.jackson.mixins.NodeMixin;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.Version;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;
import com.fasterxml.jackson.databind.jsontype.NamedType;
import com.fasterxml.jackson.databind.module.SimpleModule;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;

import java.io.IOException;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Jackson module for the code tree classes.
 *
 * <ul>
 *   <li>every node kind is registered as a subtype named after its {@code type()}</li>
 *   <li>{@link TempHandle} is written as {@code {"id": n}} and read back so that equal ids in
 *       one document yield one handle</li>
 *   <li>derived accessors such as {@code CFuncDefNode.isInline()} are not written</li>
 * </ul>
 */
public class AstModule extends SimpleModule {

    private static final List<Class<?>> CATEGORIES = List.of(
        Node.class, StatNode.class, ExprNode.class, AtomicExprNode.class, CoercionNode.class,
        SequenceNode.class, DeclaratorNode.class, BaseTypeNode.class);

    public AstModule() {
        super("AstModule", new Version(1, 0, 0, null, "com.cywriter", "cywriter-jackson"));
        addSerializer(TempHandle.class, new TempHandleSerializer());
        addDeserializer(TempHandle.class, new TempHandleDeserializer());
    }

    @Override
    public void setupModule(SetupContext context) {
        super.setupModule(context);

        for (Class<?> category : CATEGORIES) {
            context.setMixInAnnotations(category, NodeMixin.class);
        }
        context.setMixInAnnotations(CFuncDefNode.class, CFuncDefNodeMixin.class);
        context.setMixInAnnotations(CSimpleBaseTypeNode.class, CSimpleBaseTypeNodeMixin.class);

        context.registerSubtypes(nodeTypes().stream()
            .map(type -> new NamedType(type, type.getSimpleName()))
            .toArray(NamedType[]::new));
    }

    /**
     * All concrete node classes, found by walking the sealed hierarchy below {@link Node}.
     */
    static Set<Class<?>> nodeTypes() {
        Set<Class<?>> types = new LinkedHashSet<>();
        collectPermitted(Node.class, types);
        return types;
    }

    private static void collectPermitted(Class<?> type, Set<Class<?>> types) {
        if (!type.isSealed()) {
            types.add(type);
            return;
        }
        for (Class<?> permitted : type.getPermittedSubclasses()) {
            collectPermitted(permitted, types);
        }
    }

    // ==================== Mixins ====================

    private abstract static class CFuncDefNodeMixin {
        @JsonIgnore
        abstract boolean isInline();
    }

    private abstract static class CSimpleBaseTypeNodeMixin {
        @JsonProperty("isBasicCType")
        abstract boolean isBasicCType();

        @JsonProperty("isSelfArg")
        abstract boolean isSelfArg();
    }

    // ==================== Temporary handles ====================

    private static final String TEMP_HANDLES = TempHandleDeserializer.class.getName() + ".handles";

    static class TempHandleSerializer extends StdSerializer<TempHandle> {
        TempHandleSerializer() {
            super(TempHandle.class);
        }

        @Override
        public void serialize(TempHandle value, JsonGenerator gen, SerializerProvider provider) throws IOException {
            gen.writeStartObject();
            gen.writeNumberField("id", value.id());
            if (value.typeName() != null) {
                gen.writeStringField("typeName", value.typeName());
            }
            gen.writeEndObject();
        }
    }

    static class TempHandleDeserializer extends StdDeserializer<TempHandle> {
        TempHandleDeserializer() {
            super(TempHandle.class);
        }

        @Override
        @SuppressWarnings("unchecked")
        public TempHandle deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
            JsonNode node = p.readValueAsTree();
            JsonNode id = node.get("id");
            if (id == null || !id.canConvertToInt()) {
                return ctxt.reportInputMismatch(this, "Temporary handle without an integer id: %s", node);
            }
            // Handles are shared per document, so the table lives in the per-call attributes
            Map<Integer, TempHandle> handles = (Map<Integer, TempHandle>) ctxt.getAttribute(TEMP_HANDLES);
            if (handles == null) {
                handles = new HashMap<>();
                ctxt.setAttribute(TEMP_HANDLES, handles);
            }
            JsonNode typeName = node.get("typeName");
            return handles.computeIfAbsent(id.asInt(),
                key -> new TempHandle(key, typeName == null || typeName.isNull() ? null : typeName.asText()));
        }
    }
}
