package com.cywriter.jackson;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.module.paramnames.ParameterNamesModule;

/**
 * Factory for {@link ObjectMapper} instances that read and write code trees.
 *
 * <pre>
 * ObjectMapper mapper = CyWriterJackson.createObjectMapper();
 * String json = mapper.writeValueAsString(module);
 * ModuleNode module = mapper.readValue(json, ModuleNode.class);
 * </pre>
 */
public final class CyWriterJackson {

    private CyWriterJackson() {
        // Utility class
    }

    /**
     * Creates a new mapper. Null members are left out when writing and unknown members are
     * ignored when reading.
     */
    public static ObjectMapper createObjectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new ParameterNamesModule());

        mapper.setSerializationInclusion(JsonInclude.Include.NON_NULL);
        mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        // Leaf kinds such as PassStatNode have no members besides "type"
        mapper.configure(SerializationFeature.FAIL_ON_EMPTY_BEANS, false);

        mapper.registerModule(new AstModule());
        return mapper;
    }
}
