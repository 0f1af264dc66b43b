package com.fppast.jackson;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.JsonSerializer;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fppast.ast.WireEnum;

import java.io.IOException;

/**
 * Writes enumeration constants the way fpp-to-json does: {@code {"Tag": {}}}.
 */
public class WireEnumSerializer extends JsonSerializer<WireEnum> {

    @Override
    public void serialize(WireEnum value, JsonGenerator gen, SerializerProvider serializers) throws IOException {
        gen.writeStartObject();
        gen.writeFieldName(value.tag());
        gen.writeStartObject();
        gen.writeEndObject();
        gen.writeEndObject();
    }

    @Override
    public Class<WireEnum> handledType() {
        return WireEnum.class;
    }
}
